package kleene.construction;

import kleene.graph.Automaton;
import kleene.graph.IntSet;
import java.util.ArrayDeque;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.logging.Logger;
import java.util.stream.Collectors;

/**
 * Subset construction, turning any automaton into a deterministic one.
 *
 * Only subsets reachable from the set of initial states get explored. The
 * transition function of the output is partial: there is no sink state for
 * the empty subset.
 */
public final class PowersetDeterminizer {

  private static final Logger logger = Logger.getLogger(PowersetDeterminizer.class.getName());

  private PowersetDeterminizer() { }

  /**
   * Determinize an automaton without bounding the number of states.
   *
   * @param automaton input automaton
   * @return equivalent deterministic automaton
   */
  public static Automaton determinize(Automaton automaton) {
    return determinize(automaton, Integer.MAX_VALUE);
  }

  /**
   * Determinize an automaton.
   *
   * Empty transitions are first removed, after which each output state is a
   * subset of input states labelled {@code {l1,l2,...}} with the sorted
   * labels of its members.
   *
   * @param automaton input automaton
   * @param maxStates maximum number of states of the output
   * @return equivalent deterministic automaton
   * @throws StateLimitExceededException if more than {@code maxStates} subsets are reachable
   */
  public static Automaton determinize(Automaton automaton, int maxStates) {
    final Automaton nfa = automaton.withoutEpsilonTransitions();

    final var builder = new Automaton.Builder(nfa.alphabet());
    final var states = new HashMap<IntSet, Integer>();
    final var toVisit = new ArrayDeque<IntSet>();

    final IntSet initialSubset = IntSet.of(nfa.initialStates());
    final int initialState = addSubset(nfa, builder, initialSubset, maxStates);
    states.put(initialSubset, initialState);
    builder.addInitial(initialState);
    toVisit.add(initialSubset);

    while (!toVisit.isEmpty()) {
      final IntSet subset = toVisit.poll();
      final int from = states.get(subset);

      // Targets grouped by symbol, in the order symbols are first seen
      final Map<String, IntSet> transitions = subset
        .stream()
        .mapToObj(nfa::transitions)
        .flatMap(List::stream)
        .collect(
          Collectors.groupingBy(
            Automaton.Transition::symbol,
            LinkedHashMap::new,
            Collectors.mapping(
              Automaton.Transition::target,
              Collectors.collectingAndThen(Collectors.toList(), (List<Integer> targets) -> IntSet.of(targets))
            )
          )
        );

      for (var transition : transitions.entrySet()) {
        final IntSet target = transition.getValue();
        Integer to = states.get(target);
        if (to == null) {
          to = addSubset(nfa, builder, target, maxStates);
          states.put(target, to);
          toVisit.add(target);
        }
        builder.addTransition(from, transition.getKey(), to);
      }
    }

    final Automaton dfa = builder.build();
    logger.fine(() -> "Determinized " + automaton.size() + " states into " + dfa.size() + " states");
    return dfa;
  }

  private static int addSubset(
    Automaton nfa,
    Automaton.Builder builder,
    IntSet subset,
    int maxStates
  ) {
    if (builder.size() >= maxStates) {
      throw new StateLimitExceededException("Determinization", maxStates);
    }

    final String label = subset
      .stream()
      .mapToObj(nfa::label)
      .sorted()
      .collect(Collectors.joining(",", "{", "}"));

    // Labels of distinct subsets only collide when input labels contain commas
    String uniqueLabel = label;
    for (int suffix = 1; builder.hasState(uniqueLabel); suffix++) {
      uniqueLabel = label + "#" + suffix;
    }

    final int state = builder.addState(uniqueLabel);
    if (subset.intersects(nfa.acceptingStates())) {
      builder.addAccepting(state);
    }
    return state;
  }
}
