package kleene.graph;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.HashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.OptionalInt;
import java.util.Set;
import java.util.SortedSet;
import java.util.TreeSet;
import java.util.stream.Collectors;
import java.util.stream.IntStream;
import java.util.stream.Stream;

/**
 * Finite automaton over an alphabet of string symbols.
 *
 * States are dense indices from {@code 0} to {@code size() - 1}, each carrying
 * a unique human readable label. Every state has an ordered list of outgoing
 * transitions, which may be nondeterministic and may use the reserved
 * {@link #EPSILON} symbol for empty transitions.
 *
 * Instances are immutable and only come out of an {@link Builder}, which
 * checks structural rules as states and transitions get added.
 */
public final class Automaton implements DotGraph<Integer, String> {

  /**
   * Symbol of empty transitions, never part of an alphabet.
   */
  public static final String EPSILON = "ε";

  /**
   * Outgoing transition.
   *
   * @param symbol alphabet symbol or {@link #EPSILON}
   * @param target index of the state reached
   */
  public record Transition(String symbol, int target) {

    public boolean isEpsilon() {
      return EPSILON.equals(symbol);
    }
  }

  private final SortedSet<String> alphabet;
  private final List<String> labels;
  private final Map<String, Integer> indices;
  private final SortedSet<Integer> initialStates;
  private final SortedSet<Integer> acceptingStates;
  private final List<List<Transition>> transitions;

  private Automaton(
    SortedSet<String> alphabet,
    List<String> labels,
    Map<String, Integer> indices,
    SortedSet<Integer> initialStates,
    SortedSet<Integer> acceptingStates,
    List<List<Transition>> transitions
  ) {
    this.alphabet = alphabet;
    this.labels = labels;
    this.indices = indices;
    this.initialStates = initialStates;
    this.acceptingStates = acceptingStates;
    this.transitions = transitions;
  }

  /**
   * Build an automaton from labelled states.
   *
   * States get indexed in the sorted order of their labels. A transition
   * symbol equal to {@link #EPSILON} is an empty transition.
   *
   * @param alphabet symbols of the automaton
   * @param states labels of all states
   * @param initial labels of initial states
   * @param accepting labels of accepting states
   * @param transitions outgoing {@code (symbol, target)} pairs, by source state
   * @return automaton
   * @throws InvalidAutomatonException if the automaton is malformed
   */
  public static Automaton of(
    Set<String> alphabet,
    Set<String> states,
    Set<String> initial,
    Set<String> accepting,
    Map<String, List<Map.Entry<String, String>>> transitions
  ) {
    final var builder = new Builder(alphabet);
    new TreeSet<>(states).forEach(builder::addState);
    new TreeSet<>(initial).forEach(label -> builder.addInitial(builder.state(label)));
    new TreeSet<>(accepting).forEach(label -> builder.addAccepting(builder.state(label)));

    for (String source : new TreeSet<>(transitions.keySet())) {
      final int from = builder.state(source);
      for (Map.Entry<String, String> transition : transitions.get(source)) {
        builder.addTransition(from, transition.getKey(), builder.state(transition.getValue()));
      }
    }

    return builder.build();
  }

  /**
   * Symbols of the automaton, excluding {@link #EPSILON}.
   */
  public SortedSet<String> alphabet() {
    return alphabet;
  }

  /**
   * Number of states.
   */
  public int size() {
    return labels.size();
  }

  /**
   * All state indices, in increasing order.
   */
  public IntStream states() {
    return IntStream.range(0, labels.size());
  }

  public String label(int state) {
    return labels.get(state);
  }

  /**
   * Find a state from its label.
   *
   * @param label state label
   * @return index of the state, if there is one with this label
   */
  public OptionalInt stateOf(String label) {
    final Integer state = indices.get(label);
    return state == null ? OptionalInt.empty() : OptionalInt.of(state);
  }

  public SortedSet<Integer> initialStates() {
    return initialStates;
  }

  public SortedSet<Integer> acceptingStates() {
    return acceptingStates;
  }

  public boolean isAccepting(int state) {
    return acceptingStates.contains(state);
  }

  /**
   * Outgoing transitions of a state, in insertion order.
   */
  public List<Transition> transitions(int state) {
    return transitions.get(state);
  }

  public boolean hasEpsilonTransitions() {
    return transitions
      .stream()
      .flatMap(List::stream)
      .anyMatch(Transition::isEpsilon);
  }

  /**
   * An automaton is deterministic when it has a single initial state, no
   * empty transitions, and no state with two transitions on the same symbol.
   */
  public boolean isDeterministic() {
    if (initialStates.size() != 1) {
      return false;
    }
    for (List<Transition> outgoing : transitions) {
      final var symbols = new TreeSet<String>();
      for (Transition transition : outgoing) {
        if (transition.isEpsilon() || !symbols.add(transition.symbol())) {
          return false;
        }
      }
    }
    return true;
  }

  /**
   * States reachable from the given ones using only empty transitions,
   * including the starting states themselves.
   *
   * @param states starting states
   * @return closure of the starting states
   */
  public SortedSet<Integer> epsilonClosure(Collection<Integer> states) {
    final var closure = new TreeSet<Integer>(states);
    final var toVisit = new ArrayDeque<Integer>(states);

    while (!toVisit.isEmpty()) {
      final int state = toVisit.pop();
      for (Transition transition : transitions.get(state)) {
        if (transition.isEpsilon() && closure.add(transition.target())) {
          toVisit.push(transition.target());
        }
      }
    }

    return closure;
  }

  /**
   * Simulate the automaton on a word.
   *
   * @param word symbols of the word, in order
   * @return whether the word is accepted
   * @throws IllegalArgumentException if a symbol is not in the alphabet
   */
  public boolean accepts(List<String> word) {
    for (String symbol : word) {
      if (!alphabet.contains(symbol)) {
        throw new IllegalArgumentException("Invalid word " + word + ": unknown symbol `" + symbol + "`");
      }
    }

    Set<Integer> current = epsilonClosure(initialStates);
    for (String symbol : word) {
      final var next = new TreeSet<Integer>();
      for (int state : current) {
        for (Transition transition : transitions.get(state)) {
          if (transition.symbol().equals(symbol)) {
            next.add(transition.target());
          }
        }
      }
      current = epsilonClosure(next);
    }

    return current.stream().anyMatch(acceptingStates::contains);
  }

  /**
   * Simulate the automaton on a word, each code point being one symbol.
   *
   * @param word word to read
   * @return whether the word is accepted
   * @throws IllegalArgumentException if a symbol is not in the alphabet
   */
  public boolean accepts(CharSequence word) {
    return accepts(symbols(word));
  }

  /**
   * Split a word into its one code point symbols.
   */
  public static List<String> symbols(CharSequence word) {
    return word
      .codePoints()
      .mapToObj(codePoint -> new String(Character.toChars(codePoint)))
      .collect(Collectors.toList());
  }

  /**
   * Equivalent automaton with the same states and no empty transitions.
   *
   * Every state gets the non-empty transitions of its closure, and becomes
   * accepting if its closure contains an accepting state.
   *
   * @return automaton without empty transitions ({@code this} if there were none)
   */
  public Automaton withoutEpsilonTransitions() {
    if (!hasEpsilonTransitions()) {
      return this;
    }

    final var builder = new Builder(alphabet);
    labels.forEach(builder::addState);
    initialStates.forEach(builder::addInitial);

    for (int state = 0; state < size(); state++) {
      final SortedSet<Integer> closure = epsilonClosure(List.of(state));
      if (closure.stream().anyMatch(acceptingStates::contains)) {
        builder.addAccepting(state);
      }

      final var outgoing = new LinkedHashSet<Transition>();
      for (int reachable : closure) {
        for (Transition transition : transitions.get(reachable)) {
          if (!transition.isEpsilon()) {
            outgoing.add(transition);
          }
        }
      }
      for (Transition transition : outgoing) {
        builder.addTransition(state, transition.symbol(), transition.target());
      }
    }

    return builder.build();
  }

  /**
   * Same automaton over a larger alphabet.
   *
   * @param superset alphabet containing the current one
   * @return automaton over the new alphabet ({@code this} if it is unchanged)
   * @throws InvalidAutomatonException if a current symbol is missing
   */
  public Automaton withAlphabet(Collection<String> superset) {
    if (!superset.containsAll(alphabet)) {
      throw new InvalidAutomatonException("Alphabet " + superset + " does not contain " + alphabet);
    } else if (alphabet.containsAll(superset)) {
      return this;
    }

    final var builder = new Builder(superset);
    labels.forEach(builder::addState);
    initialStates.forEach(builder::addInitial);
    acceptingStates.forEach(builder::addAccepting);
    for (int state = 0; state < size(); state++) {
      for (Transition transition : transitions.get(state)) {
        builder.addTransition(state, transition.symbol(), transition.target());
      }
    }
    return builder.build();
  }

  @Override
  public Stream<DotGraph.Vertex<Integer>> vertices() {
    return states()
      .mapToObj(state -> new DotGraph.Vertex<>(
        state,
        initialStates.contains(state),
        acceptingStates.contains(state)
      ));
  }

  @Override
  public Stream<DotGraph.Edge<Integer, String>> edges() {
    return states()
      .boxed()
      .flatMap(from -> transitions
        .get(from)
        .stream()
        .map(transition -> new DotGraph.Edge<>(from, transition.target(), transition.symbol()))
      );
  }

  @Override
  public String renderVertexLabel(DotGraph.Vertex<Integer> vertex) {
    return label(vertex.id())
      .replace("&", "&amp;")
      .replace("<", "&lt;")
      .replace(">", "&gt;");
  }

  @Override
  public String toString() {
    final var builder = new StringBuilder();
    builder.append("Automaton(alphabet = " + alphabet);
    builder.append(", initial = " + labelsOf(initialStates));
    builder.append(", accepting = " + labelsOf(acceptingStates));
    builder.append(", transitions = {");
    builder.append(
      states()
        .mapToObj(state -> label(state) + " -> " + transitions
          .get(state)
          .stream()
          .map(transition -> transition.symbol() + ":" + label(transition.target()))
          .collect(Collectors.joining(", ", "[", "]")))
        .collect(Collectors.joining("; "))
    );
    builder.append("})");
    return builder.toString();
  }

  private List<String> labelsOf(Collection<Integer> states) {
    return states.stream().map(this::label).collect(Collectors.toList());
  }

  /**
   * Incrementally assemble an automaton.
   *
   * Every addition is validated immediately. A builder can only be used to
   * build once, and cannot be modified after that.
   */
  public static final class Builder {

    private final SortedSet<String> alphabet;
    private final List<String> labels = new ArrayList<>();
    private final Map<String, Integer> indices = new HashMap<>();
    private final SortedSet<Integer> initialStates = new TreeSet<>();
    private final SortedSet<Integer> acceptingStates = new TreeSet<>();
    private final List<List<Transition>> transitions = new ArrayList<>();

    // Guard against re-use of the builder
    private boolean used = false;

    /**
     * @param alphabet symbols the automaton reads
     * @throws InvalidAutomatonException if a symbol is empty or {@link #EPSILON}
     */
    public Builder(Collection<String> alphabet) {
      for (String symbol : alphabet) {
        if (symbol == null || symbol.isEmpty()) {
          throw new InvalidAutomatonException("Alphabet symbols cannot be empty");
        } else if (EPSILON.equals(symbol)) {
          throw new InvalidAutomatonException("`" + EPSILON + "` is reserved for empty transitions");
        }
      }
      this.alphabet = Collections.unmodifiableSortedSet(new TreeSet<>(alphabet));
    }

    /**
     * Add a fresh state.
     *
     * @param label unique label of the state
     * @return index of the new state
     */
    public int addState(String label) {
      checkNotBuilt();
      Objects.requireNonNull(label, "label");
      if (indices.containsKey(label)) {
        throw new InvalidAutomatonException("Duplicate state `" + label + "`");
      }
      final int state = labels.size();
      labels.add(label);
      indices.put(label, state);
      transitions.add(new ArrayList<>());
      return state;
    }

    /**
     * Look up a state that was already added.
     *
     * @param label label of the state
     * @return index of the state
     */
    public int state(String label) {
      final Integer state = indices.get(label);
      if (state == null) {
        throw new InvalidAutomatonException("Unknown state `" + label + "`");
      }
      return state;
    }

    public boolean hasState(String label) {
      return indices.containsKey(label);
    }

    public int size() {
      return labels.size();
    }

    public Builder addInitial(int state) {
      checkNotBuilt();
      checkState(state);
      initialStates.add(state);
      return this;
    }

    public Builder addAccepting(int state) {
      checkNotBuilt();
      checkState(state);
      acceptingStates.add(state);
      return this;
    }

    /**
     * Add a transition, appended after the existing ones of {@code from}.
     *
     * @param from source state
     * @param symbol alphabet symbol or {@link #EPSILON}
     * @param to target state
     */
    public Builder addTransition(int from, String symbol, int to) {
      checkNotBuilt();
      checkState(from);
      checkState(to);
      if (!EPSILON.equals(symbol) && !alphabet.contains(symbol)) {
        throw new InvalidAutomatonException(
          "In transitions for state `" + labels.get(from) + "`: unknown symbol `" + symbol + "`"
        );
      }
      transitions.get(from).add(new Transition(symbol, to));
      return this;
    }

    public Builder addEpsilonTransition(int from, int to) {
      return addTransition(from, EPSILON, to);
    }

    private void checkNotBuilt() {
      if (used) {
        throw new IllegalStateException("Automaton.Builder cannot be modified after it was built");
      }
    }

    private void checkState(int state) {
      if (state < 0 || state >= labels.size()) {
        throw new InvalidAutomatonException("Unknown state index " + state);
      }
    }

    public Automaton build() {
      if (used) {
        throw new IllegalStateException("Automaton.Builder cannot be re-used");
      } else if (initialStates.isEmpty()) {
        throw new InvalidAutomatonException("An automaton must have at least 1 initial state");
      }
      used = true;

      return new Automaton(
        alphabet,
        List.copyOf(labels),
        Map.copyOf(indices),
        Collections.unmodifiableSortedSet(new TreeSet<>(initialStates)),
        Collections.unmodifiableSortedSet(new TreeSet<>(acceptingStates)),
        transitions
          .stream()
          .map(List::copyOf)
          .collect(Collectors.toUnmodifiableList())
      );
    }
  }
}
