package kleene.construction;

import kleene.graph.Automaton;
import kleene.graph.InvalidAutomatonException;
import kleene.regex.Regex;
import kleene.regex.Residuals;
import java.util.ArrayDeque;
import java.util.Collection;
import java.util.HashMap;
import java.util.Optional;
import java.util.logging.Logger;

/**
 * Automaton whose states are the residuals of a regular expression.
 *
 * Residuals are identified by their rendering, with whitespace removed.
 * Equivalent residuals which render differently are distinct states, so the
 * result is deterministic but not necessarily minimal, and some expressions
 * (like {@code a* a*}) have infinitely many residual states.
 */
public final class ResidualAutomaton {

  private static final Logger logger = Logger.getLogger(ResidualAutomaton.class.getName());

  private ResidualAutomaton() { }

  /**
   * Key under which a residual expression is identified.
   */
  public static String stateLabel(Regex regex) {
    return regex.toString().replaceAll("\\s+", "");
  }

  public static Automaton build(Regex regex) {
    return build(regex, regex.alphabet(), Integer.MAX_VALUE);
  }

  public static Automaton build(Regex regex, Collection<String> alphabet) {
    return build(regex, alphabet, Integer.MAX_VALUE);
  }

  /**
   * Explore the residuals of an expression breadth first.
   *
   * A residual is accepting when it matches the empty word, and has a
   * transition on each letter whose residual is not empty. Letters are tried
   * in sorted order.
   *
   * @param regex expression to convert
   * @param alphabet alphabet of the automaton, containing the expression's
   * @param maxStates maximum number of residual states
   * @return deterministic automaton
   * @throws InvalidAutomatonException if a letter is missing from the alphabet
   * @throws StateLimitExceededException if more than {@code maxStates} residuals are found
   */
  public static Automaton build(Regex regex, Collection<String> alphabet, int maxStates) {
    if (!alphabet.containsAll(regex.alphabet())) {
      throw new InvalidAutomatonException("Alphabet " + alphabet + " does not contain all of " + regex.alphabet());
    }

    final var builder = new Automaton.Builder(alphabet);
    final var residuals = new HashMap<Integer, Regex>();
    final var toVisit = new ArrayDeque<Integer>();

    final int initial = addResidual(builder, residuals, regex, maxStates);
    builder.addInitial(initial);
    toVisit.add(initial);

    while (!toVisit.isEmpty()) {
      final int state = toVisit.poll();
      final Regex residual = residuals.get(state);

      for (String letter : regex.alphabet()) {
        final Optional<Regex> next = Residuals.byLetter(residual, letter);
        if (next.isEmpty()) {
          continue;
        }

        final String label = stateLabel(next.get());
        final int target;
        if (builder.hasState(label)) {
          target = builder.state(label);
        } else {
          target = addResidual(builder, residuals, next.get(), maxStates);
          toVisit.add(target);
        }
        builder.addTransition(state, letter, target);
      }
    }

    final Automaton automaton = builder.build();
    logger.fine(() -> "Residual automaton of `" + regex + "` has " + automaton.size() + " states");
    return automaton;
  }

  private static int addResidual(
    Automaton.Builder builder,
    HashMap<Integer, Regex> residuals,
    Regex residual,
    int maxStates
  ) {
    if (builder.size() >= maxStates) {
      throw new StateLimitExceededException("Residual exploration", maxStates);
    }
    final int state = builder.addState(stateLabel(residual));
    residuals.put(state, residual);
    if (residual.acceptsEpsilon()) {
      builder.addAccepting(state);
    }
    return state;
  }
}
