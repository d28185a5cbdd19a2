package kleene.construction;

import kleene.graph.Automaton;
import kleene.graph.InvalidAutomatonException;
import java.util.logging.Logger;

/**
 * Brzozowski's minimization by double reversal.
 *
 * Determinizing the transpose of an automaton whose transpose is
 * deterministic and accessible yields the minimal deterministic automaton, so
 * {@code det(transpose(det(transpose(det(a)))))} is minimal.
 */
public final class Brzozowski {

  private static final Logger logger = Logger.getLogger(Brzozowski.class.getName());

  private Brzozowski() { }

  /**
   * Reverse every transition and swap initial and accepting states.
   *
   * States keep both their index and their label.
   *
   * @param automaton automaton to transpose
   * @return automaton recognizing the mirror language
   * @throws InvalidAutomatonException if there is no accepting state
   */
  public static Automaton transpose(Automaton automaton) {
    if (automaton.acceptingStates().isEmpty()) {
      throw new InvalidAutomatonException("Cannot transpose an automaton with no accepting state");
    }

    final var builder = new Automaton.Builder(automaton.alphabet());
    automaton.states().forEach(state -> builder.addState(automaton.label(state)));
    automaton.acceptingStates().forEach(builder::addInitial);
    automaton.initialStates().forEach(builder::addAccepting);

    for (int from = 0; from < automaton.size(); from++) {
      for (Automaton.Transition transition : automaton.transitions(from)) {
        builder.addTransition(transition.target(), transition.symbol(), from);
      }
    }

    return builder.build();
  }

  /**
   * Minimal deterministic automaton of the same language.
   *
   * The empty language is minimized into a single non-accepting state.
   *
   * @param automaton automaton to minimize
   * @return minimal deterministic automaton
   */
  public static Automaton minimize(Automaton automaton) {
    return minimize(automaton, Integer.MAX_VALUE);
  }

  /**
   * Minimal deterministic automaton of the same language.
   *
   * @param automaton automaton to minimize
   * @param maxStates maximum number of states of each intermediate determinization
   * @return minimal deterministic automaton
   * @throws StateLimitExceededException if a determinization goes over {@code maxStates}
   */
  public static Automaton minimize(Automaton automaton, int maxStates) {
    final Automaton dfa = PowersetDeterminizer.determinize(automaton, maxStates);
    if (dfa.acceptingStates().isEmpty()) {
      logger.fine(() -> "Automaton of " + automaton.size() + " states recognizes the empty language");
      return emptyLanguage(automaton);
    }

    final Automaton reversed = PowersetDeterminizer.determinize(transpose(dfa), maxStates);
    final Automaton minimal = PowersetDeterminizer.determinize(transpose(reversed), maxStates);
    logger.fine(() -> "Minimized " + automaton.size() + " states into " + minimal.size() + " states");
    return minimal;
  }

  private static Automaton emptyLanguage(Automaton automaton) {
    final var builder = new Automaton.Builder(automaton.alphabet());
    builder.addInitial(builder.addState("{}"));
    return builder.build();
  }
}
