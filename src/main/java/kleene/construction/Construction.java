package kleene.construction;

import kleene.graph.Automaton;
import kleene.regex.Regex;
import java.util.Set;

/**
 * Ways of turning a regular expression into an automaton.
 */
public enum Construction {

  /** Thompson's construction, with empty transitions. */
  THOMPSON {
    @Override
    public Automaton build(Regex regex, Set<String> alphabet) {
      return Thompson.build(regex, alphabet);
    }
  },

  /** Glushkov's position automaton. */
  GLUSHKOV {
    @Override
    public Automaton build(Regex regex, Set<String> alphabet) {
      return Glushkov.build(regex, alphabet);
    }
  },

  /** Automaton of the residuals of the expression. */
  RESIDUALS {
    @Override
    public Automaton build(Regex regex, Set<String> alphabet) {
      return ResidualAutomaton.build(regex, alphabet, RESIDUAL_STATE_LIMIT);
    }
  },

  /** Brzozowski-minimized Thompson automaton. */
  MINIMIZED {
    @Override
    public Automaton build(Regex regex, Set<String> alphabet) {
      return Brzozowski.minimize(Thompson.build(regex, alphabet));
    }
  },

  /**
   * Thompson automaton of the expression recovered from the Glushkov
   * automaton by state elimination.
   */
  STATE_ELIMINATION {
    @Override
    public Automaton build(Regex regex, Set<String> alphabet) {
      final Automaton glushkov = Glushkov.build(regex, alphabet);
      return StateElimination
        .toRegex(glushkov)
        .map(eliminated -> Thompson.build(eliminated, alphabet))
        .orElseGet(() -> Brzozowski.minimize(glushkov));
    }
  };

  /**
   * Bound on residual exploration, which does not terminate on some
   * expressions.
   */
  public static final int RESIDUAL_STATE_LIMIT = 1_000;

  /**
   * Build an automaton for an expression.
   *
   * @param regex expression to convert
   * @param alphabet alphabet of the automaton, containing the expression's
   * @return automaton recognizing the language of the expression
   */
  public abstract Automaton build(Regex regex, Set<String> alphabet);
}
