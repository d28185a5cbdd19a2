package kleene.construction;

import kleene.graph.Automaton;
import kleene.regex.Regex;
import java.util.Optional;
import java.util.logging.Logger;

/**
 * Conversion of an automaton into a regular expression by eliminating states
 * one at a time.
 *
 * Edges are labelled with expressions, over the automaton's states plus a
 * fresh initial and a fresh accepting state. Removing state {@code i} reroutes
 * every path {@code k -> i -> l} into the edge {@code k -> l} as
 * {@code T[k][i] (T[i][i])* T[i][l]}. Once only the two fresh states are left,
 * the edge between them is the expression of the automaton.
 */
public final class StateElimination {

  private static final Logger logger = Logger.getLogger(StateElimination.class.getName());

  private StateElimination() { }

  /**
   * Expression of the language recognized by an automaton.
   *
   * States are eliminated from the highest index down.
   *
   * @param automaton automaton to convert
   * @return equivalent expression, or nothing if the language is empty
   */
  public static Optional<Regex> toRegex(Automaton automaton) {
    final int size = automaton.size();
    final int init = size;
    final int acc = size + 1;

    // `null` entries are the empty language
    final Regex[][] table = new Regex[size + 2][size + 2];

    for (int state : automaton.initialStates()) {
      table[init][state] = Regex.epsilon();
    }
    for (int from = 0; from < size; from++) {
      for (Automaton.Transition transition : automaton.transitions(from)) {
        final Regex label = transition.isEpsilon() ? Regex.epsilon() : Regex.letter(transition.symbol());
        table[from][transition.target()] = union(table[from][transition.target()], label);
      }
    }
    for (int state : automaton.acceptingStates()) {
      table[state][acc] = union(table[state][acc], Regex.epsilon());
    }

    for (int removed = size - 1; removed >= 0; removed--) {
      final Regex loop = table[removed][removed];

      for (int k = 0; k < size + 2; k++) {
        if (!isRemaining(k, removed, size) || table[k][removed] == null) {
          continue;
        }
        final Regex into = (loop == null)
          ? table[k][removed]
          : Regex.concat(table[k][removed], Regex.star(loop));

        for (int l = 0; l < size + 2; l++) {
          if (!isRemaining(l, removed, size) || table[removed][l] == null) {
            continue;
          }
          table[k][l] = union(table[k][l], Regex.concat(into, table[removed][l]));
        }
      }
    }

    final Optional<Regex> regex = Optional.ofNullable(table[init][acc]);
    logger.finer(() -> "Eliminated " + size + " states into " + regex.map(Regex::toString).orElse("the empty language"));
    return regex;
  }

  /**
   * Whether a table index still has to be considered once {@code removed} is
   * being eliminated (states above it are already gone).
   */
  private static boolean isRemaining(int index, int removed, int size) {
    return index < removed || index >= size;
  }

  private static Regex union(Regex existing, Regex added) {
    return existing == null ? added : Regex.sum(existing, added);
  }
}
