package kleene.construction;

import kleene.graph.Automaton;
import kleene.graph.InvalidAutomatonException;
import kleene.parser.RegexVisitor;
import kleene.regex.Regex;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.logging.Logger;

/**
 * Glushkov's position automaton of a regular expression.
 *
 * Every occurrence of a letter in the expression (a position) becomes a state,
 * plus one extra initial state named {@code 0}. There are no empty
 * transitions: a transition into a position is labelled with the letter at
 * that position.
 */
public final class Glushkov {

  private static final Logger logger = Logger.getLogger(Glushkov.class.getName());

  /**
   * Label of the synthetic initial state.
   */
  public static final String INITIAL_STATE = "0";

  private Glushkov() { }

  /**
   * Expression in which every letter occurrence was renamed to be unique.
   *
   * @param regex linear expression, with letters renamed to {@code letter + index}
   * @param positions renamed letters, from left to right
   * @param letters original letter of each renamed letter
   * @param nextIndex first index not used by a position
   */
  public record Linearized(
    Regex regex,
    List<String> positions,
    Map<String, String> letters,
    int nextIndex
  ) { }

  /**
   * Rename every letter occurrence by suffixing it with its index, counting
   * from left to right.
   *
   * Letters may themselves end in digits, so {@code a1} at index 0 and
   * {@code a} at index 10 would both become {@code a10}. A renamed letter
   * which is already taken gets primes appended until it is unique.
   *
   * @param regex expression to linearize
   * @param startIndex index of the leftmost occurrence
   * @return linear expression along with its positions
   */
  public static Linearized linearize(Regex regex, int startIndex) {
    final var positions = new ArrayList<String>();
    final var letters = new HashMap<String, String>();
    final var taken = new HashSet<String>();

    final Regex linear = regex.accept(new RegexVisitor<Regex>() {
      private int index = startIndex;

      @Override
      public Regex visitEpsilon() {
        return Regex.epsilon();
      }

      @Override
      public Regex visitLetter(String letter) {
        String position = letter + index++;
        while (!taken.add(position)) {
          position += "'";
        }
        positions.add(position);
        letters.put(position, letter);
        return Regex.letter(position);
      }

      @Override
      public Regex visitConcatenation(Regex lhs, Regex rhs) {
        return Regex.concat(lhs, rhs);
      }

      @Override
      public Regex visitSum(Regex lhs, Regex rhs) {
        return Regex.sum(lhs, rhs);
      }

      @Override
      public Regex visitStar(Regex inner) {
        return Regex.star(inner);
      }
    });

    return new Linearized(
      linear,
      Collections.unmodifiableList(positions),
      Collections.unmodifiableMap(letters),
      startIndex + positions.size()
    );
  }

  public static Linearized linearize(Regex regex) {
    return linearize(regex, 0);
  }

  /**
   * Build the position automaton of an expression.
   *
   * @param regex expression to convert
   * @param alphabet alphabet of the automaton, containing the expression's
   * @return automaton with one state per letter occurrence, plus one
   * @throws InvalidAutomatonException if a letter is missing from the alphabet
   */
  public static Automaton build(Regex regex, Collection<String> alphabet) {
    if (!alphabet.containsAll(regex.alphabet())) {
      throw new InvalidAutomatonException("Alphabet " + alphabet + " does not contain all of " + regex.alphabet());
    }

    final Linearized linearized = linearize(regex);
    final Regex linear = linearized.regex();
    final Set<String> first = linear.initialLetters();
    final Set<String> last = linear.acceptingLetters();

    final var builder = new Automaton.Builder(alphabet);
    final int initial = builder.addState(INITIAL_STATE);
    builder.addInitial(initial);
    if (linear.acceptsEpsilon()) {
      builder.addAccepting(initial);
    }

    final List<String> positions = linearized.positions();
    for (String position : positions) {
      final int state = builder.addState(position);
      if (last.contains(position)) {
        builder.addAccepting(state);
      }
    }

    // Transitions are added in position order, so the output is stable
    for (String target : positions) {
      if (first.contains(target)) {
        builder.addTransition(initial, linearized.letters().get(target), builder.state(target));
      }
    }
    for (String source : positions) {
      final Set<String> follow = linear.successors(source);
      for (String target : positions) {
        if (follow.contains(target)) {
          builder.addTransition(builder.state(source), linearized.letters().get(target), builder.state(target));
        }
      }
    }

    final Automaton automaton = builder.build();
    logger.finer(() -> "Glushkov automaton of `" + linearized.regex() + "` has " + automaton.size() + " states");
    return automaton;
  }
}
