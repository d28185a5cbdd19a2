package kleene.construction;

import kleene.graph.Automaton;
import kleene.graph.InvalidAutomatonException;
import kleene.parser.RegexVisitor;
import kleene.regex.Regex;
import java.util.Collection;
import java.util.logging.Logger;

/**
 * Thompson's construction of an NFA from a regular expression.
 *
 * Every sub-expression becomes a fragment with one entry and one exit state,
 * glued together with empty transitions. States are named {@code q<n>}, with
 * {@code n} counting up from a starting index in the order in which the
 * fragments are built (left to right, children before parents).
 */
public final class Thompson {

  private static final Logger logger = Logger.getLogger(Thompson.class.getName());

  private Thompson() { }

  /**
   * Build the Thompson automaton of an expression, numbering states from 0.
   *
   * @param regex expression to convert
   * @param alphabet alphabet of the automaton, containing the expression's
   * @return automaton with a single initial and a single accepting state
   */
  public static Automaton build(Regex regex, Collection<String> alphabet) {
    return build(regex, alphabet, 0);
  }

  /**
   * Build the Thompson automaton of an expression.
   *
   * @param regex expression to convert
   * @param alphabet alphabet of the automaton, containing the expression's
   * @param startIndex index of the first state name
   * @return automaton with a single initial and a single accepting state
   * @throws InvalidAutomatonException if a letter is missing from the alphabet
   */
  public static Automaton build(Regex regex, Collection<String> alphabet, int startIndex) {
    if (!alphabet.containsAll(regex.alphabet())) {
      throw new InvalidAutomatonException("Alphabet " + alphabet + " does not contain all of " + regex.alphabet());
    }

    final var builder = new FragmentBuilder(alphabet, startIndex);
    final Fragment fragment = regex.accept(builder);
    builder.automaton.addInitial(fragment.initial());
    builder.automaton.addAccepting(fragment.accepting());

    final Automaton automaton = builder.automaton.build();
    logger.finer(() -> "Thompson automaton of `" + regex + "` has " + automaton.size() + " states");
    return automaton;
  }

  /**
   * Sub-automaton under construction.
   *
   * @param initial entry state
   * @param accepting exit state
   */
  private record Fragment(int initial, int accepting) { }

  /**
   * Visitor gluing fragments together as the expression is folded.
   */
  private static final class FragmentBuilder implements RegexVisitor<Fragment> {

    private final Automaton.Builder automaton;
    private int nextIndex;

    FragmentBuilder(Collection<String> alphabet, int startIndex) {
      this.automaton = new Automaton.Builder(alphabet);
      this.nextIndex = startIndex;
    }

    private int freshState() {
      return automaton.addState("q" + nextIndex++);
    }

    private Fragment link(String symbol) {
      final int initial = freshState();
      final int accepting = freshState();
      automaton.addTransition(initial, symbol, accepting);
      return new Fragment(initial, accepting);
    }

    @Override
    public Fragment visitEpsilon() {
      return link(Automaton.EPSILON);
    }

    @Override
    public Fragment visitLetter(String letter) {
      return link(letter);
    }

    @Override
    public Fragment visitConcatenation(Fragment lhs, Fragment rhs) {
      automaton.addEpsilonTransition(lhs.accepting(), rhs.initial());
      return new Fragment(lhs.initial(), rhs.accepting());
    }

    @Override
    public Fragment visitSum(Fragment lhs, Fragment rhs) {
      final int initial = freshState();
      final int accepting = freshState();
      automaton.addEpsilonTransition(initial, lhs.initial());
      automaton.addEpsilonTransition(initial, rhs.initial());
      automaton.addEpsilonTransition(lhs.accepting(), accepting);
      automaton.addEpsilonTransition(rhs.accepting(), accepting);
      return new Fragment(initial, accepting);
    }

    @Override
    public Fragment visitStar(Fragment inner) {
      final int initial = freshState();
      final int accepting = freshState();
      automaton.addEpsilonTransition(initial, inner.initial());
      automaton.addEpsilonTransition(inner.accepting(), accepting);
      automaton.addEpsilonTransition(initial, accepting);
      automaton.addEpsilonTransition(inner.accepting(), inner.initial());
      return new Fragment(initial, accepting);
    }
  }
}
