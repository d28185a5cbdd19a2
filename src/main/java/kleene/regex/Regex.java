package kleene.regex;

import kleene.parser.RegexParser;
import kleene.parser.RegexVisitor;
import java.util.Collections;
import java.util.HashSet;
import java.util.Objects;
import java.util.Set;
import java.util.SortedSet;
import java.util.TreeSet;
import java.util.regex.PatternSyntaxException;

/**
 * Immutable regular expression AST.
 *
 * Nodes should be created through the static factories ({@link #epsilon()},
 * {@link #letter(String)}, {@link #concat(Regex, Regex)},
 * {@link #sum(Regex, Regex)} and {@link #star(Regex)}) which apply
 * {@link #simplify(Regex)} to the node they build. That keeps both
 * {@code equals} and {@link #toString()} canonical.
 */
public sealed interface Regex permits Regex.Epsilon, Regex.Letter, Regex.Concat, Regex.Sum, Regex.Star {

  /**
   * Symbol used for the empty word, both in the surface syntax and in
   * rendered expressions.
   */
  String EPSILON = "ε";

  /**
   * Fold the expression bottom up.
   *
   * @param visitor callbacks for each node type
   * @return output of the visitor for the root node
   */
  <R> R accept(RegexVisitor<R> visitor);

  /**
   * Whether the expression matches the empty word.
   */
  boolean acceptsEpsilon();

  /**
   * Letters that appear somewhere in the expression.
   */
  SortedSet<String> alphabet();

  /**
   * Letters that can start a matched word.
   */
  Set<String> initialLetters();

  /**
   * Letters that can end a matched word.
   */
  Set<String> acceptingLetters();

  /**
   * Letters that may immediately follow the given letter inside a matched
   * word.
   *
   * This is only meaningful on linear expressions (where every letter occurs
   * once), see {@code Glushkov.linearize}.
   *
   * @param letter letter whose successors are computed
   * @return successor letters
   */
  Set<String> successors(String letter);

  /**
   * Structural rendering, eg. {@code CONCAT(a, STAR(SUM(b, c)))}.
   */
  String toTreeString();

  static Regex epsilon() {
    return Epsilon.INSTANCE;
  }

  static Regex letter(String letter) {
    return new Letter(letter);
  }

  static Regex concat(Regex left, Regex right) {
    return simplify(new Concat(left, right));
  }

  static Regex sum(Regex left, Regex right) {
    return simplify(new Sum(left, right));
  }

  static Regex star(Regex inner) {
    return simplify(new Star(inner));
  }

  /**
   * Collapse a node whose children make it redundant.
   *
   * Concatenations with an epsilon side become the other side and the star
   * of epsilon is epsilon. Only the root of the node is looked at: children
   * built through the factories are already simplified.
   *
   * @param node freshly built node
   * @return equivalent simplified node
   */
  static Regex simplify(Regex node) {
    if (node instanceof Concat concat) {
      if (concat.left() instanceof Epsilon) {
        return concat.right();
      } else if (concat.right() instanceof Epsilon) {
        return concat.left();
      }
    } else if (node instanceof Star star && star.inner() instanceof Epsilon) {
      return star.inner();
    }
    return node;
  }

  /**
   * Parse a regular expression into an AST.
   *
   * Nested stars are flattened, so {@code (a*)*} is the same tree as
   * {@code a*}.
   *
   * @param input regular expression source
   * @return parsed and simplified expression
   */
  static Regex parse(String input) throws PatternSyntaxException {
    return RegexParser.parse(AstBuilder.INSTANCE, input);
  }

  /**
   * Visitor building up the explicit AST.
   */
  final class AstBuilder implements RegexVisitor<Regex> {

    static final AstBuilder INSTANCE = new AstBuilder();

    private AstBuilder() { }

    @Override
    public Regex visitEpsilon() {
      return Regex.epsilon();
    }

    @Override
    public Regex visitLetter(String letter) {
      return Regex.letter(letter);
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
      return (inner instanceof Star) ? inner : Regex.star(inner);
    }
  }

  /**
   * Matches only the empty word.
   */
  record Epsilon() implements Regex {

    static final Epsilon INSTANCE = new Epsilon();

    @Override
    public <R> R accept(RegexVisitor<R> visitor) {
      return visitor.visitEpsilon();
    }

    @Override
    public boolean acceptsEpsilon() {
      return true;
    }

    @Override
    public SortedSet<String> alphabet() {
      return new TreeSet<>();
    }

    @Override
    public Set<String> initialLetters() {
      return new HashSet<>();
    }

    @Override
    public Set<String> acceptingLetters() {
      return new HashSet<>();
    }

    @Override
    public Set<String> successors(String letter) {
      return new HashSet<>();
    }

    @Override
    public String toTreeString() {
      return EPSILON;
    }

    @Override
    public String toString() {
      return EPSILON;
    }
  }

  /**
   * Matches exactly the one-letter word {@code letter}.
   */
  record Letter(String letter) implements Regex {

    public Letter {
      Objects.requireNonNull(letter, "letter");
      if (letter.isEmpty()) {
        throw new IllegalArgumentException("A letter cannot be empty");
      } else if (letter.equals(EPSILON)) {
        throw new IllegalArgumentException("`" + EPSILON + "` is reserved for the empty word");
      }
    }

    @Override
    public <R> R accept(RegexVisitor<R> visitor) {
      return visitor.visitLetter(letter);
    }

    @Override
    public boolean acceptsEpsilon() {
      return false;
    }

    @Override
    public SortedSet<String> alphabet() {
      return new TreeSet<>(Collections.singleton(letter));
    }

    @Override
    public Set<String> initialLetters() {
      return new HashSet<>(Collections.singleton(letter));
    }

    @Override
    public Set<String> acceptingLetters() {
      return new HashSet<>(Collections.singleton(letter));
    }

    @Override
    public Set<String> successors(String other) {
      return new HashSet<>();
    }

    @Override
    public String toTreeString() {
      return letter;
    }

    @Override
    public String toString() {
      return letter;
    }
  }

  /**
   * Matches a word of {@code left} followed by a word of {@code right}.
   */
  record Concat(Regex left, Regex right) implements Regex {

    public Concat {
      Objects.requireNonNull(left, "left");
      Objects.requireNonNull(right, "right");
    }

    @Override
    public <R> R accept(RegexVisitor<R> visitor) {
      final R lhs = left.accept(visitor);
      final R rhs = right.accept(visitor);
      return visitor.visitConcatenation(lhs, rhs);
    }

    @Override
    public boolean acceptsEpsilon() {
      return left.acceptsEpsilon() && right.acceptsEpsilon();
    }

    @Override
    public SortedSet<String> alphabet() {
      final SortedSet<String> letters = left.alphabet();
      letters.addAll(right.alphabet());
      return letters;
    }

    @Override
    public Set<String> initialLetters() {
      final Set<String> letters = left.initialLetters();
      if (left.acceptsEpsilon()) {
        letters.addAll(right.initialLetters());
      }
      return letters;
    }

    @Override
    public Set<String> acceptingLetters() {
      final Set<String> letters = right.acceptingLetters();
      if (right.acceptsEpsilon()) {
        letters.addAll(left.acceptingLetters());
      }
      return letters;
    }

    @Override
    public Set<String> successors(String letter) {
      final Set<String> letters = left.successors(letter);
      letters.addAll(right.successors(letter));
      if (left.acceptingLetters().contains(letter)) {
        letters.addAll(right.initialLetters());
      }
      return letters;
    }

    @Override
    public String toTreeString() {
      return "CONCAT(" + left.toTreeString() + ", " + right.toTreeString() + ")";
    }

    @Override
    public String toString() {
      final String lhs = (left instanceof Sum) ? "(" + left + ")" : left.toString();
      final String rhs = (right instanceof Sum) ? "(" + right + ")" : right.toString();
      return lhs + " " + rhs;
    }
  }

  /**
   * Matches a word of either {@code left} or {@code right}.
   */
  record Sum(Regex left, Regex right) implements Regex {

    public Sum {
      Objects.requireNonNull(left, "left");
      Objects.requireNonNull(right, "right");
    }

    @Override
    public <R> R accept(RegexVisitor<R> visitor) {
      final R lhs = left.accept(visitor);
      final R rhs = right.accept(visitor);
      return visitor.visitSum(lhs, rhs);
    }

    @Override
    public boolean acceptsEpsilon() {
      return left.acceptsEpsilon() || right.acceptsEpsilon();
    }

    @Override
    public SortedSet<String> alphabet() {
      final SortedSet<String> letters = left.alphabet();
      letters.addAll(right.alphabet());
      return letters;
    }

    @Override
    public Set<String> initialLetters() {
      final Set<String> letters = left.initialLetters();
      letters.addAll(right.initialLetters());
      return letters;
    }

    @Override
    public Set<String> acceptingLetters() {
      final Set<String> letters = left.acceptingLetters();
      letters.addAll(right.acceptingLetters());
      return letters;
    }

    @Override
    public Set<String> successors(String letter) {
      final Set<String> letters = left.successors(letter);
      letters.addAll(right.successors(letter));
      return letters;
    }

    @Override
    public String toTreeString() {
      return "SUM(" + left.toTreeString() + ", " + right.toTreeString() + ")";
    }

    @Override
    public String toString() {
      return left + " + " + right;
    }
  }

  /**
   * Matches any number of words of {@code inner}, one after the other.
   */
  record Star(Regex inner) implements Regex {

    public Star {
      Objects.requireNonNull(inner, "inner");
    }

    @Override
    public <R> R accept(RegexVisitor<R> visitor) {
      return visitor.visitStar(inner.accept(visitor));
    }

    @Override
    public boolean acceptsEpsilon() {
      return true;
    }

    @Override
    public SortedSet<String> alphabet() {
      return inner.alphabet();
    }

    @Override
    public Set<String> initialLetters() {
      return inner.initialLetters();
    }

    @Override
    public Set<String> acceptingLetters() {
      return inner.acceptingLetters();
    }

    @Override
    public Set<String> successors(String letter) {
      final Set<String> letters = inner.successors(letter);
      if (inner.acceptingLetters().contains(letter)) {
        letters.addAll(inner.initialLetters());
      }
      return letters;
    }

    @Override
    public String toTreeString() {
      return "STAR(" + inner.toTreeString() + ")";
    }

    @Override
    public String toString() {
      return "(" + inner + ")*";
    }
  }
}
