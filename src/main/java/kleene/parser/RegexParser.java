package kleene.parser;

import java.util.regex.PatternSyntaxException;

/**
 * Parser for regular expressions over single-character letters.
 *
 * The supported syntax is small:
 *
 *   - letters are word characters (letters, digits and {@code _})
 *   - {@code ε} is the empty word
 *   - {@code e*} is the Kleene star (a run of stars counts as one)
 *   - {@code e + f} is a sum (union)
 *   - {@code e f} (juxtaposition) is a concatenation
 *   - parentheses group and whitespace is ignored
 *
 * A run of the same operator associates to the left. When the operator
 * changes, the operator on the right takes the rest of the chain as its
 * operand, so {@code a + ab} is {@code a + (ab)} while {@code a b + c} is
 * {@code a (b + c)}.
 *
 * Results are made available through a visitor instead of as an explicit AST
 * type.
 */
public final class RegexParser<A> {

  // Used when "visiting" the AST bottom up
  private final RegexVisitor<A> visitor;

  // Bookkeeping around position in source
  private final String input;
  private final int length;
  private int position = 0;

  /**
   * Infix operators, the empty one being concatenation.
   */
  private enum Operator {
    SUM,
    CONCATENATION
  }

  /**
   * Parse a regular expression from an input string.
   *
   * @param visitor regex visitor used to accept bottom-up parsing progress
   * @param input regular expression
   * @return parsed regular expression
   */
  public static <B> B parse(
    RegexVisitor<B> visitor,
    String input
  ) throws PatternSyntaxException {
    final var parser = new RegexParser<B>(visitor, input);
    final B parsed = parser.parseChain(parser.parseStarred());

    if (parser.peekChar() != -1) {
      throw parser.error("Expected the end of the regular expression");
    }
    return parsed;
  }

  private RegexParser(RegexVisitor<A> visitor, String input) {
    this.visitor = visitor;
    this.input = input;
    this.length = input.length();
  }

  private PatternSyntaxException error(String message) {
    return new PatternSyntaxException(message, input, position);
  }

  private UnsupportedPatternSyntaxException unsupported(String unsupported) {
    return new UnsupportedPatternSyntaxException(unsupported, input, position);
  }

  /**
   * Advance the cursor past any whitespace.
   */
  private void skipSpace() {
    while (position < length) {
      final int codePoint = input.codePointAt(position);
      if (!Character.isWhitespace(codePoint)) {
        break;
      }
      position += Character.charCount(codePoint);
    }
  }

  /**
   * Peek the next code point in the input without advancing the position.
   *
   * @return next code point or else -1 if there is none
   */
  int peekChar() {
    skipSpace();
    return position < length ? input.codePointAt(position) : -1;
  }

  /**
   * Skip over the next code point.
   */
  void skipChar() {
    skipSpace();
    position += Character.charCount(input.codePointAt(position));
  }

  /**
   * Advance past the next code point only if it matches the expected.
   *
   * @param matching desired character
   * @return whether the character was found
   */
  boolean nextCharIf(char matching) {
    skipSpace();
    final boolean matches = position < length && input.charAt(position) == matching;
    if (matches) {
      position++;
    }
    return matches;
  }

  /**
   * Which infix operator comes next, if any.
   *
   * Anything which isn't a closing paren or a {@code +} starts an operand and
   * so is treated as the (empty) concatenation operator. Invalid characters
   * get reported when the operand is parsed.
   */
  private Operator peekOperator() {
    final int c = peekChar();
    if (c == -1 || c == ')') {
      return null;
    } else if (c == '+') {
      return Operator.SUM;
    } else {
      return Operator.CONCATENATION;
    }
  }

  private A combine(Operator operator, A lhs, A rhs) {
    switch (operator) {
      case SUM:
        return visitor.visitSum(lhs, rhs);
      case CONCATENATION:
        return visitor.visitConcatenation(lhs, rhs);
      default:
        throw new IllegalStateException("Unknown operator " + operator);
    }
  }

  /**
   * Parse the rest of a chain of sums and concatenations.
   *
   * @param lhs operand already parsed at the start of the chain
   */
  private A parseChain(A lhs) throws PatternSyntaxException {
    Operator operator = peekOperator();

    while (operator != null) {
      if (operator == Operator.SUM) {
        skipChar();
      }
      A rhs = parseStarred();

      final Operator next = peekOperator();
      if (next != null && next != operator) {
        // The operator on the right swallows everything that is left
        rhs = parseChain(rhs);
        return combine(operator, lhs, rhs);
      }

      lhs = combine(operator, lhs, rhs);
      operator = next;
    }

    return lhs;
  }

  /**
   * Parse an atom followed by any number of stars.
   */
  private A parseStarred() throws PatternSyntaxException {
    A starred = parseAtom();

    boolean isStarred = false;
    while (nextCharIf('*')) {
      isStarred = true;
    }

    return isStarred ? visitor.visitStar(starred) : starred;
  }

  /**
   * Parse a letter, an epsilon, or a parenthesized expression.
   */
  private A parseAtom() throws PatternSyntaxException {
    final int c = peekChar();
    switch (c) {
      case -1:
        throw error("Unexpected end of the regular expression (expected a letter, `ε` or `(`)");

      case '(': {
        final int openParenPosition = position;
        skipChar();
        final A inner = parseChain(parseStarred());
        if (!nextCharIf(')')) {
          throw error("Unclosed group (expected close paren for group opened at " + openParenPosition + ")");
        }
        return inner;
      }

      case 'ε':
        skipChar();
        return visitor.visitEpsilon();

      case ')':
        throw error("Unexpected close paren (expected a letter, `ε` or `(`)");

      case '+':
      case '*':
        throw error("Dangling operator `" + (char) c + "` (expected a letter, `ε` or `(`)");

      case '|':
        throw unsupported("Alternations with `|` (use `+`)");

      case '?':
        throw unsupported("Optional quantifiers");

      case '{':
        throw unsupported("Bounded repetitions");

      case '[':
        throw unsupported("Character classes");

      case '.':
        throw unsupported("Wildcards");

      case '\\':
        throw unsupported("Escape sequences");

      case '^':
      case '$':
        throw unsupported("Boundary matchers");

      default:
        if (Character.isLetterOrDigit(c) || c == '_') {
          skipChar();
          return visitor.visitLetter(new String(Character.toChars(c)));
        }
        throw error("Unexpected character `" + new String(Character.toChars(c)) + "`");
    }
  }
}
