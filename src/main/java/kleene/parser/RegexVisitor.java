package kleene.parser;

/**
 * Bottom-up traversal of the regular expression AST.
 *
 * Children are always visited before their parent, and the left-hand side of
 * a binary node is visited before its right-hand side. Builders that hand out
 * fresh names from a counter can rely on that ordering to number states left
 * to right.
 *
 * @param <R> output from traversing the regex AST
 */
public interface RegexVisitor<R> {

  /**
   * Empty expression, matching only the empty word.
   */
  R visitEpsilon();

  /**
   * Matches exactly one letter.
   *
   * @param letter non-empty symbol
   */
  R visitLetter(String letter);

  /**
   * Matches a concatenation of two expressions.
   *
   * @param lhs first expression to match
   * @param rhs second expression to match
   */
  R visitConcatenation(R lhs, R rhs);

  /**
   * Matches a union of two expressions.
   *
   * @param lhs first alternative
   * @param rhs second alternative
   */
  R visitSum(R lhs, R rhs);

  /**
   * Matches an expression zero or more times.
   *
   * @param inner expression to repeat
   */
  R visitStar(R inner);
}
