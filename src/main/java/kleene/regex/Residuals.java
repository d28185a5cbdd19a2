package kleene.regex;

import java.util.List;
import java.util.Optional;

/**
 * Residuals (left quotients) of regular expressions.
 *
 * The residual of a language {@code L} by a word {@code w} is the set of words
 * {@code v} such that {@code wv} is in {@code L}. An absent result stands for
 * the empty language, which has no expression in this grammar.
 */
public final class Residuals {

  private Residuals() { }

  /**
   * Residual of an expression by one letter.
   *
   * @param regex expression to derive
   * @param letter letter to strip from the front of matched words
   * @return residual expression, empty if the residual language is empty
   */
  public static Optional<Regex> byLetter(Regex regex, String letter) {
    if (regex instanceof Regex.Epsilon) {
      return Optional.empty();
    } else if (regex instanceof Regex.Letter l) {
      return l.letter().equals(letter) ? Optional.of(Regex.epsilon()) : Optional.empty();
    } else if (regex instanceof Regex.Sum sum) {
      final Optional<Regex> left = byLetter(sum.left(), letter);
      final Optional<Regex> right = byLetter(sum.right(), letter);
      if (left.isPresent() && right.isPresent()) {
        return Optional.of(Regex.sum(left.get(), right.get()));
      }
      return left.isPresent() ? left : right;
    } else if (regex instanceof Regex.Concat concat) {
      final Optional<Regex> left = byLetter(concat.left(), letter)
        .map(residual -> Regex.concat(residual, concat.right()));
      if (!concat.left().acceptsEpsilon()) {
        return left;
      }
      final Optional<Regex> right = byLetter(concat.right(), letter);
      if (left.isPresent() && right.isPresent()) {
        return Optional.of(Regex.sum(left.get(), right.get()));
      }
      return left.isPresent() ? left : right;
    } else if (regex instanceof Regex.Star star) {
      return byLetter(star.inner(), letter).map(residual -> Regex.concat(residual, star));
    } else {
      throw new IllegalStateException("Unknown regular expression node " + regex);
    }
  }

  /**
   * Residual of an expression by a word, letters being its code points.
   *
   * @param regex expression to derive
   * @param word word to strip, the empty word leaves the expression as is
   * @return residual expression, empty if the residual language is empty
   */
  public static Optional<Regex> residual(Regex regex, String word) {
    return residual(Optional.of(regex), word);
  }

  /**
   * Residual of a possibly empty expression by a word.
   *
   * @param regex expression to derive, empty for the empty language
   * @param word word to strip, the empty word leaves the expression as is
   * @return residual expression, empty if the residual language is empty
   */
  public static Optional<Regex> residual(Optional<Regex> regex, String word) {
    Optional<Regex> current = regex;
    int offset = 0;
    while (current.isPresent() && offset < word.length()) {
      final int codePoint = word.codePointAt(offset);
      offset += Character.charCount(codePoint);
      current = byLetter(current.get(), new String(Character.toChars(codePoint)));
    }
    return current;
  }

  /**
   * Residual of an expression by a word given as a list of letters.
   *
   * @param regex expression to derive
   * @param word letters to strip, in order
   * @return residual expression, empty if the residual language is empty
   */
  public static Optional<Regex> residual(Regex regex, List<String> word) {
    Optional<Regex> current = Optional.of(regex);
    for (String letter : word) {
      if (current.isEmpty()) {
        break;
      }
      current = byLetter(current.get(), letter);
    }
    return current;
  }
}
