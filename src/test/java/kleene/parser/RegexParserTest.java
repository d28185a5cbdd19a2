package kleene.parser;

import kleene.regex.Regex;
import java.util.regex.PatternSyntaxException;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

public class RegexParserTest {

  private static void assertParsesTo(String input, String expectedTree) {
    final String tree = Regex.parse(input).toTreeString();
    Assertions.assertEquals(
      expectedTree.replace(" ", ""),
      tree.replace(" ", ""),
      "Parsing `" + input + "`"
    );
  }

  @Test
  void parsesAtoms() {
    assertParsesTo("ε", "ε");
    assertParsesTo("a", "a");
    assertParsesTo("7", "7");
    assertParsesTo("_", "_");
    assertParsesTo("((a))", "a");
  }

  @Test
  void parsesConcatenations() {
    assertParsesTo("a b", "CONCAT(a, b)");
    assertParsesTo("ab", "CONCAT(a, b)");
    assertParsesTo("abc", "CONCAT(CONCAT(a, b), c)");
    assertParsesTo("a (a + ε) b", "CONCAT(CONCAT(a, SUM(a, ε)), b)");
    assertParsesTo("(a + b*)aa b", "CONCAT(CONCAT(CONCAT(SUM(a, STAR(b)), a), a), b)");
  }

  @Test
  void dropsEpsilonFromConcatenations() {
    assertParsesTo("ε b", "b");
    assertParsesTo("b ε", "b");
    assertParsesTo("ε b ε", "b");
    assertParsesTo("ε ε ε", "ε");
  }

  @Test
  void parsesSums() {
    assertParsesTo("a + b", "SUM(a, b)");
    assertParsesTo("(a + b)", "SUM(a, b)");
    assertParsesTo("a + b + c", "SUM(SUM(a, b), c)");
  }

  @Test
  void parsesStars() {
    assertParsesTo("a*", "STAR(a)");
    assertParsesTo("a**", "STAR(a)");
    assertParsesTo("(a*)*", "STAR(a)");
    assertParsesTo("ε*", "ε");
    assertParsesTo("(a + b)*", "STAR(SUM(a, b))");
    assertParsesTo("a (a + b*)*", "CONCAT(a, STAR(SUM(a, STAR(b))))");
  }

  @Test
  void operatorOnTheRightTakesTheRestOfTheChain() {
    assertParsesTo("a + ab", "SUM(a, CONCAT(a, b))");
    assertParsesTo("a b + c", "CONCAT(a, SUM(b, c))");
    assertParsesTo("a + b c d", "SUM(a, CONCAT(CONCAT(b, c), d))");
  }

  @Test
  void ignoresWhitespace() {
    assertParsesTo("  ( a\t+ b ) *\n", "STAR(SUM(a, b))");
  }

  @Test
  void rejectsMalformedExpressions() {
    for (String input : new String[] { "", "   ", "()", "(a", "a)", "a +", "+ a", "*", "a + * b", "a # b" }) {
      Assertions.assertThrows(
        PatternSyntaxException.class,
        () -> Regex.parse(input),
        "Parsing `" + input + "`"
      );
    }
  }

  @Test
  void reportsErrorPosition() {
    final var error = Assertions.assertThrows(PatternSyntaxException.class, () -> Regex.parse("ab)"));
    Assertions.assertEquals(2, error.getIndex());
    Assertions.assertEquals("ab)", error.getPattern());
  }

  @Test
  void rejectsUnsupportedSyntax() {
    final var alternation = Assertions.assertThrows(
      UnsupportedPatternSyntaxException.class,
      () -> Regex.parse("a|b")
    );
    Assertions.assertTrue(alternation.unsupportedFeatureCategory.contains("`|`"));

    for (String input : new String[] { "a?", "a{2}", "[ab]", ".", "\\d", "^a", "a$" }) {
      Assertions.assertThrows(
        UnsupportedPatternSyntaxException.class,
        () -> Regex.parse(input),
        "Parsing `" + input + "`"
      );
    }
  }

  @Test
  void reportsThroughVisitor() {
    // Count the nodes of each kind without building a tree
    final int[] counts = new int[5];
    final Integer letters = RegexParser.parse(new RegexVisitor<Integer>() {
      @Override
      public Integer visitEpsilon() {
        counts[0]++;
        return 0;
      }

      @Override
      public Integer visitLetter(String letter) {
        counts[1]++;
        return 1;
      }

      @Override
      public Integer visitConcatenation(Integer lhs, Integer rhs) {
        counts[2]++;
        return lhs + rhs;
      }

      @Override
      public Integer visitSum(Integer lhs, Integer rhs) {
        counts[3]++;
        return lhs + rhs;
      }

      @Override
      public Integer visitStar(Integer inner) {
        counts[4]++;
        return inner;
      }
    }, "(a + ε)* b c");

    Assertions.assertEquals(3, letters);
    Assertions.assertArrayEquals(new int[] { 1, 3, 2, 1, 1 }, counts);
  }
}
