package kleene.tester;

import kleene.graph.Automaton;
import java.util.List;

/**
 * Test case in a test file.
 */
public class TestCase {

  /**
   * Word written for the empty word.
   */
  public static final String EMPTY_WORD = "ε";

  /**
   * Regular expression pattern.
   */
  public final String pattern;

  /**
   * Word to feed to the automata.
   */
  public final String input;

  /**
   * Expected output: {@code true}, {@code false} or {@code error}.
   */
  public final String output;

  /**
   * Source file from which the test originated.
   */
  public final String filePath;

  /**
   * Line in the source file from which the test originated.
   */
  public final int lineNumber;

  public TestCase(
    String pattern,
    String input,
    String output,
    String filePath,
    int lineNumber
  ) {
    this.pattern = pattern;
    this.input = input;
    this.output = output;
    this.filePath = filePath;
    this.lineNumber = lineNumber;
  }

  /**
   * Symbols of the input word, one per code point.
   */
  public List<String> word() {
    return EMPTY_WORD.equals(input) ? List.of() : Automaton.symbols(input);
  }

  /**
   * Construct an output string from whether the word was accepted.
   */
  public static String createOutput(boolean accepted) {
    return accepted ? "true" : "false";
  }

  public boolean expectsError() {
    return output.startsWith("error");
  }

  /**
   * Render the test and its source location in a human readable fashion.
   */
  public String getSummary() {
    return "/" + pattern + "/ on '" + input + "' (at " + filePath + ":" + lineNumber + ")";
  }
}
