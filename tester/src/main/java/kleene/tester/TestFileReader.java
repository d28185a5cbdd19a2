package kleene.tester;

import java.io.BufferedReader;
import java.io.FileInputStream;
import java.io.FileNotFoundException;
import java.io.IOException;
import java.io.InputStreamReader;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.util.function.Consumer;
import java.util.regex.Pattern;

/**
 * Reads test cases, three lines at a time.
 *
 * Skips over comment lines and blank lines, processes unicode escapes.
 */
public class TestFileReader {

  private static final Pattern UNICODE_ESCAPES = Pattern.compile("\\\\u([0-9a-fA-F]{4})");

  private final BufferedReader reader;

  private final String filePath;

  private int lineNumber = 0;

  public TestFileReader(String filePath) throws FileNotFoundException {
    this(new InputStreamReader(new FileInputStream(filePath), StandardCharsets.UTF_8), filePath);
  }

  /**
   * @param reader source of the test cases
   * @param filePath name under which the source is reported
   */
  public TestFileReader(Reader reader, String filePath) {
    this.reader = new BufferedReader(reader);
    this.filePath = filePath;
  }

  /**
   * Read the next processed line from the input.
   */
  public String readLine() throws IOException {
    String line;

    while (true) {
      line = reader.readLine();
      lineNumber++;
      if (line == null) {
        return line; // EOF
      } else if (line.startsWith("//") || line.isBlank()) {
        continue; // Not a valid line
      }

      line = processLineEscapes(line.strip());
      break;
    }

    return line;
  }

  /**
   * Read the next test case from the input.
   *
   * @return test case, or {@code null} at the end of the input
   * @throws IOException if the input ends in the middle of a test case
   */
  public TestCase readTestCase() throws IOException {

    // Test data
    final String pattern = readLine();
    if (pattern == null) {
      return null;
    }
    final int lineNumber = this.lineNumber;
    final String input = readLine();
    final String outputData = readLine();
    if (input == null || outputData == null) {
      throw new IOException("Incomplete test case at " + filePath + ":" + lineNumber);
    }

    return new TestCase(pattern, input, outputData, filePath, lineNumber);
  }

  /**
   * Run an action for every remaining test case in the file.
   *
   * @param action action to run on each test case
   */
  public void forEachTestCase(Consumer<? super TestCase> action) throws IOException {
    TestCase testCase;
    while ((testCase = readTestCase()) != null) {
      action.accept(testCase);
    }
  }

  public int getLineNumber() {
    return lineNumber;
  }

  /**
   * Replace unicode escape sequences with the actual characters.
   *
   * @param line line to escape
   * @return escaped line
   */
  private static String processLineEscapes(String line) {
    return UNICODE_ESCAPES.matcher(line).replaceAll(result ->
      Character.toString((char) Integer.parseInt(result.group(1), 16))
    );
  }
}
