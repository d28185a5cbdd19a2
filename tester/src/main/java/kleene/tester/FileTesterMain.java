package kleene.tester;

import java.io.FileNotFoundException;
import java.io.IOException;
import kleene.construction.StateLimitExceededException;

/**
 * Processes {@code .txt} files that encode test cases.
 *
 * Each test case is three lines: a regular expression, a word ({@code ε} for
 * the empty word) and the expected outcome ({@code true}, {@code false} or
 * {@code error}).
 */
public class FileTesterMain {

  static int successes = 0;
  static int failures = 0;
  static int skipped = 0;

  public static void main(String[] testFiles) throws IOException {

    // Console reporter - writes its output straight to console
    final var consoleReporter = new TestReporter() {
      @Override
      public void onPatternError(TestCase testCase, String route, Exception error) {
        if (error instanceof StateLimitExceededException) {
          System.err.println("Skipping " + route + " for " + testCase.getSummary() + ": " + error.getMessage());
          FileTesterMain.skipped++;
        } else {
          final String stage = (route == null) ? "parsing" : "building " + route + " for";
          System.err.println("Unexpected error " + stage + " " + testCase.getSummary() + ": " + error.getMessage());
          FileTesterMain.failures++;
        }
      }

      @Override
      public void onUnexpectedOutput(TestCase testCase, String route, String foundOutput) {
        System.err.println("Unexpected output from " + route + " on " + testCase.getSummary() + ": expected '" + testCase.output + "' but got '" + foundOutput + "'");
        FileTesterMain.failures++;
      }

      @Override
      public void onSuccess(TestCase testCase, boolean expectedFailure) {
        FileTesterMain.successes++;
      }
    };

    final var runner = new TestRunner(consoleReporter);
    for (String testFile : testFiles) {
      processFileOfTests(runner, testFile);
    }

    System.err.println();
    System.err.println("PASSED: " + successes + ", FAILED: " + failures + ", SKIPPED: " + skipped);
  }

  /**
   * Process all of the tests inside a test file.
   *
   * @param runner test runner
   * @param testFile filepath to the tests
   */
  public static void processFileOfTests(TestRunner runner, String testFile) throws IOException {
    final TestFileReader reader;
    try {
      reader = new TestFileReader(testFile);
    } catch (FileNotFoundException err) {
      System.err.println("Failed to open file " + testFile + ": " + err.getMessage());
      return;
    }

    reader.forEachTestCase(runner);
  }
}
