package kleene.tester;

import kleene.codegen.CompiledDfa;
import kleene.construction.Construction;
import kleene.graph.Automaton;
import kleene.regex.Regex;
import java.util.List;
import java.util.Set;
import java.util.TreeSet;
import java.util.function.Consumer;

/**
 * Charged with running test cases.
 *
 * The pattern goes through every {@link Construction}, and the minimal
 * automaton is also compiled to bytecode. All of them must agree with the
 * expected output.
 */
public class TestRunner implements Consumer<TestCase> {

  /**
   * Route name of the compiled minimal automaton.
   */
  static final String COMPILED_ROUTE = "COMPILED";

  /**
   * How are test outcomes reported?
   */
  final TestReporter reporter;

  public TestRunner(TestReporter reporter) {
    this.reporter = reporter;
  }

  /**
   * Accept a new test case.
   *
   * @param testCase test to run
   */
  public void accept(TestCase testCase) {

    // Parse the pattern
    final Regex regex;
    try {
      regex = Regex.parse(testCase.pattern);
    } catch (Exception error) {
      if (testCase.expectsError()) {
        reporter.onSuccess(testCase, true);
      } else {
        reporter.onPatternError(testCase, null, error);
      }
      return;
    }

    // Symbols of the word which the pattern never uses still have to be read
    final List<String> word = testCase.word();
    final Set<String> alphabet = new TreeSet<>(regex.alphabet());
    alphabet.addAll(word);

    boolean passed = true;
    for (Construction construction : Construction.values()) {
      final String route = construction.name();
      try {
        final Automaton automaton = construction.build(regex, alphabet);
        passed &= checkOutput(testCase, route, automaton.accepts(word));

        if (construction == Construction.MINIMIZED) {
          final CompiledDfa compiled = CompiledDfa.compile(automaton);
          passed &= checkOutput(testCase, COMPILED_ROUTE, compiled.accepts(word));
        }
      } catch (RuntimeException error) {
        reporter.onPatternError(testCase, route, error);
        passed = false;
      }
    }

    if (passed) {
      reporter.onSuccess(testCase, false);
    }
  }

  private boolean checkOutput(TestCase testCase, String route, boolean accepted) {
    final String foundOutput = TestCase.createOutput(accepted);
    if (testCase.output.equals(foundOutput)) {
      return true;
    }
    reporter.onUnexpectedOutput(testCase, route, foundOutput);
    return false;
  }
}
