package kleene.tester;

interface TestReporter {

  /**
   * Handler for when a pattern (unexpectedly) fails to parse, or an
   * automaton fails to build.
   *
   * @param testCase test which failed
   * @param route construction which failed, {@code null} if parsing failed
   * @param error exception that was thrown
   */
  public void onPatternError(TestCase testCase, String route, Exception error);

  /**
   * Handler for when an automaton does not produce the expected output.
   *
   * @param testCase test which failed
   * @param route construction whose automaton disagreed
   * @param foundOutput output which was found
   */
  public void onUnexpectedOutput(TestCase testCase, String route, String foundOutput);

  /**
   * Handler for a test passing on every route.
   *
   * @param testCase test which passed
   * @param expectedFailure the successful behaviour was an error
   */
  public void onSuccess(TestCase testCase, boolean expectedFailure);
}
