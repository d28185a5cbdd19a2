package kleene.construction;

/**
 * A construction needed more states than it was allowed to create.
 */
public class StateLimitExceededException extends RuntimeException {

  @java.io.Serial
  private static final long serialVersionUID = -6950383224817330482L;

  private final String construction;
  private final int stateLimit;

  public StateLimitExceededException(String construction, int stateLimit) {
    super(construction + " would require more than " + stateLimit + " states");
    this.construction = construction;
    this.stateLimit = stateLimit;
  }

  /**
   * Name of the construction which was aborted.
   */
  public String getConstruction() {
    return construction;
  }

  public int getStateLimit() {
    return stateLimit;
  }
}
