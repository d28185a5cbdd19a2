package kleene.graph;

/**
 * Attempt to build an automaton which breaks one of its structural rules.
 *
 * Thrown eagerly, as soon as the offending state, symbol or transition is
 * handed to the builder.
 */
public class InvalidAutomatonException extends IllegalArgumentException {

  @java.io.Serial
  private static final long serialVersionUID = 5293104476721348806L;

  public InvalidAutomatonException(String message) {
    super(message);
  }
}
