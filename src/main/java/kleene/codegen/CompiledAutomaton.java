package kleene.codegen;

/**
 * Deterministic automaton compiled into JVM bytecode.
 *
 * Implementations are generated at runtime by {@link CompiledDfa}.
 */
public interface CompiledAutomaton {

  /**
   * Run the automaton.
   *
   * @param symbols word to read, as indices into the sorted alphabet
   * @return whether the word is accepted
   */
  boolean accepts(int[] symbols);
}
