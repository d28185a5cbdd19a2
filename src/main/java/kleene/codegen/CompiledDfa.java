package kleene.codegen;

import kleene.graph.Automaton;
import java.lang.invoke.MethodHandle;
import java.lang.invoke.MethodHandles;
import java.lang.invoke.MethodType;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.logging.Logger;
import org.objectweb.asm.ClassWriter;
import org.objectweb.asm.Label;
import org.objectweb.asm.MethodVisitor;
import org.objectweb.asm.Opcodes;

/**
 * Deterministic automaton compiled into a hidden JVM class.
 *
 * Every state becomes a block of bytecode which reads the next symbol and
 * jumps to the block of the next state with a {@code lookupswitch}. Symbols
 * are passed in as their index in the sorted alphabet.
 */
public final class CompiledDfa {

  private static final Logger logger = Logger.getLogger(CompiledDfa.class.getName());

  private static final String CLASS_NAME = "kleene/codegen/CompiledDfa$Generated";

  private final Automaton dfa;
  private final Map<String, Integer> symbolIndices;
  private final CompiledAutomaton compiled;

  private CompiledDfa(Automaton dfa, Map<String, Integer> symbolIndices, CompiledAutomaton compiled) {
    this.dfa = dfa;
    this.symbolIndices = symbolIndices;
    this.compiled = compiled;
  }

  /**
   * Compile a deterministic automaton.
   *
   * @param dfa deterministic automaton
   * @return compiled matcher
   * @throws IllegalArgumentException if the automaton is not deterministic
   */
  public static CompiledDfa compile(Automaton dfa) {
    return compile(dfa, false);
  }

  /**
   * Compile a deterministic automaton.
   *
   * @param dfa deterministic automaton
   * @param printDebugInfo generate code which prints the states visited to STDERR
   * @return compiled matcher
   * @throws IllegalArgumentException if the automaton is not deterministic
   */
  public static CompiledDfa compile(Automaton dfa, boolean printDebugInfo) {
    if (!dfa.isDeterministic()) {
      throw new IllegalArgumentException("Only deterministic automata can be compiled");
    }

    final var symbolIndices = new HashMap<String, Integer>();
    for (String symbol : dfa.alphabet()) {
      symbolIndices.put(symbol, symbolIndices.size());
    }

    final byte[] classBytes = generateClass(dfa, symbolIndices, printDebugInfo).toByteArray();
    final CompiledAutomaton compiled;
    try {
      final MethodHandles.Lookup lookup = MethodHandles
        .lookup()
        .defineHiddenClass(classBytes, true);
      final MethodHandle constructor = lookup.findConstructor(
        lookup.lookupClass(),
        MethodType.methodType(void.class)
      );
      compiled = (CompiledAutomaton) constructor.invoke();
    } catch (Throwable e) {
      throw new IllegalStateException("Failed to load compiled automaton", e);
    }

    logger.fine(() -> "Compiled automaton of " + dfa.size() + " states into " + classBytes.length + " bytes");
    return new CompiledDfa(dfa, symbolIndices, compiled);
  }

  public Automaton automaton() {
    return dfa;
  }

  /**
   * Run the compiled automaton on a word.
   *
   * @param word symbols of the word, in order
   * @return whether the word is accepted
   * @throws IllegalArgumentException if a symbol is not in the alphabet
   */
  public boolean accepts(List<String> word) {
    final int[] symbols = new int[word.size()];
    for (int i = 0; i < symbols.length; i++) {
      final Integer index = symbolIndices.get(word.get(i));
      if (index == null) {
        throw new IllegalArgumentException("Invalid word " + word + ": unknown symbol `" + word.get(i) + "`");
      }
      symbols[i] = index;
    }
    return compiled.accepts(symbols);
  }

  /**
   * Run the compiled automaton on a word, each code point being one symbol.
   *
   * @param word word to read
   * @return whether the word is accepted
   * @throws IllegalArgumentException if a symbol is not in the alphabet
   */
  public boolean accepts(CharSequence word) {
    return accepts(Automaton.symbols(Objects.requireNonNull(word, "word")));
  }

  /**
   * Code generator for the class implementing {@link CompiledAutomaton}.
   */
  private static ClassWriter generateClass(
    Automaton dfa,
    Map<String, Integer> symbolIndices,
    boolean printDebugInfo
  ) {

    // Note: `COMPUTE_FRAMES` means that `visitMaxs` ignores its arguments
    final var cw = new ClassWriter(ClassWriter.COMPUTE_FRAMES);
    cw.visit(
      Opcodes.V1_8,
      Opcodes.ACC_SUPER | Opcodes.ACC_FINAL | Opcodes.ACC_SYNTHETIC,
      CLASS_NAME,
      null, // signature
      Method.OBJECT_CLASS_NAME,
      new String[] { Method.COMPILEDAUTOMATON_CLASS_NAME }
    );

    // Make constructor (which takes no arguments - the class has no state!)
    {
      final var mv = Method.EMPTYINIT_M.newMethod(cw, Opcodes.ACC_PUBLIC);
      mv.visitCode();
      mv.visitVarInsn(Opcodes.ALOAD, 0);
      Method.EMPTYINIT_M.invokeMethod(mv, Method.OBJECT_CLASS_NAME);
      mv.visitInsn(Opcodes.RETURN);
      mv.visitMaxs(0, 0);
      mv.visitEnd();
    }

    // `accepts` method
    {
      final var mv = Method.ACCEPTS_M.newMethod(cw, Opcodes.ACC_PUBLIC);
      mv.visitCode();
      generateBytecodeForAutomaton(mv, dfa, symbolIndices, printDebugInfo);
      mv.visitMaxs(0, 0);
      mv.visitEnd();
    }

    cw.visitEnd();
    return cw;
  }

  /**
   * Generate the body of {@code accepts}.
   *
   * @param mv method visitor (only argument is the input {@code int[]})
   * @param dfa deterministic automaton
   * @param symbolIndices index of each alphabet symbol
   * @param printDebugInfo generate code which prints debug info to STDERR
   */
  private static void generateBytecodeForAutomaton(
    MethodVisitor mv,
    Automaton dfa,
    Map<String, Integer> symbolIndices,
    boolean printDebugInfo
  ) {
    final int inputVar = 1;  // Input argument: `int[] symbols`
    final int offsetVar = 2; // Local tracking (ascending) offset in input: `int offset`
    final int lengthVar = 3; // Local tracking max offset in input: `int length`

    // Variable for offset in input
    mv.visitInsn(Opcodes.ICONST_M1);
    mv.visitVarInsn(Opcodes.ISTORE, offsetVar);

    // Variable for length of input
    mv.visitVarInsn(Opcodes.ALOAD, inputVar);
    mv.visitInsn(Opcodes.ARRAYLENGTH);
    mv.visitVarInsn(Opcodes.ISTORE, lengthVar);

    final Label returnFailure = new Label();
    final Label returnSuccess = new Label();
    final List<Label> stateLabels = new ArrayList<>();
    for (int state = 0; state < dfa.size(); state++) {
      stateLabels.add(new Label());
    }

    // Jump to the first state
    mv.visitJumpInsn(Opcodes.GOTO, stateLabels.get(dfa.initialStates().first()));

    // Lay out the blocks for each state
    for (int state = 0; state < dfa.size(); state++) {
      mv.visitLabel(stateLabels.get(state));

      if (printDebugInfo) {
        mv.visitFieldInsn(Opcodes.GETSTATIC, Method.SYSTEM_CLASS_NAME, "err", "Ljava/io/PrintStream;");
        mv.visitLdcInsn("[DFA] entering " + dfa.label(state));
        Method.PRINTLNSTR_M.invokeMethod(mv, Method.PRINTSTREAM_CLASS_NAME);
      }

      // Increment the offset and, if it reaches the length, return whether the state is accepting
      mv.visitIincInsn(offsetVar, 1);
      mv.visitVarInsn(Opcodes.ILOAD, offsetVar);
      mv.visitVarInsn(Opcodes.ILOAD, lengthVar);
      mv.visitJumpInsn(Opcodes.IF_ICMPGE, dfa.isAccepting(state) ? returnSuccess : returnFailure);

      // Get the next symbol
      mv.visitVarInsn(Opcodes.ALOAD, inputVar);
      mv.visitVarInsn(Opcodes.ILOAD, offsetVar);
      mv.visitInsn(Opcodes.IALOAD);

      generateDfaTransition(mv, dfa.transitions(state), symbolIndices, stateLabels, returnFailure);
    }

    // Returning unsuccessfully
    mv.visitLabel(returnFailure);
    mv.visitInsn(Opcodes.ICONST_0);
    mv.visitInsn(Opcodes.IRETURN);

    // Returning successfully
    mv.visitLabel(returnSuccess);
    mv.visitInsn(Opcodes.ICONST_1);
    mv.visitInsn(Opcodes.IRETURN);
  }

  /**
   * Generate the jump out of a state, with the symbol on top of the stack.
   */
  private static void generateDfaTransition(
    MethodVisitor mv,
    List<Automaton.Transition> transitions,
    Map<String, Integer> symbolIndices,
    List<Label> stateLabels,
    Label returnFailure
  ) {
    if (transitions.isEmpty()) {
      mv.visitInsn(Opcodes.POP);
      mv.visitJumpInsn(Opcodes.GOTO, returnFailure);
      return;
    }

    // `lookupswitch` keys must be sorted
    final int[] keys = transitions
      .stream()
      .mapToInt(transition -> symbolIndices.get(transition.symbol()))
      .sorted()
      .toArray();
    final Label[] targets = new Label[keys.length];
    for (Automaton.Transition transition : transitions) {
      final int key = symbolIndices.get(transition.symbol());
      for (int i = 0; i < keys.length; i++) {
        if (keys[i] == key) {
          targets[i] = stateLabels.get(transition.target());
        }
      }
    }

    mv.visitLookupSwitchInsn(returnFailure, keys, targets);
  }
}
