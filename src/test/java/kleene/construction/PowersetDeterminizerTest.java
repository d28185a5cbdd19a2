package kleene.construction;

import kleene.graph.Automaton;
import kleene.regex.Regex;
import java.util.List;
import java.util.Map;
import java.util.Set;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

public class PowersetDeterminizerTest {

  private static Automaton nfa() {
    return Automaton.of(
      Set.of("a", "b"),
      Set.of("q0", "q1"),
      Set.of("q0"),
      Set.of("q1"),
      Map.of(
        "q0", List.of(Map.entry("a", "q0"), Map.entry("b", "q0"), Map.entry("a", "q1")),
        "q1", List.of(Map.entry("a", "q1"), Map.entry("b", "q1"))
      )
    );
  }

  @Test
  void labelsStatesWithSubsets() {
    final Automaton dfa = PowersetDeterminizer.determinize(nfa());
    Assertions.assertTrue(dfa.isDeterministic());
    Assertions.assertEquals(2, dfa.size());
    Assertions.assertEquals("{q0}", dfa.label(0));
    Assertions.assertEquals("{q0,q1}", dfa.label(1));
    Assertions.assertEquals(Set.of(0), dfa.initialStates());
    Assertions.assertEquals(Set.of(1), dfa.acceptingStates());
    Assertions.assertEquals(
      List.of(new Automaton.Transition("a", 1), new Automaton.Transition("b", 0)),
      dfa.transitions(0)
    );
  }

  @Test
  void removesEpsilonTransitionsFirst() {
    final Automaton ndfae = Automaton.of(
      Set.of("a", "b"),
      Set.of("q-1", "q0", "q1", "q2"),
      Set.of("q-1"),
      Set.of("q2"),
      Map.of(
        "q-1", List.of(Map.entry("ε", "q0")),
        "q0", List.of(Map.entry("a", "q0"), Map.entry("b", "q0"), Map.entry("a", "q1")),
        "q1", List.of(Map.entry("a", "q1"), Map.entry("b", "q1"), Map.entry("ε", "q2"))
      )
    );
    final Automaton dfa = PowersetDeterminizer.determinize(ndfae);
    Assertions.assertTrue(dfa.isDeterministic());
    for (String word : List.of("", "a", "b", "ab", "ba", "bb", "bab", "bbbb", "abab")) {
      Assertions.assertEquals(ndfae.accepts(word), dfa.accepts(word), "Word `" + word + "`");
    }
  }

  @Test
  void keepsTheAlphabetAndLeavesTransitionsPartial() {
    final Automaton thompson = Thompson.build(Regex.parse("a b"), Set.of("a", "b", "c"));
    final Automaton dfa = PowersetDeterminizer.determinize(thompson);
    Assertions.assertEquals(Set.of("a", "b", "c"), dfa.alphabet());
    Assertions.assertEquals(3, dfa.size());
    Assertions.assertTrue(dfa.accepts("ab"));
    Assertions.assertFalse(dfa.accepts("abc"));
  }

  @Test
  void determinizesThompsonAutomata() {
    final Set<String> alphabet = Set.of("a", "b");
    final List<String> words = List.of("", "a", "b", "aa", "ab", "ba", "bb", "aba", "bab", "abba", "babab");
    for (String regex : List.of("(a + b)* a (a + b)", "(a b)* + b*", "((a + b) b)*", "a* b a*")) {
      final Automaton nfa = Thompson.build(Regex.parse(regex), alphabet);
      final Automaton dfa = PowersetDeterminizer.determinize(nfa);
      Assertions.assertTrue(dfa.isDeterministic(), "Expression `" + regex + "`");
      for (String word : words) {
        Assertions.assertEquals(nfa.accepts(word), dfa.accepts(word), "`" + regex + "` on `" + word + "`");
      }
    }
  }

  @Test
  void deterministicInputKeepsItsShape() {
    final Automaton dfa = PowersetDeterminizer.determinize(nfa());
    final Automaton again = PowersetDeterminizer.determinize(dfa);
    Assertions.assertEquals(dfa.size(), again.size());
    Assertions.assertEquals("{{q0}}", again.label(0));
  }

  @Test
  void enforcesStateLimit() {
    final var error = Assertions.assertThrows(
      StateLimitExceededException.class,
      () -> PowersetDeterminizer.determinize(nfa(), 1)
    );
    Assertions.assertEquals(1, error.getStateLimit());
    Assertions.assertEquals(2, PowersetDeterminizer.determinize(nfa(), 2).size());
  }
}
