package kleene.construction;

import kleene.graph.Automaton;
import kleene.graph.InvalidAutomatonException;
import kleene.regex.Regex;
import java.util.List;
import java.util.Map;
import java.util.Set;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

public class BrzozowskiTest {

  @Test
  void transpose() {
    final Automaton automaton = Automaton.of(
      Set.of("a", "b"),
      Set.of("q0", "q1", "q2"),
      Set.of("q0"),
      Set.of("q2"),
      Map.of(
        "q0", List.of(Map.entry("a", "q1")),
        "q1", List.of(Map.entry("b", "q2"))
      )
    );
    final Automaton transposed = Brzozowski.transpose(automaton);
    Assertions.assertEquals(automaton.size(), transposed.size());
    Assertions.assertEquals("q2", transposed.label(2));
    Assertions.assertEquals(Set.of(2), transposed.initialStates());
    Assertions.assertEquals(Set.of(0), transposed.acceptingStates());
    Assertions.assertTrue(transposed.accepts("ba"));
    Assertions.assertFalse(transposed.accepts(""));
    Assertions.assertFalse(transposed.accepts("a"));
    Assertions.assertFalse(transposed.accepts("b"));
    Assertions.assertFalse(transposed.accepts("aa"));
    Assertions.assertFalse(transposed.accepts("ab"));
    Assertions.assertFalse(transposed.accepts("bb"));
  }

  @Test
  void transposeNeedsAnAcceptingState() {
    final Automaton automaton = Automaton.of(Set.of("a"), Set.of("q0"), Set.of("q0"), Set.of(), Map.of());
    Assertions.assertThrows(InvalidAutomatonException.class, () -> Brzozowski.transpose(automaton));
  }

  @Test
  void minimizeWord() {
    final Automaton minimal = Brzozowski.minimize(Thompson.build(Regex.parse("abcd"), Set.of("a", "b", "c", "d")));
    Assertions.assertEquals(5, minimal.size());
    Assertions.assertTrue(minimal.isDeterministic());
    Assertions.assertTrue(minimal.accepts("abcd"));
    Assertions.assertFalse(minimal.accepts("a"));
    Assertions.assertFalse(minimal.accepts("ab"));
    Assertions.assertFalse(minimal.accepts("abc"));
    Assertions.assertFalse(minimal.accepts("bcda"));
    Assertions.assertFalse(minimal.accepts("dcbaa"));
  }

  @Test
  void minimizeMergesEquivalentStates() {
    final Set<String> alphabet = Set.of("a", "b");
    Assertions.assertEquals(2, Brzozowski.minimize(Thompson.build(Regex.parse("(a + b)* a"), alphabet)).size());
    Assertions.assertEquals(1, Brzozowski.minimize(Thompson.build(Regex.parse("(a + b)*"), alphabet)).size());
    Assertions.assertEquals(1, Brzozowski.minimize(Thompson.build(Regex.parse("(a* b*)*"), alphabet)).size());
    Assertions.assertEquals(1, Brzozowski.minimize(Thompson.build(Regex.parse("ε"), alphabet)).size());
  }

  @Test
  void minimizeIsIdempotent() {
    final Set<String> alphabet = Set.of("a", "b", "c");
    final List<String> words = List.of("", "a", "b", "c", "ab", "abc", "cab", "aabbcc", "abcabc", "ccc");
    for (String regex : List.of("(a + b)* c", "a* b* c*", "(a b + c)*", "(a + ε)(b + ε)(c + ε)", "(a (b + (bbabb))* c)*")) {
      final Automaton automaton = Glushkov.build(Regex.parse(regex), alphabet);
      final Automaton once = Brzozowski.minimize(automaton);
      final Automaton twice = Brzozowski.minimize(once);
      Assertions.assertTrue(once.isDeterministic());
      Assertions.assertEquals(once.size(), twice.size(), "Expression `" + regex + "`");
      for (String word : words) {
        Assertions.assertEquals(automaton.accepts(word), once.accepts(word), "`" + regex + "` on `" + word + "`");
        Assertions.assertEquals(once.accepts(word), twice.accepts(word), "`" + regex + "` on `" + word + "`");
      }
    }
  }

  @Test
  void minimizeEmptyLanguage() {
    final Automaton automaton = Automaton.of(
      Set.of("a"),
      Set.of("q0", "q1"),
      Set.of("q0"),
      Set.of(),
      Map.of("q0", List.of(Map.entry("a", "q1")))
    );
    final Automaton minimal = Brzozowski.minimize(automaton);
    Assertions.assertEquals(1, minimal.size());
    Assertions.assertTrue(minimal.acceptingStates().isEmpty());
    Assertions.assertTrue(minimal.isDeterministic());
    Assertions.assertFalse(minimal.accepts(""));
    Assertions.assertFalse(minimal.accepts("a"));
  }
}
