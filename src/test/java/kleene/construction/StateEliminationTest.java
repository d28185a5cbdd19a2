package kleene.construction;

import kleene.graph.Automaton;
import kleene.regex.Regex;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

public class StateEliminationTest {

  private static final Set<String> ALPHABET = Set.of("a", "b", "c");

  private static Automaton automaton(
    Set<String> states,
    Set<String> initial,
    Set<String> accepting,
    Map<String, List<Map.Entry<String, String>>> transitions
  ) {
    return Automaton.of(ALPHABET, states, initial, accepting, transitions);
  }

  private static void assertSameLanguage(Automaton expected, Automaton found, List<String> words) {
    for (String word : words) {
      Assertions.assertEquals(expected.accepts(word), found.accepts(word), "Word `" + word + "`");
    }
  }

  @Test
  void singleTransition() {
    final Automaton aut = automaton(
      Set.of("q0", "q1"),
      Set.of("q0"),
      Set.of("q1"),
      Map.of("q0", List.of(Map.entry("a", "q1")))
    );
    Assertions.assertEquals("a", StateElimination.toRegex(aut).orElseThrow().toTreeString());
  }

  @Test
  void pathOfTwoTransitions() {
    final Automaton aut = automaton(
      Set.of("q0", "q1", "q2"),
      Set.of("q0"),
      Set.of("q2"),
      Map.of(
        "q0", List.of(Map.entry("a", "q1")),
        "q1", List.of(Map.entry("b", "q2"))
      )
    );
    Assertions.assertEquals("CONCAT(a, b)", StateElimination.toRegex(aut).orElseThrow().toTreeString());
  }

  @Test
  void loopOfThree() {
    final Automaton aut = automaton(
      Set.of("q0", "q1", "q2", "q3"),
      Set.of("q0"),
      Set.of("q3"),
      Map.of(
        "q0", List.of(Map.entry("a", "q1"), Map.entry("b", "q3")),
        "q1", List.of(Map.entry("a", "q2")),
        "q2", List.of(Map.entry("a", "q0"))
      )
    );
    Assertions.assertEquals("(a a a)* b", StateElimination.toRegex(aut).orElseThrow().toString());
  }

  @Test
  void roundTripsThroughThompson() {
    final Automaton choice = automaton(
      Set.of("q0", "q1", "q2"),
      Set.of("q0"),
      Set.of("q2"),
      Map.of(
        "q0", List.of(Map.entry("a", "q1"), Map.entry("c", "q2")),
        "q1", List.of(Map.entry("b", "q2"))
      )
    );
    assertSameLanguage(
      choice,
      Thompson.build(StateElimination.toRegex(choice).orElseThrow(), ALPHABET),
      List.of("", "a", "b", "c", "ab", "abc")
    );

    final Automaton prefixLoop = automaton(
      Set.of("q0", "q1", "q2"),
      Set.of("q0"),
      Set.of("q2"),
      Map.of(
        "q0", List.of(Map.entry("a", "q0"), Map.entry("b", "q1")),
        "q1", List.of(Map.entry("c", "q2"))
      )
    );
    assertSameLanguage(
      prefixLoop,
      Thompson.build(StateElimination.toRegex(prefixLoop).orElseThrow(), ALPHABET),
      List.of("", "a", "b", "c", "ab", "abc", "aaab", "bc", "aaabc")
    );

    final Automaton evenAs = automaton(
      Set.of("q0", "q1", "q2"),
      Set.of("q0"),
      Set.of("q0"),
      Map.of(
        "q0", List.of(Map.entry("a", "q1")),
        "q1", List.of(Map.entry("a", "q0"))
      )
    );
    assertSameLanguage(
      evenAs,
      Thompson.build(StateElimination.toRegex(evenAs).orElseThrow(), ALPHABET),
      List.of("", "a", "b", "c", "aa", "aab", "aaa", "aaaa", "aaaaaa")
    );
  }

  @Test
  void handlesEpsilonTransitionsAndSeveralInitialStates() {
    final Set<String> alphabet = Set.of("a", "b");
    final List<String> words = List.of("", "a", "b", "ab", "ba", "aab", "abab", "bbb", "abba");
    for (String regex : List.of("(a + b)* a", "a* b*", "(a b)* + b", "((a + ε) b)*")) {
      final Automaton thompson = Thompson.build(Regex.parse(regex), alphabet);
      final Automaton recovered = Thompson.build(StateElimination.toRegex(thompson).orElseThrow(), alphabet);
      assertSameLanguage(thompson, recovered, words);
    }

    final Automaton twoInitial = Automaton.of(
      alphabet,
      Set.of("p", "q", "r"),
      Set.of("p", "q"),
      Set.of("r"),
      Map.of(
        "p", List.of(Map.entry("a", "r")),
        "q", List.of(Map.entry("b", "r"))
      )
    );
    assertSameLanguage(
      twoInitial,
      Thompson.build(StateElimination.toRegex(twoInitial).orElseThrow(), alphabet),
      words
    );
  }

  @Test
  void emptyWordOnly() {
    final Automaton aut = automaton(Set.of("q0"), Set.of("q0"), Set.of("q0"), Map.of());
    Assertions.assertEquals(Optional.of(Regex.epsilon()), StateElimination.toRegex(aut));
  }

  @Test
  void emptyLanguage() {
    final Automaton noAccepting = automaton(
      Set.of("q0", "q1"),
      Set.of("q0"),
      Set.of(),
      Map.of("q0", List.of(Map.entry("a", "q1")))
    );
    Assertions.assertEquals(Optional.empty(), StateElimination.toRegex(noAccepting));

    final Automaton unreachable = automaton(
      Set.of("q0", "q1"),
      Set.of("q0"),
      Set.of("q1"),
      Map.of("q1", List.of(Map.entry("a", "q0")))
    );
    Assertions.assertEquals(Optional.empty(), StateElimination.toRegex(unreachable));
  }
}
