package LangMachines;

import LangMachines.IO.AutomataLibFormat;
import LangMachines.Model.DFA;
import LangMachines.Model.MalformedAutomatonException;
import LangMachines.Model.MinDFA;
import LangMachines.Model.StateFactory;
import net.automatalib.alphabet.Alphabet;
import net.automatalib.alphabet.impl.Alphabets;
import net.automatalib.automaton.fsa.impl.CompactDFA;
import net.automatalib.util.automaton.Automata;
import net.automatalib.util.automaton.minimizer.HopcroftMinimizer;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;
import java.util.Set;

public class HopcroftMinimizationTest {
  @Test
  void testAlreadyMinimal() {
    DFA<String, String> dfa = Fixtures.evenZeros();
    MinDFA<String, String> min = HopcroftMinimization.minimizeDFA(dfa);
    Assertions.assertEquals(2, min.size());
    Assertions.assertEquals(dfa.getStates(), min.getStates());
    Assertions.assertEquals(dfa.getTransitions(), min.getTransitions());
    Assertions.assertEquals("q0", min.getInitialState());
    Assertions.assertEquals(Map.of("q0", "q0", "q1", "q1"), min.getBlockOf());

    for (String w : List.of("", "11", "1010", "100")) {
      Assertions.assertTrue(Simulator.simulate(min, RandomAutomata.word(w)), w);
    }
    for (String w : List.of("0", "10", "000")) {
      Assertions.assertFalse(Simulator.simulate(min, RandomAutomata.word(w)), w);
    }
  }

  @Test
  void testReachableSink() {
    // (A, b) is undefined, so the sink is reachable and stays distinct from A
    MinDFA<String, String> min = HopcroftMinimization.minimizeDFA(Fixtures.unreachableAndPartial());
    Assertions.assertEquals(3, min.size());
    Assertions.assertEquals(List.of("A", "B", "sink"), min.getStates());
    Assertions.assertEquals("A", min.getInitialState());
    Assertions.assertEquals(Set.of("B"), min.getAcceptingStates());
    Assertions.assertTrue(min.isComplete());
    Assertions.assertEquals("sink", min.getSuccessor("A", "b"));
    Assertions.assertEquals("sink", min.getSuccessor("sink", "a"));
    Assertions.assertEquals("A", min.getSuccessor("B", "b"));

    // unreachable states have no representative
    Assertions.assertEquals(Map.of("A", "A", "B", "B"), min.getBlockOf());
    Assertions.assertNull(min.getRepresentative("C_unreach"));
  }

  @Test
  void testMergeEquivalentStates() {
    DFA<String, String> dfa = DFA.<String, String>builder()
        .withStates("p", "q", "r")
        .withAlphabet("a", "b")
        .withStart("p")
        .withAccepting("q")
        .withTransition("p", "a", "q").withTransition("p", "b", "r")
        .withTransition("q", "a", "q").withTransition("q", "b", "r")
        .withTransition("r", "a", "q").withTransition("r", "b", "r")
        .build();
    MinDFA<String, String> min = HopcroftMinimization.minimizeDFA(dfa);
    Assertions.assertEquals(List.of("p", "q"), min.getStates());
    // least state of the block represents it
    Assertions.assertEquals("p", min.getRepresentative("r"));
    Assertions.assertEquals(Map.of("p", Map.of("a", "q", "b", "p"), "q", Map.of("a", "q", "b", "p")), min.getTransitions());
  }

  @Test
  void testSubsetConstructionOutput() {
    DFA<String, String> dfa = Determinization.toDFA(Fixtures.aOrAb());
    MinDFA<String, String> min = HopcroftMinimization.minimizeDFA(dfa);
    // start, after "a", after "ab", dead
    Assertions.assertEquals(4, min.size());
    Assertions.assertTrue(min.getStates().contains("sink"));
    assertSameLanguage(dfa, min, 5);
  }

  @Test
  void testNoAcceptingStates() {
    DFA<String, String> dfa = DFA.<String, String>builder()
        .withStates("x", "y").withAlphabet("a", "b").withStart("x")
        .withTransition("x", "a", "y")
        .build();
    MinDFA<String, String> min = HopcroftMinimization.minimizeDFA(dfa);
    Assertions.assertEquals(List.of("x"), min.getStates());
    Assertions.assertTrue(min.getAcceptingStates().isEmpty());
    Assertions.assertEquals("x", min.getSuccessor("x", "a"));
    Assertions.assertEquals("x", min.getSuccessor("x", "b"));
  }

  @Test
  void testEmptyAlphabet() {
    DFA<String, String> dfa = DFA.<String, String>builder()
        .withStates("x", "y").withStart("x").withAccepting("x")
        .build();
    MinDFA<String, String> min = HopcroftMinimization.minimizeDFA(dfa);
    Assertions.assertEquals(List.of("x"), min.getStates());
    Assertions.assertEquals(Set.of("x"), min.getAcceptingStates());
  }

  @Test
  void testSinkNameAvoidsStates() {
    DFA<String, String> dfa = DFA.<String, String>builder()
        .withStates("a0", "sink").withAlphabet("x", "y").withStart("a0").withAccepting("sink")
        .withTransition("a0", "x", "sink").withTransition("sink", "x", "sink")
        .build();
    MinDFA<String, String> min = HopcroftMinimization.minimizeDFA(dfa);
    Assertions.assertEquals(List.of("a0", "sink", "sink_1"), min.getStates());
    Assertions.assertEquals(Set.of("sink"), min.getAcceptingStates());
    Assertions.assertEquals("sink_1", min.getSuccessor("a0", "y"));
  }

  @Test
  void testIntegerStates() {
    DFA<Integer, String> dfa = DFA.<Integer, String>builder()
        .withStates(0, 1).withAlphabet("a").withStart(0).withAccepting(1)
        .withTransition(0, "a", 1)
        .build();
    MinDFA<Integer, String> min = HopcroftMinimization.minimizeDFA(dfa, StateFactory.integers());
    Assertions.assertEquals(List.of(0, 1, 2), min.getStates());
    Assertions.assertEquals(2, min.getSuccessor(1, "a"));
    Assertions.assertEquals(2, min.getSuccessor(2, "a"));
  }

  @Test
  void testMalformed() {
    DFA<String, String> noStart = DFA.<String, String>builder()
        .withStates("x").withAlphabet("a").withStart("nowhere")
        .build();
    Assertions.assertThrows(MalformedAutomatonException.class, () -> HopcroftMinimization.minimizeDFA(noStart));

    DFA<String, String> badAccept = DFA.<String, String>builder()
        .withStates("x").withAlphabet("a").withStart("x").withAccepting("y")
        .build();
    Assertions.assertThrows(MalformedAutomatonException.class, () -> HopcroftMinimization.minimizeDFA(badAccept));
  }

  @Test
  void testIdempotent() {
    for (int seed = 0; seed < 20; seed++) {
      DFA<Integer, Integer> dfa = RandomAutomata.getRandomDFA(seed, 15, 2, 0.8f);
      MinDFA<Integer, Integer> min = HopcroftMinimization.minimizeDFA(dfa, StateFactory.integers());
      MinDFA<Integer, Integer> min2 = HopcroftMinimization.minimizeDFA(min, StateFactory.integers());
      Assertions.assertTrue(min.isComplete(), "seed " + seed);
      Assertions.assertEquals(min.getStates(), min2.getStates(), "seed " + seed);
      Assertions.assertEquals(min.getTransitions(), min2.getTransitions(), "seed " + seed);
    }
  }

  @Test
  void testRandomAgainstAutomataLib() {
    final Alphabet<Integer> alphabet = Alphabets.integers(0, 2);
    for (int seed = 0; seed < 30; seed++) {
      DFA<Integer, Integer> dfa = RandomAutomata.getRandomDFA(seed, 20, 3, 0.7f);
      MinDFA<Integer, Integer> min = HopcroftMinimization.minimizeDFA(dfa, StateFactory.integers());

      DFA<Integer, Integer> total = AutomatonTrim.totalize(AutomatonTrim.pruneUnreachable(dfa), StateFactory.integers());
      CompactDFA<Integer> expected = HopcroftMinimizer.minimizeDFA(AutomataLibFormat.toCompactDFA(total), alphabet);

      Assertions.assertEquals(expected.size(), min.size(), "seed " + seed);
      Assertions.assertTrue(Automata.testEquivalence(expected, AutomataLibFormat.toCompactDFA(min), alphabet), "seed " + seed);
      assertSameLanguage(dfa, min, 6);
    }
  }

  @Test
  void testDeterminizeThenMinimize() {
    for (int seed = 0; seed < 10; seed++) {
      DFA<String, Integer> dfa = Determinization.toDFA(RandomAutomata.getRandomNFA(seed, 8, 2));
      MinDFA<String, Integer> min = HopcroftMinimization.minimizeDFA(dfa);
      Assertions.assertTrue(min.size() <= dfa.size() + 1, "seed " + seed);
      assertSameLanguage(dfa, min, 7);
    }
  }

  private static <S1 extends Comparable<? super S1>, S2 extends Comparable<? super S2>, I extends Comparable<? super I>>
      void assertSameLanguage(DFA<S1, I> a, DFA<S2, I> b, int maxLength) {
    for (List<I> w : RandomAutomata.allWords(a.getInputAlphabet(), maxLength)) {
      Assertions.assertEquals(Simulator.simulate(a, w), Simulator.simulate(b, w), "word " + w);
    }
  }
}
