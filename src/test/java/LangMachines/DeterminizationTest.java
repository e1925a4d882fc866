package LangMachines;

import LangMachines.IO.AutomataLibFormat;
import LangMachines.Model.DFA;
import LangMachines.Model.MissingStateException;
import LangMachines.Model.NFA;
import LangMachines.Model.UnknownSymbolException;
import net.automatalib.alphabet.Alphabet;
import net.automatalib.alphabet.impl.Alphabets;
import net.automatalib.automaton.fsa.impl.CompactDFA;
import net.automatalib.automaton.fsa.impl.CompactNFA;
import net.automatalib.util.automaton.Automata;
import net.automatalib.util.automaton.fsa.NFAs;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.BitSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

public class DeterminizationTest {
  @Test
  void testEpsilonClosure() {
    NFA<String, String> nfa = Fixtures.epsilonChain();
    Assertions.assertEquals(Set.of("A", "B", "C"), Determinization.epsilonClosure(nfa, List.of("A")));
    Assertions.assertEquals(Set.of("B", "C"), Determinization.epsilonClosure(nfa, List.of("B")));
    Assertions.assertEquals(Set.of("D"), Determinization.epsilonClosure(nfa, List.of("D")));
    Assertions.assertEquals(Set.of(), Determinization.epsilonClosure(nfa, List.of()));

    // closure is idempotent
    Set<String> once = Determinization.epsilonClosure(nfa, List.of("A", "D"));
    Assertions.assertEquals(once, Determinization.epsilonClosure(nfa, once));

    Assertions.assertThrows(IllegalArgumentException.class, () -> Determinization.epsilonClosure(nfa, List.of("Z")));
  }

  @Test
  void testEpsilonClosureCycle() {
    NFA<Integer, Integer> nfa = NFA.<Integer, Integer>builder()
        .withStates(0, 1, 2).withAlphabet(0).withStart(0)
        .withEpsilonTransition(0, 1).withEpsilonTransition(1, 0).withEpsilonTransition(1, 1)
        .build();
    Assertions.assertEquals(Set.of(0, 1), Determinization.epsilonClosure(nfa, List.of(1)));

    // the argument is not modified
    BitSet ids = new BitSet();
    ids.set(0);
    BitSet closure = Determinization.epsilonClosure(nfa, ids);
    Assertions.assertEquals(1, ids.cardinality());
    Assertions.assertEquals(2, closure.cardinality());
  }

  @Test
  void testMove() {
    NFA<String, String> nfa = Fixtures.aOrAb();
    Assertions.assertEquals(Set.of("f", "t"), Determinization.move(nfa, List.of("s1", "s2"), "a"));
    // epsilon-transitions are not followed
    Assertions.assertEquals(Set.of(), Determinization.move(nfa, List.of("s"), "a"));
    Assertions.assertEquals(Set.of("f"), Determinization.move(nfa, List.of("t", "s2"), "b"));

    UnknownSymbolException e = Assertions.assertThrows(UnknownSymbolException.class,
        () -> Determinization.move(nfa, List.of("s1"), "c"));
    Assertions.assertEquals("c", e.getSymbol());
    Assertions.assertThrows(IllegalArgumentException.class, () -> Determinization.move(nfa, List.of("Z"), "a"));
  }

  @Test
  void testSubsetConstruction() {
    DFA<String, String> dfa = Determinization.toDFA(Fixtures.aOrAb());

    // subsets {f} < {f,t} < {s,s1,s2}
    Assertions.assertEquals(List.of("Q0", "Q1", "Q2"), dfa.getStates());
    Assertions.assertEquals(List.of("a", "b"), dfa.getInputAlphabet());
    Assertions.assertEquals("Q2", dfa.getInitialState());
    Assertions.assertEquals(Set.of("Q0", "Q1"), dfa.getAcceptingStates());
    Assertions.assertEquals(Map.of("Q2", Map.of("a", "Q1"), "Q1", Map.of("b", "Q0")), dfa.getTransitions());

    Assertions.assertTrue(Simulator.simulate(dfa, RandomAutomata.word("a")));
    Assertions.assertTrue(Simulator.simulate(dfa, RandomAutomata.word("ab")));
    for (String rejected : List.of("", "b", "aa", "aba", "abb")) {
      Assertions.assertFalse(Simulator.simulate(dfa, RandomAutomata.word(rejected)), rejected);
    }
  }

  @Test
  void testStartOnly() {
    // no transitions at all: one subset, no edges
    NFA<String, String> nfa = NFA.<String, String>builder()
        .withStates("x", "y").withAlphabet("a").withStart("x").withAccepting("x")
        .build();
    DFA<String, String> dfa = Determinization.toDFA(nfa);
    Assertions.assertEquals(1, dfa.size());
    Assertions.assertEquals(0, dfa.countTransitions());
    Assertions.assertTrue(dfa.isAccepting("Q0"));
  }

  @Test
  void testMissingStart() {
    NFA<String, String> nfa = NFA.<String, String>builder()
        .withStates("x").withAlphabet("a").withStart("nowhere")
        .build();
    MissingStateException e = Assertions.assertThrows(MissingStateException.class, () -> Determinization.toDFA(nfa));
    Assertions.assertEquals("nowhere", e.getState());
  }

  @Test
  void testStableNaming() {
    NFA<Integer, Integer> nfa = RandomAutomata.getRandomNFA(7, 12, 4);
    DFA<String, Integer> dfa = Determinization.toDFA(nfa);
    Assertions.assertEquals(dfa, Determinization.toDFA(nfa));

    // rebuilding the same NFA from its own transitions changes nothing
    NFA<Integer, Integer> copy = new NFA<>(new ArrayList<>(nfa.getStates()), nfa.getInputAlphabet(),
        nfa.getInitialState(), nfa.getAcceptingStates(), nfa.getTransitions(), nfa.getEpsilonTransitions());
    Assertions.assertEquals(dfa, Determinization.toDFA(copy));
  }

  @Test
  void testRandomWithEpsilon() {
    for (int seed = 0; seed < 20; seed++) {
      NFA<Integer, Integer> nfa = RandomAutomata.getRandomNFA(seed, 8, 3);
      DFA<String, Integer> dfa = Determinization.toDFA(nfa);
      Assertions.assertEquals(nfa.getInputAlphabet(), dfa.getInputAlphabet());
      for (List<Integer> w : RandomAutomata.allWords(nfa.getInputAlphabet(), 7)) {
        Assertions.assertEquals(Simulator.simulate(nfa, w), Simulator.simulate(dfa, w), "seed " + seed + " word " + w);
      }
    }
  }

  @Test
  void testRandomAgainstAutomataLib() {
    final Alphabet<Integer> alphabet = Alphabets.integers(0, 1);
    for (int seed = 0; seed < 30; seed++) {
      NFA<Integer, Integer> nfa = RandomAutomata.getRandomNFA(seed, 10);
      CompactNFA<Integer> compactNFA = AutomataLibFormat.toCompactNFA(nfa);
      CompactDFA<Integer> expected = NFAs.determinize(compactNFA, alphabet, false, false);

      DFA<String, Integer> dfa = AutomatonTrim.totalize(Determinization.toDFA(nfa));
      CompactDFA<Integer> actual = AutomataLibFormat.toCompactDFA(dfa);
      Assertions.assertTrue(Automata.testEquivalence(expected, actual, alphabet), "seed " + seed);
    }
  }
}
