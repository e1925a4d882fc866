package LangMachines;

import LangMachines.Model.DFA;
import LangMachines.Model.MissingStateException;
import LangMachines.Model.NFA;
import LangMachines.Model.UnknownSymbolException;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

import java.util.List;

import static LangMachines.RandomAutomata.word;

public class SimulatorTest {
  @Test
  void testEvenZeros() {
    DFA<String, String> dfa = Fixtures.evenZeros();
    for (String w : List.of("", "11", "1010", "00", "0110", "100")) {
      Assertions.assertTrue(Simulator.simulate(dfa, word(w)), w);
    }
    for (String w : List.of("0", "10", "01", "000")) {
      Assertions.assertFalse(Simulator.simulate(dfa, word(w)), w);
    }
  }

  @Test
  void testUndefinedTransitionRejects() {
    DFA<String, String> dfa = Fixtures.unreachableAndPartial();
    Assertions.assertTrue(Simulator.simulate(dfa, word("a")));
    Assertions.assertTrue(Simulator.simulate(dfa, word("abaa")));
    Assertions.assertFalse(Simulator.simulate(dfa, word("b")));
    Assertions.assertFalse(Simulator.simulate(dfa, word("abb")));
  }

  @Test
  void testUnknownSymbol() {
    DFA<String, String> dfa = Fixtures.unreachableAndPartial();
    UnknownSymbolException e = Assertions.assertThrows(UnknownSymbolException.class,
        () -> Simulator.simulate(dfa, word("ac")));
    Assertions.assertEquals("c", e.getSymbol());
    // the word is checked before the run, so an earlier dead end does not hide the symbol
    Assertions.assertThrows(UnknownSymbolException.class, () -> Simulator.simulate(dfa, word("bbz")));

    NFA<String, String> nfa = Fixtures.aOrAb();
    Assertions.assertThrows(UnknownSymbolException.class, () -> Simulator.simulate(nfa, word("ba" + NFA.EPSILON)));
  }

  @Test
  void testMissingStart() {
    DFA<String, String> dfa = DFA.<String, String>builder()
        .withStates("a").withAlphabet("x").withStart("b")
        .build();
    Assertions.assertThrows(MissingStateException.class, () -> Simulator.simulate(dfa, word("x")));

    NFA<String, String> nfa = NFA.<String, String>builder()
        .withStates("a").withAlphabet("x").withStart("b")
        .build();
    Assertions.assertThrows(MissingStateException.class, () -> Simulator.simulate(nfa, word("")));
  }

  @Test
  void testNFA() {
    NFA<String, String> nfa = Fixtures.aOrAb();
    Assertions.assertTrue(Simulator.simulate(nfa, word("a")));
    Assertions.assertTrue(Simulator.simulate(nfa, word("ab")));
    for (String w : List.of("", "b", "aa", "aba")) {
      Assertions.assertFalse(Simulator.simulate(nfa, word(w)), w);
    }

    // epsilon-reachable accepting state accepts the empty word
    NFA<String, String> chain = Fixtures.epsilonChain();
    Assertions.assertTrue(Simulator.simulate(chain, word("")));
    Assertions.assertFalse(Simulator.simulate(chain, word("x")));
  }

  @Test
  void testIntegerSymbols() {
    DFA<Integer, Integer> dfa = DFA.<Integer, Integer>builder()
        .withStates(0, 1).withAlphabet(0, 1).withStart(0).withAccepting(1)
        .withTransition(0, 1, 1).withTransition(1, 0, 1)
        .build();
    Assertions.assertTrue(Simulator.simulate(dfa, List.of(1, 0, 0)));
    Assertions.assertFalse(Simulator.simulate(dfa, List.of(0)));
    Assertions.assertThrows(UnknownSymbolException.class, () -> Simulator.simulate(dfa, List.of(1, 5)));
  }
}
