package LangMachines;

import LangMachines.Model.DFA;
import LangMachines.Model.NFA;

/**
 * Small hand-written automata shared by the tests.
 */
public class Fixtures {
    // Binary words with an even number of zeros
    public static DFA<String, String> evenZeros() {
        return DFA.<String, String>builder()
            .withStates("q0", "q1")
            .withAlphabet("0", "1")
            .withStart("q0")
            .withAccepting("q0")
            .withTransition("q0", "0", "q1")
            .withTransition("q0", "1", "q0")
            .withTransition("q1", "0", "q0")
            .withTransition("q1", "1", "q1")
            .build();
    }

    // {a, ab} through epsilon-transitions
    public static NFA<String, String> aOrAb() {
        return NFA.<String, String>builder()
            .withStates("s", "s1", "s2", "t", "f")
            .withAlphabet("a", "b")
            .withStart("s")
            .withAccepting("f")
            .withEpsilonTransition("s", "s1")
            .withEpsilonTransition("s", "s2")
            .withTransition("s1", "a", "f")
            .withTransition("s2", "a", "t")
            .withTransition("t", "b", "f")
            .build();
    }

    // A -ε-> B -ε-> C, D isolated
    public static NFA<String, String> epsilonChain() {
        return NFA.<String, String>builder()
            .withStates("A", "B", "C", "D")
            .withAlphabet("x")
            .withStart("A")
            .withAccepting("C")
            .withEpsilonTransition("A", "B")
            .withEpsilonTransition("B", "C")
            .build();
    }

    // C_unreach is unreachable and (A, b) is undefined
    public static DFA<String, String> unreachableAndPartial() {
        return DFA.<String, String>builder()
            .withStates("A", "B", "C_unreach")
            .withAlphabet("a", "b")
            .withStart("A")
            .withAccepting("B")
            .withTransition("A", "a", "B")
            .withTransition("B", "a", "B")
            .withTransition("B", "b", "A")
            .build();
    }
}
