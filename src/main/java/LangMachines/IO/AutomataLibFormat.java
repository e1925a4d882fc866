package LangMachines.IO;

import LangMachines.Model.DFA;
import LangMachines.Model.NFA;
import net.automatalib.alphabet.Alphabet;
import net.automatalib.alphabet.impl.Alphabets;
import net.automatalib.automaton.fsa.impl.CompactDFA;
import net.automatalib.automaton.fsa.impl.CompactNFA;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;

/**
 * Conversions between the value types and AutomataLib's compact automata.
 * State {@code i} of a compact automaton corresponds to the {@code i}-th state in ascending order.
 */
public class AutomataLibFormat {
    private AutomataLibFormat() {}

    /**
     * @return the equivalent compact DFA; it has no initial state if the start state is not a state
     */
    public static <S extends Comparable<? super S>, I extends Comparable<? super I>> CompactDFA<I> toCompactDFA(DFA<S, I> dfa) {
        final Alphabet<I> alphabet = Alphabets.fromCollection(dfa.getInputAlphabet());
        final CompactDFA<I> out = new CompactDFA<>(alphabet, dfa.size());
        final int initId = dfa.getIntInitialState();

        for (int s = 0; s < dfa.size(); s++) {
            if (s == initId) {
                out.addInitialState(dfa.isIntAccepting(s));
            } else {
                out.addState(dfa.isIntAccepting(s));
            }
        }
        for (int s = 0; s < dfa.size(); s++) {
            for (int i = 0; i < dfa.numInputs(); i++) {
                int t = dfa.getIntSuccessor(s, i);
                if (t != DFA.MISSING) {
                    out.setTransition(s, alphabet.getSymbolIndex(dfa.getSymbol(i)), t);
                }
            }
        }
        return out;
    }

    /**
     * @return a DFA whose states are the integer ids of the compact DFA
     */
    public static <I extends Comparable<? super I>> DFA<Integer, I> fromCompactDFA(CompactDFA<I> dfa) {
        final Alphabet<I> alphabet = dfa.getInputAlphabet();
        final List<Integer> accept = new ArrayList<>();
        final Map<Integer, Map<I, Integer>> delta = new TreeMap<>();

        for (Integer s : dfa.getStates()) {
            if (dfa.isAccepting(s)) {
                accept.add(s);
            }
            for (I a : alphabet) {
                Integer t = dfa.getSuccessor(s, a);
                if (t != null) {
                    delta.computeIfAbsent(s, k -> new TreeMap<>()).put(a, t);
                }
            }
        }
        return new DFA<>(dfa.getStates(), alphabet, dfa.getInitialState(), accept, delta);
    }

    /**
     * @throws IllegalArgumentException if the NFA has epsilon-transitions, which compact NFAs cannot express
     */
    public static <S extends Comparable<? super S>, I extends Comparable<? super I>> CompactNFA<I> toCompactNFA(NFA<S, I> nfa) {
        if (nfa.hasEpsilonTransitions()) {
            throw new IllegalArgumentException("NFA has epsilon-transitions");
        }
        final Alphabet<I> alphabet = Alphabets.fromCollection(nfa.getInputAlphabet());
        final CompactNFA<I> out = new CompactNFA<>(alphabet, nfa.size());
        final int initId = nfa.getIntInitialState();

        for (int s = 0; s < nfa.size(); s++) {
            out.addState(nfa.isIntAccepting(s));
            if (s == initId) {
                out.setInitial(s, true);
            }
        }
        for (int s = 0; s < nfa.size(); s++) {
            for (int i = 0; i < nfa.numInputs(); i++) {
                final Set<S> targets = nfa.getSuccessors(nfa.getState(s), nfa.getSymbol(i));
                for (S t : targets) {
                    out.addTransition(s, nfa.getSymbol(i), nfa.getStateId(t));
                }
            }
        }
        return out;
    }
}
