package LangMachines;

import LangMachines.Model.DFA;
import LangMachines.Model.NFA;
import LangMachines.Model.StateFactory;

import java.util.ArrayList;
import java.util.BitSet;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;
import java.util.TreeSet;

public class AutomatonTrim {
    private AutomatonTrim() {}

    /**
     * States reachable from the start state. Empty if the start state is not a state.
     * @param dfa - automaton
     * @return indices of the reachable states
     */
    public static BitSet accessibleStates(DFA<?, ?> dfa) {
        final int numStates = dfa.size();
        final int numInputs = dfa.numInputs();
        final BitSet reached = new BitSet(numStates);
        final int initId = dfa.getIntInitialState();
        if (initId == DFA.MISSING) {
            return reached;
        }

        int[] statesBuff = new int[numStates];
        int statesPtr = 0;
        int reachableStates = 0;
        statesBuff[reachableStates++] = initId;
        reached.set(initId);

        while (statesPtr < reachableStates) {
            int currId = statesBuff[statesPtr++];
            for (int i = 0; i < numInputs; i++) {
                int succ = dfa.getIntSuccessor(currId, i);
                if (succ != DFA.MISSING && !reached.get(succ)) {
                    reached.set(succ);
                    statesBuff[reachableStates++] = succ;
                }
            }
        }
        return reached;
    }

    /**
     * States reachable from the start state through symbol and epsilon transitions.
     */
    public static BitSet accessibleStates(NFA<?, ?> nfa) {
        final int numStates = nfa.size();
        final int numInputs = nfa.numInputs();
        final BitSet reached = new BitSet(numStates);
        final int initId = nfa.getIntInitialState();
        if (initId == NFA.MISSING) {
            return reached;
        }

        int[] statesBuff = new int[numStates];
        int statesPtr = 0;
        int reachableStates = 0;
        statesBuff[reachableStates++] = initId;
        reached.set(initId);

        BitSet succs = new BitSet(numStates);
        while (statesPtr < reachableStates) {
            int currId = statesBuff[statesPtr++];
            succs.clear();
            for (int i = 0; i < numInputs; i++) {
                nfa.collectIntTransitions(currId, i, succs);
            }
            succs.or(nfa.getIntEpsilonTransitions(currId));
            succs.andNot(reached);
            for (int t = succs.nextSetBit(0); t >= 0; t = succs.nextSetBit(t + 1)) {
                reached.set(t);
                statesBuff[reachableStates++] = t;
            }
        }
        return reached;
    }

    /**
     * Restrict the automaton to the states reachable from its start state.
     * Accepting states and transitions are restricted accordingly.
     * @param dfa - automaton
     * @return the pruned automaton, or {@code dfa} itself if every state is reachable
     */
    public static <S extends Comparable<? super S>, I extends Comparable<? super I>> DFA<S, I> pruneUnreachable(DFA<S, I> dfa) {
        final BitSet reached = accessibleStates(dfa);
        if (reached.cardinality() == dfa.size()) {
            return dfa;
        }

        List<S> states = new ArrayList<>(reached.cardinality());
        List<S> accept = new ArrayList<>();
        Map<S, Map<I, S>> delta = new TreeMap<>();
        for (int s = reached.nextSetBit(0); s >= 0; s = reached.nextSetBit(s + 1)) {
            final S state = dfa.getState(s);
            states.add(state);
            if (dfa.isIntAccepting(s)) {
                accept.add(state);
            }
            for (int i = 0; i < dfa.numInputs(); i++) {
                int succ = dfa.getIntSuccessor(s, i);
                // successors of reached states are reached
                if (succ != DFA.MISSING) {
                    delta.computeIfAbsent(state, k -> new TreeMap<>()).put(dfa.getSymbol(i), dfa.getState(succ));
                }
            }
        }
        return new DFA<>(states, dfa.getInputAlphabet(), dfa.getInitialState(), accept, delta);
    }

    /**
     * Restrict the NFA to the states reachable from its start state.
     * @return the pruned automaton, or {@code nfa} itself if every state is reachable
     */
    public static <S extends Comparable<? super S>, I extends Comparable<? super I>> NFA<S, I> pruneUnreachable(NFA<S, I> nfa) {
        final BitSet reached = accessibleStates(nfa);
        if (reached.cardinality() == nfa.size()) {
            return nfa;
        }

        List<S> states = new ArrayList<>(reached.cardinality());
        List<S> accept = new ArrayList<>();
        Map<S, Map<I, Set<S>>> delta = new TreeMap<>();
        Map<S, Set<S>> epsilonDelta = new TreeMap<>();
        for (int s = reached.nextSetBit(0); s >= 0; s = reached.nextSetBit(s + 1)) {
            final S state = nfa.getState(s);
            states.add(state);
            if (nfa.isIntAccepting(s)) {
                accept.add(state);
            }
            for (int i = 0; i < nfa.numInputs(); i++) {
                BitSet succs = nfa.getIntTransitions(s, i);
                if (!succs.isEmpty()) {
                    delta.computeIfAbsent(state, k -> new TreeMap<>()).put(nfa.getSymbol(i), nfa.toStates(succs));
                }
            }
            BitSet eps = nfa.getIntEpsilonTransitions(s);
            if (!eps.isEmpty()) {
                epsilonDelta.put(state, nfa.toStates(eps));
            }
        }
        return new NFA<>(states, nfa.getInputAlphabet(), nfa.getInitialState(), accept, delta, epsilonDelta);
    }

    public static <I extends Comparable<? super I>> DFA<String, I> totalize(DFA<String, I> dfa) {
        return totalize(dfa, StateFactory.strings());
    }

    /**
     * Make the transition function total. If a transition is undefined, a single non-accepting sink is added:
     * it loops on every symbol and receives every undefined transition, its own included.
     * @param dfa - automaton
     * @param sinkFactory - names the sink
     * @return the total automaton, or {@code dfa} itself if it already was total
     */
    public static <S extends Comparable<? super S>, I extends Comparable<? super I>> DFA<S, I> totalize(
        DFA<S, I> dfa, StateFactory<S> sinkFactory) {
        if (dfa.isComplete()) {
            return dfa;
        }

        final S sink = sinkFactory.freshState(new HashSet<>(dfa.getStates()));
        if (dfa.getStateId(sink) != DFA.MISSING) {
            throw new IllegalStateException("Sink " + sink + " is already a state");
        }
        final List<I> alphabet = dfa.getInputAlphabet();

        Set<S> states = new TreeSet<>(dfa.getStates());
        states.add(sink);
        Map<S, Map<I, S>> delta = new TreeMap<>();
        for (S s : states) {
            Map<I, S> row = new TreeMap<>();
            for (I a : alphabet) {
                S succ = s.equals(sink) ? null : dfa.getSuccessor(s, a);
                row.put(a, succ == null ? sink : succ);
            }
            delta.put(s, row);
        }
        Set<S> accept = new TreeSet<>(dfa.getAcceptingStates());
        accept.remove(sink);
        return new DFA<>(states, alphabet, dfa.getInitialState(), accept, delta);
    }
}
