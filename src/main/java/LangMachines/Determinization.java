package LangMachines;

import LangMachines.Model.DFA;
import LangMachines.Model.MissingStateException;
import LangMachines.Model.NFA;
import LangMachines.Model.UnknownSymbolException;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.BitSet;
import java.util.Collection;
import java.util.Comparator;
import java.util.Deque;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;

/**
 * Subset (powerset) construction for NFAs with epsilon-transitions.
 * <p>
 * Only subsets reachable from the start closure are materialized, but their number is still exponential in the
 * number of NFA states in the worst case. Callers are responsible for bounding the input.
 */
public class Determinization {
    public static boolean DEBUG = false;
    public static final String STATE_PREFIX = "Q";
    private static final long STATES_EXPLORED_PERIOD = 10000L;

    /**
     * Lexicographic order of the ascending index sequences; a proper prefix sorts first.
     */
    static final Comparator<BitSet> SUBSET_ORDER = (a, b) -> {
        int i = a.nextSetBit(0);
        int j = b.nextSetBit(0);
        while (i >= 0 && j >= 0) {
            if (i != j) {
                return Integer.compare(i, j);
            }
            i = a.nextSetBit(i + 1);
            j = b.nextSetBit(j + 1);
        }
        return Boolean.compare(i >= 0, j >= 0);
    };

    private Determinization() {}

    /**
     * Smallest superset of {@code states} closed under epsilon-transitions.
     * @param nfa - NFA
     * @param states - states of the NFA
     * @return the closure, in ascending order
     * @throws IllegalArgumentException if a state does not belong to the NFA
     */
    public static <S extends Comparable<? super S>, I extends Comparable<? super I>> Set<S> epsilonClosure(
        NFA<S, I> nfa, Collection<? extends S> states) {
        return nfa.toStates(epsilonClosure(nfa, toIds(nfa, states)));
    }

    /**
     * Epsilon-closure on state indices. The argument is not modified.
     */
    public static BitSet epsilonClosure(NFA<?, ?> nfa, BitSet states) {
        final BitSet closure = (BitSet) states.clone();
        final Deque<Integer> stack = new ArrayDeque<>();
        for (int s = states.nextSetBit(0); s >= 0; s = states.nextSetBit(s + 1)) {
            stack.push(s);
        }
        while (!stack.isEmpty()) {
            final BitSet succs = nfa.getIntEpsilonTransitions(stack.pop());
            succs.andNot(closure);
            for (int t = succs.nextSetBit(0); t >= 0; t = succs.nextSetBit(t + 1)) {
                closure.set(t);
                stack.push(t);
            }
        }
        return closure;
    }

    /**
     * Union of the {@code symbol}-successors of {@code states}, epsilon-transitions excluded.
     * @throws UnknownSymbolException if the symbol is not in the alphabet
     * @throws IllegalArgumentException if a state does not belong to the NFA
     */
    public static <S extends Comparable<? super S>, I extends Comparable<? super I>> Set<S> move(
        NFA<S, I> nfa, Collection<? extends S> states, I symbol) {
        final int sym = nfa.getSymbolIndex(symbol);
        if (sym == NFA.MISSING) {
            throw new UnknownSymbolException(symbol);
        }
        return nfa.toStates(move(nfa, toIds(nfa, states), sym));
    }

    public static BitSet move(NFA<?, ?> nfa, BitSet states, int symbol) {
        final BitSet result = new BitSet(nfa.size());
        for (int s = states.nextSetBit(0); s >= 0; s = states.nextSetBit(s + 1)) {
            nfa.collectIntTransitions(s, symbol, result);
        }
        return result;
    }

    private static <S extends Comparable<? super S>> BitSet toIds(NFA<S, ?> nfa, Collection<? extends S> states) {
        final BitSet ids = new BitSet(nfa.size());
        for (S s : states) {
            final int id = nfa.getStateId(s);
            if (id == NFA.MISSING) {
                throw new IllegalArgumentException("State " + s + " is not a state of the NFA");
            }
            ids.set(id);
        }
        return ids;
    }

    /**
     * Convert an NFA into a language-equivalent DFA.
     * <p>
     * The result may be partial: an empty successor subset is not materialized. Its states are named
     * {@code Q0, Q1, ...} following {@link #SUBSET_ORDER} over the discovered subsets, so equal NFAs always yield
     * equal DFAs. Its alphabet is the alphabet of the NFA.
     *
     * @param nfa - NFA, possibly with unreachable states and epsilon-transitions
     * @return equivalent DFA over String states
     * @throws MissingStateException if the start state is not a state of the NFA
     */
    public static <S extends Comparable<? super S>, I extends Comparable<? super I>> DFA<String, I> toDFA(NFA<S, I> nfa) {
        final int initId = nfa.getIntInitialState();
        if (initId == NFA.MISSING) {
            throw new MissingStateException(nfa.getInitialState());
        }
        final int numInputs = nfa.numInputs();

        final Map<BitSet, Integer> discovered = new HashMap<>();
        final List<BitSet> subsets = new ArrayList<>();
        final List<int[]> successors = new ArrayList<>();
        final Deque<DeterminizeRecord> stack = new ArrayDeque<>();

        BitSet initSet = new BitSet(nfa.size());
        initSet.set(initId);
        BitSet init = epsilonClosure(nfa, initSet);
        discovered.put(init, 0);
        subsets.add(init);
        successors.add(newRow(numInputs));
        stack.push(new DeterminizeRecord(init, 0));

        long statesExplored = 0;
        while (!stack.isEmpty()) {
            DeterminizeRecord curr = stack.pop();
            int[] row = successors.get(curr.outputState());

            for (int i = 0; i < numInputs; i++) {
                BitSet succ = epsilonClosure(nfa, move(nfa, curr.inputState(), i));
                if (succ.isEmpty()) {
                    continue;
                }
                Integer outSucc = discovered.get(succ);
                if (outSucc == null) {
                    // add new subset and push it for exploration
                    outSucc = subsets.size();
                    discovered.put(succ, outSucc);
                    subsets.add(succ);
                    successors.add(newRow(numInputs));
                    stack.push(new DeterminizeRecord(succ, outSucc));
                }
                row[i] = outSucc;
            }
            statesExplored++;

            if (DEBUG && statesExplored % STATES_EXPLORED_PERIOD == 0) {
                System.out.println("DEBUG: Explored " + statesExplored + " subsets - "
                    + stack.size() + " subsets left in queue - " + subsets.size() + " subsets discovered");
            }
        }

        return nameSubsets(nfa, subsets, successors);
    }

    private static int[] newRow(int numInputs) {
        int[] row = new int[numInputs];
        Arrays.fill(row, DFA.MISSING);
        return row;
    }

    /**
     * Assign Q-names in {@link #SUBSET_ORDER} and assemble the DFA.
     */
    private static <S extends Comparable<? super S>, I extends Comparable<? super I>> DFA<String, I> nameSubsets(
        NFA<S, I> nfa, List<BitSet> subsets, List<int[]> successors) {
        final int numSubsets = subsets.size();
        Integer[] order = new Integer[numSubsets];
        for (int i = 0; i < numSubsets; i++) {
            order[i] = i;
        }
        Arrays.sort(order, (x, y) -> SUBSET_ORDER.compare(subsets.get(x), subsets.get(y)));

        String[] names = new String[numSubsets];
        for (int rank = 0; rank < numSubsets; rank++) {
            names[order[rank]] = STATE_PREFIX + rank;
        }

        List<String> states = Arrays.asList(names);
        List<String> accept = new ArrayList<>();
        Map<String, Map<I, String>> delta = new TreeMap<>();
        for (int id = 0; id < numSubsets; id++) {
            if (nfa.isIntAccepting(subsets.get(id))) {
                accept.add(names[id]);
            }
            int[] row = successors.get(id);
            for (int i = 0; i < row.length; i++) {
                if (row[i] != DFA.MISSING) {
                    delta.computeIfAbsent(names[id], k -> new TreeMap<>()).put(nfa.getSymbol(i), names[row[i]]);
                }
            }
        }
        return new DFA<>(states, nfa.getInputAlphabet(), names[0], accept, delta);
    }

    private record DeterminizeRecord(BitSet inputState, int outputState) { }
}
