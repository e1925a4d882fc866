package LangMachines;

import LangMachines.Model.DFA;
import LangMachines.Model.MalformedAutomatonException;
import LangMachines.Model.MinDFA;
import LangMachines.Model.StateFactory;

import it.unimi.dsi.fastutil.ints.IntArrayFIFOQueue;
import it.unimi.dsi.fastutil.ints.IntArrayList;

import java.util.ArrayList;
import java.util.BitSet;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/**
 * Hopcroft's partition refinement, in O(|Σ|·|Q|·log|Q|).
 * <p>
 * The automaton is pruned first. If a reachable transition is undefined, an artificial sink is added as an extra
 * table slot (index {@code n}); it only survives into the result if the start state reaches it. The representative
 * of every block is its least-index member, i.e. its least state in natural order, the sink coming after all
 * original states.
 */
public class HopcroftMinimization {
    private HopcroftMinimization() {}

    public static <I extends Comparable<? super I>> MinDFA<String, I> minimizeDFA(DFA<String, I> dfa) {
        return minimizeDFA(dfa, StateFactory.strings());
    }

    /**
     * Minimize a DFA.
     * @param dfa - automaton to minimize
     * @param sinkFactory - names the artificial sink, should it form a block of its own
     * @return minimal DFA equivalent to the reachable part of {@code dfa}
     * @throws MalformedAutomatonException if the start state is not a state, or an accepting state is not a state
     */
    public static <S extends Comparable<? super S>, I extends Comparable<? super I>> MinDFA<S, I> minimizeDFA(
        DFA<S, I> dfa, StateFactory<S> sinkFactory) {
        validate(dfa);

        final DFA<S, I> reachable = AutomatonTrim.pruneUnreachable(dfa);
        if (reachable.size() == 0) {
            // nothing to minimize; the null start marks the result as unusable
            DFA<S, I> empty = new DFA<>(List.of(), reachable.getInputAlphabet(), null, List.of(), Map.of());
            return new MinDFA<>(empty, Map.of());
        }

        final WorkingTable table = workingTable(reachable);
        final Partition partition = refine(reachable, table);
        return quotient(dfa, reachable, table, partition, sinkFactory);
    }

    private static <S extends Comparable<? super S>> void validate(DFA<S, ?> dfa) {
        if (dfa.getIntInitialState() == DFA.MISSING) {
            throw new MalformedAutomatonException("Start state " + dfa.getInitialState() + " not in states");
        }
        for (S s : dfa.getAcceptingStates()) {
            if (dfa.getStateId(s) == DFA.MISSING) {
                throw new MalformedAutomatonException("Accepting state " + s + " not in states");
            }
        }
    }

    /**
     * Transition table the refinement runs on: the automaton's own if it is total, otherwise the table
     * completed with the sink if the sink is reachable.
     */
    private static WorkingTable workingTable(DFA<?, ?> dfa) {
        final int numStates = dfa.size();
        final int numInputs = dfa.numInputs();
        final int sinkId = numStates;

        boolean partial = false;
        final int[] provisional = new int[(numStates + 1) * numInputs];
        for (int s = 0; s < numStates; s++) {
            for (int i = 0; i < numInputs; i++) {
                int succ = dfa.getIntSuccessor(s, i);
                if (succ == DFA.MISSING) {
                    succ = sinkId;
                    partial = true;
                }
                provisional[s * numInputs + i] = succ;
            }
        }
        for (int i = 0; i < numInputs; i++) {
            provisional[sinkId * numInputs + i] = sinkId;
        }

        if (partial && reachesSink(provisional, dfa.getIntInitialState(), sinkId, numInputs)) {
            return new WorkingTable(numStates + 1, provisional);
        }

        // drop the sink and every transition into it
        final int[] succs = new int[numStates * numInputs];
        for (int k = 0; k < succs.length; k++) {
            succs[k] = provisional[k] == sinkId ? DFA.MISSING : provisional[k];
        }
        return new WorkingTable(numStates, succs);
    }

    private static boolean reachesSink(int[] succs, int initId, int sinkId, int numInputs) {
        final BitSet reached = new BitSet(sinkId + 1);
        final int[] statesBuff = new int[sinkId + 1];
        int statesPtr = 0;
        int reachableStates = 0;
        statesBuff[reachableStates++] = initId;
        reached.set(initId);

        while (statesPtr < reachableStates) {
            int currId = statesBuff[statesPtr++];
            for (int i = 0; i < numInputs; i++) {
                int succ = succs[currId * numInputs + i];
                if (succ == sinkId) {
                    return true;
                }
                if (!reached.get(succ)) {
                    reached.set(succ);
                    statesBuff[reachableStates++] = succ;
                }
            }
        }
        return false;
    }

    /**
     * Refine accept / non-accept to the coarsest partition compatible with the transitions.
     */
    static Partition refine(DFA<?, ?> dfa, WorkingTable table) {
        final int numStates = table.numStates();
        final int numInputs = dfa.numInputs();
        final int[] succs = table.successors();

        final Partition partition = new Partition(numStates);
        final IntArrayList accepting = new IntArrayList();
        final IntArrayList rejecting = new IntArrayList();
        for (int s = 0; s < numStates; s++) {
            // the sink, if any, is the only index at or past dfa.size()
            if (s < dfa.size() && dfa.isIntAccepting(s)) {
                accepting.add(s);
            } else {
                rejecting.add(s);
            }
        }
        final int acceptBlock = accepting.isEmpty() ? -1 : partition.addBlock(accepting);
        final int rejectBlock = rejecting.isEmpty() ? -1 : partition.addBlock(rejecting);

        final Worklist worklist = new Worklist(numInputs);
        if (acceptBlock >= 0 && rejectBlock >= 0) {
            // ties go to the accepting block
            final int smaller = accepting.size() <= rejecting.size() ? acceptBlock : rejectBlock;
            for (int i = 0; i < numInputs; i++) {
                worklist.add(smaller, i);
            }
        }

        // inverse[i * numStates + t]: states whose i-successor is t
        final IntArrayList[] inverse = new IntArrayList[numInputs * numStates];
        for (int s = 0; s < numStates; s++) {
            for (int i = 0; i < numInputs; i++) {
                int t = succs[s * numInputs + i];
                if (t != DFA.MISSING) {
                    int idx = i * numStates + t;
                    if (inverse[idx] == null) {
                        inverse[idx] = new IntArrayList();
                    }
                    inverse[idx].add(s);
                }
            }
        }

        final BitSet pred = new BitSet(numStates);
        final int[] hits = new int[numStates];
        final IntArrayList touched = new IntArrayList();

        while (!worklist.isEmpty()) {
            final int splitter = worklist.peekBlock();
            final int symbol = worklist.peekSymbol();
            worklist.remove();

            pred.clear();
            touched.clear();
            final IntArrayList splitterStates = partition.members(splitter);
            for (int k = 0; k < splitterStates.size(); k++) {
                final IntArrayList preds = inverse[symbol * numStates + splitterStates.getInt(k)];
                if (preds == null) {
                    continue;
                }
                for (int m = 0; m < preds.size(); m++) {
                    final int p = preds.getInt(m);
                    if (!pred.get(p)) {
                        pred.set(p);
                        final int b = partition.blockOf(p);
                        if (hits[b]++ == 0) {
                            touched.add(b);
                        }
                    }
                }
            }

            for (int k = 0; k < touched.size(); k++) {
                final int block = touched.getInt(k);
                final int count = hits[block];
                hits[block] = 0;
                if (count == partition.members(block).size()) {
                    continue; // Y \ pred is empty
                }
                final int newBlock = partition.split(block, pred);
                final boolean keepSmaller = partition.members(block).size() <= partition.members(newBlock).size();
                for (int i = 0; i < numInputs; i++) {
                    if (worklist.contains(block, i)) {
                        // (Y, i) now stands for Y ∩ pred; queue the other half as well
                        worklist.add(newBlock, i);
                    } else {
                        worklist.add(keepSmaller ? block : newBlock, i);
                    }
                }
            }
        }
        return partition;
    }

    private static <S extends Comparable<? super S>, I extends Comparable<? super I>> MinDFA<S, I> quotient(
        DFA<S, I> original, DFA<S, I> reachable, WorkingTable table, Partition partition, StateFactory<S> sinkFactory) {
        final int numStates = reachable.size();
        final int numInputs = reachable.numInputs();
        final int numBlocks = partition.numBlocks();
        final int[] succs = table.successors();

        final int[] rep = new int[numBlocks];
        final List<S> names = new ArrayList<>(numBlocks);
        for (int b = 0; b < numBlocks; b++) {
            rep[b] = partition.leastMember(b);
            if (rep[b] < numStates) {
                names.add(reachable.getState(rep[b]));
            } else {
                // block made of the sink alone
                names.add(sinkFactory.freshState(new HashSet<>(original.getStates())));
            }
        }

        final List<S> accept = new ArrayList<>();
        final Map<S, Map<I, S>> delta = new TreeMap<>();
        for (int b = 0; b < numBlocks; b++) {
            final S name = names.get(b);
            if (rep[b] < numStates && reachable.isIntAccepting(rep[b])) {
                accept.add(name);
            }
            for (int i = 0; i < numInputs; i++) {
                final int t = succs[rep[b] * numInputs + i];
                if (t != DFA.MISSING) {
                    delta.computeIfAbsent(name, k -> new TreeMap<>()).put(reachable.getSymbol(i), names.get(partition.blockOf(t)));
                }
            }
        }

        final Map<S, S> blockOf = new TreeMap<>();
        for (int s = 0; s < numStates; s++) {
            blockOf.put(reachable.getState(s), names.get(partition.blockOf(s)));
        }

        final S start = names.get(partition.blockOf(reachable.getIntInitialState()));
        final DFA<S, I> minimal = new DFA<>(names, reachable.getInputAlphabet(), start, accept, delta);
        return new MinDFA<>(minimal, blockOf);
    }

    /**
     * @param numStates - states of the table, the sink (last index) included if kept
     * @param successors - successor of state s on symbol i at {@code s * numInputs + i}
     */
    record WorkingTable(int numStates, int[] successors) { }

    /**
     * Blocks of states. Splitting a block keeps its id for the part inside the splitter's predecessors.
     */
    static final class Partition {
        private final int[] blockOf;
        private final List<IntArrayList> blocks = new ArrayList<>();

        Partition(int numStates) {
            this.blockOf = new int[numStates];
        }

        int addBlock(IntArrayList states) {
            final int id = blocks.size();
            blocks.add(states);
            for (int k = 0; k < states.size(); k++) {
                blockOf[states.getInt(k)] = id;
            }
            return id;
        }

        /**
         * Move the members of {@code block} outside {@code inside} to a new block.
         * @return id of the new block
         */
        int split(int block, BitSet inside) {
            final IntArrayList members = blocks.get(block);
            final IntArrayList kept = new IntArrayList();
            final IntArrayList moved = new IntArrayList();
            for (int k = 0; k < members.size(); k++) {
                final int s = members.getInt(k);
                if (inside.get(s)) {
                    kept.add(s);
                } else {
                    moved.add(s);
                }
            }
            blocks.set(block, kept);
            return addBlock(moved);
        }

        int blockOf(int state) {
            return blockOf[state];
        }

        IntArrayList members(int block) {
            return blocks.get(block);
        }

        int numBlocks() {
            return blocks.size();
        }

        int leastMember(int block) {
            final IntArrayList members = blocks.get(block);
            int least = Integer.MAX_VALUE;
            for (int k = 0; k < members.size(); k++) {
                least = Math.min(least, members.getInt(k));
            }
            return least;
        }
    }

    /**
     * FIFO of (block, symbol) splitters with O(1) membership.
     */
    private static final class Worklist {
        private final int numInputs;
        private final IntArrayFIFOQueue blocks = new IntArrayFIFOQueue();
        private final IntArrayFIFOQueue symbols = new IntArrayFIFOQueue();
        private final BitSet pending = new BitSet();

        Worklist(int numInputs) {
            this.numInputs = numInputs;
        }

        void add(int block, int symbol) {
            final int key = block * numInputs + symbol;
            if (!pending.get(key)) {
                pending.set(key);
                blocks.enqueue(block);
                symbols.enqueue(symbol);
            }
        }

        boolean contains(int block, int symbol) {
            return pending.get(block * numInputs + symbol);
        }

        boolean isEmpty() {
            return blocks.isEmpty();
        }

        int peekBlock() {
            return blocks.firstInt();
        }

        int peekSymbol() {
            return symbols.firstInt();
        }

        void remove() {
            pending.clear(peekBlock() * numInputs + peekSymbol());
            blocks.dequeueInt();
            symbols.dequeueInt();
        }
    }
}
