package LangMachines;

import LangMachines.Model.DFA;
import LangMachines.Model.MissingStateException;
import LangMachines.Model.NFA;
import LangMachines.Model.UnknownSymbolException;

import it.unimi.dsi.fastutil.ints.IntArrayList;

import java.util.BitSet;
import java.util.function.ToIntFunction;

/**
 * Runs automata over finite words.
 */
public class Simulator {
    private Simulator() {}

    /**
     * Run the DFA on {@code word}. An undefined transition rejects immediately.
     * @param dfa - automaton
     * @param word - input symbols
     * @return whether the run ends in an accepting state
     * @throws MissingStateException if the start state is not a state
     * @throws UnknownSymbolException if a symbol of the word is not in the alphabet
     */
    public static <S extends Comparable<? super S>, I extends Comparable<? super I>> boolean simulate(
        DFA<S, I> dfa, Iterable<? extends I> word) {
        final int initId = dfa.getIntInitialState();
        if (initId == DFA.MISSING) {
            throw new MissingStateException(dfa.getInitialState());
        }
        final IntArrayList symbols = symbolIndices(dfa.getInputAlphabet().size(), word, dfa::getSymbolIndex);

        int curr = initId;
        for (int i = 0; i < symbols.size(); i++) {
            curr = dfa.getIntSuccessor(curr, symbols.getInt(i));
            if (curr == DFA.MISSING) {
                return false;
            }
        }
        return dfa.isIntAccepting(curr);
    }

    /**
     * Run the NFA on {@code word}, tracking the epsilon-closed set of current states.
     * @throws MissingStateException if the start state is not a state
     * @throws UnknownSymbolException if a symbol of the word is not in the alphabet
     */
    public static <S extends Comparable<? super S>, I extends Comparable<? super I>> boolean simulate(
        NFA<S, I> nfa, Iterable<? extends I> word) {
        final int initId = nfa.getIntInitialState();
        if (initId == NFA.MISSING) {
            throw new MissingStateException(nfa.getInitialState());
        }
        final IntArrayList symbols = symbolIndices(nfa.getInputAlphabet().size(), word, nfa::getSymbolIndex);

        BitSet curr = new BitSet(nfa.size());
        curr.set(initId);
        curr = Determinization.epsilonClosure(nfa, curr);
        for (int i = 0; i < symbols.size(); i++) {
            curr = Determinization.epsilonClosure(nfa, Determinization.move(nfa, curr, symbols.getInt(i)));
            if (curr.isEmpty()) {
                return false;
            }
        }
        return nfa.isIntAccepting(curr);
    }

    // The whole word is checked against the alphabet before the run starts.
    private static <I> IntArrayList symbolIndices(int numInputs, Iterable<? extends I> word, ToIntFunction<I> index) {
        final IntArrayList symbols = new IntArrayList();
        for (I symbol : word) {
            final int idx = index.applyAsInt(symbol);
            if (idx < 0 || idx >= numInputs) {
                throw new UnknownSymbolException(symbol);
            }
            symbols.add(idx);
        }
        return symbols;
    }
}
