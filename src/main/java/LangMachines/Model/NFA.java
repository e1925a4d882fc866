package LangMachines.Model;

import java.util.Arrays;
import java.util.BitSet;
import java.util.Collection;
import java.util.Collections;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.TreeMap;
import java.util.TreeSet;

/**
 * Immutable nondeterministic finite automaton with epsilon-transitions.
 * <p>
 * Epsilon moves are kept apart from the symbol transitions, so epsilon is never a member of the alphabet.
 * States and symbols are interned in ascending order, as in {@link DFA}; successor sets are {@link BitSet}s
 * over state indices.
 *
 * @param <S> - state type
 * @param <I> - input symbol type
 */
public class NFA<S extends Comparable<? super S>, I extends Comparable<? super I>> {
    /**
     * Spelling of epsilon in persisted automata.
     */
    public static final String EPSILON = "ε";
    public static final int MISSING = DFA.MISSING;

    private final List<S> states;
    private final Map<S, Integer> stateIds;
    private final List<I> alphabet;
    private final Map<I, Integer> symbolIds;
    private final S start;
    private final int startId;
    private final Set<S> accept;
    private final BitSet accepting;
    private final BitSet[] transitions;
    private final BitSet[] epsilonTransitions;

    /**
     * @param states - all states
     * @param alphabet - input symbols, without epsilon
     * @param start - start state
     * @param accept - accepting states
     * @param delta - symbol transitions, keyed by source state then symbol
     * @param epsilonDelta - epsilon transitions, keyed by source state
     * @throws IllegalArgumentException if a transition leaves the states or the alphabet
     */
    public NFA(Collection<? extends S> states,
               Collection<? extends I> alphabet,
               S start,
               Collection<? extends S> accept,
               Map<? extends S, ? extends Map<? extends I, ? extends Collection<? extends S>>> delta,
               Map<? extends S, ? extends Collection<? extends S>> epsilonDelta) {
        this.states = List.copyOf(new TreeSet<>(states));
        this.stateIds = new HashMap<>();
        for (int i = 0; i < this.states.size(); i++) {
            stateIds.put(this.states.get(i), i);
        }
        this.alphabet = List.copyOf(new TreeSet<>(alphabet));
        this.symbolIds = new HashMap<>();
        for (int i = 0; i < this.alphabet.size(); i++) {
            symbolIds.put(this.alphabet.get(i), i);
        }
        this.start = start;
        this.startId = start == null ? MISSING : getStateId(start);
        this.accept = Collections.unmodifiableSet(new LinkedHashSet<>(new TreeSet<>(accept)));
        this.accepting = new BitSet(this.states.size());
        for (S s : this.accept) {
            int id = getStateId(s);
            if (id != MISSING) {
                accepting.set(id);
            }
        }

        final int numInputs = this.alphabet.size();
        this.transitions = new BitSet[this.states.size() * numInputs];
        this.epsilonTransitions = new BitSet[this.states.size()];
        for (int i = 0; i < transitions.length; i++) {
            transitions[i] = new BitSet();
        }
        for (int i = 0; i < epsilonTransitions.length; i++) {
            epsilonTransitions[i] = new BitSet();
        }

        for (Map.Entry<? extends S, ? extends Map<? extends I, ? extends Collection<? extends S>>> row : delta.entrySet()) {
            int src = requireState(row.getKey());
            for (Map.Entry<? extends I, ? extends Collection<? extends S>> t : row.getValue().entrySet()) {
                Integer sym = symbolIds.get(t.getKey());
                if (sym == null) {
                    throw new IllegalArgumentException(
                        "Transition " + row.getKey() + " --" + t.getKey() + "--> " + t.getValue() + " uses a symbol outside the alphabet");
                }
                for (S target : t.getValue()) {
                    transitions[src * numInputs + sym].set(requireState(target));
                }
            }
        }
        for (Map.Entry<? extends S, ? extends Collection<? extends S>> row : epsilonDelta.entrySet()) {
            int src = requireState(row.getKey());
            for (S target : row.getValue()) {
                epsilonTransitions[src].set(requireState(target));
            }
        }
    }

    private int requireState(S s) {
        int id = getStateId(s);
        if (id == MISSING) {
            throw new IllegalArgumentException("Transition refers to unknown state " + s);
        }
        return id;
    }

    public static <S extends Comparable<? super S>, I extends Comparable<? super I>> Builder<S, I> builder() {
        return new Builder<>();
    }

    // ---- int abstraction

    public int size() {
        return states.size();
    }

    public int numInputs() {
        return alphabet.size();
    }

    public S getState(int id) {
        return states.get(id);
    }

    public int getStateId(S state) {
        Integer id = stateIds.get(state);
        return id == null ? MISSING : id;
    }

    public I getSymbol(int index) {
        return alphabet.get(index);
    }

    public int getSymbolIndex(I symbol) {
        Integer idx = symbolIds.get(symbol);
        return idx == null ? MISSING : idx;
    }

    public int getIntInitialState() {
        return startId;
    }

    public boolean isIntAccepting(int state) {
        return accepting.get(state);
    }

    /**
     * @return whether any state of the set is accepting
     */
    public boolean isIntAccepting(BitSet stateSet) {
        return stateSet.intersects(accepting);
    }

    /**
     * @return a copy of the successors of {@code state} on {@code symbol}
     */
    public BitSet getIntTransitions(int state, int symbol) {
        return (BitSet) transitions[state * alphabet.size() + symbol].clone();
    }

    /**
     * Add the successors of {@code state} on {@code symbol} to {@code into}.
     */
    public void collectIntTransitions(int state, int symbol, BitSet into) {
        into.or(transitions[state * alphabet.size() + symbol]);
    }

    /**
     * @return a copy of the epsilon-successors of {@code state}
     */
    public BitSet getIntEpsilonTransitions(int state) {
        return (BitSet) epsilonTransitions[state].clone();
    }

    public boolean hasEpsilonTransitions() {
        for (BitSet eps : epsilonTransitions) {
            if (!eps.isEmpty()) {
                return true;
            }
        }
        return false;
    }

    // ---- value view

    public List<S> getStates() {
        return states;
    }

    public List<I> getInputAlphabet() {
        return alphabet;
    }

    public S getInitialState() {
        return start;
    }

    public Set<S> getAcceptingStates() {
        return accept;
    }

    public boolean isAccepting(S state) {
        return accept.contains(state);
    }

    /**
     * @return successors of {@code state} on {@code symbol}, empty if none or if either is unknown
     */
    public Set<S> getSuccessors(S state, I symbol) {
        int s = getStateId(state);
        int a = getSymbolIndex(symbol);
        if (s == MISSING || a == MISSING) {
            return Collections.emptySet();
        }
        return toStates(transitions[s * alphabet.size() + a]);
    }

    public Set<S> getEpsilonSuccessors(S state) {
        int s = getStateId(state);
        return s == MISSING ? Collections.emptySet() : toStates(epsilonTransitions[s]);
    }

    /**
     * @return states of the given indices, in ascending order
     */
    public Set<S> toStates(BitSet ids) {
        Set<S> result = new LinkedHashSet<>();
        for (int i = ids.nextSetBit(0); i >= 0; i = ids.nextSetBit(i + 1)) {
            result.add(states.get(i));
        }
        return Collections.unmodifiableSet(result);
    }

    public Map<S, Map<I, Set<S>>> getTransitions() {
        Map<S, Map<I, Set<S>>> result = new LinkedHashMap<>();
        for (int s = 0; s < states.size(); s++) {
            Map<I, Set<S>> row = new LinkedHashMap<>();
            for (int a = 0; a < alphabet.size(); a++) {
                BitSet succ = transitions[s * alphabet.size() + a];
                if (!succ.isEmpty()) {
                    row.put(alphabet.get(a), toStates(succ));
                }
            }
            if (!row.isEmpty()) {
                result.put(states.get(s), Collections.unmodifiableMap(row));
            }
        }
        return Collections.unmodifiableMap(result);
    }

    public Map<S, Set<S>> getEpsilonTransitions() {
        Map<S, Set<S>> result = new LinkedHashMap<>();
        for (int s = 0; s < states.size(); s++) {
            if (!epsilonTransitions[s].isEmpty()) {
                result.put(states.get(s), toStates(epsilonTransitions[s]));
            }
        }
        return Collections.unmodifiableMap(result);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (o == null || getClass() != o.getClass()) {
            return false;
        }
        NFA<?, ?> other = (NFA<?, ?>) o;
        return states.equals(other.states)
            && alphabet.equals(other.alphabet)
            && Objects.equals(start, other.start)
            && accept.equals(other.accept)
            && Arrays.equals(transitions, other.transitions)
            && Arrays.equals(epsilonTransitions, other.epsilonTransitions);
    }

    @Override
    public int hashCode() {
        return Objects.hash(states, alphabet, start, accept, Arrays.hashCode(transitions), Arrays.hashCode(epsilonTransitions));
    }

    @Override
    public String toString() {
        return "NFA{states=" + states + ", alphabet=" + alphabet + ", start=" + start
            + ", accept=" + accept + ", delta=" + getTransitions() + ", epsilon=" + getEpsilonTransitions() + "}";
    }

    public static final class Builder<S extends Comparable<? super S>, I extends Comparable<? super I>> {
        private final Set<S> states = new TreeSet<>();
        private final Set<I> alphabet = new TreeSet<>();
        private final Set<S> accept = new TreeSet<>();
        private final Map<S, Map<I, Set<S>>> delta = new TreeMap<>();
        private final Map<S, Set<S>> epsilonDelta = new TreeMap<>();
        private S start;

        private Builder() {
        }

        @SafeVarargs
        public final Builder<S, I> withStates(S... states) {
            return withStates(Arrays.asList(states));
        }

        public Builder<S, I> withStates(Collection<? extends S> states) {
            this.states.addAll(states);
            return this;
        }

        @SafeVarargs
        public final Builder<S, I> withAlphabet(I... symbols) {
            return withAlphabet(Arrays.asList(symbols));
        }

        public Builder<S, I> withAlphabet(Collection<? extends I> symbols) {
            this.alphabet.addAll(symbols);
            return this;
        }

        public Builder<S, I> withStart(S start) {
            this.start = start;
            return this;
        }

        @SafeVarargs
        public final Builder<S, I> withAccepting(S... accepting) {
            return withAccepting(Arrays.asList(accepting));
        }

        public Builder<S, I> withAccepting(Collection<? extends S> accepting) {
            this.accept.addAll(accepting);
            return this;
        }

        public Builder<S, I> withTransition(S src, I symbol, S target) {
            delta.computeIfAbsent(src, k -> new TreeMap<>()).computeIfAbsent(symbol, k -> new TreeSet<>()).add(target);
            return this;
        }

        public Builder<S, I> withEpsilonTransition(S src, S target) {
            epsilonDelta.computeIfAbsent(src, k -> new TreeSet<>()).add(target);
            return this;
        }

        public NFA<S, I> build() {
            return new NFA<>(states, alphabet, start, accept, delta, epsilonDelta);
        }
    }
}
