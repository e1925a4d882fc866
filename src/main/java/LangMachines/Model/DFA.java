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
 * Immutable deterministic finite automaton with a possibly partial transition function.
 * <p>
 * States and symbols are interned: both are sorted by their natural order and addressed by index,
 * so the transition function is a flat table of successor indices ({@link #MISSING} where undefined).
 * An undefined transition means rejection.
 * <p>
 * The start state and the accepting states are kept exactly as declared. A start state outside
 * {@link #getStates()}, or accepting states that are not states, are legal values here and are
 * reported by the operations that require well-formed automata.
 *
 * @param <S> - state type
 * @param <I> - input symbol type
 */
public class DFA<S extends Comparable<? super S>, I extends Comparable<? super I>> {
    public static final int MISSING = -1;

    private final List<S> states;
    private final Map<S, Integer> stateIds;
    private final List<I> alphabet;
    private final Map<I, Integer> symbolIds;
    private final S start;
    private final int startId;
    private final Set<S> accept;
    private final BitSet accepting;
    private final int[] transitions;

    /**
     * @param states - all states
     * @param alphabet - input symbols
     * @param start - start state, may be {@code null} for an empty automaton
     * @param accept - accepting states
     * @param delta - transition function, keyed by source state then symbol
     * @throws IllegalArgumentException if a transition leaves the states or the alphabet
     */
    public DFA(Collection<? extends S> states,
               Collection<? extends I> alphabet,
               S start,
               Collection<? extends S> accept,
               Map<? extends S, ? extends Map<? extends I, ? extends S>> delta) {
        this.states = List.copyOf(new TreeSet<>(states));
        this.stateIds = index(this.states);
        this.alphabet = List.copyOf(new TreeSet<>(alphabet));
        this.symbolIds = index(this.alphabet);
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

        this.transitions = new int[this.states.size() * this.alphabet.size()];
        Arrays.fill(transitions, MISSING);
        for (Map.Entry<? extends S, ? extends Map<? extends I, ? extends S>> row : delta.entrySet()) {
            int src = requireState(row.getKey());
            for (Map.Entry<? extends I, ? extends S> t : row.getValue().entrySet()) {
                Integer sym = symbolIds.get(t.getKey());
                if (sym == null) {
                    throw new IllegalArgumentException(
                        "Transition " + row.getKey() + " --" + t.getKey() + "--> " + t.getValue() + " uses a symbol outside the alphabet");
                }
                transitions[src * this.alphabet.size() + sym] = requireState(t.getValue());
            }
        }
    }

    /**
     * Copy constructor, used by subclasses that decorate an automaton.
     */
    protected DFA(DFA<S, I> other) {
        this.states = other.states;
        this.stateIds = other.stateIds;
        this.alphabet = other.alphabet;
        this.symbolIds = other.symbolIds;
        this.start = other.start;
        this.startId = other.startId;
        this.accept = other.accept;
        this.accepting = other.accepting;
        this.transitions = other.transitions;
    }

    private static <T> Map<T, Integer> index(List<T> sorted) {
        Map<T, Integer> ids = new HashMap<>();
        for (int i = 0; i < sorted.size(); i++) {
            ids.put(sorted.get(i), i);
        }
        return ids;
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

    /**
     * @return index of the state, or {@link #MISSING}
     */
    public int getStateId(S state) {
        Integer id = stateIds.get(state);
        return id == null ? MISSING : id;
    }

    public I getSymbol(int index) {
        return alphabet.get(index);
    }

    /**
     * @return index of the symbol, or {@link #MISSING}
     */
    public int getSymbolIndex(I symbol) {
        Integer idx = symbolIds.get(symbol);
        return idx == null ? MISSING : idx;
    }

    /**
     * @return index of the start state, or {@link #MISSING} if the start state is not a state
     */
    public int getIntInitialState() {
        return startId;
    }

    public boolean isIntAccepting(int state) {
        return accepting.get(state);
    }

    public int getIntSuccessor(int state, int symbol) {
        return transitions[state * alphabet.size() + symbol];
    }

    // ---- value view

    /**
     * @return states in ascending order
     */
    public List<S> getStates() {
        return states;
    }

    /**
     * @return symbols in ascending order
     */
    public List<I> getInputAlphabet() {
        return alphabet;
    }

    public S getInitialState() {
        return start;
    }

    /**
     * @return accepting states as declared, in ascending order
     */
    public Set<S> getAcceptingStates() {
        return accept;
    }

    public boolean isAccepting(S state) {
        return accept.contains(state);
    }

    /**
     * @return successor of {@code state} on {@code symbol}, or {@code null} if undefined
     */
    public S getSuccessor(S state, I symbol) {
        int s = getStateId(state);
        int a = getSymbolIndex(symbol);
        if (s == MISSING || a == MISSING) {
            return null;
        }
        int t = getIntSuccessor(s, a);
        return t == MISSING ? null : states.get(t);
    }

    /**
     * Nested transition map, source state then symbol, in ascending order.
     */
    public Map<S, Map<I, S>> getTransitions() {
        Map<S, Map<I, S>> result = new LinkedHashMap<>();
        for (int s = 0; s < states.size(); s++) {
            Map<I, S> row = new LinkedHashMap<>();
            for (int a = 0; a < alphabet.size(); a++) {
                int t = getIntSuccessor(s, a);
                if (t != MISSING) {
                    row.put(alphabet.get(a), states.get(t));
                }
            }
            if (!row.isEmpty()) {
                result.put(states.get(s), Collections.unmodifiableMap(row));
            }
        }
        return Collections.unmodifiableMap(result);
    }

    public int countTransitions() {
        int count = 0;
        for (int t : transitions) {
            if (t != MISSING) {
                count++;
            }
        }
        return count;
    }

    /**
     * @return whether every (state, symbol) pair has a transition
     */
    public boolean isComplete() {
        for (int t : transitions) {
            if (t == MISSING) {
                return false;
            }
        }
        return true;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (o == null || getClass() != o.getClass()) {
            return false;
        }
        DFA<?, ?> other = (DFA<?, ?>) o;
        return states.equals(other.states)
            && alphabet.equals(other.alphabet)
            && Objects.equals(start, other.start)
            && accept.equals(other.accept)
            && Arrays.equals(transitions, other.transitions);
    }

    @Override
    public int hashCode() {
        return Objects.hash(states, alphabet, start, accept, Arrays.hashCode(transitions));
    }

    @Override
    public String toString() {
        return "DFA{states=" + states + ", alphabet=" + alphabet + ", start=" + start
            + ", accept=" + accept + ", delta=" + getTransitions() + "}";
    }

    /**
     * Mutable builder; {@link #build()} validates the transitions.
     */
    public static final class Builder<S extends Comparable<? super S>, I extends Comparable<? super I>> {
        private final Set<S> states = new TreeSet<>();
        private final Set<I> alphabet = new TreeSet<>();
        private final Set<S> accept = new TreeSet<>();
        private final Map<S, Map<I, S>> delta = new TreeMap<>();
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

        /**
         * @throws IllegalArgumentException if a different transition for (src, symbol) already exists
         */
        public Builder<S, I> withTransition(S src, I symbol, S target) {
            S old = delta.computeIfAbsent(src, k -> new TreeMap<>()).putIfAbsent(symbol, target);
            if (old != null && !old.equals(target)) {
                throw new IllegalArgumentException(
                    "Non-deterministic transition " + src + " --" + symbol + "--> {" + old + ", " + target + "}");
            }
            return this;
        }

        public DFA<S, I> build() {
            return new DFA<>(states, alphabet, start, accept, delta);
        }
    }
}
