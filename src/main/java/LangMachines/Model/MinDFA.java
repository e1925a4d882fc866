package LangMachines.Model;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.TreeMap;

/**
 * Result of minimization: the quotient automaton plus, for traceability, the block representative of every
 * reachable state of the automaton it was computed from. The mapping plays no part in the language.
 */
public class MinDFA<S extends Comparable<? super S>, I extends Comparable<? super I>> extends DFA<S, I> {
    private final Map<S, S> blockOf;

    public MinDFA(DFA<S, I> quotient, Map<? extends S, ? extends S> blockOf) {
        super(quotient);
        this.blockOf = Collections.unmodifiableMap(new LinkedHashMap<>(new TreeMap<>(blockOf)));
    }

    /**
     * @return original state to representative, in ascending order of original states
     */
    public Map<S, S> getBlockOf() {
        return blockOf;
    }

    /**
     * @return representative of {@code original}, or {@code null} if it was not a reachable state
     */
    public S getRepresentative(S original) {
        return blockOf.get(original);
    }

    @Override
    public boolean equals(Object o) {
        return super.equals(o) && blockOf.equals(((MinDFA<?, ?>) o).blockOf);
    }

    @Override
    public int hashCode() {
        return Objects.hash(super.hashCode(), blockOf);
    }
}
