package LangMachines.Model;

import java.util.Set;

/**
 * Names synthetic states, such as the sink added when totalizing an automaton.
 * @param <S> - state type
 */
@FunctionalInterface
public interface StateFactory<S> {
    String DEFAULT_SINK_NAME = "sink";

    /**
     * Create a state that is not contained in {@code taken}.
     * @param taken - states already in use
     * @return a fresh state
     */
    S freshState(Set<? super S> taken);

    /**
     * "sink", or "sink_1", "sink_2", ... if that name is taken.
     */
    static StateFactory<String> strings() {
        return strings(DEFAULT_SINK_NAME);
    }

    static StateFactory<String> strings(String base) {
        return taken -> {
            String candidate = base;
            for (int i = 1; taken.contains(candidate); i++) {
                candidate = base + "_" + i;
            }
            return candidate;
        };
    }

    /**
     * One above the largest taken integer, or 0 if nothing is taken.
     */
    static StateFactory<Integer> integers() {
        return taken -> {
            int max = -1;
            for (Object s : taken) {
                if (s instanceof Integer && (Integer) s > max) {
                    max = (Integer) s;
                }
            }
            if (max == Integer.MAX_VALUE) {
                throw new IllegalStateException("No fresh integer state available");
            }
            return max + 1;
        };
    }
}
