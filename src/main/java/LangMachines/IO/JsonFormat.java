package LangMachines.IO;

import LangMachines.Model.DFA;
import LangMachines.Model.NFA;
import org.json.JSONArray;
import org.json.JSONException;
import org.json.JSONObject;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.BitSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;
import java.util.TreeSet;

/**
 * JSON records for automata. States, symbols and targets are stringified on write, so reading back gives
 * String-typed automata; the round trip is exact whenever distinct states (and symbols) have distinct strings.
 * <pre>
 * {"type": "dfa", "states": [..], "alphabet": [..], "start": "..", "accept": [..],
 *  "delta": {"state": {"symbol": "target"}}}
 * {"type": "nfa", ..., "delta": {"state": {"symbol": ["target", ..], "ε": [..]}}}
 * </pre>
 */
public class JsonFormat {
    public static final String TYPE = "type";
    public static final String DFA_TYPE = "dfa";
    public static final String NFA_TYPE = "nfa";
    public static final String STATES = "states";
    public static final String ALPHABET = "alphabet";
    public static final String START = "start";
    public static final String ACCEPT = "accept";
    public static final String DELTA = "delta";

    private JsonFormat() {}

    public static JSONObject dfaToJson(DFA<?, ?> dfa) {
        JSONObject nested = new JSONObject();
        for (int s = 0; s < dfa.size(); s++) {
            JSONObject row = new JSONObject();
            for (int i = 0; i < dfa.numInputs(); i++) {
                int t = dfa.getIntSuccessor(s, i);
                if (t != DFA.MISSING) {
                    row.put(String.valueOf(dfa.getSymbol(i)), String.valueOf(dfa.getState(t)));
                }
            }
            if (!row.isEmpty()) {
                nested.put(String.valueOf(dfa.getState(s)), row);
            }
        }
        return header(DFA_TYPE, dfa.getStates(), dfa.getInputAlphabet(), dfa.getInitialState(), dfa.getAcceptingStates())
            .put(DELTA, nested);
    }

    /**
     * @throws JSONException if the record is not a DFA record
     * @throws IllegalArgumentException if the transitions are inconsistent with the states or the alphabet
     */
    public static DFA<String, String> dfaFromJson(JSONObject obj) {
        requireType(obj, DFA_TYPE);
        Map<String, Map<String, String>> delta = new TreeMap<>();
        JSONObject nested = obj.getJSONObject(DELTA);
        for (String s : nested.keySet()) {
            JSONObject row = nested.getJSONObject(s);
            Map<String, String> transitions = new TreeMap<>();
            for (String a : row.keySet()) {
                transitions.put(a, row.get(a).toString());
            }
            delta.put(s, transitions);
        }
        return new DFA<>(strings(obj, STATES), strings(obj, ALPHABET), start(obj), strings(obj, ACCEPT), delta);
    }

    /**
     * @throws IllegalArgumentException if a symbol is spelled like epsilon
     */
    public static JSONObject nfaToJson(NFA<?, ?> nfa) {
        for (Object a : nfa.getInputAlphabet()) {
            if (NFA.EPSILON.equals(String.valueOf(a))) {
                throw new IllegalArgumentException("Symbol " + a + " clashes with the epsilon key " + NFA.EPSILON);
            }
        }
        JSONObject nested = new JSONObject();
        for (int s = 0; s < nfa.size(); s++) {
            JSONObject row = new JSONObject();
            for (int i = 0; i < nfa.numInputs(); i++) {
                List<String> targets = stateNames(nfa, nfa.getIntTransitions(s, i));
                if (!targets.isEmpty()) {
                    row.put(String.valueOf(nfa.getSymbol(i)), new JSONArray(targets));
                }
            }
            List<String> epsTargets = stateNames(nfa, nfa.getIntEpsilonTransitions(s));
            if (!epsTargets.isEmpty()) {
                row.put(NFA.EPSILON, new JSONArray(epsTargets));
            }
            if (!row.isEmpty()) {
                nested.put(String.valueOf(nfa.getState(s)), row);
            }
        }
        return header(NFA_TYPE, nfa.getStates(), nfa.getInputAlphabet(), nfa.getInitialState(), nfa.getAcceptingStates())
            .put(DELTA, nested);
    }

    /**
     * An epsilon entry in the record's alphabet is dropped.
     * @throws JSONException if the record is not an NFA record
     */
    public static NFA<String, String> nfaFromJson(JSONObject obj) {
        requireType(obj, NFA_TYPE);
        Map<String, Map<String, Set<String>>> delta = new TreeMap<>();
        Map<String, Set<String>> epsilonDelta = new TreeMap<>();
        JSONObject nested = obj.getJSONObject(DELTA);
        for (String s : nested.keySet()) {
            JSONObject row = nested.getJSONObject(s);
            for (String a : row.keySet()) {
                Set<String> targets = new TreeSet<>();
                JSONArray arr = row.getJSONArray(a);
                for (int i = 0; i < arr.length(); i++) {
                    targets.add(arr.get(i).toString());
                }
                if (NFA.EPSILON.equals(a)) {
                    epsilonDelta.put(s, targets);
                } else {
                    delta.computeIfAbsent(s, k -> new TreeMap<>()).put(a, targets);
                }
            }
        }
        // records may list epsilon among the symbols; it is never an input symbol
        List<String> alphabet = strings(obj, ALPHABET);
        alphabet.removeIf(NFA.EPSILON::equals);
        return new NFA<>(strings(obj, STATES), alphabet, start(obj), strings(obj, ACCEPT), delta, epsilonDelta);
    }

    public static JSONObject readJson(Path path) throws IOException {
        return new JSONObject(Files.readString(path, StandardCharsets.UTF_8));
    }

    public static void writeJson(JSONObject obj, Path path) throws IOException {
        Files.writeString(path, obj.toString(2) + "\n", StandardCharsets.UTF_8);
    }

    public static DFA<String, String> loadDFA(Path path) throws IOException {
        return dfaFromJson(readJson(path));
    }

    public static void saveDFA(DFA<?, ?> dfa, Path path) throws IOException {
        writeJson(dfaToJson(dfa), path);
    }

    public static NFA<String, String> loadNFA(Path path) throws IOException {
        return nfaFromJson(readJson(path));
    }

    public static void saveNFA(NFA<?, ?> nfa, Path path) throws IOException {
        writeJson(nfaToJson(nfa), path);
    }

    private static JSONObject header(String type, Iterable<?> states, Iterable<?> alphabet, Object start, Iterable<?> accept) {
        return new JSONObject()
            .put(TYPE, type)
            .put(STATES, new JSONArray(stringify(states)))
            .put(ALPHABET, new JSONArray(stringify(alphabet)))
            .put(START, start == null ? JSONObject.NULL : String.valueOf(start))
            .put(ACCEPT, new JSONArray(stringify(accept)));
    }

    private static List<String> stringify(Iterable<?> values) {
        List<String> result = new ArrayList<>();
        for (Object v : values) {
            result.add(String.valueOf(v));
        }
        return result;
    }

    private static List<String> stateNames(NFA<?, ?> nfa, BitSet ids) {
        List<String> result = new ArrayList<>();
        for (int t = ids.nextSetBit(0); t >= 0; t = ids.nextSetBit(t + 1)) {
            result.add(String.valueOf(nfa.getState(t)));
        }
        return result;
    }

    private static void requireType(JSONObject obj, String type) {
        if (!type.equals(obj.optString(TYPE, null))) {
            throw new JSONException("JSON does not describe a " + type.toUpperCase() + " (missing type='" + type + "').");
        }
    }

    private static List<String> strings(JSONObject obj, String key) {
        JSONArray arr = obj.getJSONArray(key);
        List<String> result = new ArrayList<>(arr.length());
        for (int i = 0; i < arr.length(); i++) {
            result.add(arr.get(i).toString());
        }
        return result;
    }

    private static String start(JSONObject obj) {
        return obj.isNull(START) ? null : obj.get(START).toString();
    }
}
