package LangMachines.IO;

import LangMachines.Model.DFA;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.StringJoiner;
import java.util.TreeMap;
import java.util.regex.Pattern;

/**
 * Graphviz DOT source for DFAs.
 * <p>
 * Accepting states are drawn as double circles inside a dashed cluster; parallel edges are merged into one edge
 * whose label joins the symbols with commas. Nodes and edges come out in ascending state order, so the text is a
 * pure function of the automaton.
 */
public class DotWriter {
    public static final String DEFAULT_RANKDIR = "LR";
    public static final String DEFAULT_NAME = "DFA";

    private static final Pattern PLAIN_ID = Pattern.compile("[A-Za-z_][A-Za-z0-9_]*");

    private DotWriter() {}

    public static String dfaToDot(DFA<?, ?> dfa) {
        return dfaToDot(dfa, DEFAULT_RANKDIR, DEFAULT_NAME);
    }

    /**
     * @param dfa - automaton
     * @param rankdir - graph direction, e.g. LR or TB
     * @param name - graph name
     * @return DOT source, lines separated by {@code \n}, without trailing newline
     */
    public static String dfaToDot(DFA<?, ?> dfa, String rankdir, String name) {
        final int numStates = dfa.size();
        final int numInputs = dfa.numInputs();

        // (source, target) -> symbol indices, both in ascending order
        final Map<Integer, Map<Integer, List<Integer>>> edges = new TreeMap<>();
        for (int s = 0; s < numStates; s++) {
            for (int i = 0; i < numInputs; i++) {
                int t = dfa.getIntSuccessor(s, i);
                if (t != DFA.MISSING) {
                    edges.computeIfAbsent(s, k -> new TreeMap<>()).computeIfAbsent(t, k -> new ArrayList<>()).add(i);
                }
            }
        }

        final List<String> lines = new ArrayList<>();
        lines.add("digraph " + escapeId(name) + " {");
        lines.add("  rankdir=" + rankdir + ";");
        lines.add("  node [shape=circle];");

        // invisible start arrow
        lines.add("  __start__ [shape=point, style=invis, width=0];");
        lines.add("  __start__ -> " + escapeId(String.valueOf(dfa.getInitialState())) + " [label=\"start\"];");

        final StringJoiner acceptNodes = new StringJoiner(" ");
        final StringJoiner otherNodes = new StringJoiner(" ");
        for (int s = 0; s < numStates; s++) {
            final String id = escapeId(String.valueOf(dfa.getState(s)));
            if (dfa.isIntAccepting(s)) {
                acceptNodes.add(id);
            } else {
                otherNodes.add(id);
            }
        }
        if (acceptNodes.length() > 0) {
            lines.add("  subgraph cluster_accept { label=\"accepting\"; color=gray80; style=dashed;");
            lines.add("    node [shape=doublecircle];");
            lines.add("    " + acceptNodes + ";");
            lines.add("  }");
        }
        if (otherNodes.length() > 0) {
            lines.add("  " + otherNodes + ";");
        }

        for (Map.Entry<Integer, Map<Integer, List<Integer>>> row : edges.entrySet()) {
            final String from = escapeId(String.valueOf(dfa.getState(row.getKey())));
            for (Map.Entry<Integer, List<Integer>> edge : row.getValue().entrySet()) {
                final String to = escapeId(String.valueOf(dfa.getState(edge.getKey())));
                final StringJoiner label = new StringJoiner(", ");
                for (int i : edge.getValue()) {
                    label.add(String.valueOf(dfa.getSymbol(i)));
                }
                lines.add("  " + from + " -> " + to + " [label=\"" + escapeLabel(label.toString()) + "\"];");
            }
        }

        lines.add("}");
        return String.join("\n", lines);
    }

    /**
     * Plain identifiers stay as they are, anything else becomes a double-quoted string.
     */
    static String escapeId(String str) {
        if (PLAIN_ID.matcher(str).matches()) {
            return str;
        }
        return "\"" + escapeLabel(str) + "\"";
    }

    private static String escapeLabel(String str) {
        return str.replace("\\", "\\\\").replace("\"", "\\\"");
    }
}
