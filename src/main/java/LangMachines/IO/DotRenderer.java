package LangMachines.IO;

import LangMachines.Model.DFA;
import net.automatalib.visualization.dot.DOT;

import java.io.File;
import java.io.IOException;
import java.io.Reader;
import java.io.StringReader;
import java.util.function.BooleanSupplier;

/**
 * Renders DFAs to image files through Graphviz, using AutomataLib's {@link DOT} launcher.
 * The location of the {@code dot} executable follows AutomataLib's settings.
 */
public class DotRenderer {
    private DotRenderer() {}

    /**
     * @param dfa - automaton
     * @param format - Graphviz output format, e.g. png or svg
     * @param out - target file
     * @return {@code out}
     * @throws RendererUnavailableException if Graphviz cannot be run
     * @throws IOException if rendering or writing fails
     */
    public static File render(DFA<?, ?> dfa, String format, File out) throws IOException {
        return renderDot(DotWriter.dfaToDot(dfa), format, out);
    }

    public static File renderDot(String dotText, String format, File out) throws IOException {
        return renderDot(dotText, format, out, DOT::checkUsable);
    }

    static File renderDot(String dotText, String format, File out, BooleanSupplier usable) throws IOException {
        if (!usable.getAsBoolean()) {
            throw new RendererUnavailableException(
                "Graphviz 'dot' is not usable; install Graphviz to render " + format + " output");
        }
        try (Reader r = new StringReader(dotText)) {
            DOT.runDOT(r, format, out);
        }
        return out;
    }
}
