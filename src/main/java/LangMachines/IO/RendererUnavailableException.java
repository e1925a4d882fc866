package LangMachines.IO;

import java.io.IOException;

/**
 * The external Graphviz renderer cannot be used, typically because the {@code dot} executable is not installed.
 * Unrelated to the automaton being rendered.
 */
public class RendererUnavailableException extends IOException {
    public RendererUnavailableException(String message) {
        super(message);
    }
}
