package LangMachines.Model;

/**
 * Base class of the errors raised when an automaton cannot be processed as given.
 */
public class AutomatonException extends RuntimeException {
    public AutomatonException(String message) {
        super(message);
    }
}
