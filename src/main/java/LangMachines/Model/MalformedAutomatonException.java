package LangMachines.Model;

/**
 * The automaton violates a structural precondition, e.g. its start state is not one of its states,
 * or its accepting states are not a subset of its states.
 */
public class MalformedAutomatonException extends AutomatonException {
    public MalformedAutomatonException(String message) {
        super(message);
    }
}
