package LangMachines.Model;

/**
 * A state the operation needs (typically the start state) does not exist in the automaton.
 */
public class MissingStateException extends MalformedAutomatonException {
    private final transient Object state;

    public MissingStateException(Object state) {
        super("State " + state + " is not a state of the automaton");
        this.state = state;
    }

    public Object getState() {
        return state;
    }
}
