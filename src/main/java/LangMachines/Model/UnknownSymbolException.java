package LangMachines.Model;

public class UnknownSymbolException extends AutomatonException {
    private final transient Object symbol;

    public UnknownSymbolException(Object symbol) {
        super("Symbol " + symbol + " not in alphabet");
        this.symbol = symbol;
    }

    public Object getSymbol() {
        return symbol;
    }
}
