package NFAMin;

/**
 * A transition on a symbol that is not part of the alphabet, or a null symbol in the alphabet.
 */
public class UnknownSymbolException extends ValidationException {
    public UnknownSymbolException(String symbol) {
        super("Unknown symbol: " + symbol, symbol);
    }

    @Override
    public String getKind() {
        return "UnknownSymbol";
    }
}
