package mhcdata.Types;

public enum MeasurementInequality {

    LESS("<"), EQUAL("="), GREATER(">");

    private final String symbol;

    MeasurementInequality(String symbol) {
        this.symbol = symbol;
    }

    public String getSymbol() {
        return symbol;
    }

    // returns null for an unknown symbol; such records are dropped when the merged table is cleaned.
    public static MeasurementInequality fromSymbol(String symbol) {
        if (symbol == null) {
            return null;
        }
        for (MeasurementInequality inequality : values()) {
            if (inequality.symbol.contentEquals(symbol.trim())) {
                return inequality;
            }
        }
        return null;
    }
}
