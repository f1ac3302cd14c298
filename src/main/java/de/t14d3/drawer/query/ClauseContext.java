package de.t14d3.drawer.query;

/**
 * The single clause a caller-supplied fragment is meant to fill.
 */
public enum ClauseContext {
    COLUMNS("column list", ",()._+-*/'\"|"),
    WHERE("WHERE clause", ",()._+-*/'\"|%=<>!?:"),
    ORDER_BY("ORDER BY clause", ",()._+-*/'\""),
    GROUP_BY("GROUP BY clause", ",()._+-*/'\"");

    private final String label;
    private final String symbols;

    ClauseContext(String label, String symbols) {
        this.label = label;
        this.symbols = symbols;
    }

    public String label() {
        return label;
    }

    /**
     * Letters, digits, underscore and whitespace are always permitted; anything else must be listed.
     */
    boolean permits(char c) {
        return Character.isLetterOrDigit(c) || c == '_' || Character.isWhitespace(c) || symbols.indexOf(c) >= 0;
    }
}
