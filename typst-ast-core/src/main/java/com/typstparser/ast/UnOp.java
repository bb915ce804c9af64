package com.typstparser.ast;

public enum UnOp {
    POS("pos", "+"),
    NEG("neg", "-"),
    NOT("not", "not");

    private final String label;
    private final String symbol;

    UnOp(String label, String symbol) {
        this.label = label;
        this.symbol = symbol;
    }

    public String label() {
        return label;
    }

    public String symbol() {
        return symbol;
    }

    public static UnOp fromLabel(String label) {
        for (UnOp op : values()) {
            if (op.label.equals(label)) {
                return op;
            }
        }
        throw new IllegalArgumentException("Unknown unary operator: " + label);
    }
}
