package com.typstparser.ast;

/**
 * Binary operators, including the compound assignments.
 */
public enum BinOp {
    ADD("add", "+"),
    SUB("sub", "-"),
    MUL("mul", "*"),
    DIV("div", "/"),
    AND("and", "and"),
    OR("or", "or"),
    EQ("eq", "=="),
    NEQ("neq", "!="),
    LT("lt", "<"),
    LEQ("leq", "<="),
    GT("gt", ">"),
    GEQ("geq", ">="),
    ASSIGN("assign", "="),
    IN("in", "in"),
    NOT_IN("notIn", "not in"),
    ADD_ASSIGN("addAssign", "+="),
    SUB_ASSIGN("subAssign", "-="),
    MUL_ASSIGN("mulAssign", "*="),
    DIV_ASSIGN("divAssign", "/=");

    private final String label;
    private final String symbol;

    BinOp(String label, String symbol) {
        this.label = label;
        this.symbol = symbol;
    }

    public String label() {
        return label;
    }

    public String symbol() {
        return symbol;
    }

    public static BinOp fromLabel(String label) {
        for (BinOp op : values()) {
            if (op.label.equals(label)) {
                return op;
            }
        }
        throw new IllegalArgumentException("Unknown binary operator: " + label);
    }
}
