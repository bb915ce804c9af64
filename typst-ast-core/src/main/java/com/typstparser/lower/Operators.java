package com.typstparser.lower;

import com.typstparser.ast.BinOp;
import com.typstparser.ast.UnOp;
import com.typstparser.syntax.SyntaxKind;

/**
 * Maps operator tokens to operators. {@code not in} spans two tokens and is
 * recognised by the lowering engine itself.
 */
public final class Operators {

    private Operators() {
    }

    /**
     * The binary operator a token stands for, or {@code null}.
     */
    public static BinOp binOp(SyntaxKind kind) {
        return switch (kind) {
            case PLUS -> BinOp.ADD;
            case MINUS -> BinOp.SUB;
            case STAR -> BinOp.MUL;
            case SLASH -> BinOp.DIV;
            case AND -> BinOp.AND;
            case OR -> BinOp.OR;
            case EQ_EQ -> BinOp.EQ;
            case EXCL_EQ -> BinOp.NEQ;
            case LT -> BinOp.LT;
            case LT_EQ -> BinOp.LEQ;
            case GT -> BinOp.GT;
            case GT_EQ -> BinOp.GEQ;
            case EQ -> BinOp.ASSIGN;
            case IN -> BinOp.IN;
            case PLUS_EQ -> BinOp.ADD_ASSIGN;
            case HYPH_EQ -> BinOp.SUB_ASSIGN;
            case STAR_EQ -> BinOp.MUL_ASSIGN;
            case SLASH_EQ -> BinOp.DIV_ASSIGN;
            default -> null;
        };
    }

    /**
     * The unary operator a token stands for, or {@code null}.
     */
    public static UnOp unOp(SyntaxKind kind) {
        return switch (kind) {
            case PLUS -> UnOp.POS;
            case MINUS -> UnOp.NEG;
            case NOT -> UnOp.NOT;
            default -> null;
        };
    }
}
