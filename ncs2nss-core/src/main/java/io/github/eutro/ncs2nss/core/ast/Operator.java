package io.github.eutro.ncs2nss.core.ast;

/**
 * The operators of NWScript, with C-like precedence: higher binds tighter.
 */
public enum Operator {
    MUL("*", 12),
    DIV("/", 12),
    MOD("%", 12),
    ADD("+", 11),
    SUB("-", 11),
    SHL("<<", 10),
    SHR(">>", 10),
    USHR(">>>", 10),
    LT("<", 9),
    LEQ("<=", 9),
    GT(">", 9),
    GEQ(">=", 9),
    EQ("==", 8),
    NEQ("!=", 8),
    BIT_AND("&", 7),
    BIT_XOR("^", 6),
    BIT_OR("|", 5),
    LOG_AND("&&", 4),
    LOG_OR("||", 3),
    NEG("-", 13),
    NOT("!", 13),
    COMP("~", 13),
    ;

    public static final int UNARY_PRECEDENCE = 13;
    public static final int ASSIGN_PRECEDENCE = 1;

    public final String symbol;
    public final int precedence;

    Operator(String symbol, int precedence) {
        this.symbol = symbol;
        this.precedence = precedence;
    }

    public boolean isUnary() {
        return precedence == UNARY_PRECEDENCE;
    }

    public boolean isComparison() {
        return precedence == 8 || precedence == 9;
    }

    /**
     * Whether {@code (a op b) op c == a op (b op c)}, so a right operand of the same operator needs no parentheses.
     *
     * @return Whether the operator is associative.
     */
    public boolean isAssociative() {
        switch (this) {
            case MUL:
            case ADD:
            case BIT_AND:
            case BIT_XOR:
            case BIT_OR:
            case LOG_AND:
            case LOG_OR:
                return true;
            default:
                return false;
        }
    }

    /**
     * Get the comparison that holds exactly when this one does not.
     *
     * @return The inverse, or null if this is not a comparison.
     */
    public Operator inverse() {
        switch (this) {
            case LT:
                return GEQ;
            case GEQ:
                return LT;
            case GT:
                return LEQ;
            case LEQ:
                return GT;
            case EQ:
                return NEQ;
            case NEQ:
                return EQ;
            default:
                return null;
        }
    }
}
