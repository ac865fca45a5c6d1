package org.tprobe.probeCompiler.ir.expression;

import org.tprobe.probeCompiler.compiler.errors.UnimplementedException;

/** This enum encodes the opcodes for unary and binary operations
 * of the probe language.  {@link #toString()} is the token used in source. */
public enum ProbeOpcode {
    // Unary operations
    LNOT("!", true),
    BNOT("~", true),
    NEG("-", true),
    // *ptr
    DEREF("*", true),
    INCREMENT("++", true),
    DECREMENT("--", true),

    // Binary operations
    EQ("==", false),
    NE("!=", false),
    LE("<=", false),
    GE(">=", false),
    LT("<", false),
    GT(">", false),
    LAND("&&", false),
    LOR("||", false),
    LEFT("<<", false),
    RIGHT(">>", false),
    PLUS("+", false),
    MINUS("-", false),
    MUL("*", false),
    DIV("/", false),
    MOD("%", false),
    BAND("&", false),
    BOR("|", false),
    BXOR("^", false),
    ;

    private final String text;
    public final boolean isUnary;

    ProbeOpcode(String text, boolean isUnary) {
        this.text = text;
        this.isUnary = isUnary;
    }

    @Override
    public String toString() {
        return this.text;
    }

    public boolean isComparison() {
        return switch (this) {
            case EQ, NE, LE, GE, LT, GT -> true;
            default -> false;
        };
    }

    /** Increment and decrement modify their operand. */
    public boolean hasSideEffects() {
        return this == INCREMENT || this == DECREMENT;
    }

    /** Map a source token back to its opcode.
     * @param text   Operator token.
     * @param unary  True for the unary operator with this token,
     *               since some tokens (e.g., "-") denote two operators. */
    public static ProbeOpcode fromText(String text, boolean unary) {
        for (ProbeOpcode opcode: ProbeOpcode.values()) {
            if (opcode.isUnary == unary && opcode.text.equals(text))
                return opcode;
        }
        throw new UnimplementedException("Unknown " + (unary ? "unary" : "binary") + " operator " + text);
    }
}
