package org.tprobe.probeCompiler.ir.statement;

import org.tprobe.probeCompiler.compiler.errors.UnimplementedException;

public enum JumpKind {
    RETURN("return"),
    BREAK("break"),
    CONTINUE("continue");

    private final String text;

    JumpKind(String text) {
        this.text = text;
    }

    @Override
    public String toString() {
        return this.text;
    }

    public static JumpKind fromText(String text) {
        for (JumpKind kind: JumpKind.values())
            if (kind.text.equals(text))
                return kind;
        throw new UnimplementedException("Unknown jump statement " + text);
    }
}
