package org.tprobe.probeCompiler.compiler.errors;

/** An error in the compiled program, as opposed to a bug in the compiler. */
public final class CompilationError extends BaseCompilerException {
    public CompilationError(String message) {
        this(message, SourcePositionRange.INVALID);
    }

    public CompilationError(String message, SourcePositionRange range) {
        super(message, range);
    }

    @Override
    public String getErrorKind() {
        return "Compilation error";
    }
}
