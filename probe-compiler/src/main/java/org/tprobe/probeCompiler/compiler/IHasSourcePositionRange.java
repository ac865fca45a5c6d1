package org.tprobe.probeCompiler.compiler;

import org.tprobe.probeCompiler.compiler.errors.SourcePositionRange;

public interface IHasSourcePositionRange {
    SourcePositionRange getPositionRange();
}
