package org.tprobe.probeCompiler.compiler;

/** A component which is part of a compilation. */
public interface ICompilerComponent {
    ProbeCompiler compiler();
}
