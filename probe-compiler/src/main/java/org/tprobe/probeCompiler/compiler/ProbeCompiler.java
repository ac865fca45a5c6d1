/*
 * Copyright 2022 VMware, Inc.
 * SPDX-License-Identifier: MIT
 *
 * Permission is hereby granted, free of charge, to any person obtaining a copy
 * of this software and associated documentation files (the "Software"), to deal
 * in the Software without restriction, including without limitation the rights
 * to use, copy, modify, merge, publish, distribute, sublicense, and/or sell
 * copies of the Software, and to permit persons to whom the Software is
 * furnished to do so, subject to the following conditions:
 *
 * The above copyright notice and this permission notice shall be included in all
 * copies or substantial portions of the Software.
 *
 * THE SOFTWARE IS PROVIDED "AS IS", WITHOUT WARRANTY OF ANY KIND, EXPRESS OR
 * IMPLIED, INCLUDING BUT NOT LIMITED TO THE WARRANTIES OF MERCHANTABILITY,
 * FITNESS FOR A PARTICULAR PURPOSE AND NONINFRINGEMENT. IN NO EVENT SHALL THE
 * AUTHORS OR COPYRIGHT HOLDERS BE LIABLE FOR ANY CLAIM, DAMAGES OR OTHER
 * LIABILITY, WHETHER IN AN ACTION OF CONTRACT, TORT OR OTHERWISE, ARISING FROM,
 * OUT OF OR IN CONNECTION WITH THE SOFTWARE OR THE USE OR OTHER DEALINGS IN THE
 * SOFTWARE.
 *
 *
 */

package org.tprobe.probeCompiler.compiler;

import org.tprobe.probeCompiler.compiler.errors.CompilationError;
import org.tprobe.probeCompiler.compiler.errors.CompilerMessages;
import org.tprobe.probeCompiler.compiler.errors.SourcePositionRange;
import org.tprobe.probeCompiler.compiler.visitors.expansion.IAttachPointResolver;
import org.tprobe.probeCompiler.compiler.visitors.expansion.ProbeExpansion;
import org.tprobe.probeCompiler.compiler.visitors.expansion.UnrollExpansion;
import org.tprobe.probeCompiler.compiler.visitors.inner.OwnershipChecker;
import org.tprobe.probeCompiler.ir.IProbeNode;
import org.tprobe.probeCompiler.ir.probe.Program;
import org.tprobe.util.IWritesLogs;
import org.tprobe.util.Logger;

import java.io.PrintStream;
import java.util.Map;

/** Runs the passes over the tree of a probe program and collects the problems they report. */
public class ProbeCompiler implements IErrorReporter, IWritesLogs, ICompilerComponent {
    public final CompilerOptions options;
    public final CompilerMessages messages;

    public ProbeCompiler(CompilerOptions options) {
        this.options = options;
        this.messages = new CompilerMessages(this);
        for (Map.Entry<String, String> entry: options.ioOptions.loggingLevel.entrySet()) {
            try {
                int level = Integer.parseInt(entry.getValue());
                Logger.INSTANCE.setLoggingLevel(entry.getKey(), level);
            } catch (NumberFormatException ex) {
                this.reportError(SourcePositionRange.INVALID, "Invalid option",
                        "-T option must be followed by 'class=number'; could not parse " + entry);
            }
        }
    }

    public ProbeCompiler() {
        this(new CompilerOptions());
    }

    @Override
    public ProbeCompiler compiler() {
        return this;
    }

    @Override
    public void reportProblem(IHasSourcePositionRange range, boolean warning, boolean continuation,
                              String errorType, String message) {
        this.messages.reportProblem(range, warning, continuation, errorType, message);
        if (!warning && this.options.languageOptions.throwOnError) {
            System.err.println(this.messages);
            throw new CompilationError("Error during compilation", range.getPositionRange());
        }
    }

    @Override
    public boolean hasErrors() {
        return this.messages.exitCode != 0;
    }

    public void showErrors(PrintStream stream) {
        this.messages.show(stream);
    }

    /** Check that every node of the tree is owned exactly once. */
    public void validate(IProbeNode node) {
        OwnershipChecker checker = new OwnershipChecker(this);
        checker.apply(node);
    }

    /** Unroll loops and create one probe per wildcard match.
     * The input program is not modified.
     * @param program  Program to expand.
     * @param resolver Finds the symbols matching a wildcard attach point.
     * @return A new program, which shares no nodes with the input. */
    public Program expand(Program program, IAttachPointResolver resolver) {
        Logger.INSTANCE.belowLevel(this, 1)
                .append("Expanding program with ")
                .append(program.probes == null ? 0 : program.probes.size())
                .append(" probes")
                .newline();
        UnrollExpansion unroll = new UnrollExpansion(this);
        Program unrolled = unroll.apply(program).to(Program.class);
        if (this.options.languageOptions.validate)
            this.validate(unrolled);
        ProbeExpansion expansion = new ProbeExpansion(this, resolver);
        Program result = expansion.apply(unrolled).to(Program.class);
        unrolled.release();
        if (this.options.languageOptions.validate)
            this.validate(result);
        return result;
    }
}
