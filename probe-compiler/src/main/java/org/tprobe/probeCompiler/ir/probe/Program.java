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

package org.tprobe.probeCompiler.ir.probe;

import org.tprobe.probeCompiler.compiler.errors.SourcePositionRange;
import org.tprobe.probeCompiler.compiler.visitors.VisitDecision;
import org.tprobe.probeCompiler.compiler.visitors.inner.InnerVisitor;
import org.tprobe.probeCompiler.ir.ProbeNode;
import org.tprobe.util.IIndentStream;

import javax.annotation.Nullable;
import java.util.List;

/** Root of the tree: C definitions included verbatim, followed by the probes. */
public final class Program extends ProbeNode {
    public final String cDefinitions;
    @Nullable
    public final List<Probe> probes;

    public Program(String cDefinitions, List<Probe> probes, SourcePositionRange position) {
        super(position);
        this.cDefinitions = cDefinitions;
        this.probes = List.copyOf(probes);
    }

    public Program(String cDefinitions, List<Probe> probes) {
        this(cDefinitions, probes, SourcePositionRange.INVALID);
    }

    private Program(Program other) {
        super(other);
        this.cDefinitions = other.cDefinitions;
        this.probes = null;
    }

    @Override
    public Program leafcopy() {
        return new Program(this);
    }

    @Override
    protected void releaseChildren() {
        releaseAll(this.probes);
    }

    @Override
    public void accept(InnerVisitor visitor) {
        VisitDecision decision = visitor.preorder(this);
        if (decision.stop()) return;
        visitor.push(this);
        if (this.probes != null) {
            visitor.property("probes");
            for (Probe probe: this.probes)
                probe.accept(visitor);
        }
        visitor.pop(this);
        visitor.postorder(this);
    }

    @Override
    public IIndentStream toString(IIndentStream builder) {
        if (!this.cDefinitions.isEmpty())
            builder.append(this.cDefinitions).newline();
        if (this.probes == null)
            return builder.append("<none>");
        for (Probe probe: this.probes)
            builder.append(probe).newline();
        return builder;
    }
}
