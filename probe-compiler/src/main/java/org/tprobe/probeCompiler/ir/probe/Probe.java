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
import org.tprobe.probeCompiler.ir.statement.Statement;
import org.tprobe.util.IIndentStream;
import org.tprobe.util.Linq;

import javax.annotation.Nullable;
import java.util.List;

/** A probe: attach points, an optional predicate, and a body. */
public final class Probe extends ProbeNode {
    @Nullable
    public final List<AttachPoint> attachPoints;
    @Nullable
    public final Predicate predicate;
    @Nullable
    public final List<Statement> statements;
    /** A separate program must be generated for each wildcard match. */
    public boolean needExpansion;
    /** Structures describing tracepoint arguments must be imported. */
    public boolean needTracepointArgsStructs;
    private int index;

    public Probe(List<AttachPoint> attachPoints, @Nullable Predicate predicate,
                 List<Statement> statements, SourcePositionRange position) {
        super(position);
        this.attachPoints = List.copyOf(attachPoints);
        this.predicate = predicate;
        this.statements = List.copyOf(statements);
        this.needExpansion = false;
        this.needTracepointArgsStructs = false;
        this.index = 0;
    }

    public Probe(List<AttachPoint> attachPoints, @Nullable Predicate predicate, List<Statement> statements) {
        this(attachPoints, predicate, statements, SourcePositionRange.INVALID);
    }

    private Probe(Probe other) {
        super(other);
        this.attachPoints = null;
        this.predicate = null;
        this.statements = null;
        this.needExpansion = other.needExpansion;
        this.needTracepointArgsStructs = other.needTracepointArgsStructs;
        this.index = other.index;
    }

    @Override
    public Probe leafcopy() {
        return new Probe(this);
    }

    /** Comma-separated names of all attach points. */
    public String name() {
        if (this.attachPoints == null)
            return "";
        return String.join(",", Linq.map(this.attachPoints, ap -> ap.name(ap.function)));
    }

    public int index() {
        return this.index;
    }

    public void setIndex(int index) {
        this.index = index;
    }

    @Override
    protected void releaseChildren() {
        releaseAll(this.attachPoints);
        release(this.predicate);
        releaseAll(this.statements);
    }

    @Override
    public void accept(InnerVisitor visitor) {
        VisitDecision decision = visitor.preorder(this);
        if (decision.stop()) return;
        visitor.push(this);
        if (this.attachPoints != null) {
            visitor.property("attachPoints");
            for (AttachPoint attachPoint: this.attachPoints)
                attachPoint.accept(visitor);
        }
        if (this.predicate != null) {
            visitor.property("predicate");
            this.predicate.accept(visitor);
        }
        if (this.statements != null) {
            visitor.property("statements");
            for (Statement statement: this.statements)
                statement.accept(visitor);
        }
        visitor.pop(this);
        visitor.postorder(this);
    }

    @Override
    public IIndentStream toString(IIndentStream builder) {
        append(builder, ", ", this.attachPoints);
        if (this.predicate != null)
            builder.append(" ").append(this.predicate);
        builder.append(" ");
        return appendBlock(builder, this.statements);
    }
}
