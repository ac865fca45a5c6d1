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

package org.tprobe.probeCompiler.ir.expression.literal;

import org.tprobe.probeCompiler.compiler.errors.SourcePositionRange;
import org.tprobe.probeCompiler.compiler.visitors.VisitDecision;
import org.tprobe.probeCompiler.compiler.visitors.inner.InnerVisitor;
import org.tprobe.util.IIndentStream;

/** A command-line argument of the script: {@code $1}, {@code $2}, ..., or {@code $#}. */
public final class PositionalParameter extends Literal {
    public enum Kind {
        /** $n */
        POSITIONAL,
        /** $#, the number of arguments */
        COUNT
    }

    public final Kind kind;
    public final long n;
    /** Set by semantic analysis when the parameter is used inside str(). */
    public boolean isInString;

    public PositionalParameter(Kind kind, long n, SourcePositionRange position) {
        super(position);
        this.kind = kind;
        this.n = n;
        this.isInString = false;
    }

    private PositionalParameter(PositionalParameter other) {
        super(other);
        this.kind = other.kind;
        this.n = other.n;
        this.isInString = other.isInString;
    }

    @Override
    public PositionalParameter leafcopy() {
        return new PositionalParameter(this);
    }

    @Override
    public void accept(InnerVisitor visitor) {
        VisitDecision decision = visitor.preorder(this);
        if (decision.stop()) return;
        visitor.push(this);
        visitor.pop(this);
        visitor.postorder(this);
    }

    @Override
    public IIndentStream toString(IIndentStream builder) {
        if (this.kind == Kind.COUNT)
            return builder.append("$#");
        return builder.append("$").append(this.n);
    }
}
