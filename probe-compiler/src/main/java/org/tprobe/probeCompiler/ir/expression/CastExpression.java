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

package org.tprobe.probeCompiler.ir.expression;

import org.tprobe.probeCompiler.compiler.errors.SourcePositionRange;
import org.tprobe.probeCompiler.compiler.visitors.VisitDecision;
import org.tprobe.probeCompiler.compiler.visitors.inner.InnerVisitor;
import org.tprobe.util.IIndentStream;

import javax.annotation.Nullable;

/** A C-style cast, e.g. {@code (struct task_struct *)curtask}. */
public final class CastExpression extends Expression {
    /** Name of the target type, without the pointer markers. */
    public final String castType;
    public final boolean isPointer;
    public final boolean isDoublePointer;
    @Nullable
    public final Expression source;

    public CastExpression(String castType, boolean isPointer, boolean isDoublePointer,
                          Expression source, SourcePositionRange position) {
        super(position);
        this.castType = castType;
        this.isPointer = isPointer;
        this.isDoublePointer = isDoublePointer;
        this.source = source;
    }

    public CastExpression(String castType, boolean isPointer, Expression source) {
        this(castType, isPointer, false, source, SourcePositionRange.INVALID);
    }

    private CastExpression(CastExpression other) {
        super(other);
        this.castType = other.castType;
        this.isPointer = other.isPointer;
        this.isDoublePointer = other.isDoublePointer;
        this.source = null;
    }

    @Override
    public CastExpression leafcopy() {
        return new CastExpression(this);
    }

    @Override
    protected void releaseChildren() {
        release(this.source);
    }

    @Override
    public void accept(InnerVisitor visitor) {
        VisitDecision decision = visitor.preorder(this);
        if (decision.stop()) return;
        visitor.push(this);
        if (this.source != null) {
            visitor.property("source");
            this.source.accept(visitor);
        }
        visitor.pop(this);
        visitor.postorder(this);
    }

    @Override
    public IIndentStream toString(IIndentStream builder) {
        builder.append("(").append(this.castType);
        if (this.isDoublePointer)
            builder.append(" **");
        else if (this.isPointer)
            builder.append(" *");
        builder.append(")");
        return BinaryExpression.appendOperand(builder, this.source);
    }
}
