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

/** {@code condition ? positive : negative} */
public final class TernaryExpression extends Expression {
    @Nullable
    public final Expression condition;
    @Nullable
    public final Expression positive;
    @Nullable
    public final Expression negative;

    public TernaryExpression(Expression condition, Expression positive, Expression negative,
                             SourcePositionRange position) {
        super(position);
        this.condition = condition;
        this.positive = positive;
        this.negative = negative;
    }

    public TernaryExpression(Expression condition, Expression positive, Expression negative) {
        this(condition, positive, negative, SourcePositionRange.INVALID);
    }

    private TernaryExpression(TernaryExpression other) {
        super(other);
        this.condition = null;
        this.positive = null;
        this.negative = null;
    }

    @Override
    public TernaryExpression leafcopy() {
        return new TernaryExpression(this);
    }

    @Override
    protected void releaseChildren() {
        release(this.condition);
        release(this.positive);
        release(this.negative);
    }

    @Override
    public void accept(InnerVisitor visitor) {
        VisitDecision decision = visitor.preorder(this);
        if (decision.stop()) return;
        visitor.push(this);
        if (this.condition != null) {
            visitor.property("condition");
            this.condition.accept(visitor);
        }
        if (this.positive != null) {
            visitor.property("positive");
            this.positive.accept(visitor);
        }
        if (this.negative != null) {
            visitor.property("negative");
            this.negative.accept(visitor);
        }
        visitor.pop(this);
        visitor.postorder(this);
    }

    @Override
    public IIndentStream toString(IIndentStream builder) {
        BinaryExpression.appendOperand(builder, this.condition);
        builder.append(" ? ");
        BinaryExpression.appendOperand(builder, this.positive);
        builder.append(" : ");
        return BinaryExpression.appendOperand(builder, this.negative);
    }
}
