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

/** Array element access: {@code expression[index]}. */
public final class IndexExpression extends Expression {
    @Nullable
    public final Expression expression;
    @Nullable
    public final Expression index;

    public IndexExpression(Expression expression, Expression index, SourcePositionRange position) {
        super(position);
        this.expression = expression;
        this.index = index;
    }

    public IndexExpression(Expression expression, Expression index) {
        this(expression, index, SourcePositionRange.INVALID);
    }

    private IndexExpression(IndexExpression other) {
        super(other);
        this.expression = null;
        this.index = null;
    }

    @Override
    public IndexExpression leafcopy() {
        return new IndexExpression(this);
    }

    @Override
    protected void releaseChildren() {
        release(this.expression);
        release(this.index);
    }

    @Override
    public void accept(InnerVisitor visitor) {
        VisitDecision decision = visitor.preorder(this);
        if (decision.stop()) return;
        visitor.push(this);
        if (this.expression != null) {
            visitor.property("expression");
            this.expression.accept(visitor);
        }
        if (this.index != null) {
            visitor.property("index");
            this.index.accept(visitor);
        }
        visitor.pop(this);
        visitor.postorder(this);
    }

    @Override
    public IIndentStream toString(IIndentStream builder) {
        BinaryExpression.appendOperand(builder, this.expression);
        builder.append("[");
        append(builder, this.index);
        return builder.append("]");
    }
}
