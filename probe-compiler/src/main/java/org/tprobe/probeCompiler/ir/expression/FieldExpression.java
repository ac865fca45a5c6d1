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

/** Access to a record field by name ({@code e.name}) or to a tuple element by position ({@code e.0}). */
public final class FieldExpression extends Expression {
    @Nullable
    public final Expression expression;
    public final String field;
    /** Position of the tuple element, or -1 when the field is accessed by name. */
    public final int index;

    public FieldExpression(Expression expression, String field, SourcePositionRange position) {
        super(position);
        this.expression = expression;
        this.field = field;
        this.index = -1;
    }

    public FieldExpression(Expression expression, int index, SourcePositionRange position) {
        super(position);
        this.expression = expression;
        this.field = "";
        this.index = index;
    }

    public FieldExpression(Expression expression, String field) {
        this(expression, field, SourcePositionRange.INVALID);
    }

    private FieldExpression(FieldExpression other) {
        super(other);
        this.expression = null;
        this.field = other.field;
        this.index = other.index;
    }

    @Override
    public FieldExpression leafcopy() {
        return new FieldExpression(this);
    }

    public boolean isTupleAccess() {
        return this.index >= 0;
    }

    @Override
    protected void releaseChildren() {
        release(this.expression);
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
        visitor.pop(this);
        visitor.postorder(this);
    }

    @Override
    public IIndentStream toString(IIndentStream builder) {
        BinaryExpression.appendOperand(builder, this.expression);
        builder.append(".");
        if (this.isTupleAccess())
            return builder.append(this.index);
        return builder.append(this.field);
    }
}
