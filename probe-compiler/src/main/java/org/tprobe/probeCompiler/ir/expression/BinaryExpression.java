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

public final class BinaryExpression extends Expression {
    @Nullable
    public final Expression left;
    public final ProbeOpcode opcode;
    @Nullable
    public final Expression right;

    public BinaryExpression(Expression left, ProbeOpcode opcode, Expression right, SourcePositionRange position) {
        super(position);
        this.left = left;
        this.opcode = opcode;
        this.right = right;
    }

    public BinaryExpression(Expression left, ProbeOpcode opcode, Expression right) {
        this(left, opcode, right, SourcePositionRange.INVALID);
    }

    private BinaryExpression(BinaryExpression other) {
        super(other);
        this.left = null;
        this.opcode = other.opcode;
        this.right = null;
    }

    @Override
    public BinaryExpression leafcopy() {
        return new BinaryExpression(this);
    }

    public String opstr() {
        return this.opcode.toString();
    }

    @Override
    protected void releaseChildren() {
        release(this.left);
        release(this.right);
    }

    @Override
    public void accept(InnerVisitor visitor) {
        VisitDecision decision = visitor.preorder(this);
        if (decision.stop()) return;
        visitor.push(this);
        if (this.left != null) {
            visitor.property("left");
            this.left.accept(visitor);
        }
        if (this.right != null) {
            visitor.property("right");
            this.right.accept(visitor);
        }
        visitor.pop(this);
        visitor.postorder(this);
    }

    static IIndentStream appendOperand(IIndentStream builder, @Nullable Expression operand) {
        boolean parens = operand instanceof BinaryExpression || operand instanceof TernaryExpression;
        if (parens)
            builder.append("(");
        append(builder, operand);
        if (parens)
            builder.append(")");
        return builder;
    }

    @Override
    public IIndentStream toString(IIndentStream builder) {
        appendOperand(builder, this.left);
        builder.append(" ")
                .append(this.opstr())
                .append(" ");
        return appendOperand(builder, this.right);
    }
}
