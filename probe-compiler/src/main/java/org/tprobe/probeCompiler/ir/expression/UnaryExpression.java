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

public final class UnaryExpression extends Expression {
    public final ProbeOpcode opcode;
    @Nullable
    public final Expression operand;
    /** True for {@code x++} and {@code x--}. */
    public final boolean isPostOp;

    public UnaryExpression(ProbeOpcode opcode, Expression operand, boolean isPostOp, SourcePositionRange position) {
        super(position);
        this.opcode = opcode;
        this.operand = operand;
        this.isPostOp = isPostOp;
    }

    public UnaryExpression(ProbeOpcode opcode, Expression operand) {
        this(opcode, operand, false, SourcePositionRange.INVALID);
    }

    private UnaryExpression(UnaryExpression other) {
        super(other);
        this.opcode = other.opcode;
        this.operand = null;
        this.isPostOp = other.isPostOp;
    }

    @Override
    public UnaryExpression leafcopy() {
        return new UnaryExpression(this);
    }

    public String opstr() {
        return this.opcode.toString();
    }

    @Override
    protected void releaseChildren() {
        release(this.operand);
    }

    @Override
    public void accept(InnerVisitor visitor) {
        VisitDecision decision = visitor.preorder(this);
        if (decision.stop()) return;
        visitor.push(this);
        if (this.operand != null) {
            visitor.property("operand");
            this.operand.accept(visitor);
        }
        visitor.pop(this);
        visitor.postorder(this);
    }

    @Override
    public IIndentStream toString(IIndentStream builder) {
        if (this.isPostOp)
            return BinaryExpression.appendOperand(builder, this.operand).append(this.opstr());
        builder.append(this.opstr());
        return BinaryExpression.appendOperand(builder, this.operand);
    }
}
