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

package org.tprobe.probeCompiler.ir.statement;

import org.tprobe.probeCompiler.compiler.errors.SourcePositionRange;
import org.tprobe.probeCompiler.compiler.visitors.VisitDecision;
import org.tprobe.probeCompiler.compiler.visitors.inner.InnerVisitor;
import org.tprobe.probeCompiler.ir.expression.BinaryExpression;
import org.tprobe.probeCompiler.ir.expression.Expression;
import org.tprobe.probeCompiler.ir.expression.VariableExpression;
import org.tprobe.util.IIndentStream;

import javax.annotation.Nullable;

/** {@code $variable = expression}.  Compound assignments are represented
 * as in {@link AssignMapStatement}. */
public final class AssignVarStatement extends Statement {
    @Nullable
    public final VariableExpression variable;
    @Nullable
    public final Expression expression;
    public final boolean compound;

    public AssignVarStatement(VariableExpression variable, Expression expression, boolean compound,
                              SourcePositionRange position) {
        super(position);
        this.variable = variable;
        this.expression = expression;
        this.compound = compound;
        expression.variable = variable;
    }

    public AssignVarStatement(VariableExpression variable, Expression expression) {
        this(variable, expression, false, SourcePositionRange.INVALID);
    }

    private AssignVarStatement(AssignVarStatement other) {
        super(other);
        this.variable = null;
        this.expression = null;
        this.compound = other.compound;
    }

    @Override
    public AssignVarStatement leafcopy() {
        return new AssignVarStatement(this);
    }

    /** True if releasing this statement must release the variable too. */
    public boolean ownsTarget() {
        return !this.compound;
    }

    @Override
    protected void releaseChildren() {
        if (this.ownsTarget())
            release(this.variable);
        release(this.expression);
    }

    @Override
    public void accept(InnerVisitor visitor) {
        VisitDecision decision = visitor.preorder(this);
        if (decision.stop()) return;
        visitor.push(this);
        if (this.variable != null) {
            visitor.property("variable");
            this.variable.accept(visitor);
        }
        if (this.expression != null) {
            visitor.property("expression");
            this.expression.accept(visitor);
        }
        visitor.pop(this);
        visitor.postorder(this);
    }

    static IIndentStream appendAssignment(IIndentStream builder, @Nullable Expression target,
                                          @Nullable Expression expression, boolean compound) {
        append(builder, target);
        if (compound && expression instanceof BinaryExpression) {
            BinaryExpression binary = (BinaryExpression) expression;
            if (binary.left == target) {
                builder.append(" ").append(binary.opstr()).append("= ");
                return append(builder, binary.right).append(";");
            }
        }
        builder.append(" = ");
        return append(builder, expression).append(";");
    }

    @Override
    public IIndentStream toString(IIndentStream builder) {
        return appendAssignment(builder, this.variable, this.expression, this.compound);
    }
}
