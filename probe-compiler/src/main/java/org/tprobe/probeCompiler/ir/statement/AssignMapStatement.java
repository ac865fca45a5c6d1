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
import org.tprobe.probeCompiler.ir.expression.Expression;
import org.tprobe.probeCompiler.ir.expression.MapExpression;
import org.tprobe.util.IIndentStream;

import javax.annotation.Nullable;

/** {@code @map[keys] = expression}.
 *
 * <p>A compound assignment such as {@code @m += 1} is represented with
 * {@code expression = @m + 1}; the map node then belongs to the expression
 * and the statement holds a second reference to it. */
public final class AssignMapStatement extends Statement {
    @Nullable
    public final MapExpression map;
    @Nullable
    public final Expression expression;
    public final boolean compound;

    public AssignMapStatement(MapExpression map, Expression expression, boolean compound,
                              SourcePositionRange position) {
        super(position);
        this.map = map;
        this.expression = expression;
        this.compound = compound;
        expression.map = map;
    }

    public AssignMapStatement(MapExpression map, Expression expression) {
        this(map, expression, false, SourcePositionRange.INVALID);
    }

    private AssignMapStatement(AssignMapStatement other) {
        super(other);
        this.map = null;
        this.expression = null;
        this.compound = other.compound;
    }

    @Override
    public AssignMapStatement leafcopy() {
        return new AssignMapStatement(this);
    }

    /** True if releasing this statement must release the map too. */
    public boolean ownsTarget() {
        return !this.compound;
    }

    @Override
    protected void releaseChildren() {
        if (this.ownsTarget())
            release(this.map);
        release(this.expression);
    }

    @Override
    public void accept(InnerVisitor visitor) {
        VisitDecision decision = visitor.preorder(this);
        if (decision.stop()) return;
        visitor.push(this);
        if (this.map != null) {
            visitor.property("map");
            this.map.accept(visitor);
        }
        if (this.expression != null) {
            visitor.property("expression");
            this.expression.accept(visitor);
        }
        visitor.pop(this);
        visitor.postorder(this);
    }

    @Override
    public IIndentStream toString(IIndentStream builder) {
        return AssignVarStatement.appendAssignment(builder, this.map, this.expression, this.compound);
    }
}
