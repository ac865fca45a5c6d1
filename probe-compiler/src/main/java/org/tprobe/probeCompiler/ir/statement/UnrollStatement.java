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
import org.tprobe.util.IIndentStream;

import javax.annotation.Nullable;
import java.util.List;

/** {@code unroll (n) { ... }}: the body is repeated n times. */
public final class UnrollStatement extends Statement {
    @Nullable
    public final Expression countExpression;
    @Nullable
    public final List<Statement> statements;
    /** Value of {@link #countExpression}, once it has been evaluated; 0 before. */
    public long count;

    public UnrollStatement(Expression countExpression, List<Statement> statements, SourcePositionRange position) {
        super(position);
        this.countExpression = countExpression;
        this.statements = List.copyOf(statements);
        this.count = 0;
    }

    public UnrollStatement(Expression countExpression, List<Statement> statements) {
        this(countExpression, statements, SourcePositionRange.INVALID);
    }

    private UnrollStatement(UnrollStatement other) {
        super(other);
        this.countExpression = null;
        this.statements = null;
        this.count = other.count;
    }

    @Override
    public UnrollStatement leafcopy() {
        return new UnrollStatement(this);
    }

    @Override
    protected void releaseChildren() {
        release(this.countExpression);
        releaseAll(this.statements);
    }

    @Override
    public void accept(InnerVisitor visitor) {
        VisitDecision decision = visitor.preorder(this);
        if (decision.stop()) return;
        visitor.push(this);
        if (this.countExpression != null) {
            visitor.property("countExpression");
            this.countExpression.accept(visitor);
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
        builder.append("unroll (");
        append(builder, this.countExpression).append(") ");
        return appendBlock(builder, this.statements);
    }
}
