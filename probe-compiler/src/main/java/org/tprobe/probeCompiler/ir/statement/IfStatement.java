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

/** A conditional.  An absent else branch ({@code elseStatements == null}) is
 * distinct from an empty one. */
public final class IfStatement extends Statement {
    @Nullable
    public final Expression condition;
    @Nullable
    public final List<Statement> statements;
    @Nullable
    public final List<Statement> elseStatements;

    public IfStatement(Expression condition, List<Statement> statements,
                       @Nullable List<Statement> elseStatements, SourcePositionRange position) {
        super(position);
        this.condition = condition;
        this.statements = List.copyOf(statements);
        this.elseStatements = elseStatements == null ? null : List.copyOf(elseStatements);
    }

    public IfStatement(Expression condition, List<Statement> statements, @Nullable List<Statement> elseStatements) {
        this(condition, statements, elseStatements, SourcePositionRange.INVALID);
    }

    public IfStatement(Expression condition, List<Statement> statements) {
        this(condition, statements, null);
    }

    private IfStatement(IfStatement other) {
        super(other);
        this.condition = null;
        this.statements = null;
        this.elseStatements = null;
    }

    @Override
    public IfStatement leafcopy() {
        return new IfStatement(this);
    }

    public boolean hasElse() {
        return this.elseStatements != null;
    }

    @Override
    protected void releaseChildren() {
        release(this.condition);
        releaseAll(this.statements);
        releaseAll(this.elseStatements);
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
        if (this.statements != null) {
            visitor.property("statements");
            for (Statement statement: this.statements)
                statement.accept(visitor);
        }
        if (this.elseStatements != null) {
            visitor.property("elseStatements");
            for (Statement statement: this.elseStatements)
                statement.accept(visitor);
        }
        visitor.pop(this);
        visitor.postorder(this);
    }

    @Override
    public IIndentStream toString(IIndentStream builder) {
        builder.append("if (");
        append(builder, this.condition).append(") ");
        appendBlock(builder, this.statements);
        if (this.hasElse()) {
            builder.append(" else ");
            appendBlock(builder, this.elseStatements);
        }
        return builder;
    }
}
