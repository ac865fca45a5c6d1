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
import java.util.List;

/** A call to a builtin function.  {@link #arguments} is null when the call has no parentheses. */
public final class CallExpression extends Expression {
    public final String function;
    @Nullable
    public final List<Expression> arguments;

    public CallExpression(String function, @Nullable List<Expression> arguments, SourcePositionRange position) {
        super(position);
        this.function = function;
        this.arguments = arguments == null ? null : List.copyOf(arguments);
    }

    public CallExpression(String function, @Nullable List<Expression> arguments) {
        this(function, arguments, SourcePositionRange.INVALID);
    }

    private CallExpression(CallExpression other) {
        super(other);
        this.function = other.function;
        this.arguments = null;
    }

    @Override
    public CallExpression leafcopy() {
        return new CallExpression(this);
    }

    @Override
    protected void releaseChildren() {
        releaseAll(this.arguments);
    }

    @Override
    public void accept(InnerVisitor visitor) {
        VisitDecision decision = visitor.preorder(this);
        if (decision.stop()) return;
        visitor.push(this);
        if (this.arguments != null) {
            visitor.property("arguments");
            for (Expression argument: this.arguments)
                argument.accept(visitor);
        }
        visitor.pop(this);
        visitor.postorder(this);
    }

    @Override
    public IIndentStream toString(IIndentStream builder) {
        builder.append(this.function);
        if (this.arguments == null)
            return builder;
        return builder.append("(")
                .joinI(", ", this.arguments)
                .append(")");
    }
}
