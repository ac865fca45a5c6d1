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

/** A builtin variable such as {@code pid}, {@code comm} or {@code arg0}. */
public final class BuiltinExpression extends Expression {
    public final String identifier;
    /** Index of the probe using this builtin; assigned by code generation. */
    public int probeId;

    public BuiltinExpression(String identifier, SourcePositionRange position) {
        super(position);
        this.identifier = identifier;
        this.probeId = 0;
    }

    public BuiltinExpression(String identifier) {
        this(identifier, SourcePositionRange.INVALID);
    }

    private BuiltinExpression(BuiltinExpression other) {
        super(other);
        this.identifier = other.identifier;
        this.probeId = other.probeId;
    }

    @Override
    public BuiltinExpression leafcopy() {
        return new BuiltinExpression(this);
    }

    @Override
    public void accept(InnerVisitor visitor) {
        VisitDecision decision = visitor.preorder(this);
        if (decision.stop()) return;
        visitor.push(this);
        visitor.pop(this);
        visitor.postorder(this);
    }

    @Override
    public IIndentStream toString(IIndentStream builder) {
        return builder.append(this.identifier);
    }
}
