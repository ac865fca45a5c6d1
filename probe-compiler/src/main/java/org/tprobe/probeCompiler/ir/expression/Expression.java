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
import org.tprobe.probeCompiler.ir.ProbeNode;
import org.tprobe.probeCompiler.ir.type.SizedType;

import javax.annotation.Nullable;

/** Base class for all expressions.
 *
 * <p>{@link #keyForMap}, {@link #map} and {@link #variable} point at nodes owned
 * elsewhere in the tree; they are never released together with this expression. */
public abstract class Expression extends ProbeNode {
    /** Resolved type; NONE until semantic analysis has run. */
    public SizedType type;
    /** Map which uses this expression as a key. */
    @Nullable
    public MapExpression keyForMap;
    /** Only set when this expression is assigned to a map. */
    @Nullable
    public MapExpression map;
    /** Only set when this expression is assigned to a variable. */
    @Nullable
    public VariableExpression variable;
    public final boolean isLiteral;
    public final boolean isVariable;
    public final boolean isMap;

    protected Expression(SourcePositionRange position, boolean isLiteral, boolean isVariable, boolean isMap) {
        super(position);
        this.type = SizedType.NONE;
        this.isLiteral = isLiteral;
        this.isVariable = isVariable;
        this.isMap = isMap;
    }

    protected Expression(SourcePositionRange position) {
        this(position, false, false, false);
    }

    protected Expression(Expression other) {
        super(other);
        this.type = other.type;
        this.keyForMap = other.keyForMap;
        this.map = other.map;
        this.variable = other.variable;
        this.isLiteral = other.isLiteral;
        this.isVariable = other.isVariable;
        this.isMap = other.isMap;
    }

    @Override
    public boolean isExpression() {
        return true;
    }

    @Override
    public abstract Expression leafcopy();

    public SizedType getType() {
        return this.type;
    }
}
