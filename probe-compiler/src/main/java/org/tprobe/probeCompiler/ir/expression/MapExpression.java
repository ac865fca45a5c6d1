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

/** A reference to a map, optionally indexed by keys: {@code @name[k1, k2]}.
 * The identifier includes the leading '@'. */
public final class MapExpression extends Expression {
    public final String identifier;
    @Nullable
    public final List<Expression> keys;
    public boolean skipKeyValidation;

    public MapExpression(String identifier, @Nullable List<Expression> keys, SourcePositionRange position) {
        super(position, false, false, true);
        this.identifier = identifier;
        this.keys = keys == null ? null : List.copyOf(keys);
        this.skipKeyValidation = false;
        if (keys != null) {
            for (Expression key: keys)
                key.keyForMap = this;
        }
    }

    public MapExpression(String identifier, @Nullable List<Expression> keys) {
        this(identifier, keys, SourcePositionRange.INVALID);
    }

    public MapExpression(String identifier) {
        this(identifier, null);
    }

    private MapExpression(MapExpression other) {
        super(other);
        this.identifier = other.identifier;
        this.keys = null;
        this.skipKeyValidation = other.skipKeyValidation;
    }

    @Override
    public MapExpression leafcopy() {
        return new MapExpression(this);
    }

    @Override
    protected void releaseChildren() {
        releaseAll(this.keys);
    }

    @Override
    public void accept(InnerVisitor visitor) {
        VisitDecision decision = visitor.preorder(this);
        if (decision.stop()) return;
        visitor.push(this);
        if (this.keys != null) {
            visitor.property("keys");
            for (Expression key: this.keys)
                key.accept(visitor);
        }
        visitor.pop(this);
        visitor.postorder(this);
    }

    @Override
    public IIndentStream toString(IIndentStream builder) {
        builder.append(this.identifier);
        if (this.keys == null)
            return builder;
        return builder.append("[")
                .joinI(", ", this.keys)
                .append("]");
    }
}
