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

package org.tprobe.probeCompiler.ir;

import org.tprobe.probeCompiler.compiler.IHasSourcePositionRange;
import org.tprobe.probeCompiler.compiler.errors.InternalCompilerError;
import org.tprobe.probeCompiler.compiler.visitors.inner.InnerVisitor;
import org.tprobe.util.ICastable;
import org.tprobe.util.IHasId;
import org.tprobe.util.ToIndentableString;

import javax.annotation.CheckReturnValue;
import javax.annotation.Nullable;

/** A node of the abstract syntax tree of a probe program. */
public interface IProbeNode extends ICastable, IHasId, ToIndentableString, IHasSourcePositionRange {
    /** Double dispatch: invokes the visitor methods specific to the concrete node class. */
    void accept(InnerVisitor visitor);

    /** A copy of this node with the same scalar fields and no owned children. */
    @CheckReturnValue
    IProbeNode leafcopy();

    /** Release this node and every node it owns.  A node can be released only once. */
    void release();

    boolean isReleased();

    default <T> T checkNull(@Nullable T value) {
        if (value == null)
            throw new InternalCompilerError("Did not expect a null value", this);
        return value;
    }

    default boolean isExpression() {
        return false;
    }
}
