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

package org.tprobe.probeCompiler.compiler.errors;

import org.tprobe.probeCompiler.ir.IProbeNode;

import javax.annotation.Nullable;

/** Exception thrown when the compiler encounters a construct
 * that it does not know how to handle. */
public class UnimplementedException extends BaseCompilerException {
    @Nullable
    public final IProbeNode probeNode;

    public static final String KIND = "Not yet implemented";

    protected UnimplementedException(String message, @Nullable IProbeNode node, SourcePositionRange range) {
        super(message, range);
        this.probeNode = node;
    }

    public UnimplementedException() {
        this(KIND, null, SourcePositionRange.INVALID);
    }

    public UnimplementedException(String message) {
        this(message, null, SourcePositionRange.INVALID);
    }

    public UnimplementedException(String message, IProbeNode node) {
        this(message + " " + node.getClass().getSimpleName() + ":" + node,
                node, node.getPositionRange());
    }

    @Override
    public String getErrorKind() {
        return KIND;
    }
}
