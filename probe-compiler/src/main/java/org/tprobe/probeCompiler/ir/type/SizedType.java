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

package org.tprobe.probeCompiler.ir.type;

import java.util.Objects;

/** The resolved type of an expression.  Written by semantic analysis;
 * every expression starts with {@link #NONE}. */
public final class SizedType {
    public static final SizedType NONE = new SizedType(ProbeTypeCode.NONE, 0, false);

    public final ProbeTypeCode code;
    /** Size in bytes. */
    public final long size;
    public final boolean isSigned;

    public SizedType(ProbeTypeCode code, long size, boolean isSigned) {
        this.code = code;
        this.size = size;
        this.isSigned = isSigned;
    }

    public static SizedType integer(long size, boolean isSigned) {
        return new SizedType(ProbeTypeCode.INTEGER, size, isSigned);
    }

    public static SizedType string(long size) {
        return new SizedType(ProbeTypeCode.STRING, size, false);
    }

    public boolean isNone() {
        return this.code == ProbeTypeCode.NONE;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        SizedType that = (SizedType) o;
        return this.size == that.size && this.isSigned == that.isSigned && this.code == that.code;
    }

    @Override
    public int hashCode() {
        return Objects.hash(this.code, this.size, this.isSigned);
    }

    @Override
    public String toString() {
        return switch (this.code) {
            case INTEGER -> (this.isSigned ? "int" : "uint") + (8 * this.size);
            case STRING -> "string[" + this.size + "]";
            default -> this.code.toString();
        };
    }
}
