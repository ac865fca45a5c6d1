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

package org.tprobe.probeCompiler.ir.probe;

import org.tprobe.probeCompiler.compiler.errors.SourcePositionRange;
import org.tprobe.probeCompiler.compiler.visitors.VisitDecision;
import org.tprobe.probeCompiler.compiler.visitors.inner.InnerVisitor;
import org.tprobe.probeCompiler.ir.ProbeNode;
import org.tprobe.util.IIndentStream;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Where a probe attaches, e.g. {@code kprobe:vfs_read} or {@code uprobe:/bin/sh:readline+8}.
 * The parser fills in the individual components from {@link #rawInput}.
 */
public final class AttachPoint extends ProbeNode {
    /** Unparsed text written by the user. */
    public final String rawInput;
    public String provider;
    public String target;
    public String namespace;
    public String function;
    /** Resolved USDT probe, used for arguments of wildcard matches. */
    public UsdtProbeEntry usdt;
    public int frequency;
    /** For watchpoints: width of the watched address. */
    public long length;
    /** For watchpoints: access mode, e.g. "rw". */
    public String mode;
    /** True if the function contains a wildcard that must be resolved against the symbols of the target. */
    public boolean needExpansion;
    public long address;
    public long functionOffset;
    /** Index of each attachment name, in the order the names were first indexed. */
    private final Map<String, Integer> indexes;

    public AttachPoint(String rawInput, SourcePositionRange position) {
        super(position);
        this.rawInput = rawInput;
        this.provider = "";
        this.target = "";
        this.namespace = "";
        this.function = "";
        this.usdt = UsdtProbeEntry.EMPTY;
        this.frequency = 0;
        this.length = 0;
        this.mode = "";
        this.needExpansion = false;
        this.address = 0;
        this.functionOffset = 0;
        this.indexes = new LinkedHashMap<>();
    }

    public AttachPoint(String rawInput) {
        this(rawInput, SourcePositionRange.INVALID);
    }

    private AttachPoint(AttachPoint other) {
        super(other);
        this.rawInput = other.rawInput;
        this.provider = other.provider;
        this.target = other.target;
        this.namespace = other.namespace;
        this.function = other.function;
        this.usdt = other.usdt;
        this.frequency = other.frequency;
        this.length = other.length;
        this.mode = other.mode;
        this.needExpansion = other.needExpansion;
        this.address = other.address;
        this.functionOffset = other.functionOffset;
        this.indexes = new LinkedHashMap<>(other.indexes);
    }

    @Override
    public AttachPoint leafcopy() {
        return new AttachPoint(this);
    }

    public String name(String attachPoint) {
        return this.name(this.target, attachPoint);
    }

    /** The canonical name of this attach point when attached to the specified target and point. */
    public String name(String attachTarget, String attachPoint) {
        StringBuilder builder = new StringBuilder(this.provider);
        if (!attachTarget.isEmpty())
            builder.append(":").append(attachTarget);
        if (!this.namespace.isEmpty())
            builder.append(":").append(this.namespace);
        if (!attachPoint.isEmpty()) {
            builder.append(":").append(attachPoint);
            if (this.functionOffset != 0)
                builder.append("+").append(Long.toUnsignedString(this.functionOffset));
        }
        if (this.address != 0)
            builder.append(":").append(Long.toUnsignedString(this.address));
        if (this.frequency != 0)
            builder.append(":").append(this.frequency);
        if (this.length != 0)
            builder.append(":").append(Long.toUnsignedString(this.length));
        if (!this.mode.isEmpty())
            builder.append(":").append(this.mode);
        return builder.toString();
    }

    /** Index assigned to the specified name, 0 if none was assigned. */
    public int index(String name) {
        return this.indexes.getOrDefault(name, 0);
    }

    public void setIndex(String name, int index) {
        this.indexes.put(name, index);
    }

    /** Names which have an index, in the order they were first indexed. */
    public List<String> indexedNames() {
        return new ArrayList<>(this.indexes.keySet());
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
        if (this.provider.isEmpty())
            return builder.append(this.rawInput);
        return builder.append(this.name(this.function));
    }
}
