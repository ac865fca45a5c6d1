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

import org.tprobe.probeCompiler.compiler.errors.InternalCompilerError;
import org.tprobe.probeCompiler.compiler.errors.SourcePositionRange;
import org.tprobe.util.IndentStreamBuilder;
import org.tprobe.util.IIndentStream;

import javax.annotation.Nullable;
import java.util.List;

/** Base class for all tree nodes.
 *
 * <p>Ownership is explicit: each subclass releases, in {@link #releaseChildren()},
 * exactly the children it owns.  Back-references to other nodes are plain fields
 * which are never released. */
public abstract class ProbeNode implements IProbeNode {
    static long crtId = 0;
    public final long id;
    protected final SourcePositionRange position;
    private boolean released;

    protected ProbeNode(SourcePositionRange position) {
        this.id = crtId++;
        this.position = position;
        this.released = false;
    }

    /** Used by leafcopy: the copy has a fresh identity and lifecycle. */
    protected ProbeNode(ProbeNode other) {
        this(other.position);
    }

    /** Do not call this method!
     * It is only used for testing. */
    public static void reset() {
        crtId = 0;
    }

    @Override
    public long getId() {
        return this.id;
    }

    @Override
    public SourcePositionRange getPositionRange() {
        return this.position;
    }

    @Override
    public abstract ProbeNode leafcopy();

    @Override
    public final void release() {
        if (this.released)
            throw new InternalCompilerError("Node released twice: " + this, this);
        this.released = true;
        this.releaseChildren();
    }

    @Override
    public boolean isReleased() {
        return this.released;
    }

    /** Release the children owned by this node. */
    protected void releaseChildren() {}

    protected static void release(@Nullable IProbeNode node) {
        if (node != null)
            node.release();
    }

    protected static void releaseAll(@Nullable List<? extends IProbeNode> nodes) {
        if (nodes == null)
            return;
        for (IProbeNode node: nodes)
            node.release();
    }

    /** Print an owned child, which may be missing in a leafcopy. */
    protected static IIndentStream append(IIndentStream builder, @Nullable IProbeNode node) {
        if (node == null)
            return builder.append("<none>");
        return builder.append(node);
    }

    protected static IIndentStream append(IIndentStream builder, String separator,
                                          @Nullable List<? extends IProbeNode> nodes) {
        if (nodes == null)
            return builder.append("<none>");
        return builder.joinI(separator, nodes);
    }

    /** Print a brace-delimited block with one indented node per line. */
    protected static IIndentStream appendBlock(IIndentStream builder, @Nullable List<? extends IProbeNode> nodes) {
        builder.append("{").increase();
        if (nodes == null)
            builder.append("<none>").newline();
        else
            for (IProbeNode node: nodes)
                builder.append(node).newline();
        return builder.decrease().append("}");
    }

    @Override
    public String toString() {
        IndentStreamBuilder stream = new IndentStreamBuilder();
        this.toString(stream);
        return stream.toString();
    }
}
