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

package org.tprobe.probeCompiler.compiler.visitors.inner;

import org.tprobe.probeCompiler.compiler.ProbeCompiler;
import org.tprobe.probeCompiler.compiler.errors.InternalCompilerError;
import org.tprobe.probeCompiler.compiler.visitors.VisitDecision;
import org.tprobe.probeCompiler.ir.IProbeNode;
import org.tprobe.probeCompiler.ir.statement.AssignMapStatement;
import org.tprobe.probeCompiler.ir.statement.AssignVarStatement;

import javax.annotation.Nullable;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;

/** Checks that every node reachable from the root has a single owner
 * and that no released node is still reachable.
 * The only node allowed to appear twice is the target of a compound assignment. */
public class OwnershipChecker extends InnerVisitor {
    private final Set<Long> visited;
    /** Targets of compound assignments, which also appear in the assigned expression. */
    private final Set<Long> shared;
    @Nullable
    private IProbeNode offending;
    @Nullable
    private String problem;
    private final List<IProbeNode> offendingContext = new ArrayList<>();
    @Nullable
    private IProbeNode root = null;

    public OwnershipChecker(ProbeCompiler compiler) {
        super(compiler);
        this.visited = new HashSet<>();
        this.shared = new HashSet<>();
        this.offending = null;
        this.problem = null;
    }

    public boolean hasProblem() {
        return this.offending != null;
    }

    void found(IProbeNode node, String problem) {
        this.offending = node;
        this.problem = problem;
        this.offendingContext.addAll(this.context);
    }

    @Override
    public VisitDecision preorder(IProbeNode node) {
        if (this.offending != null)
            return VisitDecision.STOP;
        if (node.isReleased()) {
            this.found(node, "a released node");
            return VisitDecision.STOP;
        }
        if (!this.visited.add(node.getId())) {
            if (this.shared.remove(node.getId()))
                // second reference to a compound target; its children were already checked
                return VisitDecision.STOP;
            this.found(node, "multiple instances of");
            return VisitDecision.STOP;
        }
        return VisitDecision.CONTINUE;
    }

    @Override
    public VisitDecision preorder(AssignMapStatement node) {
        if (node.compound && node.map != null)
            this.shared.add(node.map.getId());
        return super.preorder(node);
    }

    @Override
    public VisitDecision preorder(AssignVarStatement node) {
        if (node.compound && node.variable != null)
            this.shared.add(node.variable.getId());
        return super.preorder(node);
    }

    @Override
    public void startVisit(IProbeNode node) {
        this.root = node;
        this.visited.clear();
        this.shared.clear();
        this.offending = null;
        this.problem = null;
        this.offendingContext.clear();
        super.startVisit(node);
    }

    @Override
    public void endVisit() {
        Objects.requireNonNull(this.root);
        if (this.offending != null) {
            StringBuilder builder = new StringBuilder();
            builder.append("Tree ")
                    .append(this.root.getId())
                    .append(" contains ")
                    .append(this.problem)
                    .append(" ")
                    .append(this.offending.getId())
                    .append(" ")
                    .append(this.offending)
                    .append(" context:\n");
            Collections.reverse(this.offendingContext);
            for (IProbeNode parent: this.offendingContext) {
                builder.append(parent.getId())
                        .append(" ")
                        .append(parent.getClass().getSimpleName())
                        .append("\n");
            }
            throw new InternalCompilerError(builder.toString(), this.offending);
        }
        super.endVisit();
    }
}
