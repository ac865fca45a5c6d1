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

import org.tprobe.probeCompiler.compiler.ICompilerComponent;
import org.tprobe.probeCompiler.compiler.ProbeCompiler;
import org.tprobe.probeCompiler.compiler.errors.InternalCompilerError;
import org.tprobe.probeCompiler.compiler.visitors.VisitDecision;
import org.tprobe.probeCompiler.ir.IProbeNode;
import org.tprobe.probeCompiler.ir.expression.BinaryExpression;
import org.tprobe.probeCompiler.ir.expression.BuiltinExpression;
import org.tprobe.probeCompiler.ir.expression.CallExpression;
import org.tprobe.probeCompiler.ir.expression.CastExpression;
import org.tprobe.probeCompiler.ir.expression.Expression;
import org.tprobe.probeCompiler.ir.expression.FieldExpression;
import org.tprobe.probeCompiler.ir.expression.IdentifierExpression;
import org.tprobe.probeCompiler.ir.expression.IndexExpression;
import org.tprobe.probeCompiler.ir.expression.MapExpression;
import org.tprobe.probeCompiler.ir.expression.TernaryExpression;
import org.tprobe.probeCompiler.ir.expression.TupleExpression;
import org.tprobe.probeCompiler.ir.expression.UnaryExpression;
import org.tprobe.probeCompiler.ir.expression.VariableExpression;
import org.tprobe.probeCompiler.ir.expression.literal.IntegerLiteral;
import org.tprobe.probeCompiler.ir.expression.literal.Literal;
import org.tprobe.probeCompiler.ir.expression.literal.PositionalParameter;
import org.tprobe.probeCompiler.ir.expression.literal.StackModeLiteral;
import org.tprobe.probeCompiler.ir.expression.literal.StringLiteral;
import org.tprobe.probeCompiler.ir.probe.AttachPoint;
import org.tprobe.probeCompiler.ir.probe.Predicate;
import org.tprobe.probeCompiler.ir.probe.Probe;
import org.tprobe.probeCompiler.ir.probe.Program;
import org.tprobe.probeCompiler.ir.statement.AssignMapStatement;
import org.tprobe.probeCompiler.ir.statement.AssignVarStatement;
import org.tprobe.probeCompiler.ir.statement.ExpressionStatement;
import org.tprobe.probeCompiler.ir.statement.IfStatement;
import org.tprobe.probeCompiler.ir.statement.JumpStatement;
import org.tprobe.probeCompiler.ir.statement.Statement;
import org.tprobe.probeCompiler.ir.statement.UnrollStatement;
import org.tprobe.probeCompiler.ir.statement.WhileStatement;
import org.tprobe.util.IHasId;
import org.tprobe.util.IWritesLogs;
import org.tprobe.util.Logger;
import org.tprobe.util.Utilities;

import javax.annotation.Nullable;
import java.util.ArrayList;
import java.util.List;

/** Depth-first visitor over the tree of a probe program.
 *
 * <p>Each node calls {@code preorder} on itself, then visits its children, then
 * calls {@code postorder}.  The methods for a node class delegate by default to
 * the methods of its superclass, so a visitor only overrides the classes it
 * cares about.  Visitors may update the metadata of the nodes they visit,
 * but must not change the shape of the tree; see {@link TreeCloner} for that. */
@SuppressWarnings({"SameReturnValue", "EmptyMethod", "unused"})
public abstract class InnerVisitor implements IRTransform, IWritesLogs, IHasId, ICompilerComponent {
    final long id;
    static long crtId = 0;
    public final ProbeCompiler compiler;
    protected final List<IProbeNode> context;

    public InnerVisitor(ProbeCompiler compiler) {
        this.id = crtId++;
        this.compiler = compiler;
        this.context = new ArrayList<>();
    }

    @Override
    public ProbeCompiler compiler() {
        return this.compiler;
    }

    @Override
    public long getId() {
        return this.id;
    }

    public void push(IProbeNode node) {
        this.context.add(node);
    }

    public void pop(IProbeNode node) {
        IProbeNode last = Utilities.removeLast(this.context);
        if (node != last)
            throw new InternalCompilerError("Corrupted visitor context: popping " + node
                    + " instead of " + last, node);
    }

    @Nullable
    public IProbeNode getParent() {
        if (this.context.isEmpty())
            return null;
        return Utilities.last(this.context);
    }

    /** Called before visiting each group of children of the current node. */
    public void property(String name) {}

    /** Override to initialize before visiting any node. */
    public void startVisit(IProbeNode node) {
        Logger.INSTANCE.belowLevel(this, 4)
                .append("Starting ")
                .appendSupplier(this::toString)
                .append(" at ")
                .appendSupplier(node::toString)
                .newline();
    }

    /** Override to finish after visiting all nodes. */
    public void endVisit() {}

    /************************* PREORDER *****************************/

    // preorder methods return CONTINUE when normal traversal is desired,
    // and STOP when the traversal should skip the children of the current node.
    public VisitDecision preorder(IProbeNode ignored) {
        return VisitDecision.CONTINUE;
    }

    public VisitDecision preorder(Expression node) {
        return this.preorder((IProbeNode) node);
    }

    public VisitDecision preorder(Literal node) {
        return this.preorder((Expression) node);
    }

    public VisitDecision preorder(Statement node) {
        return this.preorder((IProbeNode) node);
    }

    public VisitDecision preorder(IntegerLiteral node) {
        return this.preorder((Literal) node);
    }

    public VisitDecision preorder(StringLiteral node) {
        return this.preorder((Literal) node);
    }

    public VisitDecision preorder(StackModeLiteral node) {
        return this.preorder((Literal) node);
    }

    public VisitDecision preorder(PositionalParameter node) {
        return this.preorder((Literal) node);
    }

    public VisitDecision preorder(IdentifierExpression node) {
        return this.preorder((Expression) node);
    }

    public VisitDecision preorder(BuiltinExpression node) {
        return this.preorder((Expression) node);
    }

    public VisitDecision preorder(CallExpression node) {
        return this.preorder((Expression) node);
    }

    public VisitDecision preorder(MapExpression node) {
        return this.preorder((Expression) node);
    }

    public VisitDecision preorder(VariableExpression node) {
        return this.preorder((Expression) node);
    }

    public VisitDecision preorder(BinaryExpression node) {
        return this.preorder((Expression) node);
    }

    public VisitDecision preorder(UnaryExpression node) {
        return this.preorder((Expression) node);
    }

    public VisitDecision preorder(FieldExpression node) {
        return this.preorder((Expression) node);
    }

    public VisitDecision preorder(IndexExpression node) {
        return this.preorder((Expression) node);
    }

    public VisitDecision preorder(CastExpression node) {
        return this.preorder((Expression) node);
    }

    public VisitDecision preorder(TupleExpression node) {
        return this.preorder((Expression) node);
    }

    public VisitDecision preorder(TernaryExpression node) {
        return this.preorder((Expression) node);
    }

    public VisitDecision preorder(ExpressionStatement node) {
        return this.preorder((Statement) node);
    }

    public VisitDecision preorder(AssignMapStatement node) {
        return this.preorder((Statement) node);
    }

    public VisitDecision preorder(AssignVarStatement node) {
        return this.preorder((Statement) node);
    }

    public VisitDecision preorder(IfStatement node) {
        return this.preorder((Statement) node);
    }

    public VisitDecision preorder(UnrollStatement node) {
        return this.preorder((Statement) node);
    }

    public VisitDecision preorder(WhileStatement node) {
        return this.preorder((Statement) node);
    }

    public VisitDecision preorder(JumpStatement node) {
        return this.preorder((Statement) node);
    }

    public VisitDecision preorder(AttachPoint node) {
        return this.preorder((IProbeNode) node);
    }

    public VisitDecision preorder(Predicate node) {
        return this.preorder((IProbeNode) node);
    }

    public VisitDecision preorder(Probe node) {
        return this.preorder((IProbeNode) node);
    }

    public VisitDecision preorder(Program node) {
        return this.preorder((IProbeNode) node);
    }

    /************************* POSTORDER *****************************/

    public void postorder(IProbeNode ignored) {}

    public void postorder(Expression node) {
        this.postorder((IProbeNode) node);
    }

    public void postorder(Literal node) {
        this.postorder((Expression) node);
    }

    public void postorder(Statement node) {
        this.postorder((IProbeNode) node);
    }

    public void postorder(IntegerLiteral node) {
        this.postorder((Literal) node);
    }

    public void postorder(StringLiteral node) {
        this.postorder((Literal) node);
    }

    public void postorder(StackModeLiteral node) {
        this.postorder((Literal) node);
    }

    public void postorder(PositionalParameter node) {
        this.postorder((Literal) node);
    }

    public void postorder(IdentifierExpression node) {
        this.postorder((Expression) node);
    }

    public void postorder(BuiltinExpression node) {
        this.postorder((Expression) node);
    }

    public void postorder(CallExpression node) {
        this.postorder((Expression) node);
    }

    public void postorder(MapExpression node) {
        this.postorder((Expression) node);
    }

    public void postorder(VariableExpression node) {
        this.postorder((Expression) node);
    }

    public void postorder(BinaryExpression node) {
        this.postorder((Expression) node);
    }

    public void postorder(UnaryExpression node) {
        this.postorder((Expression) node);
    }

    public void postorder(FieldExpression node) {
        this.postorder((Expression) node);
    }

    public void postorder(IndexExpression node) {
        this.postorder((Expression) node);
    }

    public void postorder(CastExpression node) {
        this.postorder((Expression) node);
    }

    public void postorder(TupleExpression node) {
        this.postorder((Expression) node);
    }

    public void postorder(TernaryExpression node) {
        this.postorder((Expression) node);
    }

    public void postorder(ExpressionStatement node) {
        this.postorder((Statement) node);
    }

    public void postorder(AssignMapStatement node) {
        this.postorder((Statement) node);
    }

    public void postorder(AssignVarStatement node) {
        this.postorder((Statement) node);
    }

    public void postorder(IfStatement node) {
        this.postorder((Statement) node);
    }

    public void postorder(UnrollStatement node) {
        this.postorder((Statement) node);
    }

    public void postorder(WhileStatement node) {
        this.postorder((Statement) node);
    }

    public void postorder(JumpStatement node) {
        this.postorder((Statement) node);
    }

    public void postorder(AttachPoint node) {
        this.postorder((IProbeNode) node);
    }

    public void postorder(Predicate node) {
        this.postorder((IProbeNode) node);
    }

    public void postorder(Probe node) {
        this.postorder((IProbeNode) node);
    }

    public void postorder(Program node) {
        this.postorder((IProbeNode) node);
    }

    @Override
    public String toString() {
        return this.id + " " + this.getClass().getSimpleName();
    }

    @Override
    public IProbeNode apply(IProbeNode node) {
        this.startVisit(node);
        node.accept(this);
        this.endVisit();
        return node;
    }
}
