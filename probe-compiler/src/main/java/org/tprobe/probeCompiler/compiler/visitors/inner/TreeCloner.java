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
import org.tprobe.probeCompiler.ir.expression.literal.Literal;
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
import org.tprobe.util.Linq;
import org.tprobe.util.Logger;

import javax.annotation.Nullable;
import java.util.ArrayList;
import java.util.IdentityHashMap;
import java.util.List;
import java.util.Map;

/**
 * Builds a copy of a tree which shares no node with the original.
 *
 * <p>Leaves are copied with {@link IProbeNode#leafcopy()}; inner nodes are rebuilt
 * from the copies of their children and then receive the metadata of the original.
 * A node reachable twice from the root (the target of a compound assignment)
 * is copied once, so the copy has the same sharing as the original.
 * Back-references which point to nodes of the copied tree are redirected to
 * the corresponding copies; the other ones are kept unchanged.
 *
 * <p>Subclasses can override the preorder methods to rewrite parts of the tree,
 * or {@link #transformStatements} to rewrite statement lists.
 */
public class TreeCloner extends InnerVisitor {
    /** Maps each original node to its copy. */
    protected final Map<IProbeNode, IProbeNode> translation;
    /** Copies of expressions, whose back-references must be fixed at the end. */
    protected final List<Expression> copiedExpressions;
    @Nullable
    protected IProbeNode lastResult;

    public TreeCloner(ProbeCompiler compiler) {
        super(compiler);
        this.translation = new IdentityHashMap<>();
        this.copiedExpressions = new ArrayList<>();
        this.lastResult = null;
    }

    protected IProbeNode getResult() {
        if (this.lastResult == null)
            throw new InternalCompilerError("No result produced by " + this);
        return this.lastResult;
    }

    /** Record the copy of an original node. */
    protected void map(IProbeNode old, IProbeNode copy) {
        if (old == copy)
            throw new InternalCompilerError("Copy is the same as the original", old);
        Logger.INSTANCE.belowLevel(this, 3)
                .appendSupplier(this::toString)
                .append(":")
                .append(old.getId())
                .append(" -> ")
                .append(copy.getId())
                .newline();
        this.translation.put(old, copy);
        if (copy.isExpression())
            this.copiedExpressions.add(copy.to(Expression.class));
        this.lastResult = copy;
    }

    /** The copy of a node, or the node itself when it is not part of the copied tree. */
    @Nullable
    protected <T extends IProbeNode> T translate(@Nullable T node, Class<T> clazz) {
        if (node == null)
            return null;
        IProbeNode copy = this.translation.get(node);
        if (copy == null)
            return node;
        return copy.to(clazz);
    }

    protected <T extends Expression> T copyMetadata(Expression from, T to) {
        to.type = from.type;
        to.keyForMap = from.keyForMap;
        to.map = from.map;
        to.variable = from.variable;
        return to;
    }

    protected IProbeNode transformNode(IProbeNode node) {
        IProbeNode copy = this.translation.get(node);
        if (copy != null)
            return copy;
        node.accept(this);
        return this.getResult();
    }

    protected Expression transform(Expression expression) {
        return this.transformNode(expression).to(Expression.class);
    }

    @Nullable
    protected Expression transformN(@Nullable Expression expression) {
        if (expression == null)
            return null;
        return this.transform(expression);
    }

    @Nullable
    protected List<Expression> transformExpressions(@Nullable List<Expression> expressions) {
        return Linq.mapNullable(expressions, this::transform);
    }

    public Statement transform(Statement statement) {
        return this.transformNode(statement).to(Statement.class);
    }

    /** Copy a list of statements.  Subclasses may return more or fewer statements than the input. */
    @Nullable
    protected List<Statement> transformStatements(@Nullable List<Statement> statements) {
        return Linq.mapNullable(statements, this::transform);
    }

    /////////////////////// Leaves ////////////////////////////////

    @Override
    public VisitDecision preorder(Literal node) {
        this.map(node, node.leafcopy());
        return VisitDecision.STOP;
    }

    @Override
    public VisitDecision preorder(IdentifierExpression node) {
        this.map(node, node.leafcopy());
        return VisitDecision.STOP;
    }

    @Override
    public VisitDecision preorder(BuiltinExpression node) {
        this.map(node, node.leafcopy());
        return VisitDecision.STOP;
    }

    @Override
    public VisitDecision preorder(VariableExpression node) {
        this.map(node, node.leafcopy());
        return VisitDecision.STOP;
    }

    @Override
    public VisitDecision preorder(JumpStatement node) {
        this.map(node, node.leafcopy());
        return VisitDecision.STOP;
    }

    @Override
    public VisitDecision preorder(AttachPoint node) {
        this.map(node, node.leafcopy());
        return VisitDecision.STOP;
    }

    /////////////////////// Expressions ////////////////////////////////

    @Override
    public VisitDecision preorder(CallExpression node) {
        this.push(node);
        List<Expression> arguments = this.transformExpressions(node.arguments);
        this.pop(node);
        CallExpression result = new CallExpression(node.function, arguments, node.getPositionRange());
        this.map(node, this.copyMetadata(node, result));
        return VisitDecision.STOP;
    }

    @Override
    public VisitDecision preorder(MapExpression node) {
        this.push(node);
        List<Expression> keys = this.transformExpressions(node.keys);
        this.pop(node);
        MapExpression result = new MapExpression(node.identifier, keys, node.getPositionRange());
        result.skipKeyValidation = node.skipKeyValidation;
        this.map(node, this.copyMetadata(node, result));
        return VisitDecision.STOP;
    }

    @Override
    public VisitDecision preorder(BinaryExpression node) {
        this.push(node);
        Expression left = this.transform(node.checkNull(node.left));
        Expression right = this.transform(node.checkNull(node.right));
        this.pop(node);
        BinaryExpression result = new BinaryExpression(left, node.opcode, right, node.getPositionRange());
        this.map(node, this.copyMetadata(node, result));
        return VisitDecision.STOP;
    }

    @Override
    public VisitDecision preorder(UnaryExpression node) {
        this.push(node);
        Expression operand = this.transform(node.checkNull(node.operand));
        this.pop(node);
        UnaryExpression result = new UnaryExpression(node.opcode, operand, node.isPostOp, node.getPositionRange());
        this.map(node, this.copyMetadata(node, result));
        return VisitDecision.STOP;
    }

    @Override
    public VisitDecision preorder(FieldExpression node) {
        this.push(node);
        Expression expression = this.transform(node.checkNull(node.expression));
        this.pop(node);
        FieldExpression result = node.isTupleAccess() ?
                new FieldExpression(expression, node.index, node.getPositionRange()) :
                new FieldExpression(expression, node.field, node.getPositionRange());
        this.map(node, this.copyMetadata(node, result));
        return VisitDecision.STOP;
    }

    @Override
    public VisitDecision preorder(IndexExpression node) {
        this.push(node);
        Expression expression = this.transform(node.checkNull(node.expression));
        Expression index = this.transform(node.checkNull(node.index));
        this.pop(node);
        IndexExpression result = new IndexExpression(expression, index, node.getPositionRange());
        this.map(node, this.copyMetadata(node, result));
        return VisitDecision.STOP;
    }

    @Override
    public VisitDecision preorder(CastExpression node) {
        this.push(node);
        Expression source = this.transform(node.checkNull(node.source));
        this.pop(node);
        CastExpression result = new CastExpression(
                node.castType, node.isPointer, node.isDoublePointer, source, node.getPositionRange());
        this.map(node, this.copyMetadata(node, result));
        return VisitDecision.STOP;
    }

    @Override
    public VisitDecision preorder(TupleExpression node) {
        this.push(node);
        List<Expression> elements = this.transformExpressions(node.checkNull(node.elements));
        this.pop(node);
        TupleExpression result = new TupleExpression(node.checkNull(elements), node.getPositionRange());
        this.map(node, this.copyMetadata(node, result));
        return VisitDecision.STOP;
    }

    @Override
    public VisitDecision preorder(TernaryExpression node) {
        this.push(node);
        Expression condition = this.transform(node.checkNull(node.condition));
        Expression positive = this.transform(node.checkNull(node.positive));
        Expression negative = this.transform(node.checkNull(node.negative));
        this.pop(node);
        TernaryExpression result = new TernaryExpression(condition, positive, negative, node.getPositionRange());
        this.map(node, this.copyMetadata(node, result));
        return VisitDecision.STOP;
    }

    /////////////////////// Statements ////////////////////////////////

    @Override
    public VisitDecision preorder(ExpressionStatement node) {
        this.push(node);
        Expression expression = this.transform(node.checkNull(node.expression));
        this.pop(node);
        this.map(node, new ExpressionStatement(expression, node.getPositionRange()));
        return VisitDecision.STOP;
    }

    @Override
    public VisitDecision preorder(AssignMapStatement node) {
        this.push(node);
        // For compound assignments the expression contains the map again; it is copied only once.
        MapExpression map = this.transform(node.checkNull(node.map)).to(MapExpression.class);
        Expression expression = this.transform(node.checkNull(node.expression));
        this.pop(node);
        this.map(node, new AssignMapStatement(map, expression, node.compound, node.getPositionRange()));
        return VisitDecision.STOP;
    }

    @Override
    public VisitDecision preorder(AssignVarStatement node) {
        this.push(node);
        VariableExpression variable = this.transform(node.checkNull(node.variable)).to(VariableExpression.class);
        Expression expression = this.transform(node.checkNull(node.expression));
        this.pop(node);
        this.map(node, new AssignVarStatement(variable, expression, node.compound, node.getPositionRange()));
        return VisitDecision.STOP;
    }

    @Override
    public VisitDecision preorder(IfStatement node) {
        this.push(node);
        Expression condition = this.transform(node.checkNull(node.condition));
        List<Statement> statements = this.transformStatements(node.checkNull(node.statements));
        List<Statement> elseStatements = this.transformStatements(node.elseStatements);
        this.pop(node);
        this.map(node, new IfStatement(condition, node.checkNull(statements), elseStatements, node.getPositionRange()));
        return VisitDecision.STOP;
    }

    @Override
    public VisitDecision preorder(UnrollStatement node) {
        this.push(node);
        Expression countExpression = this.transform(node.checkNull(node.countExpression));
        List<Statement> statements = this.transformStatements(node.checkNull(node.statements));
        this.pop(node);
        UnrollStatement result = new UnrollStatement(countExpression, node.checkNull(statements), node.getPositionRange());
        result.count = node.count;
        this.map(node, result);
        return VisitDecision.STOP;
    }

    @Override
    public VisitDecision preorder(WhileStatement node) {
        this.push(node);
        Expression condition = this.transform(node.checkNull(node.condition));
        List<Statement> statements = this.transformStatements(node.checkNull(node.statements));
        this.pop(node);
        this.map(node, new WhileStatement(condition, node.checkNull(statements), node.getPositionRange()));
        return VisitDecision.STOP;
    }

    /////////////////////// Probes ////////////////////////////////

    @Override
    public VisitDecision preorder(Predicate node) {
        this.push(node);
        Expression expression = this.transform(node.checkNull(node.expression));
        this.pop(node);
        this.map(node, new Predicate(expression, node.getPositionRange()));
        return VisitDecision.STOP;
    }

    protected AttachPoint transform(AttachPoint attachPoint) {
        return this.transformNode(attachPoint).to(AttachPoint.class);
    }

    protected Probe transform(Probe probe) {
        return this.transformNode(probe).to(Probe.class);
    }

    @Override
    public VisitDecision preorder(Probe node) {
        this.push(node);
        List<AttachPoint> attachPoints = Linq.map(node.checkNull(node.attachPoints), this::transform);
        Predicate predicate = null;
        if (node.predicate != null)
            predicate = this.transformNode(node.predicate).to(Predicate.class);
        List<Statement> statements = this.transformStatements(node.checkNull(node.statements));
        this.pop(node);
        Probe result = new Probe(attachPoints, predicate, node.checkNull(statements), node.getPositionRange());
        result.needExpansion = node.needExpansion;
        result.needTracepointArgsStructs = node.needTracepointArgsStructs;
        result.setIndex(node.index());
        this.map(node, result);
        return VisitDecision.STOP;
    }

    @Override
    public VisitDecision preorder(Program node) {
        this.push(node);
        List<Probe> probes = Linq.map(node.checkNull(node.probes), this::transform);
        this.pop(node);
        this.map(node, new Program(node.cDefinitions, probes, node.getPositionRange()));
        return VisitDecision.STOP;
    }

    /** Redirect the back-references of the copies to copies. */
    @Override
    public void endVisit() {
        for (Expression copy: this.copiedExpressions) {
            copy.keyForMap = this.translate(copy.keyForMap, MapExpression.class);
            copy.map = this.translate(copy.map, MapExpression.class);
            copy.variable = this.translate(copy.variable, VariableExpression.class);
        }
        super.endVisit();
    }

    @Override
    public void startVisit(IProbeNode node) {
        super.startVisit(node);
        this.translation.clear();
        this.copiedExpressions.clear();
        this.lastResult = null;
    }

    @Override
    public IProbeNode apply(IProbeNode node) {
        this.startVisit(node);
        IProbeNode result = this.transformNode(node);
        this.endVisit();
        return result;
    }
}
