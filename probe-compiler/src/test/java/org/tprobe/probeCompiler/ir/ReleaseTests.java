package org.tprobe.probeCompiler.ir;

import org.junit.Assert;
import org.junit.Test;
import org.tprobe.probeCompiler.compiler.errors.InternalCompilerError;
import org.tprobe.probeCompiler.compiler.errors.SourcePositionRange;
import org.tprobe.probeCompiler.ir.expression.BinaryExpression;
import org.tprobe.probeCompiler.ir.expression.Expression;
import org.tprobe.probeCompiler.ir.expression.MapExpression;
import org.tprobe.probeCompiler.ir.expression.ProbeOpcode;
import org.tprobe.probeCompiler.ir.expression.VariableExpression;
import org.tprobe.probeCompiler.ir.expression.literal.IntegerLiteral;
import org.tprobe.probeCompiler.ir.probe.Probe;
import org.tprobe.probeCompiler.ir.statement.AssignMapStatement;
import org.tprobe.probeCompiler.ir.statement.AssignVarStatement;
import org.tprobe.probeCompiler.ir.statement.ExpressionStatement;
import org.tprobe.probeCompiler.ir.statement.IfStatement;
import org.tprobe.probeCompiler.ir.statement.Statement;
import org.tprobe.util.Linq;

import java.util.List;

public class ReleaseTests {
    @Test
    public void compoundAssignmentReleasesTargetOnce() {
        AssignMapStatement statement = Samples.compoundIncrement();
        MapExpression map = statement.map;
        Assert.assertNotNull(map);
        Assert.assertFalse(statement.ownsTarget());
        statement.release();
        Assert.assertTrue(statement.isReleased());
        Assert.assertTrue(map.isReleased());
        Assert.assertNotNull(map.keys);
        Assert.assertTrue(map.keys.get(0).isReleased());
    }

    @Test
    public void plainAssignmentReleasesTarget() {
        VariableExpression variable = new VariableExpression("$v");
        IntegerLiteral value = new IntegerLiteral(3);
        AssignVarStatement statement = new AssignVarStatement(variable, value);
        Assert.assertTrue(statement.ownsTarget());
        Assert.assertSame(variable, value.variable);
        statement.release();
        Assert.assertTrue(variable.isReleased());
        Assert.assertTrue(value.isReleased());
    }

    @Test
    public void sharedTargetInPlainAssignmentIsDefect() {
        // The target is owned by both the statement and the expression.
        MapExpression map = new MapExpression("@x");
        Expression sum = new BinaryExpression(map, ProbeOpcode.PLUS, new IntegerLiteral(1));
        AssignMapStatement statement = new AssignMapStatement(map, sum, false, SourcePositionRange.INVALID);
        Assert.assertThrows(InternalCompilerError.class, statement::release);
    }

    @Test
    public void doubleRelease() {
        IntegerLiteral literal = new IntegerLiteral(1);
        literal.release();
        InternalCompilerError error = Assert.assertThrows(InternalCompilerError.class, literal::release);
        Assert.assertSame(literal, error.probeNode);
    }

    @Test
    public void backReferencesAreNotReleased() {
        IntegerLiteral key = new IntegerLiteral(0);
        MapExpression map = new MapExpression("@m", Linq.list(key));
        Assert.assertSame(map, key.keyForMap);
        key.release();
        Assert.assertFalse(map.isReleased());

        IntegerLiteral value = new IntegerLiteral(2);
        MapExpression target = new MapExpression("@n");
        new AssignMapStatement(target, value);
        Assert.assertSame(target, value.map);
        value.release();
        Assert.assertFalse(target.isReleased());
    }

    @Test
    public void releaseWholeProbe() {
        IfStatement conditional = Samples.conditionalStore();
        Probe probe = Samples.probe("vfs_read", conditional);
        probe.release();
        Assert.assertTrue(conditional.isReleased());
        Assert.assertNotNull(conditional.condition);
        Assert.assertTrue(conditional.condition.isReleased());
        Assert.assertNotNull(probe.predicate);
        Assert.assertTrue(probe.predicate.isReleased());
        Assert.assertNotNull(probe.attachPoints);
        Assert.assertTrue(probe.attachPoints.get(0).isReleased());
    }

    @Test
    public void leafcopyHasIndependentLifecycle() {
        IfStatement conditional = Samples.conditionalStore();
        IfStatement copy = conditional.leafcopy();
        conditional.release();
        Assert.assertFalse(copy.isReleased());
        copy.release();
        Assert.assertTrue(copy.isReleased());
    }

    @Test
    public void childListsAreNotShared() {
        IntegerLiteral key = new IntegerLiteral(0);
        List<Expression> keys = Linq.list(key);
        MapExpression map = new MapExpression("@m", keys);
        keys.add(new IntegerLiteral(1));
        Assert.assertNotNull(map.keys);
        Assert.assertEquals(1, map.keys.size());

        List<Statement> elseStatements = Linq.list();
        IfStatement conditional = new IfStatement(new VariableExpression("$c"), Linq.list(), elseStatements);
        elseStatements.add(new ExpressionStatement(new IntegerLiteral(2)));
        Assert.assertNotNull(conditional.elseStatements);
        Assert.assertTrue(conditional.elseStatements.isEmpty());

        Probe probe = Samples.probe("vfs_read");
        Assert.assertNotNull(probe.statements);
        Assert.assertThrows(UnsupportedOperationException.class,
                () -> probe.statements.add(Samples.conditionalStore()));
        probe.release();
        map.release();
        Assert.assertTrue(key.isReleased());
    }
}
