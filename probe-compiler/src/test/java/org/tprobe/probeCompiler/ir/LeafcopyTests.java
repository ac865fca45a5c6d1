package org.tprobe.probeCompiler.ir;

import org.junit.Assert;
import org.junit.Test;
import org.tprobe.probeCompiler.compiler.errors.SourcePositionRange;
import org.tprobe.probeCompiler.ir.expression.BinaryExpression;
import org.tprobe.probeCompiler.ir.expression.BuiltinExpression;
import org.tprobe.probeCompiler.ir.expression.CallExpression;
import org.tprobe.probeCompiler.ir.expression.CastExpression;
import org.tprobe.probeCompiler.ir.expression.Expression;
import org.tprobe.probeCompiler.ir.expression.FieldExpression;
import org.tprobe.probeCompiler.ir.expression.IdentifierExpression;
import org.tprobe.probeCompiler.ir.expression.IndexExpression;
import org.tprobe.probeCompiler.ir.expression.MapExpression;
import org.tprobe.probeCompiler.ir.expression.ProbeOpcode;
import org.tprobe.probeCompiler.ir.expression.TernaryExpression;
import org.tprobe.probeCompiler.ir.expression.TupleExpression;
import org.tprobe.probeCompiler.ir.expression.UnaryExpression;
import org.tprobe.probeCompiler.ir.expression.VariableExpression;
import org.tprobe.probeCompiler.ir.expression.literal.IntegerLiteral;
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
import org.tprobe.probeCompiler.ir.statement.JumpKind;
import org.tprobe.probeCompiler.ir.statement.JumpStatement;
import org.tprobe.probeCompiler.ir.statement.Statement;
import org.tprobe.probeCompiler.ir.statement.UnrollStatement;
import org.tprobe.probeCompiler.ir.statement.WhileStatement;
import org.tprobe.probeCompiler.ir.type.SizedType;
import org.tprobe.util.Linq;

public class LeafcopyTests {
    static final SourcePositionRange RANGE = new SourcePositionRange(3, 5, 3, 17);

    /** Checks the properties every leafcopy shares. */
    static <T extends IProbeNode> T check(T node) {
        @SuppressWarnings("unchecked")
        T copy = (T) node.leafcopy();
        Assert.assertNotSame(node, copy);
        Assert.assertNotEquals(node.getId(), copy.getId());
        Assert.assertSame(node.getClass(), copy.getClass());
        Assert.assertEquals(node.getPositionRange(), copy.getPositionRange());
        Assert.assertFalse(copy.isReleased());
        return copy;
    }

    @Test
    public void literals() {
        IntegerLiteral integer = new IntegerLiteral(-7, RANGE);
        Assert.assertEquals(-7, check(integer).value);
        Assert.assertTrue(check(integer).isLiteral);

        Assert.assertEquals("abc", check(new StringLiteral("abc")).value);
        Assert.assertEquals("perf", check(new StackModeLiteral("perf", RANGE)).mode);

        PositionalParameter parameter = new PositionalParameter(PositionalParameter.Kind.POSITIONAL, 2, RANGE);
        parameter.isInString = true;
        PositionalParameter parameterCopy = check(parameter);
        Assert.assertEquals(PositionalParameter.Kind.POSITIONAL, parameterCopy.kind);
        Assert.assertEquals(2, parameterCopy.n);
        Assert.assertTrue(parameterCopy.isInString);
    }

    @Test
    public void expressionMetadata() {
        MapExpression map = new MapExpression("@m");
        VariableExpression variable = new VariableExpression("$v");
        BuiltinExpression builtin = new BuiltinExpression("pid", RANGE);
        builtin.type = SizedType.integer(8, false);
        builtin.keyForMap = map;
        builtin.map = map;
        builtin.variable = variable;
        builtin.probeId = 4;
        BuiltinExpression copy = check(builtin);
        Assert.assertEquals("pid", copy.identifier);
        Assert.assertEquals(4, copy.probeId);
        Assert.assertEquals(SizedType.integer(8, false), copy.type);
        Assert.assertSame(map, copy.keyForMap);
        Assert.assertSame(map, copy.map);
        Assert.assertSame(variable, copy.variable);
        Assert.assertFalse(copy.isLiteral);
    }

    @Test
    public void expressions() {
        Assert.assertEquals("x", check(new IdentifierExpression("x")).identifier);

        CallExpression call = new CallExpression("printf", Linq.list(new StringLiteral("%d")), RANGE);
        CallExpression callCopy = check(call);
        Assert.assertEquals("printf", callCopy.function);
        Assert.assertNull(callCopy.arguments);

        MapExpression map = new MapExpression("@m", Linq.list(new IntegerLiteral(1)), RANGE);
        map.skipKeyValidation = true;
        MapExpression mapCopy = check(map);
        Assert.assertEquals("@m", mapCopy.identifier);
        Assert.assertTrue(mapCopy.skipKeyValidation);
        Assert.assertTrue(mapCopy.isMap);
        Assert.assertNull(mapCopy.keys);

        VariableExpression variableCopy = check(new VariableExpression("$v"));
        Assert.assertEquals("$v", variableCopy.identifier);
        Assert.assertTrue(variableCopy.isVariable);

        BinaryExpression binary = new BinaryExpression(new IntegerLiteral(1), ProbeOpcode.LEFT, new IntegerLiteral(2));
        BinaryExpression binaryCopy = check(binary);
        Assert.assertEquals(ProbeOpcode.LEFT, binaryCopy.opcode);
        Assert.assertNull(binaryCopy.left);
        Assert.assertNull(binaryCopy.right);

        UnaryExpression unary = new UnaryExpression(ProbeOpcode.INCREMENT, new VariableExpression("$i"), true, RANGE);
        UnaryExpression unaryCopy = check(unary);
        Assert.assertEquals(ProbeOpcode.INCREMENT, unaryCopy.opcode);
        Assert.assertTrue(unaryCopy.isPostOp);
        Assert.assertNull(unaryCopy.operand);

        FieldExpression field = new FieldExpression(new BuiltinExpression("curtask"), "pid");
        FieldExpression fieldCopy = check(field);
        Assert.assertEquals("pid", fieldCopy.field);
        Assert.assertEquals(-1, fieldCopy.index);
        Assert.assertNull(fieldCopy.expression);
        FieldExpression element = new FieldExpression(new VariableExpression("$t"), 1, RANGE);
        Assert.assertEquals(1, check(element).index);

        IndexExpression index = new IndexExpression(new VariableExpression("$a"), new IntegerLiteral(0));
        IndexExpression indexCopy = check(index);
        Assert.assertNull(indexCopy.expression);
        Assert.assertNull(indexCopy.index);

        CastExpression cast = new CastExpression("struct task_struct", true, true, new BuiltinExpression("curtask"), RANGE);
        CastExpression castCopy = check(cast);
        Assert.assertEquals("struct task_struct", castCopy.castType);
        Assert.assertTrue(castCopy.isPointer);
        Assert.assertTrue(castCopy.isDoublePointer);
        Assert.assertNull(castCopy.source);

        TupleExpression tuple = new TupleExpression(Linq.list(new IntegerLiteral(1), new IntegerLiteral(2)));
        Assert.assertNull(check(tuple).elements);

        TernaryExpression ternary = new TernaryExpression(
                new IntegerLiteral(1), new IntegerLiteral(2), new IntegerLiteral(3));
        TernaryExpression ternaryCopy = check(ternary);
        Assert.assertNull(ternaryCopy.condition);
        Assert.assertNull(ternaryCopy.positive);
        Assert.assertNull(ternaryCopy.negative);
    }

    @Test
    public void statements() {
        Assert.assertNull(check(new ExpressionStatement(new IntegerLiteral(1))).expression);

        AssignMapStatement compound = Samples.compoundIncrement();
        AssignMapStatement compoundCopy = check(compound);
        Assert.assertTrue(compoundCopy.compound);
        Assert.assertFalse(compoundCopy.ownsTarget());
        Assert.assertNull(compoundCopy.map);
        Assert.assertNull(compoundCopy.expression);

        AssignVarStatement assign = new AssignVarStatement(new VariableExpression("$v"), new IntegerLiteral(1));
        AssignVarStatement assignCopy = check(assign);
        Assert.assertFalse(assignCopy.compound);
        Assert.assertNull(assignCopy.variable);

        IfStatement conditional = new IfStatement(new IntegerLiteral(1),
                Linq.list(new JumpStatement(JumpKind.RETURN)), Linq.list());
        Assert.assertTrue(conditional.hasElse());
        IfStatement conditionalCopy = check(conditional);
        Assert.assertNull(conditionalCopy.condition);
        Assert.assertNull(conditionalCopy.statements);
        Assert.assertFalse(conditionalCopy.hasElse());

        UnrollStatement unroll = new UnrollStatement(new IntegerLiteral(4), Linq.list(), RANGE);
        unroll.count = 4;
        UnrollStatement unrollCopy = check(unroll);
        Assert.assertEquals(4, unrollCopy.count);
        Assert.assertNull(unrollCopy.countExpression);

        WhileStatement loop = new WhileStatement(new IntegerLiteral(1), Linq.list(new JumpStatement(JumpKind.BREAK)));
        WhileStatement loopCopy = check(loop);
        Assert.assertNull(loopCopy.condition);
        Assert.assertNull(loopCopy.statements);

        JumpStatement jump = new JumpStatement(JumpKind.CONTINUE, RANGE);
        Assert.assertEquals(JumpKind.CONTINUE, check(jump).kind);
        Statement statement = jump.leafcopy();
        Assert.assertEquals("continue;", statement.toString());
    }

    @Test
    public void probes() {
        AttachPoint attachPoint = Samples.kprobe("vfs_*");
        attachPoint.setIndex("vfs_read", 3);
        attachPoint.functionOffset = 16;
        AttachPoint attachPointCopy = check(attachPoint);
        Assert.assertEquals("kprobe:vfs_*", attachPointCopy.rawInput);
        Assert.assertEquals("vfs_*", attachPointCopy.function);
        Assert.assertEquals(16, attachPointCopy.functionOffset);
        Assert.assertTrue(attachPointCopy.needExpansion);
        Assert.assertEquals(3, attachPointCopy.index("vfs_read"));
        // the index tables are independent
        attachPointCopy.setIndex("vfs_write", 4);
        Assert.assertEquals(0, attachPoint.index("vfs_write"));

        Predicate predicate = new Predicate(new IntegerLiteral(1));
        Assert.assertNull(check(predicate).expression);

        Probe probe = Samples.probe("vfs_read");
        probe.setIndex(5);
        probe.needExpansion = true;
        probe.needTracepointArgsStructs = true;
        Probe probeCopy = check(probe);
        Assert.assertEquals(5, probeCopy.index());
        Assert.assertTrue(probeCopy.needExpansion);
        Assert.assertTrue(probeCopy.needTracepointArgsStructs);
        Assert.assertNull(probeCopy.attachPoints);
        Assert.assertNull(probeCopy.predicate);
        Assert.assertNull(probeCopy.statements);
        Assert.assertEquals("", probeCopy.name());

        Program program = new Program("#include <linux/sched.h>", Linq.list(probe));
        Program programCopy = check(program);
        Assert.assertEquals("#include <linux/sched.h>", programCopy.cDefinitions);
        Assert.assertNull(programCopy.probes);
    }

    @Test
    public void leafcopyIsATemplate() {
        Expression sum = new BinaryExpression(new IntegerLiteral(1), ProbeOpcode.PLUS, new IntegerLiteral(2));
        Assert.assertEquals("<none> + <none>", sum.leafcopy().toString());
    }
}
