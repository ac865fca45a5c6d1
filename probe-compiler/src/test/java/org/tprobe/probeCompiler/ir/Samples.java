package org.tprobe.probeCompiler.ir;

import org.tprobe.probeCompiler.ir.expression.BinaryExpression;
import org.tprobe.probeCompiler.ir.expression.BuiltinExpression;
import org.tprobe.probeCompiler.ir.expression.CallExpression;
import org.tprobe.probeCompiler.ir.expression.IdentifierExpression;
import org.tprobe.probeCompiler.ir.expression.MapExpression;
import org.tprobe.probeCompiler.ir.expression.ProbeOpcode;
import org.tprobe.probeCompiler.ir.expression.VariableExpression;
import org.tprobe.probeCompiler.ir.expression.literal.IntegerLiteral;
import org.tprobe.probeCompiler.ir.expression.literal.StringLiteral;
import org.tprobe.probeCompiler.ir.probe.AttachPoint;
import org.tprobe.probeCompiler.ir.probe.Predicate;
import org.tprobe.probeCompiler.ir.probe.Probe;
import org.tprobe.probeCompiler.ir.probe.Program;
import org.tprobe.probeCompiler.ir.statement.AssignMapStatement;
import org.tprobe.probeCompiler.ir.statement.ExpressionStatement;
import org.tprobe.probeCompiler.ir.statement.IfStatement;
import org.tprobe.probeCompiler.ir.statement.Statement;
import org.tprobe.util.Linq;

import java.util.Arrays;
import java.util.List;

/** Small programs used by several tests. */
public class Samples {
    private Samples() {}

    public static AttachPoint kprobe(String function) {
        AttachPoint result = new AttachPoint("kprobe:" + function);
        result.provider = "kprobe";
        result.function = function;
        result.needExpansion = function.contains("*");
        return result;
    }

    /** {@code if ($x > 1) { @m = $x; }} */
    public static IfStatement conditionalStore() {
        BinaryExpression condition = new BinaryExpression(
                new VariableExpression("$x"), ProbeOpcode.GT, new IntegerLiteral(1));
        Statement store = new AssignMapStatement(new MapExpression("@m"), new VariableExpression("$x"));
        return new IfStatement(condition, Linq.list(store));
    }

    /** {@code if ($c) { a; b; } else { c; }} */
    public static IfStatement ifElse() {
        return new IfStatement(new VariableExpression("$c"),
                Linq.list(new ExpressionStatement(new IdentifierExpression("a")),
                        new ExpressionStatement(new IdentifierExpression("b"))),
                Linq.list(new ExpressionStatement(new IdentifierExpression("c"))));
    }

    /** {@code @count[comm] += 1;} */
    public static AssignMapStatement compoundIncrement() {
        MapExpression map = new MapExpression("@count", Linq.list(new BuiltinExpression("comm")));
        BinaryExpression sum = new BinaryExpression(map, ProbeOpcode.PLUS, new IntegerLiteral(1));
        return new AssignMapStatement(map, sum, true, map.getPositionRange());
    }

    /** {@code kprobe:<function> /pid == 1/ { printf("hi"); @count[comm] += 1; <extra> }} */
    public static Probe probe(String function, Statement... extra) {
        Predicate predicate = new Predicate(new BinaryExpression(
                new BuiltinExpression("pid"), ProbeOpcode.EQ, new IntegerLiteral(1)));
        List<Statement> body = Linq.list(
                new ExpressionStatement(new CallExpression("printf", Linq.list(new StringLiteral("hi")))),
                compoundIncrement());
        body.addAll(Arrays.asList(extra));
        return new Probe(Linq.list(kprobe(function)), predicate, body);
    }

    public static Program program(Probe... probes) {
        return new Program("", Linq.list(probes));
    }
}
