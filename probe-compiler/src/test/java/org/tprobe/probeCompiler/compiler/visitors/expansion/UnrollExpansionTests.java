package org.tprobe.probeCompiler.compiler.visitors.expansion;

import org.junit.Assert;
import org.junit.Test;
import org.tprobe.probeCompiler.compiler.CompilerOptions;
import org.tprobe.probeCompiler.compiler.ProbeCompiler;
import org.tprobe.probeCompiler.ir.Samples;
import org.tprobe.probeCompiler.ir.expression.BinaryExpression;
import org.tprobe.probeCompiler.ir.expression.ProbeOpcode;
import org.tprobe.probeCompiler.ir.expression.VariableExpression;
import org.tprobe.probeCompiler.ir.expression.literal.IntegerLiteral;
import org.tprobe.probeCompiler.ir.probe.Probe;
import org.tprobe.probeCompiler.ir.probe.Program;
import org.tprobe.probeCompiler.ir.statement.AssignVarStatement;
import org.tprobe.probeCompiler.ir.statement.JumpKind;
import org.tprobe.probeCompiler.ir.statement.JumpStatement;
import org.tprobe.probeCompiler.ir.statement.Statement;
import org.tprobe.probeCompiler.ir.statement.UnrollStatement;
import org.tprobe.util.Linq;
import org.tprobe.util.Logger;

import java.util.List;

public class UnrollExpansionTests {
    /** {@code unroll (count) { $i += 1; }} */
    static UnrollStatement unrollIncrement(long count) {
        VariableExpression variable = new VariableExpression("$i");
        AssignVarStatement increment = new AssignVarStatement(variable,
                new BinaryExpression(variable, ProbeOpcode.PLUS, new IntegerLiteral(1)),
                true, variable.getPositionRange());
        UnrollStatement result = new UnrollStatement(new IntegerLiteral(count), Linq.list(increment));
        result.count = count;
        return result;
    }

    static List<Statement> expandedBody(ProbeCompiler compiler, Statement... statements) {
        Probe probe = new Probe(Linq.list(Samples.kprobe("vfs_read")), null, Linq.list(statements));
        Program program = Samples.program(probe);
        Program result = new UnrollExpansion(compiler).apply(program).to(Program.class);
        compiler.validate(result);
        Probe expanded = result.checkNull(result.probes).get(0);
        return expanded.checkNull(expanded.statements);
    }

    @Test
    public void unrollCreatesIndependentCopies() {
        List<Statement> body = expandedBody(new ProbeCompiler(), unrollIncrement(3));
        Assert.assertEquals(3, body.size());
        for (Statement statement: body) {
            AssignVarStatement increment = statement.to(AssignVarStatement.class);
            Assert.assertEquals("$i += 1;", increment.toString());
            BinaryExpression sum = increment.checkNull(increment.expression).to(BinaryExpression.class);
            Assert.assertSame(increment.variable, sum.left);
            Assert.assertSame(increment.variable, sum.variable);
        }
        Assert.assertNotSame(body.get(0), body.get(1));
        Assert.assertNotSame(body.get(0).to(AssignVarStatement.class).variable,
                body.get(1).to(AssignVarStatement.class).variable);
    }

    @Test
    public void nestedUnroll() {
        UnrollStatement inner = new UnrollStatement(new IntegerLiteral(2),
                Linq.list(new JumpStatement(JumpKind.CONTINUE)));
        inner.count = 2;
        UnrollStatement outer = new UnrollStatement(new IntegerLiteral(3),
                Linq.list(inner, new JumpStatement(JumpKind.BREAK)));
        outer.count = 3;
        List<Statement> body = expandedBody(new ProbeCompiler(), outer);
        Assert.assertEquals(9, body.size());
        Assert.assertEquals(6, Linq.where(body, s -> s.to(JumpStatement.class).kind == JumpKind.CONTINUE).size());
    }

    @Test
    public void unevaluatedUnrollIsKept() {
        List<Statement> body = expandedBody(new ProbeCompiler(), unrollIncrement(0));
        Assert.assertEquals(1, body.size());
        Assert.assertTrue(body.get(0).is(UnrollStatement.class));
    }

    @Test
    public void countAboveLimit() {
        CompilerOptions options = new CompilerOptions();
        options.languageOptions.maxUnroll = 2;
        ProbeCompiler compiler = new ProbeCompiler(options);
        List<Statement> body = expandedBody(compiler, unrollIncrement(5));
        Assert.assertTrue(compiler.hasErrors());
        Assert.assertEquals(1, compiler.messages.errorCount());
        Assert.assertEquals("Invalid unroll", compiler.messages.getMessage(0).errorType);
        Assert.assertTrue(body.get(0).is(UnrollStatement.class));
    }

    @Test
    public void logging() {
        StringBuilder log = new StringBuilder();
        Appendable previous = Logger.INSTANCE.setDebugStream(log);
        try {
            Logger.INSTANCE.setLoggingLevel(UnrollExpansion.class, 1);
            expandedBody(new ProbeCompiler(), unrollIncrement(2));
            Assert.assertTrue(log.toString().contains("2 times"));
        } finally {
            Logger.INSTANCE.reset();
            Logger.INSTANCE.setDebugStream(previous);
        }
    }
}
