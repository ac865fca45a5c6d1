package org.tprobe.probeCompiler.compiler.visitors.inner;

import org.junit.Assert;
import org.junit.Test;
import org.tprobe.probeCompiler.compiler.ProbeCompiler;
import org.tprobe.probeCompiler.compiler.errors.InternalCompilerError;
import org.tprobe.probeCompiler.ir.Samples;
import org.tprobe.probeCompiler.ir.expression.BinaryExpression;
import org.tprobe.probeCompiler.ir.expression.ProbeOpcode;
import org.tprobe.probeCompiler.ir.expression.literal.IntegerLiteral;
import org.tprobe.probeCompiler.ir.probe.Probe;
import org.tprobe.probeCompiler.ir.statement.ExpressionStatement;
import org.tprobe.probeCompiler.ir.statement.Statement;
import org.tprobe.util.Linq;

public class OwnershipCheckerTests {
    @Test
    public void wellFormedTree() {
        OwnershipChecker checker = new OwnershipChecker(new ProbeCompiler());
        checker.apply(Samples.program(Samples.probe("vfs_read"), Samples.probe("vfs_write")));
        Assert.assertFalse(checker.hasProblem());
    }

    @Test
    public void aliasedNode() {
        IntegerLiteral one = new IntegerLiteral(1);
        Statement statement = new ExpressionStatement(new BinaryExpression(one, ProbeOpcode.PLUS, one));
        OwnershipChecker checker = new OwnershipChecker(new ProbeCompiler());
        InternalCompilerError error = Assert.assertThrows(InternalCompilerError.class, () -> checker.apply(statement));
        Assert.assertTrue(error.getMessage().contains("multiple instances"));
        Assert.assertSame(one, error.probeNode);
    }

    @Test
    public void releasedNodeStillReachable() {
        Probe probe = Samples.probe("vfs_read");
        Assert.assertNotNull(probe.statements);
        probe.statements.get(0).release();
        OwnershipChecker checker = new OwnershipChecker(new ProbeCompiler());
        InternalCompilerError error = Assert.assertThrows(InternalCompilerError.class, () -> checker.apply(probe));
        Assert.assertTrue(error.getMessage().contains("released"));
    }

    @Test
    public void sameStatementInTwoProbes() {
        Probe first = Samples.probe("vfs_read");
        Assert.assertNotNull(first.statements);
        Probe second = new Probe(Linq.list(Samples.kprobe("vfs_write")), null, Linq.list(first.statements.get(0)));
        ProbeCompiler compiler = new ProbeCompiler();
        Assert.assertThrows(InternalCompilerError.class, () -> compiler.validate(Samples.program(first, second)));
    }
}
