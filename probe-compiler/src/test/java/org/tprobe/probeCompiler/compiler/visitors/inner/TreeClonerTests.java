package org.tprobe.probeCompiler.compiler.visitors.inner;

import org.junit.Assert;
import org.junit.Test;
import org.tprobe.probeCompiler.compiler.ProbeCompiler;
import org.tprobe.probeCompiler.compiler.visitors.VisitDecision;
import org.tprobe.probeCompiler.ir.IProbeNode;
import org.tprobe.probeCompiler.ir.Samples;
import org.tprobe.probeCompiler.ir.expression.BinaryExpression;
import org.tprobe.probeCompiler.ir.expression.MapExpression;
import org.tprobe.probeCompiler.ir.probe.Probe;
import org.tprobe.probeCompiler.ir.probe.Program;
import org.tprobe.probeCompiler.ir.statement.AssignMapStatement;
import org.tprobe.probeCompiler.ir.statement.IfStatement;
import org.tprobe.probeCompiler.ir.type.SizedType;

import java.util.HashSet;
import java.util.Set;

public class TreeClonerTests {
    static Set<Long> ids(IProbeNode root) {
        Set<Long> result = new HashSet<>();
        InnerVisitor collector = new InnerVisitor(new ProbeCompiler()) {
            @Override
            public VisitDecision preorder(IProbeNode node) {
                result.add(node.getId());
                return VisitDecision.CONTINUE;
            }
        };
        collector.apply(root);
        return result;
    }

    @Test
    public void cloneIsIndependent() {
        Probe probe = Samples.probe("vfs_read");
        probe.setIndex(2);
        Program program = Samples.program(probe);
        ProbeCompiler compiler = new ProbeCompiler();
        Program clone = new TreeCloner(compiler).apply(program).to(Program.class);

        Assert.assertEquals(program.toString(), clone.toString());
        Set<Long> originalIds = ids(program);
        Set<Long> cloneIds = ids(clone);
        Assert.assertEquals(originalIds.size(), cloneIds.size());
        cloneIds.retainAll(originalIds);
        Assert.assertTrue(cloneIds.isEmpty());
        Assert.assertNotNull(clone.probes);
        Assert.assertEquals(2, clone.probes.get(0).index());

        // Releasing the original leaves the clone intact.
        program.release();
        compiler.validate(clone);
        clone.release();
    }

    @Test
    public void compoundSharingIsPreserved() {
        AssignMapStatement statement = Samples.compoundIncrement();
        Assert.assertNotNull(statement.expression);
        statement.expression.type = SizedType.integer(8, true);
        AssignMapStatement clone = new TreeCloner(new ProbeCompiler())
                .apply(statement).to(AssignMapStatement.class);

        Assert.assertTrue(clone.compound);
        MapExpression map = clone.map;
        Assert.assertNotNull(map);
        Assert.assertNotSame(statement.map, map);
        BinaryExpression sum = clone.checkNull(clone.expression).to(BinaryExpression.class);
        Assert.assertSame(map, sum.left);
        Assert.assertSame(map, sum.map);
        Assert.assertEquals(SizedType.integer(8, true), sum.type);
        Assert.assertNotNull(map.keys);
        Assert.assertSame(map, map.keys.get(0).keyForMap);
        new OwnershipChecker(new ProbeCompiler()).apply(clone);
        clone.release();
        Assert.assertTrue(map.isReleased());
    }

    @Test
    public void outsideBackReferencesAreKept() {
        MapExpression outside = new MapExpression("@elsewhere");
        AssignMapStatement statement = Samples.compoundIncrement();
        Assert.assertNotNull(statement.map);
        Assert.assertNotNull(statement.map.keys);
        statement.map.keys.get(0).map = outside;
        AssignMapStatement clone = new TreeCloner(new ProbeCompiler())
                .apply(statement).to(AssignMapStatement.class);
        Assert.assertNotNull(clone.map);
        Assert.assertNotNull(clone.map.keys);
        Assert.assertSame(outside, clone.map.keys.get(0).map);
    }

    @Test
    public void elseBranchIsCloned() {
        IfStatement statement = Samples.ifElse();
        IfStatement clone = new TreeCloner(new ProbeCompiler()).apply(statement).to(IfStatement.class);
        Assert.assertEquals(statement.toString(), clone.toString());
        Assert.assertTrue(clone.hasElse());
        Assert.assertNotNull(clone.elseStatements);
        Assert.assertNotNull(statement.elseStatements);
        Assert.assertEquals(1, clone.elseStatements.size());
        Assert.assertNotSame(statement.elseStatements.get(0), clone.elseStatements.get(0));
        Assert.assertEquals(2, clone.checkNull(clone.statements).size());
        statement.release();
        Assert.assertFalse(clone.elseStatements.get(0).isReleased());
    }
}
