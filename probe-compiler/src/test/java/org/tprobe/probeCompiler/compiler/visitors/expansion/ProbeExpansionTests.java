package org.tprobe.probeCompiler.compiler.visitors.expansion;

import org.junit.Assert;
import org.junit.Test;
import org.tprobe.probeCompiler.compiler.CompilerOptions;
import org.tprobe.probeCompiler.compiler.ProbeCompiler;
import org.tprobe.probeCompiler.ir.Samples;
import org.tprobe.probeCompiler.ir.probe.AttachPoint;
import org.tprobe.probeCompiler.ir.probe.Probe;
import org.tprobe.probeCompiler.ir.probe.Program;
import org.tprobe.util.Linq;

import java.util.List;

public class ProbeExpansionTests {
    static final IAttachPointResolver VFS = attachPoint -> {
        if (attachPoint.function.equals("vfs_*"))
            return List.of("vfs_read", "vfs_write");
        return List.of();
    };

    @Test
    public void wildcardCreatesOneProbePerMatch() {
        Probe probe = Samples.probe("vfs_*");
        Program program = Samples.program(probe);
        ProbeCompiler compiler = new ProbeCompiler();
        Program result = new ProbeExpansion(compiler, VFS).apply(program).to(Program.class);

        List<Probe> probes = result.checkNull(result.probes);
        Assert.assertEquals(2, probes.size());
        Assert.assertEquals("kprobe:vfs_read", probes.get(0).name());
        Assert.assertEquals("kprobe:vfs_write", probes.get(1).name());
        Assert.assertEquals(0, probes.get(0).index());
        Assert.assertEquals(1, probes.get(1).index());
        for (Probe expanded: probes) {
            AttachPoint attachPoint = expanded.checkNull(expanded.attachPoints).get(0);
            Assert.assertFalse(attachPoint.needExpansion);
            Assert.assertEquals("kprobe:vfs_*", attachPoint.rawInput);
            Assert.assertEquals(List.of("vfs_read", "vfs_write"), attachPoint.indexedNames());
        }
        // The bodies differ only by their attach point.
        String first = probes.get(0).toString().replace("vfs_read", "F");
        String second = probes.get(1).toString().replace("vfs_write", "F");
        Assert.assertEquals(first, second);
        Assert.assertNotSame(probes.get(0).statements, probes.get(1).statements);
        compiler.validate(result);

        AttachPoint wildcard = probe.checkNull(probe.attachPoints).get(0);
        Assert.assertEquals(0, wildcard.index("vfs_read"));
        Assert.assertEquals(1, wildcard.index("vfs_write"));
        Assert.assertEquals(1, program.checkNull(program.probes).size());
    }

    @Test
    public void mixedProbes() {
        Probe plain = Samples.probe("do_exit");
        AttachPoint wildcard = Samples.kprobe("vfs_*");
        AttachPoint exact = Samples.kprobe("do_fork");
        Probe mixed = new Probe(Linq.list(wildcard, exact), null, Linq.list());
        ProbeCompiler compiler = new ProbeCompiler();
        Program result = new ProbeExpansion(compiler, VFS)
                .apply(Samples.program(plain, mixed)).to(Program.class);
        List<Probe> probes = result.checkNull(result.probes);
        Assert.assertEquals(List.of("kprobe:do_exit", "kprobe:vfs_read", "kprobe:vfs_write", "kprobe:do_fork"),
                Linq.map(probes, Probe::name));
        Assert.assertEquals(List.of(0, 1, 2, 3), Linq.map(probes, Probe::index));
        // The index table of an attach point starts at 0 even when other probes precede it.
        Assert.assertEquals(0, wildcard.index("vfs_read"));
        Assert.assertEquals(1, wildcard.index("vfs_write"));
        Assert.assertFalse(compiler.hasErrors());
    }

    @Test
    public void repeatedMatchesCreateOneProbe() {
        IAttachPointResolver repeating = attachPoint -> List.of("vfs_read", "vfs_write", "vfs_read");
        Probe probe = Samples.probe("vfs_*");
        ProbeCompiler compiler = new ProbeCompiler();
        Program result = new ProbeExpansion(compiler, repeating)
                .apply(Samples.program(probe)).to(Program.class);
        List<Probe> probes = result.checkNull(result.probes);
        Assert.assertEquals(List.of("kprobe:vfs_read", "kprobe:vfs_write"), Linq.map(probes, Probe::name));
        Assert.assertEquals(List.of(0, 1), Linq.map(probes, Probe::index));
        AttachPoint wildcard = probe.checkNull(probe.attachPoints).get(0);
        Assert.assertEquals(List.of("vfs_read", "vfs_write"), wildcard.indexedNames());
        Assert.assertEquals(0, wildcard.index("vfs_read"));
        Assert.assertEquals(1, wildcard.index("vfs_write"));
        compiler.validate(result);
    }

    @Test
    public void wildcardWithoutMatches() {
        Probe probe = Samples.probe("ext4_*");
        ProbeCompiler compiler = new ProbeCompiler();
        Program result = new ProbeExpansion(compiler, VFS)
                .apply(Samples.program(probe)).to(Program.class);
        Assert.assertTrue(result.checkNull(result.probes).isEmpty());
        Assert.assertFalse(compiler.hasErrors());
        Assert.assertEquals(1, compiler.messages.warningCount());
    }

    @Test
    public void expandWholeProgram() {
        CompilerOptions options = CompilerOptions.fromArguments("--validate");
        ProbeCompiler compiler = new ProbeCompiler(options);
        Probe probe = Samples.probe("vfs_*", UnrollExpansionTests.unrollIncrement(2));
        Program program = Samples.program(probe);
        String before = program.toString();

        Program result = compiler.expand(program, VFS);
        List<Probe> probes = result.checkNull(result.probes);
        Assert.assertEquals(2, probes.size());
        // printf, the compound increment, and two unrolled increments
        Assert.assertEquals(4, probes.get(1).checkNull(probes.get(1).statements).size());
        Assert.assertEquals(before, program.toString());
        Assert.assertTrue(probe.checkNull(probe.attachPoints).get(0).indexedNames().isEmpty());
        result.release();
        Assert.assertFalse(program.isReleased());
    }
}
