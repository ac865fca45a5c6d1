package org.tprobe.probeCompiler.ir.probe;

import org.junit.Assert;
import org.junit.Test;
import org.tprobe.probeCompiler.ir.Samples;
import org.tprobe.util.Linq;

import java.util.List;

public class AttachPointTests {
    @Test
    public void nameWithOffset() {
        AttachPoint attachPoint = new AttachPoint("uprobe:/bin/sh:readline+8");
        attachPoint.provider = "uprobe";
        attachPoint.target = "/bin/sh";
        attachPoint.function = "readline";
        attachPoint.functionOffset = 8;
        Assert.assertEquals("uprobe:/bin/sh:readline+8", attachPoint.name(attachPoint.function));
        // the offset is only printed after a function
        Assert.assertEquals("uprobe:/bin/sh", attachPoint.name(""));
    }

    @Test
    public void nameOfWatchpoint() {
        AttachPoint attachPoint = new AttachPoint("watchpoint:0x1000:8:rw");
        attachPoint.provider = "watchpoint";
        attachPoint.address = 0x1000;
        attachPoint.length = 8;
        attachPoint.mode = "rw";
        Assert.assertEquals("watchpoint:4096:8:rw", attachPoint.name(attachPoint.function));
    }

    @Test
    public void nameOfProfile() {
        AttachPoint attachPoint = new AttachPoint("profile:hz:99");
        attachPoint.provider = "profile";
        attachPoint.target = "hz";
        attachPoint.frequency = 99;
        Assert.assertEquals("profile:hz:99", attachPoint.name(""));
    }

    @Test
    public void nameWithExplicitTarget() {
        AttachPoint attachPoint = new AttachPoint("usdt:/bin/app:myprov:start");
        attachPoint.provider = "usdt";
        attachPoint.target = "/bin/app";
        attachPoint.namespace = "myprov";
        attachPoint.function = "start";
        Assert.assertEquals("usdt:/bin/app:myprov:start", attachPoint.name("start"));
        Assert.assertEquals("usdt:/lib/other.so:myprov:stop", attachPoint.name("/lib/other.so", "stop"));
        Assert.assertEquals("usdt:myprov:stop", attachPoint.name("", "stop"));
    }

    @Test
    public void nameIsPure() {
        AttachPoint attachPoint = Samples.kprobe("vfs_read");
        String first = attachPoint.name(attachPoint.function);
        Assert.assertEquals(first, attachPoint.name(attachPoint.function));
        Assert.assertEquals("kprobe:vfs_read", first);
        Assert.assertEquals("kprobe:vfs_read", attachPoint.toString());
    }

    @Test
    public void indexTable() {
        AttachPoint attachPoint = Samples.kprobe("vfs_*");
        Assert.assertEquals(0, attachPoint.index("vfs_read"));
        attachPoint.setIndex("vfs_write", 2);
        attachPoint.setIndex("vfs_read", 1);
        Assert.assertEquals(2, attachPoint.index("vfs_write"));
        Assert.assertEquals(1, attachPoint.index("vfs_read"));
        attachPoint.setIndex("vfs_write", 7);
        Assert.assertEquals(7, attachPoint.index("vfs_write"));
        // insertion order survives updates
        Assert.assertEquals(List.of("vfs_write", "vfs_read"), attachPoint.indexedNames());
        Assert.assertEquals(0, attachPoint.index("vfs_open"));
    }

    @Test
    public void usdtEntry() {
        AttachPoint attachPoint = new AttachPoint("usdt:/bin/app:start");
        Assert.assertTrue(attachPoint.usdt.isEmpty());
        attachPoint.usdt = new UsdtProbeEntry("/bin/app", "app", "start", 2);
        Assert.assertFalse(attachPoint.leafcopy().usdt.isEmpty());
        Assert.assertEquals(2, attachPoint.leafcopy().usdt.numLocations());
    }

    @Test
    public void probeName() {
        AttachPoint read = Samples.kprobe("vfs_read");
        AttachPoint write = Samples.kprobe("vfs_write");
        Probe probe = new Probe(Linq.list(read, write), null, Linq.list());
        Assert.assertEquals("kprobe:vfs_read,kprobe:vfs_write", probe.name());
        Assert.assertEquals(0, probe.index());
        probe.setIndex(3);
        Assert.assertEquals(3, probe.index());
        Assert.assertFalse(probe.needExpansion);
        Assert.assertFalse(probe.needTracepointArgsStructs);
    }
}
