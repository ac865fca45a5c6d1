package org.tprobe.probeCompiler.compiler;

import com.beust.jcommander.ParameterException;
import org.junit.Assert;
import org.junit.Test;
import org.tprobe.probeCompiler.compiler.errors.CompilationError;
import org.tprobe.probeCompiler.compiler.visitors.inner.TreeCloner;
import org.tprobe.util.Logger;

public class CompilerOptionsTests {
    @Test
    public void defaults() {
        CompilerOptions options = CompilerOptions.fromArguments();
        Assert.assertEquals(100, options.languageOptions.maxUnroll);
        Assert.assertFalse(options.languageOptions.validate);
        Assert.assertFalse(options.languageOptions.throwOnError);
        Assert.assertFalse(options.ioOptions.quiet);
        Assert.assertFalse(options.ioOptions.emitJsonErrors);
        Assert.assertTrue(options.ioOptions.loggingLevel.isEmpty());
    }

    @Test
    public void parse() {
        CompilerOptions options = CompilerOptions.fromArguments(
                "--max-unroll", "5", "--validate", "-q", "-je", "-TTreeCloner=2");
        Assert.assertEquals(5, options.languageOptions.maxUnroll);
        Assert.assertTrue(options.languageOptions.validate);
        Assert.assertTrue(options.ioOptions.quiet);
        Assert.assertTrue(options.ioOptions.emitJsonErrors);
        Assert.assertEquals("2", options.ioOptions.loggingLevel.get("TreeCloner"));
        Assert.assertTrue(options.toString().contains("maxUnroll=5"));
    }

    @Test
    public void unknownOption() {
        Assert.assertThrows(ParameterException.class, () -> CompilerOptions.fromArguments("--no-such-option"));
    }

    @Test
    public void loggingLevelsAreApplied() {
        try {
            new ProbeCompiler(CompilerOptions.fromArguments("-TTreeCloner=2"));
            Assert.assertEquals(2, Logger.INSTANCE.getLoggingLevel(TreeCloner.class));
        } finally {
            Logger.INSTANCE.reset();
        }
    }

    @Test
    public void badLoggingLevel() {
        try {
            ProbeCompiler compiler = new ProbeCompiler(CompilerOptions.fromArguments("-TTreeCloner=high"));
            Assert.assertTrue(compiler.hasErrors());
            Assert.assertThrows(CompilationError.class,
                    () -> new ProbeCompiler(CompilerOptions.fromArguments("-TNoSuchPass=1")));
        } finally {
            Logger.INSTANCE.reset();
        }
    }
}
