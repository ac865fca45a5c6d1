package org.tprobe.probeCompiler.compiler.errors;

import com.fasterxml.jackson.databind.JsonNode;
import org.junit.Assert;
import org.junit.Test;
import org.tprobe.probeCompiler.compiler.CompilerOptions;
import org.tprobe.probeCompiler.compiler.ProbeCompiler;
import org.tprobe.probeCompiler.ir.Samples;
import org.tprobe.probeCompiler.ir.probe.AttachPoint;

import java.io.ByteArrayOutputStream;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;

public class CompilerMessagesTests {
    @Test
    public void warningsAndErrors() {
        ProbeCompiler compiler = new ProbeCompiler();
        SourcePositionRange range = new SourcePositionRange(1, 2, 1, 9);
        compiler.reportWarning(range, "No match", "nothing found");
        Assert.assertFalse(compiler.hasErrors());
        compiler.reportError(range, "Invalid unroll", "too many");
        Assert.assertTrue(compiler.hasErrors());
        Assert.assertEquals(1, compiler.messages.warningCount());
        Assert.assertEquals(1, compiler.messages.errorCount());
        String text = compiler.messages.toString();
        Assert.assertTrue(text.contains("warning: No match: nothing found"));
        Assert.assertTrue(text.contains("error: Invalid unroll: too many"));
        compiler.messages.clear();
        Assert.assertTrue(compiler.messages.isEmpty());
        Assert.assertFalse(compiler.hasErrors());
    }

    @Test
    public void json() {
        ProbeCompiler compiler = new ProbeCompiler(CompilerOptions.fromArguments("-je"));
        AttachPoint attachPoint = Samples.kprobe("ext4_*");
        compiler.reportWarning(attachPoint, "No match", "no function matches");
        JsonNode messages = compiler.messages.toJson();
        Assert.assertTrue(messages.isArray());
        Assert.assertEquals(1, messages.size());
        JsonNode message = messages.get(0);
        Assert.assertTrue(message.get("warning").asBoolean());
        Assert.assertEquals("No match", message.get("error_type").asText());
        Assert.assertEquals("no function matches", message.get("message").asText());
        Assert.assertTrue(compiler.messages.toString().contains("\"error_type\""));
    }

    @Test
    public void quietHidesWarnings() {
        ProbeCompiler compiler = new ProbeCompiler(CompilerOptions.fromArguments("-q"));
        compiler.reportWarning(SourcePositionRange.INVALID, "No match", "hidden");
        Assert.assertEquals("", compiler.messages.toString());
    }

    @Test
    public void showErrorsPrintsOnlyWhenNeeded() {
        ProbeCompiler compiler = new ProbeCompiler(CompilerOptions.fromArguments("-q"));
        ByteArrayOutputStream bytes = new ByteArrayOutputStream();
        PrintStream stream = new PrintStream(bytes, true, StandardCharsets.UTF_8);
        compiler.reportWarning(SourcePositionRange.INVALID, "No match", "hidden");
        compiler.showErrors(stream);
        Assert.assertEquals(0, bytes.size());
        compiler.reportError(SourcePositionRange.INVALID, "Invalid unroll", "shown");
        compiler.showErrors(stream);
        String output = bytes.toString(StandardCharsets.UTF_8);
        Assert.assertTrue(output, output.contains("error: Invalid unroll: shown"));
        Assert.assertFalse(output, output.contains("hidden"));
    }

    @Test
    public void throwOnError() {
        ProbeCompiler compiler = new ProbeCompiler(CompilerOptions.fromArguments("--throwOnError"));
        compiler.reportWarning(SourcePositionRange.INVALID, "No match", "only a warning");
        Assert.assertThrows(CompilationError.class,
                () -> compiler.reportError(SourcePositionRange.INVALID, "Invalid unroll", "fatal"));
    }

    @Test
    public void exceptionAsMessage() {
        ProbeCompiler compiler = new ProbeCompiler();
        compiler.messages.reportError(new InternalCompilerError("broken", Samples.kprobe("vfs_read")));
        Assert.assertEquals("Compiler error", compiler.messages.getMessage(0).errorType);
        Assert.assertEquals("broken", compiler.messages.getMessage(0).message);
    }
}
