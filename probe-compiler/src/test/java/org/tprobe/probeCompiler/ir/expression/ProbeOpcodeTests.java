package org.tprobe.probeCompiler.ir.expression;

import org.junit.Assert;
import org.junit.Test;
import org.tprobe.probeCompiler.compiler.errors.UnimplementedException;
import org.tprobe.probeCompiler.ir.expression.literal.IntegerLiteral;
import org.tprobe.probeCompiler.ir.statement.JumpKind;
import org.tprobe.probeCompiler.ir.statement.JumpStatement;

public class ProbeOpcodeTests {
    @Test
    public void everyOpcodeRoundTrips() {
        for (ProbeOpcode opcode: ProbeOpcode.values())
            Assert.assertEquals(opcode, ProbeOpcode.fromText(opcode.toString(), opcode.isUnary));
        for (JumpKind kind: JumpKind.values())
            Assert.assertEquals(kind, JumpKind.fromText(kind.toString()));
    }

    @Test
    public void ambiguousTokens() {
        Assert.assertEquals(ProbeOpcode.NEG, ProbeOpcode.fromText("-", true));
        Assert.assertEquals(ProbeOpcode.MINUS, ProbeOpcode.fromText("-", false));
        Assert.assertEquals(ProbeOpcode.DEREF, ProbeOpcode.fromText("*", true));
        Assert.assertEquals(ProbeOpcode.MUL, ProbeOpcode.fromText("*", false));
    }

    @Test
    public void unknownTokens() {
        Assert.assertThrows(UnimplementedException.class, () -> ProbeOpcode.fromText("**", false));
        Assert.assertThrows(UnimplementedException.class, () -> ProbeOpcode.fromText("==", true));
        Assert.assertThrows(UnimplementedException.class, () -> JumpKind.fromText("goto"));
    }

    @Test
    public void opstr() {
        BinaryExpression shift = new BinaryExpression(new IntegerLiteral(1), ProbeOpcode.LEFT, new IntegerLiteral(4));
        Assert.assertEquals("<<", shift.opstr());
        UnaryExpression not = new UnaryExpression(ProbeOpcode.LNOT, new IntegerLiteral(0));
        Assert.assertEquals("!", not.opstr());
        Assert.assertEquals("break", new JumpStatement(JumpKind.BREAK).opstr());
        Assert.assertTrue(ProbeOpcode.LE.isComparison());
        Assert.assertFalse(ProbeOpcode.LAND.isComparison());
        Assert.assertTrue(ProbeOpcode.DECREMENT.hasSideEffects());
    }
}
