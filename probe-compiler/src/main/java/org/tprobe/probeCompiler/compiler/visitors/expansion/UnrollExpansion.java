/*
 * Copyright 2022 VMware, Inc.
 * SPDX-License-Identifier: MIT
 *
 * Permission is hereby granted, free of charge, to any person obtaining a copy
 * of this software and associated documentation files (the "Software"), to deal
 * in the Software without restriction, including without limitation the rights
 * to use, copy, modify, merge, publish, distribute, sublicense, and/or sell
 * copies of the Software, and to permit persons to whom the Software is
 * furnished to do so, subject to the following conditions:
 *
 * The above copyright notice and this permission notice shall be included in all
 * copies or substantial portions of the Software.
 *
 * THE SOFTWARE IS PROVIDED "AS IS", WITHOUT WARRANTY OF ANY KIND, EXPRESS OR
 * IMPLIED, INCLUDING BUT NOT LIMITED TO THE WARRANTIES OF MERCHANTABILITY,
 * FITNESS FOR A PARTICULAR PURPOSE AND NONINFRINGEMENT. IN NO EVENT SHALL THE
 * AUTHORS OR COPYRIGHT HOLDERS BE LIABLE FOR ANY CLAIM, DAMAGES OR OTHER
 * LIABILITY, WHETHER IN AN ACTION OF CONTRACT, TORT OR OTHERWISE, ARISING FROM,
 * OUT OF OR IN CONNECTION WITH THE SOFTWARE OR THE USE OR OTHER DEALINGS IN THE
 * SOFTWARE.
 *
 *
 */

package org.tprobe.probeCompiler.compiler.visitors.expansion;

import org.tprobe.probeCompiler.compiler.ProbeCompiler;
import org.tprobe.probeCompiler.compiler.visitors.inner.TreeCloner;
import org.tprobe.probeCompiler.ir.statement.Statement;
import org.tprobe.probeCompiler.ir.statement.UnrollStatement;
import org.tprobe.util.Logger;

import javax.annotation.Nullable;
import java.util.ArrayList;
import java.util.List;

/** Replaces each unroll statement whose count is known by that many copies of its body.
 * Unroll statements with a count of 0 have not been evaluated yet and are kept. */
public class UnrollExpansion extends TreeCloner {
    final int maxUnroll;

    public UnrollExpansion(ProbeCompiler compiler) {
        super(compiler);
        this.maxUnroll = compiler.options.languageOptions.maxUnroll;
    }

    @Override
    @Nullable
    protected List<Statement> transformStatements(@Nullable List<Statement> statements) {
        if (statements == null)
            return null;
        List<Statement> result = new ArrayList<>();
        for (Statement statement: statements) {
            UnrollStatement unroll = statement.as(UnrollStatement.class);
            if (unroll == null || unroll.count == 0) {
                result.add(this.transform(statement));
                continue;
            }
            if (unroll.count < 0 || unroll.count > this.maxUnroll) {
                this.compiler.reportError(unroll, "Invalid unroll",
                        "unroll count " + unroll.count + " must be between 1 and " + this.maxUnroll);
                result.add(this.transform(statement));
                continue;
            }
            Logger.INSTANCE.belowLevel(this, 1)
                    .append("Unrolling ")
                    .append(unroll.getId())
                    .append(" ")
                    .append(unroll.count)
                    .append(" times")
                    .newline();
            List<Statement> body = unroll.checkNull(unroll.statements);
            for (long i = 0; i < unroll.count; i++) {
                // Each copy needs its own nodes.
                UnrollExpansion copier = new UnrollExpansion(this.compiler);
                for (Statement inner: body)
                    result.addAll(copier.expand(inner));
                copier.endVisit();
            }
        }
        return result;
    }

    private List<Statement> expand(Statement statement) {
        List<Statement> expanded = this.transformStatements(List.of(statement));
        return statement.checkNull(expanded);
    }
}
