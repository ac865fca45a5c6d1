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
import org.tprobe.probeCompiler.compiler.visitors.VisitDecision;
import org.tprobe.probeCompiler.compiler.visitors.inner.TreeCloner;
import org.tprobe.probeCompiler.ir.IProbeNode;
import org.tprobe.probeCompiler.ir.probe.AttachPoint;
import org.tprobe.probeCompiler.ir.probe.Predicate;
import org.tprobe.probeCompiler.ir.probe.Probe;
import org.tprobe.probeCompiler.ir.probe.Program;
import org.tprobe.probeCompiler.ir.statement.Statement;
import org.tprobe.util.Linq;
import org.tprobe.util.Logger;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;

/**
 * Creates a separate probe for every function matched by a wildcard attach point.
 *
 * <p>Each created probe has a single attach point, whose function is the matched
 * symbol, and a private copy of the predicate and body of the original probe.
 * Probes which need no expansion are copied unchanged.  All probes of the result
 * are numbered consecutively from 0.  Each wildcard attach point of the input
 * numbers its distinct matches from 0, in the order produced by the resolver.
 */
public class ProbeExpansion extends TreeCloner {
    final IAttachPointResolver resolver;
    int probeIndex;

    public ProbeExpansion(ProbeCompiler compiler, IAttachPointResolver resolver) {
        super(compiler);
        this.resolver = resolver;
        this.probeIndex = 0;
    }

    @Override
    public void startVisit(IProbeNode node) {
        super.startVisit(node);
        this.probeIndex = 0;
    }

    static boolean needsExpansion(Probe probe) {
        return probe.needExpansion ||
                Linq.any(probe.checkNull(probe.attachPoints), ap -> ap.needExpansion);
    }

    /** A new probe attached to the specified function. */
    Probe instantiate(Probe probe, AttachPoint attachPoint, String function) {
        TreeCloner cloner = new TreeCloner(this.compiler);
        Predicate predicate = null;
        if (probe.predicate != null)
            predicate = cloner.apply(probe.predicate).to(Predicate.class);
        List<Statement> statements = new ArrayList<>();
        for (Statement statement: probe.checkNull(probe.statements))
            statements.add(cloner.apply(statement).to(Statement.class));

        AttachPoint single = attachPoint.leafcopy();
        single.function = function;
        single.needExpansion = false;
        Probe result = new Probe(Linq.list(single), predicate, statements, probe.getPositionRange());
        result.needTracepointArgsStructs = probe.needTracepointArgsStructs;
        result.setIndex(this.probeIndex++);
        Logger.INSTANCE.belowLevel(this, 2)
                .append("Probe ")
                .append(result.index())
                .append(": ")
                .append(result.name())
                .newline();
        return result;
    }

    void expand(Probe probe, List<Probe> result) {
        for (AttachPoint attachPoint: probe.checkNull(probe.attachPoints)) {
            if (!attachPoint.needExpansion) {
                result.add(this.instantiate(probe, attachPoint, attachPoint.function));
                continue;
            }
            // A symbol matched twice still produces a single probe.
            List<String> matches = new ArrayList<>(new LinkedHashSet<>(this.resolver.resolve(attachPoint)));
            if (matches.isEmpty()) {
                this.compiler.reportWarning(attachPoint, "No match",
                        "Attach point " + attachPoint.rawInput + " does not match any function");
                continue;
            }
            for (int i = 0; i < matches.size(); i++)
                attachPoint.setIndex(matches.get(i), i);
            for (String match: matches)
                result.add(this.instantiate(probe, attachPoint, match));
        }
    }

    @Override
    public VisitDecision preorder(Program node) {
        this.push(node);
        List<Probe> probes = new ArrayList<>();
        for (Probe probe: node.checkNull(node.probes)) {
            if (needsExpansion(probe)) {
                this.expand(probe, probes);
            } else {
                Probe copy = this.transform(probe);
                copy.setIndex(this.probeIndex++);
                probes.add(copy);
            }
        }
        this.pop(node);
        Logger.INSTANCE.belowLevel(this, 1)
                .append("Expanded ")
                .append(node.checkNull(node.probes).size())
                .append(" probes into ")
                .append(probes.size())
                .newline();
        this.map(node, new Program(node.cDefinitions, probes, node.getPositionRange()));
        return VisitDecision.STOP;
    }
}
