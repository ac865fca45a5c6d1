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

package org.tprobe.probeCompiler.compiler.errors;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.tprobe.probeCompiler.compiler.IHasSourcePositionRange;
import org.tprobe.probeCompiler.compiler.ProbeCompiler;
import org.tprobe.util.Utilities;

import java.io.PrintStream;
import java.util.ArrayList;
import java.util.List;

/** Errors and warnings reported by the compiler passes, in the order they were produced. */
public class CompilerMessages {
    public static class Message implements IHasSourcePositionRange {
        public final SourcePositionRange range;
        public final boolean warning;
        public final boolean continuation;
        public final String errorType;
        public final String message;

        protected Message(IHasSourcePositionRange range,
                          boolean warning, boolean continuation,
                          String errorType, String message) {
            this.range = range.getPositionRange();
            this.warning = warning;
            this.errorType = errorType;
            this.message = message;
            this.continuation = continuation;
        }

        Message(BaseCompilerException e) {
            this(e.getPositionRange(), false, false, e.getErrorKind(),
                    e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName());
        }

        public void format(StringBuilder output) {
            if (this.range.isValid()) {
                output.append(this.range.start)
                        .append(": ");
            }
            if (!this.continuation) {
                if (this.warning)
                    output.append("warning:");
                else
                    output.append("error:");
                output.append(" ")
                        .append(this.errorType)
                        .append(": ");
            }
            output.append(this.message)
                    .append(System.lineSeparator());
        }

        public JsonNode toJson(ObjectMapper mapper) {
            ObjectNode result = mapper.createObjectNode();
            this.range.appendAsJson(result);
            result.put("warning", this.warning);
            result.put("error_type", this.errorType);
            result.put("message", this.message);
            return result;
        }

        @Override
        public String toString() {
            StringBuilder builder = new StringBuilder();
            this.format(builder);
            return builder.toString();
        }

        @Override
        public SourcePositionRange getPositionRange() {
            return this.range;
        }
    }

    public final ProbeCompiler compiler;
    public final List<Message> messages;
    public int exitCode = 0;

    public CompilerMessages(ProbeCompiler compiler) {
        this.compiler = compiler;
        this.messages = new ArrayList<>();
    }

    public void clear() {
        this.messages.clear();
        this.exitCode = 0;
    }

    void reportError(Message message) {
        this.messages.add(message);
        if (!message.warning) {
            this.exitCode = 1;
        }
    }

    public void reportProblem(IHasSourcePositionRange range, boolean warning, boolean continuation,
                              String errorType, String message) {
        Message msg = new Message(range, warning, continuation, errorType, message);
        this.reportError(msg);
    }

    public void reportError(BaseCompilerException e) {
        this.reportError(new Message(e));
    }

    public int errorCount() {
        return (int)this.messages.stream().filter(m -> !m.warning).count();
    }

    public int warningCount() {
        return (int)this.messages.stream().filter(m -> m.warning).count();
    }

    public Message getMessage(int index) {
        return this.messages.get(index);
    }

    public boolean isEmpty() {
        return this.messages.isEmpty();
    }

    public void show(PrintStream stream) {
        if (this.errorCount() +
                (this.compiler.options.ioOptions.quiet ? 0 : this.warningCount()) > 0)
            stream.println(this);
    }

    @Override
    public String toString() {
        StringBuilder builder = new StringBuilder();
        if (this.compiler.options.ioOptions.emitJsonErrors) {
            JsonNode node = this.toJson();
            builder.append(node.toPrettyString());
        } else {
            for (Message message: this.messages) {
                if (this.compiler.options.ioOptions.quiet && message.warning)
                    continue;
                message.format(builder);
            }
        }
        return builder.toString();
    }

    public JsonNode toJson() {
        ObjectMapper mapper = Utilities.deterministicObjectMapper();
        ArrayNode result = mapper.createArrayNode();
        for (Message message: this.messages) {
            JsonNode node = message.toJson(mapper);
            result.add(node);
        }
        return result;
    }
}
