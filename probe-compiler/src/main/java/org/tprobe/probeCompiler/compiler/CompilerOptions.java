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

package org.tprobe.probeCompiler.compiler;

import com.beust.jcommander.DynamicParameter;
import com.beust.jcommander.JCommander;
import com.beust.jcommander.Parameter;
import com.beust.jcommander.ParametersDelegate;

import java.util.HashMap;
import java.util.Map;

/** Options controlling the probe compiler. */
@SuppressWarnings("CanBeFinal")
// These fields cannot be final, since JCommander writes them through reflection.
public class CompilerOptions {
    /** Options related to the language compiled. */
    @SuppressWarnings("CanBeFinal")
    public static class Language {
        @Parameter(names = "--max-unroll", description = "Maximum number of iterations of an unroll statement")
        public int maxUnroll = 100;
        @Parameter(names = "--validate", description = "Check the ownership structure of the tree after each expansion")
        public boolean validate = false;
        /** Useful for development */
        @Parameter(names = "--throwOnError", description = "Throw an exception on the first compilation error")
        public boolean throwOnError = false;

        @Override
        public String toString() {
            return "Language{" +
                    "maxUnroll=" + this.maxUnroll +
                    ", validate=" + this.validate +
                    ", throwOnError=" + this.throwOnError +
                    '}';
        }
    }

    /** Options related to input and output. */
    @SuppressWarnings("CanBeFinal")
    public static class IO {
        @DynamicParameter(names = "-T",
                description = "Specify logging level for a class (can be repeated)")
        public Map<String, String> loggingLevel = new HashMap<>();
        @Parameter(names = {"--je", "-je"}, description = "Emit error messages as a JSON array")
        public boolean emitJsonErrors = false;
        @Parameter(names = "-q", description = "Quiet: do not print warnings")
        public boolean quiet = false;

        @Override
        public String toString() {
            return "IO{" +
                    "loggingLevel=" + this.loggingLevel +
                    ", emitJsonErrors=" + this.emitJsonErrors +
                    ", quiet=" + this.quiet +
                    '}';
        }
    }

    @ParametersDelegate
    public Language languageOptions = new Language();
    @ParametersDelegate
    public IO ioOptions = new IO();

    /** Parse the options from a command line.
     * @throws com.beust.jcommander.ParameterException if the arguments are not valid. */
    public static CompilerOptions fromArguments(String... arguments) {
        CompilerOptions result = new CompilerOptions();
        JCommander commander = JCommander.newBuilder()
                .addObject(result)
                .build();
        commander.setProgramName("probe-compiler");
        commander.parse(arguments);
        return result;
    }

    @Override
    public String toString() {
        return "CompilerOptions{" +
                "languageOptions=" + this.languageOptions +
                ", ioOptions=" + this.ioOptions +
                '}';
    }
}
