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

/** Interface for reporting errors.
 * Passes attach problems to the location of the offending node;
 * the tree itself never reports anything. */
public interface IErrorReporter {
    /** Report a problem (error or warning).
     *
     * @param range     Source position where the problem occurred.
     * @param warning   If true, this is a warning.
     * @param continuation If true, this is the continuation of a multi-line message.
     * @param errorType Type of error.
     * @param message   Message to report.
     */
    void reportProblem(IHasSourcePositionRange range, boolean warning, boolean continuation,
                       String errorType, String message);

    default void reportError(IHasSourcePositionRange range, String errorType, String message) {
        this.reportProblem(range, false, false, errorType, message);
    }

    default void reportWarning(IHasSourcePositionRange range, String errorType, String message) {
        this.reportProblem(range, true, false, errorType, message);
    }

    /** True if any error (but not a warning) has been reported. */
    boolean hasErrors();
}
