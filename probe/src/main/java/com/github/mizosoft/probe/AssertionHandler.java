/*
 * Copyright (c) 2025 Moataz Hussein
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
 */

package com.github.mizosoft.probe;

import java.util.List;

/**
 * Receives the outcome of every assertion made through a {@link Chain}. Implementations may log
 * successful assertions, report failures to the test framework, or collect both for later
 * processing. Most users don't need to implement this interface, and would rather plug a {@link
 * Reporter} into a {@link DefaultAssertionHandler}.
 *
 * <p>Handlers should avoid expensive I/O, as they're invoked synchronously by the asserting code.
 */
public interface AssertionHandler {

  /** Called when an assertion succeeds. */
  void success(AssertionContext context);

  /**
   * Called when an assertion fails. A {@link AssertionSeverity#FATAL fatal} failure should fail the
   * running test, while a {@link AssertionSeverity#NON_FATAL non-fatal} one may only be logged.
   */
  void failure(AssertionContext context, AssertionFailure failure);

  /** Returns a handler that forwards to each of the given handlers in order. */
  static AssertionHandler chaining(AssertionHandler... handlers) {
    var handlersCopy = List.of(handlers);
    return new AssertionHandler() {
      @Override
      public void success(AssertionContext context) {
        handlersCopy.forEach(handler -> handler.success(context));
      }

      @Override
      public void failure(AssertionContext context, AssertionFailure failure) {
        handlersCopy.forEach(handler -> handler.failure(context, failure));
      }

      @Override
      public String toString() {
        return "AssertionHandler.chaining" + handlersCopy;
      }
    };
  }
}
