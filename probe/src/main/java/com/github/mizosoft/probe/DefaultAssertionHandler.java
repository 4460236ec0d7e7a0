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

import static java.util.Objects.requireNonNull;

import java.lang.System.Logger;
import java.lang.System.Logger.Level;

/**
 * The default {@link AssertionHandler}. Fatal failures are formatted and passed to a {@link
 * Reporter}. Non-fatal failures and successful assertions are only logged.
 */
public final class DefaultAssertionHandler implements AssertionHandler {
  private static final Logger logger = System.getLogger(DefaultAssertionHandler.class.getName());

  private final Formatter formatter;
  private final Reporter reporter;

  public DefaultAssertionHandler(Reporter reporter) {
    this(new DefaultFormatter(), reporter);
  }

  public DefaultAssertionHandler(Formatter formatter, Reporter reporter) {
    this.formatter = requireNonNull(formatter);
    this.reporter = requireNonNull(reporter);
  }

  @Override
  public void success(AssertionContext context) {
    if (logger.isLoggable(Level.TRACE)) {
      logger.log(Level.TRACE, formatter.formatSuccess(context));
    }
  }

  @Override
  public void failure(AssertionContext context, AssertionFailure failure) {
    switch (failure.severity()) {
      case FATAL:
        reporter.report(formatter.formatFailure(context, failure));
        break;

      case NON_FATAL:
        if (logger.isLoggable(Level.INFO)) {
          logger.log(Level.INFO, formatter.formatFailure(context, failure));
        }
        break;

      default:
        throw new AssertionError("Unexpected severity: " + failure.severity());
    }
  }

  @Override
  public String toString() {
    return "DefaultAssertionHandler[formatter=" + formatter + ", reporter=" + reporter + "]";
  }
}
