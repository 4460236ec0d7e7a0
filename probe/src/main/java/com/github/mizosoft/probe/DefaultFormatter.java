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
import java.util.Locale;

/**
 * A {@code Formatter} producing plain multi-line messages. It lists the test and request names,
 * the assertion path, the errors and the values attached to the failure.
 */
public class DefaultFormatter implements Formatter {
  public DefaultFormatter() {}

  @Override
  public String formatSuccess(AssertionContext context) {
    return "assertion passed: " + joinPath(context.aliasedPath());
  }

  @Override
  public String formatFailure(AssertionContext context, AssertionFailure failure) {
    var sb = new StringBuilder();
    sb.append("assertion failed: ").append(describe(failure.type()));
    if (!failure.isFatal()) {
      sb.append(" (non-fatal)");
    }
    sb.append('\n');

    if (!context.testName().isEmpty()) {
      sb.append("\ntest name: ").append(context.testName());
    }
    if (!context.requestName().isEmpty()) {
      sb.append("\nrequest name: ").append(context.requestName());
    }
    sb.append("\nassertion: ").append(joinPath(context.path()));
    if (!context.aliasedPath().equals(context.path())) {
      sb.append("\nalias: ").append(joinPath(context.aliasedPath()));
    }
    context.roundTripTime().ifPresent(rtt -> sb.append("\nround trip time: ").append(rtt));
    sb.append('\n');

    sb.append("\nerrors:");
    for (var error : failure.errors()) {
      sb.append("\n  ").append(describe(error));
    }
    sb.append('\n');

    failure.expected().ifPresent(value -> appendValue(sb, "expected", value));
    failure.actual().ifPresent(value -> appendValue(sb, "actual", value));
    failure.reference().ifPresent(value -> appendValue(sb, "reference", value));
    failure.delta().ifPresent(value -> appendValue(sb, "allowed delta", value));
    return sb.toString();
  }

  private static void appendValue(StringBuilder sb, String title, AssertionValue value) {
    sb.append('\n').append(title).append(":\n");
    value.toString().lines().forEach(line -> sb.append("  ").append(line).append('\n'));
  }

  private static String describe(AssertionType type) {
    return type.name().toLowerCase(Locale.ROOT).replace('_', ' ');
  }

  private static String describe(Throwable error) {
    return error instanceof AssertionFailure.ErrorMessage
        ? error.getMessage()
        : error.getClass().getName() + ": " + error.getMessage();
  }

  private static String joinPath(List<String> path) {
    return String.join(".", path);
  }
}
