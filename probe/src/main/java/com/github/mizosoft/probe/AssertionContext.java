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

import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.time.Duration;
import java.util.List;
import java.util.Optional;
import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * Describes where an assertion happened. A context is an immutable snapshot of a {@link Chain}'s
 * state, taken when the chain reports to its {@link AssertionHandler}.
 */
public final class AssertionContext {
  private final String testName;
  private final String requestName;
  private final List<String> path;
  private final List<String> aliasedPath;
  private final @Nullable HttpRequest request;
  private final @Nullable HttpResponse<?> response;
  private final @Nullable Duration roundTripTime;

  AssertionContext(
      String testName,
      String requestName,
      List<String> path,
      List<String> aliasedPath,
      @Nullable HttpRequest request,
      @Nullable HttpResponse<?> response,
      @Nullable Duration roundTripTime) {
    this.testName = testName;
    this.requestName = requestName;
    this.path = List.copyOf(path);
    this.aliasedPath = List.copyOf(aliasedPath);
    this.request = request;
    this.response = response;
    this.roundTripTime = roundTripTime;
  }

  /** Returns the name of the running test, or an empty string if unknown. */
  public String testName() {
    return testName;
  }

  /** Returns the name given to the request being made, or an empty string if unnamed. */
  public String requestName() {
    return requestName;
  }

  /**
   * Returns the chain of nested assertion names starting from the chain root, for instance
   * {@code [Request("GET"), Expect(), Status()]}.
   */
  public List<String> path() {
    return path;
  }

  /**
   * Returns the chain of nested assertion names starting from the most recent alias. Same as
   * {@link #path()} if no alias is set.
   */
  public List<String> aliasedPath() {
    return aliasedPath;
  }

  /** Returns the request being made, if it was already built. */
  public Optional<HttpRequest> request() {
    return Optional.ofNullable(request);
  }

  /** Returns the response being matched, if it was already received. */
  public Optional<HttpResponse<?>> response() {
    return Optional.ofNullable(response);
  }

  /** Returns the round trip time of the last attempt, if a response was received. */
  public Optional<Duration> roundTripTime() {
    return Optional.ofNullable(roundTripTime);
  }

  @Override
  public String toString() {
    return "AssertionContext[testName="
        + testName
        + ", requestName="
        + requestName
        + ", path="
        + path
        + ", aliasedPath="
        + aliasedPath
        + ']';
  }
}
