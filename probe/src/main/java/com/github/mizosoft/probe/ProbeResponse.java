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

import com.github.mizosoft.probe.internal.Utils;
import com.google.errorprone.annotations.CanIgnoreReturnValue;
import java.io.IOException;
import java.net.http.HttpResponse;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.Arrays;
import java.util.Optional;
import java.util.regex.Pattern;
import org.checkerframework.checker.nullness.qual.MonotonicNonNull;
import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * The response of a {@link ProbeRequest}, with checks on its status, headers and body. A check
 * that doesn't hold fails the response's {@link Chain}, after which all later checks have no
 * effect. If the request failed, the response is failed from the start.
 *
 * <p>Checks on the body read a snapshot of it, so they can be repeated. The body is released
 * without being read further once a check fails, or when the response is {@link #close()
 * closed}.
 */
public final class ProbeResponse implements AutoCloseable {
  private final Chain chain;
  private final @Nullable HttpResponse<BodyReplay> response;
  private final int attemptCount;
  private final @Nullable Duration roundTripTime;
  private @MonotonicNonNull String bodyText;

  ProbeResponse(
      Chain chain,
      @Nullable HttpResponse<BodyReplay> response,
      int attemptCount,
      @Nullable Duration roundTripTime) {
    this.chain = chain;
    this.response = response;
    this.attemptCount = attemptCount;
    this.roundTripTime = roundTripTime;
    chain.onFailure(this::close);
  }

  /** Returns the chain this response reports to, for use by custom matchers. */
  public Chain chain() {
    return chain;
  }

  /** Returns the underlying response, or an empty optional if the request failed. */
  public Optional<HttpResponse<BodyReplay>> raw() {
    return Optional.ofNullable(response);
  }

  /** Returns the number of attempts made to get this response. */
  public int attemptCount() {
    return attemptCount;
  }

  /** Returns the round trip time of the attempt that got this response. */
  public Optional<Duration> roundTripTime() {
    return Optional.ofNullable(roundTripTime);
  }

  /** Makes the aliased path of later failures start from the given name. */
  @CanIgnoreReturnValue
  public ProbeResponse alias(String name) {
    requireNonNull(name);
    chain.enter("Alias(\"%s\")", name);
    try {
      chain.setAlias(name);
    } finally {
      chain.leave();
    }
    return this;
  }

  /** Checks that the response has the given status code. */
  @CanIgnoreReturnValue
  public ProbeResponse status(int statusCode) {
    chain.enter("Status(%d)", statusCode);
    try {
      var response = this.response;
      if (chain.failed() || response == null) {
        return this;
      }

      if (response.statusCode() != statusCode) {
        chain.fail(
            AssertionFailure.newBuilder(AssertionType.EQUAL)
                .actual(response.statusCode())
                .expected(statusCode)
                .error("expected: http status is equal to given value")
                .build());
      }
    } finally {
      chain.leave();
    }
    return this;
  }

  /** Checks that the response's status code belongs to the given range. */
  @CanIgnoreReturnValue
  public ProbeResponse statusRange(StatusRange range) {
    requireNonNull(range);
    chain.enter("StatusRange(%s)", range.name());
    try {
      var response = this.response;
      if (chain.failed() || response == null) {
        return this;
      }

      if (!range.includes(response.statusCode())) {
        chain.fail(
            AssertionFailure.newBuilder(AssertionType.BELONGS)
                .actual(response.statusCode())
                .expected(AssertionList.of(range))
                .error("expected: http status belongs to given range")
                .build());
      }
    } finally {
      chain.leave();
    }
    return this;
  }

  /** Checks that the response's status code is one of the given codes. */
  @CanIgnoreReturnValue
  public ProbeResponse statusIn(int... statusCodes) {
    chain.enter("StatusIn()");
    try {
      var response = this.response;
      if (chain.failed() || response == null) {
        return this;
      }

      if (statusCodes.length == 0) {
        chain.fail(
            AssertionFailure.newBuilder(AssertionType.USAGE)
                .error("unexpected empty list argument")
                .build());
        return this;
      }

      int statusCode = response.statusCode();
      if (Arrays.stream(statusCodes).noneMatch(code -> code == statusCode)) {
        chain.fail(
            AssertionFailure.newBuilder(AssertionType.BELONGS)
                .actual(statusCode)
                .expected(AssertionList.of(Arrays.stream(statusCodes).boxed().toArray()))
                .error("expected: http status belongs to given list")
                .build());
      }
    } finally {
      chain.leave();
    }
    return this;
  }

  /** Checks that the response has the given header. */
  @CanIgnoreReturnValue
  public ProbeResponse containsHeader(String name) {
    requireNonNull(name);
    chain.enter("ContainsHeader(\"%s\")", name);
    try {
      var response = this.response;
      if (chain.failed() || response == null) {
        return this;
      }

      if (response.headers().firstValue(name).isEmpty()) {
        failMissingHeader(response, name);
      }
    } finally {
      chain.leave();
    }
    return this;
  }

  /** Checks that the first value of the given header equals the given value. */
  @CanIgnoreReturnValue
  public ProbeResponse header(String name, String value) {
    requireNonNull(name);
    requireNonNull(value);
    chain.enter("Header(\"%s\")", name);
    try {
      var response = this.response;
      if (chain.failed() || response == null) {
        return this;
      }

      var actual = response.headers().firstValue(name);
      if (actual.isEmpty()) {
        failMissingHeader(response, name);
      } else if (!actual.get().equals(value)) {
        chain.fail(
            AssertionFailure.newBuilder(AssertionType.EQUAL)
                .actual(actual.get())
                .expected(value)
                .error("expected: header value is equal to given value")
                .build());
      }
    } finally {
      chain.leave();
    }
    return this;
  }

  private void failMissingHeader(HttpResponse<?> response, String name) {
    chain.fail(
        AssertionFailure.newBuilder(AssertionType.CONTAINS_KEY)
            .actual(response.headers().map().keySet())
            .expected(name)
            .error("expected: response contains header")
            .build());
  }

  /** Checks that the response body, decoded as UTF-8, equals the given text. */
  @CanIgnoreReturnValue
  public ProbeResponse body(String expected) {
    requireNonNull(expected);
    chain.enter("Body()");
    try {
      if (chain.failed() || response == null) {
        return this;
      }

      var actual = readBody();
      if (actual != null && !actual.equals(expected)) {
        chain.fail(
            AssertionFailure.newBuilder(AssertionType.EQUAL)
                .actual(actual)
                .expected(expected)
                .error("expected: response body is equal to given value")
                .build());
      }
    } finally {
      chain.leave();
    }
    return this;
  }

  /** Checks that the response body, decoded as UTF-8, matches the given pattern. */
  @CanIgnoreReturnValue
  public ProbeResponse bodyMatches(Pattern pattern) {
    requireNonNull(pattern);
    chain.enter("BodyMatches(\"%s\")", pattern.pattern());
    try {
      if (chain.failed() || response == null) {
        return this;
      }

      var actual = readBody();
      if (actual != null && !pattern.matcher(actual).matches()) {
        chain.fail(
            AssertionFailure.newBuilder(AssertionType.MATCH_REGEXP)
                .actual(actual)
                .expected(pattern.pattern())
                .error("expected: response body matches given regular expression")
                .build());
      }
    } finally {
      chain.leave();
    }
    return this;
  }

  /** Returns the body as text, or {@code null} after failing the chain if it can't be read. */
  private @Nullable String readBody() {
    var text = bodyText;
    if (text == null) {
      try (var in = requireNonNull(response).body().snapshot()) {
        text = new String(in.readAllBytes(), StandardCharsets.UTF_8);
      } catch (IOException | IllegalStateException e) {
        chain.fail(
            AssertionFailure.newBuilder(AssertionType.OPERATION)
                .error("failed to read response body")
                .error(e)
                .build());
        return null;
      }
      bodyText = text;
    }
    return text;
  }

  /**
   * Releases the response body without reading the rest of it. Body checks that haven't read the
   * body before fail afterwards.
   */
  @Override
  public void close() {
    if (response != null) {
      response.body().discard();
    }
  }

  @Override
  public String toString() {
    return Utils.toStringIdentityPrefix(this)
        + "[response="
        + response
        + ", attemptCount="
        + attemptCount
        + ", failed="
        + chain.failed()
        + "]";
  }
}
