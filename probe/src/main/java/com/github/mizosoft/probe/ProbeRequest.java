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
import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.io.InputStream;
import java.lang.System.Logger;
import java.lang.System.Logger.Level;
import java.net.URI;
import java.net.URLEncoder;
import java.net.http.HttpRequest;
import java.net.http.HttpRequest.BodyPublisher;
import java.net.http.HttpRequest.BodyPublishers;
import java.net.http.HttpResponse;
import java.net.http.HttpResponse.BodyHandler;
import java.net.http.HttpResponse.BodySubscribers;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.function.Consumer;
import java.util.function.Supplier;
import java.util.stream.Collectors;
import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * A request under construction. Each method reports its outcome to the request's {@link Chain}:
 * invalid arguments fail the chain, and once the chain fails, all later calls have no effect. The
 * request is sent by {@link #expect()}, which returns a {@link ProbeResponse} for asserting on the
 * response.
 *
 * <p>Instances are not thread-safe.
 */
public final class ProbeRequest {
  private static final Logger logger = System.getLogger(ProbeRequest.class.getName());

  private static final BodyHandler<BodyReplay> BODY_REPLAY_HANDLER =
      __ -> BodySubscribers.mapping(BodySubscribers.ofInputStream(), BodyReplay::of);

  private final Probe probe;
  private final Chain chain;
  private final String method;
  private final HttpRequest.Builder requestBuilder = HttpRequest.newBuilder();
  private final RetryPolicy.Builder retryPolicyBuilder;
  private final List<Map.Entry<String, String>> queryParams = new ArrayList<>();
  private final List<Consumer<HttpRequest.Builder>> transformers = new ArrayList<>();
  private final List<Consumer<ProbeResponse>> matchers = new ArrayList<>();

  /** Cancelled when the chain fails, which stops an in-flight retry loop. */
  private final CancellationToken.Source failureCancellation = CancellationToken.newSource();

  private String path;
  private CancellationToken cancellationToken = CancellationToken.never();
  private @Nullable BodyReplay body;
  private @Nullable String bodySetter;
  private boolean expectCalled;

  ProbeRequest(Probe probe, Chain chain, String method, String path) {
    this.probe = probe;
    this.chain = chain;
    this.method = method;
    this.path = path;
    this.retryPolicyBuilder = probe.retryPolicy().toBuilder();
    chain.onFailure(failureCancellation::cancel);
  }

  /** Returns the chain this request reports to. */
  public Chain chain() {
    return chain;
  }

  /** Sets a name for this request, which is included in failure reports. */
  @CanIgnoreReturnValue
  public ProbeRequest withName(String name) {
    requireNonNull(name);
    chain.enter("WithName()");
    try {
      chain.setRequestName(name);
    } finally {
      chain.leave();
    }
    return this;
  }

  /**
   * Adds a function that runs on every response returned by {@link #expect()}, right before it's
   * returned. Matchers are typically used to apply the same checks to many requests. They don't run
   * if the request can't be sent.
   */
  @CanIgnoreReturnValue
  public ProbeRequest withMatcher(Consumer<ProbeResponse> matcher) {
    requireNonNull(matcher);
    chain.enter("WithMatcher()");
    try {
      if (chain.failed()) {
        return this;
      }

      matchers.add(matcher);
    } finally {
      chain.leave();
    }
    return this;
  }

  /**
   * Adds a function that can modify the request right before it's sent. Transformers run in the
   * order they're added, after everything else about the request is set.
   */
  @CanIgnoreReturnValue
  public ProbeRequest withTransformer(Consumer<HttpRequest.Builder> transformer) {
    requireNonNull(transformer);
    chain.enter("WithTransformer()");
    try {
      if (chain.failed()) {
        return this;
      }

      transformers.add(transformer);
    } finally {
      chain.leave();
    }
    return this;
  }

  /**
   * Substitutes the {@code {key}} parameter in the request path with the given value. Keys are
   * matched ignoring case. Fails the chain if the path has no such parameter, or if its braces
   * aren't balanced.
   */
  @CanIgnoreReturnValue
  public ProbeRequest withPath(String key, Object value) {
    requireNonNull(key);
    requireNonNull(value);
    chain.enter("WithPath(\"%s\")", key);
    try {
      if (chain.failed()) {
        return this;
      }

      var result = new StringBuilder(path.length());
      boolean found = false;
      int pos = 0;
      while (pos < path.length()) {
        int open = path.indexOf('{', pos);
        int close = path.indexOf('}', pos);
        if (open < 0 && close < 0) {
          break;
        }

        int nextOpen = open >= 0 ? path.indexOf('{', open + 1) : -1;
        if (open < 0 || close < open || (nextOpen >= 0 && nextOpen < close)) {
          chain.fail(
              AssertionFailure.newBuilder(AssertionType.VALID)
                  .actual(path)
                  .error("invalid path template: unbalanced braces")
                  .build());
          return this;
        }

        var name = path.substring(open + 1, close);
        result.append(path, pos, open);
        if (name.equalsIgnoreCase(key)) {
          result.append(value);
          found = true;
        } else {
          result.append('{').append(name).append('}');
        }
        pos = close + 1;
      }
      result.append(path, pos, path.length());

      if (!found) {
        chain.fail(
            AssertionFailure.newBuilder(AssertionType.USAGE)
                .error(String.format("key \"%s\" not found in path template \"%s\"", key, path))
                .build());
        return this;
      }
      path = result.toString();
    } finally {
      chain.leave();
    }
    return this;
  }

  /** Adds a query parameter to the request URI. The key and value are URL-encoded as UTF-8. */
  @CanIgnoreReturnValue
  public ProbeRequest withQuery(String key, Object value) {
    requireNonNull(key);
    requireNonNull(value);
    chain.enter("WithQuery(\"%s\")", key);
    try {
      if (chain.failed()) {
        return this;
      }

      queryParams.add(Map.entry(key, value.toString()));
    } finally {
      chain.leave();
    }
    return this;
  }

  /** Adds a request header. */
  @CanIgnoreReturnValue
  public ProbeRequest withHeader(String name, String value) {
    requireNonNull(name);
    requireNonNull(value);
    chain.enter("WithHeader(\"%s\")", name);
    try {
      if (chain.failed()) {
        return this;
      }

      addHeader(name, value);
    } finally {
      chain.leave();
    }
    return this;
  }

  /** Adds the given request headers, stopping at the first invalid one. */
  @CanIgnoreReturnValue
  public ProbeRequest withHeaders(Map<String, String> headers) {
    requireNonNull(headers);
    chain.enter("WithHeaders()");
    try {
      for (var entry : headers.entrySet()) {
        if (chain.failed()) {
          return this;
        }
        addHeader(entry.getKey(), entry.getValue());
      }
    } finally {
      chain.leave();
    }
    return this;
  }

  private void addHeader(String name, String value) {
    try {
      requestBuilder.header(name, value);
    } catch (IllegalArgumentException e) {
      chain.fail(
          AssertionFailure.newBuilder(AssertionType.VALID)
              .actual(name)
              .error("invalid header")
              .error(e)
              .build());
    }
  }

  /**
   * Sets the request body to the content of the given stream. The stream is read once, then
   * replayed from memory when the request is retried.
   */
  @CanIgnoreReturnValue
  public ProbeRequest withBody(InputStream body) {
    requireNonNull(body);
    return setBody("WithBody()", () -> BodyReplay.of(body));
  }

  /**
   * Sets the request body to the content of the given stream. The given callback is run once the
   * stream is fully read and closed.
   */
  @CanIgnoreReturnValue
  public ProbeRequest withBody(InputStream body, Runnable releaseCallback) {
    requireNonNull(body);
    requireNonNull(releaseCallback);
    return setBody("WithBody()", () -> BodyReplay.of(body, releaseCallback));
  }

  /** Sets the request body to the given bytes. */
  @CanIgnoreReturnValue
  public ProbeRequest withBytes(byte[] body) {
    var bodyCopy = body.clone();
    return setBody("WithBytes()", () -> BodyReplay.of(new ByteArrayInputStream(bodyCopy)));
  }

  /** Sets the request body to the given text, encoded as UTF-8 with a {@code text/plain} type. */
  @CanIgnoreReturnValue
  public ProbeRequest withText(String text) {
    var bytes = text.getBytes(StandardCharsets.UTF_8);
    setBody("WithText()", () -> BodyReplay.of(new ByteArrayInputStream(bytes)));
    if (!chain.failed()) {
      requestBuilder.setHeader("Content-Type", "text/plain; charset=utf-8");
    }
    return this;
  }

  private ProbeRequest setBody(String setter, Supplier<BodyReplay> bodyFactory) {
    chain.enter(setter);
    try {
      if (chain.failed()) {
        return this;
      }

      if (bodySetter != null) {
        chain.fail(
            AssertionFailure.newBuilder(AssertionType.USAGE)
                .error(
                    "ambiguous request body contents: set by "
                        + bodySetter
                        + ", overwritten by "
                        + setter)
                .build());
        return this;
      }
      body = bodyFactory.get();
      bodySetter = setter;
    } finally {
      chain.leave();
    }
    return this;
  }

  /**
   * Sets the timeout of each attempt. An attempt that exceeds it fails with an {@link
   * AttemptTimeoutException}, which is retried like other timeouts.
   */
  @CanIgnoreReturnValue
  public ProbeRequest withTimeout(Duration timeout) {
    requireNonNull(timeout);
    chain.enter("WithTimeout()");
    try {
      if (chain.failed()) {
        return this;
      }

      if (requirePositive(timeout)) {
        retryPolicyBuilder.attemptTimeout(timeout);
      }
    } finally {
      chain.leave();
    }
    return this;
  }

  /**
   * Sets the timeout of the whole exchange, including retries. No attempt is started after it
   * elapses, and the request fails with a {@link DeadlineExceededException}.
   */
  @CanIgnoreReturnValue
  public ProbeRequest withDeadline(Duration timeout) {
    requireNonNull(timeout);
    chain.enter("WithDeadline()");
    try {
      if (chain.failed()) {
        return this;
      }

      if (requirePositive(timeout)) {
        retryPolicyBuilder.timeout(timeout);
      }
    } finally {
      chain.leave();
    }
    return this;
  }

  /** Sets a token that stops sending the request once cancelled. */
  @CanIgnoreReturnValue
  public ProbeRequest withCancellation(CancellationToken token) {
    requireNonNull(token);
    chain.enter("WithCancellation()");
    try {
      if (chain.failed()) {
        return this;
      }

      cancellationToken = token;
    } finally {
      chain.leave();
    }
    return this;
  }

  /** Sets the condition deciding which attempts are retried. */
  @CanIgnoreReturnValue
  public ProbeRequest withRetryPolicy(RetryCondition condition) {
    requireNonNull(condition);
    chain.enter("WithRetryPolicy()");
    try {
      if (chain.failed()) {
        return this;
      }

      retryPolicyBuilder.condition(condition);
    } finally {
      chain.leave();
    }
    return this;
  }

  /** Sets how many times the request may be retried after the first attempt. */
  @CanIgnoreReturnValue
  public ProbeRequest withMaxRetries(int maxRetries) {
    chain.enter("WithMaxRetries()");
    try {
      if (chain.failed()) {
        return this;
      }

      if (maxRetries < 0) {
        chain.fail(
            AssertionFailure.newBuilder(AssertionType.VALID)
                .actual(maxRetries)
                .error("invalid negative argument")
                .build());
        return this;
      }
      retryPolicyBuilder.maxAttempts(
          maxRetries < Integer.MAX_VALUE ? maxRetries + 1 : Integer.MAX_VALUE);
    } finally {
      chain.leave();
    }
    return this;
  }

  /**
   * Sets the delay before retrying. The delay starts at {@code minDelay} and doubles with every
   * retry, up to {@code maxDelay}.
   */
  @CanIgnoreReturnValue
  public ProbeRequest withRetryDelay(Duration minDelay, Duration maxDelay) {
    requireNonNull(minDelay);
    requireNonNull(maxDelay);
    chain.enter("WithRetryDelay()");
    try {
      if (chain.failed()) {
        return this;
      }

      if (minDelay.isNegative() || minDelay.compareTo(maxDelay) > 0) {
        chain.fail(
            AssertionFailure.newBuilder(AssertionType.VALID)
                .actual(AssertionRange.of(minDelay, maxDelay))
                .error("invalid delay range")
                .build());
        return this;
      }
      retryPolicyBuilder.backoff(
          minDelay.isZero()
              ? BackoffStrategy.none()
              : BackoffStrategy.exponential(minDelay, maxDelay));
    } finally {
      chain.leave();
    }
    return this;
  }

  private boolean requirePositive(Duration duration) {
    if (duration.isNegative() || duration.isZero()) {
      chain.fail(
          AssertionFailure.newBuilder(AssertionType.VALID)
              .actual(duration)
              .error("invalid non-positive duration")
              .build());
      return false;
    }
    return true;
  }

  /**
   * Sends the request, retrying it as configured, and returns its response. If the request can't
   * be sent, the chain is failed and the returned response is failed as well.
   */
  public ProbeResponse expect() {
    chain.enter("Expect()");
    try {
      if (chain.failed()) {
        return new ProbeResponse(chain.clone(), null, 0, null);
      }

      if (expectCalled) {
        chain.fail(
            AssertionFailure.newBuilder(AssertionType.USAGE)
                .error("unexpected call to Expect(): it may be called only once")
                .build());
        return new ProbeResponse(chain.clone(), null, 0, null);
      }
      expectCalled = true;

      var outcome = roundTrip();
      if (outcome == null) {
        return new ProbeResponse(chain.clone(), null, 0, null);
      }
      chain.setResponse(outcome.response());
      chain.setRoundTripTime(outcome.roundTripTime());
      var response =
          new ProbeResponse(
              chain.clone(), outcome.response(), outcome.attemptCount(), outcome.roundTripTime());
      for (var matcher : matchers) {
        matcher.accept(response);
      }
      return response;
    } finally {
      chain.leave();
    }
  }

  private RetryExecutor.@Nullable Outcome<BodyReplay> roundTrip() {
    HttpRequest request;
    try {
      requestBuilder.uri(resolveUri()).method(method, bodyPublisher());
      transformers.forEach(transformer -> transformer.accept(requestBuilder));
      request = requestBuilder.build();
    } catch (IllegalArgumentException | IllegalStateException e) {
      chain.fail(
          AssertionFailure.newBuilder(AssertionType.VALID)
              .actual(method + " " + path)
              .error("invalid request")
              .error(e)
              .build());
      return null;
    }
    chain.setRequest(request);

    var executor =
        RetryExecutor.newBuilder()
            .policy(retryPolicyBuilder.build())
            .clock(probe.clock())
            .delayer(probe.delayer())
            .build();
    var cancellation = CancellationToken.newSource(cancellationToken);
    var registration = failureCancellation.token().register(cancellation::cancel);
    var future =
        executor.execute(timeout -> send(request, timeout), body, cancellation.token());
    try {
      return future.get();
    } catch (ExecutionException e) {
      failSending(Utils.getDeepCompletionCause(e));
      return null;
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      cancellation.cancel(e);
      failSending(e);
      return null;
    } finally {
      registration.close();
      closeBodyQuietly();
    }
  }

  private URI resolveUri() {
    var uri = probe.baseUri().map(base -> base.resolve(path)).orElseGet(() -> URI.create(path));
    if (queryParams.isEmpty()) {
      return uri;
    }

    var query =
        queryParams.stream()
            .map(
                param ->
                    URLEncoder.encode(param.getKey(), StandardCharsets.UTF_8)
                        + "="
                        + URLEncoder.encode(param.getValue(), StandardCharsets.UTF_8))
            .collect(Collectors.joining("&"));
    var uriString = uri.toString();
    int fragmentStart = uriString.indexOf('#');
    var withoutFragment = fragmentStart >= 0 ? uriString.substring(0, fragmentStart) : uriString;
    var fragment = fragmentStart >= 0 ? uriString.substring(fragmentStart) : "";
    return URI.create(
        withoutFragment + (uri.getRawQuery() != null ? "&" : "?") + query + fragment);
  }

  /** Returns a publisher reading the body as part of its current read pass, if there's a body. */
  private BodyPublisher bodyPublisher() {
    var currentBody = body;
    if (currentBody == null) {
      return BodyPublishers.noBody();
    }
    var in = currentBody.inputStream();
    return BodyPublishers.ofInputStream(() -> in);
  }

  private void closeBodyQuietly() {
    var currentBody = body;
    if (currentBody != null) {
      try {
        currentBody.close();
      } catch (IOException e) {
        logger.log(Level.WARNING, "Failed to close request body", e);
      }
    }
  }

  private CompletableFuture<HttpResponse<BodyReplay>> send(
      HttpRequest request, @Nullable Duration timeout) {
    var attemptBuilder = requestBuilder.copy();
    if (body != null) {
      // A body stream per attempt, invalidated once the body is rewound for the next attempt.
      attemptBuilder.method(request.method(), bodyPublisher());
    }
    if (timeout != null) {
      attemptBuilder.timeout(timeout);
    }
    var attemptRequest = attemptBuilder.build();
    logger.log(Level.DEBUG, () -> "sending " + attemptRequest);
    return probe.transport().sendAsync(attemptRequest, BODY_REPLAY_HANDLER);
  }

  private void failSending(Throwable error) {
    chain.fail(
        AssertionFailure.newBuilder(AssertionType.OPERATION)
            .error("failed to send http request")
            .error(error)
            .build());
  }

  @Override
  public String toString() {
    return Utils.toStringIdentityPrefix(this) + "[" + method + " " + path + "]";
  }
}
