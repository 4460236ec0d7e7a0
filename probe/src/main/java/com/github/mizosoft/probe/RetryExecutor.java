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

import static com.github.mizosoft.probe.internal.Validate.requireArgument;
import static java.util.Objects.requireNonNull;

import com.github.mizosoft.probe.internal.Utils;
import com.github.mizosoft.probe.internal.concurrent.Delayer;
import com.github.mizosoft.probe.internal.concurrent.Race;
import com.github.mizosoft.probe.internal.util.Compare;
import com.google.errorprone.annotations.CanIgnoreReturnValue;
import java.io.IOException;
import java.lang.System.Logger;
import java.lang.System.Logger.Level;
import java.net.http.HttpResponse;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.function.Function;
import java.util.function.Supplier;
import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * Sends a logical request one or more times according to a {@link RetryPolicy}, until a result is
 * worth returning, attempts are exhausted, the deadline is reached or the request is cancelled.
 *
 * <p>Each attempt is raced against its timeout and the request's {@link CancellationToken}, and so
 * is the backoff delay between attempts. Hence, cancelling the token stops the retry loop
 * promptly, and no attempt is started after the token is cancelled or the deadline is reached. If
 * a {@link BodyReplay} is given, it is rewound before every attempt after the first.
 *
 * <p>The returned future completes exceptionally with:
 *
 * <ul>
 *   <li>{@link RequestCancelledException} if the token is cancelled first.
 *   <li>{@link DeadlineExceededException} if the deadline is reached, or would be reached while
 *       waiting for the next attempt.
 *   <li>{@link RetriesExhaustedException} if the last allowed attempt fails with a retryable
 *       exception.
 *   <li>the attempt's own exception, if it isn't retryable.
 * </ul>
 *
 * <p>If the last allowed attempt gets a retryable response, the response is returned as-is.
 */
public final class RetryExecutor {
  private static final Logger logger = System.getLogger(RetryExecutor.class.getName());

  private final RetryPolicy policy;
  private final Clock clock;
  private final Delayer delayer;
  private final Listener listener;

  private RetryExecutor(Builder builder) {
    this.policy = builder.policy;
    this.clock = builder.clock;
    this.delayer = builder.delayer;
    this.listener = builder.listener;
  }

  public RetryPolicy policy() {
    return policy;
  }

  /** Executes the given sender with no body to rewind and a token that's never cancelled. */
  public <T> CompletableFuture<Outcome<T>> execute(Sender<T> sender) {
    return execute(sender, null, CancellationToken.never());
  }

  /**
   * Executes the given sender, rewinding the given body before every attempt after the first, and
   * stopping once the given token is cancelled.
   */
  public <T> CompletableFuture<Outcome<T>> execute(
      Sender<T> sender, @Nullable BodyReplay body, CancellationToken token) {
    requireNonNull(sender);
    requireNonNull(token);
    var deadline = policy.timeout().map(clock.instant()::plus).orElse(null);
    return new AsyncRetrier<>(sender, body, token, deadline).start();
  }

  @Override
  public String toString() {
    return Utils.toStringIdentityPrefix(this) + "[policy=" + policy + "]";
  }

  private final class AsyncRetrier<T> {
    private final Sender<T> sender;
    private final @Nullable BodyReplay body;
    private final CancellationToken token;
    private final @Nullable Instant deadline;

    /** Number of attempts started so far. */
    private int attemptCount;

    private @Nullable Context<T> lastContext;

    AsyncRetrier(
        Sender<T> sender,
        @Nullable BodyReplay body,
        CancellationToken token,
        @Nullable Instant deadline) {
      this.sender = sender;
      this.body = body;
      this.token = token;
      this.deadline = deadline;
    }

    CompletableFuture<Outcome<T>> start() {
      listener.onFirstAttempt();
      return nextAttempt();
    }

    private CompletableFuture<Outcome<T>> nextAttempt() {
      if (attemptCount > 0 && body != null) {
        try {
          body.rewind();
        } catch (IOException | RuntimeException e) {
          return CompletableFuture.failedFuture(e);
        }
      }

      var cancellationCause = token.cause();
      if (cancellationCause.isPresent()) {
        return CompletableFuture.failedFuture(cancelled(cancellationCause.get()));
      }

      var remaining = deadline != null ? Duration.between(clock.instant(), deadline) : null;
      if (remaining != null && (remaining.isNegative() || remaining.isZero())) {
        return CompletableFuture.failedFuture(deadlineExceeded());
      }

      var attemptTimeout = policy.attemptTimeout().orElse(null);
      Duration timeout;
      Supplier<? extends Throwable> onTimeout;
      @Nullable Duration senderTimeout;
      if (remaining != null
          && (attemptTimeout == null || remaining.compareTo(attemptTimeout) <= 0)) {
        // Only the deadline timer ends this attempt. The sender gets no timeout to fire first.
        timeout = remaining;
        onTimeout = () -> suppressing(new DeadlineExceededException(attemptCount));
        senderTimeout = null;
      } else if (attemptTimeout != null) {
        timeout = attemptTimeout;
        onTimeout = () -> new AttemptTimeoutException(attemptTimeout);
        senderTimeout = attemptTimeout;
      } else {
        timeout = null;
        onTimeout = null;
        senderTimeout = null;
      }

      attemptCount++;
      var start = clock.instant();
      CompletableFuture<HttpResponse<T>> sendFuture;
      try {
        sendFuture = requireNonNull(sender.send(senderTimeout));
      } catch (RuntimeException e) {
        sendFuture = CompletableFuture.failedFuture(e);
      }

      var attemptFuture = sendFuture;
      return Race.firstOf(attemptFuture, timeout, onTimeout, token, delayer)
          .handle(
              (response, exception) -> {
                if (response == null) {
                  // The attempt may have lost the race while completing with a response.
                  attemptFuture.thenAccept(RetryExecutor::closeBodyQuietly);
                }
                return handleAttempt(
                    start,
                    response,
                    exception != null ? Utils.getDeepCompletionCause(exception) : null);
              })
          .thenCompose(Function.identity());
    }

    private CompletableFuture<Outcome<T>> handleAttempt(
        Instant start, @Nullable HttpResponse<T> response, @Nullable Throwable exception) {
      if (exception != null) {
        if (token.isCancelled() && token.cause().orElse(null) == exception) {
          return CompletableFuture.failedFuture(cancelled(exception));
        } else if (exception instanceof DeadlineExceededException) {
          listener.onDeadline((DeadlineExceededException) exception);
          return CompletableFuture.failedFuture(exception);
        } else if (deadline != null && !clock.instant().isBefore(deadline)) {
          // The attempt failed on its own, but only once the deadline had been reached.
          var deadlineExceeded = new DeadlineExceededException(attemptCount);
          deadlineExceeded.addSuppressed(exception);
          listener.onDeadline(deadlineExceeded);
          return CompletableFuture.failedFuture(deadlineExceeded);
        }
      }

      var roundTripTime = Duration.between(start, clock.instant());
      var context = Context.of(response, exception, attemptCount, deadline);
      lastContext = context;
      if (!policy.condition().shouldRetry(context)) {
        listener.onComplete(context);
        return complete(context, roundTripTime);
      }

      if (attemptCount >= policy.maxAttempts()) {
        listener.onExhaustion(context);
        if (response != null) {
          return CompletableFuture.completedFuture(
              new Outcome<>(response, attemptCount, roundTripTime));
        }
        return CompletableFuture.failedFuture(
            new RetriesExhaustedException(attemptCount, requireNonNull(exception)));
      }

      var delay = policy.backoff().backoff(context);

      // If we'll reach or exceed the deadline while waiting, give up now.
      if (deadline != null && Duration.between(clock.instant(), deadline).compareTo(delay) <= 0) {
        context.response().ifPresent(RetryExecutor::closeBodyQuietly);
        return CompletableFuture.failedFuture(deadlineExceeded());
      }

      listener.onRetry(context, delay);
      logger.log(
          Level.DEBUG,
          () ->
              "retrying after attempt "
                  + attemptCount
                  + " with "
                  + context.response().map(r -> "status " + r.statusCode()).orElse("")
                  + context.exception().map(Throwable::toString).orElse("")
                  + " in "
                  + delay);
      context.response().ifPresent(RetryExecutor::closeBodyQuietly);
      return Race.firstOf(
              delayer.delay(() -> {}, Compare.max(delay, Duration.ZERO), Runnable::run),
              null,
              null,
              token,
              delayer)
          .handle(
              (__, sleepException) ->
                  sleepException != null
                      ? CompletableFuture.<Outcome<T>>failedFuture(
                          cancelled(Utils.getDeepCompletionCause(sleepException)))
                      : nextAttempt())
          .thenCompose(Function.identity());
    }

    private CompletableFuture<Outcome<T>> complete(Context<T> context, Duration roundTripTime) {
      return context
          .response()
          .map(
              response ->
                  CompletableFuture.completedFuture(
                      new Outcome<>(response, attemptCount, roundTripTime)))
          .orElseGet(
              () ->
                  CompletableFuture.<Outcome<T>>failedFuture(
                      context.exception().orElseThrow(AssertionError::new)));
    }

    private RequestCancelledException cancelled(Throwable cause) {
      var exception = suppressing(new RequestCancelledException(attemptCount, cause));
      listener.onCancellation(exception);
      return exception;
    }

    private DeadlineExceededException deadlineExceeded() {
      var exception = suppressing(new DeadlineExceededException(attemptCount));
      listener.onDeadline(exception);
      return exception;
    }

    private <E extends RetryException> E suppressing(E exception) {
      var context = lastContext;
      if (context != null) {
        context.exception().ifPresent(exception::addSuppressed);
      }
      return exception;
    }
  }

  /** Releases the body of a response that won't be returned, without reading the rest of it. */
  private static void closeBodyQuietly(HttpResponse<?> response) {
    if (response.body() instanceof BodyReplay) {
      ((BodyReplay) response.body()).discard();
    } else if (response.body() instanceof AutoCloseable) {
      try {
        ((AutoCloseable) response.body()).close();
      } catch (Exception e) {
        logger.log(Level.WARNING, "Failed to close response body", e);
      }
    }
  }

  /** Returns a new {@code RetryExecutor} with the given policy. */
  public static RetryExecutor create(RetryPolicy policy) {
    return newBuilder().policy(policy).build();
  }

  public static Builder newBuilder() {
    return new Builder();
  }

  /** Sends a single attempt. */
  @FunctionalInterface
  public interface Sender<T> {

    /**
     * Starts sending the request, returning a future that completes with its response. The given
     * timeout, if not {@code null}, is the attempt timeout, which the sender may pass on to the
     * underlying client. It is {@code null} when the attempt is bounded by the deadline instead,
     * which is enforced by the executor alone.
     */
    CompletableFuture<HttpResponse<T>> send(@Nullable Duration timeout);
  }

  /** The result of a successful execution. */
  public static final class Outcome<T> {
    private final HttpResponse<T> response;
    private final int attemptCount;
    private final Duration roundTripTime;

    Outcome(HttpResponse<T> response, int attemptCount, Duration roundTripTime) {
      this.response = requireNonNull(response);
      this.attemptCount = attemptCount;
      this.roundTripTime = requireNonNull(roundTripTime);
    }

    /** Returns the response of the last attempt. */
    public HttpResponse<T> response() {
      return response;
    }

    /** Returns the number of attempts made. */
    public int attemptCount() {
      return attemptCount;
    }

    /** Returns the round trip time of the last attempt. */
    public Duration roundTripTime() {
      return roundTripTime;
    }

    @Override
    public String toString() {
      return "Outcome[response="
          + response
          + ", attemptCount="
          + attemptCount
          + ", roundTripTime="
          + roundTripTime
          + "]";
    }
  }

  /** Context for deciding whether an attempt should be retried. */
  public interface Context<T> {

    /** Returns the response of the attempt. Exactly one of response and exception is present. */
    Optional<HttpResponse<T>> response();

    /** Returns the exception of the attempt. Exactly one of response and exception is present. */
    Optional<Throwable> exception();

    /** Returns the number of the attempt, starting from {@code 1}. */
    int attempt();

    /** Returns the number of times the request has been retried before this attempt. */
    default int retryCount() {
      return attempt() - 1;
    }

    /** Returns the instant after which no attempts are started, if any. */
    Optional<Instant> deadline();

    /**
     * Creates a new context from the given state.
     *
     * @throws IllegalArgumentException if it is not the case that exactly one of {@code response}
     *     or {@code exception} is non-null, or if {@code attempt} is not positive
     */
    static <T> Context<T> of(
        @Nullable HttpResponse<T> response,
        @Nullable Throwable exception,
        int attempt,
        @Nullable Instant deadline) {
      return new ContextImpl<>(response, exception, attempt, deadline);
    }
  }

  /** A listener for retry events. */
  public interface Listener {

    /** Called when the request is about to be sent for the first time. */
    default void onFirstAttempt() {}

    /** Called when the attempt described by the given context is to be retried after a delay. */
    default void onRetry(Context<?> context, Duration delay) {}

    /** Called when the attempt described by the given context is returned because it's final. */
    default void onComplete(Context<?> context) {}

    /** Called when the last allowed attempt is retryable. */
    default void onExhaustion(Context<?> context) {}

    /** Called when the deadline is reached, or would be reached before the next attempt. */
    default void onDeadline(DeadlineExceededException exception) {}

    /** Called when the request's token is cancelled before a result is returned. */
    default void onCancellation(RequestCancelledException exception) {}
  }

  private enum EmptyListener implements Listener {
    INSTANCE
  }

  /** A builder of {@code RetryExecutor} instances. */
  public static final class Builder {
    private RetryPolicy policy = RetryPolicy.defaultPolicy();
    private Clock clock = Utils.systemMillisUtc();
    private Delayer delayer = Delayer.defaultDelayer();
    private Listener listener = EmptyListener.INSTANCE;

    Builder() {}

    @CanIgnoreReturnValue
    public Builder policy(RetryPolicy policy) {
      this.policy = requireNonNull(policy);
      return this;
    }

    @CanIgnoreReturnValue
    public Builder listener(Listener listener) {
      this.listener = requireNonNull(listener);
      return this;
    }

    @CanIgnoreReturnValue
    Builder clock(Clock clock) {
      this.clock = requireNonNull(clock);
      return this;
    }

    @CanIgnoreReturnValue
    Builder delayer(Delayer delayer) {
      this.delayer = requireNonNull(delayer);
      return this;
    }

    public RetryExecutor build() {
      return new RetryExecutor(this);
    }
  }

  @SuppressWarnings("OptionalUsedAsFieldOrParameterType")
  private static final class ContextImpl<T> implements Context<T> {
    private final Optional<HttpResponse<T>> response;
    private final Optional<Throwable> exception;
    private final int attempt;
    private final Optional<Instant> deadline;

    ContextImpl(
        @Nullable HttpResponse<T> response,
        @Nullable Throwable exception,
        int attempt,
        @Nullable Instant deadline) {
      requireArgument(
          response != null ^ exception != null,
          "Exactly one of response or exception must be non-null");
      requireArgument(attempt > 0, "Expected attempt to be positive");
      this.response = Optional.ofNullable(response);
      this.exception = Optional.ofNullable(exception);
      this.attempt = attempt;
      this.deadline = Optional.ofNullable(deadline);
    }

    @Override
    public Optional<HttpResponse<T>> response() {
      return response;
    }

    @Override
    public Optional<Throwable> exception() {
      return exception;
    }

    @Override
    public int attempt() {
      return attempt;
    }

    @Override
    public Optional<Instant> deadline() {
      return deadline;
    }

    @Override
    public String toString() {
      return "Context[response="
          + response.orElse(null)
          + ", exception="
          + exception.orElse(null)
          + ", attempt="
          + attempt
          + "]";
    }
  }
}
