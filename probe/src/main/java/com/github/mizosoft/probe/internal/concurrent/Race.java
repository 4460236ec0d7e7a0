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

package com.github.mizosoft.probe.internal.concurrent;

import static java.util.Objects.requireNonNull;

import com.github.mizosoft.probe.CancellationToken;
import com.github.mizosoft.probe.internal.Utils;
import java.time.Duration;
import java.util.concurrent.CompletableFuture;
import java.util.function.Supplier;
import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * Races a task against a timer and a {@link CancellationToken}. The returned future completes with
 * whichever of the three settles first:
 *
 * <ul>
 *   <li>the task's own result or exception,
 *   <li>the exception supplied by {@code onTimeout} once the timeout elapses,
 *   <li>the token's cancellation cause.
 * </ul>
 *
 * <p>Once the race settles, the task is cancelled (if still running), the timer is cancelled and
 * the token callback is detached, so losers never outlive the race.
 */
public final class Race {
  private Race() {}

  public static <T> CompletableFuture<T> firstOf(
      CompletableFuture<T> task, CancellationToken token) {
    return firstOf(task, null, null, token, Delayer.defaultDelayer());
  }

  public static <T> CompletableFuture<T> firstOf(
      CompletableFuture<T> task,
      @Nullable Duration timeout,
      @Nullable Supplier<? extends Throwable> onTimeout,
      CancellationToken token,
      Delayer delayer) {
    requireNonNull(task);
    requireNonNull(token);
    requireNonNull(delayer);
    var race = new CompletableFuture<T>();
    var registration = token.register(race::completeExceptionally);
    var timer =
        timeout != null
            ? delayer.delay(
                () -> race.completeExceptionally(requireNonNull(onTimeout).get()),
                timeout,
                Runnable::run)
            : null;
    task.whenComplete(
        (result, exception) -> {
          if (exception != null) {
            race.completeExceptionally(Utils.getDeepCompletionCause(exception));
          } else {
            race.complete(result);
          }
        });
    race.whenComplete(
        (__, ___) -> {
          registration.close();
          if (timer != null) {
            timer.cancel(false);
          }
          task.cancel(true);
        });
    return race;
  }
}
