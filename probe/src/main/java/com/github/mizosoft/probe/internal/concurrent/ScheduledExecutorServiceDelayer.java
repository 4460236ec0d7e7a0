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

import com.github.mizosoft.probe.internal.Utils;
import java.time.Duration;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;

/** A {@code Delayer} that arms a timer on a {@code ScheduledExecutorService} per delayed task. */
final class ScheduledExecutorServiceDelayer implements Delayer {
  private final ScheduledExecutorService scheduler;

  ScheduledExecutorServiceDelayer(ScheduledExecutorService scheduler) {
    this.scheduler = requireNonNull(scheduler);
  }

  @Override
  @SuppressWarnings("FutureReturnValueIgnored")
  public CompletableFuture<Void> delay(Runnable task, Duration delay, Executor executor) {
    var completion = new CompletableFuture<Void>();
    Runnable submission =
        () -> {
          if (!completion.isDone()) {
            completion.completeAsync(
                () -> {
                  task.run();
                  return null;
                },
                executor);
          }
        };
    if (delay.isZero() || delay.isNegative()) {
      submission.run();
      return completion;
    }

    var timer = scheduler.schedule(submission, delay.toNanos(), TimeUnit.NANOSECONDS);
    completion.whenComplete(
        (__, ___) -> {
          if (completion.isCancelled()) {
            timer.cancel(false);
          }
        });
    return completion;
  }

  @Override
  public String toString() {
    return Utils.toStringIdentityPrefix(this) + "[scheduler=" + scheduler + "]";
  }
}
