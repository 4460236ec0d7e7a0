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

import static org.assertj.core.api.Assertions.assertThat;

import com.github.mizosoft.probe.testing.HttpResponseStub;
import com.github.mizosoft.probe.testing.TestException;
import java.net.http.HttpTimeoutException;
import java.time.Duration;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

class RetryConditionTest {
  private static RetryExecutor.Context<Void> status(int statusCode) {
    return RetryExecutor.Context.of(new HttpResponseStub<>(statusCode), null, 1, null);
  }

  private static RetryExecutor.Context<Void> exception(Throwable exception) {
    return RetryExecutor.Context.of(null, exception, 1, null);
  }

  @ParameterizedTest
  @CsvSource({"200, false", "404, false", "500, false"})
  void never(int statusCode, boolean retry) {
    assertThat(RetryCondition.never().shouldRetry(status(statusCode))).isEqualTo(retry);
    assertThat(RetryCondition.never().shouldRetry(exception(new HttpTimeoutException("timed out"))))
        .isFalse();
  }

  @ParameterizedTest
  @CsvSource({"200, false", "429, false", "503, false"})
  void timeoutsOnly(int statusCode, boolean retry) {
    var condition = RetryCondition.timeoutsOnly();
    assertThat(condition.shouldRetry(status(statusCode))).isEqualTo(retry);
    assertThat(condition.shouldRetry(exception(new HttpTimeoutException("timed out")))).isTrue();
    assertThat(
            condition.shouldRetry(
                exception(new AttemptTimeoutException(Duration.ofSeconds(1)))))
        .isTrue();
    assertThat(condition.shouldRetry(exception(new TestException()))).isFalse();
  }

  @ParameterizedTest
  @CsvSource({"200, false", "302, false", "404, false", "500, true", "503, true", "599, true"})
  void timeoutsAndServerErrors(int statusCode, boolean retry) {
    var condition = RetryCondition.timeoutsAndServerErrors();
    assertThat(condition.shouldRetry(status(statusCode))).isEqualTo(retry);
    assertThat(condition.shouldRetry(exception(new HttpTimeoutException("timed out")))).isTrue();
    assertThat(condition.shouldRetry(exception(new TestException()))).isFalse();
  }

  @ParameterizedTest
  @CsvSource({"200, false", "302, false", "400, true", "404, true", "500, true"})
  void allErrors(int statusCode, boolean retry) {
    var condition = RetryCondition.allErrors();
    assertThat(condition.shouldRetry(status(statusCode))).isEqualTo(retry);
    assertThat(condition.shouldRetry(exception(new TestException()))).isTrue();
  }
}
