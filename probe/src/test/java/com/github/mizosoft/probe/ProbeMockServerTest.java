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

import com.github.mizosoft.probe.testing.RecordingAssertionHandler;
import java.io.IOException;
import java.net.http.HttpClient;
import java.time.Duration;
import java.util.concurrent.TimeUnit;
import java.util.regex.Pattern;
import okhttp3.mockwebserver.MockResponse;
import okhttp3.mockwebserver.MockWebServer;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.RepeatedTest;
import org.junit.jupiter.api.Test;

class ProbeMockServerTest {
  private static final int SERVICE_UNAVAILABLE = 503;

  private MockWebServer server;
  private RecordingAssertionHandler handler;
  private Probe probe;

  @BeforeEach
  void setUp() throws IOException {
    server = new MockWebServer();
    server.start();
    handler = new RecordingAssertionHandler();
    probe =
        Probe.newBuilder()
            .baseUri(server.url("/").uri())
            .client(HttpClient.newBuilder().version(HttpClient.Version.HTTP_1_1).build())
            .assertionHandler(handler)
            .validateFailures(true)
            .build();
  }

  @AfterEach
  void tearDown() throws IOException {
    server.shutdown();
  }

  @Test
  void getWithHeaders() throws Exception {
    server.enqueue(
        new MockResponse()
            .setHeader("Content-Type", "application/json")
            .setHeader("X-Request-Id", "42")
            .setBody("{\"id\":1}"));

    probe
        .get("/users/1")
        .withHeader("Accept", "application/json")
        .expect()
        .status(200)
        .containsHeader("x-request-id")
        .header("Content-Type", "application/json")
        .bodyMatches(Pattern.compile("\\{\"id\":\\d+}"));

    assertThat(handler.failures()).isEmpty();
    var recorded = server.takeRequest();
    assertThat(recorded.getMethod()).isEqualTo("GET");
    assertThat(recorded.getPath()).isEqualTo("/users/1");
    assertThat(recorded.getHeader("Accept")).isEqualTo("application/json");
  }

  @Test
  void headerMismatch() {
    server.enqueue(new MockResponse().setHeader("Content-Type", "text/html"));

    probe.get("/").expect().header("Content-Type", "application/json");

    var failure = handler.lastFailure().failure();
    assertThat(failure.type()).isEqualTo(AssertionType.EQUAL);
    assertThat(failure.actual()).hasValue(AssertionValue.of("text/html"));
  }

  @Test
  void retryReplaysRequestBody() throws Exception {
    server.enqueue(new MockResponse().setResponseCode(SERVICE_UNAVAILABLE));
    server.enqueue(new MockResponse().setResponseCode(SERVICE_UNAVAILABLE));
    server.enqueue(new MockResponse().setBody("stored"));

    var response =
        probe
            .post("/items")
            .withText("payload")
            .withMaxRetries(2)
            .withRetryDelay(Duration.ofMillis(1), Duration.ofMillis(5))
            .expect()
            .status(200)
            .body("stored");

    assertThat(handler.failures()).isEmpty();
    assertThat(response.attemptCount()).isEqualTo(3);
    assertThat(response.roundTripTime()).isPresent();
    for (int i = 0; i < 3; i++) {
      var recorded = server.takeRequest();
      assertThat(recorded.getMethod()).isEqualTo("POST");
      assertThat(recorded.getBody().readUtf8()).isEqualTo("payload");
    }
  }

  @Test
  void exhaustedRetriesReturnLastResponse() {
    server.enqueue(new MockResponse().setResponseCode(SERVICE_UNAVAILABLE));
    server.enqueue(new MockResponse().setResponseCode(SERVICE_UNAVAILABLE).setBody("busy"));

    var response =
        probe
            .get("/")
            .withMaxRetries(1)
            .withRetryDelay(Duration.ZERO, Duration.ZERO)
            .expect()
            .status(SERVICE_UNAVAILABLE)
            .body("busy");

    assertThat(handler.failures()).isEmpty();
    assertThat(response.attemptCount()).isEqualTo(2);
    assertThat(server.getRequestCount()).isEqualTo(2);
  }

  @Test
  void attemptTimeoutIsRetried() {
    server.enqueue(new MockResponse().setHeadersDelay(1, TimeUnit.SECONDS));
    server.enqueue(new MockResponse().setBody("fast"));

    var response =
        probe
            .get("/")
            .withTimeout(Duration.ofMillis(200))
            .withRetryPolicy(RetryCondition.timeoutsOnly())
            .withMaxRetries(1)
            .withRetryDelay(Duration.ZERO, Duration.ZERO)
            .expect()
            .status(200)
            .body("fast");

    assertThat(handler.failures()).isEmpty();
    assertThat(response.attemptCount()).isEqualTo(2);
  }

  @Test
  void deadlineExceeded() {
    server.enqueue(new MockResponse().setHeadersDelay(1, TimeUnit.SECONDS));
    server.enqueue(new MockResponse().setHeadersDelay(1, TimeUnit.SECONDS));

    var response =
        probe
            .get("/")
            .withDeadline(Duration.ofMillis(300))
            .withMaxRetries(5)
            .withRetryDelay(Duration.ZERO, Duration.ZERO)
            .expect()
            .status(200);

    var failure = handler.lastFailure().failure();
    assertThat(failure.type()).isEqualTo(AssertionType.OPERATION);
    assertThat(failure.errors().get(1)).isInstanceOf(DeadlineExceededException.class);
    assertThat(response.raw()).isEmpty();
    assertThat(handler.failures()).hasSize(1);
  }

  @RepeatedTest(3)
  void deadlineExceededWithoutRetries() {
    server.enqueue(new MockResponse().setHeadersDelay(1, TimeUnit.SECONDS));

    probe
        .get("/")
        .withDeadline(Duration.ofMillis(300))
        .withRetryPolicy(RetryCondition.never())
        .expect()
        .status(200);

    var failure = handler.lastFailure().failure();
    assertThat(failure.type()).isEqualTo(AssertionType.OPERATION);
    assertThat(failure.errors().get(1)).isInstanceOf(DeadlineExceededException.class);
    assertThat(handler.failures()).hasSize(1);
  }

  @Test
  void pathAndQueryParameters() throws Exception {
    server.enqueue(new MockResponse().setBody("[]"));

    probe
        .get("/users/{id}/repos")
        .withPath("id", 7)
        .withQuery("sort", "name asc")
        .expect()
        .status(200)
        .body("[]");

    assertThat(handler.failures()).isEmpty();
    assertThat(server.takeRequest().getPath()).isEqualTo("/users/7/repos?sort=name+asc");
  }

  @Test
  void cancellationStopsInFlightRequest() {
    server.enqueue(new MockResponse().setHeadersDelay(1, TimeUnit.SECONDS));
    var source = CancellationToken.newSource().cancelAfter(Duration.ofMillis(200));

    probe.get("/").withCancellation(source.token()).expect().status(200);

    var failure = handler.lastFailure().failure();
    assertThat(failure.type()).isEqualTo(AssertionType.OPERATION);
    assertThat(failure.errors().get(1)).isInstanceOf(RequestCancelledException.class);
  }
}
