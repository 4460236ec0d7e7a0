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

import static java.nio.charset.StandardCharsets.UTF_8;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatIllegalStateException;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.github.mizosoft.probe.testing.MockClock;
import com.github.mizosoft.probe.testing.MockDelayer;
import com.github.mizosoft.probe.testing.RecordingAssertionHandler;
import com.github.mizosoft.probe.testing.RecordingTransport;
import com.github.mizosoft.probe.testing.TestException;
import java.io.ByteArrayInputStream;
import java.net.URI;
import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.regex.Pattern;
import java.util.stream.Collectors;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class ProbeRequestTest {
  private RecordingTransport transport;
  private RecordingAssertionHandler handler;
  private Probe probe;

  @BeforeEach
  void setUp() {
    var clock = new MockClock();
    transport = new RecordingTransport();
    handler = new RecordingAssertionHandler();
    probe =
        Probe.newBuilder()
            .baseUri("http://example.com/")
            .transport(transport)
            .assertionHandler(handler)
            .testName("probeRequestTest")
            .clock(clock)
            .delayer(new MockDelayer(clock))
            .validateFailures(true)
            .build();
  }

  private void respondWith(int statusCode, String body) {
    transport.handleCalls(call -> call.complete(statusCode, body));
  }

  private AssertionFailure lastFailure() {
    return handler.lastFailure().failure();
  }

  private static String errorMessages(AssertionFailure failure) {
    return failure.errors().stream()
        .map(Throwable::getMessage)
        .map(String::valueOf)
        .collect(Collectors.joining("\n"));
  }

  @Test
  void sendAndCheckResponse() {
    respondWith(200, "hello");

    var response =
        probe
            .get("/users")
            .withHeader("Accept", "text/plain")
            .expect()
            .status(200)
            .statusRange(StatusRange.SUCCESSFUL)
            .statusIn(200, 204)
            .body("hello")
            .bodyMatches(Pattern.compile("h.*o"));

    assertThat(handler.failures()).isEmpty();
    assertThat(response.attemptCount()).isEqualTo(1);
    assertThat(response.raw()).isPresent();
    assertThat(transport.sendCount()).isEqualTo(1);

    var request = transport.lastCall().request();
    assertThat(request.uri()).isEqualTo(URI.create("http://example.com/users"));
    assertThat(request.method()).isEqualTo("GET");
    assertThat(request.headers().firstValue("Accept")).hasValue("text/plain");
  }

  @Test
  void successesAreReportedWithPath() {
    respondWith(200, "");

    probe.get("/").expect().status(200);

    assertThat(handler.successes())
        .extracting(AssertionContext::path)
        .contains(
            List.of("Request(\"GET\")", "Expect()"),
            List.of("Request(\"GET\")", "Expect()", "Status(200)"));
  }

  @Test
  void statusMismatch() {
    respondWith(404, "not found");

    var response = probe.get("/users").withName("fetchUsers").expect().status(200).body("x");

    assertThat(handler.failures()).hasSize(1);
    var recorded = handler.lastFailure();
    assertThat(recorded.context().path())
        .containsExactly("Request(\"GET\")", "Expect()", "Status(200)");
    assertThat(recorded.context().requestName()).isEqualTo("fetchUsers");
    assertThat(recorded.context().response()).isPresent();
    assertThat(recorded.failure().type()).isEqualTo(AssertionType.EQUAL);
    assertThat(recorded.failure().actual()).hasValue(AssertionValue.of(404));
    assertThat(recorded.failure().expected()).hasValue(AssertionValue.of(200));
    assertThat(response.chain().failed()).isTrue();
  }

  @Test
  void statusRangeMismatch() {
    respondWith(302, "");

    probe.get("/").expect().statusRange(StatusRange.SUCCESSFUL);

    assertThat(lastFailure().type()).isEqualTo(AssertionType.BELONGS);
    assertThat(lastFailure().expected())
        .hasValue(AssertionValue.of(AssertionList.of(StatusRange.SUCCESSFUL)));
  }

  @Test
  void statusInMismatch() {
    respondWith(500, "");

    probe.get("/").expect().statusIn(200, 201);

    assertThat(lastFailure().type()).isEqualTo(AssertionType.BELONGS);
    assertThat(lastFailure().expected()).hasValue(AssertionValue.of(AssertionList.of(200, 201)));
  }

  @Test
  void statusInWithNoCodes() {
    respondWith(200, "");

    probe.get("/").expect().statusIn();

    assertThat(lastFailure().type()).isEqualTo(AssertionType.USAGE);
  }

  @Test
  void missingHeader() {
    respondWith(200, "");

    probe.get("/").expect().containsHeader("X-Request-Id");

    assertThat(lastFailure().type()).isEqualTo(AssertionType.CONTAINS_KEY);
    assertThat(lastFailure().expected()).hasValue(AssertionValue.of("X-Request-Id"));
  }

  @Test
  void bodyMismatch() {
    respondWith(200, "actual");

    probe.get("/").expect().bodyMatches(Pattern.compile("expected"));

    assertThat(lastFailure().type()).isEqualTo(AssertionType.MATCH_REGEXP);
    assertThat(lastFailure().actual()).hasValue(AssertionValue.of("actual"));
  }

  @Test
  void bodyCanBeCheckedRepeatedly() {
    respondWith(200, "twice");

    probe.get("/").expect().body("twice").body("twice").bodyMatches(Pattern.compile("tw.*"));

    assertThat(handler.failures()).isEmpty();
  }

  @Test
  void aliasedPath() {
    respondWith(201, "");

    probe.post("/users").expect().alias("createUser").status(200);

    var context = handler.lastFailure().context();
    assertThat(context.path()).containsExactly("Request(\"POST\")", "Expect()", "Status(200)");
    assertThat(context.aliasedPath()).containsExactly("createUser", "Status(200)");
  }

  @Test
  void retryServerErrors() {
    var attempts = new AtomicInteger();
    transport.handleCalls(
        call -> call.complete(attempts.incrementAndGet() < 3 ? 503 : 200, "done"));

    var response =
        probe
            .get("/flaky")
            .withMaxRetries(2)
            .withRetryDelay(Duration.ZERO, Duration.ZERO)
            .expect()
            .status(200)
            .body("done");

    assertThat(handler.failures()).isEmpty();
    assertThat(response.attemptCount()).isEqualTo(3);
    assertThat(transport.sendCount()).isEqualTo(3);
  }

  @Test
  void noRetriesByDefault() {
    respondWith(503, "");

    var response = probe.get("/").expect();

    assertThat(response.attemptCount()).isEqualTo(1);
    assertThat(transport.sendCount()).isEqualTo(1);
  }

  @Test
  void customRetryCondition() {
    var attempts = new AtomicInteger();
    transport.handleCalls(
        call -> call.complete(attempts.incrementAndGet() < 2 ? 429 : 200, ""));

    probe
        .get("/")
        .withRetryPolicy(RetryCondition.allErrors())
        .withMaxRetries(1)
        .withRetryDelay(Duration.ZERO, Duration.ZERO)
        .expect()
        .status(200);

    assertThat(handler.failures()).isEmpty();
    assertThat(transport.sendCount()).isEqualTo(2);
  }

  @Test
  void sendFailure() {
    transport.handleCalls(call -> call.completeExceptionally(new TestException("refused")));

    var response = probe.get("/").expect().status(200);

    assertThat(handler.failures()).hasSize(1);
    assertThat(lastFailure().type()).isEqualTo(AssertionType.OPERATION);
    assertThat(lastFailure().errors())
        .extracting(Throwable::getMessage)
        .containsExactly("failed to send http request", "refused");
    assertThat(response.raw()).isEmpty();
    assertThat(response.chain().failed()).isTrue();
  }

  @Test
  void cancelledBeforeSending() {
    var source = CancellationToken.newSource();
    source.cancel();

    probe.get("/").withCancellation(source.token()).expect();

    assertThat(lastFailure().type()).isEqualTo(AssertionType.OPERATION);
    assertThat(lastFailure().errors().get(1)).isInstanceOf(RequestCancelledException.class);
    assertThat(transport.sendCount()).isZero();
  }

  @Test
  void negativeMaxRetries() {
    respondWith(200, "");

    var response = probe.get("/").withMaxRetries(-1).expect().status(200);

    assertThat(handler.failures()).hasSize(1);
    assertThat(lastFailure().type()).isEqualTo(AssertionType.VALID);
    assertThat(lastFailure().actual()).hasValue(AssertionValue.of(-1));
    assertThat(errorMessages(lastFailure())).contains("invalid negative argument");
    assertThat(response.raw()).isEmpty();
    assertThat(transport.sendCount()).isZero();
  }

  @Test
  void invalidRetryDelayRange() {
    probe.get("/").withRetryDelay(Duration.ofSeconds(2), Duration.ofSeconds(1)).expect();

    assertThat(lastFailure().type()).isEqualTo(AssertionType.VALID);
    var range = AssertionRange.of(Duration.ofSeconds(2), Duration.ofSeconds(1));
    assertThat(lastFailure().actual()).hasValue(AssertionValue.of(range));
    assertThat(transport.sendCount()).isZero();
  }

  @Test
  void nonPositiveTimeouts() {
    probe.get("/").withTimeout(Duration.ZERO).expect();
    assertThat(errorMessages(lastFailure())).contains("invalid non-positive duration");

    probe.get("/").withDeadline(Duration.ofSeconds(-1)).expect();
    assertThat(handler.failures()).hasSize(2);
    assertThat(transport.sendCount()).isZero();
  }

  @Test
  void invalidHeader() {
    probe.get("/").withHeader("Connection", "close").expect();

    assertThat(lastFailure().type()).isEqualTo(AssertionType.VALID);
    assertThat(lastFailure().actual()).hasValue(AssertionValue.of("Connection"));
    assertThat(transport.sendCount()).isZero();
  }

  @Test
  void invalidPath() {
    var probeWithoutBase =
        Probe.newBuilder().transport(transport).assertionHandler(handler).build();

    probeWithoutBase.get("not a uri").expect();

    assertThat(lastFailure().type()).isEqualTo(AssertionType.VALID);
    assertThat(errorMessages(lastFailure())).contains("invalid request");
    assertThat(transport.sendCount()).isZero();
  }

  @Test
  void ambiguousBody() {
    probe.post("/").withText("a").withBytes("b".getBytes(UTF_8)).expect();

    assertThat(lastFailure().type()).isEqualTo(AssertionType.USAGE);
    assertThat(errorMessages(lastFailure()))
        .contains("set by WithText(), overwritten by WithBytes()");
    assertThat(transport.sendCount()).isZero();
  }

  @Test
  void textBodySetsContentType() {
    respondWith(200, "");

    probe.post("/").withText("hello").expect();

    var request = transport.lastCall().request();
    assertThat(request.headers().firstValue("Content-Type")).hasValue("text/plain; charset=utf-8");
    assertThat(request.bodyPublisher()).isPresent();
  }

  @Test
  void requestBodyIsReleasedAfterExchange() {
    respondWith(200, "");
    var releaseCount = new AtomicInteger();

    probe
        .put("/")
        .withBody(new ByteArrayInputStream("body".getBytes(UTF_8)), releaseCount::incrementAndGet)
        .expect();

    assertThat(releaseCount).hasValue(1);
  }

  @Test
  void expectTwice() {
    respondWith(200, "");
    var request = probe.get("/");

    request.expect();
    request.expect();

    assertThat(lastFailure().type()).isEqualTo(AssertionType.USAGE);
    assertThat(errorMessages(lastFailure())).contains("may be called only once");
    assertThat(transport.sendCount()).isEqualTo(1);
  }

  @Test
  void callsAfterFailureHaveNoEffect() {
    probe
        .get("/")
        .withMaxRetries(-1)
        .withHeader("Connection", "close")
        .withTimeout(Duration.ZERO)
        .expect()
        .status(200)
        .body("x");

    assertThat(handler.failures()).hasSize(1);
  }

  @Test
  void nonFatalSeverity() {
    respondWith(500, "");
    var request = probe.get("/");
    request.chain().setSeverity(AssertionSeverity.NON_FATAL);

    request.expect().status(200);

    assertThat(lastFailure().isFatal()).isFalse();
  }

  @Test
  void defaultHandlerThrowsOnFatalFailure() {
    respondWith(404, "");
    var throwingProbe =
        Probe.newBuilder().baseUri("http://example.com").transport(transport).build();

    assertThatThrownBy(() -> throwingProbe.get("/").expect().status(200))
        .isInstanceOf(AssertionError.class)
        .hasMessageContaining("assertion failed: equal")
        .hasMessageContaining("Status(200)");
  }

  @Test
  void matchersRunOnResponse() {
    respondWith(200, "");
    var seen = new ArrayList<Integer>();

    probe
        .get("/")
        .withMatcher(response -> seen.add(response.attemptCount()))
        .withMatcher(response -> response.status(201))
        .expect();

    assertThat(seen).containsExactly(1);
    assertThat(handler.failures()).hasSize(1);
    assertThat(lastFailure().type()).isEqualTo(AssertionType.EQUAL);
    assertThat(lastFailure().expected()).hasValue(AssertionValue.of(201));
  }

  @Test
  void matchersDoNotRunIfRequestIsNotSent() {
    transport.handleCalls(call -> call.completeExceptionally(new TestException("refused")));
    var matcherCalls = new AtomicInteger();

    probe.get("/").withMatcher(__ -> matcherCalls.incrementAndGet()).expect();

    assertThat(matcherCalls).hasValue(0);
    assertThat(lastFailure().type()).isEqualTo(AssertionType.OPERATION);
  }

  @Test
  void transformersModifyRequest() {
    respondWith(200, "");

    probe
        .get("/")
        .withHeader("Accept", "text/plain")
        .withTransformer(builder -> builder.setHeader("Accept", "application/json"))
        .withTransformer(builder -> builder.header("X-Trace", "1"))
        .expect();

    assertThat(handler.failures()).isEmpty();
    var request = transport.lastCall().request();
    assertThat(request.headers().allValues("Accept")).containsExactly("application/json");
    assertThat(request.headers().firstValue("X-Trace")).hasValue("1");
  }

  @Test
  void transformerMakingInvalidRequest() {
    probe.get("/").withTransformer(builder -> builder.header("Connection", "close")).expect();

    assertThat(lastFailure().type()).isEqualTo(AssertionType.VALID);
    assertThat(errorMessages(lastFailure())).contains("invalid request");
    assertThat(transport.sendCount()).isZero();
  }

  @Test
  void pathParameters() {
    respondWith(200, "");

    probe
        .get("/users/{id}/repos/{Repo}")
        .withPath("id", 42)
        .withPath("repo", "methanol")
        .expect();

    assertThat(handler.failures()).isEmpty();
    assertThat(transport.lastCall().request().uri())
        .isEqualTo(URI.create("http://example.com/users/42/repos/methanol"));
  }

  @Test
  void missingPathParameter() {
    probe.get("/users/{id}").withPath("name", "x").expect();

    assertThat(handler.failures()).hasSize(1);
    var recorded = handler.lastFailure();
    assertThat(recorded.context().path())
        .containsExactly("Request(\"GET\")", "WithPath(\"name\")");
    assertThat(recorded.failure().type()).isEqualTo(AssertionType.USAGE);
    assertThat(errorMessages(recorded.failure()))
        .contains("key \"name\" not found in path template \"/users/{id}\"");
    assertThat(transport.sendCount()).isZero();
  }

  @Test
  void unbalancedPathTemplate() {
    probe.get("/users/{id").withPath("id", 1).expect();

    assertThat(lastFailure().type()).isEqualTo(AssertionType.VALID);
    assertThat(lastFailure().actual()).hasValue(AssertionValue.of("/users/{id"));
    assertThat(errorMessages(lastFailure())).contains("unbalanced braces");
    assertThat(transport.sendCount()).isZero();
  }

  @Test
  void queryParameters() {
    respondWith(200, "");

    probe.get("/search?lang=en").withQuery("q", "a b&c").withQuery("page", 2).expect();

    assertThat(handler.failures()).isEmpty();
    assertThat(transport.lastCall().request().uri())
        .isEqualTo(URI.create("http://example.com/search?lang=en&q=a+b%26c&page=2"));
  }

  @Test
  void multipleHeaders() {
    respondWith(200, "");
    var headers = new LinkedHashMap<String, String>();
    headers.put("Accept", "text/plain");
    headers.put("X-Trace", "1");

    probe.get("/").withHeaders(headers).expect();

    assertThat(handler.failures()).isEmpty();
    var request = transport.lastCall().request();
    assertThat(request.headers().firstValue("Accept")).hasValue("text/plain");
    assertThat(request.headers().firstValue("X-Trace")).hasValue("1");
  }

  @Test
  void multipleHeadersStopAtInvalidOne() {
    var headers = new LinkedHashMap<String, String>();
    headers.put("Connection", "close");
    headers.put("Expect", "100-continue");

    probe.get("/").withHeaders(headers).expect();

    assertThat(handler.failures()).hasSize(1);
    assertThat(handler.lastFailure().context().path())
        .containsExactly("Request(\"GET\")", "WithHeaders()");
    assertThat(lastFailure().type()).isEqualTo(AssertionType.VALID);
    assertThat(lastFailure().actual()).hasValue(AssertionValue.of("Connection"));
    assertThat(transport.sendCount()).isZero();
  }

  @Test
  void requestOptionsAfterFailureHaveNoEffect() {
    var matcherCalls = new AtomicInteger();
    var transformerCalls = new AtomicInteger();

    probe
        .get("/users/{id}")
        .withMaxRetries(-1)
        .withPath("id", 1)
        .withPath("missing", 2)
        .withQuery("q", "x")
        .withHeaders(Map.of("Connection", "close"))
        .withTransformer(__ -> transformerCalls.incrementAndGet())
        .withMatcher(__ -> matcherCalls.incrementAndGet())
        .expect();

    assertThat(handler.failures()).hasSize(1);
    assertThat(lastFailure().type()).isEqualTo(AssertionType.VALID);
    assertThat(transformerCalls).hasValue(0);
    assertThat(matcherCalls).hasValue(0);
    assertThat(transport.sendCount()).isZero();
  }

  @Test
  void failedCheckReleasesResponseBody() {
    respondWith(500, "server error");

    var response = probe.get("/").expect().status(200);

    var body = response.raw().orElseThrow().body();
    assertThat(body.isDrained()).isTrue();
    assertThatIllegalStateException().isThrownBy(body::snapshot);
  }

  @Test
  void closeReleasesResponseBody() {
    respondWith(200, "hello");
    var response = probe.get("/").expect().body("hello");

    response.close();

    var body = response.raw().orElseThrow().body();
    assertThat(body.isDrained()).isTrue();
    assertThatIllegalStateException().isThrownBy(body::snapshot);

    // Checks reuse the text that was read before closing.
    response.body("hello");
    assertThat(handler.failures()).isEmpty();
  }

  @Test
  void bodyCheckAfterCloseFails() {
    respondWith(200, "hello");
    var response = probe.get("/").expect();

    response.close();
    response.body("hello");

    assertThat(lastFailure().type()).isEqualTo(AssertionType.OPERATION);
    assertThat(errorMessages(lastFailure())).contains("failed to read response body");
  }

  @Test
  void customChain() {
    var chain = probe.newChain("Custom()");
    chain.enter("Positive()");
    chain.fail(
        AssertionFailure.newBuilder(AssertionType.GT)
            .actual(-1)
            .expected(0)
            .error("expected: value is greater than given value")
            .build());
    chain.leave();

    assertThat(handler.lastFailure().context().path()).containsExactly("Custom()", "Positive()");
    assertThat(handler.lastFailure().context().testName()).isEqualTo("probeRequestTest");
  }
}
