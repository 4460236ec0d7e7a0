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
import com.github.mizosoft.probe.internal.concurrent.Delayer;
import com.google.errorprone.annotations.CanIgnoreReturnValue;
import java.net.URI;
import java.net.http.HttpClient;
import java.time.Clock;
import java.util.Optional;
import org.checkerframework.checker.nullness.qual.MonotonicNonNull;
import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * The entry point for making requests and asserting on their responses. A {@code Probe} is
 * immutable and can be shared across tests.
 *
 * <pre>{@code
 * var probe = Probe.newBuilder()
 *     .baseUri("http://localhost:8080/")
 *     .testName("fetchesUsers")
 *     .build();
 * probe.get("/users")
 *     .withMaxRetries(3)
 *     .expect()
 *     .status(200)
 *     .containsHeader("Content-Type");
 * }</pre>
 */
public final class Probe {
  private final @Nullable URI baseUri;
  private final Transport transport;
  private final AssertionHandler assertionHandler;
  private final String testName;
  private final RetryPolicy retryPolicy;
  private final boolean validateFailures;
  private final Clock clock;
  private final Delayer delayer;

  private Probe(Builder builder) {
    this.baseUri = builder.baseUri;
    this.transport =
        builder.transport != null ? builder.transport : Transport.of(HttpClient.newHttpClient());
    this.assertionHandler =
        builder.assertionHandler != null
            ? builder.assertionHandler
            : new DefaultAssertionHandler(Reporter.throwing());
    this.testName = builder.testName;
    this.retryPolicy = builder.retryPolicy;
    this.validateFailures = builder.validateFailures;
    this.clock = builder.clock;
    this.delayer = builder.delayer;
  }

  public Optional<URI> baseUri() {
    return Optional.ofNullable(baseUri);
  }

  public AssertionHandler assertionHandler() {
    return assertionHandler;
  }

  public String testName() {
    return testName;
  }

  /** Returns the retry policy requests start with. */
  public RetryPolicy retryPolicy() {
    return retryPolicy;
  }

  /**
   * Returns a new request with the given method and path. The path is resolved against the base
   * URI, if any.
   */
  public ProbeRequest request(String method, String path) {
    requireNonNull(method);
    requireNonNull(path);
    var chain =
        Chain.newRoot(
            String.format("Request(\"%s\")", method), testName, assertionHandler, validateFailures);
    return new ProbeRequest(this, chain, method, path);
  }

  public ProbeRequest get(String path) {
    return request("GET", path);
  }

  public ProbeRequest head(String path) {
    return request("HEAD", path);
  }

  public ProbeRequest post(String path) {
    return request("POST", path);
  }

  public ProbeRequest put(String path) {
    return request("PUT", path);
  }

  public ProbeRequest patch(String path) {
    return request("PATCH", path);
  }

  public ProbeRequest delete(String path) {
    return request("DELETE", path);
  }

  public ProbeRequest options(String path) {
    return request("OPTIONS", path);
  }

  /** Returns a new root chain for custom assertions, reporting to this probe's handler. */
  public Chain newChain(String name) {
    return Chain.newRoot(name, testName, assertionHandler, validateFailures);
  }

  Transport transport() {
    return transport;
  }

  Clock clock() {
    return clock;
  }

  Delayer delayer() {
    return delayer;
  }

  @Override
  public String toString() {
    return Utils.toStringIdentityPrefix(this)
        + "[baseUri="
        + baseUri
        + ", testName="
        + testName
        + ", retryPolicy="
        + retryPolicy
        + "]";
  }

  /** Returns a {@code Probe} sending requests with the given client. */
  public static Probe create(HttpClient client) {
    return newBuilder().client(client).build();
  }

  public static Builder newBuilder() {
    return new Builder();
  }

  /** A builder of {@code Probe} instances. */
  public static final class Builder {
    private @MonotonicNonNull URI baseUri;
    private @MonotonicNonNull Transport transport;
    private @MonotonicNonNull AssertionHandler assertionHandler;
    private String testName = "";
    private RetryPolicy retryPolicy = RetryPolicy.defaultPolicy();
    private boolean validateFailures = Boolean.getBoolean(Chain.VALIDATE_FAILURES_PROPERTY);
    private Clock clock = Utils.systemMillisUtc();
    private Delayer delayer = Delayer.defaultDelayer();

    Builder() {}

    /** Sets the URI request paths are resolved against. */
    @CanIgnoreReturnValue
    public Builder baseUri(URI baseUri) {
      this.baseUri = requireNonNull(baseUri);
      return this;
    }

    /**
     * Sets the URI request paths are resolved against.
     *
     * @throws IllegalArgumentException if the given string isn't a valid URI
     */
    @CanIgnoreReturnValue
    public Builder baseUri(String baseUri) {
      return baseUri(URI.create(baseUri));
    }

    /** Sets the {@code Transport} requests are sent with. */
    @CanIgnoreReturnValue
    public Builder transport(Transport transport) {
      this.transport = requireNonNull(transport);
      return this;
    }

    /** Sets the {@code HttpClient} requests are sent with. */
    @CanIgnoreReturnValue
    public Builder client(HttpClient client) {
      return transport(Transport.of(client));
    }

    /**
     * Sets the handler assertion outcomes are reported to. The default handler is a {@link
     * DefaultAssertionHandler} that throws an {@code AssertionError} on fatal failures.
     */
    @CanIgnoreReturnValue
    public Builder assertionHandler(AssertionHandler assertionHandler) {
      this.assertionHandler = requireNonNull(assertionHandler);
      return this;
    }

    /** Sets a {@link DefaultAssertionHandler} reporting fatal failures to the given reporter. */
    @CanIgnoreReturnValue
    public Builder reporter(Reporter reporter) {
      return assertionHandler(new DefaultAssertionHandler(reporter));
    }

    @CanIgnoreReturnValue
    public Builder testName(String testName) {
      this.testName = requireNonNull(testName);
      return this;
    }

    /** Sets the retry policy requests start with. */
    @CanIgnoreReturnValue
    public Builder retryPolicy(RetryPolicy retryPolicy) {
      this.retryPolicy = requireNonNull(retryPolicy);
      return this;
    }

    /**
     * Specifies whether failures are checked to carry the values their type calls for. An
     * ill-formed failure makes the reporting code throw an {@code IllegalStateException}. This is
     * meant for testing custom matchers. The default is taken from the {@code
     * com.github.mizosoft.probe.chain.validateFailures} system property.
     */
    @CanIgnoreReturnValue
    public Builder validateFailures(boolean validateFailures) {
      this.validateFailures = validateFailures;
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

    public Probe build() {
      return new Probe(this);
    }
  }
}
