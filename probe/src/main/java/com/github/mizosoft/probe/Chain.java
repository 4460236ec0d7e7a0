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

import static com.github.mizosoft.probe.internal.Validate.requireState;
import static java.util.Objects.requireNonNull;

import com.github.mizosoft.probe.internal.FailureValidator;
import com.github.mizosoft.probe.internal.Utils;
import com.google.errorprone.annotations.FormatMethod;
import com.google.errorprone.annotations.FormatString;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * Tracks the state of a branch of nested assertions. Every fluent object ({@link ProbeRequest},
 * {@link ProbeResponse}, or a user-provided matcher) owns a chain, and reports the outcome of each
 * of its checks through it.
 *
 * <p>A check is bracketed by {@link #enter(String)} and {@link #leave()}, which push and pop a
 * segment of the assertion path. Between the two, the check may call {@link
 * #fail(AssertionFailure)} to report a failure. Only the first failure of a chain is reported:
 * once failed, later checks are skipped by their callers and {@code fail} becomes a no-op. If the
 * check produces a derived fluent object, it gives that object a {@link #clone() clone} of the
 * chain, so the derived object carries the current path and failure state and can fail
 * independently.
 *
 * <pre>{@code
 * chain.enter("Status(%d)", expected);
 * try {
 *   if (!chain.failed() && actual != expected) {
 *     chain.fail(AssertionFailure.newBuilder(AssertionType.EQUAL)
 *         .actual(actual)
 *         .expected(expected)
 *         .error("unexpected status code")
 *         .build());
 *   }
 * } finally {
 *   chain.leave();
 * }
 * }</pre>
 *
 * <p>A chain is confined to one flow of control, but a clone can be handed to another thread.
 */
public final class Chain {
  static final String VALIDATE_FAILURES_PROPERTY =
      "com.github.mizosoft.probe.chain.validateFailures";

  private final AssertionHandler handler;
  private final boolean validateFailures;
  private final String testName;
  private final List<String> path;

  /** Where the aliased path starts in {@code path}. */
  private int aliasStart;

  private List<String> aliasPrefix;

  /** Number of segments pushed by enter() that haven't been popped yet. */
  private int depth;

  private @Nullable Chain parent;
  private AssertionSeverity severity;
  private String requestName;
  private @Nullable HttpRequest request;
  private @Nullable HttpResponse<?> response;
  private @Nullable Duration roundTripTime;
  private @Nullable Runnable failureCallback;
  private boolean failed;
  private volatile boolean descendantFailed;

  private Chain(
      String rootName, String testName, AssertionHandler handler, boolean validateFailures) {
    this.handler = requireNonNull(handler);
    this.testName = requireNonNull(testName);
    this.validateFailures = validateFailures;
    this.path = new ArrayList<>();
    this.aliasPrefix = List.of();
    this.severity = AssertionSeverity.FATAL;
    this.requestName = "";
    if (!rootName.isEmpty()) {
      path.add(rootName);
    }
  }

  private Chain(Chain other) {
    this.handler = other.handler;
    this.testName = other.testName;
    this.validateFailures = other.validateFailures;
    this.path = new ArrayList<>(other.path);
    this.aliasStart = other.aliasStart;
    this.aliasPrefix = other.aliasPrefix;
    this.parent = other;
    this.severity = other.severity;
    this.requestName = other.requestName;
    this.request = other.request;
    this.response = other.response;
    this.roundTripTime = other.roundTripTime;
    this.failed = other.failed;
  }

  /**
   * Returns a copy of this chain that has this chain as its parent. The copy starts with the same
   * context, severity and failure state, but with no entered segments and no failure callback.
   * Later changes to either chain don't affect the other, except that a failure of the copy marks
   * this chain as having a {@link #treeFailed() failed descendant}.
   */
  @Override
  public Chain clone() {
    return new Chain(this);
  }

  /** Pushes the given segment to the assertion path. Must be paired with {@link #leave()}. */
  public void enter(String label) {
    requireNonNull(label);
    path.add(label);
    depth++;
  }

  /** Pushes a formatted segment to the assertion path. Must be paired with {@link #leave()}. */
  @FormatMethod
  public void enter(@FormatString String format, @Nullable Object... args) {
    enter(String.format(format, args));
  }

  /**
   * Reports a success to the handler unless this chain or one of its descendants has failed, then
   * pops the segment pushed by the matching {@link #enter(String)}.
   *
   * @throws IllegalStateException if there's no matching {@code enter}
   */
  public void leave() {
    requireState(depth > 0, "unpaired enter/leave");
    try {
      if (!treeFailed()) {
        handler.success(context());
      }
    } finally {
      path.remove(path.size() - 1);
      depth--;
    }
  }

  /**
   * Replaces the segment pushed by the current {@link #enter(String)}.
   *
   * @throws IllegalStateException if not called between {@code enter} and {@code leave}
   */
  public void replace(String label) {
    requireNonNull(label);
    requireState(depth > 0, "replace() is only allowed between enter() and leave()");
    path.set(path.size() - 1, label);
  }

  /**
   * Marks this chain as failed and reports the failure to the handler, stamped with this chain's
   * severity. Has no effect if the chain has already failed. The failure callback, if any, runs
   * after the handler even if the handler throws.
   *
   * @throws IllegalStateException if failure validation is enabled and the failure is ill-formed
   */
  public void fail(AssertionFailure failure) {
    requireNonNull(failure);
    if (validateFailures) {
      requireState(depth > 0, "fail() is only allowed between enter() and leave()");
      var problem = FailureValidator.validate(failure);
      if (problem.isPresent()) {
        throw new IllegalStateException("ill-formed failure: " + problem.get());
      }
    }

    if (failed) {
      return;
    }
    failed = true;
    for (var ancestor = parent; ancestor != null; ancestor = ancestor.parent) {
      ancestor.descendantFailed = true;
    }

    var callback = failureCallback;
    try {
      handler.failure(context(), failure.withSeverity(severity));
    } finally {
      if (callback != null) {
        callback.run();
      }
    }
  }

  /** Returns whether {@link #fail(AssertionFailure)} was called on this chain. */
  public boolean failed() {
    return failed;
  }

  /** Returns whether this chain or any chain cloned from it, directly or not, has failed. */
  public boolean treeFailed() {
    return failed || descendantFailed;
  }

  /** Clears the failure state of this chain. Only meant to be used by test harnesses. */
  public void reset() {
    failed = false;
    descendantFailed = false;
  }

  /** Makes the aliased path start at the given name, followed by segments entered later. */
  public void setAlias(String name) {
    requireNonNull(name);
    aliasPrefix = name.isEmpty() ? List.of() : List.of(name);
    aliasStart = path.size() - depth;
  }

  /** Sets the severity stamped on failures reported from now on, inherited by later clones. */
  public void setSeverity(AssertionSeverity severity) {
    this.severity = requireNonNull(severity);
  }

  public AssertionSeverity severity() {
    return severity;
  }

  public void setRequestName(String requestName) {
    this.requestName = requireNonNull(requestName);
  }

  public void setRequest(HttpRequest request) {
    this.request = requireNonNull(request);
  }

  public void setResponse(HttpResponse<?> response) {
    this.response = requireNonNull(response);
  }

  public void setRoundTripTime(Duration roundTripTime) {
    this.roundTripTime = requireNonNull(roundTripTime);
  }

  /** Detaches this chain from its parent, so its failures are no longer seen by ancestors. */
  public void setRoot() {
    parent = null;
  }

  /** Sets a callback that runs when this chain fails. Replaces any previously set callback. */
  public void onFailure(Runnable callback) {
    this.failureCallback = requireNonNull(callback);
  }

  /** Returns a snapshot of this chain's current context. */
  public AssertionContext context() {
    var aliasedPath = new ArrayList<>(aliasPrefix);
    aliasedPath.addAll(path.subList(aliasStart, path.size()));
    return new AssertionContext(
        testName, requestName, path, aliasedPath, request, response, roundTripTime);
  }

  @Override
  public String toString() {
    return Utils.toStringIdentityPrefix(this)
        + "[path="
        + path
        + ", failed="
        + failed
        + ", severity="
        + severity
        + "]";
  }

  /** Returns a new root chain reporting to the given handler. */
  public static Chain newRoot(String name, AssertionHandler handler) {
    return newRoot(name, "", handler, Boolean.getBoolean(VALIDATE_FAILURES_PROPERTY));
  }

  static Chain newRoot(
      String name, String testName, AssertionHandler handler, boolean validateFailures) {
    return new Chain(requireNonNull(name), testName, handler, validateFailures);
  }
}
