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

package com.github.mizosoft.probe.internal;

import com.github.mizosoft.probe.AssertionFailure;
import com.github.mizosoft.probe.AssertionList;
import com.github.mizosoft.probe.AssertionRange;
import com.github.mizosoft.probe.AssertionValue;
import java.util.Optional;

/** Checks that an {@code AssertionFailure} carries the values its type calls for. */
public class FailureValidator {
  private FailureValidator() {}

  /** Returns a description of what's wrong with the given failure, if anything. */
  public static Optional<String> validate(AssertionFailure failure) {
    switch (failure.type()) {
      case USAGE:
      case OPERATION:
        return validateFields(failure, Field.DENIED, Field.DENIED);

      case TYPE:
      case NOT_TYPE:
      case VALID:
      case NOT_VALID:
      case NIL:
      case NOT_NIL:
      case EMPTY:
      case NOT_EMPTY:
        return validateFields(failure, Field.REQUIRED, Field.DENIED);

      case EQUAL:
      case NOT_EQUAL:
      case LT:
      case LE:
      case GT:
      case GE:
      case MATCH_SCHEMA:
      case NOT_MATCH_SCHEMA:
      case MATCH_PATH:
      case NOT_MATCH_PATH:
      case MATCH_REGEXP:
      case NOT_MATCH_REGEXP:
      case MATCH_FORMAT:
      case NOT_MATCH_FORMAT:
        return validateFields(failure, Field.REQUIRED, Field.REQUIRED);

      case IN_RANGE:
      case NOT_IN_RANGE:
        return validateFields(failure, Field.REQUIRED, Field.REQUIRED)
            .or(() -> validateExpectedType(failure, AssertionRange.class));

      case CONTAINS_KEY:
      case NOT_CONTAINS_KEY:
      case CONTAINS_ELEMENT:
      case NOT_CONTAINS_ELEMENT:
      case CONTAINS_SUBSET:
      case NOT_CONTAINS_SUBSET:
        return validateFields(failure, Field.REQUIRED, Field.OPTIONAL);

      case BELONGS:
      case NOT_BELONGS:
        return validateFields(failure, Field.REQUIRED, Field.REQUIRED)
            .or(() -> validateExpectedType(failure, AssertionList.class));

      default:
        return Optional.of("unknown assertion type: " + failure.type());
    }
  }

  private static Optional<String> validateFields(
      AssertionFailure failure, Field actual, Field expected) {
    return validateField(failure, "actual", failure.actual(), actual)
        .or(() -> validateField(failure, "expected", failure.expected(), expected));
  }

  @SuppressWarnings("OptionalUsedAsFieldOrParameterType")
  private static Optional<String> validateField(
      AssertionFailure failure, String name, Optional<AssertionValue> value, Field field) {
    switch (field) {
      case REQUIRED:
        return value.isEmpty()
            ? Optional.of("failure of type " + failure.type() + " should have " + name + " value")
            : Optional.empty();

      case DENIED:
        return value.isPresent()
            ? Optional.of("failure of type " + failure.type() + " can't have " + name + " value")
            : Optional.empty();

      default:
        return Optional.empty();
    }
  }

  private static Optional<String> validateExpectedType(
      AssertionFailure failure, Class<?> expectedType) {
    return failure
        .expected()
        .filter(value -> !expectedType.isInstance(value.value()))
        .map(
            value ->
                "expected value of failure of type "
                    + failure.type()
                    + " should be an "
                    + expectedType.getSimpleName());
  }

  private enum Field {
    REQUIRED,
    DENIED,
    OPTIONAL
  }
}
