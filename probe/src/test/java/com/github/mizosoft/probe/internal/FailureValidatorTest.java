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

import static org.assertj.core.api.Assertions.assertThat;

import com.github.mizosoft.probe.AssertionFailure;
import com.github.mizosoft.probe.AssertionList;
import com.github.mizosoft.probe.AssertionRange;
import com.github.mizosoft.probe.AssertionType;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.EnumSource;

class FailureValidatorTest {
  @ParameterizedTest
  @EnumSource(
      value = AssertionType.class,
      names = {"USAGE", "OPERATION"})
  void errorOnlyTypes(AssertionType type) {
    assertThat(FailureValidator.validate(AssertionFailure.newBuilder(type).error("e").build()))
        .isEmpty();
    assertThat(
            FailureValidator.validate(
                AssertionFailure.newBuilder(type).actual(1).error("e").build()))
        .hasValueSatisfying(problem -> assertThat(problem).contains("actual"));
    assertThat(
            FailureValidator.validate(
                AssertionFailure.newBuilder(type).expected(1).error("e").build()))
        .hasValueSatisfying(problem -> assertThat(problem).contains("expected"));
  }

  @ParameterizedTest
  @EnumSource(
      value = AssertionType.class,
      names = {"TYPE", "VALID", "NIL", "NOT_EMPTY"})
  void actualOnlyTypes(AssertionType type) {
    assertThat(
            FailureValidator.validate(
                AssertionFailure.newBuilder(type).actual(1).error("e").build()))
        .isEmpty();
    assertThat(FailureValidator.validate(AssertionFailure.newBuilder(type).error("e").build()))
        .isPresent();
    assertThat(
            FailureValidator.validate(
                AssertionFailure.newBuilder(type).actual(1).expected(2).error("e").build()))
        .isPresent();
  }

  @ParameterizedTest
  @EnumSource(
      value = AssertionType.class,
      names = {"EQUAL", "NOT_EQUAL", "LT", "GE", "MATCH_REGEXP", "NOT_MATCH_FORMAT"})
  void comparisonTypes(AssertionType type) {
    assertThat(
            FailureValidator.validate(
                AssertionFailure.newBuilder(type).actual(1).expected(2).error("e").build()))
        .isEmpty();
    assertThat(
            FailureValidator.validate(
                AssertionFailure.newBuilder(type).actual(1).error("e").build()))
        .isPresent();
    assertThat(
            FailureValidator.validate(
                AssertionFailure.newBuilder(type).expected(2).error("e").build()))
        .isPresent();
  }

  @Test
  void rangeTypesRequireRange() {
    assertThat(
            FailureValidator.validate(
                AssertionFailure.newBuilder(AssertionType.IN_RANGE)
                    .actual(7)
                    .expected(AssertionRange.of(1, 5))
                    .error("e")
                    .build()))
        .isEmpty();
    assertThat(
            FailureValidator.validate(
                AssertionFailure.newBuilder(AssertionType.NOT_IN_RANGE)
                    .actual(3)
                    .expected(5)
                    .error("e")
                    .build()))
        .isPresent();
  }

  @Test
  void listTypesRequireList() {
    assertThat(
            FailureValidator.validate(
                AssertionFailure.newBuilder(AssertionType.BELONGS)
                    .actual(404)
                    .expected(AssertionList.of(200, 201))
                    .error("e")
                    .build()))
        .isEmpty();
    assertThat(
            FailureValidator.validate(
                AssertionFailure.newBuilder(AssertionType.NOT_BELONGS)
                    .actual(404)
                    .expected(200)
                    .error("e")
                    .build()))
        .isPresent();
  }

  @Test
  void containsTypesHaveOptionalExpected() {
    assertThat(
            FailureValidator.validate(
                AssertionFailure.newBuilder(AssertionType.CONTAINS_KEY)
                    .actual("{}")
                    .error("e")
                    .build()))
        .isEmpty();
    assertThat(
            FailureValidator.validate(
                AssertionFailure.newBuilder(AssertionType.CONTAINS_ELEMENT)
                    .actual("[]")
                    .expected(1)
                    .error("e")
                    .build()))
        .isEmpty();
    assertThat(
            FailureValidator.validate(
                AssertionFailure.newBuilder(AssertionType.NOT_CONTAINS_SUBSET)
                    .expected(1)
                    .error("e")
                    .build()))
        .isPresent();
  }

  @Test
  void everyTypeIsCovered() {
    for (var type : AssertionType.values()) {
      // Must not throw for any type.
      FailureValidator.validate(AssertionFailure.newBuilder(type).error("e").build());
    }
  }
}
