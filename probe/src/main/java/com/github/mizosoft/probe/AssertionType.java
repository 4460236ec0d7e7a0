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

/**
 * The kind of check an {@link AssertionFailure} reports. The meaning of a failure's {@code
 * actual}, {@code expected}, {@code reference} and {@code delta} values depends on its type.
 */
public enum AssertionType {
  /** The library was used incorrectly (e.g. an argument is out of place). */
  USAGE,

  /** An operation, such as sending a request, failed. */
  OPERATION,

  /** {@code actual} has an appropriate type. */
  TYPE,
  NOT_TYPE,

  /** {@code actual} is a valid value, e.g. a valid argument. */
  VALID,
  NOT_VALID,

  /** {@code actual} is null. */
  NIL,
  NOT_NIL,

  /** {@code actual} is empty. */
  EMPTY,
  NOT_EMPTY,

  /**
   * {@code actual} equals {@code expected}. If {@code delta} is present, it specifies the allowed
   * difference between the two.
   */
  EQUAL,
  NOT_EQUAL,

  /** {@code actual < expected}. */
  LT,
  /** {@code actual <= expected}. */
  LE,
  /** {@code actual > expected}. */
  GT,
  /** {@code actual >= expected}. */
  GE,

  /** {@code actual} belongs to the inclusive {@link AssertionRange} held by {@code expected}. */
  IN_RANGE,
  NOT_IN_RANGE,

  /** {@code actual} matches the JSON schema held by {@code expected}. */
  MATCH_SCHEMA,
  NOT_MATCH_SCHEMA,

  /** {@code actual} matches the JSON path held by {@code expected}. */
  MATCH_PATH,
  NOT_MATCH_PATH,

  /** {@code actual} matches the regular expression held by {@code expected}. */
  MATCH_REGEXP,
  NOT_MATCH_REGEXP,

  /** {@code actual} matches the format, or list of formats, in {@code expected}. */
  MATCH_FORMAT,
  NOT_MATCH_FORMAT,

  /** {@code actual} contains the key {@code expected}. */
  CONTAINS_KEY,
  NOT_CONTAINS_KEY,

  /** {@code actual} contains the element {@code expected}. */
  CONTAINS_ELEMENT,
  NOT_CONTAINS_ELEMENT,

  /** {@code actual} contains the subset {@code expected}. */
  CONTAINS_SUBSET,
  NOT_CONTAINS_SUBSET,

  /** {@code actual} belongs to the {@link AssertionList} held by {@code expected}. */
  BELONGS,
  NOT_BELONGS
}
