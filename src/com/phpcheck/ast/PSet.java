/*
 * Copyright 2026 The Phpcheck Authors.
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */

package com.phpcheck.ast;

/** A minimal interface for null-hostile, persistent immutable sets. */
public interface PSet<E> extends Iterable<E> {

  /** Returns whether this set is empty. */
  boolean isEmpty();

  /** Returns the number of elements in this set. */
  int size();

  /** Returns whether the given element is present. */
  boolean contains(E element);

  /**
   * Returns a new set with the given element added. If the element is already present, then this
   * same set will be returned.
   */
  PSet<E> plus(E element);

  /**
   * Returns a new set with the given element removed. If the element was not present in the first
   * place, then this same set will be returned.
   */
  PSet<E> minus(E element);

  /**
   * Returns the elements present in both {@code this} and {@code that}. When the result equals
   * either input, that input is returned. Note that {@code that} set must be the same
   * implementation.
   */
  PSet<E> retainAll(PSet<E> that);
}
