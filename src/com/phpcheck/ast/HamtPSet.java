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

import static com.google.common.base.Preconditions.checkNotNull;

import com.google.common.annotations.VisibleForTesting;
import java.util.ArrayDeque;
import java.util.Arrays;
import java.util.Collections;
import java.util.Deque;
import java.util.Iterator;
import java.util.NoSuchElementException;
import org.jspecify.annotations.Nullable;

/**
 * An immutable set with efficient (persistent) updates.
 *
 * <p>Uses a hash array mapped trie: http://en.wikipedia.org/wiki/Hash_array_mapped_trie.
 *
 * <p>Each node stores one element (with its hash), a mask, and children. We maintain an invariant
 * that the element with the smallest hash is always at the root of each subtree, so two sets built
 * from a common ancestor share most of their structure, and {@link #retainAll} can skip any
 * subtree that is the identical object on both sides. The EMPTY set is special-cased away as soon
 * as possible, using 'null' instead for all the internal logic.
 */
public final class HamtPSet<E> implements PSet<E> {

  /** Number of bits of fan-out at each level. */
  private static final int BITS = 4;

  /** Number of bits to shift off to get the most significant BITS number of bits. */
  private static final int BITS_SHIFT = 32 - BITS;

  /** Non-null element (exception: the empty set and intermediate vacated roots). */
  private final @Nullable E key;

  /** Hash of the element, left-shifted by BITS*depth. */
  private final int hash;

  /** Bit mask indicating the children that are present (bitCount(mask) == children.length). */
  private final int mask;

  /** Non-null array of children. Elements are never reassigned. */
  private final HamtPSet<E>[] children;

  private static final HamtPSet<?>[] EMPTY_CHILDREN = new HamtPSet<?>[0];
  private static final HamtPSet<?> EMPTY = new HamtPSet<>(null, 0, 0, emptyChildren());

  private HamtPSet(@Nullable E key, int hash, int mask, HamtPSet<E>[] children) {
    this.key = key;
    this.hash = hash;
    this.mask = mask;
    this.children = children;
  }

  /** Returns an empty set. */
  @SuppressWarnings("unchecked") // Empty immutable collection is safe to cast.
  public static <E> HamtPSet<E> empty() {
    return (HamtPSet<E>) EMPTY;
  }

  /** Returns a set holding the given elements. */
  public static <E> HamtPSet<E> of(Iterable<? extends E> elements) {
    HamtPSet<E> result = empty();
    for (E element : elements) {
      result = result.plus(element);
    }
    return result;
  }

  @SuppressWarnings("unchecked") // Empty array is safe to cast.
  private static <E> HamtPSet<E>[] emptyChildren() {
    return (HamtPSet<E>[]) EMPTY_CHILDREN;
  }

  @Override
  public boolean isEmpty() {
    return key == null;
  }

  @Override
  public int size() {
    if (isEmpty()) {
      return 0;
    }
    int size = 1;
    for (HamtPSet<E> child : children) {
      size += child.size();
    }
    return size;
  }

  @Override
  public boolean contains(E element) {
    return !isEmpty() && contains(element, hash(element));
  }

  private boolean contains(E element, int hash) {
    if (hash == this.hash && element.equals(this.key)) {
      return true;
    }
    int bucketMask = 1 << bucket(hash);
    return (mask & bucketMask) != 0 && children[index(bucketMask)].contains(element, shift(hash));
  }

  @Override
  public HamtPSet<E> plus(E element) {
    checkNotNull(element);
    return !isEmpty()
        ? plus(element, hash(element))
        : new HamtPSet<>(element, hash(element), 0, emptyChildren());
  }

  private HamtPSet<E> plus(E element, int hash) {
    if (hash == this.hash && element.equals(this.key)) {
      return this;
    }
    if (compareUnsigned(hash, this.hash) < 0) {
      return replaceRoot(element, hash);
    }
    int bucket = bucket(hash);
    hash = shift(hash);
    int bucketMask = 1 << bucket;
    int index = index(bucketMask);
    if ((mask & bucketMask) != 0) {
      HamtPSet<E> child = children[index];
      HamtPSet<E> newChild = child.plus(element, hash);
      return child == newChild ? this : withChildren(mask, replaceChild(children, index, newChild));
    }
    HamtPSet<E> newChild = new HamtPSet<>(element, hash, 0, emptyChildren());
    return withChildren(mask | bucketMask, insertChild(children, index, newChild));
  }

  /** Puts a new element with a smaller hash at the root, pushing the current root down. */
  private HamtPSet<E> replaceRoot(E element, int hash) {
    HamtPSet<E> vacated = vacateRoot();
    return new HamtPSet<>(element, hash, vacated.mask, vacated.children);
  }

  @Override
  public HamtPSet<E> minus(E element) {
    return !isEmpty() ? minus(element, hash(element)) : this;
  }

  private HamtPSet<E> minus(E element, int hash) {
    if (hash == this.hash && element.equals(this.key)) {
      HamtPSet<E> result = deleteRoot(mask, children);
      return result != null ? result : empty();
    }
    int bucketMask = 1 << bucket(hash);
    if ((mask & bucketMask) == 0) {
      return this;
    }
    int index = index(bucketMask);
    HamtPSet<E> child = children[index];
    HamtPSet<E> newChild = child.minus(element, shift(hash));
    if (newChild == child) {
      return this;
    } else if (newChild.isEmpty()) {
      return withChildren(mask & ~bucketMask, deleteChild(children, index));
    } else {
      return withChildren(mask, replaceChild(children, index, newChild));
    }
  }

  @Override
  public HamtPSet<E> retainAll(PSet<E> that) {
    HamtPSet<E> result =
        intersect(!this.isEmpty() ? this : null, !that.isEmpty() ? (HamtPSet<E>) that : null);
    return result != null ? result : empty();
  }

  /** Internal recursive implementation of retainAll, factoring out empties. */
  private static <E> @Nullable HamtPSet<E> intersect(
      @Nullable HamtPSet<E> t1, @Nullable HamtPSet<E> t2) {
    if (t1 == t2) {
      return t1;
    } else if (t1 == null || t2 == null) {
      return null;
    }

    boolean keepRoot = t1.hash == t2.hash && t1.key.equals(t2.key);
    boolean sameChildrenAs1 = keepRoot;
    boolean sameChildrenAs2 = keepRoot;
    E key = t1.key;
    int hash = t1.hash;
    if (!keepRoot) {
      // Different roots: push both down so every element is found by bucket.
      t1 = t1.vacateRoot();
      t2 = t2.vacateRoot();
    }

    int newMask = t1.mask & t2.mask;
    sameChildrenAs1 &= newMask == t1.mask;
    sameChildrenAs2 &= newMask == t2.mask;

    @SuppressWarnings("unchecked") // only used internally.
    HamtPSet<E>[] newChildren = (HamtPSet<E>[]) new HamtPSet<?>[Integer.bitCount(newMask)];
    int remaining = newMask;
    int index = 0;
    while (remaining != 0) {
      int childBit = Integer.lowestOneBit(remaining);
      remaining &= ~childBit;
      HamtPSet<E> child1 = t1.getChild(childBit);
      HamtPSet<E> child2 = t2.getChild(childBit);
      HamtPSet<E> newChild = intersect(child1, child2);
      sameChildrenAs1 &= newChild == child1;
      sameChildrenAs2 &= newChild == child2;
      if (newChild != null) {
        newChildren[index++] = newChild;
      } else {
        newMask &= ~childBit;
      }
    }
    if (index < newChildren.length) {
      newChildren = index > 0 ? Arrays.copyOf(newChildren, index) : emptyChildren();
    }

    if (!keepRoot) {
      return deleteRoot(newMask, newChildren);
    } else if (sameChildrenAs1) {
      return t1;
    } else if (sameChildrenAs2) {
      return t2;
    }
    return new HamtPSet<>(key, hash, newMask, newChildren);
  }

  @Override
  public Iterator<E> iterator() {
    if (isEmpty()) {
      return Collections.emptyIterator();
    }
    return new Iter<>(this);
  }

  @Override
  public boolean equals(Object other) {
    if (this == other) {
      return true;
    }
    if (!(other instanceof HamtPSet)) {
      return false;
    }
    @SuppressWarnings("unchecked") // contains() only calls equals() on the element.
    HamtPSet<E> that = (HamtPSet<E>) other;
    if (size() != that.size()) {
      return false;
    }
    for (E element : this) {
      if (!that.contains(element)) {
        return false;
      }
    }
    return true;
  }

  @Override
  public int hashCode() {
    int result = 0;
    for (E element : this) {
      result += element.hashCode();
    }
    return result;
  }

  @Override
  public String toString() {
    StringBuilder sb = new StringBuilder().append('[');
    for (E element : this) {
      if (sb.length() > 1) {
        sb.append(", ");
      }
      sb.append(element);
    }
    return sb.append(']').toString();
  }

  /**
   * Returns the index into the 'children' array for the given bit, which must have exactly one bit
   * set in its binary representation (i.e. must be a power of two).
   */
  private int index(int bit) {
    return Integer.bitCount(mask & (bit - 1));
  }

  /** Returns the child for the given bit, or null if there is no child for that bit. */
  private @Nullable HamtPSet<E> getChild(int bit) {
    return (mask & bit) != 0 ? children[index(bit)] : null;
  }

  /**
   * Perform the hash operation. Bits are reversed since short strings have hash codes that only
   * vary in the least significant bits, but the most significant bits are used for bucketing.
   */
  private static int hash(Object element) {
    return Integer.reverse(element.hashCode());
  }

  /** Return the current bucket index from the hash. */
  private static int bucket(int hash) {
    return hash >>> BITS_SHIFT;
  }

  /** Return a new hash with the next bucket number shifted off. */
  private static int shift(int hash) {
    return hash << BITS;
  }

  /** Unshift the bucket number back onto a hash. */
  private static int unshift(int hash, int bucket) {
    return (hash >>> BITS) | (bucket << BITS_SHIFT);
  }

  private static int compareUnsigned(int left, int right) {
    return Integer.compareUnsigned(left, right);
  }

  /** Moves the root element into the appropriate child, leaving a null root. */
  private HamtPSet<E> vacateRoot() {
    int bucketMask = 1 << bucket(this.hash);
    int index = index(bucketMask);
    if ((mask & bucketMask) != 0) {
      HamtPSet<E> newChild = children[index].plus(this.key, shift(this.hash));
      return new HamtPSet<>(null, 0, mask, replaceChild(children, index, newChild));
    }
    HamtPSet<E> newChild = new HamtPSet<>(this.key, shift(this.hash), 0, emptyChildren());
    return new HamtPSet<>(null, 0, mask | bucketMask, insertChild(children, index, newChild));
  }

  /** Returns a copy of this node with a different array of children. */
  private HamtPSet<E> withChildren(int mask, HamtPSet<E>[] children) {
    return mask == this.mask && children == this.children
        ? this
        : new HamtPSet<>(key, hash, mask, children);
  }

  /**
   * Returns a new set with the elements from children. One element is removed from the first child
   * and promoted to the root. If there are no children, returns null.
   */
  private static <E> @Nullable HamtPSet<E> deleteRoot(int mask, HamtPSet<E>[] children) {
    if (mask == 0) {
      return null;
    }
    HamtPSet<E> child = children[0];
    int hashBits = Integer.numberOfTrailingZeros(mask);
    int newHash = unshift(child.hash, hashBits);
    HamtPSet<E> newChild = deleteRoot(child.mask, child.children);
    if (newChild == null) {
      int newMask = mask & ~Integer.lowestOneBit(mask);
      return new HamtPSet<>(child.key, newHash, newMask, deleteChild(children, 0));
    }
    return new HamtPSet<>(child.key, newHash, mask, replaceChild(children, 0, newChild));
  }

  private static <E> HamtPSet<E>[] insertChild(
      HamtPSet<E>[] children, int index, HamtPSet<E> child) {
    @SuppressWarnings("unchecked") // only used internally.
    HamtPSet<E>[] newChildren = (HamtPSet<E>[]) new HamtPSet<?>[children.length + 1];
    newChildren[index] = child;
    System.arraycopy(children, 0, newChildren, 0, index);
    System.arraycopy(children, index, newChildren, index + 1, children.length - index);
    return newChildren;
  }

  private static <E> HamtPSet<E>[] replaceChild(
      HamtPSet<E>[] children, int index, HamtPSet<E> child) {
    HamtPSet<E>[] newChildren = Arrays.copyOf(children, children.length);
    newChildren[index] = child;
    return newChildren;
  }

  private static <E> HamtPSet<E>[] deleteChild(HamtPSet<E>[] children, int index) {
    if (children.length == 1) {
      return emptyChildren();
    }
    @SuppressWarnings("unchecked") // only used internally.
    HamtPSet<E>[] newChildren = (HamtPSet<E>[]) new HamtPSet<?>[children.length - 1];
    System.arraycopy(children, 0, newChildren, 0, index);
    System.arraycopy(children, index + 1, newChildren, index, children.length - index - 1);
    return newChildren;
  }

  /** Iterates sequentially over a tree. */
  private static final class Iter<E> implements Iterator<E> {
    final Deque<HamtPSet<E>> queue = new ArrayDeque<>();

    Iter(HamtPSet<E> set) {
      queue.add(set);
    }

    @Override
    public boolean hasNext() {
      return !queue.isEmpty();
    }

    @Override
    public E next() {
      if (queue.isEmpty()) {
        throw new NoSuchElementException();
      }
      HamtPSet<E> top = queue.removeFirst();
      for (int i = top.children.length - 1; i >= 0; i--) {
        queue.add(top.children[i]);
      }
      return top.key;
    }
  }

  /** Throws an assertion error if the set invariant is violated. */
  @VisibleForTesting
  HamtPSet<E> assertCorrectStructure() {
    if (isEmpty()) {
      return this;
    }
    for (HamtPSet<E> child : children) {
      if (compareUnsigned(unshiftedChildHash(child), hash) < 0) {
        throw new AssertionError(
            "Invalid set has decreasing hash " + child.key + " beneath " + key + ": " + this);
      }
      child.assertCorrectStructure();
    }
    if (Integer.bitCount(mask) != children.length) {
      throw new AssertionError("Mask does not match children of " + key + ": " + this);
    }
    return this;
  }

  private int unshiftedChildHash(HamtPSet<E> child) {
    for (int bucket = 0; bucket < (1 << BITS); bucket++) {
      if (getChild(1 << bucket) == child) {
        return unshift(child.hash, bucket);
      }
    }
    throw new AssertionError("Child " + child.key + " not found under " + key);
  }
}
