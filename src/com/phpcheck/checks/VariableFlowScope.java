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

package com.phpcheck.checks;

import static com.google.common.base.Preconditions.checkArgument;
import static com.google.common.base.Preconditions.checkState;

import com.google.common.base.MoreObjects;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableSet;
import com.google.common.collect.Iterables;
import com.phpcheck.ast.HamtPSet;
import com.phpcheck.ast.PSet;
import java.util.Objects;
import org.jspecify.annotations.Nullable;

/**
 * The state of one program point in a body: which variables are definitely assigned on every path
 * reaching it. Scopes are immutable; every transition returns a new scope sharing structure with
 * the old one.
 *
 * <p>A scope is either reachable, with a set of bound names, or unreachable. Unreachable scopes
 * are the identity of {@link #join}: a path that cannot complete contributes nothing.
 */
final class VariableFlowScope {

  /** Null when the program point cannot be reached. */
  private final @Nullable PSet<String> bound;

  /** Every name assigned anywhere in the body, including parameters and closure uses. */
  private final ImmutableSet<String> universe;

  private final boolean thisAvailable;
  private final boolean cliArgumentsAvailable;
  private final boolean responseHeaderAvailable;

  private VariableFlowScope(
      @Nullable PSet<String> bound,
      ImmutableSet<String> universe,
      boolean thisAvailable,
      boolean cliArgumentsAvailable,
      boolean responseHeaderAvailable) {
    this.bound = bound;
    this.universe = universe;
    this.thisAvailable = thisAvailable;
    this.cliArgumentsAvailable = cliArgumentsAvailable;
    this.responseHeaderAvailable = responseHeaderAvailable;
  }

  /**
   * Creates the scope at the start of a body.
   *
   * @param universe all names assigned anywhere in the body
   * @param initiallyBound parameters and closure uses; must be part of the universe
   */
  static VariableFlowScope createEntryScope(
      ImmutableSet<String> universe,
      Iterable<String> initiallyBound,
      boolean thisAvailable,
      boolean cliArgumentsAvailable) {
    VariableFlowScope scope =
        new VariableFlowScope(
            HamtPSet.empty(), universe, thisAvailable, cliArgumentsAvailable, false);
    for (String name : initiallyBound) {
      scope = scope.bind(name);
    }
    return scope;
  }

  boolean isReachable() {
    return bound != null;
  }

  /** Whether the name is definitely assigned here. Always false for unreachable scopes. */
  boolean isBound(String name) {
    return bound != null && bound.contains(name);
  }

  /** Whether the name is assigned anywhere in the body, on any path. */
  boolean isAssignedAnywhere(String name) {
    return universe.contains(name);
  }

  boolean isThisAvailable() {
    return thisAvailable;
  }

  boolean isCliArgumentsAvailable() {
    return cliArgumentsAvailable;
  }

  boolean isResponseHeaderAvailable() {
    return responseHeaderAvailable;
  }

  /** Returns the definitely assigned names, or the empty set when unreachable. */
  ImmutableSet<String> getBoundNames() {
    return bound == null ? ImmutableSet.of() : ImmutableSet.copyOf(bound);
  }

  /**
   * Returns this scope with the name definitely assigned. Implicit variables are never bound, and
   * binding in an unreachable scope is a no-op.
   */
  VariableFlowScope bind(String name) {
    if (bound == null || ImplicitVar.isImplicit(name)) {
      return this;
    }
    checkState(universe.contains(name), "binding %s, which was never collected", name);
    PSet<String> newBound = bound.plus(name);
    return newBound == bound ? this : withBound(newBound);
  }

  /** Returns this scope with the name no longer assigned, as after {@code unset}. */
  VariableFlowScope unbind(String name) {
    if (bound == null) {
      return this;
    }
    PSet<String> newBound = bound.minus(name);
    return newBound == bound ? this : withBound(newBound);
  }

  VariableFlowScope withResponseHeaderAvailable() {
    if (bound == null || responseHeaderAvailable) {
      return this;
    }
    return new VariableFlowScope(bound, universe, thisAvailable, cliArgumentsAvailable, true);
  }

  VariableFlowScope withoutThis() {
    if (!thisAvailable) {
      return this;
    }
    return new VariableFlowScope(
        bound, universe, false, cliArgumentsAvailable, responseHeaderAvailable);
  }

  /** Returns the unreachable scope for the same body. */
  VariableFlowScope unreachable() {
    if (bound == null) {
      return this;
    }
    return new VariableFlowScope(null, universe, thisAvailable, cliArgumentsAvailable, false);
  }

  private VariableFlowScope withBound(PSet<String> newBound) {
    return new VariableFlowScope(
        newBound, universe, thisAvailable, cliArgumentsAvailable, responseHeaderAvailable);
  }

  static VariableFlowScope join(VariableFlowScope first, VariableFlowScope second) {
    return join(ImmutableList.of(first, second));
  }

  /**
   * Merges the scopes of paths meeting at one program point. A name is bound in the result iff it
   * is bound in every reachable input; the result is unreachable iff every input is.
   */
  static VariableFlowScope join(Iterable<VariableFlowScope> scopes) {
    checkArgument(!Iterables.isEmpty(scopes), "nothing to join");
    VariableFlowScope template = Iterables.getFirst(scopes, null);
    VariableFlowScope result = null;
    for (VariableFlowScope scope : scopes) {
      checkState(
          scope.universe.equals(template.universe), "joining scopes of different bodies");
      if (!scope.isReachable()) {
        continue;
      }
      if (result == null) {
        result = scope;
      } else if (result != scope) {
        PSet<String> joinedBound = result.bound.retainAll(scope.bound);
        boolean header = result.responseHeaderAvailable && scope.responseHeaderAvailable;
        result =
            joinedBound == result.bound && header == result.responseHeaderAvailable
                ? result
                : new VariableFlowScope(
                    joinedBound,
                    result.universe,
                    result.thisAvailable,
                    result.cliArgumentsAvailable,
                    header);
      }
    }
    return result != null ? result : template.unreachable();
  }

  @Override
  public boolean equals(Object other) {
    if (!(other instanceof VariableFlowScope)) {
      return false;
    }
    VariableFlowScope that = (VariableFlowScope) other;
    return Objects.equals(this.bound, that.bound)
        && this.universe.equals(that.universe)
        && this.thisAvailable == that.thisAvailable
        && this.cliArgumentsAvailable == that.cliArgumentsAvailable
        && this.responseHeaderAvailable == that.responseHeaderAvailable;
  }

  @Override
  public int hashCode() {
    return Objects.hash(bound, universe, thisAvailable, responseHeaderAvailable);
  }

  @Override
  public String toString() {
    if (bound == null) {
      return "VariableFlowScope{unreachable}";
    }
    return MoreObjects.toStringHelper(this)
        .add("bound", bound)
        .add("universe", universe)
        .add("this", thisAvailable)
        .add("cli", cliArgumentsAvailable)
        .add("responseHeader", responseHeaderAvailable)
        .toString();
  }
}
