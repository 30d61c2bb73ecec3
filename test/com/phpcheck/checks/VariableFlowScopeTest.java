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

import static com.google.common.truth.Truth.assertThat;
import static com.google.common.truth.Truth.assertWithMessage;
import static org.junit.Assert.assertThrows;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableSet;
import org.junit.Before;
import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;

/** Tests for {@link VariableFlowScope}. */
@RunWith(JUnit4.class)
public final class VariableFlowScopeTest {

  private static final ImmutableSet<String> UNIVERSE = ImmutableSet.of("a", "b", "c", "p");

  private VariableFlowScope entry;

  @Before
  public void setUp() {
    entry = VariableFlowScope.createEntryScope(UNIVERSE, ImmutableList.of("p"), false, false);
  }

  @Test
  public void testEntryScope() {
    assertThat(entry.isReachable()).isTrue();
    assertThat(entry.getBoundNames()).containsExactly("p");
    assertThat(entry.isAssignedAnywhere("a")).isTrue();
    assertThat(entry.isAssignedAnywhere("z")).isFalse();
    assertThat(entry.isThisAvailable()).isFalse();
    assertThat(entry.isResponseHeaderAvailable()).isFalse();
  }

  @Test
  public void testBindIsPersistent() {
    VariableFlowScope withA = entry.bind("a");
    assertThat(withA.isBound("a")).isTrue();
    assertThat(entry.isBound("a")).isFalse();
    assertThat(withA.bind("a")).isSameInstanceAs(withA);
  }

  @Test
  public void testBindOutsideUniverseFails() {
    assertThrows(IllegalStateException.class, () -> entry.bind("z"));
  }

  @Test
  public void testImplicitNamesAreNeverBound() {
    assertThat(entry.bind("this")).isSameInstanceAs(entry);
    assertThat(entry.bind("_GET").isBound("_GET")).isFalse();
  }

  @Test
  public void testUnbindKeepsUniverse() {
    VariableFlowScope scope = entry.bind("a").unbind("a");
    assertThat(scope.isBound("a")).isFalse();
    assertThat(scope.isAssignedAnywhere("a")).isTrue();
    assertThat(entry.unbind("b")).isSameInstanceAs(entry);
  }

  @Test
  public void testJoinIntersects() {
    VariableFlowScope left = entry.bind("a").bind("b");
    VariableFlowScope right = entry.bind("b").bind("c");
    VariableFlowScope joined = VariableFlowScope.join(left, right);
    assertThat(joined.getBoundNames()).containsExactly("p", "b");
    assertWithMessage("Join should be symmetric")
        .that(VariableFlowScope.join(right, left))
        .isEqualTo(joined);
  }

  @Test
  public void testUnreachableIsJoinIdentity() {
    VariableFlowScope withA = entry.bind("a");
    VariableFlowScope dead = entry.unreachable();
    assertThat(VariableFlowScope.join(dead, withA)).isSameInstanceAs(withA);
    assertThat(VariableFlowScope.join(withA, dead)).isSameInstanceAs(withA);
  }

  @Test
  public void testJoinOfUnreachableIsUnreachable() {
    VariableFlowScope dead = entry.bind("a").unreachable();
    VariableFlowScope joined = VariableFlowScope.join(ImmutableList.of(dead, entry.unreachable()));
    assertThat(joined.isReachable()).isFalse();
    assertThat(joined.isBound("a")).isFalse();
    assertThat(joined.getBoundNames()).isEmpty();
  }

  @Test
  public void testJoinNothingFails() {
    assertThrows(
        IllegalArgumentException.class, () -> VariableFlowScope.join(ImmutableList.of()));
  }

  @Test
  public void testJoinAcrossBodiesFails() {
    VariableFlowScope other =
        VariableFlowScope.createEntryScope(ImmutableSet.of("x"), ImmutableList.of(), false, false);
    assertThrows(IllegalStateException.class, () -> VariableFlowScope.join(entry, other));
  }

  @Test
  public void testUnreachableIgnoresTransitions() {
    VariableFlowScope dead = entry.unreachable();
    assertThat(dead.bind("a")).isSameInstanceAs(dead);
    assertThat(dead.unbind("p")).isSameInstanceAs(dead);
    assertThat(dead.withResponseHeaderAvailable()).isSameInstanceAs(dead);
    assertThat(dead.isBound("p")).isFalse();
  }

  @Test
  public void testResponseHeaderNeedsEveryPath() {
    VariableFlowScope header = entry.withResponseHeaderAvailable();
    assertThat(header.isResponseHeaderAvailable()).isTrue();
    assertThat(VariableFlowScope.join(header, entry).isResponseHeaderAvailable()).isFalse();
    assertThat(VariableFlowScope.join(header, header.bind("a")).isResponseHeaderAvailable())
        .isTrue();
  }

  @Test
  public void testFlagsSurviveTransitions() {
    VariableFlowScope scope =
        VariableFlowScope.createEntryScope(UNIVERSE, ImmutableList.of(), true, true);
    VariableFlowScope after = scope.bind("a").withResponseHeaderAvailable().unbind("a");
    assertThat(after.isThisAvailable()).isTrue();
    assertThat(after.isCliArgumentsAvailable()).isTrue();
    assertThat(after.withoutThis().isThisAvailable()).isFalse();
  }
}
