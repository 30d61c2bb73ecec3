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
import static org.junit.Assert.assertThrows;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import com.google.common.collect.ImmutableSet;
import java.io.ByteArrayInputStream;
import java.io.ByteArrayOutputStream;
import java.io.ObjectInputStream;
import java.io.ObjectOutputStream;
import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;

/** Tests for {@link CheckerOptions}. */
@RunWith(JUnit4.class)
public final class CheckerOptionsTest {

  @Test
  public void testDefaults() {
    CheckerOptions options = new CheckerOptions();
    assertThat(options.isCliArgumentsVariablesRegistered()).isFalse();
    assertThat(options.getNumParallelThreads()).isEqualTo(1);
    assertThat(options.getWarningLevel(DefinedVariableCheck.UNDEFINED_VARIABLE))
        .isEqualTo(CheckLevel.ERROR);
    assertThat(options.getReferenceOutputPositions("exec")).containsExactly(1, 2);
    assertThat(options.getReferenceOutputPositions("strlen")).isEmpty();
    assertThat(options.isResponseHeaderFunction("file_get_contents")).isTrue();
    assertThat(options.isResponseHeaderFunction("curl_exec")).isFalse();
  }

  @Test
  public void testFunctionNamesAreNormalized() {
    CheckerOptions options = new CheckerOptions();
    assertThat(options.getReferenceOutputPositions("\\Preg_Match")).containsExactly(2);
    assertThat(options.isResponseHeaderFunction("\\FOPEN")).isTrue();
  }

  @Test
  public void testReplaceReferenceOutputFunctions() {
    CheckerOptions options = new CheckerOptions();
    options.setReferenceOutputFunctions(ImmutableMap.of("My_Fill", ImmutableList.of(0, 2)));
    assertThat(options.getReferenceOutputPositions("my_fill")).containsExactly(0, 2);
    assertThat(options.getReferenceOutputPositions("preg_match")).isEmpty();
  }

  @Test
  public void testAddReferenceOutputFunctionKeepsDefaults() {
    CheckerOptions options = new CheckerOptions();
    options.addReferenceOutputFunction("\\my_fill", 1);
    assertThat(options.getReferenceOutputPositions("MY_FILL")).containsExactly(1);
    assertThat(options.getReferenceOutputPositions("preg_match")).containsExactly(2);
  }

  @Test
  public void testNegativePositionIsRejected() {
    CheckerOptions options = new CheckerOptions();
    assertThrows(
        IllegalArgumentException.class, () -> options.addReferenceOutputFunction("f", -1));
  }

  @Test
  public void testResponseHeaderFunctions() {
    CheckerOptions options = new CheckerOptions();
    options.setResponseHeaderFunctions(ImmutableSet.of("Http_Get"));
    assertThat(options.isResponseHeaderFunction("http_get")).isTrue();
    assertThat(options.isResponseHeaderFunction("file_get_contents")).isFalse();
  }

  @Test
  public void testWarningLevels() {
    CheckerOptions options = new CheckerOptions();
    options.setWarningLevel(DefinedVariableCheck.UNDEFINED_VARIABLE, CheckLevel.WARNING);
    options.setCliArgumentsVariablesRegistered(true);
    assertThat(options.enables(DefinedVariableCheck.UNDEFINED_VARIABLE)).isTrue();
    options.setWarningLevel(DefinedVariableCheck.UNDEFINED_VARIABLE, CheckLevel.OFF);
    assertThat(options.enables(DefinedVariableCheck.UNDEFINED_VARIABLE)).isFalse();
  }

  @Test
  public void testThreadCountMustBePositive() {
    CheckerOptions options = new CheckerOptions();
    assertThrows(IllegalArgumentException.class, () -> options.setNumParallelThreads(0));
  }

  @Test
  public void testSerialization() throws Exception {
    CheckerOptions options = new CheckerOptions();
    options.setCliArgumentsVariablesRegistered(true);
    options.addReferenceOutputFunction("my_fill", 0);
    options.setWarningLevel(DefinedVariableCheck.UNDEFINED_VARIABLE, CheckLevel.WARNING);

    ByteArrayOutputStream bytes = new ByteArrayOutputStream();
    try (ObjectOutputStream out = new ObjectOutputStream(bytes)) {
      out.writeObject(options);
    }
    CheckerOptions copy;
    try (ObjectInputStream in =
        new ObjectInputStream(new ByteArrayInputStream(bytes.toByteArray()))) {
      copy = (CheckerOptions) in.readObject();
    }

    assertThat(copy.isCliArgumentsVariablesRegistered()).isTrue();
    assertThat(copy.getReferenceOutputPositions("my_fill")).containsExactly(0);
    assertThat(copy.getWarningLevel(DefinedVariableCheck.UNDEFINED_VARIABLE))
        .isEqualTo(CheckLevel.WARNING);
  }
}
