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

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableSet;
import com.phpcheck.ast.IR;
import com.phpcheck.ast.Node;
import org.junit.Before;
import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;

/** Tests for {@link VariableReadChecker}. */
@RunWith(JUnit4.class)
public final class VariableReadCheckerTest {

  private SortingErrorManager errorManager;
  private VariableReadChecker checker;
  private VariableFlowScope scope;

  @Before
  public void setUp() {
    errorManager = new SortingErrorManager();
    checker = new VariableReadChecker(errorManager, CheckLevel.ERROR);
    scope =
        VariableFlowScope.createEntryScope(
                ImmutableSet.of("bound", "later"), ImmutableList.of(), false, false)
            .bind("bound");
  }

  private static Node read(String name) {
    Node script = IR.script("read.php", IR.echo(IR.var(name)));
    Node var = script.getFirstChild().getFirstChild();
    var.setLineno(7);
    return var;
  }

  @Test
  public void testOrdinaryRead() {
    assertThat(checker.checkRead(read("bound"), scope)).isTrue();
    assertThat(checker.checkRead(read("later"), scope)).isFalse();
    assertThat(checker.checkRead(read("never"), scope)).isFalse();
    assertThat(errorManager.getErrorCount()).isEqualTo(2);
  }

  @Test
  public void testGuardedRead() {
    assertThat(checker.checkGuardedRead(read("bound"), scope)).isTrue();
    assertThat(checker.checkGuardedRead(read("later"), scope)).isTrue();
    assertThat(checker.checkGuardedRead(read("never"), scope)).isFalse();
    assertThat(errorManager.getErrorCount()).isEqualTo(1);
  }

  @Test
  public void testReport() {
    checker.checkRead(read("never"), scope);
    PhpError error = errorManager.getErrors().get(0);
    assertThat(error.description()).isEqualTo("Undefined variable: $never");
    assertThat(error.lineno()).isEqualTo(7);
    assertThat(error.sourceName()).isEqualTo("read.php");
  }

  @Test
  public void testUnreachableReadsPass() {
    assertThat(checker.checkRead(read("never"), scope.unreachable())).isTrue();
    assertThat(errorManager.getErrorCount()).isEqualTo(0);
  }

  @Test
  public void testImplicitVariablesFollowTheirFlags() {
    assertThat(VariableReadChecker.isDefined("this", scope, false)).isFalse();
    assertThat(VariableReadChecker.isDefined("this", scope, true)).isFalse();
    assertThat(VariableReadChecker.isDefined("argv", scope, false)).isFalse();
    assertThat(VariableReadChecker.isDefined("http_response_header", scope, false)).isFalse();
    assertThat(VariableReadChecker.isDefined("_SERVER", scope, false)).isTrue();

    VariableFlowScope method =
        VariableFlowScope.createEntryScope(ImmutableSet.of(), ImmutableList.of(), true, true)
            .withResponseHeaderAvailable();
    assertThat(VariableReadChecker.isDefined("this", method, false)).isTrue();
    assertThat(VariableReadChecker.isDefined("argc", method, false)).isTrue();
    assertThat(VariableReadChecker.isDefined("http_response_header", method, false)).isTrue();
  }

  @Test
  public void testImplicitNamesAreCaseSensitive() {
    assertThat(ImplicitVar.forName("_GET")).isEqualTo(ImplicitVar.GET);
    assertThat(ImplicitVar.forName("_get")).isNull();
    assertThat(VariableReadChecker.isDefined("_get", scope, false)).isFalse();
  }

  @Test
  public void testWarningLevel() {
    VariableReadChecker warningChecker = new VariableReadChecker(errorManager, CheckLevel.WARNING);
    warningChecker.checkRead(read("never"), scope);
    assertThat(errorManager.getErrorCount()).isEqualTo(0);
    assertThat(errorManager.getWarnings()).hasSize(1);
  }
}
