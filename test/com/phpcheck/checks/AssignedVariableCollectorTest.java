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

import com.google.common.collect.ImmutableSet;
import com.phpcheck.ast.IR;
import com.phpcheck.ast.Node;
import com.phpcheck.ast.Token;
import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;

/** Tests for {@link AssignedVariableCollector}. */
@RunWith(JUnit4.class)
public final class AssignedVariableCollectorTest {

  private final CheckerOptions options = new CheckerOptions();

  private ImmutableSet<String> collect(Node... statements) {
    return new AssignedVariableCollector(ReferenceOutputs.fromOptions(options))
        .collect(IR.block(statements));
  }

  private static Node stmt(Node expr) {
    return IR.exprResult(expr);
  }

  @Test
  public void testAssignments() {
    assertThat(
            collect(
                stmt(IR.assign(IR.var("a"), IR.number(1))),
                stmt(IR.assignOp(Token.ASSIGN_ADD, IR.var("b"), IR.number(1))),
                stmt(IR.assignOp(Token.ASSIGN_COALESCE, IR.var("c"), IR.number(1))),
                stmt(IR.inc(IR.var("d"))),
                stmt(IR.assignRef(IR.var("e"), IR.var("f")))))
        .containsExactly("a", "b", "c", "d", "e", "f");
  }

  @Test
  public void testReadsAreNotCollected() {
    assertThat(collect(IR.echo(IR.var("a")), stmt(IR.call("f", IR.var("b"))))).isEmpty();
  }

  @Test
  public void testElementAndPropertyTargets() {
    assertThat(
            collect(
                stmt(IR.assign(IR.getelem(IR.getelem(IR.var("a"), IR.var("i"))), IR.number(1))),
                stmt(IR.assign(IR.getprop(IR.var("o"), "p"), IR.number(1))),
                stmt(IR.assign(IR.getelem(IR.call("f")), IR.number(1)))))
        .containsExactly("a");
  }

  @Test
  public void testDestructuring() {
    Node pattern =
        IR.list(
            IR.var("a"),
            IR.empty(),
            IR.arrayItem(IR.string("k"), IR.arrayPattern(IR.var("b"), IR.var("c"))));
    assertThat(collect(stmt(IR.assign(pattern, IR.arrayLit())))).containsExactly("a", "b", "c");
  }

  @Test
  public void testLoopCatchAndDeclarations() {
    assertThat(
            collect(
                IR.foreach(IR.arrayLit(), IR.var("k"), IR.var("v"), IR.block()),
                IR.tryCatch(IR.block(), IR.catchNode(IR.var("e"), IR.block())),
                IR.global(IR.var("g")),
                IR.staticVars(IR.var("s"), IR.assign(IR.var("t"), IR.number(0)))))
        .containsExactly("k", "v", "e", "g", "s", "t");
  }

  @Test
  public void testUnreachableAssignmentsAreCollected() {
    assertThat(collect(IR.returnNode(), stmt(IR.assign(IR.var("late"), IR.number(1)))))
        .containsExactly("late");
  }

  @Test
  public void testNestedBodiesAreSkipped() {
    Node function =
        IR.function("f", IR.paramNames("p"), IR.block(stmt(IR.assign(IR.var("inner"), IR.number(1)))));
    Node closure =
        IR.closure(
            IR.paramNames("q"),
            IR.useList(IR.var("byValue"), IR.byRef(IR.var("byRef"))),
            IR.block(stmt(IR.assign(IR.var("closureLocal"), IR.number(1)))));
    Node cls =
        IR.classNode(
            "C",
            IR.method(
                "m", IR.paramList(), IR.block(stmt(IR.assign(IR.var("methodLocal"), IR.number(1))))));
    assertThat(collect(function, stmt(closure), cls)).containsExactly("byRef");
  }

  @Test
  public void testArrowFunctionsAreEntered() {
    Node arrow = IR.arrowFunction(IR.paramNames("x"), IR.assign(IR.var("y"), IR.var("x")));
    assertThat(collect(stmt(arrow))).containsExactly("x", "y");
  }

  @Test
  public void testReferenceOutputArguments() {
    assertThat(
            collect(
                stmt(IR.call("preg_match", IR.var("pattern"), IR.var("subject"), IR.var("m"))),
                stmt(IR.call("EXEC", IR.var("cmd"), IR.var("output"), IR.var("status"))),
                stmt(IR.call("preg_match", IR.string("/x/"), IR.string("x"),
                    IR.getelem(IR.var("notBare"))))))
        .containsExactly("m", "output", "status");
  }

  @Test
  public void testImplicitNamesAreNotCollected() {
    assertThat(
            collect(
                stmt(IR.assign(IR.thisVar(), IR.number(1))),
                stmt(IR.assign(IR.var("http_response_header"), IR.number(1))),
                stmt(IR.assign(IR.getelem(IR.var("_SESSION"), IR.string("k")), IR.number(1)))))
        .isEmpty();
  }
}
