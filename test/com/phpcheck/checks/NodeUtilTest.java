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

import com.phpcheck.ast.IR;
import com.phpcheck.ast.Node;
import java.util.ArrayList;
import java.util.List;
import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;

@RunWith(JUnit4.class)
public final class NodeUtilTest {

  private static List<String> assignedNames(Node target) {
    List<String> names = new ArrayList<>();
    NodeUtil.visitAssignedVariables(target, var -> names.add(var.getString()));
    return names;
  }

  @Test
  public void testGetParameters() {
    Node params = IR.paramNames("a", "b");
    Node fn = IR.function("f", params, IR.block());
    assertThat(NodeUtil.getParameters(fn)).isSameInstanceAs(params);

    Node closureParams = IR.paramNames("c");
    Node closure = IR.closure(closureParams, IR.useList(), IR.block());
    assertThat(NodeUtil.getParameters(closure)).isSameInstanceAs(closureParams);

    Node arrowParams = IR.paramList();
    Node arrow = IR.arrowFunction(arrowParams, IR.number(1));
    assertThat(NodeUtil.getParameters(arrow)).isSameInstanceAs(arrowParams);
  }

  @Test
  public void testGetParameterNames() {
    Node params = IR.paramList(IR.var("a"), IR.defaultParam("b", IR.nullNode()));
    assertThat(NodeUtil.getParameterNames(params)).containsExactly("a", "b").inOrder();
  }

  @Test
  public void testGetFunctionBody() {
    Node body = IR.block();
    assertThat(NodeUtil.getFunctionBody(IR.method("m", IR.paramList(), body)))
        .isSameInstanceAs(body);
    assertThat(NodeUtil.getFunctionBody(IR.abstractMethod("m", IR.paramList())).isEmpty())
        .isTrue();
  }

  @Test
  public void testIsThisAvailable() {
    Node method = IR.method("m", IR.paramList(), IR.block());
    assertThat(NodeUtil.isThisAvailable(method)).isTrue();
    assertThat(NodeUtil.isThisAvailable(IR.staticMethod("s", IR.paramList(), IR.block())))
        .isFalse();
    assertThat(NodeUtil.isThisAvailable(IR.function("f", IR.paramList(), IR.block()))).isFalse();
  }

  @Test
  public void testIsThisAvailableInClosure() {
    Node inMethod = IR.closure(IR.paramList(), IR.useList(), IR.block());
    IR.classNode("C", IR.method("m", IR.paramList(), IR.block(IR.exprResult(inMethod))));
    assertThat(NodeUtil.isThisAvailable(inMethod)).isTrue();

    Node staticInMethod = IR.staticClosure(IR.paramList(), IR.useList(), IR.block());
    IR.method("m", IR.paramList(), IR.block(IR.exprResult(staticInMethod)));
    assertThat(NodeUtil.isThisAvailable(staticInMethod)).isFalse();

    Node topLevel = IR.closure(IR.paramList(), IR.useList(), IR.block());
    IR.script("a.php", IR.exprResult(topLevel));
    assertThat(NodeUtil.isThisAvailable(topLevel)).isFalse();
  }

  @Test
  public void testGetCalledFunctionName() {
    assertThat(NodeUtil.getCalledFunctionName(IR.call("preg_match"))).isEqualTo("preg_match");
    assertThat(NodeUtil.getCalledFunctionName(IR.call(IR.var("f")))).isNull();
    assertThat(NodeUtil.getCalledFunctionName(IR.staticCall("C", "m"))).isNull();
  }

  @Test
  public void testGetWrittenVariable() {
    Node a = IR.var("a");
    assertThat(NodeUtil.getWrittenVariable(a)).isSameInstanceAs(a);
    Node b = IR.var("b");
    assertThat(NodeUtil.getWrittenVariable(IR.getelem(IR.getelem(b, IR.number(0)))))
        .isSameInstanceAs(b);
    assertThat(NodeUtil.getWrittenVariable(IR.getprop(IR.var("c"), "p"))).isNull();
  }

  @Test
  public void testGetGuardedVariable() {
    Node a = IR.var("a");
    assertThat(NodeUtil.getGuardedVariable(IR.getprop(IR.getelem(a, IR.string("k")), "p")))
        .isSameInstanceAs(a);
    assertThat(NodeUtil.getGuardedVariable(IR.staticMember("C", "x"))).isNull();
  }

  @Test
  public void testVisitAssignedVariables() {
    assertThat(assignedNames(IR.var("a"))).containsExactly("a");
    assertThat(assignedNames(IR.getelem(IR.var("b")))).containsExactly("b");
    assertThat(assignedNames(IR.getprop(IR.var("c"), "p"))).isEmpty();
  }

  @Test
  public void testVisitAssignedVariablesInPatterns() {
    Node pattern =
        IR.list(
            IR.var("a"),
            IR.empty(),
            IR.arrayItem(IR.string("k"), IR.arrayPattern(IR.var("b"), IR.getelem(IR.var("c")))),
            IR.getprop(IR.var("d"), "p"));
    assertThat(assignedNames(pattern)).containsExactly("a", "b", "c").inOrder();
  }
}
