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

import com.google.common.collect.ImmutableList;
import com.phpcheck.ast.Node;
import com.phpcheck.ast.Token;
import java.util.function.Consumer;
import org.jspecify.annotations.Nullable;

/** NodeUtil contains generally useful AST utilities. */
public final class NodeUtil {

  private NodeUtil() {}

  /** Whether the node opens a body that is not part of the enclosing body's flow. */
  static boolean startsNestedBody(Node n) {
    return n.isFunctionLike() || n.getToken() == Token.CLASS;
  }

  /** Gets the body of a FUNCTION, METHOD or CLOSURE. Abstract methods have an EMPTY body. */
  static Node getFunctionBody(Node fn) {
    checkArgument(fn.isFunctionLike(), fn);
    return fn.getLastChild();
  }

  /** Gets the PARAM_LIST of a FUNCTION, METHOD, CLOSURE or ARROW_FUNCTION. */
  static Node getParameters(Node fn) {
    checkArgument(fn.isFunctionLike() || fn.getToken() == Token.ARROW_FUNCTION, fn);
    Node params = fn.getToken() == Token.FUNCTION || fn.getToken() == Token.METHOD
        ? fn.getSecondChild()
        : fn.getFirstChild();
    checkArgument(params.isParamList(), params);
    return params;
  }

  /** Returns the VARIABLE node a parameter declares. */
  static Node getParameterVariable(Node param) {
    return param.getToken() == Token.DEFAULT_VALUE ? param.getFirstChild() : param;
  }

  /** Returns the names a PARAM_LIST declares, in order. */
  static ImmutableList<String> getParameterNames(Node paramList) {
    checkArgument(paramList.isParamList(), paramList);
    ImmutableList.Builder<String> names = ImmutableList.builder();
    for (Node param : paramList.children()) {
      names.add(getParameterVariable(param).getString());
    }
    return names.build();
  }

  /** Returns the USE_LIST of a CLOSURE. */
  static Node getClosureUses(Node closure) {
    checkArgument(closure.getToken() == Token.CLOSURE, closure);
    return closure.getSecondChild();
  }

  /** Returns the innermost FUNCTION, METHOD or CLOSURE strictly enclosing n, or null. */
  static @Nullable Node getEnclosingFunctionLike(Node n) {
    for (Node parent = n.getParent(); parent != null; parent = parent.getParent()) {
      if (parent.isFunctionLike()) {
        return parent;
      }
    }
    return null;
  }

  /**
   * Whether {@code $this} refers to an object inside the given function-like. Non-static methods
   * bind it; closures inherit it from their definition site unless declared static.
   */
  static boolean isThisAvailable(Node fn) {
    switch (fn.getToken()) {
      case METHOD:
        return !fn.isStaticMember();
      case CLOSURE:
        if (fn.isStaticMember()) {
          return false;
        }
        Node enclosing = getEnclosingFunctionLike(fn);
        return enclosing != null && isThisAvailable(enclosing);
      default:
        return false;
    }
  }

  /**
   * Returns the plain name of a called function, or null when the callee is computed, a method or a
   * static member.
   */
  static @Nullable String getCalledFunctionName(Node call) {
    checkArgument(call.isCall(), call);
    Node callee = call.getFirstChild();
    return callee.isName() ? callee.getString() : null;
  }

  /** Whether the expression is the literal {@code true}. Nothing else is folded. */
  static boolean isLiteralTrue(Node n) {
    return n.isTrue();
  }

  /**
   * Returns the variable an element write auto-vivifies: the VARIABLE itself, or the VARIABLE at
   * the base of a chain of element accesses. Returns null for property writes and computed bases.
   */
  static @Nullable Node getWrittenVariable(Node target) {
    Node n = target;
    while (n.isGetElem()) {
      n = n.getFirstChild();
    }
    return n.isVariable() ? n : null;
  }

  /**
   * Returns the variable a guard such as {@code isset} proves set: the VARIABLE itself, or the base
   * of a chain of element and property accesses.
   */
  static @Nullable Node getGuardedVariable(Node n) {
    Node base = n;
    while (base.isGetElem() || base.isGetProp()) {
      base = base.getFirstChild();
    }
    return base.isVariable() ? base : null;
  }

  /**
   * Calls the consumer with every VARIABLE that an assignment to {@code target} binds, in source
   * order. Handles plain variables, element chains and nested destructuring patterns.
   */
  static void visitAssignedVariables(Node target, Consumer<Node> consumer) {
    if (target.isDestructuringPattern()) {
      for (Node item : target.children()) {
        if (item.isArrayItem()) {
          visitAssignedVariables(item.getLastChild(), consumer);
        }
      }
      return;
    }
    Node written = getWrittenVariable(target);
    if (written != null) {
      consumer.accept(written);
    }
  }
}
