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

import com.google.common.collect.ImmutableSet;
import com.phpcheck.ast.Node;
import com.phpcheck.checks.NodeTraversal.AbstractShallowCallback;
import java.util.LinkedHashSet;
import java.util.Set;
import org.jspecify.annotations.Nullable;

/**
 * Collects every variable name a body can assign, on any path. This is the set a guarded read
 * ({@code isset}, {@code empty}, the left side of {@code ??}) is checked against, and the only set
 * of names the flow walk may ever bind.
 *
 * <p>Nested functions, methods, classes and closure bodies are separate bodies and are skipped.
 * Arrow functions are part of the body that contains them.
 */
final class AssignedVariableCollector {
  private final ReferenceOutputs referenceOutputs;

  AssignedVariableCollector(ReferenceOutputs referenceOutputs) {
    this.referenceOutputs = referenceOutputs;
  }

  ImmutableSet<String> collect(Node body) {
    Set<String> names = new LinkedHashSet<>();
    NodeTraversal.traverse(body, new Collector(names));
    return ImmutableSet.copyOf(names);
  }

  private final class Collector extends AbstractShallowCallback {
    private final Set<String> names;

    Collector(Set<String> names) {
      this.names = names;
    }

    @Override
    public void visit(NodeTraversal t, Node n, @Nullable Node parent) {
      switch (n.getToken()) {
        case ASSIGN_REF:
          addTarget(n.getFirstChild());
          addTarget(n.getLastChild());
          break;
        case INC:
        case DEC:
          addTarget(n.getFirstChild());
          break;
        case FOREACH:
          Node key = n.getSecondChild();
          if (!key.isEmpty()) {
            addTarget(key);
          }
          addTarget(key.getNext());
          break;
        case CATCH:
          addTarget(n.getFirstChild());
          break;
        case GLOBAL:
          for (Node var : n.children()) {
            addTarget(var);
          }
          break;
        case STATIC:
          for (Node item : n.children()) {
            addTarget(item.isVariable() ? item : item.getFirstChild());
          }
          break;
        case USE_LIST:
          for (Node use : n.children()) {
            if (use.isByReference()) {
              addTarget(use);
            }
          }
          break;
        case PARAM_LIST:
          // Only arrow function parameters get here; other parameter lists are not traversed.
          for (String name : NodeUtil.getParameterNames(n)) {
            add(name);
          }
          break;
        case CALL:
          addReferenceOutputs(n);
          break;
        default:
          if (n.getToken().isAssignmentOp()) {
            addTarget(n.getFirstChild());
          }
          break;
      }
    }

    private void addReferenceOutputs(Node call) {
      String functionName = NodeUtil.getCalledFunctionName(call);
      if (functionName == null) {
        return;
      }
      ImmutableSet<Integer> positions = referenceOutputs.getPositions(functionName);
      int position = 0;
      for (Node arg = call.getSecondChild(); arg != null; arg = arg.getNext(), position++) {
        if (arg.isVariable() && positions.contains(position)) {
          add(arg.getString());
        }
      }
    }

    private void addTarget(Node target) {
      NodeUtil.visitAssignedVariables(target, var -> add(var.getString()));
    }

    private void add(String name) {
      if (!ImplicitVar.isImplicit(name)) {
        names.add(name);
      }
    }
  }
}
