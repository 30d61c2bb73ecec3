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
import com.google.common.collect.ImmutableSetMultimap;
import com.google.common.collect.Sets;
import com.phpcheck.ast.Node;
import com.phpcheck.ast.Token;
import com.phpcheck.checks.NodeTraversal.AbstractPostOrderCallback;
import org.jspecify.annotations.Nullable;

/**
 * Knows which arguments of a named call are by-reference outputs: a bare variable passed there is
 * assigned by the call rather than read.
 *
 * <p>Positions come from the configured table of builtin functions and from the functions declared
 * in the analyzed scripts, whose {@code &$param} parameters are outputs wherever the function is
 * called. Declarations are gathered by name only, regardless of where the declaration sits.
 */
final class ReferenceOutputs {
  private final CheckerOptions options;
  private final ImmutableSetMultimap<String, Integer> declared;

  private ReferenceOutputs(CheckerOptions options, ImmutableSetMultimap<String, Integer> declared) {
    this.options = options;
    this.declared = declared;
  }

  /** Only the configured table. */
  static ReferenceOutputs fromOptions(CheckerOptions options) {
    return new ReferenceOutputs(options, ImmutableSetMultimap.of());
  }

  /** The configured table plus every function declared under the given roots. */
  static ReferenceOutputs gather(CheckerOptions options, Iterable<Node> roots) {
    DefinitionGatheringCallback callback = new DefinitionGatheringCallback();
    for (Node root : roots) {
      NodeTraversal.traverse(root, callback);
    }
    return new ReferenceOutputs(options, callback.positions.build());
  }

  ImmutableSet<Integer> getPositions(String functionName) {
    ImmutableSet<Integer> configured = options.getReferenceOutputPositions(functionName);
    ImmutableSet<Integer> fromDeclarations =
        declared.get(CheckerOptions.normalizeFunctionName(functionName));
    if (fromDeclarations.isEmpty()) {
      return configured;
    }
    return Sets.union(configured, fromDeclarations).immutableCopy();
  }

  private static final class DefinitionGatheringCallback extends AbstractPostOrderCallback {
    final ImmutableSetMultimap.Builder<String, Integer> positions = ImmutableSetMultimap.builder();

    @Override
    public void visit(NodeTraversal t, Node n, @Nullable Node parent) {
      if (n.getToken() != Token.FUNCTION) {
        return;
      }
      String name = CheckerOptions.normalizeFunctionName(n.getFirstChild().getString());
      int position = 0;
      for (Node param : NodeUtil.getParameters(n).children()) {
        if (NodeUtil.getParameterVariable(param).isByReference()) {
          positions.put(name, position);
        }
        position++;
      }
    }
  }
}
