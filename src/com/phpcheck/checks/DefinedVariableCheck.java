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

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableSet;
import com.phpcheck.ast.Node;
import com.phpcheck.ast.Token;
import com.phpcheck.checks.NodeTraversal.AbstractPreOrderCallback;
import java.util.logging.Level;
import java.util.logging.Logger;
import org.jspecify.annotations.Nullable;

/**
 * Checks that every variable is definitely assigned on every path before it is read, and reports
 * each read that is not.
 *
 * <p>Each script, function, method and closure body is checked on its own. Variables of one body
 * are never visible in another, except through a closure's use clause.
 */
public final class DefinedVariableCheck implements CheckPass {

  private static final Logger logger = Logger.getLogger(DefinedVariableCheck.class.getName());

  public static final DiagnosticType UNDEFINED_VARIABLE =
      DiagnosticType.error("PHP_UNDEFINED_VARIABLE", "Undefined variable: ${0}");

  private final CheckerOptions options;
  private final ErrorHandler errorHandler;
  private final @Nullable ReferenceOutputs referenceOutputs;

  /** Creates a check that sees the functions declared in the tree it processes. */
  public DefinedVariableCheck(CheckerOptions options, ErrorHandler errorHandler) {
    this(options, errorHandler, null);
  }

  /**
   * Creates a check whose by-reference outputs were gathered up front, so that functions declared
   * in other scripts are known.
   */
  DefinedVariableCheck(
      CheckerOptions options,
      ErrorHandler errorHandler,
      @Nullable ReferenceOutputs referenceOutputs) {
    this.options = options;
    this.errorHandler = errorHandler;
    this.referenceOutputs = referenceOutputs;
  }

  @Override
  public void process(Node root) {
    if (!options.enables(UNDEFINED_VARIABLE)) {
      return;
    }
    ReferenceOutputs outputs =
        referenceOutputs != null
            ? referenceOutputs
            : ReferenceOutputs.gather(options, ImmutableList.of(root));
    NodeTraversal.traverse(root, new BodyFinder(outputs));
  }

  private class BodyFinder extends AbstractPreOrderCallback {
    private final ReferenceOutputs referenceOutputs;
    private final AssignedVariableCollector collector;

    BodyFinder(ReferenceOutputs referenceOutputs) {
      this.referenceOutputs = referenceOutputs;
      this.collector = new AssignedVariableCollector(referenceOutputs);
    }

    @Override
    public boolean shouldTraverse(NodeTraversal t, Node n, @Nullable Node parent) {
      if (n.isScript()) {
        checkBody(n, n, ImmutableList.of(), false, options.isCliArgumentsVariablesRegistered());
      } else if (n.isFunctionLike()) {
        Node body = NodeUtil.getFunctionBody(n);
        // Abstract and interface methods have nothing to check.
        if (body.isBlock()) {
          checkBody(n, body, getInitiallyBound(n), NodeUtil.isThisAvailable(n), false);
        }
      }
      return true;
    }

    private void checkBody(
        Node unit,
        Node body,
        ImmutableList<String> initiallyBound,
        boolean thisAvailable,
        boolean cliArgumentsAvailable) {
      ImmutableSet.Builder<String> universe = ImmutableSet.builder();
      universe.addAll(collector.collect(body));
      for (String name : initiallyBound) {
        if (!ImplicitVar.isImplicit(name)) {
          universe.add(name);
        }
      }
      VariableFlowScope entry =
          VariableFlowScope.createEntryScope(
              universe.build(), initiallyBound, thisAvailable, cliArgumentsAvailable);
      if (logger.isLoggable(Level.FINER)) {
        logger.finer(
            "Checking " + unit.getToken() + " at " + unit.getSourceFileName() + ":"
                + unit.getLineno() + " with " + entry);
      }
      VariableReadChecker readChecker =
          new VariableReadChecker(errorHandler, options.getWarningLevel(UNDEFINED_VARIABLE));
      new DefinednessInference(readChecker, options, referenceOutputs).traverseBody(body, entry);
    }
  }

  /** Parameters, plus the use clause for closures. */
  private static ImmutableList<String> getInitiallyBound(Node fn) {
    ImmutableList.Builder<String> names = ImmutableList.builder();
    names.addAll(NodeUtil.getParameterNames(NodeUtil.getParameters(fn)));
    if (fn.getToken() == Token.CLOSURE) {
      for (Node use : NodeUtil.getClosureUses(fn).children()) {
        names.add(use.getString());
      }
    }
    return names.build();
  }
}
