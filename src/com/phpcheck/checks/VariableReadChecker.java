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

import com.phpcheck.ast.Node;

/**
 * Decides whether a read of a variable is defined in a scope and reports the reads that are not.
 *
 * <p>An ordinary read is defined when the name is bound. A guarded read, the operand of {@code
 * isset} or {@code empty} or the left side of {@code ??}, only needs the name to be assigned
 * somewhere in the body. Implicit variables are decided by the flags of the scope alone.
 */
final class VariableReadChecker {
  private final ErrorHandler errorHandler;
  private final CheckLevel level;

  VariableReadChecker(ErrorHandler errorHandler, CheckLevel level) {
    this.errorHandler = errorHandler;
    this.level = level;
  }

  /** Checks an ordinary read. Returns whether it was defined. */
  boolean checkRead(Node var, VariableFlowScope scope) {
    return check(var, scope, false);
  }

  /** Checks a read under a guard. Returns whether it was defined. */
  boolean checkGuardedRead(Node var, VariableFlowScope scope) {
    return check(var, scope, true);
  }

  private boolean check(Node var, VariableFlowScope scope, boolean guarded) {
    if (!scope.isReachable()) {
      return true;
    }
    String name = var.getString();
    if (isDefined(name, scope, guarded)) {
      return true;
    }
    errorHandler.report(
        level, PhpError.make(var, DefinedVariableCheck.UNDEFINED_VARIABLE, name));
    return false;
  }

  static boolean isDefined(String name, VariableFlowScope scope, boolean guarded) {
    ImplicitVar implicit = ImplicitVar.forName(name);
    if (implicit != null) {
      return implicit.isAvailableIn(scope);
    }
    return guarded ? scope.isAssignedAnywhere(name) : scope.isBound(name);
  }
}
