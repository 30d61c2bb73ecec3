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

import static com.google.common.base.Preconditions.checkState;

import com.google.common.collect.ImmutableSet;
import com.google.common.primitives.Ints;
import com.phpcheck.ast.Node;
import com.phpcheck.ast.Token;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.Iterator;
import java.util.List;
import org.jspecify.annotations.Nullable;

/**
 * Walks one body in evaluation order, threading a {@link VariableFlowScope} through it and
 * checking every variable read against the scope at that point.
 *
 * <p>Structured control flow is followed directly on the tree: branches are walked separately and
 * joined where they meet, loops are walked once, and jumps are collected on the statement they
 * leave. An instance walks a single body and is not reusable across threads.
 */
class DefinednessInference {
  private final VariableReadChecker readChecker;
  private final CheckerOptions options;
  private final ReferenceOutputs referenceOutputs;

  /** Enclosing loops and switches, innermost first. */
  private final Deque<JumpTarget> jumpTargets = new ArrayDeque<>();

  DefinednessInference(
      VariableReadChecker readChecker,
      CheckerOptions options,
      ReferenceOutputs referenceOutputs) {
    this.readChecker = readChecker;
    this.options = options;
    this.referenceOutputs = referenceOutputs;
  }

  /** Walks the statements of a body starting in the entry scope and returns the exit scope. */
  VariableFlowScope traverseBody(Node body, VariableFlowScope entry) {
    checkState(jumpTargets.isEmpty(), "body walks do not nest");
    return traverseStatements(body, entry);
  }

  private VariableFlowScope traverseStatements(Node parent, VariableFlowScope scope) {
    for (Node stmt = parent.getFirstChild(); stmt != null; stmt = stmt.getNext()) {
      if (!scope.isReachable()) {
        // Dead code.
        break;
      }
      scope = traverseStatement(stmt, scope);
    }
    return scope;
  }

  private VariableFlowScope traverseStatement(Node n, VariableFlowScope scope) {
    if (!scope.isReachable()) {
      return scope;
    }
    switch (n.getToken()) {
      case BLOCK:
        return traverseStatements(n, scope);
      case EXPR_RESULT:
      case ECHO:
        return traverseChildren(n, scope);
      case RETURN:
      case THROW:
        return traverseChildren(n, scope).unreachable();
      case BREAK:
        return traverseJump(n, scope, false);
      case CONTINUE:
        return traverseJump(n, scope, true);
      case IF:
        return traverseIf(n, scope);
      case WHILE:
        return traverseWhile(n, scope);
      case DO:
        return traverseDo(n, scope);
      case FOR:
        return traverseFor(n, scope);
      case FOREACH:
        return traverseForeach(n, scope);
      case SWITCH:
        return traverseSwitch(n, scope);
      case TRY:
        return traverseTry(n, scope);
      case UNSET:
        return traverseUnset(n, scope);
      case GLOBAL:
        for (Node var : n.children()) {
          scope = scope.bind(var.getString());
        }
        return scope;
      case STATIC:
        return traverseStaticVars(n, scope);
      case FUNCTION:
      case CLASS:
      case EMPTY:
        // Declarations are separate bodies.
        return scope;
      default:
        return traverse(n, scope);
    }
  }

  private VariableFlowScope traverseIf(Node n, VariableFlowScope scope) {
    Node thenBranch = n.getSecondChild();
    Node elseBranch = thenBranch.getNext();
    ConditionOutcome outcome = traverseCondition(n.getFirstChild(), scope);
    VariableFlowScope thenScope = traverseStatement(thenBranch, outcome.whenTrue);
    VariableFlowScope elseScope =
        elseBranch == null ? outcome.whenFalse : traverseStatement(elseBranch, outcome.whenFalse);
    return VariableFlowScope.join(thenScope, elseScope);
  }

  private VariableFlowScope traverseWhile(Node n, VariableFlowScope scope) {
    Node cond = n.getFirstChild();
    ConditionOutcome outcome = traverseCondition(cond, scope);
    JumpTarget target = traverseLoopBody(n, n.getLastChild(), outcome.whenTrue);
    VariableFlowScope exit =
        NodeUtil.isLiteralTrue(cond) ? outcome.whenFalse.unreachable() : outcome.whenFalse;
    return target.joinBreaks(exit);
  }

  private VariableFlowScope traverseDo(Node n, VariableFlowScope scope) {
    Node cond = n.getLastChild();
    JumpTarget target = new JumpTarget(n);
    jumpTargets.push(target);
    VariableFlowScope bodyScope = traverseStatement(n.getFirstChild(), scope);
    jumpTargets.pop();
    ConditionOutcome outcome = traverseCondition(cond, target.joinContinues(bodyScope));
    VariableFlowScope exit =
        NodeUtil.isLiteralTrue(cond) ? outcome.whenFalse.unreachable() : outcome.whenFalse;
    return target.joinBreaks(exit);
  }

  private VariableFlowScope traverseFor(Node n, VariableFlowScope scope) {
    Node init = n.getFirstChild();
    Node conds = init.getNext();
    Node step = conds.getNext();
    scope = traverseChildren(init, scope);

    ConditionOutcome outcome;
    boolean infinite;
    if (!conds.hasChildren()) {
      outcome = new ConditionOutcome(scope, scope.unreachable());
      infinite = true;
    } else {
      // Only the last expression of the condition list decides whether the loop runs.
      Node last = conds.getLastChild();
      for (Node cond = conds.getFirstChild(); cond != last; cond = cond.getNext()) {
        scope = traverse(cond, scope);
      }
      outcome = traverseCondition(last, scope);
      infinite = NodeUtil.isLiteralTrue(last);
    }

    JumpTarget target = traverseLoopBody(n, n.getLastChild(), outcome.whenTrue);
    traverseChildren(step, target.joinContinues(target.bodyExit));
    return target.joinBreaks(infinite ? outcome.whenFalse.unreachable() : outcome.whenFalse);
  }

  private VariableFlowScope traverseForeach(Node n, VariableFlowScope scope) {
    Node subject = n.getFirstChild();
    Node key = subject.getNext();
    Node value = key.getNext();
    VariableFlowScope afterSubject = traverse(subject, scope);

    VariableFlowScope bodyEntry = afterSubject;
    if (!key.isEmpty()) {
      bodyEntry = bindTarget(key, traverseTargetReads(key, bodyEntry));
    }
    bodyEntry = bindTarget(value, traverseTargetReads(value, bodyEntry));

    // The loop may run zero times, so nothing bound by the key, value or body survives it.
    JumpTarget target = traverseLoopBody(n, n.getLastChild(), bodyEntry);
    return target.joinBreaks(afterSubject);
  }

  private JumpTarget traverseLoopBody(Node loop, Node body, VariableFlowScope entry) {
    JumpTarget target = new JumpTarget(loop);
    jumpTargets.push(target);
    target.bodyExit = traverseStatement(body, entry);
    jumpTargets.pop();
    return target;
  }

  private VariableFlowScope traverseSwitch(Node n, VariableFlowScope scope) {
    Node subject = n.getFirstChild();
    VariableFlowScope tested = traverse(subject, scope);
    VariableFlowScope fallthrough = tested.unreachable();
    boolean hasDefault = false;

    JumpTarget target = new JumpTarget(n);
    jumpTargets.push(target);
    for (Node c = subject.getNext(); c != null; c = c.getNext()) {
      Node body;
      if (c.isCase()) {
        tested = traverse(c.getFirstChild(), tested);
        body = c.getLastChild();
      } else {
        checkState(c.isDefaultCase(), c);
        hasDefault = true;
        body = c.getFirstChild();
      }
      // A case is entered by matching it or by falling off the end of the previous one.
      fallthrough = traverseStatement(body, VariableFlowScope.join(fallthrough, tested));
    }
    jumpTargets.pop();

    // Without a default, a value matching no case skips every body.
    VariableFlowScope exit =
        hasDefault ? fallthrough : VariableFlowScope.join(fallthrough, tested);
    return target.joinBreaks(exit);
  }

  private VariableFlowScope traverseTry(Node n, VariableFlowScope scope) {
    Node tryBlock = n.getFirstChild();
    Node catches = tryBlock.getNext();
    Node finallyBlock = catches.getNext();

    List<VariableFlowScope> exits = new ArrayList<>();
    exits.add(traverseStatement(tryBlock, scope));
    // An exception may be thrown before any statement of the try block completes.
    for (Node catchNode : catches.children()) {
      Node var = catchNode.getFirstChild();
      VariableFlowScope catchEntry = var.isVariable() ? scope.bind(var.getString()) : scope;
      exits.add(traverseStatement(catchNode.getLastChild(), catchEntry));
    }
    VariableFlowScope joined = VariableFlowScope.join(exits);
    if (finallyBlock == null) {
      return joined;
    }
    if (!joined.isReachable()) {
      // The finally block still runs, on the way out of a return or throw.
      traverseStatement(finallyBlock, scope);
      return joined;
    }
    return traverseStatement(finallyBlock, joined);
  }

  private VariableFlowScope traverseJump(Node n, VariableFlowScope scope, boolean isContinue) {
    JumpTarget target = findJumpTarget(n);
    if (target != null) {
      // continue inside a switch behaves like break.
      if (isContinue && target.node.getToken() != Token.SWITCH) {
        target.continues.add(scope);
      } else {
        target.breaks.add(scope);
      }
    }
    return scope.unreachable();
  }

  private @Nullable JumpTarget findJumpTarget(Node jump) {
    int levels = 1;
    if (jump.hasChildren() && jump.getFirstChild().isNumber()) {
      Integer parsed = Ints.tryParse(jump.getFirstChild().getString());
      levels = parsed != null && parsed > 0 ? parsed : 1;
    }
    Iterator<JumpTarget> it = jumpTargets.iterator();
    for (int i = 1; it.hasNext(); i++) {
      JumpTarget target = it.next();
      if (i == levels) {
        return target;
      }
    }
    // A jump out of more statements than enclose it is a fatal error at runtime.
    return null;
  }

  private VariableFlowScope traverseUnset(Node n, VariableFlowScope scope) {
    for (Node target : n.children()) {
      if (target.isVariable()) {
        scope = scope.unbind(target.getString());
      } else {
        scope = traverseGuarded(target, scope);
      }
    }
    return scope;
  }

  private VariableFlowScope traverseStaticVars(Node n, VariableFlowScope scope) {
    for (Node item : n.children()) {
      if (item.isVariable()) {
        scope = scope.bind(item.getString());
      } else {
        scope = traverse(item.getLastChild(), scope).bind(item.getFirstChild().getString());
      }
    }
    return scope;
  }

  /** Walks the children of n in order, as operands evaluated left to right. */
  private VariableFlowScope traverseChildren(Node n, VariableFlowScope scope) {
    for (Node child = n.getFirstChild(); child != null; child = child.getNext()) {
      scope = traverse(child, scope);
    }
    return scope;
  }

  /** Walks an expression and returns the scope after it is evaluated. */
  private VariableFlowScope traverse(Node n, VariableFlowScope scope) {
    if (!scope.isReachable()) {
      return scope;
    }
    switch (n.getToken()) {
      case VARIABLE:
        readChecker.checkRead(n, scope);
        return scope;
      case ASSIGN:
        return traverseAssign(n, scope);
      case ASSIGN_REF:
        return traverseAssignRef(n, scope);
      case ASSIGN_COALESCE:
        return traverseCoalesceAssign(n, scope);
      case INC:
      case DEC:
        return traverseReadModifyWrite(n.getFirstChild(), null, scope);
      case AND:
      case OR:
      case NOT:
      case ISSET:
      case IS_EMPTY:
        return traverseCondition(n, scope).join();
      case HOOK:
        return traverseHook(n, scope);
      case COALESCE:
        return traverseCoalesce(n, scope);
      case CALL:
        return traverseCall(n, scope);
      case CLOSURE:
        return traverseClosure(n, scope);
      case ARROW_FUNCTION:
        return traverseArrowFunction(n, scope);
      case EXIT:
      case THROW:
        return traverseChildren(n, scope).unreachable();
      case FUNCTION:
      case CLASS:
        return scope;
      default:
        if (n.getToken().isCompoundAssignmentOp()) {
          return traverseReadModifyWrite(n.getFirstChild(), n.getLastChild(), scope);
        }
        return traverseChildren(n, scope);
    }
  }

  /**
   * Walks an assignment. The value is evaluated first, then the index expressions of the target;
   * the target's variables are bound only once both are done.
   */
  private VariableFlowScope traverseAssign(Node n, VariableFlowScope scope) {
    Node target = n.getFirstChild();
    scope = traverse(target.getNext(), scope);
    scope = traverseTargetReads(target, scope);
    return bindTarget(target, scope);
  }

  private VariableFlowScope traverseAssignRef(Node n, VariableFlowScope scope) {
    Node target = n.getFirstChild();
    Node source = n.getLastChild();
    // Taking a reference creates the source variable if needed.
    if (NodeUtil.getWrittenVariable(source) != null) {
      scope = bindTarget(source, traverseTargetReads(source, scope));
    } else {
      scope = traverse(source, scope);
    }
    scope = traverseTargetReads(target, scope);
    return bindTarget(target, scope);
  }

  /**
   * Walks {@code $x op= value}, {@code $x++} and the like. The current value of the target is read
   * after the value operand is evaluated.
   */
  private VariableFlowScope traverseReadModifyWrite(
      Node target, @Nullable Node value, VariableFlowScope scope) {
    if (value != null) {
      scope = traverse(value, scope);
    }
    scope = traverseTargetReads(target, scope);
    Node written = NodeUtil.getWrittenVariable(target);
    if (written != null) {
      readChecker.checkRead(written, scope);
    }
    return bindTarget(target, scope);
  }

  /** {@code $x ??= value} reads $x under a guard and evaluates the value only sometimes. */
  private VariableFlowScope traverseCoalesceAssign(Node n, VariableFlowScope scope) {
    Node target = n.getFirstChild();
    VariableFlowScope afterTarget = traverseTargetReads(target, scope);
    VariableFlowScope afterValue = traverse(target.getNext(), afterTarget);
    return bindTarget(target, VariableFlowScope.join(afterTarget, afterValue));
  }

  /**
   * Walks the parts of an assignment target that are evaluated as reads: indexes, property bases
   * and destructuring keys. The variables the target writes are not read.
   */
  private VariableFlowScope traverseTargetReads(Node target, VariableFlowScope scope) {
    switch (target.getToken()) {
      case VARIABLE:
      case EMPTY:
        return scope;
      case GETELEM:
        {
          Node base = target.getFirstChild();
          scope =
              base.isVariable() || base.isGetElem() || base.isGetProp()
                  ? traverseTargetReads(base, scope)
                  : traverse(base, scope);
          return traverse(base.getNext(), scope);
        }
      case GETPROP:
        // Writing a property reads the object.
        return traverse(target.getFirstChild(), scope);
      case LIST:
      case ARRAY_PATTERN:
        for (Node item : target.children()) {
          if (!item.isArrayItem()) {
            continue;
          }
          if (item.getChildCount() == 2) {
            scope = traverse(item.getFirstChild(), scope);
          }
          scope = traverseTargetReads(item.getLastChild(), scope);
        }
        return scope;
      default:
        return traverse(target, scope);
    }
  }

  private VariableFlowScope bindTarget(Node target, VariableFlowScope scope) {
    List<Node> written = new ArrayList<>();
    NodeUtil.visitAssignedVariables(target, written::add);
    for (Node var : written) {
      scope = scope.bind(var.getString());
    }
    return scope;
  }

  /**
   * Walks an operand that is only inspected, never required: the argument of {@code isset} or
   * {@code empty}, or the left side of {@code ??}. The base variable is a guarded read; indexes are
   * ordinary reads.
   */
  private VariableFlowScope traverseGuarded(Node n, VariableFlowScope scope) {
    if (!scope.isReachable()) {
      return scope;
    }
    switch (n.getToken()) {
      case VARIABLE:
        readChecker.checkGuardedRead(n, scope);
        return scope;
      case GETELEM:
        scope = traverseGuarded(n.getFirstChild(), scope);
        return traverse(n.getLastChild(), scope);
      case GETPROP:
        return traverseGuarded(n.getFirstChild(), scope);
      default:
        return traverse(n, scope);
    }
  }

  private VariableFlowScope traverseCoalesce(Node n, VariableFlowScope scope) {
    VariableFlowScope left = traverseGuarded(n.getFirstChild(), scope);
    VariableFlowScope right = traverse(n.getLastChild(), left);
    return VariableFlowScope.join(left, right);
  }

  private VariableFlowScope traverseHook(Node n, VariableFlowScope scope) {
    Node thenValue = n.getSecondChild();
    ConditionOutcome outcome = traverseCondition(n.getFirstChild(), scope);
    // The short form a ?: b yields the condition itself when it is truthy.
    VariableFlowScope thenScope =
        thenValue.isEmpty() ? outcome.whenTrue : traverse(thenValue, outcome.whenTrue);
    VariableFlowScope elseScope = traverse(n.getLastChild(), outcome.whenFalse);
    return VariableFlowScope.join(thenScope, elseScope);
  }

  /**
   * Walks a condition, producing the scopes in which it evaluated truthy and falsy. Short-circuit
   * operators and negation are followed; {@code isset} and {@code empty} refine their operands.
   */
  private ConditionOutcome traverseCondition(Node n, VariableFlowScope scope) {
    if (!scope.isReachable()) {
      return new ConditionOutcome(scope, scope);
    }
    switch (n.getToken()) {
      case AND:
        {
          ConditionOutcome left = traverseCondition(n.getFirstChild(), scope);
          ConditionOutcome right = traverseCondition(n.getLastChild(), left.whenTrue);
          return new ConditionOutcome(
              right.whenTrue, VariableFlowScope.join(left.whenFalse, right.whenFalse));
        }
      case OR:
        {
          ConditionOutcome left = traverseCondition(n.getFirstChild(), scope);
          ConditionOutcome right = traverseCondition(n.getLastChild(), left.whenFalse);
          return new ConditionOutcome(
              VariableFlowScope.join(left.whenTrue, right.whenTrue), right.whenFalse);
        }
      case NOT:
        return traverseCondition(n.getFirstChild(), scope).negate();
      case ISSET:
        {
          VariableFlowScope after = scope;
          for (Node operand : n.children()) {
            after = traverseGuarded(operand, after);
          }
          return new ConditionOutcome(refine(n, after), after);
        }
      case IS_EMPTY:
        {
          VariableFlowScope after = traverseGuarded(n.getFirstChild(), scope);
          return new ConditionOutcome(after, refine(n, after));
        }
      default:
        {
          VariableFlowScope after = traverse(n, scope);
          return new ConditionOutcome(after, after);
        }
    }
  }

  /** Binds the variables a passing isset or failing empty proves to be set. */
  private static VariableFlowScope refine(Node guard, VariableFlowScope scope) {
    for (Node operand : guard.children()) {
      Node var = NodeUtil.getGuardedVariable(operand);
      if (var != null && scope.isAssignedAnywhere(var.getString())) {
        scope = scope.bind(var.getString());
      }
    }
    return scope;
  }

  private VariableFlowScope traverseCall(Node n, VariableFlowScope scope) {
    Node callee = n.getFirstChild();
    String functionName = NodeUtil.getCalledFunctionName(n);
    if (functionName == null) {
      scope = traverse(callee, scope);
    }
    ImmutableSet<Integer> outputPositions =
        functionName == null
            ? ImmutableSet.of()
            : referenceOutputs.getPositions(functionName);

    List<Node> outputs = new ArrayList<>();
    int position = 0;
    for (Node arg = callee.getNext(); arg != null; arg = arg.getNext(), position++) {
      if (arg.isVariable() && outputPositions.contains(position)) {
        outputs.add(arg);
      } else {
        scope = traverse(arg, scope);
      }
    }
    for (Node output : outputs) {
      scope = scope.bind(output.getString());
    }
    if (functionName != null && options.isResponseHeaderFunction(functionName)) {
      scope = scope.withResponseHeaderAvailable();
    }
    return scope;
  }

  /** The closure body is its own unit; here only the use clause touches the outer scope. */
  private VariableFlowScope traverseClosure(Node n, VariableFlowScope scope) {
    for (Node use : NodeUtil.getClosureUses(n).children()) {
      if (use.isByReference()) {
        scope = scope.bind(use.getString());
      } else {
        readChecker.checkRead(use, scope);
      }
    }
    return scope;
  }

  /**
   * Arrow functions capture the enclosing scope by value when they are created, so the body is
   * checked inline against it. Nothing the body binds is visible outside.
   */
  private VariableFlowScope traverseArrowFunction(Node n, VariableFlowScope scope) {
    Node params = NodeUtil.getParameters(n);
    VariableFlowScope inner = n.isStaticMember() ? scope.withoutThis() : scope;
    for (Node param : params.children()) {
      if (param.getToken() == Token.DEFAULT_VALUE) {
        inner = traverse(param.getLastChild(), inner);
      }
    }
    for (String name : NodeUtil.getParameterNames(params)) {
      inner = inner.bind(name);
    }
    traverse(params.getNext(), inner);
    return scope;
  }

  /** The scopes after a condition, split by its boolean value. */
  private static final class ConditionOutcome {
    final VariableFlowScope whenTrue;
    final VariableFlowScope whenFalse;

    ConditionOutcome(VariableFlowScope whenTrue, VariableFlowScope whenFalse) {
      this.whenTrue = whenTrue;
      this.whenFalse = whenFalse;
    }

    ConditionOutcome negate() {
      return new ConditionOutcome(whenFalse, whenTrue);
    }

    VariableFlowScope join() {
      return VariableFlowScope.join(whenTrue, whenFalse);
    }
  }

  /** A loop or switch that break and continue statements can leave. */
  private static final class JumpTarget {
    final Node node;
    final List<VariableFlowScope> breaks = new ArrayList<>();
    final List<VariableFlowScope> continues = new ArrayList<>();

    /** The scope at the end of a loop body, once walked. */
    @Nullable VariableFlowScope bodyExit;

    JumpTarget(Node node) {
      this.node = node;
    }

    VariableFlowScope joinBreaks(VariableFlowScope exit) {
      return joinWith(exit, breaks);
    }

    VariableFlowScope joinContinues(VariableFlowScope bodyEnd) {
      return joinWith(bodyEnd, continues);
    }

    private static VariableFlowScope joinWith(
        VariableFlowScope first, List<VariableFlowScope> rest) {
      if (rest.isEmpty()) {
        return first;
      }
      List<VariableFlowScope> all = new ArrayList<>(rest.size() + 1);
      all.add(first);
      all.addAll(rest);
      return VariableFlowScope.join(all);
    }
  }
}
