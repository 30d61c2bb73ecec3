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

package com.phpcheck.ast;

import static com.google.common.base.Preconditions.checkArgument;
import static com.google.common.base.Preconditions.checkState;

import java.util.List;
import org.jspecify.annotations.Nullable;

/** An AST construction helper class. */
public class IR {

  private IR() {}

  public static Node empty() {
    return new Node(Token.EMPTY);
  }

  public static Node root(Node... scripts) {
    Node root = new Node(Token.ROOT);
    for (Node script : scripts) {
      checkState(script.isScript(), script);
      root.addChildToBack(script);
    }
    return root;
  }

  public static Node script(String sourceName, Node... stmts) {
    Node script = Node.newString(Token.SCRIPT, sourceName);
    for (Node stmt : stmts) {
      checkState(mayBeStatement(stmt), stmt);
      script.addChildToBack(stmt);
    }
    return script;
  }

  public static Node block(Node... stmts) {
    Node block = new Node(Token.BLOCK);
    for (Node stmt : stmts) {
      checkState(mayBeStatement(stmt), stmt);
      block.addChildToBack(stmt);
    }
    return block;
  }

  public static Node block(List<Node> stmts) {
    return block(stmts.toArray(new Node[0]));
  }

  public static Node exprResult(Node expr) {
    checkState(mayBeExpression(expr), expr);
    return new Node(Token.EXPR_RESULT, expr);
  }

  public static Node echo(Node... exprs) {
    checkArgument(exprs.length > 0, "echo needs at least one expression");
    Node echo = new Node(Token.ECHO);
    for (Node expr : exprs) {
      checkState(mayBeExpression(expr), expr);
      echo.addChildToBack(expr);
    }
    return echo;
  }

  public static Node returnNode() {
    return new Node(Token.RETURN);
  }

  public static Node returnNode(Node expr) {
    checkState(mayBeExpression(expr), expr);
    return new Node(Token.RETURN, expr);
  }

  public static Node throwNode(Node expr) {
    checkState(mayBeExpression(expr), expr);
    return new Node(Token.THROW, expr);
  }

  public static Node breakNode() {
    return new Node(Token.BREAK);
  }

  /** A {@code break N;} statement. */
  public static Node breakNode(int levels) {
    checkArgument(levels > 0, levels);
    return new Node(Token.BREAK, number(levels));
  }

  public static Node continueNode() {
    return new Node(Token.CONTINUE);
  }

  /** A {@code continue N;} statement. */
  public static Node continueNode(int levels) {
    checkArgument(levels > 0, levels);
    return new Node(Token.CONTINUE, number(levels));
  }

  public static Node ifNode(Node cond, Node then) {
    checkState(mayBeExpression(cond), cond);
    checkState(then.isBlock(), then);
    return new Node(Token.IF, cond, then);
  }

  /** An if with an else, where {@code elseNode} is a BLOCK or, for elseif, another IF. */
  public static Node ifNode(Node cond, Node then, Node elseNode) {
    checkState(mayBeExpression(cond), cond);
    checkState(then.isBlock(), then);
    checkState(elseNode.isBlock() || elseNode.getToken() == Token.IF, elseNode);
    return new Node(Token.IF, cond, then, elseNode);
  }

  public static Node whileNode(Node cond, Node body) {
    checkState(mayBeExpression(cond), cond);
    checkState(body.isBlock(), body);
    return new Node(Token.WHILE, cond, body);
  }

  public static Node doNode(Node body, Node cond) {
    checkState(body.isBlock(), body);
    checkState(mayBeExpression(cond), cond);
    return new Node(Token.DO, body, cond);
  }

  public static Node exprList(Node... exprs) {
    Node list = new Node(Token.EXPR_LIST);
    for (Node expr : exprs) {
      checkState(mayBeExpression(expr), expr);
      list.addChildToBack(expr);
    }
    return list;
  }

  public static Node forNode(Node init, Node cond, Node step, Node body) {
    checkState(init.getToken() == Token.EXPR_LIST, init);
    checkState(cond.getToken() == Token.EXPR_LIST, cond);
    checkState(step.getToken() == Token.EXPR_LIST, step);
    checkState(body.isBlock(), body);
    return new Node(Token.FOR, init, cond, step, body);
  }

  public static Node foreach(Node subject, Node value, Node body) {
    return foreach(subject, empty(), value, body);
  }

  public static Node foreach(Node subject, Node key, Node value, Node body) {
    checkState(mayBeExpression(subject), subject);
    checkState(key.isEmpty() || mayBeAssignmentTarget(key), key);
    checkState(mayBeAssignmentTarget(value), value);
    checkState(body.isBlock(), body);
    return new Node(Token.FOREACH, subject, key, value, body);
  }

  public static Node switchNode(Node subject, Node... cases) {
    checkState(mayBeExpression(subject), subject);
    Node switchNode = new Node(Token.SWITCH, subject);
    for (Node caseNode : cases) {
      checkState(caseNode.isCase() || caseNode.isDefaultCase(), caseNode);
      switchNode.addChildToBack(caseNode);
    }
    return switchNode;
  }

  public static Node caseNode(Node expr, Node body) {
    checkState(mayBeExpression(expr), expr);
    checkState(body.isBlock(), body);
    return new Node(Token.CASE, expr, body);
  }

  public static Node defaultCase(Node body) {
    checkState(body.isBlock(), body);
    return new Node(Token.DEFAULT_CASE, body);
  }

  public static Node tryCatch(Node tryBody, Node... catches) {
    return tryCatchFinally(tryBody, List.of(catches), null);
  }

  public static Node tryFinally(Node tryBody, Node finallyBody) {
    return tryCatchFinally(tryBody, List.of(), finallyBody);
  }

  public static Node tryCatchFinally(
      Node tryBody, List<Node> catches, @Nullable Node finallyBody) {
    checkState(tryBody.isBlock(), tryBody);
    Node catchBlock = new Node(Token.BLOCK);
    for (Node catchNode : catches) {
      checkState(catchNode.isCatch(), catchNode);
      catchBlock.addChildToBack(catchNode);
    }
    Node tryNode = new Node(Token.TRY, tryBody, catchBlock);
    if (finallyBody != null) {
      checkState(finallyBody.isBlock(), finallyBody);
      tryNode.addChildToBack(finallyBody);
    }
    return tryNode;
  }

  public static Node catchNode(Node var, Node body) {
    checkState(var.isVariable() || var.isEmpty(), var);
    checkState(body.isBlock(), body);
    return new Node(Token.CATCH, var, body);
  }

  /** A catch clause without a bound variable, as in {@code catch (Exception)}. */
  public static Node catchNode(Node body) {
    return catchNode(empty(), body);
  }

  public static Node unset(Node... targets) {
    checkArgument(targets.length > 0, "unset needs at least one target");
    Node unset = new Node(Token.UNSET);
    for (Node target : targets) {
      checkState(mayBeExpression(target), target);
      unset.addChildToBack(target);
    }
    return unset;
  }

  public static Node global(Node... vars) {
    Node global = new Node(Token.GLOBAL);
    for (Node var : vars) {
      checkState(var.isVariable(), var);
      global.addChildToBack(var);
    }
    return global;
  }

  /** A {@code static $a, $b = 1;} declaration; each item is a VARIABLE or an ASSIGN to one. */
  public static Node staticVars(Node... items) {
    Node staticNode = new Node(Token.STATIC);
    for (Node item : items) {
      checkState(
          item.isVariable()
              || (item.getToken() == Token.ASSIGN && item.getFirstChild().isVariable()),
          item);
      staticNode.addChildToBack(item);
    }
    return staticNode;
  }

  public static Node function(String name, Node params, Node body) {
    checkState(params.isParamList(), params);
    checkState(body.isBlock(), body);
    return new Node(Token.FUNCTION, name(name), params, body);
  }

  public static Node method(String name, Node params, Node body) {
    checkState(params.isParamList(), params);
    checkState(body.isBlock() || body.isEmpty(), body);
    return new Node(Token.METHOD, name(name), params, body);
  }

  public static Node staticMethod(String name, Node params, Node body) {
    return method(name, params, body).putBooleanProp(Node.Prop.STATIC_MEMBER, true);
  }

  public static Node abstractMethod(String name, Node params) {
    return method(name, params, empty());
  }

  public static Node classNode(String name, Node... methods) {
    Node members = new Node(Token.CLASS_MEMBERS);
    for (Node method : methods) {
      checkState(method.getToken() == Token.METHOD, method);
      members.addChildToBack(method);
    }
    return new Node(Token.CLASS, name(name), members);
  }

  public static Node paramList(Node... params) {
    Node paramList = new Node(Token.PARAM_LIST);
    for (Node param : params) {
      checkState(param.isVariable() || param.getToken() == Token.DEFAULT_VALUE, param);
      paramList.addChildToBack(param);
    }
    return paramList;
  }

  /** A parameter list of plain by-value parameters. */
  public static Node paramNames(String... names) {
    Node paramList = new Node(Token.PARAM_LIST);
    for (String name : names) {
      paramList.addChildToBack(var(name));
    }
    return paramList;
  }

  public static Node defaultParam(String name, Node value) {
    checkState(mayBeExpression(value), value);
    return new Node(Token.DEFAULT_VALUE, var(name), value);
  }

  public static Node closure(Node params, Node uses, Node body) {
    checkState(params.isParamList(), params);
    checkState(uses.getToken() == Token.USE_LIST, uses);
    checkState(body.isBlock(), body);
    return new Node(Token.CLOSURE, params, uses, body);
  }

  public static Node staticClosure(Node params, Node uses, Node body) {
    return closure(params, uses, body).putBooleanProp(Node.Prop.STATIC_MEMBER, true);
  }

  public static Node useList(Node... vars) {
    Node uses = new Node(Token.USE_LIST);
    for (Node var : vars) {
      checkState(var.isVariable(), var);
      uses.addChildToBack(var);
    }
    return uses;
  }

  public static Node arrowFunction(Node params, Node body) {
    checkState(params.isParamList(), params);
    checkState(mayBeExpression(body), body);
    return new Node(Token.ARROW_FUNCTION, params, body);
  }

  /** Marks a parameter, closure use or foreach value as taken by reference. */
  public static Node byRef(Node var) {
    checkState(var.isVariable() || var.isDestructuringPattern(), var);
    return var.putBooleanProp(Node.Prop.BY_REFERENCE, true);
  }

  public static Node var(String name) {
    checkArgument(!name.startsWith("$"), "variable names are stored without the sigil: %s", name);
    return Node.newString(Token.VARIABLE, name);
  }

  public static Node thisVar() {
    return var("this");
  }

  public static Node name(String name) {
    return Node.newString(Token.NAME, name);
  }

  public static Node string(String value) {
    return Node.newString(Token.STRINGLIT, value);
  }

  public static Node number(long value) {
    return Node.newString(Token.NUMBER, String.valueOf(value));
  }

  public static Node trueNode() {
    return new Node(Token.TRUE);
  }

  public static Node nullNode() {
    return new Node(Token.NULL);
  }

  public static Node interpolated(Node... parts) {
    Node str = new Node(Token.INTERPOLATED_STRING);
    for (Node part : parts) {
      checkState(mayBeExpression(part), part);
      str.addChildToBack(part);
    }
    return str;
  }

  public static Node arrayLit(Node... items) {
    Node array = new Node(Token.ARRAYLIT);
    for (Node item : items) {
      checkState(item.isArrayItem() || item.getToken() == Token.SPREAD, item);
      array.addChildToBack(item);
    }
    return array;
  }

  public static Node arrayItem(Node value) {
    return new Node(Token.ARRAY_ITEM, value);
  }

  public static Node arrayItem(Node key, Node value) {
    checkState(mayBeExpression(key), key);
    return new Node(Token.ARRAY_ITEM, key, value);
  }

  public static Node spread(Node expr) {
    checkState(mayBeExpression(expr), expr);
    return new Node(Token.SPREAD, expr);
  }

  /** A {@code list(...)} destructuring pattern. Bare targets are wrapped in ARRAY_ITEMs. */
  public static Node list(Node... items) {
    return pattern(Token.LIST, items);
  }

  /** A short {@code [...]} destructuring pattern. Bare targets are wrapped in ARRAY_ITEMs. */
  public static Node arrayPattern(Node... items) {
    return pattern(Token.ARRAY_PATTERN, items);
  }

  private static Node pattern(Token token, Node... items) {
    Node pattern = new Node(token);
    for (Node item : items) {
      if (item.isEmpty() || item.isArrayItem()) {
        pattern.addChildToBack(item);
      } else {
        checkState(mayBeAssignmentTarget(item), item);
        pattern.addChildToBack(arrayItem(item));
      }
    }
    return pattern;
  }

  public static Node assign(Node target, Node value) {
    checkState(mayBeAssignmentTarget(target), target);
    checkState(mayBeExpression(value), value);
    return new Node(Token.ASSIGN, target, value);
  }

  public static Node assignRef(Node target, Node value) {
    checkState(mayBeAssignmentTarget(target), target);
    checkState(mayBeExpression(value), value);
    return new Node(Token.ASSIGN_REF, target, value);
  }

  /** A compound assignment such as {@code $a .= $b} or {@code $a ??= $b}. */
  public static Node assignOp(Token op, Node target, Node value) {
    checkArgument(op.isCompoundAssignmentOp(), op);
    checkState(mayBeAssignmentTarget(target), target);
    checkState(mayBeExpression(value), value);
    return new Node(op, target, value);
  }

  public static Node inc(Node target) {
    checkState(mayBeAssignmentTarget(target), target);
    return new Node(Token.INC, target);
  }

  public static Node dec(Node target) {
    checkState(mayBeAssignmentTarget(target), target);
    return new Node(Token.DEC, target);
  }

  public static Node binaryOp(Token op, Node left, Node right) {
    checkState(mayBeExpression(left), left);
    checkState(mayBeExpression(right), right);
    return new Node(op, left, right);
  }

  public static Node and(Node left, Node right) {
    return binaryOp(Token.AND, left, right);
  }

  public static Node or(Node left, Node right) {
    return binaryOp(Token.OR, left, right);
  }

  public static Node coalesce(Node left, Node right) {
    return binaryOp(Token.COALESCE, left, right);
  }

  public static Node add(Node left, Node right) {
    return binaryOp(Token.ADD, left, right);
  }

  public static Node lt(Node left, Node right) {
    return binaryOp(Token.LT, left, right);
  }

  public static Node hook(Node cond, Node thenValue, Node elseValue) {
    checkState(mayBeExpression(cond), cond);
    checkState(mayBeExpression(thenValue), thenValue);
    checkState(mayBeExpression(elseValue), elseValue);
    return new Node(Token.HOOK, cond, thenValue, elseValue);
  }

  /** The short ternary {@code $a ?: $b}. */
  public static Node shortHook(Node cond, Node elseValue) {
    checkState(mayBeExpression(cond), cond);
    checkState(mayBeExpression(elseValue), elseValue);
    return new Node(Token.HOOK, cond, empty(), elseValue);
  }

  public static Node not(Node expr) {
    checkState(mayBeExpression(expr), expr);
    return new Node(Token.NOT, expr);
  }

  public static Node cast(Node expr) {
    checkState(mayBeExpression(expr), expr);
    return new Node(Token.CAST, expr);
  }

  public static Node silence(Node expr) {
    checkState(mayBeExpression(expr), expr);
    return new Node(Token.SILENCE, expr);
  }

  public static Node instanceOf(Node expr, String className) {
    checkState(mayBeExpression(expr), expr);
    return new Node(Token.INSTANCEOF, expr, name(className));
  }

  public static Node isset(Node... exprs) {
    checkArgument(exprs.length > 0, "isset needs at least one argument");
    Node isset = new Node(Token.ISSET);
    for (Node expr : exprs) {
      checkState(mayBeExpression(expr), expr);
      isset.addChildToBack(expr);
    }
    return isset;
  }

  public static Node isEmpty(Node expr) {
    checkState(mayBeExpression(expr), expr);
    return new Node(Token.IS_EMPTY, expr);
  }

  /** A call to a function referenced by name. */
  public static Node call(String functionName, Node... args) {
    return call(name(functionName), args);
  }

  public static Node call(Node callee, Node... args) {
    checkState(callee.isName() || mayBeExpression(callee), callee);
    Node call = new Node(Token.CALL, callee);
    for (Node arg : args) {
      checkState(mayBeExpression(arg) || arg.getToken() == Token.SPREAD, arg);
      call.addChildToBack(arg);
    }
    return call;
  }

  public static Node methodCall(Node target, String methodName, Node... args) {
    return call(getprop(target, methodName), args);
  }

  public static Node staticCall(String className, String methodName, Node... args) {
    return call(staticMember(className, methodName), args);
  }

  public static Node newNode(String className, Node... args) {
    Node newNode = new Node(Token.NEW, name(className));
    for (Node arg : args) {
      checkState(mayBeExpression(arg), arg);
      newNode.addChildToBack(arg);
    }
    return newNode;
  }

  public static Node getelem(Node target, Node index) {
    checkState(mayBeExpression(target), target);
    checkState(mayBeExpression(index), index);
    return new Node(Token.GETELEM, target, index);
  }

  /** The append form {@code $a[]}, only valid as an assignment target. */
  public static Node getelem(Node target) {
    checkState(mayBeExpression(target), target);
    return new Node(Token.GETELEM, target, empty());
  }

  public static Node getprop(Node target, String prop) {
    checkState(mayBeExpression(target), target);
    return new Node(Token.GETPROP, target, name(prop));
  }

  public static Node staticMember(String className, String member) {
    return new Node(Token.STATIC_MEMBER, name(className), name(member));
  }

  public static Node exit() {
    return new Node(Token.EXIT);
  }

  public static Node exit(Node status) {
    checkState(mayBeExpression(status), status);
    return new Node(Token.EXIT, status);
  }

  private static boolean mayBeStatement(Node n) {
    switch (n.getToken()) {
      case BLOCK:
      case EXPR_RESULT:
      case ECHO:
      case RETURN:
      case THROW:
      case BREAK:
      case CONTINUE:
      case IF:
      case WHILE:
      case DO:
      case FOR:
      case FOREACH:
      case SWITCH:
      case TRY:
      case UNSET:
      case GLOBAL:
      case STATIC:
      case EMPTY:
      case FUNCTION:
      case CLASS:
        return true;
      default:
        return false;
    }
  }

  private static boolean mayBeAssignmentTarget(Node n) {
    switch (n.getToken()) {
      case VARIABLE:
      case GETELEM:
      case GETPROP:
      case STATIC_MEMBER:
      case LIST:
      case ARRAY_PATTERN:
        return true;
      default:
        return false;
    }
  }

  private static boolean mayBeExpression(Node n) {
    switch (n.getToken()) {
      case ROOT:
      case SCRIPT:
      case BLOCK:
      case EXPR_RESULT:
      case ECHO:
      case RETURN:
      case BREAK:
      case CONTINUE:
      case IF:
      case WHILE:
      case DO:
      case FOR:
      case EXPR_LIST:
      case FOREACH:
      case SWITCH:
      case CASE:
      case DEFAULT_CASE:
      case TRY:
      case CATCH:
      case UNSET:
      case GLOBAL:
      case STATIC:
      case EMPTY:
      case FUNCTION:
      case CLASS:
      case CLASS_MEMBERS:
      case METHOD:
      case PARAM_LIST:
      case DEFAULT_VALUE:
      case USE_LIST:
      case ARRAY_ITEM:
      case SPREAD:
      case LIST:
      case ARRAY_PATTERN:
        return false;
      default:
        return true;
    }
  }
}
