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

/**
 * The kinds of nodes in a PHP syntax tree.
 *
 * <p>Only the distinctions that matter to flow analysis are modeled; anything else an upstream
 * parser produces can be mapped onto the closest generic kind.
 */
public enum Token {
  ROOT, // holds one or more SCRIPT nodes
  SCRIPT, // top-level statement list of one file

  // Statements
  BLOCK,
  EXPR_RESULT, // expression statement
  ECHO,
  RETURN,
  THROW,
  BREAK,
  CONTINUE,
  IF,
  WHILE,
  DO,
  FOR,
  EXPR_LIST, // init, condition or step list of a for(;;)
  FOREACH,
  SWITCH,
  CASE,
  DEFAULT_CASE,
  TRY,
  CATCH,
  UNSET,
  GLOBAL,
  STATIC, // static $x = ...;
  EMPTY, // no-op statement, skipped destructuring slot, absent optional child

  // Declarations
  FUNCTION,
  CLASS,
  CLASS_MEMBERS,
  METHOD,
  PARAM_LIST,
  DEFAULT_VALUE, // parameter with a default
  CLOSURE,
  USE_LIST, // closure use(...) clause
  ARROW_FUNCTION,

  // Leaves
  VARIABLE, // $name
  NAME, // function, class, constant or member name
  STRINGLIT,
  NUMBER,
  TRUE,
  FALSE,
  NULL,
  INTERPOLATED_STRING, // "...{$x}..."

  // Arrays and destructuring
  ARRAYLIT,
  ARRAY_ITEM, // value, or key and value
  SPREAD,
  LIST, // list(...) destructuring
  ARRAY_PATTERN, // [...] destructuring

  // Assignment
  ASSIGN, // =
  ASSIGN_REF, // =&
  ASSIGN_ADD, // +=
  ASSIGN_SUB, // -=
  ASSIGN_MUL, // *=
  ASSIGN_DIV, // /=
  ASSIGN_MOD, // %=
  ASSIGN_POW, // **=
  ASSIGN_CONCAT, // .=
  ASSIGN_BITAND, // &=
  ASSIGN_BITOR, // |=
  ASSIGN_BITXOR, // ^=
  ASSIGN_LSH, // <<=
  ASSIGN_RSH, // >>=
  ASSIGN_COALESCE, // ??=
  INC,
  DEC,

  // Operators
  ADD,
  SUB,
  MUL,
  DIV,
  MOD,
  POW,
  CONCAT,
  BITAND,
  BITOR,
  BITXOR,
  LSH,
  RSH,
  EQ,
  NE,
  SHEQ, // ===
  SHNE, // !==
  LT,
  LE,
  GT,
  GE,
  SPACESHIP, // <=>
  AND, // && and "and"
  OR, // || and "or"
  XOR, // logical xor, not short-circuiting
  COALESCE, // ??
  HOOK, // conditional (?:), middle child EMPTY for the short form
  NOT,
  NEG,
  POS,
  BITNOT,
  SILENCE, // @
  CAST,
  INSTANCEOF,

  // Existence checks
  ISSET,
  IS_EMPTY, // empty(...)

  // Calls and member access
  CALL,
  NEW,
  GETELEM, // $a[...]
  GETPROP, // $a->b
  STATIC_MEMBER, // A::b, A::$b, A::B
  EXIT; // exit and die

  /** Whether this is a simple or compound assignment operator, including ??=. */
  public boolean isAssignmentOp() {
    switch (this) {
      case ASSIGN:
      case ASSIGN_REF:
        return true;
      default:
        return isCompoundAssignmentOp();
    }
  }

  /** Whether this is an operator of the form {@code $x op= expr}, including ??=. */
  public boolean isCompoundAssignmentOp() {
    switch (this) {
      case ASSIGN_ADD:
      case ASSIGN_SUB:
      case ASSIGN_MUL:
      case ASSIGN_DIV:
      case ASSIGN_MOD:
      case ASSIGN_POW:
      case ASSIGN_CONCAT:
      case ASSIGN_BITAND:
      case ASSIGN_BITOR:
      case ASSIGN_BITXOR:
      case ASSIGN_LSH:
      case ASSIGN_RSH:
      case ASSIGN_COALESCE:
        return true;
      default:
        return false;
    }
  }
}
