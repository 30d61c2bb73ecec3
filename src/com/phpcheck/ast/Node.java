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
import static com.google.common.base.Preconditions.checkNotNull;
import static com.google.common.base.Preconditions.checkState;

import java.util.Iterator;
import java.util.NoSuchElementException;
import org.jspecify.annotations.Nullable;

/**
 * A node of a PHP syntax tree.
 *
 * <p>Children are kept in a doubly linked sibling list: {@code first.previous} points at the last
 * child so appending is constant time, while {@code last.next} stays null.
 */
public class Node {

  /** Boolean properties a node may carry. */
  public enum Prop {
    // Set on METHOD, CLOSURE and ARROW_FUNCTION nodes declared static.
    STATIC_MEMBER,
    // Set on parameters, closure uses and foreach values taken by reference.
    BY_REFERENCE,
  }

  private static final int NO_LINENO = -1;

  private final Token token;

  private @Nullable String string;

  private int lineno = NO_LINENO;

  private int props;

  private @Nullable Node parent;

  private @Nullable Node first;

  private @Nullable Node next;

  private @Nullable Node previous;

  public Node(Token token) {
    this.token = checkNotNull(token);
  }

  public Node(Token token, Node... children) {
    this(token);
    for (Node child : children) {
      addChildToBack(child);
    }
  }

  public static Node newString(Token token, String str) {
    Node n = new Node(token);
    n.string = checkNotNull(str);
    return n;
  }

  public final Token getToken() {
    return token;
  }

  /** Returns the payload of a VARIABLE, NAME, STRINGLIT, NUMBER or SCRIPT node. */
  public final String getString() {
    checkState(string != null, "%s has no string payload", token);
    return string;
  }

  public final int getLineno() {
    return lineno;
  }

  public final Node setLineno(int lineno) {
    this.lineno = lineno;
    return this;
  }

  /** Assigns {@code lineno} to this node and every descendant that does not have one yet. */
  public final Node setLinenoTreeIfMissing(int lineno) {
    if (this.lineno == NO_LINENO) {
      this.lineno = lineno;
    }
    for (Node child = first; child != null; child = child.next) {
      child.setLinenoTreeIfMissing(this.lineno);
    }
    return this;
  }

  public final boolean getBooleanProp(Prop prop) {
    return (props & (1 << prop.ordinal())) != 0;
  }

  public final Node putBooleanProp(Prop prop, boolean value) {
    if (value) {
      props |= 1 << prop.ordinal();
    } else {
      props &= ~(1 << prop.ordinal());
    }
    return this;
  }

  public final boolean isStaticMember() {
    return getBooleanProp(Prop.STATIC_MEMBER);
  }

  public final boolean isByReference() {
    return getBooleanProp(Prop.BY_REFERENCE);
  }

  public final @Nullable Node getParent() {
    return parent;
  }

  public final boolean hasChildren() {
    return first != null;
  }

  public final @Nullable Node getFirstChild() {
    return first;
  }

  public final @Nullable Node getSecondChild() {
    return first != null ? first.next : null;
  }

  public final @Nullable Node getLastChild() {
    return first != null ? first.previous : null;
  }

  public final @Nullable Node getNext() {
    return next;
  }

  public final int getChildCount() {
    int count = 0;
    for (Node n = first; n != null; n = n.next) {
      count++;
    }
    return count;
  }

  public final void addChildToBack(Node child) {
    checkArgument(
        child.parent == null, "Cannot add already-owned child node %s to %s", child, this);
    if (first == null) {
      child.previous = child;
      first = child;
    } else {
      Node last = first.previous;
      last.next = child;
      child.previous = last;
      first.previous = child;
    }
    child.parent = this;
  }

  /** Returns an iterable over the children, in source order. */
  public final Iterable<Node> children() {
    return () -> new SiblingIterator(first);
  }

  /** Returns the name of the file this node belongs to, or null if it is not under a SCRIPT. */
  public final @Nullable String getSourceFileName() {
    for (Node n = this; n != null; n = n.parent) {
      if (n.token == Token.SCRIPT) {
        return n.string;
      }
    }
    return null;
  }

  public final boolean isVariable() {
    return token == Token.VARIABLE;
  }

  public final boolean isName() {
    return token == Token.NAME;
  }

  public final boolean isEmpty() {
    return token == Token.EMPTY;
  }

  public final boolean isBlock() {
    return token == Token.BLOCK;
  }

  public final boolean isScript() {
    return token == Token.SCRIPT;
  }

  public final boolean isCall() {
    return token == Token.CALL;
  }

  public final boolean isGetElem() {
    return token == Token.GETELEM;
  }

  public final boolean isGetProp() {
    return token == Token.GETPROP;
  }

  public final boolean isArrayItem() {
    return token == Token.ARRAY_ITEM;
  }

  public final boolean isParamList() {
    return token == Token.PARAM_LIST;
  }

  public final boolean isCatch() {
    return token == Token.CATCH;
  }

  public final boolean isCase() {
    return token == Token.CASE;
  }

  public final boolean isDefaultCase() {
    return token == Token.DEFAULT_CASE;
  }

  public final boolean isTrue() {
    return token == Token.TRUE;
  }

  public final boolean isNumber() {
    return token == Token.NUMBER;
  }

  /** Whether this is a list(...) or [...] destructuring pattern. */
  public final boolean isDestructuringPattern() {
    return token == Token.LIST || token == Token.ARRAY_PATTERN;
  }

  /** Whether this node starts a separately analyzed body. */
  public final boolean isFunctionLike() {
    return token == Token.FUNCTION || token == Token.METHOD || token == Token.CLOSURE;
  }

  @Override
  public String toString() {
    StringBuilder sb = new StringBuilder().append(token);
    if (string != null) {
      sb.append(' ').append(string);
    }
    if (lineno != NO_LINENO) {
      sb.append(" [line ").append(lineno).append(']');
    }
    return sb.toString();
  }

  /** Renders this node and its descendants, one node per line, indented by depth. */
  public final String toStringTree() {
    StringBuilder sb = new StringBuilder();
    appendStringTree(sb, 0);
    return sb.toString();
  }

  private void appendStringTree(StringBuilder sb, int level) {
    for (int i = 0; i < level; i++) {
      sb.append("    ");
    }
    sb.append(this).append('\n');
    for (Node child = first; child != null; child = child.next) {
      child.appendStringTree(sb, level + 1);
    }
  }

  private static final class SiblingIterator implements Iterator<Node> {
    private @Nullable Node current;

    SiblingIterator(@Nullable Node first) {
      this.current = first;
    }

    @Override
    public boolean hasNext() {
      return current != null;
    }

    @Override
    public Node next() {
      if (current == null) {
        throw new NoSuchElementException();
      }
      Node result = current;
      current = current.next;
      return result;
    }
  }
}
