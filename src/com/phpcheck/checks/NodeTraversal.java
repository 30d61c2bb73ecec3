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

import com.phpcheck.ast.Node;
import com.phpcheck.ast.Token;
import java.util.ArrayDeque;
import java.util.Deque;
import org.jspecify.annotations.Nullable;

/** NodeTraversal allows an iteration through the nodes in the parse tree. */
public class NodeTraversal {
  private final Callback callback;

  /** Function-like nodes (and scripts) entered so far, innermost on top. */
  private final Deque<Node> scopeRoots = new ArrayDeque<>();

  private @Nullable Node root;

  /** Callback for tree-based traversals */
  public interface Callback {
    /**
     * Visits a node in preorder (before its children) and decides whether the node and its children
     * should be traversed.
     *
     * <p>If this method returns false, the node will not be visited by {@link
     * #visit(NodeTraversal, Node, Node)} and its children will not be visited at all.
     *
     * @param t The current traversal.
     * @param n The current node.
     * @param parent The parent of the current node.
     * @return whether the children of this node should be visited
     */
    boolean shouldTraverse(NodeTraversal t, Node n, @Nullable Node parent);

    /**
     * Visits a node in postorder (after its children). A node is visited in postorder iff {@link
     * #shouldTraverse(NodeTraversal, Node, Node)} returned true for it. Siblings are always
     * visited left-to-right.
     *
     * @param t The current traversal.
     * @param n The current node.
     * @param parent The parent of the current node.
     */
    void visit(NodeTraversal t, Node n, @Nullable Node parent);
  }

  /** Abstract callback to visit all nodes in postorder. */
  public abstract static class AbstractPostOrderCallback implements Callback {
    @Override
    public final boolean shouldTraverse(NodeTraversal t, Node n, @Nullable Node parent) {
      return true;
    }
  }

  /** Abstract callback to visit all nodes in preorder. */
  public abstract static class AbstractPreOrderCallback implements Callback {
    @Override
    public final void visit(NodeTraversal t, Node n, @Nullable Node parent) {}
  }

  /**
   * Abstract callback to visit the nodes of one body in postorder without entering nested
   * functions, methods, closures or classes. The use clause of a nested closure is still visited,
   * since its by-reference entries write to the enclosing body.
   */
  public abstract static class AbstractShallowCallback implements Callback {
    @Override
    public final boolean shouldTraverse(NodeTraversal t, Node n, @Nullable Node parent) {
      return parent == null
          || !NodeUtil.startsNestedBody(parent)
          || n.getToken() == Token.USE_LIST
          || n.isName();
    }
  }

  public NodeTraversal(Callback cb) {
    this.callback = cb;
  }

  /** Traverses a parse tree recursively. */
  public static void traverse(Node root, Callback cb) {
    new NodeTraversal(cb).traverse(root);
  }

  /** Traverses a parse tree recursively. */
  public void traverse(Node root) {
    checkState(this.root == null, "traversal already in progress");
    this.root = root;
    try {
      traverseBranch(root, null);
    } finally {
      this.root = null;
      scopeRoots.clear();
    }
  }

  /** Returns the node the traversal started at. */
  public Node getRoot() {
    checkState(root != null, "not traversing");
    return root;
  }

  /**
   * Returns the innermost SCRIPT, FUNCTION, METHOD or CLOSURE containing the current node, or the
   * node itself if it is one. Returns null if the traversal started below any of them.
   */
  public @Nullable Node getScopeRoot() {
    return scopeRoots.peek();
  }

  private void traverseBranch(Node n, @Nullable Node parent) {
    if (!callback.shouldTraverse(this, n, parent)) {
      return;
    }
    boolean isScopeRoot = n.isScript() || n.isFunctionLike();
    if (isScopeRoot) {
      scopeRoots.push(n);
    }
    for (Node child = n.getFirstChild(); child != null; ) {
      // Child may be replaced by the callback, so get the next one first.
      Node next = child.getNext();
      traverseBranch(child, n);
      child = next;
    }
    callback.visit(this, n, parent);
    if (isScopeRoot) {
      scopeRoots.pop();
    }
  }
}
