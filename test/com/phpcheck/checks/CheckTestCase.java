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

import static com.google.common.truth.Truth.assertThat;
import static com.google.common.truth.Truth.assertWithMessage;

import com.google.common.collect.ImmutableList;
import com.phpcheck.ast.IR;
import com.phpcheck.ast.Node;
import org.junit.Before;

/**
 * Base class for testing checks. Trees are built with {@link IR}; each statement gets its line
 * through {@link #at}, and the findings of the pass are compared as (description, line) pairs.
 */
public abstract class CheckTestCase {

  protected static final String FILENAME = "testcode.php";

  protected CheckerOptions options;
  protected SortingErrorManager errorManager;

  @Before
  public void setUp() throws Exception {
    options = new CheckerOptions();
    errorManager = new SortingErrorManager();
  }

  /** Gets the pass that is being tested. */
  protected abstract CheckPass getProcessor(CheckerOptions options, ErrorHandler errorHandler);

  /**
   * Puts n on the given line, along with every descendant that has no line yet. Inner calls run
   * first, so nested statements keep their own lines.
   */
  protected static Node at(int line, Node n) {
    return n.setLineno(line).setLinenoTreeIfMissing(line);
  }

  protected static Node script(Node... statements) {
    return IR.script(FILENAME, statements);
  }

  /** {@code $name = 1;} */
  protected static Node assign(String name) {
    return assign(name, IR.number(1));
  }

  /** {@code $name = value;} */
  protected static Node assign(String name, Node value) {
    return IR.exprResult(IR.assign(IR.var(name), value));
  }

  /** {@code echo $name, ...;} */
  protected static Node echo(String... names) {
    Node[] vars = new Node[names.length];
    for (int i = 0; i < names.length; i++) {
      vars[i] = IR.var(names[i]);
    }
    return IR.echo(vars);
  }

  /** A call that the check knows nothing about, for conditions nobody can fold. */
  protected static Node unknownCondition() {
    return IR.call("rand");
  }

  protected static Finding undefined(String name, int line) {
    return new Finding("Undefined variable: $" + name, line);
  }

  /** Checks that the statements, as a script, produce no findings. */
  protected void testSame(Node... statements) {
    test(script(statements));
  }

  /** Checks that the tree produces exactly the given findings, in any order. */
  protected void test(Node root, Finding... expected) {
    getProcessor(options, errorManager).process(root);
    assertWithMessage("Unexpected findings for\n%s", root.toStringTree())
        .that(getFindings())
        .containsExactlyElementsIn(ImmutableList.copyOf(expected));
  }

  protected ImmutableList<Finding> getFindings() {
    ImmutableList.Builder<Finding> findings = ImmutableList.builder();
    for (PhpError error : errorManager.getErrors()) {
      findings.add(new Finding(error.description(), error.lineno()));
    }
    for (PhpError error : errorManager.getWarnings()) {
      findings.add(new Finding(error.description(), error.lineno()));
    }
    return findings.build();
  }

  protected void assertNoFindings() {
    assertThat(getFindings()).isEmpty();
  }

  /** A reported finding, reduced to what a user sees. */
  protected record Finding(String description, int line) {
    @Override
    public String toString() {
      return line + ": " + description;
    }
  }
}
