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

import static java.util.Objects.requireNonNull;

import com.phpcheck.ast.Node;
import org.jspecify.annotations.Nullable;

/**
 * Description of one analysis finding.
 *
 * @param type A type of the finding.
 * @param description Description of the finding.
 * @param sourceName Name of the source file.
 * @param lineno One-indexed line number of the finding, or -1 if unknown.
 * @param node Node where the finding occurred.
 * @param defaultLevel The default level, before any configured override is applied.
 */
public record PhpError(
    DiagnosticType type,
    String description,
    @Nullable String sourceName,
    int lineno,
    @Nullable Node node,
    CheckLevel defaultLevel) {
  public PhpError {
    requireNonNull(type, "type");
    requireNonNull(description, "description");
    requireNonNull(defaultLevel, "defaultLevel");
  }

  /**
   * Creates a PhpError with no source information
   *
   * @param type The DiagnosticType
   * @param arguments Arguments to be incorporated into the message
   */
  public static PhpError make(DiagnosticType type, String... arguments) {
    return new PhpError(type, type.format(arguments), null, -1, null, type.level);
  }

  /**
   * Creates a PhpError at a given node.
   *
   * @param n Determines the source file name and line number
   * @param type The DiagnosticType
   * @param arguments Arguments to be incorporated into the message
   */
  public static PhpError make(Node n, DiagnosticType type, String... arguments) {
    return new PhpError(
        type, type.format(arguments), n.getSourceFileName(), n.getLineno(), n, type.level);
  }

  /** Formats this finding the way it is printed to a console or log. */
  public String format(CheckLevel level) {
    StringBuilder sb = new StringBuilder();
    if (sourceName != null) {
      sb.append(sourceName);
      if (lineno > 0) {
        sb.append(':').append(lineno);
      }
      sb.append(": ");
    }
    return sb.append(level)
        .append(" - [")
        .append(type.key)
        .append("] ")
        .append(description)
        .toString();
  }

  @Override
  public String toString() {
    return format(defaultLevel);
  }
}
