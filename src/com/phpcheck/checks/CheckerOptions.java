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

import static com.google.common.base.Preconditions.checkArgument;

import com.google.common.collect.ImmutableMap;
import com.google.common.collect.ImmutableSet;
import com.google.errorprone.annotations.CanIgnoreReturnValue;
import java.io.Serializable;
import java.util.Collection;
import java.util.HashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Set;

/** Options for a {@link Checker} run. */
public class CheckerOptions implements Serializable {
  private static final long serialVersionUID = 1;

  /**
   * Functions that write to a caller's variable through a by-reference argument, keyed by
   * lower-case name, with the 0-based positions of those arguments.
   */
  static final ImmutableMap<String, ImmutableSet<Integer>> DEFAULT_REFERENCE_OUTPUT_FUNCTIONS =
      ImmutableMap.<String, ImmutableSet<Integer>>builder()
          .put("parse_str", ImmutableSet.of(1))
          .put("mb_parse_str", ImmutableSet.of(1))
          .put("preg_match", ImmutableSet.of(2))
          .put("preg_match_all", ImmutableSet.of(2))
          .put("preg_replace", ImmutableSet.of(4))
          .put("preg_replace_callback", ImmutableSet.of(4))
          .put("str_replace", ImmutableSet.of(3))
          .put("str_ireplace", ImmutableSet.of(3))
          .put("exec", ImmutableSet.of(1, 2))
          .put("system", ImmutableSet.of(1))
          .put("passthru", ImmutableSet.of(1))
          .put("getimagesize", ImmutableSet.of(1))
          .put("similar_text", ImmutableSet.of(2))
          .put("fsockopen", ImmutableSet.of(2, 3))
          .put("stream_socket_client", ImmutableSet.of(1, 2))
          .put("headers_sent", ImmutableSet.of(0, 1))
          .put("openssl_sign", ImmutableSet.of(1))
          .buildOrThrow();

  /** Functions after which {@code $http_response_header} exists in the calling scope. */
  static final ImmutableSet<String> DEFAULT_RESPONSE_HEADER_FUNCTIONS =
      ImmutableSet.of("file_get_contents", "file", "fopen", "get_headers", "readfile");

  private boolean cliArgumentsVariablesRegistered = false;

  private ImmutableMap<String, ImmutableSet<Integer>> referenceOutputFunctions =
      DEFAULT_REFERENCE_OUTPUT_FUNCTIONS;

  private ImmutableSet<String> responseHeaderFunctions = DEFAULT_RESPONSE_HEADER_FUNCTIONS;

  private final Map<DiagnosticType, CheckLevel> levelOverrides = new HashMap<>();

  private int numParallelThreads = 1;

  /**
   * Whether {@code $argc} and {@code $argv} exist in top-level script bodies, i.e. whether the
   * runtime has {@code register_argc_argv} enabled.
   */
  public void setCliArgumentsVariablesRegistered(boolean registered) {
    this.cliArgumentsVariablesRegistered = registered;
  }

  public boolean isCliArgumentsVariablesRegistered() {
    return cliArgumentsVariablesRegistered;
  }

  /** Replaces the table of functions that define variables through by-reference arguments. */
  public void setReferenceOutputFunctions(Map<String, ? extends Collection<Integer>> functions) {
    ImmutableMap.Builder<String, ImmutableSet<Integer>> builder = ImmutableMap.builder();
    for (Map.Entry<String, ? extends Collection<Integer>> entry : functions.entrySet()) {
      for (int position : entry.getValue()) {
        checkArgument(position >= 0, "negative argument position for %s", entry.getKey());
      }
      builder.put(normalizeFunctionName(entry.getKey()), ImmutableSet.copyOf(entry.getValue()));
    }
    this.referenceOutputFunctions = builder.buildOrThrow();
  }

  /** Adds one function to the table of functions that define variables by reference. */
  public void addReferenceOutputFunction(String name, Integer... positions) {
    Map<String, ImmutableSet<Integer>> functions = new HashMap<>(referenceOutputFunctions);
    functions.put(normalizeFunctionName(name), ImmutableSet.copyOf(positions));
    setReferenceOutputFunctions(functions);
  }

  /**
   * Returns the positions of by-reference output arguments of the named function, or the empty set
   * if it has none.
   */
  public ImmutableSet<Integer> getReferenceOutputPositions(String functionName) {
    ImmutableSet<Integer> positions =
        referenceOutputFunctions.get(normalizeFunctionName(functionName));
    return positions != null ? positions : ImmutableSet.of();
  }

  public void setResponseHeaderFunctions(Set<String> functions) {
    ImmutableSet.Builder<String> builder = ImmutableSet.builder();
    for (String function : functions) {
      builder.add(normalizeFunctionName(function));
    }
    this.responseHeaderFunctions = builder.build();
  }

  /** Whether calling the named function populates {@code $http_response_header}. */
  public boolean isResponseHeaderFunction(String functionName) {
    return responseHeaderFunctions.contains(normalizeFunctionName(functionName));
  }

  /** Overrides the level a diagnostic is reported at. {@link CheckLevel#OFF} disables it. */
  @CanIgnoreReturnValue
  public CheckerOptions setWarningLevel(DiagnosticType type, CheckLevel level) {
    levelOverrides.put(type, level);
    return this;
  }

  /** Returns the level findings of the given type are reported at. */
  public CheckLevel getWarningLevel(DiagnosticType type) {
    return levelOverrides.getOrDefault(type, type.level);
  }

  /** Whether to report findings of the given type at all. */
  public boolean enables(DiagnosticType type) {
    return getWarningLevel(type).isOn();
  }

  /** Sets the number of threads scripts are spread over. 1 runs everything on the caller. */
  public void setNumParallelThreads(int numParallelThreads) {
    checkArgument(numParallelThreads > 0, "need at least one thread: %s", numParallelThreads);
    this.numParallelThreads = numParallelThreads;
  }

  public int getNumParallelThreads() {
    return numParallelThreads;
  }

  /** PHP function names are case-insensitive and may be written fully qualified. */
  static String normalizeFunctionName(String name) {
    String unqualified = name.startsWith("\\") ? name.substring(1) : name;
    return unqualified.toLowerCase(Locale.ROOT);
  }
}
