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

import com.google.common.collect.ImmutableMap;
import org.jspecify.annotations.Nullable;

/**
 * Variables the runtime provides without an assignment in the analyzed body. Whether a read of one
 * is defined depends only on the flags of the current scope, never on assignments.
 */
enum ImplicitVar {
  THIS("this"),
  ARGC("argc"),
  ARGV("argv"),
  HTTP_RESPONSE_HEADER("http_response_header"),
  GLOBALS("GLOBALS"),
  SERVER("_SERVER"),
  GET("_GET"),
  POST("_POST"),
  FILES("_FILES"),
  COOKIE("_COOKIE"),
  SESSION("_SESSION"),
  REQUEST("_REQUEST"),
  ENV("_ENV");

  private static final ImmutableMap<String, ImplicitVar> BY_NAME;

  static {
    ImmutableMap.Builder<String, ImplicitVar> builder = ImmutableMap.builder();
    for (ImplicitVar var : values()) {
      builder.put(var.varName, var);
    }
    BY_NAME = builder.buildOrThrow();
  }

  final String varName;

  ImplicitVar(String varName) {
    this.varName = varName;
  }

  /** Variable names are case-sensitive, so {@code $_get} is an ordinary variable. */
  static @Nullable ImplicitVar forName(String name) {
    return BY_NAME.get(name);
  }

  static boolean isImplicit(String name) {
    return BY_NAME.containsKey(name);
  }

  boolean isAvailableIn(VariableFlowScope scope) {
    switch (this) {
      case THIS:
        return scope.isThisAvailable();
      case ARGC:
      case ARGV:
        return scope.isCliArgumentsAvailable();
      case HTTP_RESPONSE_HEADER:
        return scope.isResponseHeaderAvailable();
      default:
        return true;
    }
  }
}
