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

import com.google.common.collect.ImmutableList;

/**
 * The error manager is in charge of storing, organizing and displaying findings of a run. It
 * receives findings from the passes, which report them as they are found.
 */
public interface ErrorManager extends ErrorHandler {

  /** Writes a report to an implementation-specific medium. */
  void generateReport();

  /** Gets the number of findings reported at {@link CheckLevel#ERROR}. */
  int getErrorCount();

  /** Gets the number of findings reported at {@link CheckLevel#WARNING}. */
  int getWarningCount();

  /** Gets all findings reported at {@link CheckLevel#ERROR}. */
  ImmutableList<PhpError> getErrors();

  /** Gets all findings reported at {@link CheckLevel#WARNING}. */
  ImmutableList<PhpError> getWarnings();
}
