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

import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * An error manager that logs findings using a logger in addition to collecting them in memory.
 * Errors are logged at the SEVERE level and warnings are logged at the WARNING level.
 */
public class LoggerErrorManager extends SortingErrorManager {
  private final Logger logger;

  public LoggerErrorManager(Logger logger) {
    this.logger = logger;
  }

  @Override
  public void generateReport() {
    for (ErrorWithLevel message : getSortedDiagnostics()) {
      println(message.level(), message.error());
    }
    printSummary();
    super.generateReport();
  }

  private void println(CheckLevel level, PhpError error) {
    switch (level) {
      case ERROR:
        logger.severe(error.format(level));
        break;
      case WARNING:
        logger.warning(error.format(level));
        break;
      case OFF:
        break;
    }
  }

  private void printSummary() {
    if (getErrorCount() + getWarningCount() == 0) {
      logger.log(Level.INFO, "0 error(s), 0 warning(s)");
      return;
    }
    logger.log(
        Level.WARNING,
        "{0} error(s), {1} warning(s)",
        new Object[] {getErrorCount(), getWarningCount()});
  }
}
