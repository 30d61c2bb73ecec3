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
import com.google.common.collect.ImmutableSet;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Set;

/**
 * A customizable error manager that sorts all findings reported to it, and has customizable output
 * through the {@link ErrorReportGenerator} interface.
 *
 * <p>Unlike a set-based manager, two identical findings on the same line are both kept: each read
 * of an undefined variable is its own finding.
 */
public class SortingErrorManager implements ErrorManager {

  private final List<ErrorWithLevel> messages = new ArrayList<>();
  private int errorCount = 0;
  private int warningCount = 0;

  /** Responsible for generating the report of the findings at the end of a run */
  private final ImmutableSet<ErrorReportGenerator> errorReportGenerators;

  public SortingErrorManager(Set<ErrorReportGenerator> errorReportGenerators) {
    this.errorReportGenerators = ImmutableSet.copyOf(errorReportGenerators);
  }

  public SortingErrorManager() {
    this(ImmutableSet.of());
  }

  @Override
  public void report(CheckLevel level, PhpError error) {
    if (!level.isOn()) {
      return;
    }
    messages.add(new ErrorWithLevel(error, level));
    if (level == CheckLevel.ERROR) {
      errorCount++;
    } else {
      warningCount++;
    }
  }

  @Override
  public int getErrorCount() {
    return errorCount;
  }

  @Override
  public int getWarningCount() {
    return warningCount;
  }

  @Override
  public ImmutableList<PhpError> getErrors() {
    return toList(CheckLevel.ERROR);
  }

  @Override
  public ImmutableList<PhpError> getWarnings() {
    return toList(CheckLevel.WARNING);
  }

  /** Returns every finding, ordered by file, line, level and description. */
  ImmutableList<ErrorWithLevel> getSortedDiagnostics() {
    return ImmutableList.sortedCopyOf(new LeveledErrorComparator(), messages);
  }

  private ImmutableList<PhpError> toList(CheckLevel level) {
    ImmutableList.Builder<PhpError> errors = ImmutableList.builder();
    for (ErrorWithLevel p : getSortedDiagnostics()) {
      if (p.level() == level) {
        errors.add(p.error());
      }
    }
    return errors.build();
  }

  @Override
  public void generateReport() {
    for (ErrorReportGenerator generator : this.errorReportGenerators) {
      generator.generateReport(this);
    }
  }

  /** Strategy for customizing the output format of the error report */
  public interface ErrorReportGenerator {
    void generateReport(SortingErrorManager manager);
  }

  /**
   * Comparator of {@link PhpError} with an associated {@link CheckLevel}. The ordering is the
   * lexical ordering on the quadruple (file name, line number, {@link CheckLevel}, description).
   * Findings without a file name sort first, and at the same line warnings sort before errors.
   */
  static final class LeveledErrorComparator implements Comparator<ErrorWithLevel> {
    private static final Comparator<ErrorWithLevel> ORDER =
        Comparator.comparing(
                (ErrorWithLevel e) -> e.error().sourceName(),
                Comparator.nullsFirst(Comparator.<String>naturalOrder()))
            .thenComparingInt(e -> e.error().lineno())
            .thenComparing(ErrorWithLevel::level, Comparator.reverseOrder())
            .thenComparing(e -> e.error().description());

    @Override
    public int compare(ErrorWithLevel p1, ErrorWithLevel p2) {
      return ORDER.compare(p1, p2);
    }
  }

  /** A finding together with the level it was reported at. */
  record ErrorWithLevel(PhpError error, CheckLevel level) {}
}
