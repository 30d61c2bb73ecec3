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

import java.util.ArrayList;
import java.util.List;
import java.util.logging.Handler;
import java.util.logging.Level;
import java.util.logging.LogRecord;
import java.util.logging.Logger;
import org.junit.After;
import org.junit.Before;
import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;

/** Tests {@link LoggerErrorManager}. */
@RunWith(JUnit4.class)
public final class LoggerErrorManagerTest {

  private static final DiagnosticType FOO_TYPE = DiagnosticType.error("TEST_FOO", "Foo {0}");

  private final List<LogRecord> records = new ArrayList<>();
  private Logger logger;
  private Handler handler;

  @Before
  public void setUp() {
    logger = Logger.getLogger(LoggerErrorManagerTest.class.getName());
    logger.setUseParentHandlers(false);
    handler =
        new Handler() {
          @Override
          public void publish(LogRecord record) {
            records.add(record);
          }

          @Override
          public void flush() {}

          @Override
          public void close() {}
        };
    logger.addHandler(handler);
  }

  @After
  public void tearDown() {
    logger.removeHandler(handler);
  }

  @Test
  public void testEmptyReport() {
    new LoggerErrorManager(logger).generateReport();
    assertThat(records).hasSize(1);
    assertThat(records.get(0).getLevel()).isEqualTo(Level.INFO);
    assertThat(records.get(0).getMessage()).isEqualTo("0 error(s), 0 warning(s)");
  }

  @Test
  public void testFindingsAndSummary() {
    LoggerErrorManager manager = new LoggerErrorManager(logger);
    manager.report(
        CheckLevel.WARNING, new PhpError(FOO_TYPE, "Foo b", "x.php", 4, null, CheckLevel.ERROR));
    manager.report(
        CheckLevel.ERROR, new PhpError(FOO_TYPE, "Foo a", "x.php", 2, null, CheckLevel.ERROR));
    manager.generateReport();

    assertThat(records).hasSize(3);
    assertThat(records.get(0).getLevel()).isEqualTo(Level.SEVERE);
    assertThat(records.get(0).getMessage()).isEqualTo("x.php:2: ERROR - [TEST_FOO] Foo a");
    assertThat(records.get(1).getLevel()).isEqualTo(Level.WARNING);
    assertThat(records.get(1).getMessage()).isEqualTo("x.php:4: WARNING - [TEST_FOO] Foo b");
    LogRecord summary = records.get(2);
    assertThat(summary.getLevel()).isEqualTo(Level.WARNING);
    assertThat(summary.getMessage()).isEqualTo("{0} error(s), {1} warning(s)");
    assertThat(summary.getParameters()).asList().containsExactly(1, 1).inOrder();
  }
}
