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

import com.google.common.base.Throwables;
import com.google.common.collect.ImmutableList;
import com.google.common.util.concurrent.Futures;
import com.google.common.util.concurrent.ListenableFuture;
import com.google.common.util.concurrent.ListeningExecutorService;
import com.google.common.util.concurrent.MoreExecutors;
import com.phpcheck.ast.Node;
import com.phpcheck.ast.Token;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.ThreadPoolExecutor;
import java.util.concurrent.TimeUnit;
import java.util.logging.Logger;

/**
 * Runs the checks over a set of parsed scripts and collects what they report.
 *
 * <p>Scripts share no variables, so with more than one thread configured they are checked in
 * parallel. Findings then go through a synchronized error manager.
 */
public final class Checker {

  private static final Logger logger = Logger.getLogger(Checker.class.getName());

  // The walk recurses over the tree, so deeply nested code needs a large stack.
  static final long CHECKER_STACK_SIZE = (1 << 24); // About 16MB

  private final CheckerOptions options;
  private final ErrorManager errorManager;

  public Checker(CheckerOptions options, ErrorManager errorManager) {
    this.options = options;
    this.errorManager = errorManager;
  }

  /** Creates a checker that reports through the logging framework. */
  public Checker(CheckerOptions options) {
    this(options, new LoggerErrorManager(logger));
  }

  public ErrorManager getErrorManager() {
    return errorManager;
  }

  /** Checks the scripts under a ROOT node, or a single SCRIPT. */
  public Result check(Node root) {
    if (root.isScript()) {
      return check(ImmutableList.of(root));
    }
    checkArgument(root.getToken() == Token.ROOT, "expected ROOT or SCRIPT: %s", root);
    return check(ImmutableList.copyOf(root.children()));
  }

  /** Checks each script and generates the report. */
  public Result check(List<Node> scripts) {
    for (Node script : scripts) {
      checkArgument(script.isScript(), "expected SCRIPT: %s", script);
    }
    int threads = Math.min(options.getNumParallelThreads(), scripts.size());
    logger.fine("Checking " + scripts.size() + " script(s) on " + Math.max(threads, 1)
        + " thread(s)");

    // Functions declared in any script define by-reference outputs for all of them.
    ReferenceOutputs referenceOutputs = ReferenceOutputs.gather(options, scripts);
    if (threads <= 1) {
      CheckPass pass = new DefinedVariableCheck(options, errorManager, referenceOutputs);
      for (Node script : scripts) {
        pass.process(script);
      }
    } else {
      checkInParallel(scripts, threads, referenceOutputs);
    }

    errorManager.generateReport();
    return new Result(errorManager.getErrors(), errorManager.getWarnings());
  }

  private void checkInParallel(
      List<Node> scripts, int threads, ReferenceOutputs referenceOutputs) {
    ErrorManager threadSafeErrorManager = new ThreadSafeDelegatingErrorManager(errorManager);
    ThreadFactory threadFactory =
        new ThreadFactory() {
          @Override
          public Thread newThread(Runnable r) {
            Thread t = new Thread(null, r, "phpcheck-Checker", CHECKER_STACK_SIZE);
            t.setDaemon(true); // Do not prevent the JVM from exiting.
            return t;
          }
        };
    ThreadPoolExecutor poolExecutor =
        new ThreadPoolExecutor(
            threads,
            threads,
            Integer.MAX_VALUE,
            TimeUnit.SECONDS,
            new LinkedBlockingQueue<Runnable>(),
            threadFactory);
    ListeningExecutorService executorService = MoreExecutors.listeningDecorator(poolExecutor);
    List<ListenableFuture<?>> futureList = new ArrayList<>(scripts.size());
    for (Node script : scripts) {
      futureList.add(
          executorService.submit(
              () ->
                  new DefinedVariableCheck(options, threadSafeErrorManager, referenceOutputs)
                      .process(script)));
    }

    poolExecutor.shutdown();
    try {
      Futures.allAsList(futureList).get();
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      throw new RuntimeException(e);
    } catch (ExecutionException e) {
      Throwables.throwIfUnchecked(e.getCause());
      throw new RuntimeException(e);
    } finally {
      poolExecutor.shutdownNow();
    }
  }
}
