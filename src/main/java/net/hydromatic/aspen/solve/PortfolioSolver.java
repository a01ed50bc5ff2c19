/*
 * Licensed to Julian Hyde under one or more contributor license
 * agreements.  See the NOTICE file distributed with this work
 * for additional information regarding copyright ownership.
 * Julian Hyde licenses this file to you under the Apache
 * License, Version 2.0 (the "License"); you may not use this
 * file except in compliance with the License.  You may obtain a
 * copy of the License at
 *
 * http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing,
 * software distributed under the License is distributed on an
 * "AS IS" BASIS, WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND,
 * either express or implied.  See the License for the specific
 * language governing permissions and limitations under the
 * License.
 */
package net.hydromatic.aspen.solve;

import static com.google.common.base.Preconditions.checkArgument;
import static java.util.Objects.requireNonNull;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletionService;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorCompletionService;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.atomic.AtomicBoolean;
import net.hydromatic.aspen.eval.Prop;
import net.hydromatic.aspen.ground.GroundProgram;
import net.hydromatic.aspen.util.Tracer;
import net.hydromatic.aspen.util.Tracers;
import org.checkerframework.checker.nullness.qual.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Runs several {@link Solver} instances in parallel on one ground program.
 *
 * <p>The solvers differ only in the order in which they choose decision
 * atoms: solver {@code i} rotates the order by {@code i * n / threadCount}
 * positions, where {@code n} is the number of atoms. The first
 * solver to find an answer set or to prove that there is none provides the
 * result, and the others are cancelled.
 */
public class PortfolioSolver {
  private static final Logger LOG =
      LoggerFactory.getLogger(PortfolioSolver.class);

  private final GroundProgram program;
  private final Map<Prop, Object> props;
  private final Tracer tracer;
  private final int threadCount;

  public PortfolioSolver(GroundProgram program, Map<Prop, Object> props,
      Tracer tracer) {
    this.program = program;
    this.props = props;
    this.tracer = tracer;
    this.threadCount = Prop.THREAD_COUNT.intValue(props);
    checkArgument(threadCount >= 1, "threadCount must be positive: %s",
        threadCount);
  }

  /** Finds one answer set. */
  public SolveResult solve() {
    if (threadCount == 1) {
      return new Solver(program, props, tracer).next();
    }
    final int atomCount = program.atoms.size();
    final AtomicBoolean cancelled = new AtomicBoolean();
    final ExecutorService executor = Executors.newFixedThreadPool(threadCount);
    try {
      final CompletionService<SolveResult> completionService =
          new ExecutorCompletionService<>(executor);
      final List<Solver> solvers = new ArrayList<>();
      for (int i = 0; i < threadCount; i++) {
        // Workers do not report to the tracer, which need not be
        // thread-safe.
        final Solver solver =
            new Solver(program, props, Tracers.empty(),
                i * atomCount / threadCount, cancelled);
        solvers.add(solver);
        completionService.submit(solver::next);
      }
      @Nullable SolveResult result = null;
      for (int i = 0; i < solvers.size(); i++) {
        final SolveResult r = completionService.take().get();
        if (r.status != SolveResult.Status.UNKNOWN) {
          result = r;
          cancelled.set(true);
          break;
        }
        if (result == null) {
          result = r;
        }
      }
      LOG.debug("Portfolio of {} solvers finished with {}", threadCount,
          result);
      requireNonNull(result);
      if (result.answerSet != null) {
        tracer.onAnswerSet(result.answerSet);
      }
      return result;
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      cancelled.set(true);
      throw new SearchAbortedException("interrupted", 0);
    } catch (ExecutionException e) {
      cancelled.set(true);
      final Throwable cause = e.getCause();
      if (cause instanceof RuntimeException) {
        throw (RuntimeException) cause;
      }
      throw new IllegalStateException(cause);
    } finally {
      executor.shutdownNow();
    }
  }
}

// End PortfolioSolver.java
