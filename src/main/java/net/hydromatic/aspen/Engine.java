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
package net.hydromatic.aspen;

import static java.util.Objects.requireNonNull;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import java.util.List;
import java.util.Map;
import net.hydromatic.aspen.ast.Ast;
import net.hydromatic.aspen.compile.Analyzer;
import net.hydromatic.aspen.eval.Prop;
import net.hydromatic.aspen.ground.GroundAtom;
import net.hydromatic.aspen.ground.GroundProgram;
import net.hydromatic.aspen.ground.Grounder;
import net.hydromatic.aspen.output.OutputSpec;
import net.hydromatic.aspen.output.OutputValidator;
import net.hydromatic.aspen.output.Projector;
import net.hydromatic.aspen.solve.AnswerSet;
import net.hydromatic.aspen.solve.ExhaustiveSolver;
import net.hydromatic.aspen.solve.InconsistentException;
import net.hydromatic.aspen.solve.PortfolioSolver;
import net.hydromatic.aspen.solve.Search;
import net.hydromatic.aspen.solve.SearchAbortedException;
import net.hydromatic.aspen.solve.SolveResult;
import net.hydromatic.aspen.solve.Solver;
import net.hydromatic.aspen.util.Tracer;
import net.hydromatic.aspen.util.Tracers;
import org.checkerframework.checker.nullness.qual.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Runs a program: grounds it with a set of input facts, searches for an
 * answer set, and projects the answer set into structured output.
 *
 * <p>An engine is created once for a program and an output specification,
 * both of which are checked on creation, and may then be run many times
 * with different facts. Every error is an unchecked exception that
 * implements {@link net.hydromatic.aspen.util.AspException}; no output is
 * returned with an error.
 */
public class Engine {
  private static final Logger LOG = LoggerFactory.getLogger(Engine.class);

  private final Ast.Program program;
  private final OutputSpec outputSpec;
  private final ImmutableMap<Prop, Object> props;
  private final Projector projector;
  private final Tracer tracer;

  private Engine(Ast.Program program, OutputSpec outputSpec,
      Map<Prop, Object> props, Projector projector, Tracer tracer) {
    this.program = requireNonNull(program);
    this.outputSpec = requireNonNull(outputSpec);
    this.props = ImmutableMap.copyOf(props);
    this.projector = requireNonNull(projector);
    this.tracer = requireNonNull(tracer);
  }

  /** Creates an engine with no constructors and no tracer. */
  public static Engine create(Ast.Program program, OutputSpec outputSpec,
      Map<Prop, Object> props) {
    return create(program, outputSpec, props, Projector.create(),
        Tracers.empty());
  }

  /**
   * Creates an engine.
   *
   * @param program Program
   * @param outputSpec Output specification
   * @param props Properties
   * @param projector Projector, with the constructors that the output
   *     specification uses
   * @param tracer Tracer
   *
   * @throws net.hydromatic.aspen.compile.SpecificationException if the
   *     program or the output specification is invalid
   */
  public static Engine create(Ast.Program program, OutputSpec outputSpec,
      Map<Prop, Object> props, Projector projector, Tracer tracer) {
    Analyzer.analyze(program);
    OutputValidator.validate(outputSpec, projector.constructorNames());
    return new Engine(program, outputSpec, props, projector, tracer);
  }

  /** Grounds the program with a set of input facts. */
  public GroundProgram ground(Iterable<GroundAtom> facts) {
    final GroundProgram groundProgram =
        Grounder.ground(program, facts, props);
    tracer.onGround(groundProgram);
    return groundProgram;
  }

  /**
   * Finds one answer set and projects it.
   *
   * @return Result, or null if there is no answer set
   * @throws SearchAbortedException if a step or time limit stops the search
   */
  public @Nullable Result solveOne(Iterable<GroundAtom> facts) {
    final GroundProgram groundProgram = ground(facts);
    final SolveResult solveResult;
    if (strategy() == Prop.Strategy.EXHAUSTIVE) {
      solveResult = new ExhaustiveSolver(groundProgram, tracer).next();
    } else {
      solveResult =
          new PortfolioSolver(groundProgram, props, tracer).solve();
    }
    return toResult(solveResult);
  }

  /**
   * Finds one answer set and projects it, throwing if there is none.
   *
   * @throws InconsistentException if there is no answer set
   * @throws SearchAbortedException if a step or time limit stops the search
   */
  public Result execute(Iterable<GroundAtom> facts) {
    final Result result = solveOne(facts);
    if (result == null) {
      throw new InconsistentException("program has no answer set");
    }
    return result;
  }

  /**
   * Finds up to {@code limit} answer sets, and projects each.
   *
   * @param facts Input facts
   * @param limit Greatest number of answer sets to return; 0 means no limit
   * @return Results, empty if there is no answer set
   * @throws SearchAbortedException if a step or time limit stops the search
   */
  public List<Result> solveAll(Iterable<GroundAtom> facts, int limit) {
    final GroundProgram groundProgram = ground(facts);
    final Search search = strategy() == Prop.Strategy.EXHAUSTIVE
        ? new ExhaustiveSolver(groundProgram, tracer)
        : new Solver(groundProgram, props, tracer);
    final ImmutableList.Builder<Result> results = ImmutableList.builder();
    for (int n = 0; limit <= 0 || n < limit; n++) {
      final Result result = toResult(search.next());
      if (result == null) {
        break;
      }
      results.add(result);
    }
    return results.build();
  }

  private Prop.Strategy strategy() {
    return Prop.STRATEGY.enumValue(props, Prop.Strategy.class);
  }

  private @Nullable Result toResult(SolveResult solveResult) {
    switch (solveResult.status) {
      case INCONSISTENT:
        return null;
      case UNKNOWN:
        throw new SearchAbortedException("step or time limit reached",
            solveResult.decisions);
      default:
        final AnswerSet answerSet = requireNonNull(solveResult.answerSet);
        final Result result =
            new Result(answerSet, projector.project(outputSpec, answerSet));
        LOG.debug("Projected {} outputs", result.outputs.size());
        tracer.onResult(result);
        return result;
    }
  }

  /** Answer set and the outputs projected from it. */
  public static class Result {
    public final AnswerSet answerSet;
    public final ImmutableMap<String, Object> outputs;

    Result(AnswerSet answerSet, ImmutableMap<String, Object> outputs) {
      this.answerSet = requireNonNull(answerSet);
      this.outputs = requireNonNull(outputs);
    }

    /** Returns the value of a named output. */
    public Object get(String name) {
      final Object value = outputs.get(name);
      if (value == null) {
        throw new IllegalArgumentException("no output named " + name);
      }
      return value;
    }

    @Override
    public String toString() {
      return outputs.toString();
    }
  }
}

// End Engine.java
