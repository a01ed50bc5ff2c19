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

import static net.hydromatic.aspen.ast.AstBuilder.ast;
import static net.hydromatic.aspen.output.OutputBuilder.output;

import static org.hamcrest.CoreMatchers.is;
import static org.hamcrest.CoreMatchers.notNullValue;
import static org.hamcrest.CoreMatchers.nullValue;
import static org.hamcrest.MatcherAssert.assertThat;
import static org.junit.jupiter.api.Assertions.assertThrows;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import com.google.common.collect.ImmutableSet;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.atomic.AtomicInteger;
import net.hydromatic.aspen.ast.Ast;
import net.hydromatic.aspen.compile.SpecificationException;
import net.hydromatic.aspen.compile.UnsafeVariableException;
import net.hydromatic.aspen.eval.Prop;
import net.hydromatic.aspen.ground.GroundAtom;
import net.hydromatic.aspen.output.OutputSpec;
import net.hydromatic.aspen.output.Projector;
import net.hydromatic.aspen.solve.InconsistentException;
import net.hydromatic.aspen.solve.SearchAbortedException;
import net.hydromatic.aspen.util.Tracer;
import net.hydromatic.aspen.util.Tracers;
import org.junit.jupiter.api.Test;

/** Tests {@link Engine}, end to end. */
public class EngineTest {
  private static final Set<Integer> ONE_TO_NINE =
      ImmutableSet.of(1, 2, 3, 4, 5, 6, 7, 8, 9);

  @SuppressWarnings("unchecked")
  private static List<List<Integer>> grid(Engine.Result result) {
    return (List<List<Integer>>) result.get("grid");
  }

  /** Checks that a grid is a valid sudoku solution. */
  private static void checkSudoku(List<List<Integer>> grid) {
    assertThat(grid.size(), is(9));
    for (int i = 0; i < 9; i++) {
      final Set<Integer> row = new HashSet<>();
      final Set<Integer> column = new HashSet<>();
      final Set<Integer> block = new HashSet<>();
      for (int j = 0; j < 9; j++) {
        row.add(grid.get(i).get(j));
        column.add(grid.get(j).get(i));
        block.add(grid.get(i / 3 * 3 + j / 3).get(i % 3 * 3 + j % 3));
      }
      assertThat(row, is(ONE_TO_NINE));
      assertThat(column, is(ONE_TO_NINE));
      assertThat(block, is(ONE_TO_NINE));
    }
  }

  @Test void testSudoku() {
    final Engine engine =
        Engine.create(Programs.sudoku(), Programs.sudokuOutput(),
            ImmutableMap.of());
    final Engine.Result result = engine.execute(Programs.sudokuFacts());
    final List<List<Integer>> grid = grid(result);
    assertThat(grid.get(0).get(0), is(5));
    checkSudoku(grid);
    assertThat(result.answerSet.atoms("v").size(), is(81));
  }

  @Test void testSudokuIsDeterministic() {
    final Engine engine =
        Engine.create(Programs.sudoku(), Programs.sudokuOutput(),
            ImmutableMap.of());
    final Engine.Result result0 = engine.execute(Programs.sudokuFacts());
    final Engine.Result result1 = engine.execute(Programs.sudokuFacts());
    assertThat(result1.answerSet, is(result0.answerSet));
    assertThat(result1.outputs, is(result0.outputs));
  }

  /** Several solvers race; whichever finishes first, the result is
   * valid. */
  @Test void testSudokuPortfolio() {
    final Map<Prop, Object> props = new HashMap<>();
    Prop.THREAD_COUNT.set(props, 3);
    final Engine engine =
        Engine.create(Programs.sudoku(), Programs.sudokuOutput(), props);
    final List<List<Integer>> grid =
        grid(engine.execute(Programs.sudokuFacts()));
    assertThat(grid.get(0).get(0), is(5));
    checkSudoku(grid);
  }

  @Test void testSudokuStepLimit() {
    final Map<Prop, Object> props = new HashMap<>();
    Prop.STEP_LIMIT.set(props, 1);
    final Engine engine =
        Engine.create(Programs.sudoku(), Programs.sudokuOutput(), props);
    final SearchAbortedException e =
        assertThrows(SearchAbortedException.class,
            () -> engine.execute(Programs.sudokuFacts()));
    assertThat(e.decisions, is(1L));
  }

  @Test void testTimetable() {
    final Engine engine =
        Engine.create(Programs.timetable(1, 3), Programs.timetableOutput(),
            ImmutableMap.of());
    final Engine.Result result =
        engine.execute(Programs.timetableFacts(2));
    final Set<?> lessons = (Set<?>) result.get("lessons");
    assertThat(lessons.size(), is(2));
    final Set<Object> periods = new HashSet<>();
    for (Object lesson : lessons) {
      final List<?> tuple = (List<?>) lesson;
      assertThat(tuple.subList(0, 3),
          is(ImmutableList.of("c1", "math", "t1")));
      periods.add(tuple.get(4));
    }
    assertThat(periods.size(), is(2));

    // The solver tries lessons in period order, so the free period is last.
    assertThat(result.get("schedule"),
        is(
            ImmutableMap.of("c1",
                ImmutableList.of(ImmutableList.of("math", "math", "-")))));
  }

  @Test void testTimetableAll() {
    final Engine engine =
        Engine.create(Programs.timetable(1, 3), Programs.timetableOutput(),
            ImmutableMap.of());
    final List<Engine.Result> results =
        engine.solveAll(Programs.timetableFacts(2), 0);
    // choose 2 periods of 3
    assertThat(results.size(), is(3));
    final Set<Object> schedules = new HashSet<>();
    for (Engine.Result result : results) {
      schedules.add(result.get("schedule"));
    }
    assertThat(schedules.size(), is(3));

    assertThat(engine.solveAll(Programs.timetableFacts(2), 2).size(), is(2));
  }

  /** Five lessons do not fit into three periods. */
  @Test void testTimetableInconsistent() {
    final Engine engine =
        Engine.create(Programs.timetable(1, 3), Programs.timetableOutput(),
            ImmutableMap.of());
    assertThat(engine.solveOne(Programs.timetableFacts(5)), nullValue());
    assertThat(engine.solveAll(Programs.timetableFacts(5), 0).isEmpty(),
        is(true));
    final InconsistentException e =
        assertThrows(InconsistentException.class,
            () -> engine.execute(Programs.timetableFacts(5)));
    assertThat(e.getMessage(), is("program has no answer set"));
  }

  /** As {@link #testTimetableInconsistent()}, but without simplification,
   * so that the solver rather than the grounder detects the
   * inconsistency. */
  @Test void testTimetableInconsistentWithoutSimplify() {
    final Map<Prop, Object> props = new HashMap<>();
    Prop.SIMPLIFY.set(props, false);
    final Engine engine =
        Engine.create(Programs.timetable(1, 3), Programs.timetableOutput(),
            props);
    assertThat(engine.solveOne(Programs.timetableFacts(5)), nullValue());
    assertThat(engine.solveOne(Programs.timetableFacts(2)), notNullValue());
  }

  @Test void testExhaustiveStrategyAgrees() {
    final Map<Prop, Object> props = new HashMap<>();
    Prop.STRATEGY.setLenient(props, "exhaustive");
    final Engine exhaustive =
        Engine.create(Programs.timetable(1, 3), Programs.timetableOutput(),
            props);
    final Engine search =
        Engine.create(Programs.timetable(1, 3), Programs.timetableOutput(),
            ImmutableMap.of());
    final Set<Object> expected = new HashSet<>();
    for (Engine.Result result
        : exhaustive.solveAll(Programs.timetableFacts(2), 0)) {
      expected.add(result.outputs);
    }
    final Set<Object> actual = new HashSet<>();
    for (Engine.Result result
        : search.solveAll(Programs.timetableFacts(2), 0)) {
      actual.add(result.outputs);
    }
    assertThat(actual, is(expected));
    assertThat(expected.size(), is(3));
  }

  @Test void testTracer() {
    final AtomicInteger groundCount = new AtomicInteger();
    final List<Object> results = new ArrayList<>();
    Tracer tracer = Tracers.empty();
    tracer = Tracers.withOnGround(tracer, p -> groundCount.incrementAndGet());
    tracer = Tracers.withOnResult(tracer, results::add);
    final Engine engine =
        Engine.create(Programs.timetable(1, 3), Programs.timetableOutput(),
            ImmutableMap.of(), Projector.create(),
            tracer);
    final List<Engine.Result> all =
        engine.solveAll(Programs.timetableFacts(2), 0);
    assertThat(groundCount.get(), is(1));
    assertThat(results, is(ImmutableList.<Object>copyOf(all)));
  }

  @Test void testUnsafeProgram() {
    final Ast.Program program =
        ast.program(
            ImmutableList.of(
                ast.rule(ast.atom("p", "X"), ast.pos("q", "Y"))));
    final UnsafeVariableException e =
        assertThrows(UnsafeVariableException.class,
            () -> Engine.create(program, OutputSpec.EMPTY,
                ImmutableMap.of()));
    assertThat(e.variable, is("X"));
  }

  @Test void testInvalidOutput() {
    final Ast.Program program =
        ast.program(ImmutableList.of(ast.fact("p", 1)));
    final OutputSpec spec =
        output.spec("x", output.set(output.query("p", "X"), "Y"));
    final SpecificationException e =
        assertThrows(SpecificationException.class,
            () -> Engine.create(program, spec, ImmutableMap.of()));
    assertThat(e.getMessage(),
        is("Variable Y in output 'x' is not bound by an enclosing query"));
  }

  @Test void testResultGet() {
    final Ast.Program program =
        ast.program(ImmutableList.of(ast.fact("p", ast.range(1, 3))));
    final Engine engine =
        Engine.create(program, output.spec("ps", output.set("p")),
            ImmutableMap.of());
    final Engine.Result result = engine.execute(ImmutableList.of());
    assertThat(result.get("ps"), is(ImmutableSet.of(1, 2, 3)));
    assertThat(result.answerSet.contains(GroundAtom.of("p", 2)), is(true));
    final IllegalArgumentException e =
        assertThrows(IllegalArgumentException.class,
            () -> result.get("qs"));
    assertThat(e.getMessage(), is("no output named qs"));
  }
}

// End EngineTest.java
