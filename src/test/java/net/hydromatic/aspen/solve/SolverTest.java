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

import static net.hydromatic.aspen.ast.AstBuilder.ast;

import static org.hamcrest.CoreMatchers.containsString;
import static org.hamcrest.CoreMatchers.is;
import static org.hamcrest.CoreMatchers.notNullValue;
import static org.hamcrest.CoreMatchers.nullValue;
import static org.hamcrest.MatcherAssert.assertThat;
import static org.junit.jupiter.api.Assertions.assertThrows;

import static java.util.Objects.requireNonNull;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import com.google.common.collect.ImmutableSet;
import java.util.ArrayList;
import java.util.BitSet;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.atomic.AtomicInteger;
import net.hydromatic.aspen.ast.Ast;
import net.hydromatic.aspen.ast.Ast.CompOp;
import net.hydromatic.aspen.eval.Prop;
import net.hydromatic.aspen.ground.GroundAtom;
import net.hydromatic.aspen.ground.GroundProgram;
import net.hydromatic.aspen.ground.Grounder;
import net.hydromatic.aspen.util.Tracer;
import net.hydromatic.aspen.util.Tracers;
import org.junit.jupiter.api.Test;

/** Tests {@link Solver}, {@link ExhaustiveSolver}, {@link PortfolioSolver}
 * and {@link ModelChecker}. */
public class SolverTest {
  private static GroundProgram ground(Ast.Program program) {
    return Grounder.ground(program, ImmutableList.of(), ImmutableMap.of());
  }

  private static GroundProgram ground(Ast.Rule... rules) {
    return ground(ast.program(ImmutableList.copyOf(rules)));
  }

  /** Returns the true atoms of each answer set, in the order that a search
   * finds them. */
  private static List<Set<GroundAtom>> all(Search search) {
    final List<Set<GroundAtom>> list = new ArrayList<>();
    for (;;) {
      final SolveResult result = search.next();
      if (result.status != SolveResult.Status.SATISFIABLE) {
        assertThat(result.status, is(SolveResult.Status.INCONSISTENT));
        return list;
      }
      list.add(requireNonNull(result.answerSet).atoms());
    }
  }

  private static List<Set<GroundAtom>> solveAll(GroundProgram program) {
    return all(new Solver(program, ImmutableMap.of(), Tracers.empty()));
  }

  private static Set<Set<GroundAtom>> exhaustive(GroundProgram program) {
    return ImmutableSet.copyOf(
        all(new ExhaustiveSolver(program, Tracers.empty())));
  }

  private static Set<GroundAtom> atoms(GroundAtom... atoms) {
    return ImmutableSet.copyOf(atoms);
  }

  private static GroundAtom atom(String name, Object... args) {
    return GroundAtom.of(name, args);
  }

  /** Checks that search finds each answer set exactly once, and finds the
   * same answer sets as exhaustive search and as the definition of answer
   * sets. Returns the number of answer sets. */
  private static int checkComplete(GroundProgram program) {
    final List<Set<GroundAtom>> list = solveAll(program);
    final Set<Set<GroundAtom>> set = ImmutableSet.copyOf(list);
    assertThat("duplicate answer set in " + list, set.size(),
        is(list.size()));
    assertThat(set, is(StableModels.of(program)));
    assertThat(set, is(exhaustive(program)));
    return list.size();
  }

  /** Two rules, each blocking the other, have two answer sets. */
  @Test void testEvenLoop() {
    final GroundProgram program =
        ground(ast.rule(ast.atom("a"), ast.neg("b")),
            ast.rule(ast.atom("b"), ast.neg("a")));
    final List<Set<GroundAtom>> list = solveAll(program);
    assertThat(ImmutableSet.copyOf(list),
        is(ImmutableSet.of(atoms(atom("a")), atoms(atom("b")))));
    assertThat(checkComplete(program), is(2));

    // A second search finds the same answer sets in the same order.
    assertThat(solveAll(program), is(list));
  }

  @Test void testOddLoop() {
    final GroundProgram program =
        ground(ast.rule(ast.atom("p"), ast.neg("p")));
    final SolveResult result =
        new Solver(program, ImmutableMap.of(), Tracers.empty()).next();
    assertThat(result.status, is(SolveResult.Status.INCONSISTENT));
    assertThat(result.answerSet, nullValue());
    assertThat(checkComplete(program), is(0));
  }

  /** An atom that only supports itself is false. */
  @Test void testPositiveLoop() {
    final GroundProgram program =
        ground(ast.rule(ast.atom("a"), ast.pos("b")),
            ast.rule(ast.atom("b"), ast.pos("a")),
            ast.rule(ast.choice(ast.choiceElement(ast.atom("c")))),
            ast.rule(ast.atom("a"), ast.pos("c")));
    assertThat(ImmutableSet.copyOf(solveAll(program)),
        is(
            ImmutableSet.of(atoms(),
                atoms(atom("a"), atom("b"), atom("c")))));
    assertThat(checkComplete(program), is(2));
  }

  @Test void testDisjunction() {
    final GroundProgram program =
        ground(ast.rule(ast.disjunction(ast.atom("a"), ast.atom("b"))));
    assertThat(ImmutableSet.copyOf(solveAll(program)),
        is(ImmutableSet.of(atoms(atom("a")), atoms(atom("b")))));
    assertThat(checkComplete(program), is(2));
  }

  /** Answer sets of a disjunctive program are minimal: {a, b} is a model of
   * "a v b. a :- b." but only {a} is an answer set. */
  @Test void testDisjunctionMinimal() {
    final GroundProgram program =
        ground(ast.rule(ast.disjunction(ast.atom("a"), ast.atom("b"))),
            ast.rule(ast.atom("a"), ast.pos("b")));
    assertThat(solveAll(program),
        is(ImmutableList.of(atoms(atom("a")))));
    assertThat(checkComplete(program), is(1));
  }

  /** In "a v b. a :- b. b :- a." each of a and b derives the other, so the
   * only answer set contains both. */
  @Test void testHeadCycle() {
    final GroundProgram program =
        ground(ast.rule(ast.disjunction(ast.atom("a"), ast.atom("b"))),
            ast.rule(ast.atom("a"), ast.pos("b")),
            ast.rule(ast.atom("b"), ast.pos("a")));
    assertThat(solveAll(program),
        is(ImmutableList.of(atoms(atom("a"), atom("b")))));
    assertThat(checkComplete(program), is(1));
  }

  /** A head cycle whose disjunction is conditional on a choice. */
  @Test void testHeadCycleWithChoice() {
    final GroundProgram program =
        ground(ast.rule(ast.choice(ast.choiceElement(ast.atom("c")))),
            ast.rule(ast.disjunction(ast.atom("a"), ast.atom("b")),
                ast.pos("c")),
            ast.rule(ast.atom("a"), ast.pos("b")),
            ast.rule(ast.atom("b"), ast.pos("a")),
            ast.rule(ast.atom("d"), ast.pos("a"), ast.neg("e")),
            ast.rule(ast.atom("e"), ast.pos("b"), ast.neg("d")));
    assertThat(ImmutableSet.copyOf(solveAll(program)),
        is(
            ImmutableSet.of(atoms(),
                atoms(atom("a"), atom("b"), atom("c"), atom("d")),
                atoms(atom("a"), atom("b"), atom("c"), atom("e")))));
    assertThat(checkComplete(program), is(3));
  }

  /** In "a :- #count{1 : a} >= 1." the aggregate can only be satisfied by a
   * itself, so a is false. */
  @Test void testRecursiveAggregate() {
    final GroundProgram program =
        ground(
            ast.rule(ast.atom("a"),
                ast.count(ImmutableList.of(1), ImmutableList.of(ast.pos("a")),
                    CompOp.GE, 1)));
    assertThat(solveAll(program), is(ImmutableList.of(atoms())));
    assertThat(checkComplete(program), is(1));
  }

  /** A recursive aggregate that another atom can satisfy. */
  @Test void testRecursiveAggregateWithSupport() {
    final GroundProgram program =
        ground(ast.rule(ast.choice(ast.choiceElement(ast.atom("c")))),
            ast.rule(ast.atom("a"),
                ast.aggregate(Ast.AggFunction.COUNT,
                    ImmutableList.of(
                        ast.aggElement(ImmutableList.of("x"), ast.pos("a")),
                        ast.aggElement(ImmutableList.of("y"), ast.pos("c"))),
                    CompOp.GE, 1)),
            ast.rule(ast.atom("b"),
                ast.sum(ImmutableList.of(2), ImmutableList.of(ast.pos("b")),
                    CompOp.GT, 1),
                ast.pos("c")));
    assertThat(ImmutableSet.copyOf(solveAll(program)),
        is(ImmutableSet.of(atoms(), atoms(atom("a"), atom("c")))));
    assertThat(checkComplete(program), is(2));
  }

  @Test void testChoiceCardinality() {
    final GroundProgram program =
        ground(
            ast.rule(
                ast.exactly(2,
                    ast.choiceElement(ast.atom("p", ast.range(1, 3))))));
    assertThat(checkComplete(program), is(3));
    for (Set<GroundAtom> answerSet : solveAll(program)) {
      assertThat(answerSet.size(), is(2));
    }
  }

  @Test void testSum() {
    final GroundProgram program =
        ground(
            ast.rule(
                ast.choice(ast.choiceElement(ast.atom("p", ast.range(1, 3))))),
            ast.constraint(
                ast.sum(ImmutableList.of("X"),
                    ImmutableList.of(ast.pos("p", "X")), CompOp.NE, 3)));
    assertThat(ImmutableSet.copyOf(solveAll(program)),
        is(
            ImmutableSet.of(atoms(atom("p", 1), atom("p", 2)),
                atoms(atom("p", 3)))));
    assertThat(checkComplete(program), is(2));
  }

  @Test void testAggregatesAgreeWithExhaustive() {
    final Ast.Rule choice =
        ast.rule(
            ast.choice(ast.choiceElement(ast.atom("p", ast.range(1, 4)))));
    checkComplete(
        ground(choice,
            ast.constraint(
                ast.aggregate(Ast.AggFunction.MAX,
                    ast.aggElement(ImmutableList.of("X"), ast.pos("p", "X")),
                    CompOp.GT, 2))));
    checkComplete(
        ground(choice,
            ast.constraint(
                ast.aggregate(Ast.AggFunction.MIN,
                    ast.aggElement(ImmutableList.of("X"), ast.pos("p", "X")),
                    CompOp.LT, 2))));
    checkComplete(
        ground(choice,
            ast.rule(ast.atom("none"),
                ast.not(
                    ast.count(ImmutableList.of("X"),
                        ImmutableList.of(ast.pos("p", "X")),
                        CompOp.GT, 0)))));
    checkComplete(
        ground(choice,
            ast.rule(ast.atom("q", "X"), ast.pos("p", "X"),
                ast.count(ImmutableList.of("Y"),
                    ImmutableList.of(ast.pos("p", "Y"), ast.lt("Y", "X")),
                    CompOp.GE, 1))));
  }

  /** Three-colorings of a triangle. */
  @Test void testColoring() {
    final GroundProgram program =
        ground(
            ast.program(
                ImmutableList.of(
                    ast.fact("edge", 1, 2),
                    ast.fact("edge", 2, 3),
                    ast.fact("edge", 1, 3),
                    ast.rule(
                        ast.exactly(1,
                            ast.choiceElement(ast.atom("color", "N", "C"),
                                ast.pos("col", "C"))),
                        ast.pos("node", "N")),
                    ast.constraint(ast.pos("edge", "X", "Y"),
                        ast.pos("color", "X", "C"),
                        ast.pos("color", "Y", "C"))),
                ImmutableList.of(ast.domain("node", 1, 3),
                    ast.domain("col", ImmutableList.of("r", "g", "b")))));
    assertThat(checkComplete(program), is(6));
  }

  private static GroundProgram pigeons(int pigeons, int holes) {
    return ground(
        ast.program(
            ImmutableList.of(
                ast.rule(
                    ast.exactly(1,
                        ast.choiceElement(ast.atom("in", "P", "H"),
                            ast.pos("hole", "H"))),
                    ast.pos("pigeon", "P")),
                ast.constraint(ast.pos("in", "P1", "H"),
                    ast.pos("in", "P2", "H"), ast.lt("P1", "P2"))),
            ImmutableList.of(ast.domain("pigeon", 1, pigeons),
                ast.domain("hole", 1, holes))));
  }

  @Test void testPigeonhole() {
    assertThat(checkComplete(pigeons(3, 3)), is(6));
    assertThat(checkComplete(pigeons(4, 3)), is(0));
  }

  @Test void testPortfolio() {
    final Map<Prop, Object> props = new HashMap<>();
    Prop.THREAD_COUNT.set(props, 4);
    final GroundProgram program = pigeons(5, 5);
    final SolveResult result =
        new PortfolioSolver(program, props, Tracers.empty()).solve();
    assertThat(result.status, is(SolveResult.Status.SATISFIABLE));
    final AnswerSet answerSet = requireNonNull(result.answerSet);
    assertThat(answerSet.atoms("in").size(), is(5));
    final BitSet model = new BitSet();
    for (GroundAtom atom : answerSet.atoms()) {
      model.set(program.atoms.id(atom));
    }
    assertThat(new ModelChecker(program).isAnswerSet(model), is(true));

    final SolveResult result2 =
        new PortfolioSolver(pigeons(5, 4), props, Tracers.empty()).solve();
    assertThat(result2.status, is(SolveResult.Status.INCONSISTENT));
  }

  @Test void testStepLimit() {
    final Map<Prop, Object> props = new HashMap<>();
    Prop.STEP_LIMIT.set(props, 1);
    final Solver solver =
        new Solver(pigeons(4, 4), props, Tracers.empty());
    final SolveResult result = solver.next();
    assertThat(result.status, is(SolveResult.Status.UNKNOWN));
    assertThat(result.decisions, is(1L));
    // Once stopped, a solver stays stopped.
    assertThat(solver.next().status, is(SolveResult.Status.UNKNOWN));
  }

  @Test void testCancel() {
    final Solver solver =
        new Solver(pigeons(3, 3), ImmutableMap.of(), Tracers.empty());
    solver.cancel();
    assertThat(solver.next().status, is(SolveResult.Status.UNKNOWN));
  }

  @Test void testTracer() {
    final AtomicInteger decisions = new AtomicInteger();
    final AtomicInteger conflicts = new AtomicInteger();
    final List<AnswerSet> answerSets = new ArrayList<>();
    Tracer tracer = Tracers.empty();
    tracer = Tracers.withOnDecision(tracer, a -> decisions.incrementAndGet());
    tracer = Tracers.withOnConflict(tracer, d -> conflicts.incrementAndGet());
    tracer = Tracers.withOnAnswerSet(tracer, answerSets::add);
    final Solver solver =
        new Solver(pigeons(3, 2), ImmutableMap.of(), tracer);
    final SolveResult result = solver.next();
    assertThat(result.status, is(SolveResult.Status.INCONSISTENT));
    assertThat(answerSets.isEmpty(), is(true));
    assertThat((long) decisions.get(), is(result.decisions));
    assertThat((long) conflicts.get(), is(result.conflicts));
    assertThat(conflicts.get() > 0, is(true));

    final List<Set<GroundAtom>> list =
        all(new Solver(pigeons(2, 2), ImmutableMap.of(), tracer));
    assertThat(answerSets.size(), is(2));
    assertThat(answerSets.get(0).atoms(), is(list.get(0)));
  }

  @Test void testModelChecker() {
    final GroundProgram program =
        ground(ast.rule(ast.atom("a"), ast.pos("b")),
            ast.rule(ast.atom("b"), ast.pos("a")),
            ast.rule(ast.choice(ast.choiceElement(ast.atom("c")))));
    final ModelChecker checker = new ModelChecker(program);
    final BitSet model = new BitSet();
    assertThat(checker.check(model), nullValue());
    model.set(program.atoms.id(atom("a")));
    // a without b violates "b :- a"
    assertThat(checker.check(model), notNullValue());
    model.set(program.atoms.id(atom("b")));
    // a and b support only each other
    final String failure = checker.check(model);
    assertThat(failure, notNullValue());
    assertThat(failure, containsString("unfounded"));

    // In a head cycle, both disjuncts may be true
    final GroundProgram program2 =
        ground(ast.rule(ast.disjunction(ast.atom("a"), ast.atom("b"))),
            ast.rule(ast.atom("a"), ast.pos("b")),
            ast.rule(ast.atom("b"), ast.pos("a")));
    final ModelChecker checker2 = new ModelChecker(program2);
    final BitSet model2 = new BitSet();
    model2.set(program2.atoms.id(atom("a")));
    assertThat(checker2.check(model2), containsString("b :- a."));
    model2.set(program2.atoms.id(atom("b")));
    assertThat(checker2.check(model2), nullValue());

    // An aggregate does not support the atom it depends on
    final GroundProgram program3 =
        ground(
            ast.rule(ast.atom("a"),
                ast.count(ImmutableList.of(1), ImmutableList.of(ast.pos("a")),
                    CompOp.GE, 1)));
    final BitSet model3 = new BitSet();
    model3.set(program3.atoms.id(atom("a")));
    assertThat(new ModelChecker(program3).check(model3),
        is("atom a is unfounded"));
  }

  @Test void testExhaustiveTooManyAtoms() {
    final GroundProgram program =
        ground(
            ast.rule(
                ast.choice(
                    ast.choiceElement(ast.atom("p", ast.range(1, 25))))));
    final IllegalArgumentException e =
        assertThrows(IllegalArgumentException.class,
            () -> new ExhaustiveSolver(program, Tracers.empty()));
    assertThat(e.getMessage(),
        is("too many atoms for exhaustive search: 25"));
  }

  @Test void testAnswerSetToString() {
    final GroundProgram program =
        ground(ast.fact("q", "x y"),
            ast.rule(ast.atom("p", 1), ast.neg("r")));
    final AnswerSet answerSet =
        requireNonNull(
            new Solver(program, ImmutableMap.of(), Tracers.empty())
                .next().answerSet);
    assertThat(answerSet.toString(), is("{p(1), q(\"x y\")}"));
    assertThat(answerSet.contains(atom("p", 1)), is(true));
    assertThat(answerSet.contains(atom("r")), is(false));
    final Set<GroundAtom> expected = new HashSet<>();
    expected.add(atom("p", 1));
    expected.add(atom("q", "x y"));
    assertThat(answerSet.atoms(), is(expected));
  }
}

// End SolverTest.java
