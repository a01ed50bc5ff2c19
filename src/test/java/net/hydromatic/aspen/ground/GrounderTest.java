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
package net.hydromatic.aspen.ground;

import static net.hydromatic.aspen.ast.AstBuilder.ast;

import static org.hamcrest.CoreMatchers.containsString;
import static org.hamcrest.CoreMatchers.is;
import static org.hamcrest.MatcherAssert.assertThat;
import static org.junit.jupiter.api.Assertions.assertThrows;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;
import net.hydromatic.aspen.ast.Ast;
import net.hydromatic.aspen.ast.Ast.CompOp;
import net.hydromatic.aspen.compile.SpecificationException;
import net.hydromatic.aspen.compile.TypeMismatchException;
import net.hydromatic.aspen.eval.Prop;
import org.junit.jupiter.api.Test;

/** Tests {@link Grounder}. */
public class GrounderTest {
  private static GroundProgram ground(Ast.Rule... rules) {
    return ground(ImmutableMap.of(), rules);
  }

  private static GroundProgram ground(Map<Prop, Object> props,
      Ast.Rule... rules) {
    return Grounder.ground(ast.program(ImmutableList.copyOf(rules)),
        ImmutableList.of(), props);
  }

  private static boolean isFact(GroundProgram program, GroundAtom atom) {
    final int id = program.atoms.id(atom);
    return id >= 0 && program.isFact(id);
  }

  private static List<String> describe(GroundProgram program) {
    return program.rules.stream()
        .map(rule -> rule.describe(program))
        .collect(Collectors.toList());
  }

  /** A positive program grounds to facts only. */
  @Test void testTransitiveClosure() {
    final GroundProgram program =
        ground(ast.fact("edge", 1, 2),
            ast.fact("edge", 2, 3),
            ast.fact("edge", 3, 4),
            ast.rule(ast.atom("path", "X", "Y"), ast.pos("edge", "X", "Y")),
            ast.rule(ast.atom("path", "X", "Z"), ast.pos("path", "X", "Y"),
                ast.pos("edge", "Y", "Z")));
    assertThat(program.rules.isEmpty(), is(true));
    assertThat(isFact(program, GroundAtom.of("path", 1, 4)), is(true));
    assertThat(isFact(program, GroundAtom.of("path", 2, 4)), is(true));
    assertThat(program.atoms.id(GroundAtom.of("path", 4, 1)), is(-1));
    final long pathCount = program.facts().stream()
        .filter(atom -> atom.predicate.equals("path"))
        .count();
    assertThat(pathCount, is(6L));
  }

  @Test void testRangeFact() {
    final GroundProgram program =
        ground(ast.fact("p", ast.range(1, 3)));
    assertThat(program.factCount(), is(3));
    assertThat(program.facts().toString(), is("[p(1), p(2), p(3)]"));
  }

  @Test void testRangeBoundsMustBeIntegers() {
    final TypeMismatchException e =
        assertThrows(TypeMismatchException.class,
            () -> ground(ast.fact("p", ast.range(1, "a"))));
    assertThat(e.getMessage(),
        containsString("Expected an integer but got a in range 1..a"));
  }

  @Test void testEmptyRange() {
    final GroundProgram program = ground(ast.fact("p", ast.range(3, 1)));
    assertThat(program.atoms.size(), is(0));
  }

  @Test void testDomains() {
    final GroundProgram program =
        Grounder.ground(
            ast.program(
                ImmutableList.of(
                    ast.rule(ast.atom("sq", "X", ast.times("X", "X")),
                        ast.pos("n", "X"))),
                ImmutableList.of(ast.domain("n", 1, 3),
                    ast.domain("color", ImmutableList.of("red", "Green")))),
            ImmutableList.of(), ImmutableMap.of());
    assertThat(isFact(program, GroundAtom.of("sq", 3, 9)), is(true));
    assertThat(isFact(program, GroundAtom.of("color", "Green")), is(true));
    assertThat(GroundAtom.of("color", "Green").toString(),
        is("color(\"Green\")"));
  }

  /** Negation of an atom that can never be derived is true. */
  @Test void testNegationOfUnknownAtom() {
    final GroundProgram program =
        ground(ast.fact("q", 1),
            ast.rule(ast.atom("p", "X"), ast.pos("q", "X"),
                ast.neg("r", "X")));
    assertThat(isFact(program, GroundAtom.of("p", 1)), is(true));
    assertThat(program.rules.isEmpty(), is(true));
  }

  /** Negation of a fact is false, so the rule instance disappears. */
  @Test void testNegationOfFact() {
    final GroundProgram program =
        ground(ast.fact("q", 1),
            ast.fact("r", 1),
            ast.rule(ast.atom("p", "X"), ast.pos("q", "X"),
                ast.neg("r", "X")));
    final GroundAtom p1 = GroundAtom.of("p", 1);
    assertThat(program.atoms.id(p1) >= 0, is(true));
    assertThat(isFact(program, p1), is(false));
    assertThat(program.rules.isEmpty(), is(true));
  }

  @Test void testNegationCycle() {
    final GroundProgram program =
        ground(ast.rule(ast.atom("a"), ast.neg("b")),
            ast.rule(ast.atom("b"), ast.neg("a")));
    assertThat(describe(program),
        is(ImmutableList.of("a :- not b.", "b :- not a.")));
  }

  @Test void testWithoutSimplify() {
    final Map<Prop, Object> props = new HashMap<>();
    Prop.SIMPLIFY.set(props, false);
    final GroundProgram program =
        ground(props, ast.fact("q", 1),
            ast.rule(ast.atom("p", "X"), ast.pos("q", "X")));
    assertThat(describe(program), is(ImmutableList.of("p(1) :- q(1).")));
    assertThat(isFact(program, GroundAtom.of("p", 1)), is(false));
  }

  @Test void testDisjunction() {
    final GroundProgram program =
        ground(ast.fact("c"),
            ast.rule(ast.disjunction(ast.atom("a"), ast.atom("b")),
                ast.pos("c")));
    assertThat(describe(program), is(ImmutableList.of("a v b.")));
    assertThat(program.rules.get(0).kind, is(GroundRule.Kind.DISJUNCTIVE));
  }

  /** A disjunction that is already satisfied by a fact is dropped. */
  @Test void testDisjunctionWithFact() {
    final GroundProgram program =
        ground(ast.fact("a"),
            ast.rule(ast.disjunction(ast.atom("a"), ast.atom("b"))));
    assertThat(program.rules.isEmpty(), is(true));
    assertThat(isFact(program, GroundAtom.of("a")), is(true));
  }

  @Test void testChoice() {
    final GroundProgram program =
        ground(ast.fact("p", ast.range(1, 3)),
            ast.rule(
                ast.exactly(1,
                    ast.choiceElement(ast.atom("pick", "X"),
                        ast.pos("p", "X")))));
    assertThat(describe(program),
        is(ImmutableList.of("1 {pick(1); pick(2); pick(3)} 1.")));
  }

  @Test void testChoiceCondition() {
    final GroundProgram program =
        ground(ast.fact("p", ast.range(1, 2)),
            ast.rule(
                ast.choice(
                    ast.choiceElement(ast.atom("pick", "X"),
                        ast.pos("p", "X"), ast.neg("bad", "X")))),
            ast.rule(ast.atom("bad", 2), ast.pos("pick", 1)));
    assertThat(describe(program),
        is(
            ImmutableList.of("{pick(1); pick(2) : not bad(2)}.",
                "bad(2) :- pick(1).")));
  }

  @Test void testAggregate() {
    final GroundProgram program =
        ground(ast.rule(ast.choice(
                ast.choiceElement(ast.atom("p", ast.range(1, 3))))),
            ast.constraint(
                ast.sum(ImmutableList.of("X"),
                    ImmutableList.of(ast.pos("p", "X")),
                    CompOp.NE, 3)));
    assertThat(program.aggregates.size(), is(1));
    assertThat(describe(program),
        is(
            ImmutableList.of("{p(1); p(2); p(3)}.",
                ":- #sum{1 : p(1); 2 : p(2); 3 : p(3)} != 3.")));
  }

  /** An aggregate whose value is decided by facts is evaluated during
   * grounding. */
  @Test void testAggregateFolded() {
    final GroundProgram program =
        ground(ast.fact("q", ast.range(1, 2)),
            ast.rule(ast.atom("ok"),
                ast.count(ImmutableList.of("X"),
                    ImmutableList.of(ast.pos("q", "X")), CompOp.GE, 2)),
            ast.rule(ast.atom("many"),
                ast.count(ImmutableList.of("X"),
                    ImmutableList.of(ast.pos("q", "X")), CompOp.GE, 3)));
    assertThat(isFact(program, GroundAtom.of("ok")), is(true));
    assertThat(isFact(program, GroundAtom.of("many")), is(false));
    assertThat(program.rules.isEmpty(), is(true));
    assertThat(program.aggregates.isEmpty(), is(true));
  }

  @Test void testSumWeightMustBeInteger() {
    final TypeMismatchException e =
        assertThrows(TypeMismatchException.class, () ->
            ground(ast.fact("q", "a"),
                ast.constraint(
                    ast.sum(ImmutableList.of("X"),
                        ImmutableList.of(ast.pos("q", "X")), CompOp.GT, 1))));
    assertThat(e.getMessage(), containsString("weight of #sum"));
  }

  /** Division by zero is undefined; the rule instance is dropped. */
  @Test void testUndefinedArithmetic() {
    final GroundProgram program =
        ground(ast.fact("p", ast.range(0, 2)),
            ast.rule(ast.atom("q", "X", ast.divide(6, "X")),
                ast.pos("p", "X")));
    assertThat(isFact(program, GroundAtom.of("q", 1, 6)), is(true));
    assertThat(isFact(program, GroundAtom.of("q", 2, 3)), is(true));
    assertThat(program.factCount(), is(5));
  }

  @Test void testComparisonTypeMismatch() {
    final TypeMismatchException e =
        assertThrows(TypeMismatchException.class, () ->
            ground(ast.fact("p", "a"),
                ast.rule(ast.atom("q", "X"), ast.pos("p", "X"),
                    ast.lt("X", 3))));
    assertThat(e.getMessage(), containsString("Cannot compare a < 3"));
    assertThat(e.getMessage(), containsString("in rule q(X) :- p(X), X < 3."));
  }

  @Test void testArithmeticTypeMismatch() {
    final TypeMismatchException e =
        assertThrows(TypeMismatchException.class, () ->
            ground(ast.fact("p", "a"),
                ast.rule(ast.atom("q", ast.plus("X", 1)), ast.pos("p", "X"))));
    assertThat(e.getMessage(),
        containsString("Arithmetic requires integers: a + 1"));
  }

  /** Equality between values of different types is false, not an
   * error. */
  @Test void testMixedEquality() {
    final GroundProgram program =
        ground(ast.fact("p", "a"),
            ast.fact("p", 1),
            ast.rule(ast.atom("q", "X"), ast.pos("p", "X"), ast.ne("X", 1)));
    assertThat(isFact(program, GroundAtom.of("q", "a")), is(true));
    assertThat(program.atoms.id(GroundAtom.of("q", 1)), is(-1));
  }

  @Test void testTooManyAtoms() {
    final Map<Prop, Object> props = new HashMap<>();
    Prop.MAX_GROUND_ATOMS.set(props, 100);
    final GroundingException e =
        assertThrows(GroundingException.class, () ->
            ground(props, ast.fact("n", 0),
                ast.rule(ast.atom("n", ast.plus("X", 1)), ast.pos("n", "X"))));
    assertThat(e.getMessage(),
        containsString("Number of ground atoms exceeds limit 100"));
  }

  @Test void testRangeAtEndOfIntegers() {
    final GroundProgram program =
        ground(
            ast.fact("p",
                ast.range(Integer.MAX_VALUE - 1, Integer.MAX_VALUE)));
    assertThat(program.facts().toString(),
        is("[p(2147483646), p(2147483647)]"));

    final Map<Prop, Object> props = new HashMap<>();
    Prop.MAX_GROUND_ATOMS.set(props, 100);
    final GroundingException e =
        assertThrows(GroundingException.class, () ->
            ground(props, ast.fact("p", ast.range(1, Integer.MAX_VALUE))));
    assertThat(e.getMessage(),
        is("Range 1..2147483647 in p(1..2147483647) yields more than 100 "
            + "ground atoms"));

    // The limit applies to the product of several ranges.
    assertThrows(GroundingException.class, () ->
        ground(props, ast.fact("q", ast.range(1, 10), ast.range(1, 11))));
  }

  @Test void testInputFacts() {
    final Ast.Program program =
        ast.program(
            ImmutableList.of(
                ast.rule(ast.atom("adult", "P"), ast.pos("age", "P", "A"),
                    ast.ge("A", 18))));
    final GroundProgram groundProgram =
        Grounder.ground(program,
            ImmutableList.of(GroundAtom.of("age", "ann", 30),
                GroundAtom.of("age", "bob", 12)),
            ImmutableMap.of());
    assertThat(isFact(groundProgram, GroundAtom.of("adult", "ann")),
        is(true));
    assertThat(groundProgram.atoms.id(GroundAtom.of("adult", "bob")), is(-1));

    final SpecificationException e =
        assertThrows(SpecificationException.class, () ->
            Grounder.ground(program,
                ImmutableList.of(GroundAtom.of("age", "ann")),
                ImmutableMap.of()));
    assertThat(e.getMessage(),
        is("Input fact age(ann) has arity 1 but predicate 'age' is used "
            + "with arity 2"));
  }
}

// End GrounderTest.java
