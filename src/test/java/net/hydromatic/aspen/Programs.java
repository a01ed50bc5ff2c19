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

import com.google.common.collect.ImmutableList;
import java.util.List;
import net.hydromatic.aspen.ast.Ast;
import net.hydromatic.aspen.ast.Ast.CompOp;
import net.hydromatic.aspen.ground.GroundAtom;
import net.hydromatic.aspen.output.OutputSpec;

/** Programs, facts and output specifications used by several tests. */
public class Programs {
  private Programs() {}

  /** Sudoku. Input facts {@code initial(Row, Column, Value)} give the
   * starting grid, with 0 for an empty cell. */
  public static Ast.Program sudoku() {
    return ast.program(
        ImmutableList.of(
            ast.rule(ast.atom("cell", "R", "C"),
                ast.pos("idx", "R"), ast.pos("idx", "C")),
            ast.rule(
                ast.atom("block", "R", "C",
                    ast.plus(ast.times(ast.divide("R", 3), 3),
                        ast.divide("C", 3))),
                ast.pos("cell", "R", "C")),
            ast.rule(
                ast.exactly(1,
                    ast.choiceElement(ast.atom("v", "R", "C", "N"),
                        ast.pos("num", "N"))),
                ast.pos("cell", "R", "C")),
            // each value at most once per row
            ast.constraint(ast.pos("v", "R", "C1", "N"),
                ast.pos("v", "R", "C2", "N"), ast.lt("C1", "C2")),
            // ... per column
            ast.constraint(ast.pos("v", "R1", "C", "N"),
                ast.pos("v", "R2", "C", "N"), ast.lt("R1", "R2")),
            // ... per block
            ast.constraint(ast.pos("v", "R1", "C1", "N"),
                ast.pos("v", "R2", "C2", "N"), ast.lt("R1", "R2"),
                ast.pos("block", "R1", "C1", "B"),
                ast.pos("block", "R2", "C2", "B")),
            ast.constraint(ast.pos("initial", "R", "C", "N"),
                ast.ne("N", 0), ast.neg("v", "R", "C", "N"))),
        ImmutableList.of(ast.domain("idx", 0, 8), ast.domain("num", 1, 9)));
  }

  /** Output of {@link #sudoku()}: the grid as a list of rows. */
  public static OutputSpec sudokuOutput() {
    return output.spec("grid",
        output.sequence(output.query("idx", "R"), "R",
            output.sequence(output.query("v", "R", "C", "N"), "C", "N")));
  }

  /** Input facts for a sudoku grid whose only given cell is (0, 0) = 5. */
  public static List<GroundAtom> sudokuFacts() {
    final ImmutableList.Builder<GroundAtom> facts = ImmutableList.builder();
    for (int r = 0; r < 9; r++) {
      for (int c = 0; c < 9; c++) {
        facts.add(GroundAtom.of("initial", r, c, r == 0 && c == 0 ? 5 : 0));
      }
    }
    return facts.build();
  }

  /**
   * Timetabling.
   *
   * <p>Each class has at most one lesson in each (day, period) slot; each
   * teacher teaches at most one lesson in each slot; each class has exactly
   * {@code N} lessons of a subject if {@code requires(Class, Subject, N)}.
   * Slots without a lesson are filled with "-".
   */
  public static Ast.Program timetable(int days, int periods) {
    return ast.program(
        ImmutableList.of(
            ast.rule(ast.atom("slot", "D", "P"),
                ast.pos("day", "D"), ast.pos("period", "P")),
            ast.rule(
                ast.choice(null,
                    ImmutableList.of(
                        ast.choiceElement(
                            ast.atom("assign", "C", "S", "T", "D", "P"),
                            ast.pos("requires", "C", "S", "N"),
                            ast.pos("qualified", "T", "S"))),
                    1),
                ast.pos("class", "C"), ast.pos("slot", "D", "P")),
            ast.constraint(ast.pos("teacher", "T"), ast.pos("slot", "D", "P"),
                ast.count(ImmutableList.of("C", "S"),
                    ImmutableList.of(
                        ast.pos("assign", "C", "S", "T", "D", "P")),
                    CompOp.GT, 1)),
            ast.constraint(ast.pos("requires", "C", "S", "N"),
                ast.count(ImmutableList.of("D", "P", "T"),
                    ImmutableList.of(
                        ast.pos("assign", "C", "S", "T", "D", "P")),
                    CompOp.NE, "N")),
            ast.rule(ast.atom("busy", "C", "D", "P"),
                ast.pos("assign", "C", "S", "T", "D", "P")),
            ast.rule(ast.atom("entry", "C", "D", "P", "S"),
                ast.pos("assign", "C", "S", "T", "D", "P")),
            ast.rule(ast.atom("entry", "C", "D", "P", "-"),
                ast.pos("class", "C"), ast.pos("slot", "D", "P"),
                ast.neg("busy", "C", "D", "P"))),
        ImmutableList.of(ast.domain("day", 0, days - 1),
            ast.domain("period", 0, periods - 1)));
  }

  /** Output of {@link #timetable}: the set of lessons, and for each class
   * a list of days, each a list of periods. */
  public static OutputSpec timetableOutput() {
    return output.spec(
        "lessons",
        output.set(output.query("assign", "C", "S", "T", "D", "P"),
            output.tuple("C", "S", "T", "D", "P")),
        "schedule",
        output.mapping(output.query("class", "C"), "C",
            output.sequence(output.query("day", "D"), "D",
                output.sequence(output.query("entry", "C", "D", "P", "S"),
                    "P", "S"))));
  }

  /** Input facts for a timetable with one class that requires
   * {@code weeklyPeriods} lessons of one subject, taught by one teacher. */
  public static List<GroundAtom> timetableFacts(int weeklyPeriods) {
    return ImmutableList.of(
        GroundAtom.of("class", "c1"),
        GroundAtom.of("subject", "math"),
        GroundAtom.of("teacher", "t1"),
        GroundAtom.of("qualified", "t1", "math"),
        GroundAtom.of("requires", "c1", "math", weeklyPeriods));
  }
}

// End Programs.java
