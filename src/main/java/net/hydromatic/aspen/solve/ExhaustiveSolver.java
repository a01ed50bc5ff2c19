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

import com.google.common.collect.ImmutableList;
import com.google.common.collect.Lists;
import java.util.ArrayList;
import java.util.BitSet;
import java.util.Iterator;
import java.util.List;
import net.hydromatic.aspen.ground.GroundProgram;
import net.hydromatic.aspen.util.Tracer;

/**
 * Finds answer sets by trying every assignment of the atoms that are not
 * facts, and keeping those that a {@link ModelChecker} accepts.
 *
 * <p>The cost is exponential in the number of atoms, so this is only
 * practical for small programs. It is useful as an oracle against which to
 * check {@link Solver}.
 */
public class ExhaustiveSolver implements Search {
  /** Greatest number of non-fact atoms that this solver will accept. */
  public static final int MAX_ATOMS = 24;

  private final GroundProgram program;
  private final Tracer tracer;
  private final ModelChecker checker;
  private final int[] atoms;
  private final Iterator<List<Boolean>> assignments;
  private long count;

  public ExhaustiveSolver(GroundProgram program, Tracer tracer) {
    this.program = program;
    this.tracer = tracer;
    this.checker = new ModelChecker(program);
    final List<Integer> list = new ArrayList<>();
    for (int id = 0; id < program.atoms.size(); id++) {
      if (!program.isFact(id)) {
        list.add(id);
      }
    }
    checkArgument(list.size() <= MAX_ATOMS,
        "too many atoms for exhaustive search: %s", list.size());
    this.atoms = list.stream().mapToInt(i -> i).toArray();
    final List<List<Boolean>> values = new ArrayList<>();
    for (int i = 0; i < atoms.length; i++) {
      values.add(ImmutableList.of(false, true));
    }
    this.assignments = Lists.cartesianProduct(values).iterator();
  }

  @Override public SolveResult next() {
    while (assignments.hasNext()) {
      final List<Boolean> assignment = assignments.next();
      ++count;
      final BitSet model = new BitSet(program.atoms.size());
      for (int id = 0; id < program.atoms.size(); id++) {
        if (program.isFact(id)) {
          model.set(id);
        }
      }
      for (int i = 0; i < atoms.length; i++) {
        if (assignment.get(i)) {
          model.set(atoms[i]);
        }
      }
      if (checker.isAnswerSet(model)) {
        final AnswerSet answerSet = new AnswerSet(program.atoms, model);
        tracer.onAnswerSet(answerSet);
        return new SolveResult(SolveResult.Status.SATISFIABLE, answerSet,
            count, 0);
      }
    }
    return new SolveResult(SolveResult.Status.INCONSISTENT, null, count, 0);
  }

  /** Returns all answer sets. */
  public List<AnswerSet> all() {
    final List<AnswerSet> list = new ArrayList<>();
    for (;;) {
      final SolveResult result = next();
      if (result.answerSet == null) {
        return list;
      }
      list.add(result.answerSet);
    }
  }
}

// End ExhaustiveSolver.java
