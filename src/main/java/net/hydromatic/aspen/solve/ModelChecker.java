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

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.BitSet;
import java.util.Deque;
import java.util.List;
import java.util.function.IntUnaryOperator;
import net.hydromatic.aspen.ground.GroundCondition;
import net.hydromatic.aspen.ground.GroundProgram;
import net.hydromatic.aspen.ground.GroundRule;
import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * Checks whether a set of atoms is an answer set of a ground program.
 *
 * <p>A candidate {@code M} is accepted if it contains every fact, satisfies
 * every rule, and is a minimal model of the reduct of the program with
 * respect to {@code M}.
 *
 * <p>The reduct keeps the rules whose bodies, aggregates included, are true
 * in {@code M}; it evaluates them, aggregates included, in the smaller
 * candidate. A choice rule contributes, for each of its head atoms in
 * {@code M}, a rule that derives the atom from the body and the atom's
 * condition. If some proper subset of {@code M} is closed under the reduct,
 * the atoms of {@code M} outside that subset are unfounded.
 */
public class ModelChecker {
  private final GroundProgram program;

  public ModelChecker(GroundProgram program) {
    this.program = program;
  }

  /** Whether a set of atom ids is an answer set. */
  public boolean isAnswerSet(BitSet m) {
    return check(m) == null;
  }

  /** Returns a description of why a set of atom ids is not an answer set, or
   * null if it is one. */
  public @Nullable String check(BitSet m) {
    final IntUnaryOperator value = id ->
        m.get(id) ? GroundCondition.TRUE : GroundCondition.FALSE;
    for (int id = 0; id < program.atoms.size(); id++) {
      if (program.isFact(id) && !m.get(id)) {
        return "fact " + program.atoms.atom(id) + " is false";
      }
    }
    for (GroundRule rule : program.rules) {
      if (!bodyTrue(rule, value)) {
        continue;
      }
      switch (rule.kind) {
        case CONSTRAINT:
          return "constraint violated: " + rule.describe(program);
        case NORMAL:
          if (!m.get(rule.head[0])) {
            return "rule not satisfied: " + rule.describe(program);
          }
          break;
        case DISJUNCTIVE:
          if (countTrue(rule.head, m) == 0) {
            return "rule not satisfied: " + rule.describe(program);
          }
          break;
        case CHOICE:
          final int count = countChosen(rule, value);
          if (count < rule.lower || count > rule.upper) {
            return "choice has " + count + " atoms: "
                + rule.describe(program);
          }
          break;
        default:
          throw new AssertionError(rule.kind);
      }
    }
    final @Nullable BitSet smaller = new Reduct(m, value).smallerModel();
    if (smaller != null) {
      final BitSet unfounded = (BitSet) m.clone();
      unfounded.andNot(smaller);
      return "atom " + program.atoms.atom(unfounded.nextSetBit(0))
          + " is unfounded";
    }
    return null;
  }

  /** Whether the body of a rule, including its aggregates, is true in a
   * complete assignment. */
  private boolean bodyTrue(GroundRule rule, IntUnaryOperator value) {
    return status(rule, null, value) == GroundCondition.TRUE;
  }

  /** Evaluates the body of a rule, its aggregates and an optional extra
   * condition in a possibly partial assignment. */
  private int status(GroundRule rule, @Nullable GroundCondition condition,
      IntUnaryOperator value) {
    int result = rule.body.status(value);
    if (result == GroundCondition.FALSE) {
      return result;
    }
    for (int i = 0; i < rule.aggregates.length; i++) {
      int s = program.aggregates.get(rule.aggregates[i]).status(value);
      if (rule.aggregateNegated[i]) {
        s = -s;
      }
      if (s == GroundCondition.FALSE) {
        return s;
      }
      if (s == GroundCondition.UNDEFINED) {
        result = s;
      }
    }
    if (condition != null) {
      final int s = condition.status(value);
      if (s == GroundCondition.FALSE) {
        return s;
      }
      if (s == GroundCondition.UNDEFINED) {
        result = s;
      }
    }
    return result;
  }

  private static int countTrue(int[] atoms, BitSet m) {
    int n = 0;
    for (int atom : atoms) {
      if (m.get(atom)) {
        ++n;
      }
    }
    return n;
  }

  /** Returns the number of head atoms of a choice rule that are true and have
   * a true condition. */
  static int countChosen(GroundRule rule, IntUnaryOperator value) {
    int n = 0;
    for (int i = 0; i < rule.head.length; i++) {
      if (value.applyAsInt(rule.head[i]) == GroundCondition.TRUE
          && anyTrue(rule.headConditions.get(i), value)) {
        ++n;
      }
    }
    return n;
  }

  private static boolean anyTrue(List<GroundCondition> conditions,
      IntUnaryOperator value) {
    for (GroundCondition condition : conditions) {
      if (condition.status(value) == GroundCondition.TRUE) {
        return true;
      }
    }
    return false;
  }

  /**
   * Reduct of the program with respect to a model {@code M}, and a search
   * for a model of the reduct that is a proper subset of {@code M}.
   *
   * <p>The search assigns the atoms of {@code M} that are not facts; atoms
   * outside {@code M} are false throughout. Propagation first derives the
   * atoms that every such model must contain. For a program without
   * disjunction or non-monotone aggregates these are all of {@code M} when
   * {@code M} is minimal, and no branching is needed.
   */
  private class Reduct {
    private final int[] values;
    private final IntUnaryOperator valueOf;
    /** Atoms of {@code M} that are not facts, in id order. */
    private final int[] open;
    private final List<Implication> implications = new ArrayList<>();
    private final List<List<Implication>> watches = new ArrayList<>();
    private final int[] trail;
    private int trailSize;
    private final Deque<Implication> queue = new ArrayDeque<>();

    Reduct(BitSet m, IntUnaryOperator value) {
      final int atomCount = program.atoms.size();
      this.values = new int[atomCount];
      this.valueOf = id -> values[id];
      final List<Integer> openList = new ArrayList<>();
      for (int id = 0; id < atomCount; id++) {
        if (!m.get(id)) {
          values[id] = GroundCondition.FALSE;
        } else if (program.isFact(id)) {
          values[id] = GroundCondition.TRUE;
        } else {
          values[id] = GroundCondition.UNDEFINED;
          openList.add(id);
        }
        watches.add(new ArrayList<>());
      }
      this.open = openList.stream().mapToInt(i -> i).toArray();
      this.trail = new int[open.length];

      for (GroundRule rule : program.rules) {
        if (rule.kind == GroundRule.Kind.CONSTRAINT
            || !bodyTrue(rule, value)) {
          continue;
        }
        switch (rule.kind) {
          case NORMAL:
          case DISJUNCTIVE:
            add(new Implication(rule, null, inModel(rule.head, m)));
            break;
          case CHOICE:
            for (int i = 0; i < rule.head.length; i++) {
              if (!m.get(rule.head[i])) {
                continue;
              }
              for (GroundCondition condition : rule.headConditions.get(i)) {
                if (condition.status(value) == GroundCondition.TRUE) {
                  add(new Implication(rule, condition,
                      new int[] {rule.head[i]}));
                }
              }
            }
            break;
          default:
            throw new AssertionError(rule.kind);
        }
      }
    }

    private int[] inModel(int[] atoms, BitSet m) {
      return Arrays.stream(atoms).filter(m::get).toArray();
    }

    private void add(Implication implication) {
      implications.add(implication);
      final BitSet atoms = new BitSet();
      final GroundRule rule = implication.rule;
      for (int atom : rule.body.pos) {
        atoms.set(atom);
      }
      for (int aggregate : rule.aggregates) {
        for (int atom : program.aggregates.get(aggregate).atoms()) {
          atoms.set(atom);
        }
      }
      if (implication.condition != null) {
        for (int atom : implication.condition.pos) {
          atoms.set(atom);
        }
      }
      for (int atom : implication.heads) {
        atoms.set(atom);
      }
      atoms.stream()
          .filter(atom -> values[atom] == GroundCondition.UNDEFINED)
          .forEach(atom -> watches.get(atom).add(implication));
    }

    /** Returns a model of the reduct that is a proper subset of {@code M},
     * or null if {@code M} is minimal. */
    @Nullable BitSet smallerModel() {
      // Each decision makes an atom false; once flipped, it is true.
      final Deque<int[]> decisions = new ArrayDeque<>();
      queue.addAll(implications);
      boolean conflict = !propagate();
      for (;;) {
        if (conflict) {
          for (;;) {
            final int[] decision = decisions.peek();
            if (decision == null) {
              return null;
            }
            undo(decision[1]);
            if (decision[2] == 0) {
              decision[2] = 1;
              assign(decision[0], GroundCondition.TRUE);
              break;
            }
            decisions.pop();
          }
        } else {
          final int atom = nextUndefined();
          if (atom < 0) {
            if (anyFalse()) {
              return model();
            }
            conflict = true;
            continue;
          }
          decisions.push(new int[] {atom, trailSize, 0});
          assign(atom, GroundCondition.FALSE);
        }
        conflict = !propagate();
      }
    }

    private void assign(int atom, int value) {
      values[atom] = value;
      trail[trailSize++] = atom;
      queue.addAll(watches.get(atom));
    }

    private void undo(int trailIndex) {
      while (trailSize > trailIndex) {
        values[trail[--trailSize]] = GroundCondition.UNDEFINED;
      }
    }

    /** Propagates to a fixpoint. Returns false on conflict. */
    private boolean propagate() {
      while (!queue.isEmpty()) {
        if (!propagate(queue.remove())) {
          queue.clear();
          return false;
        }
      }
      return true;
    }

    /** If the body of an implication is true, ensures that one of its head
     * atoms is true. */
    private boolean propagate(Implication implication) {
      if (status(implication.rule, implication.condition, valueOf)
          != GroundCondition.TRUE) {
        return true;
      }
      int undefinedCount = 0;
      int undefinedAtom = -1;
      for (int atom : implication.heads) {
        if (values[atom] == GroundCondition.TRUE) {
          return true;
        }
        if (values[atom] == GroundCondition.UNDEFINED) {
          ++undefinedCount;
          undefinedAtom = atom;
        }
      }
      if (undefinedCount == 0) {
        return false;
      }
      if (undefinedCount == 1) {
        assign(undefinedAtom, GroundCondition.TRUE);
      }
      return true;
    }

    private int nextUndefined() {
      for (int atom : open) {
        if (values[atom] == GroundCondition.UNDEFINED) {
          return atom;
        }
      }
      return -1;
    }

    private boolean anyFalse() {
      for (int atom : open) {
        if (values[atom] == GroundCondition.FALSE) {
          return true;
        }
      }
      return false;
    }

    private BitSet model() {
      final BitSet model = new BitSet(values.length);
      for (int id = 0; id < values.length; id++) {
        if (values[id] == GroundCondition.TRUE) {
          model.set(id);
        }
      }
      return model;
    }
  }

  /** Rule of the reduct: if the body of {@code rule} (and
   * {@code condition}, if present) holds, one of {@code heads} is true. */
  private static class Implication {
    final GroundRule rule;
    final @Nullable GroundCondition condition;
    final int[] heads;

    Implication(GroundRule rule, @Nullable GroundCondition condition,
        int[] heads) {
      this.rule = rule;
      this.condition = condition;
      this.heads = heads;
    }
  }
}

// End ModelChecker.java
