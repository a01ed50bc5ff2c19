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

import com.google.common.collect.ImmutableSet;
import java.util.ArrayList;
import java.util.BitSet;
import java.util.List;
import java.util.Set;
import net.hydromatic.aspen.ground.GroundAggregate;
import net.hydromatic.aspen.ground.GroundAtom;
import net.hydromatic.aspen.ground.GroundCondition;
import net.hydromatic.aspen.ground.GroundProgram;
import net.hydromatic.aspen.ground.GroundRule;

/**
 * Computes the answer sets of a small ground program directly from their
 * definition, without using {@link ModelChecker} or the three-valued
 * evaluation of conditions and aggregates.
 *
 * <p>A set {@code M} of atoms is an answer set if it is a model of the
 * program and no proper subset of {@code M} is a model of the reduct with
 * respect to {@code M}. The reduct consists of the rules whose bodies are
 * true in {@code M}, evaluated in the subset; a choice rule derives each of
 * its head atoms in {@code M} from the body and the atom's condition.
 *
 * <p>Both sets are enumerated by brute force, so the cost is exponential.
 */
class StableModels {
  /** Greatest number of non-fact atoms. */
  static final int MAX_ATOMS = 14;

  private final GroundProgram program;
  private final int[] atoms;

  private StableModels(GroundProgram program) {
    this.program = program;
    final List<Integer> list = new ArrayList<>();
    for (int id = 0; id < program.atoms.size(); id++) {
      if (!program.isFact(id)) {
        list.add(id);
      }
    }
    checkArgument(list.size() <= MAX_ATOMS, "too many atoms: %s",
        list.size());
    this.atoms = list.stream().mapToInt(i -> i).toArray();
  }

  /** Returns the answer sets of a program. */
  static Set<Set<GroundAtom>> of(GroundProgram program) {
    return new StableModels(program).compute();
  }

  private Set<Set<GroundAtom>> compute() {
    final ImmutableSet.Builder<Set<GroundAtom>> answerSets =
        ImmutableSet.builder();
    for (int mask = 0; mask < 1 << atoms.length; mask++) {
      final BitSet m = toSet(mask);
      if (isModel(m) && isMinimal(m, mask)) {
        final ImmutableSet.Builder<GroundAtom> answerSet =
            ImmutableSet.builder();
        m.stream().forEach(id -> answerSet.add(program.atoms.atom(id)));
        answerSets.add(answerSet.build());
      }
    }
    return answerSets.build();
  }

  private BitSet toSet(int mask) {
    final BitSet set = new BitSet();
    for (int id = 0; id < program.atoms.size(); id++) {
      if (program.isFact(id)) {
        set.set(id);
      }
    }
    for (int i = 0; i < atoms.length; i++) {
      if ((mask & 1 << i) != 0) {
        set.set(atoms[i]);
      }
    }
    return set;
  }

  private boolean isModel(BitSet m) {
    for (GroundRule rule : program.rules) {
      if (!body(rule, m)) {
        continue;
      }
      switch (rule.kind) {
        case CONSTRAINT:
          return false;
        case NORMAL:
        case DISJUNCTIVE:
          if (!anyIn(rule.head, m)) {
            return false;
          }
          break;
        case CHOICE:
          int count = 0;
          for (int i = 0; i < rule.head.length; i++) {
            if (m.get(rule.head[i])
                && anyHolds(rule.headConditions.get(i), m)) {
              ++count;
            }
          }
          if (count < rule.lower || count > rule.upper) {
            return false;
          }
          break;
        default:
          throw new AssertionError(rule.kind);
      }
    }
    return true;
  }

  /** Whether no proper subset of {@code m} is a model of the reduct. */
  private boolean isMinimal(BitSet m, int mask) {
    if (mask == 0) {
      return true;
    }
    for (int sub = (mask - 1) & mask; ; sub = (sub - 1) & mask) {
      if (isReductModel(toSet(sub), m)) {
        return false;
      }
      if (sub == 0) {
        return true;
      }
    }
  }

  private boolean isReductModel(BitSet n, BitSet m) {
    for (GroundRule rule : program.rules) {
      if (rule.kind == GroundRule.Kind.CONSTRAINT || !body(rule, m)) {
        continue;
      }
      final boolean body = body(rule, n);
      switch (rule.kind) {
        case NORMAL:
        case DISJUNCTIVE:
          if (body && !anyIn(rule.head, n)) {
            return false;
          }
          break;
        case CHOICE:
          for (int i = 0; i < rule.head.length; i++) {
            if (!m.get(rule.head[i]) || n.get(rule.head[i])) {
              continue;
            }
            for (GroundCondition condition : rule.headConditions.get(i)) {
              if (holds(condition, m) && body && holds(condition, n)) {
                return false;
              }
            }
          }
          break;
        default:
          throw new AssertionError(rule.kind);
      }
    }
    return true;
  }

  private boolean body(GroundRule rule, BitSet set) {
    if (!holds(rule.body, set)) {
      return false;
    }
    for (int i = 0; i < rule.aggregates.length; i++) {
      final GroundAggregate aggregate =
          program.aggregates.get(rule.aggregates[i]);
      if (holds(aggregate, set) == rule.aggregateNegated[i]) {
        return false;
      }
    }
    return true;
  }

  private static boolean holds(GroundCondition condition, BitSet set) {
    for (int atom : condition.pos) {
      if (!set.get(atom)) {
        return false;
      }
    }
    for (int atom : condition.neg) {
      if (set.get(atom)) {
        return false;
      }
    }
    return true;
  }

  private static boolean anyHolds(List<GroundCondition> conditions,
      BitSet set) {
    for (GroundCondition condition : conditions) {
      if (holds(condition, set)) {
        return true;
      }
    }
    return false;
  }

  private static boolean anyIn(int[] atoms, BitSet set) {
    for (int atom : atoms) {
      if (set.get(atom)) {
        return true;
      }
    }
    return false;
  }

  private static boolean holds(GroundAggregate aggregate, BitSet set) {
    long count = 0;
    long sum = 0;
    long min = Long.MAX_VALUE;
    long max = Long.MIN_VALUE;
    for (GroundAggregate.Element element : aggregate.elements) {
      if (anyHolds(element.conditions, set)) {
        ++count;
        sum += element.weight;
        min = Math.min(min, element.weight);
        max = Math.max(max, element.weight);
      }
    }
    final long value;
    switch (aggregate.function) {
      case COUNT:
        value = count;
        break;
      case SUM:
        value = sum;
        break;
      case MIN:
        value = min;
        break;
      case MAX:
        value = max;
        break;
      default:
        throw new AssertionError(aggregate.function);
    }
    final long bound = aggregate.bound;
    switch (aggregate.op) {
      case EQ:
        return value == bound;
      case NE:
        return value != bound;
      case LT:
        return value < bound;
      case LE:
        return value <= bound;
      case GT:
        return value > bound;
      case GE:
        return value >= bound;
      default:
        throw new AssertionError(aggregate.op);
    }
  }
}

// End StableModels.java
