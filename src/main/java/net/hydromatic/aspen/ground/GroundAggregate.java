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

import static java.util.Objects.requireNonNull;

import com.google.common.collect.ImmutableList;
import java.util.BitSet;
import java.util.List;
import java.util.function.IntUnaryOperator;
import net.hydromatic.aspen.ast.Ast.AggFunction;
import net.hydromatic.aspen.ast.Ast.CompOp;

/**
 * Ground instance of an aggregate literal, such as
 * {@code #count{D,P : assign(c1,math,D,P)} != 2}.
 *
 * <p>Each element is a distinct tuple of values together with one or more
 * alternative conditions; the tuple contributes to the aggregate if any of
 * its conditions holds. The weight of a tuple is its first value (for
 * {@code #sum}, {@code #min} and {@code #max}) or 1 (for {@code #count}).
 */
public class GroundAggregate {
  /** Value of {@code #min} over an empty set. */
  static final long SUPREMUM = Long.MAX_VALUE;
  /** Value of {@code #max} over an empty set. */
  static final long INFIMUM = Long.MIN_VALUE;

  public final AggFunction function;
  public final CompOp op;
  public final int bound;
  public final ImmutableList<Element> elements;

  public GroundAggregate(AggFunction function, CompOp op, int bound,
      List<Element> elements) {
    this.function = requireNonNull(function);
    this.op = requireNonNull(op);
    this.bound = bound;
    this.elements = ImmutableList.copyOf(elements);
  }

  /**
   * Evaluates this aggregate in a partial assignment.
   *
   * <p>Computes the least and greatest value the aggregate can take given the
   * elements whose conditions are decided, and returns {@link
   * GroundCondition#TRUE} or {@link GroundCondition#FALSE} if the comparison
   * has the same outcome across that whole range.
   */
  public int status(IntUnaryOperator value) {
    long lo;
    long hi;
    switch (function) {
      case COUNT:
      case SUM:
        lo = 0;
        hi = 0;
        break;
      case MIN:
        lo = SUPREMUM;
        hi = SUPREMUM;
        break;
      case MAX:
        lo = INFIMUM;
        hi = INFIMUM;
        break;
      default:
        throw new AssertionError(function);
    }
    for (Element element : elements) {
      final int s = element.status(value);
      if (s == GroundCondition.FALSE) {
        continue;
      }
      final long w = element.weight;
      switch (function) {
        case COUNT:
        case SUM:
          if (s == GroundCondition.TRUE) {
            lo += w;
            hi += w;
          } else if (w < 0) {
            lo += w;
          } else {
            hi += w;
          }
          break;
        case MIN:
          lo = Math.min(lo, w);
          if (s == GroundCondition.TRUE) {
            hi = Math.min(hi, w);
          }
          break;
        case MAX:
          hi = Math.max(hi, w);
          if (s == GroundCondition.TRUE) {
            lo = Math.max(lo, w);
          }
          break;
        default:
          throw new AssertionError(function);
      }
    }
    return compare(lo, hi);
  }

  /** Given that the aggregate's value lies in {@code [lo, hi]}, returns
   * whether the comparison with the bound is certainly true, certainly
   * false, or undecided. */
  private int compare(long lo, long hi) {
    final long b = bound;
    final boolean alwaysTrue;
    final boolean alwaysFalse;
    switch (op) {
      case EQ:
        alwaysTrue = lo == b && hi == b;
        alwaysFalse = b < lo || b > hi;
        break;
      case NE:
        alwaysTrue = b < lo || b > hi;
        alwaysFalse = lo == b && hi == b;
        break;
      case LT:
        alwaysTrue = hi < b;
        alwaysFalse = lo >= b;
        break;
      case LE:
        alwaysTrue = hi <= b;
        alwaysFalse = lo > b;
        break;
      case GT:
        alwaysTrue = lo > b;
        alwaysFalse = hi <= b;
        break;
      case GE:
        alwaysTrue = lo >= b;
        alwaysFalse = hi < b;
        break;
      default:
        throw new AssertionError(op);
    }
    return alwaysTrue
        ? GroundCondition.TRUE
        : alwaysFalse ? GroundCondition.FALSE : GroundCondition.UNDEFINED;
  }

  /** Returns the ids of all atoms that this aggregate depends on. */
  public int[] atoms() {
    final BitSet set = new BitSet();
    for (Element element : elements) {
      for (GroundCondition condition : element.conditions) {
        for (int atom : condition.pos) {
          set.set(atom);
        }
        for (int atom : condition.neg) {
          set.set(atom);
        }
      }
    }
    return set.stream().toArray();
  }

  /** Appends a description of this aggregate to a buffer. */
  public StringBuilder describe(StringBuilder b, AtomIndex atoms) {
    b.append(function).append('{');
    int n = 0;
    for (Element element : elements) {
      for (GroundCondition condition : element.conditions) {
        if (n++ > 0) {
          b.append("; ");
        }
        Values.appendTuple(b, element.tuple);
        if (!condition.isEmpty()) {
          condition.describe(b.append(" : "), atoms);
        }
      }
    }
    return b.append("} ").append(op).append(' ').append(bound);
  }

  /** Distinct tuple of an aggregate, with its alternative conditions. */
  public static class Element {
    public final ImmutableList<Object> tuple;
    public final int weight;
    public final ImmutableList<GroundCondition> conditions;

    public Element(List<Object> tuple, int weight,
        List<GroundCondition> conditions) {
      this.tuple = ImmutableList.copyOf(tuple);
      this.weight = weight;
      this.conditions = ImmutableList.copyOf(conditions);
    }

    /** Returns whether this tuple is certainly in, certainly out, or
     * undecided. */
    int status(IntUnaryOperator value) {
      int result = GroundCondition.FALSE;
      for (GroundCondition condition : conditions) {
        final int s = condition.status(value);
        if (s == GroundCondition.TRUE) {
          return GroundCondition.TRUE;
        }
        if (s == GroundCondition.UNDEFINED) {
          result = GroundCondition.UNDEFINED;
        }
      }
      return result;
    }
  }
}

// End GroundAggregate.java
