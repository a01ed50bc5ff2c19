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
import java.util.List;

/**
 * Ground instance of a rule.
 *
 * <p>The head is one of four kinds (see {@link Kind}); the body is a
 * conjunction of positive atoms, negated atoms and aggregate literals. All
 * atoms are referenced by their id in the {@link AtomTable}.
 *
 * <p>Instances are immutable. The arrays are exposed for speed and must not
 * be modified.
 */
public class GroundRule {
  public final Kind kind;
  /** Head atoms, distinct. Empty for a constraint, one atom for a normal
   * rule. */
  public final int[] head;
  /** For a choice rule, the alternative conditions under which each head atom
   * may be chosen; parallel to {@link #head}. Empty for other kinds. */
  public final ImmutableList<ImmutableList<GroundCondition>> headConditions;
  /** For a choice rule, the least number of head atoms that must be true. */
  public final int lower;
  /** For a choice rule, the greatest number of head atoms that may be
   * true. */
  public final int upper;
  public final GroundCondition body;
  /** Indexes into {@link GroundProgram#aggregates}. */
  public final int[] aggregates;
  /** Whether each aggregate literal is negated; parallel to
   * {@link #aggregates}. */
  public final boolean[] aggregateNegated;
  /** Index of the rule in the source program from which this instance was
   * created. */
  public final int ruleIndex;

  GroundRule(Kind kind, int[] head,
      List<ImmutableList<GroundCondition>> headConditions, int lower,
      int upper, GroundCondition body, int[] aggregates,
      boolean[] aggregateNegated, int ruleIndex) {
    this.kind = requireNonNull(kind);
    this.head = requireNonNull(head);
    this.headConditions = ImmutableList.copyOf(headConditions);
    this.lower = lower;
    this.upper = upper;
    this.body = requireNonNull(body);
    this.aggregates = requireNonNull(aggregates);
    this.aggregateNegated = requireNonNull(aggregateNegated);
    this.ruleIndex = ruleIndex;
  }

  /** Returns a description of this rule, such as
   * {@code "a v b :- c, not d."}. */
  public String describe(GroundProgram program) {
    final StringBuilder b = new StringBuilder();
    final AtomTable atoms = program.atoms;
    switch (kind) {
      case NORMAL:
        b.append(atoms.atom(head[0]));
        break;
      case DISJUNCTIVE:
        for (int i = 0; i < head.length; i++) {
          if (i > 0) {
            b.append(" v ");
          }
          b.append(atoms.atom(head[i]));
        }
        break;
      case CHOICE:
        if (lower > 0) {
          b.append(lower).append(' ');
        }
        b.append('{');
        for (int i = 0; i < head.length; i++) {
          for (GroundCondition condition : headConditions.get(i)) {
            if (b.charAt(b.length() - 1) != '{') {
              b.append("; ");
            }
            b.append(atoms.atom(head[i]));
            if (!condition.isEmpty()) {
              condition.describe(b.append(" : "), atoms);
            }
          }
        }
        b.append('}');
        if (upper != Integer.MAX_VALUE) {
          b.append(' ').append(upper);
        }
        break;
      default:
        break;
    }
    if (!body.isEmpty() || aggregates.length > 0) {
      if (b.length() > 0) {
        b.append(' ');
      }
      b.append(":- ");
      body.describe(b, atoms);
      for (int i = 0; i < aggregates.length; i++) {
        if (b.charAt(b.length() - 1) != ' ') {
          b.append(", ");
        }
        if (aggregateNegated[i]) {
          b.append("not ");
        }
        program.aggregates.get(aggregates[i]).describe(b, atoms);
      }
    }
    return b.append('.').toString();
  }

  /** Kind of rule head. */
  public enum Kind {
    /** Empty head; the body must not be true. */
    CONSTRAINT,
    /** Single atom, which is true if the body is true. */
    NORMAL,
    /** Disjunction of atoms; if the body is true, at least one atom is true,
     * and minimality applies to the whole disjunction. */
    DISJUNCTIVE,
    /** Choice of atoms; if the body is true, each atom whose condition holds
     * may be true, subject to the bounds. Chosen atoms need no other
     * support. */
    CHOICE
  }
}

// End GroundRule.java
