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
import net.hydromatic.aspen.ast.Ast;

/**
 * Result of grounding: the atom table, the set of atoms known to be true
 * (facts), and the ground rules.
 *
 * <p>A ground program is immutable, and may be shared between threads.
 */
public class GroundProgram {
  public final Ast.Program program;
  public final AtomTable atoms;
  public final ImmutableList<GroundRule> rules;
  public final ImmutableList<GroundAggregate> aggregates;
  private final BitSet facts;

  GroundProgram(Ast.Program program, AtomTable atoms, List<GroundRule> rules,
      List<GroundAggregate> aggregates, BitSet facts) {
    this.program = requireNonNull(program);
    this.atoms = requireNonNull(atoms);
    this.rules = ImmutableList.copyOf(rules);
    this.aggregates = ImmutableList.copyOf(aggregates);
    this.facts = (BitSet) facts.clone();
  }

  /** Whether an atom is a fact, that is, true in every answer set. */
  public boolean isFact(int atom) {
    return facts.get(atom);
  }

  /** Returns the number of facts. */
  public int factCount() {
    return facts.cardinality();
  }

  /** Returns the facts, in id order. */
  public List<GroundAtom> facts() {
    final ImmutableList.Builder<GroundAtom> list = ImmutableList.builder();
    facts.stream().forEach(id -> list.add(atoms.atom(id)));
    return list.build();
  }

  /** Returns the source rule of a ground rule. */
  public Ast.Rule sourceRule(GroundRule rule) {
    return program.rules.get(rule.ruleIndex);
  }

  @Override
  public String toString() {
    final StringBuilder b = new StringBuilder();
    for (GroundAtom fact : facts()) {
      b.append(fact).append(".\n");
    }
    for (GroundRule rule : rules) {
      b.append(rule.describe(this)).append('\n');
    }
    return b.toString();
  }
}

// End GroundProgram.java
