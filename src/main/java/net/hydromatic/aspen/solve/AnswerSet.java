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

import static java.util.Objects.requireNonNull;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableSortedSet;
import java.util.ArrayList;
import java.util.BitSet;
import java.util.List;
import net.hydromatic.aspen.ground.AtomIndex;
import net.hydromatic.aspen.ground.AtomTable;
import net.hydromatic.aspen.ground.GroundAtom;
import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * Set of atoms that are true in a stable model.
 *
 * <p>The atoms are a subset of a ground program's {@link AtomTable}, so
 * ids are shared with that table. An answer set is itself an {@link
 * AtomIndex}, which lets the projector join queries against it.
 */
public class AnswerSet implements AtomIndex {
  private final AtomTable table;
  private final BitSet trueAtoms;

  AnswerSet(AtomTable table, BitSet trueAtoms) {
    this.table = requireNonNull(table);
    this.trueAtoms = (BitSet) trueAtoms.clone();
  }

  /** Returns the number of true atoms. */
  public int size() {
    return trueAtoms.cardinality();
  }

  /** Whether an atom is true. */
  public boolean contains(GroundAtom atom) {
    return id(atom) >= 0;
  }

  /** Whether an atom, identified by its id in the ground program's atom
   * table, is true. */
  public boolean contains(int id) {
    return trueAtoms.get(id);
  }

  /** Returns the true atoms, sorted. */
  public ImmutableSortedSet<GroundAtom> atoms() {
    final ImmutableSortedSet.Builder<GroundAtom> set =
        ImmutableSortedSet.naturalOrder();
    trueAtoms.stream().forEach(id -> set.add(table.atom(id)));
    return set.build();
  }

  /** Returns the true atoms of a predicate, sorted. */
  public ImmutableSortedSet<GroundAtom> atoms(String predicate) {
    final ImmutableSortedSet.Builder<GroundAtom> set =
        ImmutableSortedSet.naturalOrder();
    for (int id : candidates(predicate, -1, null)) {
      set.add(table.atom(id));
    }
    return set.build();
  }

  @Override
  public List<Integer> candidates(String predicate, int position,
      @Nullable Object value) {
    final List<Integer> ids = table.candidates(predicate, position, value);
    final List<Integer> list = new ArrayList<>();
    for (int id : ids) {
      if (trueAtoms.get(id)) {
        list.add(id);
      }
    }
    return ImmutableList.copyOf(list);
  }

  @Override
  public int id(GroundAtom atom) {
    final int id = table.id(atom);
    return id >= 0 && trueAtoms.get(id) ? id : -1;
  }

  @Override
  public GroundAtom atom(int id) {
    return table.atom(id);
  }

  @Override
  public boolean equals(Object o) {
    return o == this
        || o instanceof AnswerSet
        && atoms().equals(((AnswerSet) o).atoms());
  }

  @Override
  public int hashCode() {
    return atoms().hashCode();
  }

  @Override
  public String toString() {
    final StringBuilder b = new StringBuilder("{");
    for (GroundAtom atom : atoms()) {
      if (b.length() > 1) {
        b.append(", ");
      }
      b.append(atom);
    }
    return b.append('}').toString();
  }
}

// End AnswerSet.java
