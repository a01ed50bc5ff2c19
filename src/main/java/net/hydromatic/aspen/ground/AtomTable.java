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
import com.google.common.collect.ImmutableMap;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * Arena of ground atoms.
 *
 * <p>Maps each ground atom to a dense integer id, and indexes atoms by
 * predicate and by argument value. The grounder fills a {@link Builder};
 * once grounding is complete, the table is immutable and is shared by
 * reference between the solver and the projector. All truth assignments
 * are over ids, not atoms.
 */
public class AtomTable implements AtomIndex {
  private final ImmutableList<GroundAtom> atoms;
  private final ImmutableMap<GroundAtom, Integer> ids;
  private final PredicateIndex index;

  private AtomTable(List<GroundAtom> atoms, Map<GroundAtom, Integer> ids,
      PredicateIndex index) {
    this.atoms = ImmutableList.copyOf(atoms);
    this.ids = ImmutableMap.copyOf(ids);
    this.index = requireNonNull(index);
  }

  /** Creates a builder. */
  public static Builder builder(int maxAtoms) {
    return new Builder(maxAtoms);
  }

  /** Returns the number of atoms. */
  public int size() {
    return atoms.size();
  }

  @Override
  public GroundAtom atom(int id) {
    return atoms.get(id);
  }

  @Override
  public int id(GroundAtom atom) {
    final Integer id = ids.get(atom);
    return id == null ? -1 : id;
  }

  /** Returns all atoms, in id order. */
  public List<GroundAtom> atoms() {
    return atoms;
  }

  /** Returns the names of all predicates that have at least one atom. */
  public Iterable<String> predicates() {
    return index.byPredicate.keySet();
  }

  @Override
  public List<Integer> candidates(String predicate, int position,
      @Nullable Object value) {
    return index.candidates(predicate, position, value);
  }

  /**
   * Index of atom ids by predicate, and by predicate, argument position and
   * value. Each list of ids is in ascending order, because ids are appended
   * in the order that atoms are added.
   */
  static class PredicateIndex {
    final Map<String, List<Integer>> byPredicate = new HashMap<>();
    final Map<String, List<Map<Object, List<Integer>>>> byArgument =
        new HashMap<>();

    void add(int id, GroundAtom atom) {
      byPredicate.computeIfAbsent(atom.predicate, p -> new ArrayList<>())
          .add(id);
      final List<Map<Object, List<Integer>>> positions =
          byArgument.computeIfAbsent(atom.predicate, p -> {
            final List<Map<Object, List<Integer>>> list = new ArrayList<>();
            for (int i = 0; i < atom.arity(); i++) {
              list.add(new HashMap<>());
            }
            return list;
          });
      for (int i = 0; i < atom.arity(); i++) {
        positions.get(i)
            .computeIfAbsent(atom.args.get(i), v -> new ArrayList<>())
            .add(id);
      }
    }

    List<Integer> candidates(String predicate, int position,
        @Nullable Object value) {
      if (position < 0) {
        return byPredicate.getOrDefault(predicate, ImmutableList.of());
      }
      final List<Map<Object, List<Integer>>> positions =
          byArgument.get(predicate);
      if (positions == null || position >= positions.size()) {
        return ImmutableList.of();
      }
      return positions.get(position).getOrDefault(value, ImmutableList.of());
    }
  }

  /** Mutable builder of an {@link AtomTable}. */
  public static class Builder implements AtomIndex {
    private final List<GroundAtom> atoms = new ArrayList<>();
    private final Map<GroundAtom, Integer> ids = new HashMap<>();
    private final PredicateIndex index = new PredicateIndex();
    private final int maxAtoms;

    private Builder(int maxAtoms) {
      this.maxAtoms = maxAtoms;
    }

    /** Adds an atom if it is not already present, and returns its id.
     *
     * @throws GroundingException if the table would exceed its size limit
     */
    public int add(GroundAtom atom) {
      final Integer id = ids.get(atom);
      if (id != null) {
        return id;
      }
      if (atoms.size() >= maxAtoms) {
        throw new GroundingException(
            "Number of ground atoms exceeds limit " + maxAtoms
                + " while adding " + atom);
      }
      final int newId = atoms.size();
      atoms.add(atom);
      ids.put(atom, newId);
      index.add(newId, atom);
      return newId;
    }

    /** Returns the greatest number of atoms that the table may hold. */
    public int maxAtoms() {
      return maxAtoms;
    }

    /** Returns the number of atoms added so far. */
    public int size() {
      return atoms.size();
    }

    @Override
    public int id(GroundAtom atom) {
      final Integer id = ids.get(atom);
      return id == null ? -1 : id;
    }

    @Override
    public GroundAtom atom(int id) {
      return atoms.get(id);
    }

    @Override
    public List<Integer> candidates(String predicate, int position,
        @Nullable Object value) {
      return index.candidates(predicate, position, value);
    }

    /** Creates an immutable table. The builder must not be used
     * afterwards. */
    public AtomTable build() {
      return new AtomTable(atoms, ids, index);
    }
  }
}

// End AtomTable.java
