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

import java.util.List;
import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * Indexed collection of ground atoms that a {@link Matcher} can join
 * against.
 *
 * <p>Each atom has an integer id. Ids are dense, and an atom's id never
 * changes once assigned.
 */
public interface AtomIndex {
  /**
   * Returns the ids of atoms with a given predicate, in ascending order.
   *
   * <p>If {@code position} is non-negative, returns only atoms whose argument
   * at that position equals {@code value}.
   */
  List<Integer> candidates(String predicate, int position,
      @Nullable Object value);

  /** Returns the id of an atom, or -1 if the atom is not in this index. */
  int id(GroundAtom atom);

  /** Returns the atom with a given id. */
  GroundAtom atom(int id);
}

// End AtomIndex.java
