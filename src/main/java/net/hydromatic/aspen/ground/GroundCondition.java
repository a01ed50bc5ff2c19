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

import java.util.function.IntUnaryOperator;

/**
 * Conjunction of ground literals: atoms that must be true and atoms that must
 * be false. Used for the body of a rule, and for the conditions of choice and
 * aggregate elements.
 *
 * <p>Truth values are encoded as integers: {@link #TRUE}, {@link #FALSE} and
 * {@link #UNDEFINED}.
 */
public class GroundCondition {
  public static final int TRUE = 1;
  public static final int FALSE = -1;
  public static final int UNDEFINED = 0;

  static final int[] EMPTY = new int[0];

  /** Condition that is always true. */
  public static final GroundCondition EMPTY_CONDITION =
      new GroundCondition(EMPTY, EMPTY);

  /** Ids of atoms that must be true. Do not modify. */
  public final int[] pos;
  /** Ids of atoms that must be false. Do not modify. */
  public final int[] neg;

  public GroundCondition(int[] pos, int[] neg) {
    this.pos = pos;
    this.neg = neg;
  }

  /** Whether this condition is always true. */
  public boolean isEmpty() {
    return pos.length == 0 && neg.length == 0;
  }

  /**
   * Evaluates this condition in a partial assignment.
   *
   * @param value Returns {@link #TRUE}, {@link #FALSE} or {@link #UNDEFINED}
   *     for an atom id
   * @return {@link #FALSE} if any literal is false, {@link #TRUE} if all are
   *     true, otherwise {@link #UNDEFINED}
   */
  public int status(IntUnaryOperator value) {
    int result = TRUE;
    for (int atom : pos) {
      final int v = value.applyAsInt(atom);
      if (v == FALSE) {
        return FALSE;
      }
      if (v == UNDEFINED) {
        result = UNDEFINED;
      }
    }
    for (int atom : neg) {
      final int v = value.applyAsInt(atom);
      if (v == TRUE) {
        return FALSE;
      }
      if (v == UNDEFINED) {
        result = UNDEFINED;
      }
    }
    return result;
  }

  /** Appends a description of this condition to a buffer. */
  public StringBuilder describe(StringBuilder b, AtomIndex atoms) {
    int n = 0;
    for (int atom : pos) {
      if (n++ > 0) {
        b.append(", ");
      }
      b.append(atoms.atom(atom));
    }
    for (int atom : neg) {
      if (n++ > 0) {
        b.append(", ");
      }
      b.append("not ").append(atoms.atom(atom));
    }
    return b;
  }
}

// End GroundCondition.java
