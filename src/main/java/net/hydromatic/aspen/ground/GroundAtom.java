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
import java.util.Objects;

/**
 * A ground atom: a predicate name and a tuple of values.
 *
 * <p>Ground atoms are ordered by predicate name, then by arguments in
 * {@link Values#TUPLE_ORDERING}. The solver uses this order to choose which
 * atom to decide next, so it must not change.
 */
public class GroundAtom implements Comparable<GroundAtom> {
  public final String predicate;
  public final ImmutableList<Object> args;

  private GroundAtom(String predicate, ImmutableList<Object> args) {
    this.predicate = requireNonNull(predicate);
    this.args = requireNonNull(args);
  }

  /** Creates a ground atom. Each argument must be an integer or a string. */
  public static GroundAtom of(String predicate, List<?> args) {
    for (Object arg : args) {
      if (!(arg instanceof Integer) && !(arg instanceof String)) {
        throw new IllegalArgumentException(
            "argument must be integer or string: " + arg);
      }
    }
    return new GroundAtom(predicate, ImmutableList.copyOf(args));
  }

  /** Creates a ground atom. Each argument must be an integer or a string. */
  public static GroundAtom of(String predicate, Object... args) {
    return of(predicate, ImmutableList.copyOf(args));
  }

  public int arity() {
    return args.size();
  }

  @Override
  public int compareTo(GroundAtom o) {
    final int c = predicate.compareTo(o.predicate);
    if (c != 0) {
      return c;
    }
    return Values.TUPLE_ORDERING.compare(args, o.args);
  }

  @Override
  public boolean equals(Object o) {
    return this == o
        || o instanceof GroundAtom
            && predicate.equals(((GroundAtom) o).predicate)
            && args.equals(((GroundAtom) o).args);
  }

  @Override
  public int hashCode() {
    return Objects.hash(predicate, args);
  }

  @Override
  public String toString() {
    if (args.isEmpty()) {
      return predicate;
    }
    return Values.appendTuple(new StringBuilder(predicate).append('('), args)
        .append(')')
        .toString();
  }
}

// End GroundAtom.java
