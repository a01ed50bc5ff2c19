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

import com.google.common.collect.Ordering;
import java.util.List;
import net.hydromatic.aspen.ast.Ast.ArithOp;
import net.hydromatic.aspen.ast.Ast.CompOp;
import net.hydromatic.aspen.ast.Ast.Constant;
import net.hydromatic.aspen.compile.TypeMismatchException;
import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * Utilities for ground values.
 *
 * <p>A value is either an {@link Integer} or a {@link String}. Values are
 * totally ordered: every integer is less than every string; integers are
 * ordered numerically and strings lexicographically.
 */
public class Values {
  private Values() {}

  /** Total order on values. */
  public static final Ordering<Object> ORDERING =
      Ordering.from(Values::compare);

  /** Lexicographic order on tuples of values. */
  public static final Ordering<Iterable<Object>> TUPLE_ORDERING =
      ORDERING.lexicographical();

  /** Compares two values in the total order. */
  public static int compare(Object v0, Object v1) {
    if (v0 instanceof Integer) {
      if (v1 instanceof Integer) {
        return Integer.compare((Integer) v0, (Integer) v1);
      }
      return -1;
    }
    if (v1 instanceof Integer) {
      return 1;
    }
    return ((String) v0).compareTo((String) v1);
  }

  /**
   * Evaluates a comparison between two values.
   *
   * <p>Equality and inequality are defined between any two values. The
   * ordering operators require both values to have the same type.
   *
   * @throws TypeMismatchException if an ordering operator is applied to an
   *     integer and a string
   */
  public static boolean compare(Object left, CompOp op, Object right) {
    if (op.isOrdering() && left.getClass() != right.getClass()) {
      throw TypeMismatchException.comparison(left, op, right);
    }
    return op.test(compare(left, right));
  }

  /**
   * Applies an arithmetic operator to two values.
   *
   * <p>Returns null if the result is undefined (division by zero, or
   * overflow); a rule instance whose arithmetic is undefined does not exist.
   *
   * @throws TypeMismatchException if either value is not an integer
   */
  public static @Nullable Integer arithmetic(ArithOp op, Object left,
      Object right) {
    if (!(left instanceof Integer) || !(right instanceof Integer)) {
      throw TypeMismatchException.arithmetic(left, op, right);
    }
    final int a = (Integer) left;
    final int b = (Integer) right;
    try {
      switch (op) {
        case PLUS:
          return Math.addExact(a, b);
        case MINUS:
          return Math.subtractExact(a, b);
        case TIMES:
          return Math.multiplyExact(a, b);
        case DIVIDE:
          return b == 0 ? null : a / b;
        case MOD:
          return b == 0 ? null : a % b;
        default:
          throw new AssertionError(op);
      }
    } catch (ArithmeticException e) {
      return null;
    }
  }

  /** Returns the value as an integer, or throws. */
  public static int intValue(Object value, String context) {
    if (!(value instanceof Integer)) {
      throw new TypeMismatchException(
          "Expected an integer but got " + value + " in " + context,
          value, null);
    }
    return (Integer) value;
  }

  /** Appends a tuple of values to a buffer, comma-separated. */
  public static StringBuilder appendTuple(StringBuilder b,
      List<Object> values) {
    for (int i = 0; i < values.size(); i++) {
      if (i > 0) {
        b.append(',');
      }
      b.append(Constant.toString(values.get(i)));
    }
    return b;
  }
}

// End Values.java
