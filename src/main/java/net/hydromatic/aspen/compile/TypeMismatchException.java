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
package net.hydromatic.aspen.compile;

import static java.lang.String.format;

import net.hydromatic.aspen.ast.Ast;
import net.hydromatic.aspen.ast.Ast.CompOp;
import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * A comparison or arithmetic operation was applied to values of the wrong
 * type, for example {@code "a" < 3} or {@code X + 1} where {@code X} is bound
 * to a string.
 */
public class TypeMismatchException extends SpecificationException {
  public final @Nullable Object left;
  public final @Nullable Object right;

  public TypeMismatchException(String message, @Nullable Object left,
      @Nullable Object right) {
    super(message);
    this.left = left;
    this.right = right;
  }

  /** Creates an exception for an ordering comparison between values of
   * different types. */
  public static TypeMismatchException comparison(Object left, CompOp op,
      Object right) {
    return new TypeMismatchException(
        format("Cannot compare %s %s %s: values have different types",
            Ast.Constant.toString(left), op, Ast.Constant.toString(right)),
        left, right);
  }

  /** Creates an exception for arithmetic on a non-integer value. */
  public static TypeMismatchException arithmetic(Object left, Ast.ArithOp op,
      Object right) {
    return new TypeMismatchException(
        format("Arithmetic requires integers: %s %s %s",
            Ast.Constant.toString(left), op, Ast.Constant.toString(right)),
        left, right);
  }

  /** Returns a copy of this exception whose message also names where the
   * mismatch occurred. */
  public TypeMismatchException withContext(String context) {
    final TypeMismatchException e =
        new TypeMismatchException(getMessage() + " in " + context, left,
            right);
    e.setStackTrace(getStackTrace());
    return e;
  }
}

// End TypeMismatchException.java
