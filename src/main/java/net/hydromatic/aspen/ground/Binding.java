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

import com.google.common.collect.ImmutableMap;
import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import net.hydromatic.aspen.ast.Ast;
import net.hydromatic.aspen.ast.Ast.ArithmeticExpr;
import net.hydromatic.aspen.ast.Ast.Constant;
import net.hydromatic.aspen.ast.Ast.Term;
import net.hydromatic.aspen.ast.Ast.Variable;
import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * Assignment of values to the variables of a rule or query, built
 * incrementally while joining literals.
 *
 * <p>Each variable has a slot, assigned by the {@link Matcher} that created
 * the binding. A slot holds null while its variable is unbound.
 */
public class Binding {
  final ImmutableMap<String, Integer> slots;
  final @Nullable Object[] values;

  Binding(ImmutableMap<String, Integer> slots) {
    this(slots, new Object[slots.size()]);
  }

  private Binding(ImmutableMap<String, Integer> slots,
      @Nullable Object[] values) {
    this.slots = requireNonNull(slots);
    this.values = values;
  }

  /** Returns an immutable copy of this binding. The matcher reuses one
   * binding while it searches, so callers that retain a binding must copy
   * it. */
  public Binding copy() {
    return new Binding(slots, values.clone());
  }

  /** Returns the value of a variable, or null if the variable is unbound or
   * unknown. */
  public @Nullable Object get(String name) {
    final Integer slot = slots.get(name);
    return slot == null ? null : values[slot];
  }

  /** Whether every variable in a term has a value. */
  public boolean isBound(Term term) {
    if (term instanceof Variable) {
      return get(((Variable) term).name) != null;
    }
    if (term instanceof ArithmeticExpr) {
      return isBound(((ArithmeticExpr) term).left)
          && isBound(((ArithmeticExpr) term).right);
    }
    if (term instanceof Ast.RangeTerm) {
      return isBound(((Ast.RangeTerm) term).lower)
          && isBound(((Ast.RangeTerm) term).upper);
    }
    return true;
  }

  /**
   * Evaluates a term whose variables are all bound.
   *
   * <p>Returns null if the term contains arithmetic whose result is
   * undefined, such as division by zero.
   */
  public @Nullable Object eval(Term term) {
    if (term instanceof Constant) {
      return ((Constant) term).value;
    }
    if (term instanceof Variable) {
      final Object value = get(((Variable) term).name);
      if (value == null) {
        throw new IllegalStateException("variable " + term + " is unbound");
      }
      return value;
    }
    if (term instanceof ArithmeticExpr) {
      final ArithmeticExpr e = (ArithmeticExpr) term;
      final Object left = eval(e.left);
      final Object right = eval(e.right);
      if (left == null || right == null) {
        return null;
      }
      return Values.arithmetic(e.op, left, right);
    }
    throw new IllegalArgumentException("cannot evaluate " + term);
  }

  /** Evaluates an atom whose variables are all bound, returning null if any
   * argument is undefined. */
  public @Nullable GroundAtom ground(Ast.Atom atom) {
    final Object[] args = new Object[atom.terms.size()];
    for (int i = 0; i < args.length; i++) {
      args[i] = eval(atom.terms.get(i));
      if (args[i] == null) {
        return null;
      }
    }
    return GroundAtom.of(atom.name, Arrays.asList(args));
  }

  /** Evaluates a list of terms whose variables are all bound, returning
   * null if any is undefined. */
  public @Nullable List<Object> evalAll(List<Term> terms) {
    final Object[] args = new Object[terms.size()];
    for (int i = 0; i < args.length; i++) {
      args[i] = eval(terms.get(i));
      if (args[i] == null) {
        return null;
      }
    }
    return Arrays.asList(args);
  }

  void set(int slot, @Nullable Object value) {
    values[slot] = value;
  }

  /** Returns the bound variables and their values. Hidden variables, whose
   * names start with '$', are omitted. */
  public Map<String, Object> toMap() {
    final Map<String, Object> map = new LinkedHashMap<>();
    slots.forEach((name, slot) -> {
      final Object value = values[slot];
      if (value != null && !name.startsWith("$")) {
        map.put(name, value);
      }
    });
    return map;
  }

  @Override
  public String toString() {
    final StringBuilder b = new StringBuilder("{");
    toMap().forEach((name, value) -> {
      if (b.length() > 1) {
        b.append(", ");
      }
      b.append(name).append('=').append(Constant.toString(value));
    });
    return b.append('}').toString();
  }
}

// End Binding.java
