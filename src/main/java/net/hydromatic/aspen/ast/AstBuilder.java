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
package net.hydromatic.aspen.ast;

import static com.google.common.base.Preconditions.checkArgument;

import com.google.common.collect.ImmutableList;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import net.hydromatic.aspen.ast.Ast.AggFunction;
import net.hydromatic.aspen.ast.Ast.ArithOp;
import net.hydromatic.aspen.ast.Ast.CompOp;
import org.checkerframework.checker.nullness.qual.Nullable;

/** Builds parse tree nodes. */
public enum AstBuilder {
  /**
   * The singleton instance of the AST builder. The short name is convenient for
   * use via 'import static', but checkstyle does not approve.
   */
  // CHECKSTYLE: IGNORE 1
  ast;

  /** Creates a variable. */
  public Ast.Variable var(String name) {
    return new Ast.Variable(name);
  }

  /** Creates an integer constant. */
  public Ast.Constant constant(int value) {
    return new Ast.Constant(value);
  }

  /** Creates a string constant. */
  public Ast.Constant constant(String value) {
    return new Ast.Constant(value);
  }

  /**
   * Converts a Java value to a term.
   *
   * <p>Terms are returned unchanged; integers become integer constants;
   * strings that start with an upper-case letter or underscore become
   * variables, and other strings become string constants.
   */
  public Ast.Term term(Object o) {
    if (o instanceof Ast.Term) {
      return (Ast.Term) o;
    }
    if (o instanceof Integer) {
      return constant((Integer) o);
    }
    if (o instanceof String) {
      final String s = (String) o;
      if (!s.isEmpty()
          && (Character.isUpperCase(s.charAt(0)) || s.charAt(0) == '_')) {
        return var(s);
      }
      return constant(s);
    }
    throw new IllegalArgumentException("not a term: " + o);
  }

  private List<Ast.Term> terms(Object... args) {
    final ImmutableList.Builder<Ast.Term> list = ImmutableList.builder();
    for (Object arg : args) {
      list.add(term(arg));
    }
    return list.build();
  }

  public Ast.ArithmeticExpr arith(Object left, ArithOp op, Object right) {
    return new Ast.ArithmeticExpr(term(left), op, term(right));
  }

  public Ast.ArithmeticExpr plus(Object left, Object right) {
    return arith(left, ArithOp.PLUS, right);
  }

  public Ast.ArithmeticExpr minus(Object left, Object right) {
    return arith(left, ArithOp.MINUS, right);
  }

  public Ast.ArithmeticExpr times(Object left, Object right) {
    return arith(left, ArithOp.TIMES, right);
  }

  public Ast.ArithmeticExpr divide(Object left, Object right) {
    return arith(left, ArithOp.DIVIDE, right);
  }

  public Ast.ArithmeticExpr mod(Object left, Object right) {
    return arith(left, ArithOp.MOD, right);
  }

  /** Creates a range term, "lower..upper". */
  public Ast.RangeTerm range(Object lower, Object upper) {
    return new Ast.RangeTerm(term(lower), term(upper));
  }

  /** Creates an atom; arguments are converted using {@link #term}. */
  public Ast.Atom atom(String name, Object... args) {
    return new Ast.Atom(name, terms(args));
  }

  /** Creates a positive literal. */
  public Ast.AtomLiteral pos(String name, Object... args) {
    return literal(atom(name, args));
  }

  /** Creates a negated literal, "not name(args)". */
  public Ast.AtomLiteral neg(String name, Object... args) {
    return not(atom(name, args));
  }

  public Ast.AtomLiteral literal(Ast.Atom atom) {
    return new Ast.AtomLiteral(atom, false);
  }

  public Ast.AtomLiteral not(Ast.Atom atom) {
    return new Ast.AtomLiteral(atom, true);
  }

  public Ast.Comparison compare(Object left, CompOp op, Object right) {
    return new Ast.Comparison(term(left), op, term(right));
  }

  public Ast.Comparison eq(Object left, Object right) {
    return compare(left, CompOp.EQ, right);
  }

  public Ast.Comparison ne(Object left, Object right) {
    return compare(left, CompOp.NE, right);
  }

  public Ast.Comparison lt(Object left, Object right) {
    return compare(left, CompOp.LT, right);
  }

  public Ast.Comparison le(Object left, Object right) {
    return compare(left, CompOp.LE, right);
  }

  public Ast.Comparison gt(Object left, Object right) {
    return compare(left, CompOp.GT, right);
  }

  public Ast.Comparison ge(Object left, Object right) {
    return compare(left, CompOp.GE, right);
  }

  /** Creates an aggregate element, "terms : conditions". */
  public Ast.AggregateElement aggElement(
      List<?> terms, Ast.Literal... conditions) {
    return new Ast.AggregateElement(
        terms(terms.toArray()), Arrays.asList(conditions));
  }

  /** Creates an aggregate literal with a single element. */
  public Ast.AggregateLiteral aggregate(
      AggFunction function,
      Ast.AggregateElement element,
      CompOp op,
      Object bound) {
    return aggregate(function, ImmutableList.of(element), op, bound);
  }

  public Ast.AggregateLiteral aggregate(
      AggFunction function,
      List<Ast.AggregateElement> elements,
      CompOp op,
      Object bound) {
    return new Ast.AggregateLiteral(function, elements, op, term(bound), false);
  }

  /** Creates "#count{terms : conditions} op bound". */
  public Ast.AggregateLiteral count(
      List<?> terms, List<Ast.Literal> conditions, CompOp op, Object bound) {
    return aggregate(
        AggFunction.COUNT,
        new Ast.AggregateElement(terms(terms.toArray()), conditions),
        op,
        bound);
  }

  /** Creates "#sum{terms : conditions} op bound". */
  public Ast.AggregateLiteral sum(
      List<?> terms, List<Ast.Literal> conditions, CompOp op, Object bound) {
    return aggregate(
        AggFunction.SUM,
        new Ast.AggregateElement(terms(terms.toArray()), conditions),
        op,
        bound);
  }

  /** Negates an aggregate literal. */
  public Ast.AggregateLiteral not(Ast.AggregateLiteral aggregate) {
    return new Ast.AggregateLiteral(
        aggregate.function,
        aggregate.elements,
        aggregate.op,
        aggregate.bound,
        !aggregate.negated);
  }

  /** Returns the head of an integrity constraint. */
  public Ast.Head constraintHead() {
    return Ast.Constraint.INSTANCE;
  }

  public Ast.NormalHead head(Ast.Atom atom) {
    return new Ast.NormalHead(atom);
  }

  public Ast.Disjunction disjunction(Ast.Atom... atoms) {
    return disjunction(Arrays.asList(atoms));
  }

  public Ast.Disjunction disjunction(List<Ast.Atom> atoms) {
    return new Ast.Disjunction(atoms);
  }

  /** Creates a choice element, "atom : conditions". */
  public Ast.ChoiceElement choiceElement(
      Ast.Atom atom, Ast.Literal... conditions) {
    return new Ast.ChoiceElement(atom, Arrays.asList(conditions));
  }

  /** Creates a choice head without bounds. */
  public Ast.Choice choice(Ast.ChoiceElement... elements) {
    return choice(null, Arrays.asList(elements), null);
  }

  /** Creates a choice head; either bound may be null. */
  public Ast.Choice choice(
      @Nullable Object lower,
      List<Ast.ChoiceElement> elements,
      @Nullable Object upper) {
    return new Ast.Choice(
        elements,
        lower == null ? null : term(lower),
        upper == null ? null : term(upper));
  }

  /** Creates a choice head whose lower and upper bound are equal,
   * "{ elements } = n". */
  public Ast.Choice exactly(Object n, Ast.ChoiceElement... elements) {
    return choice(n, Arrays.asList(elements), n);
  }

  public Ast.Rule rule(Ast.Head head, Ast.Literal... body) {
    return new Ast.Rule(head, Arrays.asList(body));
  }

  public Ast.Rule rule(Ast.Head head, List<Ast.Literal> body) {
    return new Ast.Rule(head, body);
  }

  /** Creates a normal rule, "atom :- body". */
  public Ast.Rule rule(Ast.Atom atom, Ast.Literal... body) {
    return rule(head(atom), body);
  }

  /** Creates a fact, a rule with an atom head and no body. The atom may
   * contain ranges but no variables. */
  public Ast.Rule fact(String name, Object... args) {
    return rule(head(atom(name, args)));
  }

  /** Creates an integrity constraint, ":- body". */
  public Ast.Rule constraint(Ast.Literal... body) {
    return rule(constraintHead(), body);
  }

  /** Creates a domain whose values are an integer range, inclusive. */
  public Ast.Domain domain(String name, int lower, int upper) {
    checkArgument(lower <= upper + 1, "invalid range %s..%s", lower, upper);
    final List<Object> values = new ArrayList<>();
    for (int i = lower; i <= upper; i++) {
      values.add(i);
    }
    return new Ast.Domain(name, values);
  }

  /** Creates a domain whose values are an enumeration of constants. */
  public Ast.Domain domain(String name, List<?> values) {
    for (Object value : values) {
      checkArgument(
          value instanceof Integer || value instanceof String,
          "domain value must be integer or string: %s",
          value);
    }
    return new Ast.Domain(name, ImmutableList.copyOf(values));
  }

  public Ast.Program program(List<Ast.Rule> rules) {
    return new Ast.Program(rules, ImmutableList.of());
  }

  public Ast.Program program(List<Ast.Rule> rules, List<Ast.Domain> domains) {
    return new Ast.Program(rules, domains);
  }
}

// End AstBuilder.java
