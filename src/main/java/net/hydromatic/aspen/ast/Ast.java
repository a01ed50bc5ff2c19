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
import static java.util.Objects.requireNonNull;

import com.google.common.collect.ImmutableList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.Set;
import java.util.regex.Pattern;
import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * Abstract syntax tree nodes for rule programs.
 *
 * <p>A program consists of rules and domain declarations. Each rule has a
 * head (empty, a single atom, a disjunction of atoms, or a choice of atoms)
 * and a body, which is a conjunction of literals.
 *
 * <p>Nodes are immutable. Use {@link AstBuilder} to create them.
 */
public class Ast {
  private Ast() {
    // Utility class
  }

  /** Identifiers that print without quotes. */
  private static final Pattern SYMBOL = Pattern.compile("[a-z][A-Za-z0-9_]*");

  /** A complete program. */
  public static class Program {
    public final List<Rule> rules;
    public final List<Domain> domains;

    Program(List<Rule> rules, List<Domain> domains) {
      this.rules = ImmutableList.copyOf(rules);
      this.domains = ImmutableList.copyOf(domains);
    }

    @Override
    public String toString() {
      final StringBuilder b = new StringBuilder();
      domains.forEach(d -> b.append(d).append('\n'));
      rules.forEach(r -> b.append(r).append('\n'));
      return b.toString();
    }
  }

  /**
   * A domain declaration: a unary predicate that holds for each value of an
   * integer range or of an enumeration.
   */
  public static class Domain {
    public final String name;
    public final List<Object> values;

    Domain(String name, List<Object> values) {
      this.name = requireNonNull(name);
      this.values = ImmutableList.copyOf(values);
    }

    @Override
    public String toString() {
      return "#domain " + name + values;
    }
  }

  /** A rule: head :- body. */
  public static class Rule {
    public final Head head;
    public final List<Literal> body;

    Rule(Head head, List<Literal> body) {
      this.head = requireNonNull(head);
      this.body = ImmutableList.copyOf(body);
    }

    /** Whether this rule is a fact, that is, a normal rule with no body. */
    public boolean isFact() {
      return body.isEmpty() && head instanceof NormalHead;
    }

    /** Returns the names of all variables in the rule, in order of
     * appearance. */
    public Set<String> variables() {
      final Set<String> vars = new LinkedHashSet<>();
      head.collectVariables(vars);
      for (Literal literal : body) {
        literal.collectVariables(vars);
      }
      return vars;
    }

    @Override
    public String toString() {
      final StringBuilder b = new StringBuilder();
      if (!(head instanceof Constraint)) {
        b.append(head);
      }
      if (!body.isEmpty()) {
        if (b.length() > 0) {
          b.append(' ');
        }
        b.append(":- ");
        for (int i = 0; i < body.size(); i++) {
          if (i > 0) {
            b.append(", ");
          }
          b.append(body.get(i));
        }
      }
      return b.append('.').toString();
    }
  }

  /** Rule head. */
  public abstract static class Head {
    /** Adds the variables of this head to a set. */
    public abstract void collectVariables(Set<String> vars);

    /** Returns the atoms that this head can derive. */
    public abstract List<Atom> atoms();
  }

  /** Empty head; the rule is an integrity constraint. */
  public static class Constraint extends Head {
    static final Constraint INSTANCE = new Constraint();

    private Constraint() {}

    @Override
    public void collectVariables(Set<String> vars) {}

    @Override
    public List<Atom> atoms() {
      return ImmutableList.of();
    }

    @Override
    public String toString() {
      return "";
    }
  }

  /** Head that is a single atom. */
  public static class NormalHead extends Head {
    public final Atom atom;

    NormalHead(Atom atom) {
      this.atom = requireNonNull(atom);
    }

    @Override
    public void collectVariables(Set<String> vars) {
      atom.collectVariables(vars);
    }

    @Override
    public List<Atom> atoms() {
      return ImmutableList.of(atom);
    }

    @Override
    public String toString() {
      return atom.toString();
    }
  }

  /** Head that is a disjunction of atoms, "a v b v c". */
  public static class Disjunction extends Head {
    public final List<Atom> disjuncts;

    Disjunction(List<Atom> disjuncts) {
      this.disjuncts = ImmutableList.copyOf(disjuncts);
      checkArgument(!disjuncts.isEmpty(), "empty disjunction");
    }

    @Override
    public void collectVariables(Set<String> vars) {
      disjuncts.forEach(a -> a.collectVariables(vars));
    }

    @Override
    public List<Atom> atoms() {
      return disjuncts;
    }

    @Override
    public String toString() {
      final StringBuilder b = new StringBuilder();
      for (Atom atom : disjuncts) {
        if (b.length() > 0) {
          b.append(" v ");
        }
        b.append(atom);
      }
      return b.toString();
    }
  }

  /**
   * Head that is a choice, "lower { a : c1, c2; b } upper".
   *
   * <p>Each element's atom may or may not be in the answer set. If bounds are
   * given, the number of chosen atoms must lie between them.
   *
   * <p>Variables in an element that do not occur in the rule body are local
   * to the element, and must be bound by the element's conditions.
   */
  public static class Choice extends Head {
    public final List<ChoiceElement> elements;
    public final @Nullable Term lower;
    public final @Nullable Term upper;

    Choice(
        List<ChoiceElement> elements,
        @Nullable Term lower,
        @Nullable Term upper) {
      this.elements = ImmutableList.copyOf(elements);
      this.lower = lower;
      this.upper = upper;
    }

    @Override
    public void collectVariables(Set<String> vars) {
      elements.forEach(e -> e.collectVariables(vars));
      if (lower != null) {
        lower.collectVariables(vars);
      }
      if (upper != null) {
        upper.collectVariables(vars);
      }
    }

    @Override
    public List<Atom> atoms() {
      final ImmutableList.Builder<Atom> list = ImmutableList.builder();
      elements.forEach(e -> list.add(e.atom));
      return list.build();
    }

    @Override
    public String toString() {
      final StringBuilder b = new StringBuilder();
      if (lower != null) {
        b.append(lower).append(' ');
      }
      b.append("{ ");
      for (int i = 0; i < elements.size(); i++) {
        if (i > 0) {
          b.append("; ");
        }
        b.append(elements.get(i));
      }
      b.append(" }");
      if (upper != null) {
        b.append(' ').append(upper);
      }
      return b.toString();
    }
  }

  /** Element of a choice head: an atom and its optional conditions. */
  public static class ChoiceElement {
    public final Atom atom;
    public final List<Literal> conditions;

    ChoiceElement(Atom atom, List<Literal> conditions) {
      this.atom = requireNonNull(atom);
      this.conditions = ImmutableList.copyOf(conditions);
    }

    void collectVariables(Set<String> vars) {
      atom.collectVariables(vars);
      conditions.forEach(c -> c.collectVariables(vars));
    }

    @Override
    public String toString() {
      return conditions.isEmpty()
          ? atom.toString()
          : atom + " : " + join(conditions);
    }
  }

  /** Base class for literals in a rule body. */
  public abstract static class Literal {
    /** Adds the variables of this literal to a set. */
    public abstract void collectVariables(Set<String> vars);
  }

  /** A positive or default-negated atom, "p(X)" or "not p(X)". */
  public static class AtomLiteral extends Literal {
    public final Atom atom;
    public final boolean negated;

    AtomLiteral(Atom atom, boolean negated) {
      this.atom = requireNonNull(atom);
      this.negated = negated;
    }

    @Override
    public void collectVariables(Set<String> vars) {
      atom.collectVariables(vars);
    }

    @Override
    public String toString() {
      return negated ? "not " + atom : atom.toString();
    }
  }

  /** Comparison operators. */
  public enum CompOp {
    EQ("="),
    NE("!="),
    LT("<"),
    LE("<="),
    GT(">"),
    GE(">=");

    public final String symbol;

    CompOp(String symbol) {
      this.symbol = symbol;
    }

    /** Whether this operator orders its arguments, and therefore requires
     * them to have the same type. */
    public boolean isOrdering() {
      return this != EQ && this != NE;
    }

    /** Returns the result of this operator given the result of a
     * {@link java.util.Comparator}. */
    public boolean test(int c) {
      switch (this) {
        case EQ:
          return c == 0;
        case NE:
          return c != 0;
        case LT:
          return c < 0;
        case LE:
          return c <= 0;
        case GT:
          return c > 0;
        case GE:
          return c >= 0;
        default:
          throw new AssertionError(this);
      }
    }

    @Override
    public String toString() {
      return symbol;
    }
  }

  /** A comparison in a rule body, "X < Y + 1". */
  public static class Comparison extends Literal {
    public final Term left;
    public final CompOp op;
    public final Term right;

    Comparison(Term left, CompOp op, Term right) {
      this.left = requireNonNull(left);
      this.op = requireNonNull(op);
      this.right = requireNonNull(right);
    }

    @Override
    public void collectVariables(Set<String> vars) {
      left.collectVariables(vars);
      right.collectVariables(vars);
    }

    @Override
    public String toString() {
      return left + " " + op + " " + right;
    }
  }

  /** Aggregate functions. */
  public enum AggFunction {
    COUNT,
    SUM,
    MIN,
    MAX;

    @Override
    public String toString() {
      return "#" + name().toLowerCase(Locale.ROOT);
    }
  }

  /**
   * An aggregate literal, "#count{X : p(X)} != 3".
   *
   * <p>The aggregate ranges over the distinct term tuples of elements whose
   * conditions hold. For {@code #sum}, {@code #min} and {@code #max} the
   * first term of each tuple is its weight.
   */
  public static class AggregateLiteral extends Literal {
    public final AggFunction function;
    public final List<AggregateElement> elements;
    public final CompOp op;
    public final Term bound;
    public final boolean negated;

    AggregateLiteral(
        AggFunction function,
        List<AggregateElement> elements,
        CompOp op,
        Term bound,
        boolean negated) {
      this.function = requireNonNull(function);
      this.elements = ImmutableList.copyOf(elements);
      this.op = requireNonNull(op);
      this.bound = requireNonNull(bound);
      this.negated = negated;
    }

    /** Adds the variables of the aggregate that are global to the rule,
     * namely the variables of the bound. */
    public void collectGlobalVariables(Set<String> vars) {
      bound.collectVariables(vars);
    }

    @Override
    public void collectVariables(Set<String> vars) {
      elements.forEach(e -> e.collectVariables(vars));
      bound.collectVariables(vars);
    }

    @Override
    public String toString() {
      final StringBuilder b = new StringBuilder();
      if (negated) {
        b.append("not ");
      }
      b.append(function).append('{');
      for (int i = 0; i < elements.size(); i++) {
        if (i > 0) {
          b.append("; ");
        }
        b.append(elements.get(i));
      }
      return b.append("} ").append(op).append(' ').append(bound).toString();
    }
  }

  /** Element of an aggregate: a tuple of terms and its conditions. */
  public static class AggregateElement {
    public final List<Term> terms;
    public final List<Literal> conditions;

    AggregateElement(List<Term> terms, List<Literal> conditions) {
      this.terms = ImmutableList.copyOf(terms);
      this.conditions = ImmutableList.copyOf(conditions);
    }

    void collectVariables(Set<String> vars) {
      terms.forEach(t -> t.collectVariables(vars));
      conditions.forEach(c -> c.collectVariables(vars));
    }

    @Override
    public String toString() {
      final StringBuilder b = new StringBuilder();
      for (int i = 0; i < terms.size(); i++) {
        if (i > 0) {
          b.append(',');
        }
        b.append(terms.get(i));
      }
      if (!conditions.isEmpty()) {
        b.append(" : ").append(join(conditions));
      }
      return b.toString();
    }
  }

  /** An atom: predicate(term, ...). */
  public static class Atom {
    public final String name;
    public final List<Term> terms;

    Atom(String name, List<Term> terms) {
      this.name = requireNonNull(name);
      this.terms = ImmutableList.copyOf(terms);
    }

    public int arity() {
      return terms.size();
    }

    /** Whether the atom contains no variables. */
    public boolean isGround() {
      for (Term term : terms) {
        if (!term.isGround()) {
          return false;
        }
      }
      return true;
    }

    void collectVariables(Set<String> vars) {
      terms.forEach(t -> t.collectVariables(vars));
    }

    @Override
    public String toString() {
      if (terms.isEmpty()) {
        return name;
      }
      final StringBuilder b = new StringBuilder(name).append('(');
      for (int i = 0; i < terms.size(); i++) {
        if (i > 0) {
          b.append(',');
        }
        b.append(terms.get(i));
      }
      return b.append(')').toString();
    }

    @Override
    public boolean equals(Object o) {
      return this == o
          || o instanceof Atom
              && name.equals(((Atom) o).name)
              && terms.equals(((Atom) o).terms);
    }

    @Override
    public int hashCode() {
      return Objects.hash(name, terms);
    }
  }

  /** Base class for terms in atoms. */
  public abstract static class Term {
    /** Whether this term contains no variables. A range is not ground,
     * because it stands for several values. */
    public abstract boolean isGround();

    /** Adds the variables of this term to a set. */
    public abstract void collectVariables(Set<String> vars);
  }

  /** A variable term. */
  public static class Variable extends Term {
    public final String name;

    Variable(String name) {
      this.name = requireNonNull(name);
    }

    @Override
    public boolean isGround() {
      return false;
    }

    @Override
    public void collectVariables(Set<String> vars) {
      vars.add(name);
    }

    @Override
    public String toString() {
      return name;
    }

    @Override
    public boolean equals(Object o) {
      return this == o
          || o instanceof Variable && name.equals(((Variable) o).name);
    }

    @Override
    public int hashCode() {
      return name.hashCode();
    }
  }

  /** A constant term, whose value is an {@link Integer} or a
   * {@link String}. */
  public static class Constant extends Term {
    public final Object value;

    Constant(Object value) {
      this.value = requireNonNull(value);
      checkArgument(
          value instanceof Integer || value instanceof String,
          "constant must be integer or string: %s",
          value);
    }

    @Override
    public boolean isGround() {
      return true;
    }

    @Override
    public void collectVariables(Set<String> vars) {}

    @Override
    public String toString() {
      return toString(value);
    }

    /** Converts a value to a string as it would appear in a program.
     * Strings that are valid symbols print unquoted. */
    public static String toString(Object value) {
      if (value instanceof String) {
        final String s = (String) value;
        if (SYMBOL.matcher(s).matches()) {
          return s;
        }
        return '"' + s.replace("\\", "\\\\").replace("\"", "\\\"") + '"';
      }
      return value.toString();
    }

    @Override
    public boolean equals(Object o) {
      return this == o
          || o instanceof Constant && value.equals(((Constant) o).value);
    }

    @Override
    public int hashCode() {
      return value.hashCode();
    }
  }

  /** Arithmetic operators for use in terms. */
  public enum ArithOp {
    PLUS("+"),
    MINUS("-"),
    TIMES("*"),
    DIVIDE("/"),
    MOD("\\");

    public final String symbol;

    ArithOp(String symbol) {
      this.symbol = symbol;
    }

    @Override
    public String toString() {
      return symbol;
    }
  }

  /** An arithmetic expression term, such as {@code N + 1}. */
  public static class ArithmeticExpr extends Term {
    public final Term left;
    public final ArithOp op;
    public final Term right;

    ArithmeticExpr(Term left, ArithOp op, Term right) {
      this.left = requireNonNull(left);
      this.op = requireNonNull(op);
      this.right = requireNonNull(right);
    }

    @Override
    public boolean isGround() {
      return left.isGround() && right.isGround();
    }

    @Override
    public void collectVariables(Set<String> vars) {
      left.collectVariables(vars);
      right.collectVariables(vars);
    }

    @Override
    public String toString() {
      return "(" + left + op + right + ")";
    }

    @Override
    public boolean equals(Object o) {
      if (this == o) {
        return true;
      }
      if (!(o instanceof ArithmeticExpr)) {
        return false;
      }
      ArithmeticExpr that = (ArithmeticExpr) o;
      return left.equals(that.left)
          && op == that.op
          && right.equals(that.right);
    }

    @Override
    public int hashCode() {
      return Objects.hash(left, op, right);
    }
  }

  /** An integer interval, "lo..hi". Allowed only in heads. */
  public static class RangeTerm extends Term {
    public final Term lower;
    public final Term upper;

    RangeTerm(Term lower, Term upper) {
      this.lower = requireNonNull(lower);
      this.upper = requireNonNull(upper);
    }

    @Override
    public boolean isGround() {
      return false;
    }

    @Override
    public void collectVariables(Set<String> vars) {
      lower.collectVariables(vars);
      upper.collectVariables(vars);
    }

    @Override
    public String toString() {
      return lower + ".." + upper;
    }

    @Override
    public boolean equals(Object o) {
      return this == o
          || o instanceof RangeTerm
              && lower.equals(((RangeTerm) o).lower)
              && upper.equals(((RangeTerm) o).upper);
    }

    @Override
    public int hashCode() {
      return Objects.hash(lower, upper);
    }
  }

  static String join(List<Literal> literals) {
    final StringBuilder b = new StringBuilder();
    for (int i = 0; i < literals.size(); i++) {
      if (i > 0) {
        b.append(", ");
      }
      b.append(literals.get(i));
    }
    return b.toString();
  }
}

// End Ast.java
