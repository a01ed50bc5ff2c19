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

import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import net.hydromatic.aspen.ast.Ast;
import net.hydromatic.aspen.ast.Ast.AggregateElement;
import net.hydromatic.aspen.ast.Ast.AggregateLiteral;
import net.hydromatic.aspen.ast.Ast.ArithmeticExpr;
import net.hydromatic.aspen.ast.Ast.Atom;
import net.hydromatic.aspen.ast.Ast.AtomLiteral;
import net.hydromatic.aspen.ast.Ast.Choice;
import net.hydromatic.aspen.ast.Ast.ChoiceElement;
import net.hydromatic.aspen.ast.Ast.Comparison;
import net.hydromatic.aspen.ast.Ast.Constant;
import net.hydromatic.aspen.ast.Ast.Literal;
import net.hydromatic.aspen.ast.Ast.RangeTerm;
import net.hydromatic.aspen.ast.Ast.Rule;
import net.hydromatic.aspen.ast.Ast.Term;
import net.hydromatic.aspen.ast.Ast.Variable;

/**
 * Analyzer for rule programs.
 *
 * <p>Checks that predicates are used with a consistent arity, that ranges
 * occur only in heads, that every rule is safe, and that comparisons between
 * constants are well-typed. All of these are specification errors, reported
 * before grounding starts.
 */
public class Analyzer {
  private Analyzer() {
    // Utility class
  }

  /**
   * Analyzes a program.
   *
   * @param program the program to analyze
   * @return the arity of each predicate used in the program
   * @throws SpecificationException if the program is invalid
   * @throws UnsafeVariableException if a rule is unsafe
   */
  public static Map<String, Integer> analyze(Ast.Program program) {
    final Map<String, Integer> arities = new HashMap<>();
    for (Ast.Domain domain : program.domains) {
      checkArity(arities, domain.name, 1, domain);
    }
    for (Rule rule : program.rules) {
      checkArities(arities, rule);
      checkRanges(rule);
      checkNesting(rule);
      checkSafety(rule);
      checkConstantTypes(rule);
    }
    return arities;
  }

  private static void checkArity(Map<String, Integer> arities, String name,
      int arity, Object context) {
    final Integer previous = arities.putIfAbsent(name, arity);
    if (previous != null && previous != arity) {
      throw new SpecificationException(
          format(
              "Predicate '%s' is used with arity %d and arity %d in %s",
              name, previous, arity, context));
    }
  }

  private static void checkArities(Map<String, Integer> arities, Rule rule) {
    for (Atom atom : rule.head.atoms()) {
      checkArity(arities, atom.name, atom.arity(), rule);
    }
    if (rule.head instanceof Choice) {
      for (ChoiceElement element : ((Choice) rule.head).elements) {
        checkLiteralArities(arities, element.conditions, rule);
      }
    }
    checkLiteralArities(arities, rule.body, rule);
  }

  private static void checkLiteralArities(Map<String, Integer> arities,
      List<Literal> literals, Rule rule) {
    for (Literal literal : literals) {
      if (literal instanceof AtomLiteral) {
        final Atom atom = ((AtomLiteral) literal).atom;
        checkArity(arities, atom.name, atom.arity(), rule);
      } else if (literal instanceof AggregateLiteral) {
        for (AggregateElement element : ((AggregateLiteral) literal).elements) {
          checkLiteralArities(arities, element.conditions, rule);
        }
      }
    }
  }

  /** Checks that range terms occur only as direct arguments of head
   * atoms. */
  private static void checkRanges(Rule rule) {
    for (Atom atom : rule.head.atoms()) {
      for (Term term : atom.terms) {
        if (term instanceof RangeTerm) {
          final RangeTerm range = (RangeTerm) term;
          checkNoRange(range.lower, rule);
          checkNoRange(range.upper, rule);
        } else {
          checkNoRange(term, rule);
        }
      }
    }
    if (rule.head instanceof Choice) {
      final Choice choice = (Choice) rule.head;
      for (ChoiceElement element : choice.elements) {
        checkNoRange(element.conditions, rule);
      }
      if (choice.lower != null) {
        checkNoRange(choice.lower, rule);
      }
      if (choice.upper != null) {
        checkNoRange(choice.upper, rule);
      }
    }
    checkNoRange(rule.body, rule);
  }

  private static void checkNoRange(List<Literal> literals, Rule rule) {
    for (Literal literal : literals) {
      if (literal instanceof AtomLiteral) {
        ((AtomLiteral) literal).atom.terms.forEach(t -> checkNoRange(t, rule));
      } else if (literal instanceof Comparison) {
        checkNoRange(((Comparison) literal).left, rule);
        checkNoRange(((Comparison) literal).right, rule);
      } else if (literal instanceof AggregateLiteral) {
        final AggregateLiteral aggregate = (AggregateLiteral) literal;
        checkNoRange(aggregate.bound, rule);
        for (AggregateElement element : aggregate.elements) {
          element.terms.forEach(t -> checkNoRange(t, rule));
          checkNoRange(element.conditions, rule);
        }
      }
    }
  }

  private static void checkNoRange(Term term, Rule rule) {
    if (term instanceof RangeTerm) {
      throw new SpecificationException(
          format("Range %s is only allowed as an argument of a head atom: %s",
              term, rule));
    }
    if (term instanceof ArithmeticExpr) {
      checkNoRange(((ArithmeticExpr) term).left, rule);
      checkNoRange(((ArithmeticExpr) term).right, rule);
    }
  }

  /** Checks that aggregates do not occur in the conditions of choice
   * elements or aggregate elements. */
  private static void checkNesting(Rule rule) {
    if (rule.head instanceof Choice) {
      for (ChoiceElement element : ((Choice) rule.head).elements) {
        checkNoAggregate(element.conditions, rule);
      }
    }
    for (Literal literal : rule.body) {
      if (literal instanceof AggregateLiteral) {
        for (AggregateElement element : ((AggregateLiteral) literal).elements) {
          checkNoAggregate(element.conditions, rule);
        }
      }
    }
  }

  private static void checkNoAggregate(List<Literal> literals, Rule rule) {
    for (Literal literal : literals) {
      if (literal instanceof AggregateLiteral) {
        throw new SpecificationException(
            format("Aggregate %s is not allowed in an element condition: %s",
                literal, rule));
      }
    }
  }

  /**
   * Checks that a rule is safe.
   *
   * <p>A rule is safe if every variable occurs as a direct argument of a
   * positive atom in the body. A variable that occurs only in an aggregate
   * element or a choice element is local to that element, and may instead be
   * bound by a positive atom among the element's conditions. Occurrences
   * inside arithmetic, comparisons and negated atoms never bind a variable.
   */
  static void checkSafety(Rule rule) {
    final Set<String> bound = boundVariables(rule.body, new HashSet<>());

    if (!(rule.head instanceof Choice)) {
      for (Atom atom : rule.head.atoms()) {
        checkBound(rule, atom.terms, bound, "head");
      }
    } else {
      final Choice choice = (Choice) rule.head;
      for (ChoiceElement element : choice.elements) {
        final Set<String> local =
            boundVariables(element.conditions, new HashSet<>(bound));
        checkBound(rule, element.atom.terms, local, "choice element");
        checkLiterals(rule, element.conditions, local, "choice condition");
      }
      if (choice.lower != null) {
        checkBound(rule, choice.lower, bound, "choice bound");
      }
      if (choice.upper != null) {
        checkBound(rule, choice.upper, bound, "choice bound");
      }
    }
    checkLiterals(rule, rule.body, bound, "body");
  }

  /** Checks the literals of a body or condition list, given the variables
   * bound by its positive atoms (and by any enclosing scope). */
  private static void checkLiterals(Rule rule, List<Literal> literals,
      Set<String> bound, String context) {
    for (Literal literal : literals) {
      if (literal instanceof AtomLiteral) {
        final AtomLiteral atomLiteral = (AtomLiteral) literal;
        checkBound(rule, atomLiteral.atom.terms, bound,
            atomLiteral.negated ? "negated atom" : context);
      } else if (literal instanceof Comparison) {
        final Comparison comparison = (Comparison) literal;
        checkBound(rule, comparison.left, bound, "comparison");
        checkBound(rule, comparison.right, bound, "comparison");
      } else if (literal instanceof AggregateLiteral) {
        final AggregateLiteral aggregate = (AggregateLiteral) literal;
        checkBound(rule, aggregate.bound, bound, "aggregate bound");
        for (AggregateElement element : aggregate.elements) {
          final Set<String> local =
              boundVariables(element.conditions, new HashSet<>(bound));
          checkBound(rule, element.terms, local, "aggregate element");
          checkLiterals(rule, element.conditions, local,
              "aggregate condition");
        }
      }
    }
  }

  private static void checkBound(Rule rule, List<Term> terms,
      Set<String> bound, String context) {
    for (Term term : terms) {
      checkBound(rule, term, bound, context);
    }
  }

  private static void checkBound(Rule rule, Term term, Set<String> bound,
      String context) {
    final Set<String> vars = new LinkedHashSet<>();
    term.collectVariables(vars);
    for (String var : vars) {
      if (!bound.contains(var)) {
        throw new UnsafeVariableException(rule, var, context);
      }
    }
  }

  /** Adds to a set the variables that occur as direct arguments of positive
   * atoms in a list of literals, and returns the set. */
  public static Set<String> boundVariables(List<Literal> literals,
      Set<String> vars) {
    for (Literal literal : literals) {
      if (literal instanceof AtomLiteral && !((AtomLiteral) literal).negated) {
        for (Term term : ((AtomLiteral) literal).atom.terms) {
          if (term instanceof Variable) {
            vars.add(((Variable) term).name);
          }
        }
      }
    }
    return vars;
  }

  /** Checks that ordering comparisons between two constants compare values
   * of the same type. */
  private static void checkConstantTypes(Rule rule) {
    for (Literal literal : rule.body) {
      if (literal instanceof Comparison) {
        final Comparison c = (Comparison) literal;
        if (c.op.isOrdering()
            && c.left instanceof Constant
            && c.right instanceof Constant
            && ((Constant) c.left).value.getClass()
                != ((Constant) c.right).value.getClass()) {
          throw TypeMismatchException.comparison(((Constant) c.left).value,
                  c.op, ((Constant) c.right).value)
              .withContext(rule.toString());
        }
      }
    }
  }
}

// End Analyzer.java
