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

import static net.hydromatic.aspen.ast.AstBuilder.ast;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collection;
import java.util.Collections;
import java.util.HashSet;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.function.Consumer;
import net.hydromatic.aspen.ast.Ast;
import net.hydromatic.aspen.ast.Ast.AggregateLiteral;
import net.hydromatic.aspen.ast.Ast.AtomLiteral;
import net.hydromatic.aspen.ast.Ast.Comparison;
import net.hydromatic.aspen.ast.Ast.Literal;
import net.hydromatic.aspen.ast.Ast.Term;
import net.hydromatic.aspen.ast.Ast.Variable;
import net.hydromatic.aspen.compile.SpecificationException;
import net.hydromatic.aspen.compile.TypeMismatchException;
import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * Matches a conjunction of literals against an {@link AtomIndex}.
 *
 * <p>Positive atoms are joined left to right; each binds the variables that
 * occur as its direct arguments. A comparison is applied as soon as all of
 * its variables are bound. An argument that is arithmetic over variables not
 * yet bound is matched against any value, and checked once its variables are
 * bound.
 *
 * <p>Negated atoms are filters: if the matcher was created with {@code
 * negation = true} they are applied as soon as their variables are bound
 * (the atom must be absent from the index); otherwise they are left to the
 * caller, along with aggregates, via {@link #deferred()}.
 *
 * <p>The grounder and the projector share this class; both need to match a
 * conjunctive pattern against a set of atoms.
 */
public class Matcher {
  private final ImmutableMap<String, Integer> slots;
  private final ImmutableList<Step> steps;
  private final ImmutableList<Literal> deferred;
  private final ImmutableList<String> outerVariables;
  private final int scanCount;

  private Matcher(ImmutableMap<String, Integer> slots, List<Step> steps,
      List<Literal> deferred, List<String> outerVariables) {
    this.slots = slots;
    this.steps = ImmutableList.copyOf(steps);
    this.deferred = ImmutableList.copyOf(deferred);
    this.outerVariables = ImmutableList.copyOf(outerVariables);
    int count = 0;
    for (Step step : steps) {
      if (step instanceof Scan) {
        ++count;
      }
    }
    this.scanCount = count;
  }

  /**
   * Creates a matcher.
   *
   * @param literals Literals to match, in order
   * @param outerVariables Variables that are bound before matching starts,
   *     by the binding passed to {@link #match}
   * @param negation Whether to evaluate negated atoms as filters
   * @throws SpecificationException if a comparison or negated atom has a
   *     variable that no positive atom binds
   */
  public static Matcher create(List<Literal> literals,
      Collection<String> outerVariables, boolean negation) {
    final Map<String, Integer> slots = new LinkedHashMap<>();
    for (String v : outerVariables) {
      slots.putIfAbsent(v, slots.size());
    }
    final Set<String> vars = new LinkedHashSet<>();
    for (Literal literal : literals) {
      if (!(literal instanceof AggregateLiteral)) {
        literal.collectVariables(vars);
      }
    }
    for (String v : vars) {
      slots.putIfAbsent(v, slots.size());
    }

    final Set<String> bound = new HashSet<>(outerVariables);
    final List<Step> steps = new ArrayList<>();
    final List<Literal> pending = new ArrayList<>();
    final List<Literal> deferred = new ArrayList<>();
    flush(pending, bound, steps);
    for (Literal literal : literals) {
      if (literal instanceof AtomLiteral && !((AtomLiteral) literal).negated) {
        steps.add(scan(((AtomLiteral) literal).atom, bound, slots, pending));
      } else if (literal instanceof Comparison) {
        pending.add(literal);
      } else if (literal instanceof AtomLiteral && negation) {
        pending.add(literal);
      } else {
        deferred.add(literal);
      }
      flush(pending, bound, steps);
    }
    if (!pending.isEmpty()) {
      throw new SpecificationException(
          "Literal " + pending.get(0)
              + " has a variable that is not bound by a positive atom in "
              + literals);
    }
    return new Matcher(ImmutableMap.copyOf(slots), steps, deferred,
        ImmutableList.copyOf(outerVariables));
  }

  /** Moves pending filters whose variables are all bound into the list of
   * steps. */
  private static void flush(List<Literal> pending, Set<String> bound,
      List<Step> steps) {
    for (Iterator<Literal> iterator = pending.iterator();
        iterator.hasNext(); ) {
      final Literal literal = iterator.next();
      final Set<String> vars = new HashSet<>();
      literal.collectVariables(vars);
      if (bound.containsAll(vars)) {
        steps.add(new Filter(literal));
        iterator.remove();
      }
    }
  }

  private static Scan scan(Ast.Atom atom, Set<String> bound,
      Map<String, Integer> slots, List<Literal> pending) {
    final int n = atom.terms.size();
    final Arg[] args = new Arg[n];
    final Set<String> bindsHere = new HashSet<>();
    for (int i = 0; i < n; i++) {
      final Term term = atom.terms.get(i);
      if (term instanceof Variable && !bound.contains(((Variable) term).name)) {
        final String name = ((Variable) term).name;
        final int slot = slots.get(name);
        args[i] = bindsHere.add(name)
            ? new Arg(ArgKind.BIND, slot, term)
            : new Arg(ArgKind.CHECK, slot, term);
      } else {
        final Set<String> vars = new HashSet<>();
        term.collectVariables(vars);
        if (bound.containsAll(vars)) {
          args[i] = new Arg(ArgKind.KNOWN, -1, term);
        } else {
          // Arithmetic over variables bound later; match any value, then
          // check equality once the variables are bound.
          final String hidden = "$" + slots.size();
          final int slot = slots.size();
          slots.put(hidden, slot);
          args[i] = new Arg(ArgKind.BIND, slot, term);
          pending.add(ast.eq(ast.var(hidden), term));
          bindsHere.add(hidden);
        }
      }
    }
    bound.addAll(bindsHere);
    return new Scan(atom, args);
  }

  /** Returns the literals that this matcher does not evaluate: aggregates,
   * and negated atoms if the matcher does not evaluate negation. */
  public List<Literal> deferred() {
    return deferred;
  }

  /** Returns the number of positive atoms, that is, the number of windows
   * that {@link #match(AtomIndex, Binding, int[], int[], Consumer)}
   * requires. */
  public int scanCount() {
    return scanCount;
  }

  /** Returns the names of all variables that a match binds, including outer
   * variables, in slot order. */
  public Collection<String> variables() {
    final List<String> list = new ArrayList<>();
    slots.keySet().forEach(name -> {
      if (!name.startsWith("$")) {
        list.add(name);
      }
    });
    return list;
  }

  /** Matches against all atoms of an index. */
  public void match(AtomIndex index, @Nullable Binding outer,
      Consumer<Binding> consumer) {
    final int[] lo = new int[scanCount];
    final int[] hi = new int[scanCount];
    Arrays.fill(hi, Integer.MAX_VALUE);
    match(index, outer, lo, hi, consumer);
  }

  /** Matches, returning a list of bindings; each is a copy. */
  public List<Binding> matchAll(AtomIndex index, @Nullable Binding outer) {
    final List<Binding> list = new ArrayList<>();
    match(index, outer, b -> list.add(b.copy()));
    return list;
  }

  /**
   * Matches, restricting the {@code i}th positive atom to atoms whose ids are
   * at least {@code lo[i]} and less than {@code hi[i]}.
   *
   * <p>The consumer receives the same binding object for each match; it must
   * {@link Binding#copy() copy} the binding if it wishes to retain it.
   */
  public void match(AtomIndex index, @Nullable Binding outer, int[] lo,
      int[] hi, Consumer<Binding> consumer) {
    final Binding binding = new Binding(slots);
    for (String v : outerVariables) {
      final Object value = outer == null ? null : outer.get(v);
      if (value == null) {
        throw new IllegalArgumentException("outer variable " + v
            + " is not bound");
      }
      binding.set(slots.get(v), value);
    }
    new Run(index, lo, hi, consumer).run(0, 0, binding);
  }

  /** State of one call to {@link #match}. */
  private class Run {
    final AtomIndex index;
    final int[] lo;
    final int[] hi;
    final Consumer<Binding> consumer;

    Run(AtomIndex index, int[] lo, int[] hi, Consumer<Binding> consumer) {
      this.index = index;
      this.lo = lo;
      this.hi = hi;
      this.consumer = consumer;
    }

    void run(int stepIndex, int scanIndex, Binding binding) {
      if (stepIndex == steps.size()) {
        consumer.accept(binding);
        return;
      }
      final Step step = steps.get(stepIndex);
      if (step instanceof Filter) {
        if (((Filter) step).test(index, binding)) {
          run(stepIndex + 1, scanIndex, binding);
        }
        return;
      }
      final Scan scan = (Scan) step;
      final @Nullable Object[] known = new Object[scan.args.length];
      int lookup = -1;
      for (int i = 0; i < scan.args.length; i++) {
        if (scan.args[i].kind == ArgKind.KNOWN) {
          known[i] = binding.eval(scan.args[i].term);
          if (known[i] == null) {
            return; // undefined arithmetic
          }
          if (lookup < 0) {
            lookup = i;
          }
        }
      }
      final List<Integer> candidates =
          index.candidates(scan.atom.name, lookup,
              lookup < 0 ? null : known[lookup]);
      int start = Collections.binarySearch(candidates, lo[scanIndex]);
      if (start < 0) {
        start = -start - 1;
      }
      for (int c = start; c < candidates.size(); c++) {
        final int id = candidates.get(c);
        if (id >= hi[scanIndex]) {
          break;
        }
        final GroundAtom atom = index.atom(id);
        if (atom.arity() != scan.args.length) {
          continue;
        }
        if (bind(scan, known, atom, binding)) {
          run(stepIndex + 1, scanIndex + 1, binding);
        }
        for (Arg arg : scan.args) {
          if (arg.kind == ArgKind.BIND) {
            binding.set(arg.slot, null);
          }
        }
      }
    }

    private boolean bind(Scan scan, @Nullable Object[] known,
        GroundAtom atom, Binding binding) {
      for (int i = 0; i < scan.args.length; i++) {
        final Arg arg = scan.args[i];
        final Object value = atom.args.get(i);
        switch (arg.kind) {
          case KNOWN:
            if (!value.equals(known[i])) {
              return false;
            }
            break;
          case BIND:
            binding.set(arg.slot, value);
            break;
          case CHECK:
            if (!value.equals(binding.values[arg.slot])) {
              return false;
            }
            break;
          default:
            throw new AssertionError(arg.kind);
        }
      }
      return true;
    }
  }

  /** Step in a matcher's plan. */
  private abstract static class Step {
  }

  /** Step that scans the atoms of a predicate. */
  private static class Scan extends Step {
    final Ast.Atom atom;
    final Arg[] args;

    Scan(Ast.Atom atom, Arg[] args) {
      this.atom = atom;
      this.args = args;
    }
  }

  /** Step that applies a comparison or negated atom. */
  private static class Filter extends Step {
    final Literal literal;

    Filter(Literal literal) {
      this.literal = literal;
    }

    boolean test(AtomIndex index, Binding binding) {
      if (literal instanceof Comparison) {
        final Comparison c = (Comparison) literal;
        final Object left = binding.eval(c.left);
        final Object right = binding.eval(c.right);
        if (left == null || right == null) {
          return false;
        }
        try {
          return Values.compare(left, c.op, right);
        } catch (TypeMismatchException e) {
          throw e.withContext("binding " + binding);
        }
      }
      final GroundAtom atom = binding.ground(((AtomLiteral) literal).atom);
      return atom == null || index.id(atom) < 0;
    }
  }

  /** How a scan treats an argument. */
  private enum ArgKind {
    /** Argument's value is known before the scan; the atom must match it. */
    KNOWN,
    /** Argument binds a variable. */
    BIND,
    /** Argument is a variable bound earlier in the same atom. */
    CHECK
  }

  /** Argument of a scan. */
  private static class Arg {
    final ArgKind kind;
    final int slot;
    final Term term;

    Arg(ArgKind kind, int slot, Term term) {
      this.kind = kind;
      this.slot = slot;
      this.term = term;
    }
  }
}

// End Matcher.java
