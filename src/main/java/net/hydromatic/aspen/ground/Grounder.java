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

import static java.lang.String.format;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.Lists;
import java.util.ArrayList;
import java.util.BitSet;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.function.Consumer;
import net.hydromatic.aspen.ast.Ast;
import net.hydromatic.aspen.ast.Ast.AggregateElement;
import net.hydromatic.aspen.ast.Ast.AggregateLiteral;
import net.hydromatic.aspen.ast.Ast.AtomLiteral;
import net.hydromatic.aspen.ast.Ast.Choice;
import net.hydromatic.aspen.ast.Ast.ChoiceElement;
import net.hydromatic.aspen.ast.Ast.Literal;
import net.hydromatic.aspen.ast.Ast.RangeTerm;
import net.hydromatic.aspen.ast.Ast.Term;
import net.hydromatic.aspen.compile.Analyzer;
import net.hydromatic.aspen.compile.SpecificationException;
import net.hydromatic.aspen.compile.TypeMismatchException;
import net.hydromatic.aspen.eval.Prop;
import org.checkerframework.checker.nullness.qual.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Instantiates the rules of a program over the atoms that they can derive.
 *
 * <p>Grounding has three phases.
 *
 * <ol>
 *   <li>Semi-naive fixpoint. Each round joins the positive body of every rule
 *       against the atoms known so far, requiring at least one body atom to
 *       be new in the previous round, and adds every atom that the resulting
 *       instances could derive (each disjunct, each choice element whose
 *       conditions hold). Negated atoms and aggregates are ignored, so the
 *       result is an over-approximation of every answer set.
 *   <li>Fact derivation. Instances of normal rules whose bodies consist only
 *       of facts make their heads facts.
 *   <li>Resolution. Negated atoms and aggregates of each instance are
 *       resolved against the final universe: a negated atom that can never be
 *       derived is true and is dropped; a negated fact makes the instance
 *       vanish. Literals that are facts are dropped.
 * </ol>
 */
public class Grounder {
  private static final Logger LOG = LoggerFactory.getLogger(Grounder.class);

  private final Ast.Program program;
  private final AtomTable.Builder table;
  private final BitSet facts = new BitSet();
  private final boolean simplify;
  private final List<RulePlan> plans = new ArrayList<>();
  private final List<GroundRule> rules = new ArrayList<>();
  private final List<GroundAggregate> aggregates = new ArrayList<>();

  private Grounder(Ast.Program program, Map<Prop, Object> props) {
    this.program = program;
    this.table = AtomTable.builder(Prop.MAX_GROUND_ATOMS.intValue(props));
    this.simplify = Prop.SIMPLIFY.booleanValue(props);
  }

  /**
   * Grounds a program.
   *
   * @param program Program
   * @param inputFacts Facts supplied by the host
   * @param props Properties
   * @return Ground program
   *
   * @throws SpecificationException if the program is invalid
   * @throws net.hydromatic.aspen.compile.UnsafeVariableException if a rule
   *     is unsafe
   * @throws TypeMismatchException if a comparison or arithmetic operation is
   *     applied to values of the wrong type
   * @throws GroundingException if there are too many ground atoms
   */
  public static GroundProgram ground(Ast.Program program,
      Iterable<GroundAtom> inputFacts, Map<Prop, Object> props) {
    final Map<String, Integer> arities = Analyzer.analyze(program);
    final Grounder grounder = new Grounder(program, props);
    grounder.addFacts(inputFacts, arities);
    grounder.instantiate();
    if (grounder.simplify) {
      grounder.deriveFacts();
    }
    grounder.resolve();
    final GroundProgram groundProgram =
        new GroundProgram(program, grounder.table.build(), grounder.rules,
            grounder.aggregates, grounder.facts);
    LOG.debug("Ground program has {} atoms, {} facts, {} rules",
        groundProgram.atoms.size(), groundProgram.factCount(),
        groundProgram.rules.size());
    return groundProgram;
  }

  /** Adds domain facts and input facts. */
  private void addFacts(Iterable<GroundAtom> inputFacts,
      Map<String, Integer> arities) {
    for (Ast.Domain domain : program.domains) {
      for (Object value : domain.values) {
        facts.set(table.add(GroundAtom.of(domain.name, value)));
      }
    }
    for (GroundAtom fact : inputFacts) {
      final Integer arity = arities.get(fact.predicate);
      if (arity != null && arity != fact.arity()) {
        throw new SpecificationException(
            format("Input fact %s has arity %d but predicate '%s' is used "
                + "with arity %d", fact, fact.arity(), fact.predicate, arity));
      }
      facts.set(table.add(fact));
    }
  }

  /** Phase 1. Computes the universe of atoms, and collects the instances of
   * each rule's positive body. */
  private void instantiate() {
    for (int i = 0; i < program.rules.size(); i++) {
      plans.add(new RulePlan(i, program.rules.get(i)));
    }
    int deltaStart = 0;
    int deltaEnd = table.size();
    int round = 0;
    for (;;) {
      final boolean first = round == 0;
      for (RulePlan plan : plans) {
        try {
          final int start = deltaStart;
          final int end = deltaEnd;
          runSemiNaive(plan.body, first, start, end, b -> {
            plan.instances.add(new Instance(b.copy()));
            if (!(plan.rule.head instanceof Choice)) {
              for (Ast.Atom atom : plan.rule.head.atoms()) {
                expand(atom, b, table::add);
              }
            }
          });
          for (Producer producer : plan.producers) {
            runSemiNaive(producer.matcher, first, start, end,
                b -> expand(producer.atom, b, table::add));
          }
        } catch (TypeMismatchException e) {
          throw e.withContext("rule " + plan.rule);
        }
      }
      ++round;
      LOG.trace("Grounding round {} found {} new atoms", round,
          table.size() - deltaEnd);
      if (table.size() == deltaEnd) {
        break;
      }
      deltaStart = deltaEnd;
      deltaEnd = table.size();
    }
    LOG.debug("Grounding reached fixpoint after {} rounds, {} atoms", round,
        table.size());
  }

  /**
   * Runs one semi-naive round of a matcher.
   *
   * <p>For each positive atom {@code i}, matches atom {@code i} against the
   * atoms that are new in this round ({@code [deltaStart, deltaEnd)}), atoms
   * before {@code i} against the old atoms, and atoms after {@code i} against
   * all atoms. Every combination that involves at least one new atom is
   * therefore found exactly once.
   */
  private void runSemiNaive(Matcher matcher, boolean first, int deltaStart,
      int deltaEnd, Consumer<Binding> consumer) {
    final int k = matcher.scanCount();
    if (k == 0) {
      if (first) {
        matcher.match(table, null, new int[0], new int[0], consumer);
      }
      return;
    }
    for (int i = 0; i < k; i++) {
      if (i > 0 && deltaStart == 0) {
        break; // window of atom 0 would be empty
      }
      final int[] lo = new int[k];
      final int[] hi = new int[k];
      for (int j = 0; j < k; j++) {
        if (j < i) {
          hi[j] = deltaStart;
        } else if (j == i) {
          lo[j] = deltaStart;
          hi[j] = deltaEnd;
        } else {
          hi[j] = deltaEnd;
        }
      }
      matcher.match(table, null, lo, hi, consumer);
    }
  }

  /** Evaluates an atom, expanding any range arguments, and passes each
   * resulting ground atom to a consumer. */
  private void expand(Ast.Atom atom, Binding binding,
      Consumer<GroundAtom> consumer) {
    final List<List<Object>> argLists = new ArrayList<>();
    long count = 1;
    for (Term term : atom.terms) {
      if (term instanceof RangeTerm) {
        final RangeTerm range = (RangeTerm) term;
        final Object lower = binding.eval(range.lower);
        final Object upper = binding.eval(range.upper);
        if (lower == null || upper == null) {
          return;
        }
        final int lo = Values.intValue(lower, "range " + range);
        final int hi = Values.intValue(upper, "range " + range);
        // Each tuple of the product is a distinct atom, so a product larger
        // than the table's limit cannot fit.
        count *= Math.max(0L, (long) hi - lo + 1);
        if (count > table.maxAtoms()) {
          throw new GroundingException(
              format("Range %s in %s yields more than %d ground atoms",
                  range, atom, table.maxAtoms()));
        }
        final List<Object> values = new ArrayList<>();
        for (long v = lo; v <= hi; v++) {
          values.add((int) v);
        }
        argLists.add(values);
      } else {
        final Object value = binding.eval(term);
        if (value == null) {
          return;
        }
        argLists.add(ImmutableList.of(value));
      }
    }
    for (List<Object> args : Lists.cartesianProduct(argLists)) {
      consumer.accept(GroundAtom.of(atom.name, args));
    }
  }

  /** Phase 2. Derives facts from instances of normal rules whose bodies are
   * positive and consist of facts. */
  private void deriveFacts() {
    final List<Instance> candidates = new ArrayList<>();
    final List<RulePlan> candidatePlans = new ArrayList<>();
    for (RulePlan plan : plans) {
      if (plan.rule.head instanceof Ast.NormalHead
          && plan.body.deferred().isEmpty()) {
        for (Instance instance : plan.instances) {
          candidates.add(instance);
          candidatePlans.add(plan);
        }
      }
    }
    final BitSet done = new BitSet();
    boolean changed = true;
    int passes = 0;
    while (changed) {
      changed = false;
      ++passes;
      for (int i = 0; i < candidates.size(); i++) {
        if (done.get(i)) {
          continue;
        }
        final Instance instance = candidates.get(i);
        final RulePlan plan = candidatePlans.get(i);
        if (!allFacts(instance.positiveIds(plan))) {
          continue;
        }
        done.set(i);
        final Ast.Atom head = ((Ast.NormalHead) plan.rule.head).atom;
        try {
          expand(head, instance.binding, atom -> {
            final int id = table.id(atom);
            if (id >= 0 && !facts.get(id)) {
              facts.set(id);
            }
          });
        } catch (TypeMismatchException e) {
          throw e.withContext("rule " + plan.rule);
        }
        changed = true;
      }
    }
    LOG.trace("Derived {} facts in {} passes", facts.cardinality(), passes);
  }

  private boolean allFacts(int[] ids) {
    for (int id : ids) {
      if (!facts.get(id)) {
        return false;
      }
    }
    return true;
  }

  /** Phase 3. Converts each instance into zero or more ground rules. */
  private void resolve() {
    for (RulePlan plan : plans) {
      for (Instance instance : plan.instances) {
        try {
          resolve(plan, instance);
        } catch (TypeMismatchException e) {
          throw e.withContext("rule " + plan.rule);
        }
      }
    }
  }

  private void resolve(RulePlan plan, Instance instance) {
    final Binding binding = instance.binding;
    final GroundCondition body =
        condition(plan.rule.body, binding, instance.positiveIds(plan));
    if (body == null) {
      return; // a negated atom is a fact
    }
    final List<Integer> aggregateIds = new ArrayList<>();
    final List<Boolean> aggregateNegated = new ArrayList<>();
    for (Literal literal : plan.body.deferred()) {
      if (!(literal instanceof AggregateLiteral)) {
        continue;
      }
      final AggregateLiteral aggregateLiteral = (AggregateLiteral) literal;
      final GroundAggregate aggregate =
          aggregate(aggregateLiteral, plan.aggregateMatchers.get(literal),
              binding);
      if (aggregate == null) {
        return; // bound is undefined
      }
      if (simplify) {
        int status = aggregate.status(id ->
            facts.get(id) ? GroundCondition.TRUE : GroundCondition.UNDEFINED);
        if (aggregateLiteral.negated) {
          status = -status;
        }
        if (status == GroundCondition.TRUE) {
          continue;
        }
        if (status == GroundCondition.FALSE) {
          return;
        }
      }
      aggregateIds.add(aggregates.size());
      aggregateNegated.add(aggregateLiteral.negated);
      aggregates.add(aggregate);
    }
    final int[] aggs = aggregateIds.stream().mapToInt(i -> i).toArray();
    final boolean[] negs = new boolean[aggs.length];
    for (int i = 0; i < negs.length; i++) {
      negs[i] = aggregateNegated.get(i);
    }
    final boolean emptyBody = body.isEmpty() && aggs.length == 0;
    final Ast.Head head = plan.rule.head;

    if (head instanceof Ast.Constraint) {
      rules.add(
          new GroundRule(GroundRule.Kind.CONSTRAINT, GroundCondition.EMPTY,
              ImmutableList.of(), 0, 0, body, aggs, negs, plan.index));
    } else if (head instanceof Ast.NormalHead) {
      expand(((Ast.NormalHead) head).atom, binding, atom -> {
        final int id = table.id(atom);
        if (emptyBody) {
          facts.set(id);
        } else if (!(simplify && facts.get(id))) {
          rules.add(
              new GroundRule(GroundRule.Kind.NORMAL, new int[] {id},
                  ImmutableList.of(), 0, 0, body, aggs, negs, plan.index));
        }
      });
    } else if (head instanceof Ast.Disjunction) {
      final Set<Integer> ids = new LinkedHashSet<>();
      for (Ast.Atom atom : head.atoms()) {
        expand(atom, binding, a -> ids.add(table.id(a)));
      }
      if (simplify && ids.stream().anyMatch(facts::get)) {
        return; // head is already satisfied
      }
      final int[] headIds = ids.stream().mapToInt(i -> i).toArray();
      if (headIds.length == 1 && emptyBody) {
        facts.set(headIds[0]);
        return;
      }
      rules.add(
          new GroundRule(
              headIds.length == 1
                  ? GroundRule.Kind.NORMAL
                  : GroundRule.Kind.DISJUNCTIVE,
              headIds, ImmutableList.of(), 0, 0, body, aggs, negs,
              plan.index));
    } else {
      choice(plan, binding, body, aggs, negs);
    }
  }

  private void choice(RulePlan plan, Binding binding, GroundCondition body,
      int[] aggs, boolean[] negs) {
    final Choice choice = (Choice) plan.rule.head;
    final int lower;
    final int upper;
    if (choice.lower == null) {
      lower = 0;
    } else {
      final Object value = binding.eval(choice.lower);
      if (value == null) {
        return;
      }
      lower = Values.intValue(value, "choice bound " + choice.lower);
    }
    if (choice.upper == null) {
      upper = Integer.MAX_VALUE;
    } else {
      final Object value = binding.eval(choice.upper);
      if (value == null) {
        return;
      }
      upper = Values.intValue(value, "choice bound " + choice.upper);
    }
    final Map<Integer, List<GroundCondition>> elements =
        new LinkedHashMap<>();
    for (int i = 0; i < choice.elements.size(); i++) {
      final ChoiceElement element = choice.elements.get(i);
      plan.elementMatchers.get(i).match(table, binding, b -> {
        final GroundCondition condition =
            condition(element.conditions, b, positiveIds(element.conditions,
                b));
        if (condition == null) {
          return;
        }
        expand(element.atom, b, atom -> {
          final int id = table.id(atom);
          if (id < 0) {
            return;
          }
          final List<GroundCondition> conditions =
              elements.computeIfAbsent(id, k -> new ArrayList<>());
          if (condition.isEmpty()) {
            conditions.clear();
            conditions.add(condition);
          } else if (conditions.isEmpty() || !conditions.get(0).isEmpty()) {
            conditions.add(condition);
          }
        });
      });
    }
    final int[] head = new int[elements.size()];
    final List<ImmutableList<GroundCondition>> headConditions =
        new ArrayList<>();
    int i = 0;
    for (Map.Entry<Integer, List<GroundCondition>> e : elements.entrySet()) {
      head[i++] = e.getKey();
      headConditions.add(ImmutableList.copyOf(e.getValue()));
    }
    rules.add(
        new GroundRule(GroundRule.Kind.CHOICE, head, headConditions, lower,
            upper, body, aggs, negs, plan.index));
  }

  /** Grounds an aggregate literal, or returns null if its bound is
   * undefined. */
  private @Nullable GroundAggregate aggregate(AggregateLiteral literal,
      List<Matcher> matchers, Binding binding) {
    final Object boundValue = binding.eval(literal.bound);
    if (boundValue == null) {
      return null;
    }
    final int bound = Values.intValue(boundValue, "aggregate " + literal);
    final Map<List<Object>, List<GroundCondition>> elements =
        new LinkedHashMap<>();
    for (int i = 0; i < literal.elements.size(); i++) {
      final AggregateElement element = literal.elements.get(i);
      matchers.get(i).match(table, binding, b -> {
        final List<Object> tuple = b.evalAll(element.terms);
        if (tuple == null) {
          return;
        }
        final GroundCondition condition =
            condition(element.conditions, b,
                positiveIds(element.conditions, b));
        if (condition != null) {
          elements.computeIfAbsent(ImmutableList.copyOf(tuple),
              k -> new ArrayList<>()).add(condition);
        }
      });
    }
    final List<GroundAggregate.Element> list = new ArrayList<>();
    elements.forEach((tuple, conditions) -> {
      final int weight;
      if (literal.function == Ast.AggFunction.COUNT) {
        weight = 1;
      } else if (tuple.isEmpty()) {
        throw new SpecificationException(
            "Element of " + literal.function + " has no weight: " + literal);
      } else {
        weight = Values.intValue(tuple.get(0), "weight of " + literal);
      }
      list.add(new GroundAggregate.Element(tuple, weight, conditions));
    });
    return new GroundAggregate(literal.function, literal.op, bound, list);
  }

  /** Returns the ids of the positive atoms among some literals. Every such
   * atom is in the table, because the matcher matched it. */
  private int[] positiveIds(List<Literal> literals, Binding binding) {
    final List<Integer> ids = new ArrayList<>();
    for (Literal literal : literals) {
      if (literal instanceof AtomLiteral && !((AtomLiteral) literal).negated) {
        final GroundAtom atom = binding.ground(((AtomLiteral) literal).atom);
        if (atom != null) {
          ids.add(table.id(atom));
        }
      }
    }
    return ids.stream().mapToInt(i -> i).toArray();
  }

  /**
   * Builds the ground condition of some literals under a binding.
   *
   * <p>Returns null if the condition is false because a negated atom is a
   * fact. Negated atoms that cannot be derived are omitted, and so are
   * positive atoms that are facts, if simplifying.
   */
  private @Nullable GroundCondition condition(List<Literal> literals,
      Binding binding, int[] positiveIds) {
    final List<Integer> pos = new ArrayList<>();
    for (int id : positiveIds) {
      if (!(simplify && facts.get(id))) {
        pos.add(id);
      }
    }
    final List<Integer> neg = new ArrayList<>();
    for (Literal literal : literals) {
      if (literal instanceof AtomLiteral && ((AtomLiteral) literal).negated) {
        final GroundAtom atom = binding.ground(((AtomLiteral) literal).atom);
        final int id = atom == null ? -1 : table.id(atom);
        if (id < 0) {
          continue;
        }
        if (facts.get(id)) {
          return null;
        }
        neg.add(id);
      }
    }
    if (pos.isEmpty() && neg.isEmpty()) {
      return GroundCondition.EMPTY_CONDITION;
    }
    return new GroundCondition(pos.stream().mapToInt(i -> i).toArray(),
        neg.stream().mapToInt(i -> i).toArray());
  }

  /** Compiled form of a rule. */
  private class RulePlan {
    final int index;
    final Ast.Rule rule;
    final Matcher body;
    /** For a choice rule, matchers that add each element's atoms to the
     * universe. */
    final List<Producer> producers = new ArrayList<>();
    /** For a choice rule, matchers for the conditions of each element, given
     * a body binding. */
    final List<Matcher> elementMatchers = new ArrayList<>();
    final Map<Literal, List<Matcher>> aggregateMatchers =
        new LinkedHashMap<>();
    final List<Instance> instances = new ArrayList<>();

    RulePlan(int index, Ast.Rule rule) {
      this.index = index;
      this.rule = rule;
      this.body = Matcher.create(rule.body, ImmutableList.of(), false);
      if (rule.head instanceof Choice) {
        for (ChoiceElement element : ((Choice) rule.head).elements) {
          final List<Literal> literals = new ArrayList<>(rule.body);
          literals.addAll(element.conditions);
          producers.add(
              new Producer(
                  Matcher.create(literals, ImmutableList.of(), false),
                  element.atom));
          elementMatchers.add(
              Matcher.create(element.conditions, body.variables(), false));
        }
      }
      for (Literal literal : body.deferred()) {
        if (literal instanceof AggregateLiteral) {
          final List<Matcher> matchers = new ArrayList<>();
          for (AggregateElement element
              : ((AggregateLiteral) literal).elements) {
            matchers.add(
                Matcher.create(element.conditions, body.variables(), false));
          }
          aggregateMatchers.put(literal, matchers);
        }
      }
    }
  }

  /** Matcher that derives an atom. */
  private static class Producer {
    final Matcher matcher;
    final Ast.Atom atom;

    Producer(Matcher matcher, Ast.Atom atom) {
      this.matcher = matcher;
      this.atom = atom;
    }
  }

  /** Instance of a rule body, found in phase 1. */
  private class Instance {
    final Binding binding;
    int @Nullable [] positiveIds;

    Instance(Binding binding) {
      this.binding = binding;
    }

    int[] positiveIds(RulePlan plan) {
      if (positiveIds == null) {
        positiveIds = Grounder.this.positiveIds(plan.rule.body, binding);
      }
      return positiveIds;
    }
  }
}

// End Grounder.java
