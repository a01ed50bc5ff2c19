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
package net.hydromatic.aspen.solve;

import static java.util.Objects.requireNonNull;
import static net.hydromatic.aspen.ground.GroundCondition.FALSE;
import static net.hydromatic.aspen.ground.GroundCondition.TRUE;
import static net.hydromatic.aspen.ground.GroundCondition.UNDEFINED;

import com.google.common.collect.ImmutableMap;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.BitSet;
import java.util.Comparator;
import java.util.Deque;
import java.util.List;
import java.util.Map;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.function.IntUnaryOperator;
import java.util.stream.IntStream;
import net.hydromatic.aspen.eval.Prop;
import net.hydromatic.aspen.ground.GroundAggregate;
import net.hydromatic.aspen.ground.GroundAtom;
import net.hydromatic.aspen.ground.GroundCondition;
import net.hydromatic.aspen.ground.GroundProgram;
import net.hydromatic.aspen.ground.GroundRule;
import net.hydromatic.aspen.util.Tracer;
import org.checkerframework.checker.nullness.qual.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Finds the answer sets of a ground program by propagation and
 * backtracking.
 *
 * <p>The solver assigns a truth value to each atom. It chooses values only
 * for decision atoms, the head atoms of choice and disjunctive rules; other
 * atoms get their values by propagation:
 *
 * <ul>
 *   <li>if a rule's body is true, its head follows (a normal head atom is
 *       true; if all disjuncts but one are false, that one is true; a choice
 *       rule's bounds are enforced);
 *   <li>if a rule's head cannot hold, its body must not be true, so if all
 *       body literals but one are true, that one is made false;
 *   <li>an atom that no rule can support is false, and a true atom that only
 *       one rule can support makes that rule's body true.
 * </ul>
 *
 * <p>Assignments are recorded on a trail. When propagation fails, the solver
 * undoes the trail back to the most recent decision that has not yet been
 * flipped, and flips it. When every atom has a value, the assignment is
 * checked by a {@link ModelChecker}; if it is rejected, that counts as a
 * failure too.
 *
 * <p>After returning an answer set, a further call to {@link #next()}
 * resumes the search by flipping the last decision, so answer sets are
 * enumerated without repetition.
 *
 * <p>A solver is not thread-safe, but several solvers may share one
 * ground program.
 */
public class Solver implements Search {
  private static final Logger LOG = LoggerFactory.getLogger(Solver.class);

  private final GroundProgram program;
  private final Tracer tracer;
  private final AtomicBoolean cancelled;
  private final int stepLimit;
  private final long timeLimitNanos;
  private final ModelChecker checker;

  /** Value of each atom: {@link GroundCondition#TRUE},
   * {@link GroundCondition#FALSE} or {@link GroundCondition#UNDEFINED}. */
  private final int[] values;
  private final IntUnaryOperator valueOf;
  private final int[] trail;
  private int trailSize;
  private final List<Decision> decisions = new ArrayList<>();

  /** Atoms that the solver chooses values for, in the order it chooses
   * them. */
  private final int[] decisionOrder;
  /** All atoms that are not facts, in atom order. */
  private final int[] residualOrder;

  /** For each atom, the rules that have it in their head. */
  private final int[][] supports;
  /** For each atom, the rules whose status may change when it is
   * assigned. */
  private final int[][] watchers;

  private final Deque<Integer> ruleQueue = new ArrayDeque<>();
  private final boolean[] ruleQueued;
  private final Deque<Integer> atomQueue = new ArrayDeque<>();
  private final boolean[] atomQueued;

  private State state = State.NEW;
  private long decisionCount;
  private long conflictCount;

  /** Creates a solver. */
  public Solver(GroundProgram program, Map<Prop, Object> props,
      Tracer tracer) {
    this(program, props, tracer, 0, new AtomicBoolean());
  }

  /**
   * Creates a solver with a given rotation of the decision order.
   *
   * @param program Ground program
   * @param props Properties
   * @param tracer Tracer
   * @param rotation Number of positions by which to rotate the order in
   *     which decision atoms are chosen
   * @param cancelled Flag that, when set by another thread, stops the
   *     search
   */
  Solver(GroundProgram program, Map<Prop, Object> props, Tracer tracer,
      int rotation, AtomicBoolean cancelled) {
    this.program = requireNonNull(program);
    this.tracer = requireNonNull(tracer);
    this.cancelled = requireNonNull(cancelled);
    this.stepLimit = Prop.STEP_LIMIT.intValue(props);
    this.timeLimitNanos =
        TimeUnit.MILLISECONDS.toNanos(Prop.TIME_LIMIT_MILLIS.intValue(props));
    this.checker = new ModelChecker(program);

    final int atomCount = program.atoms.size();
    this.values = new int[atomCount];
    this.valueOf = id -> values[id];
    this.trail = new int[atomCount];
    this.ruleQueued = new boolean[program.rules.size()];
    this.atomQueued = new boolean[atomCount];

    final Comparator<Integer> atomOrder =
        Comparator.comparing(program.atoms::atom);
    final BitSet decisionAtoms = new BitSet();
    for (GroundRule rule : program.rules) {
      if (rule.kind == GroundRule.Kind.CHOICE
          || rule.kind == GroundRule.Kind.DISJUNCTIVE) {
        for (int atom : rule.head) {
          if (!program.isFact(atom)) {
            decisionAtoms.set(atom);
          }
        }
      }
    }
    final int[] sorted =
        decisionAtoms.stream().boxed().sorted(atomOrder)
            .mapToInt(i -> i).toArray();
    this.decisionOrder = new int[sorted.length];
    for (int i = 0; i < sorted.length; i++) {
      decisionOrder[i] = sorted[(i + rotation) % sorted.length];
    }
    this.residualOrder =
        IntStream.range(0, atomCount)
            .filter(id -> !program.isFact(id))
            .boxed().sorted(atomOrder)
            .mapToInt(i -> i).toArray();

    final List<List<Integer>> supportLists = lists(atomCount);
    final List<List<Integer>> watcherLists = lists(atomCount);
    for (int r = 0; r < program.rules.size(); r++) {
      final GroundRule rule = program.rules.get(r);
      for (int atom : rule.head) {
        supportLists.get(atom).add(r);
        watch(watcherLists, atom, r);
      }
      watch(watcherLists, rule.body, r);
      for (List<GroundCondition> conditions : rule.headConditions) {
        for (GroundCondition condition : conditions) {
          watch(watcherLists, condition, r);
        }
      }
      for (int aggregate : rule.aggregates) {
        for (int atom : program.aggregates.get(aggregate).atoms()) {
          watch(watcherLists, atom, r);
        }
      }
    }
    this.supports = toArrays(supportLists);
    this.watchers = toArrays(watcherLists);
  }

  private static List<List<Integer>> lists(int n) {
    final List<List<Integer>> lists = new ArrayList<>(n);
    for (int i = 0; i < n; i++) {
      lists.add(new ArrayList<>());
    }
    return lists;
  }

  private static void watch(List<List<Integer>> watcherLists,
      GroundCondition condition, int rule) {
    for (int atom : condition.pos) {
      watch(watcherLists, atom, rule);
    }
    for (int atom : condition.neg) {
      watch(watcherLists, atom, rule);
    }
  }

  private static void watch(List<List<Integer>> watcherLists, int atom,
      int rule) {
    final List<Integer> list = watcherLists.get(atom);
    if (list.isEmpty() || list.get(list.size() - 1) != rule) {
      list.add(rule);
    }
  }

  private static int[][] toArrays(List<List<Integer>> lists) {
    final int[][] arrays = new int[lists.size()][];
    for (int i = 0; i < arrays.length; i++) {
      arrays[i] = lists.get(i).stream().mapToInt(j -> j).toArray();
    }
    return arrays;
  }

  /** Stops the search. May be called from any thread; the search notices
   * at its next decision. */
  public void cancel() {
    cancelled.set(true);
  }

  @Override public SolveResult next() {
    switch (state) {
      case EXHAUSTED:
        return result(SolveResult.Status.INCONSISTENT, null);
      case STOPPED:
        return result(SolveResult.Status.UNKNOWN, null);
      case NEW:
        state = State.SEARCHING;
        if (!start()) {
          return exhausted();
        }
        break;
      default:
        // Resume after an answer set.
        if (!backtrack()) {
          return exhausted();
        }
        break;
    }
    final long deadline = timeLimitNanos > 0
        ? System.nanoTime() + timeLimitNanos
        : Long.MAX_VALUE;
    final long decisionLimit = stepLimit > 0
        ? decisionCount + stepLimit
        : Long.MAX_VALUE;
    for (;;) {
      if (cancelled.get()
          || decisionCount >= decisionLimit
          || deadline != Long.MAX_VALUE && System.nanoTime() > deadline) {
        state = State.STOPPED;
        LOG.debug("Search stopped after {} decisions, {} conflicts",
            decisionCount, conflictCount);
        return result(SolveResult.Status.UNKNOWN, null);
      }
      int atom = nextUndefined(decisionOrder);
      int value = TRUE;
      if (atom < 0) {
        atom = nextUndefined(residualOrder);
        value = FALSE;
      }
      if (atom < 0) {
        final BitSet model = trueAtoms();
        final String failure = checker.check(model);
        if (failure == null) {
          final AnswerSet answerSet = new AnswerSet(program.atoms, model);
          LOG.debug("Found answer set of {} atoms after {} decisions, "
                  + "{} conflicts", answerSet.size(), decisionCount,
              conflictCount);
          tracer.onAnswerSet(answerSet);
          return result(SolveResult.Status.SATISFIABLE, answerSet);
        }
        LOG.trace("Candidate rejected: {}", failure);
        onConflict();
        if (!backtrack()) {
          return exhausted();
        }
        continue;
      }
      decide(atom, value);
      if (!propagate()) {
        onConflict();
        if (!backtrack()) {
          return exhausted();
        }
      }
    }
  }

  /** Assigns facts and propagates. Returns false if the program is
   * inconsistent without any decisions. */
  private boolean start() {
    for (int id = 0; id < values.length; id++) {
      if (program.isFact(id)) {
        assign(id, TRUE);
      }
    }
    for (int r = 0; r < program.rules.size(); r++) {
      enqueueRule(r);
    }
    for (int id = 0; id < values.length; id++) {
      enqueueAtom(id);
    }
    if (!propagate()) {
      onConflict();
      return false;
    }
    return true;
  }

  private SolveResult exhausted() {
    state = State.EXHAUSTED;
    LOG.debug("Search exhausted after {} decisions, {} conflicts",
        decisionCount, conflictCount);
    return result(SolveResult.Status.INCONSISTENT, null);
  }

  private SolveResult result(SolveResult.Status status,
      @Nullable AnswerSet answerSet) {
    return new SolveResult(status, answerSet, decisionCount, conflictCount);
  }

  private int nextUndefined(int[] order) {
    for (int atom : order) {
      if (values[atom] == UNDEFINED) {
        return atom;
      }
    }
    return -1;
  }

  private BitSet trueAtoms() {
    final BitSet model = new BitSet(values.length);
    for (int id = 0; id < values.length; id++) {
      if (values[id] == TRUE) {
        model.set(id);
      }
    }
    return model;
  }

  private void decide(int atom, int value) {
    decisions.add(new Decision(atom, trailSize, value));
    ++decisionCount;
    tracer.onDecision(decisions.size(), program.atoms.atom(atom),
        value == TRUE);
    assign(atom, value);
  }

  private void onConflict() {
    ++conflictCount;
    final ImmutableMap.Builder<GroundAtom, Boolean> map =
        ImmutableMap.builder();
    for (Decision decision : decisions) {
      map.put(program.atoms.atom(decision.atom), decision.value == TRUE);
    }
    tracer.onConflict(map.build());
  }

  /**
   * Backtracks to the most recent decision that has not been flipped,
   * flips it, and propagates. Repeats while propagation fails.
   *
   * @return whether a consistent state was reached; false if every decision
   *     has been flipped, which means that the search is complete
   */
  private boolean backtrack() {
    while (!decisions.isEmpty()) {
      final Decision decision = decisions.get(decisions.size() - 1);
      undo(decision.trailIndex);
      if (decision.flipped) {
        decisions.remove(decisions.size() - 1);
        continue;
      }
      decision.flipped = true;
      decision.value = -decision.value;
      assign(decision.atom, decision.value);
      if (propagate()) {
        return true;
      }
      onConflict();
    }
    return false;
  }

  private void undo(int trailIndex) {
    while (trailSize > trailIndex) {
      values[trail[--trailSize]] = UNDEFINED;
    }
  }

  /** Assigns a value to an atom. Returns false if the atom already has the
   * opposite value. */
  private boolean assign(int atom, int value) {
    final int current = values[atom];
    if (current != UNDEFINED) {
      return current == value;
    }
    values[atom] = value;
    trail[trailSize++] = atom;
    for (int rule : watchers[atom]) {
      enqueueRule(rule);
    }
    enqueueAtom(atom);
    return true;
  }

  private void enqueueRule(int rule) {
    if (!ruleQueued[rule]) {
      ruleQueued[rule] = true;
      ruleQueue.add(rule);
    }
  }

  private void enqueueAtom(int atom) {
    if (!atomQueued[atom]) {
      atomQueued[atom] = true;
      atomQueue.add(atom);
    }
  }

  /** Propagates until nothing changes. Returns false on conflict, leaving
   * both queues empty. */
  private boolean propagate() {
    for (;;) {
      if (!ruleQueue.isEmpty()) {
        final int r = ruleQueue.remove();
        ruleQueued[r] = false;
        final GroundRule rule = program.rules.get(r);
        if (!propagateRule(rule)) {
          clearQueues();
          return false;
        }
        for (int atom : rule.head) {
          enqueueAtom(atom);
        }
      } else if (!atomQueue.isEmpty()) {
        final int atom = atomQueue.remove();
        atomQueued[atom] = false;
        if (!propagateSupport(atom)) {
          clearQueues();
          return false;
        }
      } else {
        return true;
      }
    }
  }

  private void clearQueues() {
    for (int rule : ruleQueue) {
      ruleQueued[rule] = false;
    }
    ruleQueue.clear();
    for (int atom : atomQueue) {
      atomQueued[atom] = false;
    }
    atomQueue.clear();
  }

  /** Returns the status of a rule's body, including its aggregates. */
  private int bodyStatus(GroundRule rule) {
    int status = rule.body.status(valueOf);
    if (status == FALSE) {
      return FALSE;
    }
    for (int i = 0; i < rule.aggregates.length; i++) {
      final int s = aggregateStatus(rule, i);
      if (s == FALSE) {
        return FALSE;
      }
      if (s == UNDEFINED) {
        status = UNDEFINED;
      }
    }
    return status;
  }

  private int aggregateStatus(GroundRule rule, int i) {
    final GroundAggregate aggregate =
        program.aggregates.get(rule.aggregates[i]);
    final int s = aggregate.status(valueOf);
    return rule.aggregateNegated[i] ? -s : s;
  }

  /** Returns TRUE if any of a list of alternative conditions is true, FALSE
   * if all are false, otherwise UNDEFINED. */
  private int conditionStatus(List<GroundCondition> conditions) {
    int status = FALSE;
    for (GroundCondition condition : conditions) {
      final int s = condition.status(valueOf);
      if (s == TRUE) {
        return TRUE;
      }
      if (s == UNDEFINED) {
        status = UNDEFINED;
      }
    }
    return status;
  }

  private boolean propagateRule(GroundRule rule) {
    final int body = bodyStatus(rule);
    if (body == FALSE) {
      return true;
    }
    switch (rule.kind) {
      case CONSTRAINT:
        return refute(rule);

      case NORMAL:
        final int head = rule.head[0];
        if (body == TRUE) {
          return assign(head, TRUE);
        }
        if (values[head] == FALSE) {
          return refute(rule);
        }
        return true;

      case DISJUNCTIVE:
        int undefinedCount = 0;
        int undefinedAtom = -1;
        for (int atom : rule.head) {
          if (values[atom] == TRUE) {
            return true;
          }
          if (values[atom] == UNDEFINED) {
            ++undefinedCount;
            undefinedAtom = atom;
          }
        }
        if (undefinedCount == 0) {
          return refute(rule);
        }
        if (body == TRUE && undefinedCount == 1) {
          return assign(undefinedAtom, TRUE);
        }
        return true;

      case CHOICE:
        return propagateChoice(rule, body);

      default:
        throw new AssertionError(rule.kind);
    }
  }

  /** Enforces the bounds of a choice rule. */
  private boolean propagateChoice(GroundRule rule, int body) {
    final int[] conditions = new int[rule.head.length];
    int chosen = 0;
    int possible = 0;
    for (int i = 0; i < rule.head.length; i++) {
      conditions[i] = conditionStatus(rule.headConditions.get(i));
      final int v = values[rule.head[i]];
      if (v == TRUE && conditions[i] == TRUE) {
        ++chosen;
      }
      if (v != FALSE && conditions[i] != FALSE) {
        ++possible;
      }
    }
    if (chosen > rule.upper || possible < rule.lower) {
      return refute(rule);
    }
    if (body != TRUE) {
      return true;
    }
    if (chosen == rule.upper || possible == rule.lower) {
      final int value = chosen == rule.upper ? FALSE : TRUE;
      for (int i = 0; i < rule.head.length; i++) {
        if (values[rule.head[i]] == UNDEFINED && conditions[i] == TRUE
            && !assign(rule.head[i], value)) {
          return false;
        }
      }
    }
    return true;
  }

  /**
   * Ensures that the body of a rule is not true, because its head cannot be
   * satisfied.
   *
   * <p>Returns false if the body is already true. If exactly one literal of
   * the body is undefined and it is an atom, assigns the atom so that the
   * literal is false.
   */
  private boolean refute(GroundRule rule) {
    int undefinedCount = 0;
    int unitAtom = -1;
    int unitValue = UNDEFINED;
    for (int atom : rule.body.pos) {
      final int v = values[atom];
      if (v == FALSE) {
        return true;
      }
      if (v == UNDEFINED) {
        ++undefinedCount;
        unitAtom = atom;
        unitValue = FALSE;
      }
    }
    for (int atom : rule.body.neg) {
      final int v = values[atom];
      if (v == TRUE) {
        return true;
      }
      if (v == UNDEFINED) {
        ++undefinedCount;
        unitAtom = atom;
        unitValue = TRUE;
      }
    }
    for (int i = 0; i < rule.aggregates.length; i++) {
      final int s = aggregateStatus(rule, i);
      if (s == FALSE) {
        return true;
      }
      if (s == UNDEFINED) {
        ++undefinedCount;
        unitAtom = -1;
      }
    }
    if (undefinedCount == 0) {
      return false;
    }
    if (undefinedCount == 1 && unitAtom >= 0) {
      return assign(unitAtom, unitValue);
    }
    return true;
  }

  /** Applies support propagation to an atom. */
  private boolean propagateSupport(int atom) {
    if (program.isFact(atom)) {
      return true;
    }
    int count = 0;
    @Nullable GroundRule only = null;
    for (int r : supports[atom]) {
      final GroundRule rule = program.rules.get(r);
      if (canSupport(rule, atom)) {
        ++count;
        only = rule;
        if (count > 1) {
          return true;
        }
      }
    }
    if (count == 0) {
      return assign(atom, FALSE);
    }
    if (values[atom] == TRUE) {
      return forceSupport(requireNonNull(only), atom);
    }
    return true;
  }

  /** Whether a rule can still provide support for one of its head
   * atoms. */
  private boolean canSupport(GroundRule rule, int atom) {
    if (bodyStatus(rule) == FALSE) {
      return false;
    }
    switch (rule.kind) {
      case NORMAL:
        return true;
      case DISJUNCTIVE:
        for (int other : rule.head) {
          if (other != atom && values[other] == TRUE) {
            return false;
          }
        }
        return true;
      case CHOICE:
        return conditionStatus(rule.headConditions.get(indexOf(rule, atom)))
            != FALSE;
      default:
        throw new AssertionError(rule.kind);
    }
  }

  private static int indexOf(GroundRule rule, int atom) {
    for (int i = 0; i < rule.head.length; i++) {
      if (rule.head[i] == atom) {
        return i;
      }
    }
    throw new AssertionError(atom);
  }

  /** Makes true the body of the only rule that can support a true atom. */
  private boolean forceSupport(GroundRule rule, int atom) {
    if (!force(rule.body)) {
      return false;
    }
    switch (rule.kind) {
      case DISJUNCTIVE:
        for (int other : rule.head) {
          if (other != atom && !assign(other, FALSE)) {
            return false;
          }
        }
        return true;
      case CHOICE:
        @Nullable GroundCondition only = null;
        for (GroundCondition condition
            : rule.headConditions.get(indexOf(rule, atom))) {
          if (condition.status(valueOf) != FALSE) {
            if (only != null) {
              return true;
            }
            only = condition;
          }
        }
        return only == null || force(only);
      default:
        return true;
    }
  }

  private boolean force(GroundCondition condition) {
    for (int atom : condition.pos) {
      if (!assign(atom, TRUE)) {
        return false;
      }
    }
    for (int atom : condition.neg) {
      if (!assign(atom, FALSE)) {
        return false;
      }
    }
    return true;
  }

  /** Decision on the trail. */
  private static class Decision {
    final int atom;
    /** Position on the trail of the decision's own assignment. */
    final int trailIndex;
    int value;
    /** Whether the opposite value has already been tried. */
    boolean flipped;

    Decision(int atom, int trailIndex, int value) {
      this.atom = atom;
      this.trailIndex = trailIndex;
      this.value = value;
    }
  }

  /** State of a solver. */
  private enum State {
    NEW,
    SEARCHING,
    EXHAUSTED,
    STOPPED
  }
}

// End Solver.java
