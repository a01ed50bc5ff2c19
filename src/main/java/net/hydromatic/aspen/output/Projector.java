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
package net.hydromatic.aspen.output;

import static java.lang.String.format;
import static java.util.Objects.requireNonNull;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import com.google.common.collect.ImmutableSet;
import java.util.ArrayList;
import java.util.Collection;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.function.Function;
import net.hydromatic.aspen.compile.SpecificationException;
import net.hydromatic.aspen.ground.Binding;
import net.hydromatic.aspen.ground.GroundAtom;
import net.hydromatic.aspen.ground.Matcher;
import net.hydromatic.aspen.ground.Values;
import net.hydromatic.aspen.solve.AnswerSet;
import org.checkerframework.checker.nullness.qual.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Evaluates an output specification against an answer set.
 *
 * <p>The result of each node is built from {@link Integer}, {@link String},
 * {@link ImmutableList} (sequences and tuples), {@link ImmutableSet} (sets)
 * and {@link ImmutableMap} (mappings), plus whatever objects registered
 * constructors return. Sets and map keys made of integers and strings, or
 * of lists of them, are in {@link Values#ORDERING}; otherwise they are in
 * the order in which matches were found, which depends only on the answer
 * set. Projecting the same answer set twice gives equal results.
 *
 * <p>Queries are matched against the answer set using a {@link Matcher},
 * with negated atoms meaning "not in the answer set".
 */
public class Projector {
  private static final Logger LOG = LoggerFactory.getLogger(Projector.class);

  /** Greatest length of a sequence whose gaps are filled by a default
   * value. */
  static final int MAX_PADDED_SIZE = 1 << 20;

  private final ImmutableMap<String, Function<List<Object>, Object>>
      constructors;

  private Projector(
      Map<String, Function<List<Object>, Object>> constructors) {
    this.constructors = ImmutableMap.copyOf(constructors);
  }

  /** Creates a projector with no constructors. */
  public static Projector create() {
    return new Projector(ImmutableMap.of());
  }

  /** Returns a projector that also has a given constructor. A tuple node
   * with this constructor name calls the function with its argument
   * values. */
  public Projector withConstructor(String name,
      Function<List<Object>, Object> constructor) {
    final Map<String, Function<List<Object>, Object>> map =
        new LinkedHashMap<>(constructors);
    map.put(name, requireNonNull(constructor));
    return new Projector(map);
  }

  /** Returns the names of the registered constructors. */
  public Set<String> constructorNames() {
    return constructors.keySet();
  }

  /** Evaluates every output of a specification. */
  public ImmutableMap<String, Object> project(OutputSpec spec,
      AnswerSet answerSet) {
    final Evaluation evaluation = new Evaluation(spec, answerSet);
    final ImmutableMap.Builder<String, Object> map = ImmutableMap.builder();
    for (String name : spec.outputs.keySet()) {
      map.put(name, evaluation.named(name));
    }
    return map.build();
  }

  /** Evaluates a node that has no references and no enclosing
   * bindings. */
  public Object project(Output.Node node, AnswerSet answerSet) {
    return new Evaluation(OutputSpec.EMPTY, answerSet).eval(node, null);
  }

  /** Puts values into a deterministic order. */
  @SuppressWarnings("unchecked")
  private static <E> List<E> canonical(Collection<E> values) {
    final List<E> list = new ArrayList<>(values);
    if (list.stream().allMatch(Projector::isScalar)) {
      list.sort(Values.ORDERING::compare);
    } else if (list.stream().allMatch(Projector::isScalarList)) {
      list.sort((e0, e1) ->
          Values.TUPLE_ORDERING.compare((List<Object>) e0,
              (List<Object>) e1));
    }
    return list;
  }

  private static boolean isScalar(Object o) {
    return o instanceof Integer || o instanceof String;
  }

  private static boolean isScalarList(Object o) {
    return o instanceof List
        && ((List<?>) o).stream().allMatch(Projector::isScalar);
  }

  /** State of one projection. Each named output is evaluated at most
   * once. */
  private class Evaluation {
    final OutputSpec spec;
    final AnswerSet answerSet;
    final Map<String, Object> values = new HashMap<>();
    final Set<String> active = new HashSet<>();

    Evaluation(OutputSpec spec, AnswerSet answerSet) {
      this.spec = spec;
      this.answerSet = answerSet;
    }

    Object named(String name) {
      final Object value = values.get(name);
      if (value != null) {
        return value;
      }
      final Output.Node node = spec.outputs.get(name);
      if (node == null) {
        throw new SpecificationException("Unknown output '" + name + "'");
      }
      if (!active.add(name)) {
        throw new SpecificationException(
            "Cycle in output references at '" + name + "'");
      }
      final Object result = eval(node, null);
      active.remove(name);
      values.put(name, result);
      LOG.trace("Output {} = {}", name, result);
      return result;
    }

    Object eval(Output.Node node, @Nullable Binding outer) {
      if (node instanceof Output.VariableNode) {
        final String name = ((Output.VariableNode) node).name;
        final Object value = outer == null ? null : outer.get(name);
        if (value == null) {
          throw new SpecificationException("Variable " + name
              + " is not bound");
        }
        return value;
      }
      if (node instanceof Output.LiteralNode) {
        return ((Output.LiteralNode) node).value;
      }
      if (node instanceof Output.ReferenceNode) {
        return named(((Output.ReferenceNode) node).name);
      }
      if (node instanceof Output.TupleNode) {
        return tuple((Output.TupleNode) node, outer);
      }
      if (node instanceof Output.SimpleSetNode) {
        return simpleSet((Output.SimpleSetNode) node);
      }
      if (node instanceof Output.SetNode) {
        return set((Output.SetNode) node, outer);
      }
      if (node instanceof Output.MappingNode) {
        return mapping((Output.MappingNode) node, outer);
      }
      if (node instanceof Output.SequenceNode) {
        return sequence((Output.SequenceNode) node, outer);
      }
      throw new AssertionError(node);
    }

    private Object tuple(Output.TupleNode node, @Nullable Binding outer) {
      final ImmutableList.Builder<Object> args = ImmutableList.builder();
      for (Output.Node arg : node.args) {
        args.add(eval(arg, outer));
      }
      if (node.constructor == null) {
        return args.build();
      }
      final Function<List<Object>, Object> constructor =
          constructors.get(node.constructor);
      if (constructor == null) {
        throw new SpecificationException(
            "Unknown constructor '" + node.constructor + "'");
      }
      return requireNonNull(constructor.apply(args.build()),
          () -> "constructor " + node.constructor + " returned null");
    }

    private Object simpleSet(Output.SimpleSetNode node) {
      final ImmutableSet.Builder<Object> set = ImmutableSet.builder();
      for (GroundAtom atom : answerSet.atoms(node.predicate)) {
        set.add(atom.arity() == 1 ? atom.args.get(0) : atom.args);
      }
      return set.build();
    }

    /** Returns the matches of a node's query, in the context of the
     * bindings of enclosing queries. */
    private List<Binding> matches(Output.QueryNode node,
        @Nullable Binding outer) {
      final Collection<String> outerVariables =
          outer == null ? ImmutableList.of() : outer.toMap().keySet();
      return Matcher.create(node.query, outerVariables, true)
          .matchAll(answerSet, outer);
    }

    private Object set(Output.SetNode node, @Nullable Binding outer) {
      final Set<Object> set = new LinkedHashSet<>();
      for (Binding binding : matches(node, outer)) {
        set.add(eval(node.content, binding));
      }
      return ImmutableSet.copyOf(canonical(set));
    }

    private Object mapping(Output.MappingNode node, @Nullable Binding outer) {
      final Map<Object, Object> map = new LinkedHashMap<>();
      for (Binding binding : matches(node, outer)) {
        final Object key = eval(node.key, binding);
        final Object content = eval(node.content, binding);
        final Object previous = map.putIfAbsent(key, content);
        if (previous != null && !previous.equals(content)) {
          throw new AmbiguousKeyException(node, key, previous, content);
        }
      }
      final ImmutableMap.Builder<Object, Object> builder =
          ImmutableMap.builder();
      for (Object key : canonical(map.keySet())) {
        builder.put(key, map.get(key));
      }
      return builder.build();
    }

    private Object sequence(Output.SequenceNode node,
        @Nullable Binding outer) {
      final Map<Integer, Object> map = new HashMap<>();
      long size = 0;
      for (Binding binding : matches(node, outer)) {
        final Object indexValue = binding.get(node.index);
        if (!(indexValue instanceof Integer)
            || (Integer) indexValue < 0) {
          throw new ProjectionException(
              format("Index %s of sequence over '%s' must be a "
                      + "non-negative integer, but was %s", node.index,
                  node.queryString(), indexValue));
        }
        final int index = (Integer) indexValue;
        final Object content = eval(node.content, binding);
        final Object previous = map.putIfAbsent(index, content);
        if (previous != null && !previous.equals(content)) {
          throw new AmbiguousKeyException(node, index, previous, content);
        }
        size = Math.max(size, index + 1L);
      }
      if (node.defaultValue == null) {
        if (size > map.size()) {
          int missing = 0;
          while (map.containsKey(missing)) {
            ++missing;
          }
          throw new MissingIndexException(node.queryString(), missing,
              map.keySet());
        }
      } else if (size > MAX_PADDED_SIZE) {
        throw new ProjectionException(
            format("Sequence over '%s' would have %d elements, more than the "
                    + "limit %d for a sequence with a default value",
                node.queryString(), size, MAX_PADDED_SIZE));
      }
      final ImmutableList.Builder<Object> list = ImmutableList.builder();
      for (int i = 0; i < size; i++) {
        final Object content = map.get(i);
        list.add(
            content != null ? content : requireNonNull(node.defaultValue));
      }
      return list.build();
    }
  }
}

// End Projector.java
