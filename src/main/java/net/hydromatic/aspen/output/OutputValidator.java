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

import java.util.ArrayList;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import net.hydromatic.aspen.ast.Ast;
import net.hydromatic.aspen.compile.Analyzer;
import net.hydromatic.aspen.compile.SpecificationException;
import net.hydromatic.aspen.ground.Matcher;

/**
 * Checks an output specification before any search.
 *
 * <p>Checks that every variable used in content, a key or a tuple is bound
 * by an enclosing query; that the index of each sequence is bound by the
 * sequence's own query; that each query is safe (its comparisons and negated
 * atoms use only bound variables) and has no aggregates; that each
 * constructor is registered; and that references name an output and do not
 * form a cycle.
 */
public class OutputValidator {
  private final OutputSpec spec;
  private final Set<String> constructors;

  private OutputValidator(OutputSpec spec, Set<String> constructors) {
    this.spec = spec;
    this.constructors = constructors;
  }

  /**
   * Validates an output specification.
   *
   * @param spec Output specification
   * @param constructors Names of registered constructors
   * @throws SpecificationException if the specification is invalid
   */
  public static void validate(OutputSpec spec, Set<String> constructors) {
    final OutputValidator validator = new OutputValidator(spec, constructors);
    spec.outputs.forEach((name, node) ->
        validator.validate(name, node, new LinkedHashSet<>()));
    validator.checkCycles();
  }

  private void validate(String output, Output.Node node, Set<String> scope) {
    if (node instanceof Output.VariableNode) {
      final String name = ((Output.VariableNode) node).name;
      if (!scope.contains(name)) {
        throw new SpecificationException(
            format("Variable %s in output '%s' is not bound by an enclosing "
                + "query", name, output));
      }
    } else if (node instanceof Output.ReferenceNode) {
      final String name = ((Output.ReferenceNode) node).name;
      if (!spec.outputs.containsKey(name)) {
        throw new SpecificationException(
            format("Output '%s' refers to unknown output '%s'", output,
                name));
      }
    } else if (node instanceof Output.TupleNode) {
      final Output.TupleNode tuple = (Output.TupleNode) node;
      if (tuple.constructor != null
          && !constructors.contains(tuple.constructor)) {
        throw new SpecificationException(
            format("Unknown constructor '%s' in output '%s'",
                tuple.constructor, output));
      }
      tuple.args.forEach(arg -> validate(output, arg, scope));
    } else if (node instanceof Output.QueryNode) {
      validateQuery(output, (Output.QueryNode) node, scope);
    }
  }

  private void validateQuery(String output, Output.QueryNode node,
      Set<String> scope) {
    for (Ast.Literal literal : node.query) {
      if (literal instanceof Ast.AggregateLiteral) {
        throw new SpecificationException(
            format("Aggregate %s is not allowed in the query of output '%s'",
                literal, output));
      }
    }
    try {
      Matcher.create(node.query, scope, true);
    } catch (SpecificationException e) {
      throw new SpecificationException(
          format("Unsafe query in output '%s': %s", output, e.getMessage()),
          e);
    }
    final Set<String> queryVariables =
        Analyzer.boundVariables(node.query, new HashSet<>());
    final Set<String> inner = new LinkedHashSet<>(scope);
    inner.addAll(queryVariables);
    if (node instanceof Output.MappingNode) {
      validate(output, ((Output.MappingNode) node).key, inner);
    } else if (node instanceof Output.SequenceNode) {
      final String index = ((Output.SequenceNode) node).index;
      if (!queryVariables.contains(index)) {
        throw new SpecificationException(
            format("Index %s of sequence in output '%s' is not bound by its "
                + "query %s", index, output, node.queryString()));
      }
    }
    validate(output, node.content, inner);
  }

  /** Checks that references between outputs do not form a cycle. */
  private void checkCycles() {
    final Map<String, Boolean> done = new HashMap<>();
    for (String name : spec.outputs.keySet()) {
      visit(name, done, new ArrayList<>());
    }
  }

  private void visit(String name, Map<String, Boolean> done,
      List<String> path) {
    final Boolean finished = done.get(name);
    if (finished != null) {
      if (!finished) {
        path.add(name);
        throw new SpecificationException(
            "Cycle in output references: " + String.join(" -> ",
                path.subList(path.indexOf(name), path.size())));
      }
      return;
    }
    done.put(name, false);
    path.add(name);
    final List<String> references = new ArrayList<>();
    collectReferences(spec.outputs.get(name), references);
    for (String reference : references) {
      visit(reference, done, path);
    }
    path.remove(path.size() - 1);
    done.put(name, true);
  }

  private static void collectReferences(Output.Node node,
      List<String> references) {
    if (node instanceof Output.ReferenceNode) {
      references.add(((Output.ReferenceNode) node).name);
    } else if (node instanceof Output.TupleNode) {
      ((Output.TupleNode) node).args.forEach(arg ->
          collectReferences(arg, references));
    } else if (node instanceof Output.MappingNode) {
      collectReferences(((Output.MappingNode) node).key, references);
      collectReferences(((Output.MappingNode) node).content, references);
    } else if (node instanceof Output.QueryNode) {
      collectReferences(((Output.QueryNode) node).content, references);
    }
  }
}

// End OutputValidator.java
