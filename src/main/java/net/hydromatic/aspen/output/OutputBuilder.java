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

import static com.google.common.base.Preconditions.checkArgument;

import com.google.common.collect.ImmutableList;
import java.util.Arrays;
import java.util.List;
import net.hydromatic.aspen.ast.Ast;
import net.hydromatic.aspen.ast.AstBuilder;
import org.checkerframework.checker.nullness.qual.Nullable;

/** Builds output specification nodes. */
public enum OutputBuilder {
  /**
   * The singleton instance of the output builder. The short name is
   * convenient for use via 'import static', but checkstyle does not approve.
   */
  // CHECKSTYLE: IGNORE 1
  output;

  /** Converts a Java value to a node.
   *
   * <p>Nodes are returned unchanged; integers become literals; strings that
   * start with an upper-case letter or underscore become variables, and
   * other strings become string literals. */
  public Output.Node node(Object o) {
    if (o instanceof Output.Node) {
      return (Output.Node) o;
    }
    if (o instanceof String) {
      final String s = (String) o;
      if (!s.isEmpty()
          && (Character.isUpperCase(s.charAt(0)) || s.charAt(0) == '_')) {
        return var(s);
      }
    }
    return literal(o);
  }

  public Output.VariableNode var(String name) {
    return new Output.VariableNode(name);
  }

  public Output.LiteralNode literal(Object value) {
    return new Output.LiteralNode(value);
  }

  /** Creates a reference to another named output. */
  public Output.ReferenceNode ref(String name) {
    return new Output.ReferenceNode(name);
  }

  /** Creates a tuple; arguments are converted using {@link #node}. */
  public Output.TupleNode tuple(Object... args) {
    return new Output.TupleNode(null, nodes(args));
  }

  /** Creates a node that calls a registered constructor. */
  public Output.TupleNode object(String constructor, Object... args) {
    return new Output.TupleNode(constructor, nodes(args));
  }

  private List<Output.Node> nodes(Object... args) {
    final ImmutableList.Builder<Output.Node> list = ImmutableList.builder();
    for (Object arg : args) {
      list.add(node(arg));
    }
    return list.build();
  }

  /** Creates a query, a list of literals. */
  public List<Ast.Literal> query(Ast.Literal... literals) {
    return Arrays.asList(literals);
  }

  /** Creates a query that is a single positive atom; arguments are
   * converted using {@link AstBuilder#term}. */
  public List<Ast.Literal> query(String predicate, Object... args) {
    return ImmutableList.of(AstBuilder.ast.pos(predicate, args));
  }

  public Output.SetNode set(List<Ast.Literal> query, Object content) {
    return new Output.SetNode(query, node(content));
  }

  public Output.SimpleSetNode set(String predicate) {
    return new Output.SimpleSetNode(predicate);
  }

  public Output.MappingNode mapping(List<Ast.Literal> query, Object key,
      Object content) {
    return new Output.MappingNode(query, node(key), node(content));
  }

  public Output.SequenceNode sequence(List<Ast.Literal> query, String index,
      Object content) {
    return sequence(query, index, content, null);
  }

  /** Creates a sequence node whose gaps are filled with a default value. */
  public Output.SequenceNode sequence(List<Ast.Literal> query, String index,
      Object content, @Nullable Object defaultValue) {
    checkArgument(defaultValue == null
            || defaultValue instanceof Integer
            || defaultValue instanceof String,
        "default must be integer or string: %s", defaultValue);
    return new Output.SequenceNode(query, index, node(content),
        defaultValue);
  }

  /** Creates an output specification from alternating names and nodes. */
  public OutputSpec spec(Object... namesAndNodes) {
    checkArgument(namesAndNodes.length % 2 == 0,
        "expected name-node pairs");
    final OutputSpec.Builder builder = OutputSpec.builder();
    for (int i = 0; i < namesAndNodes.length; i += 2) {
      builder.add((String) namesAndNodes[i], node(namesAndNodes[i + 1]));
    }
    return builder.build();
  }
}

// End OutputBuilder.java
