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
import static java.util.Objects.requireNonNull;

import com.google.common.collect.ImmutableList;
import java.util.List;
import java.util.stream.Collectors;
import net.hydromatic.aspen.ast.Ast;
import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * Output specification nodes.
 *
 * <p>Each node describes how to build part of a structured value from an
 * answer set. Collection nodes ({@link SetNode}, {@link MappingNode},
 * {@link SequenceNode}) have a query, a conjunction of literals that is
 * matched against the answer set; each match binds variables that the
 * node's content, key and index can use. Inner nodes also see the variables
 * bound by enclosing queries.
 */
public class Output {
  private Output() {}

  /** Base class for output nodes. */
  public abstract static class Node {
    /** Appends a description of this node, in the syntax of output
     * specifications. */
    abstract StringBuilder unparse(StringBuilder b);

    @Override
    public String toString() {
      return unparse(new StringBuilder()).toString();
    }
  }

  /** Base class for nodes that evaluate a query. */
  public abstract static class QueryNode extends Node {
    public final ImmutableList<Ast.Literal> query;
    public final Node content;

    QueryNode(List<Ast.Literal> query, Node content) {
      this.query = ImmutableList.copyOf(query);
      this.content = requireNonNull(content);
      checkArgument(!this.query.isEmpty(), "query must not be empty");
    }

    /** Returns the query as it would be written, for example
     * "{@code p(X), not q(X)}". */
    public String queryString() {
      return query.stream().map(Object::toString)
          .collect(Collectors.joining(", "));
    }
  }

  /** Set of the contents of each match of a query, "set { predicate: query;
   * content: content; }". */
  public static class SetNode extends QueryNode {
    SetNode(List<Ast.Literal> query, Node content) {
      super(query, content);
    }

    @Override StringBuilder unparse(StringBuilder b) {
      b.append("set { predicate: ").append(queryString())
          .append("; content: ");
      return content.unparse(b).append("; }");
    }
  }

  /** Set of the atoms of a predicate, "set { predicate }". Each atom becomes
   * its single argument if the predicate has arity 1, and otherwise a list
   * of its arguments. */
  public static class SimpleSetNode extends Node {
    public final String predicate;

    SimpleSetNode(String predicate) {
      this.predicate = requireNonNull(predicate);
    }

    @Override StringBuilder unparse(StringBuilder b) {
      return b.append("set { ").append(predicate).append(" }");
    }
  }

  /** Map from key to content, "mapping { predicate: query; key: key;
   * content: content; }". */
  public static class MappingNode extends QueryNode {
    public final Node key;

    MappingNode(List<Ast.Literal> query, Node key, Node content) {
      super(query, content);
      this.key = requireNonNull(key);
    }

    @Override StringBuilder unparse(StringBuilder b) {
      b.append("mapping { predicate: ").append(queryString())
          .append("; key: ");
      key.unparse(b).append("; content: ");
      return content.unparse(b).append("; }");
    }
  }

  /**
   * List whose elements are indexed by an integer variable, "sequence {
   * predicate: query; index: I; content: content; }".
   *
   * <p>The indexes must form the range {@code 0 .. n - 1}. If the node has a
   * default value, it fills any gaps in the range.
   */
  public static class SequenceNode extends QueryNode {
    public final String index;
    public final @Nullable Object defaultValue;

    SequenceNode(List<Ast.Literal> query, String index, Node content,
        @Nullable Object defaultValue) {
      super(query, content);
      this.index = requireNonNull(index);
      this.defaultValue = defaultValue;
    }

    @Override StringBuilder unparse(StringBuilder b) {
      b.append("sequence { predicate: ").append(queryString())
          .append("; index: ").append(index).append("; content: ");
      content.unparse(b).append(";");
      if (defaultValue != null) {
        b.append(" default: ").append(Ast.Constant.toString(defaultValue))
            .append(";");
      }
      return b.append(" }");
    }
  }

  /** List of values, "(arg, ...)", or the result of calling a registered
   * constructor on them, "Name(arg, ...)". */
  public static class TupleNode extends Node {
    public final @Nullable String constructor;
    public final ImmutableList<Node> args;

    TupleNode(@Nullable String constructor, List<Node> args) {
      this.constructor = constructor;
      this.args = ImmutableList.copyOf(args);
    }

    @Override StringBuilder unparse(StringBuilder b) {
      if (constructor != null) {
        b.append(constructor);
      }
      b.append('(');
      for (int i = 0; i < args.size(); i++) {
        if (i > 0) {
          b.append(", ");
        }
        args.get(i).unparse(b);
      }
      return b.append(')');
    }
  }

  /** Value of a variable bound by an enclosing query. */
  public static class VariableNode extends Node {
    public final String name;

    VariableNode(String name) {
      this.name = requireNonNull(name);
    }

    @Override StringBuilder unparse(StringBuilder b) {
      return b.append(name);
    }
  }

  /** Constant value, an integer or a string. */
  public static class LiteralNode extends Node {
    public final Object value;

    LiteralNode(Object value) {
      this.value = requireNonNull(value);
      checkArgument(value instanceof Integer || value instanceof String,
          "literal must be integer or string: %s", value);
    }

    @Override StringBuilder unparse(StringBuilder b) {
      if (value instanceof String) {
        return b.append('"').append(value).append('"');
      }
      return b.append(value);
    }
  }

  /** Value of another named output, "&amp;name". */
  public static class ReferenceNode extends Node {
    public final String name;

    ReferenceNode(String name) {
      this.name = requireNonNull(name);
    }

    @Override StringBuilder unparse(StringBuilder b) {
      return b.append('&').append(name);
    }
  }
}

// End Output.java
