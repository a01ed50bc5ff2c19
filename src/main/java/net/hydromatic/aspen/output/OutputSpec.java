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

import com.google.common.collect.ImmutableMap;
import java.util.LinkedHashMap;
import java.util.Map;

/** Named output nodes, evaluated together against one answer set. */
public class OutputSpec {
  public final ImmutableMap<String, Output.Node> outputs;

  private OutputSpec(Map<String, Output.Node> outputs) {
    this.outputs = ImmutableMap.copyOf(outputs);
  }

  /** An output specification with no outputs. */
  public static final OutputSpec EMPTY = builder().build();

  public static Builder builder() {
    return new Builder();
  }

  @Override
  public String toString() {
    final StringBuilder b = new StringBuilder("OUTPUT {");
    outputs.forEach((name, node) -> {
      if (b.charAt(b.length() - 1) != '{') {
        b.append(',');
      }
      b.append("\n  ").append(name).append(" = ");
      node.unparse(b);
    });
    return b.append("\n}").toString();
  }

  /** Builder for {@link OutputSpec}. */
  public static class Builder {
    private final Map<String, Output.Node> outputs = new LinkedHashMap<>();

    /** Adds a named output. Names must be unique. */
    public Builder add(String name, Output.Node node) {
      checkArgument(!outputs.containsKey(name), "duplicate output name %s",
          name);
      outputs.put(name, node);
      return this;
    }

    public OutputSpec build() {
      return new OutputSpec(outputs);
    }
  }
}

// End OutputSpec.java
