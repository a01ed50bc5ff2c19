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
import static java.util.Objects.requireNonNull;

import net.hydromatic.aspen.ast.Ast;

/**
 * A variable in a rule is not bound by any positive literal in that rule's
 * body, so the rule has no finite domain and cannot be grounded.
 */
public class UnsafeVariableException extends SpecificationException {
  public final Ast.Rule rule;
  public final String variable;

  public UnsafeVariableException(Ast.Rule rule, String variable,
      String context) {
    super(
        format(
            "Rule is unsafe. Variable '%s' in %s does not appear in a "
                + "positive body atom: %s",
            variable, context, rule));
    this.rule = requireNonNull(rule);
    this.variable = requireNonNull(variable);
  }
}

// End UnsafeVariableException.java
