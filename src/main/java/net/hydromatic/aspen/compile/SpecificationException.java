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

import net.hydromatic.aspen.util.AspException;

/**
 * Error in a program or output specification that is detected before search
 * begins. For example, an atom whose arity does not match other uses of its
 * predicate, or an output node that refers to an unbound variable.
 */
public class SpecificationException extends RuntimeException
    implements AspException {
  public SpecificationException(String message) {
    super(message);
  }

  public SpecificationException(String message, Throwable cause) {
    super(message, cause);
  }

  @Override
  public StringBuilder describeTo(StringBuilder buf) {
    return buf.append("Specification error: ").append(getMessage());
  }
}

// End SpecificationException.java
