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

import static com.google.common.base.Preconditions.checkArgument;
import static java.util.Objects.requireNonNull;

import org.checkerframework.checker.nullness.qual.Nullable;

/** Outcome of a search for an answer set. */
public class SolveResult {
  public final Status status;
  /** Answer set; not null if and only if {@link #status} is
   * {@link Status#SATISFIABLE}. */
  public final @Nullable AnswerSet answerSet;
  /** Number of decisions made so far by the solver that produced this
   * result. */
  public final long decisions;
  /** Number of conflicts met so far. */
  public final long conflicts;

  SolveResult(Status status, @Nullable AnswerSet answerSet, long decisions,
      long conflicts) {
    this.status = requireNonNull(status);
    this.answerSet = answerSet;
    this.decisions = decisions;
    this.conflicts = conflicts;
    checkArgument((status == Status.SATISFIABLE) == (answerSet != null));
  }

  @Override
  public String toString() {
    return status == Status.SATISFIABLE
        ? status + " " + answerSet
        : status.toString();
  }

  /** Status of a search. */
  public enum Status {
    /** An answer set was found. */
    SATISFIABLE,
    /** There is no answer set, or, when enumerating, no further answer
     * set. */
    INCONSISTENT,
    /** The search was stopped by a step limit, a time limit or
     * cancellation before it could decide. */
    UNKNOWN
  }
}

// End SolveResult.java
