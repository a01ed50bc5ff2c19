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

import net.hydromatic.aspen.util.AspException;

/**
 * The search stopped before it found an answer set or proved that there is
 * none, because it reached {@link net.hydromatic.aspen.eval.Prop#STEP_LIMIT},
 * {@link net.hydromatic.aspen.eval.Prop#TIME_LIMIT_MILLIS} or was cancelled.
 */
public class SearchAbortedException extends RuntimeException
    implements AspException {
  public final long decisions;

  public SearchAbortedException(String message, long decisions) {
    super(message);
    this.decisions = decisions;
  }

  @Override
  public StringBuilder describeTo(StringBuilder buf) {
    return buf.append("Search aborted after ").append(decisions)
        .append(" decisions: ").append(getMessage());
  }
}

// End SearchAbortedException.java
