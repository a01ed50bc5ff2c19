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
package net.hydromatic.aspen.util;

import java.util.Map;
import net.hydromatic.aspen.ground.GroundAtom;
import net.hydromatic.aspen.ground.GroundProgram;
import net.hydromatic.aspen.solve.AnswerSet;

/** Called on various events during grounding and search. */
public interface Tracer {
  /** Called when a program has been grounded. */
  void onGround(GroundProgram program);

  /** Called when the search assigns a value to an atom by choice, at a given
   * decision level (1 for the first decision). */
  void onDecision(int level, GroundAtom atom, boolean value);

  /** Called when propagation or model checking fails, with the decisions
   * in force, in the order they were made. */
  void onConflict(Map<GroundAtom, Boolean> decisions);

  /** Called when the search finds an answer set. */
  void onAnswerSet(AnswerSet answerSet);

  /** Called on the result of an evaluation, after projection. */
  void onResult(Object o);
}

// End Tracer.java
