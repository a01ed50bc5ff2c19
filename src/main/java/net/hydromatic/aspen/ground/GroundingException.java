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
package net.hydromatic.aspen.ground;

import net.hydromatic.aspen.util.AspException;

/**
 * Grounding could not complete, for example because the number of ground
 * atoms exceeded {@link net.hydromatic.aspen.eval.Prop#MAX_GROUND_ATOMS},
 * which usually means a recursive rule with arithmetic in its head keeps
 * producing new values.
 */
public class GroundingException extends RuntimeException
    implements AspException {
  public GroundingException(String message) {
    super(message);
  }

  @Override
  public StringBuilder describeTo(StringBuilder buf) {
    return buf.append("Grounding error: ").append(getMessage());
  }
}

// End GroundingException.java
