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

import com.google.common.collect.ImmutableSortedSet;
import java.util.Collection;

/**
 * The indexes of a sequence are not the contiguous range
 * {@code 0 .. n - 1}, and the sequence has no default value to fill the
 * gap.
 */
public class MissingIndexException extends ProjectionException {
  /** Query of the sequence node. */
  public final String query;
  /** Smallest index that is missing. */
  public final int missingIndex;
  /** Indexes that are present. */
  public final ImmutableSortedSet<Integer> presentIndexes;

  public MissingIndexException(String query, int missingIndex,
      Collection<Integer> presentIndexes) {
    super(
        format("Sequence over '%s' has no element at index %d; indexes "
            + "present are %s", query, missingIndex,
            ImmutableSortedSet.copyOf(presentIndexes)));
    this.query = query;
    this.missingIndex = missingIndex;
    this.presentIndexes = ImmutableSortedSet.copyOf(presentIndexes);
  }
}

// End MissingIndexException.java
