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

/**
 * A key of a mapping, or an index of a sequence, occurs in two matches of
 * the node's query that produce different content.
 */
public class AmbiguousKeyException extends ProjectionException {
  public final Object key;
  public final Object content0;
  public final Object content1;

  public AmbiguousKeyException(Output.Node node, Object key,
      Object content0, Object content1) {
    super(
        format("Key %s has more than one value (%s and %s) in %s", key,
            content0, content1, node));
    this.key = key;
    this.content0 = content0;
    this.content1 = content1;
  }
}

// End AmbiguousKeyException.java
