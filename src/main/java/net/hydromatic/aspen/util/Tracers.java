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
import java.util.function.Consumer;
import net.hydromatic.aspen.ground.GroundAtom;
import net.hydromatic.aspen.ground.GroundProgram;
import net.hydromatic.aspen.solve.AnswerSet;

/** Utilities for {@link Tracer}. */
public abstract class Tracers {

  /** Returns a tracer that does nothing. */
  public static Tracer empty() {
    return EmptyTracer.INSTANCE;
  }

  /** Returns a tracer that performs the given action on a ground program,
   * then calls the underlying tracer. */
  public static Tracer withOnGround(Tracer tracer,
      Consumer<GroundProgram> consumer) {
    return new DelegatingTracer(tracer) {
      @Override public void onGround(GroundProgram program) {
        consumer.accept(program);
        super.onGround(program);
      }
    };
  }

  /** Returns a tracer that performs the given action on each decision,
   * then calls the underlying tracer. */
  public static Tracer withOnDecision(Tracer tracer,
      Consumer<GroundAtom> consumer) {
    return new DelegatingTracer(tracer) {
      @Override public void onDecision(int level, GroundAtom atom,
          boolean value) {
        consumer.accept(atom);
        super.onDecision(level, atom, value);
      }
    };
  }

  public static Tracer withOnConflict(Tracer tracer,
      Consumer<Map<GroundAtom, Boolean>> consumer) {
    return new DelegatingTracer(tracer) {
      @Override public void onConflict(Map<GroundAtom, Boolean> decisions) {
        consumer.accept(decisions);
        super.onConflict(decisions);
      }
    };
  }

  public static Tracer withOnAnswerSet(Tracer tracer,
      Consumer<AnswerSet> consumer) {
    return new DelegatingTracer(tracer) {
      @Override public void onAnswerSet(AnswerSet answerSet) {
        consumer.accept(answerSet);
        super.onAnswerSet(answerSet);
      }
    };
  }

  /** Returns a tracer that performs the given action on the result of an
   * evaluation, then calls the underlying tracer. */
  public static Tracer withOnResult(Tracer tracer, Consumer<Object> consumer) {
    return new DelegatingTracer(tracer) {
      @Override public void onResult(Object o) {
        consumer.accept(o);
        super.onResult(o);
      }
    };
  }

  /** Tracer that does nothing. */
  private static class EmptyTracer implements Tracer {
    static final Tracer INSTANCE = new EmptyTracer();

    @Override public void onGround(GroundProgram program) {
    }

    @Override public void onDecision(int level, GroundAtom atom,
        boolean value) {
    }

    @Override public void onConflict(Map<GroundAtom, Boolean> decisions) {
    }

    @Override public void onAnswerSet(AnswerSet answerSet) {
    }

    @Override public void onResult(Object o) {
    }
  }

  /** Tracer that delegates to an underlying tracer. */
  private static class DelegatingTracer implements Tracer {
    final Tracer tracer;

    DelegatingTracer(Tracer tracer) {
      this.tracer = tracer;
    }

    @Override public void onGround(GroundProgram program) {
      tracer.onGround(program);
    }

    @Override public void onDecision(int level, GroundAtom atom,
        boolean value) {
      tracer.onDecision(level, atom, value);
    }

    @Override public void onConflict(Map<GroundAtom, Boolean> decisions) {
      tracer.onConflict(decisions);
    }

    @Override public void onAnswerSet(AnswerSet answerSet) {
      tracer.onAnswerSet(answerSet);
    }

    @Override public void onResult(Object o) {
      tracer.onResult(o);
    }
  }
}

// End Tracers.java
