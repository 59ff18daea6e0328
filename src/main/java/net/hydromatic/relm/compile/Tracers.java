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
package net.hydromatic.relm.compile;

import java.util.List;
import java.util.function.Consumer;
import net.hydromatic.relm.instance.Bounds;
import net.hydromatic.relm.instance.Instance;
import net.hydromatic.relm.sat.SatSolver;
import net.hydromatic.relm.type.Model;

/** Utilities for {@link Tracer}. */
public abstract class Tracers {

  /** Returns a tracer that does nothing. */
  public static Tracer empty() {
    return EmptyTracer.INSTANCE;
  }

  /**
   * Returns a tracer that performs the given action on a resolved module,
   * then calls the underlying tracer.
   */
  public static Tracer withOnModel(Tracer tracer, Consumer<Model> consumer) {
    return new DelegatingTracer(tracer) {
      @Override public void onModel(Model model) {
        consumer.accept(model);
        super.onModel(model);
      }
    };
  }

  /**
   * Returns a tracer that performs the given action on the scope of a
   * command, then calls the underlying tracer.
   */
  public static Tracer withOnScope(Tracer tracer, Consumer<Scope> consumer) {
    return new DelegatingTracer(tracer) {
      @Override public void onScope(Scope scope) {
        consumer.accept(scope);
        super.onScope(scope);
      }
    };
  }

  public static Tracer withOnBounds(Tracer tracer, Consumer<Bounds> consumer) {
    return new DelegatingTracer(tracer) {
      @Override public void onBounds(Bounds bounds) {
        consumer.accept(bounds);
        super.onBounds(bounds);
      }
    };
  }

  public static Tracer withOnTranslation(Tracer tracer,
      Consumer<Problem> consumer) {
    return new DelegatingTracer(tracer) {
      @Override public void onTranslation(Problem problem) {
        consumer.accept(problem);
        super.onTranslation(problem);
      }
    };
  }

  /**
   * Returns a tracer that performs the given action on the result of each
   * solve, then calls the underlying tracer.
   */
  public static Tracer withOnSolve(Tracer tracer,
      Consumer<SatSolver.Result> consumer) {
    return new DelegatingTracer(tracer) {
      @Override public void onSolve(SatSolver.Result result,
          long elapsedMillis) {
        consumer.accept(result);
        super.onSolve(result, elapsedMillis);
      }
    };
  }

  public static Tracer withOnInstance(Tracer tracer,
      Consumer<Instance> consumer) {
    return new DelegatingTracer(tracer) {
      @Override public void onInstance(Instance instance) {
        consumer.accept(instance);
        super.onInstance(instance);
      }
    };
  }

  public static Tracer withOnWarnings(Tracer tracer,
      Consumer<List<String>> consumer) {
    return new DelegatingTracer(tracer) {
      @Override public void onWarnings(List<String> warningList) {
        consumer.accept(warningList);
        super.onWarnings(warningList);
      }
    };
  }

  /** Tracer that does nothing. */
  private static class EmptyTracer implements Tracer {
    static final Tracer INSTANCE = new EmptyTracer();

    @Override public void onModel(Model model) {
    }

    @Override public void onScope(Scope scope) {
    }

    @Override public void onBounds(Bounds bounds) {
    }

    @Override public void onTranslation(Problem problem) {
    }

    @Override public void onSolve(SatSolver.Result result,
        long elapsedMillis) {
    }

    @Override public void onInstance(Instance instance) {
    }

    @Override public void onWarnings(List<String> warningList) {
    }
  }

  /** Tracer that delegates to an underlying tracer. */
  private static class DelegatingTracer implements Tracer {
    final Tracer tracer;

    DelegatingTracer(Tracer tracer) {
      this.tracer = tracer;
    }

    @Override public void onModel(Model model) {
      tracer.onModel(model);
    }

    @Override public void onScope(Scope scope) {
      tracer.onScope(scope);
    }

    @Override public void onBounds(Bounds bounds) {
      tracer.onBounds(bounds);
    }

    @Override public void onTranslation(Problem problem) {
      tracer.onTranslation(problem);
    }

    @Override public void onSolve(SatSolver.Result result,
        long elapsedMillis) {
      tracer.onSolve(result, elapsedMillis);
    }

    @Override public void onInstance(Instance instance) {
      tracer.onInstance(instance);
    }

    @Override public void onWarnings(List<String> warningList) {
      tracer.onWarnings(warningList);
    }
  }
}

// End Tracers.java
