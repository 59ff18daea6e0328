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
package net.hydromatic.relm.sat;

import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * Token that tells a running search to stop.
 *
 * <p>A token is cancelled explicitly, when its deadline passes, or when its
 * parent is cancelled. It is safe to use from several threads.
 */
public class Cancellation {
  private final @Nullable Cancellation parent;
  private final long deadlineNanos;
  private final AtomicBoolean cancelled = new AtomicBoolean();

  private Cancellation(@Nullable Cancellation parent, long deadlineNanos) {
    this.parent = parent;
    this.deadlineNanos = deadlineNanos;
  }

  /** Creates a token that is cancelled only by {@link #cancel}. */
  public static Cancellation none() {
    return new Cancellation(null, Long.MAX_VALUE);
  }

  /**
   * Creates a token that cancels itself after a given number of
   * milliseconds; if the timeout is zero or negative, never.
   */
  public static Cancellation withTimeout(long timeoutMillis) {
    if (timeoutMillis <= 0) {
      return none();
    }
    return new Cancellation(
        null,
        System.nanoTime() + TimeUnit.MILLISECONDS.toNanos(timeoutMillis));
  }

  /** Creates a token that is also cancelled when this one is. */
  public Cancellation child() {
    return new Cancellation(this, deadlineNanos);
  }

  public void cancel() {
    cancelled.set(true);
  }

  public boolean isCancelled() {
    if (cancelled.get()) {
      return true;
    }
    if (deadlineNanos != Long.MAX_VALUE
        && System.nanoTime() - deadlineNanos >= 0) {
      cancelled.set(true);
      return true;
    }
    return parent != null && parent.isCancelled();
  }
}

// End Cancellation.java
