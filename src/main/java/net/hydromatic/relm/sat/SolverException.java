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

import net.hydromatic.relm.ast.Pos;
import net.hydromatic.relm.util.RelmException;

/** A solver failed; for example, a worker of a portfolio crashed. */
public class SolverException extends RuntimeException
    implements RelmException {
  public SolverException(String message, Throwable cause) {
    super(message, cause);
  }

  @Override public Pos pos() {
    return Pos.ZERO;
  }

  @Override public StringBuilder describeTo(StringBuilder buf) {
    buf.append("Solver error: ").append(getMessage());
    if (getCause() != null) {
      buf.append(": ").append(getCause());
    }
    return buf;
  }
}

// End SolverException.java
