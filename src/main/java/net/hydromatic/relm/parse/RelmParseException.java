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
package net.hydromatic.relm.parse;

import net.hydromatic.relm.ast.Pos;
import net.hydromatic.relm.util.RelmException;

/** Exception caused by a parse error or a lexical error. */
public class RelmParseException extends RuntimeException
    implements RelmException {
  private final Pos pos;

  RelmParseException(Throwable cause, Pos pos) {
    super(firstLine(cause.getMessage()), cause);
    this.pos = pos;
  }

  private static String firstLine(String message) {
    if (message == null) {
      return "syntax error";
    }
    final int i = message.indexOf('\n');
    return i < 0 ? message : message.substring(0, i);
  }

  @Override
  public Pos pos() {
    return pos;
  }

  @Override
  public StringBuilder describeTo(StringBuilder buf) {
    return pos.describeTo(buf).append(" Error: ").append(getMessage());
  }
}

// End RelmParseException.java
