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

import java.io.StringReader;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import net.hydromatic.relm.ast.Ast;
import net.hydromatic.relm.ast.Pos;

/** Utilities for parsing. */
public final class Parsers {
  private Parsers() {}

  private static final Pattern LEXICAL_ERROR =
      Pattern.compile("line (\\d+), column (\\d+)");

  /**
   * Parses the text of a module.
   *
   * @param text Text of the module
   * @param file File name, used in positions and error messages
   * @throws RelmParseException if the text is not valid
   */
  public static Ast.Module parse(String text, String file) {
    final RelmParserImpl parser = new RelmParserImpl(new StringReader(text));
    parser.zero(file);
    try {
      return parser.module();
    } catch (ParseException e) {
      final Token t = e.currentToken == null ? null : e.currentToken.next;
      final Pos pos =
          t == null
              ? new Pos(file, 1, 1, 1, 2)
              : new Pos(
                  file, t.beginLine, t.beginColumn, t.endLine,
                  t.endColumn + 1);
      throw new RelmParseException(e, pos);
    } catch (TokenMgrError e) {
      throw new RelmParseException(e, lexicalErrorPos(e, file));
    }
  }

  /** Deduces the position of a lexical error from its message. */
  private static Pos lexicalErrorPos(TokenMgrError e, String file) {
    final String message = e.getMessage();
    final Matcher m = LEXICAL_ERROR.matcher(message == null ? "" : message);
    if (!m.find()) {
      return new Pos(file, 1, 1, 1, 2);
    }
    final int line = Integer.parseInt(m.group(1));
    final int column = Integer.parseInt(m.group(2));
    return new Pos(file, line, column, line, column + 1);
  }

  /** Parses an integer literal, reporting overflow as a parse error. */
  static int parseInt(Token t, String file) {
    try {
      return Integer.parseInt(t.image);
    } catch (NumberFormatException e) {
      throw new RelmParseException(e,
          new Pos(file, t.beginLine, t.beginColumn, t.endLine,
              t.endColumn + 1));
    }
  }
}

// End Parsers.java
