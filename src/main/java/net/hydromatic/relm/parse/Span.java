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

import java.util.ArrayList;
import java.util.List;
import net.hydromatic.relm.ast.AstNode;
import net.hydromatic.relm.ast.Pos;

/**
 * Accumulates the positions of the tokens and nodes that make up a
 * production, and combines them into one {@link Pos}.
 *
 * <p>A grammar production typically starts with {@code s = span();} after
 * its first token, adds sub-nodes as it parses them, and finishes with
 * {@code s.end(this)}, which adds the last token consumed and returns the
 * combined position.
 */
public final class Span {
  private final List<Pos> posList = new ArrayList<>();

  private Span() {}

  /** Creates a span containing one position. */
  public static Span of(Pos pos) {
    return new Span().add(pos);
  }

  /** Creates a span containing the position of one node. */
  public static Span of(AstNode node) {
    return new Span().add(node.pos);
  }

  public Span add(Pos pos) {
    posList.add(pos);
    return this;
  }

  public Span add(AstNode node) {
    return add(node.pos);
  }

  public Span addAll(Iterable<? extends AstNode> nodes) {
    for (AstNode node : nodes) {
      add(node);
    }
    return this;
  }

  /** Adds the position of the last token consumed by a parser. */
  public Span add(RelmParser parser) {
    return add(parser.pos());
  }

  /** Returns a position from the earliest to the latest position added. */
  public Pos pos() {
    return Pos.sum(posList);
  }

  /** Adds the last token consumed by a parser, and returns the position. */
  public Pos end(RelmParser parser) {
    return add(parser).pos();
  }

  /** Adds a node, and returns the position. */
  public Pos end(AstNode node) {
    return add(node).pos();
  }
}

// End Span.java
