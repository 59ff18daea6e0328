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
package net.hydromatic.relm.ast;

import java.util.Locale;

/** Sub-types of {@link AstNode}. */
public enum Op {
  // identifiers and constants
  ID(true),
  INT_LITERAL(true),
  UNIV(true),
  IDEN(true),
  NONE(true),

  // resolved references; occur after resolution, never in parse trees
  SIG_REF(true),
  FIELD_REF(true),
  VAR_REF(true),
  CALL(true),

  // declarations
  MODULE,
  SIG_DECL,
  FIELD_DECL,
  FACT_DECL,
  PRED_DECL,
  FUN_DECL,
  ASSERT_DECL,
  VAR_DECL,
  RUN,
  CHECK,
  TYPE_SCOPE,

  // quantified formulas and binders; extend as far right as possible
  ALL("all ", 1, false),
  SOME("some ", 1, false),
  NO("no ", 1, false),
  ONE("one ", 1, false),
  LONE("lone ", 1, false),
  LET("let ", 1, false),
  COMPREHENSION(true),
  BLOCK(true),

  // formulas
  OR(" or ", 2),
  IFF(" iff ", 3),
  IMPLIES(" implies ", 4, false),
  ITE(" else ", 4, false),
  AND(" and ", 5),
  NOT("not ", 6, false),
  IN(" in ", 7),
  NOT_IN(" not in ", 7),
  EQ(" = ", 7),
  NE(" != ", 7),
  LT(" < ", 7),
  LE(" =< ", 7),
  GT(" > ", 7),
  GE(" >= ", 7),
  // multiplicity formulas "no e", "some e", "one e", "lone e"
  NO_EXP("no ", 8, false),
  SOME_EXP("some ", 8, false),
  ONE_EXP("one ", 8, false),
  LONE_EXP("lone ", 8, false),

  // relational expressions
  UNION(" + ", 10),
  DIFFERENCE(" - ", 10),
  CARDINALITY("#", 11, false),
  OVERRIDE(" ++ ", 12),
  INTERSECT(" & ", 13),
  PRODUCT(" -> ", 14),
  DOMAIN(" <: ", 15),
  RANGE(" :> ", 15),
  APPLY("[", 16),
  JOIN(".", 17),
  TRANSPOSE("~", 18, false),
  CLOSURE("^", 18, false),
  REFLEXIVE_CLOSURE("*", 18, false);

  /** Padded name, e.g. " + ". */
  public final String padded;
  /** Left precedence. */
  public final int left;
  /** Right precedence. */
  public final int right;

  Op() {
    this("", 0, 0);
  }

  Op(boolean atom) {
    this("", 99, 99);
    assert atom;
  }

  Op(String padded, int leftPrecedence) {
    this(padded, leftPrecedence, true);
  }

  Op(String padded, int precedence, boolean leftAssociative) {
    this(
        padded,
        precedence * 2 + (leftAssociative ? 0 : 1),
        precedence * 2 + (leftAssociative ? 1 : 0));
  }

  Op(String padded, int left, int right) {
    this.padded = padded;
    this.left = left;
    this.right = right;
  }

  /** Returns the lower-case name, e.g. "sig_decl". */
  public String lowerName() {
    return name().toLowerCase(Locale.ROOT);
  }
}

// End Op.java
