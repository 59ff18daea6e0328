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
package net.hydromatic.relm.eval;

import static net.hydromatic.relm.Als.als;

import static org.hamcrest.CoreMatchers.is;
import static org.hamcrest.MatcherAssert.assertThat;

import net.hydromatic.relm.Als;
import org.junit.jupiter.api.Test;

/**
 * Tests the meaning of formulas and expressions, by solving small models.
 *
 * <p>Scopes are upper bounds, not exact, unless a test says otherwise. Every
 * instance found is also checked by {@link Evaluator} against every
 * constraint.
 */
public class SolveTest {
  private static Als inexact(String text) {
    return als(text).withProp(Prop.EXACT_SCOPES, false);
  }

  /** Checks that the first command has an instance. */
  private static void assertSat(String text) {
    inexact(text).assertSolutions("run$1", solutions ->
        assertThat(text, solutions.get(0).isSatisfiable(), is(true)));
  }

  /** Checks that the first command has no instance. */
  private static void assertUnsat(String text) {
    inexact(text).assertSolutions("run$1", solutions ->
        assertThat(text, solutions.get(0).isSatisfiable(), is(false)));
  }

  @Test void testRelationalOperators() {
    assertSat("sig A {r: set A} run {some r and no iden & r and r = ~r}");
    assertUnsat("sig A {r: set A} run {some r and no A <: r}");
    assertUnsat("sig A {} sig B {r: set A} run {some r and no r :> A}");
    assertUnsat("sig A {r: set A, s: set A}\n"
        + "run {r ++ s != r + s and no s}");
    assertSat("sig A {r: set A, s: set A} run {r ++ s != r + s}");
    assertUnsat("sig A {} run {some none}");
    assertSat("sig A {} run {univ = A and some A}");
    assertUnsat("sig A {} sig B {} run {some A and univ = B}");
    assertUnsat("sig A {r: set A} run {some A - A.(A -> A)}");
  }

  @Test void testClosure() {
    assertSat("sig N {next: lone N} run {some n: N | n in n.^next}");
    assertUnsat("sig N {next: lone N}\n"
        + "fact {no n: N | n in n.^next}\n"
        + "run {some N and (all n: N | some n.next)}");
    assertSat("sig A {r: set A} run {some a: A | a.*r = A and #A = 3}");
    assertUnsat("sig A {r: set A}\n"
        + "run {some a: A | a in a.^r and no r & ~r} for 1");
    assertUnsat("sig A {r: set A} run {some a: A | a !in a.*r}");
  }

  @Test void testCardinality() {
    assertSat("sig A {} run {#A = 3}");
    assertUnsat("sig A {} run {#A = 4}");
    assertSat("sig A {} sig B {} run {#A > #B}");
    assertUnsat("sig A {} run {#A >= 2 and #A =< 1}");
    assertSat("sig A {r: set A} run {#{a: A | some a.r} = 2}");
    assertUnsat("sig A {} run {#{a: A | a in A} != #A}");
    assertSat("sig A {} run {#A = 5} for 5");
    inexact("sig A {} run {#A = 5}")
        .withProp(Prop.DEFAULT_SCOPE, 5)
        .assertOutcome("run$1", Solution.Outcome.SATISFIABLE);
  }

  /** A literal larger than any count is compared without unrolling it. */
  @Test void testLargeLiterals() {
    als("sig A {} run {#A = 2147483647} for 3")
        .assertOutcome("run$1", Solution.Outcome.TRIVIALLY_UNSATISFIABLE);
    als("sig A {} run {#A = 100000000} for 3")
        .assertOutcome("run$1", Solution.Outcome.TRIVIALLY_UNSATISFIABLE);
    assertUnsat("sig A {} run {#A = 2147483647}");
    assertUnsat("sig A {} run {100000000 =< #A}");
    assertSat("sig A {} run {#A < 100000000 and #A != 2147483647}");
    assertSat("sig A {} run {2147483647 > #A and some A}");
    assertSat("sig A {} run {some A and 2147483647 > 100000000}");
    assertUnsat("sig A {} run {100000000 >= 2147483647}");
  }

  @Test void testQuantifiers() {
    assertSat("sig A {r: set A} run {some a: A | one a.r and lone a.r}");
    assertUnsat("sig A {} run {some disj a, b: A | a = b}");
    assertUnsat("sig A {} run {one a: A | a = a} for exactly 2 A");
    assertSat("sig A {} run {one a: A | a = a} for exactly 1 A");
    assertUnsat("sig A {} run {lone a: A | a = a} for exactly 2 A");
    assertSat("sig A {} run {no a: A | a != a}");
    assertUnsat("sig A {r: set A}\n"
        + "run {some A and (all a: A | some a.r) and no A.r}");
  }

  @Test void testFormulaOperators() {
    assertUnsat("sig A {}\n"
        + "run {#A = 2 and (some A implies #A = 1 else #A = 3)}");
    assertSat("sig A {} run {#A = 2 and (no A implies #A = 1 else #A = 2)}");
    assertUnsat("sig A {} run {some A iff no A}");
    assertUnsat("sig A {} run {not (some A or no A)}");
    assertSat("sig A {} run {some A => #A = 1}");
    assertUnsat("sig A {r: set A} run {let x = A.r | some x and no x}");
    assertSat("sig A {r: set A} run {let x = A.r, y = r.A | x = y}");
  }

  @Test void testFunctionsAndPredicates() {
    assertUnsat("sig A {r: set A}\n"
        + "fun img[a: A]: set A {a.r}\n"
        + "run {some a: A | some img[a] and no a.r}");
    assertSat("sig A {} pred two[x, y: A] {x != y} run two");
    assertUnsat("sig A {} pred two[x, y: A] {x != y} run two for 1 A");
    assertSat("sig A {r: set A}\n"
        + "pred loop[a: A] {a in a.r}\n"
        + "run {some a: A | loop[a]}");
    assertUnsat("sig A {r: set A}\n"
        + "pred loop[a: A] {a in a.r}\n"
        + "fact {no iden & r}\n"
        + "run {some a: A | loop[a]}");
  }

  @Test void testDeclarations() {
    assertUnsat("sig A {f: one A} run {some a: A | no a.f}");
    assertSat("sig A {f: lone A} run {some a: A | no a.f}");
    assertUnsat("sig A {f: some A} run {some a: A | no a.f}");
    assertUnsat("sig A {f: A -> one A} run {some a, b: A | no b.(a.f)}");
    assertUnsat("sig A {f: set A} {some f} run {some a: A | no a.f}");
    assertUnsat("sig A {} sig B in A {} run {some B - A}");
    assertUnsat("abstract sig A {} sig B extends A {} run {some A - B}");
    assertUnsat("sig A {} sig B, C extends A {} run {some B & C}");
    assertUnsat("sig A {disj f: set A}\n"
        + "run {some disj a, b: A | some a.f & b.f}");
    assertUnsat("one sig A {} run {#A != 1}");
    assertUnsat("lone sig A {} run {#A > 1}");
    assertUnsat("some sig A {} run {no A}");
    assertUnsat("sig A {} sig B {f: A lone -> B}\n"
        + "run {some disj a, a2: A, b, c: B | a -> b + a2 -> b in c.f}");
    assertSat("sig A {} sig B {f: A lone -> B}\n"
        + "run {some a: A, disj b, c: B | a -> b + a -> c in b.f}");
  }

  @Test void testCheck() {
    inexact("sig A {r: set A} assert Sym {r = ~r} check Sym")
        .assertOutcome("Sym", Solution.Outcome.SATISFIABLE);
    inexact("sig A {r: set A} fact {r = ~r} assert Sym {~r in r} check Sym")
        .assertOutcome("Sym", Solution.Outcome.UNSATISFIABLE);
  }

  @Test void testExactScopes() {
    // with exact scopes, "#A = 2" is decided before solving
    als("sig A {} run {#A = 2} for 3")
        .assertOutcome("run$1", Solution.Outcome.TRIVIALLY_UNSATISFIABLE);
    als("sig A {} run {#A = 3} for 3")
        .assertOutcome("run$1", Solution.Outcome.SATISFIABLE);
  }
}

// End SolveTest.java
