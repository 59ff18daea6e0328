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

import static net.hydromatic.relm.Als.assertError;
import static net.hydromatic.relm.Als.throwsA;

import static org.hamcrest.CoreMatchers.instanceOf;
import static org.hamcrest.CoreMatchers.is;
import static org.hamcrest.CoreMatchers.startsWith;
import static org.hamcrest.MatcherAssert.assertThat;

import com.google.common.io.Resources;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.util.List;
import net.hydromatic.relm.ast.Ast;
import net.hydromatic.relm.ast.Op;
import org.junit.jupiter.api.Test;

/** Tests the parser. */
public class ParserTest {
  /** Parses a module. */
  private static Ast.Module module(String text) {
    return Parsers.parse(text, "test.als");
  }

  /** Parses an expression by wrapping it in a fact. */
  private static Ast.Exp exp(String text) {
    final Ast.Module module = module("fact {" + text + "}");
    final Ast.FactDecl fact = module.decls(Ast.FactDecl.class).get(0);
    final List<Ast.Exp> exps = ((Ast.Block) fact.body).exps;
    assertThat(exps.size(), is(1));
    return exps.get(0);
  }

  /** Checks that an expression parses and unparses to a given string. */
  private static void assertParse(String text, String expected) {
    assertThat(exp(text).toString(), is(expected));
  }

  /** Checks that an expression survives a round trip through the parser. */
  private static void assertParseSame(String text) {
    assertParse(text, text);
  }

  /** Checks that parsing fails with a given description. */
  private static void assertParseError(String text, String expected) {
    try {
      module(text);
      throw new AssertionError("expected error");
    } catch (RelmParseException e) {
      assertThat(e.describeTo(new StringBuilder()).toString(),
          startsWith(expected));
    }
  }

  @Test void testFamily() throws IOException {
    final String text =
        Resources.toString(Resources.getResource("family.als"),
            StandardCharsets.UTF_8);
    final Ast.Module module = Parsers.parse(text, "family.als");
    assertThat(module.name == null ? null : module.name.name, is("family"));
    assertThat(module.decls.size(), is(16));
    assertThat(module.decls(Ast.SigDecl.class).size(), is(4));
    assertThat(module.decls(Ast.FactDecl.class).size(), is(4));
    assertThat(module.decls(Ast.PredDecl.class).size(), is(2));
    assertThat(module.decls(Ast.AssertDecl.class).size(), is(2));
    assertThat(module.decls(Ast.Command.class).size(), is(4));

    final Ast.SigDecl person = module.decls(Ast.SigDecl.class).get(0);
    assertThat(person.isAbstract, is(true));
    assertThat(person.toString(),
        is("abstract sig Person {spouse: lone Person, "
            + "parents: set Person}"));
    final Ast.SigDecl manWoman = module.decls(Ast.SigDecl.class).get(1);
    assertThat(manWoman.toString(), is("sig Man, Woman extends Person {}"));
    final Ast.SigDecl adam = module.decls(Ast.SigDecl.class).get(2);
    assertThat(adam.mult, is(Ast.Mult.ONE));

    final List<Ast.Command> commands = module.decls(Ast.Command.class);
    assertThat(commands.get(0).toString(), is("run Show for 4 Person"));
    assertThat(commands.get(2).op, is(Op.CHECK));
  }

  @Test void testEmpty() {
    final Ast.Module module = module("// nothing\n/* at all */");
    assertThat(module.name == null, is(true));
    assertThat(module.decls.isEmpty(), is(true));
  }

  @Test void testPrecedence() {
    assertParseSame("a + b.c");
    assertParse("(a + b).c", "(a + b).c");
    assertParse("(a.b).c", "a.b.c");
    assertParseSame("a - b - c");
    assertParseSame("a - (b - c)");
    assertParse("(a - b) - c", "a - b - c");
    assertParseSame("a + b & c");
    assertParseSame("(a + b) & c");
    assertParseSame("#p.spouse > 1");
    assertParseSame("no p.spouse and some q");
    assertParse("no p.spouse && some q", "no p.spouse and some q");
    assertParseSame("not a in b");
    assertParse("!(a in b)", "not a in b");
    assertParseSame("a or b and c");
    assertParseSame("(a or b) and c");
    assertParse("a => b", "a implies b");
    assertParse("a <=> b", "a iff b");
    assertParseSame("~r.s");
    assertParseSame("^r + *s");
    assertParseSame("a <: r :> b");
    assertParseSame("r ++ s");
  }

  @Test void testComparisons() {
    assertParseSame("a in b");
    assertParse("a !in b", "a not in b");
    assertParse("a not in b", "a not in b");
    assertParseSame("a = b");
    assertParseSame("a != b");
    assertParse("a not = b", "a != b");
    assertParse("#a <= 2", "#a =< 2");
    assertParse("#a not < 2", "not #a < 2");
    assertParseSame("#a >= #b");
  }

  @Test void testIfThenElse() {
    final Ast.Exp e = exp("a implies b else c");
    assertThat(e, instanceOf(Ast.Ite.class));
    assertThat(e.toString(), is("a implies b else c"));
    assertParseSame("a implies b implies c");
  }

  @Test void testQuantified() {
    assertParse("all p: Person | p !in p.^parents",
        "all p: Person | p not in p.^parents");
    assertParseSame("some disj p, q: Person | p.spouse = q");
    assertParse("no p: Person { p in p.spouse }",
        "no p: Person | {p in p.spouse}");
    assertParseSame("one x: A, y: B | x -> y in r");
    final Ast.Exp e = exp("lone p: Person | some p.spouse");
    assertThat(e.op, is(Op.LONE));
    assertThat(((Ast.Quantified) e).decls.get(0).names.get(0).name, is("p"));
  }

  @Test void testMultiplicityFormulas() {
    assertThat(exp("some p").op, is(Op.SOME_EXP));
    assertThat(exp("no p.spouse").op, is(Op.NO_EXP));
    assertThat(exp("one (a + b)").op, is(Op.ONE_EXP));
    assertThat(exp("lone a").op, is(Op.LONE_EXP));
    assertParseSame("no (Adam + Eve).parents");
  }

  @Test void testLet() {
    final Ast.Exp e = exp("let x = a, y = b | x in y");
    assertThat(e, instanceOf(Ast.Let.class));
    final Ast.Let let = (Ast.Let) e;
    assertThat(let.name.name, is("x"));
    assertThat(let.body, instanceOf(Ast.Let.class));
    assertThat(((Ast.Let) let.body).name.name, is("y"));
  }

  @Test void testComprehensionAndBlock() {
    assertParseSame("{p: Person | some p.spouse}");
    assertParseSame("{a in b c in d}");
    assertThat(exp("{}").op, is(Op.BLOCK));
  }

  @Test void testArrow() {
    final Ast.Module module = module("sig A {f: A -> lone A, g: set A}");
    final Ast.SigDecl sig = module.decls(Ast.SigDecl.class).get(0);
    final Ast.FieldDecl f = sig.fields.get(0);
    assertThat(f.exp, instanceOf(Ast.Arrow.class));
    assertThat(((Ast.Arrow) f.exp).rightMult, is(Ast.Mult.LONE));
    assertThat(f.exp.toString(), is("A -> lone A"));
    assertThat(sig.fields.get(1).mult, is(Ast.Mult.SET));
  }

  @Test void testApply() {
    assertParseSame("f[x]");
    assertParseSame("p.parents[q, r].spouse");
  }

  @Test void testSignatures() {
    final Ast.Module module =
        module("abstract sig A {}\n"
            + "lone sig B extends A {}\n"
            + "sig C in A + B {}\n"
            + "sig D {} {some D}");
    final List<Ast.SigDecl> sigs = module.decls(Ast.SigDecl.class);
    assertThat(sigs.get(1).mult, is(Ast.Mult.LONE));
    assertThat(sigs.get(1).parent == null ? null : sigs.get(1).parent.name,
        is("A"));
    assertThat(sigs.get(2).isSubset(), is(true));
    assertThat(sigs.get(2).toString(), is("sig C in A + B {}"));
    assertThat(sigs.get(3).toString(), is("sig D {} {some D}"));
  }

  @Test void testParagraphs() {
    final Ast.Module module =
        module("pred P[x: A, y: B] {x in y}\n"
            + "fun f(x: A): set B {x.r}\n"
            + "assert Q {no A}\n"
            + "fact {some A}\n");
    final List<Ast.PredDecl> preds = module.decls(Ast.PredDecl.class);
    assertThat(preds.get(0).toString(), is("pred P[x: A, y: B] {x in y}"));
    assertThat(preds.get(1).op, is(Op.FUN_DECL));
    assertThat(preds.get(1).toString(), is("fun f[x: A]: set B {x.r}"));
    assertThat(module.decls(Ast.AssertDecl.class).get(0).toString(),
        is("assert Q {no A}"));
    assertThat(module.decls(Ast.FactDecl.class).get(0).name == null,
        is(true));
  }

  @Test void testCommands() {
    final Ast.Module module =
        module("run Show for 4 but exactly 2 Man, 3 Woman expect 1\n"
            + "check {no A} for 5\n"
            + "run P for exactly 3 A\n"
            + "run Q");
    final List<Ast.Command> commands = module.decls(Ast.Command.class);
    assertThat(commands.get(0).toString(),
        is("run Show for 4 but exactly 2 Man, 3 Woman expect 1"));
    assertThat(commands.get(0).overall, is(4));
    assertThat(commands.get(0).expect, is(1));
    assertThat(commands.get(0).scopes.get(0).exactly, is(true));
    assertThat(commands.get(1).toString(), is("check {no A} for 5"));
    assertThat(commands.get(1).target == null, is(true));
    assertThat(commands.get(2).overall == null, is(true));
    assertThat(commands.get(2).scopes.get(0).count, is(3));
    assertThat(commands.get(3).toString(), is("run Q"));
  }

  @Test void testPositions() {
    final Ast.Module module = module("sig A {}\n\nfact F {\n  some A\n}");
    final Ast.FactDecl fact = module.decls(Ast.FactDecl.class).get(0);
    assertThat(fact.pos.startLine, is(3));
    assertThat(fact.pos.startColumn, is(1));
    assertThat(fact.pos.endLine, is(5));
  }

  @Test void testErrors() {
    assertParseError("sig A {} sig {}", "test.als:1.14 Error: Encountered");
    assertParseError("sig A { f: $ }", "test.als:1.12 Error: Lexical error");
    assertParseError("sig A {}\nfact {\n  all p: A p}",
        "test.als:3.12 Error: Encountered");
    assertError(() -> module("run {} for 99999999999"),
        throwsA(RelmParseException.class, "99999999999"));
  }
}

// End ParserTest.java
