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

import static net.hydromatic.relm.ast.AstBuilder.ast;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import net.hydromatic.relm.ast.Ast;
import net.hydromatic.relm.ast.Op;
import net.hydromatic.relm.ast.Pos;
import net.hydromatic.relm.instance.Atom;
import net.hydromatic.relm.instance.Bounds;
import net.hydromatic.relm.instance.TupleSet;
import net.hydromatic.relm.instance.Universe;
import net.hydromatic.relm.sat.BooleanMatrix;
import net.hydromatic.relm.sat.Sat;
import net.hydromatic.relm.type.Fact;
import net.hydromatic.relm.type.Field;
import net.hydromatic.relm.type.Model;
import net.hydromatic.relm.type.Relation;
import net.hydromatic.relm.type.Sig;

/**
 * Computes the bounds of every relation for a given scope, and the implicit
 * constraints of the declarations.
 *
 * <p>A signature's upper bound holds the atoms tagged with it or its
 * descendants, plus atoms of its ancestors that are not yet committed to a
 * sub-signature ("floating" atoms). Its lower bound holds the atoms of exact
 * signatures within it. A field {@code f: E} of {@code S} is bounded above
 * by {@code upper(S)} times an over-approximation of {@code E}, and below by
 * the empty set.
 */
public class BoundCompiler {
  private final Model model;
  private final Scope scope;
  private final Universe universe;
  private final Map<Relation, TupleSet> lowers = new LinkedHashMap<>();
  private final Map<Relation, TupleSet> uppers = new LinkedHashMap<>();
  private int nextVar = 0;

  private BoundCompiler(Model model, Scope scope) {
    this.model = model;
    this.scope = scope;
    this.universe = scope.universe;
  }

  /** Computes the bounds of every signature and field. */
  public static Bounds bounds(Model model, Scope scope) {
    return new BoundCompiler(model, scope).bounds();
  }

  /**
   * Returns the constraints implied by declarations: sub-signatures within
   * their parent, disjoint siblings, abstract signatures, multiplicities and
   * scopes of signatures, field types and multiplicities, and appended
   * facts.
   */
  public static List<Fact> implicitFacts(Model model, Scope scope,
      Bounds bounds) {
    return new BoundCompiler(model, scope).implicitFacts(bounds);
  }

  /**
   * Creates a matrix for every relation, whose cells are true for tuples in
   * its lower bound and a fresh variable for tuples in its upper bound but
   * not its lower bound.
   *
   * <p>Relations are processed in declaration order and tuples in index
   * order, which is the order of variables in the circuit.
   */
  public static ImmutableMap<Relation, BooleanMatrix> primaryMatrices(
      Sat sat, Model model, Bounds bounds) {
    final int n = bounds.universe.size();
    final ImmutableMap.Builder<Relation, BooleanMatrix> b =
        ImmutableMap.builder();
    for (Relation relation : model.relations()) {
      final TupleSet lower = bounds.lower(relation);
      final TupleSet upper = bounds.upper(relation);
      final Map<Integer, Sat.Term> cells = new LinkedHashMap<>();
      for (int index : upper.indexes) {
        if (lower.contains(index)) {
          cells.put(index, Sat.TRUE);
        } else {
          cells.put(index,
              sat.variable(relation.name + tupleName(upper, index)));
        }
      }
      b.put(relation, BooleanMatrix.of(sat, n, relation.arity(), cells));
    }
    return b.build();
  }

  private static String tupleName(TupleSet set, int index) {
    final StringBuilder b = new StringBuilder("(");
    for (Atom atom : set.tuple(index)) {
      if (b.length() > 1) {
        b.append(", ");
      }
      b.append(atom.name);
    }
    return b.append(')').toString();
  }

  // bounds

  private Bounds bounds() {
    for (Sig sig : model.sigs) {
      sigUpper(sig);
    }
    for (Sig sig : model.sigs) {
      lowers.put(sig, sig.isSubset() ? TupleSet.empty(universe, 1)
          : sigLower(sig));
    }
    for (Field field : model.fields) {
      if (!universe.fits(field.arity())) {
        throw new ScopeException("universe of " + universe.size()
            + " atoms is too large for field '" + field.name + "' of arity "
            + field.arity(), field.pos);
      }
      final TupleSet ownerUpper = uppers.get(field.owner);
      final Map<String, TupleSet> vars = new HashMap<>();
      vars.put("this", ownerUpper);
      uppers.put(field, ownerUpper.product(approximate(field.exp, vars)));
      lowers.put(field, TupleSet.empty(universe, field.arity()));
    }
    return new Bounds(universe, lowers, uppers);
  }

  private TupleSet sigUpper(Sig sig) {
    final TupleSet existing = uppers.get(sig);
    if (existing != null) {
      return existing;
    }
    TupleSet upper;
    if (sig.isSubset()) {
      upper = TupleSet.empty(universe, 1);
      for (Sig superset : sig.supersets) {
        upper = upper.union(sigUpper(superset));
      }
    } else {
      final List<Atom> atoms = new ArrayList<>();
      for (Atom atom : universe.atoms) {
        if (sig.isSameOrAncestorOf(atom.tag) || isFloating(sig, atom.tag)) {
          atoms.add(atom);
        }
      }
      upper = TupleSet.ofAtoms(universe, atoms);
    }
    uppers.put(sig, upper);
    return upper;
  }

  /**
   * Whether atoms tagged {@code tag} may belong to {@code sig} although not
   * allocated for it; true if {@code tag} is a proper ancestor of
   * {@code sig} and no exact signature lies between them.
   */
  private boolean isFloating(Sig sig, Sig tag) {
    if (scope.isExact(sig)) {
      return false;
    }
    for (Sig a = sig.parent; a != null; a = a.parent) {
      if (a == tag) {
        return true;
      }
      if (scope.isExact(a)) {
        return false;
      }
    }
    return false;
  }

  private TupleSet sigLower(Sig sig) {
    final List<Atom> atoms = new ArrayList<>();
    for (Atom atom : universe.atoms) {
      if (scope.isExact(atom.tag) && sig.isSameOrAncestorOf(atom.tag)) {
        atoms.add(atom);
      }
    }
    return TupleSet.ofAtoms(universe, atoms);
  }

  /**
   * Returns a set of tuples that contains the value of an expression in every
   * instance, given the bounds of the relations it references and of its
   * free variables.
   */
  private TupleSet approximate(Ast.Exp exp, Map<String, TupleSet> vars) {
    switch (exp.op) {
      case SIG_REF:
        return sigUpper(((Ast.SigRef) exp).sig);
      case FIELD_REF:
        return uppers.get(((Ast.FieldRef) exp).field);
      case VAR_REF:
        return vars.get(((Ast.VarRef) exp).name);
      case UNIV:
        return TupleSet.all(universe, 1);
      case IDEN:
        return iden();
      case NONE:
        return TupleSet.empty(universe, 1);
      case UNION:
      case OVERRIDE:
        final Ast.Binary union = (Ast.Binary) exp;
        return approximate(union.left, vars)
            .union(approximate(union.right, vars));
      case INTERSECT:
        final Ast.Binary intersect = (Ast.Binary) exp;
        return approximate(intersect.left, vars)
            .intersect(approximate(intersect.right, vars));
      case DIFFERENCE:
      case RANGE:
        return approximate(((Ast.Binary) exp).left, vars);
      case DOMAIN:
        return approximate(((Ast.Binary) exp).right, vars);
      case JOIN:
        final Ast.Binary join = (Ast.Binary) exp;
        return approximate(join.left, vars)
            .join(approximate(join.right, vars));
      case PRODUCT:
        final Ast.Arrow arrow = (Ast.Arrow) exp;
        return approximate(arrow.left, vars)
            .product(approximate(arrow.right, vars));
      case TRANSPOSE:
        return approximate(((Ast.Unary) exp).exp, vars).transpose();
      case CLOSURE:
        return approximate(((Ast.Unary) exp).exp, vars).closure();
      case REFLEXIVE_CLOSURE:
        return approximate(((Ast.Unary) exp).exp, vars).closure()
            .union(iden());
      case ITE:
        final Ast.Ite ite = (Ast.Ite) exp;
        return approximate(ite.ifTrue, vars)
            .union(approximate(ite.ifFalse, vars));
      case LET:
        final Ast.Let let = (Ast.Let) exp;
        final Map<String, TupleSet> vars2 = new HashMap<>(vars);
        vars2.put(let.name.name, approximate(let.exp, vars));
        return approximate(let.body, vars2);
      case CALL:
        return TupleSet.all(universe,
            ((Ast.Call) exp).function.returnType.arity);
      case COMPREHENSION:
        int arity = 0;
        for (Ast.VarDecl decl : ((Ast.Comprehension) exp).decls) {
          arity += decl.names.size();
        }
        return TupleSet.all(universe, arity);
      default:
        throw new AssertionError("unexpected " + exp.op + " in " + exp);
    }
  }

  private TupleSet iden() {
    final List<Integer> indexes = new ArrayList<>();
    for (int i = 0; i < universe.size(); i++) {
      indexes.add(universe.encode(i, i));
    }
    return TupleSet.of(universe, 2, indexes);
  }

  // implicit constraints

  private List<Fact> implicitFacts(Bounds bounds) {
    final List<Fact> facts = new ArrayList<>();
    for (Sig sig : model.sigs) {
      sigFacts(sig, bounds, facts);
    }
    for (Field field : model.fields) {
      fieldFacts(field, facts);
    }
    model.appendedFacts.forEach((sig, body) ->
        facts.add(
            new Fact(sig.name + " appended fact", body.pos,
                ast.all(body.pos, decl("this", ast.sigRef(body.pos, sig)),
                    body))));
    return facts;
  }

  private void sigFacts(Sig sig, Bounds bounds, List<Fact> facts) {
    final Pos pos = sig.pos;
    final Ast.Exp ref = ast.sigRef(pos, sig);
    if (sig.parent != null) {
      facts.add(
          new Fact(sig.name + " in " + sig.parent.name, pos,
              ast.in(pos, ref, ast.sigRef(pos, sig.parent))));
    }
    if (sig.isSubset()) {
      final Ast.Exp supersets = union(pos, sig.supersets);
      facts.add(
          new Fact(sig.name + " in " + supersets, pos,
              ast.in(pos, ref, supersets)));
    }
    final List<Sig> children = model.children(sig);
    for (int i = 0; i < children.size(); i++) {
      for (Sig other : children.subList(i + 1, children.size())) {
        final Sig child = children.get(i);
        facts.add(
            new Fact("disjoint " + child.name + ", " + other.name, pos,
                ast.unary(pos, Op.NO_EXP,
                    ast.binary(pos, Op.INTERSECT, ast.sigRef(pos, child),
                        ast.sigRef(pos, other)))));
      }
    }
    if (sig.isAbstract) {
      facts.add(
          new Fact("abstract " + sig.name, pos,
              children.isEmpty()
                  ? ast.unary(pos, Op.NO_EXP, ref)
                  : ast.in(pos, ref, union(pos, children))));
    }
    if (sig.mult != null && !scope.isExact(sig)) {
      final Ast.Exp formula = ast.multiplicity(pos, sig.mult, ref);
      if (formula != null) {
        facts.add(new Fact(sig.mult.keyword() + " " + sig.name, pos, formula));
      }
    }
    final Integer count = scope.count(sig);
    if (count != null
        && !scope.isExact(sig)
        && bounds.upper(sig).size() > count) {
      facts.add(
          new Fact("scope of " + sig.name, pos,
              ast.binary(pos, Op.LE, ast.unary(pos, Op.CARDINALITY, ref),
                  ast.intLiteral(pos, count))));
    }
  }

  private void fieldFacts(Field field, List<Fact> facts) {
    final Pos pos = field.pos;
    final Ast.Exp owner = ast.sigRef(pos, field.owner);
    final Ast.Exp thisField =
        ast.join(pos, ast.varRef(pos, "this"), ast.fieldRef(pos, field));

    // f in S -> univ -> ... -> univ
    Ast.Exp domain = owner;
    for (int i = 1; i < field.arity(); i++) {
      domain = ast.product(pos, domain, ast.univ(pos));
    }
    facts.add(
        new Fact(field.name + " domain", pos,
            ast.in(pos, ast.fieldRef(pos, field), domain)));

    // all this: S | this.f in E
    final List<Ast.Exp> conjuncts = new ArrayList<>();
    conjuncts.add(ast.in(pos, thisField, stripMultiplicities(field.exp)));
    final Ast.Exp mult = ast.multiplicity(pos, field.mult, thisField);
    if (mult != null) {
      conjuncts.add(mult);
    }
    arrowFacts(thisField, field.exp, conjuncts);
    facts.add(
        new Fact(field.name + " type", pos,
            ast.all(pos, decl("this", owner), ast.andAll(pos, conjuncts))));

    if (field.disj) {
      // all disj a, b: S | no a.f & b.f
      final String a = freshName();
      final String b = freshName();
      facts.add(
          new Fact(field.name + " disjoint", pos,
              ast.quantified(pos, Op.ALL,
                  ImmutableList.of(
                      ast.varDecl(pos, true,
                          ImmutableList.of(ast.id(pos, a), ast.id(pos, b)),
                          owner)),
                  ast.unary(pos, Op.NO_EXP,
                      ast.binary(pos, Op.INTERSECT,
                          ast.join(pos, ast.varRef(pos, a),
                              ast.fieldRef(pos, field)),
                          ast.join(pos, ast.varRef(pos, b),
                              ast.fieldRef(pos, field)))))));
    }
  }

  /**
   * Adds the constraints of arrow multiplicities in a field's type. For
   * "{@code r in A m -> n B}", every atom of {@code A} maps to {@code n}
   * atoms of {@code B}, and every atom of {@code B} is mapped from {@code m}
   * atoms of {@code A}.
   */
  private void arrowFacts(Ast.Exp r, Ast.Exp exp, List<Ast.Exp> conjuncts) {
    if (!(exp instanceof Ast.Arrow)) {
      return;
    }
    final Ast.Arrow arrow = (Ast.Arrow) exp;
    final Pos pos = arrow.pos;
    if (arrow.rightMult != Ast.Mult.SET || arrow.right instanceof Ast.Arrow) {
      checkNotArrow(arrow.left, arrow);
      final String x = freshName();
      final Ast.Exp image = ast.join(pos, ast.varRef(pos, x), r);
      final List<Ast.Exp> inner = new ArrayList<>();
      final Ast.Exp mult = ast.multiplicity(pos, arrow.rightMult, image);
      if (mult != null) {
        inner.add(mult);
      }
      arrowFacts(image, arrow.right, inner);
      conjuncts.add(
          ast.all(pos, decl(x, stripMultiplicities(arrow.left)),
              ast.andAll(pos, inner)));
    }
    if (arrow.leftMult != Ast.Mult.SET || arrow.left instanceof Ast.Arrow) {
      checkNotArrow(arrow.right, arrow);
      final String y = freshName();
      final Ast.Exp image = ast.join(pos, r, ast.varRef(pos, y));
      final List<Ast.Exp> inner = new ArrayList<>();
      final Ast.Exp mult = ast.multiplicity(pos, arrow.leftMult, image);
      if (mult != null) {
        inner.add(mult);
      }
      arrowFacts(image, arrow.left, inner);
      conjuncts.add(
          ast.all(pos, decl(y, stripMultiplicities(arrow.right)),
              ast.andAll(pos, inner)));
    }
  }

  private static void checkNotArrow(Ast.Exp exp, Ast.Arrow arrow) {
    if (exp instanceof Ast.Arrow) {
      throw new TranslationException(
          "multiplicities on both sides of nested arrows are not supported: "
              + arrow,
          arrow.pos);
    }
  }

  /** Converts "{@code A lone -> one B}" to "{@code A -> B}", recursively. */
  private static Ast.Exp stripMultiplicities(Ast.Exp exp) {
    if (exp instanceof Ast.Arrow) {
      final Ast.Arrow arrow = (Ast.Arrow) exp;
      return ast.product(arrow.pos, stripMultiplicities(arrow.left),
          stripMultiplicities(arrow.right));
    }
    return exp;
  }

  private static Ast.Exp union(Pos pos, List<Sig> sigs) {
    Ast.Exp e = ast.sigRef(pos, sigs.get(0));
    for (Sig sig : sigs.subList(1, sigs.size())) {
      e = ast.binary(pos, Op.UNION, e, ast.sigRef(pos, sig));
    }
    return e;
  }

  private static Ast.VarDecl decl(String name, Ast.Exp exp) {
    return ast.varDecl(exp.pos, false,
        ImmutableList.of(ast.id(exp.pos, name)), exp);
  }

  /** Returns a variable name that cannot clash with a user's name. */
  private String freshName() {
    return "v$" + nextVar++;
  }
}

// End BoundCompiler.java
