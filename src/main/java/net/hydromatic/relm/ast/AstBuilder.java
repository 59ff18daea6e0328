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

import com.google.common.collect.ImmutableList;
import java.util.List;
import net.hydromatic.relm.type.Field;
import net.hydromatic.relm.type.Function;
import net.hydromatic.relm.type.Sig;
import org.checkerframework.checker.nullness.qual.Nullable;

/** Builds parse tree nodes. */
public enum AstBuilder {
  /**
   * The singleton instance of the AST builder. The short name is convenient for
   * use via 'import static', but checkstyle does not approve.
   */
  // CHECKSTYLE: IGNORE 1
  ast;

  // declarations

  public Ast.Module module(
      Pos pos, Ast.@Nullable Id name, List<? extends Ast.Decl> decls) {
    return new Ast.Module(pos, name, ImmutableList.copyOf(decls));
  }

  public Ast.SigDecl sigDecl(
      Pos pos,
      boolean isAbstract,
      Ast.@Nullable Mult mult,
      List<Ast.Id> names,
      Ast.@Nullable Id parent,
      List<Ast.Id> supersets,
      List<Ast.FieldDecl> fields,
      Ast.@Nullable Exp appendedFact) {
    return new Ast.SigDecl(
        pos,
        isAbstract,
        mult,
        ImmutableList.copyOf(names),
        parent,
        ImmutableList.copyOf(supersets),
        ImmutableList.copyOf(fields),
        appendedFact);
  }

  public Ast.FieldDecl fieldDecl(
      Pos pos,
      boolean disj,
      List<Ast.Id> names,
      Ast.@Nullable Mult mult,
      Ast.Exp exp) {
    return new Ast.FieldDecl(
        pos, disj, ImmutableList.copyOf(names), mult, exp);
  }

  public Ast.FactDecl factDecl(Pos pos, Ast.@Nullable Id name, Ast.Exp body) {
    return new Ast.FactDecl(pos, name, body);
  }

  public Ast.PredDecl predDecl(
      Pos pos, Ast.Id name, List<Ast.VarDecl> params, Ast.Exp body) {
    return new Ast.PredDecl(
        pos, Op.PRED_DECL, name, ImmutableList.copyOf(params), null, null,
        body);
  }

  public Ast.PredDecl funDecl(
      Pos pos,
      Ast.Id name,
      List<Ast.VarDecl> params,
      Ast.@Nullable Mult returnMult,
      Ast.Exp returnType,
      Ast.Exp body) {
    return new Ast.PredDecl(
        pos, Op.FUN_DECL, name, ImmutableList.copyOf(params), returnMult,
        returnType, body);
  }

  public Ast.AssertDecl assertDecl(Pos pos, Ast.Id name, Ast.Exp body) {
    return new Ast.AssertDecl(pos, name, body);
  }

  public Ast.Command command(
      Pos pos,
      boolean check,
      Ast.@Nullable Id target,
      Ast.@Nullable Exp body,
      @Nullable Integer overall,
      List<Ast.TypeScope> scopes,
      @Nullable Integer expect) {
    return new Ast.Command(
        pos,
        check ? Op.CHECK : Op.RUN,
        target,
        body,
        overall,
        ImmutableList.copyOf(scopes),
        expect);
  }

  public Ast.TypeScope typeScope(
      Pos pos, boolean exactly, int count, Ast.Id sig) {
    return new Ast.TypeScope(pos, exactly, count, sig);
  }

  public Ast.VarDecl varDecl(
      Pos pos, boolean disj, List<Ast.Id> names, Ast.Exp exp) {
    return new Ast.VarDecl(pos, disj, ImmutableList.copyOf(names), exp);
  }

  // leaves

  public Ast.Id id(Pos pos, String name) {
    return new Ast.Id(pos, name);
  }

  public Ast.IntLiteral intLiteral(Pos pos, int value) {
    return new Ast.IntLiteral(pos, value);
  }

  public Ast.Constant univ(Pos pos) {
    return new Ast.Constant(pos, Op.UNIV);
  }

  public Ast.Constant iden(Pos pos) {
    return new Ast.Constant(pos, Op.IDEN);
  }

  public Ast.Constant none(Pos pos) {
    return new Ast.Constant(pos, Op.NONE);
  }

  public Ast.SigRef sigRef(Pos pos, Sig sig) {
    return new Ast.SigRef(pos, sig);
  }

  public Ast.FieldRef fieldRef(Pos pos, Field field) {
    return new Ast.FieldRef(pos, field);
  }

  public Ast.VarRef varRef(Pos pos, String name) {
    return new Ast.VarRef(pos, name);
  }

  // operators

  public Ast.Unary unary(Pos pos, Op op, Ast.Exp exp) {
    return new Ast.Unary(pos, op, exp);
  }

  public Ast.Exp not(Pos pos, Ast.Exp exp) {
    return unary(pos, Op.NOT, exp);
  }

  public Ast.Binary binary(Pos pos, Op op, Ast.Exp left, Ast.Exp right) {
    return new Ast.Binary(pos, op, left, right);
  }

  public Ast.Binary join(Pos pos, Ast.Exp left, Ast.Exp right) {
    return binary(pos, Op.JOIN, left, right);
  }

  public Ast.Binary in(Pos pos, Ast.Exp left, Ast.Exp right) {
    return binary(pos, Op.IN, left, right);
  }

  public Ast.Arrow arrow(
      Pos pos,
      Ast.Exp left,
      Ast.Mult leftMult,
      Ast.Mult rightMult,
      Ast.Exp right) {
    return new Ast.Arrow(pos, left, leftMult, rightMult, right);
  }

  public Ast.Arrow product(Pos pos, Ast.Exp left, Ast.Exp right) {
    return arrow(pos, left, Ast.Mult.SET, Ast.Mult.SET, right);
  }

  public Ast.Ite ite(
      Pos pos, Ast.Exp condition, Ast.Exp ifTrue, Ast.Exp ifFalse) {
    return new Ast.Ite(pos, condition, ifTrue, ifFalse);
  }

  public Ast.Apply apply(Pos pos, Ast.Exp fn, List<Ast.Exp> args) {
    return new Ast.Apply(pos, fn, ImmutableList.copyOf(args));
  }

  public Ast.Call call(Pos pos, Function function, List<Ast.Exp> args) {
    return new Ast.Call(pos, function, ImmutableList.copyOf(args));
  }

  /**
   * Creates a multiplicity formula, such as "{@code lone e}"; returns null for
   * {@link Ast.Mult#SET}, which constrains nothing.
   */
  public Ast.@Nullable Exp multiplicity(Pos pos, Ast.Mult mult, Ast.Exp exp) {
    final Op op = mult.toOp();
    return op == null ? null : unary(pos, op, exp);
  }

  // binders

  public Ast.Quantified quantified(
      Pos pos, Op op, List<Ast.VarDecl> decls, Ast.Exp body) {
    return new Ast.Quantified(pos, op, ImmutableList.copyOf(decls), body);
  }

  public Ast.Quantified all(Pos pos, Ast.VarDecl decl, Ast.Exp body) {
    return quantified(pos, Op.ALL, ImmutableList.of(decl), body);
  }

  public Ast.Comprehension comprehension(
      Pos pos, List<Ast.VarDecl> decls, Ast.Exp body) {
    return new Ast.Comprehension(pos, ImmutableList.copyOf(decls), body);
  }

  public Ast.Let let(Pos pos, Ast.Id name, Ast.Exp exp, Ast.Exp body) {
    return new Ast.Let(pos, name, exp, body);
  }

  public Ast.Block block(Pos pos, List<? extends Ast.Exp> exps) {
    return new Ast.Block(pos, ImmutableList.copyOf(exps));
  }

  /**
   * Creates the conjunction of a list of formulas, or an empty block (true) if
   * the list is empty.
   */
  public Ast.Exp andAll(Pos pos, List<? extends Ast.Exp> exps) {
    if (exps.size() == 1) {
      return exps.get(0);
    }
    return block(pos, exps);
  }
}

// End AstBuilder.java
