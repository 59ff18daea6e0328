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

import static com.google.common.base.Preconditions.checkArgument;
import static java.util.Objects.requireNonNull;

import com.google.common.collect.ImmutableList;
import java.util.List;
import java.util.Locale;
import net.hydromatic.relm.type.Field;
import net.hydromatic.relm.type.Function;
import net.hydromatic.relm.type.Sig;
import org.checkerframework.checker.nullness.qual.Nullable;

/** Various sub-classes of AST nodes. */
public class Ast {
  private Ast() {}

  /** Multiplicity keyword of a signature, field or arrow. */
  public enum Mult {
    SET,
    LONE,
    ONE,
    SOME;

    /** Returns the keyword, e.g. "lone". */
    public String keyword() {
      return name().toLowerCase(Locale.ROOT);
    }

    /** Returns the multiplicity formula operator, or null for {@link #SET}. */
    public @Nullable Op toOp() {
      switch (this) {
        case LONE:
          return Op.LONE_EXP;
        case ONE:
          return Op.ONE_EXP;
        case SOME:
          return Op.SOME_EXP;
        default:
          return null;
      }
    }
  }

  /** A module: an optional header and a list of paragraphs. */
  public static class Module extends AstNode {
    public final @Nullable Id name;
    public final ImmutableList<Decl> decls;

    Module(Pos pos, @Nullable Id name, ImmutableList<Decl> decls) {
      super(pos, Op.MODULE);
      this.name = name;
      this.decls = requireNonNull(decls);
    }

    @Override
    AstWriter unparse(AstWriter w, int left, int right) {
      if (name != null) {
        w.append("module ").append(name.name).append("\n");
      }
      for (Decl decl : decls) {
        w.append(decl, 0, 0).append("\n");
      }
      return w;
    }

    @Override
    public void accept(Visitor visitor) {
      visitor.visit(this);
    }

    /** Returns the declarations of a given class. */
    public <D extends Decl> List<D> decls(Class<D> clazz) {
      final ImmutableList.Builder<D> b = ImmutableList.builder();
      for (Decl decl : decls) {
        if (clazz.isInstance(decl)) {
          b.add(clazz.cast(decl));
        }
      }
      return b.build();
    }
  }

  /** Base class for paragraphs (signatures, facts, predicates, commands). */
  public abstract static class Decl extends AstNode {
    Decl(Pos pos, Op op) {
      super(pos, op);
    }
  }

  /**
   * Signature declaration.
   *
   * <p>For example, "{@code abstract sig Person {spouse: lone Person}}".
   */
  public static class SigDecl extends Decl {
    public final boolean isAbstract;
    public final @Nullable Mult mult;
    public final ImmutableList<Id> names;
    public final @Nullable Id parent;
    public final ImmutableList<Id> supersets;
    public final ImmutableList<FieldDecl> fields;
    public final @Nullable Exp appendedFact;

    SigDecl(
        Pos pos,
        boolean isAbstract,
        @Nullable Mult mult,
        ImmutableList<Id> names,
        @Nullable Id parent,
        ImmutableList<Id> supersets,
        ImmutableList<FieldDecl> fields,
        @Nullable Exp appendedFact) {
      super(pos, Op.SIG_DECL);
      this.isAbstract = isAbstract;
      this.mult = mult;
      this.names = requireNonNull(names);
      this.parent = parent;
      this.supersets = requireNonNull(supersets);
      this.fields = requireNonNull(fields);
      this.appendedFact = appendedFact;
      checkArgument(!names.isEmpty());
      checkArgument(parent == null || supersets.isEmpty());
    }

    /** Whether this is a subset signature, declared with "in". */
    public boolean isSubset() {
      return !supersets.isEmpty();
    }

    @Override
    AstWriter unparse(AstWriter w, int left, int right) {
      if (isAbstract) {
        w.append("abstract ");
      }
      if (mult != null) {
        w.append(mult.keyword()).append(" ");
      }
      w.append("sig ").appendAll(names, ", ");
      if (parent != null) {
        w.append(" extends ").append(parent, 0, 0);
      }
      if (!supersets.isEmpty()) {
        w.append(" in ").appendAll(supersets, " + ");
      }
      w.append(" {").appendAll(fields, ", ").append("}");
      if (appendedFact != null) {
        w.append(" ").append(appendedFact, 0, 0);
      }
      return w;
    }

    @Override
    public void accept(Visitor visitor) {
      visitor.visit(this);
    }
  }

  /**
   * Field declaration within a signature.
   *
   * <p>For example, "{@code parents: set Person}". If the multiplicity is
   * omitted, it is "one" for a unary type and "set" otherwise.
   */
  public static class FieldDecl extends Decl {
    public final boolean disj;
    public final ImmutableList<Id> names;
    public final @Nullable Mult mult;
    public final Exp exp;

    FieldDecl(
        Pos pos,
        boolean disj,
        ImmutableList<Id> names,
        @Nullable Mult mult,
        Exp exp) {
      super(pos, Op.FIELD_DECL);
      this.disj = disj;
      this.names = requireNonNull(names);
      this.mult = mult;
      this.exp = requireNonNull(exp);
    }

    @Override
    AstWriter unparse(AstWriter w, int left, int right) {
      w.appendAll(names, ", ").append(": ");
      if (disj) {
        w.append("disj ");
      }
      if (mult != null) {
        w.append(mult.keyword()).append(" ");
      }
      return w.append(exp, 0, 0);
    }

    @Override
    public void accept(Visitor visitor) {
      visitor.visit(this);
    }
  }

  /** Fact declaration, such as "{@code fact Acyclic {no p: Person | ...}}". */
  public static class FactDecl extends Decl {
    public final @Nullable Id name;
    public final Exp body;

    FactDecl(Pos pos, @Nullable Id name, Exp body) {
      super(pos, Op.FACT_DECL);
      this.name = name;
      this.body = requireNonNull(body);
    }

    @Override
    AstWriter unparse(AstWriter w, int left, int right) {
      w.append("fact ");
      if (name != null) {
        w.append(name.name).append(" ");
      }
      return w.append(body, 0, 0);
    }

    @Override
    public void accept(Visitor visitor) {
      visitor.visit(this);
    }
  }

  /**
   * Predicate or function declaration.
   *
   * <p>A predicate ({@link Op#PRED_DECL}) has a formula body; a function
   * ({@link Op#FUN_DECL}) has a return type and an expression body.
   */
  public static class PredDecl extends Decl {
    public final Id name;
    public final ImmutableList<VarDecl> params;
    public final @Nullable Mult returnMult;
    public final @Nullable Exp returnType;
    public final Exp body;

    PredDecl(
        Pos pos,
        Op op,
        Id name,
        ImmutableList<VarDecl> params,
        @Nullable Mult returnMult,
        @Nullable Exp returnType,
        Exp body) {
      super(pos, op);
      this.name = requireNonNull(name);
      this.params = requireNonNull(params);
      this.returnMult = returnMult;
      this.returnType = returnType;
      this.body = requireNonNull(body);
      checkArgument(op == Op.PRED_DECL || op == Op.FUN_DECL);
      checkArgument((op == Op.FUN_DECL) == (returnType != null));
    }

    @Override
    AstWriter unparse(AstWriter w, int left, int right) {
      w.append(op == Op.PRED_DECL ? "pred " : "fun ").append(name.name);
      if (!params.isEmpty()) {
        w.append("[").appendAll(params, ", ").append("]");
      }
      if (returnType != null) {
        w.append(": ");
        if (returnMult != null) {
          w.append(returnMult.keyword()).append(" ");
        }
        w.append(returnType, 0, 0);
      }
      w.append(" ");
      if (op == Op.FUN_DECL) {
        return w.append("{").append(body, 0, 0).append("}");
      }
      return w.append(body, 0, 0);
    }

    @Override
    public void accept(Visitor visitor) {
      visitor.visit(this);
    }
  }

  /** Assertion, such as "{@code assert NoSelfParent {...}}". */
  public static class AssertDecl extends Decl {
    public final Id name;
    public final Exp body;

    AssertDecl(Pos pos, Id name, Exp body) {
      super(pos, Op.ASSERT_DECL);
      this.name = requireNonNull(name);
      this.body = requireNonNull(body);
    }

    @Override
    AstWriter unparse(AstWriter w, int left, int right) {
      return w.append("assert ").append(name.name).append(" ")
          .append(body, 0, 0);
    }

    @Override
    public void accept(Visitor visitor) {
      visitor.visit(this);
    }
  }

  /**
   * Command, "run" ({@link Op#RUN}) or "check" ({@link Op#CHECK}).
   *
   * <p>For example, "{@code run Show for 4 but 2 Man}".
   */
  public static class Command extends Decl {
    public final @Nullable Id target;
    public final @Nullable Exp body;
    public final @Nullable Integer overall;
    public final ImmutableList<TypeScope> scopes;
    public final @Nullable Integer expect;

    Command(
        Pos pos,
        Op op,
        @Nullable Id target,
        @Nullable Exp body,
        @Nullable Integer overall,
        ImmutableList<TypeScope> scopes,
        @Nullable Integer expect) {
      super(pos, op);
      this.target = target;
      this.body = body;
      this.overall = overall;
      this.scopes = requireNonNull(scopes);
      this.expect = expect;
      checkArgument(op == Op.RUN || op == Op.CHECK);
      checkArgument(target == null || body == null);
    }

    @Override
    AstWriter unparse(AstWriter w, int left, int right) {
      w.append(op == Op.RUN ? "run" : "check");
      if (target != null) {
        w.append(" ").append(target.name);
      }
      if (body != null) {
        w.append(" ").append(body, 0, 0);
      }
      if (overall != null || !scopes.isEmpty()) {
        w.append(" for ");
        if (overall != null) {
          w.append(overall.toString());
          if (!scopes.isEmpty()) {
            w.append(" but ");
          }
        }
        w.appendAll(scopes, ", ");
      }
      if (expect != null) {
        w.append(" expect ").append(expect.toString());
      }
      return w;
    }

    @Override
    public void accept(Visitor visitor) {
      visitor.visit(this);
    }
  }

  /** Scope of one signature in a command, such as "exactly 2 Man". */
  public static class TypeScope extends AstNode {
    public final boolean exactly;
    public final int count;
    public final Id sig;

    TypeScope(Pos pos, boolean exactly, int count, Id sig) {
      super(pos, Op.TYPE_SCOPE);
      this.exactly = exactly;
      this.count = count;
      this.sig = requireNonNull(sig);
    }

    @Override
    AstWriter unparse(AstWriter w, int left, int right) {
      return w.append(exactly ? "exactly " : "")
          .append(Integer.toString(count))
          .append(" ")
          .append(sig.name);
    }

    @Override
    public void accept(Visitor visitor) {
      visitor.visit(this);
    }
  }

  /**
   * Declaration of variables in a quantifier, comprehension or parameter
   * list, such as "{@code disj p, q: Person}".
   */
  public static class VarDecl extends AstNode {
    public final boolean disj;
    public final ImmutableList<Id> names;
    public final Exp exp;

    VarDecl(Pos pos, boolean disj, ImmutableList<Id> names, Exp exp) {
      super(pos, Op.VAR_DECL);
      this.disj = disj;
      this.names = requireNonNull(names);
      this.exp = requireNonNull(exp);
      checkArgument(!names.isEmpty());
    }

    @Override
    AstWriter unparse(AstWriter w, int left, int right) {
      if (disj) {
        w.append("disj ");
      }
      return w.appendAll(names, ", ").append(": ").append(exp, 0, 0);
    }

    @Override
    public void accept(Visitor visitor) {
      visitor.visit(this);
    }
  }

  /** Base class of expressions and formulas. */
  public abstract static class Exp extends AstNode {
    Exp(Pos pos, Op op) {
      super(pos, op);
    }
  }

  /** Identifier, such as "Person" or "spouse"; occurs before resolution. */
  public static class Id extends Exp {
    public final String name;

    Id(Pos pos, String name) {
      super(pos, Op.ID);
      this.name = requireNonNull(name);
    }

    @Override
    AstWriter unparse(AstWriter w, int left, int right) {
      return w.append(name);
    }

    @Override
    public void accept(Visitor visitor) {
      visitor.visit(this);
    }
  }

  /** Integer literal; used as the bound of a cardinality comparison. */
  public static class IntLiteral extends Exp {
    public final int value;

    IntLiteral(Pos pos, int value) {
      super(pos, Op.INT_LITERAL);
      this.value = value;
    }

    @Override
    AstWriter unparse(AstWriter w, int left, int right) {
      return w.append(Integer.toString(value));
    }

    @Override
    public void accept(Visitor visitor) {
      visitor.visit(this);
    }
  }

  /** Built-in relation "univ", "iden" or "none". */
  public static class Constant extends Exp {
    Constant(Pos pos, Op op) {
      super(pos, op);
      checkArgument(op == Op.UNIV || op == Op.IDEN || op == Op.NONE);
    }

    @Override
    AstWriter unparse(AstWriter w, int left, int right) {
      return w.append(op.lowerName());
    }

    @Override
    public void accept(Visitor visitor) {
      visitor.visit(this);
    }
  }

  /** Call to a prefix operator, such as "~r", "#r", "some r" or "not f". */
  public static class Unary extends Exp {
    public final Exp exp;

    Unary(Pos pos, Op op, Exp exp) {
      super(pos, op);
      this.exp = requireNonNull(exp);
    }

    @Override
    AstWriter unparse(AstWriter w, int left, int right) {
      return w.prefix(left, op, exp, right);
    }

    @Override
    public void accept(Visitor visitor) {
      visitor.visit(this);
    }
  }

  /** Call to an infix operator, such as "a + b", "p.spouse" or "a in b". */
  public static class Binary extends Exp {
    public final Exp left;
    public final Exp right;

    Binary(Pos pos, Op op, Exp left, Exp right) {
      super(pos, op);
      this.left = requireNonNull(left);
      this.right = requireNonNull(right);
    }

    @Override
    AstWriter unparse(AstWriter w, int left, int right) {
      return w.infix(left, this.left, op, this.right, right);
    }

    @Override
    public void accept(Visitor visitor) {
      visitor.visit(this);
    }
  }

  /**
   * Arrow product, possibly with multiplicities, such as "{@code A -> B}" or
   * "{@code A -> lone B}".
   */
  public static class Arrow extends Exp {
    public final Exp left;
    public final Mult leftMult;
    public final Mult rightMult;
    public final Exp right;

    Arrow(Pos pos, Exp left, Mult leftMult, Mult rightMult, Exp right) {
      super(pos, Op.PRODUCT);
      this.left = requireNonNull(left);
      this.leftMult = requireNonNull(leftMult);
      this.rightMult = requireNonNull(rightMult);
      this.right = requireNonNull(right);
    }

    /** Whether either side has a multiplicity other than "set". */
    public boolean hasMultiplicity() {
      return leftMult != Mult.SET || rightMult != Mult.SET;
    }

    @Override
    AstWriter unparse(AstWriter w, int left, int right) {
      if (left > op.left || op.right < right) {
        return unparse(w.append("("), 0, 0).append(")");
      }
      w.append(this.left, left, op.left);
      w.append(leftMult == Mult.SET ? "" : " " + leftMult.keyword());
      w.append(" ->");
      w.append(rightMult == Mult.SET ? " " : " " + rightMult.keyword() + " ");
      return w.append(this.right, op.right, right);
    }

    @Override
    public void accept(Visitor visitor) {
      visitor.visit(this);
    }
  }

  /** "{@code c implies a else b}", as a formula or an expression. */
  public static class Ite extends Exp {
    public final Exp condition;
    public final Exp ifTrue;
    public final Exp ifFalse;

    Ite(Pos pos, Exp condition, Exp ifTrue, Exp ifFalse) {
      super(pos, Op.ITE);
      this.condition = requireNonNull(condition);
      this.ifTrue = requireNonNull(ifTrue);
      this.ifFalse = requireNonNull(ifFalse);
    }

    @Override
    AstWriter unparse(AstWriter w, int left, int right) {
      if (left > op.left || op.right < right) {
        return unparse(w.append("("), 0, 0).append(")");
      }
      return w.append(condition, left, Op.IMPLIES.left)
          .append(" implies ")
          .append(ifTrue, Op.IMPLIES.right, op.left)
          .append(op.padded)
          .append(ifFalse, op.right, right);
    }

    @Override
    public void accept(Visitor visitor) {
      visitor.visit(this);
    }
  }

  /**
   * Box join or call, such as "{@code parents[p]}" or "{@code show[p, q]}";
   * occurs before resolution.
   */
  public static class Apply extends Exp {
    public final Exp fn;
    public final ImmutableList<Exp> args;

    Apply(Pos pos, Exp fn, ImmutableList<Exp> args) {
      super(pos, Op.APPLY);
      this.fn = requireNonNull(fn);
      this.args = requireNonNull(args);
    }

    @Override
    AstWriter unparse(AstWriter w, int left, int right) {
      return w.append(fn, left, op.left)
          .append("[")
          .appendAll(args, ", ")
          .append("]");
    }

    @Override
    public void accept(Visitor visitor) {
      visitor.visit(this);
    }
  }

  /**
   * Quantified formula, such as "{@code all p: Person | p !in p.^parents}".
   *
   * <p>The op is one of {@link Op#ALL}, {@link Op#SOME}, {@link Op#NO},
   * {@link Op#ONE}, {@link Op#LONE}.
   */
  public static class Quantified extends Exp {
    public final ImmutableList<VarDecl> decls;
    public final Exp body;

    Quantified(Pos pos, Op op, ImmutableList<VarDecl> decls, Exp body) {
      super(pos, op);
      this.decls = requireNonNull(decls);
      this.body = requireNonNull(body);
      checkArgument(!decls.isEmpty());
    }

    @Override
    AstWriter unparse(AstWriter w, int left, int right) {
      if (left > op.left || op.right < right) {
        return unparse(w.append("("), 0, 0).append(")");
      }
      return w.append(op.padded)
          .appendAll(decls, ", ")
          .append(" | ")
          .append(body, op.right, right);
    }

    @Override
    public void accept(Visitor visitor) {
      visitor.visit(this);
    }
  }

  /** Set comprehension, such as "{@code {p: Person | some p.spouse}}". */
  public static class Comprehension extends Exp {
    public final ImmutableList<VarDecl> decls;
    public final Exp body;

    Comprehension(Pos pos, ImmutableList<VarDecl> decls, Exp body) {
      super(pos, Op.COMPREHENSION);
      this.decls = requireNonNull(decls);
      this.body = requireNonNull(body);
    }

    @Override
    AstWriter unparse(AstWriter w, int left, int right) {
      return w.append("{")
          .appendAll(decls, ", ")
          .append(" | ")
          .append(body, 0, 0)
          .append("}");
    }

    @Override
    public void accept(Visitor visitor) {
      visitor.visit(this);
    }
  }

  /** "{@code let x = e | body}". */
  public static class Let extends Exp {
    public final Id name;
    public final Exp exp;
    public final Exp body;

    Let(Pos pos, Id name, Exp exp, Exp body) {
      super(pos, Op.LET);
      this.name = requireNonNull(name);
      this.exp = requireNonNull(exp);
      this.body = requireNonNull(body);
    }

    @Override
    AstWriter unparse(AstWriter w, int left, int right) {
      if (left > op.left || op.right < right) {
        return unparse(w.append("("), 0, 0).append(")");
      }
      return w.append("let ")
          .append(name.name)
          .append(" = ")
          .append(exp, 0, 0)
          .append(" | ")
          .append(body, op.right, right);
    }

    @Override
    public void accept(Visitor visitor) {
      visitor.visit(this);
    }
  }

  /** Conjunction of formulas written between braces. */
  public static class Block extends Exp {
    public final ImmutableList<Exp> exps;

    Block(Pos pos, ImmutableList<Exp> exps) {
      super(pos, Op.BLOCK);
      this.exps = requireNonNull(exps);
    }

    @Override
    AstWriter unparse(AstWriter w, int left, int right) {
      return w.append("{").appendAll(exps, " ").append("}");
    }

    @Override
    public void accept(Visitor visitor) {
      visitor.visit(this);
    }
  }

  /** Reference to a signature; occurs after resolution. */
  public static class SigRef extends Exp {
    public final Sig sig;

    SigRef(Pos pos, Sig sig) {
      super(pos, Op.SIG_REF);
      this.sig = requireNonNull(sig);
    }

    @Override
    AstWriter unparse(AstWriter w, int left, int right) {
      return w.append(sig.name);
    }

    @Override
    public void accept(Visitor visitor) {
      visitor.visit(this);
    }
  }

  /** Reference to a field; occurs after resolution. */
  public static class FieldRef extends Exp {
    public final Field field;

    FieldRef(Pos pos, Field field) {
      super(pos, Op.FIELD_REF);
      this.field = requireNonNull(field);
    }

    @Override
    AstWriter unparse(AstWriter w, int left, int right) {
      return w.append(field.name);
    }

    @Override
    public void accept(Visitor visitor) {
      visitor.visit(this);
    }
  }

  /**
   * Reference to a variable bound by a quantifier, comprehension, let,
   * parameter list, or the implicit "this"; occurs after resolution.
   */
  public static class VarRef extends Exp {
    public final String name;

    VarRef(Pos pos, String name) {
      super(pos, Op.VAR_REF);
      this.name = requireNonNull(name);
    }

    @Override
    AstWriter unparse(AstWriter w, int left, int right) {
      return w.append(name);
    }

    @Override
    public void accept(Visitor visitor) {
      visitor.visit(this);
    }
  }

  /** Call to a predicate or function; occurs after resolution. */
  public static class Call extends Exp {
    public final Function function;
    public final ImmutableList<Exp> args;

    Call(Pos pos, Function function, ImmutableList<Exp> args) {
      super(pos, Op.CALL);
      this.function = requireNonNull(function);
      this.args = requireNonNull(args);
    }

    @Override
    AstWriter unparse(AstWriter w, int left, int right) {
      w.append(function.name);
      if (args.isEmpty()) {
        return w;
      }
      return w.append("[").appendAll(args, ", ").append("]");
    }

    @Override
    public void accept(Visitor visitor) {
      visitor.visit(this);
    }
  }
}

// End Ast.java
