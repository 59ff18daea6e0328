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

import static java.util.Objects.requireNonNull;

import com.google.common.math.IntMath;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.HashMap;
import java.util.IdentityHashMap;
import java.util.List;
import java.util.Map;
import java.util.function.BiFunction;
import net.hydromatic.relm.ast.Ast;
import net.hydromatic.relm.ast.Op;
import net.hydromatic.relm.instance.Universe;
import net.hydromatic.relm.sat.BooleanMatrix;
import net.hydromatic.relm.sat.Counter;
import net.hydromatic.relm.sat.Sat;
import net.hydromatic.relm.type.Function;
import net.hydromatic.relm.type.Model;
import net.hydromatic.relm.type.Relation;
import net.hydromatic.relm.type.Sig;
import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * Translates resolved formulas to boolean circuits, and resolved expressions
 * to boolean matrices.
 *
 * <p>Each relation has a matrix whose cells are variables or constants (see
 * {@link BoundCompiler#primaryMatrices}). Quantifiers are unrolled over the
 * atoms that may be in their bound; calls to predicates and functions are
 * inlined. Sub-expressions without free variables are translated once.
 */
public class Translator {
  private final Sat sat;
  private final Model model;
  private final Universe universe;
  private final Map<Relation, BooleanMatrix> relations;
  private final Map<Ast.Exp, Boolean> closed = new IdentityHashMap<>();
  private final Map<Ast.Exp, Sat.Term> formulaCache = new IdentityHashMap<>();
  private final Map<Ast.Exp, BooleanMatrix> matrixCache =
      new IdentityHashMap<>();
  private final Deque<Function> callStack = new ArrayDeque<>();
  private @Nullable BooleanMatrix univ;

  public Translator(Sat sat, Model model, Universe universe,
      Map<Relation, BooleanMatrix> relations) {
    this.sat = requireNonNull(sat);
    this.model = requireNonNull(model);
    this.universe = requireNonNull(universe);
    this.relations = requireNonNull(relations);
  }

  private int n() {
    return universe.size();
  }

  /** Whether an expression has no free variables. */
  private boolean isClosed(Ast.Exp exp) {
    return closed.computeIfAbsent(exp,
        e -> FreeFinder.freeVars(e).isEmpty());
  }

  // formulas

  /** Translates a formula to a boolean term. */
  public Sat.Term formula(Ast.Exp exp, Environment<BooleanMatrix> env) {
    if (isClosed(exp)) {
      final Sat.Term cached = formulaCache.get(exp);
      if (cached != null) {
        return cached;
      }
      final Sat.Term term = formula_(exp, env);
      formulaCache.put(exp, term);
      return term;
    }
    return formula_(exp, env);
  }

  private Sat.Term formula_(Ast.Exp exp, Environment<BooleanMatrix> env) {
    switch (exp.op) {
      case NOT:
        return sat.not(formula(((Ast.Unary) exp).exp, env));

      case AND:
        final Ast.Binary and = (Ast.Binary) exp;
        final Sat.Term andLeft = formula(and.left, env);
        if (andLeft == Sat.FALSE) {
          return Sat.FALSE;
        }
        return sat.and(andLeft, formula(and.right, env));

      case OR:
        final Ast.Binary or = (Ast.Binary) exp;
        final Sat.Term orLeft = formula(or.left, env);
        if (orLeft == Sat.TRUE) {
          return Sat.TRUE;
        }
        return sat.or(orLeft, formula(or.right, env));

      case IMPLIES:
        final Ast.Binary implies = (Ast.Binary) exp;
        final Sat.Term premise = formula(implies.left, env);
        if (premise == Sat.FALSE) {
          return Sat.TRUE;
        }
        return sat.implies(premise, formula(implies.right, env));

      case IFF:
        final Ast.Binary iff = (Ast.Binary) exp;
        return sat.iff(formula(iff.left, env), formula(iff.right, env));

      case ITE:
        final Ast.Ite ite = (Ast.Ite) exp;
        final Sat.Term condition = formula(ite.condition, env);
        if (condition.isConstant()) {
          return formula(condition == Sat.TRUE ? ite.ifTrue : ite.ifFalse,
              env);
        }
        return sat.ite(condition, formula(ite.ifTrue, env),
            formula(ite.ifFalse, env));

      case BLOCK:
        final List<Sat.Term> conjuncts = new ArrayList<>();
        for (Ast.Exp e : ((Ast.Block) exp).exps) {
          final Sat.Term term = formula(e, env);
          if (term == Sat.FALSE) {
            return Sat.FALSE;
          }
          conjuncts.add(term);
        }
        return sat.and(conjuncts);

      case NO_EXP:
        return matrix(((Ast.Unary) exp).exp, env).no();
      case SOME_EXP:
        return matrix(((Ast.Unary) exp).exp, env).some();
      case ONE_EXP:
        return matrix(((Ast.Unary) exp).exp, env).one();
      case LONE_EXP:
        return matrix(((Ast.Unary) exp).exp, env).lone();

      case IN:
      case NOT_IN:
      case EQ:
      case NE:
      case LT:
      case LE:
      case GT:
      case GE:
        return comparison((Ast.Binary) exp, env);

      case ALL:
      case SOME:
      case NO:
      case ONE:
      case LONE:
        return quantified((Ast.Quantified) exp, env);

      case LET:
        final Ast.Let let = (Ast.Let) exp;
        return formula(let.body,
            env.bind(let.name.name, matrix(let.exp, env)));

      case CALL:
        final Ast.Call call = (Ast.Call) exp;
        if (!call.function.isPredicate) {
          throw new TranslationException(
              "expected a formula, but '" + exp + "' is a call to "
                  + call.function,
              exp.pos);
        }
        return inline(call, env, this::formula);

      default:
        throw new TranslationException(
            "expected a formula, but got '" + exp + "'", exp.pos);
    }
  }

  private Sat.Term comparison(Ast.Binary binary,
      Environment<BooleanMatrix> env) {
    if (isInt(binary.left) || isInt(binary.right)) {
      return intComparison(binary, env);
    }
    final BooleanMatrix left = matrix(binary.left, env);
    final BooleanMatrix right = matrix(binary.right, env);
    checkArity(binary, left, right);
    switch (binary.op) {
      case IN:
        return left.in(right);
      case NOT_IN:
        return sat.not(left.in(right));
      case EQ:
        return left.eq(right);
      case NE:
        return sat.not(left.eq(right));
      default:
        throw new TranslationException(
            "cannot compare relations with '" + binary.op.padded.trim()
                + "' in '" + binary + "'",
            binary.pos);
    }
  }

  /** Whether an expression is an integer: a literal or a cardinality. */
  private static boolean isInt(Ast.Exp exp) {
    switch (exp.op) {
      case INT_LITERAL:
      case CARDINALITY:
        return true;
      case LET:
        return isInt(((Ast.Let) exp).body);
      default:
        return false;
    }
  }

  private Sat.Term intComparison(Ast.Binary binary,
      Environment<BooleanMatrix> env) {
    if (binary.left.op == Op.INT_LITERAL
        && binary.right.op == Op.INT_LITERAL) {
      final int c = Integer.compare(((Ast.IntLiteral) binary.left).value,
          ((Ast.IntLiteral) binary.right).value);
      return constantComparison(binary, c);
    }
    // A count compared with a literal k only needs to distinguish up to k+1;
    // a literal is capped one above the largest value the count can reach.
    final Counter left;
    final Counter right;
    if (binary.left.op == Op.INT_LITERAL) {
      right = counter(binary.right, env, limit(binary.left));
      left = counter(binary.left, env, cap(right));
    } else {
      left = counter(binary.left, env, limit(binary.right));
      right = counter(binary.right, env, cap(left));
    }
    switch (binary.op) {
      case EQ:
        return left.eq(right);
      case NE:
        return sat.not(left.eq(right));
      case LT:
        return left.lt(right);
      case LE:
        return left.le(right);
      case GT:
        return right.lt(left);
      case GE:
        return right.le(left);
      default:
        throw new TranslationException(
            "cannot compare integers with '" + binary.op.padded.trim()
                + "' in '" + binary + "'",
            binary.pos);
    }
  }

  private static Sat.Term constantComparison(Ast.Binary binary, int c) {
    final boolean b;
    switch (binary.op) {
      case EQ:
        b = c == 0;
        break;
      case NE:
        b = c != 0;
        break;
      case LT:
        b = c < 0;
        break;
      case LE:
        b = c <= 0;
        break;
      case GT:
        b = c > 0;
        break;
      case GE:
        b = c >= 0;
        break;
      default:
        throw new TranslationException(
            "cannot compare integers with '" + binary.op.padded.trim()
                + "' in '" + binary + "'",
            binary.pos);
    }
    return b ? Sat.TRUE : Sat.FALSE;
  }

  private static int limit(Ast.Exp other) {
    if (other instanceof Ast.IntLiteral) {
      return IntMath.saturatedAdd(((Ast.IntLiteral) other).value, 1);
    }
    return Integer.MAX_VALUE;
  }

  private static int cap(Counter other) {
    return other.isExact()
        ? IntMath.saturatedAdd(other.max(), 1)
        : Integer.MAX_VALUE;
  }

  private Counter counter(Ast.Exp exp, Environment<BooleanMatrix> env,
      int limit) {
    switch (exp.op) {
      case INT_LITERAL:
        return Counter.constant(sat,
            Math.min(((Ast.IntLiteral) exp).value, limit));
      case CARDINALITY:
        return matrix(((Ast.Unary) exp).exp, env).count(limit);
      case LET:
        final Ast.Let let = (Ast.Let) exp;
        return counter(let.body,
            env.bind(let.name.name, matrix(let.exp, env)), limit);
      default:
        throw new TranslationException(
            "expected an integer, but got '" + exp + "'", exp.pos);
    }
  }

  private Sat.Term quantified(Ast.Quantified quantified,
      Environment<BooleanMatrix> env) {
    final List<Sat.Term> terms = new ArrayList<>();
    switch (quantified.op) {
      case ALL:
        unroll(quantified.decls, env, (env2, guard, atoms) -> {
          final Sat.Term term =
              sat.implies(guard, formula(quantified.body, env2));
          terms.add(term);
          return term != Sat.FALSE;
        });
        return sat.and(terms);

      case SOME:
      case NO:
        unroll(quantified.decls, env, (env2, guard, atoms) -> {
          final Sat.Term term = sat.and(guard, formula(quantified.body, env2));
          terms.add(term);
          return term != Sat.TRUE;
        });
        final Sat.Term some = sat.or(terms);
        return quantified.op == Op.SOME ? some : sat.not(some);

      case ONE:
      case LONE:
        unroll(quantified.decls, env, (env2, guard, atoms) -> {
          terms.add(sat.and(guard, formula(quantified.body, env2)));
          return true;
        });
        final Sat.Term lone = lone(terms);
        return quantified.op == Op.LONE ? lone : sat.and(sat.or(terms), lone);

      default:
        throw new AssertionError(quantified.op);
    }
  }

  /**
   * Returns the condition that at most one of a list of terms is true, using
   * a chain of prefix disjunctions.
   */
  private Sat.Term lone(List<Sat.Term> terms) {
    final List<Sat.Term> conjuncts = new ArrayList<>();
    Sat.Term seen = Sat.FALSE;
    for (Sat.Term term : terms) {
      conjuncts.add(sat.not(sat.and(seen, term)));
      seen = sat.or(seen, term);
    }
    return sat.and(conjuncts);
  }

  /**
   * Calls a consumer for each assignment of atoms to the variables of a list
   * of declarations, with the condition that each atom is in its variable's
   * bound. Stops early if the consumer returns false.
   */
  private void unroll(List<Ast.VarDecl> decls, Environment<BooleanMatrix> env,
      Assignment consumer) {
    unroll(decls, 0, env, Sat.TRUE, new ArrayList<>(), consumer);
  }

  private boolean unroll(List<Ast.VarDecl> decls, int i,
      Environment<BooleanMatrix> env, Sat.Term guard, List<Integer> atoms,
      Assignment consumer) {
    if (i == decls.size()) {
      return consumer.accept(env, guard, atoms);
    }
    final Ast.VarDecl decl = decls.get(i);
    final BooleanMatrix domain = matrix(decl.exp, env);
    if (domain.arity != 1) {
      throw new TranslationException(
          "variable must range over a unary expression, but '" + decl.exp
              + "' has arity " + domain.arity,
          decl.pos);
    }
    return unrollNames(decls, i, 0, domain, env, guard, atoms, consumer);
  }

  /** Assigns atoms to the variables of one declaration. */
  private boolean unrollNames(List<Ast.VarDecl> decls, int i, int j,
      BooleanMatrix domain, Environment<BooleanMatrix> env, Sat.Term guard,
      List<Integer> atoms, Assignment consumer) {
    final Ast.VarDecl decl = decls.get(i);
    if (j == decl.names.size()) {
      return unroll(decls, i + 1, env, guard, atoms, consumer);
    }
    for (Map.Entry<Integer, Sat.Term> cell : domain.cells().entrySet()) {
      final int atom = cell.getKey();
      if (decl.disj
          && atoms.subList(atoms.size() - j, atoms.size()).contains(atom)) {
        continue;
      }
      final Sat.Term guard2 = sat.and(guard, cell.getValue());
      if (guard2 == Sat.FALSE) {
        continue;
      }
      atoms.add(atom);
      final boolean more =
          unrollNames(decls, i, j + 1, domain,
              env.bind(decl.names.get(j).name,
                  BooleanMatrix.atom(sat, n(), atom)),
              guard2, atoms, consumer);
      atoms.remove(atoms.size() - 1);
      if (!more) {
        return false;
      }
    }
    return true;
  }

  /** Translates the body of a predicate or function for a call. */
  private <T> T inline(Ast.Call call, Environment<BooleanMatrix> env,
      BiFunction<Ast.Exp, Environment<BooleanMatrix>, T> translate) {
    final Function function = call.function;
    if (callStack.contains(function)) {
      throw new TranslationException("recursive call to " + function,
          call.pos);
    }
    final List<String> names = function.paramNames();
    Environment<BooleanMatrix> env2 = Environment.empty();
    for (int i = 0; i < names.size(); i++) {
      env2 = env2.bind(names.get(i), matrix(call.args.get(i), env));
    }
    callStack.push(function);
    try {
      return translate.apply(function.body(), env2);
    } finally {
      callStack.pop();
    }
  }

  // expressions

  /** Translates a relational expression to a matrix. */
  public BooleanMatrix matrix(Ast.Exp exp, Environment<BooleanMatrix> env) {
    if (isClosed(exp)) {
      final BooleanMatrix cached = matrixCache.get(exp);
      if (cached != null) {
        return cached;
      }
      final BooleanMatrix matrix = matrix_(exp, env);
      matrixCache.put(exp, matrix);
      return matrix;
    }
    return matrix_(exp, env);
  }

  private BooleanMatrix matrix_(Ast.Exp exp, Environment<BooleanMatrix> env) {
    switch (exp.op) {
      case SIG_REF:
        return relation(((Ast.SigRef) exp).sig);

      case FIELD_REF:
        return relation(((Ast.FieldRef) exp).field);

      case VAR_REF:
        final String name = ((Ast.VarRef) exp).name;
        final BooleanMatrix value = env.getOpt(name);
        if (value == null) {
          throw new TranslationException("unbound variable '" + name + "'",
              exp.pos);
        }
        return value;

      case UNIV:
        return univ();

      case IDEN:
        return iden();

      case NONE:
        return BooleanMatrix.empty(sat, n(), 1);

      case UNION:
      case INTERSECT:
      case DIFFERENCE:
      case OVERRIDE:
        final Ast.Binary binary = (Ast.Binary) exp;
        final BooleanMatrix left = matrix(binary.left, env);
        final BooleanMatrix right = matrix(binary.right, env);
        checkArity(binary, left, right);
        switch (exp.op) {
          case UNION:
            return left.union(right);
          case INTERSECT:
            return left.intersect(right);
          case DIFFERENCE:
            return left.difference(right);
          default:
            return left.override(right);
        }

      case JOIN:
        final Ast.Binary join = (Ast.Binary) exp;
        final BooleanMatrix joinLeft = matrix(join.left, env);
        final BooleanMatrix joinRight = matrix(join.right, env);
        if (joinLeft.arity + joinRight.arity <= 2) {
          throw new TranslationException(
              "cannot join two unary expressions in '" + exp + "'", exp.pos);
        }
        return joinLeft.join(joinRight);

      case PRODUCT:
        final Ast.Arrow arrow = (Ast.Arrow) exp;
        return matrix(arrow.left, env).product(matrix(arrow.right, env));

      case DOMAIN:
        final Ast.Binary domain = (Ast.Binary) exp;
        return matrix(domain.right, env)
            .restrictDomain(unary(domain.left, env));

      case RANGE:
        final Ast.Binary range = (Ast.Binary) exp;
        return matrix(range.left, env).restrictRange(unary(range.right, env));

      case TRANSPOSE:
        return binary((Ast.Unary) exp, env).transpose();

      case CLOSURE:
        return binary((Ast.Unary) exp, env).closure();

      case REFLEXIVE_CLOSURE:
        return binary((Ast.Unary) exp, env).closure().union(iden());

      case ITE:
        final Ast.Ite ite = (Ast.Ite) exp;
        final Sat.Term condition = formula(ite.condition, env);
        if (condition.isConstant()) {
          return matrix(condition == Sat.TRUE ? ite.ifTrue : ite.ifFalse,
              env);
        }
        final BooleanMatrix ifTrue = matrix(ite.ifTrue, env);
        final BooleanMatrix ifFalse = matrix(ite.ifFalse, env);
        if (ifTrue.arity != ifFalse.arity) {
          throw new TranslationException(
              "arity mismatch in branches of '" + exp + "'", exp.pos);
        }
        return ifTrue.choice(condition, ifFalse);

      case LET:
        final Ast.Let let = (Ast.Let) exp;
        return matrix(let.body,
            env.bind(let.name.name, matrix(let.exp, env)));

      case CALL:
        final Ast.Call call = (Ast.Call) exp;
        if (call.function.isPredicate) {
          throw new TranslationException(
              "expected an expression, but '" + exp + "' is a call to "
                  + call.function,
              exp.pos);
        }
        return inline(call, env, this::matrix);

      case COMPREHENSION:
        return comprehension((Ast.Comprehension) exp, env);

      default:
        throw new TranslationException(
            "expected a relational expression, but got '" + exp + "'",
            exp.pos);
    }
  }

  private BooleanMatrix comprehension(Ast.Comprehension comprehension,
      Environment<BooleanMatrix> env) {
    final Map<Integer, Sat.Term> cells = new HashMap<>();
    final int[] arity = {0};
    comprehension.decls.forEach(decl -> arity[0] += decl.names.size());
    unroll(comprehension.decls, env, (env2, guard, atoms) -> {
      final int[] columns = new int[atoms.size()];
      for (int i = 0; i < columns.length; i++) {
        columns[i] = atoms.get(i);
      }
      cells.put(universe.encode(columns),
          sat.and(guard, formula(comprehension.body, env2)));
      return true;
    });
    return BooleanMatrix.of(sat, n(), arity[0], cells);
  }

  private BooleanMatrix relation(Relation relation) {
    final BooleanMatrix matrix = relations.get(relation);
    if (matrix == null) {
      throw new TranslationException("relation '" + relation
          + "' has no bounds", relation.pos);
    }
    return matrix;
  }

  /** Returns the matrix of "univ", the atoms of the top-level signatures. */
  private BooleanMatrix univ() {
    if (univ == null) {
      BooleanMatrix m = BooleanMatrix.empty(sat, n(), 1);
      for (Sig sig : model.topLevelSigs()) {
        m = m.union(relation(sig));
      }
      univ = m;
    }
    return univ;
  }

  /** Returns the matrix of "iden", pairs (a, a) for each atom a of univ. */
  private BooleanMatrix iden() {
    final Map<Integer, Sat.Term> cells = new HashMap<>();
    univ().cells().forEach((atom, term) ->
        cells.put(universe.encode(atom, atom), term));
    return BooleanMatrix.of(sat, n(), 2, cells);
  }

  private BooleanMatrix unary(Ast.Exp exp, Environment<BooleanMatrix> env) {
    final BooleanMatrix matrix = matrix(exp, env);
    if (matrix.arity != 1) {
      throw new TranslationException(
          "expected a unary expression, but '" + exp + "' has arity "
              + matrix.arity,
          exp.pos);
    }
    return matrix;
  }

  private BooleanMatrix binary(Ast.Unary unary,
      Environment<BooleanMatrix> env) {
    final BooleanMatrix matrix = matrix(unary.exp, env);
    if (matrix.arity != 2) {
      throw new TranslationException(
          "operand of '" + unary.op.padded + "' must be binary, but '"
              + unary.exp + "' has arity " + matrix.arity,
          unary.pos);
    }
    return matrix;
  }

  private static void checkArity(Ast.Binary binary, BooleanMatrix left,
      BooleanMatrix right) {
    if (left.arity != right.arity) {
      throw new TranslationException(
          "arity mismatch in '" + binary + "': " + left.arity + " and "
              + right.arity,
          binary.pos);
    }
  }

  /** Receives an assignment of atoms to quantified variables. */
  @FunctionalInterface
  private interface Assignment {
    /** Returns whether to continue with the next assignment. */
    boolean accept(Environment<BooleanMatrix> env, Sat.Term guard,
        List<Integer> atoms);
  }
}

// End Translator.java
