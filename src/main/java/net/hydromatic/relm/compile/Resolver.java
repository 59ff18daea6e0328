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
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import net.hydromatic.relm.ast.Ast;
import net.hydromatic.relm.ast.Op;
import net.hydromatic.relm.ast.Pos;
import net.hydromatic.relm.ast.Visitor;
import net.hydromatic.relm.type.Command;
import net.hydromatic.relm.type.Fact;
import net.hydromatic.relm.type.Field;
import net.hydromatic.relm.type.Function;
import net.hydromatic.relm.type.Model;
import net.hydromatic.relm.type.RelType;
import net.hydromatic.relm.type.Sig;
import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * Resolves the names in a parsed module and checks types, producing a
 * {@link Model}.
 *
 * <p>Identifiers become references to signatures, fields, variables, or calls
 * to predicates and functions; box joins become joins. Errors are reported as
 * a {@link TranslationException} that names the paragraph being resolved.
 */
public class Resolver {
  private final Ast.Module module;
  private final Map<String, Sig> sigs = new LinkedHashMap<>();
  private final Map<String, Field> fields = new LinkedHashMap<>();
  private final Map<String, Function> functions = new LinkedHashMap<>();
  private final Map<Function, List<RelType>> paramTypes = new HashMap<>();
  private final Map<String, Fact> assertions = new LinkedHashMap<>();
  private int ordinal = 0;

  /** Paragraph being resolved, e.g. "fact Acyclic"; used in messages. */
  private String context = "";

  /** Signature whose fields may be used without "this.", or null. */
  private @Nullable Sig implicitThis;

  private Resolver(Ast.Module module) {
    this.module = module;
  }

  /** Resolves a module. */
  public static Model resolve(Ast.Module module) {
    return new Resolver(module).resolve();
  }

  private Model resolve() {
    resolveSigs();
    resolveFields();
    resolveFunctionHeaders();
    resolveFunctionBodies();
    checkRecursion();
    final List<Fact> facts = resolveFacts();
    final ImmutableMap<Sig, Ast.Exp> appendedFacts = resolveAppendedFacts();
    resolveAssertions();
    final List<Command> commands = resolveCommands();
    return new Model(ImmutableList.copyOf(sigs.values()),
        ImmutableList.copyOf(fields.values()), facts, appendedFacts,
        ImmutableMap.copyOf(functions), ImmutableMap.copyOf(assertions),
        commands);
  }

  private TranslationException error(Pos pos, String message) {
    return new TranslationException(
        context.isEmpty() ? message : message + " in " + context, pos);
  }

  // signatures and fields

  private void resolveSigs() {
    final Map<String, Ast.SigDecl> declOf = new LinkedHashMap<>();
    final Map<String, Ast.Id> idOf = new HashMap<>();
    for (Ast.SigDecl decl : module.decls(Ast.SigDecl.class)) {
      for (Ast.Id id : decl.names) {
        if (declOf.put(id.name, decl) != null) {
          throw error(id.pos, "duplicate signature '" + id.name + "'");
        }
        idOf.put(id.name, id);
      }
    }
    final Map<String, Integer> ordinals = new HashMap<>();
    for (String name : declOf.keySet()) {
      ordinals.put(name, ordinal++);
    }

    // Create each signature after its parent and supersets.
    final List<String> pending = new ArrayList<>(declOf.keySet());
    while (!pending.isEmpty()) {
      boolean progress = false;
      for (String name : new ArrayList<>(pending)) {
        final Ast.SigDecl decl = declOf.get(name);
        context = "sig " + name;
        final List<Ast.Id> ancestors = new ArrayList<>(decl.supersets);
        if (decl.parent != null) {
          ancestors.add(decl.parent);
        }
        boolean ready = true;
        for (Ast.Id id : ancestors) {
          if (!declOf.containsKey(id.name)) {
            throw error(id.pos, "unknown signature '" + id.name + "'");
          }
          ready &= sigs.containsKey(id.name);
        }
        if (!ready) {
          continue;
        }
        Sig parent = null;
        if (decl.parent != null) {
          parent = sigs.get(decl.parent.name);
          if (parent.isSubset()) {
            throw error(decl.parent.pos,
                "cannot extend subset signature '" + parent.name + "'");
          }
        }
        final ImmutableList.Builder<Sig> supersets = ImmutableList.builder();
        for (Ast.Id id : decl.supersets) {
          supersets.add(sigs.get(id.name));
        }
        sigs.put(name,
            new Sig(name, idOf.get(name).pos, ordinals.get(name),
                decl.isAbstract, decl.mult, parent, supersets.build()));
        pending.remove(name);
        progress = true;
      }
      if (!progress) {
        final String name = pending.get(0);
        context = "sig " + name;
        throw error(idOf.get(name).pos, "cyclic signature hierarchy");
      }
    }
    context = "";
  }

  private void resolveFields() {
    for (Ast.SigDecl decl : module.decls(Ast.SigDecl.class)) {
      for (Ast.Id sigName : decl.names) {
        final Sig sig = sigs.get(sigName.name);
        context = "sig " + sig.name;
        implicitThis = sig;
        final Environment<RelType> env =
            Environment.<RelType>empty().bind("this", RelType.of(sig));
        for (Ast.FieldDecl fieldDecl : decl.fields) {
          final Typed t = resolveDeclExp(fieldDecl.exp, env);
          final Ast.Mult mult;
          if (fieldDecl.mult != null) {
            mult = fieldDecl.mult;
          } else {
            mult = t.type.arity == 1 ? Ast.Mult.ONE : Ast.Mult.SET;
          }
          for (Ast.Id id : fieldDecl.names) {
            if (fields.containsKey(id.name)) {
              throw error(id.pos, "duplicate field '" + id.name + "'");
            }
            if (sigs.containsKey(id.name)) {
              throw error(id.pos,
                  "field '" + id.name + "' has the same name as a signature");
            }
            fields.put(id.name,
                new Field(id.name, id.pos, ordinal++, sig, fieldDecl.disj,
                    mult, t.exp, RelType.of(sig).product(t.type)));
          }
        }
      }
    }
    implicitThis = null;
    context = "";
  }

  // predicates and functions

  private void resolveFunctionHeaders() {
    for (Ast.PredDecl decl : module.decls(Ast.PredDecl.class)) {
      final String name = decl.name.name;
      final boolean isPredicate = decl.op == Op.PRED_DECL;
      context = (isPredicate ? "pred " : "fun ") + name;
      if (functions.containsKey(name)
          || sigs.containsKey(name)
          || fields.containsKey(name)) {
        throw error(decl.name.pos, "duplicate name '" + name + "'");
      }
      final List<Ast.VarDecl> params = new ArrayList<>();
      final List<RelType> types = new ArrayList<>();
      final Environment<RelType> env =
          resolveDecls(decl.params, Environment.empty(), params, types, false);
      final RelType returnType;
      if (decl.returnType != null) {
        final Typed t = resolve(decl.returnType, env);
        requireRelation(t);
        returnType = t.type;
      } else {
        returnType = RelType.FORMULA;
      }
      final Function function =
          new Function(name, decl.pos, isPredicate,
              ImmutableList.copyOf(params), returnType);
      functions.put(name, function);
      paramTypes.put(function, types);
    }
    context = "";
  }

  private void resolveFunctionBodies() {
    for (Ast.PredDecl decl : module.decls(Ast.PredDecl.class)) {
      final Function function = functions.get(decl.name.name);
      context = function.toString();
      Environment<RelType> env = Environment.empty();
      final List<String> names = function.paramNames();
      final List<RelType> types = paramTypes.get(function);
      for (int i = 0; i < names.size(); i++) {
        env = env.bind(names.get(i), types.get(i));
      }
      final Typed body = resolve(decl.body, env);
      if (function.isPredicate) {
        requireFormula(body);
      } else {
        requireRelation(body);
        if (body.type.arity != function.returnType.arity) {
          throw error(decl.body.pos,
              "body has arity " + body.type.arity
                  + " but declared type has arity "
                  + function.returnType.arity);
        }
      }
      function.setBody(body.exp);
    }
    context = "";
  }

  /** Throws if a predicate or function calls itself, directly or not. */
  private void checkRecursion() {
    final Set<Function> done = new LinkedHashSet<>();
    for (Function function : functions.values()) {
      checkRecursion(function, new LinkedHashSet<>(), done);
    }
  }

  private void checkRecursion(Function function, Set<Function> active,
      Set<Function> done) {
    if (done.contains(function)) {
      return;
    }
    if (!active.add(function)) {
      context = function.toString();
      throw error(function.pos, "recursive call to " + function);
    }
    for (Function callee : callees(function.body())) {
      checkRecursion(callee, active, done);
    }
    active.remove(function);
    done.add(function);
  }

  /** Returns the predicates and functions called by an expression. */
  static Set<Function> callees(Ast.Exp exp) {
    final Set<Function> callees = new LinkedHashSet<>();
    exp.accept(
        new Visitor() {
          @Override protected void visit(Ast.Call call) {
            callees.add(call.function);
            super.visit(call);
          }
        });
    return callees;
  }

  // facts, assertions and commands

  private List<Fact> resolveFacts() {
    final List<Fact> facts = new ArrayList<>();
    final Set<String> names = new LinkedHashSet<>();
    int anonymous = 0;
    for (Ast.FactDecl decl : module.decls(Ast.FactDecl.class)) {
      final String name =
          decl.name != null ? decl.name.name : "fact$" + anonymous++;
      context = "fact " + name;
      if (!names.add(name)) {
        throw error(decl.pos, "duplicate fact '" + name + "'");
      }
      final Typed body = resolve(decl.body, Environment.empty());
      requireFormula(body);
      facts.add(new Fact(name, decl.pos, body.exp));
    }
    context = "";
    return facts;
  }

  private ImmutableMap<Sig, Ast.Exp> resolveAppendedFacts() {
    final ImmutableMap.Builder<Sig, Ast.Exp> b = ImmutableMap.builder();
    for (Ast.SigDecl decl : module.decls(Ast.SigDecl.class)) {
      if (decl.appendedFact == null) {
        continue;
      }
      for (Ast.Id id : decl.names) {
        final Sig sig = sigs.get(id.name);
        context = "sig " + sig.name;
        implicitThis = sig;
        final Typed body =
            resolve(decl.appendedFact,
                Environment.<RelType>empty().bind("this", RelType.of(sig)));
        requireFormula(body);
        b.put(sig, body.exp);
      }
    }
    implicitThis = null;
    context = "";
    return b.build();
  }

  private void resolveAssertions() {
    for (Ast.AssertDecl decl : module.decls(Ast.AssertDecl.class)) {
      final String name = decl.name.name;
      context = "assert " + name;
      if (assertions.containsKey(name)) {
        throw error(decl.name.pos, "duplicate assertion '" + name + "'");
      }
      final Typed body = resolve(decl.body, Environment.empty());
      requireFormula(body);
      assertions.put(name, new Fact(name, decl.pos, body.exp));
    }
    context = "";
  }

  private List<Command> resolveCommands() {
    final List<Command> commands = new ArrayList<>();
    final Set<String> labels = new LinkedHashSet<>();
    int i = 0;
    for (Ast.Command decl : module.decls(Ast.Command.class)) {
      final boolean check = decl.op == Op.CHECK;
      ++i;
      String label =
          decl.target != null
              ? decl.target.name
              : (check ? "check$" : "run$") + i;
      if (!labels.add(label)) {
        label = label + "$" + i;
        labels.add(label);
      }
      context = "command " + label;
      final Ast.Exp formula =
          check ? checkFormula(decl) : runFormula(decl);
      commands.add(
          new Command(label, decl.pos, check, formula, decl.overall,
              resolveScopes(decl), decl.expect));
    }
    context = "";
    return commands;
  }

  /**
   * Returns the formula that an instance found by "run" must satisfy: the
   * body of the predicate, with its parameters existentially quantified.
   */
  private Ast.Exp runFormula(Ast.Command decl) {
    if (decl.body != null) {
      final Typed body = resolve(decl.body, Environment.empty());
      requireFormula(body);
      return body.exp;
    }
    final Ast.Id target = target(decl);
    final Function function = functions.get(target.name);
    if (function == null) {
      throw error(target.pos, "unknown predicate '" + target.name + "'");
    }
    final List<Ast.Exp> args = new ArrayList<>();
    for (String name : function.paramNames()) {
      args.add(ast.varRef(target.pos, name));
    }
    final Ast.Exp call = ast.call(target.pos, function, args);
    final Ast.Exp formula =
        function.isPredicate ? call : ast.unary(target.pos, Op.SOME_EXP, call);
    if (function.params.isEmpty()) {
      return formula;
    }
    for (RelType type : paramTypes.get(function)) {
      if (type.arity != 1) {
        throw error(target.pos,
            "cannot run " + function + " because it has a parameter of arity "
                + type.arity);
      }
    }
    return ast.quantified(target.pos, Op.SOME, function.params, formula);
  }

  /**
   * Returns the formula that a counterexample found by "check" must satisfy:
   * the negation of the assertion.
   */
  private Ast.Exp checkFormula(Ast.Command decl) {
    if (decl.body != null) {
      final Typed body = resolve(decl.body, Environment.empty());
      requireFormula(body);
      return ast.not(decl.body.pos, body.exp);
    }
    final Ast.Id target = target(decl);
    final Fact assertion = assertions.get(target.name);
    if (assertion == null) {
      throw error(target.pos, "unknown assertion '" + target.name + "'");
    }
    return ast.not(target.pos, assertion.formula);
  }

  private static Ast.Id target(Ast.Command decl) {
    if (decl.target == null) {
      throw new AssertionError("command has neither target nor body");
    }
    return decl.target;
  }

  private ImmutableList<Command.SigScope> resolveScopes(Ast.Command decl) {
    final Map<Sig, Command.SigScope> scopes = new LinkedHashMap<>();
    for (Ast.TypeScope typeScope : decl.scopes) {
      final Sig sig = sigs.get(typeScope.sig.name);
      if (sig == null) {
        throw new ScopeException(
            "unknown signature '" + typeScope.sig.name + "' in scope of "
                + context,
            typeScope.sig.pos);
      }
      final Command.SigScope scope =
          new Command.SigScope(sig, typeScope.count, typeScope.exactly,
              typeScope.pos);
      if (scopes.put(sig, scope) != null) {
        throw new ScopeException(
            "signature '" + sig.name + "' has more than one scope in "
                + context,
            typeScope.pos);
      }
    }
    return ImmutableList.copyOf(scopes.values());
  }

  // expressions

  /**
   * Resolves declarations, binding each variable in the scope of the next
   * declaration; adds resolved declarations and the type of each variable to
   * lists, and returns the environment that binds all variables.
   */
  private Environment<RelType> resolveDecls(List<Ast.VarDecl> decls,
      Environment<RelType> env, List<Ast.VarDecl> resolvedDecls,
      List<RelType> types, boolean unary) {
    for (Ast.VarDecl decl : decls) {
      final Typed t = resolve(decl.exp, env);
      requireRelation(t);
      if (unary && t.type.arity != 1) {
        throw error(decl.exp.pos,
            "variable must range over a unary expression, but '" + decl.exp
                + "' has arity " + t.type.arity);
      }
      resolvedDecls.add(ast.varDecl(decl.pos, decl.disj, decl.names, t.exp));
      for (Ast.Id id : decl.names) {
        types.add(t.type);
        env = env.bind(id.name, t.type);
      }
    }
    return env;
  }

  /** Resolves the type of a field, which may have arrow multiplicities. */
  private Typed resolveDeclExp(Ast.Exp exp, Environment<RelType> env) {
    if (exp instanceof Ast.Arrow) {
      final Ast.Arrow arrow = (Ast.Arrow) exp;
      final Typed left = resolveDeclExp(arrow.left, env);
      final Typed right = resolveDeclExp(arrow.right, env);
      requireRelation(left);
      requireRelation(right);
      return new Typed(
          ast.arrow(arrow.pos, left.exp, arrow.leftMult, arrow.rightMult,
              right.exp),
          left.type.product(right.type));
    }
    final Typed t = resolve(exp, env);
    requireRelation(t);
    return t;
  }

  private Typed resolve(Ast.Exp exp, Environment<RelType> env) {
    switch (exp.op) {
      case ID:
        return resolveId((Ast.Id) exp, env);

      case INT_LITERAL:
        return new Typed(exp, RelType.INT);

      case UNIV:
        return new Typed(exp, RelType.univ(1));

      case IDEN:
        return new Typed(exp, RelType.univ(2));

      case NONE:
        return new Typed(exp, RelType.empty(1));

      case NOT:
        final Ast.Unary not = (Ast.Unary) exp;
        final Typed notArg = resolve(not.exp, env);
        requireFormula(notArg);
        return new Typed(ast.not(exp.pos, notArg.exp), RelType.FORMULA);

      case NO_EXP:
      case SOME_EXP:
      case ONE_EXP:
      case LONE_EXP:
        final Typed multArg = resolve(((Ast.Unary) exp).exp, env);
        requireRelation(multArg);
        return new Typed(ast.unary(exp.pos, exp.op, multArg.exp),
            RelType.FORMULA);

      case CARDINALITY:
        final Typed countArg = resolve(((Ast.Unary) exp).exp, env);
        requireRelation(countArg);
        return new Typed(ast.unary(exp.pos, exp.op, countArg.exp), RelType.INT);

      case TRANSPOSE:
      case CLOSURE:
      case REFLEXIVE_CLOSURE:
        return resolveBinaryRelationOp((Ast.Unary) exp, env);

      case OR:
      case AND:
      case IFF:
      case IMPLIES:
        final Ast.Binary connective = (Ast.Binary) exp;
        final Typed a = resolve(connective.left, env);
        final Typed b = resolve(connective.right, env);
        requireFormula(a);
        requireFormula(b);
        return new Typed(ast.binary(exp.pos, exp.op, a.exp, b.exp),
            RelType.FORMULA);

      case IN:
      case NOT_IN:
      case EQ:
      case NE:
      case LT:
      case LE:
      case GT:
      case GE:
        return resolveComparison((Ast.Binary) exp, env);

      case UNION:
      case DIFFERENCE:
      case INTERSECT:
      case OVERRIDE:
      case JOIN:
      case DOMAIN:
      case RANGE:
        final Ast.Binary binary = (Ast.Binary) exp;
        return resolveRelationOp(binary.pos, binary.op,
            resolve(binary.left, env), resolve(binary.right, env));

      case PRODUCT:
        final Ast.Arrow arrow = (Ast.Arrow) exp;
        if (arrow.hasMultiplicity()) {
          throw error(arrow.pos,
              "arrow multiplicities are only allowed in field declarations");
        }
        final Typed left = resolve(arrow.left, env);
        final Typed right = resolve(arrow.right, env);
        requireRelation(left);
        requireRelation(right);
        return new Typed(ast.product(exp.pos, left.exp, right.exp),
            left.type.product(right.type));

      case ITE:
        return resolveIte((Ast.Ite) exp, env);

      case APPLY:
        return resolveApply((Ast.Apply) exp, env);

      case ALL:
      case SOME:
      case NO:
      case ONE:
      case LONE:
        final Ast.Quantified quantified = (Ast.Quantified) exp;
        final List<Ast.VarDecl> decls = new ArrayList<>();
        final Environment<RelType> env2 =
            resolveDecls(quantified.decls, env, decls, new ArrayList<>(),
                true);
        final Typed body = resolve(quantified.body, env2);
        requireFormula(body);
        return new Typed(ast.quantified(exp.pos, exp.op, decls, body.exp),
            RelType.FORMULA);

      case COMPREHENSION:
        final Ast.Comprehension comprehension = (Ast.Comprehension) exp;
        final List<Ast.VarDecl> decls2 = new ArrayList<>();
        final List<RelType> types = new ArrayList<>();
        final Environment<RelType> env3 =
            resolveDecls(comprehension.decls, env, decls2, types, true);
        final Typed filter = resolve(comprehension.body, env3);
        requireFormula(filter);
        RelType type = types.get(0);
        for (RelType t : types.subList(1, types.size())) {
          type = type.product(t);
        }
        return new Typed(ast.comprehension(exp.pos, decls2, filter.exp), type);

      case LET:
        final Ast.Let let = (Ast.Let) exp;
        final Typed bound = resolve(let.exp, env);
        if (!bound.type.isRelation()) {
          throw error(let.exp.pos,
              "let may only bind a relational expression");
        }
        final Typed letBody =
            resolve(let.body, env.bind(let.name.name, bound.type));
        return new Typed(ast.let(exp.pos, let.name, bound.exp, letBody.exp),
            letBody.type);

      case BLOCK:
        final List<Ast.Exp> exps = new ArrayList<>();
        for (Ast.Exp e : ((Ast.Block) exp).exps) {
          final Typed t = resolve(e, env);
          requireFormula(t);
          exps.add(t.exp);
        }
        return new Typed(ast.block(exp.pos, exps), RelType.FORMULA);

      default:
        throw new AssertionError("unexpected " + exp.op + ": " + exp);
    }
  }

  private Typed resolveId(Ast.Id id, Environment<RelType> env) {
    final RelType varType = env.getOpt(id.name);
    if (varType != null) {
      return new Typed(ast.varRef(id.pos, id.name), varType);
    }
    final Field field = fields.get(id.name);
    if (field != null
        && implicitThis != null
        && field.owner.isSameOrAncestorOf(implicitThis)) {
      final RelType thisType = env.get("this");
      return new Typed(
          ast.join(id.pos, ast.varRef(id.pos, "this"),
              ast.fieldRef(id.pos, field)),
          thisType.join(field.type));
    }
    final Sig sig = sigs.get(id.name);
    if (sig != null) {
      return new Typed(ast.sigRef(id.pos, sig), RelType.of(sig));
    }
    if (field != null) {
      return new Typed(ast.fieldRef(id.pos, field), field.type);
    }
    final Function function = functions.get(id.name);
    if (function != null) {
      return resolveCall(id.pos, function, ImmutableList.of(), env);
    }
    throw error(id.pos, "unknown name '" + id.name + "'");
  }

  private Typed resolveCall(Pos pos, Function function, List<Ast.Exp> args,
      Environment<RelType> env) {
    final List<RelType> types = paramTypes.get(function);
    if (args.size() != types.size()) {
      throw error(pos,
          function + " expects " + types.size() + " argument(s), got "
              + args.size());
    }
    final List<Ast.Exp> args2 = new ArrayList<>();
    for (int i = 0; i < args.size(); i++) {
      final Typed arg = resolve(args.get(i), env);
      requireRelation(arg);
      if (arg.type.arity != types.get(i).arity) {
        throw error(arg.exp.pos,
            "argument " + (i + 1) + " of " + function + " has arity "
                + arg.type.arity + ", expected " + types.get(i).arity);
      }
      args2.add(arg.exp);
    }
    return new Typed(ast.call(pos, function, args2), function.returnType);
  }

  /** Resolves "{@code f[a, b]}", a call or a box join. */
  private Typed resolveApply(Ast.Apply apply, Environment<RelType> env) {
    if (apply.fn instanceof Ast.Id) {
      final String name = ((Ast.Id) apply.fn).name;
      final Function function = functions.get(name);
      if (function != null && env.getOpt(name) == null) {
        return resolveCall(apply.pos, function, apply.args, env);
      }
    }
    // "e[a, b]" is "b.(a.e)"
    Typed result = resolve(apply.fn, env);
    for (Ast.Exp arg : apply.args) {
      result = resolveRelationOp(apply.pos, Op.JOIN, resolve(arg, env), result);
    }
    return result;
  }

  private Typed resolveBinaryRelationOp(Ast.Unary unary,
      Environment<RelType> env) {
    final Typed arg = resolve(unary.exp, env);
    requireRelation(arg);
    if (arg.type.arity != 2) {
      throw error(unary.pos,
          "operand of '" + unary.op.padded + "' must be a binary relation, "
              + "but '" + unary.exp + "' has arity " + arg.type.arity);
    }
    final RelType type;
    switch (unary.op) {
      case TRANSPOSE:
        type = arg.type.transpose();
        break;
      case REFLEXIVE_CLOSURE:
        type = arg.type.union(RelType.univ(2));
        break;
      default:
        type = arg.type;
    }
    return new Typed(ast.unary(unary.pos, unary.op, arg.exp), type);
  }

  private Typed resolveRelationOp(Pos pos, Op op, Typed left, Typed right) {
    requireRelation(left);
    requireRelation(right);
    final Ast.Exp exp = ast.binary(pos, op, left.exp, right.exp);
    switch (op) {
      case UNION:
      case OVERRIDE:
        requireSameArity(pos, op, left, right);
        return new Typed(exp, left.type.union(right.type));

      case DIFFERENCE:
        requireSameArity(pos, op, left, right);
        return new Typed(exp, left.type);

      case INTERSECT:
        requireSameArity(pos, op, left, right);
        return new Typed(exp, left.type.intersect(right.type));

      case JOIN:
        if (left.type.arity == 1 && right.type.arity == 1) {
          throw error(pos,
              "cannot join two unary expressions, '" + left.exp + "' and '"
                  + right.exp + "'");
        }
        final RelType type = left.type.join(right.type);
        if (type.isEmpty() && !left.type.isEmpty() && !right.type.isEmpty()) {
          throw error(pos,
              "join of disjoint types: '" + left.exp + "' has type "
                  + left.type + " and '" + right.exp + "' has type "
                  + right.type);
        }
        return new Typed(exp, type);

      case DOMAIN:
        if (left.type.arity != 1) {
          throw error(pos, "left operand of '<:' must be unary");
        }
        return new Typed(exp, right.type);

      case RANGE:
        if (right.type.arity != 1) {
          throw error(pos, "right operand of ':>' must be unary");
        }
        return new Typed(exp, left.type);

      default:
        throw new AssertionError(op);
    }
  }

  private Typed resolveComparison(Ast.Binary binary, Environment<RelType> env) {
    final Typed left = resolve(binary.left, env);
    final Typed right = resolve(binary.right, env);
    final Ast.Exp exp = ast.binary(binary.pos, binary.op, left.exp, right.exp);
    switch (binary.op) {
      case LT:
      case LE:
      case GT:
      case GE:
        requireInt(left);
        requireInt(right);
        return new Typed(exp, RelType.FORMULA);

      case EQ:
      case NE:
        if (left.type.kind == RelType.Kind.INT
            || right.type.kind == RelType.Kind.INT) {
          requireInt(left);
          requireInt(right);
          return new Typed(exp, RelType.FORMULA);
        }
        // fall through
      default:
        requireRelation(left);
        requireRelation(right);
        requireSameArity(binary.pos, binary.op, left, right);
        return new Typed(exp, RelType.FORMULA);
    }
  }

  private Typed resolveIte(Ast.Ite ite, Environment<RelType> env) {
    final Typed condition = resolve(ite.condition, env);
    requireFormula(condition);
    final Typed ifTrue = resolve(ite.ifTrue, env);
    final Typed ifFalse = resolve(ite.ifFalse, env);
    final Ast.Exp exp =
        ast.ite(ite.pos, condition.exp, ifTrue.exp, ifFalse.exp);
    if (ifTrue.type.isFormula() && ifFalse.type.isFormula()) {
      return new Typed(exp, RelType.FORMULA);
    }
    requireRelation(ifTrue);
    requireRelation(ifFalse);
    requireSameArity(ite.pos, Op.ITE, ifTrue, ifFalse);
    return new Typed(exp, ifTrue.type.union(ifFalse.type));
  }

  private void requireFormula(Typed t) {
    if (!t.type.isFormula()) {
      throw error(t.exp.pos,
          "expected a formula, but '" + t.exp + "' has type " + t.type);
    }
  }

  private void requireRelation(Typed t) {
    if (!t.type.isRelation()) {
      throw error(t.exp.pos,
          "expected a relational expression, but '" + t.exp + "' is a "
              + t.type);
    }
  }

  private void requireInt(Typed t) {
    if (t.type.kind != RelType.Kind.INT) {
      throw error(t.exp.pos,
          "expected an integer, but '" + t.exp + "' has type " + t.type);
    }
  }

  private void requireSameArity(Pos pos, Op op, Typed left, Typed right) {
    if (left.type.arity != right.type.arity) {
      throw error(pos,
          "arity mismatch in '" + op.padded.trim() + "': '" + left.exp
              + "' has arity " + left.type.arity + " but '" + right.exp
              + "' has arity " + right.type.arity);
    }
  }

  /** Resolved expression and its type. */
  private static class Typed {
    final Ast.Exp exp;
    final RelType type;

    Typed(Ast.Exp exp, RelType type) {
      this.exp = exp;
      this.type = type;
    }
  }
}

// End Resolver.java
