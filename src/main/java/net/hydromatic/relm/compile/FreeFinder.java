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

import com.google.common.collect.ImmutableSet;
import java.util.HashSet;
import java.util.Set;
import java.util.function.Consumer;
import net.hydromatic.relm.ast.Ast;
import net.hydromatic.relm.ast.Visitor;

/** Finds free variables in a resolved expression. */
class FreeFinder extends Visitor {
  private final Set<String> bound;
  private final Consumer<String> consumer;

  private FreeFinder(Set<String> bound, Consumer<String> consumer) {
    this.bound = bound;
    this.consumer = consumer;
  }

  /** Finds the free variables in an expression. */
  static Set<String> freeVars(Ast.Exp exp) {
    final ImmutableSet.Builder<String> set = ImmutableSet.builder();
    exp.accept(new FreeFinder(ImmutableSet.of(), set::add));
    return set.build();
  }

  /** Returns a finder that also regards some names as bound. */
  private FreeFinder push(Iterable<String> names) {
    final Set<String> set = new HashSet<>(bound);
    names.forEach(set::add);
    return new FreeFinder(set, consumer);
  }

  @Override protected void visit(Ast.VarRef varRef) {
    if (!bound.contains(varRef.name)) {
      consumer.accept(varRef.name);
    }
  }

  @Override protected void visit(Ast.Quantified quantified) {
    visitDecls(quantified.decls).accept(quantified.body);
  }

  @Override protected void visit(Ast.Comprehension comprehension) {
    visitDecls(comprehension.decls).accept(comprehension.body);
  }

  @Override protected void visit(Ast.Let let) {
    let.exp.accept(this);
    push(ImmutableSet.of(let.name.name)).accept(let.body);
  }

  /**
   * Visits declarations, each in the scope of the previous ones, and returns
   * a finder in the scope of all of them.
   */
  private FreeFinder visitDecls(Iterable<Ast.VarDecl> decls) {
    FreeFinder finder = this;
    for (Ast.VarDecl decl : decls) {
      decl.exp.accept(finder);
      final Set<String> names = new HashSet<>();
      decl.names.forEach(id -> names.add(id.name));
      finder = finder.push(names);
    }
    return finder;
  }
}

// End FreeFinder.java
