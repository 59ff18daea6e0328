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

/** Visits syntax trees. */
public class Visitor {

  /** For use as a method reference. */
  protected <E extends AstNode> void accept(E e) {
    e.accept(this);
  }

  // declarations

  protected void visit(Ast.Module module) {
    module.decls.forEach(this::accept);
  }

  protected void visit(Ast.SigDecl sigDecl) {
    sigDecl.fields.forEach(this::accept);
    if (sigDecl.appendedFact != null) {
      sigDecl.appendedFact.accept(this);
    }
  }

  protected void visit(Ast.FieldDecl fieldDecl) {
    fieldDecl.exp.accept(this);
  }

  protected void visit(Ast.FactDecl factDecl) {
    factDecl.body.accept(this);
  }

  protected void visit(Ast.PredDecl predDecl) {
    predDecl.params.forEach(this::accept);
    if (predDecl.returnType != null) {
      predDecl.returnType.accept(this);
    }
    predDecl.body.accept(this);
  }

  protected void visit(Ast.AssertDecl assertDecl) {
    assertDecl.body.accept(this);
  }

  protected void visit(Ast.Command command) {
    if (command.body != null) {
      command.body.accept(this);
    }
    command.scopes.forEach(this::accept);
  }

  protected void visit(Ast.TypeScope typeScope) {}

  protected void visit(Ast.VarDecl varDecl) {
    varDecl.exp.accept(this);
  }

  // leaves

  protected void visit(Ast.Id id) {}

  protected void visit(Ast.IntLiteral intLiteral) {}

  protected void visit(Ast.Constant constant) {}

  protected void visit(Ast.SigRef sigRef) {}

  protected void visit(Ast.FieldRef fieldRef) {}

  protected void visit(Ast.VarRef varRef) {}

  // operators

  protected void visit(Ast.Unary unary) {
    unary.exp.accept(this);
  }

  protected void visit(Ast.Binary binary) {
    binary.left.accept(this);
    binary.right.accept(this);
  }

  protected void visit(Ast.Arrow arrow) {
    arrow.left.accept(this);
    arrow.right.accept(this);
  }

  protected void visit(Ast.Ite ite) {
    ite.condition.accept(this);
    ite.ifTrue.accept(this);
    ite.ifFalse.accept(this);
  }

  protected void visit(Ast.Apply apply) {
    apply.fn.accept(this);
    apply.args.forEach(this::accept);
  }

  protected void visit(Ast.Call call) {
    call.args.forEach(this::accept);
  }

  // binders

  protected void visit(Ast.Quantified quantified) {
    quantified.decls.forEach(this::accept);
    quantified.body.accept(this);
  }

  protected void visit(Ast.Comprehension comprehension) {
    comprehension.decls.forEach(this::accept);
    comprehension.body.accept(this);
  }

  protected void visit(Ast.Let let) {
    let.exp.accept(this);
    let.body.accept(this);
  }

  protected void visit(Ast.Block block) {
    block.exps.forEach(this::accept);
  }
}

// End Visitor.java
