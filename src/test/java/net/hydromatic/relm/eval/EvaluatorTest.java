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

import static org.hamcrest.CoreMatchers.hasItems;
import static org.hamcrest.CoreMatchers.is;
import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.hasSize;

import com.google.common.collect.ImmutableMap;
import java.util.ArrayList;
import java.util.List;
import java.util.stream.Collectors;
import net.hydromatic.relm.ast.Ast;
import net.hydromatic.relm.instance.Instance;
import net.hydromatic.relm.instance.TupleSet;
import net.hydromatic.relm.instance.Universe;
import net.hydromatic.relm.type.Fact;
import net.hydromatic.relm.type.Field;
import net.hydromatic.relm.type.Model;
import net.hydromatic.relm.type.Sig;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

/** Tests {@link Evaluator}, on an instance built by hand. */
public class EvaluatorTest {
  private static final String TEXT = "sig A {r: set A}\n"
      + "fact Loop {some r & iden}\n"
      + "fact Small {#A =< 3}\n"
      + "assert Reach {A.^r = A}\n"
      + "assert Closure {^r = A -> A}\n"
      + "assert Star {*r = A -> A}\n"
      + "assert Range {r.A = A}\n"
      + "assert Transpose {~r = r}\n"
      + "assert Restrict {A <: r :> A = r}\n"
      + "assert Heads {{a: A | some a.r} = A}\n"
      + "assert Acyclic {no a: A | a in a.^r}\n"
      + "assert Total {all a: A | some a.r}\n"
      + "assert Ite {(some r implies #A = 3 else #A = 0)}\n"
      + "assert Count {#A > #r and #r = 2}\n"
      + "assert Let {let x = A.r | some x - r.A}\n";

  private Model model;
  private Evaluator evaluator;

  @BeforeEach void setUp() {
    model = als(TEXT).model();
    final Sig a = model.sig("A");
    final Field r = model.field("r");
    final Universe.Builder builder = Universe.builder();
    builder.add(a, 3);
    final Universe universe = builder.build();
    // A$0 -> A$1 -> A$2
    final TupleSet rValue =
        TupleSet.of(universe, 2,
            List.of(universe.encode(0, 1), universe.encode(1, 2)));
    final Instance instance =
        new Instance(universe,
            ImmutableMap.of(a, TupleSet.all(universe, 1), r, rValue));
    evaluator = new Evaluator(model, instance);
  }

  private Ast.Exp formula(String name) {
    return model.assertions.get(name).formula;
  }

  /** Returns the left side of the comparison in an assertion. */
  private Ast.Exp left(String name) {
    final Ast.Block block = (Ast.Block) formula(name);
    return ((Ast.Binary) block.exps.get(0)).left;
  }

  private void assertValue(String name, String expected) {
    assertThat(evaluator.evaluate(left(name)).toString(), is(expected));
  }

  private void assertHolds(String name, boolean expected) {
    assertThat(name, evaluator.holds(formula(name)), is(expected));
  }

  @Test void testEvaluate() {
    assertValue("Reach", "{A$1, A$2}");
    assertValue("Closure", "{(A$0, A$1), (A$0, A$2), (A$1, A$2)}");
    assertValue("Star",
        "{(A$0, A$0), (A$0, A$1), (A$0, A$2), (A$1, A$1), (A$1, A$2),"
            + " (A$2, A$2)}");
    assertValue("Range", "{A$0, A$1}");
    assertValue("Transpose", "{(A$1, A$0), (A$2, A$1)}");
    assertValue("Restrict", "{(A$0, A$1), (A$1, A$2)}");
    assertValue("Heads", "{A$0, A$1}");
  }

  @Test void testHolds() {
    assertHolds("Reach", false);
    assertHolds("Closure", false);
    assertHolds("Restrict", true);
    assertHolds("Acyclic", true);
    assertHolds("Total", false);
    assertHolds("Ite", true);
    assertHolds("Count", true);
    assertHolds("Let", true);
  }

  @Test void testViolated() {
    final List<Fact> violated = evaluator.violated(model.facts);
    assertThat(names(violated), is(List.of("Loop")));

    final List<String> names = names(evaluator.violated(
        new ArrayList<>(model.assertions.values())));
    assertThat(names, hasSize(7));
    assertThat(names,
        hasItems("Reach", "Closure", "Star", "Range", "Transpose", "Heads",
            "Total"));
  }

  private static List<String> names(List<Fact> facts) {
    return facts.stream().map(f -> f.name).collect(Collectors.toList());
  }
}

// End EvaluatorTest.java
