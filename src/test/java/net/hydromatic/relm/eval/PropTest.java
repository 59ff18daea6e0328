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

import static net.hydromatic.relm.Als.assertError;
import static net.hydromatic.relm.Als.throwsA;

import static org.hamcrest.CoreMatchers.is;
import static org.hamcrest.CoreMatchers.nullValue;
import static org.hamcrest.MatcherAssert.assertThat;

import java.util.LinkedHashMap;
import java.util.Map;
import org.junit.jupiter.api.Test;

/** Tests {@link Prop}. */
public class PropTest {
  @Test void testLookup() {
    assertThat(Prop.lookup("solutionLimit"), is(Prop.SOLUTION_LIMIT));
    assertThat(Prop.lookup("SOLUTION_LIMIT"), is(Prop.SOLUTION_LIMIT));
    assertError(() -> Prop.lookup("solution_limit"),
        throwsA(IllegalArgumentException.class,
            "property solution_limit not found"));
    assertThat(Prop.BY_CAMEL_NAME.get(0), is(Prop.CANONICAL_CHECK_LIMIT));
  }

  @Test void testDefaults() {
    final Map<Prop, Object> map = new LinkedHashMap<>();
    assertThat(Prop.SOLUTION_LIMIT.intValue(map), is(1));
    assertThat(Prop.DEFAULT_SCOPE.intValue(map), is(3));
    assertThat(Prop.EXACT_SCOPES.booleanValue(map), is(true));
    assertThat(Prop.TIMEOUT_MILLIS.longValue(map), is(0L));
    assertThat(Prop.COMMAND.stringValue(map), nullValue());
    assertThat(Prop.OUTPUT.enumValue(map, Prop.Output.class),
        is(Prop.Output.TEXT));
  }

  @Test void testSetLenient() {
    final Map<Prop, Object> map = new LinkedHashMap<>();
    Prop.SOLUTION_LIMIT.setLenient(map, "7");
    Prop.TIMEOUT_MILLIS.setLenient(map, "1500");
    Prop.EXACT_SCOPES.setLenient(map, "FALSE");
    Prop.OUTPUT.setLenient(map, "compact");
    Prop.COMMAND.setLenient(map, "Show");
    assertThat(Prop.SOLUTION_LIMIT.intValue(map), is(7));
    assertThat(Prop.TIMEOUT_MILLIS.longValue(map), is(1500L));
    assertThat(Prop.EXACT_SCOPES.booleanValue(map), is(false));
    assertThat(Prop.OUTPUT.enumValue(map, Prop.Output.class),
        is(Prop.Output.COMPACT));
    assertThat(Prop.COMMAND.stringValue(map), is("Show"));

    Prop.COMMAND.set(map, null);
    assertThat(Prop.COMMAND.stringValue(map), nullValue());
  }

  @Test void testInvalid() {
    final Map<Prop, Object> map = new LinkedHashMap<>();
    assertError(() -> Prop.SOLUTION_LIMIT.setLenient(map, "x"),
        throwsA(IllegalArgumentException.class,
            "value for property solutionLimit must be a number: 'x'"));
    assertError(() -> Prop.EXACT_SCOPES.setLenient(map, "yes"),
        throwsA(IllegalArgumentException.class,
            "value for property exactScopes must be true or false: 'yes'"));
    assertError(() -> Prop.OUTPUT.setLenient(map, "xml"),
        throwsA(IllegalArgumentException.class,
            "must be one of: 'TEXT', 'COMPACT'"));
    assertError(() -> Prop.SOLUTION_LIMIT.set(map, null),
        throwsA(IllegalArgumentException.class,
            "property solutionLimit is required"));
    assertError(() -> Prop.SOLUTION_LIMIT.set(map, "7"),
        throwsA(IllegalArgumentException.class,
            "must have type Integer"));
  }
}

// End PropTest.java
