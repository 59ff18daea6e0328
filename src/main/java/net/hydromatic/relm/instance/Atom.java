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
package net.hydromatic.relm.instance;

import static java.util.Objects.requireNonNull;

import net.hydromatic.relm.type.Sig;

/**
 * Element of a universe.
 *
 * <p>An atom is named "{@code Sig$i}" after the signature it was allocated
 * for (its tag); atoms with the same tag are interchangeable.
 */
public class Atom implements Comparable<Atom> {
  public final String name;
  public final int index;
  public final Sig tag;

  Atom(String name, int index, Sig tag) {
    this.name = requireNonNull(name);
    this.index = index;
    this.tag = requireNonNull(tag);
  }

  @Override
  public int compareTo(Atom o) {
    return Integer.compare(index, o.index);
  }

  @Override
  public String toString() {
    return name;
  }
}

// End Atom.java
