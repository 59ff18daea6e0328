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

import java.util.List;
import net.hydromatic.relm.instance.Bounds;
import net.hydromatic.relm.instance.Instance;
import net.hydromatic.relm.sat.SatSolver;
import net.hydromatic.relm.type.Model;

/** Called on various events while a command is compiled and solved. */
public interface Tracer {
  /** Called when a module has been resolved. */
  void onModel(Model model);

  /** Called when the scope of a command has been computed. */
  void onScope(Scope scope);

  /** Called when the bounds of a command have been computed. */
  void onBounds(Bounds bounds);

  /** Called when a command has been translated to a boolean circuit. */
  void onTranslation(Problem problem);

  /** Called after each call to the solver. */
  void onSolve(SatSolver.Result result, long elapsedMillis);

  /** Called on each instance before it is returned. */
  void onInstance(Instance instance);

  /** Called with the list of warnings after a command has run. */
  void onWarnings(List<String> warningList);
}

// End Tracer.java
