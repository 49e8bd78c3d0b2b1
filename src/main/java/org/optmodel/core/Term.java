// Copyright 2010-2025 Google LLC
// Licensed under the Apache License, Version 2.0 (the "License");
// you may not use this file except in compliance with the License.
// You may obtain a copy of the License at
//
//     http://www.apache.org/licenses/LICENSE-2.0
//
// Unless required by applicable law or agreed to in writing, software
// distributed under the License is distributed on an "AS IS" BASIS,
// WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
// See the License for the specific language governing permissions and
// limitations under the License.

package org.optmodel.core;

import org.optmodel.NumberFormatter;

/**
 * An atomic factor of a monomial: a variable, a parameter, a set iterator or an opaque
 * nonlinear term such as a function call.
 */
public interface Term {
  /** Renders the term as it appears in generated code. */
  String render(NumberFormatter formatter);

  /**
   * Returns the current numeric value of the term.
   *
   * @throws org.optmodel.UnsupportedModelException if the term is symbolic
   */
  double evaluate();

  /** Returns true if the value of this term is only known on the remote engine. */
  boolean isSymbolic();

  /** Returns true if the rendering must be parenthesized when the term is raised to a power. */
  default boolean isCompound() {
    return false;
  }

  /** Returns true if the term is a decision variable, i.e. linear in the matrix sense. */
  default boolean isDecisionVariable() {
    return false;
  }
}
