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

/** An opaque power such as {@code (x - 1) ^ 2} or {@code x ^ 0.5}, kept unexpanded. */
public final class PowerTerm implements Term {
  PowerTerm(Expression base, Expression exponent) {
    this.base = base;
    this.exponent = exponent;
  }

  public Expression getBase() {
    return base;
  }

  public Expression getExponent() {
    return exponent;
  }

  /** Returns true if the exponent depends on a decision variable. */
  public boolean hasVariableExponent() {
    return !exponent.isConstant() && !exponent.getVariables().isEmpty();
  }

  @Override
  public String render(NumberFormatter formatter) {
    String b = base.render(formatter);
    String e = exponent.render(formatter);
    return (base.isCompound() ? "(" + b + ")" : b) + " ^ "
        + (exponent.isCompound() ? "(" + e + ")" : e);
  }

  @Override
  public double evaluate() {
    return Math.pow(base.getValue(), exponent.getValue());
  }

  @Override
  public boolean isSymbolic() {
    return base.isSymbolic() || exponent.isSymbolic();
  }

  @Override
  public boolean isCompound() {
    return true;
  }

  @Override
  public boolean equals(Object o) {
    if (!(o instanceof PowerTerm)) {
      return false;
    }
    PowerTerm other = (PowerTerm) o;
    return base.sameStructure(other.base) && exponent.sameStructure(other.exponent);
  }

  @Override
  public int hashCode() {
    return 31 * base.structuralHash() + exponent.structuralHash();
  }

  @Override
  public String toString() {
    return render(new NumberFormatter(12));
  }

  private final Expression base;
  private final Expression exponent;
}
