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

/** An opaque quotient whose divisor is not a constant, e.g. {@code (x + 1) / y}. */
public final class QuotientTerm implements Term {
  QuotientTerm(Expression numerator, Expression denominator) {
    this.numerator = numerator;
    this.denominator = denominator;
  }

  public Expression getNumerator() {
    return numerator;
  }

  public Expression getDenominator() {
    return denominator;
  }

  @Override
  public String render(NumberFormatter formatter) {
    String n = numerator.render(formatter);
    String d = denominator.render(formatter);
    return (numerator.isCompound() ? "(" + n + ")" : n) + " / "
        + (denominator.isCompound() ? "(" + d + ")" : d);
  }

  @Override
  public double evaluate() {
    return numerator.getValue() / denominator.getValue();
  }

  @Override
  public boolean isSymbolic() {
    return numerator.isSymbolic() || denominator.isSymbolic();
  }

  @Override
  public boolean isCompound() {
    return true;
  }

  @Override
  public boolean equals(Object o) {
    if (!(o instanceof QuotientTerm)) {
      return false;
    }
    QuotientTerm other = (QuotientTerm) o;
    return numerator.sameStructure(other.numerator)
        && denominator.sameStructure(other.denominator);
  }

  @Override
  public int hashCode() {
    return 31 * numerator.structuralHash() + denominator.structuralHash();
  }

  @Override
  public String toString() {
    return render(new NumberFormatter(12));
  }

  private final Expression numerator;
  private final Expression denominator;
}
