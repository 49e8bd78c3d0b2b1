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

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import org.optmodel.NumberFormatter;

/**
 * A product of terms, each raised to a positive integer exponent.
 *
 * <p>Two monomials with the same factors are equal regardless of the order in which the factors
 * were multiplied; the rendering follows that order.
 */
public final class Monomial {
  /** The empty product, used for constants. */
  static final Monomial ONE = new Monomial(new LinkedHashMap<>());

  public static Monomial of(Term term) {
    Map<Term, Integer> factors = new LinkedHashMap<>();
    factors.put(term, 1);
    return new Monomial(factors);
  }

  private Monomial(Map<Term, Integer> factors) {
    this.factors = factors;
    this.hash = factors.hashCode();
  }

  /** Returns the product of this monomial and {@code other}, adding exponents of common terms. */
  public Monomial multiply(Monomial other) {
    Map<Term, Integer> result = new LinkedHashMap<>(factors);
    for (Map.Entry<Term, Integer> entry : other.factors.entrySet()) {
      result.merge(entry.getKey(), entry.getValue(), Integer::sum);
    }
    return new Monomial(result);
  }

  /** Returns this monomial raised to a non-negative integer power. */
  public Monomial power(int exponent) {
    Map<Term, Integer> result = new LinkedHashMap<>();
    if (exponent == 0) {
      return ONE;
    }
    for (Map.Entry<Term, Integer> entry : factors.entrySet()) {
      result.put(entry.getKey(), entry.getValue() * exponent);
    }
    return new Monomial(result);
  }

  public Map<Term, Integer> getFactors() {
    return Collections.unmodifiableMap(factors);
  }

  /** Sum of the exponents. */
  public int degree() {
    int degree = 0;
    for (int exponent : factors.values()) {
      degree += exponent;
    }
    return degree;
  }

  /** Returns the single term if this monomial is a term to the first power, or null. */
  public Term asSingleTerm() {
    if (factors.size() == 1) {
      Map.Entry<Term, Integer> entry = factors.entrySet().iterator().next();
      if (entry.getValue() == 1) {
        return entry.getKey();
      }
    }
    return null;
  }

  public boolean isSymbolic() {
    for (Term term : factors.keySet()) {
      if (term.isSymbolic()) {
        return true;
      }
    }
    return false;
  }

  public double evaluate() {
    double value = 1.0;
    for (Map.Entry<Term, Integer> entry : factors.entrySet()) {
      value *= Math.pow(entry.getKey().evaluate(), entry.getValue());
    }
    return value;
  }

  public String render(NumberFormatter formatter) {
    StringBuilder sb = new StringBuilder();
    for (Map.Entry<Term, Integer> entry : factors.entrySet()) {
      if (sb.length() > 0) {
        sb.append(" * ");
      }
      Term term = entry.getKey();
      String rendered = term.render(formatter);
      if (entry.getValue() == 1) {
        sb.append(rendered);
      } else {
        sb.append(term.isCompound() ? "(" + rendered + ")" : rendered)
            .append(" ^ ")
            .append(entry.getValue());
      }
    }
    return sb.toString();
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) {
      return true;
    }
    if (!(o instanceof Monomial)) {
      return false;
    }
    Monomial other = (Monomial) o;
    return hash == other.hash && factors.equals(other.factors);
  }

  @Override
  public int hashCode() {
    return hash;
  }

  @Override
  public String toString() {
    return render(new NumberFormatter(12));
  }

  private final Map<Term, Integer> factors;
  private final int hash;
}
