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

/**
 * An expression updated in place by its arithmetic methods.
 *
 * <p>Used while a large expression is assembled term by term, e.g.
 *
 * <pre>{@code
 * MutableExpression total = Expression.mutable();
 * for (Variable v : group) {
 *   total.plus(v.times(2));
 * }
 * Expression frozen = total.freeze();
 * }</pre>
 */
public final class MutableExpression extends Expression {
  MutableExpression() {
    super();
  }

  MutableExpression(Expression other) {
    super(other);
  }

  @Override
  Expression target() {
    return this;
  }

  @Override
  Expression assign(Expression result) {
    replaceContents(result);
    return this;
  }

  /** Replaces the coefficient of {@code term} to the first power, creating the entry if needed. */
  public MutableExpression setCoefficient(Term term, double coefficient) {
    setTerm(Monomial.of(term), coefficient);
    return this;
  }

  /** Removes the monomial {@code term} to the first power. */
  public MutableExpression removeTerm(Term term) {
    terms.remove(Monomial.of(term));
    return this;
  }

  public MutableExpression setConstant(double value) {
    setConstantInPlace(value);
    return this;
  }

  /** Returns a permanent copy of the current state. */
  @Override
  public Expression freeze() {
    return new Expression(this);
  }
}
