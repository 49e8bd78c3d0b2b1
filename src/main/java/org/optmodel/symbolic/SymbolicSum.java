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

package org.optmodel.symbolic;

import org.optmodel.NumberFormatter;
import org.optmodel.UnsupportedModelException;
import org.optmodel.core.Expression;
import org.optmodel.core.ExpressionArgument;
import org.optmodel.core.Term;

/** A sum evaluated on the engine: {@code sum {i in I} c[i] * x[i]}. */
public final class SymbolicSum implements Term {
  /** Returns the expression {@code sum {iteration} body}. */
  public static Expression over(Iteration iteration, ExpressionArgument body) {
    return Expression.of(new SymbolicSum(iteration, Expression.copyOf(body)));
  }

  private SymbolicSum(Iteration iteration, Expression body) {
    this.iteration = iteration;
    this.body = body;
  }

  public Iteration getIteration() {
    return iteration;
  }

  public Expression getBody() {
    return body;
  }

  @Override
  public String render(NumberFormatter formatter) {
    String rendered = body.render(formatter);
    boolean multiple = body.size() + (body.getConstant() != 0.0 ? 1 : 0) > 1;
    return "sum " + iteration.render(formatter) + " "
        + (multiple ? "(" + rendered + ")" : rendered);
  }

  @Override
  public double evaluate() {
    throw new UnsupportedModelException(
        "SymbolicSum.evaluate", "sum over " + iteration + " is only known on the engine");
  }

  @Override
  public boolean isSymbolic() {
    return true;
  }

  @Override
  public boolean isCompound() {
    return true;
  }

  @Override
  public boolean equals(Object o) {
    if (!(o instanceof SymbolicSum)) {
      return false;
    }
    SymbolicSum other = (SymbolicSum) o;
    return iteration.equals(other.iteration) && body.sameStructure(other.body);
  }

  @Override
  public int hashCode() {
    return 31 * iteration.hashCode() + body.structuralHash();
  }

  @Override
  public String toString() {
    return render(new NumberFormatter(12));
  }

  private final Iteration iteration;
  private final Expression body;
}
