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
import org.optmodel.core.Expression;
import org.optmodel.core.ExpressionArgument;

/** A numeric range {@code first..last}, both ends included. The ends may be symbolic. */
public final class SetRange implements SetDomain {
  public static SetRange of(double first, double last) {
    return new SetRange(Expression.constant(first), Expression.constant(last));
  }

  public static SetRange of(ExpressionArgument first, ExpressionArgument last) {
    return new SetRange(Expression.copyOf(first), Expression.copyOf(last));
  }

  private SetRange(Expression first, Expression last) {
    this.first = first;
    this.last = last;
  }

  public Expression getFirst() {
    return first;
  }

  public Expression getLast() {
    return last;
  }

  @Override
  public String renderDomain(NumberFormatter formatter) {
    return first.render(formatter) + ".." + last.render(formatter);
  }

  @Override
  public int getDimension() {
    return 1;
  }

  @Override
  public boolean equals(Object o) {
    if (!(o instanceof SetRange)) {
      return false;
    }
    SetRange other = (SetRange) o;
    return first.sameStructure(other.first) && last.sameStructure(other.last);
  }

  @Override
  public int hashCode() {
    return 31 * first.structuralHash() + last.structuralHash();
  }

  @Override
  public String toString() {
    return renderDomain(new NumberFormatter(12));
  }

  private final Expression first;
  private final Expression last;
}
