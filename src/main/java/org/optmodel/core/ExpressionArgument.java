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
 * An object that may be used in an algebraic expression: a variable, a parameter, a set iterator
 * or an expression itself.
 *
 * <p>The arithmetic methods follow the mutability of the receiver: they return a new expression
 * unless the receiver is a {@link MutableExpression}, which is updated in place. Comparisons never
 * modify their operands.
 */
public interface ExpressionArgument {
  /** Returns the expression form of this argument. */
  Expression toExpression();

  /** Returns {@code this + other}. */
  default Expression plus(ExpressionArgument other) {
    return toExpression().add(other, 1.0);
  }

  /** Returns {@code this + value}. */
  default Expression plus(double value) {
    return toExpression().add(value);
  }

  /** Returns {@code this - other}. */
  default Expression minus(ExpressionArgument other) {
    return toExpression().add(other, -1.0);
  }

  /** Returns {@code this - value}. */
  default Expression minus(double value) {
    return toExpression().add(-value);
  }

  /** Returns {@code this * other}, distributing over the terms of both operands. */
  default Expression times(ExpressionArgument other) {
    return toExpression().mult(other);
  }

  /** Returns {@code this * scalar}. */
  default Expression times(double scalar) {
    return toExpression().mult(scalar);
  }

  /** Returns {@code this / other}. */
  default Expression div(ExpressionArgument other) {
    return toExpression().divide(other);
  }

  /** Returns {@code this / scalar}. */
  default Expression div(double scalar) {
    return toExpression().divide(scalar);
  }

  /** Returns {@code this ^ exponent}. */
  default Expression pow(double exponent) {
    return toExpression().power(exponent);
  }

  /** Returns {@code this ^ exponent} for a symbolic or variable exponent. */
  default Expression pow(ExpressionArgument exponent) {
    return toExpression().power(exponent);
  }

  /** Returns {@code -this}. */
  default Expression negate() {
    return toExpression().mult(-1.0);
  }

  /** Returns the constraint {@code this <= other}. */
  default Constraint le(ExpressionArgument other) {
    return Constraint.compare("le", this, other, Direction.LE);
  }

  /** Returns the constraint {@code this <= value}. */
  default Constraint le(double value) {
    return Constraint.compare("le", this, Expression.constant(value), Direction.LE);
  }

  /** Returns the constraint {@code this >= other}. */
  default Constraint ge(ExpressionArgument other) {
    return Constraint.compare("ge", this, other, Direction.GE);
  }

  /** Returns the constraint {@code this >= value}. */
  default Constraint ge(double value) {
    return Constraint.compare("ge", this, Expression.constant(value), Direction.GE);
  }

  /** Returns the constraint {@code this == other}. */
  default Constraint eq(ExpressionArgument other) {
    return Constraint.compare("eq", this, other, Direction.EQ);
  }

  /** Returns the constraint {@code this == value}. */
  default Constraint eq(double value) {
    return Constraint.compare("eq", this, Expression.constant(value), Direction.EQ);
  }

  /** Returns the range constraint {@code lower <= this <= upper}. */
  default Constraint eq(double lower, double upper) {
    return Constraint.range(this, lower, upper);
  }
}
