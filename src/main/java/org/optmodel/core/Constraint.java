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

import java.util.Map;
import org.optmodel.ModelingException;
import org.optmodel.NameRegistry;
import org.optmodel.NumberFormatter;

/**
 * A relation between an expression and a right-hand side.
 *
 * <p>For {@code <=}, {@code >=} and {@code =}, the body holds {@code lhs - rhs} and the right-hand
 * side is the opposite of its constant. For a range, the body holds the given expression and
 * the bounds are kept aside. The body stays live: {@link #updateVarCoef} changes what is rendered
 * next.
 */
public final class Constraint implements Declaration {
  static Constraint compare(String methodName, ExpressionArgument lhs, ExpressionArgument rhs,
      Direction direction) {
    MutableExpression body = Expression.copyOf(lhs).toMutable();
    body.addInPlace("Constraint." + methodName, rhs.toExpression(), -1.0);
    return new Constraint(body, direction, Double.NaN, Double.NaN);
  }

  static Constraint range(ExpressionArgument expression, double lower, double upper) {
    checkRange(lower, upper);
    return new Constraint(
        Expression.copyOf(expression).toMutable(), Direction.RANGE, lower, upper);
  }

  private static void checkRange(double lower, double upper) {
    if (Double.isNaN(lower) || Double.isNaN(upper) || lower > upper
        || lower == Double.POSITIVE_INFINITY || upper == Double.NEGATIVE_INFINITY) {
      throw new ModelingException(
          "Constraint.range", "invalid range [" + lower + ", " + upper + "]");
    }
  }

  private Constraint(MutableExpression body, Direction direction, double lower, double upper) {
    this.body = body;
    this.direction = direction;
    this.lower = lower;
    this.upper = upper;
  }

  /** Copy used by constraint groups instantiating a template. */
  Constraint copy() {
    return new Constraint(body.freeze().toMutable(), direction, lower, upper);
  }

  /**
   * Names this constraint in {@code registry}, or generates a name if {@code name} is empty.
   *
   * @throws ModelingException if the constraint is already named differently, or the name is
   *     taken
   */
  public Constraint register(NameRegistry registry, String name) {
    if (this.name != null) {
      if (name == null || name.isEmpty() || name.equals(this.name)) {
        registry.register(this.name, this);
        return this;
      }
      throw new ModelingException(
          "Constraint.register", "constraint is already named " + this.name);
    }
    this.name = registry.registerOrGenerate(name, "con", this);
    return this;
  }

  void setGroup(ConstraintGroup group, Key key) {
    this.group = group;
    this.key = key;
  }

  @Override
  public String getName() {
    return name;
  }

  public Direction getDirection() {
    return direction;
  }

  /** Changes the direction of a non-range constraint. */
  public void setDirection(Direction direction) {
    if (direction == Direction.RANGE || this.direction == Direction.RANGE) {
      throw new ModelingException(
          "Constraint.setDirection", "use setRange() to turn a constraint into a range");
    }
    this.direction = direction;
  }

  public boolean isRange() {
    return direction == Direction.RANGE;
  }

  /** Returns the right-hand side, i.e. the opposite of the body constant. */
  public double getRhs() {
    if (isRange()) {
      throw new ModelingException("Constraint.getRhs", "range constraint " + name
          + " has two bounds");
    }
    return -body.getConstant();
  }

  public void setRhs(double rhs) {
    if (isRange()) {
      throw new ModelingException("Constraint.setRhs", "range constraint " + name
          + " has two bounds");
    }
    body.setConstant(-rhs);
  }

  /** Lower bound of a range constraint. */
  public double getLower() {
    return lower;
  }

  /** Upper bound of a range constraint. */
  public double getUpper() {
    return upper;
  }

  /** Turns this constraint into {@code lower <= body <= upper}, body being the current body. */
  public void setRange(double lower, double upper) {
    checkRange(lower, upper);
    if (!isRange()) {
      body.setConstant(0.0);
    }
    this.direction = Direction.RANGE;
    this.lower = lower;
    this.upper = upper;
  }

  /**
   * Replaces the coefficient of {@code variable}, creating the term if absent. Other terms and the
   * right-hand side are unchanged.
   */
  public void updateVarCoef(Variable variable, double coefficient) {
    body.setCoefficient(variable, coefficient);
  }

  /** Returns a permanent copy of the body. */
  public Expression getBody() {
    return body.freeze();
  }

  /** Returns the value of the body terms from the current variable values, constant excluded. */
  public double getBodyValue() {
    double value = 0.0;
    for (Map.Entry<Monomial, Double> entry : body.getTerms().entrySet()) {
      value += entry.getValue() * entry.getKey().evaluate();
    }
    return value;
  }

  public boolean isSymbolic() {
    return body.isSymbolic();
  }

  public boolean isLinear() {
    return body.isLinear();
  }

  /** Returns the body value reported by the engine, NaN before a solve. */
  public double getValue() {
    return value;
  }

  public void setValue(double value) {
    this.value = value;
  }

  /** Returns the dual value, NaN before a solve. */
  public double getDual() {
    return dual;
  }

  public void setDual(double dual) {
    this.dual = dual;
  }

  public void clearSolution() {
    value = Double.NaN;
    dual = Double.NaN;
  }

  /** Returns the owning group, or null. */
  public ConstraintGroup getGroup() {
    return group;
  }

  /** Returns the key within the owning group, or null. */
  public Key getKey() {
    return key;
  }

  /** Renders the relation alone: {@code x + 2 * y <= 9} or {@code 2 <= x + 2 * y <= 9}. */
  public String renderRelation(NumberFormatter formatter) {
    String terms = body.renderTerms(formatter);
    if (terms.isEmpty()) {
      terms = "0";
    }
    double constant = body.getConstant();
    if (isRange()) {
      return formatter.format(lower - constant) + " <= " + terms + " <= "
          + formatter.format(upper - constant);
    }
    return terms + " " + direction.getSymbol() + " " + formatter.format(-constant);
  }

  @Override
  public String toDeclaration(NumberFormatter formatter) {
    return "con " + name + " : " + renderRelation(formatter) + ";";
  }

  @Override
  public String toString() {
    String relation = renderRelation(new NumberFormatter(12));
    return name == null ? relation : name + " : " + relation;
  }

  private final MutableExpression body;
  private Direction direction;
  private double lower;
  private double upper;
  private String name;
  private ConstraintGroup group;
  private Key key;
  private double value = Double.NaN;
  private double dual = Double.NaN;
}
