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

import org.optmodel.ModelingException;
import org.optmodel.NameRegistry;
import org.optmodel.NumberFormatter;

/**
 * A decision variable.
 *
 * <p>Variables are held by reference: the same variable included in two models is one object,
 * and a solution value written by one model is visible through the other. Expressions reference
 * variables without copying their bounds.
 */
public final class Variable implements Term, ExpressionArgument, Declaration {
  /** Builder for a standalone {@link Variable}. */
  public static final class Builder {
    private final String name;
    private VarType type = VarType.CONTINUOUS;
    private Double lowerBound;
    private Double upperBound;
    private Double init;

    private Builder(String name) {
      this.name = name;
    }

    public Builder setType(VarType type) {
      this.type = type;
      return this;
    }

    public Builder setLowerBound(double lowerBound) {
      this.lowerBound = lowerBound;
      return this;
    }

    public Builder setUpperBound(double upperBound) {
      this.upperBound = upperBound;
      return this;
    }

    public Builder setBounds(double lowerBound, double upperBound) {
      this.lowerBound = lowerBound;
      this.upperBound = upperBound;
      return this;
    }

    public Builder setInit(double init) {
      this.init = init;
      return this;
    }

    /** Creates the variable, registering its name in {@code registry}. */
    public Variable build(NameRegistry registry) {
      double lb = lowerBound != null ? lowerBound : type.defaultLowerBound();
      double ub = upperBound != null ? upperBound : type.defaultUpperBound();
      Variable variable = new Variable(null, null, type, lb, ub, init);
      variable.name = registry.registerOrGenerate(name, "x", variable);
      return variable;
    }
  }

  /** Returns a builder; an empty name is replaced by a generated one. */
  public static Builder newBuilder(String name) {
    return new Builder(name);
  }

  Variable(VariableGroup group, Key key, VarType type, double lb, double ub, Double init) {
    this.group = group;
    this.key = key;
    this.type = type;
    this.init = init;
    setBounds(lb, ub);
  }

  /** Sets the name of a group member. */
  void setMemberName(String name) {
    this.name = name;
  }

  /** Returns the name, {@code x[0,a]} for a group member. */
  @Override
  public String getName() {
    return name;
  }

  public VarType getType() {
    return type;
  }

  public double getLowerBound() {
    return lowerBound;
  }

  public double getUpperBound() {
    return upperBound;
  }

  public void setLowerBound(double lowerBound) {
    setBounds(lowerBound, this.upperBound);
  }

  public void setUpperBound(double upperBound) {
    setBounds(this.lowerBound, upperBound);
  }

  /**
   * Updates both bounds. Binary variables are clamped to {@code [0, 1]}. Expressions already built
   * over this variable see the new bounds.
   */
  public void setBounds(double lowerBound, double upperBound) {
    if (Double.isNaN(lowerBound) || Double.isNaN(upperBound)) {
      throw new ModelingException("Variable.setBounds", "bounds must not be NaN");
    }
    if (type == VarType.BINARY) {
      lowerBound = Math.max(lowerBound, 0.0);
      upperBound = Math.min(upperBound, 1.0);
    }
    this.lowerBound = lowerBound;
    this.upperBound = upperBound;
  }

  /** Returns the initial value, or null. */
  public Double getInit() {
    return init;
  }

  public void setInit(Double init) {
    this.init = init;
  }

  /** Inline setter. */
  public Variable withInit(double init) {
    setInit(init);
    return this;
  }

  /** Returns the solution value, NaN before a solve. */
  public double getValue() {
    return value;
  }

  public void setValue(double value) {
    this.value = value;
  }

  /** Returns the reduced cost, NaN before a solve. */
  public double getDual() {
    return dual;
  }

  public void setDual(double dual) {
    this.dual = dual;
  }

  /** Resets the solution value and the reduced cost. */
  public void clearSolution() {
    value = Double.NaN;
    dual = Double.NaN;
  }

  /** Returns the owning group, or null for a standalone variable. */
  public VariableGroup getGroup() {
    return group;
  }

  /** Returns the key within the owning group, or null for a standalone variable. */
  public Key getKey() {
    return key;
  }

  // Term interface
  @Override
  public String render(NumberFormatter formatter) {
    if (group != null) {
      return group.getName() + "[" + key.render(formatter) + "]";
    }
    return name;
  }

  @Override
  public double evaluate() {
    return value;
  }

  @Override
  public boolean isSymbolic() {
    return false;
  }

  @Override
  public boolean isDecisionVariable() {
    return true;
  }

  // ExpressionArgument interface
  @Override
  public Expression toExpression() {
    return Expression.of(this);
  }

  // Declaration interface
  @Override
  public String toDeclaration(NumberFormatter formatter) {
    StringBuilder sb = new StringBuilder("var ").append(name);
    appendAttributes(sb, type, lowerBound, upperBound, init, formatter);
    return sb.append(';').toString();
  }

  /** Appends the type, the bounds that differ from the engine defaults and the initial value. */
  static void appendAttributes(StringBuilder sb, VarType type, double lb, double ub, Double init,
      NumberFormatter formatter) {
    if (type != VarType.CONTINUOUS) {
      sb.append(' ').append(type.getKeyword());
    }
    if (lb != Double.NEGATIVE_INFINITY && !(type == VarType.BINARY && lb == 0.0)) {
      sb.append(" >= ").append(formatter.format(lb));
    }
    if (ub != Double.POSITIVE_INFINITY && !(type == VarType.BINARY && ub == 1.0)) {
      sb.append(" <= ").append(formatter.format(ub));
    }
    if (init != null) {
      sb.append(" init ").append(formatter.format(init));
    }
  }

  @Override
  public String toString() {
    return name;
  }

  private final VariableGroup group;
  private final Key key;
  private final VarType type;
  private String name;
  private double lowerBound;
  private double upperBound;
  private Double init;
  private double value = Double.NaN;
  private double dual = Double.NaN;
}
