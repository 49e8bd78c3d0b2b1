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

import org.optmodel.NameRegistry;
import org.optmodel.NumberFormatter;

/** An expression to minimize or maximize. */
public final class Objective implements Declaration {
  /** Creates an objective, registering its name (or a generated one) in {@code registry}. */
  public static Objective create(NameRegistry registry, ExpressionArgument expression,
      Sense sense, String name) {
    Objective objective = new Objective(Expression.copyOf(expression), sense);
    objective.name = registry.registerOrGenerate(name, "obj", objective);
    return objective;
  }

  private Objective(Expression expression, Sense sense) {
    this.expression = expression;
    this.sense = sense;
  }

  @Override
  public String getName() {
    return name;
  }

  public Sense getSense() {
    return sense;
  }

  public Expression getExpression() {
    return expression;
  }

  /** Returns the objective value reported by the engine, NaN before a solve. */
  public double getValue() {
    return value;
  }

  public void setValue(double value) {
    this.value = value;
  }

  public void clearSolution() {
    value = Double.NaN;
  }

  /** Evaluates the expression from the current variable values. */
  public double evaluate() {
    return expression.getValue();
  }

  @Override
  public String toDeclaration(NumberFormatter formatter) {
    return sense.getKeyword() + " " + name + " = " + expression.render(formatter) + ";";
  }

  @Override
  public String toString() {
    return sense.getKeyword() + " " + name + " = " + expression;
  }

  private final Expression expression;
  private final Sense sense;
  private String name;
  private double value = Double.NaN;
}
