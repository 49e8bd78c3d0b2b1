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

import java.util.Objects;
import org.optmodel.NumberFormatter;
import org.optmodel.core.Expression;
import org.optmodel.core.ExpressionArgument;

/**
 * A logical condition evaluated on the engine, used to filter iterations and in conditional
 * statements, e.g. {@code i <= j and j ne 3}.
 */
public final class Condition {
  /** Comparison and logical operators. */
  public enum Operator {
    LE("<="),
    LT("<"),
    GE(">="),
    GT(">"),
    EQ("="),
    NE("ne"),
    IN("in"),
    AND("and"),
    OR("or");

    Operator(String symbol) {
      this.symbol = symbol;
    }

    public String getSymbol() {
      return symbol;
    }

    private final String symbol;
  }

  public static Condition compare(ExpressionArgument left, Operator operator,
      ExpressionArgument right) {
    if (operator == Operator.AND || operator == Operator.OR || operator == Operator.IN) {
      throw new IllegalArgumentException("Condition.compare: not a comparison: " + operator);
    }
    return new Condition(
        Expression.copyOf(left), operator, Expression.copyOf(right), null, null, null);
  }

  public static Condition le(ExpressionArgument left, ExpressionArgument right) {
    return compare(left, Operator.LE, right);
  }

  public static Condition le(ExpressionArgument left, double right) {
    return compare(left, Operator.LE, Expression.constant(right));
  }

  public static Condition lt(ExpressionArgument left, ExpressionArgument right) {
    return compare(left, Operator.LT, right);
  }

  public static Condition lt(ExpressionArgument left, double right) {
    return compare(left, Operator.LT, Expression.constant(right));
  }

  public static Condition ge(ExpressionArgument left, ExpressionArgument right) {
    return compare(left, Operator.GE, right);
  }

  public static Condition ge(ExpressionArgument left, double right) {
    return compare(left, Operator.GE, Expression.constant(right));
  }

  public static Condition gt(ExpressionArgument left, ExpressionArgument right) {
    return compare(left, Operator.GT, right);
  }

  public static Condition gt(ExpressionArgument left, double right) {
    return compare(left, Operator.GT, Expression.constant(right));
  }

  public static Condition eq(ExpressionArgument left, ExpressionArgument right) {
    return compare(left, Operator.EQ, right);
  }

  public static Condition eq(ExpressionArgument left, double right) {
    return compare(left, Operator.EQ, Expression.constant(right));
  }

  public static Condition ne(ExpressionArgument left, ExpressionArgument right) {
    return compare(left, Operator.NE, right);
  }

  public static Condition ne(ExpressionArgument left, double right) {
    return compare(left, Operator.NE, Expression.constant(right));
  }

  /** Returns the membership test {@code element in set}. */
  public static Condition in(ExpressionArgument element, SetDomain set) {
    return new Condition(Expression.copyOf(element), Operator.IN, null, set, null, null);
  }

  private Condition(Expression left, Operator operator, Expression right, SetDomain set,
      Condition first, Condition second) {
    this.left = left;
    this.operator = operator;
    this.right = right;
    this.set = set;
    this.first = first;
    this.second = second;
  }

  public Condition and(Condition other) {
    return new Condition(null, Operator.AND, null, null, this, other);
  }

  public Condition or(Condition other) {
    return new Condition(null, Operator.OR, null, null, this, other);
  }

  public Operator getOperator() {
    return operator;
  }

  public String render(NumberFormatter formatter) {
    switch (operator) {
      case AND:
      case OR:
        return renderOperand(first, formatter) + " " + operator.getSymbol() + " "
            + renderOperand(second, formatter);
      case IN:
        return left.render(formatter) + " in " + set.renderDomain(formatter);
      default:
        return left.render(formatter) + " " + operator.getSymbol() + " "
            + right.render(formatter);
    }
  }

  private String renderOperand(Condition operand, NumberFormatter formatter) {
    boolean logical = operand.operator == Operator.AND || operand.operator == Operator.OR;
    String text = operand.render(formatter);
    return logical && operand.operator != operator ? "(" + text + ")" : text;
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) {
      return true;
    }
    if (!(o instanceof Condition)) {
      return false;
    }
    Condition other = (Condition) o;
    return operator == other.operator
        && sameStructure(left, other.left)
        && sameStructure(right, other.right)
        && Objects.equals(set, other.set)
        && Objects.equals(first, other.first)
        && Objects.equals(second, other.second);
  }

  private static boolean sameStructure(Expression a, Expression b) {
    return a == null ? b == null : b != null && a.sameStructure(b);
  }

  @Override
  public int hashCode() {
    int hash = operator.hashCode();
    hash = 31 * hash + (left == null ? 0 : left.structuralHash());
    hash = 31 * hash + (right == null ? 0 : right.structuralHash());
    hash = 31 * hash + Objects.hashCode(set);
    return 31 * hash + Objects.hash(first, second);
  }

  @Override
  public String toString() {
    return render(new NumberFormatter(12));
  }

  private final Expression left;
  private final Operator operator;
  private final Expression right;
  private final SetDomain set;
  private final Condition first;
  private final Condition second;
}
