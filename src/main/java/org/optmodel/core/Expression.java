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

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.optmodel.ModelingException;
import org.optmodel.NumberFormatter;
import org.optmodel.ShapeMismatchException;
import org.optmodel.UnsupportedModelException;

/**
 * A sum of monomials with numeric coefficients, plus a constant.
 *
 * <p>An {@code Expression} is permanent: every arithmetic operation returns a new expression and
 * leaves the operands unchanged. Use {@link #mutable()} or {@link #toMutable()} to obtain a
 * {@link MutableExpression}, which is updated in place, and {@link #freeze()} to get back a
 * permanent copy.
 *
 * <p>Monomials are kept in insertion order. Two structurally identical monomials always share a
 * single coefficient entry, and an entry whose coefficient becomes exactly zero after an addition
 * is removed. Near-zero coefficients are only removed by {@link #clean(double)}.
 */
public class Expression implements ExpressionArgument {
  private static final NumberFormatter DEFAULT_FORMATTER = new NumberFormatter(12);

  /** Returns the constant expression {@code value}. */
  public static Expression constant(double value) {
    Expression e = new Expression();
    e.constant = checkFinite("Expression.constant", value);
    return e;
  }

  /** Returns the expression {@code term}. */
  public static Expression of(Term term) {
    return of(term, 1.0);
  }

  /** Returns the expression {@code coefficient * term}. */
  public static Expression of(Term term, double coefficient) {
    Expression e = new Expression();
    e.addTerm(Monomial.of(term), checkFinite("Expression.of", coefficient));
    return e;
  }

  /** Returns a permanent copy of {@code argument}. */
  public static Expression copyOf(ExpressionArgument argument) {
    return new Expression(argument.toExpression());
  }

  /** Returns an empty expression updated in place by arithmetic operations. */
  public static MutableExpression mutable() {
    return new MutableExpression();
  }

  /** Returns the sum of the arguments. */
  public static Expression sum(Iterable<? extends ExpressionArgument> arguments) {
    Expression result = new Expression();
    for (ExpressionArgument argument : arguments) {
      result.addInPlace("Expression.sum", argument.toExpression(), 1.0);
    }
    return result;
  }

  /** Returns the sum of the arguments. */
  public static Expression sum(ExpressionArgument... arguments) {
    Expression result = new Expression();
    for (ExpressionArgument argument : arguments) {
      result.addInPlace("Expression.sum", argument.toExpression(), 1.0);
    }
    return result;
  }

  /** Returns sum(arguments[i] * coefficients[i]). */
  public static Expression weightedSum(
      List<? extends ExpressionArgument> arguments, double[] coefficients) {
    if (arguments.size() != coefficients.length) {
      throw new ShapeMismatchException(
          "Expression.weightedSum",
          "arguments",
          arguments.size(),
          "coefficients",
          coefficients.length);
    }
    Expression result = new Expression();
    for (int i = 0; i < coefficients.length; ++i) {
      result.addInPlace("Expression.weightedSum", arguments.get(i).toExpression(), coefficients[i]);
    }
    return result;
  }

  Expression() {
    this.terms = new LinkedHashMap<>();
    this.constant = 0.0;
  }

  Expression(Expression other) {
    this.terms = new LinkedHashMap<>(other.terms);
    this.constant = other.constant;
  }

  /** Returns the expression receiving the result of an arithmetic operation. */
  Expression target() {
    return new Expression(this);
  }

  // ExpressionArgument interface
  @Override
  public Expression toExpression() {
    return this;
  }

  /** Adds {@code sign * other}. */
  public Expression add(ExpressionArgument other, double sign) {
    Expression result = target();
    result.addInPlace("Expression.add", other.toExpression(), sign);
    return result;
  }

  /** Adds a constant. */
  public Expression add(double value) {
    Expression result = target();
    result.constant = checkFinite("Expression.add", result.constant + value);
    return result;
  }

  /** Multiplies every coefficient and the constant by {@code scalar}. */
  public Expression mult(double scalar) {
    checkFinite("Expression.mult", scalar);
    Expression result = target();
    if (scalar == 0.0) {
      result.terms.clear();
      result.constant = 0.0;
      return result;
    }
    for (Map.Entry<Monomial, Double> entry : result.terms.entrySet()) {
      entry.setValue(checkFinite("Expression.mult", entry.getValue() * scalar));
    }
    result.constant = checkFinite("Expression.mult", result.constant * scalar);
    return result;
  }

  /** Multiplies by {@code other}, producing the cross products of all terms. */
  public Expression mult(ExpressionArgument other) {
    Expression right = other.toExpression();
    if (right.terms.isEmpty()) {
      return mult(right.constant);
    }
    Expression left = this;
    if (right == this) {
      right = new Expression(this);
    }
    Expression product = new Expression();
    for (Map.Entry<Monomial, Double> l : left.terms.entrySet()) {
      for (Map.Entry<Monomial, Double> r : right.terms.entrySet()) {
        product.addTerm(l.getKey().multiply(r.getKey()), l.getValue() * r.getValue());
      }
      if (right.constant != 0.0) {
        product.addTerm(l.getKey(), l.getValue() * right.constant);
      }
    }
    if (left.constant != 0.0) {
      for (Map.Entry<Monomial, Double> r : right.terms.entrySet()) {
        product.addTerm(r.getKey(), left.constant * r.getValue());
      }
    }
    product.constant = checkFinite("Expression.mult", left.constant * right.constant);
    return assign(product);
  }

  /** Divides by a nonzero scalar. */
  public Expression divide(double scalar) {
    if (scalar == 0.0) {
      throw new ModelingException("Expression.div", "division by zero");
    }
    return mult(1.0 / scalar);
  }

  /**
   * Divides by {@code other}. A constant divisor scales the coefficients, any other divisor
   * produces an opaque quotient term.
   */
  public Expression divide(ExpressionArgument other) {
    Expression denominator = other.toExpression();
    if (denominator.terms.isEmpty()) {
      return divide(denominator.constant);
    }
    for (Monomial monomial : denominator.terms.keySet()) {
      for (Term term : monomial.getFactors().keySet()) {
        if (term instanceof PowerTerm && ((PowerTerm) term).hasVariableExponent()) {
          throw new ModelingException(
              "Expression.div", "division by a power with a variable exponent is not supported");
        }
      }
    }
    return assign(Expression.of(new QuotientTerm(copyOf(this), copyOf(denominator))));
  }

  /**
   * Raises this expression to a non-negative numeric power.
   *
   * <p>A single monomial raised to an integer power is expanded, e.g. {@code (3 * x * y) ^ 2}
   * becomes {@code 9 * x ^ 2 * y ^ 2}. Other bases and fractional exponents produce an opaque
   * power term such as {@code (x - 1) ^ 2}.
   */
  public Expression power(double exponent) {
    if (Double.isNaN(exponent) || Double.isInfinite(exponent)) {
      throw new ModelingException("Expression.pow", "exponent must be finite: " + exponent);
    }
    if (exponent < 0) {
      throw new ModelingException(
          "Expression.pow", "negative exponent " + exponent + " is not supported");
    }
    if (terms.isEmpty()) {
      return assign(constant(checkFinite("Expression.pow", Math.pow(constant, exponent))));
    }
    boolean integral = exponent == Math.rint(exponent) && exponent <= Integer.MAX_VALUE;
    if (integral && exponent == 0) {
      return assign(constant(1.0));
    }
    if (integral && exponent == 1) {
      return assign(new Expression(this));
    }
    if (integral && terms.size() == 1 && constant == 0.0) {
      Map.Entry<Monomial, Double> entry = terms.entrySet().iterator().next();
      int n = (int) exponent;
      Expression result = new Expression();
      result.addTerm(
          entry.getKey().power(n), checkFinite("Expression.pow", Math.pow(entry.getValue(), n)));
      return assign(result);
    }
    return assign(Expression.of(new PowerTerm(copyOf(this), constant(exponent))));
  }

  /** Raises this expression to a symbolic or variable exponent. */
  public Expression power(ExpressionArgument exponent) {
    Expression e = exponent.toExpression();
    if (e.terms.isEmpty()) {
      return power(e.constant);
    }
    return assign(Expression.of(new PowerTerm(copyOf(this), copyOf(e))));
  }

  /** Returns an expression without the coefficients of magnitude at most {@code tolerance}. */
  public Expression clean(double tolerance) {
    Expression result = target();
    result.terms.values().removeIf(coefficient -> Math.abs(coefficient) <= tolerance);
    if (Math.abs(result.constant) <= tolerance) {
      result.constant = 0.0;
    }
    return result;
  }

  /** Returns a permanent version of this expression. */
  public Expression freeze() {
    return this;
  }

  /** Returns a mutable copy of this expression. */
  public MutableExpression toMutable() {
    return new MutableExpression(this);
  }

  /** Returns the monomials and their coefficients, in insertion order. */
  public Map<Monomial, Double> getTerms() {
    return Collections.unmodifiableMap(terms);
  }

  public double getConstant() {
    return constant;
  }

  /** Returns the coefficient of {@code term} to the first power, 0 if absent. */
  public double getCoefficient(Term term) {
    return getCoefficient(Monomial.of(term));
  }

  /** Returns the coefficient of {@code monomial}, 0 if absent. */
  public double getCoefficient(Monomial monomial) {
    return terms.getOrDefault(monomial, 0.0);
  }

  /** Number of monomials, excluding the constant. */
  public int size() {
    return terms.size();
  }

  public boolean isConstant() {
    return terms.isEmpty();
  }

  /** Returns true if every monomial is a single decision variable to the first power. */
  public boolean isLinear() {
    for (Monomial monomial : terms.keySet()) {
      Term term = monomial.asSingleTerm();
      if (term == null || !term.isDecisionVariable()) {
        return false;
      }
    }
    return true;
  }

  /** Returns true if some term can only be resolved on the remote engine. */
  public boolean isSymbolic() {
    for (Monomial monomial : terms.keySet()) {
      if (monomial.isSymbolic()) {
        return true;
      }
    }
    return false;
  }

  /** Returns the decision variables appearing in this expression, in order of appearance. */
  public List<Variable> getVariables() {
    List<Variable> variables = new ArrayList<>();
    for (Monomial monomial : terms.keySet()) {
      for (Term term : monomial.getFactors().keySet()) {
        if (term instanceof Variable && !variables.contains(term)) {
          variables.add((Variable) term);
        }
      }
    }
    return variables;
  }

  /**
   * Evaluates the expression from the current values of its variables.
   *
   * @throws UnsupportedModelException if the expression is symbolic
   */
  public double getValue() {
    if (isSymbolic()) {
      throw new UnsupportedModelException(
          "Expression.getValue", "symbolic expression " + this + " cannot be evaluated");
    }
    double value = constant;
    for (Map.Entry<Monomial, Double> entry : terms.entrySet()) {
      value += entry.getValue() * entry.getKey().evaluate();
    }
    return value;
  }

  /** Renders the expression, the constant last, e.g. {@code x + 2 * y - 3}. */
  public String render(NumberFormatter formatter) {
    String body = renderTerms(formatter);
    if (body.isEmpty()) {
      return formatter.format(constant);
    }
    if (constant == 0.0) {
      return body;
    }
    return body + " " + formatter.formatSigned(constant);
  }

  /** Renders the monomials without the constant, or an empty string if there are none. */
  public String renderTerms(NumberFormatter formatter) {
    StringBuilder sb = new StringBuilder();
    for (Map.Entry<Monomial, Double> entry : terms.entrySet()) {
      double coefficient = entry.getValue();
      if (coefficient == 0.0) {
        continue;
      }
      if (sb.length() == 0) {
        if (coefficient < 0) {
          sb.append("- ");
        }
      } else {
        sb.append(coefficient < 0 ? " - " : " + ");
      }
      double magnitude = Math.abs(coefficient);
      if (magnitude != 1.0) {
        sb.append(formatter.format(magnitude)).append(" * ");
      }
      sb.append(entry.getKey().render(formatter));
    }
    return sb.toString();
  }

  /** Returns true if the rendering holds more than one term, i.e. needs parentheses as a factor. */
  public boolean isCompound() {
    int count = terms.size() + (constant != 0.0 ? 1 : 0);
    if (count > 1) {
      return true;
    }
    if (terms.size() == 1) {
      double coefficient = terms.values().iterator().next();
      return coefficient != 1.0 || terms.keySet().iterator().next().getFactors().size() > 1;
    }
    return constant < 0;
  }

  /**
   * Returns true if both expressions hold the same terms with the same coefficients and the same
   * constant. Used by terms and keys that hold sub-expressions.
   */
  public boolean sameStructure(Expression other) {
    return constant == other.constant && terms.equals(other.terms);
  }

  /** Hash code consistent with {@link #sameStructure}. */
  public int structuralHash() {
    return 31 * terms.hashCode() + (constant == 0.0 ? 0 : Double.hashCode(constant));
  }

  @Override
  public String toString() {
    return render(DEFAULT_FORMATTER);
  }

  // Internal mutation helpers, applied only to expressions owned by the caller.

  void addInPlace(String methodName, Expression other, double sign) {
    checkFinite(methodName, sign);
    if (other == this) {
      other = new Expression(other);
    }
    for (Map.Entry<Monomial, Double> entry : other.terms.entrySet()) {
      addTerm(entry.getKey(), checkFinite(methodName, sign * entry.getValue()));
    }
    constant = checkFinite(methodName, constant + sign * other.constant);
  }

  void addTerm(Monomial monomial, double coefficient) {
    Double merged = terms.merge(monomial, coefficient, Double::sum);
    if (merged != null && merged == 0.0) {
      terms.remove(monomial);
    }
  }

  void setTerm(Monomial monomial, double coefficient) {
    terms.put(monomial, checkFinite("Expression.setCoefficient", coefficient));
  }

  void setConstantInPlace(double value) {
    constant = checkFinite("Expression.setConstant", value);
  }

  /** Stores {@code result} into the receiver of the operation. */
  Expression assign(Expression result) {
    return result;
  }

  void replaceContents(Expression other) {
    if (other == this) {
      return;
    }
    terms.clear();
    terms.putAll(other.terms);
    constant = other.constant;
  }

  static double checkFinite(String methodName, double value) {
    if (Double.isNaN(value) || Double.isInfinite(value)) {
      throw new ModelingException(methodName, "coefficient must be finite, got " + value);
    }
    // -0.0 and 0.0 must compare equal in term keys.
    return value == 0.0 ? 0.0 : value;
  }

  final LinkedHashMap<Monomial, Double> terms;
  double constant;
}
