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

import static com.google.common.truth.Truth.assertThat;
import static org.junit.jupiter.api.Assertions.assertThrows;

import java.util.List;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.optmodel.ModelingException;
import org.optmodel.NameRegistry;
import org.optmodel.NumberFormatter;
import org.optmodel.ShapeMismatchException;
import org.optmodel.UnsupportedModelException;
import org.optmodel.symbolic.IndexSet;
import org.optmodel.symbolic.SetIterator;

public final class ExpressionTest {
  private NameRegistry registry;
  private Variable x;
  private Variable y;

  @BeforeEach
  public void setUp() {
    registry = new NameRegistry();
    x = Variable.newBuilder("x").build(registry);
    y = Variable.newBuilder("y").build(registry);
  }

  @Test
  public void plusAndTimes_distributeScalar() {
    Expression e = x.plus(y).times(2);
    assertThat(e.getCoefficient(x)).isEqualTo(2.0);
    assertThat(e.getCoefficient(y)).isEqualTo(2.0);
    assertThat(e.toString()).isEqualTo("2 * x + 2 * y");
  }

  @Test
  public void permanentExpression_isNotModifiedByArithmetic() {
    Expression e = x.plus(1);
    Expression f = e.plus(y);
    assertThat(e.toString()).isEqualTo("x + 1");
    assertThat(f.toString()).isEqualTo("x + y + 1");
    assertThat(e.freeze()).isSameInstanceAs(e);
  }

  @Test
  public void mutableExpression_isUpdatedInPlace() {
    MutableExpression total = Expression.mutable();
    assertThat(total.add(x, 1.0)).isSameInstanceAs(total);
    total.plus(y.times(3));
    total.minus(4);
    assertThat(total.toString()).isEqualTo("x + 3 * y - 4");
    Expression frozen = total.freeze();
    total.setCoefficient(x, 5);
    assertThat(frozen.getCoefficient(x)).isEqualTo(1.0);
    assertThat(total.getCoefficient(x)).isEqualTo(5.0);
  }

  @Test
  public void add_removesCancelledTerms() {
    Expression e = x.plus(y).minus(x);
    assertThat(e.size()).isEqualTo(1);
    assertThat(e.toString()).isEqualTo("y");
  }

  @Test
  public void clean_removesNearZeroCoefficients() {
    Expression e = Expression.of(x, 1e-9).plus(y).plus(1e-12);
    assertThat(e.size()).isEqualTo(2);
    Expression cleaned = e.clean(1e-6);
    assertThat(cleaned.size()).isEqualTo(1);
    assertThat(cleaned.getConstant()).isEqualTo(0.0);
    assertThat(e.size()).isEqualTo(2);
  }

  @Test
  public void mult_producesCrossProducts() {
    Expression e = x.plus(1).times(y.plus(2));
    assertThat(e.toString()).isEqualTo("x * y + 2 * x + y + 2");
    assertThat(e.isLinear()).isFalse();
  }

  @Test
  public void mult_sameVariable_raisesExponent() {
    assertThat(x.times(x).toString()).isEqualTo("x ^ 2");
    assertThat(x.times(y).getCoefficient(Monomial.of(y).multiply(Monomial.of(x))))
        .isEqualTo(1.0);
  }

  @Test
  public void mult_byZero_clearsExpression() {
    Expression e = x.plus(y).plus(3).times(0);
    assertThat(e.isConstant()).isTrue();
    assertThat(e.toString()).isEqualTo("0");
  }

  @Test
  public void pow_expandsSingleMonomial() {
    assertThat(x.times(3).pow(2).toString()).isEqualTo("9 * x ^ 2");
    assertThat(x.pow(1).toString()).isEqualTo("x");
    assertThat(x.pow(0).toString()).isEqualTo("1");
  }

  @Test
  public void pow_keepsCompoundBaseOpaque() {
    Expression e = x.minus(1).pow(2);
    assertThat(e.toString()).isEqualTo("(x - 1) ^ 2");
    assertThat(e.size()).isEqualTo(1);
    x.setValue(3);
    assertThat(e.getValue()).isEqualTo(4.0);
  }

  @Test
  public void pow_fractionalAndSymbolicExponents() {
    assertThat(x.pow(0.5).toString()).isEqualTo("x ^ 0.5");
    assertThat(x.pow(y).toString()).isEqualTo("x ^ y");
  }

  @Test
  public void pow_negativeExponent_throws() {
    ModelingException e = assertThrows(ModelingException.class, () -> x.pow(-1));
    assertThat(e).hasMessageThat().startsWith("Expression.pow: ");
  }

  @Test
  public void div_byConstantScales() {
    assertThat(x.plus(y).div(2).toString()).isEqualTo("0.5 * x + 0.5 * y");
    assertThrows(ModelingException.class, () -> x.div(0));
    assertThrows(ModelingException.class, () -> x.div(Expression.constant(0)));
  }

  @Test
  public void div_byExpression_isOpaqueQuotient() {
    Expression e = x.plus(1).div(y);
    assertThat(e.toString()).isEqualTo("(x + 1) / y");
    x.setValue(3);
    y.setValue(2);
    assertThat(e.getValue()).isEqualTo(2.0);
  }

  @Test
  public void div_byVariablePower_throws() {
    assertThrows(ModelingException.class, () -> x.div(Expression.constant(2).pow(y)));
  }

  @Test
  public void rendering_negativeFirstTermAndConstant() {
    Expression e = Expression.of(y, -1).plus(x).minus(3);
    assertThat(e.toString()).isEqualTo("- y + x - 3");
    assertThat(Expression.constant(-2).toString()).isEqualTo("-2");
    assertThat(Expression.mutable().toString()).isEqualTo("0");
    assertThat(x.times(1.0 / 3).render(new NumberFormatter(3))).isEqualTo("0.333 * x");
  }

  @Test
  public void getValue_usesVariableValues() {
    x.setValue(2);
    y.setValue(3);
    assertThat(x.times(y).plus(1).getValue()).isEqualTo(7.0);
  }

  @Test
  public void getValue_symbolicExpression_throws() {
    IndexSet set = IndexSet.newBuilder("I").build(registry);
    SetIterator i = set.iterator("i");
    Expression e = x.plus(i);
    assertThat(e.isSymbolic()).isTrue();
    assertThrows(UnsupportedModelException.class, e::getValue);
  }

  @Test
  public void weightedSum_checksShapes() {
    Expression e = Expression.weightedSum(List.of(x, y), new double[] {1, -2});
    assertThat(e.toString()).isEqualTo("x - 2 * y");
    ShapeMismatchException mismatch =
        assertThrows(
            ShapeMismatchException.class,
            () -> Expression.weightedSum(List.of(x, y), new double[] {1}));
    assertThat(mismatch).hasMessageThat().startsWith("Expression.weightedSum: ");
  }

  @Test
  public void nonFiniteCoefficient_throws() {
    assertThrows(ModelingException.class, () -> x.times(Double.NaN));
    assertThrows(ModelingException.class, () -> Expression.constant(Double.POSITIVE_INFINITY));
  }

  @Test
  public void functions_renderAndEvaluate() {
    Expression e = Functions.sqrt(x).times(2).plus(Functions.sqrt(x));
    assertThat(e.size()).isEqualTo(1);
    assertThat(e.toString()).isEqualTo("3 * sqrt(x)");
    x.setValue(4);
    assertThat(e.getValue()).isEqualTo(6.0);
    assertThat(Functions.abs(Expression.constant(-2)).getConstant()).isEqualTo(2.0);
    assertThat(Functions.max(x, y, Expression.constant(1)).toString())
        .isEqualTo("max(x, y, 1)");
    assertThrows(ModelingException.class, () -> Functions.log(Expression.constant(-1)));
  }

  @Test
  public void getVariables_inOrderOfAppearance() {
    Expression e = y.times(x).plus(x).plus(y);
    assertThat(e.getVariables()).containsExactly(y, x).inOrder();
  }

  @Test
  public void add_negatedSelf_leavesZero() {
    Expression e = x.times(2).plus(y.times(x)).plus(3);
    Expression difference = e.add(e, -1);
    assertThat(difference.getTerms()).isEmpty();
    assertThat(difference.getConstant()).isEqualTo(0.0);
    assertThat(e.size()).isEqualTo(2);

    MutableExpression m = Expression.mutable();
    m.add(x.plus(4), 1);
    assertThat(m.add(m, -1)).isSameInstanceAs(m);
    assertThat(m.getTerms()).isEmpty();
    assertThat(m.getConstant()).isEqualTo(0.0);
  }

  @Test
  public void functions_sameArgumentShareOneTerm() {
    assertThat(x.negate().getConstant()).isEqualTo(0.0);
    Expression e = Functions.sin(x.negate()).plus(Functions.sin(Expression.of(x, -1)));
    assertThat(e.size()).isEqualTo(1);
    assertThat(e.getTerms().values()).containsExactly(2.0);
    assertThat(e.toString()).isEqualTo("2 * sin(- x)");
  }

  @Test
  public void symbolicTerms_builtTwiceShareOneTerm() {
    IndexSet set = IndexSet.newBuilder("I").build(registry);
    VariableGroup z = VariableGroup.newBuilder("z").addIndex(set).build(registry);
    Expression sums = z.sum().plus(z.sum());
    assertThat(sums.size()).isEqualTo(1);
    assertThat(sums.getTerms().values()).containsExactly(2.0);

    SetIterator i = set.iterator("i");
    Expression shifted = z.at(i.plus(1)).plus(z.at(i.plus(1)));
    assertThat(shifted.size()).isEqualTo(1);
    assertThat(shifted.toString()).isEqualTo("2 * z[i + 1]");
    assertThat(z.at(i.plus(2)).plus(z.at(i.plus(1))).size()).isEqualTo(2);
  }
}
