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
import org.optmodel.symbolic.IndexSet;
import org.optmodel.symbolic.Iteration;
import org.optmodel.symbolic.Parameter;
import org.optmodel.symbolic.ParameterGroup;
import org.optmodel.symbolic.SetIterator;

public final class ConstraintTest {
  private final NumberFormatter formatter = new NumberFormatter(12);
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
  public void le_movesRightHandSideTerms() {
    Constraint c = x.plus(3).le(y.plus(12)).register(registry, "c1");
    assertThat(c.getDirection()).isEqualTo(Direction.LE);
    assertThat(c.getRhs()).isEqualTo(9.0);
    assertThat(c.getBody().getCoefficient(y)).isEqualTo(-1.0);
    assertThat(c.toDeclaration(formatter)).isEqualTo("con c1 : x - y <= 9;");
  }

  @Test
  public void eq_withConstantOnly() {
    Constraint c = x.plus(y).eq(4).register(registry, "balance");
    assertThat(c.toDeclaration(formatter)).isEqualTo("con balance : x + y = 4;");
    assertThat(c.isLinear()).isTrue();
  }

  @Test
  public void range_keepsBoundsApart() {
    Constraint c = x.minus(y).plus(1).eq(2, 4).register(registry, "c2");
    assertThat(c.isRange()).isTrue();
    assertThat(c.getLower()).isEqualTo(2.0);
    assertThat(c.getUpper()).isEqualTo(4.0);
    assertThat(c.toDeclaration(formatter)).isEqualTo("con c2 : 1 <= x - y <= 3;");
    assertThrows(ModelingException.class, c::getRhs);
    assertThrows(ModelingException.class, () -> c.setDirection(Direction.LE));
  }

  @Test
  public void range_invalidBounds_throws() {
    ModelingException e = assertThrows(ModelingException.class, () -> x.eq(3, 1));
    assertThat(e).hasMessageThat().startsWith("Constraint.range: ");
    assertThrows(ModelingException.class, () -> x.eq(Double.NaN, 1));
    assertThrows(
        ModelingException.class,
        () -> x.eq(Double.POSITIVE_INFINITY, Double.POSITIVE_INFINITY));
    assertThrows(
        ModelingException.class,
        () -> x.eq(Double.NEGATIVE_INFINITY, Double.NEGATIVE_INFINITY));
  }

  @Test
  public void updateVarCoef_changesOnlyThatTerm() {
    Constraint c = x.plus(y.times(2)).le(9).register(registry, "c");
    c.updateVarCoef(y, 5);
    Variable z = Variable.newBuilder("z").build(registry);
    c.updateVarCoef(z, -1);
    assertThat(c.toDeclaration(formatter)).isEqualTo("con c : x + 5 * y - z <= 9;");
    assertThat(c.getRhs()).isEqualTo(9.0);
  }

  @Test
  public void setRhsAndDirection() {
    Constraint c = x.ge(1).register(registry, "c");
    c.setRhs(2);
    c.setDirection(Direction.EQ);
    assertThat(c.toDeclaration(formatter)).isEqualTo("con c : x = 2;");
    c.setRange(-1, 1);
    assertThat(c.toDeclaration(formatter)).isEqualTo("con c : -1 <= x <= 1;");
  }

  @Test
  public void constraintIsIndependentOfSourceExpression() {
    MutableExpression total = Expression.mutable();
    total.plus(x);
    Constraint c = total.le(1).register(registry, "c");
    total.plus(y);
    assertThat(c.toDeclaration(formatter)).isEqualTo("con c : x <= 1;");
  }

  @Test
  public void register_generatesNameAndRejectsRenaming() {
    Constraint c = x.le(1).register(registry, "");
    assertThat(c.getName()).isEqualTo("con_1");
    assertThrows(ModelingException.class, () -> c.register(registry, "other"));
    assertThat(c.register(registry, null)).isSameInstanceAs(c);
  }

  @Test
  public void getBodyValue_excludesConstant() {
    Constraint c = x.plus(y).le(10).register(registry, "c");
    x.setValue(2);
    y.setValue(3);
    assertThat(c.getBodyValue()).isEqualTo(5.0);
  }

  @Test
  public void concreteGroup_namesMembersByKey() {
    VariableGroup v = VariableGroup.newBuilder("v").addRange(2).build(registry);
    ConstraintGroup group =
        ConstraintGroup.of(registry, "cap", List.of(0, 1), key -> v.get(key).le(5));
    assertThat(group.size()).isEqualTo(2);
    Constraint first = group.get(0);
    assertThat(first.getName()).isEqualTo("cap_0");
    assertThat(first.getGroup()).isSameInstanceAs(group);
    assertThat(first.getKey()).isEqualTo(Key.of(0));
    assertThat(group.toDeclaration(formatter))
        .isEqualTo("con cap_0 : v[0] <= 5;\ncon cap_1 : v[1] <= 5;");
    assertThrows(ModelingException.class, () -> group.get(2));
  }

  @Test
  public void concreteGroup_duplicateKey_throws() {
    assertThrows(
        ModelingException.class,
        () -> ConstraintGroup.of(registry, "c", List.of(1, 1), key -> x.le(1)));
  }

  @Test
  public void abstractGroup_rendersOneLine() {
    IndexSet set = IndexSet.newBuilder("I").build(registry);
    ParameterGroup cap = ParameterGroup.newBuilder("cap").addIndex(set).build(registry);
    VariableGroup z = VariableGroup.newBuilder("z").addIndex(set).build(registry);
    SetIterator i = set.iterator("i");
    ConstraintGroup group =
        ConstraintGroup.over(registry, "limit", Iteration.over(i), z.get(i).le(cap.get(i)));
    assertThat(group.isAbstract()).isTrue();
    assertThat(group.toDeclaration(formatter))
        .isEqualTo("con limit {i in I} : z[i] - cap[i] <= 0;");
    Parameter budget = Parameter.newBuilder("budget").build(registry);
    assertThat(z.sum().le(budget).isSymbolic()).isTrue();
  }
}
