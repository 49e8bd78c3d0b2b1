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

import static com.google.common.truth.Truth.assertThat;
import static org.junit.jupiter.api.Assertions.assertThrows;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.optmodel.ModelingException;
import org.optmodel.NameRegistry;
import org.optmodel.NumberFormatter;
import org.optmodel.UnsupportedModelException;
import org.optmodel.core.Expression;
import org.optmodel.core.Variable;
import org.optmodel.core.VariableGroup;

public final class ParameterTest {
  private final NumberFormatter formatter = new NumberFormatter(12);
  private NameRegistry registry;

  @BeforeEach
  public void setUp() {
    registry = new NameRegistry();
  }

  @Test
  public void parameter_declarations() {
    Parameter p = Parameter.newBuilder("p").setInit(2.5).build(registry);
    assertThat(p.toDeclaration(formatter)).isEqualTo("num p init 2.5;");
    Parameter name =
        Parameter.newBuilder("label").setType(ValueType.STR).setInit("it's").build(registry);
    assertThat(name.toDeclaration(formatter)).isEqualTo("str label init 'it''s';");
    Parameter q = Parameter.newBuilder("q").setValue(p.times(2)).build(registry);
    assertThat(q.toDeclaration(formatter)).isEqualTo("num q = 2 * p;");
  }

  @Test
  public void parameter_stringInitForNumber_throws() {
    assertThrows(
        ModelingException.class,
        () -> Parameter.newBuilder("p").setInit("a").build(registry));
  }

  @Test
  public void parameter_isSymbolic() {
    Parameter p = Parameter.newBuilder("p").build(registry);
    Expression e = p.plus(1);
    assertThat(e.isSymbolic()).isTrue();
    assertThat(e.toString()).isEqualTo("p + 1");
    assertThrows(UnsupportedModelException.class, e::getValue);
  }

  @Test
  public void parameterGroup_overSets() {
    IndexSet set = IndexSet.newBuilder("I").build(registry);
    ParameterGroup cost =
        ParameterGroup.newBuilder("cost").addIndex(set).setInit(0).build(registry);
    assertThat(cost.toDeclaration(formatter)).isEqualTo("num cost {I} init 0;");
    assertThat(cost.get(1).render(formatter)).isEqualTo("cost[1]");
    assertThrows(ModelingException.class, () -> cost.get(1, 2));
  }

  @Test
  public void parameterGroup_overIteration() {
    IndexSet set = IndexSet.newBuilder("I").build(registry);
    SetIterator i = set.iterator("i");
    ParameterGroup square =
        ParameterGroup.newBuilder("sq")
            .over(Iteration.over(i))
            .setValue(i.times(i))
            .build(registry);
    assertThat(square.toDeclaration(formatter)).isEqualTo("num sq {i in I} = i ^ 2;");
  }

  @Test
  public void parameterGroup_needsExactlyOneIndex() {
    assertThrows(
        ModelingException.class, () -> ParameterGroup.newBuilder("p").build(registry));
  }

  @Test
  public void implicitVariable_scalarEvaluatesDefinition() {
    Variable x = Variable.newBuilder("x").build(registry);
    Variable y = Variable.newBuilder("y").build(registry);
    ImplicitVariable total =
        ImplicitVariable.newBuilder("total").setDefinition(x.plus(y)).build(registry);
    assertThat(total.toDeclaration(formatter)).isEqualTo("impvar total = x + y;");
    x.setValue(1);
    y.setValue(2);
    assertThat(total.evaluate()).isEqualTo(3.0);
    assertThat(total.times(2).toString()).isEqualTo("2 * total");
  }

  @Test
  public void implicitVariable_indexed() {
    IndexSet set = IndexSet.newBuilder("I").build(registry);
    SetIterator i = set.iterator("i");
    VariableGroup x = VariableGroup.newBuilder("x").addIndex(set).build(registry);
    ImplicitVariable twice =
        ImplicitVariable.newBuilder("twice")
            .over(Iteration.over(i))
            .setDefinition(x.get(i).times(2))
            .build(registry);
    assertThat(twice.toDeclaration(formatter)).isEqualTo("impvar twice {i in I} = 2 * x[i];");
    assertThat(twice.get(3).render(formatter)).isEqualTo("twice[3]");
    assertThrows(ModelingException.class, twice::toExpression);
    assertThrows(UnsupportedModelException.class, twice::evaluate);
  }

  @Test
  public void symbolicSum_rendersBody() {
    IndexSet set = IndexSet.newBuilder("I").build(registry);
    SetIterator i = set.iterator("i");
    ParameterGroup c = ParameterGroup.newBuilder("c").addIndex(set).build(registry);
    VariableGroup x = VariableGroup.newBuilder("x").addIndex(set).build(registry);
    Expression single = SymbolicSum.over(Iteration.over(i), c.get(i).times(x.get(i)));
    assertThat(single.toString()).isEqualTo("sum {i in I} c[i] * x[i]");
    Expression compound = SymbolicSum.over(Iteration.over(i), x.get(i).plus(1));
    assertThat(compound.times(2).toString()).isEqualTo("2 * sum {i in I} (x[i] + 1)");
    assertThat(compound.isSymbolic()).isTrue();
    assertThrows(UnsupportedModelException.class, compound::getValue);
  }
}
