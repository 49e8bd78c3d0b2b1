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
import java.util.Map;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.optmodel.ModelingException;
import org.optmodel.NameRegistry;
import org.optmodel.NumberFormatter;
import org.optmodel.ShapeMismatchException;
import org.optmodel.symbolic.IndexSet;
import org.optmodel.symbolic.SetIterator;

public final class VariableGroupTest {
  private final NumberFormatter formatter = new NumberFormatter(12);
  private NameRegistry registry;

  @BeforeEach
  public void setUp() {
    registry = new NameRegistry();
  }

  private VariableGroup twoByTwo() {
    return VariableGroup.newBuilder("x")
        .addIndex(List.of("a", "b"))
        .addRange(2)
        .setUpperBound(10)
        .build(registry);
  }

  @Test
  public void build_cartesianProductOfIndices() {
    VariableGroup x = twoByTwo();
    assertThat(x.size()).isEqualTo(4);
    assertThat(x.getArity()).isEqualTo(2);
    assertThat(x.getKeys())
        .containsExactly(Key.of("a", 0), Key.of("a", 1), Key.of("b", 0), Key.of("b", 1))
        .inOrder();
    assertThat(x.get("a", 0).getName()).isEqualTo("x[a,0]");
    assertThat(x.get("b", 1).render(formatter)).isEqualTo("x['b',1]");
    assertThat(registry.lookup("x[a,1]")).hasValue(x.get("a", 1));
  }

  @Test
  public void toDeclaration_rendersGroupAndOverrides() {
    VariableGroup x = twoByTwo();
    assertThat(x.toDeclaration(formatter)).isEqualTo("var x {{'a','b'}, 0..1} >= 0 <= 10;");
    x.get("a", 0).setUpperBound(3);
    assertThat(x.toDeclaration(formatter))
        .isEqualTo("var x {{'a','b'}, 0..1} >= 0 <= 10;\nx['a',0].ub = 3;");
  }

  @Test
  public void build_perMemberBounds() {
    VariableGroup y =
        VariableGroup.newBuilder("y")
            .addIndex(List.of("a", "b"))
            .setLowerBound(KeyedValues.ofMap(Map.of("a", 1.0)))
            .build(registry);
    assertThat(y.get("a").getLowerBound()).isEqualTo(1.0);
    assertThat(y.get("b").getLowerBound()).isEqualTo(0.0);
    assertThat(y.toDeclaration(formatter)).isEqualTo("var y {{'a','b'}} >= 0;\ny['a'].lb = 1;");
  }

  @Test
  public void build_boundsAlignedWithMemberOrder() {
    VariableGroup w =
        VariableGroup.newBuilder("w")
            .addRange(3)
            .setUpperBound(KeyedValues.ofList(List.of(1, 2.5, 4)))
            .build(registry);
    assertThat(w.get(0).getUpperBound()).isEqualTo(1.0);
    assertThat(w.get(1).getUpperBound()).isEqualTo(2.5);
    assertThat(w.get(2).getUpperBound()).isEqualTo(4.0);
  }

  @Test
  public void build_perMemberValuesOfWrongShape_throw() {
    ModelingException tooShort =
        assertThrows(
            ModelingException.class,
            () ->
                VariableGroup.newBuilder("w")
                    .addRange(3)
                    .setInit(KeyedValues.ofList(List.of(1, 2)))
                    .build(registry));
    assertThat(tooShort).hasMessageThat().startsWith("VariableGroup.build: ");
    assertThrows(
        ModelingException.class,
        () ->
            VariableGroup.newBuilder("v")
                .addIndex(List.of("a", "b"))
                .addRange(2)
                .setLowerBound(KeyedValues.ofMap(Map.of("a", 1.0)))
                .build(registry));
  }

  @Test
  public void build_binaryGroup() {
    VariableGroup b =
        VariableGroup.newBuilder("b").addRange(3).setType(VarType.BINARY).build(registry);
    assertThat(b.toDeclaration(formatter)).isEqualTo("var b {0..2} binary;");
    assertThat(b.get(2).getUpperBound()).isEqualTo(1.0);
  }

  @Test
  public void get_missingMember_throws() {
    VariableGroup x = twoByTwo();
    assertThrows(ModelingException.class, () -> x.get("c", 0));
  }

  @Test
  public void sum_filtersMembers() {
    VariableGroup x = twoByTwo();
    assertThat(x.sum().size()).isEqualTo(4);
    assertThat(x.sum("a", VariableGroup.ANY).toString()).isEqualTo("x['a',0] + x['a',1]");
    assertThat(x.sum(VariableGroup.ANY, List.of(1)).toString())
        .isEqualTo("x['a',1] + x['b',1]");
    assertThrows(ModelingException.class, () -> x.sum("a"));
  }

  @Test
  public void mult_pairsCoefficientsWithMembers() {
    VariableGroup x = VariableGroup.newBuilder("x").addRange(3).build(registry);
    assertThat(x.mult(new double[] {1, 0, 2}).toString()).isEqualTo("x[0] + 2 * x[2]");
    assertThat(x.mult(Map.of(0, 0, 1, 4, 2, 0)).toString()).isEqualTo("4 * x[1]");
    assertThrows(ShapeMismatchException.class, () -> x.mult(List.of(1, 2)));
  }

  @Test
  public void setBounds_updatesEveryMember() {
    VariableGroup x = twoByTwo();
    x.setBounds(-1, 1);
    for (Variable member : x) {
      assertThat(member.getLowerBound()).isEqualTo(-1.0);
      assertThat(member.getUpperBound()).isEqualTo(1.0);
    }
    assertThat(x.toDeclaration(formatter)).isEqualTo("var x {{'a','b'}, 0..1} >= -1 <= 1;");
  }

  @Test
  public void abstractGroup_rendersSymbolically() {
    IndexSet set = IndexSet.newBuilder("I").build(registry);
    VariableGroup z = VariableGroup.newBuilder("z").addIndex(set).build(registry);
    assertThat(z.isAbstract()).isTrue();
    assertThat(z.size()).isEqualTo(0);
    assertThat(z.toDeclaration(formatter)).isEqualTo("var z {I} >= 0;");
    assertThat(z.sum().toString()).isEqualTo("sum {o1 in I} z[o1]");
    SetIterator i = set.iterator("i");
    assertThat(z.get(i).render(formatter)).isEqualTo("z[i]");
    assertThrows(ModelingException.class, () -> z.get(1));
    assertThrows(ModelingException.class, () -> z.mult(List.of()));
  }
}
