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

import java.util.List;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.optmodel.NameRegistry;
import org.optmodel.NumberFormatter;
import org.optmodel.core.Expression;

public final class IndexSetTest {
  private final NumberFormatter formatter = new NumberFormatter(12);
  private NameRegistry registry;

  @BeforeEach
  public void setUp() {
    registry = new NameRegistry();
  }

  @Test
  public void toDeclaration_range() {
    IndexSet set = IndexSet.newBuilder("I").setValue(SetRange.of(1, 3)).build(registry);
    assertThat(set.toDeclaration(formatter)).isEqualTo("set I = 1..3;");
    assertThat(set.getDimension()).isEqualTo(1);
  }

  @Test
  public void toDeclaration_symbolicRangeEnd() {
    Parameter n = Parameter.newBuilder("n").setInit(5).build(registry);
    IndexSet set =
        IndexSet.newBuilder("I").setInit(SetRange.of(Expression.constant(1), n)).build(registry);
    assertThat(set.toDeclaration(formatter)).isEqualTo("set I init 1..n;");
  }

  @Test
  public void toDeclaration_stringMembers() {
    IndexSet set =
        IndexSet.newBuilder("CITY")
            .setTypes(ValueType.STR)
            .setValue(List.of("paris", "rome"))
            .build(registry);
    assertThat(set.toDeclaration(formatter)).isEqualTo("set <str> CITY = {'paris','rome'};");
  }

  @Test
  public void toDeclaration_tupleSet() {
    IndexSet set =
        IndexSet.newBuilder("ARCS")
            .setTypes(ValueType.NUM, ValueType.STR)
            .setInit(List.of(List.of(1, "a"), List.of(2, "b")))
            .build(registry);
    assertThat(set.toDeclaration(formatter))
        .isEqualTo("set <num, str> ARCS init {<1,'a'>,<2,'b'>};");
    assertThat(set.getDimension()).isEqualTo(2);
  }

  @Test
  public void toDeclaration_withoutMembers() {
    IndexSet set = IndexSet.newBuilder("I").build(registry);
    assertThat(set.toDeclaration(formatter)).isEqualTo("set I;");
    assertThat(set.getMembers()).isNull();
  }

  @Test
  public void iterator_checksDimension() {
    IndexSet set =
        IndexSet.newBuilder("ARCS").setTypes(ValueType.NUM, ValueType.NUM).build(registry);
    assertThrows(IllegalArgumentException.class, () -> set.iterator("i"));
    List<SetIterator> tuple = set.iterators("i", "j");
    assertThat(tuple).hasSize(2);
    assertThat(tuple.get(1).getPosition()).isEqualTo(1);
    assertThat(Iteration.over(tuple).render(formatter)).isEqualTo("{<i, j> in ARCS}");
    assertThrows(IllegalArgumentException.class, () -> set.iterators("i"));
  }

  @Test
  public void iteration_rendersBindingsAndFilter() {
    IndexSet set = IndexSet.newBuilder("I").build(registry);
    SetIterator i = set.iterator("i");
    SetIterator j = set.iterator("j");
    Iteration iteration =
        Iteration.over(i, j).where(Condition.le(i, j)).where(Condition.ne(j, 3));
    assertThat(iteration.render(formatter)).isEqualTo("{i in I, j in I: i <= j and j ne 3}");
  }

  @Test
  public void condition_parenthesizesMixedOperators() {
    IndexSet set = IndexSet.newBuilder("I").build(registry);
    SetIterator i = set.iterator("i");
    Condition c = Condition.gt(i, 1).and(Condition.lt(i, 4).or(Condition.eq(i, 9)));
    assertThat(c.render(formatter)).isEqualTo("i > 1 and (i < 4 or i = 9)");
    assertThat(Condition.in(i, SetRange.of(1, 2)).render(formatter)).isEqualTo("i in 1..2");
    assertThrows(
        IllegalArgumentException.class,
        () -> Condition.compare(i, Condition.Operator.AND, i));
  }

  @Test
  public void literalSet_rejectsMixedDimensions() {
    assertThrows(
        IllegalArgumentException.class,
        () -> LiteralSet.ofValues(List.of(1, List.of(1, 2))));
  }
}
