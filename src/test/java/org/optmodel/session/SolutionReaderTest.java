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

package org.optmodel.session;

import static com.google.common.truth.Truth.assertThat;

import com.google.common.collect.ImmutableList;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.optmodel.Config;
import org.optmodel.NameRegistry;
import org.optmodel.core.Constraint;
import org.optmodel.core.ConstraintGroup;
import org.optmodel.core.Variable;
import org.optmodel.core.VariableGroup;

public final class SolutionReaderTest {
  private NameRegistry registry;
  private Variable x;
  private VariableGroup v;
  private Constraint c;
  private ConstraintGroup cap;
  private SolutionReader reader;

  @BeforeEach
  public void setUp() {
    registry = new NameRegistry();
    x = Variable.newBuilder("x").build(registry);
    v = VariableGroup.newBuilder("v").addIndex(List.of("a", "b")).build(registry);
    c = x.le(3).register(registry, "c");
    cap = ConstraintGroup.of(registry, "cap", List.of("a", "b"), key -> v.get(key).le(1));
    reader = new SolutionReader(Config.getDefault());
  }

  private Map<String, Variable> variables() {
    return SolutionReader.indexVariables(ImmutableList.of(x, v));
  }

  private Map<String, Constraint> constraints() {
    return SolutionReader.indexConstraints(ImmutableList.of(c, cap));
  }

  @Test
  public void index_flattensGroups() {
    assertThat(variables().keySet()).containsExactly("x", "v[a]", "v[b]").inOrder();
    assertThat(constraints().keySet()).containsExactly("c", "cap_a", "cap_b").inOrder();
  }

  @Test
  public void apply_copiesValuesAndDuals() {
    ResultBlock block =
        ResultBlock.newBuilder()
            .putSolutionSummary(ResultBlock.SOLUTION_STATUS, "OPTIMAL")
            .addPrimalRow(SolutionRow.of("x", 3, -0.5))
            .addPrimalRow(SolutionRow.of("v[b]", 1, 0))
            .addDualRow(SolutionRow.of("c", 3, 2))
            .addDualRow(SolutionRow.of("cap_b", 1, 0.25))
            .build();
    assertThat(reader.apply(block, variables(), constraints())).isEqualTo(4);
    assertThat(x.getValue()).isEqualTo(3.0);
    assertThat(x.getDual()).isEqualTo(-0.5);
    assertThat(v.get("b").getValue()).isEqualTo(1.0);
    assertThat(v.get("a").getValue()).isNaN();
    assertThat(c.getDual()).isEqualTo(2.0);
    assertThat(cap.get("b").getDual()).isEqualTo(0.25);
  }

  @Test
  public void apply_skipsUnknownNames() {
    ResultBlock block =
        ResultBlock.newBuilder()
            .putSolutionSummary(ResultBlock.SOLUTION_STATUS, "OPTIMAL")
            .addPrimalRow(SolutionRow.of("X", 1, 0))
            .addPrimalRow(SolutionRow.of("x", 2, 0))
            .addDualRow(SolutionRow.of("cap_c", 1, 1))
            .build();
    assertThat(reader.apply(block, variables(), constraints())).isEqualTo(1);
    assertThat(x.getValue()).isEqualTo(2.0);
  }

  @Test
  public void apply_invalidStatusStillCopiesValues() {
    ResultBlock block =
        ResultBlock.newBuilder()
            .putSolutionSummary(ResultBlock.SOLUTION_STATUS, "INFEASIBLE")
            .addPrimalRow(SolutionRow.of("x", 0, 0))
            .build();
    assertThat(reader.checkStatus(block)).isFalse();
    assertThat(reader.apply(block, variables(), constraints())).isEqualTo(1);
    assertThat(x.getValue()).isEqualTo(0.0);
  }

  @Test
  public void checkStatus_usesConfiguredOutcomes() {
    ResultBlock conditional =
        ResultBlock.newBuilder()
            .putSolutionSummary(ResultBlock.SOLUTION_STATUS, "CONDITIONAL_OPTIMAL")
            .build();
    assertThat(reader.checkStatus(conditional)).isFalse();
    SolutionReader lenient =
        new SolutionReader(
            Config.newBuilder()
                .setValidOutcomes(List.of("OPTIMAL", "CONDITIONAL_OPTIMAL"))
                .build());
    assertThat(lenient.checkStatus(conditional)).isTrue();
    assertThat(reader.checkStatus(ResultBlock.newBuilder().build())).isFalse();
  }

  @Test
  public void resultBlock_parsesObjectiveValue() {
    ResultBlock block =
        ResultBlock.newBuilder()
            .putSolutionSummary(ResultBlock.OBJECTIVE_VALUE, " 12.5 ")
            .putSolutionSummary(ResultBlock.OBJECTIVE_VALUE, "42")
            .putProblemSummary("Objective Sense", "Minimization")
            .build();
    assertThat(block.getObjectiveValue()).isEqualTo(42.0);
    assertThat(block.getProblemSummary()).containsEntry("Objective Sense", "Minimization");
    assertThat(
            ResultBlock.newBuilder()
                .putSolutionSummary(ResultBlock.OBJECTIVE_VALUE, "n/a")
                .build()
                .getObjectiveValue())
        .isNaN();
    assertThat(ResultBlock.newBuilder().build().getObjectiveValue()).isNaN();
  }

  @Test
  public void engineResponse_failureCarriesDiagnostic() {
    EngineResponse failure = EngineResponse.failure("ERROR: out of memory");
    assertThat(failure.isSuccessful()).isFalse();
    assertThat(failure.getDiagnostic()).isEqualTo("ERROR: out of memory");
    assertThat(failure.getBlocks()).isEmpty();
    EngineResponse success = EngineResponse.success(List.of(ResultBlock.newBuilder().build()));
    assertThat(success.isSuccessful()).isTrue();
    assertThat(success.getBlocks()).hasSize(1);
  }
}
