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

import java.util.ArrayList;
import java.util.List;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.optmodel.ModelingException;
import org.optmodel.SubmissionException;
import org.optmodel.format.FormatOptions;
import org.optmodel.session.EngineResponse;
import org.optmodel.session.ResultBlock;
import org.optmodel.session.Session;
import org.optmodel.session.SolutionRow;
import org.optmodel.session.Submission;
import org.optmodel.statement.SolveOptions;

public final class ModelTest {
  private Model model;

  @BeforeEach
  public void setUp() {
    model = new Model("m");
  }

  private static ResultBlock optimalBlock(double x, double objective) {
    return ResultBlock.newBuilder()
        .putSolutionSummary(ResultBlock.SOLUTION_STATUS, "OPTIMAL")
        .putSolutionSummary(ResultBlock.OBJECTIVE_VALUE, Double.toString(objective))
        .putProblemSummary("Number of Variables", "1")
        .addPrimalRow(SolutionRow.of("x", x, 0.0))
        .build();
  }

  @Test
  public void toText_singleVariableNonlinearObjective() {
    Variable x = model.newNumVar(0, 5, "x");
    model.minimize(x.minus(1).pow(2));
    assertThat(model.getObjective().getName()).isEqualTo("obj_1");
    model.setObjective(x.minus(1).pow(2), Sense.MINIMIZE, "f");
    assertThat(model.toText())
        .isEqualTo(
            "proc optmodel;\n"
                + "   var x >= 0 <= 5;\n"
                + "   min f = (x - 1) ^ 2;\n"
                + "   solve;\n"
                + "quit;\n");
  }

  @Test
  public void toText_isDeterministic() {
    Variable x = model.newNumVar(0, 10, "x");
    Variable y = model.newIntVar(-1, 4, "y");
    model.addLessOrEqual(x.plus(y.times(2)), 9);
    model.maximize(x.plus(y));
    assertThat(model.toText()).isEqualTo(model.toText());
  }

  @Test
  public void setObjective_replacesPreviousObjective() {
    Variable x = model.addVariable("x");
    Objective first = model.setObjective(x, Sense.MINIMIZE, "f");
    Objective second = model.setObjective(x.times(2), Sense.MAXIMIZE, "f");
    assertThat(second).isNotSameInstanceAs(first);
    assertThat(model.getObjectives()).containsExactly(second);
    assertThat(model.toText()).contains("max f = 2 * x;");
    assertThat(model.toText()).doesNotContain("min f");
  }

  @Test
  public void setObjective_usesConfiguredDefaultSense() {
    Variable x = model.addVariable("x");
    assertThat(model.setObjective(x, "f").getSense()).isEqualTo(Sense.MINIMIZE);
  }

  @Test
  public void appendObjective_solvesLastOneByDefault() {
    Variable x = model.addVariable("x");
    model.appendObjective(x, Sense.MINIMIZE, "f1");
    Objective f2 = model.appendObjective(x.times(-1), Sense.MAXIMIZE, "f2");
    assertThat(model.getObjective()).isSameInstanceAs(f2);
    assertThat(model.toText()).contains("   solve obj f2;\n");
  }

  @Test
  public void multiObjectiveSolve_listsObjectives() {
    Variable x = model.addVariable("x");
    Objective f1 = model.appendObjective(x, Sense.MINIMIZE, "f1");
    Objective f2 = model.appendObjective(x.times(-1), Sense.MAXIMIZE, "f2");
    SolveOptions options =
        SolveOptions.newBuilder().setSolver("blackbox").addObjective(f1).addObjective(f2).build();
    String text = model.toText(FormatOptions.newBuilder().setSolveOptions(options).build());
    assertThat(text).contains("   solve with blackbox obj (f1 f2);\n");
  }

  @Test
  public void duplicateName_throws() {
    model.addVariable("x");
    ModelingException e = assertThrows(ModelingException.class, () -> model.addVariable("x"));
    assertThat(e).hasMessageThat().contains("already in use");
  }

  @Test
  public void addConstraint_twice_throws() {
    Variable x = model.addVariable("x");
    Constraint c = model.addConstraint(x.le(1), "c");
    assertThrows(ModelingException.class, () -> model.addConstraint(c, "c"));
  }

  @Test
  public void addLinearConstraint_picksRelation() {
    Variable x = model.addVariable("x");
    assertThat(model.addLinearConstraint(x, Double.NEGATIVE_INFINITY, 3).getDirection())
        .isEqualTo(Direction.LE);
    assertThat(model.addLinearConstraint(x, 1, Double.POSITIVE_INFINITY).getDirection())
        .isEqualTo(Direction.GE);
    assertThat(model.addLinearConstraint(x, 2, 2).getDirection()).isEqualTo(Direction.EQ);
    assertThat(model.addLinearConstraint(x, 1, 2).isRange()).isTrue();
    assertThat(model.numConstraints()).isEqualTo(4);
  }

  @Test
  public void include_sharesComponentsByReference() {
    Variable x = model.newNumVar(0, 5, "x");
    Constraint c = model.addConstraint(x.le(4), "c");
    Model other = new Model("other");
    other.include(model);
    assertThat(other.getVariable("x")).isSameInstanceAs(x);
    assertThat(other.getConstraint("c")).isSameInstanceAs(c);
    x.setUpperBound(3);
    assertThat(other.toText()).contains("var x >= 0 <= 3;");
  }

  @Test
  public void include_groupRegistersMembers() {
    VariableGroup v = model.addVariables(VariableGroup.newBuilder("v").addRange(2));
    Model other = new Model("other");
    other.include(v);
    assertThat(other.numVariables()).isEqualTo(2);
    assertThat(other.getVariable("v[1]")).isSameInstanceAs(v.get(1));
    assertThrows(ModelingException.class, () -> other.addVariable("v[0]"));
  }

  @Test
  public void dropConstraint_groupMemberRendersDropStatement() {
    Variable x = model.addVariable("x");
    ConstraintGroup group = model.addConstraints(List.of(0, 1), key -> x.le(1), "c");
    model.dropConstraint(group.get(1));
    assertThat(model.getDroppedConstraints()).containsExactly(group.get(1));
    assertThat(model.toText()).contains("   drop c_1;\n   solve;\n");
    model.restoreConstraint(group.get(1));
    assertThat(model.toText()).doesNotContain("drop");
  }

  @Test
  public void dropConstraint_standaloneLeavesModel() {
    Variable x = model.addVariable("x");
    Constraint c = model.addConstraint(x.le(1), "c");
    model.dropConstraint(c);
    assertThat(model.numConstraints()).isEqualTo(0);
    assertThat(model.getRegistry().contains("c")).isFalse();
    model.restoreConstraint(c);
    assertThat(model.getConstraint("c")).isSameInstanceAs(c);
    assertThrows(ModelingException.class, () -> model.dropVariable(c));
  }

  @Test
  public void getVariable_missing_throws() {
    assertThrows(ModelingException.class, () -> model.getVariable("nope"));
    assertThrows(ModelingException.class, () -> model.getConstraint("nope"));
  }

  @Test
  public void solve_appliesValuesAndSummaries() {
    Variable x = model.newNumVar(0, 5, "x");
    Objective f = model.setObjective(x.minus(1).pow(2), Sense.MINIMIZE, "f");
    List<Submission> submitted = new ArrayList<>();
    Session session =
        submission -> {
          submitted.add(submission);
          return EngineResponse.success(optimalBlock(1.0, 0.0));
        };
    ResultBlock block = model.solve(session);
    assertThat(submitted).hasSize(1);
    assertThat(submitted.get(0).getKind()).isEqualTo(Submission.Kind.PROGRAM);
    assertThat(submitted.get(0).getProgram()).contains("create data solution");
    assertThat(block.getSolutionStatus()).isEqualTo("OPTIMAL");
    assertThat(x.getValue()).isEqualTo(1.0);
    assertThat(f.getValue()).isEqualTo(0.0);
    assertThat(model.getSolutionStatus()).isEqualTo("OPTIMAL");
    assertThat(model.getProblemSummary()).containsEntry("Number of Variables", "1");
    model.clearSolution();
    assertThat(x.getValue()).isNaN();
    assertThat(model.getSolutionStatus()).isNull();
  }

  @Test
  public void solve_failureKeepsPreviousValues() {
    Variable x = model.newNumVar(0, 5, "x");
    model.setObjective(x, Sense.MINIMIZE, "f");
    model.solve(submission -> EngineResponse.success(optimalBlock(2.0, 2.0)));
    SubmissionException e =
        assertThrows(
            SubmissionException.class,
            () -> model.solve(submission -> EngineResponse.failure("ERROR: syntax error")));
    assertThat(e.getDiagnostic()).isEqualTo("ERROR: syntax error");
    assertThat(x.getValue()).isEqualTo(2.0);
    assertThat(model.getObjectiveValue()).isEqualTo(2.0);
  }

  @Test
  public void solve_transportErrorIsWrapped() {
    model.addVariable("x");
    IllegalStateException cause = new IllegalStateException("connection reset");
    SubmissionException e =
        assertThrows(
            SubmissionException.class,
            () ->
                model.solve(
                    submission -> {
                      throw cause;
                    }));
    assertThat(e).hasCauseThat().isSameInstanceAs(cause);
    assertThat(e).hasMessageThat().isEqualTo("Model.solve: connection reset");
  }

  @Test
  public void solve_emptyResponse_throws() {
    model.addVariable("x");
    assertThrows(
        SubmissionException.class, () -> model.solve(submission -> EngineResponse.success()));
  }

  @Test
  public void solve_matrixFormatSubmitsMatrix() {
    Variable x = model.newNumVar(0, 5, "x");
    model.maximize(x);
    List<Submission> submitted = new ArrayList<>();
    model.solve(
        submission -> {
          submitted.add(submission);
          return EngineResponse.success(optimalBlock(5.0, 5.0));
        },
        SolveOptions.newBuilder().setSolver("lp").setMatrixFormat(true).build());
    Submission submission = submitted.get(0);
    assertThat(submission.getKind()).isEqualTo(Submission.Kind.MATRIX);
    assertThat(submission.getSolver()).isEqualTo("lp");
    assertThat(submission.getMatrix().getColumns()).hasSize(1);
    assertThat(x.getValue()).isEqualTo(5.0);
  }

  @Test
  public void toString_summarizesCounts() {
    model.addVariables(VariableGroup.newBuilder("v").addRange(3));
    assertThat(model.toString()).isEqualTo("Model(m, 3 variables, 0 constraints)");
  }
}
