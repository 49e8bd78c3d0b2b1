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

package org.optmodel.statement;

import static com.google.common.truth.Truth.assertThat;
import static org.junit.jupiter.api.Assertions.assertThrows;

import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.optmodel.ModelingException;
import org.optmodel.NameRegistry;
import org.optmodel.NumberFormatter;
import org.optmodel.core.Constraint;
import org.optmodel.core.Objective;
import org.optmodel.core.Sense;
import org.optmodel.core.Variable;
import org.optmodel.core.VariableGroup;
import org.optmodel.symbolic.Condition;
import org.optmodel.symbolic.IndexSet;
import org.optmodel.symbolic.Iteration;
import org.optmodel.symbolic.Parameter;
import org.optmodel.symbolic.ParameterGroup;
import org.optmodel.symbolic.SetIterator;

public final class StatementTest {
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
  public void solveOptions_defaultRendersBareSolve() {
    assertThat(SolveOptions.getDefault().toSolveText(formatter)).isEqualTo("solve;");
    assertThat(SolveOptions.getDefault().selectsObjective()).isFalse();
  }

  @Test
  public void solveOptions_rendersSolverFlagsAndOptions() {
    SolveOptions options =
        SolveOptions.newBuilder()
            .setSolver("milp")
            .setRelaxInt(true)
            .setOption("maxtime", 60)
            .setOption("presolver", "none")
            .setOption("heuristics", true)
            .setOption("decomp", Map.of("method", "set"))
            .setPrimalIn(true)
            .build();
    assertThat(options.toSolveText(formatter))
        .isEqualTo(
            "solve with milp relaxint / maxtime=60 presolver=none heuristics"
                + " decomp=(method=set) primalin;");
  }

  @Test
  public void solveOptions_falseFlagIsOmitted() {
    SolveOptions options = SolveOptions.newBuilder().setOption("logfreq", false).build();
    assertThat(options.toSolveText(formatter)).isEqualTo("solve;");
  }

  @Test
  public void solveOptions_objectiveSelection() {
    Objective f1 = Objective.create(registry, x, Sense.MINIMIZE, "f1");
    Objective f2 = Objective.create(registry, y, Sense.MAXIMIZE, "f2");
    SolveOptions single = SolveOptions.newBuilder().setObjective(f1).setObjective(f2).build();
    assertThat(single.toSolveText(formatter)).isEqualTo("solve obj f2;");
    SolveOptions multi = single.toBuilder().addObjective(f1).build();
    assertThat(multi.toSolveText(formatter)).isEqualTo("solve obj (f2 f1);");
    assertThat(SolveOptions.newBuilder().setNoObjective(true).build().toSolveText(formatter))
        .isEqualTo("solve noobj;");
    assertThrows(
        ModelingException.class,
        () -> SolveOptions.newBuilder().setNoObjective(true).setObjective(f1).build());
  }

  @Test
  public void solveOptions_invalidOption_throws() {
    assertThrows(
        ModelingException.class, () -> SolveOptions.newBuilder().setOption("", 1));
    assertThrows(
        ModelingException.class, () -> SolveOptions.newBuilder().setOption("maxiter", null));
  }

  @Test
  public void solveStatement_withProblem() {
    SolveStatement solve =
        new SolveStatement(SolveOptions.newBuilder().setSolver("nlp").build(), "diet");
    assertThat(solve.toText(formatter)).isEqualTo("use problem diet;\nsolve with nlp;");
    assertThat(solve.getSolutionStatus()).isNull();
    assertThat(solve.getObjectiveValue()).isNaN();
  }

  @Test
  public void printStatement_rendersItems() {
    IndexSet set = IndexSet.newBuilder("I").build(registry);
    ParameterGroup p = ParameterGroup.newBuilder("p").addIndex(set).build(registry);
    PrintStatement print = PrintStatement.of(x, p, x.plus(y), "done", 3);
    assertThat(print.toText(formatter)).isEqualTo("print x p (x + y) 'done' 3;");
    assertThat(print.getOutput()).isNull();
    assertThrows(ModelingException.class, () -> PrintStatement.of());
  }

  @Test
  public void printStatement_groupMemberByReference() {
    VariableGroup v = VariableGroup.newBuilder("v").addIndex(List.of("a")).build(registry);
    assertThat(PrintStatement.of(v.get("a")).toText(formatter)).isEqualTo("print v['a'];");
  }

  @Test
  public void fixAndUnfix() {
    FixStatement fix = FixStatement.newBuilder().add(x, 3).add(y).build();
    assertThat(fix.toText(formatter)).isEqualTo("fix x=3 y;");
    assertThat(FixStatement.of(y, 2.5).toText(formatter)).isEqualTo("fix y=2.5;");
    assertThat(UnfixStatement.of(x, y).toText(formatter)).isEqualTo("unfix x y;");
    assertThrows(ModelingException.class, () -> FixStatement.newBuilder().build());
  }

  @Test
  public void assignments() {
    Parameter p = Parameter.newBuilder("p").build(registry);
    assertThat(AssignmentStatement.assign(p, x.plus(1)).toText(formatter))
        .isEqualTo("p = x + 1;");
    assertThat(AssignmentStatement.setLowerBound(x, 2).toText(formatter))
        .isEqualTo("x.lb = 2;");
    assertThat(AssignmentStatement.setUpperBound(x, p).toText(formatter))
        .isEqualTo("x.ub = p;");
    assertThrows(
        ModelingException.class,
        () -> AssignmentStatement.assign("x", 1).toText(formatter));
  }

  @Test
  public void dropAndRestore() {
    Constraint c1 = x.le(1).register(registry, "c1");
    Constraint c2 = y.le(1).register(registry, "c2");
    assertThat(DropStatement.of(c1, c2).toText(formatter)).isEqualTo("drop c1 c2;");
    assertThat(RestoreStatement.of(c1).toText(formatter)).isEqualTo("restore c1;");
    assertThrows(ModelingException.class, () -> DropStatement.of());
  }

  @Test
  public void forLoop_nestsBody() {
    IndexSet set = IndexSet.newBuilder("I").build(registry);
    SetIterator i = set.iterator("i");
    VariableGroup z = VariableGroup.newBuilder("z").addIndex(set).build(registry);
    ForLoopStatement loop = new ForLoopStatement(Iteration.over(i));
    loop.add(FixStatement.of(z.get(i), 0));
    loop.add(new SolveStatement(SolveOptions.getDefault()));
    assertThat(loop.toText(formatter))
        .isEqualTo("for {i in I} do;\n   fix z[i]=0;\n   solve;\nend;");
    CoForLoopStatement coLoop = new CoForLoopStatement(Iteration.over(i));
    coLoop.add(LiteralStatement.of("solve;"));
    assertThat(coLoop.toText(formatter)).isEqualTo("cofor {i in I} do;\n   solve;\nend;");
    assertThat(coLoop.getStatements()).hasSize(1);
  }

  @Test
  public void ifElse_rendersBranches() {
    Parameter p = Parameter.newBuilder("p").build(registry);
    IfElseStatement statement = new IfElseStatement(Condition.gt(p, 1));
    statement.getThen().add(FixStatement.of(x, 1));
    statement.elseIf(Condition.eq(p, 0)).add(UnfixStatement.of(x));
    statement.otherwise().add(PrintStatement.of(p));
    assertThat(statement.toText(formatter))
        .isEqualTo(
            "if p > 1 then do;\n"
                + "   fix x=1;\n"
                + "end;\n"
                + "else if p = 0 then do;\n"
                + "   unfix x;\n"
                + "end;\n"
                + "else do;\n"
                + "   print p;\n"
                + "end;");
    assertThrows(ModelingException.class, statement::otherwise);
    assertThrows(ModelingException.class, () -> statement.elseIf(Condition.lt(p, 0)));
  }

  @Test
  public void readData_rendersKeysAndColumns() {
    IndexSet set = IndexSet.newBuilder("NODES").build(registry);
    ParameterGroup supply = ParameterGroup.newBuilder("supply").addIndex(set).build(registry);
    ParameterGroup demand = ParameterGroup.newBuilder("demand").addIndex(set).build(registry);
    ReadDataStatement read =
        ReadDataStatement.newBuilder("nodedata")
            .setIndexSet(set, "node")
            .addColumn(supply)
            .addColumn(demand, "dem")
            .build();
    assertThat(read.toText(formatter))
        .isEqualTo("read data nodedata into NODES=[node] supply demand=dem;");
    assertThrows(ModelingException.class, () -> ReadDataStatement.newBuilder("t").build());
  }

  @Test
  public void createData_rendersIterationAndColumns() {
    IndexSet set = IndexSet.newBuilder("I").build(registry);
    SetIterator i = set.iterator("i");
    VariableGroup z = VariableGroup.newBuilder("z").addIndex(set).build(registry);
    CreateDataStatement create =
        CreateDataStatement.newBuilder("out")
            .setIteration(Iteration.over(i))
            .addColumn(z)
            .addColumn("twice", z.get(i).times(2))
            .build();
    assertThat(create.toText(formatter))
        .isEqualTo("create data out from [i] = {i in I} z twice=(2 * z[i]);");
    assertThrows(ModelingException.class, () -> CreateDataStatement.newBuilder("t").build());
  }

  @Test
  public void literalStatement_keepsLines() {
    LiteralStatement literal = LiteralStatement.of("expand;\nprint _var_;");
    assertThat(literal.toText(formatter)).isEqualTo("expand;\nprint _var_;");
  }
}
