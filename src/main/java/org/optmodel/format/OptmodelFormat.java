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

package org.optmodel.format;

import com.google.common.collect.ImmutableList;
import org.optmodel.Config;
import org.optmodel.ProgramWriter;
import org.optmodel.core.Constraint;
import org.optmodel.core.Model;
import org.optmodel.core.Objective;
import org.optmodel.core.ProgramElement;
import org.optmodel.statement.DropStatement;
import org.optmodel.statement.SolveOptions;
import org.optmodel.statement.Statement;
import org.optmodel.statement.Workspace;

/**
 * Generates the procedural text of a model or a workspace.
 *
 * <p>Components are written in insertion order, one declaration per variable, constraint, group
 * or objective. The output only depends on the state of the components, so two calls on an
 * unchanged model return identical text.
 */
public final class OptmodelFormat {
  /** Table receiving the variable values of a solve. */
  public static final String PRIMAL_TABLE = "solution";
  /** Table receiving the constraint values of a solve. */
  public static final String DUAL_TABLE = "dual";

  static final String PRIMAL_OUTPUT = "create data " + PRIMAL_TABLE
      + " from [i]= {1.._NVAR_} var=_VAR_.name value=_VAR_ lb=_VAR_.lb ub=_VAR_.ub"
      + " rc=_VAR_.rc;";
  static final String DUAL_OUTPUT = "create data " + DUAL_TABLE
      + " from [j] = {1.._NCON_} con=_CON_.name value=_CON_.body dual=_CON_.dual;";

  /** Returns the program text of {@code model}. */
  public static String toText(Model model, FormatOptions options) {
    Config config = model.getConfig();
    ProgramWriter out = new ProgramWriter(config.getFormatter(), config.getIndent());
    if (options.hasHeader()) {
      out.line("proc optmodel;");
      out.indent();
    }
    for (ProgramElement element : model.getElements()) {
      element.writeTo(out);
    }
    ImmutableList<Constraint> dropped = model.getDroppedConstraints();
    if (!dropped.isEmpty()) {
      DropStatement.of(dropped.toArray(new Constraint[0])).writeTo(out);
    }
    if (options.hasSolve()) {
      out.line(effectiveOptions(model, options.getSolveOptions())
          .toSolveText(out.getFormatter()));
      if (options.parsesResults()) {
        out.line(PRIMAL_OUTPUT);
        out.line(DUAL_OUTPUT);
      }
    }
    for (Statement statement : model.getPostSolveStatements()) {
      statement.writeTo(out);
    }
    if (options.hasHeader()) {
      out.dedent();
      out.line("quit;");
    }
    return out.toString();
  }

  /** Returns the program text of {@code workspace}, in program order. */
  public static String toText(Workspace workspace) {
    Config config = workspace.getConfig();
    ProgramWriter out = new ProgramWriter(config.getFormatter(), config.getIndent());
    out.line("proc optmodel;");
    out.indent();
    for (ProgramElement element : workspace.getElements()) {
      element.writeTo(out);
    }
    out.dedent();
    out.line("quit;");
    return out.toString();
  }

  /** With several objectives and no explicit choice, the solve targets the active objective. */
  private static SolveOptions effectiveOptions(Model model, SolveOptions options) {
    if (options.selectsObjective() || model.getObjectives().size() < 2) {
      return options;
    }
    Objective active = model.getObjective();
    return options.withObjective(active);
  }

  private OptmodelFormat() {}
}
