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

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import org.optmodel.ProgramWriter;
import org.optmodel.symbolic.Iteration;

/**
 * A loop over an iteration, executed on the engine:
 *
 * <pre>
 * for {i in I} do;
 *    ...
 * end;
 * </pre>
 */
public class ForLoopStatement implements Statement, StatementContainer {
  public ForLoopStatement(Iteration iteration) {
    this.iteration = iteration;
  }

  public Iteration getIteration() {
    return iteration;
  }

  @Override
  public <T extends Statement> T add(T statement) {
    if (sealed) {
      throw new IllegalStateException(
          "ForLoopStatement.add: the enclosing program is serialized, no statement can be added");
    }
    body.add(statement);
    return statement;
  }

  @Override
  public List<Statement> getStatements() {
    return Collections.unmodifiableList(body);
  }

  @Override
  public void seal() {
    sealed = true;
    for (Statement statement : body) {
      statement.seal();
    }
  }

  /** The loop keyword. */
  protected String keyword() {
    return "for";
  }

  @Override
  public void writeTo(ProgramWriter out) {
    out.line(keyword() + " " + iteration.render(out.getFormatter()) + " do;");
    out.indent();
    for (Statement statement : body) {
      statement.writeTo(out);
    }
    out.dedent();
    out.line("end;");
  }

  private final Iteration iteration;
  private final List<Statement> body = new ArrayList<>();
  private boolean sealed;
}
