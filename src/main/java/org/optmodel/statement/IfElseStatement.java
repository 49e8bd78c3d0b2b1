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
import org.optmodel.ModelingException;
import org.optmodel.ProgramWriter;
import org.optmodel.symbolic.Condition;

/**
 * A conditional block:
 *
 * <pre>
 * if x.sol > 1 then do;
 *    ...
 * end;
 * else do;
 *    ...
 * end;
 * </pre>
 */
public final class IfElseStatement implements Statement {
  /** One branch of the conditional. The else branch has no condition. */
  public static final class Case implements StatementContainer {
    private Case(Condition condition) {
      this.condition = condition;
    }

    /** Returns the condition, or null for the else branch. */
    public Condition getCondition() {
      return condition;
    }

    @Override
    public <T extends Statement> T add(T statement) {
      if (sealed) {
        throw new IllegalStateException(
            "IfElseStatement.add: the enclosing program is serialized, no statement can be added");
      }
      statements.add(statement);
      return statement;
    }

    private void seal() {
      sealed = true;
      for (Statement statement : statements) {
        statement.seal();
      }
    }

    @Override
    public List<Statement> getStatements() {
      return Collections.unmodifiableList(statements);
    }

    private final Condition condition;
    private final List<Statement> statements = new ArrayList<>();
    private boolean sealed;
  }

  public IfElseStatement(Condition condition) {
    cases.add(new Case(condition));
  }

  /** Returns the branch taken when the first condition holds. */
  public Case getThen() {
    return cases.get(0);
  }

  /** Appends an {@code else if} branch. */
  public Case elseIf(Condition condition) {
    checkOpen("IfElseStatement.elseIf");
    Case branch = new Case(condition);
    cases.add(branch);
    return branch;
  }

  /** Appends the {@code else} branch. */
  public Case otherwise() {
    checkOpen("IfElseStatement.otherwise");
    Case branch = new Case(null);
    cases.add(branch);
    return branch;
  }

  public List<Case> getCases() {
    return Collections.unmodifiableList(cases);
  }

  @Override
  public void seal() {
    sealed = true;
    for (Case branch : cases) {
      branch.seal();
    }
  }

  private void checkOpen(String methodName) {
    if (sealed) {
      throw new IllegalStateException(
          methodName + ": the enclosing program is serialized, no branch can be added");
    }
    if (cases.get(cases.size() - 1).condition == null) {
      throw new ModelingException(methodName, "the else branch is already defined");
    }
  }

  @Override
  public void writeTo(ProgramWriter out) {
    for (int i = 0; i < cases.size(); i++) {
      Case branch = cases.get(i);
      String head;
      if (branch.condition == null) {
        head = "else do;";
      } else {
        head = (i == 0 ? "if " : "else if ") + branch.condition.render(out.getFormatter())
            + " then do;";
      }
      out.line(head);
      out.indent();
      for (Statement statement : branch.statements) {
        statement.writeTo(out);
      }
      out.dedent();
      out.line("end;");
    }
  }

  private final List<Case> cases = new ArrayList<>();
  private boolean sealed;
}
