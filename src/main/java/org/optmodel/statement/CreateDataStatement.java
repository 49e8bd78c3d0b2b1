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

import com.google.common.collect.ImmutableList;
import java.util.ArrayList;
import java.util.List;
import java.util.stream.Collectors;
import org.optmodel.ModelingException;
import org.optmodel.ProgramWriter;
import org.optmodel.core.Expression;
import org.optmodel.core.ExpressionArgument;
import org.optmodel.symbolic.Iteration;
import org.optmodel.symbolic.SetIterator;

/**
 * Writes values computed on the engine into a table:
 *
 * <pre>
 * create data out from [i j] = {i in I, j in J} x ratio=(x[i, j] / cap[i]);
 * </pre>
 */
public final class CreateDataStatement implements Statement {
  /** One output column: a whole declaration, or a named expression. */
  private static final class Column {
    final String name;
    final Object value;

    Column(String name, Object value) {
      this.name = name;
      this.value = value;
    }
  }

  /** Builder for {@link CreateDataStatement}. */
  public static final class Builder {
    private final String table;
    private Iteration iteration;
    private final List<Column> columns = new ArrayList<>();

    private Builder(String table) {
      this.table = table;
    }

    /** Creates one row per element of {@code iteration}, keyed by the iterator names. */
    public Builder setIteration(Iteration iteration) {
      this.iteration = iteration;
      return this;
    }

    /** Adds a column named after {@code value}, a parameter or variable group declaration. */
    public Builder addColumn(Object value) {
      columns.add(new Column(null, value));
      return this;
    }

    /** Adds a column holding the value of {@code value} in each row. */
    public Builder addColumn(String name, ExpressionArgument value) {
      columns.add(new Column(name, Expression.copyOf(value)));
      return this;
    }

    public CreateDataStatement build() {
      if (columns.isEmpty()) {
        throw new ModelingException("CreateDataStatement.build", "no column for " + table);
      }
      return new CreateDataStatement(this);
    }
  }

  public static Builder newBuilder(String table) {
    return new Builder(table);
  }

  private CreateDataStatement(Builder builder) {
    this.table = builder.table;
    this.iteration = builder.iteration;
    this.columns = ImmutableList.copyOf(builder.columns);
  }

  public String getTable() {
    return table;
  }

  @Override
  public void writeTo(ProgramWriter out) {
    StringBuilder sb = new StringBuilder("create data ").append(table).append(" from");
    if (iteration != null) {
      sb.append(iteration.getIterators().stream()
              .map(SetIterator::getName)
              .collect(Collectors.joining(" ", " [", "]")))
          .append(" = ")
          .append(iteration.render(out.getFormatter()));
    }
    for (Column column : columns) {
      sb.append(' ');
      if (column.name == null) {
        sb.append(Operands.item(column.value, out.getFormatter()));
      } else {
        sb.append(column.name).append('=')
            .append(Operands.expression((Expression) column.value, out.getFormatter()));
      }
    }
    out.line(sb.append(';').toString());
  }

  private final String table;
  private final Iteration iteration;
  private final ImmutableList<Column> columns;
}
