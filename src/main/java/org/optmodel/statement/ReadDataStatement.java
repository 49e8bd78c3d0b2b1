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
import org.optmodel.ModelingException;
import org.optmodel.ProgramWriter;
import org.optmodel.symbolic.IndexSet;

/**
 * Populates sets and parameters from a table on the engine:
 *
 * <pre>
 * read data products into PRODUCTS=[name] price cost=unit_cost;
 * </pre>
 */
public final class ReadDataStatement implements Statement {
  /** One target of the statement: a declaration or member reference, with its source column. */
  private static final class Column {
    final Object target;
    final String column;

    Column(Object target, String column) {
      this.target = target;
      this.column = column;
    }
  }

  /** Builder for {@link ReadDataStatement}. */
  public static final class Builder {
    private final String table;
    private IndexSet indexSet;
    private ImmutableList<String> keyColumns = ImmutableList.of();
    private final List<Column> columns = new ArrayList<>();

    private Builder(String table) {
      this.table = table;
    }

    /** Reads the members of {@code set} from the key columns: {@code into I=[k]}. */
    public Builder setIndexSet(IndexSet set, String... keyColumns) {
      this.indexSet = set;
      this.keyColumns = ImmutableList.copyOf(keyColumns);
      return this;
    }

    /** Names the key columns without populating a set: {@code into [a b]}. */
    public Builder setKeyColumns(String... keyColumns) {
      this.keyColumns = ImmutableList.copyOf(keyColumns);
      return this;
    }

    /** Reads {@code target} from the column of the same name. */
    public Builder addColumn(Object target) {
      return addColumn(target, null);
    }

    /** Reads {@code target}, a parameter group or a member reference, from {@code column}. */
    public Builder addColumn(Object target, String column) {
      columns.add(new Column(target, column));
      return this;
    }

    public ReadDataStatement build() {
      if (table == null || table.isEmpty()) {
        throw new ModelingException("ReadDataStatement.build", "table name must not be empty");
      }
      if (indexSet == null && columns.isEmpty()) {
        throw new ModelingException("ReadDataStatement.build", "nothing to read from " + table);
      }
      return new ReadDataStatement(this);
    }
  }

  public static Builder newBuilder(String table) {
    return new Builder(table);
  }

  private ReadDataStatement(Builder builder) {
    this.table = builder.table;
    this.indexSet = builder.indexSet;
    this.keyColumns = builder.keyColumns;
    this.columns = ImmutableList.copyOf(builder.columns);
  }

  public String getTable() {
    return table;
  }

  @Override
  public void writeTo(ProgramWriter out) {
    StringBuilder sb = new StringBuilder("read data ").append(table).append(" into");
    String keys = keyColumns.isEmpty() ? "" : "[" + String.join(" ", keyColumns) + "]";
    if (indexSet != null) {
      sb.append(' ').append(indexSet.getName());
      if (!keys.isEmpty()) {
        sb.append('=').append(keys);
      }
    } else if (!keys.isEmpty()) {
      sb.append(' ').append(keys);
    }
    for (Column column : columns) {
      String target = Operands.target(column.target, out.getFormatter());
      sb.append(' ').append(target);
      if (column.column != null && !column.column.equals(target)) {
        sb.append('=').append(column.column);
      }
    }
    out.line(sb.append(';').toString());
  }

  private final String table;
  private final IndexSet indexSet;
  private final ImmutableList<String> keyColumns;
  private final ImmutableList<Column> columns;
}
