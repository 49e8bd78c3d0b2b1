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
import com.google.common.collect.ImmutableMap;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.optmodel.ModelingException;
import org.optmodel.NumberFormatter;
import org.optmodel.core.Direction;
import org.optmodel.core.Sense;
import org.optmodel.core.VarType;

/**
 * Sparse matrix form of a concrete model: one column per variable, one row per constraint, both
 * in model insertion order, and the nonzero coefficients.
 */
public final class MatrixModel {
  /** A variable of the matrix. */
  public static final class Column {
    Column(String name, VarType type, double lowerBound, double upperBound,
        double objectiveCoefficient) {
      this.name = name;
      this.type = type;
      this.lowerBound = lowerBound;
      this.upperBound = upperBound;
      this.objectiveCoefficient = objectiveCoefficient;
    }

    public String getName() {
      return name;
    }

    public VarType getType() {
      return type;
    }

    public double getLowerBound() {
      return lowerBound;
    }

    public double getUpperBound() {
      return upperBound;
    }

    public double getObjectiveCoefficient() {
      return objectiveCoefficient;
    }

    private final String name;
    private final VarType type;
    private final double lowerBound;
    private final double upperBound;
    private final double objectiveCoefficient;
  }

  /**
   * A constraint of the matrix. A range row {@code lower <= body <= upper} has the right-hand
   * side {@code lower} and the range {@code upper - lower}.
   */
  public static final class Row {
    Row(String name, Direction direction, double rhs, double range) {
      this.name = name;
      this.direction = direction;
      this.rhs = rhs;
      this.range = range;
    }

    public String getName() {
      return name;
    }

    public Direction getDirection() {
      return direction;
    }

    public double getRhs() {
      return rhs;
    }

    /** Returns the width of a range row, 0 otherwise. */
    public double getRange() {
      return range;
    }

    private final String name;
    private final Direction direction;
    private final double rhs;
    private final double range;
  }

  /** A nonzero coefficient. */
  public static final class Entry {
    Entry(int row, int column, double coefficient) {
      this.row = row;
      this.column = column;
      this.coefficient = coefficient;
    }

    public int getRow() {
      return row;
    }

    public int getColumn() {
      return column;
    }

    public double getCoefficient() {
      return coefficient;
    }

    private final int row;
    private final int column;
    private final double coefficient;
  }

  /** Accumulates columns, rows and entries. */
  static final class Builder {
    private final String name;
    private Sense sense = Sense.MINIMIZE;
    private String objectiveName = "obj";
    private double objectiveConstant = 0.0;
    private final List<Column> columns = new ArrayList<>();
    private final List<Row> rows = new ArrayList<>();
    private final List<Entry> entries = new ArrayList<>();
    private final Map<String, Integer> columnIndex = new LinkedHashMap<>();
    private final Map<String, Integer> rowIndex = new LinkedHashMap<>();

    Builder(String name) {
      this.name = name;
    }

    Builder setObjective(String objectiveName, Sense sense, double constant) {
      this.objectiveName = objectiveName;
      this.sense = sense;
      this.objectiveConstant = constant;
      return this;
    }

    boolean hasColumn(String columnName) {
      return columnIndex.containsKey(columnName);
    }

    boolean hasRow(String rowName) {
      return rowIndex.containsKey(rowName);
    }

    int columnIndex(String columnName) {
      return columnIndex.get(columnName);
    }

    int addColumn(String columnName, VarType type, double lb, double ub, double objective) {
      if (columnIndex.containsKey(columnName)) {
        throw new ModelingException("MatrixModel.addColumn", "duplicate column " + columnName);
      }
      columnIndex.put(columnName, columns.size());
      columns.add(new Column(columnName, type, lb, ub, objective));
      return columns.size() - 1;
    }

    int addRow(String rowName, Direction direction, double rhs, double range) {
      if (rowIndex.containsKey(rowName)) {
        throw new ModelingException("MatrixModel.addRow", "duplicate row " + rowName);
      }
      rowIndex.put(rowName, rows.size());
      rows.add(new Row(rowName, direction, rhs, range));
      return rows.size() - 1;
    }

    void addEntry(int row, int column, double coefficient) {
      entries.add(new Entry(row, column, coefficient));
    }

    MatrixModel build() {
      return new MatrixModel(this);
    }
  }

  private MatrixModel(Builder builder) {
    this.name = builder.name;
    this.sense = builder.sense;
    this.objectiveName = builder.objectiveName;
    this.objectiveConstant = builder.objectiveConstant;
    this.columns = ImmutableList.copyOf(builder.columns);
    this.rows = ImmutableList.copyOf(builder.rows);
    this.entries = ImmutableList.copyOf(builder.entries);
    this.columnIndex = ImmutableMap.copyOf(builder.columnIndex);
    this.rowIndex = ImmutableMap.copyOf(builder.rowIndex);
  }

  public String getName() {
    return name;
  }

  public Sense getSense() {
    return sense;
  }

  public String getObjectiveName() {
    return objectiveName;
  }

  /**
   * Returns the objective constant. It is also carried by a fixed auxiliary column, since the
   * matrix has no other place for it.
   */
  public double getObjectiveConstant() {
    return objectiveConstant;
  }

  public ImmutableList<Column> getColumns() {
    return columns;
  }

  public ImmutableList<Row> getRows() {
    return rows;
  }

  public ImmutableList<Entry> getEntries() {
    return entries;
  }

  /** Returns the index of the named column, or -1. */
  public int getColumnIndex(String columnName) {
    return columnIndex.getOrDefault(columnName, -1);
  }

  /** Returns the index of the named row, or -1. */
  public int getRowIndex(String rowName) {
    return rowIndex.getOrDefault(rowName, -1);
  }

  /** Returns the coefficient at ({@code row}, {@code column}), 0 if absent. */
  public double getCoefficient(int row, int column) {
    double value = 0.0;
    for (Entry entry : entries) {
      if (entry.row == row && entry.column == column) {
        value += entry.coefficient;
      }
    }
    return value;
  }

  /** Exports the matrix in free MPS format. */
  public String toMpsString(NumberFormatter formatter) {
    StringBuilder sb = new StringBuilder();
    sb.append("NAME ").append(name).append('\n');
    if (sense == Sense.MAXIMIZE) {
      sb.append("OBJSENSE\n    MAX\n");
    }
    sb.append("ROWS\n");
    sb.append(" N ").append(objectiveName).append('\n');
    for (Row row : rows) {
      sb.append(' ').append(row.direction.getRowType()).append(' ').append(row.name).append('\n');
    }

    sb.append("COLUMNS\n");
    List<List<Entry>> byColumn = new ArrayList<>();
    for (int i = 0; i < columns.size(); i++) {
      byColumn.add(new ArrayList<>());
    }
    for (Entry entry : entries) {
      byColumn.get(entry.column).add(entry);
    }
    boolean inIntegerBlock = false;
    int markers = 0;
    for (int i = 0; i < columns.size(); i++) {
      Column column = columns.get(i);
      if (column.type.isIntegral() != inIntegerBlock) {
        inIntegerBlock = column.type.isIntegral();
        sb.append(String.format(" MARKER%04d 'MARKER' '%s'", markers++,
            inIntegerBlock ? "INTORG" : "INTEND")).append('\n');
      }
      List<Entry> columnEntries = byColumn.get(i);
      if (column.objectiveCoefficient != 0.0 || columnEntries.isEmpty()) {
        sb.append(' ').append(column.name).append(' ').append(objectiveName).append(' ')
            .append(formatter.format(column.objectiveCoefficient)).append('\n');
      }
      for (Entry entry : columnEntries) {
        sb.append(' ').append(column.name).append(' ').append(rows.get(entry.row).name)
            .append(' ').append(formatter.format(entry.coefficient)).append('\n');
      }
    }
    if (inIntegerBlock) {
      sb.append(String.format(" MARKER%04d 'MARKER' 'INTEND'", markers)).append('\n');
    }

    sb.append("RHS\n");
    for (Row row : rows) {
      if (row.rhs != 0.0) {
        sb.append(" RHS ").append(row.name).append(' ').append(formatter.format(row.rhs))
            .append('\n');
      }
    }

    StringBuilder ranges = new StringBuilder();
    for (Row row : rows) {
      if (row.direction == Direction.RANGE) {
        ranges.append(" RNG ").append(row.name).append(' ').append(formatter.format(row.range))
            .append('\n');
      }
    }
    if (ranges.length() > 0) {
      sb.append("RANGES\n").append(ranges);
    }

    StringBuilder bounds = new StringBuilder();
    for (Column column : columns) {
      appendBounds(bounds, column, formatter);
    }
    if (bounds.length() > 0) {
      sb.append("BOUNDS\n").append(bounds);
    }
    sb.append("ENDATA\n");
    return sb.toString();
  }

  private static void appendBounds(StringBuilder sb, Column column, NumberFormatter formatter) {
    double lb = column.lowerBound;
    double ub = column.upperBound;
    if (column.type == VarType.BINARY && lb == 0.0 && ub == 1.0) {
      bound(sb, "BV", column.name, null);
    } else if (lb == ub) {
      bound(sb, "FX", column.name, formatter.format(lb));
    } else if (lb == Double.NEGATIVE_INFINITY && ub == Double.POSITIVE_INFINITY) {
      bound(sb, "FR", column.name, null);
    } else if (column.type.isIntegral() && lb == 0.0 && ub == Double.POSITIVE_INFINITY) {
      // Some readers default unbounded integer columns to binary.
      bound(sb, "PL", column.name, null);
    } else {
      if (lb == Double.NEGATIVE_INFINITY) {
        bound(sb, "MI", column.name, null);
      } else if (lb != 0.0 || column.type.isIntegral()) {
        bound(sb, "LO", column.name, formatter.format(lb));
      }
      if (ub != Double.POSITIVE_INFINITY) {
        bound(sb, "UP", column.name, formatter.format(ub));
      }
    }
  }

  private static void bound(StringBuilder sb, String type, String column, String value) {
    sb.append(' ').append(type).append(" BND ").append(column);
    if (value != null) {
      sb.append(' ').append(value);
    }
    sb.append('\n');
  }

  private final String name;
  private final Sense sense;
  private final String objectiveName;
  private final double objectiveConstant;
  private final ImmutableList<Column> columns;
  private final ImmutableList<Row> rows;
  private final ImmutableList<Entry> entries;
  private final ImmutableMap<String, Integer> columnIndex;
  private final ImmutableMap<String, Integer> rowIndex;
}
