/*
 * Copyright (c) 2025 Verity Model Checker
 * Licensed under the Apache License, Version 2.0
 */
package com.verity.modelchecker.model;

import it.unimi.dsi.fastutil.objects.Object2IntMap;
import it.unimi.dsi.fastutil.objects.Object2IntOpenHashMap;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * Rule table as read from the spreadsheet: a header row and data rows of untyped cells.
 * A null cell is a missing value. Rows shorter than the header are padded with nulls.
 */
public final class RawRuleTable {
    private final List<String> columns;
    private final List<List<Object>> rows;
    private final Object2IntMap<String> columnIndex = new Object2IntOpenHashMap<>();

    public RawRuleTable(List<String> columns, List<? extends List<?>> rows) {
        Objects.requireNonNull(columns, "Columns cannot be null");
        this.columns = List.copyOf(columns);
        this.columnIndex.defaultReturnValue(-1);
        for (int i = 0; i < this.columns.size(); i++) {
            columnIndex.putIfAbsent(this.columns.get(i).trim(), i);
        }

        List<List<Object>> copied = new ArrayList<>();
        if (rows != null) {
            for (List<?> row : rows) {
                Object[] cells = new Object[this.columns.size()];
                for (int i = 0; i < cells.length && i < row.size(); i++) {
                    cells[i] = row.get(i);
                }
                copied.add(Collections.unmodifiableList(Arrays.asList(cells)));
            }
        }
        this.rows = Collections.unmodifiableList(copied);
    }

    public List<String> columns() {
        return columns;
    }

    public List<List<Object>> rows() {
        return rows;
    }

    public int rowCount() {
        return rows.size();
    }

    public boolean hasColumn(String name) {
        return columnIndex.getInt(name) >= 0;
    }

    /**
     * Returns the first of the given column names present in this table, or null.
     * Used for columns with alternative headings ("Property Name" / "Property Path").
     */
    public String firstPresent(String... names) {
        for (String name : names) {
            if (hasColumn(name)) {
                return name;
            }
        }
        return null;
    }

    /**
     * Returns a cell, or null when the column does not exist.
     */
    public Object get(int row, String column) {
        int index = column == null ? -1 : columnIndex.getInt(column);
        return index < 0 ? null : rows.get(row).get(index);
    }

    public List<Object> column(String column) {
        int index = columnIndex.getInt(column);
        if (index < 0) {
            return List.of();
        }
        List<Object> values = new ArrayList<>(rows.size());
        for (List<Object> row : rows) {
            values.add(row.get(index));
        }
        return values;
    }
}
