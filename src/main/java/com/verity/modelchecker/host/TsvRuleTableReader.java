/*
 * Copyright (c) 2025 Verity Model Checker
 * Licensed under the Apache License, Version 2.0
 */
package com.verity.modelchecker.host;

import com.verity.modelchecker.model.RawRuleTable;
import org.apache.commons.lang3.StringUtils;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.logging.Logger;

/**
 * Reads a tab-separated rule table export: a header row followed by data rows.
 * Empty cells become missing values; blank lines are ignored.
 */
public class TsvRuleTableReader {
    private static final Logger logger = Logger.getLogger(TsvRuleTableReader.class.getName());

    public RawRuleTable read(Path path) throws IOException {
        if (!Files.isRegularFile(path)) {
            throw new IOException("Rule table not found: " + path);
        }
        try (Reader reader = Files.newBufferedReader(path, StandardCharsets.UTF_8)) {
            RawRuleTable table = read(reader);
            logger.info(String.format("Read %d rule rows from %s", table.rowCount(), path));
            return table;
        }
    }

    public RawRuleTable read(Reader source) throws IOException {
        BufferedReader reader = source instanceof BufferedReader buffered ? buffered : new BufferedReader(source);

        String header = reader.readLine();
        while (header != null && header.isBlank()) {
            header = reader.readLine();
        }
        if (header == null) {
            throw new IOException("Rule table is empty");
        }

        List<String> columns = new ArrayList<>();
        for (String name : split(stripBom(header))) {
            columns.add(name.trim());
        }

        List<List<Object>> rows = new ArrayList<>();
        String line;
        while ((line = reader.readLine()) != null) {
            if (line.isBlank()) continue;
            List<Object> cells = new ArrayList<>();
            for (String cell : split(line)) {
                cells.add(cell.isEmpty() ? null : cell);
            }
            rows.add(cells);
        }
        return new RawRuleTable(columns, rows);
    }

    private static List<String> split(String line) {
        String trimmed = StringUtils.removeEnd(line, "\r");
        return Arrays.asList(StringUtils.splitPreserveAllTokens(trimmed, '\t'));
    }

    private static String stripBom(String line) {
        return StringUtils.removeStart(line, "\uFEFF");
    }
}
