/*
 * Copyright (c) 2025 Verity Model Checker
 * Licensed under the Apache License, Version 2.0
 */
package com.verity.modelchecker.host;

import com.verity.modelchecker.model.RawRuleTable;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.io.StringReader;
import java.net.URISyntaxException;
import java.nio.file.Path;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class TsvRuleTableReaderTest {

    private final TsvRuleTableReader reader = new TsvRuleTableReader();

    @Test
    @DisplayName("Should read a tab-separated export with empty cells as missing")
    void testReadFile() throws IOException, URISyntaxException {
        Path path = Path.of(getClass().getResource("/rules/walls.tsv").toURI());

        RawRuleTable table = reader.read(path);

        assertThat(table.columns()).containsExactly(
                "Rule Number", "Logic", "Property Name", "Predicate", "Value", "Message", "Report Severity");
        assertThat(table.rowCount()).isEqualTo(7);
        assertThat(table.get(0, "Predicate")).isEqualTo("matches");
        assertThat(table.get(1, "Value")).isEqualTo("200");
        assertThat(table.get(1, "Message")).isNull();
        assertThat(table.get(2, "Rule Number")).isNull();
        assertThat(table.get(0, "No Such Column")).isNull();
    }

    @Test
    @DisplayName("Should pad short rows and ignore blank lines, CRLF and a byte order mark")
    void testReadReader() throws IOException {
        String tsv = "\uFEFFRule Number\tLogic\tValue\r\n"
                + "\r\n"
                + "1\tWHERE\r\n"
                + "2\tCHECK\t5\r\n";

        RawRuleTable table = reader.read(new StringReader(tsv));

        assertThat(table.columns()).containsExactly("Rule Number", "Logic", "Value");
        assertThat(table.rowCount()).isEqualTo(2);
        assertThat(table.rows().get(0)).containsExactly("1", "WHERE", null);
        assertThat(table.get(1, "Value")).isEqualTo("5");
    }

    @Test
    @DisplayName("Should fail for empty or missing sources")
    void testFailures(@TempDir Path tempDir) {
        assertThatThrownBy(() -> reader.read(new StringReader("")))
                .isInstanceOf(IOException.class)
                .hasMessage("Rule table is empty");
        assertThatThrownBy(() -> reader.read(tempDir.resolve("missing.tsv")))
                .isInstanceOf(IOException.class)
                .hasMessageContaining("Rule table not found");
    }
}
