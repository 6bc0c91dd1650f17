package io.gridflow.renewables.quality;

import io.gridflow.core.Table;
import org.junit.jupiter.api.Test;

import java.util.HashMap;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

public class NoNullValuesPolicyTest {
    private final NoNullValuesPolicy policy = new NoNullValuesPolicy();

    @Test
    void complete_table_passes() {
        Table t = Table.builder(List.of("a", "b")).addRow(Map.of("a", 1, "b", "x")).build();
        assertTrue(policy.check(t));
        assertTrue(policy.check(Table.builder(List.of("a")).build()));
    }

    @Test
    void any_null_fails() {
        Map<String, Object> row = new HashMap<>();
        row.put("a", 1);
        row.put("b", null);
        Table t = Table.builder(List.of("a", "b")).addRow(Map.of("a", 2, "b", "y")).addRow(row).build();
        assertFalse(policy.check(t));
        assertEquals("Data contains null values.", policy.errorMessage());
    }

    @Test
    void absent_cell_counts_as_null() {
        Table t = Table.builder(List.of("a", "b")).addRow(Map.of("a", 1)).build();
        assertFalse(policy.check(t));
    }
}
