package com.georep.storage.query;

import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class TableQueryTest {

    @Test
    void testBuildsQuery() {
        TableQuery query = TableQuery.from("people")
            .where("PartitionKey eq 'smith'")
            .select("Email", "Phone")
            .take(25)
            .build();

        assertEquals("people", query.getTableName());
        assertEquals("PartitionKey eq 'smith'", query.getFilter());
        assertEquals(List.of("Email", "Phone"), query.getSelectColumns());
        assertEquals(25, query.getTakeCount());
        assertEquals(25, query.newBudget().getRemaining());
    }

    @Test
    void testUnboundedByDefault() {
        TableQuery query = TableQuery.from("people").build();

        assertNull(query.getTakeCount());
        assertFalse(query.newBudget().isBounded());
    }

    @Test
    void testRejectsInvalidInput() {
        assertThrows(IllegalArgumentException.class, () -> TableQuery.from("people").take(0));
        assertThrows(IllegalArgumentException.class, () -> TableQuery.from("people").take(-1));
        assertThrows(IllegalArgumentException.class, () -> TableQuery.from(" ").build());
        assertThrows(IllegalArgumentException.class, () -> TableQuery.from("people").select("").build());
    }
}
