package com.georep.storage.model;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class ContinuationTokenTest {

    @Test
    void testNoMarkersMeansNoToken() {
        assertNull(ContinuationToken.fromMarkers(null, null, null, StorageLocation.PRIMARY));
        assertNull(ContinuationToken.fromMarkers("", " ", null, StorageLocation.PRIMARY));
    }

    @Test
    void testCarriesMarkersAndIssuingLocation() {
        ContinuationToken token = ContinuationToken.fromMarkers("pk", "00100", null, StorageLocation.SECONDARY);

        assertEquals("pk", token.getNextPartitionKey());
        assertEquals("00100", token.getNextRowKey());
        assertNull(token.getNextTableName());
        assertEquals(StorageLocation.SECONDARY, token.getTargetLocation());
    }

    @Test
    void testValueEquality() {
        ContinuationToken a = ContinuationToken.fromMarkers("pk", "1", null, StorageLocation.PRIMARY);
        ContinuationToken b = ContinuationToken.fromMarkers("pk", "1", "", StorageLocation.PRIMARY);
        ContinuationToken other = ContinuationToken.fromMarkers("pk", "1", null, StorageLocation.SECONDARY);

        assertEquals(a, b);
        assertEquals(a.hashCode(), b.hashCode());
        assertNotEquals(a, other);
    }
}
