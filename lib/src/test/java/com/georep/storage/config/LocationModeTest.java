package com.georep.storage.config;

import com.georep.storage.model.StorageLocation;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class LocationModeTest {

    @Test
    void testInitialLocations() {
        assertEquals(StorageLocation.PRIMARY, LocationMode.PRIMARY_ONLY.initialLocation());
        assertEquals(StorageLocation.SECONDARY, LocationMode.SECONDARY_ONLY.initialLocation());
        assertEquals(StorageLocation.PRIMARY, LocationMode.PRIMARY_THEN_SECONDARY.initialLocation());
        assertEquals(StorageLocation.SECONDARY, LocationMode.SECONDARY_THEN_PRIMARY.initialLocation());
    }

    @Test
    void testFallbackModesAlternate() {
        assertEquals(StorageLocation.SECONDARY,
            LocationMode.PRIMARY_THEN_SECONDARY.alternate(StorageLocation.PRIMARY));
        assertEquals(StorageLocation.PRIMARY,
            LocationMode.PRIMARY_THEN_SECONDARY.alternate(StorageLocation.SECONDARY));
        assertEquals(StorageLocation.PRIMARY,
            LocationMode.SECONDARY_THEN_PRIMARY.alternate(StorageLocation.SECONDARY));
    }

    @Test
    void testSingleLocationModesNeverLeave() {
        assertEquals(StorageLocation.PRIMARY, LocationMode.PRIMARY_ONLY.alternate(StorageLocation.PRIMARY));
        assertEquals(StorageLocation.SECONDARY, LocationMode.SECONDARY_ONLY.alternate(StorageLocation.SECONDARY));
        assertFalse(LocationMode.PRIMARY_ONLY.canTarget(StorageLocation.SECONDARY));
        assertFalse(LocationMode.SECONDARY_ONLY.canTarget(StorageLocation.PRIMARY));
        assertTrue(LocationMode.PRIMARY_THEN_SECONDARY.canTarget(StorageLocation.SECONDARY));
    }

    @Test
    void testPinnedTo() {
        assertEquals(LocationMode.PRIMARY_ONLY, LocationMode.pinnedTo(StorageLocation.PRIMARY));
        assertEquals(LocationMode.SECONDARY_ONLY, LocationMode.pinnedTo(StorageLocation.SECONDARY));
    }
}
