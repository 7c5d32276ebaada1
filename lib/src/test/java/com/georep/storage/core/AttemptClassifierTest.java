package com.georep.storage.core;

import com.georep.storage.core.AttemptClassifier.Outcome;
import com.georep.storage.exception.ErrorKind;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class AttemptClassifierTest {

    @Test
    void testClassifiesStatuses() {
        assertEquals(Outcome.SUCCESS, AttemptClassifier.classify(200));
        assertEquals(Outcome.SUCCESS, AttemptClassifier.classify(204));
        assertEquals(Outcome.RETRYABLE, AttemptClassifier.classify(null));
        assertEquals(Outcome.RETRYABLE, AttemptClassifier.classify(408));
        assertEquals(Outcome.RETRYABLE, AttemptClassifier.classify(429));
        assertEquals(Outcome.RETRYABLE, AttemptClassifier.classify(500));
        assertEquals(Outcome.RETRYABLE, AttemptClassifier.classify(503));
        assertEquals(Outcome.FATAL, AttemptClassifier.classify(400));
        assertEquals(Outcome.FATAL, AttemptClassifier.classify(404));
        assertEquals(Outcome.FATAL, AttemptClassifier.classify(501));
        assertEquals(Outcome.FATAL, AttemptClassifier.classify(505));
    }

    @Test
    void testLocationFallbackEligibility() {
        assertTrue(AttemptClassifier.isLocationFallbackEligible(null));
        assertTrue(AttemptClassifier.isLocationFallbackEligible(408));
        assertTrue(AttemptClassifier.isLocationFallbackEligible(503));
        assertFalse(AttemptClassifier.isLocationFallbackEligible(429));
        assertFalse(AttemptClassifier.isLocationFallbackEligible(404));
    }

    @Test
    void testFailureKinds() {
        assertEquals(ErrorKind.TRANSIENT, AttemptClassifier.failureFor(503, "r1").getKind());
        assertEquals(ErrorKind.CLIENT, AttemptClassifier.failureFor(404, "r2").getKind());
        assertEquals(ErrorKind.SERVER, AttemptClassifier.failureFor(501, "r3").getKind());
        assertEquals(404, AttemptClassifier.failureFor(404, "r2").getStatusCode());
        assertThrows(IllegalArgumentException.class, () -> AttemptClassifier.failureFor(200, "r4"));
    }
}
