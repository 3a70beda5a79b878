package edu.harvard.hms.dbmi.avillach.phenology.processing.parse;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Detection of missing-data markers in input cells.
 */
class NullSentinelDetectorTest {

    @Test
    void testDefaultNullSentinels() {
        NullSentinelDetector detector = new NullSentinelDetector();

        assertTrue(detector.isNullSentinel(""), "Empty string should be null sentinel");
        assertTrue(detector.isNullSentinel("nan"), "lowercase nan should be null sentinel");
        assertTrue(detector.isNullSentinel("NaN"), "mixed case NaN should be null sentinel");
        assertTrue(detector.isNullSentinel("NA"), "uppercase NA should be null sentinel");
        assertTrue(detector.isNullSentinel("N/A"), "uppercase N/A should be null sentinel");
        assertTrue(detector.isNullSentinel("NULL"), "uppercase NULL should be null sentinel");
        assertTrue(detector.isNullSentinel("None"), "capitalized None should be null sentinel");
    }

    @Test
    void testWhitespaceHandling() {
        NullSentinelDetector detector = new NullSentinelDetector();

        assertTrue(detector.isNullSentinel("  nan  "));
        assertTrue(detector.isNullSentinel("\tNone\t"));
        assertTrue(detector.isNullSentinel(" "), "Space should be detected as empty");
    }

    @Test
    void testNonSentinels() {
        NullSentinelDetector detector = new NullSentinelDetector();

        assertFalse(detector.isNullSentinel("0"));
        assertFalse(detector.isNullSentinel("12.5"));
        assertFalse(detector.isNullSentinel("Fishing"));
        assertFalse(detector.isNullSentinel("Not Applicable"));
        assertFalse(detector.isNullSentinel("Nantucket"));
        assertFalse(detector.isNullSentinel("\\N"));
    }

    @Test
    void testNullValue() {
        assertTrue(new NullSentinelDetector().isNullSentinel(null));
    }
}
