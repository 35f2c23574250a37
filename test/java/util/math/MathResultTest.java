package util.math;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("MathResult Tests")
class MathResultTest {

    @Test
    @DisplayName("A value result has no error")
    void valueResult() {
        var result = MathResult.of(4);
        assertTrue(result.isValid());
        assertFalse(result.isInvalid());
        assertEquals(4, result.value());
        assertTrue(result.error().isEmpty());
        assertEquals("4.0", result.toString());
    }

    @Test
    @DisplayName("A failed result only gives access to the error")
    void failedResult() {
        var result = MathResult.failed(MathError.invalidDomain(0));
        assertTrue(result.isInvalid());
        assertEquals(-1, result.orElse(-1));
        assertThrows(IllegalStateException.class, result::value);
        assertTrue(result.toString().startsWith("INVALID_DOMAIN"));
    }

    @Test
    @DisplayName("A failed result needs an error")
    void failedNeedsError() {
        assertThrows(IllegalArgumentException.class, () -> MathResult.failed(null));
    }

    @Test
    @DisplayName("map only touches values")
    void map() {
        assertEquals(8, MathResult.of(4).map(d -> d * 2).value());
        var failed = MathResult.failed(MathError.parse("nope"));
        assertSame(failed, failed.map(d -> d * 2));
    }
}
