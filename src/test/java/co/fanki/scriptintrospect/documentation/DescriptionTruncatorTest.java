package co.fanki.scriptintrospect.documentation;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;

/**
 * Unit tests for {@link DescriptionTruncator}.
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
class DescriptionTruncatorTest {

    private final DescriptionTruncator truncator = new DescriptionTruncator();

    @Test
    void whenTruncating_givenShortDescription_shouldOnlyStripIt() {
        assertEquals("Greets someone.",
                truncator.truncate("  Greets someone.\n", 80));
    }

    @Test
    void whenTruncating_givenLongDescription_shouldCutAtWordBoundary() {
        assertEquals("Counts the words...",
                truncator.truncate("Counts the words of every file", 20));
    }

    @Test
    void whenTruncating_givenSingleLongWord_shouldCutTheWord() {
        assertEquals("abcdefg...", truncator.truncate("abcdefghijklmnop", 10));
    }

    @Test
    void whenTruncating_givenExactLength_shouldKeepIt() {
        assertEquals("1234567890", truncator.truncate("1234567890", 10));
    }

    @Test
    void whenTruncating_givenNull_shouldReturnNull() {
        assertNull(truncator.truncate(null, 80));
    }

    @Test
    void whenTruncating_givenTinyLimit_shouldFail() {
        assertThrows(IllegalArgumentException.class,
                () -> truncator.truncate("text", 3));
    }

}
