package tessera.utils;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

public class GlobPatternTest {

    @Test
    public void testWildcards() {
        assertTrue(GlobPattern.compile("*").matches(""));
        assertTrue(GlobPattern.compile("*").matches("anything"));
        assertTrue(GlobPattern.compile("h?llo").matches("hello"));
        assertFalse(GlobPattern.compile("h?llo").matches("hllo"));
        assertTrue(GlobPattern.compile("h*llo").matches("heeeello"));
        assertTrue(GlobPattern.compile("a*b").matches("a\nb"));
    }

    @Test
    public void testClasses() {
        GlobPattern vowels = GlobPattern.compile("h[ae]llo");
        assertTrue(vowels.matches("hello"));
        assertTrue(vowels.matches("hallo"));
        assertFalse(vowels.matches("hillo"));

        GlobPattern negated = GlobPattern.compile("h[^e]llo");
        assertTrue(negated.matches("hallo"));
        assertFalse(negated.matches("hello"));

        GlobPattern range = GlobPattern.compile("h[a-b]llo");
        assertTrue(range.matches("hbllo"));
        assertFalse(range.matches("hcllo"));
    }

    @Test
    public void testEscapes() {
        assertTrue(GlobPattern.compile("a\\*").matches("a*"));
        assertFalse(GlobPattern.compile("a\\*").matches("ab"));
        assertTrue(GlobPattern.compile("[\\]]").matches("]"));
    }

    @Test
    public void testRegexMetaCharactersAreLiteral() {
        assertTrue(GlobPattern.compile("a.b").matches("a.b"));
        assertFalse(GlobPattern.compile("a.b").matches("axb"));
        assertTrue(GlobPattern.compile("(x)+").matches("(x)+"));
        assertTrue(GlobPattern.compile("[").matches("["));
    }
}
