package io.hypha.core.store;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

class GlobPatternTest {

    @Test
    void starMatchesAnyRun() {
        GlobPattern glob = GlobPattern.compile("services:*:ws1/*:calc@*");

        assertTrue(glob.matches("services:public:ws1/alice:calc@*"));
        assertTrue(glob.matches("services:protected:ws1/bob:calc@app1"));
        assertFalse(glob.matches("services:public:ws2/alice:calc@*"));
    }

    @Test
    void questionMarkAndClassesMatchSingleCharacters() {
        assertTrue(GlobPattern.compile("h?llo").matches("hallo"));
        assertFalse(GlobPattern.compile("h?llo").matches("hllo"));
        assertTrue(GlobPattern.compile("h[ae]llo").matches("hello"));
        assertFalse(GlobPattern.compile("h[^e]llo").matches("hello"));
        assertTrue(GlobPattern.compile("v[0-9]").matches("v7"));
    }

    @Test
    void regexMetacharactersAreLiteral() {
        assertTrue(GlobPattern.compile("a.b+c").matches("a.b+c"));
        assertFalse(GlobPattern.compile("a.b").matches("axb"));
    }

    @Test
    void literalEscapesWildcards() {
        String escaped = GlobPattern.literal("ws/*:calc@*");

        assertTrue(GlobPattern.compile(escaped).matches("ws/*:calc@*"));
        assertFalse(GlobPattern.compile(escaped).matches("ws/alice:calc@app"));
        assertFalse(GlobPattern.compile(escaped).isLiteral());
        assertTrue(GlobPattern.compile("plain-key").isLiteral());
    }
}
