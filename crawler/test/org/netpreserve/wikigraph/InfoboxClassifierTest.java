package org.netpreserve.wikigraph;

import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class InfoboxClassifierTest {
    private final InfoboxClassifier classifier = new InfoboxClassifier(List.of("musical artist", "band"));

    private boolean accepts(String text) {
        return classifier.classify(new Article("1", "T", List.of(), text));
    }

    @Test
    void matchesConfiguredInfoboxes() {
        assertTrue(accepts("{{Infobox musical artist\n| name = Miles Davis\n}}"));
        assertTrue(accepts("intro\n{{ infobox Musical_Artist|name=x}}"));
        assertTrue(accepts("{{Infobox band}}"));
        assertTrue(accepts("{{Infobox musical artist <!-- see guidelines -->\n}}"));
        assertTrue(accepts("{{Infobox  musical   artist\n}}"));
    }

    @Test
    void ignoresOtherInfoboxes() {
        assertFalse(accepts("{{Infobox person\n| name = x}}"));
        assertFalse(accepts("{{Infobox musical artist awards|x}}"));
        assertFalse(accepts("{{Infobox bandy player}}"));
        assertFalse(accepts("A musical artist without an infobox."));
        assertFalse(accepts(""));
    }

    @Test
    void requiresTypes() {
        assertThrows(IllegalArgumentException.class, () -> new InfoboxClassifier(List.of()));
    }
}
