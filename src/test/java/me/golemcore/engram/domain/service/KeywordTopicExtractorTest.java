package me.golemcore.engram.domain.service;

import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class KeywordTopicExtractorTest {

    private final KeywordTopicExtractor extractor = new KeywordTopicExtractor();

    @Test
    void technicalTermsComeBeforeActionsAndAreCapped() {
        List<String> topics = extractor.extractTopics(
                "We fixed a database bug in the API and deployed the feature");

        assertEquals(List.of("api", "database", "bug", "feature", "fix"), topics);
    }

    @Test
    void matchesAtWordStartOnly() {
        assertEquals(List.of(), extractor.extractTopics("A rapid prefix change"));
        assertEquals(List.of("implement"), extractor.extractTopics("Implementing it now"));
    }

    @Test
    void caseInsensitive() {
        assertEquals(List.of("memory", "token"), extractor.extractTopics("MEMORY usage per Token"));
    }

    @Test
    void emptyInputHasNoTopics() {
        assertTrue(extractor.extractTopics(null).isEmpty());
        assertTrue(extractor.extractTopics("   ").isEmpty());
    }
}
