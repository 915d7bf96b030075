package me.golemcore.engram.domain.service;

import me.golemcore.engram.infrastructure.config.EngramProperties;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class TokenEstimatorTest {

    @Test
    void roundsUpCharactersPerToken() {
        TokenEstimator estimator = new TokenEstimator(new EngramProperties());

        assertEquals(0, estimator.estimate(null));
        assertEquals(0, estimator.estimate(""));
        assertEquals(1, estimator.estimate("abc"));
        assertEquals(1, estimator.estimate("abcd"));
        assertEquals(2, estimator.estimate("abcde"));
    }

    @Test
    void usesConfiguredRatio() {
        EngramProperties properties = new EngramProperties();
        properties.getConsolidation().setCharsPerToken(2.0);

        assertEquals(3, new TokenEstimator(properties).estimate("abcde"));
    }
}
