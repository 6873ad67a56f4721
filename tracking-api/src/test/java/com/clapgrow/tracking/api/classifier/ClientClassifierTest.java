package com.clapgrow.tracking.api.classifier;

import com.clapgrow.tracking.api.config.TrackingProperties;
import com.clapgrow.tracking.api.enums.ClientLabel;
import com.clapgrow.tracking.api.service.TrackingMetricsService;
import com.clapgrow.tracking.common.event.EngagementEventType;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.io.IOException;
import java.time.Duration;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class ClientClassifierTest {

    @Mock
    private ClassificationRuleLoader ruleLoader;

    @Mock
    private TrackingMetricsService metricsService;

    private TrackingProperties properties;
    private ClientClassifier classifier;

    @BeforeEach
    void setUp() {
        properties = new TrackingProperties();
        classifier = new ClientClassifier(ruleLoader, properties, metricsService);
    }

    @Test
    void reloadInstallsNewTable() throws IOException {
        when(ruleLoader.load(anyString())).thenReturn(table("v1"));

        assertTrue(classifier.reload());

        assertEquals("v1", classifier.currentRules().version());
        Classification result = classifier.classify(new RequestContext("any", null, EngagementEventType.OPEN, null, 99));
        assertEquals(ClientLabel.BOT, result.label());
        verify(metricsService).recordClassification(ClientLabel.BOT);
    }

    @Test
    void failedReloadKeepsPreviousTable() throws IOException {
        when(ruleLoader.load(anyString())).thenReturn(table("v1")).thenThrow(new IOException("broken json"));
        classifier.reload();

        assertFalse(classifier.reload());

        assertEquals("v1", classifier.currentRules().version());
    }

    @Test
    void emptyTableUntilFirstLoad() {
        Classification result = classifier.classify(
            new RequestContext("Mozilla/5.0", null, EngagementEventType.OPEN, Duration.ofSeconds(1), 1));

        assertEquals(ClientLabel.HUMAN, result.label());
        assertEquals("empty", classifier.currentRules().version());
    }

    private static ClassificationRuleSet table(String version) {
        return new ClassificationRuleSet(version, List.of(
            new ClassificationRule("burst", RuleKind.RATE, ClientLabel.BOT, 0.8, null, null, 5L, null)));
    }
}
