package com.clapgrow.tracking.api.classifier;

import com.clapgrow.tracking.api.config.TrackingProperties;
import com.clapgrow.tracking.api.service.TrackingMetricsService;
import jakarta.annotation.PostConstruct;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Labels tracking requests against the currently loaded rule table.
 *
 * {@link #classify} has no side effects beyond a metric: the same context and table always
 * give the same result. The table is swapped atomically on reload; a table that fails to
 * load leaves the previous one in place.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class ClientClassifier {

    private final ClassificationRuleLoader ruleLoader;
    private final TrackingProperties trackingProperties;
    private final TrackingMetricsService metricsService;

    private final AtomicReference<ClassificationRuleSet> ruleSet = new AtomicReference<>(ClassificationRuleSet.empty());

    @PostConstruct
    void init() {
        if (!reload()) {
            log.error("No classification rules loaded from {}; every request falls back to human/unknown",
                trackingProperties.getClassifier().getRulesLocation());
        }
    }

    public Classification classify(RequestContext context) {
        Classification result = ruleSet.get().evaluate(context);
        metricsService.recordClassification(result.label());
        return result;
    }

    /**
     * @return true when a new table was installed
     */
    public boolean reload() {
        String location = trackingProperties.getClassifier().getRulesLocation();
        try {
            ClassificationRuleSet loaded = ruleLoader.load(location);
            ClassificationRuleSet previous = ruleSet.getAndSet(loaded);
            log.info("Loaded {} classification rules (version {}), replacing version {}",
                loaded.size(), loaded.version(), previous.version());
            return true;
        } catch (IOException e) {
            log.error("Failed to reload classification rules from {}; keeping version {}",
                location, ruleSet.get().version(), e);
            return false;
        }
    }

    @Scheduled(fixedDelayString = "#{@trackingProperties.classifier.reloadInterval.toMillis()}",
               initialDelayString = "#{@trackingProperties.classifier.reloadInterval.toMillis()}")
    public void scheduledReload() {
        reload();
    }

    public ClassificationRuleSet currentRules() {
        return ruleSet.get();
    }
}
