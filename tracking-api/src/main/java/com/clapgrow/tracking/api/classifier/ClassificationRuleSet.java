package com.clapgrow.tracking.api.classifier;

import com.clapgrow.tracking.api.enums.ClientLabel;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * Ordered, immutable rule table. The first matching rule decides; when none matches the
 * request is human at 0.5, or unknown at 0.0 when it carried no user agent.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record ClassificationRuleSet(String version, List<ClassificationRule> rules) {

    static final String FALLBACK_HUMAN = "fallback-human";
    static final String FALLBACK_NO_USER_AGENT = "no-user-agent";

    public ClassificationRuleSet {
        rules = rules == null ? List.of() : List.copyOf(rules);
        Set<String> names = new HashSet<>();
        for (ClassificationRule rule : rules) {
            if (!names.add(rule.name())) {
                throw new IllegalArgumentException("Duplicate rule name: " + rule.name());
            }
        }
    }

    public static ClassificationRuleSet empty() {
        return new ClassificationRuleSet("empty", List.of());
    }

    public Classification evaluate(RequestContext context) {
        UserAgentParser.ClientInfo client = UserAgentParser.parse(context.userAgent());
        for (ClassificationRule rule : rules) {
            if (rule.matches(context)) {
                return new Classification(rule.label(), rule.confidence(), rule.name(),
                    client.deviceType(), client.clientName());
            }
        }
        if (!context.hasUserAgent()) {
            return new Classification(ClientLabel.UNKNOWN, 0.0, FALLBACK_NO_USER_AGENT,
                client.deviceType(), client.clientName());
        }
        return new Classification(ClientLabel.HUMAN, 0.5, FALLBACK_HUMAN,
            client.deviceType(), client.clientName());
    }

    public int size() {
        return rules.size();
    }
}
