package com.advisoryplatform.orchestrator.coordinator;

import java.util.List;
import java.util.Locale;
import java.util.Optional;

/**
 * {@link PeerInferrer} using case-insensitive substring matching against an ordered rule
 * list. The first rule with a matching keyword wins.
 *
 * <pre>
 *   kaygee | empirical   → KayGee_1.0
 *   ecm    | convergent  → UCM_Core_ECM
 *   genesis              → Caleon_Genesis_1.12
 *   cali_x               → Cali_X_One
 * </pre>
 */
public class KeywordPeerInferrer implements PeerInferrer {

    public record KeywordRule(List<String> keywords, String peer) {
        public KeywordRule {
            keywords = keywords.stream().map(k -> k.toLowerCase(Locale.ROOT)).toList();
        }
    }

    public static final List<KeywordRule> DEFAULT_RULES = List.of(
        new KeywordRule(List.of("kaygee", "empirical"), "KayGee_1.0"),
        new KeywordRule(List.of("ecm", "convergent"),   "UCM_Core_ECM"),
        new KeywordRule(List.of("genesis"),             "Caleon_Genesis_1.12"),
        new KeywordRule(List.of("cali_x"),              "Cali_X_One")
    );

    private final List<KeywordRule> rules;

    public KeywordPeerInferrer() {
        this(DEFAULT_RULES);
    }

    public KeywordPeerInferrer(List<KeywordRule> rules) {
        this.rules = List.copyOf(rules);
    }

    @Override
    public Optional<String> infer(String decisionContext) {
        if (decisionContext == null || decisionContext.isBlank()) {
            return Optional.empty();
        }
        String text = decisionContext.toLowerCase(Locale.ROOT);
        for (KeywordRule rule : rules) {
            for (String keyword : rule.keywords()) {
                if (text.contains(keyword)) {
                    return Optional.of(rule.peer());
                }
            }
        }
        return Optional.empty();
    }
}
