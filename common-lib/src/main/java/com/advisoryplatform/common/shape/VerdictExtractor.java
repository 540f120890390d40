package com.advisoryplatform.common.shape;

import com.advisoryplatform.common.model.Verdict;
import com.advisoryplatform.common.shape.ExtractionRule.Located;
import com.fasterxml.jackson.databind.JsonNode;

import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.OptionalDouble;
import java.util.Set;

/**
 * Turns a conforming peer payload into a {@link Verdict} using an ordered rule table.
 *
 * <h3>Rule table (evaluated top to bottom, first match wins)</h3>
 * <pre>
 *   flat-assertion  assertion text            → confidence
 *   final-verdict   final_verdict.{status|verdict|decision}
 *                                             → final_verdict.{inevitability|confidence|probability|meta.confidence}
 *   flat-verdict    verdict text + confidence
 *   flat-status     status text + confidence
 *   flat-response   response text + confidence
 * </pre>
 *
 * <p>Confidence is clamped to [0.0, 1.0]. A {@code core_name} in the payload overrides the
 * endpoint's configured name. Every top-level field the matching rule did not consume
 * (including {@code assertion_id}, {@code timestamp}, {@code metadata} and the whole
 * {@code final_verdict} object) is copied into {@link Verdict#metadata()} unchanged.
 *
 * <p>Nothing is defaulted: when no rule yields both fields there is no verdict.
 */
public final class VerdictExtractor {

    private static final List<List<String>> FINAL_VERDICT_ASSERTION = List.of(
        List.of(PayloadFields.FINAL_VERDICT, "status"),
        List.of(PayloadFields.FINAL_VERDICT, "verdict"),
        List.of(PayloadFields.FINAL_VERDICT, "decision")
    );

    private static final List<List<String>> FINAL_VERDICT_CONFIDENCE = List.of(
        List.of(PayloadFields.FINAL_VERDICT, "inevitability"),
        List.of(PayloadFields.FINAL_VERDICT, "confidence"),
        List.of(PayloadFields.FINAL_VERDICT, "probability"),
        List.of(PayloadFields.FINAL_VERDICT, "meta", "confidence")
    );

    public static final List<ExtractionRule> RULES = List.of(
        flatRule("flat-assertion", "assertion", false),
        new ExtractionRule(
            "final-verdict",
            p -> p.path(PayloadFields.FINAL_VERDICT).isObject()
                 && PayloadFields.firstText(p, FINAL_VERDICT_ASSERTION).isPresent(),
            p -> {
                Optional<String> text = PayloadFields.firstText(p, FINAL_VERDICT_ASSERTION);
                OptionalDouble confidence = PayloadFields.firstNumber(p, FINAL_VERDICT_CONFIDENCE);
                if (text.isEmpty() || confidence.isEmpty()) {
                    return Optional.empty();
                }
                // final_verdict itself stays in metadata for traceability
                return Optional.of(new Located(text.get(), confidence.getAsDouble(), Set.of()));
            }),
        flatRule("flat-verdict", "verdict", true),
        flatRule("flat-status", "status", true),
        flatRule("flat-response", "response", true)
    );

    private VerdictExtractor() {}

    /**
     * @param endpointCoreName name from endpoint configuration, used when the payload has none
     * @param payload          peer response body; read only
     * @return the extraction outcome; never {@code null}
     */
    public static Extraction extract(String endpointCoreName, JsonNode payload) {
        if (payload == null || !payload.isObject()) {
            return Extraction.none(null, ShapeGuide.NOT_AN_OBJECT);
        }
        for (ExtractionRule rule : RULES) {
            if (!rule.applies().test(payload)) {
                continue;
            }
            Optional<Located> located = rule.extractor().apply(payload);
            if (located.isEmpty()) {
                return Extraction.none(rule.name(), "rule " + rule.name() + " matched but fields were incomplete");
            }
            String coreName = PayloadFields.readText(payload.path(PayloadFields.CORE_NAME))
                .orElse(endpointCoreName);
            Verdict verdict = new Verdict(
                coreName,
                located.get().assertion(),
                Verdict.clamp(located.get().confidence()),
                passThrough(payload, located.get().consumedKeys()));
            return new Extraction(verdict, rule.name(), "extracted");
        }
        return Extraction.none(null, "no extraction rule matched payload shape");
    }

    private static ExtractionRule flatRule(String name, String textKey, boolean requireConfidence) {
        return new ExtractionRule(
            name,
            p -> PayloadFields.hasText(p.path(textKey))
                 && (!requireConfidence || PayloadFields.isNumeric(p.path("confidence"))),
            p -> {
                OptionalDouble confidence = PayloadFields.readNumber(p.path("confidence"));
                if (confidence.isEmpty()) {
                    return Optional.empty();
                }
                return Optional.of(new Located(
                    PayloadFields.readText(p.path(textKey)).orElseThrow(),
                    confidence.getAsDouble(),
                    Set.of(textKey, "confidence")));
            });
    }

    private static Map<String, Object> passThrough(JsonNode payload, Set<String> consumed) {
        Map<String, Object> metadata = new LinkedHashMap<>();
        Iterator<Map.Entry<String, JsonNode>> fields = payload.fields();
        while (fields.hasNext()) {
            Map.Entry<String, JsonNode> field = fields.next();
            if (consumed.contains(field.getKey()) || PayloadFields.CORE_NAME.equals(field.getKey())) {
                continue;
            }
            metadata.put(field.getKey(), PayloadFields.toPlain(field.getValue()));
        }
        return metadata;
    }

    /**
     * @param verdict the extracted verdict, or {@code null}
     * @param rule    name of the rule that matched, or {@code null} when none did
     * @param reason  human-readable outcome for logging
     */
    public record Extraction(Verdict verdict, String rule, String reason) {

        static Extraction none(String rule, String reason) {
            return new Extraction(null, rule, reason);
        }

        public boolean isPresent() {
            return verdict != null;
        }

        public Optional<Verdict> asOptional() {
            return Optional.ofNullable(verdict);
        }
    }
}
