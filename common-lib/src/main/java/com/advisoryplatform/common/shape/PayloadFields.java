package com.advisoryplatform.common.shape;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;

import java.util.List;
import java.util.Optional;
import java.util.OptionalDouble;

/**
 * Known locations of the two required semantic fields inside a peer payload, in the order
 * they are searched. Shared by {@link ShapeGuide} (presence) and {@link VerdictExtractor}
 * (extraction) so both read the same table.
 *
 * <p>All lookups are read-only; a missing path resolves to Jackson's missing node.
 */
public final class PayloadFields {

    public static final String FINAL_VERDICT = "final_verdict";
    public static final String CORE_NAME     = "core_name";

    public static final List<List<String>> ASSERTION_PATHS = List.of(
        List.of("assertion"),
        List.of("verdict"),
        List.of("status"),
        List.of("response"),
        List.of(FINAL_VERDICT, "status"),
        List.of(FINAL_VERDICT, "verdict"),
        List.of(FINAL_VERDICT, "decision")
    );

    public static final List<List<String>> CONFIDENCE_PATHS = List.of(
        List.of("confidence"),
        List.of(FINAL_VERDICT, "inevitability"),
        List.of(FINAL_VERDICT, "confidence"),
        List.of(FINAL_VERDICT, "probability"),
        List.of(FINAL_VERDICT, "meta", "confidence")
    );

    private static final ObjectMapper PLAIN = new ObjectMapper();

    private PayloadFields() {}

    public static JsonNode resolve(JsonNode root, List<String> path) {
        JsonNode node = root;
        for (String segment : path) {
            node = node.path(segment);
        }
        return node;
    }

    public static boolean hasText(JsonNode node) {
        return node.isTextual() && !node.asText().isBlank();
    }

    /** Numbers, or strings parseable as a number. Only NaN is refused. */
    public static boolean isNumeric(JsonNode node) {
        return readNumber(node).isPresent();
    }

    public static Optional<String> readText(JsonNode node) {
        return hasText(node) ? Optional.of(node.asText().strip()) : Optional.empty();
    }

    /**
     * Reads a numeric value as given. Overflowing values such as {@code 1e400} or
     * {@code "Infinity"} come back infinite; bringing them into range is left to
     * {@link com.advisoryplatform.common.model.Verdict#clamp}.
     */
    public static OptionalDouble readNumber(JsonNode node) {
        if (node.isNumber()) {
            return notNaN(node.asDouble());
        }
        if (node.isTextual()) {
            try {
                return notNaN(Double.parseDouble(node.asText().strip()));
            } catch (NumberFormatException e) {
                return OptionalDouble.empty();
            }
        }
        return OptionalDouble.empty();
    }

    public static Optional<String> firstText(JsonNode root, List<List<String>> paths) {
        for (List<String> path : paths) {
            Optional<String> text = readText(resolve(root, path));
            if (text.isPresent()) {
                return text;
            }
        }
        return Optional.empty();
    }

    public static OptionalDouble firstNumber(JsonNode root, List<List<String>> paths) {
        for (List<String> path : paths) {
            OptionalDouble number = readNumber(resolve(root, path));
            if (number.isPresent()) {
                return number;
            }
        }
        return OptionalDouble.empty();
    }

    private static OptionalDouble notNaN(double value) {
        return Double.isNaN(value) ? OptionalDouble.empty() : OptionalDouble.of(value);
    }

    /** Converts a JSON value into plain Java maps, lists and scalars. */
    public static Object toPlain(JsonNode node) {
        return PLAIN.convertValue(node, Object.class);
    }
}
