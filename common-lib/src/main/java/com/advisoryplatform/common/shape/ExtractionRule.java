package com.advisoryplatform.common.shape;

import com.fasterxml.jackson.databind.JsonNode;

import java.util.Optional;
import java.util.Set;
import java.util.function.Function;
import java.util.function.Predicate;

/**
 * One row of the extraction table: when {@code applies} matches a payload, {@code extractor}
 * locates the assertion text and raw confidence for it.
 *
 * @param name      stable rule identifier, logged with every extraction
 * @param applies   shape predicate; the first matching rule in table order wins
 * @param extractor reads the fields; empty when the matched shape is incomplete
 */
public record ExtractionRule(
    String name,
    Predicate<JsonNode> applies,
    Function<JsonNode, Optional<Located>> extractor
) {

    /**
     * Fields found by a rule.
     *
     * @param consumedKeys top-level keys the rule read; every other key passes through to metadata
     */
    public record Located(String assertion, double confidence, Set<String> consumedKeys) {}
}
