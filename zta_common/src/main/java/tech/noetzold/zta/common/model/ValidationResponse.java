package tech.noetzold.zta.common.model;

import java.util.Map;

/**
 * Validator output. {@code validated} is authoritative; the other sections are diagnostics.
 */
public record ValidationResponse(
        ValidatedVector validated,
        Map<String, Object> quality,
        Map<String, Object> cross,
        Map<String, Object> enrichment
) {}
