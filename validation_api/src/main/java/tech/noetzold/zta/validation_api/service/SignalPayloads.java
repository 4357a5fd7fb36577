package tech.noetzold.zta.validation_api.service;

import java.time.Instant;
import java.time.LocalDate;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.time.format.DateTimeParseException;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.function.Function;

/**
 * Typed reads over untyped signal payload maps.
 */
final class SignalPayloads {

    private static final List<Function<String, Instant>> TIMESTAMP_PARSERS = List.of(
            Instant::parse,
            s -> OffsetDateTime.parse(s).toInstant(),
            s -> LocalDate.parse(s).atStartOfDay(ZoneOffset.UTC).toInstant(),
            s -> Instant.ofEpochMilli(Math.round(Double.parseDouble(s) * 1000)));

    private SignalPayloads() {}

    static Optional<String> text(Map<String, Object> payload, String field) {
        Object v = payload.get(field);
        if (v == null) return Optional.empty();
        String s = v.toString().trim();
        return s.isEmpty() ? Optional.empty() : Optional.of(s);
    }

    static Optional<Double> number(Map<String, Object> payload, String field) {
        Object v = payload.get(field);
        if (v instanceof Number n) {
            double d = n.doubleValue();
            return Double.isFinite(d) ? Optional.of(d) : Optional.empty();
        }
        if (v instanceof String s && !s.isBlank()) {
            try {
                double d = Double.parseDouble(s.trim());
                return Double.isFinite(d) ? Optional.of(d) : Optional.empty();
            } catch (NumberFormatException e) {
                return Optional.empty();
            }
        }
        return Optional.empty();
    }

    static Optional<Boolean> bool(Map<String, Object> payload, String field) {
        Object v = payload.get(field);
        if (v instanceof Boolean b) return Optional.of(b);
        if (v instanceof String s) {
            return switch (s.trim().toLowerCase(Locale.ROOT)) {
                case "true", "1", "yes" -> Optional.of(Boolean.TRUE);
                case "false", "0", "no" -> Optional.of(Boolean.FALSE);
                default -> Optional.empty();
            };
        }
        if (v instanceof Number n) return Optional.of(n.intValue() != 0);
        return Optional.empty();
    }

    /**
     * Parses an ISO-8601 instant, an offset date-time, a plain date or epoch seconds.
     *
     * @throws IllegalArgumentException when the value is present but unreadable
     */
    static Optional<Instant> instant(Object v) {
        if (v == null) return Optional.empty();
        if (v instanceof Number n) {
            return Optional.of(Instant.ofEpochMilli(Math.round(n.doubleValue() * 1000)));
        }
        String s = v.toString().trim();
        if (s.isEmpty()) return Optional.empty();
        RuntimeException last = null;
        for (Function<String, Instant> parser : TIMESTAMP_PARSERS) {
            try {
                return Optional.of(parser.apply(s));
            } catch (DateTimeParseException | NumberFormatException e) {
                last = e;
            }
        }
        throw new IllegalArgumentException("Unreadable timestamp: " + s, last);
    }
}
