package com.ryuqq.prp.adapter.file.store;

import com.fasterxml.jackson.core.JsonParser;
import com.fasterxml.jackson.databind.DeserializationContext;
import com.fasterxml.jackson.databind.deser.std.StdScalarDeserializer;

import java.io.IOException;
import java.time.Instant;
import java.time.LocalDateTime;
import java.time.OffsetDateTime;
import java.time.ZoneId;
import java.time.format.DateTimeParseException;

/**
 * ISO-8601 시각을 Instant로 읽는 Deserializer.
 *
 * <p>offset이 있는 값({@code 2025-01-01T10:00:00Z}, {@code +09:00})은 그대로 변환하고,
 * offset이 없는 로컬 시각({@code 2025-01-01T10:00:00.123456})은 주어진 zone 기준으로 해석합니다.
 * 어느 형식도 아니면 InvalidFormatException을 발생시킵니다.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
final class LenientInstantDeserializer extends StdScalarDeserializer<Instant> {

    private static final long serialVersionUID = 1L;

    private final ZoneId zone;

    LenientInstantDeserializer(ZoneId zone) {
        super(Instant.class);
        if (zone == null) {
            throw new IllegalArgumentException("zone cannot be null");
        }
        this.zone = zone;
    }

    @Override
    public Instant deserialize(JsonParser parser, DeserializationContext context) throws IOException {
        String text = parser.getValueAsString();
        if (text == null || text.isBlank()) {
            return null;
        }
        String value = text.trim();
        try {
            return OffsetDateTime.parse(value).toInstant();
        } catch (DateTimeParseException offsetMissing) {
            try {
                return LocalDateTime.parse(value).atZone(zone).toInstant();
            } catch (DateTimeParseException e) {
                return (Instant) context.handleWeirdStringValue(Instant.class, value,
                    "not an ISO-8601 date-time");
            }
        }
    }
}
