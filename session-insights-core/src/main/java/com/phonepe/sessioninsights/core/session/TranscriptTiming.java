/*
 * Copyright (c) 2025 Original Author(s), PhonePe India Pvt. Ltd.
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 * http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */

package com.phonepe.sessioninsights.core.session;

import com.google.common.base.Strings;
import com.phonepe.sessioninsights.core.messages.Message;
import com.phonepe.sessioninsights.core.utils.AnalysisUtils;
import lombok.experimental.UtilityClass;
import lombok.extern.slf4j.Slf4j;

import java.time.Duration;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeFormatterBuilder;
import java.time.format.DateTimeParseException;
import java.util.List;
import java.util.Locale;
import java.util.Optional;

/**
 * Wall clock span of a transcript
 */
@UtilityClass
@Slf4j
public class TranscriptTiming {
    private static final DateTimeFormatter TIMESTAMP_FORMAT = new DateTimeFormatterBuilder()
            .append(DateTimeFormatter.ISO_LOCAL_DATE)
            .optionalStart()
            .optionalStart().appendLiteral('T').optionalEnd()
            .optionalStart().appendLiteral(' ').optionalEnd()
            .append(DateTimeFormatter.ISO_LOCAL_TIME)
            .optionalStart().appendOffsetId().optionalEnd()
            .optionalEnd()
            .toFormatter(Locale.ROOT);

    /**
     * Minutes between the first and the last message, rounded to two places. Returns 0 when there are fewer than two
     * messages, when either end has no timestamp or when a timestamp cannot be parsed.
     */
    public static double durationMinutes(final List<Message> messages) {
        if (messages.size() < 2) {
            return 0;
        }
        final var first = parse(messages.get(0).getTimestamp());
        final var last = parse(messages.get(messages.size() - 1).getTimestamp());
        if (first.isEmpty() || last.isEmpty()) {
            return 0;
        }
        final var seconds = Duration.between(first.get(), last.get()).toMillis() / 1000.0;
        return AnalysisUtils.round(seconds / 60, 2);
    }

    /**
     * Parses an ISO-8601 style timestamp. The date and time may be separated by {@code T} or by a space, the time
     * may be missing (start of day) and an offset, when present, is normalised to UTC.
     */
    static Optional<LocalDateTime> parse(final String timestamp) {
        if (Strings.isNullOrEmpty(timestamp)) {
            return Optional.empty();
        }
        try {
            final var parsed = TIMESTAMP_FORMAT.parseBest(timestamp.trim(),
                                                          OffsetDateTime::from,
                                                          LocalDateTime::from,
                                                          LocalDate::from);
            if (parsed instanceof OffsetDateTime offsetDateTime) {
                return Optional.of(offsetDateTime.withOffsetSameInstant(ZoneOffset.UTC).toLocalDateTime());
            }
            if (parsed instanceof LocalDate date) {
                return Optional.of(date.atStartOfDay());
            }
            return Optional.of((LocalDateTime) parsed);
        }
        catch (DateTimeParseException e) {
            log.debug("Ignoring unparseable timestamp {}: {}", timestamp, e.getMessage());
            return Optional.empty();
        }
    }
}
