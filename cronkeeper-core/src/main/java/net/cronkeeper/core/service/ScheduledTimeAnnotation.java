package net.cronkeeper.core.service;

import java.time.Instant;
import java.time.OffsetDateTime;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.time.temporal.ChronoUnit;

/**
 * 슬롯 시각 어노테이션의 텍스트 포맷 (RFC 3339, 초 단위, UTC).
 * 재시작 후 이력 복원에 쓰이므로 parse → format → parse 가 같아야 한다.
 */
public final class ScheduledTimeAnnotation {
    private ScheduledTimeAnnotation() {}

    public static String format(Instant scheduledTime) {
        return DateTimeFormatter.ISO_INSTANT.format(scheduledTime.truncatedTo(ChronoUnit.SECONDS));
    }

    /** 오프셋 표기(+09:00 등)도 받아들인다 */
    public static Instant parse(String text) throws DateTimeParseException {
        return OffsetDateTime.parse(text, DateTimeFormatter.ISO_OFFSET_DATE_TIME).toInstant();
    }
}
