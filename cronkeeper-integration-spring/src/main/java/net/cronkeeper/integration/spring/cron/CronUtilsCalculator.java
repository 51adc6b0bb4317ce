package net.cronkeeper.integration.spring.cron;

import com.cronutils.model.CronType;
import com.cronutils.model.definition.CronDefinitionBuilder;
import com.cronutils.model.time.ExecutionTime;
import com.cronutils.parser.CronParser;
import net.cronkeeper.core.schedule.ScheduleParseException;
import net.cronkeeper.core.spi.CronCalculator;

import java.time.Instant;
import java.time.ZoneId;
import java.time.ZonedDateTime;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/** cron-utils 기반 계산기. 표준 5필드 UNIX cron (분 시 일 월 요일) */
public final class CronUtilsCalculator implements CronCalculator {
    private static final CronParser PARSER =
            new CronParser(CronDefinitionBuilder.instanceDefinitionFor(CronType.UNIX));

    // 간단 LRU (최대 256개). 파싱 결과만 캐시한다
    private final Map<String, ExecutionTime> cache = new LruMap<>(256);

    @Override
    public Instant next(Instant from, String cronExpr, ZoneId zone) throws ScheduleParseException {
        Objects.requireNonNull(from); Objects.requireNonNull(zone);

        ExecutionTime et = executionTime(cronExpr);
        ZonedDateTime base = from.atZone(zone);
        return et.nextExecution(base)
                .map(ZonedDateTime::toInstant)
                .orElseThrow(() -> new ScheduleParseException(cronExpr, "schedule has no execution after " + base));
    }

    private ExecutionTime executionTime(String cronExpr) throws ScheduleParseException {
        if (cronExpr == null || cronExpr.isBlank()) {
            throw new ScheduleParseException(String.valueOf(cronExpr), "empty expression");
        }
        synchronized (cache) {
            ExecutionTime cached = cache.get(cronExpr);
            if (cached != null) return cached;
        }
        ExecutionTime parsed;
        try {
            parsed = ExecutionTime.forCron(PARSER.parse(cronExpr.trim()));
        } catch (IllegalArgumentException e) {
            throw new ScheduleParseException(cronExpr, e);
        }
        synchronized (cache) {
            cache.put(cronExpr, parsed);
        }
        return parsed;
    }

    public void invalidateAll() { synchronized (cache) { cache.clear(); } }

    // --- 내부 LRU ---
    private static final class LruMap<K, V> extends LinkedHashMap<K, V> {
        private final int max;
        LruMap(int max) { super(16, 0.75f, true); this.max = max; }
        @Override protected boolean removeEldestEntry(Map.Entry<K, V> eldest) { return size() > max; }
    }
}
