package jobsched.cron;

import com.cronutils.model.CronType;
import com.cronutils.model.definition.CronDefinitionBuilder;
import com.cronutils.model.time.ExecutionTime;
import com.cronutils.parser.CronParser;
import jobsched.InvalidCronExpressionException;
import jobsched.spi.CronEvaluator;

import java.time.Instant;
import java.time.ZoneId;
import java.time.ZoneOffset;
import java.time.ZonedDateTime;
import java.time.temporal.ChronoUnit;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * {@link CronEvaluator} backed by cron-utils.
 *
 * <p>Accepts two formats, told apart by field count:
 * <ul>
 *   <li>5 fields, Unix style: {@code minute hour day-of-month month day-of-week},
 *       e.g. {@code "0 15 * * *"}</li>
 *   <li>6 fields with leading seconds, Spring style: {@code "*}{@code /5 * * * * *"}</li>
 * </ul>
 * Occurrences are computed in a fixed time zone (UTC unless configured). Parsed expressions
 * are kept in a bounded LRU cache.
 */
public final class CronUtilsEvaluator implements CronEvaluator {
    public static final int DEFAULT_CACHE_SIZE = 256;

    private static final CronParser UNIX_PARSER =
            new CronParser(CronDefinitionBuilder.instanceDefinitionFor(CronType.UNIX));
    private static final CronParser SECONDS_PARSER =
            new CronParser(CronDefinitionBuilder.instanceDefinitionFor(CronType.SPRING53));

    private final ZoneId zone;
    private final Map<String, ExecutionTime> cache;

    public CronUtilsEvaluator() {
        this(ZoneOffset.UTC);
    }

    public CronUtilsEvaluator(ZoneId zone) {
        this(zone, DEFAULT_CACHE_SIZE);
    }

    public CronUtilsEvaluator(ZoneId zone, int cacheSize) {
        this.zone = Objects.requireNonNull(zone, "zone");
        if (cacheSize <= 0) {
            throw new IllegalArgumentException("cacheSize must be > 0");
        }
        this.cache = new LruMap<>(cacheSize);
    }

    @Override
    public Instant nextOccurrence(String expression, Instant reference) {
        Objects.requireNonNull(expression, "expression");
        Objects.requireNonNull(reference, "reference");
        ExecutionTime executionTime = parseOrThrow(expression);

        ZonedDateTime base = reference.truncatedTo(ChronoUnit.SECONDS).atZone(zone);
        return executionTime.nextExecution(base)
                .map(ZonedDateTime::toInstant)
                .orElseThrow(() -> new InvalidCronExpressionException(expression,
                        "no occurrence after " + reference));
    }

    @Override
    public void validate(String expression) {
        parseOrThrow(Objects.requireNonNull(expression, "expression"));
    }

    public ZoneId zone() {
        return zone;
    }

    private ExecutionTime executionTime(String expression) {
        String normalized = expression.trim();
        synchronized (cache) {
            ExecutionTime cached = cache.get(normalized);
            if (cached != null) {
                return cached;
            }
        }
        ExecutionTime parsed = ExecutionTime.forCron(parserFor(normalized).parse(normalized).validate());
        synchronized (cache) {
            cache.put(normalized, parsed);
        }
        return parsed;
    }

    private static CronParser parserFor(String expression) {
        int fields = expression.isEmpty() ? 0 : expression.split("\\s+").length;
        switch (fields) {
            case 5:
                return UNIX_PARSER;
            case 6:
                return SECONDS_PARSER;
            default:
                throw new InvalidCronExpressionException(expression,
                        "expected 5 or 6 fields but found " + fields);
        }
    }

    private ExecutionTime parseOrThrow(String expression) {
        try {
            return executionTime(expression);
        } catch (InvalidCronExpressionException e) {
            throw e;
        } catch (IllegalArgumentException e) {
            throw new InvalidCronExpressionException(expression, e);
        }
    }

    private static final class LruMap<K, V> extends LinkedHashMap<K, V> {
        private final int max;

        LruMap(int max) {
            super(16, 0.75f, true);
            this.max = max;
        }

        @Override
        protected boolean removeEldestEntry(Map.Entry<K, V> eldest) {
            return size() > max;
        }
    }
}
