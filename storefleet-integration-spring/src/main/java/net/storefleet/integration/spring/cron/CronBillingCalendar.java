package net.storefleet.integration.spring.cron;

import com.cronutils.model.CronType;
import com.cronutils.model.definition.CronDefinitionBuilder;
import com.cronutils.model.time.ExecutionTime;
import com.cronutils.parser.CronParser;
import net.storefleet.core.spi.BillingCalendar;

import java.time.Instant;
import java.time.ZoneId;
import java.time.ZonedDateTime;
import java.util.Objects;

/**
 * 과금 주기 경계를 Quartz cron 으로 표현한다 (기본: 매월 1일 00:00, "0 0 0 1 * ?").
 * 주기 시작 = now 이후 다음 실행 시각의 직전 실행 시각.
 */
public final class CronBillingCalendar implements BillingCalendar {
    public static final String MONTHLY = "0 0 0 1 * ?";

    private static final CronParser PARSER =
            new CronParser(CronDefinitionBuilder.instanceDefinitionFor(CronType.QUARTZ));

    private final String expression;
    private final ExecutionTime executionTime;
    private final ZoneId zone;

    public CronBillingCalendar(String expression, ZoneId zone) {
        this.expression = Objects.requireNonNull(expression);
        this.zone = Objects.requireNonNull(zone);
        this.executionTime = ExecutionTime.forCron(PARSER.parse(expression));
    }

    public static CronBillingCalendar monthly(ZoneId zone) {
        return new CronBillingCalendar(MONTHLY, zone);
    }

    @Override
    public Instant periodStart(Instant now) {
        ZonedDateTime base = now.atZone(zone);
        ZonedDateTime next = executionTime.nextExecution(base).orElseThrow(
                () -> new IllegalStateException("no next billing boundary for [" + expression + "] at " + base));
        return executionTime.lastExecution(next)
                .orElseThrow(() -> new IllegalStateException("no billing period start for [" + expression + "]"))
                .toInstant();
    }

    public Instant nextPeriodStart(Instant now) {
        return executionTime.nextExecution(now.atZone(zone)).map(ZonedDateTime::toInstant)
                .orElseThrow(() -> new IllegalStateException("no next billing boundary for [" + expression + "]"));
    }
}
