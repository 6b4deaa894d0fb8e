package net.storefleet.core.spi;

import java.time.Instant;

public interface BillingCalendar {
    /** now 가 속한 과금 주기의 시작 시각 */
    Instant periodStart(Instant now);
}
