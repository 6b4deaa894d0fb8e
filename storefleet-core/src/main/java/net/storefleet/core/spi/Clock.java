package net.storefleet.core.spi;

import java.time.Instant;

/** 테스트에서 시각을 고정할 수 있도록 분리 (기본 구현: Instant::now) */
@FunctionalInterface
public interface Clock {
    Instant now();
}
