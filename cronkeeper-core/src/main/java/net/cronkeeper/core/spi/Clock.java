package net.cronkeeper.core.spi;

import java.time.Instant;

/** 현재 시각 공급자. 운영은 Instant::now, 테스트는 고정/가변 시계 */
@FunctionalInterface
public interface Clock {
    Instant now();

    static Clock system() { return Instant::now; }
}
