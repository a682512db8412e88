package com.parasitereg.registry;

import java.util.concurrent.atomic.AtomicLong;

/**
 * 毫秒级墙钟，保证单调不回退（系统时间回拨时沿用上一次的值）。
 */
public class SystemSequenceClock implements SequenceClock {

    private final AtomicLong last = new AtomicLong();

    @Override
    public long current() {
        long now = System.currentTimeMillis();
        return last.accumulateAndGet(now, Math::max);
    }
}
