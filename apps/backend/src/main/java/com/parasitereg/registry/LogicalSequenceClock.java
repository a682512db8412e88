package com.parasitereg.registry;

import java.util.concurrent.atomic.AtomicLong;

/** 每次提交读取都前进一格的逻辑时钟（类似块高度） */
public class LogicalSequenceClock implements SequenceClock {

    private final AtomicLong counter;

    public LogicalSequenceClock(long start) {
        this.counter = new AtomicLong(start - 1);
    }

    @Override
    public long current() {
        return counter.incrementAndGet();
    }
}
