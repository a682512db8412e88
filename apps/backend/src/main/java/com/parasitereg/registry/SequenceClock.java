package com.parasitereg.registry;

/**
 * 托管环境提供的单调序列值，用作提交时间戳。
 * 只在写事务已通过全部校验、即将提交时读取。
 */
public interface SequenceClock {

    long current();
}
