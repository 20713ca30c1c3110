package com.pipeline.factor.core;

import com.pipeline.factor.model.TimeSeriesFrame;

/**
 * 持久化接口：按 (实体标识, 时间戳) 做持久化 upsert。
 * 写入为阻塞调用，不做重试；失败以运行时异常抛给调用方。
 */
@FunctionalInterface
public interface PersistenceSink {

    void write(TimeSeriesFrame frame, String schema, String provider);
}
