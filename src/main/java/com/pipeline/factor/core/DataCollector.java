package com.pipeline.factor.core;

/**
 * 数据采集器接口。
 * 采集到的数据追加进存储，由存储负责通知订阅的因子。
 */
public interface DataCollector {

    /** 启动采集；重复启动应被忽略 */
    void start();

    /** 请求停止采集 */
    void stop();

    boolean isRunning();
}
