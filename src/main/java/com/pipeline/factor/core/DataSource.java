package com.pipeline.factor.core;

import com.pipeline.factor.model.DataQuery;
import com.pipeline.factor.model.TimeSeriesFrame;

import java.sql.Timestamp;

/**
 * 数据源接口：因子读取原始数据和已持久化因子的唯一入口。
 *
 * 所有返回的帧都以 (实体标识, 时间戳) 为键，组内按时间升序。
 * 无数据时返回空帧（非null）；底层读取失败抛出运行时异常。
 */
public interface DataSource {

    /**
     * 按查询描述读取数据，依次应用实体范围、时间范围、过滤条件、排序截取和列投影。
     *
     * @param query 查询描述
     * @return 查询结果帧
     */
    TimeSeriesFrame query(DataQuery query);

    /**
     * 读取每个实体最近 window 行数据。
     *
     * @param provider 数据提供方
     * @param schema   数据模式名
     * @param window   每个实体保留的最大行数，0 表示不读取
     * @return 结果帧
     */
    TimeSeriesFrame loadRecent(String provider, String schema, int window);

    /**
     * 读取从起始时间开始的全部数据。
     *
     * @param provider       数据提供方
     * @param schema         数据模式名
     * @param startTimestamp 起始时间（含）；null表示全部历史
     * @return 结果帧
     */
    TimeSeriesFrame loadFull(String provider, String schema, Timestamp startTimestamp);

    /**
     * 订阅数据变化。
     * 当查询所指向的数据表追加新数据时，把符合查询的新行同步推送给监听器。
     *
     * @param query    订阅范围
     * @param listener 监听器
     */
    void onChange(DataQuery query, DataChangeListener listener);

    /**
     * 取消监听器的全部订阅
     *
     * @return 是否存在该监听器的订阅
     */
    boolean removeListener(DataChangeListener listener);
}
