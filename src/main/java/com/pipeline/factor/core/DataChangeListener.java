package com.pipeline.factor.core;

import com.pipeline.factor.model.TimeSeriesFrame;

/**
 * 数据变化监听器。
 * 通过 {@link DataSource#onChange} 显式订阅，数据源在同一线程内同步回调。
 */
public interface DataChangeListener {

    /**
     * 初始数据加载完成
     *
     * @param data 已加载的全部数据
     */
    void onDataLoaded(TimeSeriesFrame data);

    /**
     * 追加了新数据
     *
     * @param added 新到达且符合订阅查询的行
     */
    void onDataChanged(TimeSeriesFrame added);

    /**
     * 单个实体追加了新数据，在 {@link #onDataChanged} 之后按实体逐个回调
     *
     * @param entityId 实体标识
     * @param added    该实体新到达的行
     */
    default void onEntityDataChanged(String entityId, TimeSeriesFrame added) {
    }
}
