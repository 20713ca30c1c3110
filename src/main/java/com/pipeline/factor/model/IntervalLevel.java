package com.pipeline.factor.model;

/**
 * 数据粒度级别
 */
public enum IntervalLevel {
    LEVEL_1MIN("1m"),
    LEVEL_5MIN("5m"),
    LEVEL_15MIN("15m"),
    LEVEL_30MIN("30m"),
    LEVEL_1HOUR("1h"),
    LEVEL_4HOUR("4h"),
    LEVEL_1DAY("1d"),
    LEVEL_1WEEK("1wk"),
    LEVEL_1MON("1mon");

    private final String value;

    IntervalLevel(String value) {
        this.value = value;
    }

    public String getValue() { return value; }

    /**
     * 按取值或枚举名解析，如 "1d" 或 "LEVEL_1DAY"
     */
    public static IntervalLevel of(String text) {
        if (text == null || text.isBlank()) {
            throw new IllegalArgumentException("Interval level must not be null or blank");
        }
        for (IntervalLevel level : values()) {
            if (level.value.equalsIgnoreCase(text) || level.name().equalsIgnoreCase(text)) {
                return level;
            }
        }
        throw new IllegalArgumentException("Unknown interval level: " + text);
    }
}
