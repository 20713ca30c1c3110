package com.pipeline.factor.model;

/**
 * 缺口填充方向
 */
public enum FillMethod {
    /** 用前一个有效值向后填充 */
    FFILL,
    /** 用后一个有效值向前填充 */
    BFILL;

    public static FillMethod of(String text) {
        if (text == null || text.isBlank()) {
            throw new IllegalArgumentException("Fill method must not be null or blank");
        }
        switch (text.trim().toLowerCase()) {
            case "ffill":
            case "pad":
                return FFILL;
            case "bfill":
            case "backfill":
                return BFILL;
            default:
                throw new IllegalArgumentException("Unknown fill method: " + text);
        }
    }
}
