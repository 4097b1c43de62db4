package com.edge.metrics.core.coco;

/**
 * COCO 评估的一组参数：尺寸区间 + 每张图片的最大检测数
 */
public enum CocoSetting {
    ALL_100(AreaRange.ALL, 100),
    SMALL_100(AreaRange.SMALL, 100),
    MEDIUM_100(AreaRange.MEDIUM, 100),
    LARGE_100(AreaRange.LARGE, 100),
    ALL_1(AreaRange.ALL, 1),
    ALL_10(AreaRange.ALL, 10);

    private final AreaRange areaRange;
    private final int maxDetections;

    CocoSetting(AreaRange areaRange, int maxDetections) {
        this.areaRange = areaRange;
        this.maxDetections = maxDetections;
    }

    public AreaRange getAreaRange() { return areaRange; }

    public int getMaxDetections() { return maxDetections; }
}
