package com.edge.metrics.core.coco;

/**
 * COCO 目标尺寸区间（按真值面积，单位像素²），左闭右开
 */
public enum AreaRange {
    ALL(0.0, Double.POSITIVE_INFINITY),
    SMALL(0.0, 32.0 * 32.0),
    MEDIUM(32.0 * 32.0, 96.0 * 96.0),
    LARGE(96.0 * 96.0, Double.POSITIVE_INFINITY);

    private final double min;
    private final double max;

    AreaRange(double min, double max) {
        this.min = min;
        this.max = max;
    }

    public boolean contains(double area) {
        return area >= min && area < max;
    }

    /**
     * 面积所属的尺寸桶（SMALL / MEDIUM / LARGE）
     */
    public static AreaRange bucketOf(double area) {
        if (SMALL.contains(area)) return SMALL;
        if (MEDIUM.contains(area)) return MEDIUM;
        return LARGE;
    }

    public double getMin() { return min; }

    public double getMax() { return max; }
}
