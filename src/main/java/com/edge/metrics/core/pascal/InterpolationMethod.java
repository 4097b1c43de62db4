package com.edge.metrics.core.pascal;

/**
 * Pascal VOC AP 插值方式
 */
public enum InterpolationMethod {
    /**
     * 连续插值（VOC 2010 之后），对单调包络后的 PR 曲线在召回率变化处求面积
     */
    EVERY_POINT,

    /**
     * 11 点插值（VOC 2007），在召回率 0, 0.1, ..., 1 处取右侧最大精度的平均值
     */
    ELEVEN_POINT
}
