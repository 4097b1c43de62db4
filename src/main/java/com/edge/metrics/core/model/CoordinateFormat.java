package com.edge.metrics.core.model;

/**
 * 原始坐标的表达方式
 * <p>
 * 评估核心只接受绝对坐标 (x1, y1, x2, y2)，其他格式在进入核心前由 {@link BoundingBoxes#fromFormat} 转换
 */
public enum CoordinateFormat {
    /**
     * 绝对坐标，左上角 + 右下角 [x1, y1, x2, y2]
     */
    XYX2Y2,

    /**
     * 绝对坐标，左上角 + 宽高 [x, y, w, h]
     */
    XYWH,

    /**
     * YOLO 归一化坐标，中心点 + 宽高 [cx, cy, w, h]，取值 0.0 - 1.0，需要图片尺寸
     */
    YOLO;

    public boolean requiresImageSize() {
        return this == YOLO;
    }
}
