package com.edge.metrics.core.model;

/**
 * 边界框类型
 */
public enum BoxType {
    /**
     * 标注真值，没有置信度
     */
    GROUND_TRUTH,

    /**
     * 模型检测结果，必须带置信度
     */
    DETECTED
}
