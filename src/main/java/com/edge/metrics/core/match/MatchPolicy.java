package com.edge.metrics.core.match;

/**
 * 检测框与真值框的贪心匹配规则
 */
public enum MatchPolicy {
    /**
     * 只在尚未匹配的真值框中选 IoU 最大者（COCO 评估使用的规则）
     * 优点：高置信度检测不会"挡住"同一目标附近的另一个真值
     */
    GREEDY_UNMATCHED,

    /**
     * Pascal VOC devkit 规则：在全部真值框中选 IoU 最大者，
     * 若该真值已被更高置信度的检测占用，则当前检测记为误检（即使 IoU 超过阈值）
     */
    VOC_DEVKIT
}
