package com.edge.metrics.core.match;

import com.edge.metrics.core.model.BoundingBox;

/**
 * 单个检测框的匹配结果
 */
public class DetectionMatch {
    private final BoundingBox detection;
    private final boolean truePositive;
    private final double iou;                       // TP 为匹配真值的 IoU，FP 为同图同类中的最大 IoU
    private final BoundingBox matchedGroundTruth;   // FP 时为 null

    public DetectionMatch(BoundingBox detection, boolean truePositive, double iou,
                          BoundingBox matchedGroundTruth) {
        this.detection = detection;
        this.truePositive = truePositive;
        this.iou = iou;
        this.matchedGroundTruth = matchedGroundTruth;
    }

    public BoundingBox getDetection() { return detection; }

    public boolean isTruePositive() { return truePositive; }

    public double getIou() { return iou; }

    public BoundingBox getMatchedGroundTruth() { return matchedGroundTruth; }

    public double getConfidence() { return detection.confidenceOrZero(); }

    public String getImageId() { return detection.getImageId(); }

    @Override
    public String toString() {
        return String.format("DetectionMatch[%s conf=%.3f %s iou=%.3f]",
            detection.getImageId(), getConfidence(), truePositive ? "TP" : "FP", iou);
    }
}
