package com.edge.metrics.core.pascal;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * PR 明细表中的一行，对应一个检测框
 */
public class DetectionRecord {
    @JsonProperty("image")
    private final String imageId;
    private final double confidence;
    @JsonProperty("TP")
    private final boolean truePositive;
    private final double iou;
    @JsonProperty("acc_TP")
    private final int accumulatedTp;
    @JsonProperty("acc_FP")
    private final int accumulatedFp;
    private final double precision;
    private final double recall;

    public DetectionRecord(String imageId, double confidence, boolean truePositive, double iou,
                           int accumulatedTp, int accumulatedFp, double precision, double recall) {
        this.imageId = imageId;
        this.confidence = confidence;
        this.truePositive = truePositive;
        this.iou = iou;
        this.accumulatedTp = accumulatedTp;
        this.accumulatedFp = accumulatedFp;
        this.precision = precision;
        this.recall = recall;
    }

    public String getImageId() { return imageId; }

    public double getConfidence() { return confidence; }

    public boolean isTruePositive() { return truePositive; }

    public double getIou() { return iou; }

    public int getAccumulatedTp() { return accumulatedTp; }

    public int getAccumulatedFp() { return accumulatedFp; }

    public double getPrecision() { return precision; }

    public double getRecall() { return recall; }
}
