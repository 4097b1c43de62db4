package com.edge.metrics.core.summary;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * 单个类别的 PR 曲线数据，供外部绘图使用
 * <p>
 * PASCAL 曲线的 precision/recall 为原始点，interpolated* 为单调包络；
 * COCO 曲线只有 101 个召回率等级上的插值精度
 */
public class PrecisionRecallCurve {

    public enum Source {
        PASCAL,
        COCO
    }

    @JsonProperty("class")
    private final String classLabel;
    private final Source source;
    private final double iouThreshold;
    private final double[] precision;
    private final double[] recall;
    @JsonProperty("interpolated_precision")
    private final double[] interpolatedPrecision;
    @JsonProperty("interpolated_recall")
    private final double[] interpolatedRecall;
    @JsonProperty("AP")
    private final double averagePrecision;

    public PrecisionRecallCurve(String classLabel, Source source, double iouThreshold,
                                double[] precision, double[] recall,
                                double[] interpolatedPrecision, double[] interpolatedRecall,
                                double averagePrecision) {
        this.classLabel = classLabel;
        this.source = source;
        this.iouThreshold = iouThreshold;
        this.precision = precision;
        this.recall = recall;
        this.interpolatedPrecision = interpolatedPrecision;
        this.interpolatedRecall = interpolatedRecall;
        this.averagePrecision = averagePrecision;
    }

    public String getClassLabel() { return classLabel; }

    public Source getSource() { return source; }

    public double getIouThreshold() { return iouThreshold; }

    public double[] getPrecision() { return precision; }

    public double[] getRecall() { return recall; }

    public double[] getInterpolatedPrecision() { return interpolatedPrecision; }

    public double[] getInterpolatedRecall() { return interpolatedRecall; }

    public double getAveragePrecision() { return averagePrecision; }

    @Override
    public String toString() {
        return String.format("PrecisionRecallCurve[%s %s IoU=%.2f points=%d AP=%.4f]",
            source, classLabel, iouThreshold, precision.length, averagePrecision);
    }
}
