package com.edge.metrics.core.pascal;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Collections;
import java.util.List;

/**
 * 单个类别的 Pascal VOC 指标
 * <p>
 * precision/recall 数组与按置信度降序的检测一一对应，也是绘制 PR 曲线所需的全部数据
 */
public class ClassApResult {
    @JsonProperty("class")
    private final String classLabel;
    private final double[] precision;
    private final double[] recall;
    @JsonProperty("AP")
    private final double averagePrecision;
    @JsonProperty("interpolated_precision")
    private final double[] interpolatedPrecision;
    @JsonProperty("interpolated_recall")
    private final double[] interpolatedRecall;
    @JsonProperty("total_positives")
    private final int totalPositives;
    @JsonProperty("TP")
    private final int totalTp;
    @JsonProperty("FP")
    private final int totalFp;
    private final double iouThreshold;
    private final InterpolationMethod method;
    @JsonProperty("table")
    private final List<DetectionRecord> records;

    public ClassApResult(String classLabel, double[] precision, double[] recall, double averagePrecision,
                         double[] interpolatedPrecision, double[] interpolatedRecall,
                         int totalPositives, int totalTp, int totalFp,
                         double iouThreshold, InterpolationMethod method, List<DetectionRecord> records) {
        this.classLabel = classLabel;
        this.precision = precision;
        this.recall = recall;
        this.averagePrecision = averagePrecision;
        this.interpolatedPrecision = interpolatedPrecision;
        this.interpolatedRecall = interpolatedRecall;
        this.totalPositives = totalPositives;
        this.totalTp = totalTp;
        this.totalFp = totalFp;
        this.iouThreshold = iouThreshold;
        this.method = method;
        this.records = Collections.unmodifiableList(records);
    }

    public String getClassLabel() { return classLabel; }

    public double[] getPrecision() { return precision.clone(); }

    public double[] getRecall() { return recall.clone(); }

    public double getAveragePrecision() { return averagePrecision; }

    public double[] getInterpolatedPrecision() { return interpolatedPrecision.clone(); }

    public double[] getInterpolatedRecall() { return interpolatedRecall.clone(); }

    public int getTotalPositives() { return totalPositives; }

    public int getTotalTp() { return totalTp; }

    public int getTotalFp() { return totalFp; }

    public double getIouThreshold() { return iouThreshold; }

    public InterpolationMethod getMethod() { return method; }

    public List<DetectionRecord> getRecords() { return records; }

    @Override
    public String toString() {
        return String.format("ClassApResult[%s: AP=%.4f, GT=%d, TP=%d, FP=%d, IoU=%.2f, %s]",
            classLabel, averagePrecision, totalPositives, totalTp, totalFp, iouThreshold, method);
    }
}
