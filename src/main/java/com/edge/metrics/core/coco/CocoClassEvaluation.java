package com.edge.metrics.core.coco;

import java.util.Arrays;
import java.util.EnumMap;
import java.util.Map;

/**
 * 单个类别的 COCO 中间结果
 * <p>
 * 每个评估参数下，按 IoU 阈值记录 AP（101 点插值）和最终召回率。
 * 未计算或该参数下没有真值的位置为 NaN。
 */
public class CocoClassEvaluation {
    private final String classLabel;
    private final Map<CocoSetting, double[]> averagePrecision = new EnumMap<>(CocoSetting.class);
    private final Map<CocoSetting, double[]> recall = new EnumMap<>(CocoSetting.class);
    private final Map<CocoSetting, Integer> totalPositives = new EnumMap<>(CocoSetting.class);
    // ALL_100 下各阈值的 101 点插值精度，用于绘制 COCO PR 曲线
    private final double[][] interpolatedPrecision = new double[CocoEvaluator.IOU_THRESHOLDS.length][];

    public CocoClassEvaluation(String classLabel) {
        this.classLabel = classLabel;
    }

    void record(CocoSetting setting, int thresholdIndex, double ap, double finalRecall, int positives) {
        averagePrecision.computeIfAbsent(setting, s -> nanArray())[thresholdIndex] = ap;
        recall.computeIfAbsent(setting, s -> nanArray())[thresholdIndex] = finalRecall;
        totalPositives.put(setting, positives);
    }

    void recordCurve(int thresholdIndex, double[] precisionAtRecallLevels) {
        interpolatedPrecision[thresholdIndex] = precisionAtRecallLevels;
    }

    private static double[] nanArray() {
        double[] values = new double[CocoEvaluator.IOU_THRESHOLDS.length];
        Arrays.fill(values, Double.NaN);
        return values;
    }

    /**
     * 指定参数、指定阈值下的 AP，没有结果时为 NaN
     */
    public double getAveragePrecision(CocoSetting setting, int thresholdIndex) {
        double[] values = averagePrecision.get(setting);
        return values != null ? values[thresholdIndex] : Double.NaN;
    }

    /**
     * 指定参数、指定阈值下的召回率（TP / 真值数），没有结果时为 NaN
     */
    public double getRecall(CocoSetting setting, int thresholdIndex) {
        double[] values = recall.get(setting);
        return values != null ? values[thresholdIndex] : Double.NaN;
    }

    /**
     * 指定参数下参与评估（未被忽略）的真值数量，未评估时为 0
     */
    public int getTotalPositives(CocoSetting setting) {
        return totalPositives.getOrDefault(setting, 0);
    }

    /**
     * 指标在该类别上的取值（多阈值指标取阈值平均），没有结果时为 NaN
     */
    public double value(CocoMetric metric) {
        CocoSetting setting = metric.getSetting();
        if (!metric.usesAllThresholds()) {
            return metric.getKind() == CocoMetric.Kind.PRECISION
                ? getAveragePrecision(setting, metric.getThresholdIndex())
                : getRecall(setting, metric.getThresholdIndex());
        }
        double sum = 0.0;
        int count = 0;
        for (int t = 0; t < CocoEvaluator.IOU_THRESHOLDS.length; t++) {
            double v = metric.getKind() == CocoMetric.Kind.PRECISION
                ? getAveragePrecision(setting, t)
                : getRecall(setting, t);
            if (!Double.isNaN(v)) {
                sum += v;
                count++;
            }
        }
        return count > 0 ? sum / count : Double.NaN;
    }

    /**
     * ALL_100 下某阈值的 101 点插值精度，未计算时为 null
     */
    public double[] getInterpolatedPrecision(int thresholdIndex) {
        double[] values = interpolatedPrecision[thresholdIndex];
        return values != null ? values.clone() : null;
    }

    public String getClassLabel() { return classLabel; }

    @Override
    public String toString() {
        return String.format("CocoClassEvaluation[%s: settings=%s]", classLabel, averagePrecision.keySet());
    }
}
