package com.edge.metrics.core.pascal;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Collections;
import java.util.Map;
import java.util.TreeMap;

/**
 * Pascal VOC 评估结果：各类别 AP 和 mAP
 */
public class PascalVocResult {
    @JsonProperty("mAP")
    private final double meanAveragePrecision;
    @JsonProperty("per_class")
    private final Map<String, ClassApResult> perClass;

    public PascalVocResult(double meanAveragePrecision, Map<String, ClassApResult> perClass) {
        this.meanAveragePrecision = meanAveragePrecision;
        this.perClass = Collections.unmodifiableMap(new TreeMap<>(perClass));
    }

    /**
     * 由各类别结果聚合 mAP，没有任何带真值的类别时为 NaN
     */
    public static PascalVocResult of(Map<String, ClassApResult> perClass) {
        if (perClass.isEmpty()) {
            return new PascalVocResult(Double.NaN, perClass);
        }
        double sum = 0.0;
        for (ClassApResult result : perClass.values()) {
            sum += result.getAveragePrecision();
        }
        return new PascalVocResult(sum / perClass.size(), perClass);
    }

    public double getMeanAveragePrecision() { return meanAveragePrecision; }

    public Map<String, ClassApResult> getPerClass() { return perClass; }

    public ClassApResult getClassResult(String classLabel) {
        return perClass.get(classLabel);
    }

    @Override
    public String toString() {
        return String.format("PascalVocResult[mAP=%.4f, classes=%d]", meanAveragePrecision, perClass.size());
    }
}
