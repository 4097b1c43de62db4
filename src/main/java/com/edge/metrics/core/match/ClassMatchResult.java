package com.edge.metrics.core.match;

import java.util.Collections;
import java.util.List;

/**
 * 单个类别在全部图片上的匹配结果
 * <p>
 * 检测按置信度降序排列，加上真值总数，足以计算所有下游指标
 */
public class ClassMatchResult {
    private final String classLabel;
    private final List<DetectionMatch> matches;
    private final int totalPositives;

    public ClassMatchResult(String classLabel, List<DetectionMatch> matches, int totalPositives) {
        this.classLabel = classLabel;
        this.matches = Collections.unmodifiableList(matches);
        this.totalPositives = totalPositives;
    }

    public int getTruePositives() {
        int count = 0;
        for (DetectionMatch match : matches) {
            if (match.isTruePositive()) count++;
        }
        return count;
    }

    public int getFalsePositives() {
        return matches.size() - getTruePositives();
    }

    /**
     * 未被匹配的真值数量（漏检）
     */
    public int getFalseNegatives() {
        return totalPositives - getTruePositives();
    }

    public String getClassLabel() { return classLabel; }

    public List<DetectionMatch> getMatches() { return matches; }

    public int getTotalPositives() { return totalPositives; }

    @Override
    public String toString() {
        return String.format("ClassMatchResult[%s: detections=%d, TP=%d, FP=%d, GT=%d]",
            classLabel, matches.size(), getTruePositives(), getFalsePositives(), totalPositives);
    }
}
