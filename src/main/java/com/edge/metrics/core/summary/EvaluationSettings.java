package com.edge.metrics.core.summary;

import com.edge.metrics.core.match.DetectionMatcher;
import com.edge.metrics.core.match.MatchPolicy;
import com.edge.metrics.core.pascal.InterpolationMethod;

/**
 * 评估参数
 * <p>
 * 默认值由评估核心持有（{@link #DEFAULT}），界面、接口或配置文件只做覆盖，
 * 保证无界面的调用方得到完全相同的默认行为。
 */
public final class EvaluationSettings {

    public static final double DEFAULT_IOU_THRESHOLD = 0.5;

    public static final EvaluationSettings DEFAULT = new EvaluationSettings(
        DEFAULT_IOU_THRESHOLD, InterpolationMethod.EVERY_POINT, MatchPolicy.GREEDY_UNMATCHED, MetricSelection.all());

    private final double iouThreshold;
    private final InterpolationMethod interpolation;
    private final MatchPolicy matchPolicy;
    private final MetricSelection selection;

    public EvaluationSettings(double iouThreshold, InterpolationMethod interpolation,
                              MatchPolicy matchPolicy, MetricSelection selection) {
        DetectionMatcher.checkThreshold(iouThreshold);
        this.iouThreshold = iouThreshold;
        this.interpolation = interpolation != null ? interpolation : InterpolationMethod.EVERY_POINT;
        this.matchPolicy = matchPolicy != null ? matchPolicy : MatchPolicy.GREEDY_UNMATCHED;
        this.selection = selection != null ? selection : MetricSelection.all();
    }

    public EvaluationSettings withIouThreshold(double threshold) {
        return new EvaluationSettings(threshold, interpolation, matchPolicy, selection);
    }

    public EvaluationSettings withInterpolation(InterpolationMethod method) {
        return new EvaluationSettings(iouThreshold, method, matchPolicy, selection);
    }

    public EvaluationSettings withMatchPolicy(MatchPolicy policy) {
        return new EvaluationSettings(iouThreshold, interpolation, policy, selection);
    }

    public EvaluationSettings withSelection(MetricSelection newSelection) {
        return new EvaluationSettings(iouThreshold, interpolation, matchPolicy, newSelection);
    }

    /**
     * Pascal VOC 使用的 IoU 阈值，COCO 固定使用 0.50:0.05:0.95
     */
    public double getIouThreshold() { return iouThreshold; }

    public InterpolationMethod getInterpolation() { return interpolation; }

    public MatchPolicy getMatchPolicy() { return matchPolicy; }

    public MetricSelection getSelection() { return selection; }

    @Override
    public String toString() {
        return String.format("EvaluationSettings[IoU=%.2f, %s, %s, %s]",
            iouThreshold, interpolation, matchPolicy, selection);
    }
}
