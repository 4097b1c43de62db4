package com.edge.metrics.core.coco;

import com.edge.metrics.core.geometry.BoxGeometry;
import com.edge.metrics.core.match.DetectionMatcher;
import com.edge.metrics.core.match.MatchPolicy;
import com.edge.metrics.core.model.BoundingBox;
import com.edge.metrics.core.model.BoundingBoxes;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collection;
import java.util.EnumMap;
import java.util.EnumSet;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeSet;

/**
 * COCO 评估器
 * <p>
 * 10 个 IoU 阈值 (0.50:0.05:0.95) × 尺寸区间 × 最大检测数，AP 采用 101 点插值。
 * <p>
 * 评估分两步：
 * <ol>
 *   <li>{@link #evaluateClass} 计算单个类别在所需参数下的 AP / 召回率，类别之间互不依赖，可并行</li>
 *   <li>{@link #summarize} 在类别（及阈值）上取平均，得到 12 项汇总</li>
 * </ol>
 * 只计算请求的指标所需要的参数组合。
 */
public class CocoEvaluator {
    private static final Logger logger = LoggerFactory.getLogger(CocoEvaluator.class);

    public static final double[] IOU_THRESHOLDS = {
        0.50, 0.55, 0.60, 0.65, 0.70, 0.75, 0.80, 0.85, 0.90, 0.95
    };

    public static final double[] RECALL_LEVELS = recallLevels();

    // COCO 匹配固定使用"只在未匹配真值中选择"的规则
    private final DetectionMatcher matcher = new DetectionMatcher(MatchPolicy.GREEDY_UNMATCHED);

    private static double[] recallLevels() {
        double[] levels = new double[101];
        for (int i = 0; i < levels.length; i++) {
            levels[i] = i / 100.0;
        }
        return levels;
    }

    /**
     * 评估全部类别并汇总
     */
    public CocoSummary evaluate(List<BoundingBox> groundTruths, List<BoundingBox> detections,
                                Set<CocoMetric> metrics) {
        Map<String, List<BoundingBox>> gtByClass = BoundingBoxes.groupByClass(groundTruths);
        Map<String, List<BoundingBox>> detByClass = BoundingBoxes.groupByClass(detections);

        List<CocoClassEvaluation> evaluations = new ArrayList<>();
        for (String label : new TreeSet<>(gtByClass.keySet())) {
            evaluations.add(evaluateClass(label, gtByClass.get(label),
                detByClass.getOrDefault(label, List.of()), metrics));
        }
        CocoSummary summary = summarize(evaluations, metrics);
        logger.info("COCO evaluation over {} classes: {}", evaluations.size(), summary);
        return summary;
    }

    /**
     * 评估单个类别
     *
     * @param classLabel   类别
     * @param groundTruths 该类别的真值框
     * @param detections   该类别的检测框
     * @param metrics      请求的指标，决定需要计算的参数与阈值
     */
    public CocoClassEvaluation evaluateClass(String classLabel, List<BoundingBox> groundTruths,
                                             List<BoundingBox> detections, Set<CocoMetric> metrics) {
        CocoClassEvaluation evaluation = new CocoClassEvaluation(classLabel);
        Map<CocoSetting, Set<Integer>> plan = plan(metrics);
        if (plan.isEmpty()) {
            return evaluation;
        }

        List<ImageData> images = prepareImages(groundTruths, detections);
        for (Map.Entry<CocoSetting, Set<Integer>> entry : plan.entrySet()) {
            CocoSetting setting = entry.getKey();
            List<ImageSetting> prepared = new ArrayList<>(images.size());
            for (ImageData image : images) {
                prepared.add(image.forSetting(setting));
            }

            for (int t : entry.getValue()) {
                Accumulation acc = new Accumulation();
                for (ImageSetting image : prepared) {
                    image.evaluate(matcher, IOU_THRESHOLDS[t], acc);
                }
                double[] interpolated = acc.interpolatedPrecision();
                double ap = interpolated != null ? mean(interpolated) : Double.NaN;
                evaluation.record(setting, t, ap, acc.finalRecall(), acc.positives);
                if (setting == CocoSetting.ALL_100 && interpolated != null) {
                    evaluation.recordCurve(t, interpolated);
                }
            }
        }
        logger.debug("COCO class {} evaluated: {}", classLabel, evaluation);
        return evaluation;
    }

    /**
     * 汇总各类别结果
     * <p>
     * 多阈值指标在 (类别, 阈值) 上取平均，单阈值指标在类别上取平均；
     * 没有真值的类别不参与平均，全部缺失时为 NaN
     */
    public CocoSummary summarize(Collection<CocoClassEvaluation> evaluations, Set<CocoMetric> metrics) {
        Map<CocoMetric, Double> values = new EnumMap<>(CocoMetric.class);
        for (CocoMetric metric : requested(metrics)) {
            double sum = 0.0;
            int count = 0;
            for (CocoClassEvaluation evaluation : evaluations) {
                if (metric.usesAllThresholds()) {
                    for (int t = 0; t < IOU_THRESHOLDS.length; t++) {
                        double v = valueAt(evaluation, metric, t);
                        if (!Double.isNaN(v)) {
                            sum += v;
                            count++;
                        }
                    }
                } else {
                    double v = valueAt(evaluation, metric, metric.getThresholdIndex());
                    if (!Double.isNaN(v)) {
                        sum += v;
                        count++;
                    }
                }
            }
            values.put(metric, count > 0 ? sum / count : Double.NaN);
        }
        return new CocoSummary(values);
    }

    private static Set<CocoMetric> requested(Set<CocoMetric> metrics) {
        return metrics != null ? metrics : EnumSet.allOf(CocoMetric.class);
    }

    private static double valueAt(CocoClassEvaluation evaluation, CocoMetric metric, int thresholdIndex) {
        return metric.getKind() == CocoMetric.Kind.PRECISION
            ? evaluation.getAveragePrecision(metric.getSetting(), thresholdIndex)
            : evaluation.getRecall(metric.getSetting(), thresholdIndex);
    }

    /**
     * 请求的指标需要的 (参数 -> 阈值下标) 组合
     */
    static Map<CocoSetting, Set<Integer>> plan(Set<CocoMetric> metrics) {
        Map<CocoSetting, Set<Integer>> plan = new EnumMap<>(CocoSetting.class);
        for (CocoMetric metric : requested(metrics)) {
            Set<Integer> thresholds = plan.computeIfAbsent(metric.getSetting(), s -> new TreeSet<>());
            if (metric.usesAllThresholds()) {
                for (int t = 0; t < IOU_THRESHOLDS.length; t++) {
                    thresholds.add(t);
                }
            } else {
                thresholds.add(metric.getThresholdIndex());
            }
        }
        return plan;
    }

    private static List<ImageData> prepareImages(List<BoundingBox> groundTruths, List<BoundingBox> detections) {
        Map<String, List<BoundingBox>> gtByImage = BoundingBoxes.groupByImage(groundTruths);
        Map<String, List<BoundingBox>> detByImage = BoundingBoxes.groupByImage(detections);
        Set<String> imageIds = new LinkedHashSet<>(gtByImage.keySet());
        imageIds.addAll(detByImage.keySet());

        Map<String, ImageData> images = new LinkedHashMap<>();
        for (String imageId : imageIds) {
            images.put(imageId, new ImageData(gtByImage.getOrDefault(imageId, List.of()),
                BoundingBoxes.sortedByConfidence(detByImage.getOrDefault(imageId, List.of()))));
        }
        return new ArrayList<>(images.values());
    }

    /**
     * 101 个召回率等级上的插值精度：取召回率不小于该等级处的包络精度，没有则为 0
     */
    static double[] interpolate(double[] recall, double[] precision) {
        int n = precision.length;
        double[] envelope = precision.clone();
        for (int i = n - 1; i > 0; i--) {
            envelope[i - 1] = Math.max(envelope[i - 1], envelope[i]);
        }
        double[] sampled = new double[RECALL_LEVELS.length];
        for (int k = 0; k < RECALL_LEVELS.length; k++) {
            int idx = lowerBound(recall, RECALL_LEVELS[k]);
            sampled[k] = idx < n ? envelope[idx] : 0.0;
        }
        return sampled;
    }

    /**
     * 第一个不小于 value 的下标（values 单调不减）
     */
    private static int lowerBound(double[] values, double value) {
        int lo = 0;
        int hi = values.length;
        while (lo < hi) {
            int mid = (lo + hi) >>> 1;
            if (values[mid] < value) {
                lo = mid + 1;
            } else {
                hi = mid;
            }
        }
        return lo;
    }

    private static double mean(double[] values) {
        double sum = 0.0;
        for (double v : values) {
            sum += v;
        }
        return sum / values.length;
    }

    /**
     * 单张图片（单个类别）的数据，IoU 矩阵只计算一次
     */
    private static class ImageData {
        final List<BoundingBox> groundTruths;
        final List<BoundingBox> detections;
        final double[][] ious;

        ImageData(List<BoundingBox> groundTruths, List<BoundingBox> sortedDetections) {
            this.groundTruths = groundTruths;
            this.detections = sortedDetections;
            this.ious = BoxGeometry.iouMatrix(sortedDetections, groundTruths);
        }

        /**
         * 按尺寸区间标记忽略的真值并把它们排到末尾，按最大检测数截断
         */
        ImageSetting forSetting(CocoSetting setting) {
            AreaRange range = setting.getAreaRange();
            int gtCount = groundTruths.size();
            int detCount = Math.min(setting.getMaxDetections(), detections.size());

            int[] order = new int[gtCount];
            boolean[] ignore = new boolean[gtCount];
            int k = 0;
            for (int g = 0; g < gtCount; g++) {
                if (range.contains(groundTruths.get(g).getArea())) order[k++] = g;
            }
            int regular = k;
            for (int g = 0; g < gtCount; g++) {
                if (!range.contains(groundTruths.get(g).getArea())) {
                    ignore[k] = true;
                    order[k++] = g;
                }
            }

            double[][] reordered = new double[detCount][gtCount];
            double[] scores = new double[detCount];
            boolean[] detOutside = new boolean[detCount];
            for (int d = 0; d < detCount; d++) {
                for (int j = 0; j < gtCount; j++) {
                    reordered[d][j] = ious[d][order[j]];
                }
                scores[d] = detections.get(d).confidenceOrZero();
                detOutside[d] = !range.contains(detections.get(d).getArea());
            }
            return new ImageSetting(reordered, ignore, scores, detOutside, regular);
        }
    }

    /**
     * 单张图片在某个参数下的匹配输入
     */
    private static class ImageSetting {
        final double[][] ious;
        final boolean[] gtIgnore;
        final double[] scores;
        final boolean[] detOutside;
        final int positives;

        ImageSetting(double[][] ious, boolean[] gtIgnore, double[] scores, boolean[] detOutside, int positives) {
            this.ious = ious;
            this.gtIgnore = gtIgnore;
            this.scores = scores;
            this.detOutside = detOutside;
            this.positives = positives;
        }

        void evaluate(DetectionMatcher matcher, double threshold, Accumulation acc) {
            int[] assignment = matcher.assign(ious, scores.length, gtIgnore.length, gtIgnore, threshold);
            for (int d = 0; d < scores.length; d++) {
                int g = assignment[d];
                // 匹配到被忽略的真值，或未匹配且自身不在区间内的检测，不参与统计
                boolean ignored = g != DetectionMatcher.UNMATCHED ? gtIgnore[g] : detOutside[d];
                if (!ignored) {
                    acc.add(scores[d], g != DetectionMatcher.UNMATCHED);
                }
            }
            acc.positives += positives;
        }
    }

    /**
     * 单个类别、单个阈值下跨图片累积的检测
     */
    private static class Accumulation {
        final List<double[]> entries = new ArrayList<>();   // {score, matched ? 1 : 0}
        int positives;
        private int truePositives;

        void add(double score, boolean matched) {
            entries.add(new double[]{score, matched ? 1.0 : 0.0});
            if (matched) truePositives++;
        }

        double finalRecall() {
            return positives > 0 ? (double) truePositives / positives : Double.NaN;
        }

        /**
         * 没有真值时返回 null
         */
        double[] interpolatedPrecision() {
            if (positives == 0) {
                return null;
            }
            // 跨图片按置信度降序（稳定排序）
            entries.sort((a, b) -> Double.compare(b[0], a[0]));
            int n = entries.size();
            double[] recall = new double[n];
            double[] precision = new double[n];
            int tp = 0;
            int fp = 0;
            for (int i = 0; i < n; i++) {
                if (entries.get(i)[1] > 0) tp++;
                else fp++;
                recall[i] = (double) tp / positives;
                precision[i] = (double) tp / (tp + fp);
            }
            return interpolate(recall, precision);
        }
    }
}
