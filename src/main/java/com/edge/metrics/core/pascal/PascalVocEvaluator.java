package com.edge.metrics.core.pascal;

import com.edge.metrics.core.match.ClassMatchResult;
import com.edge.metrics.core.match.DetectionMatch;
import com.edge.metrics.core.match.DetectionMatcher;
import com.edge.metrics.core.model.BoundingBox;
import com.edge.metrics.core.model.BoundingBoxes;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Pascal VOC 评估器
 * <p>
 * 在单一 IoU 阈值下计算各类别的 precision/recall/AP 以及 mAP。
 * 只有真值中出现的类别参与评估；有真值但没有检测的类别 AP 为 0。
 */
public class PascalVocEvaluator {
    private static final Logger logger = LoggerFactory.getLogger(PascalVocEvaluator.class);

    private static final int ELEVEN_POINTS = 11;

    private final DetectionMatcher matcher;
    private final InterpolationMethod method;

    public PascalVocEvaluator() {
        this(new DetectionMatcher(), InterpolationMethod.EVERY_POINT);
    }

    public PascalVocEvaluator(DetectionMatcher matcher, InterpolationMethod method) {
        this.matcher = matcher;
        this.method = method != null ? method : InterpolationMethod.EVERY_POINT;
    }

    /**
     * 评估全部类别
     *
     * @param groundTruths 真值框
     * @param detections   检测框
     * @param iouThreshold IoU 阈值，取值 (0, 1]
     */
    public PascalVocResult evaluate(List<BoundingBox> groundTruths, List<BoundingBox> detections,
                                    double iouThreshold) {
        DetectionMatcher.checkThreshold(iouThreshold);
        Map<String, List<BoundingBox>> gtByClass = BoundingBoxes.groupByClass(groundTruths);
        Map<String, List<BoundingBox>> detByClass = BoundingBoxes.groupByClass(detections);

        Map<String, ClassApResult> perClass = new LinkedHashMap<>();
        for (Map.Entry<String, List<BoundingBox>> entry : gtByClass.entrySet()) {
            String label = entry.getKey();
            ClassApResult result = evaluateClass(label, entry.getValue(),
                detByClass.getOrDefault(label, List.of()), iouThreshold);
            perClass.put(label, result);
        }

        PascalVocResult result = PascalVocResult.of(perClass);
        logger.info("Pascal VOC evaluation (IoU={}, {}): {}", iouThreshold, method, result);
        return result;
    }

    /**
     * 评估单个类别
     *
     * @return 类别结果；没有真值时返回 null（该类别不参与 mAP）
     */
    public ClassApResult evaluateClass(String classLabel, List<BoundingBox> groundTruths,
                                       List<BoundingBox> detections, double iouThreshold) {
        if (groundTruths.isEmpty()) {
            logger.debug("Class {} has no ground truth, excluded", classLabel);
            return null;
        }
        ClassMatchResult matches = matcher.matchClass(classLabel, groundTruths, detections, iouThreshold);
        return fromMatches(matches, iouThreshold);
    }

    /**
     * 由匹配结果计算 PR 曲线与 AP
     */
    public ClassApResult fromMatches(ClassMatchResult matches, double iouThreshold) {
        List<DetectionMatch> sequence = matches.getMatches();
        int n = sequence.size();
        int totalPositives = matches.getTotalPositives();

        double[] precision = new double[n];
        double[] recall = new double[n];
        List<DetectionRecord> records = new ArrayList<>(n);
        int accTp = 0;
        int accFp = 0;
        for (int i = 0; i < n; i++) {
            DetectionMatch match = sequence.get(i);
            if (match.isTruePositive()) {
                accTp++;
            } else {
                accFp++;
            }
            precision[i] = (double) accTp / (accTp + accFp);
            recall[i] = totalPositives > 0 ? (double) accTp / totalPositives : 0.0;
            records.add(new DetectionRecord(match.getImageId(), match.getConfidence(), match.isTruePositive(),
                match.getIou(), accTp, accFp, precision[i], recall[i]));
        }

        Interpolation interpolation = method == InterpolationMethod.ELEVEN_POINT
            ? elevenPointAp(recall, precision)
            : everyPointAp(recall, precision);

        return new ClassApResult(matches.getClassLabel(), precision, recall, interpolation.ap,
            interpolation.precision, interpolation.recall,
            totalPositives, accTp, accFp, iouThreshold, method, records);
    }

    /**
     * 连续插值 AP
     * <p>
     * 曲线两端补 (0, 0) 和 (1, 0)，从右向左取精度最大值得到单调不增的包络，
     * 再在召回率发生变化的位置累加 (r[i] - r[i-1]) * p[i]
     */
    static Interpolation everyPointAp(double[] recall, double[] precision) {
        int n = recall.length;
        double[] mrec = new double[n + 2];
        double[] mpre = new double[n + 2];
        mrec[0] = 0.0;
        mpre[0] = 0.0;
        System.arraycopy(recall, 0, mrec, 1, n);
        System.arraycopy(precision, 0, mpre, 1, n);
        mrec[n + 1] = 1.0;
        mpre[n + 1] = 0.0;

        for (int i = mpre.length - 1; i > 0; i--) {
            mpre[i - 1] = Math.max(mpre[i - 1], mpre[i]);
        }

        double ap = 0.0;
        for (int i = 1; i < mrec.length; i++) {
            if (mrec[i] != mrec[i - 1]) {
                ap += (mrec[i] - mrec[i - 1]) * mpre[i];
            }
        }
        return new Interpolation(ap, mpre, mrec);
    }

    /**
     * 11 点插值 AP
     * <p>
     * 在召回率 0, 0.1, ..., 1.0 处取召回率不小于该值的最大精度（没有则为 0），求平均
     */
    static Interpolation elevenPointAp(double[] recall, double[] precision) {
        double[] levels = new double[ELEVEN_POINTS];
        double[] sampled = new double[ELEVEN_POINTS];
        double sum = 0.0;
        for (int k = 0; k < ELEVEN_POINTS; k++) {
            double level = k / 10.0;
            double best = 0.0;
            for (int i = 0; i < recall.length; i++) {
                if (recall[i] >= level) {
                    best = Math.max(best, precision[i]);
                }
            }
            levels[k] = level;
            sampled[k] = best;
            sum += best;
        }
        return new Interpolation(sum / ELEVEN_POINTS, sampled, levels);
    }

    public InterpolationMethod getMethod() { return method; }

    public DetectionMatcher getMatcher() { return matcher; }

    /**
     * 插值结果
     */
    static class Interpolation {
        final double ap;
        final double[] precision;
        final double[] recall;

        Interpolation(double ap, double[] precision, double[] recall) {
            this.ap = ap;
            this.precision = precision;
            this.recall = recall;
        }
    }
}
