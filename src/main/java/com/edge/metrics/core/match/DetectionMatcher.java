package com.edge.metrics.core.match;

import com.edge.metrics.core.geometry.BoxGeometry;
import com.edge.metrics.core.model.BoundingBox;
import com.edge.metrics.core.model.BoundingBoxes;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * 检测框匹配器
 * <p>
 * 按图片、按类别，把检测框贪心地一一分配给真值框：
 * <ol>
 *   <li>检测按置信度降序处理，置信度相同时先出现者优先</li>
 *   <li>每个检测选 IoU 最大的候选真值（IoU 相同时先出现者优先）</li>
 *   <li>IoU ≥ 阈值记为 TP 并占用该真值，否则记为 FP</li>
 * </ol>
 * 每个真值最多被一个检测占用，跨图片永远不会匹配。
 */
public class DetectionMatcher {
    private static final Logger logger = LoggerFactory.getLogger(DetectionMatcher.class);

    public static final int UNMATCHED = -1;

    private final MatchPolicy policy;

    public DetectionMatcher() {
        this(MatchPolicy.GREEDY_UNMATCHED);
    }

    public DetectionMatcher(MatchPolicy policy) {
        this.policy = policy != null ? policy : MatchPolicy.GREEDY_UNMATCHED;
    }

    /**
     * 匹配单个类别在所有图片上的检测
     *
     * @param classLabel   类别
     * @param groundTruths 该类别的真值框（可跨多张图片）
     * @param detections   该类别的检测框（可跨多张图片）
     * @param iouThreshold IoU 阈值，取值 (0, 1]
     * @return 按置信度降序的匹配结果
     */
    public ClassMatchResult matchClass(String classLabel, List<BoundingBox> groundTruths,
                                       List<BoundingBox> detections, double iouThreshold) {
        checkThreshold(iouThreshold);
        checkLabels(classLabel, groundTruths);
        checkLabels(classLabel, detections);

        List<BoundingBox> sorted = BoundingBoxes.sortedByConfidence(detections);
        Map<String, List<BoundingBox>> gtByImage = BoundingBoxes.groupByImage(groundTruths);

        // 每张图片中检测在全局排序里的下标，保持置信度顺序
        Map<String, List<Integer>> detIndicesByImage = new LinkedHashMap<>();
        for (int i = 0; i < sorted.size(); i++) {
            detIndicesByImage.computeIfAbsent(sorted.get(i).getImageId(), k -> new ArrayList<>()).add(i);
        }

        DetectionMatch[] matches = new DetectionMatch[sorted.size()];
        for (Map.Entry<String, List<Integer>> entry : detIndicesByImage.entrySet()) {
            List<BoundingBox> imageGts = gtByImage.getOrDefault(entry.getKey(), List.of());
            List<Integer> indices = entry.getValue();
            List<BoundingBox> imageDets = new ArrayList<>(indices.size());
            for (int index : indices) {
                imageDets.add(sorted.get(index));
            }

            List<DetectionMatch> imageMatches = matchImage(imageGts, imageDets, iouThreshold);
            for (int k = 0; k < indices.size(); k++) {
                matches[indices.get(k)] = imageMatches.get(k);
            }
        }

        ClassMatchResult result = new ClassMatchResult(classLabel, Arrays.asList(matches), groundTruths.size());
        logger.debug("Matched class {} at IoU {}: {}", classLabel, iouThreshold, result);
        return result;
    }

    /**
     * 匹配同一图片、同一类别的检测
     *
     * @param groundTruths 真值框
     * @param detections   已按置信度降序排列的检测框
     * @return 与 detections 一一对应的匹配结果
     */
    public List<DetectionMatch> matchImage(List<BoundingBox> groundTruths, List<BoundingBox> detections,
                                           double iouThreshold) {
        double[][] ious = BoxGeometry.iouMatrix(detections, groundTruths);
        int[] assignment = assign(ious, detections.size(), groundTruths.size(), null, iouThreshold);

        List<DetectionMatch> result = new ArrayList<>(detections.size());
        for (int d = 0; d < detections.size(); d++) {
            int g = assignment[d];
            if (g != UNMATCHED) {
                result.add(new DetectionMatch(detections.get(d), true, ious[d][g], groundTruths.get(g)));
            } else {
                result.add(new DetectionMatch(detections.get(d), false, maxIou(ious[d]), null));
            }
        }
        return result;
    }

    /**
     * 基于 IoU 矩阵执行贪心分配
     * <p>
     * 行为检测（已按置信度降序），列为真值。gtIgnore 不为 null 时，被忽略的真值必须排在列的末尾：
     * 检测一旦匹配到普通真值，就不再尝试被忽略的真值。
     *
     * @param ious      IoU 矩阵
     * @param detCount  参与匹配的检测数量（前 detCount 行，用于最大检测数截断）
     * @param gtCount   真值数量
     * @param gtIgnore  真值是否被忽略，可为 null
     * @param threshold IoU 阈值
     * @return result[d] = 匹配的真值列下标，未匹配为 {@link #UNMATCHED}
     */
    public int[] assign(double[][] ious, int detCount, int gtCount, boolean[] gtIgnore, double threshold) {
        int[] result = new int[detCount];
        Arrays.fill(result, UNMATCHED);
        boolean[] gtMatched = new boolean[gtCount];

        for (int d = 0; d < detCount; d++) {
            result[d] = policy == MatchPolicy.VOC_DEVKIT
                ? assignDevkit(ious[d], gtCount, gtMatched, threshold)
                : assignGreedy(ious[d], gtCount, gtMatched, gtIgnore, threshold);
            if (result[d] != UNMATCHED) {
                gtMatched[result[d]] = true;
            }
        }
        return result;
    }

    private int assignGreedy(double[] row, int gtCount, boolean[] gtMatched, boolean[] gtIgnore, double threshold) {
        int best = UNMATCHED;
        double bestIou = -1.0;
        for (int g = 0; g < gtCount; g++) {
            if (gtMatched[g]) {
                continue;
            }
            // 已匹配到普通真值，后面只剩被忽略的真值
            if (best != UNMATCHED && gtIgnore != null && !gtIgnore[best] && gtIgnore[g]) {
                break;
            }
            double iou = row[g];
            if (iou < threshold || iou <= bestIou) {
                continue;
            }
            bestIou = iou;
            best = g;
        }
        return best;
    }

    private int assignDevkit(double[] row, int gtCount, boolean[] gtMatched, double threshold) {
        int best = UNMATCHED;
        double bestIou = 0.0;
        for (int g = 0; g < gtCount; g++) {
            if (row[g] > bestIou) {
                bestIou = row[g];
                best = g;
            }
        }
        if (best == UNMATCHED || bestIou < threshold || gtMatched[best]) {
            return UNMATCHED;
        }
        return best;
    }

    private static double maxIou(double[] row) {
        double max = 0.0;
        for (double iou : row) {
            max = Math.max(max, iou);
        }
        return max;
    }

    private static void checkLabels(String classLabel, List<BoundingBox> boxes) {
        for (BoundingBox box : boxes) {
            if (!box.getClassLabel().equals(classLabel)) {
                throw new IllegalArgumentException(String.format(
                    "Box of class %s passed to matcher for class %s", box.getClassLabel(), classLabel));
            }
        }
    }

    public static void checkThreshold(double iouThreshold) {
        if (!(iouThreshold > 0.0 && iouThreshold <= 1.0)) {
            throw new IllegalArgumentException("IoU threshold must lie in (0, 1], got " + iouThreshold);
        }
    }

    public MatchPolicy getPolicy() { return policy; }
}
