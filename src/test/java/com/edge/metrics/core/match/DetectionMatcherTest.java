package com.edge.metrics.core.match;

import com.edge.metrics.core.model.BoundingBox;
import org.junit.jupiter.api.Test;

import java.util.Arrays;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

public class DetectionMatcherTest {

    private static BoundingBox gt(String image, double x1, double y1, double x2, double y2) {
        return BoundingBox.groundTruth(image, "cat", x1, y1, x2, y2);
    }

    private static BoundingBox det(String image, double x1, double y1, double x2, double y2, double conf) {
        return BoundingBox.detected(image, "cat", x1, y1, x2, y2, conf);
    }

    @Test
    public void testMatchClass_ExactDetection_IsTruePositive() {
        // Given
        List<BoundingBox> gts = List.of(gt("img1", 0, 0, 10, 10));
        List<BoundingBox> dets = List.of(det("img1", 0, 0, 10, 10, 0.9));

        // When
        ClassMatchResult result = new DetectionMatcher().matchClass("cat", gts, dets, 0.5);

        // Then
        assertEquals(1, result.getTruePositives());
        assertEquals(0, result.getFalsePositives());
        assertEquals(0, result.getFalseNegatives());
        DetectionMatch match = result.getMatches().get(0);
        assertTrue(match.isTruePositive());
        assertEquals(1.0, match.getIou(), 1e-12);
        assertSame(gts.get(0), match.getMatchedGroundTruth());
    }

    @Test
    public void testMatchClass_DisjointDetection_IsFalsePositiveAndMiss() {
        List<BoundingBox> gts = List.of(gt("img1", 0, 0, 10, 10));
        List<BoundingBox> dets = List.of(det("img1", 20, 20, 30, 30, 0.9));

        ClassMatchResult result = new DetectionMatcher().matchClass("cat", gts, dets, 0.5);

        assertEquals(0, result.getTruePositives());
        assertEquals(1, result.getFalsePositives());
        assertEquals(1, result.getFalseNegatives());
        assertNull(result.getMatches().get(0).getMatchedGroundTruth());
        assertEquals(0.0, result.getMatches().get(0).getIou(), 0.0);
    }

    @Test
    public void testMatchClass_NeverCrossesImages() {
        List<BoundingBox> gts = List.of(gt("img1", 0, 0, 10, 10));
        List<BoundingBox> dets = List.of(det("img2", 0, 0, 10, 10, 0.9));

        ClassMatchResult result = new DetectionMatcher().matchClass("cat", gts, dets, 0.5);

        assertEquals(0, result.getTruePositives());
        assertEquals(1, result.getFalsePositives());
    }

    @Test
    public void testMatchClass_DuplicateOfClaimedTruth_IsFalsePositive() {
        // Given: 同一个真值上的两个检测
        List<BoundingBox> gts = List.of(gt("img1", 0, 0, 10, 10));
        List<BoundingBox> dets = Arrays.asList(
            det("img1", 0, 0, 10, 10, 0.6),
            det("img1", 1, 0, 10, 10, 0.9));

        // When
        ClassMatchResult result = new DetectionMatcher().matchClass("cat", gts, dets, 0.5);

        // Then: 结果按置信度降序，高置信度占用真值
        List<DetectionMatch> matches = result.getMatches();
        assertEquals(0.9, matches.get(0).getConfidence(), 1e-12);
        assertTrue(matches.get(0).isTruePositive());
        assertFalse(matches.get(1).isTruePositive());
    }

    @Test
    public void testMatchClass_TwoTruthsTwoDetections_NoDoubleAssignment() {
        // Given: 两个检测都与两个真值重叠 (IoU 1.0 与 0.818)
        List<BoundingBox> gts = Arrays.asList(gt("img1", 0, 0, 10, 10), gt("img1", 1, 0, 11, 10));
        List<BoundingBox> dets = Arrays.asList(
            det("img1", 0, 0, 10, 10, 0.9),
            det("img1", 0, 0, 10, 10, 0.8));

        for (MatchPolicy policy : MatchPolicy.values()) {
            ClassMatchResult result = new DetectionMatcher(policy).matchClass("cat", gts, dets, 0.5);

            // 每个真值最多被一个检测占用
            long distinct = result.getMatches().stream()
                .filter(DetectionMatch::isTruePositive)
                .map(DetectionMatch::getMatchedGroundTruth)
                .distinct()
                .count();
            assertEquals(result.getTruePositives(), distinct, "policy " + policy);
            assertSame(gts.get(0), result.getMatches().get(0).getMatchedGroundTruth(), "policy " + policy);
        }
    }

    @Test
    public void testVocDevkit_LowerConfidenceOnClaimedTruth_BecomesFalsePositive() {
        List<BoundingBox> gts = Arrays.asList(gt("img1", 0, 0, 10, 10), gt("img1", 1, 0, 11, 10));
        List<BoundingBox> dets = Arrays.asList(
            det("img1", 0, 0, 10, 10, 0.9),
            det("img1", 0, 0, 10, 10, 0.8));

        ClassMatchResult result = new DetectionMatcher(MatchPolicy.VOC_DEVKIT).matchClass("cat", gts, dets, 0.5);

        DetectionMatch second = result.getMatches().get(1);
        assertFalse(second.isTruePositive());
        // IoU 超过阈值，但最佳真值已被占用
        assertEquals(1.0, second.getIou(), 1e-12);
        assertEquals(1, result.getFalseNegatives());
    }

    @Test
    public void testGreedyUnmatched_LowerConfidenceFallsBackToFreeTruth() {
        List<BoundingBox> gts = Arrays.asList(gt("img1", 0, 0, 10, 10), gt("img1", 1, 0, 11, 10));
        List<BoundingBox> dets = Arrays.asList(
            det("img1", 0, 0, 10, 10, 0.9),
            det("img1", 0, 0, 10, 10, 0.8));

        ClassMatchResult result = new DetectionMatcher().matchClass("cat", gts, dets, 0.5);

        DetectionMatch second = result.getMatches().get(1);
        assertTrue(second.isTruePositive());
        assertSame(gts.get(1), second.getMatchedGroundTruth());
        assertEquals(90.0 / 110.0, second.getIou(), 1e-12);
    }

    @Test
    public void testMatchClass_EqualConfidenceKeepsInputOrder() {
        List<BoundingBox> gts = List.of(gt("img1", 0, 0, 10, 10));
        BoundingBox first = det("img1", 0, 0, 10, 10, 0.5);
        BoundingBox second = det("img1", 0, 0, 10, 10, 0.5);

        ClassMatchResult result = new DetectionMatcher().matchClass("cat", gts, Arrays.asList(first, second), 0.5);

        assertSame(first, result.getMatches().get(0).getDetection());
        assertTrue(result.getMatches().get(0).isTruePositive());
        assertFalse(result.getMatches().get(1).isTruePositive());
    }

    @Test
    public void testMatchClass_BelowThreshold_IsFalsePositive() {
        // IoU = 1/3
        List<BoundingBox> gts = List.of(gt("img1", 0, 0, 10, 10));
        List<BoundingBox> dets = List.of(det("img1", 5, 0, 15, 10, 0.9));

        assertEquals(0, new DetectionMatcher().matchClass("cat", gts, dets, 0.5).getTruePositives());
        assertEquals(1, new DetectionMatcher().matchClass("cat", gts, dets, 0.3).getTruePositives());
    }

    @Test
    public void testMatchClass_WrongLabel_Rejected() {
        List<BoundingBox> gts = List.of(BoundingBox.groundTruth("img1", "dog", 0, 0, 10, 10));

        assertThrows(IllegalArgumentException.class,
            () -> new DetectionMatcher().matchClass("cat", gts, List.of(), 0.5));
    }

    @Test
    public void testCheckThreshold_OutOfRange_Rejected() {
        assertThrows(IllegalArgumentException.class, () -> DetectionMatcher.checkThreshold(0.0));
        assertThrows(IllegalArgumentException.class, () -> DetectionMatcher.checkThreshold(1.01));
        assertThrows(IllegalArgumentException.class, () -> DetectionMatcher.checkThreshold(Double.NaN));
        assertDoesNotThrow(() -> DetectionMatcher.checkThreshold(1.0));
    }

    @Test
    public void testAssign_StopsAtIgnoredTruthOnceRegularMatchFound() {
        // Given: 第 0 列为普通真值，第 1 列为被忽略的真值且 IoU 更高
        double[][] ious = {{0.6, 0.9}};
        boolean[] ignore = {false, true};

        // When
        int[] result = new DetectionMatcher().assign(ious, 1, 2, ignore, 0.5);

        // Then
        assertEquals(0, result[0]);
    }

    @Test
    public void testAssign_MatchesIgnoredTruthWhenNoRegularCandidate() {
        double[][] ious = {{0.2, 0.9}};
        boolean[] ignore = {false, true};

        int[] result = new DetectionMatcher().assign(ious, 1, 2, ignore, 0.5);

        assertEquals(1, result[0]);
    }

    @Test
    public void testAssign_DetCountTruncatesRows() {
        double[][] ious = {{0.9}, {0.9}};

        int[] result = new DetectionMatcher().assign(ious, 1, 1, null, 0.5);

        assertEquals(1, result.length);
        assertEquals(0, result[0]);
    }
}
