package com.edge.metrics.core.pascal;

import com.edge.metrics.core.match.DetectionMatcher;
import com.edge.metrics.core.match.MatchPolicy;
import com.edge.metrics.core.model.BoundingBox;
import com.edge.metrics.core.model.BoxType;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

public class PascalVocEvaluatorTest {

    private static final double EPS = 1e-9;

    private static BoundingBox gt(String label, double x1, double y1, double x2, double y2) {
        return BoundingBox.groundTruth("img1", label, x1, y1, x2, y2);
    }

    private static BoundingBox det(String label, double x1, double y1, double x2, double y2, double conf) {
        return BoundingBox.detected("img1", label, x1, y1, x2, y2, conf);
    }

    /**
     * 三个真值，四个检测：TP, FP, TP, FP（最后一个重复命中已占用的真值）
     */
    private static List<BoundingBox> mixedTruths() {
        return Arrays.asList(gt("cat", 0, 0, 10, 10), gt("cat", 20, 0, 30, 10), gt("cat", 40, 0, 50, 10));
    }

    private static List<BoundingBox> mixedDetections() {
        return Arrays.asList(
            det("cat", 0, 0, 10, 10, 0.9),
            det("cat", 100, 100, 110, 110, 0.8),
            det("cat", 20, 0, 30, 10, 0.7),
            det("cat", 0, 0, 10, 10, 0.6));
    }

    @Test
    public void testEvaluate_SingleExactDetection_ApIsOne() {
        // Given
        List<BoundingBox> gts = List.of(gt("cat", 0, 0, 10, 10));
        List<BoundingBox> dets = List.of(det("cat", 0, 0, 10, 10, 0.9));

        // When
        PascalVocResult result = new PascalVocEvaluator().evaluate(gts, dets, 0.5);

        // Then
        ClassApResult cat = result.getClassResult("cat");
        assertEquals(1.0, cat.getAveragePrecision(), EPS);
        assertEquals(1, cat.getTotalTp());
        assertEquals(0, cat.getTotalFp());
        assertEquals(1.0, result.getMeanAveragePrecision(), EPS);
    }

    @Test
    public void testEvaluate_DisjointDetection_ApIsZeroAndRecallEndsAtZero() {
        List<BoundingBox> gts = List.of(gt("cat", 0, 0, 10, 10));
        List<BoundingBox> dets = List.of(det("cat", 20, 20, 30, 30, 0.9));

        ClassApResult cat = new PascalVocEvaluator().evaluate(gts, dets, 0.5).getClassResult("cat");

        assertEquals(0.0, cat.getAveragePrecision(), EPS);
        double[] recall = cat.getRecall();
        assertEquals(0.0, recall[recall.length - 1], 0.0);
        assertEquals(1, cat.getTotalFp());
    }

    @Test
    public void testEvaluate_MixedSequence_EveryPointAp() {
        ClassApResult cat = new PascalVocEvaluator().evaluate(mixedTruths(), mixedDetections(), 0.5)
            .getClassResult("cat");

        assertArrayEquals(new double[]{1.0, 0.5, 2.0 / 3.0, 0.5}, cat.getPrecision(), EPS);
        assertArrayEquals(new double[]{1.0 / 3.0, 1.0 / 3.0, 2.0 / 3.0, 2.0 / 3.0}, cat.getRecall(), EPS);
        assertEquals(5.0 / 9.0, cat.getAveragePrecision(), EPS);
        assertEquals(3, cat.getTotalPositives());
        assertEquals(2, cat.getTotalTp());
        assertEquals(2, cat.getTotalFp());
    }

    @Test
    public void testEvaluate_MixedSequence_ElevenPointAp() {
        PascalVocEvaluator evaluator = new PascalVocEvaluator(new DetectionMatcher(), InterpolationMethod.ELEVEN_POINT);

        ClassApResult cat = evaluator.evaluate(mixedTruths(), mixedDetections(), 0.5).getClassResult("cat");

        assertEquals(6.0 / 11.0, cat.getAveragePrecision(), EPS);
        assertEquals(11, cat.getInterpolatedRecall().length);
        assertEquals(InterpolationMethod.ELEVEN_POINT, cat.getMethod());
    }

    @Test
    public void testEvaluate_InterpolatedPrecisionIsMonotoneEnvelope() {
        ClassApResult cat = new PascalVocEvaluator().evaluate(mixedTruths(), mixedDetections(), 0.5)
            .getClassResult("cat");

        double[] mpre = cat.getInterpolatedPrecision();
        double[] mrec = cat.getInterpolatedRecall();
        assertEquals(6, mpre.length);
        assertEquals(0.0, mrec[0], 0.0);
        assertEquals(1.0, mrec[mrec.length - 1], 0.0);
        for (int i = 1; i < mpre.length; i++) {
            assertTrue(mpre[i] <= mpre[i - 1], "envelope must be non-increasing at " + i);
        }
    }

    @Test
    public void testEvaluate_RecordsTableAccumulates() {
        ClassApResult cat = new PascalVocEvaluator().evaluate(mixedTruths(), mixedDetections(), 0.5)
            .getClassResult("cat");

        List<DetectionRecord> records = cat.getRecords();
        assertEquals(4, records.size());
        assertEquals(0.9, records.get(0).getConfidence(), EPS);
        assertTrue(records.get(0).isTruePositive());
        assertFalse(records.get(1).isTruePositive());
        assertEquals(2, records.get(3).getAccumulatedTp());
        assertEquals(2, records.get(3).getAccumulatedFp());
    }

    @Test
    public void testEvaluate_PerfectDetector_ApIsOneForEveryClass() {
        // Given
        List<BoundingBox> gts = new ArrayList<>();
        List<BoundingBox> dets = new ArrayList<>();
        String[] labels = {"cat", "dog", "bird"};
        for (int i = 0; i < 12; i++) {
            String image = "img" + (i % 4);
            String label = labels[i % labels.length];
            BoundingBox truth = BoundingBox.groundTruth(image, label, i * 20, 0, i * 20 + 15, 15);
            gts.add(truth);
            dets.add(truth.withType(BoxType.DETECTED));
        }

        // When
        PascalVocResult result = new PascalVocEvaluator().evaluate(gts, dets, 0.5);

        // Then
        for (String label : labels) {
            assertEquals(1.0, result.getClassResult(label).getAveragePrecision(), EPS, label);
        }
        assertEquals(1.0, result.getMeanAveragePrecision(), EPS);
    }

    @Test
    public void testEvaluate_NoDetections_ApIsZero() {
        PascalVocResult result = new PascalVocEvaluator().evaluate(mixedTruths(), List.of(), 0.5);

        ClassApResult cat = result.getClassResult("cat");
        assertEquals(0.0, cat.getAveragePrecision(), 0.0);
        assertEquals(0, cat.getPrecision().length);
        assertEquals(0.0, result.getMeanAveragePrecision(), 0.0);
    }

    @Test
    public void testEvaluate_ClassWithoutTruthExcludedFromMean() {
        // Given: dog 只有检测，没有真值
        List<BoundingBox> gts = List.of(gt("cat", 0, 0, 10, 10));
        List<BoundingBox> dets = Arrays.asList(det("cat", 0, 0, 10, 10, 0.9), det("dog", 50, 50, 60, 60, 0.8));

        // When
        PascalVocResult result = new PascalVocEvaluator().evaluate(gts, dets, 0.5);

        // Then
        assertNull(result.getClassResult("dog"));
        assertEquals(1, result.getPerClass().size());
        assertEquals(1.0, result.getMeanAveragePrecision(), EPS);
    }

    @Test
    public void testEvaluate_MeanOverClasses() {
        List<BoundingBox> gts = Arrays.asList(gt("cat", 0, 0, 10, 10), gt("dog", 50, 50, 60, 60));
        List<BoundingBox> dets = List.of(det("cat", 0, 0, 10, 10, 0.9));

        PascalVocResult result = new PascalVocEvaluator().evaluate(gts, dets, 0.5);

        assertEquals(0.5, result.getMeanAveragePrecision(), EPS);
    }

    @Test
    public void testEvaluate_NoTruthAtAll_MeanIsNaN() {
        PascalVocResult result = new PascalVocEvaluator().evaluate(List.of(), mixedDetections(), 0.5);

        assertTrue(result.getPerClass().isEmpty());
        assertTrue(Double.isNaN(result.getMeanAveragePrecision()));
    }

    @Test
    public void testEvaluate_RecallIsNonDecreasing() {
        ClassApResult cat = new PascalVocEvaluator().evaluate(mixedTruths(), mixedDetections(), 0.5)
            .getClassResult("cat");

        double[] recall = cat.getRecall();
        for (int i = 1; i < recall.length; i++) {
            assertTrue(recall[i] >= recall[i - 1]);
        }
    }

    @Test
    public void testEvaluate_VocDevkitPolicy_DuplicateBecomesFalsePositive() {
        // Given: 第二个检测与已被占用的真值 IoU 最高
        List<BoundingBox> gts = Arrays.asList(gt("cat", 0, 0, 10, 10), gt("cat", 1, 0, 11, 10));
        List<BoundingBox> dets = Arrays.asList(det("cat", 0, 0, 10, 10, 0.9), det("cat", 0, 0, 10, 10, 0.8));

        // When
        ClassApResult devkit = new PascalVocEvaluator(new DetectionMatcher(MatchPolicy.VOC_DEVKIT),
            InterpolationMethod.EVERY_POINT).evaluate(gts, dets, 0.5).getClassResult("cat");
        ClassApResult greedy = new PascalVocEvaluator().evaluate(gts, dets, 0.5).getClassResult("cat");

        // Then
        assertEquals(1, devkit.getTotalTp());
        assertEquals(0.5, devkit.getAveragePrecision(), EPS);
        assertEquals(2, greedy.getTotalTp());
        assertEquals(1.0, greedy.getAveragePrecision(), EPS);
    }

    @Test
    public void testEveryPointAp_EmptyCurve_IsZero() {
        PascalVocEvaluator.Interpolation interpolation =
            PascalVocEvaluator.everyPointAp(new double[0], new double[0]);

        assertEquals(0.0, interpolation.ap, 0.0);
        assertEquals(2, interpolation.recall.length);
    }

    @Test
    public void testEvaluate_InvalidThreshold_Rejected() {
        assertThrows(IllegalArgumentException.class,
            () -> new PascalVocEvaluator().evaluate(mixedTruths(), mixedDetections(), 0.0));
    }
}
