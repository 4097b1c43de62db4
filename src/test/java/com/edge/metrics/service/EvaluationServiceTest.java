package com.edge.metrics.service;

import com.edge.metrics.core.coco.CocoEvaluator;
import com.edge.metrics.core.coco.CocoMetric;
import com.edge.metrics.core.coco.CocoSummary;
import com.edge.metrics.core.model.BoundingBox;
import com.edge.metrics.core.model.CoordinateFormat;
import com.edge.metrics.core.model.InvalidBoxException;
import com.edge.metrics.core.pascal.ClassApResult;
import com.edge.metrics.core.stats.AnnotationStatistics;
import com.edge.metrics.core.stats.StatisticsCalculator;
import com.edge.metrics.core.summary.EvaluationReport;
import com.edge.metrics.core.summary.EvaluationSettings;
import com.edge.metrics.core.summary.MetricSelection;
import com.edge.metrics.core.summary.MetricsSummaryProducer;
import com.edge.metrics.dto.BoxDto;
import com.edge.metrics.dto.EvaluationRequest;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Map;
import java.util.Random;

import static org.junit.jupiter.api.Assertions.*;

public class EvaluationServiceTest {

    private static final String[] LABELS = {"bird", "car", "cat", "dog", "person"};

    private EvaluationService sequential;
    private EvaluationService parallel;

    @BeforeEach
    public void setUp() {
        sequential = newService(1);
        parallel = newService(4);
    }

    @AfterEach
    public void tearDown() {
        sequential.shutdown();
        parallel.shutdown();
    }

    private static EvaluationService newService(int parallelism) {
        return new EvaluationService(EvaluationSettings.DEFAULT, new CocoEvaluator(), new MetricsSummaryProducer(),
            new StatisticsCalculator(), parallelism);
    }

    /**
     * 随机生成的数据集：真值加上抖动后的检测和随机误检
     */
    private static List<List<BoundingBox>> randomDataset(long seed) {
        Random random = new Random(seed);
        List<BoundingBox> gts = new ArrayList<>();
        List<BoundingBox> dets = new ArrayList<>();
        for (int image = 0; image < 20; image++) {
            String imageId = "img" + image;
            for (int k = 0; k < 6; k++) {
                String label = LABELS[random.nextInt(LABELS.length)];
                double x = random.nextInt(500);
                double y = random.nextInt(500);
                double size = 8 + random.nextInt(150);
                gts.add(BoundingBox.groundTruth(imageId, label, x, y, x + size, y + size));
                if (random.nextDouble() < 0.8) {
                    double dx = random.nextGaussian() * size * 0.1;
                    double dy = random.nextGaussian() * size * 0.1;
                    dets.add(BoundingBox.detected(imageId, label, x + dx, y + dy, x + dx + size, y + dy + size,
                        random.nextDouble()));
                }
            }
            for (int k = 0; k < 3; k++) {
                String label = LABELS[random.nextInt(LABELS.length)];
                double x = random.nextInt(500);
                double y = random.nextInt(500);
                dets.add(BoundingBox.detected(imageId, label, x, y, x + 30, y + 30, random.nextDouble()));
            }
        }
        return Arrays.asList(gts, dets);
    }

    @Test
    public void testEvaluate_ParallelEqualsSequential() {
        // Given
        List<List<BoundingBox>> data = randomDataset(42L);

        // When
        EvaluationReport seq = sequential.evaluate(data.get(0), data.get(1), EvaluationSettings.DEFAULT);
        EvaluationReport par = parallel.evaluate(data.get(0), data.get(1), EvaluationSettings.DEFAULT);

        // Then
        assertEquals(seq.getClasses(), par.getClasses());
        assertEquals(seq.getCoco().getValues(), par.getCoco().getValues());
        assertEquals(seq.getPascalResult().getMeanAveragePrecision(),
            par.getPascalResult().getMeanAveragePrecision(), 0.0);
        for (String label : seq.getClasses()) {
            ClassApResult a = seq.getPascalResult().getClassResult(label);
            ClassApResult b = par.getPascalResult().getClassResult(label);
            assertEquals(a.getAveragePrecision(), b.getAveragePrecision(), 0.0, label);
            assertArrayEquals(a.getPrecision(), b.getPrecision(), 0.0, label);
            assertArrayEquals(a.getRecall(), b.getRecall(), 0.0, label);
        }
    }

    @Test
    public void testEvaluate_RetagsInputBatches() {
        // Given: 真值列表中混入检测框，检测列表中混入真值框
        List<BoundingBox> gts = List.of(BoundingBox.detected("img1", "cat", 0, 0, 10, 10, 0.3));
        List<BoundingBox> dets = List.of(BoundingBox.groundTruth("img1", "cat", 0, 0, 10, 10));

        // When
        EvaluationReport report = sequential.evaluate(gts, dets, EvaluationSettings.DEFAULT);

        // Then
        ClassApResult cat = report.getPascalResult().getClassResult("cat");
        assertEquals(1, cat.getTotalPositives());
        assertEquals(1.0, cat.getAveragePrecision(), 1e-12);
    }

    @Test
    public void testEvaluate_ExcludingClassDoesNotChangeOthers() {
        // Given
        List<List<BoundingBox>> data = randomDataset(7L);
        MetricSelection onlyCat = MetricSelection.all().withClasses(List.of("cat"));

        // When
        EvaluationReport all = parallel.evaluate(data.get(0), data.get(1), EvaluationSettings.DEFAULT);
        EvaluationReport cat = parallel.evaluate(data.get(0), data.get(1),
            EvaluationSettings.DEFAULT.withSelection(onlyCat));

        // Then
        assertEquals(List.of("cat"), cat.getClasses());
        assertEquals(all.getPascalResult().getClassResult("cat").getAveragePrecision(),
            cat.getPascalResult().getClassResult("cat").getAveragePrecision(), 0.0);
        assertEquals(cat.getPascalResult().getClassResult("cat").getAveragePrecision(),
            cat.getPascalResult().getMeanAveragePrecision(), 1e-12);
    }

    @Test
    public void testEvaluate_PascalOnlySelectionSkipsCoco() {
        List<List<BoundingBox>> data = randomDataset(3L);
        EvaluationSettings settings = EvaluationSettings.DEFAULT
            .withSelection(MetricSelection.parse(List.of("mAP")));

        EvaluationReport report = sequential.evaluate(data.get(0), data.get(1), settings);

        assertNull(report.getCoco());
        assertEquals(1, report.getPascal().size());
        assertTrue(report.getPascal().containsKey("mAP"));
    }

    @Test
    public void testEvaluate_NullBatch_Rejected() {
        assertThrows(IllegalArgumentException.class,
            () -> sequential.evaluate(null, List.of(), EvaluationSettings.DEFAULT));
    }

    @Test
    public void testEvaluateRequest_ConvertsYoloWithImageSizes() {
        // Given
        EvaluationRequest request = new EvaluationRequest();
        request.setCoordinateFormat(CoordinateFormat.YOLO);
        request.setImageSizes(Map.of("img1", new EvaluationRequest.ImageSize(100, 100)));
        request.setGroundTruths(List.of(new BoxDto("img1", "cat", List.of(0.5, 0.5, 0.2, 0.2), null)));
        request.setDetections(List.of(new BoxDto("img1", "cat", List.of(0.5, 0.5, 0.2, 0.2), 0.9)));

        // When
        CocoSummary coco = parallel.evaluateCoco(request);
        Map<String, Object> pascal = parallel.evaluatePascal(request);

        // Then
        assertEquals(1.0, coco.get(CocoMetric.AP), 1e-12);
        assertEquals(1.0, (Double) pascal.get("mAP"), 1e-12);
    }

    @Test
    public void testEvaluateRequest_DetectionWithoutConfidence_Rejected() {
        EvaluationRequest request = new EvaluationRequest();
        request.setGroundTruths(List.of(new BoxDto("img1", "cat", List.of(0.0, 0.0, 10.0, 10.0), null)));
        request.setDetections(List.of(new BoxDto("img1", "cat", List.of(0.0, 0.0, 10.0, 10.0), null)));

        assertThrows(InvalidBoxException.class, () -> sequential.evaluate(request));
    }

    @Test
    public void testEvaluateRequest_InvalidThreshold_Rejected() {
        EvaluationRequest request = new EvaluationRequest();
        request.setIouThreshold(0.0);

        assertThrows(IllegalArgumentException.class, () -> sequential.evaluate(request));
    }

    @Test
    public void testResolveSettings_OverridesOnlyGivenFields() {
        EvaluationRequest request = new EvaluationRequest();
        request.setIouThreshold(0.7);
        request.setMetrics(List.of("AP50"));
        request.setClasses(List.of("cat"));

        EvaluationSettings settings = sequential.resolveSettings(request);

        assertEquals(0.7, settings.getIouThreshold(), 0.0);
        assertEquals(EvaluationSettings.DEFAULT.getInterpolation(), settings.getInterpolation());
        assertFalse(settings.getSelection().requiresPascal());
        assertFalse(settings.getSelection().includesClass("dog"));
    }

    @Test
    public void testStatistics_AppliesClassFilter() {
        EvaluationRequest request = new EvaluationRequest();
        request.setClasses(List.of("cat"));
        request.setGroundTruths(Arrays.asList(
            new BoxDto("img1", "cat", List.of(0.0, 0.0, 10.0, 10.0), null),
            new BoxDto("img1", "dog", List.of(0.0, 0.0, 10.0, 10.0), null)));

        AnnotationStatistics stats = sequential.statistics(request);

        assertEquals(1, stats.getGroundTruthCount());
        assertTrue(stats.getPerClass().containsKey("cat"));
        assertFalse(stats.getPerClass().containsKey("dog"));
    }
}
