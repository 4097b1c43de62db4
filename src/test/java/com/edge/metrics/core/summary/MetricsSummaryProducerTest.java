package com.edge.metrics.core.summary;

import com.edge.metrics.core.coco.CocoClassEvaluation;
import com.edge.metrics.core.coco.CocoEvaluator;
import com.edge.metrics.core.coco.CocoMetric;
import com.edge.metrics.core.coco.CocoSummary;
import com.edge.metrics.core.model.BoundingBox;
import com.edge.metrics.core.pascal.PascalVocEvaluator;
import com.edge.metrics.core.pascal.PascalVocResult;
import org.junit.jupiter.api.Test;

import java.util.Arrays;
import java.util.EnumSet;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

public class MetricsSummaryProducerTest {

    private final MetricsSummaryProducer producer = new MetricsSummaryProducer();

    private static final List<BoundingBox> GTS = Arrays.asList(
        BoundingBox.groundTruth("img1", "cat", 0, 0, 10, 10),
        BoundingBox.groundTruth("img1", "dog", 50, 50, 80, 80));

    private static final List<BoundingBox> DETS = Arrays.asList(
        BoundingBox.detected("img1", "cat", 0, 0, 10, 10, 0.9),
        BoundingBox.detected("img1", "dog", 0, 0, 5, 5, 0.4));

    @Test
    public void testPascalPayload_OnlyRequestedKeys() {
        PascalVocResult result = new PascalVocEvaluator().evaluate(GTS, DETS, 0.5);

        Map<String, Object> onlyMap = producer.pascalPayload(result, EnumSet.of(PascalMetric.MAP));
        Map<String, Object> both = producer.pascalPayload(result, EnumSet.allOf(PascalMetric.class));

        assertEquals(1, onlyMap.size());
        assertEquals(0.5, (Double) onlyMap.get("mAP"), 1e-12);
        assertTrue(both.containsKey("per_class"));
        assertTrue(both.containsKey("mAP"));
    }

    @Test
    public void testProduce_BuildsCurvesForEveryClass() {
        // Given
        PascalVocResult pascal = new PascalVocEvaluator().evaluate(GTS, DETS, 0.5);
        CocoEvaluator cocoEvaluator = new CocoEvaluator();
        List<CocoClassEvaluation> cocoClasses = Arrays.asList(
            cocoEvaluator.evaluateClass("cat", GTS.subList(0, 1), DETS.subList(0, 1), null),
            cocoEvaluator.evaluateClass("dog", GTS.subList(1, 2), DETS.subList(1, 2), null));
        CocoSummary coco = cocoEvaluator.summarize(cocoClasses, null);

        // When
        EvaluationReport report = producer.produce(EvaluationSettings.DEFAULT, pascal, coco, cocoClasses,
            List.of("cat", "dog"), 5);

        // Then
        assertEquals(4, report.getCurves().size());
        long cocoCurves = report.getCurves().stream()
            .filter(c -> c.getSource() == PrecisionRecallCurve.Source.COCO)
            .count();
        assertEquals(2, cocoCurves);
        PrecisionRecallCurve catCoco = report.getCurves().stream()
            .filter(c -> c.getSource() == PrecisionRecallCurve.Source.COCO && c.getClassLabel().equals("cat"))
            .findFirst()
            .orElseThrow();
        assertEquals(101, catCoco.getRecall().length);
        assertEquals(1.0, catCoco.getAveragePrecision(), 1e-12);
        assertEquals(0.5, (Double) report.getPascal().get("mAP"), 1e-12);
        assertEquals(0.5, report.getCoco().get(CocoMetric.AP), 1e-12);
        assertFalse(report.isEmpty());
    }

    @Test
    public void testProduce_NothingRequested_ReportIsEmpty() {
        EvaluationSettings settings = EvaluationSettings.DEFAULT.withSelection(MetricSelection.of(null, null));

        EvaluationReport report = producer.produce(settings, null, null, null, List.of(), 0);

        assertTrue(report.isEmpty());
        assertNull(report.getPascal());
        assertTrue(report.getCurves().isEmpty());
    }
}
