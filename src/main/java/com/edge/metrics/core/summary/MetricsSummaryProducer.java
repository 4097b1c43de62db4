package com.edge.metrics.core.summary;

import com.edge.metrics.core.coco.CocoClassEvaluation;
import com.edge.metrics.core.coco.CocoEvaluator;
import com.edge.metrics.core.coco.CocoSetting;
import com.edge.metrics.core.coco.CocoSummary;
import com.edge.metrics.core.pascal.ClassApResult;
import com.edge.metrics.core.pascal.PascalVocResult;

import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * 把评估结果整理成调用方需要的结构
 * <p>
 * Pascal 输出 {mAP, per_class}，只保留请求的键；PR 曲线按类别打包供外部绘图
 */
public class MetricsSummaryProducer {

    public EvaluationReport produce(EvaluationSettings settings, PascalVocResult pascalResult,
                                    CocoSummary cocoSummary, Collection<CocoClassEvaluation> cocoClasses,
                                    List<String> classes, long processingTimeMs) {
        MetricSelection selection = settings.getSelection();
        Map<String, Object> pascal = pascalResult != null
            ? pascalPayload(pascalResult, selection.getPascalMetrics())
            : null;

        List<PrecisionRecallCurve> curves = new ArrayList<>();
        if (pascalResult != null) {
            curves.addAll(pascalCurves(pascalResult));
        }
        if (cocoClasses != null) {
            curves.addAll(cocoCurves(cocoClasses));
        }
        return new EvaluationReport(settings, cocoSummary, pascal, pascalResult, curves, classes, processingTimeMs);
    }

    /**
     * Pascal 结果字典，只包含请求的键
     */
    public Map<String, Object> pascalPayload(PascalVocResult result, Set<PascalMetric> metrics) {
        Map<String, Object> payload = new LinkedHashMap<>();
        if (metrics.contains(PascalMetric.MAP)) {
            payload.put(PascalMetric.MAP.getPayloadKey(), result.getMeanAveragePrecision());
        }
        if (metrics.contains(PascalMetric.AP)) {
            payload.put(PascalMetric.AP.getPayloadKey(), result.getPerClass());
        }
        return payload;
    }

    public List<PrecisionRecallCurve> pascalCurves(PascalVocResult result) {
        List<PrecisionRecallCurve> curves = new ArrayList<>();
        for (ClassApResult classResult : result.getPerClass().values()) {
            curves.add(new PrecisionRecallCurve(classResult.getClassLabel(), PrecisionRecallCurve.Source.PASCAL,
                classResult.getIouThreshold(), classResult.getPrecision(), classResult.getRecall(),
                classResult.getInterpolatedPrecision(), classResult.getInterpolatedRecall(),
                classResult.getAveragePrecision()));
        }
        return curves;
    }

    /**
     * IoU=0.50 下的 COCO 插值曲线，只在该阈值被计算过的类别上生成
     */
    public List<PrecisionRecallCurve> cocoCurves(Collection<CocoClassEvaluation> evaluations) {
        List<PrecisionRecallCurve> curves = new ArrayList<>();
        double[] levels = CocoEvaluator.RECALL_LEVELS;
        for (CocoClassEvaluation evaluation : evaluations) {
            double[] interpolated = evaluation.getInterpolatedPrecision(0);
            if (interpolated == null) {
                continue;
            }
            curves.add(new PrecisionRecallCurve(evaluation.getClassLabel(), PrecisionRecallCurve.Source.COCO,
                CocoEvaluator.IOU_THRESHOLDS[0], interpolated, levels.clone(), interpolated, levels.clone(),
                evaluation.getAveragePrecision(CocoSetting.ALL_100, 0)));
        }
        return curves;
    }
}
