package com.edge.metrics.core.summary;

import com.edge.metrics.core.coco.CocoSummary;
import com.edge.metrics.core.pascal.PascalVocResult;
import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;

import java.util.Collections;
import java.util.List;
import java.util.Map;

/**
 * 一次评估的完整输出
 * <p>
 * coco 只含请求的 COCO 指标；pascal 只含请求的 mAP / per_class；未请求 COCO 或 Pascal 时对应字段为空
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public class EvaluationReport {
    private final EvaluationSettings settings;
    private final CocoSummary coco;
    private final Map<String, Object> pascal;
    private final List<PrecisionRecallCurve> curves;
    private final List<String> classes;
    private final long processingTimeMs;

    @JsonIgnore
    private final PascalVocResult pascalResult;

    public EvaluationReport(EvaluationSettings settings, CocoSummary coco, Map<String, Object> pascal,
                            PascalVocResult pascalResult, List<PrecisionRecallCurve> curves,
                            List<String> classes, long processingTimeMs) {
        this.settings = settings;
        this.coco = coco;
        this.pascal = pascal != null ? Collections.unmodifiableMap(pascal) : null;
        this.pascalResult = pascalResult;
        this.curves = Collections.unmodifiableList(curves);
        this.classes = Collections.unmodifiableList(classes);
        this.processingTimeMs = processingTimeMs;
    }

    /**
     * COCO 与 Pascal 都没有产出任何指标
     */
    @JsonIgnore
    public boolean isEmpty() {
        boolean noCoco = coco == null || coco.getValues().isEmpty();
        boolean noPascal = pascal == null || pascal.isEmpty();
        return noCoco && noPascal;
    }

    public EvaluationSettings getSettings() { return settings; }

    public CocoSummary getCoco() { return coco; }

    public Map<String, Object> getPascal() { return pascal; }

    public PascalVocResult getPascalResult() { return pascalResult; }

    public List<PrecisionRecallCurve> getCurves() { return curves; }

    public List<String> getClasses() { return classes; }

    public long getProcessingTimeMs() { return processingTimeMs; }

    @Override
    public String toString() {
        return String.format("EvaluationReport[classes=%d, coco=%s, pascal=%s, curves=%d, %dms]",
            classes.size(), coco, pascalResult, curves.size(), processingTimeMs);
    }
}
