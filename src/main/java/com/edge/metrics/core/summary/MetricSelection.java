package com.edge.metrics.core.summary;

import com.edge.metrics.core.coco.CocoMetric;

import java.util.Collection;
import java.util.Collections;
import java.util.EnumSet;
import java.util.Set;
import java.util.TreeSet;

/**
 * 请求的指标集合
 * <p>
 * 在评估前确定，未请求的指标不会被计算。classes 为 null 表示评估全部类别。
 */
public final class MetricSelection {

    private final Set<CocoMetric> cocoMetrics;
    private final Set<PascalMetric> pascalMetrics;
    private final Set<String> classes;

    private MetricSelection(Set<CocoMetric> cocoMetrics, Set<PascalMetric> pascalMetrics, Set<String> classes) {
        this.cocoMetrics = Collections.unmodifiableSet(cocoMetrics);
        this.pascalMetrics = Collections.unmodifiableSet(pascalMetrics);
        this.classes = classes != null ? Collections.unmodifiableSet(new TreeSet<>(classes)) : null;
    }

    /**
     * 全部 12 项 COCO 指标 + Pascal AP / mAP
     */
    public static MetricSelection all() {
        return new MetricSelection(EnumSet.allOf(CocoMetric.class), EnumSet.allOf(PascalMetric.class), null);
    }

    public static MetricSelection of(Collection<CocoMetric> coco, Collection<PascalMetric> pascal) {
        Set<CocoMetric> cocoSet = EnumSet.noneOf(CocoMetric.class);
        if (coco != null) cocoSet.addAll(coco);
        Set<PascalMetric> pascalSet = EnumSet.noneOf(PascalMetric.class);
        if (pascal != null) pascalSet.addAll(pascal);
        return new MetricSelection(cocoSet, pascalSet, null);
    }

    /**
     * 按键名解析，例如 "AP", "AP50", "ARsmall", "AP_pascal", "mAP"
     * <p>
     * 键名为空时返回全部指标
     */
    public static MetricSelection parse(Collection<String> keys) {
        if (keys == null || keys.isEmpty()) {
            return all();
        }
        Set<CocoMetric> coco = EnumSet.noneOf(CocoMetric.class);
        Set<PascalMetric> pascal = EnumSet.noneOf(PascalMetric.class);
        for (String key : keys) {
            String trimmed = key == null ? "" : key.trim();
            try {
                pascal.add(PascalMetric.fromKey(trimmed));
            } catch (IllegalArgumentException notPascal) {
                coco.add(CocoMetric.fromKey(trimmed));
            }
        }
        return new MetricSelection(coco, pascal, null);
    }

    /**
     * 只评估指定类别，其他类别的数据被丢弃
     */
    public MetricSelection withClasses(Collection<String> classLabels) {
        Set<String> labels = classLabels != null ? new TreeSet<>(classLabels) : null;
        return new MetricSelection(cocoMetrics, pascalMetrics, labels);
    }

    public boolean requiresCoco() {
        return !cocoMetrics.isEmpty();
    }

    public boolean requiresPascal() {
        return !pascalMetrics.isEmpty();
    }

    public boolean isEmpty() {
        return cocoMetrics.isEmpty() && pascalMetrics.isEmpty();
    }

    public boolean includesClass(String classLabel) {
        return classes == null || classes.contains(classLabel);
    }

    public Set<CocoMetric> getCocoMetrics() { return cocoMetrics; }

    public Set<PascalMetric> getPascalMetrics() { return pascalMetrics; }

    public Set<String> getClasses() { return classes; }

    @Override
    public String toString() {
        return "MetricSelection[coco=" + cocoMetrics + ", pascal=" + pascalMetrics
            + (classes != null ? ", classes=" + classes : "") + "]";
    }
}
