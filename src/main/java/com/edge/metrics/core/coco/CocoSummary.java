package com.edge.metrics.core.coco;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Collections;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * COCO 汇总结果
 * <p>
 * 只包含请求的指标，按标准顺序输出；没有任何真值时取值为 NaN
 */
public class CocoSummary {
    private final Map<CocoMetric, Double> values;

    public CocoSummary(Map<CocoMetric, Double> values) {
        Map<CocoMetric, Double> copy = new EnumMap<>(CocoMetric.class);
        copy.putAll(values);
        this.values = Collections.unmodifiableMap(copy);
    }

    public static CocoSummary empty() {
        return new CocoSummary(new EnumMap<>(CocoMetric.class));
    }

    /**
     * 指标值，未请求的指标返回 null
     */
    public Double get(CocoMetric metric) {
        return values.get(metric);
    }

    public boolean contains(CocoMetric metric) {
        return values.containsKey(metric);
    }

    public Map<CocoMetric, Double> getValues() {
        return values;
    }

    /**
     * 以标准键名（AP, AP50, ..., ARlarge）输出
     */
    @JsonValue
    public Map<String, Double> toMap() {
        Map<String, Double> map = new LinkedHashMap<>();
        values.forEach((metric, value) -> map.put(metric.getKey(), value));
        return map;
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder("CocoSummary[");
        boolean first = true;
        for (Map.Entry<CocoMetric, Double> entry : values.entrySet()) {
            if (!first) sb.append(", ");
            sb.append(entry.getKey().getKey()).append('=').append(String.format("%.4f", entry.getValue()));
            first = false;
        }
        return sb.append(']').toString();
    }
}
