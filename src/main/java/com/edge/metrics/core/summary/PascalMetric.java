package com.edge.metrics.core.summary;

/**
 * Pascal VOC 可请求的指标
 */
public enum PascalMetric {
    /**
     * 各类别 AP（含 PR 曲线数据）
     */
    AP("AP_pascal", "per_class"),

    /**
     * 各类别 AP 的平均值
     */
    MAP("mAP", "mAP");

    private final String key;
    private final String payloadKey;

    PascalMetric(String key, String payloadKey) {
        this.key = key;
        this.payloadKey = payloadKey;
    }

    public static PascalMetric fromKey(String key) {
        for (PascalMetric metric : values()) {
            if (metric.key.equalsIgnoreCase(key) || metric.payloadKey.equalsIgnoreCase(key)) {
                return metric;
            }
        }
        throw new IllegalArgumentException("Unknown Pascal metric: " + key);
    }

    public String getKey() { return key; }

    public String getPayloadKey() { return payloadKey; }
}
