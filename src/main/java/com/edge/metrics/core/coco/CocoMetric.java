package com.edge.metrics.core.coco;

/**
 * COCO 汇总的 12 个指标
 * <p>
 * thresholdIndex 为 {@link CocoEvaluator#IOU_THRESHOLDS} 中的下标，-1 表示在 10 个阈值上取平均
 */
public enum CocoMetric {
    AP("AP", Kind.PRECISION, CocoSetting.ALL_100, -1),
    AP50("AP50", Kind.PRECISION, CocoSetting.ALL_100, 0),
    AP75("AP75", Kind.PRECISION, CocoSetting.ALL_100, 5),
    AP_SMALL("APsmall", Kind.PRECISION, CocoSetting.SMALL_100, -1),
    AP_MEDIUM("APmedium", Kind.PRECISION, CocoSetting.MEDIUM_100, -1),
    AP_LARGE("APlarge", Kind.PRECISION, CocoSetting.LARGE_100, -1),
    AR1("AR1", Kind.RECALL, CocoSetting.ALL_1, -1),
    AR10("AR10", Kind.RECALL, CocoSetting.ALL_10, -1),
    AR100("AR100", Kind.RECALL, CocoSetting.ALL_100, -1),
    AR_SMALL("ARsmall", Kind.RECALL, CocoSetting.SMALL_100, -1),
    AR_MEDIUM("ARmedium", Kind.RECALL, CocoSetting.MEDIUM_100, -1),
    AR_LARGE("ARlarge", Kind.RECALL, CocoSetting.LARGE_100, -1);

    public enum Kind {
        PRECISION,
        RECALL
    }

    private final String key;
    private final Kind kind;
    private final CocoSetting setting;
    private final int thresholdIndex;

    CocoMetric(String key, Kind kind, CocoSetting setting, int thresholdIndex) {
        this.key = key;
        this.kind = kind;
        this.setting = setting;
        this.thresholdIndex = thresholdIndex;
    }

    /**
     * 按输出键名查找，例如 "APsmall"
     */
    public static CocoMetric fromKey(String key) {
        for (CocoMetric metric : values()) {
            if (metric.key.equalsIgnoreCase(key) || metric.name().equalsIgnoreCase(key)) {
                return metric;
            }
        }
        throw new IllegalArgumentException("Unknown COCO metric: " + key);
    }

    public boolean usesAllThresholds() {
        return thresholdIndex < 0;
    }

    public String getKey() { return key; }

    public Kind getKind() { return kind; }

    public CocoSetting getSetting() { return setting; }

    public int getThresholdIndex() { return thresholdIndex; }
}
