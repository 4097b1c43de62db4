package com.edge.metrics.core.stats;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Data;

import java.util.Map;
import java.util.TreeMap;

/**
 * 标注统计
 */
@Data
public class AnnotationStatistics {
    @JsonProperty("image_count")
    private int imageCount;

    @JsonProperty("ground_truth_count")
    private int groundTruthCount;

    @JsonProperty("detection_count")
    private int detectionCount;

    @JsonProperty("mean_ground_truths_per_image")
    private double meanGroundTruthsPerImage;

    @JsonProperty("mean_detections_per_image")
    private double meanDetectionsPerImage;

    @JsonProperty("per_class")
    private Map<String, ClassStatistics> perClass = new TreeMap<>();

    /**
     * 单个类别的统计
     */
    @Data
    public static class ClassStatistics {
        @JsonProperty("ground_truths")
        private int groundTruths;

        private int detections;

        @JsonProperty("images_with_ground_truth")
        private int imagesWithGroundTruth;

        // 真值尺寸分布 small / medium / large
        @JsonProperty("size_buckets")
        private Map<String, Integer> sizeBuckets = new TreeMap<>();

        // 没有检测时为 NaN
        @JsonProperty("min_confidence")
        private double minConfidence = Double.NaN;

        @JsonProperty("mean_confidence")
        private double meanConfidence = Double.NaN;

        @JsonProperty("max_confidence")
        private double maxConfidence = Double.NaN;
    }
}
