package com.edge.metrics.core.stats;

import com.edge.metrics.core.coco.AreaRange;
import com.edge.metrics.core.model.BoundingBox;
import com.edge.metrics.core.model.BoundingBoxes;

import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;

/**
 * 统计真值与检测的分布：图片数、各类别数量、尺寸分布、置信度范围
 */
public class StatisticsCalculator {

    public AnnotationStatistics calculate(List<BoundingBox> groundTruths, List<BoundingBox> detections) {
        AnnotationStatistics stats = new AnnotationStatistics();

        Set<String> images = new LinkedHashSet<>();
        groundTruths.forEach(b -> images.add(b.getImageId()));
        detections.forEach(b -> images.add(b.getImageId()));

        stats.setImageCount(images.size());
        stats.setGroundTruthCount(groundTruths.size());
        stats.setDetectionCount(detections.size());
        if (!images.isEmpty()) {
            stats.setMeanGroundTruthsPerImage((double) groundTruths.size() / images.size());
            stats.setMeanDetectionsPerImage((double) detections.size() / images.size());
        }

        Map<String, AnnotationStatistics.ClassStatistics> perClass = stats.getPerClass();
        for (Map.Entry<String, List<BoundingBox>> entry : BoundingBoxes.groupByClass(groundTruths).entrySet()) {
            AnnotationStatistics.ClassStatistics cs =
                perClass.computeIfAbsent(entry.getKey(), k -> newClassStatistics());
            Set<String> classImages = new HashSet<>();
            for (BoundingBox box : entry.getValue()) {
                classImages.add(box.getImageId());
                String bucket = AreaRange.bucketOf(box.getArea()).name().toLowerCase(Locale.ROOT);
                cs.getSizeBuckets().merge(bucket, 1, Integer::sum);
            }
            cs.setGroundTruths(entry.getValue().size());
            cs.setImagesWithGroundTruth(classImages.size());
        }

        for (Map.Entry<String, List<BoundingBox>> entry : BoundingBoxes.groupByClass(detections).entrySet()) {
            AnnotationStatistics.ClassStatistics cs =
                perClass.computeIfAbsent(entry.getKey(), k -> newClassStatistics());
            double min = Double.POSITIVE_INFINITY;
            double max = Double.NEGATIVE_INFINITY;
            double sum = 0.0;
            for (BoundingBox box : entry.getValue()) {
                double confidence = box.confidenceOrZero();
                min = Math.min(min, confidence);
                max = Math.max(max, confidence);
                sum += confidence;
            }
            cs.setDetections(entry.getValue().size());
            cs.setMinConfidence(min);
            cs.setMaxConfidence(max);
            cs.setMeanConfidence(sum / entry.getValue().size());
        }
        return stats;
    }

    private static AnnotationStatistics.ClassStatistics newClassStatistics() {
        AnnotationStatistics.ClassStatistics cs = new AnnotationStatistics.ClassStatistics();
        for (AreaRange range : new AreaRange[]{AreaRange.SMALL, AreaRange.MEDIUM, AreaRange.LARGE}) {
            cs.getSizeBuckets().put(range.name().toLowerCase(Locale.ROOT), 0);
        }
        return cs;
    }
}
