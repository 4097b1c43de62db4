package com.edge.metrics.core.model;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.TreeSet;

/**
 * 边界框集合工具
 * <p>
 * 所有方法都返回新集合，不修改入参
 */
public final class BoundingBoxes {

    /**
     * 置信度降序，相同置信度保持输入顺序（List.sort 为稳定排序）
     */
    public static final Comparator<BoundingBox> BY_CONFIDENCE_DESC =
        Comparator.comparingDouble(BoundingBox::confidenceOrZero).reversed();

    private BoundingBoxes() {
    }

    /**
     * 把其他坐标格式转换为绝对坐标边界框
     *
     * @param values      4 个坐标值，含义由 format 决定
     * @param imageWidth  图片宽度（像素），仅 YOLO 需要
     * @param imageHeight 图片高度（像素），仅 YOLO 需要
     * @param confidence  检测框置信度，真值传 null
     */
    public static BoundingBox fromFormat(CoordinateFormat format, String imageId, String classLabel,
                                         double[] values, double imageWidth, double imageHeight,
                                         Double confidence) {
        if (values == null || values.length != 4) {
            throw new InvalidBoxException("Exactly 4 coordinates are required for box in image " + imageId);
        }
        double x1;
        double y1;
        double x2;
        double y2;
        switch (format) {
            case XYX2Y2:
                x1 = values[0];
                y1 = values[1];
                x2 = values[2];
                y2 = values[3];
                break;
            case XYWH:
                x1 = values[0];
                y1 = values[1];
                x2 = values[0] + values[2];
                y2 = values[1] + values[3];
                break;
            case YOLO:
                if (!(imageWidth > 0) || !(imageHeight > 0)) {
                    throw new InvalidBoxException("Image size is required for YOLO coordinates of image " + imageId);
                }
                double w = values[2] * imageWidth;
                double h = values[3] * imageHeight;
                double cx = values[0] * imageWidth;
                double cy = values[1] * imageHeight;
                x1 = cx - w / 2;
                y1 = cy - h / 2;
                x2 = cx + w / 2;
                y2 = cy + h / 2;
                break;
            default:
                throw new InvalidBoxException("Unsupported coordinate format: " + format);
        }
        return confidence == null
            ? BoundingBox.groundTruth(imageId, classLabel, x1, y1, x2, y2)
            : BoundingBox.detected(imageId, classLabel, x1, y1, x2, y2, confidence);
    }

    /**
     * 生成统一类型的新列表
     */
    public static List<BoundingBox> retag(List<BoundingBox> boxes, BoxType type) {
        List<BoundingBox> result = new ArrayList<>(boxes.size());
        for (BoundingBox box : boxes) {
            if (box == null) {
                throw new InvalidBoxException("Null bounding box in input");
            }
            result.add(box.withType(type));
        }
        return Collections.unmodifiableList(result);
    }

    /**
     * 按类别分组，保持输入顺序
     */
    public static Map<String, List<BoundingBox>> groupByClass(List<BoundingBox> boxes) {
        Map<String, List<BoundingBox>> groups = new LinkedHashMap<>();
        for (BoundingBox box : boxes) {
            groups.computeIfAbsent(box.getClassLabel(), k -> new ArrayList<>()).add(box);
        }
        return groups;
    }

    /**
     * 按图片分组，保持输入顺序
     */
    public static Map<String, List<BoundingBox>> groupByImage(List<BoundingBox> boxes) {
        Map<String, List<BoundingBox>> groups = new LinkedHashMap<>();
        for (BoundingBox box : boxes) {
            groups.computeIfAbsent(box.getImageId(), k -> new ArrayList<>()).add(box);
        }
        return groups;
    }

    /**
     * 按置信度降序排列的新列表
     */
    public static List<BoundingBox> sortedByConfidence(List<BoundingBox> detections) {
        List<BoundingBox> sorted = new ArrayList<>(detections);
        sorted.sort(BY_CONFIDENCE_DESC);
        return sorted;
    }

    /**
     * 集合中出现过的全部类别，按字典序
     */
    public static TreeSet<String> classLabels(List<BoundingBox> boxes) {
        TreeSet<String> labels = new TreeSet<>();
        for (BoundingBox box : boxes) {
            labels.add(box.getClassLabel());
        }
        return labels;
    }
}
