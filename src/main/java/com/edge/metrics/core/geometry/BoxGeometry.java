package com.edge.metrics.core.geometry;

import com.edge.metrics.core.model.BoundingBox;

import java.util.List;

/**
 * 边界框几何计算
 * <p>
 * 面积、交集面积、IoU (Intersection over Union)
 */
public final class BoxGeometry {

    private BoxGeometry() {
    }

    /**
     * 面积，翻转/退化框返回 0
     */
    public static double area(BoundingBox box) {
        return box.getArea();
    }

    /**
     * 两个框重叠区域的面积，不相交时为 0
     */
    public static double intersectionArea(BoundingBox a, BoundingBox b) {
        double x1 = Math.max(a.getX1(), b.getX1());
        double y1 = Math.max(a.getY1(), b.getY1());
        double x2 = Math.min(a.getX2(), b.getX2());
        double y2 = Math.min(a.getY2(), b.getY2());
        return Math.max(0.0, x2 - x1) * Math.max(0.0, y2 - y1);
    }

    /**
     * 计算 IoU
     * <p>
     * 并集面积为 0（两个框都退化）时返回 0.0
     */
    public static double iou(BoundingBox a, BoundingBox b) {
        double intersection = intersectionArea(a, b);
        double union = area(a) + area(b) - intersection;
        if (union <= 0) return 0.0;
        return intersection / union;
    }

    /**
     * IoU 矩阵，ious[i][j] 为 detections[i] 与 groundTruths[j] 的 IoU
     */
    public static double[][] iouMatrix(List<BoundingBox> detections, List<BoundingBox> groundTruths) {
        double[][] ious = new double[detections.size()][groundTruths.size()];
        for (int d = 0; d < detections.size(); d++) {
            BoundingBox det = detections.get(d);
            for (int g = 0; g < groundTruths.size(); g++) {
                ious[d][g] = iou(det, groundTruths.get(g));
            }
        }
        return ious;
    }
}
