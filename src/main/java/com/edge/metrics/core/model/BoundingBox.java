package com.edge.metrics.core.model;

import java.util.Objects;

/**
 * 边界框
 * <p>
 * 统一使用绝对像素坐标 (x1, y1, x2, y2)，构造后不可修改。
 * 重新打标签（例如把一批框强制设为真值）必须通过 {@link #withType(BoxType)} 生成新对象。
 */
public final class BoundingBox {

    // 允许的坐标翻转误差（像素），超出即视为非法框
    public static final double INVERSION_TOLERANCE = 1e-6;

    private final String imageId;
    private final String classLabel;
    private final BoxType type;
    private final double x1;
    private final double y1;
    private final double x2;
    private final double y2;
    private final Double confidence;   // 仅 DETECTED 有效

    private BoundingBox(String imageId, String classLabel, BoxType type,
                        double x1, double y1, double x2, double y2, Double confidence) {
        this.imageId = imageId;
        this.classLabel = classLabel;
        this.type = type;
        this.x1 = x1;
        this.y1 = y1;
        this.x2 = x2;
        this.y2 = y2;
        this.confidence = confidence;
        validate();
    }

    /**
     * 创建真值框
     */
    public static BoundingBox groundTruth(String imageId, String classLabel,
                                          double x1, double y1, double x2, double y2) {
        return new BoundingBox(imageId, classLabel, BoxType.GROUND_TRUTH, x1, y1, x2, y2, null);
    }

    /**
     * 创建检测框
     */
    public static BoundingBox detected(String imageId, String classLabel,
                                       double x1, double y1, double x2, double y2, double confidence) {
        return new BoundingBox(imageId, classLabel, BoxType.DETECTED, x1, y1, x2, y2, confidence);
    }

    /**
     * 返回指定类型的新边界框，当前对象保持不变
     * <p>
     * 检测框转为真值时丢弃置信度；真值转为检测框时置信度设为 1.0
     */
    public BoundingBox withType(BoxType newType) {
        if (newType == type) {
            return this;
        }
        Double newConfidence = newType == BoxType.DETECTED
            ? (confidence != null ? confidence : 1.0)
            : null;
        return new BoundingBox(imageId, classLabel, newType, x1, y1, x2, y2, newConfidence);
    }

    private void validate() {
        if (imageId == null || imageId.isBlank()) {
            throw new InvalidBoxException("imageId is required");
        }
        if (classLabel == null || classLabel.isBlank()) {
            throw new InvalidBoxException("classLabel is required for box in image " + imageId);
        }
        if (type == null) {
            throw new InvalidBoxException("box type is required for box in image " + imageId);
        }
        if (!Double.isFinite(x1) || !Double.isFinite(y1) || !Double.isFinite(x2) || !Double.isFinite(y2)) {
            throw new InvalidBoxException(String.format(
                "Non-finite coordinates [%s, %s, %s, %s] in image %s", x1, y1, x2, y2, imageId));
        }
        if (x2 < x1 - INVERSION_TOLERANCE || y2 < y1 - INVERSION_TOLERANCE) {
            throw new InvalidBoxException(String.format(
                "Inverted rectangle [%.4f, %.4f, %.4f, %.4f] in image %s", x1, y1, x2, y2, imageId));
        }
        if (type == BoxType.DETECTED) {
            if (confidence == null || !Double.isFinite(confidence) || confidence < 0.0 || confidence > 1.0) {
                throw new InvalidBoxException(String.format(
                    "Detection in image %s (class %s) needs a confidence in [0, 1], got %s",
                    imageId, classLabel, confidence));
            }
        }
    }

    /**
     * 面积，负的宽高按 0 处理
     */
    public double getArea() {
        return getWidth() * getHeight();
    }

    public double getWidth() {
        return Math.max(0.0, x2 - x1);
    }

    public double getHeight() {
        return Math.max(0.0, y2 - y1);
    }

    public boolean isGroundTruth() {
        return type == BoxType.GROUND_TRUTH;
    }

    /**
     * 排序用的置信度，真值框返回 0
     */
    public double confidenceOrZero() {
        return confidence != null ? confidence : 0.0;
    }

    public String getImageId() { return imageId; }

    public String getClassLabel() { return classLabel; }

    public BoxType getType() { return type; }

    public double getX1() { return x1; }

    public double getY1() { return y1; }

    public double getX2() { return x2; }

    public double getY2() { return y2; }

    public Double getConfidence() { return confidence; }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof BoundingBox)) return false;
        BoundingBox that = (BoundingBox) o;
        return Double.compare(that.x1, x1) == 0
            && Double.compare(that.y1, y1) == 0
            && Double.compare(that.x2, x2) == 0
            && Double.compare(that.y2, y2) == 0
            && imageId.equals(that.imageId)
            && classLabel.equals(that.classLabel)
            && type == that.type
            && Objects.equals(confidence, that.confidence);
    }

    @Override
    public int hashCode() {
        return Objects.hash(imageId, classLabel, type, x1, y1, x2, y2, confidence);
    }

    @Override
    public String toString() {
        if (type == BoxType.DETECTED) {
            return String.format("BoundingBox[%s/%s %.2f,%.2f - %.2f,%.2f conf=%.3f]",
                imageId, classLabel, x1, y1, x2, y2, confidence);
        }
        return String.format("BoundingBox[%s/%s %.2f,%.2f - %.2f,%.2f GT]",
            imageId, classLabel, x1, y1, x2, y2);
    }
}
