package com.edge.metrics.dto;

import com.edge.metrics.core.match.MatchPolicy;
import com.edge.metrics.core.model.CoordinateFormat;
import com.edge.metrics.core.pascal.InterpolationMethod;

import java.util.List;
import java.util.Map;

/**
 * 评估请求
 * <p>
 * 未设置的参数使用服务端默认配置
 */
public class EvaluationRequest {
    private List<BoxDto> groundTruths;
    private List<BoxDto> detections;
    private CoordinateFormat coordinateFormat;
    private Map<String, ImageSize> imageSizes;
    private Double iouThreshold;
    private InterpolationMethod interpolation;
    private MatchPolicy matchPolicy;
    private List<String> metrics;
    private List<String> classes;

    public List<BoxDto> getGroundTruths() { return groundTruths; }
    public void setGroundTruths(List<BoxDto> groundTruths) { this.groundTruths = groundTruths; }

    public List<BoxDto> getDetections() { return detections; }
    public void setDetections(List<BoxDto> detections) { this.detections = detections; }

    public CoordinateFormat getCoordinateFormat() { return coordinateFormat; }
    public void setCoordinateFormat(CoordinateFormat coordinateFormat) { this.coordinateFormat = coordinateFormat; }

    public Map<String, ImageSize> getImageSizes() { return imageSizes; }
    public void setImageSizes(Map<String, ImageSize> imageSizes) { this.imageSizes = imageSizes; }

    public Double getIouThreshold() { return iouThreshold; }
    public void setIouThreshold(Double iouThreshold) { this.iouThreshold = iouThreshold; }

    public InterpolationMethod getInterpolation() { return interpolation; }
    public void setInterpolation(InterpolationMethod interpolation) { this.interpolation = interpolation; }

    public MatchPolicy getMatchPolicy() { return matchPolicy; }
    public void setMatchPolicy(MatchPolicy matchPolicy) { this.matchPolicy = matchPolicy; }

    public List<String> getMetrics() { return metrics; }
    public void setMetrics(List<String> metrics) { this.metrics = metrics; }

    public List<String> getClasses() { return classes; }
    public void setClasses(List<String> classes) { this.classes = classes; }

    /**
     * 图片尺寸（像素）
     */
    public static class ImageSize {
        private double width;
        private double height;

        public ImageSize() {
        }

        public ImageSize(double width, double height) {
            this.width = width;
            this.height = height;
        }

        public double getWidth() { return width; }
        public void setWidth(double width) { this.width = width; }

        public double getHeight() { return height; }
        public void setHeight(double height) { this.height = height; }
    }
}
