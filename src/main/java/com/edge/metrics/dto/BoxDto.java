package com.edge.metrics.dto;

import java.util.List;

/**
 * 请求中的单个框
 * <p>
 * coordinates 的含义由请求的 coordinateFormat 决定；真值框忽略 confidence
 */
public class BoxDto {
    private String imageId;
    private String label;
    private List<Double> coordinates;
    private Double confidence;
    // YOLO 格式时的图片尺寸，未提供时从 EvaluationRequest.imageSizes 中查找
    private Double imageWidth;
    private Double imageHeight;

    public BoxDto() {
    }

    public BoxDto(String imageId, String label, List<Double> coordinates, Double confidence) {
        this.imageId = imageId;
        this.label = label;
        this.coordinates = coordinates;
        this.confidence = confidence;
    }

    public String getImageId() { return imageId; }
    public void setImageId(String imageId) { this.imageId = imageId; }

    public String getLabel() { return label; }
    public void setLabel(String label) { this.label = label; }

    public List<Double> getCoordinates() { return coordinates; }
    public void setCoordinates(List<Double> coordinates) { this.coordinates = coordinates; }

    public Double getConfidence() { return confidence; }
    public void setConfidence(Double confidence) { this.confidence = confidence; }

    public Double getImageWidth() { return imageWidth; }
    public void setImageWidth(Double imageWidth) { this.imageWidth = imageWidth; }

    public Double getImageHeight() { return imageHeight; }
    public void setImageHeight(Double imageHeight) { this.imageHeight = imageHeight; }
}
