package com.edge.metrics.controller;

import com.edge.metrics.core.coco.AreaRange;
import com.edge.metrics.core.coco.CocoEvaluator;
import com.edge.metrics.core.coco.CocoMetric;
import com.edge.metrics.core.coco.CocoSummary;
import com.edge.metrics.core.match.MatchPolicy;
import com.edge.metrics.core.model.CoordinateFormat;
import com.edge.metrics.core.pascal.InterpolationMethod;
import com.edge.metrics.core.stats.AnnotationStatistics;
import com.edge.metrics.core.summary.EvaluationReport;
import com.edge.metrics.core.summary.EvaluationSettings;
import com.edge.metrics.core.summary.PascalMetric;
import com.edge.metrics.dto.EvaluationRequest;
import com.edge.metrics.service.EvaluationService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.media.Content;
import io.swagger.v3.oas.annotations.media.ExampleObject;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.responses.ApiResponses;
import io.swagger.v3.oas.annotations.tags.Tag;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.*;

/**
 * 检测评估控制器
 *
 * 计算 Pascal VOC / COCO 指标与标注统计
 */
@RestController
@RequestMapping("/api/evaluation")
@Tag(name = "检测评估", description = "输入真值框与检测框，计算 Pascal VOC 与 COCO 检测指标")
public class EvaluationController {
    private static final Logger logger = LoggerFactory.getLogger(EvaluationController.class);

    @Autowired
    private EvaluationService evaluationService;

    /**
     * 完整评估
     */
    @PostMapping
    @Operation(
            summary = "完整评估",
            description = """
                    计算请求的全部指标，返回 Pascal 结果、COCO 指标与各类别 PR 曲线。

                    **请求示例**：
                    ```json
                    {
                      "groundTruths": [
                        {"imageId": "img1", "label": "cat", "coordinates": [0, 0, 10, 10]}
                      ],
                      "detections": [
                        {"imageId": "img1", "label": "cat", "coordinates": [0, 0, 10, 10], "confidence": 0.9}
                      ],
                      "coordinateFormat": "XYX2Y2",
                      "iouThreshold": 0.5,
                      "interpolation": "EVERY_POINT",
                      "matchPolicy": "GREEDY_UNMATCHED",
                      "metrics": ["AP", "AP50", "mAP"]
                    }
                    ```

                    **参数说明**：
                    | 参数 | 说明 | 默认值 |
                    |------|------|--------|
                    | coordinateFormat | XYX2Y2 / XYWH / YOLO | XYX2Y2 |
                    | imageSizes | YOLO 格式时每张图片的宽高 | - |
                    | iouThreshold | Pascal VOC 的 IoU 阈值，取值 (0, 1] | 0.5 |
                    | interpolation | EVERY_POINT / ELEVEN_POINT | EVERY_POINT |
                    | matchPolicy | GREEDY_UNMATCHED / VOC_DEVKIT | GREEDY_UNMATCHED |
                    | metrics | 指标键名，为空时计算全部 14 项 | 全部 |
                    | classes | 只评估这些类别 | 全部 |

                    COCO 指标固定使用 IoU 0.50:0.05:0.95，不受 iouThreshold 影响。
                    """
    )
    @ApiResponses(value = {
            @ApiResponse(
                    responseCode = "200",
                    description = "评估成功",
                    content = @Content(
                            mediaType = "application/json",
                            examples = @ExampleObject(
                                    value = """
                                            {
                                              "status": "success",
                                              "data": {
                                                "coco": {"AP": 1.0, "AP50": 1.0},
                                                "pascal": {"mAP": 1.0},
                                                "classes": ["cat"],
                                                "processingTimeMs": 3
                                              }
                                            }
                                            """
                            )
                    )
            )
    })
    public ResponseEntity<Map<String, Object>> evaluate(@RequestBody EvaluationRequest request) {
        Map<String, Object> response = new HashMap<>();
        try {
            EvaluationReport report = evaluationService.evaluate(request);
            response.put("status", "success");
            response.put("data", report);
            return ResponseEntity.ok(response);
        } catch (IllegalArgumentException e) {
            logger.warn("Invalid evaluation request: {}", e.getMessage());
            response.put("status", "error");
            response.put("message", e.getMessage());
            return ResponseEntity.badRequest().body(response);
        } catch (Exception e) {
            logger.error("Evaluation failed", e);
            response.put("status", "error");
            response.put("message", e.getMessage());
            return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR).body(response);
        }
    }

    /**
     * Pascal VOC 评估
     */
    @PostMapping("/pascal")
    @Operation(
            summary = "Pascal VOC 评估",
            description = """
                    在单一 IoU 阈值下计算每个类别的 AP 与 mAP。

                    只有存在真值的类别参与 mAP；per_class 中每个类别包含 precision、recall、AP、TP、FP、
                    total_positives 以及逐条检测的累计表 table。
                    """
    )
    @ApiResponses(value = {
            @ApiResponse(
                    responseCode = "200",
                    description = "评估成功",
                    content = @Content(
                            mediaType = "application/json",
                            examples = @ExampleObject(
                                    value = """
                                            {
                                              "status": "success",
                                              "data": {
                                                "mAP": 0.5556,
                                                "per_class": {
                                                  "cat": {"AP": 0.5556, "TP": 2, "FP": 2, "total_positives": 3}
                                                }
                                              }
                                            }
                                            """
                            )
                    )
            )
    })
    public ResponseEntity<Map<String, Object>> evaluatePascal(@RequestBody EvaluationRequest request) {
        Map<String, Object> response = new HashMap<>();
        try {
            Map<String, Object> pascal = evaluationService.evaluatePascal(request);
            response.put("status", "success");
            response.put("data", pascal);
            return ResponseEntity.ok(response);
        } catch (IllegalArgumentException e) {
            logger.warn("Invalid Pascal request: {}", e.getMessage());
            response.put("status", "error");
            response.put("message", e.getMessage());
            return ResponseEntity.badRequest().body(response);
        } catch (Exception e) {
            logger.error("Pascal evaluation failed", e);
            response.put("status", "error");
            response.put("message", e.getMessage());
            return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR).body(response);
        }
    }

    /**
     * COCO 评估
     */
    @PostMapping("/coco")
    @Operation(
            summary = "COCO 评估",
            description = """
                    计算 COCO 风格的 12 项指标（或 metrics 中请求的子集）。

                    | 指标 | 说明 |
                    |------|------|
                    | AP | IoU 0.50:0.95 平均 |
                    | AP50 / AP75 | 单一 IoU 阈值 |
                    | APsmall / APmedium / APlarge | 面积 < 32² / 32²~96² / >= 96² |
                    | AR1 / AR10 / AR100 | 每张图最多 1 / 10 / 100 个检测 |
                    | ARsmall / ARmedium / ARlarge | 各尺寸的召回率 |

                    没有真值的指标值为 NaN。
                    """
    )
    @ApiResponses(value = {
            @ApiResponse(
                    responseCode = "200",
                    description = "评估成功",
                    content = @Content(
                            mediaType = "application/json",
                            examples = @ExampleObject(
                                    value = """
                                            {
                                              "status": "success",
                                              "data": {"AP": 0.5545, "AP50": 0.5545, "AR100": 0.6667}
                                            }
                                            """
                            )
                    )
            )
    })
    public ResponseEntity<Map<String, Object>> evaluateCoco(@RequestBody EvaluationRequest request) {
        Map<String, Object> response = new HashMap<>();
        try {
            CocoSummary summary = evaluationService.evaluateCoco(request);
            response.put("status", "success");
            response.put("data", summary);
            return ResponseEntity.ok(response);
        } catch (IllegalArgumentException e) {
            logger.warn("Invalid COCO request: {}", e.getMessage());
            response.put("status", "error");
            response.put("message", e.getMessage());
            return ResponseEntity.badRequest().body(response);
        } catch (Exception e) {
            logger.error("COCO evaluation failed", e);
            response.put("status", "error");
            response.put("message", e.getMessage());
            return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR).body(response);
        }
    }

    /**
     * 标注统计
     */
    @PostMapping("/statistics")
    @Operation(
            summary = "标注统计",
            description = "统计图片数、各类别真值与检测数量、真值尺寸分布和检测置信度范围。"
    )
    public ResponseEntity<Map<String, Object>> statistics(@RequestBody EvaluationRequest request) {
        Map<String, Object> response = new HashMap<>();
        try {
            AnnotationStatistics stats = evaluationService.statistics(request);
            response.put("status", "success");
            response.put("data", stats);
            return ResponseEntity.ok(response);
        } catch (IllegalArgumentException e) {
            logger.warn("Invalid statistics request: {}", e.getMessage());
            response.put("status", "error");
            response.put("message", e.getMessage());
            return ResponseEntity.badRequest().body(response);
        } catch (Exception e) {
            logger.error("Failed to compute statistics", e);
            response.put("status", "error");
            response.put("message", e.getMessage());
            return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR).body(response);
        }
    }

    /**
     * 默认配置与可用指标
     */
    @GetMapping("/defaults")
    @Operation(
            summary = "获取默认配置",
            description = "返回服务端默认评估参数以及可选的指标、坐标格式、插值方式和匹配策略。"
    )
    public ResponseEntity<Map<String, Object>> getDefaults() {
        Map<String, Object> response = new HashMap<>();
        try {
            EvaluationSettings settings = evaluationService.getDefaultSettings();

            Map<String, Object> defaults = new LinkedHashMap<>();
            defaults.put("iouThreshold", settings.getIouThreshold());
            defaults.put("interpolation", settings.getInterpolation());
            defaults.put("matchPolicy", settings.getMatchPolicy());
            defaults.put("metrics", metricKeys(settings.getSelection().getCocoMetrics(),
                settings.getSelection().getPascalMetrics()));
            defaults.put("parallelism", evaluationService.getParallelism());

            Map<String, Object> catalogue = new LinkedHashMap<>();
            catalogue.put("metrics", metricKeys(EnumSet.allOf(CocoMetric.class), EnumSet.allOf(PascalMetric.class)));
            catalogue.put("coordinateFormats", Arrays.asList(CoordinateFormat.values()));
            catalogue.put("interpolations", Arrays.asList(InterpolationMethod.values()));
            catalogue.put("matchPolicies", Arrays.asList(MatchPolicy.values()));
            catalogue.put("cocoIouThresholds", CocoEvaluator.IOU_THRESHOLDS);
            catalogue.put("areaRanges", areaRanges());

            Map<String, Object> data = new LinkedHashMap<>();
            data.put("defaults", defaults);
            data.put("catalogue", catalogue);

            response.put("status", "success");
            response.put("data", data);
            return ResponseEntity.ok(response);
        } catch (Exception e) {
            logger.error("Failed to get defaults", e);
            response.put("status", "error");
            response.put("message", e.getMessage());
            return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR).body(response);
        }
    }

    private static List<String> metricKeys(Set<CocoMetric> coco, Set<PascalMetric> pascal) {
        List<String> keys = new ArrayList<>();
        coco.forEach(m -> keys.add(m.getKey()));
        pascal.forEach(m -> keys.add(m.getKey()));
        return keys;
    }

    private static Map<String, Object> areaRanges() {
        Map<String, Object> ranges = new LinkedHashMap<>();
        for (AreaRange range : AreaRange.values()) {
            Map<String, Object> bounds = new LinkedHashMap<>();
            bounds.put("min", range.getMin());
            // 无上界时为 null
            bounds.put("max", Double.isInfinite(range.getMax()) ? null : range.getMax());
            ranges.put(range.name().toLowerCase(Locale.ROOT), bounds);
        }
        return ranges;
    }
}
