package com.edge.metrics.config;

import io.swagger.v3.oas.models.OpenAPI;
import io.swagger.v3.oas.models.info.Contact;
import io.swagger.v3.oas.models.info.Info;
import io.swagger.v3.oas.models.info.License;
import io.swagger.v3.oas.models.media.Content;
import io.swagger.v3.oas.models.media.MediaType;
import io.swagger.v3.oas.models.media.Schema;
import io.swagger.v3.oas.models.responses.ApiResponse;
import org.springdoc.core.customizers.OpenApiCustomizer;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.Map;

/**
 * OpenAPI / Swagger 配置
 *
 * 访问地址：
 * - Swagger UI: http://localhost:{port}/swagger-ui.html
 * - API 文档 (JSON): http://localhost:{port}/v3/api-docs
 */
@Configuration
public class OpenApiConfig {

    @Bean
    public OpenAPI edgeMetricsOpenAPI() {
        return new OpenAPI()
                .info(new Info()
                        .title("Edge Metrics API")
                        .description("""
                                目标检测评估服务 API 文档

                                ## 功能概述

                                输入真值框与检测框，计算 Pascal VOC 与 COCO 风格的检测指标。

                                ### 核心功能
                                - **Pascal VOC**：单一 IoU 阈值下的每类 AP、PR 曲线与 mAP
                                - **COCO**：IoU 0.50:0.05:0.95 下的 12 项 AP / AR 指标
                                - **标注统计**：图片数、类别数量、尺寸分布、置信度范围

                                ### 坐标格式
                                | 格式 | 说明 |
                                |------|------|
                                | `XYX2Y2` | 左上角与右下角绝对坐标（默认） |
                                | `XYWH` | 左上角绝对坐标加宽高 |
                                | `YOLO` | 归一化中心点加宽高，需要图片尺寸 |

                                ### API 响应格式
                                所有接口返回统一的 JSON 格式：
                                ```json
                                {
                                  "status": "success | error",
                                  "data": { ... },
                                  "message": "错误信息（仅错误时）"
                                }
                                ```
                                """)
                        .version("1.0.0")
                        .contact(new Contact()
                                .name("Edge Metrics Team"))
                        .license(new License()
                                .name("MIT License")
                                .url("https://opensource.org/licenses/MIT")));
    }

    /**
     * 为所有接口添加统一的响应示例
     */
    @Bean
    public OpenApiCustomizer globalResponseCustomizer() {
        return openApi -> {
            if (openApi.getPaths() == null) {
                return;
            }
            openApi.getPaths().forEach((path, pathItem) -> {
                if (pathItem.getGet() != null) {
                    pathItem.getGet().getResponses().addApiResponse("200", createSuccessResponse());
                }
                if (pathItem.getPost() != null) {
                    pathItem.getPost().getResponses().addApiResponse("200", createSuccessResponse());
                    pathItem.getPost().getResponses().addApiResponse("400", createBadRequestResponse());
                }
            });
        };
    }

    private ApiResponse createSuccessResponse() {
        Schema<?> schema = new Schema<>();
        schema.setType("object");
        schema.setProperties(Map.of(
                "status", new Schema<>().type("string").description("状态: success/error").example("success"),
                "data", new Schema<>().type("object").description("响应数据"),
                "message", new Schema<>().type("string").description("消息（可选）")
        ));

        return new ApiResponse()
                .description("成功")
                .content(new Content()
                        .addMediaType("application/json",
                                new MediaType().schema(schema)));
    }

    private ApiResponse createBadRequestResponse() {
        Schema<?> schema = new Schema<>();
        schema.setType("object");
        schema.setProperties(Map.of(
                "status", new Schema<>().type("string").description("状态").example("error"),
                "message", new Schema<>().type("string").description("错误信息").example("IoU threshold must be in (0, 1]")
        ));

        return new ApiResponse()
                .description("请求错误")
                .content(new Content()
                        .addMediaType("application/json",
                                new MediaType().schema(schema)));
    }
}
