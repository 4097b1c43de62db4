package com.edge.metrics.config;

import com.edge.metrics.core.match.MatchPolicy;
import com.edge.metrics.core.pascal.InterpolationMethod;
import com.edge.metrics.core.summary.EvaluationSettings;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

import java.util.List;

@Data
@Configuration
@ConfigurationProperties(prefix = "edge-metrics")
public class YamlConfig {
    private EvaluationConfig evaluation;
    private ExecutorConfig executor;

    @Data
    public static class EvaluationConfig {
        // Pascal VOC 的 IoU 阈值，取值 (0, 1]
        private double iouThreshold = EvaluationSettings.DEFAULT_IOU_THRESHOLD;
        private InterpolationMethod interpolation = InterpolationMethod.EVERY_POINT;
        private MatchPolicy matchPolicy = MatchPolicy.GREEDY_UNMATCHED;
        // 默认请求的指标键名，空表示全部
        private List<String> metrics;
    }

    @Data
    public static class ExecutorConfig {
        // 按类别并行评估的线程数，1 表示在调用线程中顺序执行
        private int parallelism = Runtime.getRuntime().availableProcessors();
    }
}
