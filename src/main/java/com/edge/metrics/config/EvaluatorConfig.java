package com.edge.metrics.config;

import com.edge.metrics.core.coco.CocoEvaluator;
import com.edge.metrics.core.stats.StatisticsCalculator;
import com.edge.metrics.core.summary.EvaluationSettings;
import com.edge.metrics.core.summary.MetricSelection;
import com.edge.metrics.core.summary.MetricsSummaryProducer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * 评估器配置
 * <p>
 * 从 application.yml 读取配置，覆盖 {@link EvaluationSettings#DEFAULT} 中的默认值
 */
@Configuration
public class EvaluatorConfig {
    private static final Logger logger = LoggerFactory.getLogger(EvaluatorConfig.class);

    @Autowired
    private YamlConfig yamlConfig;

    @Bean
    public EvaluationSettings evaluationSettings() {
        YamlConfig.EvaluationConfig evaluationConfig = yamlConfig.getEvaluation();
        if (evaluationConfig == null) {
            logger.info("使用默认的评估配置: {}", EvaluationSettings.DEFAULT);
            return EvaluationSettings.DEFAULT;
        }

        EvaluationSettings settings = new EvaluationSettings(
            evaluationConfig.getIouThreshold(),
            evaluationConfig.getInterpolation(),
            evaluationConfig.getMatchPolicy(),
            MetricSelection.parse(evaluationConfig.getMetrics()));

        logger.info("评估配置: iouThreshold={}, interpolation={}, matchPolicy={}, metrics={}",
            settings.getIouThreshold(), settings.getInterpolation(), settings.getMatchPolicy(),
            settings.getSelection());

        return settings;
    }

    @Bean
    public CocoEvaluator cocoEvaluator() {
        return new CocoEvaluator();
    }

    @Bean
    public MetricsSummaryProducer metricsSummaryProducer() {
        return new MetricsSummaryProducer();
    }

    @Bean
    public StatisticsCalculator statisticsCalculator() {
        return new StatisticsCalculator();
    }
}
