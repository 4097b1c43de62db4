package com.edge.metrics.service;

import com.edge.metrics.config.YamlConfig;
import com.edge.metrics.core.coco.CocoClassEvaluation;
import com.edge.metrics.core.coco.CocoEvaluator;
import com.edge.metrics.core.coco.CocoMetric;
import com.edge.metrics.core.coco.CocoSummary;
import com.edge.metrics.core.match.DetectionMatcher;
import com.edge.metrics.core.model.BoundingBox;
import com.edge.metrics.core.model.BoundingBoxes;
import com.edge.metrics.core.model.BoxType;
import com.edge.metrics.core.model.CoordinateFormat;
import com.edge.metrics.core.model.InvalidBoxException;
import com.edge.metrics.core.pascal.ClassApResult;
import com.edge.metrics.core.pascal.PascalVocEvaluator;
import com.edge.metrics.core.pascal.PascalVocResult;
import com.edge.metrics.core.stats.AnnotationStatistics;
import com.edge.metrics.core.stats.StatisticsCalculator;
import com.edge.metrics.core.summary.EvaluationReport;
import com.edge.metrics.core.summary.EvaluationSettings;
import com.edge.metrics.core.summary.MetricSelection;
import com.edge.metrics.core.summary.MetricsSummaryProducer;
import com.edge.metrics.core.summary.PascalMetric;
import com.edge.metrics.dto.BoxDto;
import com.edge.metrics.dto.EvaluationRequest;
import jakarta.annotation.PreDestroy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.TreeSet;
import java.util.concurrent.Callable;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.FutureTask;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * 评估服务
 * <p>
 * 校验输入、统一框类型，然后按类别把 Pascal / COCO 计算分发到固定大小的线程池，
 * 最后按类别名顺序汇总。并行结果与顺序计算完全一致。
 */
@Service
public class EvaluationService {
    private static final Logger logger = LoggerFactory.getLogger(EvaluationService.class);

    private final EvaluationSettings defaultSettings;
    private final CocoEvaluator cocoEvaluator;
    private final MetricsSummaryProducer summaryProducer;
    private final StatisticsCalculator statisticsCalculator;
    private final int parallelism;

    // parallelism 为 1 时为 null，任务在调用线程中执行
    private ExecutorService evaluationExecutor;

    @Autowired
    public EvaluationService(YamlConfig config, EvaluationSettings defaultSettings, CocoEvaluator cocoEvaluator,
                             MetricsSummaryProducer summaryProducer, StatisticsCalculator statisticsCalculator) {
        this(defaultSettings, cocoEvaluator, summaryProducer, statisticsCalculator,
            config.getExecutor() != null ? config.getExecutor().getParallelism() : 1);
    }

    public EvaluationService(EvaluationSettings defaultSettings, CocoEvaluator cocoEvaluator,
                             MetricsSummaryProducer summaryProducer, StatisticsCalculator statisticsCalculator,
                             int parallelism) {
        this.defaultSettings = defaultSettings != null ? defaultSettings : EvaluationSettings.DEFAULT;
        this.cocoEvaluator = cocoEvaluator;
        this.summaryProducer = summaryProducer;
        this.statisticsCalculator = statisticsCalculator;
        this.parallelism = Math.max(1, parallelism);

        if (this.parallelism > 1) {
            AtomicInteger threadIndex = new AtomicInteger();
            evaluationExecutor = Executors.newFixedThreadPool(this.parallelism, r -> {
                Thread t = new Thread(r, "Metrics-Worker-" + threadIndex.incrementAndGet());
                t.setDaemon(true);
                return t;
            });
        }
        logger.info("EvaluationService initialized: parallelism={}, defaults={}", this.parallelism,
            this.defaultSettings);
    }

    // ==================== 请求入口 ====================

    public EvaluationReport evaluate(EvaluationRequest request) {
        EvaluationSettings settings = resolveSettings(request);
        return evaluate(toGroundTruths(request), toDetections(request), settings);
    }

    /**
     * 只计算 Pascal 指标，请求中没有 Pascal 指标时计算 AP 与 mAP
     */
    public Map<String, Object> evaluatePascal(EvaluationRequest request) {
        EvaluationSettings settings = resolveSettings(request);
        MetricSelection selection = settings.getSelection();
        MetricSelection pascalOnly = MetricSelection
            .of(null, selection.requiresPascal() ? selection.getPascalMetrics() : EnumSet.allOf(PascalMetric.class))
            .withClasses(selection.getClasses());
        return evaluate(toGroundTruths(request), toDetections(request), settings.withSelection(pascalOnly))
            .getPascal();
    }

    /**
     * 只计算 COCO 指标，请求中没有 COCO 指标时计算全部 12 项
     */
    public CocoSummary evaluateCoco(EvaluationRequest request) {
        EvaluationSettings settings = resolveSettings(request);
        MetricSelection selection = settings.getSelection();
        MetricSelection cocoOnly = (selection.requiresCoco()
            ? MetricSelection.of(selection.getCocoMetrics(), null)
            : MetricSelection.of(MetricSelection.all().getCocoMetrics(), null))
            .withClasses(selection.getClasses());
        return evaluate(toGroundTruths(request), toDetections(request), settings.withSelection(cocoOnly))
            .getCoco();
    }

    public AnnotationStatistics statistics(EvaluationRequest request) {
        MetricSelection selection = resolveSettings(request).getSelection();
        return statistics(toGroundTruths(request), toDetections(request), selection);
    }

    // ==================== 评估 ====================

    /**
     * 评估一批真值与检测
     *
     * @param groundTruths 真值框，统一视为 GROUND_TRUTH
     * @param detections   检测框，统一视为 DETECTED
     * @param settings     评估参数
     */
    public EvaluationReport evaluate(List<BoundingBox> groundTruths, List<BoundingBox> detections,
                                     EvaluationSettings settings) {
        long startTime = System.currentTimeMillis();
        if (settings == null) {
            settings = defaultSettings;
        }
        MetricSelection selection = settings.getSelection();
        List<BoundingBox> gts = prepare(groundTruths, BoxType.GROUND_TRUTH, selection, "groundTruths");
        List<BoundingBox> dets = prepare(detections, BoxType.DETECTED, selection, "detections");

        Map<String, List<BoundingBox>> gtByClass = BoundingBoxes.groupByClass(gts);
        Map<String, List<BoundingBox>> detByClass = BoundingBoxes.groupByClass(dets);
        List<String> classes = new ArrayList<>(new TreeSet<>(gtByClass.keySet()));

        // 先提交全部任务，再按类别顺序收集
        List<Future<ClassApResult>> pascalFutures = Collections.emptyList();
        if (selection.requiresPascal()) {
            PascalVocEvaluator pascalEvaluator = new PascalVocEvaluator(
                new DetectionMatcher(settings.getMatchPolicy()), settings.getInterpolation());
            double iouThreshold = settings.getIouThreshold();
            List<Callable<ClassApResult>> tasks = new ArrayList<>();
            for (String label : classes) {
                List<BoundingBox> classDets = detByClass.getOrDefault(label, List.of());
                tasks.add(() -> pascalEvaluator.evaluateClass(label, gtByClass.get(label), classDets, iouThreshold));
            }
            pascalFutures = submitAll(tasks);
        }

        List<Future<CocoClassEvaluation>> cocoFutures = Collections.emptyList();
        if (selection.requiresCoco()) {
            List<Callable<CocoClassEvaluation>> tasks = new ArrayList<>();
            for (String label : classes) {
                List<BoundingBox> classDets = detByClass.getOrDefault(label, List.of());
                tasks.add(() -> cocoEvaluator.evaluateClass(label, gtByClass.get(label), classDets,
                    selection.getCocoMetrics()));
            }
            cocoFutures = submitAll(tasks);
        }

        PascalVocResult pascalResult = null;
        if (selection.requiresPascal()) {
            List<ClassApResult> results = joinAll(pascalFutures);
            Map<String, ClassApResult> perClass = new LinkedHashMap<>();
            for (int i = 0; i < classes.size(); i++) {
                perClass.put(classes.get(i), results.get(i));
            }
            pascalResult = PascalVocResult.of(perClass);
        }

        CocoSummary cocoSummary = null;
        List<CocoClassEvaluation> cocoClasses = null;
        if (selection.requiresCoco()) {
            cocoClasses = joinAll(cocoFutures);
            cocoSummary = cocoEvaluator.summarize(cocoClasses, selection.getCocoMetrics());
        }

        long duration = System.currentTimeMillis() - startTime;
        EvaluationReport report = summaryProducer.produce(settings, pascalResult, cocoSummary, cocoClasses,
            classes, duration);

        logger.info("Evaluation finished: gts={}, dets={}, classes={}, mAP={}, cocoAP={}, {} ms",
            gts.size(), dets.size(), classes.size(),
            pascalResult != null ? String.format("%.4f", pascalResult.getMeanAveragePrecision()) : "-",
            cocoSummary != null && cocoSummary.get(CocoMetric.AP) != null
                ? String.format("%.4f", cocoSummary.get(CocoMetric.AP)) : "-",
            duration);
        return report;
    }

    public AnnotationStatistics statistics(List<BoundingBox> groundTruths, List<BoundingBox> detections,
                                           MetricSelection selection) {
        MetricSelection effective = selection != null ? selection : MetricSelection.all();
        List<BoundingBox> gts = prepare(groundTruths, BoxType.GROUND_TRUTH, effective, "groundTruths");
        List<BoundingBox> dets = prepare(detections, BoxType.DETECTED, effective, "detections");
        AnnotationStatistics stats = statisticsCalculator.calculate(gts, dets);
        logger.info("Statistics: images={}, gts={}, dets={}, classes={}",
            stats.getImageCount(), stats.getGroundTruthCount(), stats.getDetectionCount(),
            stats.getPerClass().size());
        return stats;
    }

    public EvaluationSettings getDefaultSettings() {
        return defaultSettings;
    }

    public int getParallelism() {
        return parallelism;
    }

    // ==================== 请求转换 ====================

    /**
     * 在默认参数上覆盖请求中设置的参数
     */
    public EvaluationSettings resolveSettings(EvaluationRequest request) {
        EvaluationSettings settings = defaultSettings;
        if (request.getIouThreshold() != null) {
            settings = settings.withIouThreshold(request.getIouThreshold());
        }
        if (request.getInterpolation() != null) {
            settings = settings.withInterpolation(request.getInterpolation());
        }
        if (request.getMatchPolicy() != null) {
            settings = settings.withMatchPolicy(request.getMatchPolicy());
        }

        MetricSelection selection = request.getMetrics() != null && !request.getMetrics().isEmpty()
            ? MetricSelection.parse(request.getMetrics())
            : defaultSettings.getSelection();
        if (request.getClasses() != null && !request.getClasses().isEmpty()) {
            selection = selection.withClasses(request.getClasses());
        }
        return settings.withSelection(selection);
    }

    public List<BoundingBox> toGroundTruths(EvaluationRequest request) {
        return toBoxes(request, request.getGroundTruths(), BoxType.GROUND_TRUTH);
    }

    public List<BoundingBox> toDetections(EvaluationRequest request) {
        return toBoxes(request, request.getDetections(), BoxType.DETECTED);
    }

    private List<BoundingBox> toBoxes(EvaluationRequest request, List<BoxDto> dtos, BoxType type) {
        if (dtos == null) {
            return List.of();
        }
        CoordinateFormat format = request.getCoordinateFormat() != null
            ? request.getCoordinateFormat()
            : CoordinateFormat.XYX2Y2;

        List<BoundingBox> boxes = new ArrayList<>(dtos.size());
        for (int i = 0; i < dtos.size(); i++) {
            BoxDto dto = dtos.get(i);
            String what = (type == BoxType.GROUND_TRUTH ? "ground truth" : "detection") + " #" + i;
            if (dto == null) {
                throw new InvalidBoxException(what + " is null");
            }
            Double confidence = null;
            if (type == BoxType.DETECTED) {
                if (dto.getConfidence() == null) {
                    throw new InvalidBoxException(what + " in image " + dto.getImageId() + " has no confidence");
                }
                confidence = dto.getConfidence();
            }

            double width = 0;
            double height = 0;
            if (format.requiresImageSize()) {
                EvaluationRequest.ImageSize size = request.getImageSizes() != null
                    ? request.getImageSizes().get(dto.getImageId())
                    : null;
                width = dto.getImageWidth() != null ? dto.getImageWidth() : size != null ? size.getWidth() : 0;
                height = dto.getImageHeight() != null ? dto.getImageHeight() : size != null ? size.getHeight() : 0;
            }

            boxes.add(BoundingBoxes.fromFormat(format, dto.getImageId(), dto.getLabel(),
                toArray(dto.getCoordinates(), what), width, height, confidence));
        }
        return boxes;
    }

    private static double[] toArray(List<Double> values, String what) {
        if (values == null) {
            throw new InvalidBoxException(what + " has no coordinates");
        }
        double[] array = new double[values.size()];
        for (int i = 0; i < array.length; i++) {
            Double v = values.get(i);
            if (v == null) {
                throw new InvalidBoxException(what + " has a null coordinate");
            }
            array[i] = v;
        }
        return array;
    }

    /**
     * 统一框类型并按类别过滤
     */
    private static List<BoundingBox> prepare(List<BoundingBox> boxes, BoxType type, MetricSelection selection,
                                             String name) {
        if (boxes == null) {
            throw new IllegalArgumentException(name + " must not be null");
        }
        List<BoundingBox> retagged = BoundingBoxes.retag(boxes, type);
        if (selection.getClasses() == null) {
            return retagged;
        }
        List<BoundingBox> filtered = new ArrayList<>();
        for (BoundingBox box : retagged) {
            if (selection.includesClass(box.getClassLabel())) {
                filtered.add(box);
            }
        }
        return filtered;
    }

    // ==================== 任务执行 ====================

    private <T> List<Future<T>> submitAll(List<Callable<T>> tasks) {
        List<Future<T>> futures = new ArrayList<>(tasks.size());
        for (Callable<T> task : tasks) {
            if (evaluationExecutor == null) {
                FutureTask<T> inline = new FutureTask<>(task);
                inline.run();
                futures.add(inline);
            } else {
                futures.add(evaluationExecutor.submit(task));
            }
        }
        return futures;
    }

    private static <T> List<T> joinAll(List<Future<T>> futures) {
        List<T> results = new ArrayList<>(futures.size());
        for (Future<T> future : futures) {
            try {
                results.add(future.get());
            } catch (ExecutionException e) {
                Throwable cause = e.getCause();
                // 参数错误保持原样，交给调用方处理
                if (cause instanceof IllegalArgumentException) {
                    throw (IllegalArgumentException) cause;
                }
                throw new EvaluationException("Evaluation task failed: " + cause, cause);
            } catch (InterruptedException e) {
                futures.forEach(f -> f.cancel(true));
                Thread.currentThread().interrupt();
                throw new EvaluationException("Evaluation interrupted", e);
            }
        }
        return results;
    }

    @PreDestroy
    public void shutdown() {
        if (evaluationExecutor != null) {
            evaluationExecutor.shutdown();
            try {
                if (!evaluationExecutor.awaitTermination(2, TimeUnit.SECONDS)) {
                    evaluationExecutor.shutdownNow();
                }
            } catch (InterruptedException e) {
                evaluationExecutor.shutdownNow();
                Thread.currentThread().interrupt();
            }
            evaluationExecutor = null;
            logger.info("EvaluationService executor shut down");
        }
    }
}
