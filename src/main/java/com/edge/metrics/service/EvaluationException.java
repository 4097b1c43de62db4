package com.edge.metrics.service;

/**
 * 评估任务执行失败
 */
public class EvaluationException extends RuntimeException {

    public EvaluationException(String message, Throwable cause) {
        super(message, cause);
    }
}
