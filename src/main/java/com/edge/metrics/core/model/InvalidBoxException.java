package com.edge.metrics.core.model;

/**
 * 非法的边界框输入
 * <p>
 * 在入口处同步抛出，计算过程中不会再出现
 */
public class InvalidBoxException extends IllegalArgumentException {

    public InvalidBoxException(String message) {
        super(message);
    }
}
