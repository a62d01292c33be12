package com.bit.chainsim.exception;

/**
 * 模拟层统一异常：封装异常类型与错误信息，便于问题定位
 */
public class SimulationException extends RuntimeException {

    // 异常类型（用于分类处理）
    private final ErrorType errorType;

    public SimulationException(ErrorType errorType, String message) {
        super("[" + errorType.getDesc() + "]：" + message);
        this.errorType = errorType;
    }

    public SimulationException(ErrorType errorType, String message, Throwable cause) {
        super("[" + errorType.getDesc() + "]：" + message, cause);
        this.errorType = errorType;
    }

    public ErrorType getErrorType() {
        return errorType;
    }
}
