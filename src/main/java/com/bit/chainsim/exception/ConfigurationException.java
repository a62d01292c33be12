package com.bit.chainsim.exception;

/**
 * 配置错误：在模拟开始前抛出，属于致命错误
 */
public class ConfigurationException extends SimulationException {

    public ConfigurationException(String message) {
        super(ErrorType.CONFIG_INVALID, message);
    }

    protected ConfigurationException(ErrorType errorType, String message) {
        super(errorType, message);
    }
}
