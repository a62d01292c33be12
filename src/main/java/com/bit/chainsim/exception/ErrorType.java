package com.bit.chainsim.exception;

public enum ErrorType {
    CONFIG_INVALID("模拟配置无效（参数非法/共识与参数组合非法）"),
    TOPOLOGY_DISCONNECTED("网络拓扑不连通（存在不可达节点）"),
    EMPTY_QUEUE("事件队列为空（调度循环未检查终止条件）"),
    RUN_NOT_FOUND("模拟运行记录不存在或已过期");

    private final String desc;

    ErrorType(String desc) {
        this.desc = desc;
    }

    public String getDesc() {
        return desc;
    }
}
