package com.bit.chainsim.exception;

/**
 * 拓扑构建后可达性检查失败
 */
public class DisconnectedTopologyException extends ConfigurationException {

    private final int reachable;
    private final int total;

    public DisconnectedTopologyException(int reachable, int total) {
        super(ErrorType.TOPOLOGY_DISCONNECTED, "从起始节点仅可达 " + reachable + "/" + total + " 个节点");
        this.reachable = reachable;
        this.total = total;
    }

    public int getReachable() {
        return reachable;
    }

    public int getTotal() {
        return total;
    }
}
