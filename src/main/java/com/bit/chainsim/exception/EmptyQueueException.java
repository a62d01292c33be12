package com.bit.chainsim.exception;

public class EmptyQueueException extends SimulationException {

    public EmptyQueueException() {
        super(ErrorType.EMPTY_QUEUE, "popNext() 调用前应先检查 isEmpty()");
    }
}
