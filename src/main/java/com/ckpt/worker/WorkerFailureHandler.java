package com.ckpt.worker;

public interface WorkerFailureHandler {

    void onFatalError(String workerId, Throwable cause);
}
