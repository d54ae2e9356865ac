package com.ckpt.worker;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

// The worker halts itself separately; this only reports the failure to whatever restarts it
public class LoggingFailureHandler implements WorkerFailureHandler {

    private static final Logger log = LoggerFactory.getLogger(LoggingFailureHandler.class);

    @Override
    public void onFatalError(String workerId, Throwable cause) {
        log.error("Worker {} hit a fatal error and must be restarted", workerId, cause);
    }
}
