package com.ckpt.worker;

import com.ckpt.log.LogEvent;

import java.util.Map;

public interface EventProcessor {

    void process(LogEvent event, Map<String, String> partitionState);

    static EventProcessor lastValueWins() {
        return (event, state) -> state.put(event.getKey(), event.getPayload());
    }
}
