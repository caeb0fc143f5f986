package com.yerin.pipeline.application;

import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

@Slf4j
@Component
public class ProcessorRegistry {
    private final Processor active;

    public ProcessorRegistry(List<Processor> processors,
                             @Value("${pipeline.processor.type:noop}") String type) {
        Map<String, Processor> map = processors.stream().collect(Collectors.toMap(Processor::name, p -> p));
        this.active = map.get(type);
        if (active == null) {
            throw new IllegalStateException("unknown pipeline.processor.type=" + type + ", known=" + map.keySet());
        }
        log.info("[Processor] active processor={}", type);
    }

    public Processor active() { return active; }
}
