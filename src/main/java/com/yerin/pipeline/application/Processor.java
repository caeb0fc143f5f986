package com.yerin.pipeline.application;

import com.yerin.pipeline.domain.Job;
import com.yerin.pipeline.domain.ProcessingResult;

/**
 * The processing stage run for a job. Implementations are selected by
 * {@code pipeline.processor.type}.
 */
public interface Processor {

    String name();

    /**
     * @return the result; a {@code null} result or summary fails validation
     * @throws ProcessorException for failures the processor can classify
     */
    ProcessingResult process(Job job) throws ProcessorException;
}
