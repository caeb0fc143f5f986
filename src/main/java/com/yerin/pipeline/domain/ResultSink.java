package com.yerin.pipeline.domain;

/**
 * Persists a processor result. Called before the job is marked completed, so a failure here
 * can still fail the job.
 */
public interface ResultSink {

    void store(Job job, ProcessingResult result);
}
