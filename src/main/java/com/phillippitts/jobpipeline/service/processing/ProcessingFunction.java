package com.phillippitts.jobpipeline.service.processing;

import com.phillippitts.jobpipeline.domain.JobKind;
import com.phillippitts.jobpipeline.domain.payload.JobPayload;
import com.phillippitts.jobpipeline.domain.result.JobResult;
import com.phillippitts.jobpipeline.service.job.ProgressReporter;

/**
 * Externally supplied AI operation for one job kind.
 *
 * <p>Implementations report progress through the reporter at natural checkpoints, which
 * is also where cancellation and the soft deadline take effect. Throw
 * {@link com.phillippitts.jobpipeline.exception.UpstreamUnavailableException} for
 * transient network failures so the job is retried; any other failure is final.
 *
 * @param <P> payload type of {@link #kind()}
 * @param <R> result type of {@link #kind()}
 */
public interface ProcessingFunction<P extends JobPayload, R extends JobResult> {

    JobKind kind();

    /** Payload class of {@link #kind()}; must equal {@code kind().getPayloadType()}. */
    Class<P> payloadType();

    R process(P payload, ProgressReporter reporter);
}
