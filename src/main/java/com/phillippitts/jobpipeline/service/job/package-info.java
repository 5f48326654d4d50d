/**
 * Job submission, queueing and execution.
 *
 * <p>{@link com.phillippitts.jobpipeline.service.job.JobService} records a job and schedules
 * it on the run queue. Workers started by
 * {@link com.phillippitts.jobpipeline.service.job.JobWorkerPool} poll the queue, claim a job
 * with a compare-and-set on its state and run it through the processing adapter.
 *
 * <p>All state changes go through
 * {@link com.phillippitts.jobpipeline.service.job.JobStateMachine}, which only writes when the
 * stored state still matches the expected one. A cancelled job therefore never receives a
 * late result or progress update.
 *
 * @since 1.0
 */
package com.phillippitts.jobpipeline.service.job;
