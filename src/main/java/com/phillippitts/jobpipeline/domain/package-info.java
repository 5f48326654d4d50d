/**
 * Domain model of the job pipeline.
 *
 * <p>All types are immutable records or enums with no persistence concerns:
 * <ul>
 *   <li>{@link com.phillippitts.jobpipeline.domain.Job} - a job record, including its
 *       payload, progress, attempts and outcome</li>
 *   <li>{@link com.phillippitts.jobpipeline.domain.JobState} - the lifecycle states and their
 *       allowed transitions</li>
 *   <li>{@link com.phillippitts.jobpipeline.domain.JobStatus} - the client-facing view of a job</li>
 *   <li>{@link com.phillippitts.jobpipeline.domain.JobLifecycleEvent} - published on every
 *       state transition</li>
 * </ul>
 *
 * @since 1.0
 */
package com.phillippitts.jobpipeline.domain;
