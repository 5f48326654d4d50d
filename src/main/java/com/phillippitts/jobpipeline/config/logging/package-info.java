/**
 * Log4j2 ThreadContext (MDC) propagation for requests and background work.
 *
 * <p>Key Components:
 * <ul>
 *   <li>{@link com.phillippitts.jobpipeline.config.logging.MdcFilter} - servlet filter that puts
 *       {@code requestId}, {@code userId} and, for job URLs, {@code jobId} into the context</li>
 *   <li>{@link com.phillippitts.jobpipeline.config.logging.MdcTaskDecorator} - copies the
 *       submitting thread's context onto pooled processing threads</li>
 * </ul>
 *
 * <p>Workers add {@code jobId}, {@code jobKind} and {@code ownerId} while a job attempt runs.
 *
 * @see org.apache.logging.log4j.ThreadContext
 * @since 1.0
 */
package com.phillippitts.jobpipeline.config.logging;
