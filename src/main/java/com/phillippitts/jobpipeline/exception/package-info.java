/**
 * Application-specific exception hierarchy.
 *
 * <p>Every exception extends
 * {@link com.phillippitts.jobpipeline.exception.JobPipelineException} and carries an
 * {@link com.phillippitts.jobpipeline.domain.ErrorKind}. The kind decides both the HTTP status
 * returned to API callers and whether a failed job attempt is retried.
 *
 * <p>Retryable kinds:
 * <ul>
 *   <li>{@link com.phillippitts.jobpipeline.exception.StoreUnavailableException} - the
 *       coordination store could not be reached</li>
 *   <li>{@link com.phillippitts.jobpipeline.exception.UpstreamUnavailableException} - a network
 *       dependency of a processing function failed, or processing was interrupted</li>
 * </ul>
 *
 * @see com.phillippitts.jobpipeline.presentation.exception.GlobalExceptionHandler
 * @since 1.0
 */
package com.phillippitts.jobpipeline.exception;
