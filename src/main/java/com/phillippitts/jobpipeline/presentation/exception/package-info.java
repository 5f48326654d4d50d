/**
 * Global exception handling that turns pipeline exceptions into {@code ApiError} bodies.
 *
 * <p>Each {@link com.phillippitts.jobpipeline.domain.ErrorKind} maps to one HTTP status;
 * coordination store and upstream outages become 503.
 *
 * @see com.phillippitts.jobpipeline.presentation.exception.GlobalExceptionHandler
 * @since 1.0
 */
package com.phillippitts.jobpipeline.presentation.exception;
