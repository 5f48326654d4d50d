/**
 * Presentation layer (REST API controllers and exception handling).
 *
 * <p>This package is the HTTP boundary of the application. Presentation depends on the
 * service layer, never the other way around.
 *
 * <p>Sub-packages:
 * <ul>
 *   <li>{@code presentation.controller} - job, session and statistics endpoints</li>
 *   <li>{@code presentation.dto} - request and response bodies of the API</li>
 *   <li>{@code presentation.exception} - mapping of pipeline exceptions to HTTP responses</li>
 * </ul>
 *
 * <p>Controllers are thin adapters: they resolve the caller, apply the submission rate limit
 * and delegate to services. Business failures surface as
 * {@link com.phillippitts.jobpipeline.exception.JobPipelineException} subclasses.
 *
 * @see com.phillippitts.jobpipeline.presentation.exception.GlobalExceptionHandler
 * @since 1.0
 */
package com.phillippitts.jobpipeline.presentation;
