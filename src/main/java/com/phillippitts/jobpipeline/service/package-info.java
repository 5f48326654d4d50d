/**
 * Service layer containing the job pipeline's business logic.
 *
 * <p>Service Sub-packages:
 * <ul>
 *   <li>{@code service.job} - submission, queueing, state transitions and workers</li>
 *   <li>{@code service.processing} - processing function registry and payload decoding</li>
 *   <li>{@code service.maintenance} - cleanup, reconciliation and statistics schedules</li>
 *   <li>{@code service.session}, {@code service.ratelimit}, {@code service.cache} - small
 *       stores built on the coordination store</li>
 * </ul>
 *
 * <p>Services are constructor-injected Spring beans, safe for concurrent use, and throw
 * pipeline exceptions rather than HTTP-specific ones.
 *
 * @since 1.0
 */
package com.phillippitts.jobpipeline.service;
