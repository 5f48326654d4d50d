/**
 * REST controllers under {@code /api/v1}.
 *
 * <ul>
 *   <li>{@link com.phillippitts.jobpipeline.presentation.controller.JobController} - submit,
 *       poll, list and cancel jobs</li>
 *   <li>{@link com.phillippitts.jobpipeline.presentation.controller.SessionController} - create
 *       and delete sessions</li>
 *   <li>{@link com.phillippitts.jobpipeline.presentation.controller.StatisticsController} - latest
 *       per-kind job statistics</li>
 * </ul>
 *
 * <p>Callers identify themselves with {@code X-User-ID} or an {@code X-Session-ID} header,
 * resolved by {@link com.phillippitts.jobpipeline.presentation.controller.RequesterResolver}.
 *
 * @since 1.0
 */
package com.phillippitts.jobpipeline.presentation.controller;
