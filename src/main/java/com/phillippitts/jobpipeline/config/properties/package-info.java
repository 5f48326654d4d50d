/**
 * Type-safe {@code @ConfigurationProperties} bound from {@code application.properties}.
 * Classes annotated {@code @Validated} are checked at startup with Jakarta Validation.
 *
 * <p>Prefixes: {@code jobs}, {@code threadpool}, {@code ratelimit}, {@code session}
 * and {@code authorization}.
 *
 * @since 1.0
 */
package com.phillippitts.jobpipeline.config.properties;
