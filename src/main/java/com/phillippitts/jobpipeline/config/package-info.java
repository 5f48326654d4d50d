/**
 * Spring configuration: the application clock, the processing thread pool and the
 * placeholder processing functions used until real ones are registered.
 *
 * @since 1.0
 */
package com.phillippitts.jobpipeline.config;
