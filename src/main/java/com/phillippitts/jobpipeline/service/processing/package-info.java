/**
 * Registry of processing functions and decoding of submission parameters into typed payloads.
 *
 * @see com.phillippitts.jobpipeline.service.processing.ProcessingFunction
 * @since 1.0
 */
package com.phillippitts.jobpipeline.service.processing;
