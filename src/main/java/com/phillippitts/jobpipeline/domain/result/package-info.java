/**
 * Typed processing results, one per {@link com.phillippitts.jobpipeline.domain.JobKind}.
 */
package com.phillippitts.jobpipeline.domain.result;
