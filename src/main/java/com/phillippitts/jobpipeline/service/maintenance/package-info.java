/**
 * Scheduled maintenance: the daily job sweep, stranded-job reconciliation and the weekly
 * statistics snapshot.
 *
 * @since 1.0
 */
package com.phillippitts.jobpipeline.service.maintenance;
