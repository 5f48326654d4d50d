package com.phillippitts.jobpipeline.domain.result;

import com.phillippitts.jobpipeline.domain.JobKind;

/**
 * Transcription of a spoken form value.
 *
 * @param transcribedText  recognized text as spoken
 * @param extractedValue   normalized value for the target field
 * @param confidenceScore  0-100
 * @param processingTimeMs time spent by the processing function
 */
public record VoiceResult(String transcribedText,
                          String extractedValue,
                          int confidenceScore,
                          long processingTimeMs) implements JobResult {

    @Override
    public JobKind kind() {
        return JobKind.VOICE;
    }
}
