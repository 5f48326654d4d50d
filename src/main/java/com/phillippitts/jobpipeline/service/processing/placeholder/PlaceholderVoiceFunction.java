package com.phillippitts.jobpipeline.service.processing.placeholder;

import com.phillippitts.jobpipeline.domain.JobKind;
import com.phillippitts.jobpipeline.domain.payload.VoicePayload;
import com.phillippitts.jobpipeline.domain.result.VoiceResult;
import com.phillippitts.jobpipeline.service.job.ProgressReporter;
import com.phillippitts.jobpipeline.service.processing.ProcessingFunction;

/**
 * Stand-in speech recognizer that returns a fixed transcription.
 */
public class PlaceholderVoiceFunction implements ProcessingFunction<VoicePayload, VoiceResult> {

    @Override
    public JobKind kind() {
        return JobKind.VOICE;
    }

    @Override
    public Class<VoicePayload> payloadType() {
        return VoicePayload.class;
    }

    @Override
    public VoiceResult process(VoicePayload payload, ProgressReporter reporter) {
        long start = System.nanoTime();
        return new VoiceResult("Mười triệu đồng", "10000000", 95, (System.nanoTime() - start) / 1_000_000);
    }
}
