package com.phillippitts.jobpipeline.domain.payload;

import com.phillippitts.jobpipeline.domain.JobKind;

import java.util.Arrays;
import java.util.Objects;

/**
 * Audio to transcribe and the form field the spoken value should fill.
 *
 * @param audio       raw audio bytes (serialized as base64 in JSON)
 * @param targetField form field the transcription targets, e.g. "income"
 * @param formType    tax form identifier
 * @param language    speech language, "vi" unless specified
 */
public record VoicePayload(byte[] audio, String targetField, String formType, String language)
        implements JobPayload {

    public static final String DEFAULT_LANGUAGE = "vi";

    public VoicePayload {
        Objects.requireNonNull(audio, "audio");
        Objects.requireNonNull(targetField, "targetField");
        Objects.requireNonNull(formType, "formType");
        language = (language == null || language.isBlank()) ? DEFAULT_LANGUAGE : language;
    }

    @Override
    public JobKind kind() {
        return JobKind.VOICE;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof VoicePayload other)) {
            return false;
        }
        return Arrays.equals(audio, other.audio)
                && targetField.equals(other.targetField)
                && formType.equals(other.formType)
                && language.equals(other.language);
    }

    @Override
    public int hashCode() {
        return Objects.hash(Arrays.hashCode(audio), targetField, formType, language);
    }

    @Override
    public String toString() {
        return "VoicePayload[audio=" + audio.length + " bytes, targetField=" + targetField
                + ", formType=" + formType + ", language=" + language + "]";
    }
}
