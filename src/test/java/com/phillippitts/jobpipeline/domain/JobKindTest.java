package com.phillippitts.jobpipeline.domain;

import com.phillippitts.jobpipeline.domain.payload.VoicePayload;
import com.phillippitts.jobpipeline.domain.result.CalculationResult;
import com.phillippitts.jobpipeline.exception.ValidationException;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class JobKindTest {

    @ParameterizedTest
    @ValueSource(strings = {"voice", "VOICE", " Voice "})
    void parsesWireValueCaseInsensitively(String value) {
        assertThat(JobKind.fromValue(value)).isEqualTo(JobKind.VOICE);
    }

    @Test
    void rejectsUnknownAndBlankKinds() {
        assertThatThrownBy(() -> JobKind.fromValue("ocr"))
                .isInstanceOf(ValidationException.class)
                .hasMessage("Unsupported job kind: ocr");
        assertThatThrownBy(() -> JobKind.fromValue(" "))
                .isInstanceOf(ValidationException.class)
                .hasMessage("Job kind is required");
    }

    @Test
    void bindsPayloadAndResultTypes() {
        assertThat(JobKind.VOICE.getPayloadType()).isEqualTo(VoicePayload.class);
        assertThat(JobKind.CALCULATE.getResultType()).isEqualTo(CalculationResult.class);
        assertThat(JobKind.DOCUMENT.getProcessingCheckpoint()).isEqualTo(30);
    }
}
