package com.phillippitts.jobpipeline.domain.payload;

import com.phillippitts.jobpipeline.domain.JobKind;

import java.util.Arrays;
import java.util.List;
import java.util.Objects;

/**
 * Scanned document and the fields to extract from it.
 *
 * @param document            raw document bytes (image or PDF)
 * @param fieldSpecifications names of the fields to extract
 * @param documentType        document category, e.g. "salary_certificate"
 * @param formType            tax form the extracted values are destined for
 */
public record DocumentPayload(byte[] document,
                              List<String> fieldSpecifications,
                              String documentType,
                              String formType) implements JobPayload {

    public DocumentPayload {
        Objects.requireNonNull(document, "document");
        Objects.requireNonNull(documentType, "documentType");
        Objects.requireNonNull(formType, "formType");
        fieldSpecifications = fieldSpecifications == null ? List.of() : List.copyOf(fieldSpecifications);
    }

    @Override
    public JobKind kind() {
        return JobKind.DOCUMENT;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof DocumentPayload other)) {
            return false;
        }
        return Arrays.equals(document, other.document)
                && fieldSpecifications.equals(other.fieldSpecifications)
                && documentType.equals(other.documentType)
                && formType.equals(other.formType);
    }

    @Override
    public int hashCode() {
        return Objects.hash(Arrays.hashCode(document), fieldSpecifications, documentType, formType);
    }

    @Override
    public String toString() {
        return "DocumentPayload[document=" + document.length + " bytes, fields=" + fieldSpecifications
                + ", documentType=" + documentType + ", formType=" + formType + "]";
    }
}
