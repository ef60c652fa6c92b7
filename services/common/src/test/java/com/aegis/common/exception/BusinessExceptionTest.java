package com.aegis.common.exception;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@DisplayName("BusinessException Tests")
class BusinessExceptionTest {

    @Test
    @DisplayName("Should prefix message with error code")
    void shouldPrefixMessageWithErrorCode() {
        BusinessException exception = new BusinessException(ErrorCode.SCR_TIMEOUT, "payment P-1 timed out");

        assertThat(exception.getMessage()).isEqualTo("[SCR_003] payment P-1 timed out");
        assertThat(exception.getErrorCode()).isEqualTo(ErrorCode.SCR_TIMEOUT);
        assertThat(exception.getErrorId()).isNotBlank();
    }

    @Test
    @DisplayName("Should fall back to default message")
    void shouldFallBackToDefaultMessage() {
        BusinessException exception = new BusinessException(ErrorCode.VAL_REQUIRED_FIELD, (String) null);

        assertThat(exception.getMessage()).isEqualTo("[VAL_001] Required field is missing");
        assertThat(exception.getErrorCode().isClientError()).isTrue();
    }

    @Test
    @DisplayName("Should ignore null metadata and expose read-only view")
    void shouldExposeReadOnlyMetadata() {
        BusinessException exception = new BusinessException(ErrorCode.SCR_MALFORMED_RECORD, "bad record",
            Map.of("listName", "OFAC SDN List"))
            .withMetadata("recordName", "John Smith")
            .withMetadata("ignored", null);

        assertThat(exception.getMetadata())
            .containsEntry("listName", "OFAC SDN List")
            .containsEntry("recordName", "John Smith")
            .doesNotContainKey("ignored");
        assertThatThrownBy(() -> exception.getMetadata().put("x", "y"))
            .isInstanceOf(UnsupportedOperationException.class);
    }

    @Test
    @DisplayName("Should resolve unknown codes to internal error")
    void shouldResolveUnknownCodes() {
        assertThat(ErrorCode.fromCode("SCR_002")).isEqualTo(ErrorCode.SCR_SIMILARITY_UNAVAILABLE);
        assertThat(ErrorCode.fromCode("NOPE")).isEqualTo(ErrorCode.SYS_INTERNAL_ERROR);
    }
}
