package com.phillippitts.leaderkey.presentation.exception;

import com.phillippitts.leaderkey.exception.ConfigDecodeException;
import com.phillippitts.leaderkey.exception.ConfigReadException;
import com.phillippitts.leaderkey.exception.ConfigWriteException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;

import java.io.IOException;
import java.nio.file.Path;

import static org.assertj.core.api.Assertions.assertThat;

class GlobalExceptionHandlerTest {

    private GlobalExceptionHandler handler;

    @BeforeEach
    void setUp() {
        handler = new GlobalExceptionHandler();
    }

    @Test
    void verifiesDecodeErrorReturns400WithReason() {
        ResponseEntity<?> response = handler.handleDecode(new ConfigDecodeException("missing 'value' at $.actions[0]"));

        assertThat(response.getStatusCode()).isEqualTo(HttpStatus.BAD_REQUEST);
        assertThat(response.getBody()).isNotNull();
        assertThat(response.getBody().toString())
                .contains("ConfigDecodeException")
                .contains("missing 'value' at $.actions[0]");
    }

    @Test
    void verifiesIllegalArgumentReturns400() {
        ResponseEntity<?> response = handler.handleBadRequest(new IllegalArgumentException("Unknown modifier: 'HYPER'"));

        assertThat(response.getStatusCode()).isEqualTo(HttpStatus.BAD_REQUEST);
        assertThat(response.getBody().toString()).contains("Unknown modifier");
    }

    @Test
    void verifiesConfigIoErrorsReturn503WithoutPaths() {
        Path file = Path.of("/Users/someone/.config/leader-key/config.json");

        ResponseEntity<?> read = handler.handleConfigIo(new ConfigReadException(file, new IOException("denied")));
        ResponseEntity<?> write = handler.handleConfigIo(new ConfigWriteException(file, new IOException("disk full")));

        assertThat(read.getStatusCode()).isEqualTo(HttpStatus.SERVICE_UNAVAILABLE);
        assertThat(write.getStatusCode()).isEqualTo(HttpStatus.SERVICE_UNAVAILABLE);
        assertThat(read.getBody().toString()).contains("ConfigReadException").doesNotContain("/Users/someone");
    }

    @Test
    void verifiesUnexpectedErrorReturns500() {
        ResponseEntity<?> response = handler.handleUnexpected(new IllegalStateException("boom"));

        assertThat(response.getStatusCode()).isEqualTo(HttpStatus.INTERNAL_SERVER_ERROR);
        assertThat(response.getBody().toString())
                .contains("InternalServerError")
                .doesNotContain("boom");
    }
}
