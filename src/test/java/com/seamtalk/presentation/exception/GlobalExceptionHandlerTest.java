package com.seamtalk.presentation.exception;

import com.seamtalk.exception.CollaboratorExceptionBuilder;
import com.seamtalk.exception.InvalidRequestException;
import com.seamtalk.exception.MissingCredentialsException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpMethod;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.mock.http.MockHttpInputMessage;
import org.springframework.web.HttpMediaTypeNotSupportedException;
import org.springframework.web.HttpRequestMethodNotSupportedException;
import org.springframework.web.servlet.resource.NoResourceFoundException;

import java.time.Instant;

import static org.assertj.core.api.Assertions.assertThat;

class GlobalExceptionHandlerTest {

    private GlobalExceptionHandler handler;

    @BeforeEach
    void setUp() {
        handler = new GlobalExceptionHandler();
    }

    @Test
    void invalidRequestReturns400WithMessage() {
        ResponseEntity<GlobalExceptionHandler.ApiError> response =
                handler.handleInvalidRequest(new InvalidRequestException("Missing required fields: text, lang"));

        assertThat(response.getStatusCode()).isEqualTo(HttpStatus.BAD_REQUEST);
        assertThat(response.getBody()).isNotNull();
        assertThat(response.getBody().error()).isEqualTo("Missing required fields: text, lang");
        assertThat(response.getBody().detail()).isNull();
    }

    @Test
    void unreadableBodyReturns400() {
        HttpMessageNotReadableException ex = new HttpMessageNotReadableException("JSON parse error",
                new IllegalStateException("Unexpected character"), new MockHttpInputMessage(new byte[0]));

        ResponseEntity<GlobalExceptionHandler.ApiError> response = handler.handleUnreadable(ex);

        assertThat(response.getStatusCode()).isEqualTo(HttpStatus.BAD_REQUEST);
        assertThat(response.getBody().error()).isEqualTo("Malformed JSON request body");
    }

    @Test
    void missingCredentialsReturns500NamingVariable() {
        ResponseEntity<GlobalExceptionHandler.ApiError> response =
                handler.handleMissingCredentials(new MissingCredentialsException("DOUBAO_API_KEY"));

        assertThat(response.getStatusCode()).isEqualTo(HttpStatus.INTERNAL_SERVER_ERROR);
        assertThat(response.getBody().error()).isEqualTo("Missing env DOUBAO_API_KEY");
    }

    @Test
    void providerStatusReturns502WithBodyAsDetail() {
        ResponseEntity<GlobalExceptionHandler.ApiError> response = handler.handleCollaborator(
                CollaboratorExceptionBuilder.translation("Doubao error: 503")
                        .provider("doubao")
                        .status(503)
                        .responseBody("{\"error\":\"overloaded\"}")
                        .build());

        assertThat(response.getStatusCode()).isEqualTo(HttpStatus.BAD_GATEWAY);
        assertThat(response.getBody().error()).isEqualTo("Doubao error: 503");
        assertThat(response.getBody().detail()).isEqualTo("{\"error\":\"overloaded\"}");
    }

    @Test
    void providerUnreachableReturns500() {
        ResponseEntity<GlobalExceptionHandler.ApiError> response = handler.handleCollaborator(
                CollaboratorExceptionBuilder.synthesis("TTS failed: connect timed out")
                        .provider("dashscope")
                        .build());

        assertThat(response.getStatusCode()).isEqualTo(HttpStatus.INTERNAL_SERVER_ERROR);
        assertThat(response.getBody().error()).isEqualTo("TTS failed: connect timed out");
        assertThat(response.getBody().detail()).isNull();
    }

    @Test
    void unknownPathReturns404() {
        ResponseEntity<GlobalExceptionHandler.ApiError> response =
                handler.handleFrameworkRejection(new NoResourceFoundException(HttpMethod.GET, "api/v1/other"));

        assertThat(response.getStatusCode().value()).isEqualTo(404);
        assertThat(response.getBody().error()).isEqualTo("Not Found");
        assertThat(response.getBody().detail()).contains("api/v1/other");
    }

    @Test
    void wrongMethodReturns405() {
        ResponseEntity<GlobalExceptionHandler.ApiError> response =
                handler.handleFrameworkRejection(new HttpRequestMethodNotSupportedException("GET"));

        assertThat(response.getStatusCode().value()).isEqualTo(405);
        assertThat(response.getBody().error()).isEqualTo("Method Not Allowed");
    }

    @Test
    void wrongMediaTypeReturns415() {
        HttpMediaTypeNotSupportedException ex =
                new HttpMediaTypeNotSupportedException("Content-Type 'text/plain' is not supported");

        ResponseEntity<GlobalExceptionHandler.ApiError> response = handler.handleFrameworkRejection(ex);

        assertThat(response.getStatusCode().value()).isEqualTo(415);
        assertThat(response.getBody().error()).isEqualTo("Unsupported Media Type");
    }

    @Test
    void unexpectedErrorDoesNotLeakMessage() {
        ResponseEntity<GlobalExceptionHandler.ApiError> response =
                handler.handleUnexpected(new IllegalStateException("/secret/internal/path"));

        assertThat(response.getStatusCode()).isEqualTo(HttpStatus.INTERNAL_SERVER_ERROR);
        assertThat(response.getBody().error()).isEqualTo("An unexpected error occurred");
        assertThat(response.getBody().toString()).doesNotContain("/secret/internal/path");
    }

    @Test
    void errorsCarryRecentTimestamp() {
        Instant before = Instant.now().minusSeconds(1);

        ResponseEntity<GlobalExceptionHandler.ApiError> response =
                handler.handleInvalidRequest(new InvalidRequestException("bad"));

        assertThat(response.getBody().timestamp()).isAfter(before).isBefore(Instant.now().plusSeconds(1));
    }
}
