package io.stagewise.server.security;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.InstanceOfAssertFactories.MAP;

import io.stagewise.core.session.SessionNotFoundException;
import io.stagewise.core.session.SessionStateException;
import jakarta.ws.rs.NotFoundException;
import jakarta.ws.rs.WebApplicationException;
import jakarta.ws.rs.core.Response;
import org.assertj.core.api.MapAssert;
import org.junit.jupiter.api.Test;

class GlobalExceptionMapperTest {

    private final GlobalExceptionMapper mapper = new GlobalExceptionMapper();

    @Test
    void shouldMapMissingSessionTo404() {
        assertBody(mapper.toResponse(new SessionNotFoundException("s-1")), 404)
                .containsEntry("error", "Session not found: s-1");
    }

    @Test
    void shouldMapStateConflictTo409() {
        assertBody(mapper.toResponse(new SessionStateException("Session s-1 is already running")), 409)
                .containsEntry("error", "Session s-1 is already running")
                .containsEntry("status", 409);
    }

    @Test
    void shouldMapIllegalArgumentTo400() {
        assertBody(mapper.toResponse(new IllegalArgumentException("Data file not found: x.csv")), 400)
                .containsEntry("error", "Data file not found: x.csv");
    }

    @Test
    void shouldHideNotFoundDetails() {
        assertBody(mapper.toResponse(new NotFoundException("/internal/path")), 404)
                .containsEntry("error", "Resource not found");
    }

    @Test
    void shouldHideServerErrorDetails() {
        assertBody(mapper.toResponse(new WebApplicationException("db password wrong", 503)), 503)
                .containsEntry("error", "Internal server error");
    }

    @Test
    void shouldMapUnexpectedExceptionsTo500() {
        assertBody(mapper.toResponse(new IllegalStateException("stack details")), 500)
                .containsEntry("error", "Internal server error");
    }

    private static MapAssert<Object, Object> assertBody(Response response, int expectedStatus) {
        try (response) {
            assertThat(response.getStatus()).isEqualTo(expectedStatus);
            return assertThat(response.getEntity()).asInstanceOf(MAP);
        }
    }
}
