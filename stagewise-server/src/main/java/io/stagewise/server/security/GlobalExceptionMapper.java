package io.stagewise.server.security;

import io.stagewise.core.session.SessionNotFoundException;
import io.stagewise.core.session.SessionStateException;
import jakarta.ws.rs.WebApplicationException;
import jakarta.ws.rs.core.MediaType;
import jakarta.ws.rs.core.Response;
import jakarta.ws.rs.ext.ExceptionMapper;
import jakarta.ws.rs.ext.Provider;
import java.util.Map;
import org.jboss.logging.Logger;

/// Global exception mapper that keeps stack traces away from clients.
///
/// ### Mapping
/// | Exception | Status |
/// |-----------|--------|
/// | {@link SessionNotFoundException} | 404 |
/// | {@link SessionStateException} | 409 |
/// | `IllegalArgumentException` | 400 |
/// | `WebApplicationException` | its own status |
/// | anything else | 500 |
///
/// ### Response Format
/// ```json
/// {"error": "Human-readable message", "status": 409}
/// ```
///
/// @implNote Thread-safe. Stateless.
@Provider
public class GlobalExceptionMapper implements ExceptionMapper<Throwable> {

    private static final Logger LOG = Logger.getLogger(GlobalExceptionMapper.class);

    @Override
    public Response toResponse(Throwable exception) {
        if (exception instanceof SessionNotFoundException notFound) {
            LOG.debugv("Session not found: {0}", notFound.getSessionId());
            return json(404, exception.getMessage());
        }
        if (exception instanceof SessionStateException) {
            LOG.debugv("Session state conflict: {0}", exception.getMessage());
            return json(409, exception.getMessage());
        }
        if (exception instanceof IllegalArgumentException) {
            LOG.debugv("Bad request: {0}", exception.getMessage());
            return json(400, exception.getMessage() != null ? exception.getMessage() : "Bad request");
        }
        if (exception instanceof WebApplicationException wae) {
            int status = wae.getResponse().getStatus();
            String message = sanitize(status, wae.getMessage());
            if (status >= 500) {
                LOG.errorv(exception, "Server error: {0}", message);
            } else {
                LOG.debugv("Client error {0}: {1}", status, message);
            }
            return json(status, message);
        }

        LOG.errorv(exception, "Unhandled exception: {0}", exception.getMessage());
        return json(500, "Internal server error");
    }

    private static Response json(int status, String message) {
        return Response.status(status)
                .type(MediaType.APPLICATION_JSON)
                .entity(Map.of("error", message, "status", status))
                .build();
    }

    private static String sanitize(int status, String raw) {
        return switch (status) {
            case 400 -> raw != null ? raw : "Bad request";
            case 401 -> "Authentication required";
            case 403 -> "Access denied";
            case 404 -> "Resource not found";
            case 405 -> "Method not allowed";
            case 409 -> "Conflict";
            case 415 -> "Unsupported media type";
            default -> {
                if (status >= 500) yield "Internal server error";
                yield raw != null ? raw : "Request failed";
            }
        };
    }
}
