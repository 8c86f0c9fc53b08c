package io.stagewise.server.validation;

import jakarta.validation.ConstraintViolation;
import jakarta.validation.ConstraintViolationException;
import jakarta.validation.Path;
import jakarta.ws.rs.core.MediaType;
import jakarta.ws.rs.core.Response;
import jakarta.ws.rs.ext.ExceptionMapper;
import jakarta.ws.rs.ext.Provider;
import java.util.Map;
import java.util.stream.Collectors;
import org.jboss.logging.Logger;

/// Maps Bean Validation constraint violations to HTTP 400 JSON responses in the format of
/// {@link io.stagewise.server.security.GlobalExceptionMapper}.
///
/// ```json
/// {"error": "objective: must not be blank", "status": 400}
/// ```
@Provider
public class ConstraintViolationExceptionMapper implements ExceptionMapper<ConstraintViolationException> {

    private static final Logger LOG = Logger.getLogger(ConstraintViolationExceptionMapper.class);

    @Override
    public Response toResponse(ConstraintViolationException exception) {
        String message = exception.getConstraintViolations().stream()
                .map(v -> leafName(v) + ": " + v.getMessage())
                .sorted()
                .collect(Collectors.joining("; "));

        LOG.debugv("Validation error: {0}", message);

        return Response.status(400)
                .type(MediaType.APPLICATION_JSON)
                .entity(Map.of("error", message, "status", 400))
                .build();
    }

    /// Leaf of the property path: `paramName` for `method.paramName`, the field name for beans.
    private static String leafName(ConstraintViolation<?> violation) {
        String name = null;
        for (Path.Node node : violation.getPropertyPath()) {
            name = node.getName();
        }
        return name != null ? name : "unknown";
    }
}
