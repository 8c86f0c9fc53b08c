package io.stagewise.server.validation;

import static java.lang.annotation.ElementType.FIELD;
import static java.lang.annotation.ElementType.PARAMETER;
import static java.lang.annotation.ElementType.TYPE_USE;
import static java.lang.annotation.RetentionPolicy.RUNTIME;

import jakarta.validation.Constraint;
import jakarta.validation.Payload;
import java.lang.annotation.Documented;
import java.lang.annotation.Retention;
import java.lang.annotation.Target;

/// Validates that a string is a safe session identifier for path parameters and DTO fields.
///
/// A valid identifier starts with an alphanumeric character, contains only alphanumerics,
/// dots, hyphens and underscores, and is at most 255 characters long. Session ids double as
/// directory names in the file checkpoint store, so anything else is rejected at the API
/// boundary.
///
/// @see ValidSessionIdValidator
@Target({FIELD, PARAMETER, TYPE_USE})
@Retention(RUNTIME)
@Constraint(validatedBy = ValidSessionIdValidator.class)
@Documented
public @interface ValidSessionId {

    String message() default
            "must be a valid session id (alphanumeric, dots, hyphens, underscores; 1-255 chars)";

    Class<?>[] groups() default {};

    Class<? extends Payload>[] payload() default {};
}
