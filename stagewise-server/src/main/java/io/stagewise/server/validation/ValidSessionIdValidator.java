package io.stagewise.server.validation;

import jakarta.validation.ConstraintValidator;
import jakarta.validation.ConstraintValidatorContext;
import java.util.regex.Pattern;

/// @see ValidSessionId
public class ValidSessionIdValidator implements ConstraintValidator<ValidSessionId, String> {

    private static final Pattern ID_PATTERN = Pattern.compile("[a-zA-Z0-9][a-zA-Z0-9._-]{0,254}");

    @Override
    public boolean isValid(String value, ConstraintValidatorContext context) {
        return isValid(value);
    }

    static boolean isValid(String value) {
        return value != null && ID_PATTERN.matcher(value).matches();
    }
}
