package com.validatorpayments.api.validation;

import jakarta.validation.Constraint;
import jakarta.validation.Payload;

import java.lang.annotation.Documented;
import java.lang.annotation.Retention;
import java.lang.annotation.Target;

import static java.lang.annotation.ElementType.*;
import static java.lang.annotation.RetentionPolicy.RUNTIME;

/**
 * Calendar date in ISO format (YYYY-MM-DD).
 * Error code for API: INVALID_RANGE.
 */
@Target({FIELD, PARAMETER, RECORD_COMPONENT})
@Retention(RUNTIME)
@Documented
@Constraint(validatedBy = IsoDateValidator.class)
public @interface IsoDate {

    String message() default "INVALID_RANGE";

    Class<?>[] groups() default {};

    Class<? extends Payload>[] payload() default {};
}
