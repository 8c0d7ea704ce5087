package com.example.sessionstore.validation;

import jakarta.validation.Constraint;
import jakarta.validation.Payload;

import java.lang.annotation.*;

/**
 * IPv4 address, {@code address:port} or CIDR {@code address/prefix}.
 */
@Documented
@Constraint(validatedBy = AddressValidator.class)
@Target({ElementType.FIELD, ElementType.PARAMETER, ElementType.TYPE_USE})
@Retention(RetentionPolicy.RUNTIME)
public @interface Address {

    String message() default "invalid address";

    Class<?>[] groups() default {};

    Class<? extends Payload>[] payload() default {};
}
