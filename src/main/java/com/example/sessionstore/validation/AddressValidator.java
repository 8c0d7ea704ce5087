package com.example.sessionstore.validation;

import jakarta.validation.ConstraintValidator;
import jakarta.validation.ConstraintValidatorContext;

import java.util.regex.Matcher;
import java.util.regex.Pattern;

public class AddressValidator implements ConstraintValidator<Address, String> {

    private static final Pattern ADDRESS = Pattern.compile(
            "^(\\d{1,3})\\.(\\d{1,3})\\.(\\d{1,3})\\.(\\d{1,3})(?:(:)(\\d{1,5})|(/)(\\d{1,2}))?$");

    @Override
    public boolean isValid(String value, ConstraintValidatorContext context) {
        // null is left to @NotNull
        if (value == null) return true;
        return isAddress(value);
    }

    public static boolean isAddress(String value) {
        Matcher m = ADDRESS.matcher(value.trim());
        if (!m.matches()) return false;

        for (int i = 1; i <= 4; i++) {
            if (Integer.parseInt(m.group(i)) > 255) return false;
        }
        if (m.group(5) != null && Integer.parseInt(m.group(6)) > 65535) return false;
        if (m.group(7) != null && Integer.parseInt(m.group(8)) > 32) return false;
        return true;
    }
}
