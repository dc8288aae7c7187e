package com.validatorpayments.payments.validator;

import java.util.regex.Pattern;

/**
 * Accepted validator identifiers: a decimal index or a 0x-prefixed 48-byte BLS public key.
 */
public final class ValidatorIdentifiers {

    private static final Pattern INDEX = Pattern.compile("^[0-9]{1,19}$");
    private static final Pattern PUBKEY = Pattern.compile("^0x[0-9a-fA-F]{96}$");

    private ValidatorIdentifiers() {
    }

    public static boolean isValid(String identifier) {
        if (identifier == null || identifier.isBlank()) return false;
        String id = identifier.trim();
        return INDEX.matcher(id).matches() || PUBKEY.matcher(id).matches();
    }

    public static boolean isPubkey(String identifier) {
        return identifier != null && PUBKEY.matcher(identifier.trim()).matches();
    }
}
