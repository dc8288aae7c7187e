package com.validatorpayments.payments.validator;

import java.util.Collection;
import java.util.Locale;
import java.util.Optional;
import java.util.regex.Pattern;

/**
 * Decodes 32-byte withdrawal credentials: one prefix byte, eleven zero bytes, then a 20-byte execution address
 * for address-type credentials.
 */
public final class WithdrawalCredentials {

    private static final Pattern CREDENTIALS = Pattern.compile("^0x[0-9a-fA-F]{64}$");
    private static final int ADDRESS_HEX_LENGTH = 40;

    private WithdrawalCredentials() {
    }

    /**
     * Execution address encoded in the credentials, lower-case, when the prefix byte is one of {@code addressPrefixes}.
     */
    public static Optional<String> executionAddress(String credentials, Collection<String> addressPrefixes) {
        if (credentials == null || !CREDENTIALS.matcher(credentials).matches()) {
            return Optional.empty();
        }
        String prefix = credentials.substring(0, 4).toLowerCase(Locale.ROOT);
        boolean addressType = addressPrefixes.stream()
                .anyMatch(p -> p != null && p.trim().toLowerCase(Locale.ROOT).equals(prefix));
        if (!addressType) {
            return Optional.empty();
        }
        return Optional.of("0x" + credentials.substring(credentials.length() - ADDRESS_HEX_LENGTH).toLowerCase(Locale.ROOT));
    }
}
