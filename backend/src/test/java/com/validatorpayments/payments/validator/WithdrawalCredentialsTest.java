package com.validatorpayments.payments.validator;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class WithdrawalCredentialsTest {

    private static final List<String> ADDRESS_PREFIXES = List.of("0x01");

    @Test
    @DisplayName("0x01 credentials yield the trailing 20 bytes, lower-cased")
    void executionAddressCredentials() {
        String credentials = "0x01" + "0".repeat(22) + "ABCDEFABCDEFABCDEFABCDEFABCDEFABCDEFABCD";

        assertThat(WithdrawalCredentials.executionAddress(credentials, ADDRESS_PREFIXES))
                .contains("0xabcdefabcdefabcdefabcdefabcdefabcdefabcd");
    }

    @Test
    @DisplayName("BLS (0x00) credentials have no execution address")
    void blsCredentials() {
        String credentials = "0x00" + "1".repeat(62);

        assertThat(WithdrawalCredentials.executionAddress(credentials, ADDRESS_PREFIXES)).isEmpty();
    }

    @Test
    @DisplayName("additional prefixes are accepted when configured")
    void configurablePrefixes() {
        String credentials = "0x02" + "0".repeat(22) + "1111111111111111111111111111111111111111";

        assertThat(WithdrawalCredentials.executionAddress(credentials, ADDRESS_PREFIXES)).isEmpty();
        assertThat(WithdrawalCredentials.executionAddress(credentials, List.of("0x01", "0x02")))
                .contains("0x1111111111111111111111111111111111111111");
    }

    @Test
    @DisplayName("malformed credentials rejected")
    void malformed() {
        assertThat(WithdrawalCredentials.executionAddress(null, ADDRESS_PREFIXES)).isEmpty();
        assertThat(WithdrawalCredentials.executionAddress("0x01abc", ADDRESS_PREFIXES)).isEmpty();
    }
}
