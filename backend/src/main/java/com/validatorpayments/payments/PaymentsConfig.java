package com.validatorpayments.payments;

import com.validatorpayments.chain.RetryingOperation;
import com.validatorpayments.payments.range.SlotRangeResolver;
import com.validatorpayments.payments.scan.BoundedScanner;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;

@Configuration
@EnableConfigurationProperties(PaymentsProperties.class)
public class PaymentsConfig {

    @Bean
    public SlotRangeResolver slotRangeResolver(PaymentsProperties properties) {
        return new SlotRangeResolver(properties.getSecondsPerSlot());
    }

    @Bean
    public BoundedScanner boundedScanner(PaymentsProperties properties, RetryingOperation retryingOperation) {
        return new BoundedScanner(properties.getConcurrency(), properties.getProgressIntervalMs(),
                retryingOperation, Clock.systemUTC());
    }
}
