package com.validatorpayments.api.controller;

import com.validatorpayments.api.dto.PaymentsRequest;
import com.validatorpayments.api.dto.PaymentsResponse;
import com.validatorpayments.payments.ValidatorPaymentsService;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;

/**
 * POST /payments: scans the date range and returns payment totals. The scan blocks, so it runs on bounded-elastic.
 */
@RestController
@RequestMapping("/api/v1/payments")
@RequiredArgsConstructor
public class PaymentsController {

    private final ValidatorPaymentsService validatorPaymentsService;

    @PostMapping
    public Mono<PaymentsResponse> computePayments(@Valid @RequestBody PaymentsRequest request) {
        return Mono.fromCallable(() -> validatorPaymentsService.computePayments(
                        request.ids(), request.startDate(), request.endDate()))
                .subscribeOn(Schedulers.boundedElastic())
                .map(PaymentsResponse::from);
    }
}
