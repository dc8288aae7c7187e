package com.validatorpayments.api.controller;

import com.validatorpayments.api.dto.ErrorBody;
import com.validatorpayments.api.dto.WithdrawalAddressResponse;
import com.validatorpayments.payments.validator.ValidatorRegistry;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;

import java.util.List;

/**
 * GET /validators/withdrawal-addresses?ids=... : execution address from each validator's withdrawal credentials.
 */
@RestController
@RequestMapping("/api/v1/validators")
@RequiredArgsConstructor
public class ValidatorController {

    private final ValidatorRegistry validatorRegistry;

    @GetMapping("/withdrawal-addresses")
    public Mono<ResponseEntity<?>> withdrawalAddresses(@RequestParam(required = false) List<String> ids) {
        if (ids == null || ids.isEmpty()) {
            return Mono.just(ResponseEntity.badRequest().body(ErrorBody.of("INVALID_REQUEST", "At least one id is required")));
        }
        return Mono.fromCallable(() -> validatorRegistry.lookupWithdrawalAddresses(ids))
                .subscribeOn(Schedulers.boundedElastic())
                .<ResponseEntity<?>>map(results -> ResponseEntity.ok(results.values().stream()
                        .map(WithdrawalAddressResponse::from)
                        .toList()));
    }
}
