package com.validatorpayments.api.dto;

import com.validatorpayments.api.validation.IsoDate;
import jakarta.validation.constraints.NotEmpty;

import java.util.List;

/**
 * POST /api/v1/payments request body. Dates are YYYY-MM-DD (UTC); endDate is exclusive.
 */
public record PaymentsRequest(
        @NotEmpty(message = "INVALID_REQUEST") List<String> ids,
        @IsoDate String startDate,
        @IsoDate String endDate
) {
}
