package com.validatorpayments.payments.validator;

import com.validatorpayments.chain.NotFoundException;
import com.validatorpayments.chain.RetryingOperation;
import com.validatorpayments.chain.beacon.BeaconChainService;
import com.validatorpayments.chain.beacon.BeaconValidator;
import com.validatorpayments.payments.PaymentsProperties;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.SortedMap;
import java.util.TreeMap;

/**
 * Resolves validator identifiers (index or public key) into canonical {@link ValidatorRecord}s keyed by index.
 * Identifiers that fail to resolve are logged and skipped; two identifiers naming the same validator yield one record.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class ValidatorRegistry {

    private final BeaconChainService beaconChainService;
    private final RetryingOperation retryingOperation;
    private final PaymentsProperties paymentsProperties;

    /**
     * @return records by validator index, never empty
     * @throws NoValidatorsResolvedException when no identifier resolves
     */
    public SortedMap<Long, ValidatorRecord> resolve(List<String> identifiers) {
        SortedMap<Long, ValidatorRecord> byIndex = new TreeMap<>();
        for (String identifier : identifiers == null ? List.<String>of() : identifiers) {
            fetchRecord(identifier).ifPresent(record -> {
                ValidatorRecord existing = byIndex.putIfAbsent(record.index(), record);
                if (existing != null) {
                    log.info("Validator identifier {} duplicates index {}", identifier, record.index());
                }
            });
        }
        if (byIndex.isEmpty()) {
            throw new NoValidatorsResolvedException("No valid validators found among " + sizeOf(identifiers) + " identifier(s)");
        }
        log.info("Resolved {} validator(s) from {} identifier(s)", byIndex.size(), sizeOf(identifiers));
        return Collections.unmodifiableSortedMap(byIndex);
    }

    /**
     * Withdrawal address per identifier, in request order. Never throws for a single bad identifier.
     */
    public Map<String, WithdrawalAddressLookup> lookupWithdrawalAddresses(List<String> identifiers) {
        Map<String, WithdrawalAddressLookup> results = new LinkedHashMap<>();
        for (String raw : identifiers == null ? List.<String>of() : identifiers) {
            String identifier = raw == null ? "" : raw.trim();
            if (results.containsKey(identifier)) {
                continue;
            }
            if (!ValidatorIdentifiers.isValid(identifier)) {
                results.put(identifier, WithdrawalAddressLookup.failed(identifier, "Invalid validator identifier"));
                continue;
            }
            try {
                results.put(identifier, WithdrawalAddressLookup.of(identifier, toRecord(fetchValidator(identifier))));
            } catch (RuntimeException e) {
                log.warn("Failed to fetch validator {}: {}", identifier, e.getMessage());
                results.put(identifier, WithdrawalAddressLookup.failed(identifier, e.getMessage()));
            }
        }
        return results;
    }

    private Optional<ValidatorRecord> fetchRecord(String raw) {
        if (!ValidatorIdentifiers.isValid(raw)) {
            log.warn("Skipping invalid validator identifier '{}'", raw);
            return Optional.empty();
        }
        String identifier = raw.trim();
        try {
            return Optional.of(toRecord(fetchValidator(identifier)));
        } catch (NotFoundException e) {
            log.warn("Validator {} not found: {}", identifier, e.getMessage());
        } catch (RuntimeException e) {
            log.warn("Failed to fetch validator {}: {}", identifier, e.getMessage());
        }
        return Optional.empty();
    }

    private BeaconValidator fetchValidator(String identifier) {
        String id = ValidatorIdentifiers.isPubkey(identifier) ? identifier.toLowerCase(Locale.ROOT) : identifier;
        return retryingOperation.execute("validator " + id, () -> beaconChainService.getValidator(id));
    }

    private ValidatorRecord toRecord(BeaconValidator validator) {
        String address = WithdrawalCredentials
                .executionAddress(validator.withdrawalCredentials(), paymentsProperties.getExecutionAddressCredentialPrefixes())
                .orElse(null);
        return new ValidatorRecord(validator.index(), validator.pubkey(), address);
    }

    private static int sizeOf(List<String> identifiers) {
        return identifiers == null ? 0 : identifiers.size();
    }
}
