package com.validatorpayments.chain.execution;

import java.math.BigInteger;

public record TransactionReceipt(String transactionHash, BigInteger gasUsed) {
}
