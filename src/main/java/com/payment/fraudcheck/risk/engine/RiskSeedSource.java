package com.payment.fraudcheck.risk.engine;

import com.payment.fraudcheck.domain.Transaction;

import java.security.SecureRandom;

/**
 * Supplies the seed for one risk assessment. The seed is taken once per request so retries of the
 * downstream call score the transaction identically.
 */
@FunctionalInterface
public interface RiskSeedSource {

    long seedFor(Transaction transaction);

    /** Fresh seed per request; scores vary between calls for the same transaction. */
    static RiskSeedSource random(SecureRandom secureRandom) {
        return transaction -> secureRandom.nextLong();
    }

    /** Seed derived from the transaction id; the same transaction always scores the same. */
    static RiskSeedSource perTransaction() {
        return transaction -> {
            long h = 1125899906842597L;
            for (char c : transaction.getTransactionId().toCharArray()) {
                h = 31 * h + c;
            }
            return h;
        };
    }
}
