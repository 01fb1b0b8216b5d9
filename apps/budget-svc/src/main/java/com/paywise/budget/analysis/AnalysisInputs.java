package com.paywise.budget.analysis;

import java.util.function.Supplier;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

final class AnalysisInputs {

    private static final Logger log = LoggerFactory.getLogger(AnalysisInputs.class);

    private AnalysisInputs() {
    }

    // a stored frequency that cannot be parsed is a configuration error, not a storage failure
    static <T> T fetch(String query, Supplier<T> supplier) {
        try {
            return supplier.get();
        } catch (InvalidPayFrequencyException ex) {
            throw ex;
        } catch (RuntimeException ex) {
            log.warn("Failed to load {}: {}", query, ex.getMessage());
            throw new AnalysisDataAccessException(query, ex);
        }
    }
}
