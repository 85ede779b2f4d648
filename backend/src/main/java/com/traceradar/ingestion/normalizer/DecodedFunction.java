package com.traceradar.ingestion.normalizer;

import com.traceradar.domain.FunctionCategory;
import com.traceradar.domain.FunctionParameters;

/**
 * Function identity resolved for one call.
 */
public record DecodedFunction(String name, FunctionCategory category, FunctionParameters parameters) {

    static DecodedFunction of(String name, FunctionCategory category) {
        return new DecodedFunction(name, category, FunctionParameters.empty());
    }
}
