package com.traceradar.ingestion.normalizer;

import com.traceradar.domain.FunctionCategory;

import java.util.List;

/**
 * One row of the decode table: selector, canonical name, category and argument layout.
 */
record FunctionSignature(String selector, String name, FunctionCategory category, List<Param> params) {

    FunctionSignature {
        params = List.copyOf(params);
    }

    /** Named argument slot, in calldata order. */
    record Param(String name, AbiType type) {
    }

    static Param address(String name) {
        return new Param(name, AbiType.ADDRESS);
    }

    static Param uint(String name) {
        return new Param(name, AbiType.UINT256);
    }
}
