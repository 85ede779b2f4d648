package com.traceradar.ingestion.normalizer;

/**
 * Static ABI argument types the signature table decodes. Each occupies one 32-byte word.
 */
enum AbiType {
    ADDRESS,
    UINT256
}
