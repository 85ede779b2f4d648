package com.traceradar.domain;

/**
 * Token movement shapes recognized on tracked contracts.
 */
public enum TransferKind {
    TRANSFER,
    TRANSFER_FROM,
    MINT,
    BURN
}
