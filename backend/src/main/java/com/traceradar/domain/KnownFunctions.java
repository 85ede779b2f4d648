package com.traceradar.domain;

/**
 * Canonical names of the tracked token functions that analyzers match on.
 */
public final class KnownFunctions {

    public static final String TRANSFER = "transfer(address,uint256)";
    public static final String TRANSFER_FROM = "transferFrom(address,address,uint256)";
    public static final String APPROVE = "approve(address,uint256)";
    public static final String MINT = "mint(address,uint256)";
    public static final String BURN = "burn(uint256)";
    public static final String TRANSFER_OWNERSHIP = "transferOwnership(address)";
    public static final String PAUSE = "pause()";
    public static final String UNPAUSE = "unpause()";

    public static final String CONSTRUCTOR = "Constructor";
    public static final String SELFDESTRUCT = "selfdestruct";
    public static final String NOT_DECODED = "N/A";

    public static final String ZERO_ADDRESS = "0x0000000000000000000000000000000000000000";

    private KnownFunctions() {
    }
}
