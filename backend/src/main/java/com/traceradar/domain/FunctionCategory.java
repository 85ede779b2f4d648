package com.traceradar.domain;

/**
 * Category tag attached to a decoded function.
 */
public enum FunctionCategory {
    TOKEN_MOVEMENT,
    ALLOWANCE,
    SUPPLY_CHANGE,
    VIEW,
    ADMIN,
    CONTROL,
    CONSTRUCTOR,
    DESTRUCT,
    OTHER
}
