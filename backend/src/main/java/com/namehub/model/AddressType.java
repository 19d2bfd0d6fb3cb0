package com.namehub.model;

/**
 * What a registered name resolves to.
 */
public enum AddressType {
    IDENTITY,
    PROGRAM,
    HUB
}
