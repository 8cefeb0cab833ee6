package com.vidnyan.trustgate.domain.meta;

/**
 * How far data flowing through a node can be trusted.
 * Advisory only; normalisation always assigns {@link #UNKNOWN}.
 */
public enum TrustLevel {
    TRUSTED,
    UNTRUSTED,
    SANITIZED,
    UNKNOWN
}
