package org.pyken.model;

public enum ParameterRole {
    DATUM,
    REDEEMER,
    CONTEXT
}
