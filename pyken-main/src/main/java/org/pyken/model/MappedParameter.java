package org.pyken.model;

import org.pyken.diagnostic.SourceLocation;

/**
 * A parameter after type mapping.
 *
 * @param type Aiken type text, or {@code null} when the parameter is emitted without annotation
 * @param role the validator role, or {@code null} for helpers and tests
 */
public record MappedParameter(String name, String type, ParameterRole role, SourceLocation location) {
}
