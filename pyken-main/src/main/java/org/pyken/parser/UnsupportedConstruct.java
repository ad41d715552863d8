package org.pyken.parser;

import org.pyken.diagnostic.SourceLocation;

public record UnsupportedConstruct(String description, SourceLocation location) {
}
