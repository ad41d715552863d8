package org.pyken.diagnostic;

public enum Severity {
    INFO,
    WARNING,
    FATAL
}
