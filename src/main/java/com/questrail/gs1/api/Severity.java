package com.questrail.gs1.api;

/**
 * Severity of a {@link Diagnostic}.
 */
public enum Severity
{
    ERROR,
    WARNING
}
