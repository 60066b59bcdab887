/*
 * Copyright (c) 2026 Bob Hablutzel. All rights reserved.
 *
 * Licensed under a dual-license model: freely available for non-commercial use;
 * commercial use requires a separate license. See LICENSE file for details.
 * Contact license@geastalt.com for commercial licensing.
 */

package com.geastalt.licensing.service;

import org.springframework.boot.ExitCodeGenerator;

/**
 * A run that stopped because its progress could not be persisted. Carries the summary
 * accumulated up to the failure.
 */
public class EnrichmentRunException extends RuntimeException implements ExitCodeGenerator {

    public static final int EXIT_CODE = 2;

    private final transient RunSummary summary;

    public EnrichmentRunException(String message, RunSummary summary, Throwable cause) {
        super(message, cause);
        this.summary = summary;
    }

    public RunSummary getSummary() {
        return summary;
    }

    @Override
    public int getExitCode() {
        return EXIT_CODE;
    }
}
