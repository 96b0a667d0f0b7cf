package org.learningjava.pyml.infrastructure.adapter.in.web;

import org.learningjava.pyml.domain.error.ErrorKind;

import java.time.Instant;

public record ApiError(
        int status,
        String error,
        ErrorKind kind,
        Integer line,
        String message,
        String path,
        Instant timestamp
) {}
