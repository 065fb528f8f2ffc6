package com.wom.openings.exception;

import com.wom.openings.model.SourceLabel;
import lombok.Getter;

/**
 * A mandatory source could not be reached on any endpoint. Aborts the run.
 */
@Getter
public class SourceUnavailableException extends RuntimeException {

    private final SourceLabel source;

    public SourceUnavailableException(SourceLabel source, String message, Throwable cause) {
        super(message, cause);
        this.source = source;
    }
}
