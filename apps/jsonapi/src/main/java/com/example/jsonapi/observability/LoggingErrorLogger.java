package com.example.jsonapi.observability;

import com.example.jsonapi.common.util.StringSanitizer;
import com.example.jsonapi.document.ErrorLogger;
import com.example.jsonapi.document.ErrorObject;
import lombok.extern.slf4j.Slf4j;
import org.springframework.lang.Nullable;

/**
 * Default error logger: server errors at ERROR with the stack trace, client errors at WARN
 * when enabled.
 */
@Slf4j
public class LoggingErrorLogger implements ErrorLogger {

    private final boolean includeClientErrors;

    public LoggingErrorLogger(boolean includeClientErrors) {
        this.includeClientErrors = includeClientErrors;
    }

    @Override
    public void log(ErrorObject error, @Nullable Throwable cause) {
        int status = error.statusCode();
        String detail = StringSanitizer.forLog(error.detail());
        if (status >= 500) {
            log.error("JSON:API error: status={}, title={}, detail={}", status, error.title(), detail, cause);
        } else if (includeClientErrors) {
            log.warn("JSON:API client error: status={}, title={}, detail={}", status, error.title(), detail);
        }
    }
}
