package com.heronix.progress.model.result;

import java.util.List;
import java.util.Map;

import com.heronix.progress.model.enums.ErrorCategory;
import com.heronix.progress.model.enums.ErrorCode;

/**
 * A typed failure with a code, a human-readable message, the individual problems found
 * and free-form context (ids, periods) for logs.
 */
public record DomainError(
        ErrorCode code,
        String message,
        List<String> details,
        Map<String, String> context
) {
    public DomainError {
        details = details == null ? List.of() : List.copyOf(details);
        context = context == null ? Map.of() : Map.copyOf(context);
    }

    public static DomainError of(ErrorCode code, String message) {
        return new DomainError(code, message, List.of(), Map.of());
    }

    public static DomainError of(ErrorCode code, String message, List<String> details) {
        return new DomainError(code, message, details, Map.of());
    }

    public static DomainError of(ErrorCode code, String message, Map<String, String> context) {
        return new DomainError(code, message, List.of(), context);
    }

    public ErrorCategory category() {
        return code.getCategory();
    }
}
