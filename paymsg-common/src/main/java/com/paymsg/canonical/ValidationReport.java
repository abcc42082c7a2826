package com.paymsg.canonical;

import lombok.Value;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Outcome of a validation pass: valid exactly when no error was recorded.
 */
@Value
public class ValidationReport {

    boolean valid;

    List<String> errors;

    public static ValidationReport of(List<String> errors) {
        List<String> copy = errors == null ? new ArrayList<>() : new ArrayList<>(errors);
        return new ValidationReport(copy.isEmpty(), Collections.unmodifiableList(copy));
    }

    public static ValidationReport valid() {
        return of(Collections.emptyList());
    }

    public static ValidationReport invalid(String error) {
        return of(List.of(error));
    }
}
