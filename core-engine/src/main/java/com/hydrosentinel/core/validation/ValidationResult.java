package com.hydrosentinel.core.validation;

import com.hydrosentinel.core.model.CleanedReading;
import com.hydrosentinel.core.model.Rejection;

import java.util.Objects;
import java.util.Optional;

/**
 * Either a {@link CleanedReading} or a {@link Rejection}, never both.
 *
 * @since 1.0.0
 */
public final class ValidationResult {

    private final CleanedReading cleaned;
    private final Rejection rejection;

    private ValidationResult(CleanedReading cleaned, Rejection rejection) {
        this.cleaned = cleaned;
        this.rejection = rejection;
    }

    public static ValidationResult accepted(CleanedReading cleaned) {
        return new ValidationResult(Objects.requireNonNull(cleaned, "cleaned must not be null"), null);
    }

    public static ValidationResult rejected(Rejection rejection) {
        return new ValidationResult(null, Objects.requireNonNull(rejection, "rejection must not be null"));
    }

    public boolean isAccepted() {
        return cleaned != null;
    }

    public Optional<CleanedReading> getCleaned() {
        return Optional.ofNullable(cleaned);
    }

    public Optional<Rejection> getRejection() {
        return Optional.ofNullable(rejection);
    }

    @Override
    public String toString() {
        return isAccepted() ? "Accepted[" + cleaned + "]" : "Rejected[" + rejection + "]";
    }
}
