package com.questrail.choreography.config;

import com.questrail.choreography.verification.DiagnosticCode;

import java.util.Collections;
import java.util.EnumSet;
import java.util.Objects;
import java.util.Set;

/**
 * Verifier switches.
 *
 * @param enabledChecks checks to run, identified by the code each one reports
 * @param strictMode    when set, warnings also make a report invalid
 */
public record VerificationOptions(
    Set<DiagnosticCode> enabledChecks,
    boolean strictMode
) {
    public VerificationOptions {
        Objects.requireNonNull(enabledChecks, "enabledChecks");
        enabledChecks = enabledChecks.isEmpty()
                ? Collections.unmodifiableSet(EnumSet.noneOf(DiagnosticCode.class))
                : Collections.unmodifiableSet(EnumSet.copyOf(enabledChecks));
    }

    public static VerificationOptions defaults() {
        return builder().build();
    }

    public static Builder builder() {
        return new Builder();
    }

    public boolean isEnabled(DiagnosticCode code) {
        return enabledChecks.contains(code);
    }

    public static final class Builder {
        private final Set<DiagnosticCode> enabledChecks = EnumSet.allOf(DiagnosticCode.class);
        private boolean strictMode = false;

        public Builder withoutCheck(DiagnosticCode code) {
            enabledChecks.remove(Objects.requireNonNull(code, "code"));
            return this;
        }

        public Builder withCheck(DiagnosticCode code) {
            enabledChecks.add(Objects.requireNonNull(code, "code"));
            return this;
        }

        public Builder withOnlyChecks(Set<DiagnosticCode> codes) {
            enabledChecks.clear();
            enabledChecks.addAll(codes);
            return this;
        }

        public Builder withStrictMode(boolean strictMode) {
            this.strictMode = strictMode;
            return this;
        }

        public VerificationOptions build() {
            return new VerificationOptions(enabledChecks, strictMode);
        }
    }
}
