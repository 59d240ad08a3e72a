package ai.acsl.injector.pipeline;

import java.util.Objects;
import java.util.Optional;

/**
 * Outcome of validating a candidate and injecting fragments into it. A success always carries annotated
 * text; a failure always carries a diagnostic and never any text.
 */
public record InjectionResult(boolean success, Optional<String> annotatedText, Optional<String> diagnostic) {

    public InjectionResult {
        annotatedText = annotatedText == null ? Optional.empty() : annotatedText;
        diagnostic = diagnostic == null ? Optional.empty() : diagnostic;
        if (success == annotatedText.isEmpty() || success == diagnostic.isPresent()) {
            throw new IllegalArgumentException("A success needs annotated text only, a failure a diagnostic only");
        }
    }

    public static InjectionResult succeeded(String annotatedText) {
        return new InjectionResult(true, Optional.of(Objects.requireNonNull(annotatedText, "annotatedText")), Optional.empty());
    }

    public static InjectionResult failed(String diagnostic) {
        return new InjectionResult(false, Optional.empty(), Optional.of(Objects.requireNonNull(diagnostic, "diagnostic")));
    }
}
