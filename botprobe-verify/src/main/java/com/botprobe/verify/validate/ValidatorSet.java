package com.botprobe.verify.validate;

import com.botprobe.common.infra.ErrorUtils;
import com.botprobe.verify.model.ProbeResponse;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Objects;

/**
 * Ordered AND-composition of validators.
 * <p>
 * Every validator runs, even after one fails, so the report names all of
 * them. A validator that throws, or fails an assertion, counts as failed;
 * the throwable never leaves {@link #evaluate(ProbeResponse)}. An empty set
 * passes.
 */
@Slf4j
public final class ValidatorSet {

    private final List<ResponseValidator> validators;

    public ValidatorSet(List<ResponseValidator> validators) {
        Objects.requireNonNull(validators, "validators");
        validators.forEach(v -> Objects.requireNonNull(v, "validator"));
        this.validators = List.copyOf(validators);
    }

    public static ValidatorSet of(ResponseValidator... validators) {
        return new ValidatorSet(Arrays.asList(validators));
    }

    public ValidationReport evaluate(ProbeResponse response) {
        List<String> failures = new ArrayList<>();
        for (ResponseValidator validator : validators) {
            String name = safeName(validator);
            try {
                if (!validator.test(response)) {
                    failures.add("Validator " + name + " failed");
                }
            } catch (Exception | AssertionError e) {
                log.debug("Validator {} threw on message {}", name, response.messageId(), e);
                failures.add("Validator " + name + " error: " + ErrorUtils.formatErrorMessage(e));
            }
        }
        return new ValidationReport(failures.isEmpty(), failures);
    }

    /**
     * Evaluate and finalize a pending response.
     *
     * @return a new response marked passed, or failed with the aggregated detail
     */
    public ProbeResponse apply(ProbeResponse response) {
        ValidationReport report = evaluate(response);
        return report.passed() ? response.markPassed() : response.markFailed(report.detail());
    }

    public int size() {
        return validators.size();
    }

    private static String safeName(ResponseValidator validator) {
        try {
            String name = validator.name();
            return name != null ? name : validator.getClass().getSimpleName();
        } catch (Exception e) {
            return validator.getClass().getSimpleName();
        }
    }
}
