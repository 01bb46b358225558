package com.botprobe.verify.validate;

import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.function.Predicate;

/**
 * Built-in validators. Keyword checks are case-insensitive substring matches.
 */
public final class ResponseValidators {

    private ResponseValidators() {
    }

    /** Terms that indicate the responder hit a failure. */
    public static final List<String> ERROR_KEYWORDS = List.of(
            "error:", "failed:", "exception:",
            "traceback", "could not", "unable to");

    /** Terms that indicate the responder completed its work. */
    public static final List<String> SUCCESS_KEYWORDS = List.of(
            "complete", "success", "committed", "pushed",
            "changes", "modified", "updated");

    public static final String NO_ERROR_KEYWORDS = "no-error-keywords";
    public static final String HAS_SUCCESS_INDICATORS = "has-success-indicators";

    private static final ResponseValidator NO_ERRORS = ResponseValidator.of(NO_ERROR_KEYWORDS,
            response -> findKeyword(response.body(), ERROR_KEYWORDS) == null);

    private static final ResponseValidator HAS_SUCCESS = ResponseValidator.of(HAS_SUCCESS_INDICATORS,
            response -> findKeyword(response.body(), SUCCESS_KEYWORDS) != null);

    /**
     * Passes if the body contains {@code expected}, ignoring case.
     */
    public static ResponseValidator containsText(String expected) {
        Objects.requireNonNull(expected, "expected");
        String needle = lower(expected);
        return ResponseValidator.of("contains-text(" + expected + ")",
                response -> lower(response.body()).contains(needle));
    }

    /**
     * Passes if none of {@link #ERROR_KEYWORDS} appear in the body.
     */
    public static ResponseValidator noErrorKeywords() {
        return NO_ERRORS;
    }

    /**
     * Passes if at least one of {@link #SUCCESS_KEYWORDS} appears in the body.
     */
    public static ResponseValidator hasSuccessIndicators() {
        return HAS_SUCCESS;
    }

    /**
     * Delegates to a caller-supplied predicate over the raw body text.
     */
    public static ResponseValidator custom(String name, Predicate<String> bodyPredicate) {
        Objects.requireNonNull(bodyPredicate, "bodyPredicate");
        return ResponseValidator.of(name, response -> bodyPredicate.test(response.body()));
    }

    /**
     * First keyword found in {@code text}, or null.
     */
    static String findKeyword(String text, List<String> keywords) {
        String haystack = lower(text);
        for (String keyword : keywords) {
            if (haystack.contains(keyword)) {
                return keyword;
            }
        }
        return null;
    }

    private static String lower(String value) {
        return value == null ? "" : value.toLowerCase(Locale.ROOT);
    }
}
