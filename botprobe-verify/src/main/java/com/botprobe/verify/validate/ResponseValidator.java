package com.botprobe.verify.validate;

import com.botprobe.verify.model.ProbeResponse;

import java.util.Objects;
import java.util.function.Predicate;

/**
 * A named acceptance check over a response. Implementations must not depend
 * on anything but the response for their result.
 */
public interface ResponseValidator {

    /** Name reported when the check fails. */
    String name();

    /**
     * @return {@code true} if the response satisfies this check
     */
    boolean test(ProbeResponse response);

    /**
     * Wrap a predicate over the whole response.
     */
    static ResponseValidator of(String name, Predicate<ProbeResponse> predicate) {
        Objects.requireNonNull(name, "name");
        Objects.requireNonNull(predicate, "predicate");
        return new ResponseValidator() {
            @Override
            public String name() {
                return name;
            }

            @Override
            public boolean test(ProbeResponse response) {
                return predicate.test(response);
            }

            @Override
            public String toString() {
                return "ResponseValidator[" + name + "]";
            }
        };
    }
}
