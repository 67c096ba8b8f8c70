package com.eainde.lending.decision;

import java.util.List;

/**
 * Outcome of the compliance gate. When {@code vetoed} is true the decision is forced
 * to Rejected / 0.0 / 1.00 and no other signal is consulted.
 */
public record VetoResult(boolean vetoed, List<String> reasons) {

    public VetoResult {
        reasons = reasons == null ? List.of() : List.copyOf(reasons);
    }

    public static VetoResult clear() {
        return new VetoResult(false, List.of());
    }
}
