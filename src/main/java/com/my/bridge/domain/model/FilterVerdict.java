package com.my.bridge.domain.model;

import java.util.EnumSet;
import java.util.Set;

public record FilterVerdict(boolean allowed, Set<ReasonCode> reasons) {

    public FilterVerdict {
        reasons = reasons.isEmpty() ? Set.of() : Set.copyOf(EnumSet.copyOf(reasons));
    }

    public static FilterVerdict of(Set<ReasonCode> reasons) {
        return new FilterVerdict(reasons.isEmpty(), reasons);
    }
}
