package com.github.salilvnair.convrouter.router;

import java.util.List;

public record RouteValidation(boolean canRoute, List<String> reasons) {

    public RouteValidation {
        reasons = List.copyOf(reasons);
    }

    public static RouteValidation of(List<String> reasons) {
        return new RouteValidation(reasons.isEmpty(), reasons);
    }
}
