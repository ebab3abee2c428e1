package com.github.salilvnair.convrouter.router;

public enum RouteErrorKind {
    HANDLER_FAILURE,
    TIMEOUT,
    CANCELLED,
    HANDLER_MISSING
}
