package com.github.salilvnair.convrouter.api.dto;

import com.github.salilvnair.convrouter.router.RouteResult;

public record RouteResponse(String sessionId, RouteResult result) {
}
