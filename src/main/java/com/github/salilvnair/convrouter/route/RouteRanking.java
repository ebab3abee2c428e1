package com.github.salilvnair.convrouter.route;

public record RouteRanking(String routeId, RouteMetrics metrics) {
}
