package com.github.salilvnair.convrouter.api.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class RouteRequest {

    private String text;
    private String sessionId;
    private String userId;
    private boolean authenticated;
}
