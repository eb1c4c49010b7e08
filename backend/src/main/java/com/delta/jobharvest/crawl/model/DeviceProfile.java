package com.delta.jobharvest.crawl.model;

import java.util.Map;

/**
 * A browser persona whose headers are kept internally consistent: the client-hint headers always
 * describe the same browser and platform as the user agent.
 */
public record DeviceProfile(
    String name,
    String userAgent,
    Map<String, String> clientHints
) {
    public DeviceProfile {
        clientHints = clientHints == null ? Map.of() : Map.copyOf(clientHints);
    }
}
