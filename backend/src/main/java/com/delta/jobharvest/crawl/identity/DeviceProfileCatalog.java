package com.delta.jobharvest.crawl.identity;

import com.delta.jobharvest.crawl.model.DeviceProfile;
import org.springframework.stereotype.Component;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.atomic.AtomicInteger;

@Component
public class DeviceProfileCatalog {
    private static final String HTML_ACCEPT =
        "text/html,application/xhtml+xml,application/xml;q=0.9,image/avif,image/webp,*/*;q=0.8";

    private final List<DeviceProfile> profiles;
    private final AtomicInteger cursor = new AtomicInteger();

    public DeviceProfileCatalog() {
        this(defaultProfiles());
    }

    public DeviceProfileCatalog(List<DeviceProfile> profiles) {
        if (profiles == null || profiles.isEmpty()) {
            throw new IllegalArgumentException("device profile catalog must not be empty");
        }
        this.profiles = List.copyOf(profiles);
    }

    public DeviceProfile next() {
        int index = Math.floorMod(cursor.getAndIncrement(), profiles.size());
        return profiles.get(index);
    }

    private static List<DeviceProfile> defaultProfiles() {
        return List.of(
            chromium(
                "chrome-windows",
                "Mozilla/5.0 (Windows NT 10.0; Win64; x64) AppleWebKit/537.36 (KHTML, like Gecko) Chrome/120.0.0.0 Safari/537.36",
                "\"Windows\""
            ),
            chromium(
                "chrome-macos",
                "Mozilla/5.0 (Macintosh; Intel Mac OS X 10_15_7) AppleWebKit/537.36 (KHTML, like Gecko) Chrome/120.0.0.0 Safari/537.36",
                "\"macOS\""
            ),
            chromium(
                "chrome-linux",
                "Mozilla/5.0 (X11; Linux x86_64) AppleWebKit/537.36 (KHTML, like Gecko) Chrome/120.0.0.0 Safari/537.36",
                "\"Linux\""
            ),
            // Firefox does not send client hints.
            new DeviceProfile(
                "firefox-windows",
                "Mozilla/5.0 (Windows NT 10.0; Win64; x64; rv:121.0) Gecko/20100101 Firefox/121.0",
                navigationHeaders()
            )
        );
    }

    private static DeviceProfile chromium(String name, String userAgent, String platform) {
        Map<String, String> hints = new LinkedHashMap<>(navigationHeaders());
        hints.put("sec-ch-ua", "\"Not_A Brand\";v=\"8\", \"Chromium\";v=\"120\", \"Google Chrome\";v=\"120\"");
        hints.put("sec-ch-ua-mobile", "?0");
        hints.put("sec-ch-ua-platform", platform);
        return new DeviceProfile(name, userAgent, hints);
    }

    private static Map<String, String> navigationHeaders() {
        Map<String, String> headers = new LinkedHashMap<>();
        headers.put("Accept", HTML_ACCEPT);
        headers.put("Sec-Fetch-Dest", "document");
        headers.put("Sec-Fetch-Mode", "navigate");
        headers.put("Sec-Fetch-Site", "same-origin");
        headers.put("Sec-Fetch-User", "?1");
        headers.put("Upgrade-Insecure-Requests", "1");
        return headers;
    }
}
