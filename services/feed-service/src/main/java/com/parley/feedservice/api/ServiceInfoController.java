package com.parley.feedservice.api;

import com.parley.eventbus.routing.SubscriptionRouter;
import com.parley.feedservice.config.FeedServiceProperties;
import java.time.Instant;
import java.util.Map;
import java.util.TreeSet;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

/** Lightweight runtime info: service name, subscription names and open subscription count. */
@RestController
@RequestMapping("/api/v1")
public class ServiceInfoController {

    private final FeedServiceProperties properties;
    private final SubscriptionRouter router;

    public ServiceInfoController(FeedServiceProperties properties, SubscriptionRouter router) {
        this.properties = properties;
        this.router = router;
    }

    @GetMapping("/info")
    public Map<String, Object> serviceInfo() {
        return Map.of(
                "name", properties.name(),
                "environment", properties.environment(),
                "subscriptions", new TreeSet<>(router.names()),
                "activeSubscriptions", router.activeSubscriptions(),
                "status", "running",
                "timestamp", Instant.now().toString());
    }
}
