package com.parley.feedservice.api;

import com.parley.eventbus.routing.FilterArgs;
import com.parley.eventbus.routing.Subscription;
import com.parley.eventbus.routing.SubscriptionRequest;
import com.parley.eventbus.routing.SubscriptionRouter;
import com.parley.eventbus.routing.UnknownSubscriptionException;
import com.parley.feedservice.config.FeedServiceProperties;
import com.parley.feedservice.infrastructure.web.IdentityResolver;
import com.parley.feedservice.infrastructure.web.SseEventSink;
import com.parley.security.Identity;
import jakarta.servlet.http.HttpServletRequest;
import java.util.List;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.servlet.mvc.method.annotation.SseEmitter;

/**
 * Live subscriptions as server-sent-event streams.
 *
 * <pre>
 * GET /api/v1/subscriptions/messageAdded?groupIds=1,2
 * GET /api/v1/subscriptions/groupAdded?userId=7
 * </pre>
 *
 * <p>The stream opens immediately. Authorization runs asynchronously; a denied subscription
 * receives one {@code error} frame and the stream ends. Closing the stream closes the
 * subscription.
 */
@RestController
@RequestMapping("/api/v1/subscriptions")
public class SubscriptionController {

    private final SubscriptionRouter router;
    private final IdentityResolver identities;
    private final FeedServiceProperties properties;

    public SubscriptionController(
            SubscriptionRouter router, IdentityResolver identities, FeedServiceProperties properties) {
        this.router = router;
        this.identities = identities;
        this.properties = properties;
    }

    @GetMapping("/{name}")
    public SseEmitter subscribe(
            @PathVariable String name,
            @RequestParam(required = false) List<Long> groupIds,
            @RequestParam(required = false) Long userId,
            HttpServletRequest request) {
        if (!router.names().contains(name)) {
            throw new UnknownSubscriptionException(name);
        }
        Identity identity = identities.resolve(request);

        SseEmitter emitter = new SseEmitter(properties.sseTimeout().toMillis());
        SseEventSink sink = new SseEventSink(emitter, name);
        Subscription subscription =
                router.subscribe(new SubscriptionRequest(name, new FilterArgs(groupIds, userId), identity), sink);
        sink.bind(subscription);

        emitter.onCompletion(subscription::close);
        emitter.onTimeout(subscription::close);
        emitter.onError(error -> subscription.close());
        return emitter;
    }
}
