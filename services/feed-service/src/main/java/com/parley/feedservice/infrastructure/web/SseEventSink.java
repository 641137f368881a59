package com.parley.feedservice.infrastructure.web;

import com.parley.eventbus.AuthorizationTimeoutException;
import com.parley.eventbus.EventSink;
import com.parley.eventbus.routing.Subscription;
import com.parley.feedmodel.FeedSerializer;
import com.parley.security.UnauthenticatedException;
import com.parley.security.UnauthorizedException;
import java.io.IOException;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.concurrent.atomic.AtomicReference;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.MediaType;
import org.springframework.web.servlet.mvc.method.annotation.SseEmitter;

/**
 * Writes subscription events to a server-sent-events stream.
 *
 * <p>Each event becomes a frame named after the subscription with the record as JSON data. A
 * terminal error becomes a single {@code error} frame carrying a stable code, after which the
 * stream completes. A client that has gone away closes its subscription on the next write.
 */
public class SseEventSink implements EventSink<Object> {

    private static final Logger log = LoggerFactory.getLogger(SseEventSink.class);

    static final String ERROR_EVENT = "error";

    private final SseEmitter emitter;
    private final String eventName;
    private final AtomicReference<Subscription> subscription = new AtomicReference<>();

    public SseEventSink(SseEmitter emitter, String eventName) {
        this.emitter = emitter;
        this.eventName = eventName;
    }

    /** Attaches the subscription to close when the client disconnects. */
    public void bind(Subscription opened) {
        subscription.set(opened);
    }

    @Override
    public void onEvent(Object event) {
        try {
            emitter.send(SseEmitter.event()
                    .name(eventName)
                    .data(FeedSerializer.serialize(event), MediaType.APPLICATION_JSON));
        } catch (IOException | IllegalStateException e) {
            log.debug("Client of {} stream went away: {}", eventName, e.getMessage());
            Subscription open = subscription.get();
            if (open != null) {
                open.close();
            }
        }
    }

    @Override
    public void onError(Throwable cause) {
        Map<String, String> body = new LinkedHashMap<>();
        String code = errorCode(cause);
        body.put("code", code);
        body.put("message", "INTERNAL".equals(code) ? "Subscription failed" : cause.getMessage());
        if ("INTERNAL".equals(code)) {
            log.warn("{} subscription failed", eventName, cause);
        }
        try {
            emitter.send(SseEmitter.event()
                    .name(ERROR_EVENT)
                    .data(FeedSerializer.serialize(body), MediaType.APPLICATION_JSON));
            emitter.complete();
        } catch (IOException | IllegalStateException e) {
            log.debug("Could not deliver terminal error to {} stream: {}", eventName, e.getMessage());
        }
    }

    @Override
    public void onComplete() {
        try {
            emitter.complete();
        } catch (IllegalStateException e) {
            log.debug("{} stream already completed", eventName);
        }
    }

    /** Stable, client-facing code for a terminal subscription error. */
    static String errorCode(Throwable cause) {
        if (cause instanceof UnauthenticatedException) {
            return "UNAUTHENTICATED";
        }
        if (cause instanceof UnauthorizedException) {
            return "UNAUTHORIZED";
        }
        if (cause instanceof AuthorizationTimeoutException) {
            return "AUTH_TIMEOUT";
        }
        return "INTERNAL";
    }
}
