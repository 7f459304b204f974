package com.example.integritychecker.display;

import com.example.integritychecker.model.StatusView;
import com.example.integritychecker.model.VerdictSnapshot;
import com.example.integritychecker.repository.VerdictStateStore;
import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;
import org.springframework.web.servlet.mvc.method.annotation.SseEmitter;

import java.io.IOException;
import java.time.Clock;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.function.Supplier;

/**
 * Server-sent event fan-out of state changes and notifications. A state event equal
 * to the last one broadcast is not sent again.
 */
@Component
public class StateStreamBroadcaster implements DisplaySurface {

    private static final Logger logger = LoggerFactory.getLogger(StateStreamBroadcaster.class);

    static final String STATE_EVENT = "state";
    static final String NOTIFICATION_EVENT = "notification";

    private final VerdictStateStore stateStore;
    private final Clock clock;
    private final Supplier<SseEmitter> emitterFactory;
    private final List<SseEmitter> emitters = new CopyOnWriteArrayList<>();

    private VerdictStateStore.Subscription subscription;
    private VerdictSnapshot lastBroadcast;

    @Autowired
    public StateStreamBroadcaster(VerdictStateStore stateStore, Clock clock) {
        this(stateStore, clock, () -> new SseEmitter(0L));
    }

    StateStreamBroadcaster(VerdictStateStore stateStore, Clock clock, Supplier<SseEmitter> emitterFactory) {
        this.stateStore = stateStore;
        this.clock = clock;
        this.emitterFactory = emitterFactory;
    }

    @PostConstruct
    public void init() {
        subscription = stateStore.subscribe(this::refresh);
    }

    @PreDestroy
    public void shutdown() {
        if (subscription != null) {
            subscription.close();
        }
        emitters.forEach(SseEmitter::complete);
        emitters.clear();
    }

    /**
     * Opens a new stream; it receives the current state first.
     */
    public SseEmitter register(VerdictSnapshot current) {
        SseEmitter emitter = emitterFactory.get();
        emitter.onCompletion(() -> emitters.remove(emitter));
        emitter.onTimeout(() -> emitters.remove(emitter));
        emitter.onError(e -> emitters.remove(emitter));
        emitters.add(emitter);
        send(emitter, STATE_EVENT, StatusView.of(current, clock.millis()));
        return emitter;
    }

    @Override
    public void refresh(VerdictSnapshot snapshot) {
        synchronized (this) {
            if (snapshot.equals(lastBroadcast)) {
                return;
            }
            lastBroadcast = snapshot;
        }
        broadcast(STATE_EVENT, StatusView.of(snapshot, clock.millis()));
    }

    public void broadcastNotification(Notification notification) {
        broadcast(NOTIFICATION_EVENT, notification);
    }

    int subscriberCount() {
        return emitters.size();
    }

    private void broadcast(String eventName, Object data) {
        for (SseEmitter emitter : emitters) {
            send(emitter, eventName, data);
        }
    }

    private void send(SseEmitter emitter, String eventName, Object data) {
        try {
            emitter.send(SseEmitter.event().name(eventName).data(data));
        } catch (IOException | IllegalStateException e) {
            logger.debug("Dropping state stream subscriber: {}", e.getMessage());
            emitters.remove(emitter);
        }
    }

    public record Notification(String title, String message, boolean improvement) {}
}
