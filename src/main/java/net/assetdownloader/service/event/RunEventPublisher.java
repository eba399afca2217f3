package net.assetdownloader.service.event;

import net.assetdownloader.application.download.DownloadRunListener;
import net.assetdownloader.model.RunCompletion;
import net.assetdownloader.model.RunProgress;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.web.servlet.mvc.method.annotation.SseEmitter;

import java.io.IOException;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * Fans download run events out to Server-Sent Event subscribers.
 *
 * <p>Event names: {@code progress}, {@code complete}, {@code cancelled} and {@code error}.</p>
 */
@Service
public class RunEventPublisher implements DownloadRunListener {

    private static final Logger log = LoggerFactory.getLogger(RunEventPublisher.class);

    static final String EVENT_PROGRESS = "progress";
    static final String EVENT_COMPLETE = "complete";
    static final String EVENT_CANCELLED = "cancelled";
    static final String EVENT_ERROR = "error";

    private final List<SseEmitter> emitters = new CopyOnWriteArrayList<>();

    /** Registers a new subscriber with no server-side timeout. */
    public SseEmitter subscribe() {
        SseEmitter emitter = new SseEmitter(0L);
        emitters.add(emitter);

        emitter.onCompletion(() -> emitters.remove(emitter));
        emitter.onTimeout(() -> emitters.remove(emitter));
        emitter.onError(ex -> emitters.remove(emitter));

        return emitter;
    }

    int subscriberCount() {
        return emitters.size();
    }

    @Override
    public void onProgress(RunProgress progress) {
        publish(EVENT_PROGRESS, progress);
    }

    @Override
    public void onComplete(RunCompletion completion) {
        publish(completion.cancelled() ? EVENT_CANCELLED : EVENT_COMPLETE, completion);
    }

    @Override
    public void onError(String message) {
        publish(EVENT_ERROR, Map.of("message", message));
    }

    private void publish(String type, Object payload) {
        for (SseEmitter emitter : emitters) {
            try {
                emitter.send(SseEmitter.event().name(type).data(payload));
            } catch (IOException | IllegalStateException e) {
                log.debug("Removing SSE emitter after send failure: {}", e.getMessage());
                emitters.remove(emitter);
            }
        }
    }
}
