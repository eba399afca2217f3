package net.assetdownloader.service.event;

import net.assetdownloader.model.RunCompletion;
import net.assetdownloader.model.RunProgress;
import org.junit.jupiter.api.Test;
import org.springframework.web.servlet.mvc.method.annotation.SseEmitter;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatCode;

class RunEventPublisherTest {

    private final RunEventPublisher publisher = new RunEventPublisher();

    @Test
    void should_KeepSubscribers_When_EventsAreBuffered() {
        publisher.subscribe();
        publisher.subscribe();

        publisher.onProgress(RunProgress.initial(3));
        publisher.onComplete(new RunCompletion(2, 1, 3, 0, "/tmp/log.csv", false));

        assertThat(publisher.subscriberCount()).isEqualTo(2);
    }

    @Test
    void should_DropSubscriber_When_EmitterAlreadyCompleted() {
        SseEmitter closed = publisher.subscribe();
        publisher.subscribe();
        closed.complete();

        publisher.onError("Cannot create audit log");

        assertThat(publisher.subscriberCount()).isEqualTo(1);
    }

    @Test
    void should_PublishWithoutSubscribers_When_NobodyListens() {
        assertThatCode(() -> publisher.onComplete(new RunCompletion(0, 0, 0, 0, "/tmp/log.csv", true)))
            .doesNotThrowAnyException();
        assertThat(publisher.subscriberCount()).isZero();
    }
}
