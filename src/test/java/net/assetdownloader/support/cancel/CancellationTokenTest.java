package net.assetdownloader.support.cancel;

import net.assetdownloader.exception.DownloadCancelledException;
import org.junit.jupiter.api.Test;
import reactor.test.StepVerifier;

import java.time.Duration;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatCode;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class CancellationTokenTest {

    @Test
    void should_SignalSubscribers_When_Cancelled() {
        CancellationToken token = new CancellationToken();

        StepVerifier.create(token.onCancel())
            .then(token::cancel)
            .expectNext(Boolean.TRUE)
            .verifyComplete();
        assertThat(token.isCancelled()).isTrue();
    }

    @Test
    void should_ReplaySignal_When_SubscribingAfterCancel() {
        CancellationToken token = new CancellationToken();
        token.cancel();
        token.cancel();

        StepVerifier.create(token.onCancel())
            .expectNext(Boolean.TRUE)
            .verifyComplete();
    }

    @Test
    void should_StaySilent_When_NotCancelled() {
        CancellationToken token = new CancellationToken();

        StepVerifier.create(token.onCancel())
            .expectSubscription()
            .expectNoEvent(Duration.ofMillis(50))
            .thenCancel()
            .verify();
        assertThatCode(() -> token.throwIfCancelled("http://x/a.png")).doesNotThrowAnyException();
    }

    @Test
    void should_ThrowAtCheckpoint_When_Cancelled() {
        CancellationToken token = new CancellationToken();
        token.cancel();

        assertThatThrownBy(() -> token.throwIfCancelled("http://x/a.png"))
            .isInstanceOf(DownloadCancelledException.class)
            .hasMessage("Download cancelled");
    }
}
