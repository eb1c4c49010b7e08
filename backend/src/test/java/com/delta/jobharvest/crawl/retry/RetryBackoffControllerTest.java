package com.delta.jobharvest.crawl.retry;

import com.delta.jobharvest.crawl.model.Classification;
import com.delta.jobharvest.crawl.model.CrawlTask;
import org.junit.jupiter.api.Test;

import java.time.Duration;

import static org.assertj.core.api.Assertions.assertThat;

class RetryBackoffControllerTest {

    @Test
    void okProceedsWithoutTouchingTheIdentity() {
        RetryBackoffController controller = new RetryBackoffController(3, 100, 1000, () -> 1.0);
        BackoffDecision decision = controller.decide(task(0), Classification.OK);
        assertThat(decision.isProceed()).isTrue();
        assertThat(decision.identityAction()).isEqualTo(IdentityAction.KEEP);
    }

    @Test
    void blocksPickTheMatchingIdentityAction() {
        RetryBackoffController controller = new RetryBackoffController(3, 100, 1000, () -> 1.0);
        assertThat(controller.decide(task(0), Classification.HARD_BLOCK).identityAction())
            .isEqualTo(IdentityAction.RETIRE);
        assertThat(controller.decide(task(0), Classification.SOFT_BLOCK).identityAction())
            .isEqualTo(IdentityAction.REFRESH_COOKIES);
        assertThat(controller.decide(task(0), Classification.TRANSPORT_ERROR).identityAction())
            .isEqualTo(IdentityAction.KEEP);
    }

    @Test
    void delayGrowsExponentiallyAndIsCapped() {
        RetryBackoffController controller = new RetryBackoffController(10, 100, 1000, () -> 1.0);
        assertThat(controller.delayFor(0)).isEqualTo(Duration.ofMillis(100));
        assertThat(controller.delayFor(1)).isEqualTo(Duration.ofMillis(200));
        assertThat(controller.delayFor(3)).isEqualTo(Duration.ofMillis(800));
        assertThat(controller.delayFor(4)).isEqualTo(Duration.ofMillis(1000));
        assertThat(controller.delayFor(40)).isEqualTo(Duration.ofMillis(1000));
    }

    @Test
    void jitterIsClampedToItsRange() {
        RetryBackoffController low = new RetryBackoffController(3, 100, 10_000, () -> 0.0);
        RetryBackoffController high = new RetryBackoffController(3, 100, 10_000, () -> 5.0);
        assertThat(low.delayFor(0)).isEqualTo(Duration.ofMillis(50));
        assertThat(high.delayFor(0).toMillis()).isBetween(129L, 130L);
    }

    @Test
    void abandonsOnceRetriesAreSpent() {
        RetryBackoffController controller = new RetryBackoffController(2, 100, 1000, () -> 1.0);
        assertThat(controller.decide(task(0), Classification.HARD_BLOCK).isRetry()).isTrue();
        assertThat(controller.decide(task(1), Classification.HARD_BLOCK).isRetry()).isTrue();
        BackoffDecision last = controller.decide(task(2), Classification.HARD_BLOCK);
        assertThat(last.isAbandon()).isTrue();
        assertThat(last.identityAction()).isEqualTo(IdentityAction.RETIRE);
    }

    @Test
    void zeroAttemptsAbandonsImmediately() {
        RetryBackoffController controller = new RetryBackoffController(0, 100, 1000, () -> 1.0);
        assertThat(controller.decide(task(0), Classification.TRANSPORT_ERROR).isAbandon()).isTrue();
    }

    private CrawlTask task(int attempt) {
        CrawlTask task = CrawlTask.detail("https://jobs.example.test/desc/1", null, 1);
        for (int i = 0; i < attempt; i++) {
            task = task.nextAttempt();
        }
        return task;
    }
}
