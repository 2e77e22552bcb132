package com.deepknow.abis.interview.domain.session;

import com.deepknow.abis.interview.domain.emotion.EmotionSnapshot;
import com.deepknow.abis.interview.domain.emotion.ModalitySnapshot;
import org.junit.jupiter.api.Test;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.concurrent.RejectedExecutionException;

import static org.assertj.core.api.Assertions.assertThat;

class SnapshotPublisherTest {

    private static EmotionSnapshot snapshot(long total) {
        ModalitySnapshot empty = new ModalitySnapshot(null, null, null, 1.0, 0);
        return new EmotionSnapshot("s-1", empty, empty, total);
    }

    @Test
    void pendingSnapshotsCoalesceToLatest() {
        Deque<Runnable> queued = new ArrayDeque<>();
        List<Long> delivered = new ArrayList<>();
        SnapshotPublisher publisher = new SnapshotPublisher("s-1", queued::add, s -> delivered.add(s.getTotalSamples()));

        publisher.publish(snapshot(1));
        publisher.publish(snapshot(2));
        publisher.publish(snapshot(3));
        assertThat(queued).hasSize(1);

        queued.poll().run();

        assertThat(delivered).containsExactly(3L);
        assertThat(queued).isEmpty();
    }

    @Test
    void failingConsumerDoesNotStopDelivery() {
        List<Long> delivered = new ArrayList<>();
        SnapshotPublisher publisher = new SnapshotPublisher("s-1", Runnable::run, s -> {
            delivered.add(s.getTotalSamples());
            if (s.getTotalSamples() == 1) throw new IllegalStateException("socket closed");
        });

        publisher.publish(snapshot(1));
        publisher.publish(snapshot(2));

        assertThat(delivered).containsExactly(1L, 2L);
    }

    @Test
    void rejectedDeliveryCanBeRetriedByNextPublish() {
        List<Long> delivered = new ArrayList<>();
        boolean[] reject = {true};
        SnapshotPublisher publisher = new SnapshotPublisher("s-1", r -> {
            if (reject[0]) throw new RejectedExecutionException("full");
            r.run();
        }, s -> delivered.add(s.getTotalSamples()));

        publisher.publish(snapshot(1));
        reject[0] = false;
        publisher.publish(snapshot(2));

        assertThat(delivered).containsExactly(2L);
    }
}
