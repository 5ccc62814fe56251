package com.threatintel.auth.snapshot;

import com.threatintel.auth.directory.DirectorySnapshot;
import com.threatintel.auth.directory.SnapshotAssembler;
import com.threatintel.auth.error.CommunicationException;
import com.threatintel.auth.testing.DirectoryFixtures;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class SnapshotHolderTest {

    @Test
    void emptyUntilFirstPublication() {
        SnapshotHolder holder = new SnapshotHolder(Duration.ofMillis(50));

        assertThat(holder.peek()).isNull();
        assertThatThrownBy(holder::current)
                .isInstanceOf(CommunicationException.class)
                .hasMessageContaining("No directory snapshot available");
    }

    @Test
    void waitingReaderGetsFirstSnapshot() throws Exception {
        SnapshotHolder holder = new SnapshotHolder(Duration.ofSeconds(5));
        DirectorySnapshot snapshot = DirectoryFixtures.standardSnapshot();

        CompletableFuture<DirectorySnapshot> reader = CompletableFuture.supplyAsync(holder::current);
        holder.publish(snapshot);

        assertThat(reader.get(5, TimeUnit.SECONDS)).isSameAs(snapshot);
    }

    @Test
    void laterPublicationReplacesSnapshot() {
        SnapshotHolder holder = new SnapshotHolder(Duration.ofSeconds(1));
        DirectorySnapshot first = DirectoryFixtures.standardSnapshot();
        DirectorySnapshot second = new SnapshotAssembler().assemble(
                DirectoryFixtures.standardDocument(6, DirectoryFixtures.TIMESTAMP + 1));

        holder.publish(first);
        holder.publish(second);

        assertThat(holder.peek()).isSameAs(second);
        assertThat(holder.current()).isSameAs(second);
    }

    @Test
    void failedFirstSnapshotFailsWaitingReaders() {
        SnapshotHolder holder = new SnapshotHolder(Duration.ofSeconds(5));

        holder.failFirst(new IllegalStateException("gave up"));

        assertThatThrownBy(holder::current)
                .isInstanceOf(CommunicationException.class)
                .hasRootCauseMessage("gave up");
    }

    @Test
    void failureAfterPublicationIsIgnored() {
        SnapshotHolder holder = new SnapshotHolder(Duration.ofSeconds(1));
        DirectorySnapshot snapshot = DirectoryFixtures.standardSnapshot();
        holder.publish(snapshot);

        holder.failFirst(new IllegalStateException("gave up"));

        assertThat(holder.current()).isSameAs(snapshot);
    }
}
