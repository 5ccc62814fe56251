package com.threatintel.auth.cache;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.threatintel.auth.config.JacksonConfig;
import com.threatintel.auth.directory.DirectorySnapshot;
import com.threatintel.auth.directory.SnapshotAssembler;
import com.threatintel.auth.dto.CacheMetadata;
import com.threatintel.auth.engine.DirectoryViews;
import com.threatintel.auth.error.CacheIntegrityException;
import com.threatintel.auth.testing.DirectoryFixtures;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class PickleCacheStoreTest {

    private static final String KEY = "0123456789abcdef0123456789abcdef";

    @TempDir
    Path dir;

    private final ObjectMapper mapper = JacksonConfig.apply(new ObjectMapper());
    private PickleCacheStore store;

    @BeforeEach
    void setUp() {
        store = new PickleCacheStore(dir, new CachePayloadCodec(KEY, Clock.systemUTC()), mapper, new SnapshotAssembler());
    }

    @Test
    void noMetadataWithoutCache() {
        assertThat(store.readMetadata()).isNull();
    }

    @Test
    void unreadableMetadataCountsAsNoCache() throws Exception {
        Files.writeString(dir.resolve(PickleCacheStore.METADATA_FILE), "{not json");

        assertThat(store.readMetadata()).isNull();
    }

    @Test
    void loadsWhatWasWritten() throws Exception {
        DirectorySnapshot snapshot = DirectoryFixtures.standardSnapshot();
        DirectoryViews views = DirectoryFixtures.views();

        store.write(snapshot, 2.5);
        CacheMetadata metadata = store.readMetadata();
        DirectorySnapshot loaded = store.load(metadata);

        assertThat(metadata.version).isEqualTo(DirectoryFixtures.VERSION);
        assertThat(metadata.timestamp).isEqualTo(DirectoryFixtures.TIMESTAMP);
        assertThat(metadata.jobDuration).isEqualTo(2.5);
        assertThat(loaded.getVersion()).isEqualTo(snapshot.getVersion());
        assertThat(views.orgIdsToAccessInfos(loaded)).isEqualTo(views.orgIdsToAccessInfos(snapshot));
        assertThat(views.orgIdsToCombinedConfigs(loaded)).isEqualTo(views.orgIdsToCombinedConfigs(snapshot));
        assertThat(dir).isDirectoryNotContaining("glob:**.tmp");
    }

    @Test
    void rejectsPayloadOfOtherVersionThanMetadata() throws Exception {
        store.write(DirectoryFixtures.standardSnapshot(), 1.0);

        CacheMetadata newer = new CacheMetadata(DirectoryFixtures.VERSION + 1, DirectoryFixtures.TIMESTAMP, 1.0);

        assertThatThrownBy(() -> store.load(newer))
                .isInstanceOf(CacheIntegrityException.class)
                .hasMessageContaining("v" + DirectoryFixtures.VERSION);
    }

    @Test
    void rejectsPayloadWrittenWithOtherKey() throws Exception {
        PickleCacheStore foreign = new PickleCacheStore(dir,
                new CachePayloadCodec("some other key of sufficient size", Clock.systemUTC()),
                mapper, new SnapshotAssembler());
        foreign.write(DirectoryFixtures.standardSnapshot(), 1.0);

        assertThatThrownBy(() -> store.load(store.readMetadata())).isInstanceOf(CacheIntegrityException.class);
    }

    @Test
    void missingPayloadIsAnIntegrityFailure() {
        CacheMetadata metadata = new CacheMetadata(DirectoryFixtures.VERSION, DirectoryFixtures.TIMESTAMP, 1.0);

        assertThatThrownBy(() -> store.load(metadata)).isInstanceOf(CacheIntegrityException.class);
    }

    @Test
    void rewritingReplacesPreviousCache() throws Exception {
        SnapshotAssembler assembler = new SnapshotAssembler();
        store.write(DirectoryFixtures.standardSnapshot(), 1.0);
        store.write(assembler.assemble(DirectoryFixtures.standardDocument(9, DirectoryFixtures.TIMESTAMP + 60)), 1.0);

        CacheMetadata metadata = store.readMetadata();

        assertThat(metadata.version).isEqualTo(9);
        assertThat(store.load(metadata).getVersion()).isEqualTo(9);
    }
}
