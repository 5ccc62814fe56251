package com.threatintel.auth.cache;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.threatintel.auth.directory.DirectorySnapshot;
import com.threatintel.auth.directory.SnapshotAssembler;
import com.threatintel.auth.dto.CacheMetadata;
import com.threatintel.auth.dto.DirectoryDocument;
import com.threatintel.auth.error.CacheIntegrityException;
import com.threatintel.auth.error.DirectoryStructureException;
import org.jboss.logging.Logger;

import java.io.IOException;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;

/**
 * On-disk cache of the last built snapshot: a signed payload file holding the
 * directory document, plus a small JSON metadata file describing it.
 * <p>
 * Both files are replaced atomically (write to a temporary file, then rename),
 * payload first, so a reader never sees a half-written file. Concurrent writers
 * from several processes are kept apart by {@link CacheLockSet}.
 */
public class PickleCacheStore {

    private static final Logger LOG = Logger.getLogger(PickleCacheStore.class);

    static final String PAYLOAD_FILE = "directory-snapshot.cache";
    static final String METADATA_FILE = "directory-snapshot.meta.json";

    private final Path payloadPath;
    private final Path metadataPath;
    private final CachePayloadCodec codec;
    private final ObjectMapper mapper;
    private final SnapshotAssembler assembler;

    public PickleCacheStore(Path dir, CachePayloadCodec codec, ObjectMapper mapper, SnapshotAssembler assembler) {
        this.payloadPath = dir.resolve(PAYLOAD_FILE);
        this.metadataPath = dir.resolve(METADATA_FILE);
        this.codec = codec;
        this.mapper = mapper;
        this.assembler = assembler;
    }

    public Path getPayloadPath() {
        return payloadPath;
    }

    /**
     * @return the metadata, or null if there is no (readable) cache
     */
    public CacheMetadata readMetadata() {
        try {
            return mapper.readValue(Files.readAllBytes(metadataPath), CacheMetadata.class);
        } catch (NoSuchFileException e) {
            return null;
        } catch (IOException e) {
            LOG.warnf("Cannot read snapshot cache metadata %s: %s", metadataPath, e.getMessage());
            return null;
        }
    }

    /**
     * Loads the cached snapshot.
     *
     * @param expected metadata the caller based its decision on; the payload must be of the same version
     * @throws CacheIntegrityException if the payload is missing, fails verification, or
     *                                 does not hold the expected version
     */
    public DirectorySnapshot load(CacheMetadata expected) {
        long start = System.currentTimeMillis();
        byte[] payload;
        try {
            payload = Files.readAllBytes(payloadPath);
        } catch (IOException e) {
            throw new CacheIntegrityException("Cannot read snapshot cache " + payloadPath, e);
        }
        CachePayloadCodec.Decoded decoded = codec.decode(payload);

        DirectoryDocument document;
        try {
            document = mapper.readValue(decoded.body(), DirectoryDocument.class);
        } catch (IOException e) {
            throw new CacheIntegrityException("Cannot parse snapshot cache body: " + e.getMessage(), e);
        }
        if (document.version != expected.version) {
            throw new CacheIntegrityException("Snapshot cache holds v" + document.version
                    + " while its metadata says v" + expected.version);
        }
        DirectorySnapshot snapshot;
        try {
            snapshot = assembler.assemble(document);
        } catch (DirectoryStructureException e) {
            throw new CacheIntegrityException("Cached directory document is unusable: " + e.getMessage(), e);
        }
        LOG.infof("Loaded snapshot v%d from cache (written by %s) in %dms",
                snapshot.getVersion(), decoded.stamperId(), System.currentTimeMillis() - start);
        return snapshot;
    }

    /**
     * Writes the snapshot's document and then the metadata.
     *
     * @param jobDurationSeconds how long it took to build the snapshot
     */
    public void write(DirectorySnapshot snapshot, double jobDurationSeconds) throws IOException {
        long start = System.currentTimeMillis();
        Files.createDirectories(payloadPath.getParent());
        byte[] body = mapper.writeValueAsBytes(snapshot.getDocument());
        writeAtomically(payloadPath, codec.encode(body));
        CacheMetadata metadata = new CacheMetadata(snapshot.getVersion(), snapshot.getTimestamp(), jobDurationSeconds);
        writeAtomically(metadataPath, mapper.writeValueAsBytes(metadata));
        LOG.infof("Wrote snapshot v%d to cache %s (%d bytes) in %dms",
                snapshot.getVersion(), payloadPath, body.length, System.currentTimeMillis() - start);
    }

    private static void writeAtomically(Path target, byte[] content) throws IOException {
        Path temp = Files.createTempFile(target.getParent(), target.getFileName().toString(), ".tmp");
        try {
            Files.write(temp, content);
            try {
                Files.move(temp, target, StandardCopyOption.ATOMIC_MOVE, StandardCopyOption.REPLACE_EXISTING);
            } catch (AtomicMoveNotSupportedException e) {
                Files.move(temp, target, StandardCopyOption.REPLACE_EXISTING);
            }
        } finally {
            Files.deleteIfExists(temp);
        }
    }
}
