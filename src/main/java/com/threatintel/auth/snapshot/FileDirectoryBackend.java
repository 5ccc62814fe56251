package com.threatintel.auth.snapshot;

import com.fasterxml.jackson.core.JsonParser;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.JsonToken;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import com.threatintel.auth.config.AuthCoreConfig;
import com.threatintel.auth.config.JacksonConfig;
import com.threatintel.auth.dto.CriteriaContainerEntry;
import com.threatintel.auth.dto.DirectoryDocument;
import com.threatintel.auth.dto.OrganizationEntry;
import com.threatintel.auth.dto.OrganizationGroupEntry;
import com.threatintel.auth.dto.SourceEntry;
import com.threatintel.auth.dto.SubsourceEntry;
import com.threatintel.auth.dto.SubsourceGroupEntry;
import com.threatintel.auth.error.CommunicationException;
import com.threatintel.auth.error.DirectoryStructureException;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import org.jboss.logging.Logger;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * Directory backend reading a dump file (JSON, or YAML when the file name ends
 * with {@code .yaml} or {@code .yml}).
 * <p>
 * The file is re-read on every call, so replacing it (atomically) publishes a
 * new directory version.
 */
@ApplicationScoped
public class FileDirectoryBackend implements DirectoryBackend {

    private static final Logger LOG = Logger.getLogger(FileDirectoryBackend.class);

    private static final String VERSION = "version";
    private static final String TIMESTAMP = "timestamp";

    private final Path path;
    private final ObjectMapper mapper;

    @Inject
    public FileDirectoryBackend(AuthCoreConfig config) {
        this(Paths.get(config.directoryPath));
    }

    public FileDirectoryBackend(Path path) {
        this.path = path;
        String fileName = path.getFileName() == null ? "" : path.getFileName().toString().toLowerCase(Locale.ROOT);
        ObjectMapper base = fileName.endsWith(".yaml") || fileName.endsWith(".yml")
                ? new ObjectMapper(new YAMLFactory())
                : new ObjectMapper();
        this.mapper = JacksonConfig.apply(base);
    }

    public Path getPath() {
        return path;
    }

    /**
     * Streams the top-level fields of the dump until both {@code version} and
     * {@code timestamp} have been seen; other fields are skipped unparsed.
     */
    @Override
    public DirectoryVersion peekVersion() {
        try (InputStream in = Files.newInputStream(path);
             JsonParser parser = mapper.getFactory().createParser(in)) {
            if (parser.nextToken() != JsonToken.START_OBJECT) {
                throw new DirectoryStructureException("Directory dump " + path + " is not an object");
            }
            Long version = null;
            Double timestamp = null;
            while (parser.nextToken() == JsonToken.FIELD_NAME) {
                String field = parser.getCurrentName();
                parser.nextToken();
                if (VERSION.equals(field)) {
                    version = parser.getValueAsLong();
                } else if (TIMESTAMP.equals(field)) {
                    timestamp = parser.getValueAsDouble();
                } else {
                    parser.skipChildren();
                }
                if (version != null && timestamp != null) {
                    break;
                }
            }
            if (version == null || timestamp == null) {
                throw new DirectoryStructureException(
                        "Directory dump " + path + " lacks top-level version/timestamp");
            }
            return new DirectoryVersion(version, timestamp);
        } catch (JsonProcessingException e) {
            throw new DirectoryStructureException("Cannot parse directory dump " + path + ": " + e.getOriginalMessage(), e);
        } catch (IOException e) {
            throw new CommunicationException("Cannot read directory dump " + path, e);
        }
    }

    @Override
    public DirectoryDocument fetch(CancellationToken token) {
        long start = System.currentTimeMillis();
        JsonNode root;
        try {
            root = mapper.readTree(path.toFile());
        } catch (JsonProcessingException e) {
            throw new DirectoryStructureException("Cannot parse directory dump " + path + ": " + e.getOriginalMessage(), e);
        } catch (IOException e) {
            throw new CommunicationException("Cannot read directory dump " + path, e);
        }
        if (root == null || !root.isObject()) {
            throw new DirectoryStructureException("Directory dump " + path + " is not an object");
        }
        if (!root.path(VERSION).isNumber() || !root.path(TIMESTAMP).isNumber()) {
            throw new DirectoryStructureException("Directory dump " + path + " lacks top-level version/timestamp");
        }

        DirectoryDocument document = new DirectoryDocument();
        document.version = root.get(VERSION).asLong();
        document.timestamp = root.get(TIMESTAMP).asDouble();

        token.throwIfCancelled();
        document.ignoredIpNetworks = section(root, "ignored_ip_networks", new TypeReference<List<String>>() {});
        token.throwIfCancelled();
        document.sources = section(root, "sources", new TypeReference<List<SourceEntry>>() {});
        token.throwIfCancelled();
        document.criteriaContainers = section(root, "criteria_containers",
                new TypeReference<List<CriteriaContainerEntry>>() {});
        token.throwIfCancelled();
        document.subsources = section(root, "subsources", new TypeReference<List<SubsourceEntry>>() {});
        token.throwIfCancelled();
        document.subsourceGroups = section(root, "subsource_groups",
                new TypeReference<List<SubsourceGroupEntry>>() {});
        token.throwIfCancelled();
        document.organizationGroups = section(root, "organization_groups",
                new TypeReference<List<OrganizationGroupEntry>>() {});
        token.throwIfCancelled();
        document.organizations = section(root, "organizations", new TypeReference<List<OrganizationEntry>>() {});
        token.throwIfCancelled();

        LOG.infof("Fetched directory v%d from %s (%d organizations) in %dms",
                document.version, path, document.organizations.size(), System.currentTimeMillis() - start);
        return document;
    }

    private <T> List<T> section(JsonNode root, String name, TypeReference<List<T>> type) {
        JsonNode node = root.get(name);
        if (node == null || node.isNull()) {
            return new ArrayList<>();
        }
        if (!node.isArray()) {
            throw new DirectoryStructureException("Section '" + name + "' of directory dump " + path + " is not a list");
        }
        try {
            return mapper.readerFor(type).readValue(node);
        } catch (IOException e) {
            throw new DirectoryStructureException("Cannot parse section '" + name + "' of directory dump "
                    + path + ": " + e.getMessage(), e);
        }
    }
}
