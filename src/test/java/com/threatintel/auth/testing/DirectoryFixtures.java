package com.threatintel.auth.testing;

import com.threatintel.auth.config.AuthCoreConfig;
import com.threatintel.auth.config.ConditionPipelineSettings;
import com.threatintel.auth.directory.DirectorySnapshot;
import com.threatintel.auth.directory.SnapshotAssembler;
import com.threatintel.auth.dto.ChannelEntry;
import com.threatintel.auth.dto.CriteriaContainerEntry;
import com.threatintel.auth.dto.DirectoryDocument;
import com.threatintel.auth.dto.InsideCriteriaEntry;
import com.threatintel.auth.dto.OrganizationEntry;
import com.threatintel.auth.dto.ResourceEntry;
import com.threatintel.auth.dto.SourceEntry;
import com.threatintel.auth.dto.SubsourceEntry;
import com.threatintel.auth.engine.AccessInfoCompiler;
import com.threatintel.auth.engine.DirectoryViews;
import com.threatintel.auth.engine.GraphResolver;
import com.threatintel.auth.engine.NotificationConfigResolver;

import java.util.List;
import java.util.Optional;

/**
 * Builds directory documents for tests.
 * <p>
 * The standard document:
 * <ul>
 *   <li>sources {@code source.one} (anonymized as {@code a1}) and {@code x}
 *       (anonymized as {@code a2}, destination IP anonymization enabled)</li>
 *   <li>criteria containers {@code c1} (asn 1, 2, 3), {@code c2} (asn 3, 4, 5), {@code c3} (name foo)</li>
 *   <li>subsource {@code p1} of {@code source.one} including {@code c1}</li>
 *   <li>subsource {@code p5} of {@code x} including {@code c2} and {@code c3}, excluding {@code c1}</li>
 *   <li>{@code o1}: full access, {@code threats} access to {@code p1}, user {@code u1}</li>
 *   <li>{@code o5}: {@code threats} and {@code inside} access to {@code p5}, user {@code u5},
 *       stream API and email notifications enabled, inside criteria on 10.0.0.0/8</li>
 *   <li>{@code o7}: no access at all, stream API explicitly disabled, user {@code u7}</li>
 * </ul>
 */
public final class DirectoryFixtures {

    public static final long VERSION = 5;
    public static final double TIMESTAMP = 1_700_000_000.0;

    private DirectoryFixtures() {}

    public static DirectoryDocument standardDocument() {
        return standardDocument(VERSION, TIMESTAMP);
    }

    public static DirectoryDocument standardDocument(long version, double timestamp) {
        DirectoryDocument document = new DirectoryDocument(version, timestamp);
        document.ignoredIpNetworks.add("192.168.0.0/16");

        document.sources.add(new SourceEntry("source.one", "a1"));
        SourceEntry x = new SourceEntry("x", "a2");
        x.dipAnonymizationEnabled = "TRUE";
        document.sources.add(x);

        document.criteriaContainers.add(asnContainer("c1", 1, 2, 3));
        document.criteriaContainers.add(asnContainer("c2", 3, 4, 5));
        CriteriaContainerEntry c3 = new CriteriaContainerEntry("c3");
        c3.name.add("foo");
        document.criteriaContainers.add(c3);

        SubsourceEntry p1 = new SubsourceEntry("p1", "source.one");
        p1.inclusionCriteria.add("c1");
        document.subsources.add(p1);
        SubsourceEntry p5 = new SubsourceEntry("p5", "x");
        p5.inclusionCriteria.addAll(List.of("c2", "c3"));
        p5.exclusionCriteria.add("c1");
        document.subsources.add(p5);

        OrganizationEntry o1 = new OrganizationEntry("o1");
        o1.name = "Org One";
        o1.fullAccess = "TRUE";
        o1.users.add("u1");
        o1.channels.put("threats", channel("p1"));
        ResourceEntry threats = new ResourceEntry();
        threats.queriesLimit = "100";
        o1.resources.put("threats", threats);
        document.organizations.add(o1);

        OrganizationEntry o5 = new OrganizationEntry("o5");
        o5.users.add("u5");
        o5.channels.put("threats", channel("p5"));
        o5.channels.put("inside", channel("p5"));
        o5.streamApiEnabled = "TRUE";
        o5.emailNotificationsEnabled = "TRUE";
        o5.emailNotificationsTimes.addAll(List.of("9:30", "8"));
        o5.emailNotificationsAddresses.addAll(List.of("soc@o5.example", "abuse@o5.example"));
        o5.insideCriteria = new InsideCriteriaEntry();
        o5.insideCriteria.ipNetwork.add("10.0.0.0/8");
        o5.insideCriteria.fqdn.add("o5.example");
        o5.insideCriteria.url.add("http://o5.example/*");
        document.organizations.add(o5);

        OrganizationEntry o7 = new OrganizationEntry("o7");
        o7.users.add("u7");
        o7.streamApiEnabled = "FALSE";
        document.organizations.add(o7);

        return document;
    }

    public static DirectorySnapshot standardSnapshot() {
        return new SnapshotAssembler().assemble(standardDocument());
    }

    public static ChannelEntry channel(String... subsources) {
        return new ChannelEntry(List.of(subsources), List.of());
    }

    public static CriteriaContainerEntry asnContainer(String id, long... asns) {
        CriteriaContainerEntry container = new CriteriaContainerEntry(id);
        for (long asn : asns) {
            container.asn.add(asn);
        }
        return container;
    }

    public static AccessInfoCompiler accessInfoCompiler() {
        return new AccessInfoCompiler(new GraphResolver(), ConditionPipelineSettings.defaults());
    }

    public static DirectoryViews views() {
        GraphResolver graphResolver = new GraphResolver();
        return new DirectoryViews(graphResolver,
                new AccessInfoCompiler(graphResolver, ConditionPipelineSettings.defaults()),
                new NotificationConfigResolver());
    }

    /**
     * Configuration with the production defaults and no cache.
     */
    public static AuthCoreConfig config() {
        AuthCoreConfig config = new AuthCoreConfig();
        config.directoryPath = "directory.json";
        config.prefetchEnabled = true;
        config.maxSleepSeconds = 12;
        config.acceptableStalenessSeconds = 300;
        config.errorToleranceSeconds = 3600;
        config.firstSnapshotTimeoutSeconds = 60;
        config.cacheDir = Optional.empty();
        config.cacheShared = false;
        config.cacheSigningKey = Optional.empty();
        config.conditionOptimize = true;
        config.negationMode = "NULL_SAFE";
        config.compileTarget = "QUERY_EXPRESSION";
        return config;
    }
}
