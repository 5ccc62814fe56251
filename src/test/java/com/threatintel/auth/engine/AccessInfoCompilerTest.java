package com.threatintel.auth.engine;

import com.threatintel.auth.directory.DirectorySnapshot;
import com.threatintel.auth.domain.AccessInfo;
import com.threatintel.auth.domain.AccessZone;
import com.threatintel.auth.domain.EventRecord;
import com.threatintel.auth.domain.NotificationAccessInfo;
import com.threatintel.auth.domain.StreamAccessInfo;
import com.threatintel.auth.domain.SubsourceAccessKey;
import com.threatintel.auth.testing.DirectoryFixtures;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.Map;
import java.util.Set;
import java.util.SortedMap;

import static org.assertj.core.api.Assertions.assertThat;

class AccessInfoCompilerTest {

    private static final String O1_CONDITION = "source = 'source.one' AND asn IN (1, 2, 3)";
    private static final String O5_CONDITION = "source = 'x' AND asn IN (3, 4, 5) AND name = 'foo'"
            + " AND (asn IS NULL OR asn NOT IN (1, 2, 3))"
            + " AND restriction != 'internal'"
            + " AND (ignored IS NULL OR NOT (ignored IS TRUE))";

    private final GraphResolver graphResolver = new GraphResolver();
    private final AccessInfoCompiler compiler = DirectoryFixtures.accessInfoCompiler();

    private DirectorySnapshot snapshot;

    @BeforeEach
    void setUp() {
        snapshot = DirectoryFixtures.standardSnapshot();
    }

    @Test
    void compilesConditionOfFullAccessOrganization() {
        AccessInfo o1 = compile().get("o1");

        assertThat(o1.isFullAccess()).isTrue();
        assertThat(o1.getAccessZoneConditions()).containsOnlyKeys(AccessZone.THREATS);
        assertThat(o1.getAccessZoneConditions().get(AccessZone.THREATS)).hasSize(1);
        assertThat(o1.getCondition(AccessZone.THREATS).toString()).isEqualTo(O1_CONDITION);
        assertThat(o1.getResourceLimits()).containsOnlyKeys("/report/threats");
    }

    @Test
    void restrictedOrganizationGetsRestrictionClause() {
        AccessInfo o5 = compile().get("o5");

        assertThat(o5.isFullAccess()).isFalse();
        assertThat(o5.getAccessZoneConditions()).containsOnlyKeys(AccessZone.INSIDE, AccessZone.THREATS);
        assertThat(o5.getCondition(AccessZone.THREATS).toString()).isEqualTo(O5_CONDITION);
        assertThat(o5.getCondition(AccessZone.INSIDE).toString()).isEqualTo(O5_CONDITION);
        assertThat(o5.getCondition(AccessZone.SEARCH)).isNull();
        assertThat(o5.getResourceLimits()).isEmpty();
    }

    @Test
    void organizationWithoutFactsHasNoAccessInfo() {
        assertThat(compile()).containsOnlyKeys("o1", "o5");
    }

    @Test
    void compilationIsDeterministic() {
        assertThat(compile()).isEqualTo(compile());
    }

    @Test
    void subsourceConditionIsRawConjunction() {
        assertThat(compiler.subsourceCondition(snapshot, snapshot.getSubsource("p5")).toString())
                .isEqualTo("(<source = x> AND <asn IN [3, 4, 5]> AND <name = foo> AND NOT <asn IN [1, 2, 3]>)");
    }

    @Test
    void streamMappingCoversStreamEnabledOrganizations() {
        SortedMap<String, SortedMap<String, StreamAccessInfo>> mapping =
                compiler.compileStreamAccessInfos(snapshot, graphResolver.resolveAccessFacts(snapshot));

        assertThat(mapping).containsOnlyKeys("x");
        StreamAccessInfo p5 = mapping.get("x").get("p5");
        assertThat(p5.zoneOrgIds()).containsOnlyKeys(AccessZone.values());
        assertThat(p5.zoneOrgIds().get(AccessZone.INSIDE)).containsExactly("o5");
        assertThat(p5.zoneOrgIds().get(AccessZone.THREATS)).containsExactly("o5");
        assertThat(p5.zoneOrgIds().get(AccessZone.SEARCH)).isEmpty();

        assertThat(p5.condition().getPredicate().matches(event("public"))).isTrue();
        assertThat(p5.condition().getPredicate().matches(event("internal"))).isFalse();
    }

    @Test
    void notificationMappingCoversEmailEnabledInsideAccess() {
        SortedMap<String, Map<SubsourceAccessKey, NotificationAccessInfo>> mapping =
                compiler.compileNotificationAccessInfos(snapshot, graphResolver.resolveAccessFacts(snapshot));

        assertThat(mapping).containsOnlyKeys("x");
        NotificationAccessInfo info = mapping.get("x").get(new SubsourceAccessKey("p5", false));
        assertThat(info.orgIds()).isEqualTo(Set.of("o5"));
        assertThat(info.condition().getPredicate().matches(event("public"))).isTrue();
        assertThat(info.condition().getPredicate().matches(event("internal"))).isFalse();
    }

    private SortedMap<String, AccessInfo> compile() {
        return compiler.compileAccessInfos(snapshot, graphResolver.resolveAccessFacts(snapshot));
    }

    private static EventRecord event(String restriction) {
        return EventRecord.builder()
                .field("source", "x")
                .field("name", "foo")
                .field("restriction", restriction)
                .address("10.1.2.3", 4L, "PL")
                .build();
    }
}
