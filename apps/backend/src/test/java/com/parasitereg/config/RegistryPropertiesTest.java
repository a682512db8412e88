package com.parasitereg.config;

import com.parasitereg.TestIdentities;
import com.parasitereg.identity.Identity;
import com.parasitereg.registry.InstitutionRegistry;
import com.parasitereg.registry.RecordStore;
import com.parasitereg.registry.RegistryState;
import com.parasitereg.registry.ResearcherDirectory;
import com.parasitereg.registry.SequenceClock;
import com.parasitereg.registry.LogicalSequenceClock;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * 确认 registry.* 能正确绑定，并装配出以配置所有者为准的注册表。
 */
@SpringBootTest
class RegistryPropertiesTest {

    private static final Identity OWNER = Identity.fromHex("00112233445566778899aabbccddeeff00112233");

    @Autowired
    private RegistryProperties props;

    @Autowired
    private RegistryState state;

    @Autowired
    private SequenceClock clock;

    @Autowired
    private InstitutionRegistry institutions;

    @Autowired
    private ResearcherDirectory researchers;

    @Autowired
    private RecordStore records;

    @Test
    void shouldBindRegistryConfig() {
        assertThat(props.getOwner()).isEqualTo("00112233445566778899aabbccddeeff00112233");
        assertThat(props.getClock()).isEqualTo(RegistryProperties.ClockMode.LOGICAL);
        assertThat(props.getClockStart()).isEqualTo(100);
        assertThat(props.getInstitutions().isAllowOverwrite()).isFalse();

        assertThat(state.getOwner()).isEqualTo(OWNER);
        assertThat(clock).isInstanceOf(LogicalSequenceClock.class);
    }

    @Test
    void wiredComponentsShareOneRegistry() {
        Identity researcher = TestIdentities.named("wired-researcher");
        institutions.registerInstitution("WIRED_LAB", "Wired Lab", OWNER);
        institutions.verifyInstitution("WIRED_LAB", OWNER);
        researchers.setMembership(researcher, "WIRED_LAB", OWNER);

        long before = records.getTotalRecords();
        long id = records.addRecord("Ascaris lumbricoides", "Nematoda", "Wired Region",
                TestIdentities.hash("wired"), researcher);

        assertThat(id).isEqualTo(before + 1);
        assertThat(records.getRecord(id).orElseThrow().getRecordedAt()).isGreaterThanOrEqualTo(100);
    }
}
