package com.parasitereg.registry;

import com.parasitereg.TestIdentities;
import com.parasitereg.identity.Identity;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import static com.parasitereg.registry.RegistryFixture.OWNER;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ResearcherDirectoryTest {

    private final RegistryFixture fx = new RegistryFixture();
    private final Identity researcher = TestIdentities.named("researcher");
    private final Identity stranger = TestIdentities.named("stranger");

    @BeforeEach
    void setUp() {
        fx.institutions.registerInstitution("WHO_AFRICA", "WHO Africa", OWNER);
        fx.institutions.registerInstitution("CDC", "CDC", OWNER);
    }

    @Test
    void ownerAssignsAndReassignsMembership() {
        assertThat(fx.researchers.membershipOf(researcher)).isEmpty();

        fx.researchers.setMembership(researcher, "WHO_AFRICA", OWNER);
        assertThat(fx.researchers.membershipOf(researcher)).contains("WHO_AFRICA");

        fx.researchers.setMembership(researcher, "CDC", OWNER);
        assertThat(fx.researchers.membershipOf(researcher)).contains("CDC");
    }

    @Test
    void strangerCannotAssign() {
        RegistrySnapshot before = fx.state.snapshot();

        assertThatThrownBy(() -> fx.researchers.setMembership(researcher, "WHO_AFRICA", stranger))
                .isInstanceOf(RegistryException.class)
                .extracting("error").isEqualTo(RegistryError.NOT_AUTHORIZED);

        assertThat(fx.state.snapshot()).isEqualTo(before);
    }

    @Test
    void unknownInstitutionIsRejected() {
        assertThatThrownBy(() -> fx.researchers.setMembership(researcher, "NOPE", OWNER))
                .isInstanceOf(RegistryException.class)
                .extracting("error").isEqualTo(RegistryError.INVALID_INSTITUTION);
        assertThat(fx.researchers.membershipOf(researcher)).isEmpty();
    }

    @Test
    void revokeRemovesMembership() {
        fx.researchers.setMembership(researcher, "WHO_AFRICA", OWNER);

        assertThatThrownBy(() -> fx.researchers.revokeMembership(researcher, stranger))
                .isInstanceOf(RegistryException.class)
                .extracting("error").isEqualTo(RegistryError.NOT_AUTHORIZED);
        assertThat(fx.researchers.membershipOf(researcher)).contains("WHO_AFRICA");

        fx.researchers.revokeMembership(researcher, OWNER);
        assertThat(fx.researchers.membershipOf(researcher)).isEmpty();

        // 再次撤销是无操作
        fx.researchers.revokeMembership(researcher, OWNER);
        assertThat(fx.researchers.membershipOf(researcher)).isEmpty();
    }
}
