package com.parasitereg.registry;

import com.parasitereg.TestIdentities;
import com.parasitereg.identity.Identity;
import com.parasitereg.registry.model.Institution;
import org.junit.jupiter.api.Test;

import static com.parasitereg.registry.RegistryFixture.OWNER;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class InstitutionRegistryTest {

    private final RegistryFixture fx = new RegistryFixture();
    private final Identity stranger = TestIdentities.named("stranger");

    @Test
    void ownerRegistersUnverifiedInstitutionAdministeredByOwner() {
        fx.institutions.registerInstitution("WHO_AFRICA", "WHO Regional Office for Africa", OWNER);

        Institution inst = fx.institutions.getInstitution("WHO_AFRICA").orElseThrow();
        assertThat(inst.getName()).isEqualTo("WHO Regional Office for Africa");
        assertThat(inst.isVerified()).isFalse();
        assertThat(inst.getAdmin()).isEqualTo(OWNER);
    }

    @Test
    void nonOwnerCannotRegisterOrVerify() {
        fx.institutions.registerInstitution("WHO_AFRICA", "WHO Africa", OWNER);
        RegistrySnapshot before = fx.state.snapshot();

        assertThatThrownBy(() -> fx.institutions.registerInstitution("ROGUE", "Rogue Lab", stranger))
                .isInstanceOf(RegistryException.class)
                .extracting("error").isEqualTo(RegistryError.NOT_AUTHORIZED);
        assertThatThrownBy(() -> fx.institutions.verifyInstitution("WHO_AFRICA", stranger))
                .isInstanceOf(RegistryException.class)
                .extracting("error").isEqualTo(RegistryError.NOT_AUTHORIZED);

        assertThat(fx.state.snapshot()).isEqualTo(before);
    }

    @Test
    void verifyIsIdempotentAndRequiresKnownInstitution() {
        fx.institutions.registerInstitution("WHO_AFRICA", "WHO Africa", OWNER);
        fx.institutions.verifyInstitution("WHO_AFRICA", OWNER);
        fx.institutions.verifyInstitution("WHO_AFRICA", OWNER);

        assertThat(fx.institutions.getInstitution("WHO_AFRICA").orElseThrow().isVerified()).isTrue();
        assertThatThrownBy(() -> fx.institutions.verifyInstitution("NOPE", OWNER))
                .isInstanceOf(RegistryException.class)
                .extracting("error").isEqualTo(RegistryError.INVALID_INSTITUTION);
    }

    @Test
    void duplicateRegistrationIsRejectedAndKeepsVerification() {
        fx.institutions.registerInstitution("WHO_AFRICA", "WHO Africa", OWNER);
        fx.institutions.verifyInstitution("WHO_AFRICA", OWNER);

        assertThatThrownBy(() -> fx.institutions.registerInstitution("WHO_AFRICA", "Impostor", OWNER))
                .isInstanceOf(RegistryException.class)
                .extracting("error").isEqualTo(RegistryError.DUPLICATE_INSTITUTION);

        Institution inst = fx.institutions.getInstitution("WHO_AFRICA").orElseThrow();
        assertThat(inst.getName()).isEqualTo("WHO Africa");
        assertThat(inst.isVerified()).isTrue();
    }

    @Test
    void overwriteModeReplacesInstitution() {
        fx.properties.getInstitutions().setAllowOverwrite(true);
        fx.institutions.registerInstitution("LAB", "Old name", OWNER);
        fx.institutions.verifyInstitution("LAB", OWNER);

        fx.institutions.registerInstitution("LAB", "New name", OWNER);

        Institution inst = fx.institutions.getInstitution("LAB").orElseThrow();
        assertThat(inst.getName()).isEqualTo("New name");
        assertThat(inst.isVerified()).isFalse();
    }

    @Test
    void fieldLimitsAreEnforced() {
        String longId = "X".repeat(51);
        assertThatThrownBy(() -> fx.institutions.registerInstitution(longId, "name", OWNER))
                .isInstanceOf(RegistryException.class)
                .extracting("error").isEqualTo(RegistryError.INVALID_ARGUMENT);
        assertThatThrownBy(() -> fx.institutions.registerInstitution("OK", "n".repeat(101), OWNER))
                .isInstanceOf(RegistryException.class)
                .extracting("error").isEqualTo(RegistryError.INVALID_ARGUMENT);
        assertThat(fx.institutions.listInstitutions()).isEmpty();
    }

    @Test
    void listIsOrderedById() {
        fx.institutions.registerInstitution("B_LAB", "B", OWNER);
        fx.institutions.registerInstitution("A_LAB", "A", OWNER);

        assertThat(fx.institutions.listInstitutions())
                .extracting(Institution::getId)
                .containsExactly("A_LAB", "B_LAB");
    }
}
