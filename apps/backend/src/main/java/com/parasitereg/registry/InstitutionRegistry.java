package com.parasitereg.registry;

import com.parasitereg.config.RegistryProperties;
import com.parasitereg.identity.Identity;
import com.parasitereg.registry.model.Institution;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

import static com.parasitereg.registry.RegistryError.DUPLICATE_INSTITUTION;
import static com.parasitereg.registry.RegistryError.INVALID_INSTITUTION;

@Slf4j
@Service
@RequiredArgsConstructor
public class InstitutionRegistry {

    private final RegistryState state;
    private final AccessControl access;
    private final RegistryProperties properties;

    public void registerInstitution(String id, String name, Identity caller) {
        state.write(() -> {
            access.requireOwner(caller, "register_institution");
            FieldLimits.require("institution id", id, FieldLimits.INSTITUTION_ID);
            FieldLimits.require("institution name", name, FieldLimits.INSTITUTION_NAME);

            Institution existing = state.institution(id);
            if (existing != null && !properties.getInstitutions().isAllowOverwrite()) {
                throw RegistryException.of(DUPLICATE_INSTITUTION, "institution %s is already registered", id);
            }
            state.putInstitution(Institution.builder()
                    .id(id)
                    .name(name)
                    .verified(false)
                    .admin(caller)
                    .build());
            log.info("[INST][REGISTER] id={} name='{}' overwrote={}", id, name, existing != null);
            return null;
        });
    }

    public void verifyInstitution(String id, Identity caller) {
        state.write(() -> {
            access.requireOwner(caller, "verify_institution");
            Institution existing = state.institution(id);
            if (existing == null) {
                throw RegistryException.of(INVALID_INSTITUTION, "institution %s does not exist", id);
            }
            if (existing.isVerified()) {
                log.debug("[INST][VERIFY] id={} already verified", id);
                return null;
            }
            state.putInstitution(existing.toBuilder().verified(true).build());
            log.info("[INST][VERIFY] id={} verified", id);
            return null;
        });
    }

    public Optional<Institution> getInstitution(String id) {
        return state.read(() -> Optional.ofNullable(state.institution(id)));
    }

    public List<Institution> listInstitutions() {
        return state.read(() -> {
            List<Institution> out = new ArrayList<>();
            state.institutions().forEach(out::add);
            return out;
        });
    }
}
