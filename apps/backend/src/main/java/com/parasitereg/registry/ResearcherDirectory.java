package com.parasitereg.registry;

import com.parasitereg.identity.Identity;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.Optional;

import static com.parasitereg.registry.RegistryError.INVALID_INSTITUTION;

/**
 * 研究人员 -> 机构 的成员关系，由注册表所有者或机构管理员维护。
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class ResearcherDirectory {

    private final RegistryState state;
    private final AccessControl access;

    public Optional<String> membershipOf(Identity identity) {
        return state.read(() -> Optional.ofNullable(state.membership(identity)));
    }

    /** 指派（或改派）成员关系 */
    public void setMembership(Identity identity, String institutionId, Identity caller) {
        state.write(() -> {
            access.requireOwnerOrInstitutionAdmin(caller, institutionId, "set_researcher_membership");
            FieldLimits.requirePresent("researcher identity", identity);
            if (state.institution(institutionId) == null) {
                throw RegistryException.of(INVALID_INSTITUTION, "institution %s does not exist", institutionId);
            }
            String previous = state.membership(identity);
            state.putMembership(identity, institutionId);
            log.info("[MEMBER][SET] researcher={} institution={} previous={}", identity, institutionId, previous);
            return null;
        });
    }

    /**
     * 撤销成员关系。只有所有者或该研究人员当前所属机构的管理员可以撤销；
     * 对非成员的撤销在授权通过后视为成功。
     */
    public void revokeMembership(Identity identity, Identity caller) {
        state.write(() -> {
            String current = state.membership(identity);
            access.requireOwnerOrInstitutionAdmin(caller, current, "revoke_researcher_membership");
            if (current == null) {
                log.debug("[MEMBER][REVOKE] researcher={} had no membership", identity);
                return null;
            }
            state.removeMembership(identity);
            log.info("[MEMBER][REVOKE] researcher={} institution={}", identity, current);
            return null;
        });
    }
}
