package com.parasitereg.registry;

import com.parasitereg.identity.Identity;
import com.parasitereg.registry.model.Institution;
import com.parasitereg.registry.model.ParasiteRecord;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.Objects;

import static com.parasitereg.registry.RegistryError.NOT_AUTHORIZED;
import static com.parasitereg.registry.RegistryError.NOT_VERIFIED;

/**
 * 集中的授权谓词。各组件在任何修改之前调用 require*，失败即抛出对应的错误类别。
 * <p>
 * 谓词直接读取注册表状态，必须在 {@link RegistryState#read}/{@link RegistryState#write} 内调用。
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class AccessControl {

    private final RegistryState state;

    public boolean isOwner(Identity caller) {
        return Objects.equals(state.getOwner(), caller);
    }

    public boolean isInstitutionAdmin(Identity caller, String institutionId) {
        Institution institution = state.institution(institutionId);
        return institution != null && caller != null && caller.equals(institution.getAdmin());
    }

    /** 调用方有成员身份，且所属机构存在并已认证 */
    public boolean isVerifiedMember(Identity caller) {
        Institution institution = state.institution(state.membership(caller));
        return institution != null && institution.isVerified();
    }

    /** 记录作者本人，或调用方所属机构的管理员 */
    public boolean isAuthorOrOwnInstitutionAdmin(Identity caller, ParasiteRecord record) {
        if (caller == null) {
            return false;
        }
        if (caller.equals(record.getAuthor())) {
            return true;
        }
        return isInstitutionAdmin(caller, state.membership(caller));
    }

    void requireOwner(Identity caller, String action) {
        if (!isOwner(caller)) {
            log.warn("[ACL][DENY] {} requires registry owner caller={}", action, caller);
            throw RegistryException.of(NOT_AUTHORIZED, "%s requires the registry owner", action);
        }
    }

    void requireOwnerOrInstitutionAdmin(Identity caller, String institutionId, String action) {
        if (!isOwner(caller) && !isInstitutionAdmin(caller, institutionId)) {
            log.warn("[ACL][DENY] {} requires owner or admin of {} caller={}", action, institutionId, caller);
            throw RegistryException.of(NOT_AUTHORIZED,
                    "%s requires the registry owner or the admin of institution %s", action, institutionId);
        }
    }

    void requireVerifiedMember(Identity caller) {
        if (!isVerifiedMember(caller)) {
            log.warn("[ACL][DENY] caller={} has no verified institution membership", caller);
            throw RegistryException.of(NOT_VERIFIED, "caller has no verified institution membership");
        }
    }

    void requireAuthorOrOwnInstitutionAdmin(Identity caller, ParasiteRecord record) {
        if (!isAuthorOrOwnInstitutionAdmin(caller, record)) {
            log.warn("[ACL][DENY] update of record {} by non-author caller={}", record.getId(), caller);
            throw RegistryException.of(NOT_AUTHORIZED,
                    "only the author or an institution admin may update record %d", record.getId());
        }
    }
}
