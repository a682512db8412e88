package com.parasitereg.registry;

/**
 * 公开操作失败时的错误类别，调用方据此分支处理（例如提示机构认证还是重新登录）。
 */
public enum RegistryError {
    /** 调用方缺少执行该写操作所需的角色或关系 */
    NOT_AUTHORIZED,
    /** 引用的记录不存在，或不处于预期状态 */
    INVALID_RECORD,
    /** 引用的机构不存在 */
    INVALID_INSTITUTION,
    /** 调用方没有机构成员身份，或所属机构未认证 */
    NOT_VERIFIED,
    /** 机构 id 已被注册 */
    DUPLICATE_INSTITUTION,
    /** 字段超长或缺失 */
    INVALID_ARGUMENT
}
