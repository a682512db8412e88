package com.parasitereg.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

@Data
@Configuration
@ConfigurationProperties(prefix = "registry")
public class RegistryProperties {

    /**
     * 注册表所有者的身份（40 位十六进制），启动后不可变更
     */
    private String owner;

    /**
     * 提交序列值来源：logical（每次提交 +1，类似块高度）或 system（毫秒墙钟）
     */
    private ClockMode clock = ClockMode.LOGICAL;

    /** logical 时钟的起始值 */
    private long clockStart = 1;

    private Institutions institutions = new Institutions();

    public enum ClockMode { LOGICAL, SYSTEM }

    @Data
    public static class Institutions {
        /** true 时重复注册覆盖原机构（并重置认证状态）；默认拒绝 */
        private boolean allowOverwrite = false;
    }
}
