package com.parasitereg.config;

import com.parasitereg.identity.Identity;
import com.parasitereg.registry.LogicalSequenceClock;
import com.parasitereg.registry.RegistryState;
import com.parasitereg.registry.SequenceClock;
import com.parasitereg.registry.SystemSequenceClock;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.util.StringUtils;

@Slf4j
@Configuration
public class RegistryConfig {

    @Bean
    public RegistryState registryState(RegistryProperties props) {
        if (!StringUtils.hasText(props.getOwner())) {
            throw new IllegalStateException("registry.owner must be configured");
        }
        return new RegistryState(Identity.fromHex(props.getOwner().trim()));
    }

    @Bean
    public SequenceClock sequenceClock(RegistryProperties props) {
        log.info("Sequence clock mode={} start={}", props.getClock(), props.getClockStart());
        return switch (props.getClock()) {
            case SYSTEM -> new SystemSequenceClock();
            case LOGICAL -> new LogicalSequenceClock(props.getClockStart());
        };
    }
}
