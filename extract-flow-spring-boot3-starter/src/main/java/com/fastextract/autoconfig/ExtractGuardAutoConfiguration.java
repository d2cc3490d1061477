package com.fastextract.autoconfig;

import com.fastextract.config.ExtractGuardProperties;
import com.fastextract.core.guard.DownstreamGuard;
import org.springframework.boot.autoconfigure.AutoConfiguration;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;

@AutoConfiguration
@EnableConfigurationProperties({
        ExtractGuardProperties.class
})
public class ExtractGuardAutoConfiguration {

    /**
     * 下游调用统一入口
     */
    @Bean
    @ConditionalOnMissingBean
    public DownstreamGuard downstreamGuard(ExtractGuardProperties props) {
        return new DownstreamGuard(props);
    }
}
