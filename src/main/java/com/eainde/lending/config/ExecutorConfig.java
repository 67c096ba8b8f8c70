package com.eainde.lending.config;

import com.eainde.lending.thread.MdcAwareExecutor;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
public class ExecutorConfig {

    @Bean(destroyMethod = "shutdown")
    public MdcAwareExecutor decisionExecutor(DecisionProperties properties) {
        return new MdcAwareExecutor(properties.getWorkerThreadPrefix());
    }
}
