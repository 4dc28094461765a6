package com.github.salilvnair.proofgen.config;

import org.springframework.boot.autoconfigure.AutoConfiguration;
import org.springframework.boot.autoconfigure.AutoConfigurationPackage;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.ComponentScan;

import java.time.Clock;

@AutoConfiguration
@AutoConfigurationPackage(basePackages = "com.github.salilvnair.proofgen")
@ComponentScan(basePackages = "com.github.salilvnair.proofgen")
public class ProofGenAutoConfiguration {

    @Bean
    @ConditionalOnMissingBean
    public Clock proofGenClock() {
        return Clock.systemUTC();
    }
}
