package com.couplesync.backend.program.config;

import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Configuration;

@Configuration
@EnableConfigurationProperties(ProgramProperties.class)
public class ProgramConfig {}
