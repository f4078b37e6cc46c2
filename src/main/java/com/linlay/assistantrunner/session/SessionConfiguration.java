package com.linlay.assistantrunner.session;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.linlay.assistantrunner.config.SessionProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.util.StringUtils;

import java.nio.file.Path;

@Configuration
public class SessionConfiguration {

    @Bean
    public ThreadDirectory threadDirectory(SessionProperties properties, ObjectMapper objectMapper) {
        if (!StringUtils.hasText(properties.getThreadDirectoryFile())) {
            return new InMemoryThreadDirectory();
        }
        return new FileThreadDirectory(Path.of(properties.getThreadDirectoryFile().trim()), objectMapper);
    }
}
