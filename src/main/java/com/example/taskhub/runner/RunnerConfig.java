package com.example.taskhub.runner;

import com.example.taskhub.runner.email.LoggingMailGateway;
import com.example.taskhub.runner.email.MailGateway;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
public class RunnerConfig {

    @Bean
    @ConditionalOnMissingBean(MailGateway.class)
    public MailGateway mailGateway() {
        return new LoggingMailGateway();
    }
}
