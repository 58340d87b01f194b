package com.example.taskhub.runner.email;

import lombok.extern.slf4j.Slf4j;

/**
 * 默认实现：不真正投递，只写日志。
 */
@Slf4j
public class LoggingMailGateway implements MailGateway {

    @Override
    public void send(String from, String to, String subject, String body) {
        log.info("Mail from={} to={} subject={} ({} chars)", from, to, subject, body == null ? 0 : body.length());
    }
}
