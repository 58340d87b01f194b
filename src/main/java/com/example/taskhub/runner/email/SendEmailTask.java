package com.example.taskhub.runner.email;

import com.example.taskhub.scheduler.task.BoundParameters;
import com.example.taskhub.scheduler.task.TaskContext;
import com.example.taskhub.scheduler.task.TaskContract;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

import java.time.Clock;

@Slf4j
@RequiredArgsConstructor
public class SendEmailTask implements TaskContract {

    public static final String NAME = "send_email";

    private final MailGateway gateway;
    private final ObjectMapper mapper;
    private final Clock clock;
    private final String defaultSender;

    @Override
    public JsonNode execute(BoundParameters params, TaskContext context) throws Exception {
        String to = params.getString("recipient_email");
        String subject = params.getString("subject");
        String message = params.getString("message");
        String from = params.getString("sender_email", defaultSender);

        context.throwIfCancelled();
        try {
            gateway.send(from, to, subject, message);
        } catch (Exception ex) {
            log.error("SendEmailTask.failed log={} to={}", context.getLogId(), to, ex);
            // 上层 Dispatcher 负责重试 / 状态变更
            throw ex;
        }
        log.info("Email sent successfully to {}", to);

        ObjectNode result = mapper.createObjectNode();
        result.put("status", "success");
        result.put("message", "Email sent successfully to " + to);
        result.put("timestamp", clock.instant().toString());
        result.put("recipient", to);
        result.put("subject", subject);
        return result;
    }
}
