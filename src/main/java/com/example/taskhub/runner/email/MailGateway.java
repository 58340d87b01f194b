package com.example.taskhub.runner.email;

/**
 * Outbound mail boundary used by the send_email task.
 */
public interface MailGateway {

    /**
     * @throws Exception when the message could not be handed over; the execution then fails and may be retried
     */
    void send(String from, String to, String subject, String body) throws Exception;
}
