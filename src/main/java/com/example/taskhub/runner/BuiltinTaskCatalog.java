package com.example.taskhub.runner;

import com.example.taskhub.runner.cleanup.CleanupTempFolderTask;
import com.example.taskhub.runner.csv.ProcessCsvTask;
import com.example.taskhub.runner.email.MailGateway;
import com.example.taskhub.runner.email.SendEmailTask;
import com.example.taskhub.scheduler.task.ParameterSpec;
import com.example.taskhub.scheduler.task.ParameterType;
import com.example.taskhub.scheduler.task.TaskDefinitionProvider;
import com.example.taskhub.scheduler.task.TaskDescriptor;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.util.Arrays;
import java.util.List;

/**
 * The tasks shipped with the application.
 */
@Component
public class BuiltinTaskCatalog implements TaskDefinitionProvider {

    private static final JsonNodeFactory JSON = JsonNodeFactory.instance;

    private final MailGateway mailGateway;
    private final ObjectMapper mapper;
    private final Clock clock;
    private final String defaultSender;

    public BuiltinTaskCatalog(MailGateway mailGateway, ObjectMapper mapper, Clock clock,
                              @Value("${taskhub.mail.default-sender:noreply@taskhub.local}") String defaultSender) {
        this.mailGateway = mailGateway;
        this.mapper = mapper;
        this.clock = clock;
        this.defaultSender = defaultSender;
    }

    @Override
    public List<TaskDescriptor> taskDefinitions() {
        return Arrays.asList(sendEmail(), processCsv(), cleanupTempFolder());
    }

    TaskDescriptor sendEmail() {
        return TaskDescriptor.builder()
                .name(SendEmailTask.NAME)
                .description("Send email to specified address")
                .parameter(ParameterSpec.required("recipient_email", ParameterType.EMAIL, "Recipient email address"))
                .parameter(ParameterSpec.required("subject", ParameterType.STRING, "Email subject"))
                .parameter(ParameterSpec.required("message", ParameterType.STRING, "Email message"))
                .parameter(ParameterSpec.optional("sender_email", ParameterType.EMAIL, null,
                        "Sender email address (default: " + defaultSender + ")"))
                .contract(new SendEmailTask(mailGateway, mapper, clock, defaultSender))
                .build();
    }

    TaskDescriptor processCsv() {
        return TaskDescriptor.builder()
                .name(ProcessCsvTask.NAME)
                .description("Process an orders CSV file and calculate tax")
                .parameter(ParameterSpec.required("input_file_path", ParameterType.STRING, "Input CSV file path"))
                .parameter(ParameterSpec.required("output_file_path", ParameterType.STRING, "Output CSV file path"))
                .parameter(ParameterSpec.optional("tax_rate", ParameterType.FLOAT, JSON.numberNode(0.1), "Tax rate (default: 0.1)"))
                .contract(new ProcessCsvTask(mapper, clock))
                .build();
    }

    TaskDescriptor cleanupTempFolder() {
        return TaskDescriptor.builder()
                .name(CleanupTempFolderTask.NAME)
                .description("Cleanup old files from temp folder")
                .parameter(ParameterSpec.optional("temp_path", ParameterType.STRING,
                        JSON.textNode(System.getProperty("java.io.tmpdir")), "Temp directory path (default: system temp)"))
                .parameter(ParameterSpec.optional("days_old", ParameterType.INTEGER, JSON.numberNode(7L), "Number of days for file age (default: 7)"))
                .parameter(ParameterSpec.optional("file_extensions", ParameterType.JSON, null, "List of file extensions to filter"))
                .parameter(ParameterSpec.optional("dry_run", ParameterType.BOOLEAN, JSON.booleanNode(false), "If true, only report what would be deleted"))
                .contract(new CleanupTempFolderTask(mapper, clock))
                .build();
    }
}
