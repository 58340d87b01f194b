package com.example.taskhub.runner.csv;

import com.example.taskhub.scheduler.task.BoundParameters;
import com.example.taskhub.scheduler.task.TaskContext;
import com.example.taskhub.scheduler.task.TaskContract;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.csv.CSVFormat;
import org.apache.commons.csv.CSVParser;
import org.apache.commons.csv.CSVPrinter;
import org.apache.commons.csv.CSVRecord;

import java.io.IOException;
import java.io.OutputStreamWriter;
import java.io.Reader;
import java.math.BigDecimal;
import java.math.RoundingMode;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.time.Clock;
import java.util.*;

/**
 * 读取订单 CSV，为每行追加 Tax / Total with Tax 两列并写出，返回汇总统计。
 */
@Slf4j
@RequiredArgsConstructor
public class ProcessCsvTask implements TaskContract {

    public static final String NAME = "process_csv";

    static final String CUSTOMER = "Customer Name";
    static final String PRODUCT = "Product Name";
    static final String PRICE = "Price";
    static final String PURCHASE_DATE = "Purchase Date";
    static final String TAX = "Tax";
    static final String TOTAL = "Total with Tax";
    static final List<String> REQUIRED_COLUMNS = Arrays.asList(CUSTOMER, PRODUCT, PRICE, PURCHASE_DATE);

    private static final int CANCEL_CHECK_EVERY = 1000;
    private static final JsonNodeFactory EXACT_DECIMALS = JsonNodeFactory.withExactBigDecimals(true);

    private final ObjectMapper mapper;
    private final Clock clock;

    @Override
    public JsonNode execute(BoundParameters params, TaskContext context) throws Exception {
        Path input = Paths.get(params.getString("input_file_path"));
        Path output = Paths.get(params.getString("output_file_path"));
        BigDecimal taxRate = BigDecimal.valueOf(params.getDouble("tax_rate", 0.1));
        if (taxRate.signum() < 0) {
            throw new IllegalArgumentException("tax_rate must not be negative: " + taxRate);
        }
        if (!Files.isRegularFile(input)) {
            throw new IllegalArgumentException("Input file " + input + " does not exist");
        }

        log.info("ProcessCsvTask.start input={} output={} taxRate={}", input, output, taxRate);

        CSVFormat inFmt = CSVFormat.DEFAULT.builder().setHeader().setSkipHeaderRecord(true).setTrim(true).build();
        BigDecimal totalAmount = BigDecimal.ZERO;
        BigDecimal totalTax = BigDecimal.ZERO;
        Set<String> customers = new HashSet<>();
        Set<String> products = new HashSet<>();
        int records = 0;

        try (Reader reader = Files.newBufferedReader(input, StandardCharsets.UTF_8);
             CSVParser parser = inFmt.parse(reader)) {

            List<String> headers = parser.getHeaderNames();
            List<String> missing = new ArrayList<>();
            for (String c : REQUIRED_COLUMNS) {
                if (!headers.contains(c)) missing.add(c);
            }
            if (!missing.isEmpty()) {
                throw new IllegalArgumentException("Missing columns in CSV file: " + missing);
            }

            List<String> outHeaders = new ArrayList<>(headers);
            outHeaders.add(TAX);
            outHeaders.add(TOTAL);

            try (CSVPrinter printer = csv(output, outHeaders.toArray(new String[0]))) {
                for (CSVRecord row : parser) {
                    if (++records % CANCEL_CHECK_EVERY == 0) {
                        context.throwIfCancelled();
                    }
                    BigDecimal price = parsePrice(row);
                    BigDecimal tax = price.multiply(taxRate).setScale(2, RoundingMode.HALF_UP);
                    BigDecimal total = price.add(tax);

                    List<String> values = new ArrayList<>(row.toList());
                    values.add(tax.toPlainString());
                    values.add(total.toPlainString());
                    printer.printRecord(values);

                    totalAmount = totalAmount.add(price);
                    totalTax = totalTax.add(tax);
                    customers.add(row.get(CUSTOMER));
                    products.add(row.get(PRODUCT));
                }
            }
        }

        log.info("CSV file processed successfully: {} records", records);

        // 金额保留两位小数，默认 JsonNodeFactory 会把 10.00 规整成 1E+1
        ObjectNode stats = new ObjectNode(EXACT_DECIMALS);
        stats.put("total_records", records);
        stats.put("total_amount", money(totalAmount));
        stats.put("total_tax", money(totalTax));
        stats.put("total_with_tax", money(totalAmount.add(totalTax)));
        stats.put("tax_rate", taxRate);
        stats.put("unique_customers", customers.size());
        stats.put("unique_products", products.size());

        ObjectNode result = mapper.createObjectNode();
        result.put("status", "success");
        result.put("message", "CSV file processed successfully");
        result.put("timestamp", clock.instant().toString());
        result.put("input_file", input.toString());
        result.put("output_file", output.toString());
        result.set("statistics", stats);
        return result;
    }

    private static BigDecimal money(BigDecimal amount) {
        return amount.setScale(2, RoundingMode.HALF_UP);
    }

    private static BigDecimal parsePrice(CSVRecord row) {
        String raw = row.get(PRICE);
        try {
            return new BigDecimal(raw.trim());
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("Row " + row.getRecordNumber() + ": invalid Price '" + raw + "'");
        }
    }

    private static CSVPrinter csv(Path file, String... headers) throws IOException {
        Path parent = file.toAbsolutePath().getParent();
        if (parent != null) Files.createDirectories(parent);
        CSVFormat fmt = CSVFormat.DEFAULT.builder().setHeader(headers).build();
        return new CSVPrinter(new OutputStreamWriter(Files.newOutputStream(file), StandardCharsets.UTF_8), fmt);
    }
}
