package com.example.taskhub.runner.csv;

import com.example.taskhub.scheduler.task.BoundParameters;
import com.example.taskhub.scheduler.task.TaskContext;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.math.BigDecimal;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class ProcessCsvTaskTest {

    private static final String HEADER = "Customer Name,Product Name,Price,Purchase Date";

    private final ObjectMapper mapper = new ObjectMapper();
    private final ProcessCsvTask task = new ProcessCsvTask(mapper,
            Clock.fixed(Instant.parse("2024-03-01T10:00:00Z"), ZoneOffset.UTC));

    @TempDir
    Path dir;

    @Test
    void addsTaxColumnsAndSummarizes() throws Exception {
        Path in = write("orders.csv",
                HEADER,
                "Alice,Widget,10.00,2024-01-01",
                "Bob,Gadget,25.50,2024-01-02",
                "Alice,Gadget,4.99,2024-01-03");
        Path out = dir.resolve("out/orders_taxed.csv");

        JsonNode result = task.execute(params(in, out, 0.1), context());

        assertEquals("success", result.get("status").asText());
        assertEquals("2024-03-01T10:00:00Z", result.get("timestamp").asText());
        JsonNode stats = result.get("statistics");
        assertEquals(3, stats.get("total_records").asInt());
        assertEquals(new BigDecimal("40.49"), stats.get("total_amount").decimalValue());
        assertEquals(new BigDecimal("4.05"), stats.get("total_tax").decimalValue());
        assertEquals(new BigDecimal("44.54"), stats.get("total_with_tax").decimalValue());
        assertEquals(2, stats.get("unique_customers").asInt());
        assertEquals(2, stats.get("unique_products").asInt());

        List<String> lines = Files.readAllLines(out, StandardCharsets.UTF_8);
        assertEquals(Arrays.asList(
                HEADER + ",Tax,Total with Tax",
                "Alice,Widget,10.00,2024-01-01,1.00,11.00",
                "Bob,Gadget,25.50,2024-01-02,2.55,28.05",
                "Alice,Gadget,4.99,2024-01-03,0.50,5.49"), lines);
    }

    @Test
    void keepsExtraColumnsAndDefaultRate() throws Exception {
        Path in = write("orders.csv",
                HEADER + ",Notes",
                "Carol,Lamp,\"1,000.00\",2024-01-01,quoted");
        Path out = dir.resolve("bad.csv");
        // 带千分位的价格不是合法数字
        IllegalArgumentException e = assertThrows(IllegalArgumentException.class,
                () -> task.execute(params(in, out, null), context()));
        assertTrue(e.getMessage().contains("invalid Price '1,000.00'"));

        Path ok = write("ok.csv", HEADER + ",Notes", "Carol,Lamp,100,2024-01-01,gift");
        JsonNode result = task.execute(params(ok, out, null), context());
        JsonNode stats = result.get("statistics");
        assertEquals(new BigDecimal("10.00"), stats.get("total_tax").decimalValue());
        assertEquals(new BigDecimal("100.00"), stats.get("total_amount").decimalValue());
        assertEquals(new BigDecimal("110.00"), stats.get("total_with_tax").decimalValue());
        // 存入 ExecutionLog 的是 toString() 的文本
        assertTrue(result.toString().contains("\"total_tax\":10.00"), result.toString());
        assertTrue(result.toString().contains("\"total_with_tax\":110.00"), result.toString());
        assertEquals("Carol,Lamp,100,2024-01-01,gift,10.00,110.00", Files.readAllLines(out).get(1));
    }

    @Test
    void missingColumns_areReported() throws Exception {
        Path in = write("orders.csv", "Customer Name,Price", "Alice,10");
        IllegalArgumentException e = assertThrows(IllegalArgumentException.class,
                () -> task.execute(params(in, dir.resolve("o.csv"), 0.1), context()));
        assertTrue(e.getMessage().contains("Product Name"));
        assertTrue(e.getMessage().contains("Purchase Date"));
    }

    @Test
    void missingInput_andNegativeRate() {
        assertThrows(IllegalArgumentException.class,
                () -> task.execute(params(dir.resolve("nope.csv"), dir.resolve("o.csv"), 0.1), context()));
        assertThrows(IllegalArgumentException.class,
                () -> task.execute(params(dir.resolve("nope.csv"), dir.resolve("o.csv"), -0.5), context()));
    }

    @Test
    void stopsWhenCancelled() throws Exception {
        List<String> rows = new ArrayList<>();
        rows.add(HEADER);
        for (int i = 0; i < 1500; i++) {
            rows.add("C" + i + ",P,1.00,2024-01-01");
        }
        Path in = write("big.csv", rows.toArray(new String[0]));
        TaskContext ctx = context();
        ctx.cancel();

        assertThrows(InterruptedException.class, () -> task.execute(params(in, dir.resolve("o.csv"), 0.1), ctx));
    }

    private Path write(String name, String... lines) throws Exception {
        Path p = dir.resolve(name);
        Files.write(p, Arrays.asList(lines), StandardCharsets.UTF_8);
        return p;
    }

    private BoundParameters params(Path in, Path out, Double rate) {
        ObjectNode n = mapper.createObjectNode();
        n.put("input_file_path", in.toString());
        n.put("output_file_path", out.toString());
        if (rate != null) n.put("tax_rate", rate);
        return new BoundParameters(n);
    }

    private static TaskContext context() {
        return new TaskContext(1L, null, 1);
    }
}
