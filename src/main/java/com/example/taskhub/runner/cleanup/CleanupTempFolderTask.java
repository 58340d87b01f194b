package com.example.taskhub.runner.cleanup;

import com.example.taskhub.scheduler.task.BoundParameters;
import com.example.taskhub.scheduler.task.TaskContext;
import com.example.taskhub.scheduler.task.TaskContract;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.nio.file.*;
import java.nio.file.attribute.BasicFileAttributes;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

/**
 * Deletes files older than {@code days_old} under {@code temp_path}, optionally only some extensions,
 * then removes directories left empty. With {@code dry_run} nothing is touched and the result lists
 * what would be deleted.
 */
@Slf4j
@RequiredArgsConstructor
public class CleanupTempFolderTask implements TaskContract {

    public static final String NAME = "cleanup_temp_folder";

    static final int MAX_LISTED_FILES = 10;
    static final int MAX_LISTED_DIRS = 5;

    private final ObjectMapper mapper;
    private final Clock clock;

    @Override
    public JsonNode execute(BoundParameters params, TaskContext context) throws Exception {
        Path root = Paths.get(params.getString("temp_path", System.getProperty("java.io.tmpdir")));
        long daysOld = params.getLong("days_old", 7);
        boolean dryRun = params.getBoolean("dry_run", false);
        List<String> extensions = readExtensions(params.getJson("file_extensions"));

        if (daysOld < 0) {
            throw new IllegalArgumentException("days_old must not be negative: " + daysOld);
        }
        if (!Files.isDirectory(root)) {
            throw new IllegalArgumentException("Temp directory " + root + " does not exist");
        }

        Instant cutoff = clock.instant().minus(Duration.ofDays(daysOld));
        ExtensionFilter filter = new ExtensionFilter(root, extensions);
        Sweep sweep = new Sweep(root, cutoff, filter, dryRun, context);
        Files.walkFileTree(root, sweep);
        context.throwIfCancelled();

        String action = dryRun ? "would be deleted" : "deleted";
        log.info("Temp cleanup completed: {} files {} under {}", sweep.files.size(), action, root);

        ObjectNode result = mapper.createObjectNode();
        result.put("status", "success");
        result.put("message", "Temp folder cleanup completed successfully");
        result.put("timestamp", clock.instant().toString());
        result.put("temp_directory", root.toString());
        result.put("days_old", daysOld);
        result.put("dry_run", dryRun);
        result.put("deleted_files_count", sweep.files.size());
        result.put("deleted_dirs_count", sweep.dirs.size());
        result.put("total_size_freed_bytes", sweep.bytes);

        ArrayNode files = result.putArray("deleted_files");
        for (ObjectNode f : sweep.files.subList(0, Math.min(MAX_LISTED_FILES, sweep.files.size()))) {
            files.add(f);
        }
        ArrayNode dirs = result.putArray("deleted_dirs");
        for (String d : sweep.dirs.subList(0, Math.min(MAX_LISTED_DIRS, sweep.dirs.size()))) {
            dirs.addObject().put("path", d).put("deleted", true);
        }
        return result;
    }

    private static List<String> readExtensions(JsonNode node) {
        List<String> out = new ArrayList<>();
        if (node == null || node.isNull()) return out;
        if (!node.isArray()) {
            throw new IllegalArgumentException("file_extensions must be a JSON array of strings");
        }
        for (JsonNode e : node) {
            if (!e.isTextual()) {
                throw new IllegalArgumentException("file_extensions must be a JSON array of strings");
            }
            out.add(e.asText());
        }
        return out;
    }

    private final class Sweep extends SimpleFileVisitor<Path> {
        private final Path root;
        private final Instant cutoff;
        private final ExtensionFilter filter;
        private final boolean dryRun;
        private final TaskContext context;

        private final List<ObjectNode> files = new ArrayList<>();
        private final List<String> dirs = new ArrayList<>();
        private long bytes;

        private Sweep(Path root, Instant cutoff, ExtensionFilter filter, boolean dryRun, TaskContext context) {
            this.root = root;
            this.cutoff = cutoff;
            this.filter = filter;
            this.dryRun = dryRun;
            this.context = context;
        }

        @Override
        public FileVisitResult visitFile(Path file, BasicFileAttributes attrs) throws IOException {
            if (context.isCancelled()) return FileVisitResult.TERMINATE;
            if (!attrs.isRegularFile() || !filter.accept(file)) return FileVisitResult.CONTINUE;

            Instant modified = attrs.lastModifiedTime().toInstant();
            if (!modified.isBefore(cutoff)) return FileVisitResult.CONTINUE;

            try {
                if (!dryRun) Files.delete(file);
            } catch (IOException e) {
                log.warn("Could not process file {}: {}", file, e.toString());
                return FileVisitResult.CONTINUE;
            }
            ObjectNode entry = mapper.createObjectNode();
            entry.put("path", file.toString());
            entry.put("size", attrs.size());
            entry.put("modified_date", modified.toString());
            entry.put("deleted", !dryRun);
            files.add(entry);
            bytes += attrs.size();
            return FileVisitResult.CONTINUE;
        }

        @Override
        public FileVisitResult visitFileFailed(Path file, IOException exc) {
            log.warn("Could not process file {}: {}", file, exc.toString());
            return FileVisitResult.CONTINUE;
        }

        @Override
        public FileVisitResult postVisitDirectory(Path dir, IOException exc) {
            if (dryRun || dir.equals(root)) return FileVisitResult.CONTINUE;
            try (DirectoryStream<Path> children = Files.newDirectoryStream(dir)) {
                if (children.iterator().hasNext()) return FileVisitResult.CONTINUE;
            } catch (IOException e) {
                log.warn("Could not inspect directory {}: {}", dir, e.toString());
                return FileVisitResult.CONTINUE;
            }
            try {
                Files.delete(dir);
                dirs.add(dir.toString());
            } catch (IOException e) {
                log.warn("Could not remove directory {}: {}", dir, e.toString());
            }
            return FileVisitResult.CONTINUE;
        }
    }
}
