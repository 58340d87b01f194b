package com.example.taskhub.runner.cleanup;

import java.nio.file.*;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * 按扩展名（不区分大小写）过滤 root 下的文件。扩展名可写成 "log" 或 ".log"；列表为空时全部接受。
 */
public class ExtensionFilter {
    private final Path root;
    private final List<PathMatcher> matchers;

    public ExtensionFilter(Path root, List<String> extensions) {
        this.root = root.toAbsolutePath().normalize();
        this.matchers = compileMatchers(FileSystems.getDefault(), extensions);
    }

    public boolean accept(Path p) {
        if (matchers.isEmpty()) return true;
        Path rel = safeRel(root, p);
        Path lower = Paths.get(rel.toString().toLowerCase(Locale.ROOT));
        for (PathMatcher m : matchers) {
            if (m.matches(lower)) return true;
        }
        return false;
    }

    private static List<PathMatcher> compileMatchers(FileSystem fs, List<String> extensions) {
        List<PathMatcher> ms = new ArrayList<>();
        if (extensions != null) {
            for (String e : extensions) {
                if (e == null || e.trim().isEmpty()) continue;
                String ext = e.trim().toLowerCase(Locale.ROOT);
                if (ext.startsWith(".")) ext = ext.substring(1);
                // 根目录下的文件 + 任意深度子目录下的文件
                ms.add(fs.getPathMatcher("glob:*." + ext));
                ms.add(fs.getPathMatcher("glob:**/*." + ext));
            }
        }
        return ms;
    }

    private static Path safeRel(Path root, Path p) {
        try {
            return root.relativize(p.toAbsolutePath().normalize());
        } catch (IllegalArgumentException e) {
            // 回退到文件名（防止跨盘符等）
            return p.getFileName();
        }
    }
}
