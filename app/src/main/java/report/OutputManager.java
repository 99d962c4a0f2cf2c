package report;

import crawler.PageRecord;
import crawler.UrlUtil;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import java.util.ArrayList;
import java.util.List;

// Writes the report and the failed-fetch list next to it.
public class OutputManager {

    private static final DateTimeFormatter STAMP = DateTimeFormatter.ofPattern("yyyy-MM-dd_HHmm");

    // Report path inside outputDir: <host>_<yyyy-MM-dd_HHmm>.md
    public static Path autoReportPath(Path outputDir, String url, LocalDateTime now) {
        String host = UrlUtil.hostOf(url);
        String base = UrlUtil.toSafeFilename(host == null ? "site" : host, "");
        return outputDir.resolve(base + "_" + STAMP.format(now) + ".md");
    }

    // Failures file that belongs to a report: report.md -> report.failures.csv
    public static Path failuresPath(Path reportPath) {
        String name = reportPath.getFileName().toString();
        int dot = name.lastIndexOf('.');
        String base = dot > 0 ? name.substring(0, dot) : name;
        return reportPath.resolveSibling(base + ".failures.csv");
    }

    public void writeReport(Path reportPath, String text) throws IOException {
        Path parent = reportPath.toAbsolutePath().getParent();
        if (parent != null) Files.createDirectories(parent);

        // Overwrite file if it exists
        Files.writeString(reportPath, text, StandardCharsets.UTF_8,
                StandardOpenOption.CREATE, StandardOpenOption.TRUNCATE_EXISTING);
    }

    // Returns null when there were no failures.
    public Path writeFailuresFile(Path reportPath, List<PageRecord.Failure> failures) throws IOException {
        if (failures.isEmpty()) return null;

        Path out = failuresPath(reportPath);
        // Very simple CSV: depth,url,type,status,message
        List<String> lines = new ArrayList<>();
        lines.add("depth,url,type,status,message");
        for (PageRecord.Failure f : failures) {
            lines.add(csv(f.depth()) + "," + csv(f.url()) + "," + csv(f.kind()) + ","
                    + csv(f.statusCode()) + "," + csv(f.error()));
        }

        Files.write(out, lines, StandardCharsets.UTF_8,
                StandardOpenOption.CREATE, StandardOpenOption.TRUNCATE_EXISTING);
        return out;
    }

    // Quote CSV fields safely (minimal)
    private static String csv(Object v) {
        String s = v == null ? "" : String.valueOf(v);
        s = s.replace("\"", "\"\"");
        return "\"" + s + "\"";
    }
}
