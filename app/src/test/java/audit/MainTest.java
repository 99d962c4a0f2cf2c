package audit;

import crawler.FakeSite;
import crawler.FetchStatus;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

class MainTest {

    private static final String HOME = "https://example.com";

    private static AuditArgs args(Path report) {
        return AuditArgs.parse(new String[]{HOME, "--no-llm", "--no-plan", "--pacing", "off", "-o", report.toString()});
    }

    @Test
    void reportSurvivesBrowserFailingToClose(@TempDir Path dir) throws IOException {
        Path report = dir.resolve("report.md");
        FakeSite site = new FakeSite()
                .page(HOME, FakeSite.html("Example home page"))
                .failOnClose("Target closed");

        int code = Main.run(args(report), AuditConfig.defaults(), () -> site);

        assertEquals(0, code);
        assertTrue(Files.readString(report, StandardCharsets.UTF_8).startsWith("# Site Audit Report\n"));
    }

    @Test
    void noSuccessfulPageExitsWithOneAndWritesNothing(@TempDir Path dir) {
        Path report = dir.resolve("report.md");
        FakeSite site = new FakeSite().fail(HOME, FetchStatus.FAILED, "net::ERR_NAME_NOT_RESOLVED");

        int code = Main.run(args(report), AuditConfig.defaults(), () -> site);

        assertEquals(1, code);
        assertFalse(Files.exists(report));
    }

    @Test
    void browserLaunchFailureExitsWithOne(@TempDir Path dir) {
        int code = Main.run(args(dir.resolve("report.md")), AuditConfig.defaults(), () -> {
            throw new IllegalStateException("Executable doesn't exist");
        });

        assertEquals(1, code);
    }
}
