package audit;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

// Audit plans are handed to the LLM verbatim.
public final class PlanLoader {

    private PlanLoader() {
    }

    public static String load(Path plan) throws IOException {
        return Files.readString(plan, StandardCharsets.UTF_8);
    }
}
