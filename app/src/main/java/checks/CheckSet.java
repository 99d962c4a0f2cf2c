package checks;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

public final class CheckSet {

    private final String name;
    private final Map<String, Check> checks;

    private CheckSet(String name, Map<String, Check> checks) {
        this.name = name;
        this.checks = Collections.unmodifiableMap(new LinkedHashMap<>(checks));
    }

    public static Builder builder(String name) {
        return new Builder(name);
    }

    public String name() {
        return name;
    }

    public List<String> ids() {
        return new ArrayList<>(checks.keySet());
    }

    public Map<String, Check> checks() {
        return checks;
    }

    public boolean contains(String checkId) {
        return checks.containsKey(checkId);
    }

    public static final class Builder {

        private final String name;
        private final Map<String, Check> checks = new LinkedHashMap<>();

        private Builder(String name) {
            this.name = Objects.requireNonNull(name, "name");
        }

        public Builder add(String checkId, Check check) {
            Objects.requireNonNull(checkId, "checkId");
            Objects.requireNonNull(check, "check");
            if (checks.putIfAbsent(checkId, check) != null) {
                throw new IllegalArgumentException("Duplicate check id: " + checkId);
            }
            return this;
        }

        // Copy the given ids, in the order listed, from an existing set.
        public Builder addFrom(CheckSet source, String... checkIds) {
            for (String id : checkIds) {
                Check check = source.checks.get(id);
                if (check == null) throw new IllegalArgumentException("Unknown check id: " + id);
                add(id, check);
            }
            return this;
        }

        public CheckSet build() {
            return new CheckSet(name, checks);
        }
    }
}
