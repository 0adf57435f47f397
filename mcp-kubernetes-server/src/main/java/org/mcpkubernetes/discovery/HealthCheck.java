package org.mcpkubernetes.discovery;

import com.fasterxml.jackson.annotation.JsonValue;
import java.util.Locale;

public record HealthCheck(String name, Result status, String message) {

    public enum Result {
        PASS, WARN, FAIL;

        @JsonValue
        public String value() {
            return name().toLowerCase(Locale.ROOT);
        }
    }
}
