package org.mcpkubernetes.discovery;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonValue;
import java.util.Locale;

@JsonInclude(JsonInclude.Include.NON_NULL)
public record ComponentHealth(Status status, Integer ready, Integer total, String message) {

    public enum Status {
        HEALTHY, UNHEALTHY, UNKNOWN;

        @JsonValue
        public String value() {
            return name().toLowerCase(Locale.ROOT);
        }
    }

    public static ComponentHealth of(boolean healthy, String readyMessage, String notReadyMessage) {
        return healthy
                ? new ComponentHealth(Status.HEALTHY, null, null, readyMessage)
                : new ComponentHealth(Status.UNHEALTHY, null, null, notReadyMessage);
    }
}
