package me.bechberger.phidetect.pipeline;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import org.jetbrains.annotations.Nullable;

import java.util.Objects;

/**
 * Enabled flag and priority of a pipeline stage.
 * <p>
 * Used both as a stage's complete default and as a partial override from configuration: an unset
 * field keeps the value of the settings it is {@linkplain #over(StageSettings) merged over}.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public final class StageSettings {

    private final @Nullable Boolean enabled;
    private final @Nullable Integer priority;

    @JsonCreator
    public StageSettings(@JsonProperty("enabled") @Nullable Boolean enabled,
                         @JsonProperty("priority") @Nullable Integer priority) {
        this.enabled = enabled;
        this.priority = priority;
    }

    public static StageSettings of(boolean enabled, int priority) {
        return new StageSettings(enabled, priority);
    }

    public static StageSettings enabled(boolean enabled) {
        return new StageSettings(enabled, null);
    }

    public static StageSettings priority(int priority) {
        return new StageSettings(null, priority);
    }

    @JsonProperty("enabled")
    public @Nullable Boolean getEnabled() {
        return enabled;
    }

    @JsonProperty("priority")
    public @Nullable Integer getPriority() {
        return priority;
    }

    public boolean enabledOr(boolean fallback) {
        return enabled != null ? enabled : fallback;
    }

    public int priorityOr(int fallback) {
        return priority != null ? priority : fallback;
    }

    /**
     * Fill unset fields from the given defaults.
     */
    public StageSettings over(StageSettings defaults) {
        return new StageSettings(enabled != null ? enabled : defaults.enabled,
            priority != null ? priority : defaults.priority);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof StageSettings)) return false;
        StageSettings that = (StageSettings) o;
        return Objects.equals(enabled, that.enabled) && Objects.equals(priority, that.priority);
    }

    @Override
    public int hashCode() {
        return Objects.hash(enabled, priority);
    }

    @Override
    public String toString() {
        return "StageSettings{enabled=" + enabled + ", priority=" + priority + "}";
    }
}
