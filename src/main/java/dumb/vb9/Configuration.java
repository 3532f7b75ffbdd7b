package dumb.vb9;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.core.JsonProcessingException;

import java.io.IOException;
import java.nio.charset.StandardCharsets;

import static dumb.vb9.Log.error;

/**
 * Runtime settings, read from the classpath resource {@value #RESOURCE}; missing keys take defaults.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record Configuration(
        @JsonProperty("pollTimeoutMillis") long pollTimeoutMillis,
        @JsonProperty("stopTimeoutMillis") long stopTimeoutMillis,
        @JsonProperty("mountSource") String mountSource,
        @JsonProperty("mountPoint") String mountPoint
) {
    public static final String RESOURCE = "vb9.json";
    static final long DEFAULT_POLL_TIMEOUT_MILLIS = 100;
    static final long DEFAULT_STOP_TIMEOUT_MILLIS = 1000;
    static final String DEFAULT_MOUNT_SOURCE = "/form";
    static final String DEFAULT_MOUNT_POINT = "/mnt/app";

    @JsonCreator
    public Configuration(
            @JsonProperty("pollTimeoutMillis") Long pollTimeoutMillis,
            @JsonProperty("stopTimeoutMillis") Long stopTimeoutMillis,
            @JsonProperty("mountSource") String mountSource,
            @JsonProperty("mountPoint") String mountPoint
    ) {
        this(
                pollTimeoutMillis != null ? pollTimeoutMillis.longValue() : DEFAULT_POLL_TIMEOUT_MILLIS,
                stopTimeoutMillis != null ? stopTimeoutMillis.longValue() : DEFAULT_STOP_TIMEOUT_MILLIS,
                mountSource != null ? mountSource : DEFAULT_MOUNT_SOURCE,
                mountPoint != null ? mountPoint : DEFAULT_MOUNT_POINT
        );
    }

    public Configuration() {
        this(DEFAULT_POLL_TIMEOUT_MILLIS, DEFAULT_STOP_TIMEOUT_MILLIS, DEFAULT_MOUNT_SOURCE, DEFAULT_MOUNT_POINT);
    }

    public static Configuration load() {
        try (var in = Configuration.class.getClassLoader().getResourceAsStream(RESOURCE)) {
            if (in == null) return new Configuration();
            return load(new String(in.readAllBytes(), StandardCharsets.UTF_8));
        } catch (IOException e) {
            error("Failed to read " + RESOURCE + ", using defaults: " + e.getMessage());
            return new Configuration();
        }
    }

    public static Configuration load(String json) throws JsonProcessingException {
        return Json.obj(json, Configuration.class);
    }
}
