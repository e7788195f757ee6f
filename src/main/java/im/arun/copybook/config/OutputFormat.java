package im.arun.copybook.config;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

public enum OutputFormat {
    JSON,
    YAML;

    @JsonValue
    public String getName() {
        return name().toLowerCase(Locale.ROOT);
    }

    public String getExtension() {
        return this == JSON ? ".json" : ".yaml";
    }

    @JsonCreator
    public static OutputFormat fromName(String name) {
        return valueOf(name.trim().toUpperCase(Locale.ROOT));
    }
}
