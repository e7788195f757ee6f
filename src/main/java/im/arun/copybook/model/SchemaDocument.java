package im.arun.copybook.model;

import com.fasterxml.jackson.annotation.JsonAnyGetter;
import com.fasterxml.jackson.annotation.JsonAnySetter;
import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Top-level schema emitted for one copybook.
 * Flat documents fill {@code nodes}; nested documents carry a single root entry.
 */
@Data
@NoArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonPropertyOrder({"nodes", "timestamp", "source"})
public class SchemaDocument {

    @JsonProperty("nodes")
    private List<Map<String, FieldSpec>> nodes;

    @JsonProperty("timestamp")
    private String timestamp;

    @JsonProperty("source")
    private String source;

    @JsonIgnore
    private Map<String, FieldSpec> root = new LinkedHashMap<>();

    @JsonAnyGetter
    public Map<String, FieldSpec> getRootEntries() {
        return root;
    }

    @JsonAnySetter
    public void putRootEntry(String name, FieldSpec spec) {
        root.put(name, spec);
    }

    @JsonIgnore
    public boolean isNested() {
        return nodes == null && !root.isEmpty();
    }
}
