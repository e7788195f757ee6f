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
 * Serialized form of one copybook entry.
 * In nested output the children are keyed by their two-digit level, e.g. {@code "05"}.
 */
@Data
@NoArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonPropertyOrder({"level", "type", "length", "signed", "scale", "default", "usage", "values",
    "occurs", "redefines", "indexed_by"})
public class FieldSpec {
    public static final String TYPE_RECORD = "record";
    public static final String TYPE_ENUM = "enum";

    @JsonProperty("level")
    private Integer level;

    @JsonProperty("type")
    private String type;

    @JsonProperty("length")
    private Integer length;

    @JsonProperty("signed")
    private Boolean signed;

    @JsonProperty("scale")
    private Integer scale;

    @JsonProperty("default")
    private String defaultValue;

    @JsonProperty("usage")
    private String usage;

    @JsonProperty("values")
    private String values;

    @JsonProperty("occurs")
    private Integer occurs;

    @JsonProperty("redefines")
    private String redefines;

    @JsonProperty("indexed_by")
    private String indexedBy;

    @JsonIgnore
    private Map<String, List<Map<String, FieldSpec>>> children = new LinkedHashMap<>();

    @JsonAnyGetter
    public Map<String, List<Map<String, FieldSpec>>> getChildLevels() {
        return children;
    }

    @JsonAnySetter
    public void putChildLevel(String levelKey, List<Map<String, FieldSpec>> entries) {
        children.put(levelKey, entries);
    }
}
