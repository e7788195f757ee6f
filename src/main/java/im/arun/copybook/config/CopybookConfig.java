package im.arun.copybook.config;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Data;

@Data
@JsonIgnoreProperties(ignoreUnknown = true)
public class CopybookConfig {
    @JsonProperty("output_format")
    private OutputFormat outputFormat = OutputFormat.JSON;

    @JsonProperty("nested")
    private boolean nested = false;

    @JsonProperty("fixed_format")
    private boolean fixedFormat = true;

    @JsonProperty("text_area_end")
    private int textAreaEnd = 72;

    @JsonProperty("include_timestamp")
    private boolean includeTimestamp = true;

    @JsonProperty("log_directory")
    private String logDirectory;

    // 0 means one worker per available processor
    @JsonProperty("max_workers")
    private int maxWorkers = 0;
}
