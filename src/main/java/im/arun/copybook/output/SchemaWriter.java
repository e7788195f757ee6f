package im.arun.copybook.output;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import com.fasterxml.jackson.dataformat.yaml.YAMLGenerator;
import im.arun.copybook.config.OutputFormat;
import im.arun.copybook.exception.CopybookException;
import im.arun.copybook.model.FieldSpec;
import im.arun.copybook.model.Node;
import im.arun.copybook.model.NodeTree;
import im.arun.copybook.model.NodeType;
import im.arun.copybook.model.SchemaDocument;
import im.arun.copybook.model.TreeNode;
import im.arun.copybook.model.UsageType;
import im.arun.copybook.picture.Picture;

import java.time.Clock;
import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Converts parsed entries into a {@link SchemaDocument} and renders it as JSON or YAML.
 */
public class SchemaWriter {
    static final DateTimeFormatter TIMESTAMP_FORMAT = DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm:ss");

    private final ObjectMapper jsonMapper;
    private final ObjectMapper yamlMapper;
    private final Clock clock;
    private final boolean includeTimestamp;

    public SchemaWriter() {
        this(Clock.systemDefaultZone(), true);
    }

    public SchemaWriter(Clock clock, boolean includeTimestamp) {
        this.clock = clock;
        this.includeTimestamp = includeTimestamp;
        this.jsonMapper = new ObjectMapper();
        this.jsonMapper.enable(SerializationFeature.INDENT_OUTPUT);
        this.yamlMapper = new ObjectMapper(YAMLFactory.builder()
            .disable(YAMLGenerator.Feature.WRITE_DOC_START_MARKER)
            .build());
    }

    /**
     * Flat document: one entry per node in declaration order.
     */
    public SchemaDocument flat(List<Node> nodes, String source) {
        List<Map<String, FieldSpec>> entries = new ArrayList<>();
        for (Node node : nodes) {
            entries.add(entry(node.getName(), toSpec(node)));
        }

        SchemaDocument document = new SchemaDocument();
        document.setNodes(entries);
        stamp(document, source);
        return document;
    }

    /**
     * Nested document: children keyed by their two-digit level under the synthetic root.
     */
    public SchemaDocument nested(NodeTree tree, String source) {
        TreeNode root = tree.getRoot();
        SchemaDocument document = new SchemaDocument();
        document.putRootEntry(root.getNode().getName(), toNestedSpec(root));
        stamp(document, source);
        return document;
    }

    public String write(SchemaDocument document, OutputFormat format) {
        ObjectMapper mapper = format == OutputFormat.YAML ? yamlMapper : jsonMapper;
        try {
            return mapper.writeValueAsString(document);
        } catch (JsonProcessingException e) {
            throw new CopybookException("Failed to serialize schema: " + e.getMessage(), e);
        }
    }

    private void stamp(SchemaDocument document, String source) {
        document.setSource(source);
        if (includeTimestamp) {
            document.setTimestamp(LocalDateTime.now(clock).format(TIMESTAMP_FORMAT));
        }
    }

    private FieldSpec toNestedSpec(TreeNode treeNode) {
        FieldSpec spec = toSpec(treeNode.getNode());
        List<TreeNode> children = treeNode.getChildren();
        if (!children.isEmpty()) {
            List<Map<String, FieldSpec>> entries = new ArrayList<>();
            for (TreeNode child : children) {
                entries.add(entry(child.getNode().getName(), toNestedSpec(child)));
            }
            // siblings always share one level
            spec.putChildLevel(String.format("%02d", children.get(0).getLevel()), entries);
        }
        return spec;
    }

    /**
     * Mapping for a single entry; optional keys are left null and omitted on output.
     */
    public FieldSpec toSpec(Node node) {
        FieldSpec spec = new FieldSpec();
        spec.setLevel(node.getLevel());

        if (node.getType() == NodeType.RECORD) {
            spec.setType(FieldSpec.TYPE_RECORD);
        } else if (node.getType() == NodeType.FIELD) {
            Picture picture = node.getPicture();
            spec.setType(picture.getType().getTag());
            spec.setLength(picture.getLength());
            if (picture.isNumeric()) {
                spec.setSigned(picture.isSigned());
                if (picture.getScale() != 0) {
                    spec.setScale(picture.getScale());
                }
            }
            spec.setDefaultValue(picture.getDefaultValue());
        } else {
            spec.setType(FieldSpec.TYPE_ENUM);
            spec.setValues(String.join(",", node.getValues()));
        }

        if (node.getUsage() != UsageType.NONE) {
            spec.setUsage(node.getUsage().getTag());
        }
        if (node.getOccurs() > 1) {
            spec.setOccurs(node.getOccurs());
        }
        spec.setRedefines(node.getRedefines());
        spec.setIndexedBy(node.getIndexedBy());
        return spec;
    }

    private static Map<String, FieldSpec> entry(String name, FieldSpec spec) {
        Map<String, FieldSpec> entry = new LinkedHashMap<>();
        entry.put(name, spec);
        return entry;
    }
}
