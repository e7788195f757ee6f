package im.arun.copybook.output;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import im.arun.copybook.config.OutputFormat;
import im.arun.copybook.exception.CopybookException;
import im.arun.copybook.model.FieldSpec;
import im.arun.copybook.model.Node;
import im.arun.copybook.model.NodeTree;
import im.arun.copybook.model.NodeType;
import im.arun.copybook.model.SchemaDocument;
import im.arun.copybook.model.UsageType;
import im.arun.copybook.picture.Picture;
import im.arun.copybook.picture.PictureType;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Map;

/**
 * Reads a schema produced by {@link SchemaWriter} back into the flat entry list.
 * Nested documents are flattened in declaration order.
 */
public class SchemaReader {
    private static final Logger logger = LoggerFactory.getLogger(SchemaReader.class);

    private final ObjectMapper jsonMapper = new ObjectMapper();
    private final ObjectMapper yamlMapper = new ObjectMapper(new YAMLFactory());

    public List<Node> read(String content, OutputFormat format) {
        ObjectMapper mapper = format == OutputFormat.YAML ? yamlMapper : jsonMapper;
        SchemaDocument document;
        try {
            document = mapper.readValue(content, SchemaDocument.class);
        } catch (IOException e) {
            throw new CopybookException("Failed to read schema: " + e.getMessage(), e);
        }
        return toNodes(document);
    }

    public List<Node> toNodes(SchemaDocument document) {
        List<Node> nodes = new ArrayList<>();

        if (document.getNodes() != null) {
            for (Map<String, FieldSpec> entry : document.getNodes()) {
                entry.forEach((name, spec) -> nodes.add(makeNode(name, spec)));
            }
        } else {
            document.getRootEntries().forEach((name, spec) -> {
                if (isSyntheticRoot(name, spec)) {
                    addChildren(spec, nodes);
                } else {
                    nodes.add(makeNode(name, spec));
                    addChildren(spec, nodes);
                }
            });
        }

        logger.debug("Read {} entries from schema", nodes.size());
        return nodes;
    }

    private static boolean isSyntheticRoot(String name, FieldSpec spec) {
        return NodeTree.ROOT_NAME.equals(name) && spec.getLevel() != null && spec.getLevel() == 0;
    }

    private void addChildren(FieldSpec spec, List<Node> nodes) {
        for (List<Map<String, FieldSpec>> entries : spec.getChildLevels().values()) {
            for (Map<String, FieldSpec> entry : entries) {
                entry.forEach((name, child) -> {
                    nodes.add(makeNode(name, child));
                    addChildren(child, nodes);
                });
            }
        }
    }

    /**
     * Create a node from its serialized mapping.
     *
     * @throws CopybookException if a required key is missing or a value is unknown
     */
    public Node makeNode(String name, FieldSpec spec) {
        Integer level = require(spec.getLevel(), "level", name);
        String type = require(spec.getType(), "type", name);

        Node.NodeBuilder builder = Node.builder().name(name).level(level);

        switch (type) {
            case FieldSpec.TYPE_RECORD:
                builder.type(NodeType.RECORD);
                break;
            case FieldSpec.TYPE_ENUM:
                builder.type(NodeType.ENUMERATION);
                builder.values(Arrays.asList(require(spec.getValues(), "values", name).split(",", -1)));
                break;
            default:
                builder.type(NodeType.FIELD);
                builder.picture(makePicture(name, type, spec));
                break;
        }

        if (spec.getUsage() != null) {
            builder.usage(UsageType.fromTag(spec.getUsage())
                .orElseThrow(() -> new CopybookException(
                    String.format("Unknown value for 'usage' field of %s: %s", name, spec.getUsage()))));
        }
        if (spec.getOccurs() != null) {
            builder.occurs(spec.getOccurs());
        }
        builder.redefines(spec.getRedefines());
        builder.indexedBy(spec.getIndexedBy());
        return builder.build();
    }

    private Picture makePicture(String name, String type, FieldSpec spec) {
        PictureType pictureType;
        try {
            pictureType = PictureType.fromTag(type);
        } catch (IllegalArgumentException e) {
            throw new CopybookException(String.format("Unknown value for 'type' field of %s: %s", name, type), e);
        }

        return Picture.builder()
            .type(pictureType)
            .length(spec.getLength() != null ? spec.getLength() : 0)
            .scale(spec.getScale() != null ? spec.getScale() : 0)
            .signed(Boolean.TRUE.equals(spec.getSigned()))
            .defaultValue(spec.getDefaultValue())
            .build();
    }

    private static <T> T require(T value, String key, String name) {
        if (value == null) {
            throw new CopybookException(String.format("Could not find key '%s' in: %s", key, name));
        }
        return value;
    }
}
