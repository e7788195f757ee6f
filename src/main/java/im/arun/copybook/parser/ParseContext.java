package im.arun.copybook.parser;

import im.arun.copybook.lexer.Token;
import im.arun.copybook.model.Node;
import im.arun.copybook.model.NodeType;
import im.arun.copybook.model.UsageType;
import im.arun.copybook.picture.Picture;

import java.util.ArrayList;
import java.util.List;

/**
 * Mutable state of one parse: the token cursor, the entry being assembled and the output.
 */
class ParseContext {
    private final List<Token<CopybookTokenType>> tokens;
    private final List<Node> output = new ArrayList<>();
    private int index;

    ParseState state = ParseState.START;
    int level;

    // entry under construction
    String name;
    Picture picture;
    String redefines;
    int occurs;
    UsageType usage;
    List<String> values;
    String indexedBy;

    ParseContext(List<Token<CopybookTokenType>> tokens) {
        this.tokens = tokens;
    }

    boolean hasMore() {
        return index < tokens.size();
    }

    Token<CopybookTokenType> token() {
        return tokens.get(index);
    }

    /**
     * One-token lookahead; past the end the EOF token is returned again.
     */
    Token<CopybookTokenType> peek() {
        return tokens.get(Math.min(index + 1, tokens.size() - 1));
    }

    void advance() {
        index++;
    }

    void startNode(String nodeName) {
        name = nodeName;
        picture = null;
        redefines = null;
        occurs = 1;
        usage = UsageType.NONE;
        values = new ArrayList<>();
        indexedBy = null;
    }

    /**
     * Close the current entry at its terminating period.
     */
    Node finishNode() {
        NodeType type;
        if (picture != null) {
            type = NodeType.FIELD;
        } else if (!values.isEmpty()) {
            type = NodeType.ENUMERATION;
        } else {
            type = NodeType.RECORD;
        }

        Node node = Node.builder()
            .name(name)
            .level(level)
            .type(type)
            .picture(picture)
            .redefines(redefines)
            .occurs(occurs)
            .usage(usage)
            .values(values)
            .indexedBy(indexedBy)
            .build();
        output.add(node);
        return node;
    }

    List<Node> getOutput() {
        return output;
    }
}
