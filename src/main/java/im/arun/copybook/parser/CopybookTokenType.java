package im.arun.copybook.parser;

/**
 * Token kinds produced by {@link CopybookTokenizer}.
 */
public enum CopybookTokenType {
    TEXT,
    PERIOD,
    EOF
}
