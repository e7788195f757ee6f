package im.arun.copybook.parser;

/**
 * States of the copybook clause grammar.
 */
enum ParseState {
    START,
    SENTENCE,
    CLAUSE,
    REDEFINES,
    OCCURS,
    PICTURE,
    VALUE,
    USAGE,
    ENUM,
    INDEXED
}
