package io.cifxform.core.parse;

/** Kinds of token produced by {@link CifLexer}. */
public enum TokenType {
    /** A data name: any bare word starting with an underscore outside opaque content. */
    TAG,
    BARE,
    /** Single-line {@code '...'} or {@code "..."} value; token text is the unquoted content. */
    QUOTED,
    /** {@code '''...'''} or {@code """..."""}; token text is the content between the delimiters. */
    TRIPLE_QUOTED,
    /** A CIF2 list or table, brackets included, taken verbatim. */
    COMPOUND,
    TEXT_BLOCK_OPEN,
    /** Everything between an opening and a closing semicolon line, taken verbatim. */
    TEXT_BLOCK_BODY,
    TEXT_BLOCK_CLOSE,
    LOOP,
    /** {@code data_name}, {@code save_name} or {@code global_}. */
    BLOCK_HEADER,
    /** A bare {@code save_} closing a save frame. */
    SAVE_END,
    STOP,
    COMMENT,
    /** A line holding only whitespace; the span includes the line terminator. */
    BLANK_LINE;

    /** Returns {@code true} for tokens that start a data value. */
    public boolean isValueStart() {
        return this == BARE || this == QUOTED || this == TRIPLE_QUOTED || this == COMPOUND || this == TEXT_BLOCK_OPEN;
    }
}
