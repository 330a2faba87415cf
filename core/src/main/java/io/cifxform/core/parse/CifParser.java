package io.cifxform.core.parse;

import io.cifxform.core.error.CifParseException;
import io.cifxform.core.model.Block;
import io.cifxform.core.model.Document;
import io.cifxform.core.model.Entry;
import io.cifxform.core.model.ProtectedSpan;
import io.cifxform.core.model.Span;
import io.cifxform.core.model.Value;
import java.io.IOException;
import java.nio.ByteBuffer;
import java.nio.charset.CharacterCodingException;
import java.nio.charset.CodingErrorAction;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Builds a {@link Document} from CIF text.
 *
 * <p>
 * The parser records the span of every data name, every value and every entry, and flags text
 * blocks, triple-quoted values, CIF2 lists and tables, and comments as protected. Entry extents tile the input, so the
 * resulting document serializes back to exactly the parsed text.
 *
 * <p>
 * Structural errors are fatal: an incomplete loop row, a field without a value, a value without a
 * field name, a data item before the first block header. No partial document is ever returned.
 *
 * <p>
 * Stateless and thread-safe; each call runs on its own {@link CifLexer}.
 */
public final class CifParser {

    private static final Logger LOG = LoggerFactory.getLogger(CifParser.class);

    /** Source name used when parsing in-memory text without an explicit name. */
    public static final String IN_MEMORY = "<memory>";

    /**
     * Reads and parses a CIF file.
     *
     * @throws CifParseException if the file cannot be read or is malformed
     */
    public Document parse(Path path) {
        byte[] bytes;
        try {
            bytes = Files.readAllBytes(path);
        } catch (IOException e) {
            throw new CifParseException("Failed to read CIF file: " + e.getMessage(), e, path.toString());
        }
        return parse(bytes, path.toString());
    }

    /**
     * Decodes UTF-8 input strictly and parses it.
     *
     * @throws CifParseException if the bytes are not valid UTF-8 or the text is malformed
     */
    public Document parse(byte[] bytes, String sourceName) {
        String text;
        try {
            text = StandardCharsets.UTF_8
                    .newDecoder()
                    .onMalformedInput(CodingErrorAction.REPORT)
                    .onUnmappableCharacter(CodingErrorAction.REPORT)
                    .decode(ByteBuffer.wrap(bytes))
                    .toString();
        } catch (CharacterCodingException e) {
            throw new CifParseException("Input is not valid UTF-8", e, sourceName);
        }
        return parse(text, sourceName);
    }

    public Document parse(String text) {
        return parse(text, IN_MEMORY);
    }

    public Document parse(String text, String sourceName) {
        Document document = new Run(text, sourceName).document();
        LOG.debug(
                "Parsed CIF: source={}, blocks={}, protectedSpans={}",
                sourceName,
                document.blocks().size(),
                document.protectedSpans().size());
        return document;
    }

    /** Parser state for one call. */
    private static final class Run {

        private final String text;
        private final String sourceName;
        private final CifLexer lexer;

        private final List<Entry> leading = new ArrayList<>();
        private final List<Block> blocks = new ArrayList<>();
        private final List<ProtectedSpan> protectedSpans = new ArrayList<>();

        private Token peeked;
        private int cursor;

        private String blockName;
        private Block.Kind blockKind;
        private Span blockHeader;
        private int blockLine;
        private List<Entry> blockEntries;

        Run(String text, String sourceName) {
            this.text = text;
            this.sourceName = sourceName;
            this.lexer = new CifLexer(text, sourceName);
        }

        Document document() {
            Token token;
            while ((token = nextToken()) != null) {
                switch (token.type()) {
                    case BLOCK_HEADER -> openBlock(token);
                    case COMMENT -> add(new Entry.Comment(token.text(), finish(token), token.line()));
                    case BLANK_LINE -> add(new Entry.BlankLine(claim(token.span().end()), token.line()));
                    case TAG -> add(field(token));
                    case LOOP -> add(loop(token));
                    case SAVE_END -> {
                        if (blockKind != Block.Kind.SAVE) {
                            throw error("save_ terminator outside a save frame", token);
                        }
                        add(new Entry.Marker(Entry.Marker.Kind.SAVE_END, finish(token), token.line()));
                    }
                    case STOP -> add(new Entry.Marker(Entry.Marker.Kind.STOP, finish(token), token.line()));
                    case BARE, QUOTED, TRIPLE_QUOTED, COMPOUND -> throw error(
                            "Value '" + abbreviate(token.text()) + "' has no field name", token);
                    default -> throw error("Unexpected " + token.type(), token);
                }
            }
            closeBlock();
            return new Document(text, sourceName, leading, blocks, protectedSpans);
        }

        // ── Entries ──

        private Entry.Field field(Token tag) {
            requireBlock(tag);
            Token first = nextToken();
            while (first != null && first.type() == TokenType.COMMENT) {
                first = nextToken();
            }
            if (first == null || !first.type().isValueStart()) {
                throw error("Field '" + tag.text() + "' has no value", tag);
            }
            ValueRead read = readValue(first);
            return new Entry.Field(tag.text(), tag.span(), read.value(), read.span(), finish(read.last()), tag.line());
        }

        private Entry.Loop loop(Token keyword) {
            requireBlock(keyword);
            List<Entry.LoopColumn> columns = new ArrayList<>();
            Set<String> names = new HashSet<>();
            Token last = keyword;
            Token token;
            while ((token = peek()) != null
                    && (token.type() == TokenType.TAG
                            || token.type() == TokenType.COMMENT
                            || token.type() == TokenType.BLANK_LINE)) {
                nextToken();
                if (token.type() == TokenType.TAG) {
                    if (!names.add(token.text())) {
                        throw error("Duplicate loop column '" + token.text() + "'", token);
                    }
                    columns.add(new Entry.LoopColumn(token.text(), token.span()));
                }
                last = token;
            }
            if (columns.isEmpty()) {
                throw error("loop_ declares no columns", keyword);
            }

            List<Value> values = new ArrayList<>();
            int lastCompleteRowEnd = last.span().end();
            int lastValueLine = last.line();
            while ((token = peek()) != null) {
                if (token.type().isValueStart()) {
                    nextToken();
                    ValueRead read = readValue(token);
                    values.add(read.value());
                    last = read.last();
                    lastValueLine = token.line();
                    if (values.size() % columns.size() == 0) {
                        lastCompleteRowEnd = last.span().end();
                    }
                } else if (token.type() == TokenType.COMMENT) {
                    nextToken();
                    last = token;
                } else {
                    break;
                }
            }
            if (values.isEmpty()) {
                throw error("Loop has no data values", keyword);
            }
            int remainder = values.size() % columns.size();
            if (remainder != 0) {
                throw new CifParseException(
                        "Loop with " + columns.size() + " columns ends with an incomplete row of " + remainder
                                + " value(s)",
                        sourceName,
                        lastCompleteRowEnd,
                        lastValueLine);
            }

            List<List<Value>> rows = new ArrayList<>();
            for (int i = 0; i < values.size(); i += columns.size()) {
                rows.add(values.subList(i, i + columns.size()));
            }
            return new Entry.Loop(keyword.span(), columns, rows, finish(last), keyword.line());
        }

        private ValueRead readValue(Token first) {
            return switch (first.type()) {
                case BARE -> new ValueRead(new Value.Bare(first.text()), first.span(), first);
                case QUOTED -> new ValueRead(
                        new Value.Quoted(first.text(), text.charAt(first.span().start())), first.span(), first);
                case TRIPLE_QUOTED -> new ValueRead(
                        new Value.TripleQuoted(first.text(), text.charAt(first.span().start())), first.span(), first);
                case COMPOUND -> new ValueRead(new Value.Compound(first.text()), first.span(), first);
                case TEXT_BLOCK_OPEN -> {
                    Token body = expect(nextToken(), TokenType.TEXT_BLOCK_BODY, first);
                    Token close = expect(nextToken(), TokenType.TEXT_BLOCK_CLOSE, first);
                    yield new ValueRead(
                            new Value.TextBlock(textBlockContent(body.text())),
                            new Span(first.span().start(), close.span().end()),
                            close);
                }
                default -> throw error("Expected a value but found " + first.type(), first);
            };
        }

        // ── Blocks ──

        private void openBlock(Token header) {
            closeBlock();
            String word = header.text();
            String lower = word.toLowerCase(Locale.ROOT);
            Block.Kind kind;
            if (lower.startsWith("data_")) {
                kind = Block.Kind.DATA;
            } else if (lower.startsWith("save_")) {
                kind = Block.Kind.SAVE;
            } else {
                kind = Block.Kind.GLOBAL;
            }
            blockKind = kind;
            blockName = word.substring(kind.keyword().length());
            blockLine = header.line();
            blockHeader = finish(header);
            blockEntries = new ArrayList<>();
        }

        private void closeBlock() {
            if (blockEntries == null) {
                return;
            }
            int end = blockEntries.isEmpty()
                    ? blockHeader.end()
                    : blockEntries.get(blockEntries.size() - 1).extent().end();
            blocks.add(new Block(
                    blockName, blockKind, blockHeader, blockEntries, new Span(blockHeader.start(), end), blockLine));
            blockEntries = null;
        }

        private void add(Entry entry) {
            if (blockEntries != null) {
                blockEntries.add(entry);
            } else {
                leading.add(entry);
            }
        }

        private void requireBlock(Token token) {
            if (blockEntries == null) {
                throw error("'" + token.text() + "' appears before the first data block header", token);
            }
        }

        // ── Extents ──

        /**
         * Closes the entry whose last token is {@code last}. A comment on the same line is absorbed;
         * when nothing else follows on the line, the extent runs through the line terminator.
         */
        private Span finish(Token last) {
            int end = last.span().end();
            int lastLine = last.endLine();
            Token next = peek();
            if (next != null && next.type() == TokenType.COMMENT && next.line() == lastLine) {
                nextToken();
                end = next.span().end();
                next = peek();
            }
            if (next == null || next.line() > lastLine) {
                end = lineEnd(end);
            }
            return claim(end);
        }

        private Span claim(int end) {
            Span extent = new Span(cursor, end);
            cursor = end;
            return extent;
        }

        private int lineEnd(int from) {
            int i = from;
            while (i < text.length() && text.charAt(i) != '\n' && text.charAt(i) != '\r') {
                i++;
            }
            if (i < text.length()) {
                i += text.startsWith("\r\n", i) ? 2 : 1;
            }
            return i;
        }

        // ── Tokens ──

        private Token peek() {
            if (peeked == null && lexer.hasNext()) {
                peeked = receive(lexer.next());
            }
            return peeked;
        }

        private Token nextToken() {
            Token token = peek();
            peeked = null;
            return token;
        }

        private Token receive(Token token) {
            Span span = token.span();
            switch (token.type()) {
                case COMMENT -> protectedSpans.add(new ProtectedSpan(span, ProtectedSpan.Kind.COMMENT));
                case TEXT_BLOCK_BODY -> protectedSpans.add(new ProtectedSpan(span, ProtectedSpan.Kind.TEXT_BLOCK));
                case TRIPLE_QUOTED -> protectedSpans.add(new ProtectedSpan(
                        new Span(span.start() + 3, span.end() - 3), ProtectedSpan.Kind.TRIPLE_QUOTED));
                case COMPOUND -> protectedSpans.add(new ProtectedSpan(span, ProtectedSpan.Kind.COMPOUND));
                default -> {
                    // not protected
                }
            }
            return token;
        }

        private Token expect(Token token, TokenType type, Token context) {
            if (token == null || token.type() != type) {
                throw error("Malformed text block", context);
            }
            return token;
        }

        private CifParseException error(String message, Token token) {
            return new CifParseException(message, sourceName, cursor, token.line());
        }
    }

    /**
     * Text-block content without the delimiting line breaks: the terminator before the closing
     * semicolon, and the opening line when it holds nothing but whitespace.
     */
    static String textBlockContent(String body) {
        String content = body;
        if (content.endsWith("\r\n")) {
            content = content.substring(0, content.length() - 2);
        } else if (content.endsWith("\n") || content.endsWith("\r")) {
            content = content.substring(0, content.length() - 1);
        }
        int firstBreak = 0;
        while (firstBreak < content.length()
                && (content.charAt(firstBreak) == ' ' || content.charAt(firstBreak) == '\t')) {
            firstBreak++;
        }
        if (firstBreak == content.length()) {
            return "";
        }
        if (content.startsWith("\r\n", firstBreak)) {
            return content.substring(firstBreak + 2);
        }
        if (content.charAt(firstBreak) == '\n' || content.charAt(firstBreak) == '\r') {
            return content.substring(firstBreak + 1);
        }
        return content;
    }

    private static String abbreviate(String value) {
        return value.length() <= 40 ? value : value.substring(0, 37) + "...";
    }

    private record ValueRead(Value value, Span span, Token last) {}
}
