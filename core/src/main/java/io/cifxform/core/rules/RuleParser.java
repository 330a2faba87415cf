package io.cifxform.core.rules;

import io.cifxform.core.error.RuleParseException;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Parses field-rule files, one rule per line.
 *
 * <pre>
 * # _diffrn_ambient_temperature: should be measured
 * _diffrn_ambient_temperature 293
 * CHECK: _cell_measurement_temperature 293
 * DELETE: _shelx_res_file
 * EDIT: _chemical_name_common 'compound X'
 * RENAME: _symmetry_space_group_name_H-M _space_group_name_H-M_alt
 * CALCULATE: _exptl_absorpt_coefficient_mu = _exptl_absorpt_coefficient_mu / 10
 * APPEND: _publ_section_references "Ref A\nRef B"
 * </pre>
 *
 * <p>
 * Values may be quoted with {@code '} or {@code "}; inside double quotes {@code \n} is a line
 * break. A {@code #} preceded by whitespace outside quotes starts a trailing comment; on a check
 * line that comment becomes the check's description unless a {@code # _field:} line names one.
 * Lines starting with {@code //} are ignored.
 *
 * <p>
 * Thread-safe and stateless.
 */
public final class RuleParser {

    private static final Logger LOG = LoggerFactory.getLogger(RuleParser.class);

    private static final Pattern DIRECTIVE = Pattern.compile("([A-Za-z]+)\\s*:\\s*(.*)");
    private static final Pattern DESCRIPTION = Pattern.compile("#\\s*(_\\S+?)\\s*:\\s*(.*)");
    private static final Pattern CALCULATION = Pattern.compile("(\\S+)\\s*=\\s*(.+)");

    /**
     * Reads and parses a rule file.
     *
     * @throws RuleParseException if the file cannot be read or contains an invalid line
     */
    public List<Rule> parse(Path path) {
        Objects.requireNonNull(path, "path must not be null");
        String content;
        try {
            content = Files.readString(path, StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new RuleParseException("Failed to read rule file: " + e.getMessage(), e, path.toString());
        }
        return parse(content, path.toString());
    }

    /**
     * Parses rule text.
     *
     * @param sourceName reported in errors
     * @throws RuleParseException on the first invalid line
     */
    public List<Rule> parse(String content, String sourceName) {
        List<Rule> rules = new ArrayList<>();
        Map<String, String> descriptions = new HashMap<>();
        String[] lines = content.split("\\r?\\n|\\r", -1);
        for (int i = 0; i < lines.length; i++) {
            int lineNumber = i + 1;
            String line = lines[i].strip();
            if (line.isEmpty() || line.startsWith("//")) {
                continue;
            }
            if (line.startsWith("#")) {
                Matcher description = DESCRIPTION.matcher(line);
                if (description.matches()) {
                    descriptions.put(description.group(1), description.group(2).strip());
                }
                continue;
            }
            int comment = commentStart(line);
            Rule rule = parseLine(comment < 0 ? line : line.substring(0, comment).strip(), sourceName, lineNumber);
            if (comment >= 0 && rule instanceof Rule.Check check) {
                String note = line.substring(comment + 1).strip();
                rule = new Rule.Check(check.field(), check.expectedDefault(), note.isEmpty() ? null : note, lineNumber);
            }
            rules.add(rule);
        }
        List<Rule> described = new ArrayList<>(rules.size());
        for (Rule rule : rules) {
            if (rule instanceof Rule.Check check && descriptions.containsKey(check.field())) {
                described.add(new Rule.Check(
                        check.field(), check.expectedDefault(), descriptions.get(check.field()), check.line()));
            } else {
                described.add(rule);
            }
        }
        LOG.debug("Parsed rules: source={}, rules={}", sourceName, described.size());
        return List.copyOf(described);
    }

    private Rule parseLine(String line, String source, int lineNumber) {
        if (line.startsWith("_")) {
            return check(line, source, lineNumber);
        }
        Matcher directive = DIRECTIVE.matcher(line);
        if (!directive.matches()) {
            throw new RuleParseException("Unrecognized rule '" + line + "'", source, lineNumber);
        }
        String operands = directive.group(2).strip();
        return switch (directive.group(1).toUpperCase(Locale.ROOT)) {
            case "CHECK" -> check(operands, source, lineNumber);
            case "DELETE" -> {
                String[] parts = split(operands, source, lineNumber, "DELETE needs a field name");
                if (!parts[1].isEmpty()) {
                    throw new RuleParseException("DELETE takes exactly one field name", source, lineNumber);
                }
                yield new Rule.Delete(parts[0], lineNumber);
            }
            case "EDIT" -> {
                String[] parts = split(operands, source, lineNumber, "EDIT needs a field name and a value");
                yield new Rule.Edit(parts[0], value(parts[1], "EDIT", source, lineNumber), lineNumber);
            }
            case "RENAME" -> {
                String[] parts = split(operands, source, lineNumber, "RENAME needs two field names");
                String newName = parts[1];
                if (newName.isEmpty() || newName.chars().anyMatch(Character::isWhitespace)) {
                    throw new RuleParseException("RENAME needs exactly two field names", source, lineNumber);
                }
                yield new Rule.Rename(parts[0], fieldName(newName, source, lineNumber), lineNumber);
            }
            case "CALCULATE" -> {
                Matcher calculation = CALCULATION.matcher(operands);
                if (!calculation.matches()) {
                    throw new RuleParseException(
                            "CALCULATE needs the form '_field = expression'", source, lineNumber);
                }
                String field = fieldName(calculation.group(1), source, lineNumber);
                String expressionText = calculation.group(2).strip();
                yield new Rule.Calculate(
                        field, ExpressionParser.parse(expressionText, source, lineNumber), expressionText, lineNumber);
            }
            case "APPEND" -> {
                String[] parts = split(operands, source, lineNumber, "APPEND needs a field name and text");
                yield new Rule.Append(parts[0], value(parts[1], "APPEND", source, lineNumber), lineNumber);
            }
            default -> throw new RuleParseException(
                    "Unknown directive '" + directive.group(1) + "'", source, lineNumber);
        };
    }

    private Rule check(String operands, String source, int lineNumber) {
        String[] parts = split(operands, source, lineNumber, "CHECK needs a field name and a default value");
        return new Rule.Check(parts[0], value(parts[1], "CHECK", source, lineNumber), null, lineNumber);
    }

    /** Splits operands into a validated field name and the stripped remainder. */
    private static String[] split(String operands, String source, int lineNumber, String missing) {
        if (operands.isEmpty()) {
            throw new RuleParseException(missing, source, lineNumber);
        }
        int space = 0;
        while (space < operands.length() && !Character.isWhitespace(operands.charAt(space))) {
            space++;
        }
        String field = fieldName(operands.substring(0, space), source, lineNumber);
        return new String[] {field, operands.substring(space).strip()};
    }

    private static String fieldName(String name, String source, int lineNumber) {
        if (name.length() < 2 || name.charAt(0) != '_') {
            throw new RuleParseException("Invalid field name '" + name + "' (must start with '_')", source, lineNumber);
        }
        return name;
    }

    private static String value(String raw, String directive, String source, int lineNumber) {
        if (raw.isEmpty()) {
            throw new RuleParseException(directive + " is missing its value", source, lineNumber);
        }
        if (raw.length() >= 2) {
            char first = raw.charAt(0);
            char last = raw.charAt(raw.length() - 1);
            if (first == '"' && last == '"') {
                return raw.substring(1, raw.length() - 1).replace("\\n", "\n");
            }
            if (first == '\'' && last == '\'') {
                return raw.substring(1, raw.length() - 1);
            }
        }
        return raw;
    }

    /** Index of a trailing {@code #} comment, or -1. */
    static int commentStart(String line) {
        char quote = 0;
        for (int i = 0; i < line.length(); i++) {
            char c = line.charAt(i);
            if (quote != 0) {
                if (c == quote) {
                    quote = 0;
                }
            } else if (c == '\'' || c == '"') {
                quote = c;
            } else if (c == '#' && i > 0 && Character.isWhitespace(line.charAt(i - 1))) {
                return i;
            }
        }
        return -1;
    }
}
