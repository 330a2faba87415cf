package io.cifxform.core.rules;

import java.util.Objects;

/**
 * One declarative edit rule. Every rule targets a field by exact data name; {@code line} is the
 * 1-based line in the rule source, or 0 for rules built in code.
 */
public sealed interface Rule {

    /** The data name the rule reads or writes. */
    String field();

    int line();

    /** The rule as it would be written in a rule file. */
    String toSource();

    /**
     * Reports whether a field holds its expected default. Never mutates.
     *
     * @param expectedDefault the value the field is expected to hold
     * @param description     optional note from the rule file, or {@code null}
     */
    record Check(String field, String expectedDefault, String description, int line) implements Rule {
        public Check {
            requireName(field);
            Objects.requireNonNull(expectedDefault, "expectedDefault must not be null");
        }

        @Override
        public String toSource() {
            return "CHECK: " + field + " " + expectedDefault;
        }
    }

    /** Removes a field, or a loop column together with its values. */
    record Delete(String field, int line) implements Rule {
        public Delete {
            requireName(field);
        }

        @Override
        public String toSource() {
            return "DELETE: " + field;
        }
    }

    /** Replaces the value of an existing field. */
    record Edit(String field, String value, int line) implements Rule {
        public Edit {
            requireName(field);
            Objects.requireNonNull(value, "value must not be null");
        }

        @Override
        public String toSource() {
            return "EDIT: " + field + " " + value;
        }
    }

    /** Renames a field or loop column. */
    record Rename(String field, String newName, int line) implements Rule {
        public Rename {
            requireName(field);
            requireName(newName);
        }

        @Override
        public String toSource() {
            return "RENAME: " + field + " " + newName;
        }
    }

    /** Computes a field's value from other fields, creating the field when absent. */
    record Calculate(String field, Expression expression, String expressionText, int line) implements Rule {
        public Calculate {
            requireName(field);
            Objects.requireNonNull(expression, "expression must not be null");
            Objects.requireNonNull(expressionText, "expressionText must not be null");
        }

        @Override
        public String toSource() {
            return "CALCULATE: " + field + " = " + expressionText;
        }
    }

    /** Adds a line of text to a field, turning it into a text block. */
    record Append(String field, String text, int line) implements Rule {
        public Append {
            requireName(field);
            Objects.requireNonNull(text, "text must not be null");
        }

        @Override
        public String toSource() {
            return "APPEND: " + field + " " + text;
        }
    }

    private static void requireName(String name) {
        Objects.requireNonNull(name, "field name must not be null");
        if (name.length() < 2 || name.charAt(0) != '_' || name.chars().anyMatch(Character::isWhitespace)) {
            throw new IllegalArgumentException("Invalid data name: '" + name + "'");
        }
    }
}
