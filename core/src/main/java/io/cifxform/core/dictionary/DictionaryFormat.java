package io.cifxform.core.dictionary;

import java.util.List;
import java.util.Locale;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Dictionary definition-language dialects. Detection scores characteristic markers in the raw
 * source; the dialect with the highest score wins and a zero score is {@link #UNKNOWN}.
 */
public enum DictionaryFormat {
    DDLM,
    DDL1,
    DDL2,
    UNKNOWN;

    private static final List<String> DDLM_MARKERS =
            List.of("_definition.id", "_dictionary.title", "_type.contents", "_name.category_id");
    private static final List<String> DDL1_MARKERS = List.of("data_on_this_dictionary", "_dictionary_name");
    private static final List<String> DDL2_MARKERS = List.of("_item.name", "_item.category_id");

    private static final Pattern DATA_HEADER = Pattern.compile("(?m)^\\s*data_\\S+");
    private static final Pattern SAVE_HEADER = Pattern.compile("(?m)^\\s*save_\\S+");

    /** Detects the dialect of a dictionary source. */
    public static DictionaryFormat detect(String content) {
        String lower = content.toLowerCase(Locale.ROOT);
        int ddlm = score(lower, DDLM_MARKERS);
        int ddl1 = score(lower, DDL1_MARKERS);
        int ddl2 = score(lower, DDL2_MARKERS);
        if (countMatches(DATA_HEADER, lower) > 1 && !SAVE_HEADER.matcher(lower).find()) {
            ddl1++;
        }
        if (ddlm == 0 && ddl1 == 0 && ddl2 == 0) {
            return UNKNOWN;
        }
        if (ddl2 > ddlm && ddl2 > ddl1) {
            return DDL2;
        }
        return ddlm >= ddl1 ? DDLM : DDL1;
    }

    private static int score(String content, List<String> markers) {
        int score = 0;
        for (String marker : markers) {
            if (content.contains(marker)) {
                score++;
            }
        }
        return score;
    }

    private static int countMatches(Pattern pattern, String content) {
        Matcher matcher = pattern.matcher(content);
        int count = 0;
        while (matcher.find()) {
            count++;
        }
        return count;
    }
}
