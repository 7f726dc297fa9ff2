package com.xmlserdes.schema;

import lombok.experimental.UtilityClass;

import java.util.Arrays;
import java.util.Locale;
import java.util.stream.Collectors;

/**
 * Naming conventions between XML tags and Java names.
 */
@UtilityClass
public class TagNames {

    public static final String ATTRIBUTE_MARKER = "@";
    public static final String ITEM_SUFFIX = "-item";

    /**
     * {@code seat-count} becomes {@code seat_count}.
     */
    public static String toFieldName(String tag) {
        return tag.replace('-', '_');
    }

    /**
     * Item tag for a list whose grouping element is {@code groupingTag}:
     * {@code categories -> category}, {@code dimensions -> dimension}, otherwise the
     * grouping tag plus {@value #ITEM_SUFFIX}.
     */
    public static String singular(String groupingTag) {
        if (groupingTag.length() > 3 && groupingTag.endsWith("ies")) {
            return groupingTag.substring(0, groupingTag.length() - 3) + "y";
        }
        if (groupingTag.length() > 1 && groupingTag.endsWith("s") && !groupingTag.endsWith("ss")) {
            return groupingTag.substring(0, groupingTag.length() - 1);
        }
        return groupingTag + ITEM_SUFFIX;
    }

    /**
     * {@code FurnitureItem -> furniture-item}.
     */
    public static String fromClassName(String simpleName) {
        return Arrays.stream(simpleName.split("(?<=[a-z0-9])(?=[A-Z])"))
                .map(part -> part.toLowerCase(Locale.ROOT))
                .collect(Collectors.joining("-"));
    }
}
