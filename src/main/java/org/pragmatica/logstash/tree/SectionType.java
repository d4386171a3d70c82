package org.pragmatica.logstash.tree;

import java.util.Arrays;
import java.util.Locale;
import java.util.Optional;

public enum SectionType {
    INPUT,
    FILTER,
    OUTPUT;

    /**
     * Keyword as written in configuration text.
     */
    public String keyword() {
        return name().toLowerCase(Locale.ROOT);
    }

    public static Optional<SectionType> fromKeyword(String keyword) {
        return Arrays.stream(values())
                     .filter(type -> type.keyword().equals(keyword))
                     .findFirst();
    }
}
