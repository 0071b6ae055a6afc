package org.zimcorpus.sharding.pipeline.filter;

import java.util.Arrays;
import java.util.Locale;
import java.util.stream.Collectors;

/**
 * Wikipedia languages with a known disambiguation page title marker.
 */
public enum Language {
    HU("hu", "(egyértelműsítő lap)"),
    EN("en", "(disambiguation)");

    private final String code;
    private final String disambiguationMarker;

    Language(String code, String disambiguationMarker) {
        this.code = code;
        this.disambiguationMarker = disambiguationMarker;
    }

    public String code() {
        return code;
    }

    public String disambiguationMarker() {
        return disambiguationMarker;
    }

    public static Language fromCode(String code) {
        var normalized = code.toLowerCase(Locale.ROOT);
        return Arrays.stream(values())
            .filter(language -> language.code.equals(normalized))
            .findFirst()
            .orElseThrow(() -> new IllegalArgumentException(
                "Language '" + code + "' is not supported. Choose between " + supportedCodes() + "."));
    }

    public static String supportedCodes() {
        return Arrays.stream(values())
            .map(language -> "'" + language.code + "'")
            .collect(Collectors.joining(" and "));
    }
}
