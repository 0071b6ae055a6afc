package org.zimcorpus.sharding.pipeline.filter;

import java.util.Objects;
import java.util.Optional;
import java.util.regex.Pattern;

import org.zimcorpus.sharding.pipeline.ir.RecordEntry;

/**
 * The rejection predicates applied by the scanner, evaluated in a fixed order: namespace, deletion,
 * redirect, then the title pattern. The first one that matches decides.
 *
 * @param namespace the only namespace whose entries are kept
 * @param titleExclusion entries whose title contains a match are dropped; {@code null} disables the check
 */
public record ExclusionRules(String namespace, Pattern titleExclusion) implements RecordFilter {

    public static final String ARTICLE_NAMESPACE = "A";

    public ExclusionRules {
        Objects.requireNonNull(namespace, "namespace must not be null");
    }

    /** Keeps articles and drops the disambiguation pages of the given language. */
    public static ExclusionRules forLanguage(Language language) {
        return forLiteralTitleMarker(ARTICLE_NAMESPACE, language.disambiguationMarker());
    }

    public static ExclusionRules forLiteralTitleMarker(String namespace, String marker) {
        return new ExclusionRules(namespace, Pattern.compile(Pattern.quote(marker)));
    }

    public static ExclusionRules forRegex(String namespace, String regex) {
        return new ExclusionRules(namespace, Pattern.compile(regex));
    }

    @Override
    public Optional<DropReason> rejectionOf(RecordEntry entry) {
        if (!namespace.equals(entry.namespace())) {
            return Optional.of(DropReason.WRONG_NAMESPACE);
        }
        if (entry.deleted()) {
            return Optional.of(DropReason.DELETED);
        }
        if (entry.redirect()) {
            return Optional.of(DropReason.REDIRECT);
        }
        if (titleExclusion != null && entry.title() != null && titleExclusion.matcher(entry.title()).find()) {
            return Optional.of(DropReason.EXCLUDED_TITLE);
        }
        return Optional.empty();
    }
}
