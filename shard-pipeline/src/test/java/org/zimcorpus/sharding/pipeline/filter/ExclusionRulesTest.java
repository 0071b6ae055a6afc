package org.zimcorpus.sharding.pipeline.filter;

import java.util.Optional;

import org.zimcorpus.sharding.pipeline.ir.RecordEntry;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class ExclusionRulesTest {

    private static RecordEntry article(String title) {
        return new RecordEntry(1, title, "A", false, false);
    }

    @Test
    void keepsPlainArticles() {
        var rules = ExclusionRules.forLanguage(Language.EN);
        assertEquals(Optional.empty(), rules.rejectionOf(article("Mercury (planet)")));
        assertTrue(rules.accepts(article("Mercury (planet)")));
    }

    @Test
    void namespaceIsCheckedFirst() {
        var rules = ExclusionRules.forLanguage(Language.EN);
        var everything = new RecordEntry(1, "Mercury (disambiguation)", "I", true, true);
        assertEquals(Optional.of(DropReason.WRONG_NAMESPACE), rules.rejectionOf(everything));
    }

    @Test
    void deletionBeatsRedirectAndTitle() {
        var rules = ExclusionRules.forLanguage(Language.EN);
        assertEquals(Optional.of(DropReason.DELETED),
            rules.rejectionOf(new RecordEntry(1, "X (disambiguation)", "A", true, true)));
        assertEquals(Optional.of(DropReason.REDIRECT),
            rules.rejectionOf(new RecordEntry(1, "X (disambiguation)", "A", true, false)));
    }

    @Test
    void languageMarkerIsMatchedLiterally() {
        var hungarian = ExclusionRules.forLanguage(Language.HU);
        assertEquals(Optional.of(DropReason.EXCLUDED_TITLE),
            hungarian.rejectionOf(article("Merkúr (egyértelműsítő lap)")));
        // the parentheses are not a regex group
        assertTrue(hungarian.accepts(article("Merkúr egyértelműsítő lap")));
        assertTrue(hungarian.accepts(article("Mercury (disambiguation)")));
    }

    @Test
    void regexPatternMatchesAnywhereInTitle() {
        var rules = ExclusionRules.forRegex("A", "^List of|\\(disambiguation\\)$");
        assertFalse(rules.accepts(article("List of rivers")));
        assertFalse(rules.accepts(article("Java (disambiguation)")));
        assertTrue(rules.accepts(article("Rivers of Europe")));
    }

    @Test
    void missingPatternOnlyAppliesFlagChecks() {
        var rules = new ExclusionRules("A", null);
        assertTrue(rules.accepts(article("Java (disambiguation)")));
    }

    @Test
    void resolvesSupportedLanguages() {
        assertEquals(Language.HU, Language.fromCode("hu"));
        assertEquals(Language.EN, Language.fromCode("EN"));
        var failure = assertThrows(IllegalArgumentException.class, () -> Language.fromCode("de"));
        assertTrue(failure.getMessage().contains("'hu' and 'en'"));
    }
}
