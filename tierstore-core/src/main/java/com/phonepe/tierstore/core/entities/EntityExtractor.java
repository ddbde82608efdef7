package com.phonepe.tierstore.core.entities;

import com.google.common.base.Strings;
import lombok.experimental.UtilityClass;

import java.util.Arrays;
import java.util.LinkedHashSet;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * Pulls entities out of free text. Two rules are applied:
 * <ul>
 *     <li>Runs of capitalized words ("Paris", "New York City"). A leading article or pronoun is dropped, so "The
 *     Louvre" yields "Louvre" and a lone "The" yields nothing.</li>
 *     <li>Anything between double quotes, verbatim.</li>
 * </ul>
 * Extraction never fails, text without matches gives an empty set.
 */
@UtilityClass
public class EntityExtractor {
    private static final Pattern CAPITALIZED_PHRASE = Pattern.compile("\\b[A-Z][a-z]+(?:\\s+[A-Z][a-z]+)*\\b");
    private static final Pattern QUOTED = Pattern.compile("\"([^\"]+)\"");
    private static final Set<String> STOP_WORDS = Set.of(
            "The", "A", "An", "I", "It", "He", "She", "We", "They", "You", "This", "That");

    /**
     * @param text Free text, may be null
     * @return Entities in order of first appearance, without duplicates
     */
    public static Set<String> extract(final String text) {
        final var entities = new LinkedHashSet<String>();
        if (Strings.isNullOrEmpty(text)) {
            return entities;
        }
        final var phrases = CAPITALIZED_PHRASE.matcher(text);
        while (phrases.find()) {
            final var phrase = stripLeadingStopWord(phrases.group());
            if (!phrase.isEmpty()) {
                entities.add(phrase);
            }
        }
        final var quotes = QUOTED.matcher(text);
        while (quotes.find()) {
            entities.add(quotes.group(1));
        }
        return entities;
    }

    private static String stripLeadingStopWord(String phrase) {
        final var words = phrase.split("\\s+");
        if (!STOP_WORDS.contains(words[0])) {
            return phrase;
        }
        return String.join(" ", Arrays.copyOfRange(words, 1, words.length));
    }
}
