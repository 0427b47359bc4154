package com.medReports.facilityRecon.facility.service;

import com.medReports.facilityRecon.facility.model.FacilityKey;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * Service for normalizing raw facility labels to canonical facility keys.
 *
 * Extracts from different sources name the same facility differently
 * ("Medilodge of Wyoming", "Medilodge of Wyoming (M)", "Medilodge of Wyoming - SNF, LLC").
 * All of them collapse to one {@link FacilityKey}. Labels that reduce to nothing are kept
 * verbatim so two unknown labels are never merged.
 */
@Slf4j
@Service
public class FacilityNormalizer {

    private static final Pattern BRACKETED = Pattern.compile("\\([^)]*\\)|\\[[^\\]]*\\]");
    private static final Pattern SUITE = Pattern.compile("[\\s,-]*\\b(?:ste|suite)\\.?\\s*#?\\d+\\w*\\s*$");
    private static final Pattern QUARTER = Pattern.compile(
            "[\\s,-]+(?:q[1-4]|quarter\\s*[1-4])(?:[\\s,-]*\\d{4})?$|[\\s,-]+\\d{4}[\\s-]*q[1-4]$");
    private static final Pattern LEGAL_ENTITY = Pattern.compile(
            "[\\s,-]+(?:llc|l\\.l\\.c\\.?|inc\\.?|incorporated|corp\\.?|corporation|ltd\\.?|llp|lp)$");
    private static final Pattern CARE_TYPE = Pattern.compile(
            "[\\s,-]+(?:snf|skilled\\s+nursing(?:\\s+facility)?)$");
    private static final Pattern TRAILING_PUNCTUATION = Pattern.compile("[\\s,.-]+$");
    private static final Pattern SAINT = Pattern.compile("\\b(?:saint|st\\.?)(?=\\s)");
    private static final Pattern MOUNT = Pattern.compile("\\b(?:mount|mt\\.?)(?=\\s)");
    private static final Pattern SEPARATORS = Pattern.compile("[_,/-]+");
    private static final Pattern DROPPED = Pattern.compile("[.'\"]+");
    private static final Pattern WHITESPACE = Pattern.compile("\\s+");

    private static final List<Pattern> SUFFIXES = List.of(SUITE, QUARTER, LEGAL_ENTITY, CARE_TYPE, TRAILING_PUNCTUATION);
    private static final Set<String> LOWERCASE_WORDS = Set.of("of", "at", "the", "and", "on", "in", "by");

    /**
     * Normalizes a raw facility label.
     *
     * Never fails: a label that cannot be reduced becomes its own verbatim key.
     *
     * @param rawLabel Raw label as found in an extract or upload file name
     * @return Canonical facility key
     */
    public FacilityKey normalize(String rawLabel) {
        if (rawLabel == null || rawLabel.isBlank()) {
            return FacilityKey.verbatim(FacilityKey.UNLABELED);
        }

        String normalized = rawLabel.trim().toLowerCase(Locale.ROOT);
        String previous;
        do {
            previous = normalized;
            normalized = clean(normalized);
        } while (!normalized.equals(previous));

        if (normalized.isEmpty()) {
            log.debug("Facility label kept verbatim - label: '{}'", rawLabel);
            return FacilityKey.verbatim(rawLabel.trim());
        }
        return FacilityKey.of(normalized);
    }

    /**
     * Formats a facility key for display, e.g. "medilodge of st joseph" becomes
     * "Medilodge of St. Joseph". Normalizing the display name yields the same key again.
     */
    public String displayName(FacilityKey key) {
        if (key.verbatim()) {
            return key.value();
        }

        String[] words = key.value().split(" ");
        List<String> formatted = new ArrayList<>(words.length);
        for (int i = 0; i < words.length; i++) {
            String word = words[i];
            if (word.equals("st")) {
                formatted.add("St.");
            } else if (word.equals("mt")) {
                formatted.add("Mt.");
            } else if (i > 0 && LOWERCASE_WORDS.contains(word)) {
                formatted.add(word);
            } else {
                formatted.add(Character.toUpperCase(word.charAt(0)) + word.substring(1));
            }
        }
        return String.join(" ", formatted);
    }

    /**
     * Creates the per-run label cache. Every run gets its own directory.
     *
     * @param knownLabels Expected facility labels; empty accepts any facility
     */
    public FacilityDirectory newDirectory(Collection<String> knownLabels) {
        return new FacilityDirectory(this, knownLabels);
    }

    private String clean(String label) {
        String cleaned = BRACKETED.matcher(label).replaceAll(" ");
        cleaned = WHITESPACE.matcher(cleaned).replaceAll(" ").trim();
        cleaned = stripSuffixes(cleaned);
        cleaned = SAINT.matcher(cleaned + " ").replaceAll("st");
        cleaned = MOUNT.matcher(cleaned).replaceAll("mt");
        cleaned = SEPARATORS.matcher(cleaned).replaceAll(" ");
        cleaned = DROPPED.matcher(cleaned).replaceAll("");
        return WHITESPACE.matcher(cleaned).replaceAll(" ").trim();
    }

    private String stripSuffixes(String label) {
        String previous;
        String current = label;
        do {
            previous = current;
            for (Pattern suffix : SUFFIXES) {
                current = suffix.matcher(current).replaceAll("");
            }
        } while (!current.equals(previous));
        return current;
    }
}
