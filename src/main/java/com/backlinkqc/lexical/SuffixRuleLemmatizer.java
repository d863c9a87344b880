package com.backlinkqc.lexical;

import java.util.Locale;
import java.util.Map;
import java.util.Set;

/**
 * English suffix-stripping lemmatizer driven by a fixed rule table.
 *
 * <p>Rules, applied in order:
 * <ol>
 *   <li>Tokens with an upper-case letter after the first character (acronyms,
 *       brand spellings such as {@code SEO} or {@code iPhone}) are kept verbatim.</li>
 *   <li>The token is lower-cased; irregular forms map through {@link #IRREGULAR}.</li>
 *   <li>Protected words (homographs whose suffix carries meaning, e.g.
 *       {@code news}, {@code series}) and tokens of three letters or fewer are kept.</li>
 *   <li>Plural: {@code -sses → -ss}, {@code -ies → -y}, {@code -es} after
 *       s/x/z/ch/sh is dropped, a final {@code -s} is dropped unless the word
 *       ends in {@code ss}, {@code us} or {@code is}.</li>
 *   <li>Verb: {@code -ied → -y}; {@code -ing} and {@code -ed} are dropped when
 *       at least four letters remain, then a doubled final consonant other than
 *       l/s/z is reduced ({@code planned → plan}).</li>
 *   <li>A trailing {@code e} is dropped from stems longer than four letters
 *       unless the stem ends in {@code ee}, so {@code measure}, {@code measured}
 *       and {@code measuring} share the root {@code measur}.</li>
 * </ol>
 */
public class SuffixRuleLemmatizer implements Lemmatizer {

    static final Map<String, String> IRREGULAR = Map.of(
        "analyses", "analysis",
        "data", "data",
        "criteria", "criterion",
        "indices", "index",
        "children", "child",
        "people", "person"
    );

    static final Set<String> PROTECTED = Set.of(
        "news", "series", "species", "lens", "physics", "economics", "analytics",
        "politics", "means", "bass", "this", "thus", "does", "always", "perhaps",
        "sometimes", "across", "less", "unless", "various", "previous", "famous"
    );

    @Override
    public String lemma(String token) {
        if (token == null || token.isEmpty()) {
            return "";
        }
        if (hasInnerUpperCase(token)) {
            return token;
        }
        String word = token.toLowerCase(Locale.ROOT);
        String irregular = IRREGULAR.get(word);
        if (irregular != null) {
            return irregular;
        }
        if (word.length() <= 3 || PROTECTED.contains(word) || !isAlphabetic(word)) {
            return word;
        }
        word = stripPlural(word);
        word = stripVerbSuffix(word);
        return stripFinalE(word);
    }

    private static String stripPlural(String word) {
        if (word.endsWith("sses")) {
            return word.substring(0, word.length() - 2);
        }
        if (word.endsWith("ies") && word.length() > 4) {
            return word.substring(0, word.length() - 3) + "y";
        }
        if (word.endsWith("es") && word.length() > 4) {
            String stem = word.substring(0, word.length() - 2);
            if (stem.endsWith("s") || stem.endsWith("x") || stem.endsWith("z")
                || stem.endsWith("ch") || stem.endsWith("sh")) {
                return stem;
            }
        }
        if (word.endsWith("s") && !word.endsWith("ss") && !word.endsWith("us") && !word.endsWith("is")) {
            return word.substring(0, word.length() - 1);
        }
        return word;
    }

    private static String stripVerbSuffix(String word) {
        if (word.endsWith("ied") && word.length() > 4) {
            return word.substring(0, word.length() - 3) + "y";
        }
        if (word.endsWith("ing") && word.length() - 3 >= 4) {
            return undouble(word.substring(0, word.length() - 3));
        }
        if (word.endsWith("ed") && word.length() - 2 >= 4) {
            return undouble(word.substring(0, word.length() - 2));
        }
        return word;
    }

    private static String undouble(String stem) {
        int n = stem.length();
        if (n >= 2) {
            char last = stem.charAt(n - 1);
            if (last == stem.charAt(n - 2) && isConsonant(last) && "lsz".indexOf(last) < 0) {
                return stem.substring(0, n - 1);
            }
        }
        return stem;
    }

    private static String stripFinalE(String word) {
        if (word.length() > 4 && word.endsWith("e") && !word.endsWith("ee")) {
            return word.substring(0, word.length() - 1);
        }
        return word;
    }

    private static boolean isConsonant(char c) {
        return Character.isLetter(c) && "aeiouy".indexOf(c) < 0;
    }

    private static boolean isAlphabetic(String word) {
        for (int i = 0; i < word.length(); i++) {
            if (!Character.isLetter(word.charAt(i))) {
                return false;
            }
        }
        return true;
    }

    private static boolean hasInnerUpperCase(String token) {
        for (int i = 1; i < token.length(); i++) {
            if (Character.isUpperCase(token.charAt(i))) {
                return true;
            }
        }
        return false;
    }
}
