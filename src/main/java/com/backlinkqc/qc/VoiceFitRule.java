package com.backlinkqc.qc;

import com.backlinkqc.lexical.ArticleParser;
import com.backlinkqc.lexical.Sentence;
import com.backlinkqc.order.Tone;
import com.backlinkqc.preflight.Perspective;
import com.backlinkqc.preflight.VoicePlan;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Compares formality markers in the draft with the planned tone and
 * perspective.
 */
public class VoiceFitRule implements CategoryRule {

    static final Pattern CONTRACTION = Pattern.compile(
        "(?i)\\b(?:[a-z]+n['’]t|[a-z]+['’](?:re|ve|ll|m|d)|(?:it|that|there|let|what|here|who)['’]s)\\b");

    static final Set<String> FORMAL_CONNECTORS = Set.of(
        "furthermore", "moreover", "consequently", "therefore", "thus", "hence", "nevertheless",
        "notwithstanding", "whereas", "accordingly");

    static final List<String> PROMOTIONAL_PHRASES = List.of(
        "best ever", "amazing", "unbeatable", "act now", "don't miss", "once in a lifetime",
        "limited time", "incredible", "exclusive offer", "sign up today", "100%");

    static final Set<String> FIRST_PERSON = Set.of("i", "me", "my", "mine", "myself", "we", "our", "ours", "us");

    @Override
    public ScoreCategory category() {
        return ScoreCategory.FIT;
    }

    @Override
    public CategoryResult evaluate(ArticleFacts facts) {
        VoicePlan voice = facts.matrix().voice();
        String body = String.join(" ", facts.document().sentences().stream()
            .map(Sentence::text).toList());
        String lower = body.toLowerCase(Locale.ROOT);
        List<String> words = ArticleParser.words(lower);

        int contractions = count(CONTRACTION.matcher(body));
        int exclamations = (int) body.chars().filter(c -> c == '!').count();
        int connectors = (int) words.stream().filter(FORMAL_CONNECTORS::contains).count();
        int secondPerson = (int) words.stream().filter(w -> w.equals("you") || w.equals("your")).count();
        int firstPerson = (int) words.stream().filter(FIRST_PERSON::contains).count();
        int promotional = 0;
        for (String phrase : PROMOTIONAL_PHRASES) {
            promotional += occurrences(lower, phrase);
        }

        List<ValidationIssue> issues = new ArrayList<>();
        int score = 100;
        Tone tone = voice == null ? null : voice.tone();
        if (tone != null && tone.isFormal()) {
            if (contractions > 2) {
                score -= 20;
                issues.add(ValidationIssue.warning(category(), IssueCategory.CONTENT, "TONE_TOO_INFORMAL",
                    contractions + " contractions in a " + tone.getValue() + " article", null));
            }
            if (exclamations > 1) {
                score -= 10;
                issues.add(ValidationIssue.warning(category(), IssueCategory.CONTENT, "EXCESSIVE_EXCLAMATIONS",
                    exclamations + " exclamation marks in a " + tone.getValue() + " article", null));
            }
        } else if (tone == Tone.CONVERSATIONAL) {
            if (connectors > 3 && contractions == 0 && secondPerson == 0) {
                score -= 20;
                issues.add(ValidationIssue.warning(category(), IssueCategory.CONTENT, "TONE_TOO_FORMAL",
                    "Formal connectors without direct address in a conversational article", null));
            }
        } else if (tone == Tone.INFORMATIVE && exclamations > 2) {
            score -= 10;
            issues.add(ValidationIssue.warning(category(), IssueCategory.CONTENT, "EXCESSIVE_EXCLAMATIONS",
                exclamations + " exclamation marks in an informative article", null));
        }
        if (promotional > 3) {
            score -= 20;
            issues.add(ValidationIssue.warning(category(), IssueCategory.CONTENT, "OVERLY_PROMOTIONAL",
                promotional + " promotional phrases found", null));
        }
        if (voice != null && voice.perspective() == Perspective.THIRD_PERSON && firstPerson > 3) {
            score -= 10;
            issues.add(ValidationIssue.info(category(), IssueCategory.CONTENT, "PERSPECTIVE_MISMATCH",
                firstPerson + " first-person pronouns in a third-person article", null));
        }
        return new CategoryResult(score, issues);
    }

    private static int count(Matcher matcher) {
        int n = 0;
        while (matcher.find()) {
            n++;
        }
        return n;
    }

    private static int occurrences(String text, String phrase) {
        int n = 0;
        int from = text.indexOf(phrase);
        while (from >= 0) {
            n++;
            from = text.indexOf(phrase, from + phrase.length());
        }
        return n;
    }
}
