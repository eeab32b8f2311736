package com.directory.actions.intake;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.LocalDate;
import java.util.List;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Keyword-driven classifier for Russian and English operator messages.
 *
 * <p>The first matching intent phrase decides the intent. The phrase, any recognised date and a
 * few filler words are then cut from the text; what remains is the person query, in its
 * original spelling.</p>
 */
public class RuleBasedIntentClassifier implements IntentClassifier {
    private static final Logger log = LoggerFactory.getLogger(RuleBasedIntentClassifier.class);

    private static final int FLAGS = Pattern.CASE_INSENSITIVE | Pattern.UNICODE_CASE | Pattern.UNICODE_CHARACTER_CLASS;

    private static final Pattern LIST_JOBS = Pattern.compile(
            "^\\s*(?:list\\s+jobs|jobs|задачи|список\\s+задач)\\s*$", FLAGS);

    private static final List<Pattern> RESET = List.of(
            Pattern.compile("\\b(?:смени(?:ть)?|сбрось|сбросить|сброс|поменяй|поменять|reset|change)\\s+(?:пароль|password)\\b", FLAGS),
            Pattern.compile("^\\s*reset\\b", FLAGS));

    private static final List<Pattern> DISABLE = List.of(
            Pattern.compile("\\bschedule\\s+block\\b", FLAGS),
            Pattern.compile("\\bdisable(?:\\s+account)?\\b", FLAGS),
            Pattern.compile("\\bblock\\b", FLAGS),
            Pattern.compile("\\b(?:за)?блокир\\w*(?:\\s+уч[её]тную\\s+запись)?", FLAGS),
            Pattern.compile("\\bотключ\\w*", FLAGS),
            Pattern.compile("\\bдеактивир\\w*", FLAGS),
            Pattern.compile("\\bувольня\\w*", FLAGS),
            Pattern.compile("\\bуволен[аоы]?\\b", FLAGS));

    private static final Pattern FILLER = Pattern.compile(
            "\\b(?:для|у|с|со|пользовател[яюь]|сотрудник[аиу]?|аккаунт|пожалуйста|for|user|account|please|of|on)\\b", FLAGS);
    private static final Pattern PUNCTUATION = Pattern.compile("[,:;!?\"«»]");
    private static final Pattern EDGES = Pattern.compile("^[\\s.\\-]+|[\\s.\\-]+$");
    private static final Pattern SPACES = Pattern.compile("\\s+");

    private final DateExtractor dateExtractor;

    public RuleBasedIntentClassifier(DateExtractor dateExtractor) {
        this.dateExtractor = dateExtractor;
    }

    @Override
    public ClassifiedText classify(String text) {
        if (text == null || text.isBlank()) {
            return ClassifiedText.none();
        }
        if (LIST_JOBS.matcher(text).matches()) {
            return new ClassifiedText(Intent.LIST_JOBS, null, null);
        }

        Intent intent = Intent.NONE;
        String rest = text;
        Optional<String> phrase = firstMatch(RESET, text);
        if (phrase.isPresent()) {
            intent = Intent.RESET_PASSWORD;
        } else {
            phrase = firstMatch(DISABLE, text);
            if (phrase.isPresent()) {
                intent = Intent.DISABLE_ACCOUNT;
            }
        }
        if (intent == Intent.NONE) {
            log.debug("intent.none text='{}'", text);
            return ClassifiedText.none();
        }
        rest = rest.replace(phrase.get(), " ");

        LocalDate date = null;
        Optional<DateExtractor.Match> dateMatch = dateExtractor.find(rest);
        if (dateMatch.isPresent()) {
            date = dateMatch.get().date();
            rest = rest.replace(dateMatch.get().matchedText(), " ");
        }

        String query = cleanQuery(rest);
        log.debug("intent.classified intent={} query='{}' date={}", intent, query, date);
        return new ClassifiedText(intent, query, date);
    }

    private static Optional<String> firstMatch(List<Pattern> patterns, String text) {
        for (Pattern pattern : patterns) {
            Matcher m = pattern.matcher(text);
            if (m.find()) {
                return Optional.of(m.group());
            }
        }
        return Optional.empty();
    }

    static String cleanQuery(String rest) {
        String cleaned = PUNCTUATION.matcher(rest).replaceAll(" ");
        cleaned = FILLER.matcher(cleaned).replaceAll(" ");
        cleaned = SPACES.matcher(cleaned).replaceAll(" ");
        return EDGES.matcher(cleaned).replaceAll("");
    }
}
