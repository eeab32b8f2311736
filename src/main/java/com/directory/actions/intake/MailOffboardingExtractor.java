package com.directory.actions.intake;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.LocalDate;
import java.util.Locale;
import java.util.Optional;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Pulls an offboarding notice out of an HR mail's subject and body.
 *
 * <p>Only mails mentioning a termination are considered. An explicit {@code sam: <handle>}
 * marker wins; otherwise the first capitalised Cyrillic "Surname Name" pair that is not a
 * greeting or keyword is taken as the person to resolve.</p>
 */
public class MailOffboardingExtractor {
    private static final Logger log = LoggerFactory.getLogger(MailOffboardingExtractor.class);

    private static final int FLAGS = Pattern.CASE_INSENSITIVE | Pattern.UNICODE_CASE | Pattern.UNICODE_CHARACTER_CLASS;

    private static final Pattern TERMINATION = Pattern.compile(
            "увольнени\\w*|уволен\\w*|увольня\\w*|offboarding|terminat\\w*|last\\s+working\\s+day"
                    + "|последний\\s+рабочий\\s+день", FLAGS);
    private static final Pattern SAM_MARKER = Pattern.compile(
            "\\bsam(?:accountname)?\\s*[:=]\\s*([A-Za-z0-9._-]+)", Pattern.CASE_INSENSITIVE);
    private static final Pattern NAME_PAIR = Pattern.compile(
            "(?<![\\p{L}])([А-ЯЁ][а-яё]+(?:-[А-ЯЁ][а-яё]+)?)\\s+([А-ЯЁ][а-яё]+)(?![\\p{L}])");

    private static final Set<String> NOT_NAMES = Set.of(
            "увольнение", "уволен", "уволена", "уважаемые", "уважаемый", "уважаемая", "коллеги",
            "прошу", "сотрудник", "сотрудница", "последний", "отдел", "добрый", "здравствуйте",
            "информируем", "сообщаем", "дата", "приказ", "тема");

    private final DateExtractor dateExtractor;

    public MailOffboardingExtractor(DateExtractor dateExtractor) {
        this.dateExtractor = dateExtractor;
    }

    public Optional<MailExtractedOffboarding> extract(String subject, String body, String messageId) {
        String text = (subject != null ? subject : "") + "\n" + (body != null ? body : "");
        if (!TERMINATION.matcher(text).find()) {
            log.debug("mail.ignored messageId={} reason=no termination keyword", messageId);
            return Optional.empty();
        }
        Optional<String> person = explicitHandle(text).or(() -> namePair(text));
        if (person.isEmpty()) {
            log.info("mail.unparsed messageId={} reason=no handle or name found", messageId);
            return Optional.empty();
        }
        LocalDate date = dateExtractor.find(text).map(DateExtractor.Match::date).orElse(null);
        log.info("mail.extracted messageId={} person='{}' date={}", messageId, person.get(), date);
        return Optional.of(new MailExtractedOffboarding(person.get(), date, messageId));
    }

    private static Optional<String> explicitHandle(String text) {
        Matcher m = SAM_MARKER.matcher(text);
        return m.find() ? Optional.of(m.group(1)) : Optional.empty();
    }

    private static Optional<String> namePair(String text) {
        Matcher m = NAME_PAIR.matcher(text);
        int from = 0;
        while (from < text.length() && m.find(from)) {
            if (isName(m.group(1)) && isName(m.group(2))) {
                return Optional.of(m.group(1) + " " + m.group(2));
            }
            from = m.start(2);
        }
        return Optional.empty();
    }

    private static boolean isName(String word) {
        return !NOT_NAMES.contains(word.toLowerCase(Locale.ROOT));
    }
}
