package com.ai.salescaller.service.extraction;

import org.apache.commons.lang3.StringUtils;
import org.springframework.stereotype.Component;

import java.util.Locale;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Pulls an email address out of a transcript. Understands the spoken form
 * ("john dot smith at gmail dot com") that speech recognizers often return.
 */
@Component
public class EmailExtractor {

    private static final Pattern EMAIL = Pattern.compile(
            "\\b[A-Za-z0-9._%+-]+@[A-Za-z0-9.-]+\\.[A-Za-z]{2,}\\b");

    private static final Pattern SPOKEN_AT = Pattern.compile("\\s+(at)\\s+", Pattern.CASE_INSENSITIVE);
    private static final Pattern SPOKEN_DOT = Pattern.compile("\\s+(dot|period)\\s+", Pattern.CASE_INSENSITIVE);
    private static final Pattern SPOKEN_SYMBOLS = Pattern.compile(
            "\\s+(underscore|dash|hyphen)\\s+", Pattern.CASE_INSENSITIVE);

    private static final int MAX_LENGTH = 254;

    public Optional<String> extract(String transcript) {
        if (StringUtils.isBlank(transcript)) {
            return Optional.empty();
        }
        Optional<String> direct = find(transcript);
        if (direct.isPresent()) {
            return direct;
        }
        return find(normalizeSpoken(transcript));
    }

    String normalizeSpoken(String transcript) {
        String s = " " + transcript.trim() + " ";
        Matcher symbols = SPOKEN_SYMBOLS.matcher(s);
        StringBuilder sb = new StringBuilder();
        while (symbols.find()) {
            String word = symbols.group(1).toLowerCase(Locale.ROOT);
            symbols.appendReplacement(sb, "underscore".equals(word) ? "_" : "-");
        }
        symbols.appendTail(sb);
        s = SPOKEN_DOT.matcher(sb.toString()).replaceAll(".");
        // only the last " at " is the separator: "i'm at home, it's bob at mail dot com"
        Matcher at = SPOKEN_AT.matcher(s);
        int lastStart = -1;
        int lastEnd = -1;
        while (at.find()) {
            lastStart = at.start();
            lastEnd = at.end();
        }
        if (lastStart >= 0) {
            String local = s.substring(0, lastStart);
            String domain = s.substring(lastEnd);
            // spelled-out local parts arrive as "j o h n"
            String[] localWords = local.trim().split("\\s+");
            String localPart = trailingSpelledRun(localWords);
            String domainPart = domain.trim().split("\\s+")[0];
            s = localPart + "@" + domainPart;
        }
        return s.trim();
    }

    private Optional<String> find(String text) {
        Matcher m = EMAIL.matcher(text);
        if (!m.find()) {
            return Optional.empty();
        }
        String email = m.group().toLowerCase(Locale.ROOT);
        if (email.length() > MAX_LENGTH || email.contains("..") || email.startsWith(".")) {
            return Optional.empty();
        }
        return Optional.of(email);
    }

    /** Joins a trailing run of single characters ("j o h n"), else returns the last word. */
    private static String trailingSpelledRun(String[] words) {
        int start = words.length;
        while (start > 0 && words[start - 1].length() == 1) {
            start--;
        }
        if (words.length - start > 1) {
            StringBuilder sb = new StringBuilder();
            for (int i = start; i < words.length; i++) {
                sb.append(words[i]);
            }
            return sb.toString();
        }
        return words[words.length - 1];
    }
}
