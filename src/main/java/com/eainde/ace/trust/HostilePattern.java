package com.eainde.ace.trust;

import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * One prompt-injection signature.
 *
 * @param id      stable name reported alongside a match
 * @param pattern compiled matcher
 */
public record HostilePattern(String id, Pattern pattern) {

    public static HostilePattern of(String id, String regex) {
        return new HostilePattern(id, Pattern.compile(regex, Pattern.CASE_INSENSITIVE | Pattern.MULTILINE));
    }

    /**
     * @return the matched text, if the pattern occurs in {@code content}
     */
    public Optional<String> find(String content) {
        Matcher matcher = pattern.matcher(content);
        return matcher.find() ? Optional.of(matcher.group()) : Optional.empty();
    }
}
