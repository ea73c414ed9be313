package org.Aayush.citeproc.eval;

import lombok.experimental.UtilityClass;

/**
 * Given-name initialization shared by name rendering and disambiguation.
 */
@UtilityClass
public class GivenNames {
    public static final String DEFAULT_INITIALIZE_WITH = ". ";

    /**
     * Returns the given name reduced to {@code ". "} initials: "John Paul" and "J.P." both
     * become "J. P.".
     */
    public String initials(String given) {
        return initialize(given, DEFAULT_INITIALIZE_WITH, true, true);
    }

    /**
     * Initializes a given name.
     *
     * @param given given name, nullable.
     * @param initializeWith text appended to each initial.
     * @param initializeWords when false only words that already are initials are normalized.
     * @param keepHyphen whether hyphenated names keep the hyphen between initials.
     * @return initialized given name, trailing whitespace removed.
     */
    public String initialize(String given, String initializeWith, boolean initializeWords, boolean keepHyphen) {
        if (given == null || given.isBlank()) {
            return "";
        }
        StringBuilder out = new StringBuilder();
        for (String word : given.trim().split("\\s+")) {
            if (isInitials(word)) {
                for (char letter : word.toCharArray()) {
                    if (Character.isLetter(letter)) {
                        out.append(Character.toUpperCase(letter)).append(initializeWith);
                    }
                }
            } else if (initializeWords) {
                appendWordInitials(out, word, initializeWith, keepHyphen);
            } else {
                out.append(word).append(' ');
            }
        }
        return out.toString().stripTrailing();
    }

    private void appendWordInitials(StringBuilder out, String word, String initializeWith, boolean keepHyphen) {
        String[] parts = word.split("-");
        boolean first = true;
        for (String part : parts) {
            if (part.isEmpty()) {
                continue;
            }
            if (!first && keepHyphen) {
                trimTrailingSpace(out);
                out.append('-');
            }
            out.append(Character.toUpperCase(part.charAt(0))).append(initializeWith);
            first = false;
        }
    }

    private void trimTrailingSpace(StringBuilder out) {
        while (out.length() > 0 && Character.isWhitespace(out.charAt(out.length() - 1))) {
            out.setLength(out.length() - 1);
        }
    }

    /**
     * "J", "J." and "J.P." are initials; "Jo" is not.
     */
    private boolean isInitials(String word) {
        boolean sawLetter = false;
        for (int i = 0; i < word.length(); i++) {
            char c = word.charAt(i);
            if (Character.isLetter(c)) {
                if (!Character.isUpperCase(c)) {
                    return false;
                }
                if (i + 1 < word.length() && Character.isLetter(word.charAt(i + 1))) {
                    return false;
                }
                sawLetter = true;
            } else if (c != '.') {
                return false;
            }
        }
        return sawLetter;
    }
}
