package io.storyforge.core.engine.english;

import io.storyforge.core.spi.Modifier;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Built-in English inflection modifiers and the extended tree modifiers. Each factory returns a
 * fresh map; register it with {@code Grammar.addModifiers()}.
 *
 * <ul>
 *   <li>{@code a}: indefinite article ({@code albatross} → {@code an albatross})
 *   <li>{@code s}: plural ({@code fox} → {@code foxes}, {@code guppy} → {@code guppies})
 *   <li>{@code ed}: past tense ({@code carry} → {@code carried})
 *   <li>{@code capitalize}: upper-case the first character
 *   <li>{@code capitalizeAll}: upper-case the first letter of every word
 *   <li>{@code replace(target,replacement)}: regular-expression substitution; in the replacement
 *       {@code $1}..{@code $n} and {@code $&} insert groups, {@code $$} is a dollar sign and any
 *       other character is literal
 *   <li>{@code pop!!}: unbind the current value of the node's rule name
 * </ul>
 */
public final class EnglishModifiers {

    /** Name of the tree modifier that unwinds one binding. */
    public static final String POP = "pop!!";

    private EnglishModifiers() {}

    /** The inflection modifiers. */
    public static Map<String, Modifier> create() {
        Map<String, Modifier> modifiers = new LinkedHashMap<>();
        modifiers.put("a", Modifier.text(EnglishModifiers::article));
        modifiers.put("s", Modifier.text(EnglishModifiers::plural));
        modifiers.put("ed", Modifier.text(EnglishModifiers::pastTense));
        modifiers.put("capitalize", Modifier.text(EnglishModifiers::capitalize));
        modifiers.put("capitalizeAll", Modifier.text(EnglishModifiers::capitalizeAll));
        modifiers.put("replace", Modifier.text(2, (input, params) -> replace(input, params.get(0), params.get(1))));
        return modifiers;
    }

    /** Tree modifiers that manipulate the symbol table. */
    public static Map<String, Modifier> extended() {
        Map<String, Modifier> modifiers = new LinkedHashMap<>();
        modifiers.put(POP, Modifier.tree(0, (tree, ruleName, params) -> {
            tree.symbols().pop(ruleName);
            return "";
        }));
        return modifiers;
    }

    /**
     * Replaces every match of {@code target} in {@code input}.
     *
     * @throws java.util.regex.PatternSyntaxException if {@code target} is not a valid pattern
     */
    static String replace(String input, String target, String replacement) {
        Matcher matcher = Pattern.compile(target).matcher(input);
        return matcher.replaceAll(javaReplacement(replacement, matcher.groupCount()));
    }

    private static String javaReplacement(String replacement, int groupCount) {
        StringBuilder sb = new StringBuilder(replacement.length() + 8);
        for (int i = 0; i < replacement.length(); i++) {
            char c = replacement.charAt(i);
            char next = i + 1 < replacement.length() ? replacement.charAt(i + 1) : 0;
            if (c == '$' && next == '&') {
                sb.append("$0");
                i++;
            } else if (c == '$' && next == '$') {
                sb.append("\\$");
                i++;
            } else if (c == '$' && next >= '0' && next <= '9' && next - '0' <= groupCount) {
                sb.append(c);
            } else if (c == '$' || c == '\\') {
                sb.append('\\').append(c);
            } else {
                sb.append(c);
            }
        }
        return sb.toString();
    }

    static String article(String input) {
        if (input.isEmpty()) {
            return input;
        }
        // "union", "unicorn": a long u sounds like a consonant
        if (input.length() > 2
                && Character.toLowerCase(input.charAt(0)) == 'u'
                && Character.toLowerCase(input.charAt(2)) == 'i') {
            return "a " + input;
        }
        return (isVowel(input.charAt(0)) ? "an " : "a ") + input;
    }

    static String plural(String input) {
        if (input.isEmpty()) {
            return input;
        }
        switch (last(input)) {
            case 's', 'h', 'x':
                return input + "es";
            case 'y':
                if (input.length() > 1 && !isVowel(input.charAt(input.length() - 2))) {
                    return input.substring(0, input.length() - 1) + "ies";
                }
                return input + "s";
            default:
                return input + "s";
        }
    }

    static String pastTense(String input) {
        if (input.isEmpty()) {
            return input;
        }
        switch (last(input)) {
            case 'e':
                return input + "d";
            case 'y':
                if (input.length() > 1 && !isVowel(input.charAt(input.length() - 2))) {
                    return input.substring(0, input.length() - 1) + "ied";
                }
                return input + "ed";
            default:
                return input + "ed";
        }
    }

    static String capitalize(String input) {
        if (input.isEmpty()) {
            return input;
        }
        return Character.toUpperCase(input.charAt(0)) + input.substring(1);
    }

    static String capitalizeAll(String input) {
        StringBuilder sb = new StringBuilder(input.length());
        boolean capitalizeNext = true;
        for (int i = 0; i < input.length(); i++) {
            char c = input.charAt(i);
            if (Character.isLetterOrDigit(c)) {
                sb.append(capitalizeNext ? Character.toUpperCase(c) : c);
                capitalizeNext = false;
            } else {
                sb.append(c);
                capitalizeNext = true;
            }
        }
        return sb.toString();
    }

    private static char last(String input) {
        return input.charAt(input.length() - 1);
    }

    private static boolean isVowel(char c) {
        return "aeiou".indexOf(Character.toLowerCase(c)) >= 0;
    }
}
