package FSAConv.Regex;

import java.util.ArrayList;
import java.util.List;

/**
 * Members of the escape classes {@code \d}, {@code \w} and {@code \s}.
 */
public final class CharClasses {
    private static final String SPACE = " \t\n\r\f\u000B";

    private CharClasses() {}

    public static boolean isClassLetter(char c) {
        return c == 'd' || c == 'w' || c == 's';
    }

    public static List<Character> members(char classLetter) {
        final List<Character> members = new ArrayList<>();
        switch (classLetter) {
            case 'd' -> addRange(members, '0', '9');
            case 'w' -> {
                addRange(members, '0', '9');
                addRange(members, 'A', 'Z');
                members.add('_');
                addRange(members, 'a', 'z');
            }
            case 's' -> {
                for (char c : SPACE.toCharArray()) {
                    members.add(c);
                }
            }
            default -> throw new IllegalArgumentException("Not an escape class: \\" + classLetter);
        }
        return members;
    }

    private static void addRange(List<Character> members, char from, char to) {
        for (char c = from; c <= to; c++) {
            members.add(c);
        }
    }
}
