package FSAConv.Exceptions;

/**
 * Malformed regular expression. Carries the offending token position.
 */
public class RegexSyntaxException extends AutomatonException {

    @java.io.Serial
    private static final long serialVersionUID = 4185520641637236201L;

    private final String pattern;
    private final int position;

    public RegexSyntaxException(String description, String pattern, int position) {
        super(description + " at index " + position + " in \"" + pattern + "\"");
        this.pattern = pattern;
        this.position = position;
    }

    public String getPattern() {
        return pattern;
    }

    public int getPosition() {
        return position;
    }
}
