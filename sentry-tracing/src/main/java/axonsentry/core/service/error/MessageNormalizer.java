package axonsentry.core.service.error;

import java.util.regex.Pattern;

/**
 * Rewrites error messages into stable patterns for grouping.
 *
 * <p>Variable parts are replaced in a fixed order, each pass running on the
 * output of the previous one:
 * <ol>
 *   <li>UUIDs become {@code {uuid}}</li>
 *   <li>Standalone integers and decimals become {@code {number}}</li>
 *   <li>Double-quoted strings become {@code {string}}</li>
 * </ol>
 * The result is cut to {@value #MAX_LENGTH} characters.
 *
 * <p>Example: {@code "Account 123 not found"} becomes {@code "Account {number} not found"}.
 */
public final class MessageNormalizer {

    /** Maximum length of a normalized message. */
    public static final int MAX_LENGTH = 100;

    private static final Pattern UUID_PATTERN =
            Pattern.compile("[0-9a-fA-F]{8}-[0-9a-fA-F]{4}-[0-9a-fA-F]{4}-[0-9a-fA-F]{4}-[0-9a-fA-F]{12}");
    private static final Pattern NUMBER_PATTERN = Pattern.compile("\\b\\d+(\\.\\d+)?\\b");
    private static final Pattern QUOTED_STRING_PATTERN = Pattern.compile("\"[^\"]*\"");

    private MessageNormalizer() {}

    /**
     * Normalize an error message.
     *
     * @param message the message, may be null
     * @return the normalized message; empty for a null or empty message
     */
    public static String normalize(String message) {
        if (message == null || message.isEmpty()) {
            return "";
        }

        var normalized = UUID_PATTERN.matcher(message).replaceAll("{uuid}");
        normalized = NUMBER_PATTERN.matcher(normalized).replaceAll("{number}");
        normalized = QUOTED_STRING_PATTERN.matcher(normalized).replaceAll("{string}");

        if (normalized.length() > MAX_LENGTH) {
            normalized = normalized.substring(0, MAX_LENGTH);
        }
        return normalized;
    }
}
