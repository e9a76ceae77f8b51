package co.fanki.scriptintrospect.documentation;

import co.fanki.scriptintrospect.shared.Preconditions;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

/**
 * Fits a description into a maximum length.
 *
 * <p>A description that is too long is cut at the last complete word
 * that fits and marked with {@code ...}. A single overlong word is cut
 * mid-word so that the result, marker included, is exactly the maximum
 * length.</p>
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public class DescriptionTruncator {

    private static final String ELLIPSIS = "...";

    /**
     * Truncates a description.
     *
     * @param description the description, may be null
     * @param maxLength the maximum length, greater than the marker
     * @return the stripped description, truncated if needed, or null
     */
    public String truncate(final String description, final int maxLength) {
        Preconditions.require(maxLength > ELLIPSIS.length(),
                "Max length must be greater than " + ELLIPSIS.length());
        if (description == null) {
            return null;
        }
        final String stripped = description.strip();
        if (stripped.length() <= maxLength) {
            return stripped;
        }

        final String head = stripped.substring(0, maxLength).strip();
        final List<String> words = head.isEmpty() ? new ArrayList<>()
                : new ArrayList<>(Arrays.asList(head.split("\\s+")));
        if (words.size() > 1) {
            // The last word may have been cut.
            words.remove(words.size() - 1);
            return String.join(" ", words) + ELLIPSIS;
        }
        return stripped.substring(0, maxLength - ELLIPSIS.length()) + ELLIPSIS;
    }

}
