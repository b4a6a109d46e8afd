package io.github.eutro.ncs2nss.api.verify;

/**
 * Asks the user a yes/no question, remembering questions they asked not to be shown again.
 */
public interface ConfirmationDialog {
    /**
     * Ask the user.
     *
     * @param title   The title.
     * @param message The question.
     * @return Whether the user agreed.
     */
    boolean confirm(String title, String message);

    /**
     * Whether the user asked not to be shown the question with this key again.
     *
     * @param key The key.
     * @return Whether the question is suppressed.
     */
    boolean isSuppressed(String key);

    /**
     * Stop showing the question with this key.
     *
     * @param key The key.
     */
    void suppress(String key);
}
