package com.parley.feedmodel;

import java.util.ArrayList;

/**
 * Validates message and group input on the write path, before anything reaches the store.
 *
 * <p>Returns all errors at once in a {@link ValidationResult} rather than failing on the first.
 */
public final class MessageValidator {

    /** Upper bound on message text length, in characters. */
    public static final int MAX_TEXT_LENGTH = 4096;

    /** Upper bound on group name length, in characters. */
    public static final int MAX_GROUP_NAME_LENGTH = 128;

    private MessageValidator() {
        // utility class
    }

    /**
     * Validates the fields a caller supplies when sending a message.
     *
     * @param groupId  target group
     * @param authorId sending user
     * @param text     message body
     * @return a {@link ValidationResult} with any errors found
     */
    public static ValidationResult validateNewMessage(long groupId, long authorId, String text) {
        var errors = new ArrayList<String>();

        if (groupId <= 0) {
            errors.add("groupId must be positive");
        }
        if (authorId <= 0) {
            errors.add("authorId must be positive");
        }
        if (text == null || text.isBlank()) {
            errors.add("text must not be null or blank");
        } else if (text.length() > MAX_TEXT_LENGTH) {
            errors.add("text must be at most " + MAX_TEXT_LENGTH + " characters");
        }

        return errors.isEmpty() ? ValidationResult.ok() : ValidationResult.fail(errors);
    }

    /**
     * Validates the fields a caller supplies when creating a group.
     *
     * @param name      group display name
     * @param creatorId creating user
     * @return a {@link ValidationResult} with any errors found
     */
    public static ValidationResult validateNewGroup(String name, long creatorId) {
        var errors = new ArrayList<String>();

        if (name == null || name.isBlank()) {
            errors.add("name must not be null or blank");
        } else if (name.length() > MAX_GROUP_NAME_LENGTH) {
            errors.add("name must be at most " + MAX_GROUP_NAME_LENGTH + " characters");
        }
        if (creatorId <= 0) {
            errors.add("creatorId must be positive");
        }

        return errors.isEmpty() ? ValidationResult.ok() : ValidationResult.fail(errors);
    }
}
