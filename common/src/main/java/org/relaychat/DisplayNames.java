package org.relaychat;

public final class DisplayNames {
    public static final int MAX_LENGTH = 32;

    private DisplayNames() {
    }

    /**
     * Trims the requested name and checks it can be shown to other users.
     *
     * @return the trimmed name
     * @throws IllegalArgumentException with a user-readable reason when the name is rejected
     */
    public static String validate(String requested) {
        if (requested == null || requested.isBlank()) {
            throw new IllegalArgumentException("Display name must not be empty");
        }
        String name = requested.trim();
        if (name.length() > MAX_LENGTH) {
            throw new IllegalArgumentException("Display name is longer than " + MAX_LENGTH + " characters");
        }
        for (int i = 0; i < name.length(); i++) {
            if (Character.isISOControl(name.charAt(i))) {
                throw new IllegalArgumentException("Display name contains control characters");
            }
        }
        return name;
    }
}
