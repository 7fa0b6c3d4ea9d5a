package com.volunteersinc.payment_settlement.notification;

import java.util.UUID;

/**
 * Content categories users can be notified about.
 *
 * Each category carries the user_notification_settings column that opts
 * a user in or out, and the app path its notifications link to.
 */
public enum NotificationCategory {
    CAUSE("cause", "causes_enabled", "/causes/") {
        @Override
        public NotificationDraft draft(UUID relatedId, String title, String body) {
            return new NotificationDraft(this, relatedId, "New Fundraising Cause",
                    title + " - Help make a difference!", link(relatedId));
        }
    },
    EVENT("event", "events_enabled", "/events/") {
        @Override
        public NotificationDraft draft(UUID relatedId, String title, String body) {
            return new NotificationDraft(this, relatedId, "New Event",
                    title + " - Join us!", link(relatedId));
        }
    },
    ANNOUNCEMENT("announcement", "announcements_enabled", "/post/") {
        @Override
        public NotificationDraft draft(UUID relatedId, String title, String body) {
            return new NotificationDraft(this, relatedId, title,
                    body != null ? body : "", link(relatedId));
        }
    };

    private final String code;
    private final String settingColumn;
    private final String linkPrefix;

    NotificationCategory(String code, String settingColumn, String linkPrefix) {
        this.code = code;
        this.settingColumn = settingColumn;
        this.linkPrefix = linkPrefix;
    }

    public String getCode() {
        return code;
    }

    /**
     * Column of user_notification_settings holding the opt-in flag.
     * A fixed identifier, never derived from request input.
     */
    public String getSettingColumn() {
        return settingColumn;
    }

    /**
     * Builds the notification text for newly created content.
     *
     * @param relatedId id of the cause, event or post
     * @param title     title of the created content
     * @param body      announcement body; ignored by the other categories
     */
    public abstract NotificationDraft draft(UUID relatedId, String title, String body);

    String link(UUID relatedId) {
        return linkPrefix + relatedId;
    }

    public static NotificationCategory fromCode(String code) {
        if (code != null) {
            for (NotificationCategory category : values()) {
                if (category.code.equalsIgnoreCase(code.trim())) {
                    return category;
                }
            }
        }
        throw new IllegalArgumentException("Unknown notification category: " + code);
    }
}
