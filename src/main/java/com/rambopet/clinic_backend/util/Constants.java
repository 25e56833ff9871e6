package com.rambopet.clinic_backend.util;

public class Constants {

    private Constants() {
        // Utility class, no instantiation
    }

    // Validation Constants
    public static final int MIN_PASSWORD_LENGTH = 8;
    public static final int MAX_NAME_LENGTH = 100;
    public static final String PHONE_REGEX = "^\\+?1?\\d{9,15}$";
    public static final String PHONE_MESSAGE = "Phone number must be in the format '+999999999' with up to 15 digits";

    // Pagination Constants
    public static final int DEFAULT_PAGE_SIZE = 20;
    public static final int MAX_PAGE_SIZE = 100;

    // Inventory Constants
    public static final int DEFAULT_MOVEMENT_HISTORY_LIMIT = 50;
    public static final int DEFAULT_PRODUCT_MOVEMENTS_LIMIT = 100;
    public static final int DEFAULT_EXPIRING_DAYS = 30;

    // Scheduling Constants
    public static final int DEFAULT_UPCOMING_DAYS = 7;

    // File Upload Constants
    public static final long MAX_FILE_SIZE_MB = 10;
    public static final String PROFILE_PHOTO_DIR = "users/profiles";
    public static final String PATIENT_PHOTO_DIR = "patients/photos";
    public static final String EPISODE_ATTACHMENT_DIR = "episodes/attachments";

    // Currency Constants
    public static final String CURRENCY_CODE = "MXN";

    // Success Messages
    public static final String SUCCESS_CREATED = "Created successfully";
    public static final String SUCCESS_UPDATED = "Updated successfully";
    public static final String SUCCESS_DEACTIVATED = "Deactivated successfully";
}
