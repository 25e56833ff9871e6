package com.rambopet.clinic_backend.enums;

public enum AttachmentType {
    XRAY,
    ULTRASOUND,
    LAB_RESULT,
    PHOTO,
    DOCUMENT,
    OTHER
}
