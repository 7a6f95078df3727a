package uk.gegc.questionbot.features.linking.domain;

public enum LinkReplyType {
    ALREADY_LINKED,
    PROMPT_EMAIL,
    INVALID_EMAIL,
    ACCOUNT_NOT_FOUND,
    EMAIL_BOUND_ELSEWHERE,
    DELIVERY_FAILED,
    CODE_SENT,
    INVALID_CODE,
    VERIFICATION_FAILED,
    LINKED,
    INCONSISTENT_STATE,
    LINK_FAILED,
    CANCELLED,
    NOTHING_TO_CANCEL,
    NO_ACTIVE_SESSION
}
