package uk.gegc.questionbot.features.otp.application;

public interface OtpService {

    /**
     * Stores a fresh 6-digit passcode for the email and returns it in plain text. Earlier outstanding
     * passcodes for the same email stay valid until they expire.
     */
    String issue(String email);

    /**
     * Issues a passcode and emails it.
     *
     * @throws uk.gegc.questionbot.features.otp.domain.exception.PasscodeDeliveryException if either step fails
     */
    void issueAndSend(String email);

    /**
     * Consumes a matching, unused, unexpired passcode. At most one concurrent caller succeeds per passcode.
     */
    boolean verify(String email, String code);

    /**
     * Deletes records that expired longer ago than the retention window.
     *
     * @return number of deleted records
     */
    int purgeExpired();
}
