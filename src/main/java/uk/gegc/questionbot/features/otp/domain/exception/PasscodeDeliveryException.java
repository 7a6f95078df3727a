package uk.gegc.questionbot.features.otp.domain.exception;

/**
 * The passcode could not be stored or handed to the email provider.
 */
public class PasscodeDeliveryException extends RuntimeException {

    public PasscodeDeliveryException(String message) {
        super(message);
    }

    public PasscodeDeliveryException(String message, Throwable cause) {
        super(message, cause);
    }
}
