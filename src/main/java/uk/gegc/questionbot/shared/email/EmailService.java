package uk.gegc.questionbot.shared.email;

public interface EmailService {

    /**
     * Sends the account-link passcode to the given address.
     *
     * @return {@code true} when the provider accepted the message, {@code false} otherwise
     */
    boolean sendLinkPasscodeEmail(String email, String passcode);
}
