package uk.gegc.questionbot.features.chat.application;

import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;
import uk.gegc.questionbot.features.account.domain.model.Account;
import uk.gegc.questionbot.features.chat.domain.ReplyButton;
import uk.gegc.questionbot.features.linking.domain.LinkReply;

import java.util.List;

/**
 * User-facing texts of the chat surface.
 */
@Component
@RequiredArgsConstructor
public class ChatMessages {

    public static final String CALLBACK_CHECK_PAYMENT = "check_payment";
    public static final String CALLBACK_START_LINK = "start_link";

    private static final String RULE = "━━━━━━━━━━━━━━━━━━━━";

    private final ChatBotProperties properties;

    public String welcome(Account account) {
        return "🎯 UPSC Predictor Bot\n\n"
                + RULE + "\n"
                + "🎁 You have " + account.getTotalCredits() + " credit(s).\n"
                + RULE + "\n\n"
                + "Send any current affairs topic and get 10 UPSC-style questions:\n"
                + "• 5 Prelims MCQs with trap explanations\n"
                + "• 5 Mains questions with answer frameworks\n"
                + "• Cross-subject angles\n"
                + "• A downloadable text file\n\n"
                + "Example: Governor NEET Bill delay\n\n"
                + linkStatus(account) + "\n\n"
                + "Commands: /credits /buy /link /help";
    }

    public String help() {
        return "📖 How to use\n\n"
                + "1. Type a topic, e.g. Governor NEET Bill delay\n"
                + "2. Wait 20-30 seconds\n"
                + "3. Get 10 questions plus a downloadable file\n\n"
                + "Each topic costs 1 credit.\n\n"
                + "/start - welcome and balance\n"
                + "/credits - check your balance\n"
                + "/buy - buy more credits (" + properties.getPricePerCredit() + " each)\n"
                + "/paid - refresh your balance after paying\n"
                + "/link - link your " + properties.getWebUrl() + " account\n"
                + "/cancel - cancel linking";
    }

    public String credits(Account account) {
        int total = account.getTotalCredits();
        return "💳 Your Credits\n\n"
                + "🎁 Free: " + account.getFreeCredits() + "\n"
                + "💰 Paid: " + account.getPaidCredits() + "\n"
                + RULE + "\n"
                + "📊 Total Available: " + total + "\n"
                + "📈 Total Used: " + account.getTotalQueries() + "\n\n"
                + linkStatus(account) + "\n\n"
                + (total > 0 ? "✅ Ready to generate!" : "⚠️ No credits. Use /buy to get more.");
    }

    public String userNotFound() {
        return "❌ User not found. Send /start to register.";
    }

    public String buyLinked(Account account) {
        return "🛒 Buy Credits\n\n"
                + "Price: " + properties.getPricePerCredit() + " per credit\n"
                + "1 credit = 10 UPSC questions\n\n"
                + "✅ Your linked email: " + account.getEmail() + "\n\n"
                + "1. Tap the pay button below\n"
                + "2. Pay with the email " + account.getEmail() + "\n"
                + "3. Come back here and tap \"I've Paid\"";
    }

    public List<ReplyButton> buyLinkedButtons() {
        return List.of(
                ReplyButton.link("💳 Pay " + properties.getPricePerCredit() + " per Credit", properties.getCheckoutUrl()),
                ReplyButton.callback("✅ I've Paid - Check Now", CALLBACK_CHECK_PAYMENT));
    }

    public String buyUnlinked() {
        return "🛒 Buy Credits\n\n"
                + "Price: " + properties.getPricePerCredit() + " per credit\n\n"
                + "⚠️ Account not linked!\n"
                + "Link your account first so purchased credits reach this chat automatically.\n\n"
                + "Or pay anyway and use /paid after paying.";
    }

    public List<ReplyButton> buyUnlinkedButtons() {
        return List.of(
                ReplyButton.callback("🔗 Link Account First", CALLBACK_START_LINK),
                ReplyButton.link("💳 Pay Anyway", properties.getCheckoutUrl()));
    }

    public String paidNotLinked() {
        return "⚠️ Account not linked!\n\n"
                + "To find your payment I need your email.\n"
                + "Use /link to connect your web account, then try /paid again.";
    }

    public String paidBalance(Account account) {
        return "🔍 Balance for " + account.getEmail() + "\n\n"
                + "💳 Total credits: " + account.getTotalCredits() + "\n\n"
                + "If you just paid, credits appear once the payment is confirmed. "
                + "Make sure you paid with this email. Contact " + properties.getSupportContact() + " for help.";
    }

    public String startLinkHint() {
        return "🔗 Link Your Account\n\nSend /link to start linking your web account.";
    }

    public String unknownCommand() {
        return "Unknown command. Send /help to see what I can do.";
    }

    public String emptyMessage() {
        return "Send a current affairs topic to get questions, or /help for commands.";
    }

    public String topicTooShort() {
        return "⚠️ Topic too short. Please provide more detail.\n\nExample: Governor delays NEET Bill controversy";
    }

    public String topicTooLong() {
        return "⚠️ Topic too long. Keep it under " + properties.getMaxTopicLength() + " characters.";
    }

    public String noCredits() {
        return "❌ No credits remaining!\n\nUse /buy to purchase more (" + properties.getPricePerCredit() + " each).";
    }

    public List<ReplyButton> noCreditsButtons() {
        return List.of(ReplyButton.link("💳 Buy Credits", properties.getCheckoutUrl()));
    }

    public String generationFailed(String reason) {
        return "❌ Error generating questions: " + reason + "\n\nPlease try again in a moment.";
    }

    public String creditsRemaining(int remaining) {
        return RULE + "\n💳 Credits remaining: " + remaining
                + (remaining > 0 ? "" : "\nUse /buy to get more.");
    }

    public String unexpectedError() {
        return "❌ Something went wrong. Please try again.";
    }

    public String link(LinkReply reply) {
        return switch (reply.type()) {
            case ALREADY_LINKED -> "✅ Already linked to: " + reply.email()
                    + "\n\nYour credits sync across chat and web!";
            case PROMPT_EMAIL -> "🔗 Link Your Web Account\n\n"
                    + "Enter the email you use on " + properties.getWebUrl() + "\n\n"
                    + "(This syncs your credits across both platforms. Send /cancel to stop.)";
            case INVALID_EMAIL -> "❌ Invalid email. Please try again or /cancel";
            case ACCOUNT_NOT_FOUND -> "❌ No account found for " + reply.email() + "\n\n"
                    + "First sign up at " + properties.getWebUrl() + ", then come back to link.\n\n"
                    + "Or send /cancel to exit.";
            case EMAIL_BOUND_ELSEWHERE -> "❌ This email is already linked to another chat account.\n\n"
                    + "Contact " + properties.getSupportContact() + " for help.";
            case DELIVERY_FAILED -> "❌ Failed to send the code. Try again later or /cancel";
            case CODE_SENT -> "📧 Code sent to " + reply.email() + "\n\n"
                    + "Enter the 6-digit code to verify.\n\n(Check your spam folder if it is not in your inbox.)";
            case INVALID_CODE -> "❌ Invalid code. Enter 6 digits or /cancel";
            case VERIFICATION_FAILED -> "❌ Invalid or expired code. Try /link again.";
            case LINKED -> "✅ Successfully linked!\n\n"
                    + "Email: " + reply.email() + "\n"
                    + "Credits: " + reply.totalCredits() + "\n\n"
                    + "Your credits now sync across chat and " + properties.getWebUrl() + "!";
            case INCONSISTENT_STATE -> "⚠️ We could not link this account automatically.\n\n"
                    + "Contact " + properties.getSupportContact() + " so we can sort it out.";
            case LINK_FAILED -> "❌ Linking failed. Please try /link again later.";
            case CANCELLED -> "❌ Linking cancelled.";
            case NOTHING_TO_CANCEL -> "Nothing to cancel.";
            case NO_ACTIVE_SESSION -> "⌛ Your linking session expired. Start again with /link";
        };
    }

    private String linkStatus(Account account) {
        return account.isLinked()
                ? "🔗 Linked to: " + account.getEmail()
                : "⚠️ Not linked - use /link to connect your web account";
    }
}
