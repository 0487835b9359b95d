package com.mimecast.catcher.smtp.session;

import com.mimecast.catcher.smtp.Email;
import com.mimecast.catcher.smtp.SmtpLimits;
import com.mimecast.catcher.smtp.error.SmtpError;
import com.mimecast.catcher.smtp.error.SmtpException;
import com.mimecast.catcher.smtp.verb.Command;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.UUID;

/**
 * Session.
 *
 * <p>This is the container for the state of one SMTP connection.
 * <p>It is owned by the connection thread and never shared, hence it is not synchronized.
 * <p>Mutators enforce size limits but rely on the caller to check {@link #canExecute(SessionState, Command)}
 * before changing the transaction.
 */
public class Session {
    private static final Logger log = LogManager.getLogger(Session.class);

    /**
     * UID.
     */
    private final String uid = UUID.randomUUID().toString();

    /**
     * Current state.
     */
    private SessionState state = SessionState.INITIAL;

    /**
     * HELO domain.
     */
    private String clientDomain;

    /**
     * MAIL FROM address.
     */
    private String sender;

    /**
     * RCPT TO addresses.
     */
    private final List<String> recipients = new ArrayList<>();

    /**
     * DATA lines.
     */
    private final List<String> dataLines = new ArrayList<>();

    /**
     * DATA bytes including line terminators.
     */
    private int dataSize = 0;

    /**
     * Is collecting DATA lines.
     */
    private boolean inDataMode = false;

    /**
     * Can the command be executed in given state.
     *
     * @param state   SessionState.
     * @param command Command.
     * @return Boolean.
     */
    public static boolean canExecute(SessionState state, Command command) {
        switch (command) {
            case HELO:
            case EHLO:
            case NOOP:
            case QUIT:
                return true;
            case MAIL:
                return state == SessionState.GREETING_RECEIVED;
            case RCPT:
                return state == SessionState.MAIL_RECEIVED || state == SessionState.RECIPIENTS_RECEIVED;
            case DATA:
                return state == SessionState.RECIPIENTS_RECEIVED;
            case RSET:
                return state != SessionState.INITIAL;
            default:
                return false;
        }
    }

    /**
     * Can the command be executed in the current state.
     *
     * @param command Command.
     * @return Boolean.
     */
    public boolean canExecute(Command command) {
        return canExecute(state, command);
    }

    /**
     * Sets client domain and starts a fresh transaction.
     *
     * @param domain Domain from HELO.
     * @throws SmtpException Domain too long.
     */
    public void setClientDomain(String domain) throws SmtpException {
        if (length(domain) > SmtpLimits.DOMAIN_MAX_LENGTH) {
            throw new SmtpException(SmtpError.DOMAIN_TOO_LONG, SmtpLimits.DOMAIN_MAX_LENGTH);
        }

        clientDomain = domain;
        reset();
    }

    /**
     * Sets envelope sender.
     *
     * @param address Address.
     * @throws SmtpException Path too long.
     */
    public void setSender(String address) throws SmtpException {
        if (length(address) > SmtpLimits.PATH_MAX_LENGTH) {
            throw new SmtpException(SmtpError.PATH_TOO_LONG, SmtpLimits.PATH_MAX_LENGTH);
        }

        sender = address;
        recipients.clear();
        clearData();
        state = SessionState.MAIL_RECEIVED;
    }

    /**
     * Adds envelope recipient.
     *
     * @param address Address.
     * @throws SmtpException Path too long or too many recipients.
     */
    public void addRecipient(String address) throws SmtpException {
        if (length(address) > SmtpLimits.PATH_MAX_LENGTH) {
            throw new SmtpException(SmtpError.PATH_TOO_LONG, SmtpLimits.PATH_MAX_LENGTH);
        }

        if (recipients.size() >= SmtpLimits.MAX_RECIPIENTS) {
            throw new SmtpException(SmtpError.TOO_MANY_RECIPIENTS, SmtpLimits.MAX_RECIPIENTS);
        }

        recipients.add(address);
        state = SessionState.RECIPIENTS_RECEIVED;
    }

    /**
     * Enters data collection.
     *
     * @throws SmtpException Not in RECIPIENTS_RECEIVED state.
     */
    public void startDataMode() throws SmtpException {
        if (state != SessionState.RECIPIENTS_RECEIVED) {
            throw SmtpException.invalidState("DATA command requires RCPT first");
        }

        clearData();
        inDataMode = true;
        state = SessionState.DATA_MODE;
    }

    /**
     * Adds a data line.
     * <p>Each line is accounted with two extra bytes for its CRLF.
     *
     * @param line Line without terminator.
     * @throws SmtpException Line too long or too much data.
     */
    public void addDataLine(String line) throws SmtpException {
        int lineSize = length(line) + SmtpLimits.LINE_TERMINATOR_LENGTH;

        if (lineSize > SmtpLimits.TEXT_LINE_MAX_LENGTH) {
            throw new SmtpException(SmtpError.LINE_TOO_LONG, SmtpLimits.TEXT_LINE_MAX_LENGTH);
        }

        if ((long) dataSize + lineSize > SmtpLimits.MAX_DATA_SIZE) {
            throw new SmtpException(SmtpError.TOO_MUCH_DATA, SmtpLimits.MAX_DATA_SIZE);
        }

        dataLines.add(line);
        dataSize += lineSize;
    }

    /**
     * Completes data collection.
     * <p>The transaction is cleared and the session no longer references the email.
     *
     * @return Email instance.
     * @throws SmtpException Not collecting or incomplete envelope.
     */
    public Email finishDataCollection() throws SmtpException {
        if (!inDataMode) {
            throw SmtpException.invalidState("Not in data collection mode");
        }

        if (sender == null) {
            throw SmtpException.invalidState("No sender specified");
        }

        if (recipients.isEmpty()) {
            throw SmtpException.invalidState("No recipients specified");
        }

        Email email = new Email(sender, recipients, String.join("\n", dataLines));
        log.debug("Session {} completed transaction from {} to {} recipients ({} bytes)",
                uid, sender, recipients.size(), dataSize);

        reset();
        return email;
    }

    /**
     * Resets the transaction.
     * <p>Client domain is kept.
     */
    public void reset() {
        state = SessionState.GREETING_RECEIVED;
        sender = null;
        recipients.clear();
        clearData();
    }

    /**
     * Resets everything including the client domain.
     */
    public void fullReset() {
        reset();
        clientDomain = null;
        state = SessionState.INITIAL;
    }

    /**
     * Clears data lines and counters.
     */
    private void clearData() {
        dataLines.clear();
        dataSize = 0;
        inDataMode = false;
    }

    /**
     * UTF-8 byte length.
     *
     * @param value String.
     * @return Length.
     */
    private static int length(String value) {
        return value.getBytes(StandardCharsets.UTF_8).length;
    }

    /**
     * Gets UID.
     *
     * @return UID string.
     */
    public String getUID() {
        return uid;
    }

    /**
     * Gets state.
     *
     * @return SessionState.
     */
    public SessionState getState() {
        return state;
    }

    /**
     * Gets client domain.
     *
     * @return Domain string or null.
     */
    public String getClientDomain() {
        return clientDomain;
    }

    /**
     * Gets sender.
     *
     * @return Address string or null.
     */
    public String getSender() {
        return sender;
    }

    /**
     * Gets recipients.
     *
     * @return Unmodifiable list view.
     */
    public List<String> getRecipients() {
        return Collections.unmodifiableList(recipients);
    }

    /**
     * Gets data lines.
     *
     * @return Unmodifiable list view.
     */
    public List<String> getDataLines() {
        return Collections.unmodifiableList(dataLines);
    }

    /**
     * Is in data mode.
     *
     * @return Boolean.
     */
    public boolean isInDataMode() {
        return inDataMode;
    }

    public int recipientCount() {
        return recipients.size();
    }

    public int currentDataSize() {
        return dataSize;
    }

    /**
     * Is the envelope ready for DATA.
     *
     * @return Boolean.
     */
    public boolean hasCompleteTransaction() {
        return sender != null && !recipients.isEmpty() && state == SessionState.RECIPIENTS_RECEIVED;
    }
}
