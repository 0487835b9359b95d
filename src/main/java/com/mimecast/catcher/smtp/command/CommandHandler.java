package com.mimecast.catcher.smtp.command;

import com.mimecast.catcher.config.server.ServerConfig;
import com.mimecast.catcher.smtp.SmtpLimits;
import com.mimecast.catcher.smtp.SmtpResponse;
import com.mimecast.catcher.smtp.SmtpResponses;
import com.mimecast.catcher.smtp.error.SmtpError;
import com.mimecast.catcher.smtp.error.SmtpException;
import com.mimecast.catcher.smtp.session.Session;
import com.mimecast.catcher.smtp.verb.AddressValidator;
import com.mimecast.catcher.smtp.verb.Command;
import com.mimecast.catcher.smtp.verb.PathVerb;
import com.mimecast.catcher.smtp.verb.Verb;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.Locale;
import java.util.Optional;

/**
 * SMTP command handler.
 *
 * <p>Parses a command line, checks it against the session state and applies it.
 * <p>Failures are thrown as {@link SmtpException} before the session is changed,
 * so a rejected command leaves the session as it was.
 * <p>Instances are stateless and may be shared between connections.
 */
public class CommandHandler {
    private static final Logger log = LogManager.getLogger(CommandHandler.class);

    private final String hostname;
    private final boolean ehloEnabled;
    private final List<String> capabilities;

    /**
     * Constructs a new CommandHandler instance with default EHLO capabilities.
     *
     * @param hostname Server hostname.
     */
    public CommandHandler(String hostname) {
        this(hostname, true, ServerConfig.DEFAULT_CAPABILITIES);
    }

    /**
     * Constructs a new CommandHandler instance from server configuration.
     *
     * @param config ServerConfig instance.
     */
    public CommandHandler(ServerConfig config) {
        this(config.getHostname(), config.isEhloEnabled(), config.getCapabilities());
    }

    /**
     * Constructs a new CommandHandler instance.
     *
     * @param hostname     Server hostname.
     * @param ehloEnabled  Accept EHLO.
     * @param capabilities EHLO capability lines.
     */
    public CommandHandler(String hostname, boolean ehloEnabled, List<String> capabilities) {
        this.hostname = hostname;
        this.ehloEnabled = ehloEnabled;
        this.capabilities = List.copyOf(capabilities);
    }

    /**
     * Processes a command line.
     *
     * @param line    Command line without terminator.
     * @param session Session instance.
     * @return SmtpResponse instance.
     * @throws SmtpException Command rejected.
     */
    public SmtpResponse process(String line, Session session) throws SmtpException {
        if (line.getBytes(StandardCharsets.UTF_8).length > SmtpLimits.COMMAND_LINE_MAX_LENGTH) {
            throw new SmtpException(SmtpError.LINE_TOO_LONG, SmtpLimits.COMMAND_LINE_MAX_LENGTH);
        }

        Verb verb = new Verb(line);
        if (verb.isEmpty()) {
            throw new SmtpException(SmtpError.INVALID_COMMAND);
        }

        Optional<Command> command = verb.getCommand();
        if (command.isEmpty() || (command.get() == Command.EHLO && !ehloEnabled)) {
            log.debug("Session {} unrecognized command: {}", session.getUID(), verb.getVerb());
            throw new SmtpException(SmtpError.INVALID_COMMAND);
        }

        switch (command.get()) {
            case HELO:
                return helo(verb, session);
            case EHLO:
                return ehlo(verb, session);
            case MAIL:
                return mail(verb, session);
            case RCPT:
                return rcpt(verb, session);
            case DATA:
                return data(verb, session);
            case RSET:
                return rset(session);
            case NOOP:
                return SmtpResponses.OK_250;
            case QUIT:
                return SmtpResponses.CLOSING_221;
            default:
                throw new SmtpException(SmtpError.INVALID_COMMAND);
        }
    }

    /**
     * HELO processor.
     *
     * @param verb    Verb instance.
     * @param session Session instance.
     * @return SmtpResponse instance.
     * @throws SmtpException Missing or invalid domain.
     */
    private SmtpResponse helo(Verb verb, Session session) throws SmtpException {
        String domain = greetingDomain(verb);
        session.setClientDomain(domain);
        return SmtpResponses.helo(hostname, domain);
    }

    /**
     * EHLO processor.
     * <p>Same as HELO with the capability block appended.
     *
     * @param verb    Verb instance.
     * @param session Session instance.
     * @return SmtpResponse instance.
     * @throws SmtpException Missing or invalid domain.
     */
    private SmtpResponse ehlo(Verb verb, Session session) throws SmtpException {
        String domain = greetingDomain(verb);
        session.setClientDomain(domain);
        return SmtpResponses.ehlo(hostname, domain, capabilities);
    }

    /**
     * Gets the single HELO/EHLO argument.
     *
     * @param verb Verb instance.
     * @return Domain string.
     * @throws SmtpException Argument missing or repeated.
     */
    private String greetingDomain(Verb verb) throws SmtpException {
        String name = verb.getKey().toUpperCase(Locale.ROOT);
        if (verb.getCount() < 2) {
            throw SmtpException.invalidSyntax(name + " requires domain argument");
        }
        if (verb.getCount() > 2) {
            throw SmtpException.invalidSyntax(name + " takes exactly one domain argument");
        }

        return verb.getPart(1);
    }

    /**
     * MAIL processor.
     *
     * @param verb    Verb instance.
     * @param session Session instance.
     * @return SmtpResponse instance.
     * @throws SmtpException Out of sequence or invalid address.
     */
    private SmtpResponse mail(Verb verb, Session session) throws SmtpException {
        if (!session.canExecute(Command.MAIL)) {
            throw SmtpException.invalidState("MAIL command requires HELO first");
        }

        String address = new PathVerb(verb, "FROM").getAddress();
        AddressValidator.validate(address);
        session.setSender(address);

        log.debug("Session {} sender: {}", session.getUID(), address);
        return SmtpResponses.OK_250;
    }

    /**
     * RCPT processor.
     *
     * @param verb    Verb instance.
     * @param session Session instance.
     * @return SmtpResponse instance.
     * @throws SmtpException Out of sequence, invalid address or too many recipients.
     */
    private SmtpResponse rcpt(Verb verb, Session session) throws SmtpException {
        if (!session.canExecute(Command.RCPT)) {
            throw SmtpException.invalidState("RCPT command requires MAIL first");
        }

        String address = new PathVerb(verb, "TO").getAddress();
        AddressValidator.validate(address);
        session.addRecipient(address);

        log.debug("Session {} recipient {}: {}", session.getUID(), session.recipientCount(), address);
        return SmtpResponses.OK_250;
    }

    /**
     * DATA processor.
     * <p>Only switches the session to data mode, lines are handled by {@link DataCollector}.
     *
     * @param verb    Verb instance.
     * @param session Session instance.
     * @return SmtpResponse instance.
     * @throws SmtpException Out of sequence or arguments given.
     */
    private SmtpResponse data(Verb verb, Session session) throws SmtpException {
        if (!session.canExecute(Command.DATA)) {
            throw SmtpException.invalidState("DATA command requires RCPT first");
        }

        if (verb.getCount() > 1) {
            throw SmtpException.invalidSyntax("DATA command takes no arguments");
        }

        session.startDataMode();
        return SmtpResponses.DATA_START_354;
    }

    /**
     * RSET processor.
     *
     * @param session Session instance.
     * @return SmtpResponse instance.
     * @throws SmtpException Before HELO.
     */
    private SmtpResponse rset(Session session) throws SmtpException {
        if (!session.canExecute(Command.RSET)) {
            throw SmtpException.invalidState("RSET command requires HELO first");
        }

        session.reset();
        return SmtpResponses.OK_250;
    }

    public String getHostname() {
        return hostname;
    }
}
