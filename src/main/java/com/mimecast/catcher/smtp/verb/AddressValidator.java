package com.mimecast.catcher.smtp.verb;

import com.mimecast.catcher.smtp.SmtpLimits;
import com.mimecast.catcher.smtp.error.SmtpError;
import com.mimecast.catcher.smtp.error.SmtpException;
import org.apache.commons.lang3.StringUtils;

import java.nio.charset.StandardCharsets;

/**
 * Email address validator.
 *
 * <p>Checks the address shape and component lengths only.
 */
public final class AddressValidator {

    private AddressValidator() {
        throw new IllegalStateException("Static class");
    }

    /**
     * Validates an address.
     *
     * @param address Address without angle brackets.
     * @throws SmtpException Invalid address.
     */
    public static void validate(String address) throws SmtpException {
        int at = address.indexOf('@');
        if (at < 0) {
            throw SmtpException.invalidSyntax("Email address must contain @ symbol");
        }

        if (StringUtils.countMatches(address, '@') > 1) {
            throw SmtpException.invalidSyntax("Email address must contain exactly one @ symbol");
        }

        String user = address.substring(0, at);
        String domain = address.substring(at + 1);

        if (user.getBytes(StandardCharsets.UTF_8).length > SmtpLimits.USER_MAX_LENGTH) {
            throw new SmtpException(SmtpError.USER_TOO_LONG, SmtpLimits.USER_MAX_LENGTH);
        }

        if (domain.getBytes(StandardCharsets.UTF_8).length > SmtpLimits.DOMAIN_MAX_LENGTH) {
            throw new SmtpException(SmtpError.DOMAIN_TOO_LONG, SmtpLimits.DOMAIN_MAX_LENGTH);
        }

        if (user.isEmpty() || domain.isEmpty()) {
            throw SmtpException.invalidSyntax("Invalid email address format");
        }
    }
}
