package io.mailagenda.internal.mail;

import io.mailagenda.MailTransport;
import io.mailagenda.core.DeliveryResult;
import io.mailagenda.core.MailMessage;
import jakarta.mail.MessagingException;
import jakarta.mail.SendFailedException;
import jakarta.mail.internet.MimeMessage;
import org.eclipse.angus.mail.smtp.SMTPAddressFailedException;
import org.eclipse.angus.mail.smtp.SMTPSendFailedException;
import org.eclipse.angus.mail.smtp.SMTPSenderFailedException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.core.io.FileSystemResource;
import org.springframework.mail.MailAuthenticationException;
import org.springframework.mail.MailException;
import org.springframework.mail.MailParseException;
import org.springframework.mail.MailPreparationException;
import org.springframework.mail.MailSendException;
import org.springframework.mail.javamail.JavaMailSender;
import org.springframework.mail.javamail.MimeMessageHelper;

import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.util.ArrayDeque;
import java.util.Collections;
import java.util.Deque;
import java.util.IdentityHashMap;
import java.util.Objects;
import java.util.Set;

/**
 * {@link MailTransport} backed by Spring's {@link JavaMailSender}.
 *
 * <p>SMTP replies are classified by code: 4xx is transient, 5xx is permanent. Authentication
 * failures and messages that cannot be built (bad address, unreadable attachment) are permanent.
 * A send failure without any SMTP reply (connection refused, dropped connection) is transient.
 */
public class JavaMailTransport implements MailTransport {

    private static final Logger log = LoggerFactory.getLogger(JavaMailTransport.class);

    private final JavaMailSender mailSender;
    private final String from;

    public JavaMailTransport(JavaMailSender mailSender, String from) {
        this.mailSender = Objects.requireNonNull(mailSender, "mailSender must not be null");
        this.from = from;
    }

    @Override
    public DeliveryResult deliver(MailMessage message, String recipient) {
        Objects.requireNonNull(message, "message must not be null");
        Objects.requireNonNull(recipient, "recipient must not be null");

        MimeMessage mime;
        try {
            mime = build(message, recipient);
        } catch (MessagingException | MailException e) {
            return DeliveryResult.permanentError("Message could not be built: " + e.getMessage());
        }

        try {
            mailSender.send(mime);
        } catch (MailAuthenticationException e) {
            return DeliveryResult.permanentError("SMTP authentication failed: " + e.getMessage());
        } catch (MailPreparationException | MailParseException e) {
            return DeliveryResult.permanentError("Message could not be prepared: " + e.getMessage());
        } catch (MailSendException e) {
            return classify(e);
        } catch (MailException e) {
            return DeliveryResult.transientError("Mail server error: " + e.getMessage());
        }

        return DeliveryResult.ok(messageId(mime, message.jobId()));
    }

    private MimeMessage build(MailMessage message, String recipient) throws MessagingException {
        MimeMessage mime = mailSender.createMimeMessage();
        boolean multipart = !message.attachments().isEmpty();
        MimeMessageHelper helper = new MimeMessageHelper(mime, multipart, StandardCharsets.UTF_8.name());

        if (from != null && !from.isBlank()) {
            helper.setFrom(from);
        }
        helper.setTo(recipient);
        if (!message.cc().isEmpty()) {
            helper.setCc(message.cc().toArray(String[]::new));
        }
        if (!message.bcc().isEmpty()) {
            helper.setBcc(message.bcc().toArray(String[]::new));
        }
        helper.setSubject(message.subject());
        helper.setText(message.body(), message.html());

        for (Path attachment : message.attachments()) {
            helper.addAttachment(attachment.getFileName().toString(), new FileSystemResource(attachment));
        }
        return mime;
    }

    static DeliveryResult classify(MailSendException e) {
        Integer code = null;
        boolean addressRejected = false;

        Deque<Throwable> pending = new ArrayDeque<>();
        pending.add(e);
        e.getFailedMessages().values().forEach(pending::add);
        Set<Throwable> seen = Collections.newSetFromMap(new IdentityHashMap<>());

        while (!pending.isEmpty() && code == null) {
            Throwable t = pending.poll();
            if (t == null || !seen.add(t)) {
                continue;
            }
            code = returnCode(t);
            if (t instanceof SendFailedException sfe
                    && sfe.getInvalidAddresses() != null
                    && sfe.getInvalidAddresses().length > 0) {
                addressRejected = true;
            }
            if (t instanceof MessagingException me && me.getNextException() != null) {
                pending.add(me.getNextException());
            }
            if (t.getCause() != null) {
                pending.add(t.getCause());
            }
        }

        String detail = e.getMessage();
        if (code != null && code >= 500) {
            return DeliveryResult.permanentError("SMTP " + code + ": " + detail);
        }
        if (code != null && code >= 400) {
            return DeliveryResult.transientError("SMTP " + code + ": " + detail);
        }
        if (addressRejected) {
            return DeliveryResult.permanentError("Recipient refused: " + detail);
        }
        return DeliveryResult.transientError("Mail server unavailable: " + detail);
    }

    private static Integer returnCode(Throwable t) {
        if (t instanceof SMTPAddressFailedException a) {
            return a.getReturnCode();
        }
        if (t instanceof SMTPSenderFailedException s) {
            return s.getReturnCode();
        }
        if (t instanceof SMTPSendFailedException s) {
            return s.getReturnCode();
        }
        return null;
    }

    private static String messageId(MimeMessage mime, String jobId) {
        try {
            return mime.getMessageID();
        } catch (MessagingException e) {
            log.debug("JavaMailTransport could not read Message-ID: id={}, err={}", jobId, e.toString());
            return null;
        }
    }
}
