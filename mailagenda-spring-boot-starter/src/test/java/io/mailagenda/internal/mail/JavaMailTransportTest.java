package io.mailagenda.internal.mail;

import io.mailagenda.core.DeliveryResult;
import io.mailagenda.core.MailMessage;
import jakarta.mail.Message;
import jakarta.mail.MessagingException;
import jakarta.mail.Session;
import jakarta.mail.internet.InternetAddress;
import jakarta.mail.internet.MimeMessage;
import jakarta.mail.internet.MimeMultipart;
import org.eclipse.angus.mail.smtp.SMTPAddressFailedException;
import org.eclipse.angus.mail.smtp.SMTPSendFailedException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.mockito.ArgumentCaptor;
import org.springframework.mail.MailAuthenticationException;
import org.springframework.mail.MailSendException;
import org.springframework.mail.javamail.JavaMailSender;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;
import java.util.Properties;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.doAnswer;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class JavaMailTransportTest {

    private JavaMailSender mailSender;
    private JavaMailTransport transport;

    @BeforeEach
    void setUp() {
        mailSender = mock(JavaMailSender.class);
        when(mailSender.createMimeMessage()).thenAnswer(inv -> new MimeMessage(Session.getInstance(new Properties())));
        transport = new JavaMailTransport(mailSender, "news@example.com");
    }

    @Test
    void deliversRenderedMessageAndReturnsMessageId() throws Exception {
        doAnswer(inv -> {
            MimeMessage sent = inv.getArgument(0);
            sent.setHeader("Message-ID", "<abc@example.com>");
            return null;
        }).when(mailSender).send(any(MimeMessage.class));

        MailMessage message = new MailMessage("job-1", List.of("cc@example.com"), List.of("bcc@example.com"),
                "Hello Sarah", "<p>Hi</p>", true, List.of());

        DeliveryResult result = transport.deliver(message, "sarah@example.com");

        assertThat(result.isOk()).isTrue();
        assertThat(result.messageId()).isEqualTo("<abc@example.com>");

        ArgumentCaptor<MimeMessage> captor = ArgumentCaptor.forClass(MimeMessage.class);
        verify(mailSender).send(captor.capture());
        MimeMessage sent = captor.getValue();
        assertThat(sent.getSubject()).isEqualTo("Hello Sarah");
        assertThat(sent.getFrom()).containsExactly(new InternetAddress("news@example.com"));
        assertThat(sent.getRecipients(Message.RecipientType.TO)).containsExactly(new InternetAddress("sarah@example.com"));
        assertThat(sent.getRecipients(Message.RecipientType.CC)).containsExactly(new InternetAddress("cc@example.com"));
        assertThat(sent.getRecipients(Message.RecipientType.BCC)).containsExactly(new InternetAddress("bcc@example.com"));
    }

    @Test
    void attachmentsMakeAMultipartMessage(@TempDir Path dir) throws Exception {
        Path report = Files.writeString(dir.resolve("report.txt"), "numbers");
        MailMessage message = new MailMessage("job-2", null, null, "Report", "see attached", false, List.of(report));

        DeliveryResult result = transport.deliver(message, "sarah@example.com");

        assertThat(result.isOk()).isTrue();
        ArgumentCaptor<MimeMessage> captor = ArgumentCaptor.forClass(MimeMessage.class);
        verify(mailSender).send(captor.capture());
        assertThat(captor.getValue().getContent()).isInstanceOf(MimeMultipart.class);
    }

    @Test
    void smtp4xxIsTransient() throws Exception {
        SMTPSendFailedException smtp = new SMTPSendFailedException(
                "DATA", 451, "451 4.7.1 Try again later", null, null, null, null);
        doThrow(new MailSendException("send failed", smtp)).when(mailSender).send(any(MimeMessage.class));

        DeliveryResult result = transport.deliver(plain(), "sarah@example.com");

        assertThat(result.status()).isEqualTo(DeliveryResult.Status.TRANSIENT_ERROR);
        assertThat(result.error()).startsWith("SMTP 451");
    }

    @Test
    void smtp5xxIsPermanent() throws Exception {
        SMTPAddressFailedException rejected = new SMTPAddressFailedException(
                new InternetAddress("nobody@example.com"), "RCPT TO", 550, "550 5.1.1 User unknown");
        MessagingException wrapper = new MessagingException("Invalid Addresses", rejected);
        Map<Object, Exception> failed = Map.of("msg", wrapper);
        doThrow(new MailSendException(failed)).when(mailSender).send(any(MimeMessage.class));

        DeliveryResult result = transport.deliver(plain(), "nobody@example.com");

        assertThat(result.status()).isEqualTo(DeliveryResult.Status.PERMANENT_ERROR);
        assertThat(result.error()).startsWith("SMTP 550");
    }

    @Test
    void connectionFailureWithoutReplyIsTransient() {
        doThrow(new MailSendException("Mail server connection failed", new MessagingException("Couldn't connect to host")))
                .when(mailSender).send(any(MimeMessage.class));

        DeliveryResult result = transport.deliver(plain(), "sarah@example.com");

        assertThat(result.status()).isEqualTo(DeliveryResult.Status.TRANSIENT_ERROR);
    }

    @Test
    void authenticationFailureIsPermanent() {
        doThrow(new MailAuthenticationException("535 Authentication failed"))
                .when(mailSender).send(any(MimeMessage.class));

        DeliveryResult result = transport.deliver(plain(), "sarah@example.com");

        assertThat(result.status()).isEqualTo(DeliveryResult.Status.PERMANENT_ERROR);
        assertThat(result.error()).contains("authentication");
    }

    @Test
    void malformedAddressIsPermanentAndNothingIsSent() {
        DeliveryResult result = transport.deliver(plain(), "Sarah <sarah@example.com");

        assertThat(result.status()).isEqualTo(DeliveryResult.Status.PERMANENT_ERROR);
        verify(mailSender, never()).send(any(MimeMessage.class));
    }

    private static MailMessage plain() {
        return new MailMessage("job-x", null, null, "Subject", "Body", false, null);
    }
}
