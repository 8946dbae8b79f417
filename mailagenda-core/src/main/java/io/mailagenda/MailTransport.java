package io.mailagenda;

import io.mailagenda.core.DeliveryResult;
import io.mailagenda.core.MailMessage;

/**
 * Delivers one rendered message to one recipient, once.
 *
 * <p>Implementations either return a {@link DeliveryResult} or throw
 * {@link io.mailagenda.core.TransientDeliveryException} /
 * {@link io.mailagenda.core.PermanentDeliveryException}. Any other exception counts as permanent.
 */
public interface MailTransport {

    DeliveryResult deliver(MailMessage message, String recipient);
}
