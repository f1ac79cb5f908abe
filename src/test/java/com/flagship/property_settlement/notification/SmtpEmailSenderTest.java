package com.flagship.property_settlement.notification;

import jakarta.mail.Message;
import jakarta.mail.Session;
import jakarta.mail.internet.MimeMessage;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.mail.MailSendException;
import org.springframework.mail.javamail.JavaMailSender;

import java.util.Properties;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class SmtpEmailSenderTest {

    @Mock
    private JavaMailSender mailSender;

    private SmtpEmailSender emailSender;

    @BeforeEach
    void setUp() {
        emailSender = new SmtpEmailSender(mailSender, "no-reply@settlements.test");
    }

    @Test
    @DisplayName("Message is built with sender, recipient, subject and body and handed to the mail sender")
    void testSend() throws Exception {
        when(mailSender.createMimeMessage()).thenReturn(new MimeMessage(Session.getInstance(new Properties())));

        emailSender.send("owner@home.test", "Property Status Updated: Harbour View",
                "Your property status has been updated from Unconditional to Settled");

        ArgumentCaptor<MimeMessage> captor = ArgumentCaptor.forClass(MimeMessage.class);
        verify(mailSender).send(captor.capture());
        MimeMessage sent = captor.getValue();
        assertEquals("no-reply@settlements.test", sent.getFrom()[0].toString());
        assertEquals("owner@home.test", sent.getRecipients(Message.RecipientType.TO)[0].toString());
        assertEquals("Property Status Updated: Harbour View", sent.getSubject());
        assertEquals("Your property status has been updated from Unconditional to Settled", sent.getContent());
    }

    @Test
    @DisplayName("Transport failure propagates so the delivery is recorded as failed")
    void testSend_TransportFails() {
        when(mailSender.createMimeMessage()).thenReturn(new MimeMessage(Session.getInstance(new Properties())));
        doThrow(new MailSendException("Connection refused")).when(mailSender).send(any(MimeMessage.class));

        assertThrows(MailSendException.class,
                () -> emailSender.send("owner@home.test", "Subject", "Body"));
    }

    @Test
    @DisplayName("Blank recipient is rejected before anything is sent")
    void testSend_BlankRecipient() {
        assertThrows(IllegalArgumentException.class, () -> emailSender.send(" ", "Subject", "Body"));
        verify(mailSender, never()).send(any(MimeMessage.class));
    }
}
