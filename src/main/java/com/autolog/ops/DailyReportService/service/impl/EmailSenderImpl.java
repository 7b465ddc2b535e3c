package com.autolog.ops.DailyReportService.service.impl;

import com.autolog.ops.DailyReportService.exception.TransportException;
import com.autolog.ops.DailyReportService.service.EmailSender;
import jakarta.mail.internet.MimeMessage;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.mail.MailException;
import org.springframework.mail.MailSendException;
import org.springframework.mail.javamail.JavaMailSender;
import org.springframework.stereotype.Service;

@Service
public class EmailSenderImpl implements EmailSender {

    private static final Logger LOGGER = LoggerFactory.getLogger(EmailSenderImpl.class);

    private final JavaMailSender javaMailSender;

    public EmailSenderImpl(JavaMailSender javaMailSender) {
        this.javaMailSender = javaMailSender;
    }

    @Override
    public void send(MimeMessage message) {
        try {
            javaMailSender.send(message);
        } catch (MailSendException mse) {
            LOGGER.error("Error occurred while sending email: {}", mse.getMessage(), mse);
            throw new TransportException(firstFailure(mse), mse);
        } catch (MailException me) {
            LOGGER.error("Error occurred while sending email: {}", me.getMessage(), me);
            throw new TransportException(String.valueOf(me.getMessage()), me);
        }
    }

    private static String firstFailure(MailSendException mse) {
        Exception[] failures = mse.getMessageExceptions();
        if (failures.length > 0 && failures[0].getMessage() != null) {
            return failures[0].getMessage();
        }
        return String.valueOf(mse.getMessage());
    }
}
