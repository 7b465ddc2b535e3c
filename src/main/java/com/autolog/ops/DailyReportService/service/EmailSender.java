package com.autolog.ops.DailyReportService.service;

import jakarta.mail.internet.MimeMessage;

public interface EmailSender {

    void send(MimeMessage message);
}
