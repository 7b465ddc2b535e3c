package com.autolog.ops.DailyReportService.dto.requestDto;

import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
public class MailDto {
    private String from;
    private String[] to;
    private String[] cc;
    private String[] bcc;
    private String subject;
}
