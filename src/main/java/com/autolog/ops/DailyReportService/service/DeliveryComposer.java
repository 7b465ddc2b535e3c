package com.autolog.ops.DailyReportService.service;

import com.autolog.ops.DailyReportService.dto.report.CsvAttachment;
import com.autolog.ops.DailyReportService.dto.report.InlineAsset;
import com.autolog.ops.DailyReportService.dto.report.RenderedReport;
import com.autolog.ops.DailyReportService.dto.requestDto.MailDto;
import com.autolog.ops.DailyReportService.exception.ComposeException;
import jakarta.activation.DataSource;
import jakarta.mail.MessagingException;
import jakarta.mail.internet.MimeMessage;
import jakarta.mail.util.ByteArrayDataSource;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.core.io.ByteArrayResource;
import org.springframework.mail.javamail.JavaMailSender;
import org.springframework.mail.javamail.MimeMessageHelper;
import org.springframework.stereotype.Component;

import java.nio.charset.StandardCharsets;
import java.util.*;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Assembles a rendered report and its CSV attachments into one MIME message. Does no network I/O.
 */
@Component
public class DeliveryComposer {

    private static final Logger LOGGER = LoggerFactory.getLogger(DeliveryComposer.class);

    // src attributes only; escaped report text never matches
    private static final Pattern CID_REFERENCE = Pattern.compile("(?i)\\bsrc\\s*=\\s*[\"']cid:([^\"']+)[\"']");

    private final JavaMailSender javaMailSender;

    public DeliveryComposer(JavaMailSender javaMailSender) {
        this.javaMailSender = javaMailSender;
    }

    public MimeMessage compose(MailDto mailDto, RenderedReport rendered, List<CsvAttachment> attachments) {
        if (mailDto.getTo() == null || mailDto.getTo().length == 0) {
            throw new ComposeException("To address array must not be null or empty");
        }
        Map<String, InlineAsset> assets = rendered.getAssets() == null ? Collections.emptyMap() : rendered.getAssets();
        checkContentIds(rendered.getHtml(), assets);

        try {
            MimeMessage message = javaMailSender.createMimeMessage();
            int mode = assets.isEmpty() ? MimeMessageHelper.MULTIPART_MODE_MIXED : MimeMessageHelper.MULTIPART_MODE_MIXED_RELATED;
            MimeMessageHelper helper = new MimeMessageHelper(message, mode, StandardCharsets.UTF_8.name());
            helper.setTo(mailDto.getTo());
            if (mailDto.getCc() != null && mailDto.getCc().length > 0) {
                helper.setCc(mailDto.getCc());
            }
            if (mailDto.getBcc() != null && mailDto.getBcc().length > 0) {
                helper.setBcc(mailDto.getBcc());
            }
            if (mailDto.getFrom() != null && !mailDto.getFrom().isBlank()) {
                helper.setFrom(mailDto.getFrom());
            }
            helper.setSubject(mailDto.getSubject());
            // text must be set before inline parts
            helper.setText(rendered.getText() == null ? "" : rendered.getText(), rendered.getHtml());

            for (InlineAsset asset : assets.values()) {
                DataSource dataSource = new ByteArrayDataSource(asset.getBytes(), asset.getMimeType());
                helper.addInline(asset.getContentId(), dataSource);
            }

            Set<String> names = new HashSet<>();
            for (CsvAttachment attachment : attachments) {
                if (!names.add(attachment.getFileName())) {
                    throw new ComposeException("Duplicate attachment name " + attachment.getFileName());
                }
                helper.addAttachment(attachment.getFileName(), new ByteArrayResource(attachment.getBytes()), CsvAttachment.CONTENT_TYPE);
            }
            LOGGER.debug("Composed message '{}' with {} inline assets and {} attachments",
                    mailDto.getSubject(), assets.size(), attachments.size());
            return message;
        } catch (MessagingException e) {
            LOGGER.error("Error occurred while composing email: {}", e.getMessage(), e);
            throw new ComposeException("Failed to compose message: " + e.getMessage(), e);
        }
    }

    /**
     * Every {@code src="cid:..."} reference in the document needs an asset. Assets nothing refers to are only logged.
     */
    static void checkContentIds(String html, Map<String, InlineAsset> assets) {
        Set<String> referenced = referencedContentIds(html);
        for (String contentId : referenced) {
            if (!assets.containsKey(contentId)) {
                throw new ComposeException("Document references content id " + contentId + " with no matching asset");
            }
        }
        for (String contentId : assets.keySet()) {
            if (!referenced.contains(contentId)) {
                LOGGER.warn("Inline asset {} is not referenced by the document", contentId);
            }
        }
    }

    static Set<String> referencedContentIds(String html) {
        Set<String> ids = new LinkedHashSet<>();
        if (html == null) {
            return ids;
        }
        Matcher matcher = CID_REFERENCE.matcher(html);
        while (matcher.find()) {
            ids.add(matcher.group(1));
        }
        return ids;
    }
}
