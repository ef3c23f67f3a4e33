package com.airbooking.booking.service.notification;

import com.airbooking.booking.dto.ReceiptPayload;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;
import org.springframework.util.StringUtils;
import org.springframework.web.client.RestTemplate;

/**
 * Posts the receipt as JSON to the configured mailer endpoint.
 * With no endpoint configured the receipt is only logged.
 */
@Component
@Slf4j
public class HttpReceiptSender implements ReceiptSender {

    private final RestTemplate restTemplate;
    private final String receiptUrl;

    public HttpReceiptSender(RestTemplate restTemplate,
                             @Value("${booking.notification.receipt-url:}") String receiptUrl) {
        this.restTemplate = restTemplate;
        this.receiptUrl = receiptUrl;
    }

    @Override
    public boolean send(ReceiptPayload receipt) {
        if (!StringUtils.hasText(receiptUrl)) {
            log.info("Receipt delivery disabled, skipping receipt {} for {}",
                    receipt.getReferenceCode(), receipt.getPayerEmail());
            return false;
        }

        try {
            log.info("Sending receipt {} to {}", receipt.getReferenceCode(), receiptUrl);
            restTemplate.postForEntity(receiptUrl, receipt, String.class);
            log.info("Receipt sent successfully: {}", receipt.getReferenceCode());
            return true;
        } catch (Exception e) {
            log.error("Failed to send receipt {}: {}", receipt.getReferenceCode(), e.getMessage());
            return false;
        }
    }
}
