package com.airbooking.booking.service.notification;

import com.airbooking.booking.event.PaymentSettledEvent;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.annotation.Async;
import org.springframework.stereotype.Component;
import org.springframework.transaction.event.TransactionPhase;
import org.springframework.transaction.event.TransactionalEventListener;

@Component
@RequiredArgsConstructor
@Slf4j
public class ReceiptNotificationListener {

    private final ReceiptSender receiptSender;

    @Async
    @TransactionalEventListener(phase = TransactionPhase.AFTER_COMMIT)
    public void onPaymentSettled(PaymentSettledEvent event) {
        try {
            boolean sent = receiptSender.send(event.getReceipt());
            if (!sent) {
                log.warn("Receipt not delivered for payment {}", event.getReceipt().getReferenceCode());
            }
        } catch (Exception e) {
            log.error("Receipt dispatch failed for payment {}: {}",
                    event.getReceipt().getReferenceCode(), e.getMessage(), e);
        }
    }
}
