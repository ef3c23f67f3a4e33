package com.airbooking.booking.event;

import com.airbooking.booking.dto.ReceiptPayload;
import lombok.Getter;
import org.springframework.context.ApplicationEvent;

/**
 * Published inside the settlement transaction; listeners act only once it has committed.
 */
@Getter
public class PaymentSettledEvent extends ApplicationEvent {

    private final ReceiptPayload receipt;

    public PaymentSettledEvent(Object source, ReceiptPayload receipt) {
        super(source);
        this.receipt = receipt;
    }
}
