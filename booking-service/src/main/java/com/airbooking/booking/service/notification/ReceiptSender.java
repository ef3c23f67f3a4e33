package com.airbooking.booking.service.notification;

import com.airbooking.booking.dto.ReceiptPayload;

/**
 * Delivers a payment receipt to the payer. Delivery is best effort.
 */
public interface ReceiptSender {

    /**
     * @return true when the receipt was handed over to the delivery channel
     */
    boolean send(ReceiptPayload receipt);
}
