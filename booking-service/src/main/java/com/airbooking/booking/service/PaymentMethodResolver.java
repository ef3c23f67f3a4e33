package com.airbooking.booking.service;

import com.airbooking.booking.model.PaymentMethod;
import com.airbooking.booking.repository.PaymentMethodRepository;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.TransactionDefinition;
import org.springframework.transaction.support.TransactionSynchronizationManager;
import org.springframework.transaction.support.TransactionTemplate;

/**
 * Finds a payment method id by label, creating the row on first use. Must be called before the
 * caller opens its own transaction, so a payment never holds two pooled connections at once.
 * A concurrent first use of the same label ends in one row.
 */
@Service
@Slf4j
public class PaymentMethodResolver {

    private final PaymentMethodRepository paymentMethodRepository;
    private final TransactionTemplate requiresNew;

    public PaymentMethodResolver(PaymentMethodRepository paymentMethodRepository,
                                 PlatformTransactionManager transactionManager) {
        this.paymentMethodRepository = paymentMethodRepository;
        this.requiresNew = new TransactionTemplate(transactionManager);
        this.requiresNew.setPropagationBehavior(TransactionDefinition.PROPAGATION_REQUIRES_NEW);
    }

    public Long resolveId(String label) {
        if (TransactionSynchronizationManager.isActualTransactionActive()) {
            throw new IllegalStateException("Payment method must be resolved outside a transaction");
        }
        Long id = findId(label);
        if (id != null) {
            return id;
        }
        try {
            id = requiresNew.execute(status -> paymentMethodRepository
                    .saveAndFlush(PaymentMethod.builder().label(label).build())
                    .getId());
            log.info("Created payment method: label={}, id={}", label, id);
            return id;
        } catch (DataIntegrityViolationException e) {
            log.info("Payment method {} created concurrently, reusing it", label);
            id = findId(label);
            if (id == null) {
                throw e;
            }
            return id;
        }
    }

    /**
     * @return a reference usable in the caller's transaction
     */
    public PaymentMethod reference(Long id) {
        return paymentMethodRepository.getReferenceById(id);
    }

    private Long findId(String label) {
        return paymentMethodRepository.findByLabel(label)
                .map(PaymentMethod::getId)
                .orElse(null);
    }
}
