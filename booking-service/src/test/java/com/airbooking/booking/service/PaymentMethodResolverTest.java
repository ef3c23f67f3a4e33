package com.airbooking.booking.service;

import com.airbooking.booking.model.PaymentMethod;
import com.airbooking.booking.repository.PaymentMethodRepository;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.mockito.junit.jupiter.MockitoSettings;
import org.mockito.quality.Strictness;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.support.TransactionSynchronizationManager;

import java.util.Optional;

import static org.assertj.core.api.Assertions.*;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
@MockitoSettings(strictness = Strictness.LENIENT)
@DisplayName("PaymentMethodResolver Unit Tests")
class PaymentMethodResolverTest {

    @Mock
    private PaymentMethodRepository paymentMethodRepository;

    @Mock
    private PlatformTransactionManager transactionManager;

    private PaymentMethodResolver resolver;

    @BeforeEach
    void setUp() {
        resolver = new PaymentMethodResolver(paymentMethodRepository, transactionManager);
    }

    @AfterEach
    void tearDown() {
        TransactionSynchronizationManager.setActualTransactionActive(false);
    }

    @Test
    @DisplayName("Should reuse an existing method without opening a transaction")
    void resolveId_Existing_ReturnsId() {
        when(paymentMethodRepository.findByLabel("Mobile Money"))
                .thenReturn(Optional.of(PaymentMethod.builder().id(4L).label("Mobile Money").build()));

        assertThat(resolver.resolveId("Mobile Money")).isEqualTo(4L);
        verify(paymentMethodRepository, never()).saveAndFlush(any());
        verifyNoInteractions(transactionManager);
    }

    @Test
    @DisplayName("Should create the method on first use")
    void resolveId_Missing_Creates() {
        when(paymentMethodRepository.findByLabel("Mobile Money")).thenReturn(Optional.empty());
        when(paymentMethodRepository.saveAndFlush(any(PaymentMethod.class))).thenAnswer(inv -> {
            PaymentMethod method = inv.getArgument(0);
            method.setId(9L);
            return method;
        });

        assertThat(resolver.resolveId("Mobile Money")).isEqualTo(9L);
        verify(paymentMethodRepository).saveAndFlush(argThat(m -> "Mobile Money".equals(m.getLabel())));
    }

    @Test
    @DisplayName("Should reuse the row another request created concurrently")
    void resolveId_ConcurrentCreate_ReusesRow() {
        when(paymentMethodRepository.findByLabel("Mobile Money"))
                .thenReturn(Optional.empty())
                .thenReturn(Optional.of(PaymentMethod.builder().id(12L).label("Mobile Money").build()));
        when(paymentMethodRepository.saveAndFlush(any(PaymentMethod.class)))
                .thenThrow(new DataIntegrityViolationException("uk_payment_method_label"));

        assertThat(resolver.resolveId("Mobile Money")).isEqualTo(12L);
    }

    @Test
    @DisplayName("Should refuse to run inside a caller's transaction")
    void resolveId_InsideTransaction_Throws() {
        TransactionSynchronizationManager.setActualTransactionActive(true);

        assertThatThrownBy(() -> resolver.resolveId("Mobile Money"))
                .isInstanceOf(IllegalStateException.class);
        verifyNoInteractions(paymentMethodRepository);
    }
}
