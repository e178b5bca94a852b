package com.example.storefront.presentation.controller;

import com.example.storefront.application.dto.CheckoutCommand;
import com.example.storefront.application.dto.CheckoutResult;
import com.example.storefront.application.dto.OrderListFilter;
import com.example.storefront.application.service.OrderService;
import com.example.storefront.domain.exception.InsufficientStockException;
import com.example.storefront.domain.exception.InvalidTransitionException;
import com.example.storefront.domain.exception.OrderAccessDeniedException;
import com.example.storefront.domain.model.order.Order;
import com.example.storefront.domain.model.order.OrderLineItem;
import com.example.storefront.domain.model.order.OrderStatus;
import com.example.storefront.domain.model.payment.Payment;
import com.example.storefront.domain.model.payment.PaymentStatus;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.data.domain.PageImpl;
import org.springframework.data.domain.PageRequest;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.patch;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@WebMvcTest(OrderController.class)
class OrderControllerTest {

    private static final String CREATE_BODY = "{"
            + "\"storeUsername\":\"felicity\","
            + "\"customerName\":\"Ada Obi\","
            + "\"customerEmail\":\"ada@example.com\","
            + "\"customerPhone\":\"08012345678\","
            + "\"items\":[{\"productId\":\"p-1\",\"quantity\":2,\"variantSelection\":{\"size\":\"M\"}}],"
            + "\"shippingFee\":200}";

    @Autowired
    private MockMvc mockMvc;

    @MockBean
    private OrderService orderService;

    @Test
    void checkoutReturnsCreated() throws Exception {
        when(orderService.createOrder(any())).thenReturn(sampleCheckout());

        mockMvc.perform(post("/api/v1/orders").contentType(MediaType.APPLICATION_JSON).content(CREATE_BODY))
                .andExpect(status().isCreated())
                .andExpect(jsonPath("$.message").value("Order created successfully"))
                .andExpect(jsonPath("$.paymentInitialized").value(true))
                .andExpect(jsonPath("$.order.orderNumber").value("ORD-20240815-48213"))
                .andExpect(jsonPath("$.order.status").value("pending"))
                .andExpect(jsonPath("$.order.total").value(2250.00))
                .andExpect(jsonPath("$.items[0].product_id").value("p-1"))
                .andExpect(jsonPath("$.payment.accountDetails.accountNumber").value("1234567890"));

        ArgumentCaptor<CheckoutCommand> captor = ArgumentCaptor.forClass(CheckoutCommand.class);
        verify(orderService).createOrder(captor.capture());
        assertEquals("felicity", captor.getValue().getStoreUsername());
        assertEquals(2, captor.getValue().getLines().get(0).getQuantity());
        assertEquals(Map.of("size", "M"), captor.getValue().getLines().get(0).getVariantSelection());
        assertEquals(0, BigDecimal.ZERO.compareTo(captor.getValue().getDiscount()));
    }

    @Test
    void listingPassesSearchAndDateFilters() throws Exception {
        Order order = sampleCheckout().getOrder();
        when(orderService.listOrders(eq("owner"), any(), eq(2), eq(10)))
                .thenReturn(new PageImpl<>(List.of(order), PageRequest.of(1, 10), 11));

        mockMvc.perform(get("/api/v1/orders")
                        .header("X-User-Id", "owner")
                        .param("status", "pending")
                        .param("search", "ada")
                        .param("dateFrom", "2024-08-01")
                        .param("dateTo", "2024-08-31")
                        .param("page", "2")
                        .param("limit", "10"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.page").value(2))
                .andExpect(jsonPath("$.total").value(11))
                .andExpect(jsonPath("$.items[0].orderNumber").value("ORD-20240815-48213"));

        ArgumentCaptor<OrderListFilter> captor = ArgumentCaptor.forClass(OrderListFilter.class);
        verify(orderService).listOrders(eq("owner"), captor.capture(), eq(2), eq(10));
        OrderListFilter filter = captor.getValue();
        assertEquals(OrderStatus.PENDING, filter.getStatus());
        assertNull(filter.getPaymentStatus());
        assertEquals("ada", filter.getSearch());
        assertEquals(LocalDate.of(2024, 8, 1), filter.getDateFrom());
        assertEquals(LocalDate.of(2024, 8, 31), filter.getDateTo());
    }

    @Test
    void malformedDateFilterIsBadRequest() throws Exception {
        mockMvc.perform(get("/api/v1/orders")
                        .header("X-User-Id", "owner")
                        .param("dateFrom", "last tuesday"))
                .andExpect(status().isBadRequest());

        verify(orderService, never()).listOrders(anyString(), any(), anyInt(), anyInt());
    }

    @Test
    void invalidCheckoutIsRejectedBeforeTheService() throws Exception {
        String body = "{\"storeUsername\":\"felicity\",\"customerName\":\"Ada\",\"customerPhone\":\"080\","
                + "\"customerEmail\":\"not-an-email\",\"items\":[{\"productId\":\"p-1\",\"quantity\":0}]}";

        mockMvc.perform(post("/api/v1/orders").contentType(MediaType.APPLICATION_JSON).content(body))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.errorCode").value("VALIDATION_ERROR"))
                .andExpect(jsonPath("$.details.customerEmail").exists());

        verify(orderService, never()).createOrder(any());
    }

    @Test
    void insufficientStockIsBadRequestWithDetails() throws Exception {
        when(orderService.createOrder(any()))
                .thenThrow(new InsufficientStockException("p-1", "Ankara Dress", 1, 2));

        mockMvc.perform(post("/api/v1/orders").contentType(MediaType.APPLICATION_JSON).content(CREATE_BODY))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.errorCode").value("INSUFFICIENT_STOCK"))
                .andExpect(jsonPath("$.message").value("Insufficient stock for Ankara Dress"))
                .andExpect(jsonPath("$.details.available").value(1))
                .andExpect(jsonPath("$.details.requested").value(2));
    }

    @Test
    void ownerEndpointsRequireUserHeader() throws Exception {
        mockMvc.perform(get("/api/v1/orders/o-1"))
                .andExpect(status().isUnauthorized());

        verify(orderService, never()).getOrderDetails(anyString(), anyString());
    }

    @Test
    void nonOwnerIsForbidden() throws Exception {
        when(orderService.getOrderDetails("o-1", "intruder")).thenThrow(new OrderAccessDeniedException());

        mockMvc.perform(get("/api/v1/orders/o-1").header("X-User-Id", "intruder"))
                .andExpect(status().isForbidden())
                .andExpect(jsonPath("$.errorCode").value("FORBIDDEN"));
    }

    @Test
    void illegalStatusChangeIsBadRequest() throws Exception {
        when(orderService.updateStatus(eq("o-1"), eq("owner"), eq(OrderStatus.SHIPPED)))
                .thenThrow(new InvalidTransitionException(OrderStatus.PENDING, OrderStatus.SHIPPED));

        mockMvc.perform(patch("/api/v1/orders/o-1/status")
                        .header("X-User-Id", "owner")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"status\":\"shipped\"}"))
                .andExpect(status().isBadRequest());
    }

    @Test
    void unknownStatusValueIsBadRequest() throws Exception {
        mockMvc.perform(patch("/api/v1/orders/o-1/status")
                        .header("X-User-Id", "owner")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"status\":\"teleported\"}"))
                .andExpect(status().isBadRequest());

        verify(orderService, never()).updateStatus(anyString(), anyString(), any());
    }

    private static CheckoutResult sampleCheckout() {
        OrderLineItem item = OrderLineItem.snapshot("p-1", "Ankara Dress", null, new BigDecimal("1000.00"), 2);
        Order order = Order.builder()
                .id("0b6f4c1e-1111-2222-3333-444455556666")
                .storeId("s-1")
                .orderNumber("ORD-20240815-48213")
                .customerName("Ada Obi")
                .customerPhone("08012345678")
                .items(List.of(item))
                .subtotal(new BigDecimal("2000.00"))
                .discount(BigDecimal.ZERO)
                .shippingFee(new BigDecimal("200.00"))
                .platformFee(new BigDecimal("50.00"))
                .total(new BigDecimal("2250.00"))
                .status(OrderStatus.PENDING)
                .paymentStatus(PaymentStatus.PENDING)
                .build();
        Payment payment = Payment.builder()
                .id("pay-1")
                .orderId(order.getId())
                .amount(order.getTotal())
                .currency("NGN")
                .status(PaymentStatus.PENDING)
                .paymentReference("PAY-0b6f4c1e-a1b2c3d4")
                .accountNumber("1234567890")
                .accountName("STORE-Ada Obi")
                .bankName("Wema Bank")
                .expiresAt(LocalDateTime.now().plusHours(24))
                .build();
        return CheckoutResult.builder()
                .order(order)
                .payment(payment)
                .paymentInitialized(true)
                .message("Order created successfully")
                .build();
    }
}
