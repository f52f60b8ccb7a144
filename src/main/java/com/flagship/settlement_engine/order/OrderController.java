package com.flagship.settlement_engine.order;

import com.flagship.settlement_engine.order.dto.OrderResponse;
import com.flagship.settlement_engine.order.dto.RegisterOrderRequest;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.UUID;

/**
 * Order registration for the booking flow. Orders must exist before the
 * processor reports a payment for them.
 */
@RestController
@RequestMapping("/api/orders")
@RequiredArgsConstructor
@Slf4j
public class OrderController {

    private final OrderService orderService;

    @PostMapping
    public ResponseEntity<OrderResponse> registerOrder(@Valid @RequestBody RegisterOrderRequest request) {
        Order order = orderService.registerOrder(
            request.getOrderId(),
            request.getPayerId(),
            request.getFulfillerId(),
            request.getReferrerId(),
            request.getFacilitatorId(),
            request.getGrossAmount(),
            request.getFulfillmentEndTime(),
            new OrderContext(
                request.getServiceName(),
                request.getSubject(),
                request.getPayerName(),
                request.getFulfillerName(),
                request.getFacilitatorName())
        );
        return ResponseEntity.status(HttpStatus.CREATED).body(OrderResponse.from(order));
    }

    @GetMapping("/{id}")
    public ResponseEntity<OrderResponse> getOrder(@PathVariable("id") UUID id) {
        return orderService.findOrder(id)
            .map(order -> ResponseEntity.ok(OrderResponse.from(order)))
            .orElse(ResponseEntity.notFound().build());
    }
}
