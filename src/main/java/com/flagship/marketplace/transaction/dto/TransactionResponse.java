package com.flagship.marketplace.transaction.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.flagship.marketplace.listing.DeliveryMethod;
import com.flagship.marketplace.transaction.DeliveryStatus;
import com.flagship.marketplace.transaction.PaymentStatus;
import com.flagship.marketplace.transaction.Transaction;
import com.flagship.marketplace.transaction.TransactionStatus;
import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.List;
import java.util.UUID;

@Value
@Builder
public class TransactionResponse {

    @JsonProperty("id")
    UUID id;

    @JsonProperty("offer_id")
    UUID offerId;

    @JsonProperty("item_id")
    UUID itemId;

    @JsonProperty("buyer_id")
    UUID buyerId;

    @JsonProperty("seller_id")
    UUID sellerId;

    @JsonProperty("amount")
    BigDecimal amount;

    @JsonProperty("currency")
    String currency;

    @JsonProperty("status")
    TransactionStatus status;

    @JsonProperty("payment_status")
    PaymentStatus paymentStatus;

    @JsonProperty("delivery_method")
    DeliveryMethod deliveryMethod;

    @JsonProperty("delivery_status")
    DeliveryStatus deliveryStatus;

    @JsonProperty("delivery_address")
    String deliveryAddress;

    @JsonProperty("delivery_tracking_number")
    String deliveryTrackingNumber;

    @JsonProperty("delivery_proof_images")
    List<String> deliveryProofImages;

    @JsonProperty("cancellation_reason")
    String cancellationReason;

    @JsonProperty("delivered_at")
    Instant deliveredAt;

    @JsonProperty("completed_at")
    Instant completedAt;

    @JsonProperty("created_at")
    Instant createdAt;

    @JsonProperty("updated_at")
    Instant updatedAt;

    @JsonProperty("version")
    long version;

    public static TransactionResponse from(Transaction transaction, List<String> deliveryProofImages) {
        return TransactionResponse.builder()
            .id(transaction.getId())
            .offerId(transaction.getOfferId())
            .itemId(transaction.getItemId())
            .buyerId(transaction.getBuyerId())
            .sellerId(transaction.getSellerId())
            .amount(transaction.getAmount())
            .currency(transaction.getCurrency().name())
            .status(transaction.getStatus())
            .paymentStatus(transaction.getPaymentStatus())
            .deliveryMethod(transaction.getDeliveryMethod())
            .deliveryStatus(transaction.getDeliveryStatus())
            .deliveryAddress(transaction.getDeliveryAddress())
            .deliveryTrackingNumber(transaction.getDeliveryTrackingNumber())
            .deliveryProofImages(deliveryProofImages)
            .cancellationReason(transaction.getCancellationReason())
            .deliveredAt(transaction.getDeliveredAt())
            .completedAt(transaction.getCompletedAt())
            .createdAt(transaction.getCreatedAt())
            .updatedAt(transaction.getUpdatedAt())
            .version(transaction.getVersion())
            .build();
    }
}
