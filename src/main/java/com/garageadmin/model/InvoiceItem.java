package com.garageadmin.model;

import jakarta.persistence.*;
import lombok.Getter;
import lombok.Setter;

import java.math.BigDecimal;

@Entity
@Table(name = "invoice_items")
@Getter
@Setter
public class InvoiceItem {

    public static final String TYPE_SERVICE = "service";
    public static final String TYPE_PART = "part";

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "invoice_id", nullable = false)
    private Long invoiceId;

    @Column(name = "item_type", nullable = false)
    private String itemType;            // "service" | "part"

    @Column(name = "item_id", nullable = false)
    private Long itemId;                // services.id or parts.id, depending on itemType

    private String description;

    @Column(nullable = false)
    private Integer quantity;

    // parts only: cost price at invoicing time, for margin reporting
    @Column(name = "purchased_cost", precision = 14, scale = 2)
    private BigDecimal purchasedCost;

    @Column(name = "unit_price", nullable = false, precision = 14, scale = 2)
    private BigDecimal unitPrice;

    @Column(name = "total", nullable = false, precision = 14, scale = 2)
    private BigDecimal total;
}
